/*
 * Copyright (c) Meta Platforms, Inc. and affiliates.
 *
 * This source code is dual-licensed under either the MIT license found in the
 * LICENSE-MIT file in the root directory of this source tree or the Apache
 * License, Version 2.0 found in the LICENSE-APACHE file in the root directory
 * of this source tree. You may select, at your option, one of the
 * above-listed licenses.
 */

package com.facebook.minitest.discovery;

import static com.google.common.base.Preconditions.checkNotNull;

import com.facebook.minitest.source.DefinitionOrder;

/**
 * A discovered, runnable test: either a {@link FunctionUnit} or a {@link ClassUnit}, as given by
 * {@link #getKind()}.
 */
public abstract class TestUnit {

  /** Variant tag, fixed at discovery time. */
  public enum Kind {
    FUNCTION,
    CLASS,
  }

  private final String name;
  private final DefinitionOrder order;

  TestUnit(String name, DefinitionOrder order) {
    this.name = checkNotNull(name);
    this.order = checkNotNull(order);
  }

  public abstract Kind getKind();

  public String getName() {
    return name;
  }

  public DefinitionOrder getOrder() {
    return order;
  }

  public FunctionUnit asFunction() {
    throw new IllegalStateException(name + " is not a function unit");
  }

  public ClassUnit asClass() {
    throw new IllegalStateException(name + " is not a class unit");
  }

  @Override
  public String toString() {
    return String.format("%s(%s at %s)", getClass().getSimpleName(), name, order);
  }
}
