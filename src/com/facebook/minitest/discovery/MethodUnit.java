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

import com.facebook.minitest.api.TestMethod;
import com.facebook.minitest.source.DefinitionOrder;

/** An eligible test method of a {@link ClassUnit}. */
public final class MethodUnit {

  private final String name;
  private final DefinitionOrder order;
  private final TestMethod body;

  public MethodUnit(String name, DefinitionOrder order, TestMethod body) {
    this.name = checkNotNull(name);
    this.order = checkNotNull(order);
    this.body = checkNotNull(body);
  }

  public String getName() {
    return name;
  }

  public DefinitionOrder getOrder() {
    return order;
  }

  public TestMethod getBody() {
    return body;
  }

  @Override
  public String toString() {
    return String.format("MethodUnit(%s at %s)", name, order);
  }
}
