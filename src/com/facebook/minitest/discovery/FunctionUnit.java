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

import com.facebook.minitest.api.TestFunction;
import com.facebook.minitest.source.DefinitionOrder;

public final class FunctionUnit extends TestUnit {

  private final TestFunction body;

  public FunctionUnit(String name, DefinitionOrder order, TestFunction body) {
    super(name, order);
    this.body = checkNotNull(body);
  }

  @Override
  public Kind getKind() {
    return Kind.FUNCTION;
  }

  @Override
  public FunctionUnit asFunction() {
    return this;
  }

  public TestFunction getBody() {
    return body;
  }
}
