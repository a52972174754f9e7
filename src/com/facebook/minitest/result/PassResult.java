/*
 * Copyright (c) Meta Platforms, Inc. and affiliates.
 *
 * This source code is dual-licensed under either the MIT license found in the
 * LICENSE-MIT file in the root directory of this source tree or the Apache
 * License, Version 2.0 found in the LICENSE-APACHE file in the root directory
 * of this source tree. You may select, at your option, one of the
 * above-listed licenses.
 */

package com.facebook.minitest.result;

import com.facebook.minitest.result.type.ResultType;
import com.google.common.collect.ImmutableList;

public final class PassResult extends TestResult {

  public PassResult(String testName) {
    this(testName, ImmutableList.of());
  }

  public PassResult(String testName, Iterable<? extends TestResult> subResults) {
    super(testName, subResults);
  }

  @Override
  public ResultType getType() {
    return ResultType.PASS;
  }
}
