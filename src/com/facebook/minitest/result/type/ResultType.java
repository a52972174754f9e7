/*
 * Copyright (c) Meta Platforms, Inc. and affiliates.
 *
 * This source code is dual-licensed under either the MIT license found in the
 * LICENSE-MIT file in the root directory of this source tree or the Apache
 * License, Version 2.0 found in the LICENSE-APACHE file in the root directory
 * of this source tree. You may select, at your option, one of the
 * above-listed licenses.
 */

package com.facebook.minitest.result.type;

/** The kind of result. Declared from least to most severe. */
public enum ResultType {

  /** The test ran to completion and its context was never failed. */
  PASS,
  /**
   * The test ran and its context was failed at least once, either directly or through an
   * assertion. A required failure that ended the test early is still a FAIL.
   */
  FAIL,
  /**
   * The test, or a lifecycle hook around it, raised an exception. Errors take precedence over
   * failures recorded before the exception.
   */
  ERROR;

  /** Returns whichever of {@code this} and {@code other} is more severe. */
  public ResultType worst(ResultType other) {
    return compareTo(other) >= 0 ? this : other;
  }
}
