/*
 * Copyright (c) Meta Platforms, Inc. and affiliates.
 *
 * This source code is dual-licensed under either the MIT license found in the
 * LICENSE-MIT file in the root directory of this source tree or the Apache
 * License, Version 2.0 found in the LICENSE-APACHE file in the root directory
 * of this source tree. You may select, at your option, one of the
 * above-listed licenses.
 */

package com.facebook.minitest.testdata;

/** Code under test for the fixture sources. */
public class Numbers {

  private Numbers() {}

  public static int add(int x, int y) {
    return x + y;
  }

  public static int sub(int x, int y) {
    return x - y;
  }
}
