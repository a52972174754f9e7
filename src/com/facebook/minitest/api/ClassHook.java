/*
 * Copyright (c) Meta Platforms, Inc. and affiliates.
 *
 * This source code is dual-licensed under either the MIT license found in the
 * LICENSE-MIT file in the root directory of this source tree or the Apache
 * License, Version 2.0 found in the LICENSE-APACHE file in the root directory
 * of this source tree. You may select, at your option, one of the
 * above-listed licenses.
 */

package com.facebook.minitest.api;

/** {@code setup_class} / {@code teardown_class}: runs once per class with the class-level state. */
@FunctionalInterface
public interface ClassHook {
  void run(StateBag classState) throws Exception;
}
