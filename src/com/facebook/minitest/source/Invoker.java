/*
 * Copyright (c) Meta Platforms, Inc. and affiliates.
 *
 * This source code is dual-licensed under either the MIT license found in the
 * LICENSE-MIT file in the root directory of this source tree or the Apache
 * License, Version 2.0 found in the LICENSE-APACHE file in the root directory
 * of this source tree. You may select, at your option, one of the
 * above-listed licenses.
 */

package com.facebook.minitest.source;

/**
 * Untyped entry point of a registered member. Arguments match the member's declared parameter
 * types, in order.
 */
@FunctionalInterface
public interface Invoker {
  void invoke(Object... args) throws Exception;
}
