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

import com.facebook.minitest.source.SourceBuilder;

/**
 * A file of tests. Implementations register their members, in the order they are written, on the
 * builder passed to {@link #define(SourceBuilder)}:
 *
 * <pre>{@code
 * public class NumbersTests implements TestSource {
 *   public void define(SourceBuilder source) {
 *     source.function("test_add", t -> t.assertEqual(5, 2 + 3));
 *     source.testClass(
 *         "TestSub",
 *         cls -> cls.method("test_sub", (self, t) -> t.assertEqual(-1, 2 - 3)));
 *   }
 * }
 * }</pre>
 *
 * <p>Implementations loaded from the command line need a public no-argument constructor.
 */
public interface TestSource {

  /** Canonical name of this source. Members registered here are owned by this name. */
  default String getName() {
    return getClass().getName();
  }

  void define(SourceBuilder source) throws Exception;
}
