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

import com.facebook.minitest.api.TestSource;
import com.facebook.minitest.source.SourceBuilder;

public class ClassesSource implements TestSource {

  @Override
  public void define(SourceBuilder source) {
    source.testClass(
        "TestAdd",
        cls ->
            cls.method(
                    "test_adding_two_and_three_returns_five",
                    (self, t) -> t.assertEqual(5, Numbers.add(2, 3), "this is most disappointing"))
                .method(
                    "test_adding_three_and_three_returns_seven",
                    (self, t) ->
                        t.assertEqual(7, Numbers.add(3, 3), "this is most disappointing")));
  }
}
