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
import com.google.common.collect.ImmutableList;

public class NumbersSource implements TestSource {

  @Override
  public void define(SourceBuilder source) {
    source.function("test_add", t -> t.assertEqual(5, Numbers.add(2, 3)));
    source.function(
        "test_sub",
        t -> {
          t.assertEqual(-1, Numbers.sub(2, 3));
          t.assertEqual(-1, 5, "disappointing");
        });
    source.member(
        "add",
        ImmutableList.of(int.class, int.class),
        args -> Numbers.add((int) args[0], (int) args[1]));
  }
}
