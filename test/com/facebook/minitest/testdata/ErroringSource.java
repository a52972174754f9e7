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

public class ErroringSource implements TestSource {

  @Override
  public void define(SourceBuilder source) {
    source.function(
        "test_errors",
        t -> {
          throw new IllegalStateException("oh no!");
        });
    source.testClass(
        "TestBrokenSetup",
        cls ->
            cls.setup(
                    self -> {
                      throw new IllegalArgumentException("setup failed");
                    })
                .method("test_never_runs", (self, t) -> t.fail("won't reach here")));
  }
}
