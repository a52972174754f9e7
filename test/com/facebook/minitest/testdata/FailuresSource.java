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

public class FailuresSource implements TestSource {

  @Override
  public void define(SourceBuilder source) {
    source.function(
        "test_multiple_failures",
        t -> {
          t.fail("failure message");
          t.fail();
          t.fail("multiple failures are allowed in the same test");
        });
    source.function(
        "test_require_failure",
        t -> {
          t.fail("requiring a failure stops the test", true);
          t.fail("won't reach here");
        });
  }
}
