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

import com.facebook.minitest.api.TestInstance;
import com.facebook.minitest.api.TestSource;
import com.facebook.minitest.source.SourceBuilder;
import com.google.common.collect.ImmutableList;

/** Only TestOne and TestTwo are test classes. */
public class TwoValidClassesSource implements TestSource {

  @Override
  public void define(SourceBuilder source) {
    source.testClass(
        "TestMissingTestContext",
        cls ->
            cls.member(
                "test_missing_test_context", ImmutableList.of(TestInstance.class), args -> {}));
    source.testClass(
        "TestMissingTestFunction",
        cls -> cls.member("foo", ImmutableList.of(TestInstance.class), args -> {}));
    source.testClass("TestOne", cls -> cls.method("test_one", (self, t) -> t.fail("oh no!")));
    source.testClass(
        "TestUntypedTestContext",
        cls ->
            cls.member(
                "test_untyped_test_context",
                ImmutableList.of(TestInstance.class, Object.class),
                args -> {}));
    source.testClass(
        "NoTestPrefix", cls -> cls.method("no_test_prefix", (self, t) -> t.fail("oh no!")));
    source.testClass("TestTwo", cls -> cls.method("test_two", (self, t) -> t.fail("oh no!")));
  }
}
