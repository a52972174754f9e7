/*
 * Copyright (c) Meta Platforms, Inc. and affiliates.
 *
 * This source code is dual-licensed under either the MIT license found in the
 * LICENSE-MIT file in the root directory of this source tree or the Apache
 * License, Version 2.0 found in the LICENSE-APACHE file in the root directory
 * of this source tree. You may select, at your option, one of the
 * above-listed licenses.
 */

package com.facebook.minitest.result;

import com.facebook.minitest.result.type.ResultType;
import com.google.common.collect.ImmutableList;

/** Utilities for working with lists of {@link TestResult}. */
public class TestResults {

  /** Utility class: do not instantiate. */
  private TestResults() {}

  /**
   * The variant a parent takes from its children: ERROR if any child errored, else FAIL if any
   * failed, else PASS. No children means PASS.
   */
  public static ResultType overallType(Iterable<? extends TestResult> results) {
    ResultType overall = ResultType.PASS;
    for (TestResult result : results) {
      overall = overall.worst(result.getType());
      if (overall == ResultType.ERROR) {
        break;
      }
    }
    return overall;
  }

  /**
   * Builds the result of a group whose own execution raised nothing: its variant is derived from
   * the children, it carries no messages and no error.
   */
  public static TestResult aggregate(String testName, Iterable<? extends TestResult> subResults) {
    ImmutableList<TestResult> children = ImmutableList.copyOf(subResults);
    switch (overallType(children)) {
      case PASS:
        return new PassResult(testName, children);
      case FAIL:
        return new FailResult(testName, ImmutableList.of(), children);
      case ERROR:
        return new ErrorResult(testName, null, children);
    }
    throw new IllegalStateException("unknown result type");
  }

  /** True when every result, nested ones included, passed. */
  public static boolean allPassed(Iterable<? extends TestResult> results) {
    for (TestResult result : results) {
      if (!result.isPassed() || !allPassed(result.getSubResults())) {
        return false;
      }
    }
    return true;
  }
}
