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

import static com.google.common.base.Preconditions.checkNotNull;

import com.facebook.minitest.result.type.ResultType;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import java.util.Objects;

/**
 * Immutable outcome of one test unit. Results of test classes nest the results of their methods,
 * in the order the methods ran.
 *
 * <p>The variant is one of {@link PassResult}, {@link FailResult} or {@link ErrorResult}; {@link
 * #getType()} tells them apart without a type check.
 */
public abstract class TestResult {

  private final String testName;
  private final ImmutableList<TestResult> subResults;

  TestResult(String testName, Iterable<? extends TestResult> subResults) {
    this.testName = checkNotNull(testName);
    this.subResults = ImmutableList.copyOf(subResults);
  }

  public abstract ResultType getType();

  public String getTestName() {
    return testName;
  }

  public ImmutableList<TestResult> getSubResults() {
    return subResults;
  }

  /** Failure messages; only failing results carry any. */
  public ImmutableList<String> getMessages() {
    return ImmutableList.of();
  }

  public boolean isPassed() {
    return getType() == ResultType.PASS;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || obj.getClass() != getClass()) {
      return false;
    }
    TestResult other = (TestResult) obj;
    return testName.equals(other.testName) && subResults.equals(other.subResults);
  }

  @Override
  public int hashCode() {
    return Objects.hash(getType(), testName, subResults);
  }

  @Override
  public String toString() {
    MoreObjects.ToStringHelper helper =
        MoreObjects.toStringHelper(this).addValue("\"" + testName + "\"");
    addDetails(helper);
    if (!subResults.isEmpty()) {
      helper.add("subResults", subResults);
    }
    return helper.toString();
  }

  void addDetails(MoreObjects.ToStringHelper helper) {}
}
