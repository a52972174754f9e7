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
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import java.util.Objects;

/** A failed test, with the failure messages it recorded in the order they were recorded. */
public final class FailResult extends TestResult {

  private final ImmutableList<String> messages;

  public FailResult(String testName) {
    this(testName, ImmutableList.of(), ImmutableList.of());
  }

  public FailResult(String testName, Iterable<String> messages) {
    this(testName, messages, ImmutableList.of());
  }

  public FailResult(
      String testName, Iterable<String> messages, Iterable<? extends TestResult> subResults) {
    super(testName, subResults);
    this.messages = ImmutableList.copyOf(messages);
  }

  @Override
  public ResultType getType() {
    return ResultType.FAIL;
  }

  @Override
  public ImmutableList<String> getMessages() {
    return messages;
  }

  @Override
  public boolean equals(Object obj) {
    return super.equals(obj) && messages.equals(((FailResult) obj).messages);
  }

  @Override
  public int hashCode() {
    return Objects.hash(super.hashCode(), messages);
  }

  @Override
  void addDetails(MoreObjects.ToStringHelper helper) {
    if (!messages.isEmpty()) {
      helper.add("messages", messages);
    }
  }
}
