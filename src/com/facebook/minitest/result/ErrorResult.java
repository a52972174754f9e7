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
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * A test that raised. The captured throwable is kept as is so that its stack trace can be rendered
 * later.
 *
 * <p>Two error results are equal when their errors have the same class and message; stack traces
 * and identity are not compared.
 */
public final class ErrorResult extends TestResult {

  private final @Nullable Throwable error;

  public ErrorResult(String testName, @Nullable Throwable error) {
    this(testName, error, ImmutableList.of());
  }

  public ErrorResult(
      String testName, @Nullable Throwable error, Iterable<? extends TestResult> subResults) {
    super(testName, subResults);
    this.error = error;
  }

  @Override
  public ResultType getType() {
    return ResultType.ERROR;
  }

  public Optional<Throwable> getError() {
    return Optional.ofNullable(error);
  }

  @Override
  public boolean equals(Object obj) {
    if (!super.equals(obj)) {
      return false;
    }
    Throwable otherError = ((ErrorResult) obj).error;
    if (error == null || otherError == null) {
      return error == otherError;
    }
    return error.getClass() == otherError.getClass()
        && Objects.equals(error.getMessage(), otherError.getMessage());
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        super.hashCode(),
        error == null ? null : error.getClass(),
        error == null ? null : error.getMessage());
  }

  @Override
  void addDetails(MoreObjects.ToStringHelper helper) {
    if (error != null) {
      helper.add("error", error);
    }
  }
}
