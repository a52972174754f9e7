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

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Object made available inside a test to record its failures.
 *
 * <p>A fresh context is created for every test invocation and dropped as soon as the test body
 * returns. Failing never throws, unless the failure is required: then the rest of the test body is
 * skipped via {@link StopTestSignal}.
 */
public final class TestContext {

  private boolean passed = true;
  private final List<String> messages = new ArrayList<>();

  public TestContext() {}

  /** Fails the current test without a message. */
  public void fail() {
    fail("", false);
  }

  /** Fails the current test with the given message. */
  public void fail(@Nullable String message) {
    fail(message, false);
  }

  /**
   * Fails the current test. Empty messages are not recorded but still fail the test.
   *
   * @param message failure message, recorded when non-empty
   * @param require when true, the remainder of the test body is not executed
   */
  public void fail(@Nullable String message, boolean require) {
    passed = false;
    if (!Strings.isNullOrEmpty(message)) {
      messages.add(message);
    }
    if (require) {
      throw new StopTestSignal();
    }
  }

  public void assertEqual(@Nullable Object expected, @Nullable Object actual) {
    assertEqual(expected, actual, "", false);
  }

  public void assertEqual(
      @Nullable Object expected, @Nullable Object actual, @Nullable String message) {
    assertEqual(expected, actual, message, false);
  }

  /** Fails the test unless {@code expected} and {@code actual} are equal by value. */
  public void assertEqual(
      @Nullable Object expected,
      @Nullable Object actual,
      @Nullable String message,
      boolean require) {
    if (Objects.deepEquals(expected, actual)) {
      return;
    }
    fail(
        withSuffix(
            String.format("Expected %s and %s to be equal", render(expected), render(actual)),
            message),
        require);
  }

  public void assertTrue(@Nullable Object value) {
    assertTrue(value, "", false);
  }

  public void assertTrue(@Nullable Object value, @Nullable String message) {
    assertTrue(value, message, false);
  }

  /** Fails the test unless {@code value} is exactly {@link Boolean#TRUE}. */
  public void assertTrue(@Nullable Object value, @Nullable String message, boolean require) {
    if (Boolean.TRUE.equals(value)) {
      return;
    }
    fail(withSuffix(String.format("Expected %s to be True", literal(value)), message), require);
  }

  public void assertFalse(@Nullable Object value) {
    assertFalse(value, "", false);
  }

  public void assertFalse(@Nullable Object value, @Nullable String message) {
    assertFalse(value, message, false);
  }

  /** Fails the test unless {@code value} is exactly {@link Boolean#FALSE}. */
  public void assertFalse(@Nullable Object value, @Nullable String message, boolean require) {
    if (Boolean.FALSE.equals(value)) {
      return;
    }
    fail(withSuffix(String.format("Expected %s to be False", literal(value)), message), require);
  }

  public boolean isPassed() {
    return passed;
  }

  public ImmutableList<String> getMessages() {
    return ImmutableList.copyOf(messages);
  }

  private static String withSuffix(String failureMessage, @Nullable String message) {
    if (Strings.isNullOrEmpty(message)) {
      return failureMessage;
    }
    return failureMessage + "; " + message;
  }

  private static String render(@Nullable Object value) {
    if (value != null && value.getClass().isArray()) {
      String deep = Arrays.deepToString(new Object[] {value});
      // strip the wrapping array added above
      return deep.substring(1, deep.length() - 1);
    }
    return String.valueOf(value);
  }

  private static String literal(@Nullable Object value) {
    if (value instanceof CharSequence) {
      return "\"" + value + "\"";
    }
    if (value instanceof Character) {
      return "'" + value + "'";
    }
    return render(value);
  }
}
