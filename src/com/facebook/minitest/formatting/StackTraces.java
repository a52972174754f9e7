/*
 * Copyright (c) Meta Platforms, Inc. and affiliates.
 *
 * This source code is dual-licensed under either the MIT license found in the
 * LICENSE-MIT file in the root directory of this source tree or the Apache
 * License, Version 2.0 found in the LICENSE-APACHE file in the root directory
 * of this source tree. You may select, at your option, one of the
 * above-listed licenses.
 */

package com.facebook.minitest.formatting;

import com.google.common.base.Splitter;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** Renders the stack trace of an error captured while running a test. */
public class StackTraces {

  // Frames of these packages below the first test frame are the framework calling the test.
  private static final ImmutableList<String> FRAMEWORK_PACKAGES =
      ImmutableList.of(
          "com.facebook.minitest.runner.",
          "com.facebook.minitest.discovery.",
          "com.facebook.minitest.source.");

  private static final Splitter LINE_SPLITTER = Splitter.onPattern("\r?\n").omitEmptyStrings();

  /** Utility class: do not instantiate. */
  private StackTraces() {}

  /**
   * Returns the lines of {@code error}'s stack trace, causes and suppressed errors included,
   * without the frames of the test framework that called the test.
   *
   * <p>Framework frames above the first test frame are kept: they are where the error was raised,
   * e.g. a framework method the test called.
   */
  public static ImmutableList<String> trimmedLines(Throwable error) {
    List<String> lines = LINE_SPLITTER.splitToList(Throwables.getStackTraceAsString(error));
    ImmutableList.Builder<String> trimmed = ImmutableList.builder();
    boolean seenTestFrame = false;
    boolean skipping = false;
    for (String line : lines) {
      String stripped = line.trim();
      if (stripped.startsWith("at ")) {
        boolean frameworkFrame = isFrameworkFrame(stripped.substring(3));
        if (frameworkFrame && seenTestFrame) {
          skipping = true;
        } else if (!frameworkFrame) {
          seenTestFrame = true;
        }
        if (!skipping) {
          trimmed.add(line);
        }
      } else if (!skipping || !stripped.startsWith("... ")) {
        // a new section: the exception line, "Caused by:" or "Suppressed:"
        seenTestFrame = false;
        skipping = false;
        trimmed.add(line);
      }
    }
    return trimmed.build();
  }

  private static boolean isFrameworkFrame(String frame) {
    int paren = frame.indexOf('(');
    String qualifiedMethod = paren >= 0 ? frame.substring(0, paren) : frame;
    // drop any "loader/module@version/" prefix
    qualifiedMethod = qualifiedMethod.substring(qualifiedMethod.lastIndexOf('/') + 1);
    for (String prefix : FRAMEWORK_PACKAGES) {
      if (qualifiedMethod.startsWith(prefix)) {
        return true;
      }
    }
    return false;
  }
}
