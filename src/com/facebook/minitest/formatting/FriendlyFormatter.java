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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.facebook.minitest.result.ErrorResult;
import com.facebook.minitest.result.TestResult;
import com.facebook.minitest.util.Ansi;
import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * Formats test results in a human-readable way. Each result is formatted as:
 *
 * <pre>
 * [$PREFIX]$TEST_NAME (PASS | FAIL | ERROR)
 *     [- $FAILURE_MESSAGE ... | $STACK_TRACE]
 * [$SUB_RESULTS prefixed with $TEST_NAME/]
 * </pre>
 */
public class FriendlyFormatter {

  public static final int DEFAULT_INDENT_SIZE = 4;

  private static final Joiner NEW_LINE_JOINER = Joiner.on('\n');

  private final ImmutableList<TestResult> results;
  private final String testPrefix;
  private final String indent;
  private final Ansi ansi;

  public FriendlyFormatter(List<? extends TestResult> results) {
    this(results, "", DEFAULT_INDENT_SIZE, Ansi.withoutTty());
  }

  public FriendlyFormatter(
      List<? extends TestResult> results, String testPrefix, int indentSize, Ansi ansi) {
    checkArgument(indentSize >= 0, "indent size must not be negative: %s", indentSize);
    this.results = ImmutableList.copyOf(results);
    this.testPrefix = checkNotNull(testPrefix);
    this.indent = Strings.repeat(" ", indentSize);
    this.ansi = checkNotNull(ansi);
  }

  public String format() {
    return format(true);
  }

  public String format(boolean trailingNewLine) {
    List<String> lines = new ArrayList<>();
    for (TestResult result : results) {
      formatResult(result, testPrefix, lines);
    }
    String formatted = NEW_LINE_JOINER.join(lines);
    return trailingNewLine ? formatted + "\n" : formatted;
  }

  private void formatResult(TestResult result, String prefix, List<String> lines) {
    lines.add(formatTestName(result, prefix));
    switch (result.getType()) {
      case PASS:
        break;
      case FAIL:
        for (String message : result.getMessages()) {
          lines.add(indent + "- " + message);
        }
        break;
      case ERROR:
        ((ErrorResult) result)
            .getError()
            .ifPresent(
                error -> {
                  for (String line : StackTraces.trimmedLines(error)) {
                    lines.add(indent + line.replace("\t", indent));
                  }
                });
        break;
    }
    for (TestResult subResult : result.getSubResults()) {
      formatResult(subResult, result.getTestName() + "/", lines);
    }
  }

  private String formatTestName(TestResult result, String prefix) {
    String line = prefix + result.getTestName() + " " + result.getType();
    switch (result.getType()) {
      case PASS:
        return ansi.asBoldText(ansi.asGreenText(line));
      case FAIL:
        return ansi.asBoldText(ansi.asRedText(line));
      case ERROR:
        return ansi.asBoldText(ansi.asBlueText(line));
    }
    throw new IllegalStateException("Unknown result type " + result.getType());
  }
}
