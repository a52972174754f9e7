/*
 * Copyright (c) Meta Platforms, Inc. and affiliates.
 *
 * This source code is dual-licensed under either the MIT license found in the
 * LICENSE-MIT file in the root directory of this source tree or the Apache
 * License, Version 2.0 found in the LICENSE-APACHE file in the root directory
 * of this source tree. You may select, at your option, one of the
 * above-listed licenses.
 */

package com.facebook.minitest.printing;

import com.facebook.minitest.formatting.FriendlyFormatter;
import com.facebook.minitest.result.TestResult;
import com.facebook.minitest.util.Ansi;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Prints test results to a console, coloured by outcome, followed by a summary line such as:
 *
 * <pre>
 * 3 tests run; 2 passed, 1 failed
 * </pre>
 */
public class FriendlyPrinter {

  private final ImmutableList<TestResult> results;
  private final Ansi ansi;
  private final int indentSize;
  private final RunSummary summary;

  public FriendlyPrinter(List<? extends TestResult> results) {
    this(results, true, FriendlyFormatter.DEFAULT_INDENT_SIZE);
  }

  public FriendlyPrinter(List<? extends TestResult> results, boolean colourise, int indentSize) {
    this.results = ImmutableList.copyOf(results);
    this.ansi = colourise ? Ansi.forceTty() : Ansi.withoutTty();
    this.indentSize = indentSize;
    this.summary = RunSummary.of(this.results);
  }

  public void print(PrintStream out) {
    if (!results.isEmpty()) {
      out.print(new FriendlyFormatter(results, "", indentSize, ansi).format());
    }
    out.print(formatSummary() + "\n");
    out.flush();
  }

  public RunSummary getSummary() {
    return summary;
  }

  private String formatSummary() {
    int run = summary.getTestsRun();
    String line = String.format("%d test%s run", run, run == 1 ? "" : "s");
    List<String> parts = new ArrayList<>();
    if (summary.getTestsPassed() > 0) {
      parts.add(ansi.asGreenText(summary.getTestsPassed() + " passed"));
    }
    if (summary.getTestsFailed() > 0) {
      parts.add(ansi.asRedText(summary.getTestsFailed() + " failed"));
    }
    if (summary.getTestsErrored() > 0) {
      parts.add(ansi.asBlueText(summary.getTestsErrored() + " errored"));
    }
    if (!parts.isEmpty()) {
      line += "; " + Joiner.on(", ").join(parts);
    }
    return ansi.asBoldText(line);
  }
}
