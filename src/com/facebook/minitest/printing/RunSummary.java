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

import com.facebook.minitest.result.TestResult;

/** Counts of results by type. Parents and their sub results each count as one test. */
public final class RunSummary {

  private int testsRun;
  private int testsPassed;
  private int testsFailed;
  private int testsErrored;

  private RunSummary() {}

  public static RunSummary of(Iterable<? extends TestResult> results) {
    RunSummary summary = new RunSummary();
    summary.count(results);
    return summary;
  }

  private void count(Iterable<? extends TestResult> results) {
    for (TestResult result : results) {
      testsRun++;
      switch (result.getType()) {
        case PASS:
          testsPassed++;
          break;
        case FAIL:
          testsFailed++;
          break;
        case ERROR:
          testsErrored++;
          break;
      }
      count(result.getSubResults());
    }
  }

  public int getTestsRun() {
    return testsRun;
  }

  public int getTestsPassed() {
    return testsPassed;
  }

  public int getTestsFailed() {
    return testsFailed;
  }

  public int getTestsErrored() {
    return testsErrored;
  }

  public boolean isSuccessful() {
    return testsFailed == 0 && testsErrored == 0;
  }

  @Override
  public String toString() {
    return String.format(
        "RunSummary{run=%d, passed=%d, failed=%d, errored=%d}",
        testsRun, testsPassed, testsFailed, testsErrored);
  }
}
