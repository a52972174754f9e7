/*
 * Copyright (c) Meta Platforms, Inc. and affiliates.
 *
 * This source code is dual-licensed under either the MIT license found in the
 * LICENSE-MIT file in the root directory of this source tree or the Apache
 * License, Version 2.0 found in the LICENSE-APACHE file in the root directory
 * of this source tree. You may select, at your option, one of the
 * above-listed licenses.
 */

package com.facebook.minitest.runner;

import static com.google.common.base.Preconditions.checkNotNull;

import com.facebook.minitest.result.TestResult;
import com.google.common.collect.ImmutableList;

/**
 * Raised inside {@link ClassUnitRunner} when a lifecycle hook throws. The cause is what the hook
 * threw; {@link #getResults()} holds the method results gathered before the hook ran.
 */
class LifecycleException extends Exception {

  private static final long serialVersionUID = 1L;

  private final LifecyclePhase phase;
  private final transient ImmutableList<TestResult> results;

  LifecycleException(LifecyclePhase phase, Throwable raised, Iterable<TestResult> results) {
    super(String.format("%s raised %s", phase, raised), checkNotNull(raised));
    this.phase = phase;
    this.results = ImmutableList.copyOf(results);
  }

  LifecyclePhase getPhase() {
    return phase;
  }

  ImmutableList<TestResult> getResults() {
    return results;
  }
}
