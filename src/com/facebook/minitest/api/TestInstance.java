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

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The {@code self} of a test method: one per method invocation, seen by {@code setup}, the method
 * and {@code teardown}, then discarded.
 */
public final class TestInstance {

  private final String className;
  private final StateBag classState;
  private final StateBag state = new StateBag();

  public TestInstance(String className, StateBag classState) {
    this.className = checkNotNull(className);
    this.classState = checkNotNull(classState);
  }

  public String getClassName() {
    return className;
  }

  /** State shared by every method of the current class run. */
  public StateBag classState() {
    return classState;
  }

  /** State private to this instance. */
  public StateBag state() {
    return state;
  }
}
