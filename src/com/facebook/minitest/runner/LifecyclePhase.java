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

/** The lifecycle hooks of a test class, in the order they run. */
public enum LifecyclePhase {
  SETUP_CLASS("setup_class"),
  SETUP("setup"),
  TEARDOWN("teardown"),
  TEARDOWN_CLASS("teardown_class"),
  ;

  private final String hookName;

  LifecyclePhase(String hookName) {
    this.hookName = hookName;
  }

  public String getHookName() {
    return hookName;
  }

  @Override
  public String toString() {
    return hookName;
  }
}
