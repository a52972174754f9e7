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

/**
 * Thrown by {@link TestContext#fail(String, boolean)} when a failure is required, to end the
 * current test body early.
 *
 * <p>This is a control signal, not an error: the runner catches it before any other throwable and
 * finishes the test with whatever the context recorded. It extends {@link Error} so that a test
 * body catching {@link Exception} does not intercept it, and it carries no stack trace.
 */
public final class StopTestSignal extends Error {

  private static final long serialVersionUID = 1L;

  StopTestSignal() {
    super("test stopped by a required failure", null, false, false);
  }
}
