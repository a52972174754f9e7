/*
 * Copyright (c) Meta Platforms, Inc. and affiliates.
 *
 * This source code is dual-licensed under either the MIT license found in the
 * LICENSE-MIT file in the root directory of this source tree or the Apache
 * License, Version 2.0 found in the LICENSE-APACHE file in the root directory
 * of this source tree. You may select, at your option, one of the
 * above-listed licenses.
 */

package com.facebook.minitest.core.exceptions;

import javax.annotation.Nullable;

/**
 * A problem with the run itself, such as a test source that cannot be loaded or an unusable
 * command line, whose message is shown to the user as is. Only the command line entry point
 * catches it; test outcomes never use it.
 */
public class HumanReadableException extends RuntimeException {

  public HumanReadableException(String format, Object... args) {
    this((Throwable) null, format, args);
  }

  public HumanReadableException(@Nullable Throwable cause, String format, Object... args) {
    super(String.format(format, args), cause);
  }

  /** The message to print, without a stack trace. */
  public String getHumanReadableErrorMessage() {
    return getMessage();
  }
}
