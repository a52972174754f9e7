/*
 * Copyright (c) Meta Platforms, Inc. and affiliates.
 *
 * This source code is dual-licensed under either the MIT license found in the
 * LICENSE-MIT file in the root directory of this source tree or the Apache
 * License, Version 2.0 found in the LICENSE-APACHE file in the root directory
 * of this source tree. You may select, at your option, one of the
 * above-listed licenses.
 */

package com.facebook.minitest.source;

import com.google.common.collect.ImmutableSet;

/** Finds the source line that called into the registration API. */
class CallSites {

  private static final StackWalker WALKER = StackWalker.getInstance();

  private static final ImmutableSet<String> REGISTRATION_CLASSES =
      ImmutableSet.of(
          CallSites.class.getName(), SourceBuilder.class.getName(), ClassBuilder.class.getName());

  /** Utility class: do not instantiate. */
  private CallSites() {}

  static int registeringLine() {
    return WALKER.walk(
        frames ->
            frames
                .filter(frame -> !REGISTRATION_CLASSES.contains(frame.getClassName()))
                .findFirst()
                .map(StackWalker.StackFrame::getLineNumber)
                .filter(line -> line > 0)
                .orElse(DefinitionOrder.UNKNOWN_LINE));
  }
}
