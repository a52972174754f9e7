/*
 * Copyright (c) Meta Platforms, Inc. and affiliates.
 *
 * This source code is dual-licensed under either the MIT license found in the
 * LICENSE-MIT file in the root directory of this source tree or the Apache
 * License, Version 2.0 found in the LICENSE-APACHE file in the root directory
 * of this source tree. You may select, at your option, one of the
 * above-listed licenses.
 */

package com.facebook.minitest.util;

/** Decorates text with ANSI escape sequences when the output supports them. */
public final class Ansi {

  private static final String RESET = "\u001B[0m";
  private static final String BOLD = "\u001B[1m";
  private static final String RED = "\u001B[31m";
  private static final String GREEN = "\u001B[32m";
  private static final String BLUE = "\u001B[34m";

  private static final Ansi NO_TTY = new Ansi(false);
  private static final Ansi FORCE_TTY = new Ansi(true);

  private final boolean isAnsiTerminal;

  private Ansi(boolean isAnsiTerminal) {
    this.isAnsiTerminal = isAnsiTerminal;
  }

  /** An {@link Ansi} that leaves text untouched. */
  public static Ansi withoutTty() {
    return NO_TTY;
  }

  public static Ansi forceTty() {
    return FORCE_TTY;
  }

  public boolean isAnsiTerminal() {
    return isAnsiTerminal;
  }

  public String asBoldText(String text) {
    return wrap(BOLD, text);
  }

  public String asGreenText(String text) {
    return wrap(GREEN, text);
  }

  public String asRedText(String text) {
    return wrap(RED, text);
  }

  public String asBlueText(String text) {
    return wrap(BLUE, text);
  }

  // Styles nested in text end with a reset; re-apply ours after each of them.
  private String wrap(String code, String text) {
    if (!isAnsiTerminal) {
      return text;
    }
    return code + text.replace(RESET, RESET + code) + RESET;
  }
}
