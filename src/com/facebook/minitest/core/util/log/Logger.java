/*
 * Copyright (c) Meta Platforms, Inc. and affiliates.
 *
 * This source code is dual-licensed under either the MIT license found in the
 * LICENSE-MIT file in the root directory of this source tree or the Apache
 * License, Version 2.0 found in the LICENSE-APACHE file in the root directory
 * of this source tree. You may select, at your option, one of the
 * above-listed licenses.
 */

package com.facebook.minitest.core.util.log;

import java.util.logging.Level;
import java.util.logging.LogRecord;
import javax.annotation.Nullable;

/**
 * Thin wrapper around {@link java.util.logging.Logger} taking {@link String#format} style
 * arguments. Messages are only formatted when the level is enabled.
 */
public class Logger {

  private final java.util.logging.Logger delegate;

  private Logger(java.util.logging.Logger delegate) {
    this.delegate = delegate;
  }

  public static Logger get(Class<?> cls) {
    return get(cls.getName());
  }

  public static Logger get(String name) {
    return new Logger(java.util.logging.Logger.getLogger(name));
  }

  public String getName() {
    return delegate.getName();
  }

  public boolean isVerboseEnabled() {
    return delegate.isLoggable(Level.FINER);
  }

  public boolean isDebugEnabled() {
    return delegate.isLoggable(Level.FINE);
  }

  public void verbose(String format, Object... args) {
    log(Level.FINER, null, format, args);
  }

  public void verbose(Throwable t, String format, Object... args) {
    log(Level.FINER, t, format, args);
  }

  public void debug(String format, Object... args) {
    log(Level.FINE, null, format, args);
  }

  public void debug(Throwable t, String format, Object... args) {
    log(Level.FINE, t, format, args);
  }

  public void info(String format, Object... args) {
    log(Level.INFO, null, format, args);
  }

  public void info(Throwable t, String format, Object... args) {
    log(Level.INFO, t, format, args);
  }

  public void warn(String format, Object... args) {
    log(Level.WARNING, null, format, args);
  }

  public void warn(Throwable t, String format, Object... args) {
    log(Level.WARNING, t, format, args);
  }

  public void error(String format, Object... args) {
    log(Level.SEVERE, null, format, args);
  }

  public void error(Throwable t, String format, Object... args) {
    log(Level.SEVERE, t, format, args);
  }

  public void error(Throwable t) {
    log(Level.SEVERE, t, String.valueOf(t.getMessage()));
  }

  private void log(Level level, @Nullable Throwable t, String format, Object... args) {
    if (!delegate.isLoggable(level)) {
      return;
    }
    String message = args.length == 0 ? format : String.format(format, args);
    LogRecord record = new LogRecord(level, message);
    record.setLoggerName(delegate.getName());
    record.setThrown(t);
    delegate.log(record);
  }
}
