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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class LoggerTest {

  private static final String NAME = LoggerTest.class.getName();

  private final List<LogRecord> records = new ArrayList<>();
  private final Handler handler =
      new Handler() {
        @Override
        public void publish(LogRecord record) {
          records.add(record);
        }

        @Override
        public void flush() {}

        @Override
        public void close() {}
      };
  private java.util.logging.Logger julLogger;

  @Before
  public void setUp() {
    julLogger = java.util.logging.Logger.getLogger(NAME);
    julLogger.setUseParentHandlers(false);
    julLogger.addHandler(handler);
  }

  @After
  public void tearDown() {
    julLogger.removeHandler(handler);
    julLogger.setUseParentHandlers(true);
    julLogger.setLevel(null);
  }

  @Test
  public void formatsArgumentsIntoTheRecord() {
    julLogger.setLevel(Level.ALL);
    Logger log = Logger.get(LoggerTest.class);

    log.debug("Running %d units from %s", 3, "source");

    assertThat(records.size(), equalTo(1));
    LogRecord record = records.get(0);
    assertThat(record.getLevel(), equalTo(Level.FINE));
    assertThat(record.getMessage(), equalTo("Running 3 units from source"));
    assertThat(record.getLoggerName(), equalTo(NAME));
    assertThat(record.getThrown(), nullValue());
  }

  @Test
  public void messagesWithoutArgumentsAreNotFormatted() {
    julLogger.setLevel(Level.ALL);
    Logger.get(NAME).info("100% done");

    assertThat(records.get(0).getMessage(), equalTo("100% done"));
  }

  @Test
  public void attachesThrowables() {
    julLogger.setLevel(Level.ALL);
    IllegalStateException error = new IllegalStateException("oh no!");
    Logger log = Logger.get(NAME);

    log.warn(error, "%s raised", "test_errors");
    log.error(error);

    assertThat(records.get(0).getLevel(), equalTo(Level.WARNING));
    assertThat(records.get(0).getThrown(), sameInstance(error));
    assertThat(records.get(1).getLevel(), equalTo(Level.SEVERE));
    assertThat(records.get(1).getMessage(), equalTo("oh no!"));
  }

  @Test
  public void disabledLevelsAreDropped() {
    julLogger.setLevel(Level.INFO);
    Logger log = Logger.get(NAME);

    log.verbose("hidden %s", "verbose");
    log.debug("hidden %s", "debug");
    log.info("shown");

    assertFalse(log.isDebugEnabled());
    assertFalse(log.isVerboseEnabled());
    assertThat(records.size(), equalTo(1));
    assertThat(records.get(0).getMessage(), equalTo("shown"));
  }

  @Test
  public void verboseIsFinerThanDebug() {
    julLogger.setLevel(Level.FINE);
    Logger log = Logger.get(NAME);

    assertTrue(log.isDebugEnabled());
    assertFalse(log.isVerboseEnabled());
  }
}
