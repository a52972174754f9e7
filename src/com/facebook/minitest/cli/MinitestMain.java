/*
 * Copyright (c) Meta Platforms, Inc. and affiliates.
 *
 * This source code is dual-licensed under either the MIT license found in the
 * LICENSE-MIT file in the root directory of this source tree or the Apache
 * License, Version 2.0 found in the LICENSE-APACHE file in the root directory
 * of this source tree. You may select, at your option, one of the
 * above-listed licenses.
 */

package com.facebook.minitest.cli;

import com.facebook.minitest.core.exceptions.HumanReadableException;
import com.facebook.minitest.core.util.log.Logger;
import com.facebook.minitest.discovery.TestDiscovery;
import com.facebook.minitest.discovery.TestUnit;
import com.facebook.minitest.printing.FriendlyPrinter;
import com.facebook.minitest.result.TestResult;
import com.facebook.minitest.runner.TestRunner;
import com.facebook.minitest.source.LoadedSource;
import com.facebook.minitest.source.SourceLoader;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import java.io.PrintStream;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;

/**
 * Main entry point: runs the tests of one or more test sources and prints their results.
 *
 * <p>Expected usage: {@code this_binary [options] SOURCE_CLASS...}, where each {@code
 * SOURCE_CLASS} is the fully-qualified name of a {@link com.facebook.minitest.api.TestSource} on
 * the classpath.
 *
 * <p>Exits with {@link #EXIT_SUCCESS} when every test passed, {@link #EXIT_TEST_FAILURES} when any
 * failed or errored and {@link #EXIT_USAGE_ERROR} when the arguments or sources are unusable.
 */
public class MinitestMain {

  static final int EXIT_SUCCESS = 0;
  static final int EXIT_TEST_FAILURES = 1;
  static final int EXIT_USAGE_ERROR = 2;

  static final String LOG_LEVEL_PROPERTY = "com.facebook.minitest.logLevel";

  private static final Logger LOG = Logger.get(MinitestMain.class);

  static {
    // set java.util.logging (JUL) simple formatter to 1 liner.
    System.setProperty(
        "java.util.logging.SimpleFormatter.format",
        "[%1$tY-%1$tm-%1$td %1$tH:%1$tM:%1$tS] [%4$s] %5$s%6$s%n");
  }

  private MinitestMain() {
    // Launcher class.
  }

  public static void main(String[] args) {
    System.exit(run(System.out, System.err, args));
  }

  /** Prevent {@link System#exit(int)} execution so it can be used in unit tests. */
  @VisibleForTesting
  static int run(PrintStream out, PrintStream err, String... args) {
    CommandLineOptions options = new CommandLineOptions();
    CmdLineParser parser = new CmdLineParser(options);
    try {
      parser.parseArgument(args);
    } catch (CmdLineException e) {
      err.println(e.getMessage());
      parser.printUsage(err);
      return EXIT_USAGE_ERROR;
    }

    try {
      configureLogging(options);
      return runTests(options, out);
    } catch (HumanReadableException e) {
      LOG.debug(e, "Aborting test run");
      err.println(e.getHumanReadableErrorMessage());
      return EXIT_USAGE_ERROR;
    }
  }

  private static int runTests(CommandLineOptions options, PrintStream out) {
    if (options.getIndentSize() < 0) {
      throw new HumanReadableException(
          "--indent-size must not be negative, got %d", options.getIndentSize());
    }
    ImmutableList<LoadedSource> sources =
        new SourceLoader().loadAll(options.getSourceClassNames());
    ImmutableList<TestUnit> units = new TestDiscovery().discover(sources);
    LOG.info("Running %d test units from %d sources", units.size(), sources.size());
    ImmutableList<TestResult> results = new TestRunner().run(units);

    FriendlyPrinter printer =
        new FriendlyPrinter(results, options.isColourised(), options.getIndentSize());
    printer.print(out);
    return printer.getSummary().isSuccessful() ? EXIT_SUCCESS : EXIT_TEST_FAILURES;
  }

  private static void configureLogging(CommandLineOptions options) {
    String levelName =
        options.getLogLevel().orElse(System.getProperty(LOG_LEVEL_PROPERTY, "WARNING"));
    Level level;
    try {
      level = Level.parse(levelName);
    } catch (IllegalArgumentException e) {
      throw new HumanReadableException(e, "Unknown log level: %s", levelName);
    }
    java.util.logging.Logger rootLogger = LogManager.getLogManager().getLogger("");
    if (rootLogger == null) {
      return;
    }
    rootLogger.setLevel(level);
    for (Handler handler : rootLogger.getHandlers()) {
      handler.setLevel(level);
    }
  }
}
