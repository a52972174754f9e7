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

import com.facebook.minitest.formatting.FriendlyFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;

/** Command line options of {@link MinitestMain}. */
public class CommandLineOptions {

  @Argument(
      metaVar = "SOURCE_CLASS",
      required = true,
      multiValued = true,
      usage = "Fully-qualified names of the TestSource classes to run")
  private List<String> sourceClassNames = new ArrayList<>();

  @Option(
      name = "--no-colour",
      aliases = {"--no-color"},
      usage = "Print results without ANSI colours")
  private boolean noColour = false;

  @Option(name = "--indent-size", metaVar = "N", usage = "Indentation of messages and traces")
  private int indentSize = FriendlyFormatter.DEFAULT_INDENT_SIZE;

  @Option(
      name = "--log-level",
      metaVar = "LEVEL",
      usage = "java.util.logging level of the runner's own logs, e.g. FINE")
  @Nullable
  private String logLevel;

  public List<String> getSourceClassNames() {
    return sourceClassNames;
  }

  public boolean isColourised() {
    return !noColour;
  }

  public int getIndentSize() {
    return indentSize;
  }

  public Optional<String> getLogLevel() {
    return Optional.ofNullable(logLevel);
  }
}
