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

import com.google.common.collect.ComparisonChain;
import java.util.Objects;

/**
 * Where a member was defined in its source: the line of the registering call, then the
 * registration sequence number. The sequence number is unique within a source, so no two members
 * of a source compare equal.
 */
public final class DefinitionOrder implements Comparable<DefinitionOrder> {

  /** Line used when the registering call site could not be determined. */
  public static final int UNKNOWN_LINE = Integer.MAX_VALUE;

  private final int line;
  private final long sequence;

  private DefinitionOrder(int line, long sequence) {
    this.line = line;
    this.sequence = sequence;
  }

  public static DefinitionOrder of(int line, long sequence) {
    return new DefinitionOrder(line, sequence);
  }

  public static DefinitionOrder atLine(int line) {
    return new DefinitionOrder(line, 0);
  }

  public int getLine() {
    return line;
  }

  public long getSequence() {
    return sequence;
  }

  @Override
  public int compareTo(DefinitionOrder other) {
    return ComparisonChain.start()
        .compare(line, other.line)
        .compare(sequence, other.sequence)
        .result();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof DefinitionOrder)) {
      return false;
    }
    DefinitionOrder other = (DefinitionOrder) obj;
    return line == other.line && sequence == other.sequence;
  }

  @Override
  public int hashCode() {
    return Objects.hash(line, sequence);
  }

  @Override
  public String toString() {
    return String.format("line %d (#%d)", line, sequence);
  }
}
