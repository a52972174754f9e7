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

import static com.google.common.base.Preconditions.checkNotNull;

import com.facebook.minitest.api.TestSource;
import com.facebook.minitest.core.exceptions.HumanReadableException;
import com.google.common.collect.ImmutableList;
import java.util.NoSuchElementException;

/** A test source after registration: its name and its members, in registration order. */
public final class LoadedSource {

  private final String name;
  private final ImmutableList<SourceMember> members;

  LoadedSource(String name, ImmutableList<SourceMember> members) {
    this.name = checkNotNull(name);
    this.members = checkNotNull(members);
  }

  /**
   * Runs the registration of {@code source}.
   *
   * @throws HumanReadableException if the source fails while registering its members
   */
  public static LoadedSource load(TestSource source) {
    SourceBuilder builder = new SourceBuilder(source.getName());
    try {
      source.define(builder);
    } catch (Exception e) {
      throw new HumanReadableException(
          e, "Failed to define test source %s: %s", source.getName(), e.getMessage());
    }
    return builder.build();
  }

  public String getName() {
    return name;
  }

  public ImmutableList<SourceMember> getMembers() {
    return members;
  }

  /**
   * @throws NoSuchElementException if no member has that name
   */
  public SourceMember getMember(String memberName) {
    return members.stream()
        .filter(member -> member.getName().equals(memberName))
        .findFirst()
        .orElseThrow(
            () ->
                new NoSuchElementException(
                    String.format("%s has no member named %s", name, memberName)));
  }

  @Override
  public String toString() {
    return name;
  }
}
