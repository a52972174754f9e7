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

import com.facebook.minitest.api.TestFunction;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Collects the members of one test source.
 *
 * <p>Every registration records the line it was called from as the member's definition order, so
 * members are ordered as written no matter in which order they are registered. The {@code int
 * line} overloads take the line explicitly instead.
 */
public final class SourceBuilder {

  private final String sourceName;
  private final ImmutableList.Builder<SourceMember> members = ImmutableList.builder();
  private long sequence = 0;

  public SourceBuilder(String sourceName) {
    this.sourceName = checkNotNull(sourceName);
  }

  public String getSourceName() {
    return sourceName;
  }

  /** Registers a function taking a {@link com.facebook.minitest.api.TestContext}. */
  public SourceBuilder function(String name, TestFunction function) {
    return function(CallSites.registeringLine(), name, function);
  }

  public SourceBuilder function(int line, String name, TestFunction function) {
    members.add(SourceMember.testFunction(name, sourceName, nextOrder(line), function));
    return this;
  }

  /** Declares a function with an arbitrary signature, typically a helper that is not a test. */
  public SourceBuilder member(String name, List<Class<?>> parameterTypes, Invoker invoker) {
    members.add(
        SourceMember.function(
            name,
            sourceName,
            nextOrder(CallSites.registeringLine()),
            ImmutableList.copyOf(parameterTypes),
            invoker));
    return this;
  }

  /** Registers a class; {@code body} declares its methods and lifecycle hooks. */
  public SourceBuilder testClass(String name, Consumer<ClassBuilder> body) {
    return testClass(CallSites.registeringLine(), name, body);
  }

  public SourceBuilder testClass(int line, String name, Consumer<ClassBuilder> body) {
    // the class takes its position before any of its methods are registered
    DefinitionOrder order = nextOrder(line);
    ClassBuilder builder = new ClassBuilder(this, checkNotNull(name));
    body.accept(builder);
    members.add(SourceMember.ofClass(builder.build(), sourceName, order));
    return this;
  }

  /**
   * Makes a member of another source visible from this one, the way an import would. The member
   * keeps its origin, so discovery does not treat it as defined here.
   */
  public SourceBuilder include(LoadedSource other, String memberName) {
    members.add(other.getMember(memberName));
    return this;
  }

  public LoadedSource build() {
    return new LoadedSource(sourceName, members.build());
  }

  DefinitionOrder nextOrder(int line) {
    return DefinitionOrder.of(line, sequence++);
  }
}
