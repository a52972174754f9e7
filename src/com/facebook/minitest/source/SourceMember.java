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
import static com.google.common.base.Preconditions.checkState;

import com.facebook.minitest.api.TestContext;
import com.facebook.minitest.api.TestFunction;
import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/**
 * A top-level member of a test source: a function or a class.
 *
 * <p>Each member remembers the source it was originally defined in. A member re-exported by
 * another source keeps its original {@link #getOrigin()}.
 */
public final class SourceMember {

  /** The shape of a member. */
  public enum Kind {
    FUNCTION,
    CLASS,
  }

  private final String name;
  private final Kind kind;
  private final String origin;
  private final DefinitionOrder order;
  private final ImmutableList<Class<?>> parameterTypes;
  private final @Nullable Invoker invoker;
  private final @Nullable ClassDefinition classDefinition;

  private SourceMember(
      String name,
      Kind kind,
      String origin,
      DefinitionOrder order,
      ImmutableList<Class<?>> parameterTypes,
      @Nullable Invoker invoker,
      @Nullable ClassDefinition classDefinition) {
    this.name = checkNotNull(name);
    this.kind = kind;
    this.origin = checkNotNull(origin);
    this.order = checkNotNull(order);
    this.parameterTypes = checkNotNull(parameterTypes);
    this.invoker = invoker;
    this.classDefinition = classDefinition;
  }

  /** A function with an arbitrary signature. */
  public static SourceMember function(
      String name,
      String origin,
      DefinitionOrder order,
      ImmutableList<Class<?>> parameterTypes,
      Invoker invoker) {
    return new SourceMember(
        name, Kind.FUNCTION, origin, order, parameterTypes, checkNotNull(invoker), null);
  }

  /** A function with the single {@link TestContext} parameter of a test function. */
  public static SourceMember testFunction(
      String name, String origin, DefinitionOrder order, TestFunction function) {
    checkNotNull(function);
    return function(
        name,
        origin,
        order,
        ImmutableList.of(TestContext.class),
        args -> function.run((TestContext) args[0]));
  }

  public static SourceMember ofClass(
      ClassDefinition classDefinition, String origin, DefinitionOrder order) {
    return new SourceMember(
        classDefinition.getName(),
        Kind.CLASS,
        origin,
        order,
        ImmutableList.of(),
        null,
        classDefinition);
  }

  public String getName() {
    return name;
  }

  public Kind getKind() {
    return kind;
  }

  /** Name of the source this member was defined in. */
  public String getOrigin() {
    return origin;
  }

  public DefinitionOrder getOrder() {
    return order;
  }

  /** Declared parameter types of a function; empty for classes. */
  public ImmutableList<Class<?>> getParameterTypes() {
    return parameterTypes;
  }

  public Invoker getInvoker() {
    checkState(invoker != null, "%s is not a function", name);
    return invoker;
  }

  public ClassDefinition getClassDefinition() {
    checkState(classDefinition != null, "%s is not a class", name);
    return classDefinition;
  }

  @Override
  public String toString() {
    return String.format("%s %s (from %s, %s)", kind, name, origin, order);
  }
}
