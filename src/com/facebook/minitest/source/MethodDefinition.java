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

import com.facebook.minitest.api.TestContext;
import com.facebook.minitest.api.TestInstance;
import com.facebook.minitest.api.TestMethod;
import com.google.common.collect.ImmutableList;

/** A method declared in a test class, whether or not it is a test. */
public final class MethodDefinition {

  private final String name;
  private final DefinitionOrder order;
  private final ImmutableList<Class<?>> parameterTypes;
  private final Invoker invoker;

  public MethodDefinition(
      String name,
      DefinitionOrder order,
      ImmutableList<Class<?>> parameterTypes,
      Invoker invoker) {
    this.name = checkNotNull(name);
    this.order = checkNotNull(order);
    this.parameterTypes = checkNotNull(parameterTypes);
    this.invoker = checkNotNull(invoker);
  }

  /** A method with the {@code (self, t)} signature of a test method. */
  public static MethodDefinition of(String name, DefinitionOrder order, TestMethod method) {
    checkNotNull(method);
    return new MethodDefinition(
        name,
        order,
        ImmutableList.of(TestInstance.class, TestContext.class),
        args -> method.run((TestInstance) args[0], (TestContext) args[1]));
  }

  public String getName() {
    return name;
  }

  public DefinitionOrder getOrder() {
    return order;
  }

  /** Declared parameter types, {@code self} included. */
  public ImmutableList<Class<?>> getParameterTypes() {
    return parameterTypes;
  }

  public Invoker getInvoker() {
    return invoker;
  }

  @Override
  public String toString() {
    return String.format("%s%s at %s", name, parameterTypes, order);
  }
}
