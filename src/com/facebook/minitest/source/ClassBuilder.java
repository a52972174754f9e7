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

import com.facebook.minitest.api.ClassHook;
import com.facebook.minitest.api.InstanceHook;
import com.facebook.minitest.api.TestMethod;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/** Registers the members of one test class. Obtained from {@link SourceBuilder#testClass}. */
public final class ClassBuilder {

  private final SourceBuilder source;
  private final String name;
  private final ImmutableList.Builder<MethodDefinition> methods = ImmutableList.builder();
  private final Map<String, Object> classAttributes = new LinkedHashMap<>();
  private @Nullable ClassHook setupClass;
  private @Nullable ClassHook teardownClass;
  private @Nullable InstanceHook setup;
  private @Nullable InstanceHook teardown;

  ClassBuilder(SourceBuilder source, String name) {
    this.source = source;
    this.name = name;
  }

  public String getName() {
    return name;
  }

  /** Runs once before the first method. */
  /**
   * Defines an attribute on the class itself. It is in the class state of every run of this class
   * before {@code setup_class} is called; a later definition of the same name replaces it.
   */
  public ClassBuilder classAttribute(String attributeName, Object value) {
    classAttributes.put(checkNotNull(attributeName), checkNotNull(value));
    return this;
  }

  public ClassBuilder setupClass(ClassHook hook) {
    checkState(setupClass == null, "setup_class is already defined for %s", name);
    setupClass = checkNotNull(hook);
    return this;
  }

  /** Runs once after the last method. */
  public ClassBuilder teardownClass(ClassHook hook) {
    checkState(teardownClass == null, "teardown_class is already defined for %s", name);
    teardownClass = checkNotNull(hook);
    return this;
  }

  /** Runs on each fresh instance before its method. */
  public ClassBuilder setup(InstanceHook hook) {
    checkState(setup == null, "setup is already defined for %s", name);
    setup = checkNotNull(hook);
    return this;
  }

  /** Runs on each instance after its method. */
  public ClassBuilder teardown(InstanceHook hook) {
    checkState(teardown == null, "teardown is already defined for %s", name);
    teardown = checkNotNull(hook);
    return this;
  }

  public ClassBuilder method(String methodName, TestMethod method) {
    return method(CallSites.registeringLine(), methodName, method);
  }

  public ClassBuilder method(int line, String methodName, TestMethod method) {
    methods.add(MethodDefinition.of(methodName, source.nextOrder(line), method));
    return this;
  }

  /** Declares a method with an arbitrary signature, typically a helper that is not a test. */
  public ClassBuilder member(String methodName, List<Class<?>> parameterTypes, Invoker invoker) {
    methods.add(
        new MethodDefinition(
            methodName,
            source.nextOrder(CallSites.registeringLine()),
            ImmutableList.copyOf(parameterTypes),
            invoker));
    return this;
  }

  ClassDefinition build() {
    return new ClassDefinition(
        name,
        methods.build(),
        ImmutableMap.copyOf(classAttributes),
        setupClass,
        teardownClass,
        setup,
        teardown);
  }
}
