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

import com.facebook.minitest.api.ClassHook;
import com.facebook.minitest.api.InstanceHook;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * The body of a class registered in a source: its methods, its lifecycle hooks and the attributes
 * it defines itself.
 */
public final class ClassDefinition {

  private final String name;
  private final ImmutableList<MethodDefinition> methods;
  private final ImmutableMap<String, Object> classAttributes;
  private final @Nullable ClassHook setupClass;
  private final @Nullable ClassHook teardownClass;
  private final @Nullable InstanceHook setup;
  private final @Nullable InstanceHook teardown;

  ClassDefinition(
      String name,
      ImmutableList<MethodDefinition> methods,
      ImmutableMap<String, Object> classAttributes,
      @Nullable ClassHook setupClass,
      @Nullable ClassHook teardownClass,
      @Nullable InstanceHook setup,
      @Nullable InstanceHook teardown) {
    this.name = checkNotNull(name);
    this.methods = checkNotNull(methods);
    this.classAttributes = checkNotNull(classAttributes);
    this.setupClass = setupClass;
    this.teardownClass = teardownClass;
    this.setup = setup;
    this.teardown = teardown;
  }

  public String getName() {
    return name;
  }

  /** Every declared method, in registration order. */
  public ImmutableList<MethodDefinition> getMethods() {
    return methods;
  }

  /** Attributes every run of the class starts with, before {@code setup_class}. */
  public ImmutableMap<String, Object> getClassAttributes() {
    return classAttributes;
  }

  public Optional<ClassHook> getSetupClass() {
    return Optional.ofNullable(setupClass);
  }

  public Optional<ClassHook> getTeardownClass() {
    return Optional.ofNullable(teardownClass);
  }

  public Optional<InstanceHook> getSetup() {
    return Optional.ofNullable(setup);
  }

  public Optional<InstanceHook> getTeardown() {
    return Optional.ofNullable(teardown);
  }
}
