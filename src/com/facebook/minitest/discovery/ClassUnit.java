/*
 * Copyright (c) Meta Platforms, Inc. and affiliates.
 *
 * This source code is dual-licensed under either the MIT license found in the
 * LICENSE-MIT file in the root directory of this source tree or the Apache
 * License, Version 2.0 found in the LICENSE-APACHE file in the root directory
 * of this source tree. You may select, at your option, one of the
 * above-listed licenses.
 */

package com.facebook.minitest.discovery;

import static com.google.common.base.Preconditions.checkNotNull;

import com.facebook.minitest.api.ClassHook;
import com.facebook.minitest.api.InstanceHook;
import com.facebook.minitest.source.DefinitionOrder;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;

/** A test class: its eligible methods, sorted by definition order, and its lifecycle hooks. */
public final class ClassUnit extends TestUnit {

  private final ImmutableList<MethodUnit> methods;
  private final ImmutableMap<String, Object> classAttributes;
  private final @Nullable ClassHook setupClass;
  private final @Nullable ClassHook teardownClass;
  private final @Nullable InstanceHook setup;
  private final @Nullable InstanceHook teardown;

  private ClassUnit(Builder builder) {
    super(builder.name, builder.order);
    this.methods = builder.methods.build();
    this.classAttributes = builder.classAttributes.build();
    this.setupClass = builder.setupClass;
    this.teardownClass = builder.teardownClass;
    this.setup = builder.setup;
    this.teardown = builder.teardown;
  }

  @Override
  public Kind getKind() {
    return Kind.CLASS;
  }

  @Override
  public ClassUnit asClass() {
    return this;
  }

  public ImmutableList<MethodUnit> getMethods() {
    return methods;
  }

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

  /**
   * @return New instance of a builder for {@link ClassUnit}
   */
  public static Builder builder(String name, DefinitionOrder order) {
    return new Builder(name, order);
  }

  /** Builder class for {@link ClassUnit} */
  public static class Builder {

    private final String name;
    private final DefinitionOrder order;
    private final ImmutableList.Builder<MethodUnit> methods = ImmutableList.builder();
    private final ImmutableMap.Builder<String, Object> classAttributes = ImmutableMap.builder();
    private @Nullable ClassHook setupClass;
    private @Nullable ClassHook teardownClass;
    private @Nullable InstanceHook setup;
    private @Nullable InstanceHook teardown;

    private Builder(String name, DefinitionOrder order) {
      this.name = checkNotNull(name);
      this.order = checkNotNull(order);
    }

    /** Methods run in the order they are added. */
    public Builder addMethod(MethodUnit method) {
      methods.add(checkNotNull(method));
      return this;
    }

    public Builder classAttributes(Map<String, ?> attributes) {
      classAttributes.putAll(attributes);
      return this;
    }

    public Builder setupClass(@Nullable ClassHook hook) {
      setupClass = hook;
      return this;
    }

    public Builder teardownClass(@Nullable ClassHook hook) {
      teardownClass = hook;
      return this;
    }

    public Builder setup(@Nullable InstanceHook hook) {
      setup = hook;
      return this;
    }

    public Builder teardown(@Nullable InstanceHook hook) {
      teardown = hook;
      return this;
    }

    public ClassUnit build() {
      return new ClassUnit(this);
    }
  }
}
