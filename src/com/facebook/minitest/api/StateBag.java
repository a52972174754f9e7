/*
 * Copyright (c) Meta Platforms, Inc. and affiliates.
 *
 * This source code is dual-licensed under either the MIT license found in the
 * LICENSE-MIT file in the root directory of this source tree or the Apache
 * License, Version 2.0 found in the LICENSE-APACHE file in the root directory
 * of this source tree. You may select, at your option, one of the
 * above-listed licenses.
 */

package com.facebook.minitest.api;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Named attributes shared between lifecycle hooks and test methods.
 *
 * <p>A test class run owns one class-level bag, visible to every method of that run, and creates a
 * new per-method bag for each method invocation. Values may be null.
 */
public final class StateBag {

  private final Map<String, Object> attributes = new LinkedHashMap<>();

  public StateBag() {}

  public StateBag put(String name, @Nullable Object value) {
    attributes.put(checkNotNull(name), value);
    return this;
  }

  public boolean contains(String name) {
    return attributes.containsKey(name);
  }

  /**
   * @throws NoSuchElementException if no attribute called {@code name} was set
   * @throws ClassCastException if the attribute is not a {@code type}
   */
  @Nullable
  public <T> T get(String name, Class<T> type) {
    if (!attributes.containsKey(name)) {
      throw new NoSuchElementException(String.format("No attribute named '%s'", name));
    }
    return type.cast(attributes.get(name));
  }

  public <T> Optional<T> find(String name, Class<T> type) {
    return Optional.ofNullable(attributes.get(name)).map(type::cast);
  }

  public <T> T getOrDefault(String name, Class<T> type, T defaultValue) {
    return find(name, type).orElse(defaultValue);
  }

  public void remove(String name) {
    attributes.remove(name);
  }

  public ImmutableSet<String> names() {
    return ImmutableSet.copyOf(attributes.keySet());
  }

  @Override
  public String toString() {
    return "StateBag" + attributes;
  }
}
