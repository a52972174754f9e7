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

import com.facebook.minitest.api.TestSource;
import com.facebook.minitest.core.exceptions.HumanReadableException;
import com.facebook.minitest.core.util.log.Logger;
import com.google.common.collect.ImmutableList;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;

/** Loads {@link TestSource} implementations by their fully-qualified class name. */
public class SourceLoader {

  private static final Logger LOG = Logger.get(SourceLoader.class);

  private final ClassLoader classLoader;

  public SourceLoader() {
    this(SourceLoader.class.getClassLoader());
  }

  public SourceLoader(ClassLoader classLoader) {
    this.classLoader = classLoader;
  }

  public ImmutableList<LoadedSource> loadAll(Iterable<String> classNames) {
    ImmutableList.Builder<LoadedSource> sources = ImmutableList.builder();
    for (String className : classNames) {
      sources.add(load(className));
    }
    return sources.build();
  }

  /**
   * @throws HumanReadableException if the class is missing, is not a usable {@link TestSource}, or
   *     fails while defining its members
   */
  public LoadedSource load(String className) {
    LOG.debug("Loading test source %s", className);
    Class<?> cls;
    try {
      cls = Class.forName(className, true, classLoader);
    } catch (ClassNotFoundException | LinkageError e) {
      throw new HumanReadableException(e, "Unable to load test source %s", className);
    }
    if (!TestSource.class.isAssignableFrom(cls)) {
      throw new HumanReadableException(
          "%s does not implement %s", className, TestSource.class.getName());
    }
    int modifiers = cls.getModifiers();
    if (Modifier.isInterface(modifiers) || Modifier.isAbstract(modifiers)) {
      throw new HumanReadableException("%s is abstract and cannot be instantiated", className);
    }
    return LoadedSource.load(instantiate(cls.asSubclass(TestSource.class)));
  }

  private static TestSource instantiate(Class<? extends TestSource> cls) {
    Constructor<? extends TestSource> constructor;
    try {
      constructor = cls.getConstructor();
    } catch (NoSuchMethodException e) {
      throw new HumanReadableException(
          e, "%s needs a public no-argument constructor", cls.getName());
    }
    try {
      return constructor.newInstance();
    } catch (InvocationTargetException e) {
      throw new HumanReadableException(
          e.getCause(), "Failed to create test source %s", cls.getName());
    } catch (ReflectiveOperationException e) {
      throw new HumanReadableException(e, "Failed to create test source %s", cls.getName());
    }
  }
}
