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

import com.facebook.minitest.api.TestContext;
import com.facebook.minitest.core.util.log.Logger;
import com.facebook.minitest.source.ClassDefinition;
import com.facebook.minitest.source.Invoker;
import com.facebook.minitest.source.LoadedSource;
import com.facebook.minitest.source.MethodDefinition;
import com.facebook.minitest.source.SourceMember;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Extracts the test units of loaded sources.
 *
 * <p>A test function:
 *
 * <ul>
 *   <li>has a name beginning with {@code test_}
 *   <li>declares exactly one parameter, a {@link TestContext}
 *   <li>was defined in the source being discovered, not re-exported from another one
 * </ul>
 *
 * <p>A test class has a name beginning with {@code Test}, was defined in the source being
 * discovered and has at least one test method. A test method has a name beginning with {@code
 * test_} and declares exactly two parameters: {@code self}, then a {@link TestContext}.
 *
 * <p>Anything else is skipped. Units are returned sorted by definition order, functions and classes
 * interleaved.
 */
public class TestDiscovery {

  private static final Logger LOG = Logger.get(TestDiscovery.class);

  static final String TEST_FUNCTION_PREFIX = "test_";
  static final String TEST_CLASS_PREFIX = "Test";

  public ImmutableList<TestUnit> discover(Iterable<LoadedSource> sources) {
    ImmutableList.Builder<TestUnit> units = ImmutableList.builder();
    for (LoadedSource source : sources) {
      units.addAll(discover(source));
    }
    return units.build();
  }

  public ImmutableList<TestUnit> discover(LoadedSource source) {
    List<TestUnit> units = new ArrayList<>();
    for (SourceMember member : source.getMembers()) {
      if (!member.getOrigin().equals(source.getName())) {
        LOG.debug(
            "Skipping %s in %s: defined in %s", member.getName(), source, member.getOrigin());
        continue;
      }
      switch (member.getKind()) {
        case FUNCTION:
          toFunctionUnit(member).ifPresent(units::add);
          break;
        case CLASS:
          toClassUnit(member).ifPresent(units::add);
          break;
      }
    }
    units.sort(Comparator.comparing(TestUnit::getOrder));
    LOG.debug("Discovered %d test units in %s", units.size(), source);
    return ImmutableList.copyOf(units);
  }

  private static Optional<TestUnit> toFunctionUnit(SourceMember member) {
    if (!isTestFunction(member.getName(), member.getParameterTypes())) {
      LOG.debug("Skipping %s: not a test function", member);
      return Optional.empty();
    }
    Invoker invoker = member.getInvoker();
    return Optional.of(
        new FunctionUnit(member.getName(), member.getOrder(), t -> invoker.invoke(t)));
  }

  private static Optional<TestUnit> toClassUnit(SourceMember member) {
    if (!member.getName().startsWith(TEST_CLASS_PREFIX)) {
      LOG.debug("Skipping %s: not a test class", member);
      return Optional.empty();
    }
    ClassDefinition definition = member.getClassDefinition();
    List<MethodDefinition> testMethods = new ArrayList<>();
    for (MethodDefinition method : definition.getMethods()) {
      if (isTestMethod(method.getName(), method.getParameterTypes())) {
        testMethods.add(method);
      } else {
        LOG.debug("Skipping %s.%s: not a test method", member.getName(), method);
      }
    }
    if (testMethods.isEmpty()) {
      LOG.debug("Skipping %s: no test methods", member);
      return Optional.empty();
    }
    testMethods.sort(Comparator.comparing(MethodDefinition::getOrder));

    ClassUnit.Builder unit =
        ClassUnit.builder(member.getName(), member.getOrder())
            .classAttributes(definition.getClassAttributes())
            .setupClass(definition.getSetupClass().orElse(null))
            .teardownClass(definition.getTeardownClass().orElse(null))
            .setup(definition.getSetup().orElse(null))
            .teardown(definition.getTeardown().orElse(null));
    for (MethodDefinition method : testMethods) {
      Invoker invoker = method.getInvoker();
      unit.addMethod(
          new MethodUnit(
              method.getName(), method.getOrder(), (self, t) -> invoker.invoke(self, t)));
    }
    return Optional.of(unit.build());
  }

  @VisibleForTesting
  static boolean isTestFunction(String name, List<Class<?>> parameterTypes) {
    return name.startsWith(TEST_FUNCTION_PREFIX)
        && parameterTypes.size() == 1
        && parameterTypes.get(0) == TestContext.class;
  }

  @VisibleForTesting
  static boolean isTestMethod(String name, List<Class<?>> parameterTypes) {
    return name.startsWith(TEST_FUNCTION_PREFIX)
        && parameterTypes.size() == 2
        && parameterTypes.get(1) == TestContext.class;
  }
}
