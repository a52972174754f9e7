/*
 * Copyright (c) Meta Platforms, Inc. and affiliates.
 *
 * This source code is dual-licensed under either the MIT license found in the
 * LICENSE-MIT file in the root directory of this source tree or the Apache
 * License, Version 2.0 found in the LICENSE-APACHE file in the root directory
 * of this source tree. You may select, at your option, one of the
 * above-listed licenses.
 */

package com.facebook.minitest.runner;

import com.facebook.minitest.api.ClassHook;
import com.facebook.minitest.api.InstanceHook;
import com.facebook.minitest.api.StateBag;
import com.facebook.minitest.api.TestInstance;
import com.facebook.minitest.core.util.log.Logger;
import com.facebook.minitest.discovery.ClassUnit;
import com.facebook.minitest.discovery.MethodUnit;
import com.facebook.minitest.result.ErrorResult;
import com.facebook.minitest.result.TestResult;
import com.facebook.minitest.result.TestResults;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs a test class:
 *
 * <ol>
 *   <li>{@code setup_class} once, on a class state holding the attributes the class defines
 *   <li>for each test method, on a new {@link TestInstance}: {@code setup}, the method, {@code
 *       teardown}
 *   <li>{@code teardown_class} once
 * </ol>
 *
 * <p>The first hook that throws ends the run. The class then errors with what the hook threw, and
 * its sub results are the method results collected until then. Otherwise the class result is
 * derived from its sub results.
 */
class ClassUnitRunner {

  private static final Logger LOG = Logger.get(ClassUnitRunner.class);

  TestResult run(ClassUnit unit) {
    List<TestResult> results = new ArrayList<>();
    try {
      runMethods(unit, newClassState(unit), results);
    } catch (LifecycleException e) {
      LOG.debug(e.getCause(), "%s of %s raised", e.getPhase(), unit.getName());
      return new ErrorResult(unit.getName(), e.getCause(), e.getResults());
    }
    return TestResults.aggregate(unit.getName(), results);
  }

  private static StateBag newClassState(ClassUnit unit) {
    StateBag classState = new StateBag();
    unit.getClassAttributes().forEach(classState::put);
    return classState;
  }

  private void runMethods(ClassUnit unit, StateBag classState, List<TestResult> results)
      throws LifecycleException {
    runClassHook(LifecyclePhase.SETUP_CLASS, unit.getSetupClass(), classState, results);
    for (MethodUnit method : unit.getMethods()) {
      TestInstance self = new TestInstance(unit.getName(), classState);
      runInstanceHook(LifecyclePhase.SETUP, unit.getSetup(), self, results);
      results.add(TestRunner.runFunction(method.getName(), t -> method.getBody().run(self, t)));
      runInstanceHook(LifecyclePhase.TEARDOWN, unit.getTeardown(), self, results);
    }
    runClassHook(LifecyclePhase.TEARDOWN_CLASS, unit.getTeardownClass(), classState, results);
  }

  private static void runClassHook(
      LifecyclePhase phase,
      Optional<ClassHook> hook,
      StateBag classState,
      List<TestResult> results)
      throws LifecycleException {
    if (hook.isEmpty()) {
      return;
    }
    try {
      hook.get().run(classState);
    } catch (Throwable e) {
      TestRunner.rethrowIfFatal(e);
      throw new LifecycleException(phase, e, results);
    }
  }

  private static void runInstanceHook(
      LifecyclePhase phase,
      Optional<InstanceHook> hook,
      TestInstance self,
      List<TestResult> results)
      throws LifecycleException {
    if (hook.isEmpty()) {
      return;
    }
    try {
      hook.get().run(self);
    } catch (Throwable e) {
      TestRunner.rethrowIfFatal(e);
      throw new LifecycleException(phase, e, results);
    }
  }
}
