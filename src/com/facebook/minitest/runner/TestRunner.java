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

import static com.google.common.base.Preconditions.checkNotNull;

import com.facebook.minitest.api.StopTestSignal;
import com.facebook.minitest.api.TestContext;
import com.facebook.minitest.api.TestFunction;
import com.facebook.minitest.core.util.log.Logger;
import com.facebook.minitest.discovery.TestUnit;
import com.facebook.minitest.result.ErrorResult;
import com.facebook.minitest.result.FailResult;
import com.facebook.minitest.result.PassResult;
import com.facebook.minitest.result.TestResult;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Runs test units one after the other and returns one result per unit, in the same order.
 *
 * <p>Whatever a test or a lifecycle hook throws ends up in an {@link ErrorResult}, stack
 * overflows included; only the other {@link VirtualMachineError}s and malformed units escape.
 */
public class TestRunner {

  private static final Logger LOG = Logger.get(TestRunner.class);

  private final ClassUnitRunner classUnitRunner = new ClassUnitRunner();

  public ImmutableList<TestResult> run(List<? extends TestUnit> units) {
    checkNotNull(units);
    ImmutableList.Builder<TestResult> results = ImmutableList.builderWithExpectedSize(units.size());
    for (TestUnit unit : units) {
      results.add(run(unit));
    }
    return results.build();
  }

  public TestResult run(TestUnit unit) {
    checkNotNull(unit, "test unit");
    LOG.debug("Running %s", unit);
    TestResult result;
    switch (unit.getKind()) {
      case FUNCTION:
        result = runFunction(unit.getName(), unit.asFunction().getBody());
        break;
      case CLASS:
        result = classUnitRunner.run(unit.asClass());
        break;
      default:
        throw new IllegalStateException("Unknown test unit kind " + unit.getKind());
    }
    LOG.debug("%s finished: %s", unit.getName(), result.getType());
    return result;
  }

  /**
   * Runs one test body against a fresh {@link TestContext}. A required failure ends the body
   * without turning into an error.
   */
  static TestResult runFunction(String name, TestFunction body) {
    TestContext t = new TestContext();
    try {
      body.run(t);
    } catch (StopTestSignal signal) {
      LOG.verbose("%s stopped by a required failure", name);
    } catch (Throwable e) {
      rethrowIfFatal(e);
      if (e instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      LOG.debug(e, "%s raised", name);
      return new ErrorResult(name, e);
    }
    if (!t.isPassed()) {
      return new FailResult(name, t.getMessages());
    }
    return new PassResult(name);
  }

  /**
   * Rethrows errors the JVM cannot recover from. A {@link StackOverflowError} is not one of them:
   * the stack has unwound by the time it is caught here.
   */
  static void rethrowIfFatal(Throwable e) {
    if (e instanceof VirtualMachineError && !(e instanceof StackOverflowError)) {
      throw (VirtualMachineError) e;
    }
  }
}
