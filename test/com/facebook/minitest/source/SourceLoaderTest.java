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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.fail;

import com.facebook.minitest.api.TestSource;
import com.facebook.minitest.core.exceptions.HumanReadableException;
import com.facebook.minitest.testdata.BrokenSource;
import com.facebook.minitest.testdata.NoDefaultConstructorSource;
import com.facebook.minitest.testdata.NotASource;
import com.facebook.minitest.testdata.NumbersSource;
import com.facebook.minitest.testdata.PassingSource;
import com.google.common.collect.ImmutableList;
import java.util.stream.Collectors;
import org.junit.Test;

public class SourceLoaderTest {

  private final SourceLoader loader = new SourceLoader();

  @Test
  public void loadsSourcesByClassName() {
    LoadedSource source = loader.load(NumbersSource.class.getName());
    assertThat(source.getName(), equalTo(NumbersSource.class.getName()));
    assertThat(
        source.getMembers().stream().map(SourceMember::getName).collect(Collectors.toList()),
        equalTo(ImmutableList.of("test_add", "test_sub", "add")));
  }

  @Test
  public void loadsSourcesInTheGivenOrder() {
    ImmutableList<LoadedSource> sources =
        loader.loadAll(
            ImmutableList.of(PassingSource.class.getName(), NumbersSource.class.getName()));
    assertThat(sources.get(0).getName(), equalTo(PassingSource.class.getName()));
    assertThat(sources.get(1).getName(), equalTo(NumbersSource.class.getName()));
  }

  @Test
  public void unknownClassIsReported() {
    HumanReadableException e = expectFailure("com.facebook.minitest.testdata.Missing");
    assertThat(
        e.getHumanReadableErrorMessage(),
        equalTo("Unable to load test source com.facebook.minitest.testdata.Missing"));
  }

  @Test
  public void classThatIsNotASourceIsReported() {
    HumanReadableException e = expectFailure(NotASource.class.getName());
    assertThat(e.getHumanReadableErrorMessage(), containsString("does not implement"));
    assertThat(e.getHumanReadableErrorMessage(), containsString(TestSource.class.getName()));
  }

  @Test
  public void interfaceIsReported() {
    HumanReadableException e = expectFailure(TestSource.class.getName());
    assertThat(e.getHumanReadableErrorMessage(), containsString("is abstract"));
  }

  @Test
  public void sourceWithoutNoArgConstructorIsReported() {
    HumanReadableException e = expectFailure(NoDefaultConstructorSource.class.getName());
    assertThat(
        e.getHumanReadableErrorMessage(), containsString("needs a public no-argument constructor"));
  }

  @Test
  public void failureToDefineIsReportedWithItsCause() {
    HumanReadableException e = expectFailure(BrokenSource.class.getName());
    assertThat(
        e.getHumanReadableErrorMessage(),
        equalTo(
            "Failed to define test source "
                + BrokenSource.class.getName()
                + ": cannot define tests"));
    assertThat(e.getCause(), instanceOf(Exception.class));
    assertThat(e.getCause().getMessage(), equalTo("cannot define tests"));
  }

  @Test
  public void sourceNamesItself() {
    NoDefaultConstructorSource source = new NoDefaultConstructorSource("custom");
    LoadedSource loaded = LoadedSource.load(source);
    assertThat(loaded.getName(), equalTo("custom"));
    assertThat(loaded.getMember("test_nothing").getOrigin(), equalTo("custom"));
  }

  private HumanReadableException expectFailure(String className) {
    try {
      loader.load(className);
    } catch (HumanReadableException e) {
      return e;
    }
    fail("expected loading " + className + " to fail");
    throw new AssertionError();
  }
}
