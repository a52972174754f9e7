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
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.Assert.assertTrue;

import com.facebook.minitest.api.TestContext;
import com.facebook.minitest.api.TestInstance;
import com.facebook.minitest.testdata.NumbersSource;
import com.google.common.collect.ImmutableList;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;
import org.junit.Test;

public class SourceBuilderTest {

  @Test
  public void builderIsNamedAfterItsSource() {
    assertThat(new SourceBuilder("mine").getSourceName(), equalTo("mine"));
  }

  @Test
  public void membersKeepTheirSourceAsOrigin() {
    LoadedSource source =
        new SourceBuilder("mine")
            .function("test_one", t -> {})
            .testClass("TestTwo", cls -> {})
            .build();
    assertThat(source.getName(), equalTo("mine"));
    for (SourceMember member : source.getMembers()) {
      assertThat(member.getOrigin(), equalTo("mine"));
    }
  }

  @Test
  public void functionsTakeATestContext() {
    SourceMember member =
        new SourceBuilder("mine").function("test_one", t -> {}).build().getMember("test_one");
    assertThat(member.getKind(), equalTo(SourceMember.Kind.FUNCTION));
    assertThat(member.getParameterTypes(), contains(TestContext.class));
  }

  @Test
  public void methodsTakeAnInstanceAndATestContext() {
    LoadedSource source =
        new SourceBuilder("mine")
            .testClass("TestFoo", cls -> cls.method("test_bar", (self, t) -> {}))
            .build();
    ClassDefinition definition = source.getMember("TestFoo").getClassDefinition();
    assertThat(definition.getMethods().size(), equalTo(1));
    assertThat(
        definition.getMethods().get(0).getParameterTypes(),
        contains(TestInstance.class, TestContext.class));
  }

  @Test
  public void explicitLinesOrderMembers() {
    LoadedSource source =
        new SourceBuilder("mine")
            .function(10, "test_b", t -> {})
            .function(5, "test_a", t -> {})
            .build();
    assertThat(
        source.getMember("test_a").getOrder(), lessThan(source.getMember("test_b").getOrder()));
  }

  @Test
  public void registrationSequenceBreaksLineTies() {
    LoadedSource source =
        new SourceBuilder("mine")
            .function(7, "test_b", t -> {})
            .function(7, "test_a", t -> {})
            .build();
    assertThat(
        source.getMember("test_b").getOrder(), lessThan(source.getMember("test_a").getOrder()));
    assertThat(source.getMember("test_b").getOrder().getSequence(), equalTo(0L));
    assertThat(source.getMember("test_a").getOrder().getSequence(), equalTo(1L));
  }

  @Test
  public void registeringLinesAreCapturedFromTheCaller() {
    SourceBuilder builder = new SourceBuilder("mine");
    builder.function("test_first", t -> {});
    builder.function("test_second", t -> {});
    LoadedSource source = builder.build();

    DefinitionOrder first = source.getMember("test_first").getOrder();
    DefinitionOrder second = source.getMember("test_second").getOrder();
    assertThat(first.getLine(), lessThan(DefinitionOrder.UNKNOWN_LINE));
    assertThat(second.getLine(), greaterThan(first.getLine()));
  }

  @Test
  public void classIsOrderedBeforeItsMethods() {
    LoadedSource source =
        new SourceBuilder("mine")
            .testClass(
                20,
                "TestFoo",
                cls ->
                    cls.method(21, "test_b", (self, t) -> {})
                        .method(22, "test_a", (self, t) -> {}))
            .build();
    SourceMember cls = source.getMember("TestFoo");
    assertThat(cls.getOrder(), equalTo(DefinitionOrder.of(20, 0)));
    assertThat(
        cls.getClassDefinition().getMethods().stream()
            .map(MethodDefinition::getName)
            .collect(Collectors.toList()),
        contains("test_b", "test_a"));
  }

  @Test(expected = IllegalStateException.class)
  public void hooksCanOnlyBeSetOnce() {
    new SourceBuilder("mine")
        .testClass("TestFoo", cls -> cls.setup(self -> {}).setup(self -> {}));
  }

  @Test
  public void classBuilderCollectsHooks() {
    LoadedSource source =
        new SourceBuilder("mine")
            .testClass(
                "TestFoo",
                cls ->
                    cls.setupClass(state -> {})
                        .teardownClass(state -> {})
                        .setup(self -> {})
                        .teardown(self -> {}))
            .build();
    ClassDefinition definition = source.getMember("TestFoo").getClassDefinition();
    assertTrue(definition.getSetupClass().isPresent());
    assertTrue(definition.getTeardownClass().isPresent());
    assertTrue(definition.getSetup().isPresent());
    assertTrue(definition.getTeardown().isPresent());
  }

  @Test
  public void classAttributesAreKeptInDefinitionOrder() {
    LoadedSource source =
        new SourceBuilder("mine")
            .testClass(
                "TestFoo",
                cls ->
                    cls.classAttribute("host", "localhost")
                        .classAttribute("port", 80)
                        .classAttribute("port", 8080))
            .build();
    ClassDefinition definition = source.getMember("TestFoo").getClassDefinition();
    assertThat(definition.getClassAttributes().keySet(), contains("host", "port"));
    assertThat(definition.getClassAttributes().get("port"), equalTo((Object) 8080));
  }

  @Test
  public void includedMembersKeepTheirOrigin() {
    LoadedSource numbers = LoadedSource.load(new NumbersSource());
    LoadedSource source =
        new SourceBuilder("mine")
            .include(numbers, "test_add")
            .function("test_own", t -> {})
            .build();
    assertThat(source.getMember("test_add").getOrigin(), equalTo(numbers.getName()));
    assertThat(source.getMember("test_own").getOrigin(), equalTo("mine"));
  }

  @Test
  public void membersRegisteredWithParameterTypesKeepThem() {
    LoadedSource source =
        new SourceBuilder("mine").member("helper", ImmutableList.of(int.class), args -> {}).build();
    assertThat(source.getMember("helper").getParameterTypes(), contains(int.class));
  }

  @Test(expected = NoSuchElementException.class)
  public void unknownMemberThrows() {
    new SourceBuilder("mine").build().getMember("missing");
  }

  @Test(expected = IllegalStateException.class)
  public void functionHasNoClassDefinition() {
    new SourceBuilder("mine")
        .function("test_one", t -> {})
        .build()
        .getMember("test_one")
        .getClassDefinition();
  }
}
