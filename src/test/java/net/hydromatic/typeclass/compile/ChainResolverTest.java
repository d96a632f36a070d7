/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.typeclass.compile;

import static net.hydromatic.typeclass.Fixture.constraint;
import static net.hydromatic.typeclass.Matchers.resolvedTo;
import static net.hydromatic.typeclass.Matchers.stoppedAt;
import static net.hydromatic.typeclass.Matchers.throwsA;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.typeclass.Fixture;
import net.hydromatic.typeclass.decl.ClassDecl;
import net.hydromatic.typeclass.decl.Constraint;
import net.hydromatic.typeclass.decl.InstanceChain;
import net.hydromatic.typeclass.type.ExistentialVar;
import net.hydromatic.typeclass.type.Type;
import net.hydromatic.typeclass.type.TypeVar;
import org.junit.jupiter.api.Test;

/** Tests for {@link ChainResolver}. */
public class ChainResolverTest {
  /** Returns a tracer that records the name of each candidate instance. */
  private static Tracer recording(List<String> names) {
    return Tracers.withOnCandidate(Tracers.empty(),
        (instance, result) -> names.add(instance.name + ":" + result.kind));
  }

  /** Adds a module with class {@code TupleShow a} and the chain
   * [{@code TupleShow (Tuple String 'a)}, else {@code TupleShow 'a}]. */
  private static Fixture tupleShow() {
    final Fixture f = Fixture.prelude();
    final TypeVar a = f.var(0);
    f.module("Data.TupleShow")
        .addClass(ClassDecl.builder("TupleShow", "a"))
        .addChain(
            InstanceChain.builder("TupleShow")
                .instance("tupleShowString",
                    ImmutableList.of(f.type("Tuple", f.type("String"), a)))
                .elseInstance("tupleShowOther", ImmutableList.of(a)));
    return f;
  }

  /** Once an instance matches, later instances in the chain are not
   * consulted. */
  @Test
  void testFirstMatchWins() {
    final Fixture f = Fixture.prelude();
    final InstanceStore store = f.load();
    final List<String> names = new ArrayList<>();
    final ChainResolver resolver = new ChainResolver(store, recording(names));

    assertThat(resolver.resolve(constraint("MyShow", f.type("String"))),
        resolvedTo("myShowString"));
    assertThat(names, is(ImmutableList.of("myShowString:MATCHED")));

    names.clear();
    assertThat(resolver.resolve(constraint("MyShow", f.type("Boolean"))),
        resolvedTo("myShowBoolean"));
    assertThat(names,
        is(ImmutableList.of("myShowString:NO_MATCH",
            "myShowBoolean:MATCHED")));

    names.clear();
    assertThat(resolver.resolve(constraint("MyShow", f.type("CustomType"))),
        resolvedTo("myShowOther"));
    assertThat(names,
        is(ImmutableList.of("myShowString:NO_MATCH", "myShowBoolean:NO_MATCH",
            "myShowOther:MATCHED")));
  }

  /** Once an instance matches ambiguously, later instances in the chain are
   * not consulted, even one that would match. */
  @Test
  void testAmbiguityStopsChain() {
    final Fixture f = tupleShow();
    final InstanceStore store = f.load();
    final List<String> names = new ArrayList<>();
    final List<String> stops = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnChainStop(recording(names), i -> stops.add(i.name));
    final ChainResolver resolver = new ChainResolver(store, tracer);

    final ExistentialVar l = f.unknown();
    final ExistentialVar r = f.unknown();
    final Constraint c = constraint("TupleShow", f.type("Tuple", l, r));
    final ChainResult result = resolver.resolve(c);
    assertThat(result, stoppedAt("tupleShowString"));
    assertThat(names, is(ImmutableList.of("tupleShowString:AMBIGUOUS")));
    assertThat(stops, is(ImmutableList.of("tupleShowString")));

    // The solver reports the ambiguity as a missing instance.
    final ResolveException.NoInstanceFound e =
        assertThrows(ResolveException.NoInstanceFound.class,
            () -> ConstraintSolver.create(store).solve(c));
    assertThat(e,
        throwsA(ResolveException.AmbiguousInstance.class,
            is("No type class instance was found for "
                + "TupleShow (Tuple ?t0 ?t1)")));
    assertThat(
        ((ResolveException.AmbiguousInstance) e).blockingInstance().name,
        is("tupleShowString"));
  }

  @Test
  void testNoMatchBeforeAmbiguity() {
    final Fixture f = tupleShow();
    final InstanceStore store = f.load();
    final ChainResolver resolver = new ChainResolver(store, Tracers.empty());
    final Type intT = f.type("Int");
    final Type stringT = f.type("String");

    // First component is Int, so the first instance cannot match, however
    // the second component turns out.
    assertThat(
        resolver.resolve(
            constraint("TupleShow", f.type("Tuple", intT, f.unknown()))),
        resolvedTo("tupleShowOther"));
    assertThat(
        resolver.resolve(
            constraint("TupleShow", f.type("Tuple", stringT, f.unknown()))),
        resolvedTo("tupleShowString"));
    assertThat(
        resolver.resolve(constraint("TupleShow", f.type("Tuple", stringT,
            intT))),
        resolvedTo("tupleShowString"));
    final ChainResult result =
        resolver.resolve(constraint("TupleShow", f.type("Tuple", stringT,
            intT)));
    assertThat(result.substitution.toString(), is("{'a=Int}"));
  }

  /** Each chain is consulted; the first resolution wins. */
  @Test
  void testChains() {
    final Fixture f = Fixture.prelude();
    final InstanceStore store = f.load();
    final List<String> names = new ArrayList<>();
    final Constraint c = constraint("Show", f.type("String"));

    final ChainResult result =
        new ChainResolver(store, recording(names))
            .resolve(store.classDecl("Show"), c, true);
    assertThat(result, resolvedTo("showString"));
    assertThat(names,
        is(
            ImmutableList.of("showInt:NO_MATCH", "showString:MATCHED",
                "showBoolean:NO_MATCH", "showArray:NO_MATCH",
                "showTuple:NO_MATCH")));

    // Without overlap checking, chains after the first resolution are not
    // consulted.
    names.clear();
    assertThat(
        new ChainResolver(store, recording(names))
            .resolve(store.classDecl("Show"), c, false),
        resolvedTo("showString"));
    assertThat(names,
        is(ImmutableList.of("showInt:NO_MATCH", "showString:MATCHED")));
  }

  @Test
  void testAmbiguousAcrossChains() {
    final Fixture f = Fixture.prelude();
    final InstanceStore store = f.load();
    final ChainResolver resolver = new ChainResolver(store, Tracers.empty());
    assertThat(resolver.resolve(constraint("Show", f.unknown())),
        stoppedAt("showInt"));
    assertThat(
        resolver.resolve(constraint("Show", f.type("Array", f.unknown()))),
        resolvedTo("showArray"));
  }

  @Test
  void testNotFound() {
    final Fixture f = Fixture.prelude();
    final InstanceStore store = f.load();
    final ChainResolver resolver = new ChainResolver(store, Tracers.empty());
    final ChainResult result =
        resolver.resolve(constraint("Show", f.type("CustomType")));
    assertThat(result.kind, is(ChainResult.Kind.NOT_FOUND));
    assertThat(result.toString(), is("not found"));
    assertThrows(ResolveException.UnknownClass.class,
        () -> resolver.resolve(constraint("Eq", f.type("Int"))));
  }

  @Test
  void testOverlapping() {
    final Fixture f = Fixture.prelude();
    final TypeVar a = f.var(0);
    f.module("Data.Pretty")
        .addClass(ClassDecl.builder("Pretty", "a"))
        .addChain(f.instance("Pretty", "prettyInt", f.type("Int")))
        .addChain(f.instance("Pretty", "prettyAny", a));
    final InstanceStore store = f.load();
    final ChainResolver resolver = new ChainResolver(store, Tracers.empty());
    final Constraint c = constraint("Pretty", f.type("Int"));
    final ResolveException.OverlappingInstances e =
        assertThrows(ResolveException.OverlappingInstances.class,
            () -> resolver.resolve(c));
    assertThat(e.getMessage(),
        is("Overlapping type class instances found for Pretty Int: "
            + "prettyInt, prettyAny"));
    assertThat(resolver.resolve(store.classDecl("Pretty"), c, false),
        resolvedTo("prettyInt"));

    // With the "overlapCheck" property off, the first chain wins.
    final Map<Prop, Object> props = new HashMap<>();
    Prop.OVERLAP_CHECK.set(props, false);
    final ChainResolver lenient =
        new ChainResolver(store, props, Tracers.empty());
    assertThat(lenient.resolve(c), resolvedTo("prettyInt"));
    assertThat(resolver.resolve(constraint("Pretty", f.type("String"))),
        resolvedTo("prettyAny"));
  }

  /** A position determined by a functional dependency is an output, and
   * the resolved instance improves it. */
  @Test
  void testFunctionalDependency() {
    final Fixture f = Fixture.prelude();
    final InstanceStore store = f.load();
    final ChainResolver resolver = new ChainResolver(store, Tracers.empty());
    final ExistentialVar t0 = f.unknown();
    final ChainResult result =
        resolver.resolve(constraint("TypeEquals", f.type("String"), t0));
    assertThat(result, resolvedTo("refl"));
    assertThat(result.improvements.toString(), is("{?t0=String}"));

    final ChainResult result2 =
        resolver.resolve(constraint("TypeEquals", f.unknown(), f.unknown()));
    assertThat(result2, stoppedAt("refl"));
  }
}

// End ChainResolverTest.java
