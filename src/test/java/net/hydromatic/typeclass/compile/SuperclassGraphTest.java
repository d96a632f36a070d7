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
import static net.hydromatic.typeclass.Matchers.throwsA;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.typeclass.Fixture;
import net.hydromatic.typeclass.decl.ClassDecl;
import net.hydromatic.typeclass.decl.Superclass;
import net.hydromatic.typeclass.type.Skolem;
import org.junit.jupiter.api.Test;

/** Tests for {@link SuperclassGraph}. */
public class SuperclassGraphTest {
  private static Map<String, ClassDecl> classes(ClassDecl.Builder... builders) {
    final Map<String, ClassDecl> map = new LinkedHashMap<>();
    for (ClassDecl.Builder builder : builders) {
      final ClassDecl classDecl = builder.build("M");
      map.put(classDecl.name, classDecl);
    }
    return map;
  }

  @Test
  void testClosure() {
    final Fixture f = Fixture.prelude();
    final SuperclassGraph graph = f.load().superclassGraph;
    assertThat(graph.superclasses("MonadFail").asList(),
        is(ImmutableList.of("Monad", "Applicative", "Bind", "Apply",
            "Functor")));
    assertThat(graph.superclasses("Functor").isEmpty(), is(true));
    assertThat(graph.subclasses("Apply").asList(),
        is(ImmutableList.of("Applicative", "Bind", "Monad", "MonadFail")));
    assertThat(graph.isSuperclass("Applicative", "MonadFail"), is(true));
    assertThat(graph.isSuperclass("MonadFail", "Applicative"), is(false));
    assertThat(graph.isSuperclass("Show", "Monad"), is(false));
    assertThat(graph.isSuperclass("Monad", "Monad"), is(false));

    // The closure is computed when the graph is created.
    assertThat(graph.superclasses("MonadFail"),
        sameInstance(graph.superclasses("MonadFail")));
    assertThat(graph.subclasses("Nope").isEmpty(), is(true));
    assertThrows(IllegalArgumentException.class,
        () -> graph.superclasses("Nope"));
  }

  /** Each implied constraint carries the path by which it was reached;
   * {@code Apply m} is reachable twice, but appears once. */
  @Test
  void testImplied() {
    final Fixture f = Fixture.prelude();
    final SuperclassGraph graph = f.load().superclassGraph;
    final Skolem m = f.rigid("m");
    final List<SuperclassGraph.Implied> implied =
        graph.implied(constraint("MonadFail", m));
    assertThat(implied.toString(),
        is("[Monad m via MonadFail => Monad, "
            + "Applicative m via MonadFail => Monad => Applicative, "
            + "Apply m via MonadFail => Monad => Applicative => Apply, "
            + "Functor m via MonadFail => Monad => Applicative => Apply "
            + "=> Functor, "
            + "Bind m via MonadFail => Monad => Bind]"));
    assertThat(graph.implied(constraint("Functor", m)).isEmpty(), is(true));
  }

  /** Superclass arguments may be a permutation of the subclass's
   * parameters. */
  @Test
  void testPermutation() {
    final Fixture f = Fixture.prelude();
    final SuperclassGraph graph =
        SuperclassGraph.create(
            classes(ClassDecl.builder("Swap", "a", "b"),
                ClassDecl.builder("Pair", "a", "b")
                    .superclass("Swap", "b", "a")));
    assertThat(
        graph.implied(constraint("Pair", f.type("Int"), f.type("String")))
            .get(0).constraint.toString(),
        is("Swap String Int"));
  }

  @Test
  void testCycle() {
    final LoadException.SuperclassCycle e =
        assertThrows(LoadException.SuperclassCycle.class,
            () -> SuperclassGraph.create(
                classes(
                    ClassDecl.builder("Z", "x"),
                    ClassDecl.builder("A", "x").superclass("B", "x"),
                    ClassDecl.builder("B", "x").superclass("C", "x"),
                    ClassDecl.builder("C", "x")
                        .superclass("Z", "x")
                        .superclass("A", "x"))));
    assertThat(e.cycle(), is(ImmutableList.of("A", "B", "C", "A")));
    assertThat(e,
        throwsA("Cycle in superclasses of class A: A => B => C => A"));

    final LoadException.SuperclassCycle e2 =
        assertThrows(LoadException.SuperclassCycle.class,
            () -> SuperclassGraph.create(
                classes(ClassDecl.builder("S", "x").superclass("S", "x"))));
    assertThat(e2.cycle(), is(ImmutableList.of("S", "S")));
  }

  /** A diamond is not a cycle. */
  @Test
  void testDiamond() {
    final SuperclassGraph graph =
        SuperclassGraph.create(
            classes(ClassDecl.builder("Top", "x"),
                ClassDecl.builder("Left", "x").superclass("Top", "x"),
                ClassDecl.builder("Right", "x").superclass("Top", "x"),
                ClassDecl.builder("Bottom", "x")
                    .superclass("Left", "x")
                    .superclass("Right", "x")));
    assertThat(graph.superclasses("Bottom").asList(),
        is(ImmutableList.of("Left", "Right", "Top")));
  }

  @Test
  void testInvalid() {
    assertThat(
        assertThrows(LoadException.InvalidDeclaration.class,
            () -> SuperclassGraph.create(
                classes(ClassDecl.builder("A", "x").superclass("B", "x")))),
        throwsA("Class A has unknown superclass B"));
    assertThat(
        assertThrows(LoadException.InvalidDeclaration.class,
            () -> SuperclassGraph.create(
                classes(ClassDecl.builder("F", "f"),
                    ClassDecl.builder("A", "x")
                        .superclass(
                            Superclass.of("F", ImmutableList.of(0, 0)))))),
        throwsA("Superclass F of class A expects 1 arguments, got 2"));
    assertThat(
        assertThrows(LoadException.InvalidDeclaration.class,
            () -> SuperclassGraph.create(
                classes(ClassDecl.builder("F", "f"),
                    ClassDecl.builder("A", "x")
                        .superclass(Superclass.of("F", ImmutableList.of(3)))))),
        throwsA("Superclass F of class A refers to parameter #3"));
  }
}

// End SuperclassGraphTest.java
