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

import static net.hydromatic.typeclass.Matchers.isMatch;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import net.hydromatic.typeclass.compile.MatchResult.Kind;
import net.hydromatic.typeclass.type.ExistentialVar;
import net.hydromatic.typeclass.type.Skolem;
import net.hydromatic.typeclass.type.Type;
import net.hydromatic.typeclass.type.TypeSystem;
import net.hydromatic.typeclass.type.TypeVar;
import org.junit.jupiter.api.Test;

/** Tests for {@link TypeMatcher}. */
public class TypeMatcherTest {
  final TypeSystem ts = new TypeSystem();
  final Type intT;
  final Type stringT;
  final Type booleanT;
  final TypeVar a;
  final TypeVar b;

  public TypeMatcherTest() {
    ts.define("Prim", "Int", 0);
    ts.define("Prim", "String", 0);
    ts.define("Prim", "Boolean", 0);
    ts.define("Prim", "Array", 1);
    ts.define("Data.Tuple", "Tuple", 2);
    intT = ts.apply("Int");
    stringT = ts.apply("String");
    booleanT = ts.apply("Boolean");
    a = ts.typeVar(0);
    b = ts.typeVar(1);
  }

  private Type array(Type t) {
    return ts.apply("Array", t);
  }

  private Type tuple(Type t0, Type t1) {
    return ts.apply("Tuple", t0, t1);
  }

  private static MatchResult match(List<Type> head, List<Type> args) {
    return TypeMatcher.match(head, args);
  }

  private MatchResult improve(List<Type> head, List<Type> args,
      Integer... outputs) {
    return new TypeMatcher(ts::existential)
        .matchInstance(head, args, ImmutableSet.copyOf(outputs));
  }

  /** Matching a head with no variables against itself succeeds with an
   * empty substitution. */
  @Test
  void testReflexive() {
    final List<Type> head = ImmutableList.of(tuple(intT, array(stringT)));
    assertThat(match(head, head), isMatch("matched[]"));
    assertThat(match(head, head).substitution.isEmpty(), is(true));
    final List<Type> head2 = ImmutableList.of(intT, booleanT);
    assertThat(match(head2, head2), isMatch("matched[]"));
  }

  @Test
  void testBind() {
    assertThat(
        match(ImmutableList.of(array(a)), ImmutableList.of(array(stringT))),
        isMatch("matched['a := String]"));
    assertThat(
        match(ImmutableList.of(tuple(a, b)),
            ImmutableList.of(tuple(intT, array(booleanT)))),
        isMatch("matched['a := Int, 'b := Array Boolean]"));
    assertThat(
        match(ImmutableList.of(a), ImmutableList.of(array(intT))),
        isMatch("matched['a := Array Int]"));
  }

  @Test
  void testNoMatch() {
    assertThat(
        match(ImmutableList.of(array(a)), ImmutableList.of(intT)),
        sameInstance(MatchResult.NO_MATCH));
    assertThat(
        match(ImmutableList.of(stringT), ImmutableList.of(booleanT)),
        sameInstance(MatchResult.NO_MATCH));
  }

  /** A constructor in the head against an unknown type in the constraint is
   * ambiguous; a head variable against an unknown type binds to it. */
  @Test
  void testExistential() {
    final ExistentialVar t0 = ts.existential();
    assertThat(match(ImmutableList.of(stringT), ImmutableList.of(t0)),
        sameInstance(MatchResult.AMBIGUOUS));
    assertThat(match(ImmutableList.of(a), ImmutableList.of(t0)),
        isMatch("matched['a := ?t0]"));
    assertThat(
        match(ImmutableList.of(array(stringT)), ImmutableList.of(array(t0))),
        isMatch("ambiguous"));
  }

  /** If one position does not match, the instance does not match, even if
   * another position is ambiguous, and regardless of their order. */
  @Test
  void testNoMatchDominates() {
    final ExistentialVar t0 = ts.existential();
    assertThat(
        match(ImmutableList.of(tuple(stringT, intT)),
            ImmutableList.of(tuple(t0, booleanT))),
        isMatch("no_match"));
    assertThat(
        match(ImmutableList.of(tuple(intT, stringT)),
            ImmutableList.of(tuple(booleanT, t0))),
        isMatch("no_match"));
    assertThat(
        match(ImmutableList.of(stringT, intT),
            ImmutableList.of(t0, booleanT)),
        isMatch("no_match"));
  }

  /** A variable that occurs twice in the head must bind to equal types. */
  @Test
  void testRepeatedVariable() {
    final ExistentialVar t0 = ts.existential();
    final ExistentialVar t1 = ts.existential();
    final List<Type> head = ImmutableList.of(tuple(a, a));
    assertThat(match(head, ImmutableList.of(tuple(intT, intT))),
        isMatch("matched['a := Int]"));
    assertThat(match(head, ImmutableList.of(tuple(intT, stringT))),
        isMatch("no_match"));
    assertThat(match(head, ImmutableList.of(tuple(intT, t0))),
        isMatch("ambiguous"));
    assertThat(match(head, ImmutableList.of(tuple(t0, t0))),
        isMatch("matched['a := ?t0]"));
    assertThat(match(head, ImmutableList.of(tuple(t0, t1))),
        isMatch("ambiguous"));
    assertThat(
        match(head,
            ImmutableList.of(tuple(array(intT), array(stringT)))),
        isMatch("no_match"));
  }

  /** A rigid variable never matches a constructor. */
  @Test
  void testSkolem() {
    final Skolem m = ts.skolem("m");
    assertThat(match(ImmutableList.of(stringT), ImmutableList.of(m)),
        isMatch("no_match"));
    assertThat(
        match(ImmutableList.of(array(a)), ImmutableList.of(array(m))),
        isMatch("matched['a := m]"));
    assertThat(
        match(ImmutableList.of(tuple(a, a)), ImmutableList.of(tuple(m, m))),
        isMatch("matched['a := m]"));
    assertThat(
        match(ImmutableList.of(tuple(a, a)),
            ImmutableList.of(tuple(m, ts.skolem("n")))),
        isMatch("no_match"));
  }

  /** An output position takes no part in selection, but is then unified with
   * the head. */
  @Test
  void testImprove() {
    final ExistentialVar t0 = ts.existential();
    assertThat(improve(ImmutableList.of(a, a), ImmutableList.of(stringT, t0),
            1),
        isMatch("matched['a := String, ?t0 := String]"));
    assertThat(
        improve(ImmutableList.of(array(a), a),
            ImmutableList.of(array(intT), t0), 1),
        isMatch("matched['a := Int, ?t0 := Int]"));

    // Without the output, the same constraint is ambiguous
    // for a head with a constructor in that position.
    assertThat(
        match(ImmutableList.of(intT, stringT), ImmutableList.of(intT, t0)),
        isMatch("ambiguous"));
    assertThat(
        improve(ImmutableList.of(intT, stringT), ImmutableList.of(intT, t0),
            1),
        isMatch("matched[?t0 := String]"));
  }

  @Test
  void testImproveConflict() {
    final ExistentialVar t0 = ts.existential();
    assertThat(
        improve(ImmutableList.of(intT, stringT),
            ImmutableList.of(intT, array(t0)), 1),
        isMatch("no_match"));
    assertThat(
        improve(ImmutableList.of(a, a), ImmutableList.of(intT, array(t0)), 1),
        isMatch("no_match"));
  }

  /** A head variable that occurs only in an output position is
   * instantiated with a fresh unknown type. */
  @Test
  void testImproveFresh() {
    final ExistentialVar t0 = ts.existential();
    assertThat(
        improve(ImmutableList.of(intT, array(b)), ImmutableList.of(intT, t0),
            1),
        isMatch("matched['b := ?t1, ?t0 := Array ?t1]"));
  }

  @Test
  void testOccursCheck() {
    final ExistentialVar t0 = ts.existential();
    assertThat(
        improve(ImmutableList.of(a, array(a)), ImmutableList.of(t0, t0), 1),
        isMatch("no_match"));
  }

  @Test
  void testInvalid() {
    final ExistentialVar t0 = ts.existential();
    assertThrows(IllegalArgumentException.class,
        () -> match(ImmutableList.of(t0), ImmutableList.of(intT)));
    assertThrows(IllegalArgumentException.class,
        () -> match(ImmutableList.of(a, b), ImmutableList.of(intT)));
  }

  @Test
  void testCombine() {
    assertThat(Kind.MATCHED.combine(Kind.MATCHED), is(Kind.MATCHED));
    assertThat(Kind.MATCHED.combine(Kind.AMBIGUOUS), is(Kind.AMBIGUOUS));
    assertThat(Kind.AMBIGUOUS.combine(Kind.MATCHED), is(Kind.AMBIGUOUS));
    assertThat(Kind.AMBIGUOUS.combine(Kind.NO_MATCH), is(Kind.NO_MATCH));
    assertThat(Kind.NO_MATCH.combine(Kind.AMBIGUOUS), is(Kind.NO_MATCH));
    assertThat(Kind.NO_MATCH.combine(Kind.MATCHED), is(Kind.NO_MATCH));
  }
}

// End TypeMatcherTest.java
