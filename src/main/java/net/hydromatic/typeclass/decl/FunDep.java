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
package net.hydromatic.typeclass.decl;

import com.google.common.collect.ImmutableSortedSet;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;

/**
 * Functional dependency between the parameters of a multi-parameter class.
 *
 * <p>In {@code class TypeEquals a b | a -> b, b -> a} there are two
 * dependencies; the first has determiners {0} and determined {1}.
 * Parameters are identified by their index.
 */
public class FunDep {
  public final SortedSet<Integer> determiners;
  public final SortedSet<Integer> determined;

  private FunDep(Iterable<Integer> determiners, Iterable<Integer> determined) {
    this.determiners = ImmutableSortedSet.copyOf(determiners);
    this.determined = ImmutableSortedSet.copyOf(determined);
  }

  /** Creates a functional dependency. */
  public static FunDep of(
      Iterable<Integer> determiners, Iterable<Integer> determined) {
    return new FunDep(determiners, determined);
  }

  @Override
  public int hashCode() {
    return Objects.hash(determiners, determined);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof FunDep
            && determiners.equals(((FunDep) obj).determiners)
            && determined.equals(((FunDep) obj).determined);
  }

  @Override
  public String toString() {
    return determiners + " -> " + determined;
  }

  /** Describes this dependency using parameter names, e.g. "a -> b". */
  public StringBuilder describe(StringBuilder buf, List<String> parameters) {
    determiners.forEach(i -> buf.append(name(parameters, i)).append(' '));
    buf.append("->");
    determined.forEach(i -> buf.append(' ').append(name(parameters, i)));
    return buf;
  }

  private static String name(List<String> parameters, int i) {
    return i >= 0 && i < parameters.size() ? parameters.get(i) : "#" + i;
  }
}

// End FunDep.java
