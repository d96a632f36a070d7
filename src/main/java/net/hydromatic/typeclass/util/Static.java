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
package net.hydromatic.typeclass.util;

import com.google.common.collect.ImmutableList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.function.BiPredicate;
import java.util.function.Function;

/** Utilities. */
public class Static {
  private Static() {}

  /**
   * Eagerly converts an iterable to an immutable list, applying a mapping
   * function to each element.
   *
   * @param elements Elements
   * @param mapper Mapping function
   * @param <E> Element type
   * @param <T> Result element type
   */
  public static <E, T> ImmutableList<T> transformEager(
      Iterable<? extends E> elements, Function<E, T> mapper) {
    if (elements instanceof Collection
        && ((Collection<? extends E>) elements).isEmpty()) {
      // Save ourselves the effort of creating a builder.
      return ImmutableList.of();
    }
    final ImmutableList.Builder<T> b = ImmutableList.builder();
    elements.forEach(e -> b.add(mapper.apply(e)));
    return b.build();
  }

  /**
   * Returns whether two lists have the same length and a predicate is true
   * for each pair of corresponding elements.
   */
  public static <E, F> boolean allMatch(
      List<? extends E> list0,
      List<? extends F> list1,
      BiPredicate<? super E, ? super F> predicate) {
    if (list0.size() != list1.size()) {
      return false;
    }
    final Iterator<? extends F> iterator1 = list1.iterator();
    for (E e : list0) {
      if (!predicate.test(e, iterator1.next())) {
        return false;
      }
    }
    return true;
  }
}

// End Static.java
