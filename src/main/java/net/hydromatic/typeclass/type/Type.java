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
package net.hydromatic.typeclass.type;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Type.
 *
 * <p>A type is a tree. Leaves are variables ({@link TypeVar}, {@link
 * ExistentialVar}, {@link Skolem}); interior nodes are {@link NamedType}s.
 * Types are immutable and compared structurally.
 */
public interface Type {
  /** Type operator. */
  Op op();

  <R> R accept(TypeVisitor<R> typeVisitor);

  /**
   * Copies this type, applying a given transform to component types, and
   * returning the original type if the component types are unchanged.
   */
  Type copy(UnaryOperator<Type> transform);

  /**
   * Writes a description of this type to a string builder.
   *
   * @param buf Builder
   * @param nested Whether this type is the argument of a type application,
   *     and must therefore be parenthesized if it is itself an application
   */
  StringBuilder describe(StringBuilder buf, boolean nested);

  /**
   * Returns the name of the outermost type constructor, or null if this type
   * is a variable.
   */
  default @Nullable String constructorName() {
    return null;
  }

  /**
   * Returns a copy of this type, replacing variables that are keys of the map
   * ({@link TypeVar}s or {@link ExistentialVar}s) with their values.
   */
  default Type substitute(Map<? extends Type, ? extends Type> map) {
    if (map.isEmpty()) {
      return this;
    }
    return accept(
        new TypeShuttle() {
          @Override
          public Type visit(TypeVar typeVar) {
            final Type type = map.get(typeVar);
            return type != null ? type : typeVar;
          }

          @Override
          public Type visit(ExistentialVar existentialVar) {
            final Type type = map.get(existentialVar);
            return type != null ? type : existentialVar;
          }
        });
  }

  /** Returns whether this type contains a variable of a given kind. */
  default boolean contains(Op op) {
    final AtomicInteger c = new AtomicInteger();
    accept(
        new TypeVisitor<Void>() {
          @Override
          public Void visit(TypeVar typeVar) {
            if (op == Op.TY_VAR) {
              c.incrementAndGet();
            }
            return null;
          }

          @Override
          public Void visit(ExistentialVar existentialVar) {
            if (op == Op.EXISTENTIAL) {
              c.incrementAndGet();
            }
            return null;
          }

          @Override
          public Void visit(Skolem skolem) {
            if (op == Op.SKOLEM) {
              c.incrementAndGet();
            }
            return null;
          }
        });
    return c.get() > 0;
  }

  /** Returns whether this type contains a given variable. */
  default boolean references(Type variable) {
    final AtomicInteger c = new AtomicInteger();
    accept(
        new TypeVisitor<Void>() {
          @Override
          public Void visit(TypeVar typeVar) {
            if (typeVar.equals(variable)) {
              c.incrementAndGet();
            }
            return null;
          }

          @Override
          public Void visit(ExistentialVar existentialVar) {
            if (existentialVar.equals(variable)) {
              c.incrementAndGet();
            }
            return null;
          }
        });
    return c.get() > 0;
  }

  /**
   * Returns whether this type is concrete enough to select an instance: it
   * contains no existential variables. (Skolems are concrete; they stand for
   * a fixed, if unknown, type.)
   */
  default boolean isConcrete() {
    return !contains(Op.EXISTENTIAL);
  }
}

// End Type.java
