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

import static java.util.Objects.requireNonNull;

import java.util.function.UnaryOperator;

/**
 * Rigid type variable.
 *
 * <p>A skolem is bound by the signature of the code being checked, for
 * example {@code m} in {@code f :: MonadFail m => m Int}. It is a fixed but
 * unknown type: it never matches a type constructor, and it only equals
 * itself.
 */
public class Skolem implements Type {
  public final String name;

  Skolem(String name) {
    this.name = requireNonNull(name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Skolem && name.equals(((Skolem) obj).name);
  }

  @Override
  public String toString() {
    return name;
  }

  @Override
  public Op op() {
    return Op.SKOLEM;
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public Type copy(UnaryOperator<Type> transform) {
    return transform.apply(this);
  }

  @Override
  public StringBuilder describe(StringBuilder buf, boolean nested) {
    return buf.append(name);
  }
}

// End Skolem.java
