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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.function.UnaryOperator;

/**
 * Existential variable (e.g. {@code ?t3}) in a constraint.
 *
 * <p>Stands for a type that the elaborator has not inferred yet. An instance
 * that would apply only if the variable were later instantiated to a
 * particular type matches ambiguously.
 *
 * <p>Create via {@link TypeSystem#existential()}, which allocates unique ids.
 */
public class ExistentialVar implements Type {
  public final int id;

  ExistentialVar(int id) {
    checkArgument(id >= 0);
    this.id = id;
  }

  @Override
  public int hashCode() {
    return id * 37 + 11;
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof ExistentialVar && id == ((ExistentialVar) obj).id;
  }

  @Override
  public String toString() {
    return "?t" + id;
  }

  @Override
  public Op op() {
    return Op.EXISTENTIAL;
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
    return buf.append("?t").append(id);
  }
}

// End ExistentialVar.java
