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
import static net.hydromatic.typeclass.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Nominal type constructor applied to arguments.
 *
 * <p>For example, {@code String} (no arguments), {@code Array Int}, and
 * {@code Tuple String 'a}.
 *
 * <p>Create via {@link TypeSystem#apply}, which checks that the constructor
 * exists and that the number of arguments matches its arity.
 */
public class NamedType implements Type {
  public final String name;
  public final List<Type> args;

  NamedType(String name, List<? extends Type> args) {
    this.name = requireNonNull(name);
    this.args = ImmutableList.copyOf(args);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, args);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof NamedType
            && name.equals(((NamedType) obj).name)
            && args.equals(((NamedType) obj).args);
  }

  @Override
  public String toString() {
    return describe(new StringBuilder(), false).toString();
  }

  @Override
  public Op op() {
    return Op.NAMED;
  }

  @Override
  public String constructorName() {
    return name;
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public NamedType copy(UnaryOperator<Type> transform) {
    final List<Type> args = transformEager(this.args, transform);
    if (args.equals(this.args)) {
      return this;
    }
    return new NamedType(name, args);
  }

  @Override
  public StringBuilder describe(StringBuilder buf, boolean nested) {
    if (args.isEmpty()) {
      return buf.append(name);
    }
    if (nested) {
      buf.append('(');
    }
    buf.append(name);
    for (Type arg : args) {
      arg.describe(buf.append(' '), true);
    }
    if (nested) {
      buf.append(')');
    }
    return buf;
  }
}

// End NamedType.java
