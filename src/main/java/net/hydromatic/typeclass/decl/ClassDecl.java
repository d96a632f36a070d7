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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * Declaration of a type class.
 *
 * <p>A class has a name that is unique across the program, one or more
 * parameters, zero or more superclasses and zero or more functional
 * dependencies. For example,
 *
 * <pre>{@code
 * class (Applicative m, Bind m) <= Monad m
 * class TypeEquals a b | a -> b, b -> a
 * }</pre>
 */
public class ClassDecl {
  public final String moduleName;
  public final String name;
  public final List<String> parameters;
  public final List<Superclass> superclasses;
  public final List<FunDep> funDeps;

  private ClassDecl(
      String moduleName,
      String name,
      List<String> parameters,
      List<Superclass> superclasses,
      List<FunDep> funDeps) {
    this.moduleName = requireNonNull(moduleName);
    this.name = requireNonNull(name);
    this.parameters = ImmutableList.copyOf(parameters);
    this.superclasses = ImmutableList.copyOf(superclasses);
    this.funDeps = ImmutableList.copyOf(funDeps);
    checkArgument(!parameters.isEmpty(), "class %s has no parameters", name);
  }

  /** Creates a builder for a class with given parameter names. */
  public static Builder builder(String name, String... parameters) {
    return new Builder(name, ImmutableList.copyOf(parameters));
  }

  /** Returns the number of parameters. */
  public int arity() {
    return parameters.size();
  }

  @Override
  public String toString() {
    return describe(new StringBuilder()).toString();
  }

  /** Writes the declaration, e.g. "class (Functor f) <= Apply f". */
  public StringBuilder describe(StringBuilder buf) {
    buf.append("class ");
    if (!superclasses.isEmpty()) {
      buf.append('(');
      for (int i = 0; i < superclasses.size(); i++) {
        final Superclass superclass = superclasses.get(i);
        buf.append(i > 0 ? ", " : "").append(superclass.className);
        superclass.paramIndexes.forEach(
            p -> buf.append(' ').append(parameters.get(p)));
      }
      buf.append(") <= ");
    }
    buf.append(name);
    parameters.forEach(p -> buf.append(' ').append(p));
    for (int i = 0; i < funDeps.size(); i++) {
      buf.append(i == 0 ? " | " : ", ");
      funDeps.get(i).describe(buf, parameters);
    }
    return buf;
  }

  /** Builder for {@link ClassDecl}. */
  public static class Builder {
    private final String name;
    private final List<String> parameters;
    private final List<Superclass> superclasses = new ArrayList<>();
    private final List<FunDep> funDeps = new ArrayList<>();

    private Builder(String name, List<String> parameters) {
      this.name = requireNonNull(name);
      this.parameters = parameters;
    }

    private int index(String parameter) {
      final int i = parameters.indexOf(parameter);
      checkArgument(
          i >= 0, "unknown parameter %s of class %s", parameter, name);
      return i;
    }

    private List<Integer> indexes(List<String> parameters) {
      final ImmutableList.Builder<Integer> b = ImmutableList.builder();
      parameters.forEach(p -> b.add(index(p)));
      return b.build();
    }

    /**
     * Adds a superclass applied to some of this class's parameters. For
     * example, {@code superclass("Functor", "f")}.
     */
    public Builder superclass(String className, String... parameters) {
      superclasses.add(
          Superclass.of(className, indexes(ImmutableList.copyOf(parameters))));
      return this;
    }

    /** Adds a superclass whose arguments are given by parameter index. */
    public Builder superclass(Superclass superclass) {
      superclasses.add(requireNonNull(superclass));
      return this;
    }

    /**
     * Adds a functional dependency. For example, {@code
     * funDep(ImmutableList.of("a"), ImmutableList.of("b"))} is "a -> b".
     */
    public Builder funDep(List<String> determiners, List<String> determined) {
      funDeps.add(FunDep.of(indexes(determiners), indexes(determined)));
      return this;
    }

    /** Adds a functional dependency whose parameters are given by index. */
    public Builder funDep(FunDep funDep) {
      funDeps.add(requireNonNull(funDep));
      return this;
    }

    /** Creates the class, as defined in a given module. */
    public ClassDecl build(String moduleName) {
      return new ClassDecl(moduleName, name, parameters, superclasses, funDeps);
    }
  }
}

// End ClassDecl.java
