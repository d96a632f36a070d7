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
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.typeclass.type.Type;

/**
 * Ordered sequence of instances of the same class.
 *
 * <p>Declared as an {@code instance} followed by zero or more {@code else
 * instance}s. Resolution tries the instances in order and never reorders
 * them. A bare {@code instance} is a chain of length 1.
 */
public class InstanceChain {
  public final String moduleName;
  public final String className;
  public final List<InstanceDecl> instances;

  private InstanceChain(
      String moduleName, String className, List<InstanceDecl> instances) {
    this.moduleName = requireNonNull(moduleName);
    this.className = requireNonNull(className);
    this.instances = ImmutableList.copyOf(instances);
    checkArgument(!instances.isEmpty(), "empty chain");
  }

  /** Creates a builder for a chain of instances of a given class. */
  public static Builder builder(String className) {
    return new Builder(className);
  }

  /** Returns the name of the chain, which is the name of its first instance. */
  public String name() {
    return instances.get(0).name;
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder();
    for (InstanceDecl instance : instances) {
      instance.describe(buf.append(buf.length() > 0 ? "\n" : ""));
    }
    return buf.toString();
  }

  /** Builder for {@link InstanceChain}. */
  public static class Builder {
    private final String className;
    private final List<Entry> entries = new ArrayList<>();
    private InstanceDecl.Origin origin = InstanceDecl.Origin.DECLARED;

    private Builder(String className) {
      this.className = requireNonNull(className);
    }

    private Builder add(
        String name, List<? extends Type> head, Constraint... constraints) {
      entries.add(
          new Entry(name, ImmutableList.copyOf(head),
              ImmutableList.copyOf(constraints)));
      return this;
    }

    /** Adds the first instance of the chain. */
    public Builder instance(
        String name, List<? extends Type> head, Constraint... constraints) {
      checkState(entries.isEmpty(), "chain already has a first instance");
      return add(name, head, constraints);
    }

    /** Adds an {@code else instance} to the chain. */
    public Builder elseInstance(
        String name, List<? extends Type> head, Constraint... constraints) {
      checkState(!entries.isEmpty(), "else instance must follow an instance");
      checkState(
          origin == InstanceDecl.Origin.DECLARED,
          "derived instance cannot have an else instance");
      return add(name, head, constraints);
    }

    /** Adds a {@code derive instance}, which is a chain on its own. */
    public Builder derive(
        String name, List<? extends Type> head, Constraint... constraints) {
      checkState(entries.isEmpty(), "derived instance must be alone");
      origin = InstanceDecl.Origin.DERIVED;
      return add(name, head, constraints);
    }

    /** Adds a {@code derive newtype instance}, which is a chain on its own. */
    public Builder deriveNewtype(
        String name, List<? extends Type> head, Constraint... constraints) {
      checkState(entries.isEmpty(), "derived instance must be alone");
      origin = InstanceDecl.Origin.DERIVED_NEWTYPE;
      return add(name, head, constraints);
    }

    /** Creates the chain, as declared in a given module. */
    public InstanceChain build(String moduleName) {
      checkState(!entries.isEmpty(), "chain has no instances");
      final String chainName = entries.get(0).name;
      final ImmutableList.Builder<InstanceDecl> instances =
          ImmutableList.builder();
      for (int i = 0; i < entries.size(); i++) {
        final Entry e = entries.get(i);
        instances.add(
            new InstanceDecl(moduleName, e.name, className, e.head,
                e.constraints, origin, chainName, i));
      }
      return new InstanceChain(moduleName, className, instances.build());
    }
  }

  /** Instance that has been added to a builder but not yet built. */
  private static class Entry {
    final String name;
    final List<Type> head;
    final List<Constraint> constraints;

    Entry(String name, List<Type> head, List<Constraint> constraints) {
      this.name = requireNonNull(name);
      this.head = head;
      this.constraints = constraints;
    }
  }
}

// End InstanceChain.java
