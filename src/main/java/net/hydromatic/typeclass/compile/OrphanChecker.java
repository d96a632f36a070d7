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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.typeclass.decl.ClassDecl;
import net.hydromatic.typeclass.decl.InstanceDecl;
import net.hydromatic.typeclass.decl.ModuleDecl;
import net.hydromatic.typeclass.decl.Program;
import net.hydromatic.typeclass.type.Type;
import net.hydromatic.typeclass.type.TypeDef;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Rejects orphan instances.
 *
 * <p>An instance is an orphan unless it is declared in the module that
 * declares its class, or in a module that defines the outermost type
 * constructor of its head. For a class with one parameter, that is the
 * first (only) head type; for a class with several parameters, any head
 * type will do. Without this rule two modules could each declare an
 * instance for the same class and type, and which one a program sees
 * would depend on which modules it imports.
 */
public class OrphanChecker {
  private final ImmutableMap<String, TypeDef> typeDefs;
  private final ImmutableMap<String, ClassDecl> classes;

  private OrphanChecker(
      Map<String, TypeDef> typeDefs, Map<String, ClassDecl> classes) {
    this.typeDefs = ImmutableMap.copyOf(typeDefs);
    this.classes = ImmutableMap.copyOf(classes);
  }

  /** Creates a checker for the types and classes of a program. */
  public static OrphanChecker create(Program program) {
    return create(program, program.typeSystem.snapshot());
  }

  /**
   * Creates a checker for the classes of a program and a given snapshot of
   * its types.
   */
  static OrphanChecker create(Program program,
      Map<String, TypeDef> typeDefs) {
    final Map<String, ClassDecl> classes = new LinkedHashMap<>();
    for (ModuleDecl module : program.modules) {
      module.classes.forEach(c -> classes.putIfAbsent(c.name, c));
    }
    return new OrphanChecker(typeDefs, classes);
  }

  /** Checks every instance in a program; returns those that are orphans. */
  public List<LoadException.OrphanInstance> check(Program program) {
    final ImmutableList.Builder<LoadException.OrphanInstance> b =
        ImmutableList.builder();
    for (ModuleDecl module : program.modules) {
      for (InstanceDecl instance : module.instances()) {
        final ClassDecl classDecl = classes.get(instance.className);
        if (classDecl == null) {
          throw new LoadException.InvalidDeclaration("Instance "
              + instance.name + " is for unknown class " + instance.className);
        }
        final Verdict verdict = checkInstance(instance, classDecl, module);
        if (!verdict.ok) {
          b.add(
              new LoadException.OrphanInstance(instance,
                  requireNonNull(verdict.reason)));
        }
      }
    }
    return b.build();
  }

  /** Checks one instance. */
  public Verdict checkInstance(
      InstanceDecl instance, ClassDecl classDecl, ModuleDecl module) {
    if (module.name.equals(classDecl.moduleName)) {
      return Verdict.OK;
    }
    final List<Type> candidates =
        classDecl.arity() == 1
            ? instance.head.subList(0, 1)
            : instance.head;
    for (Type type : candidates) {
      if (module.name.equals(definingModule(type))) {
        return Verdict.OK;
      }
    }
    return Verdict.rejected("module " + module.name
        + " defines neither class " + classDecl.name + " nor "
        + (candidates.size() == 1
            ? "type " + describe(candidates.get(0))
            : "any of the types in the instance head"));
  }

  /**
   * Returns the module that defines the outermost constructor of a type,
   * or null if the type is a variable.
   */
  private @Nullable String definingModule(Type type) {
    final String name = type.constructorName();
    if (name == null) {
      return null;
    }
    final TypeDef typeDef = typeDefs.get(name);
    return typeDef == null ? null : typeDef.moduleName;
  }

  private static String describe(Type type) {
    final String name = type.constructorName();
    return name != null ? name : type.toString();
  }

  /** Outcome of checking an instance. */
  public static class Verdict {
    static final Verdict OK = new Verdict(true, null);

    public final boolean ok;
    public final @Nullable String reason;

    private Verdict(boolean ok, @Nullable String reason) {
      this.ok = ok;
      this.reason = reason;
    }

    static Verdict rejected(String reason) {
      return new Verdict(false, requireNonNull(reason));
    }

    @Override
    public String toString() {
      return ok ? "ok" : "rejected: " + reason;
    }
  }
}

// End OrphanChecker.java
