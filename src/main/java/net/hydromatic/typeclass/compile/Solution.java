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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.typeclass.decl.Constraint;
import net.hydromatic.typeclass.decl.InstanceDecl;
import net.hydromatic.typeclass.type.ExistentialVar;
import net.hydromatic.typeclass.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Result of successfully solving a constraint. */
public class Solution {
  /** The constraint, with improvements applied. */
  public final Constraint constraint;
  public final Evidence evidence;
  /**
   * Types that resolution determined for the existential variables of the
   * wanted constraint, via functional dependencies.
   */
  public final ImmutableMap<ExistentialVar, Type> improvements;

  Solution(Constraint constraint, Evidence evidence,
      Map<ExistentialVar, Type> improvements) {
    this.constraint = requireNonNull(constraint);
    this.evidence = requireNonNull(evidence);
    this.improvements = ImmutableMap.copyOf(improvements);
  }

  /**
   * Returns the instance at the root of the evidence, or null if the
   * constraint was discharged by a given.
   */
  public @Nullable InstanceDecl instance() {
    return evidence instanceof Evidence.InstanceEvidence
        ? ((Evidence.InstanceEvidence) evidence).instance
        : null;
  }

  @Override
  public String toString() {
    return constraint + " by " + evidence;
  }
}

// End Solution.java
