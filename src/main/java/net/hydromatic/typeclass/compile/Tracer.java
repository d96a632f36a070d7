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

import java.util.List;
import net.hydromatic.typeclass.decl.Constraint;
import net.hydromatic.typeclass.decl.InstanceDecl;

/**
 * Called on various events during loading and resolution.
 *
 * @see Tracers
 */
public interface Tracer {
  /** Called after an instance has been matched against a constraint. */
  void onCandidate(
      Constraint constraint, InstanceDecl instance, MatchResult result);

  /** Called when a chain stops because an instance matched ambiguously. */
  void onChainStop(Constraint constraint, InstanceDecl instance);

  /** Called when a constraint is resolved to an instance. */
  void onResolved(Constraint constraint, InstanceDecl instance);

  /**
   * Called when a constraint is discharged by given evidence.
   *
   * @param constraint Constraint being resolved
   * @param given Given evidence
   * @param path Classes from the given's class to the constraint's class
   */
  void onDischarge(Constraint constraint, Constraint given, List<String> path);

  /** Called when a declaration is rejected at load time. */
  void onReject(LoadException e);
}

// End Tracer.java
