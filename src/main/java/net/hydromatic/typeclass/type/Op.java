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

/** Kind of a {@link Type}. */
public enum Op {
  /** Variable in the head of an instance, e.g. {@code 'a}. */
  TY_VAR,

  /**
   * Existential (unknown) variable in a constraint, e.g. {@code ?t0}. Its
   * type has not been inferred yet.
   */
  EXISTENTIAL,

  /**
   * Rigid variable in a constraint, bound by an enclosing signature, e.g.
   * {@code m} in {@code MonadFail m => m Int}.
   */
  SKOLEM,

  /** Nominal type constructor applied to zero or more arguments. */
  NAMED
}

// End Op.java
