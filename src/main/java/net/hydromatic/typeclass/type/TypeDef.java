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
import static java.util.Objects.requireNonNull;

/**
 * Definition of a nominal type: its name, its arity, and the module that
 * defines it.
 *
 * <p>The defining module is what the orphan check compares against.
 */
public class TypeDef {
  public final String moduleName;
  public final String name;
  public final int arity;

  TypeDef(String moduleName, String name, int arity) {
    this.moduleName = requireNonNull(moduleName);
    this.name = requireNonNull(name);
    checkArgument(arity >= 0, "negative arity for %s", name);
    this.arity = arity;
  }

  @Override
  public String toString() {
    return moduleName + "." + name;
  }
}

// End TypeDef.java
