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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property of a {@link ConstraintSolver}.
 *
 * <p>Values are held in a {@code Map<Prop, Object>}; a property that is not
 * in the map has its default value.
 */
public enum Prop {
  /**
   * Integer property "resolutionDepth" is the maximum nesting of
   * prerequisite constraints that the solver will follow before failing with
   * {@link ResolveException.ResolutionDepthExceeded}. Default is 64.
   */
  RESOLUTION_DEPTH("resolutionDepth", Integer.class, true, 64),

  /**
   * Boolean property "superclassDischarge" controls whether, when a
   * constraint's own chains find nothing, given evidence for a subclass may
   * discharge it. Default is true.
   */
  SUPERCLASS_DISCHARGE("superclassDischarge", Boolean.class, true, true),

  /**
   * Boolean property "overlapCheck" controls whether every chain of a class
   * is examined, so that two chains resolving the same constraint are
   * reported as {@link ResolveException.OverlappingInstances}. If false, the
   * first chain to resolve wins. Default is true.
   */
  OVERLAP_CHECK("overlapCheck", Boolean.class, true, true);

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final Object defaultValue;

  Prop(String camelName, Class<?> type, boolean required, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.required = required;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    if (defaultValue == null) {
      checkArgument(
          !required, "required property %s must have default value", camelName);
    } else {
      checkArgument(type.isInstance(defaultValue));
    }
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(
        type == requestedType,
        "invalid type %s for property %s",
        type,
        camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    return this.<Boolean>typeValue(map.get(this));
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    return this.<Integer>typeValue(map.get(this));
  }

  @SuppressWarnings("unchecked")
  private <T> T typeValue(Object o) {
    if (o == null) {
      if (defaultValue == null) {
        throw new IllegalStateException(
            "no value for property " + camelName + " and no default value");
      }
      return (T) defaultValue;
    }
    return (T) o;
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      if (required) {
        throw new IllegalArgumentException("property is required");
      }
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new IllegalArgumentException(
            "value for property must have type " + type);
      }
      if (this == RESOLUTION_DEPTH && (Integer) value < 1) {
        throw new IllegalArgumentException(
            "value for property " + camelName + " must be positive");
      }
      map.put(this, value);
    }
  }
}

// End Prop.java
