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
package net.hydromatic.symbolic.integrate;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import java.util.EnumMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Property that controls the behavior of {@link Integrator}. */
public enum Prop {
  /**
   * Integer property "maxDepth" is the maximum depth of nested dispatches;
   * the top-level call has depth 1. When a nested dispatch would exceed it,
   * the sub-problem returns an unevaluated integral. Default is 10.
   */
  MAX_DEPTH("maxDepth", Integer.class, 10),

  /**
   * Integer property "maxDispatches" is the maximum total number of
   * dispatches in one top-level call, at any depth. Default is 500.
   */
  MAX_DISPATCHES("maxDispatches", Integer.class, 500),

  /**
   * Boolean property "rischEnabled" controls whether the Risch decision
   * procedure is tried after the heuristic techniques. If false, no integral
   * is ever proven non-elementary. Default is true.
   */
  RISCH_ENABLED("rischEnabled", Boolean.class, true),

  /**
   * Boolean property "verify" controls whether each closed form is checked,
   * by differentiating it and comparing with the integrand numerically, before
   * it is accepted. A refuted closed form is treated as if the technique had
   * declined. Default is false.
   */
  VERIFY("verify", Boolean.class, false),

  /**
   * Integer property "timeoutMillis" is the time after which a call gives up
   * and returns an unevaluated integral marked as cancelled. Zero, the
   * default, means no timeout.
   */
  TIMEOUT_MILLIS("timeoutMillis", Integer.class, 0);

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  Prop(String camelName, Class<?> type, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Returns a copy of an option map, checking that each value has the
   * type of its property. */
  public static ImmutableMap<Prop, Object> validate(Map<Prop, Object> map) {
    final Map<Prop, Object> validated = new EnumMap<>(Prop.class);
    map.forEach((prop, value) -> prop.set(validated, value));
    return Maps.immutableEnumMap(validated);
  }

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
    final Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(type == requestedType,
        "invalid type %s for property %s", type, camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    return (Boolean) get(map);
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    return (Integer) get(map);
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    checkArgument(value != null, "property %s is required", camelName);
    checkArgument(type.isInstance(value),
        "value for property %s must have type %s", camelName, type);
    map.put(this, value);
  }
}

// End Prop.java
