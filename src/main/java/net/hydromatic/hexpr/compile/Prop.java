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
package net.hydromatic.hexpr.compile;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.base.CaseFormat;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.Map;
import net.hydromatic.hexpr.graph.HypergraphWriter.Orientation;

/**
 * Property that controls compilation and output.
 *
 * <p>Values are held in a {@code Map<Prop, Object>}; a property that is not
 * in the map has its default value.
 */
public enum Prop {
  /**
   * Boolean property "minimize" controls whether the result is the quotient
   * of the graph, in which each class of unified wires is a single node.
   * Default is false.
   */
  MINIMIZE("minimize", Boolean.class, false),

  /**
   * Enum property "orientation" is the direction in which DOT output flows.
   * Default is "LR" (left to right).
   */
  ORIENTATION("orientation", Orientation.class, Orientation.LR),

  /**
   * Enum property "output" controls how the resulting graph is printed.
   * Default is "text".
   */
  OUTPUT("output", Output.class, Output.TEXT);

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  /** Properties keyed by both {@link #name()} and {@link #camelName}. */
  private static final ImmutableMap<String, Prop> BY_NAME;

  static {
    final ImmutableMap.Builder<String, Prop> b = ImmutableMap.builder();
    for (Prop prop : values()) {
      b.put(prop.name(), prop).put(prop.camelName, prop);
    }
    BY_NAME = b.build();
  }

  Prop(String camelName, Class<?> type, Object defaultValue) {
    checkArgument(CaseFormat.LOWER_CAMEL
        .to(CaseFormat.UPPER_UNDERSCORE, camelName).equals(name()));
    checkArgument(type == Boolean.class || type.isEnum());
    checkArgument(type.isInstance(defaultValue));
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = defaultValue;
  }

  /**
   * Looks up a property by its name, such as "MINIMIZE", or its camel name,
   * such as "minimize".
   *
   * @throws IllegalArgumentException if there is no such property
   */
  public static Prop lookup(String propName) {
    final Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName + " not found");
    }
    return prop;
  }

  /** Returns the value of this property, or its default value. */
  public Object get(Map<Prop, Object> map) {
    final Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    return (Boolean) typedValue(map, Boolean.class);
  }

  /** Returns the value of an enum property. */
  public <E extends Enum<E>> E enumValue(Map<Prop, Object> map, Class<E> type) {
    return type.cast(typedValue(map, type));
  }

  private Object typedValue(Map<Prop, Object> map, Class<?> requestedType) {
    checkArgument(type == requestedType, "invalid type %s for property %s",
        requestedType.getSimpleName(), camelName);
    return get(map);
  }

  /**
   * Sets the value of this property.
   *
   * @throws IllegalArgumentException if the value has the wrong type
   */
  public void set(Map<Prop, Object> map, Object value) {
    checkArgument(type.isInstance(requireNonNull(value)),
        "value for property %s must have type %s", camelName,
        type.getSimpleName());
    map.put(this, value);
  }

  /**
   * Sets the value of this property from a string, as given on the command
   * line. Case does not matter.
   *
   * @throws IllegalArgumentException if the string is not a valid value
   */
  public void setLenient(Map<Prop, Object> map, String value) {
    final Object[] allowed =
        type == Boolean.class
            ? new Object[] {true, false}
            : type.getEnumConstants();
    for (Object o : allowed) {
      if (o.toString().equalsIgnoreCase(value)) {
        set(map, o);
        return;
      }
    }
    throw new IllegalArgumentException("value must be one of: '"
        + Joiner.on("', '").join(Arrays.asList(allowed)) + "'");
  }

  /** Allowed values for {@link #OUTPUT} property. */
  public enum Output {
    /** Plain listing of nodes, edges and interface. The default. */
    TEXT,
    /** Graphviz DOT. */
    DOT
  }
}

// End Prop.java
