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
package net.hydromatic.egraph.run;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.base.Enums;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property of a {@link Runner}.
 *
 * @see Runner#withProps(Map)
 */
public enum Prop {
  /**
   * Integer property "iterationLimit" is the maximum number of iterations
   * the runner performs. Default is 30.
   */
  ITERATION_LIMIT("iterationLimit", Integer.class, true, 30),

  /**
   * Integer property "nodeLimit" is the number of e-nodes beyond which the
   * runner stops. Default is 10,000.
   */
  NODE_LIMIT("nodeLimit", Integer.class, true, 10_000),

  /**
   * Integer property "timeLimitMillis" is the time, in milliseconds, after
   * which the runner stops. It is checked between iterations, so an
   * iteration that starts before the limit runs to completion. Default is
   * 5,000.
   */
  TIME_LIMIT_MILLIS("timeLimitMillis", Integer.class, true, 5_000),

  /**
   * Property "scheduler" is the scheduler used when none is given
   * explicitly. Default is "backoff".
   */
  SCHEDULER("scheduler", SchedulerKind.class, true, SchedulerKind.BACKOFF),

  /**
   * Integer property "matchLimit" is the initial number of matches per
   * iteration beyond which the backoff scheduler bans a rule. Default is
   * 1,000.
   */
  MATCH_LIMIT("matchLimit", Integer.class, true, 1_000),

  /**
   * Integer property "banLength" is the initial number of iterations for
   * which the backoff scheduler bans a rule. Default is 5.
   */
  BAN_LENGTH("banLength", Integer.class, true, 5),

  /**
   * Boolean property "explanationsEnabled" controls whether the e-graph
   * records why classes were merged. It must be set before any expression
   * is added. Default is false.
   */
  EXPLANATIONS_ENABLED("explanationsEnabled", Boolean.class, true, false);

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, boolean required, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.required = required;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName + " not found");
    }
    return prop;
  }

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
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

  /** Returns the value of an enum property. */
  public <E extends Enum<E>> E enumValue(Map<Prop, Object> map, Class<E> type) {
    checkType(type);
    return this.typeValue(map.get(this));
  }

  @SuppressWarnings("unchecked")
  private <T> T typeValue(@Nullable Object o) {
    return (T) (o == null ? defaultValue : o);
  }

  /**
   * Sets the value of a property, allowing strings for integer, boolean and
   * enum types.
   */
  @SuppressWarnings({"rawtypes", "unchecked"})
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (value instanceof String) {
      final String s = ((String) value).trim();
      if (type.isEnum()) {
        Optional<Enum> optional =
            Enums.getIfPresent((Class<Enum>) type, s.toUpperCase(Locale.ROOT));
        if (!optional.isPresent()) {
          String values =
              Arrays.stream((Enum[]) type.getEnumConstants())
                  .map(Enum::name)
                  .collect(Collectors.joining("', '", "'", "'"));
          throw new IllegalArgumentException(
              "value for property " + camelName + " must be one of: " + values);
        }
        set(map, optional.get());
        return;
      }
      if (type == Integer.class) {
        try {
          set(map, Integer.valueOf(s));
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException(
              "value for property " + camelName + " must be an integer", e);
        }
        return;
      }
      if (type == Boolean.class) {
        checkArgument(
            s.equalsIgnoreCase("true") || s.equalsIgnoreCase("false"),
            "value for property %s must be true or false",
            camelName);
        set(map, Boolean.valueOf(s));
        return;
      }
    }
    set(map, value);
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      if (required) {
        throw new IllegalArgumentException(
            "property " + camelName + " is required");
      }
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new IllegalArgumentException(
            "value for property " + camelName + " must have type " + type);
      }
      if (type == Integer.class) {
        checkArgument(
            (Integer) value >= 0,
            "value for property %s must not be negative",
            camelName);
      }
      map.put(this, value);
    }
  }

  /** Allowed values for {@link #SCHEDULER} property. */
  public enum SchedulerKind {
    /** Every rule searches and applies in every iteration. */
    SIMPLE,
    /** Rules that match too often are banned for exponentially longer. */
    BACKOFF
  }
}

// End Prop.java
