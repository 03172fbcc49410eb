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
package net.hydromatic.rustsmith.run;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.io.File;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property of a generation run.
 *
 * <p>Values are held in a {@code Map<Prop, Object>}; a property that has no
 * value in the map has its default value.
 *
 * @see Runner
 */
public enum Prop {
  /** Integer property "count" is the number of programs to generate. */
  COUNT("count", Integer.class, true, 100),

  /**
   * Boolean property "print" causes the program and its arguments to be
   * written to standard output instead of to files. Default is false.
   */
  PRINT("print", Boolean.class, true, false),

  /**
   * Boolean property "stats" causes the node counts of each program to be
   * written, as JSON, alongside the program. Default is false.
   */
  STATS("stats", Boolean.class, true, false),

  /** Integer property "threads" is the number of worker threads. */
  THREADS("threads", Integer.class, true, 8),

  /**
   * Boolean property "failFast" controls whether an expression that reaches
   * a dead-end abandons the program immediately, rather than first trying
   * other productions. Default is false.
   */
  FAIL_FAST("failFast", Boolean.class, true, false),

  /**
   * Long property "seed" is the seed of the first program. If not set, each
   * program has a random seed.
   */
  SEED("seed", Long.class, false, null),

  /**
   * File property "directory" is where programs are written. It is deleted
   * and re-created at the start of each run. Default is "outRust".
   */
  DIRECTORY("directory", File.class, true, new File("outRust")),

  /**
   * Boolean property "zkvm" causes each program to also be written as a
   * library crate, with a wrapper binary and a file of inputs. Default is
   * false.
   */
  ZKVM("zkvm", Boolean.class, true, false),

  /** Integer property "usizeWidth" is the width of {@code usize}, 32 or 64. */
  USIZE_WIDTH("usizeWidth", Integer.class, true, 64),

  /** Integer property "maxDepth" is the maximum depth of expressions. */
  MAX_DEPTH("maxDepth", Integer.class, true, 5);

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final @Nullable Object defaultValue;

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

  Prop(String camelName, Class<?> type, boolean required,
      @Nullable Object defaultValue) {
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

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName + " not found");
    }
    return prop;
  }

  /** Returns the value of a property, or its default value. */
  public @Nullable Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Whether this is a boolean property, which a command-line option sets
   * without a value. */
  public boolean isFlag() {
    return type == Boolean.class;
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

  /** Returns the value of a long property, or null if it has no value. */
  public @Nullable Long longValue(Map<Prop, Object> map) {
    checkType(Long.class);
    final Object o = map.get(this);
    return o != null ? (Long) o : (Long) defaultValue;
  }

  /** Returns the value of a file property. */
  public File fileValue(Map<Prop, Object> map) {
    checkType(File.class);
    return this.typeValue(map.get(this));
  }

  @SuppressWarnings("unchecked")
  private <T> T typeValue(@Nullable Object o) {
    if (o == null) {
      if (defaultValue == null) {
        throw new IllegalStateException(
            "no value for property " + camelName + " and no default value");
      }
      return (T) defaultValue;
    }
    return (T) o;
  }

  /**
   * Sets the value of a property, converting a string to the property's
   * type; for example, "10" becomes 10 for an integer property.
   */
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (value instanceof String && type != String.class) {
      final String s = ((String) value).trim();
      try {
        if (type == Integer.class) {
          set(map, Integer.valueOf(s));
        } else if (type == Long.class) {
          set(map, Long.valueOf(s));
        } else if (type == Boolean.class) {
          final String lower = s.toLowerCase(Locale.ROOT);
          checkArgument(lower.equals("true") || lower.equals("false"),
              "invalid boolean '%s' for property %s", s, camelName);
          set(map, Boolean.valueOf(lower));
        } else if (type == File.class) {
          set(map, new File(s));
        } else {
          set(map, value);
        }
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("invalid value '" + s
            + "' for property " + camelName, e);
      }
      return;
    }
    set(map, value);
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      if (required) {
        throw new IllegalArgumentException("property " + camelName
            + " is required");
      }
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new IllegalArgumentException("value for property " + camelName
            + " must have type " + type);
      }
      map.put(this, value);
    }
  }
}

// End Prop.java
