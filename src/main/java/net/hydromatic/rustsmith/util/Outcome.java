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
package net.hydromatic.rustsmith.util;

import static java.util.Objects.requireNonNull;

import java.util.function.Function;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Result of a generation step: either a value, or a dead-end.
 *
 * <p>A dead-end means that at some decision point no production was legal.
 * It is the only recoverable condition during generation, and it is
 * propagated by ordinary control flow rather than by throwing.
 *
 * @param <T> Value type
 */
public final class Outcome<T> {
  private static final Outcome<Object> DEAD_END_UNKNOWN =
      new Outcome<>(null, "dead end");

  private final @Nullable T value;
  private final @Nullable String reason;

  private Outcome(@Nullable T value, @Nullable String reason) {
    this.value = value;
    this.reason = reason;
  }

  /** Creates an outcome that holds a value. */
  public static <T> Outcome<T> of(T value) {
    return new Outcome<>(requireNonNull(value), null);
  }

  /** Creates a dead-end outcome, with a description of the decision point. */
  public static <T> Outcome<T> deadEnd(String reason) {
    return new Outcome<>(null, requireNonNull(reason));
  }

  /** Creates a dead-end outcome with no particular reason. */
  @SuppressWarnings("unchecked")
  public static <T> Outcome<T> deadEnd() {
    return (Outcome<T>) DEAD_END_UNKNOWN;
  }

  public boolean isDeadEnd() {
    return value == null;
  }

  /** Returns the value. Throws if this is a dead-end. */
  public T get() {
    if (value == null) {
      throw new IllegalStateException("dead end has no value: " + reason);
    }
    return value;
  }

  /** Returns why generation dead-ended. Throws if this holds a value. */
  public String reason() {
    if (reason == null) {
      throw new IllegalStateException("not a dead end");
    }
    return reason;
  }

  /**
   * Converts a dead-end to a dead-end of another type, for returning to a
   * caller that expects a different value type.
   */
  @SuppressWarnings("unchecked")
  public <U> Outcome<U> propagate() {
    if (value != null) {
      throw new IllegalStateException("not a dead end");
    }
    return (Outcome<U>) this;
  }

  /** Applies a function to the value, or propagates a dead-end. */
  public <U> Outcome<U> map(Function<? super T, ? extends U> fn) {
    if (value == null) {
      return propagate();
    }
    return Outcome.of(fn.apply(value));
  }

  /** Applies a function that may itself dead-end. */
  public <U> Outcome<U> flatMap(Function<? super T, Outcome<U>> fn) {
    if (value == null) {
      return propagate();
    }
    return fn.apply(value);
  }

  @Override
  public String toString() {
    return value == null ? "DeadEnd(" + reason + ")" : "Outcome(" + value + ")";
  }
}

// End Outcome.java
