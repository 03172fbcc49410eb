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
package net.hydromatic.rustsmith.compile;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Predicate;
import net.hydromatic.rustsmith.ast.Identifier;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Lexical scope: the variables and parameters visible at a point in a
 * generated program.
 *
 * <p>Every scope is immutable; when you call {@link #bind}, a new scope is
 * created that inherits from the previous scope. Neither the new nor the old
 * will ever change, so a block's bindings disappear when the generator
 * returns to the enclosing scope.
 */
public class Scope {
  private static final Scope EMPTY = new Scope(null, null, 0);

  private final @Nullable Scope parent;
  private final @Nullable Identifier identifier;
  /** Nesting level; 0 outside any function. */
  public final int level;

  private Scope(@Nullable Scope parent, @Nullable Identifier identifier,
      int level) {
    this.parent = parent;
    this.identifier = identifier;
    this.level = level;
  }

  /** Returns the empty scope. */
  public static Scope empty() {
    return EMPTY;
  }

  /** Creates a scope that is this scope plus one more identifier. */
  public Scope bind(Identifier identifier) {
    if (identifier.level != level) {
      throw new IllegalArgumentException("identifier " + identifier.name
          + " has level " + identifier.level + ", scope has level " + level);
    }
    return new Scope(this, identifier, level);
  }

  /** Creates a nested scope, for a block or a function body. */
  public Scope enter() {
    return new Scope(this, null, level + 1);
  }

  /** Calls a consumer for each identifier, innermost first. */
  public void forEach(Consumer<Identifier> consumer) {
    for (Scope s = this; s != null; s = s.parent) {
      if (s.identifier != null) {
        consumer.accept(s.identifier);
      }
    }
  }

  /** Returns the identifiers that match a predicate, innermost first. */
  public List<Identifier> filter(Predicate<Identifier> predicate) {
    final List<Identifier> list = new ArrayList<>();
    forEach(id -> {
      if (predicate.test(id)) {
        list.add(id);
      }
    });
    return ImmutableList.copyOf(list);
  }

  /** Returns the identifiers bound at exactly this scope's level. */
  public List<Identifier> local() {
    return filter(id -> id.level == level);
  }
}

// End Scope.java
