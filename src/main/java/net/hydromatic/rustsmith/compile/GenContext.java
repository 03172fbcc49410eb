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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Random;
import net.hydromatic.rustsmith.ast.Ast;
import net.hydromatic.rustsmith.ast.Identifier;
import net.hydromatic.rustsmith.type.Type;
import net.hydromatic.rustsmith.type.TypeSystem;

/**
 * Context of a decision point during generation.
 *
 * <p>The scope, depth and flags belong to the decision point and are
 * immutable; the random source, type system and node budget are shared by
 * every context of the same attempt.
 */
public class GenContext {
  public final Random random;
  public final TypeSystem typeSystem;
  final Budget budget;
  public final Scope scope;
  /** Remaining recursion depth. */
  public final int depth;
  /** Whether the decision point is in the entry function, "main". */
  public final boolean inEntry;
  /** Whether a reference type may be chosen here. */
  public final boolean referencesAllowed;
  /** Functions that may be called here; those declared earlier. */
  public final List<Ast.FunDecl> functions;

  private GenContext(Random random, TypeSystem typeSystem, Budget budget,
      Scope scope, int depth, boolean inEntry, boolean referencesAllowed,
      List<Ast.FunDecl> functions) {
    this.random = requireNonNull(random);
    this.typeSystem = requireNonNull(typeSystem);
    this.budget = requireNonNull(budget);
    this.scope = requireNonNull(scope);
    this.depth = depth;
    this.inEntry = inEntry;
    this.referencesAllowed = referencesAllowed;
    this.functions = ImmutableList.copyOf(functions);
  }

  /** Creates a root context, with an empty scope, for a new attempt. */
  public static GenContext create(Random random, TypeSystem typeSystem,
      int maxNodes, int depth) {
    return new GenContext(random, typeSystem, new Budget(maxNodes),
        Scope.empty(), depth, false, false, ImmutableList.of());
  }

  public GenContext withScope(Scope scope) {
    return scope == this.scope ? this
        : new GenContext(random, typeSystem, budget, scope, depth, inEntry,
            referencesAllowed, functions);
  }

  public GenContext withDepth(int depth) {
    return depth == this.depth ? this
        : new GenContext(random, typeSystem, budget, scope, depth, inEntry,
            referencesAllowed, functions);
  }

  /** Returns a context one level deeper; the depth must be positive. */
  public GenContext descend() {
    checkArgument(depth > 0, "cannot descend below depth 0");
    return withDepth(depth - 1);
  }

  public GenContext withEntry(boolean inEntry) {
    return inEntry == this.inEntry ? this
        : new GenContext(random, typeSystem, budget, scope, depth, inEntry,
            referencesAllowed, functions);
  }

  public GenContext withReferences(boolean referencesAllowed) {
    return referencesAllowed == this.referencesAllowed ? this
        : new GenContext(random, typeSystem, budget, scope, depth, inEntry,
            referencesAllowed, functions);
  }

  public GenContext withFunctions(List<Ast.FunDecl> functions) {
    return new GenContext(random, typeSystem, budget, scope, depth, inEntry,
        referencesAllowed, functions);
  }

  /** Whether the node budget is used up. */
  public boolean isExhausted() {
    return budget.used >= budget.max;
  }

  /**
   * Returns the depth available for statements and types; zero once the node
   * budget is exhausted.
   */
  public int effectiveDepth() {
    return isExhausted() ? 0 : depth;
  }

  /**
   * Returns the depth available for an expression of a given type. Once the
   * node budget is exhausted, this is just enough to build a value of the
   * type by its cheapest production.
   */
  public int effectiveDepth(Type type) {
    return isExhausted()
        ? Math.min(depth, typeSystem.minDepth(type))
        : depth;
  }

  /** Returns the variables and parameters in scope, innermost first. */
  public List<Identifier> variables() {
    return scope.filter(id ->
        id.kind == Identifier.Kind.VARIABLE
            || id.kind == Identifier.Kind.PARAMETER);
  }

  /** Counter of generated nodes, shared by all contexts of an attempt. */
  static class Budget {
    final int max;
    int used;

    Budget(int max) {
      this.max = max;
    }
  }
}

// End GenContext.java
