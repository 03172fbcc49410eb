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
package net.hydromatic.rustsmith.select;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Multiset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import net.hydromatic.rustsmith.ast.Op;
import net.hydromatic.rustsmith.compile.GenContext;
import net.hydromatic.rustsmith.type.EnumType;
import net.hydromatic.rustsmith.type.PrimitiveType;
import net.hydromatic.rustsmith.type.StructType;
import net.hydromatic.rustsmith.type.Type;
import net.hydromatic.rustsmith.type.TypeSystem;
import net.hydromatic.rustsmith.util.Outcome;

/**
 * Chooses which production to make at each decision point of generation.
 *
 * <p>Legality is decided by {@link Legality}, the same for every strategy;
 * the strategy decides only how to choose among legal productions. A
 * selection manager holds the state of one attempt, so create a new one (or
 * call {@link #startAttempt}) for each program.
 */
public final class SelectionManager {
  /** Node kind that {@link Strategy#AGGRESSIVE} targets by default. */
  public static final Op DEFAULT_TARGET = Op.BOX_DEREF;

  private final Strategy strategy;
  private final Op target;
  /** How often each node kind has been chosen in this attempt. */
  private final Multiset<Op> counts = HashMultiset.create();
  private SwarmConfiguration swarm = SwarmConfiguration.all();

  private SelectionManager(Strategy strategy, Op target) {
    this.strategy = requireNonNull(strategy);
    this.target = requireNonNull(target);
  }

  /** Creates a selection manager with the given strategy. */
  public static SelectionManager of(Strategy strategy) {
    return new SelectionManager(strategy, DEFAULT_TARGET);
  }

  /**
   * Creates a selection manager that chooses a given node kind wherever it
   * is legal.
   */
  public static SelectionManager aggressive(Op target) {
    return new SelectionManager(Strategy.AGGRESSIVE, target);
  }

  public Strategy strategy() {
    return strategy;
  }

  /** Returns the production kinds enabled in this attempt. */
  public SwarmConfiguration swarmConfiguration() {
    return swarm;
  }

  /** Returns how many times productions of a node kind have been chosen. */
  public int count(Op op) {
    return counts.count(op);
  }

  /**
   * Resets the per-attempt state. For {@link Strategy#SWARM}, samples the
   * set of enabled production kinds from the attempt's random source.
   */
  public void startAttempt(Random random) {
    counts.clear();
    swarm = strategy == Strategy.SWARM
        ? SwarmConfiguration.sample(random)
        : SwarmConfiguration.all();
  }

  /** Chooses a kind of statement. */
  public Outcome<StatementKind> chooseStatementKind(GenContext cx) {
    return choose(cx.random, Legality.statementKinds(cx), "statement");
  }

  /** Chooses a kind of expression that yields a value of a given type. */
  public Outcome<ExpressionKind> chooseExpressionKind(GenContext cx,
      Type type) {
    return chooseExpressionKind(cx, type, ImmutableList.of());
  }

  /**
   * Chooses a kind of expression that yields a value of a given type, other
   * than the kinds already tried.
   */
  public Outcome<ExpressionKind> chooseExpressionKind(GenContext cx,
      Type type, Iterable<ExpressionKind> excluded) {
    final List<ExpressionKind> legal =
        new ArrayList<>(Legality.expressionKinds(cx, type));
    excluded.forEach(legal::remove);
    return choose(cx.random, legal, "expression of type " + type);
  }

  /**
   * Chooses a type whose values can be built within the context's depth.
   * Component types are chosen recursively, one level down.
   */
  public Outcome<Type> chooseType(GenContext cx) {
    final Outcome<TypeKind> kind =
        choose(cx.random, Legality.typeKinds(cx), "type");
    if (kind.isDeadEnd()) {
      return kind.propagate();
    }
    final TypeSystem ts = cx.typeSystem;
    final Random random = cx.random;
    final int d = cx.effectiveDepth();
    switch (kind.get()) {
      case BOOL:
        return Outcome.of(PrimitiveType.BOOL);
      case CHAR:
        return Outcome.of(PrimitiveType.CHAR);
      case INTEGER:
        return Outcome.of(pick(random, PrimitiveType.INTEGERS));
      case STRING:
        return Outcome.of(PrimitiveType.STRING);
      case ARRAY:
        return component(cx).map(t ->
            ts.arrayType(t, 1 + random.nextInt(4)));
      case TUPLE:
        final int arity = 2 + random.nextInt(3);
        final List<Type> types = new ArrayList<>();
        for (int i = 0; i < arity; i++) {
          final Outcome<Type> type = component(cx);
          if (type.isDeadEnd()) {
            return type;
          }
          types.add(type.get());
        }
        return Outcome.of(ts.tupleType(types));
      case BOX:
        return component(cx).map(ts::boxType);
      case OPTION:
        return component(cx).map(ts::optionType);
      case RESULT:
        return component(cx).flatMap(ok ->
            component(cx).map(err -> ts.resultType(ok, err)));
      case STRUCT:
        final List<StructType> structTypes =
            Legality.constructibleTypes(ts.structTypes(), cx, d);
        return Outcome.of(pick(random, structTypes));
      case ENUM:
        final List<EnumType> enumTypes =
            Legality.constructibleTypes(ts.enumTypes(), cx, d);
        return Outcome.of(pick(random, enumTypes));
      case REFERENCE:
        return component(cx).map(ts::refType);
      default:
        throw new AssertionError("unknown type kind " + kind.get());
    }
  }

  /** Chooses the type of a component, one level down, never a reference. */
  private Outcome<Type> component(GenContext cx) {
    return chooseType(cx.descend().withReferences(false));
  }

  /**
   * Chooses among legal productions, according to the strategy. Records the
   * choice, and returns a dead-end if there is nothing to choose from.
   */
  private <K extends Production> Outcome<K> choose(Random random,
      List<K> legal, String what) {
    final List<K> enabled = new ArrayList<>();
    for (K k : legal) {
      if (swarm.isEnabled(k)) {
        enabled.add(k);
      }
    }
    if (enabled.isEmpty()) {
      return Outcome.deadEnd("no legal " + what);
    }
    final K chosen;
    switch (strategy) {
      case UNIFORM:
      case SWARM:
        chosen = pick(random, enabled);
        break;
      case OPTIMAL:
        chosen = pickWeighted(random, enabled);
        break;
      case AGGRESSIVE:
        final List<K> targets = new ArrayList<>();
        for (K k : enabled) {
          if (k.op() == target) {
            targets.add(k);
          }
        }
        chosen = pick(random, targets.isEmpty() ? enabled : targets);
        break;
      default:
        throw new AssertionError("unknown strategy " + strategy);
    }
    counts.add(chosen.op());
    return Outcome.of(chosen);
  }

  /**
   * Chooses a production with probability proportional to
   * {@code 1 / (1 + n)}, where {@code n} is how often its node kind has been
   * chosen in this attempt.
   */
  private <K extends Production> K pickWeighted(Random random, List<K> list) {
    final Map<K, Double> weights = new LinkedHashMap<>();
    double total = 0d;
    for (K k : list) {
      final double weight = 1d / (1d + counts.count(k.op()));
      weights.put(k, weight);
      total += weight;
    }
    double r = random.nextDouble() * total;
    for (Map.Entry<K, Double> entry : weights.entrySet()) {
      r -= entry.getValue();
      if (r < 0d) {
        return entry.getKey();
      }
    }
    // Rounding error; return the last
    return list.get(list.size() - 1);
  }

  /** Chooses an element of a non-empty list uniformly. */
  public static <E> E pick(Random random, List<E> list) {
    return list.get(random.nextInt(list.size()));
  }

  /** Strategy for choosing among legal productions. */
  public enum Strategy {
    /** Uniform among legal productions. */
    UNIFORM("BASE_SELECTION"),
    /** Uniform among the productions enabled for this program. */
    SWARM("SWARM_SELECTION"),
    /** Favors node kinds that have been chosen least often so far. */
    OPTIMAL("OPTIMAL_SELECTION"),
    /** Chooses a target node kind wherever it is legal. */
    AGGRESSIVE("AGGRESSIVE_SELECTION");

    /** Name of the strategy on the command line. */
    public final String optionName;

    Strategy(String optionName) {
      this.optionName = optionName;
    }

    /**
     * Looks up a strategy by its command-line name, e.g. "SWARM_SELECTION",
     * or by its own name, e.g. "swarm".
     */
    public static Strategy lookup(String name) {
      for (Strategy strategy : values()) {
        if (strategy.optionName.equals(name)
            || strategy.name().equals(name.toUpperCase(Locale.ROOT))) {
          return strategy;
        }
      }
      throw new IllegalArgumentException("unknown strategy: " + name);
    }
  }
}

// End SelectionManager.java
