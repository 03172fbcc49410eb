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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.util.EnumSet;
import java.util.Random;
import java.util.Set;

/**
 * Set of production kinds that are enabled for one program.
 *
 * <p>Swarm testing generates each program from a random subset of the
 * grammar, so that programs differ more from each other than a uniform
 * choice would make them. Essential kinds are always enabled.
 */
public class SwarmConfiguration {
  private static final SwarmConfiguration ALL =
      new SwarmConfiguration(EnumSet.allOf(StatementKind.class),
          EnumSet.allOf(ExpressionKind.class), EnumSet.allOf(TypeKind.class));

  private final Set<StatementKind> statementKinds;
  private final Set<ExpressionKind> expressionKinds;
  private final Set<TypeKind> typeKinds;

  private SwarmConfiguration(Set<StatementKind> statementKinds,
      Set<ExpressionKind> expressionKinds, Set<TypeKind> typeKinds) {
    this.statementKinds = Sets.immutableEnumSet(statementKinds);
    this.expressionKinds = Sets.immutableEnumSet(expressionKinds);
    this.typeKinds = Sets.immutableEnumSet(typeKinds);
  }

  /** Returns a configuration in which every kind is enabled. */
  public static SwarmConfiguration all() {
    return ALL;
  }

  /**
   * Samples a configuration: each kind that is not essential is enabled with
   * probability 1/2.
   */
  public static SwarmConfiguration sample(Random random) {
    return new SwarmConfiguration(
        sample(random, StatementKind.values()),
        sample(random, ExpressionKind.values()),
        sample(random, TypeKind.values()));
  }

  private static <K extends Enum<K> & Production> Set<K> sample(Random random,
      K[] values) {
    final EnumSet<K> set = EnumSet.noneOf(values[0].getDeclaringClass());
    for (K k : values) {
      if (k.essential() || random.nextBoolean()) {
        set.add(k);
      }
    }
    return set;
  }

  /** Whether a production kind is enabled. */
  public boolean isEnabled(Production production) {
    if (production instanceof StatementKind) {
      return statementKinds.contains(production);
    } else if (production instanceof ExpressionKind) {
      return expressionKinds.contains(production);
    } else if (production instanceof TypeKind) {
      return typeKinds.contains(production);
    } else {
      throw new AssertionError("unknown production " + production);
    }
  }

  /** Returns the enabled kinds of every category. */
  public Set<Production> enabled() {
    return ImmutableSet.<Production>builder()
        .addAll(statementKinds)
        .addAll(expressionKinds)
        .addAll(typeKinds)
        .build();
  }

  @Override
  public int hashCode() {
    return statementKinds.hashCode() ^ expressionKinds.hashCode()
        ^ typeKinds.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof SwarmConfiguration
            && statementKinds.equals(((SwarmConfiguration) o).statementKinds)
            && expressionKinds.equals(((SwarmConfiguration) o).expressionKinds)
            && typeKinds.equals(((SwarmConfiguration) o).typeKinds);
  }

  @Override
  public String toString() {
    return "Swarm" + enabled();
  }
}

// End SwarmConfiguration.java
