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

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;
import net.hydromatic.rustsmith.ast.Op;
import net.hydromatic.rustsmith.compile.GenContext;
import net.hydromatic.rustsmith.select.SelectionManager.Strategy;
import net.hydromatic.rustsmith.type.PrimitiveType;
import net.hydromatic.rustsmith.type.RefType;
import net.hydromatic.rustsmith.type.Type;
import net.hydromatic.rustsmith.type.TypeSystem;
import net.hydromatic.rustsmith.util.Outcome;
import org.junit.jupiter.api.Test;

/** Tests for {@link SelectionManager} and {@link Legality}. */
public class SelectionManagerTest {
  private final TypeSystem ts = new TypeSystem(64);

  private GenContext context(int depth) {
    return GenContext.create(new Random(0), ts, 100, depth);
  }

  @Test
  void testLegalityAtDepthZero() {
    final GenContext cx = context(0);
    assertThat(Legality.expressionKinds(cx, PrimitiveType.I32),
        is(ImmutableList.of(ExpressionKind.INT_LITERAL)));
    assertThat(Legality.expressionKinds(cx.withEntry(true), PrimitiveType.I32),
        is(ImmutableList.of(ExpressionKind.INT_LITERAL,
            ExpressionKind.CLI_ARGUMENT)));
    assertThat(Legality.expressionKinds(cx, PrimitiveType.STRING),
        is(ImmutableList.of(ExpressionKind.STRING_LITERAL)));
    assertThat(Legality.statementKinds(cx).isEmpty(), is(true));
    assertThat(Legality.typeKinds(cx),
        is(ImmutableList.of(TypeKind.BOOL, TypeKind.CHAR, TypeKind.INTEGER,
            TypeKind.STRING)));
  }

  @Test
  void testLegalityOfReferences() {
    final RefType ref = ts.refType(PrimitiveType.I32);
    assertThat(Legality.expressionKinds(context(2), ref),
        is(ImmutableList.of(ExpressionKind.REFERENCE)));
    assertThat(Legality.expressionKinds(context(0), ref).isEmpty(), is(true));
    assertThat(Legality.isLegal(context(2), TypeKind.REFERENCE), is(false));
    assertThat(
        Legality.isLegal(context(2).withReferences(true), TypeKind.REFERENCE),
        is(true));
  }

  @Test
  void testLegalityOfUnit() {
    assertThat(Legality.expressionKinds(context(3), PrimitiveType.UNIT)
        .isEmpty(), is(true));
  }

  /** If no production is legal, the choice is a dead-end, not an error. */
  @Test
  void testDeadEnd() {
    final SelectionManager sm = SelectionManager.of(Strategy.UNIFORM);
    final Outcome<ExpressionKind> kind =
        sm.chooseExpressionKind(context(0), ts.refType(PrimitiveType.I32));
    assertThat(kind.isDeadEnd(), is(true));
    assertThat(kind.reason(), containsString("no legal expression"));
    assertThrows(IllegalStateException.class, kind::get);

    assertThat(sm.chooseStatementKind(context(0)).isDeadEnd(), is(true));

    // Excluding the only legal kind is a dead-end too
    assertThat(
        sm.chooseExpressionKind(context(0), PrimitiveType.I32,
            ImmutableList.of(ExpressionKind.INT_LITERAL)).isDeadEnd(),
        is(true));
  }

  @Test
  void testChooseType() {
    final SelectionManager sm = SelectionManager.of(Strategy.UNIFORM);
    final GenContext cx0 = context(0);
    for (int i = 0; i < 50; i++) {
      assertThat(sm.chooseType(cx0).get(), instanceOf(PrimitiveType.class));
    }
    final GenContext cx = context(2);
    boolean sawReference = false;
    for (int i = 0; i < 200; i++) {
      final Type type = sm.chooseType(cx).get();
      assertThat(type, not(instanceOf(RefType.class)));
      assertThat(ts.isConstructible(type, 2), is(true));
      if (sm.chooseType(cx.withReferences(true)).get() instanceof RefType) {
        sawReference = true;
      }
    }
    assertThat(sawReference, is(true));
  }

  @Test
  void testAggressive() {
    final SelectionManager sm = SelectionManager.aggressive(Op.PLUS);
    assertThat(sm.strategy(), is(Strategy.AGGRESSIVE));
    final GenContext cx = context(3);
    for (int i = 0; i < 20; i++) {
      assertThat(sm.chooseExpressionKind(cx, PrimitiveType.I32).get(),
          is(ExpressionKind.PLUS));
    }
    assertThat(sm.count(Op.PLUS), is(20));

    // Where the target is not legal, choose among the legal kinds
    assertThat(sm.chooseExpressionKind(cx, PrimitiveType.STRING).isDeadEnd(),
        is(false));

    // By default, the target is dereference of a box
    final SelectionManager sm2 = SelectionManager.of(Strategy.AGGRESSIVE);
    assertThat(sm2.chooseExpressionKind(cx, PrimitiveType.I32).get(),
        is(ExpressionKind.BOX_DEREF));
  }

  /** The optimal strategy favors the kinds chosen least often, so after many
   * choices, many different kinds have been chosen. */
  @Test
  void testOptimal() {
    final SelectionManager sm = SelectionManager.of(Strategy.OPTIMAL);
    final GenContext cx = context(3);
    final Set<ExpressionKind> chosen = EnumSet.noneOf(ExpressionKind.class);
    for (int i = 0; i < 100; i++) {
      chosen.add(sm.chooseExpressionKind(cx, PrimitiveType.I32).get());
    }
    int total = 0;
    for (ExpressionKind kind : chosen) {
      total += sm.count(kind.op());
    }
    assertThat(total, is(100));
    assertThat(chosen.size(), greaterThan(5));

    sm.startAttempt(new Random(1));
    assertThat(sm.count(Op.PLUS), is(0));
  }

  @Test
  void testSwarm() {
    final SelectionManager sm = SelectionManager.of(Strategy.SWARM);
    final Set<SwarmConfiguration> configurations = new HashSet<>();
    for (int seed = 0; seed < 10; seed++) {
      sm.startAttempt(new Random(seed));
      final SwarmConfiguration swarm = sm.swarmConfiguration();
      configurations.add(swarm);
      for (ExpressionKind kind : ExpressionKind.values()) {
        if (kind.essential()) {
          assertThat(swarm.isEnabled(kind), is(true));
        }
      }
      for (TypeKind kind : TypeKind.values()) {
        if (kind.essential()) {
          assertThat(swarm.isEnabled(kind), is(true));
        }
      }

      // Only enabled kinds are chosen
      final GenContext cx = context(3);
      for (int i = 0; i < 20; i++) {
        final Outcome<ExpressionKind> kind =
            sm.chooseExpressionKind(cx, PrimitiveType.I64);
        assertThat(swarm.isEnabled(kind.get()), is(true));
      }
    }
    assertThat(configurations.size(), greaterThan(1));

    // Other strategies enable everything
    final SelectionManager uniform = SelectionManager.of(Strategy.UNIFORM);
    uniform.startAttempt(new Random(0));
    assertThat(uniform.swarmConfiguration(), is(SwarmConfiguration.all()));
  }

  @Test
  void testLookup() {
    assertThat(Strategy.lookup("SWARM_SELECTION"), is(Strategy.SWARM));
    assertThat(Strategy.lookup("BASE_SELECTION"), is(Strategy.UNIFORM));
    assertThat(Strategy.lookup("optimal"), is(Strategy.OPTIMAL));
    assertThat(Strategy.lookup("AGGRESSIVE_SELECTION"),
        is(Strategy.AGGRESSIVE));
    assertThrows(IllegalArgumentException.class,
        () -> Strategy.lookup("RANDOM_SELECTION"));
  }
}

// End SelectionManagerTest.java
