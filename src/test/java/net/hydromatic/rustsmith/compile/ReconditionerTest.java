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

import static net.hydromatic.rustsmith.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.greaterThan;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import net.hydromatic.rustsmith.ast.Ast;
import net.hydromatic.rustsmith.ast.Identifier;
import net.hydromatic.rustsmith.ast.Op;
import net.hydromatic.rustsmith.select.SelectionManager;
import net.hydromatic.rustsmith.select.SelectionManager.Strategy;
import net.hydromatic.rustsmith.type.PrimitiveType;
import net.hydromatic.rustsmith.type.TypeSystem;
import net.hydromatic.rustsmith.util.Outcome;
import org.junit.jupiter.api.Test;

/** Tests for {@link Reconditioner} and {@link Statistics}. */
public class ReconditionerTest {
  /** Operations that can panic, and that reconditioning removes. */
  private static final List<Op> UNSAFE_OPS =
      ImmutableList.of(Op.PLUS, Op.MINUS, Op.TIMES, Op.DIVIDE, Op.MOD,
          Op.SHL, Op.SHR, Op.NEGATE, Op.INDEX, Op.OPTION_UNWRAP,
          Op.RESULT_UNWRAP, Op.TRY_CONVERT);

  private final TypeSystem ts = new TypeSystem(64);

  private static Identifier var(String name, PrimitiveType type) {
    return new Identifier(name, Identifier.Kind.VARIABLE, type, 1, false);
  }

  /** Creates a program that performs each kind of unsafe operation. */
  private Ast.Program unsafeProgram() {
    final Identifier v0 = var("var0", PrimitiveType.I32);
    final Identifier v1 = var("var1", PrimitiveType.I32);
    final Identifier v2 = var("var2", PrimitiveType.U8);
    final Identifier v3 = var("var3", PrimitiveType.I32);
    final Identifier v4 = var("var4", PrimitiveType.BOOL);
    final Identifier main =
        new Identifier("main", Identifier.Kind.FUNCTION, PrimitiveType.UNIT, 0,
            false);
    final List<Ast.Stmt> stmts =
        ImmutableList.of(
            ast.let(v0,
                ast.infixCall(Op.PLUS, ast.intLiteral(PrimitiveType.I32, 1),
                    ast.intLiteral(PrimitiveType.I32, 2))),
            ast.let(v1,
                ast.infixCall(Op.DIVIDE, ast.id(v0),
                    ast.intLiteral(PrimitiveType.I32, 0))),
            ast.let(v2, ast.convert(ast.id(v1), PrimitiveType.U8)),
            ast.let(v3,
                ast.index(
                    ast.array(ts.arrayType(PrimitiveType.I32, 2),
                        ImmutableList.of(ast.id(v0), ast.id(v1))),
                    ast.intLiteral(PrimitiveType.USIZE, 5))),
            ast.let(v4,
                ast.unwrap(ast.none(ts.optionType(PrimitiveType.BOOL)))),
            ast.hash(v4));
    return ast.program(ImmutableList.of(),
        ast.funDecl(main, ImmutableList.of(), ast.block(stmts, null)),
        ImmutableList.of(), 0L);
  }

  @Test
  void testRecondition() {
    final Reconditioner reconditioner = new Reconditioner();
    final Ast.Program program = reconditioner.recondition(unsafeProgram());
    final String s = program.toString();
    assertThat(s, containsString("let var0: i32 = 1i32.wrapping_add(2i32);"));
    assertThat(s,
        containsString(
            "let var1: i32 = var0.checked_div(0i32).unwrap_or(0i32);"));
    assertThat(s,
        containsString("let var2: u8 = u8::try_from(var1).unwrap_or(0u8);"));
    assertThat(s,
        containsString("let var3: i32 = [var0, var1][(5usize) % 2usize];"));
    assertThat(s,
        containsString("let var4: bool = None::<bool>.unwrap_or(false);"));
    assertThat(s, not(containsString(".unwrap()")));
  }

  @Test
  void testIdempotent() {
    final Ast.Program unsafe = unsafeProgram();
    final Ast.Program program = new Reconditioner().recondition(unsafe);
    assertThat(program, not(sameInstance(unsafe)));
    assertThat(new Reconditioner().recondition(program),
        sameInstance(program));
  }

  @Test
  void testStatistics() {
    final Reconditioner reconditioner = new Reconditioner();
    assertThrows(NullPointerException.class, reconditioner::statistics);
    reconditioner.recondition(unsafeProgram());
    final Statistics statistics = reconditioner.statistics();
    assertThat(statistics.count(Op.LET), is(5));
    assertThat(statistics.count(Op.HASH), is(1));
    assertThat(statistics.count(Op.WRAPPING_ADD), is(1));
    assertThat(statistics.count(Op.CHECKED_DIV), is(1));
    assertThat(statistics.count(Op.SAFE_INDEX), is(1));
    assertThat(statistics.count(Op.PLUS), is(0));
    assertThat(statistics.count(Op.ID), is(5));
    assertThat(statistics.useCount("var0"), is(2));
    assertThat(statistics.useCount("var2"), is(0));
    assertThat(statistics.useCount("var4"), is(1));

    // "main" and five variables are declared; five uses in all
    assertThat(statistics.averageIdentifierUse(), closeTo(5d / 6d, 1e-9));

    final Map<String, Object> map = statistics.toMap();
    assertThat(map.get("nodeCount"), is(statistics.nodeCount()));
    @SuppressWarnings("unchecked")
    final Map<String, Integer> nodes = (Map<String, Integer>) map.get("nodes");
    assertThat(nodes.get("wrappingAdd"), is(1));
    assertThat(nodes.get("let"), is(5));
    assertThat(statistics.toString(), is(map.toString()));
    assertThat(statistics.toString(), containsString("wrappingAdd=1"));
  }

  /** Generated programs, once reconditioned, contain no operation that can
   * panic, and keep their external parameters. */
  @Test
  void testGeneratedPrograms() {
    int programCount = 0;
    for (Strategy strategy : Strategy.values()) {
      for (long seed = 0; seed < 10; seed++) {
        final Outcome<GeneratedProgram> outcome =
            Generator.generateProgram(seed, new NameGenerator(),
                SelectionManager.of(strategy), GenerationConfig.DEFAULT);
        if (outcome.isDeadEnd()) {
          continue;
        }
        ++programCount;
        final GeneratedProgram generated = outcome.get();
        final Reconditioner reconditioner = new Reconditioner();
        final Ast.Program program =
            reconditioner.recondition(generated.program);
        final Statistics statistics = reconditioner.statistics();
        for (Op op : UNSAFE_OPS) {
          assertThat(op.name(), statistics.count(op), is(0));
        }
        assertThat(program.externals,
            sameInstance(generated.program.externals));
        assertThat(program.seed, is(generated.program.seed));
        assertThat(program.decls.size(), is(generated.program.decls.size()));
        for (int i = 0; i < program.decls.size(); i++) {
          final Ast.Decl decl = program.decls.get(i);
          if (decl instanceof Ast.FunDecl) {
            final Ast.FunDecl f0 =
                (Ast.FunDecl) generated.program.decls.get(i);
            final Ast.FunDecl f1 = (Ast.FunDecl) decl;
            assertThat(f1.function, sameInstance(f0.function));
            assertThat(f1.params, is(f0.params));
          }
        }
        assertThat(new Reconditioner().recondition(program),
            sameInstance(program));
        assertThat(generated.withProgram(program).arguments(),
            is(generated.arguments()));
      }
    }
    assertThat(programCount, greaterThan(0));
  }
}

// End ReconditionerTest.java
