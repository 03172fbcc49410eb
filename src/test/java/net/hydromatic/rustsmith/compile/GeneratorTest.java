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
import static org.hamcrest.CoreMatchers.anyOf;
import static org.hamcrest.CoreMatchers.hasItem;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.matchesPattern;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import net.hydromatic.rustsmith.ast.Ast;
import net.hydromatic.rustsmith.ast.ExternalParameter;
import net.hydromatic.rustsmith.ast.Identifier;
import net.hydromatic.rustsmith.ast.Visitor;
import net.hydromatic.rustsmith.select.SelectionManager;
import net.hydromatic.rustsmith.select.SelectionManager.Strategy;
import net.hydromatic.rustsmith.type.PrimitiveType;
import net.hydromatic.rustsmith.type.Type;
import net.hydromatic.rustsmith.util.Outcome;
import org.junit.jupiter.api.Test;

/** Tests for {@link Generator}. */
public class GeneratorTest {
  private static Outcome<GeneratedProgram> generate(long seed,
      Strategy strategy, GenerationConfig config) {
    return Generator.generateProgram(seed, new NameGenerator(),
        SelectionManager.of(strategy), config);
  }

  /** Generates programs for a few seeds and each strategy. */
  private static List<GeneratedProgram> programs(GenerationConfig config) {
    final List<GeneratedProgram> list = new ArrayList<>();
    for (Strategy strategy : Strategy.values()) {
      for (long seed = 0; seed < 10; seed++) {
        final Outcome<GeneratedProgram> outcome =
            generate(seed, strategy, config);
        if (!outcome.isDeadEnd()) {
          list.add(outcome.get());
        }
      }
    }
    return list;
  }

  @Test
  void testDeterministic() {
    for (Strategy strategy : Strategy.values()) {
      final Outcome<GeneratedProgram> o1 =
          generate(42L, strategy, GenerationConfig.DEFAULT);
      final Outcome<GeneratedProgram> o2 =
          generate(42L, strategy, GenerationConfig.DEFAULT);
      assertThat(o1.isDeadEnd(), is(o2.isDeadEnd()));
      if (o1.isDeadEnd()) {
        assertThat(o1.reason(), is(o2.reason()));
      } else {
        assertThat(o1.get().source(), is(o2.get().source()));
        assertThat(o1.get().arguments(), is(o2.get().arguments()));
      }
    }
  }

  @Test
  void testDifferentSeeds() {
    final Set<String> sources = new HashSet<>();
    for (long seed = 0; seed < 5; seed++) {
      final Outcome<GeneratedProgram> outcome =
          generate(seed, Strategy.UNIFORM, GenerationConfig.DEFAULT);
      if (!outcome.isDeadEnd()) {
        sources.add(outcome.get().source());
      }
    }
    assertThat(sources.size(), greaterThan(1));
  }

  /** Most attempts produce a program, whatever the strategy. */
  @Test
  void testMostAttemptsSucceed() {
    for (Strategy strategy : Strategy.values()) {
      int succeeded = 0;
      for (long seed = 0; seed < 50; seed++) {
        if (!generate(seed, strategy, GenerationConfig.DEFAULT).isDeadEnd()) {
          ++succeeded;
        }
      }
      assertThat(strategy.name(), succeeded, greaterThan(25));
    }
  }

  @Test
  void testFailFast() {
    final GenerationConfig config =
        GenerationConfig.DEFAULT.withFailFast(true);
    int succeeded = 0;
    for (long seed = 0; seed < 20; seed++) {
      if (!generate(seed, Strategy.OPTIMAL, config).isDeadEnd()) {
        ++succeeded;
      }
    }
    assertThat(succeeded, greaterThan(0));
  }

  /** Every variable is declared before use, in an enclosing scope, and
   * every call is to a function declared earlier. */
  @Test
  void testScopes() {
    for (GeneratedProgram program : programs(GenerationConfig.DEFAULT)) {
      final ScopeChecker checker = new ScopeChecker();
      program.program.accept(checker);
      assertThat(program.source(), checker.errors, empty());
    }
  }

  @Test
  void testExternalParameters() {
    for (GeneratedProgram program : programs(GenerationConfig.DEFAULT)) {
      final List<ExternalParameter> externals = program.externals();
      for (int i = 0; i < externals.size(); i++) {
        final ExternalParameter p = externals.get(i);
        assertThat(p.ordinal, is(i));
        checkValue(p, 64);
      }

      // Every parameter is read, and with the type it was declared with
      final ScopeChecker checker = new ScopeChecker();
      program.program.accept(checker);
      final Set<Integer> ordinals = new TreeSet<>();
      checker.cliArguments.forEach(a -> {
        ordinals.add(a.ordinal);
        assertThat(a.ordinal, lessThan(externals.size()));
        assertThat(a.type.moniker(),
            is(externals.get(a.ordinal).type.moniker()));
      });
      assertThat(ordinals.size(), is(externals.size()));
      assertThat(program.arguments().size(), is(externals.size()));
    }
  }

  private static void checkValue(ExternalParameter p, int usizeWidth) {
    switch (p.type) {
      case BOOL:
        assertThat(p.value, anyOf(is("true"), is("false")));
        break;
      case CHAR:
        assertThat(p.value.length(), is(1));
        break;
      case STRING:
        assertThat(p.value.isEmpty(), is(false));
        assertThat(p.value, not(matchesPattern(".*\\s.*")));
        break;
      default:
        final BigInteger v = new BigInteger(p.value);
        assertThat(p.toString(),
            v.compareTo(p.type.minValue(usizeWidth)) >= 0
                && v.compareTo(p.type.maxValue(usizeWidth)) <= 0,
            is(true));
    }
  }

  /** The entry function ends by hashing each of its top-level variables,
   * in the order they were declared. */
  @Test
  void testMainHashesVariables() {
    for (GeneratedProgram program : programs(GenerationConfig.DEFAULT)) {
      final List<Ast.Stmt> stmts = program.program.main.body.stmts;
      final List<String> declared = new ArrayList<>();
      for (Ast.Stmt stmt : stmts) {
        if (stmt instanceof Ast.Let) {
          declared.add(((Ast.Let) stmt).id.name);
        }
      }
      final List<String> hashed = new ArrayList<>();
      for (Ast.Stmt stmt : stmts.subList(stmts.size() - declared.size(),
          stmts.size())) {
        assertThat(stmt instanceof Ast.Hash, is(true));
        hashed.add(((Ast.Hash) stmt).id.identifier.name);
      }
      assertThat(hashed, is(declared));
    }
  }

  @Test
  void testUsizeWidth32() {
    final GenerationConfig config =
        GenerationConfig.DEFAULT.withUsizeWidth(32);
    final BigInteger max = BigInteger.ONE.shiftLeft(32);
    for (GeneratedProgram program : programs(config)) {
      for (ExternalParameter p : program.externals()) {
        checkValue(p, 32);
      }
      final List<Ast.Literal> literals = new ArrayList<>();
      program.program.accept(new Visitor() {
        @Override protected void visit(Ast.Literal literal) {
          if (literal.type == PrimitiveType.USIZE
              || literal.type == PrimitiveType.ISIZE) {
            literals.add(literal);
          }
        }
      });
      for (Ast.Literal literal : literals) {
        final BigInteger v = (BigInteger) literal.value;
        assertThat(literal.toString(), v.abs().compareTo(max) < 0, is(true));
      }
    }
  }

  @Test
  void testScopeCheckerCatchesUndeclared() {
    final ScopeChecker checker = new ScopeChecker();
    ast.id(
        new Identifier("var9", Identifier.Kind.VARIABLE, PrimitiveType.I32,
            1, false)).accept(checker);
    assertThat(checker.errors, hasItem("not in scope: var9"));
  }

  /** Checks that identifiers are in scope where they are used, and that
   * statements and function bodies have the declared types. */
  private static class ScopeChecker extends Visitor {
    final List<String> errors = new ArrayList<>();
    final List<Ast.CliArgument> cliArguments = new ArrayList<>();
    final Set<String> functions = new HashSet<>();
    Set<String> visible = new HashSet<>();

    private void check(boolean condition, String message) {
      if (!condition) {
        errors.add(message);
      }
    }

    private static boolean sameType(Type t0, Type t1) {
      return t0.moniker().equals(t1.moniker());
    }

    @Override protected void visit(Ast.Block block) {
      final Set<String> saved = new HashSet<>(visible);
      super.visit(block);
      visible = saved;
    }

    @Override protected void visit(Ast.MatchArm matchArm) {
      final Set<String> saved = new HashSet<>(visible);
      super.visit(matchArm);
      visible = saved;
    }

    @Override protected void visit(Ast.IdPat idPat) {
      visible.add(idPat.identifier.name);
    }

    @Override protected void visit(Ast.Id id) {
      check(visible.contains(id.identifier.name),
          "not in scope: " + id.identifier.name);
    }

    @Override protected void visit(Ast.CliArgument cliArgument) {
      cliArguments.add(cliArgument);
    }

    @Override protected void visit(Ast.Let let) {
      check(sameType(let.id.type, let.exp.type), "bad let: " + let);
      check(!visible.contains(let.id.name), "shadowed: " + let.id.name);
      super.visit(let);
      visible.add(let.id.name);
    }

    @Override protected void visit(Ast.Assign assign) {
      check(visible.contains(assign.id.name),
          "not in scope: " + assign.id.name);
      check(assign.id.mutable, "not mutable: " + assign.id.name);
      check(sameType(assign.id.type, assign.exp.type),
          "bad assignment: " + assign);
      super.visit(assign);
    }

    @Override protected void visit(Ast.Call call) {
      check(functions.contains(call.function.name),
          "not declared earlier: " + call.function.name);
      super.visit(call);
    }

    @Override protected void visit(Ast.FunDecl funDecl) {
      final Set<String> saved = visible;
      visible = new HashSet<>();
      for (Identifier param : funDecl.params) {
        visible.add(param.name);
      }
      if (funDecl.body.tail == null) {
        check(funDecl.function.type == PrimitiveType.UNIT,
            "no result: " + funDecl.function.name);
      } else {
        check(sameType(funDecl.function.type, funDecl.body.tail.type),
            "bad result: " + funDecl.function.name);
      }
      super.visit(funDecl);
      visible = saved;
      functions.add(funDecl.function.name);
    }
  }
}

// End GeneratorTest.java
