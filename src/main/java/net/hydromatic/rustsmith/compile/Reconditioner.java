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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.rustsmith.ast.AstBuilder.ast;

import net.hydromatic.rustsmith.ast.Ast;
import net.hydromatic.rustsmith.ast.Op;
import net.hydromatic.rustsmith.ast.Shuttle;
import net.hydromatic.rustsmith.type.PrimitiveType;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Rewrites a program so that it cannot panic at run time.
 *
 * <p>Each operation that can overflow, divide by zero, index out of bounds,
 * fail a conversion, or unwrap an empty value is replaced by a total
 * equivalent: a wrapping or checked method, an index reduced modulo the
 * array's size, or an unwrap with a default. Every node keeps its type, and
 * the program keeps its signature and external parameters.
 *
 * <p>Reconditioning is idempotent; reconditioning a program a second time
 * returns the same instance.
 */
public class Reconditioner extends Shuttle {
  private @Nullable Statistics statistics;

  /** Reconditions a program, and computes statistics for the result. */
  public Ast.Program recondition(Ast.Program program) {
    final Ast.Program program2 = program.accept(this);
    statistics = Statistics.of(program2);
    return program2;
  }

  /** Returns statistics of the most recently reconditioned program. */
  public Statistics statistics() {
    return requireNonNull(statistics, "no program has been reconditioned");
  }

  @Override
  protected Ast.Exp visit(Ast.PrefixCall prefixCall) {
    final Ast.Exp a = prefixCall.a.accept(this);
    if (prefixCall.op == Op.NEGATE) {
      return ast.methodCall(Op.WRAPPING_NEG, a, null, null);
    }
    return prefixCall.copy(a);
  }

  @Override
  protected Ast.Exp visit(Ast.InfixCall infixCall) {
    final Ast.Exp a0 = infixCall.a0.accept(this);
    final Ast.Exp a1 = infixCall.a1.accept(this);
    switch (infixCall.op) {
      case PLUS:
      case MINUS:
      case TIMES:
      case SHL:
      case SHR:
        return ast.methodCall(requireNonNull(infixCall.op.safeOp()), a0, a1,
            null);
      case DIVIDE:
      case MOD:
        return ast.methodCall(requireNonNull(infixCall.op.safeOp()), a0, a1,
            Defaults.zero(infixCall.type));
      default:
        return infixCall.copy(a0, a1);
    }
  }

  @Override
  protected Ast.Exp visit(Ast.Convert convert) {
    final Ast.Exp a = convert.a.accept(this);
    if (convert.op == Op.TRY_CONVERT) {
      return ast.convertOr(a, (PrimitiveType) convert.type,
          Defaults.zero(convert.type));
    }
    return convert.copy(a, visitOpt(convert.fallback));
  }

  @Override
  protected Ast.Exp visit(Ast.Index index) {
    final Ast.Exp array = index.array.accept(this);
    final Ast.Exp i = index.index.accept(this);
    if (index.op == Op.INDEX) {
      return ast.safeIndex(array, i);
    }
    return index.copy(array, i);
  }

  @Override
  protected Ast.Exp visit(Ast.Unwrap unwrap) {
    final Ast.Exp a = unwrap.a.accept(this);
    if (unwrap.fallback == null) {
      return ast.unwrapOr(a, Defaults.of(unwrap.type));
    }
    return unwrap.copy(unwrap.op, a, visitOpt(unwrap.fallback));
  }
}

// End Reconditioner.java
