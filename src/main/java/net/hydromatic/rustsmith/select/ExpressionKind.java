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

import net.hydromatic.rustsmith.ast.Op;

/**
 * Kinds of expression.
 *
 * <p>Literals and value constructors are essential: they are the only way
 * to build a value of a given type from scratch.
 */
public enum ExpressionKind implements Production {
  // literals
  BOOL_LITERAL(Op.BOOL_LITERAL, true),
  CHAR_LITERAL(Op.CHAR_LITERAL, true),
  INT_LITERAL(Op.INT_LITERAL, true),
  STRING_LITERAL(Op.STRING_LITERAL, true),

  // identifiers
  VARIABLE(Op.ID, false),
  /** Value of an external parameter; only in "main". */
  CLI_ARGUMENT(Op.CLI_ARGUMENT, false),
  /** Dereference of a variable whose type is a reference. */
  DEREFERENCE(Op.DEREFERENCE, false),

  // value constructors
  TUPLE(Op.TUPLE, true),
  ARRAY(Op.ARRAY, true),
  STRUCT(Op.STRUCT, true),
  ENUM_VARIANT(Op.ENUM_VARIANT, true),
  SOME(Op.SOME, true),
  NONE(Op.NONE, true),
  OK(Op.OK, true),
  ERR(Op.ERR, true),
  BOX_NEW(Op.BOX_NEW, true),
  REFERENCE(Op.REFERENCE, true),

  // operators
  PLUS(Op.PLUS, false),
  MINUS(Op.MINUS, false),
  TIMES(Op.TIMES, false),
  DIVIDE(Op.DIVIDE, false),
  MOD(Op.MOD, false),
  NEGATE(Op.NEGATE, false),
  SHL(Op.SHL, false),
  SHR(Op.SHR, false),
  BIT_AND(Op.BIT_AND, false),
  BIT_OR(Op.BIT_OR, false),
  BIT_XOR(Op.BIT_XOR, false),
  NOT(Op.NOT, false),
  AND_ALSO(Op.AND_ALSO, false),
  OR_ELSE(Op.OR_ELSE, false),
  EQ(Op.EQ, false),
  NE(Op.NE, false),
  LT(Op.LT, false),
  LE(Op.LE, false),
  GT(Op.GT, false),
  GE(Op.GE, false),
  CAST(Op.CAST, false),
  TRY_CONVERT(Op.TRY_CONVERT, false),

  // access to components
  TUPLE_FIELD(Op.TUPLE_FIELD, false),
  FIELD_ACCESS(Op.FIELD_ACCESS, false),
  INDEX(Op.INDEX, false),
  BOX_DEREF(Op.BOX_DEREF, false),
  OPTION_UNWRAP(Op.OPTION_UNWRAP, false),
  RESULT_UNWRAP(Op.RESULT_UNWRAP, false),

  // control flow
  IF(Op.IF, false),
  MATCH(Op.MATCH, false),
  BLOCK(Op.BLOCK, false),
  CALL(Op.CALL, false);

  private final Op op;
  private final boolean essential;

  ExpressionKind(Op op, boolean essential) {
    this.op = op;
    this.essential = essential;
  }

  @Override
  public Op op() {
    return op;
  }

  @Override
  public boolean essential() {
    return essential;
  }

  /** Whether this is a binary operator whose result has its operands' type. */
  public boolean isArithmetic() {
    switch (this) {
      case PLUS:
      case MINUS:
      case TIMES:
      case DIVIDE:
      case MOD:
      case BIT_AND:
      case BIT_OR:
      case BIT_XOR:
        return true;
      default:
        return false;
    }
  }

  /** Whether this is a comparison, whose operands may have any type. */
  public boolean isComparison() {
    return op.isComparison();
  }
}

// End ExpressionKind.java
