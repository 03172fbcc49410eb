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
package net.hydromatic.rustsmith.ast;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Sub-types of {@link AstNode}, and operators of {@link
 * net.hydromatic.rustsmith.type.Type}.
 */
public enum Op {
  // identifiers
  ID(true),
  /** Reference to an external parameter, read from the command line. */
  CLI_ARGUMENT(true),

  // literals
  BOOL_LITERAL(true),
  CHAR_LITERAL(true),
  INT_LITERAL(true),
  STRING_LITERAL(true),

  // patterns
  ID_PAT(true),
  WILDCARD_PAT(true),
  LITERAL_PAT(true),
  CON_PAT(true),
  CON0_PAT(true),

  // value constructors
  TUPLE(true),
  ARRAY(true),
  STRUCT(true),
  ENUM_VARIANT(true),
  NONE(true),
  SOME(true),
  OK(true),
  ERR(true),
  BOX_NEW(true),
  CALL(true),
  /** Widening cast "(e as T)"; always written in parentheses. */
  CAST(true),

  // postfix operators; method calls, field access and indexing
  TUPLE_FIELD(".", 12),
  FIELD_ACCESS(".", 12),
  INDEX("[]", 12),
  OPTION_UNWRAP(".unwrap()", 12),
  RESULT_UNWRAP(".unwrap()", 12),
  TRY_CONVERT("::try_from", 12),

  // postfix operators created by reconditioning
  SAFE_INDEX("[]", 12),
  UNWRAP_OR(".unwrap_or", 12),
  CONVERT_OR("::try_from", 12),
  WRAPPING_ADD(".wrapping_add", 12),
  WRAPPING_SUB(".wrapping_sub", 12),
  WRAPPING_MUL(".wrapping_mul", 12),
  WRAPPING_NEG(".wrapping_neg", 12),
  WRAPPING_SHL(".wrapping_shl", 12),
  WRAPPING_SHR(".wrapping_shr", 12),
  CHECKED_DIV(".checked_div", 12),
  CHECKED_REM(".checked_rem", 12),

  // prefix operators
  NEGATE("-", 11),
  NOT("!", 11),
  BOX_DEREF("*", 11),
  DEREFERENCE("*", 11),
  REFERENCE("&", 11),

  // infix operators
  TIMES(" * ", 9),
  DIVIDE(" / ", 9),
  MOD(" % ", 9),
  PLUS(" + ", 8),
  MINUS(" - ", 8),
  SHL(" << ", 7),
  SHR(" >> ", 7),
  BIT_AND(" & ", 6),
  BIT_XOR(" ^ ", 5),
  BIT_OR(" | ", 4),
  EQ(" == ", 3, Assoc.NONE),
  NE(" != ", 3, Assoc.NONE),
  LT(" < ", 3, Assoc.NONE),
  LE(" <= ", 3, Assoc.NONE),
  GT(" > ", 3, Assoc.NONE),
  GE(" >= ", 3, Assoc.NONE),
  AND_ALSO(" && ", 2),
  OR_ELSE(" || ", 1),

  // expressions that contain blocks; parenthesized when they are operands
  IF(" ", 0),
  MATCH(" ", 0),
  BLOCK(" ", 0),
  MATCH_ARM,

  // statements
  LET,
  ASSIGN,
  EXPRESSION_STATEMENT,
  HASH,
  FOR_LOOP,
  IF_STATEMENT,

  // declarations
  STRUCT_DECL,
  ENUM_DECL,
  FUN_DECL,
  PROGRAM,

  // types
  PRIMITIVE_TYPE,
  ARRAY_TYPE,
  TUPLE_TYPE,
  BOX_TYPE,
  OPTION_TYPE,
  RESULT_TYPE,
  STRUCT_TYPE,
  ENUM_TYPE,
  REF_TYPE;

  /** Padded name, e.g. " + ". */
  public final String padded;
  /** Left precedence */
  public final int left;
  /** Right precedence */
  public final int right;
  /** Whether the operator is non-associative, like Rust's comparisons. */
  public final boolean nonAssociative;

  Op() {
    this("", 0, 0, false);
  }

  Op(boolean atom) {
    this("", 99);
    assert atom;
  }

  Op(String padded, int precedence) {
    this(padded, precedence, Assoc.LEFT);
  }

  Op(String padded, int precedence, Assoc assoc) {
    this(
        padded,
        precedence * 2 + (assoc == Assoc.RIGHT ? 1 : 0),
        precedence * 2 + (assoc == Assoc.RIGHT ? 0 : 1),
        assoc == Assoc.NONE);
  }

  Op(String padded, int left, int right, boolean nonAssociative) {
    this.padded = padded;
    this.left = left;
    this.right = right;
    this.nonAssociative = nonAssociative;
  }

  /** Whether this is a comparison operator, yielding {@code bool}. */
  public boolean isComparison() {
    return nonAssociative;
  }

  /**
   * Returns the operator that the reconditioner substitutes for this one, or
   * null if this operator cannot fail at run time.
   */
  public @Nullable Op safeOp() {
    switch (this) {
      case PLUS:
        return WRAPPING_ADD;
      case MINUS:
        return WRAPPING_SUB;
      case TIMES:
        return WRAPPING_MUL;
      case NEGATE:
        return WRAPPING_NEG;
      case SHL:
        return WRAPPING_SHL;
      case SHR:
        return WRAPPING_SHR;
      case DIVIDE:
        return CHECKED_DIV;
      case MOD:
        return CHECKED_REM;
      case INDEX:
        return SAFE_INDEX;
      case OPTION_UNWRAP:
      case RESULT_UNWRAP:
        return UNWRAP_OR;
      case TRY_CONVERT:
        return CONVERT_OR;
      default:
        return null;
    }
  }

  /** Associativity of an operator. */
  enum Assoc {
    LEFT,
    RIGHT,
    NONE
  }
}

// End Op.java
