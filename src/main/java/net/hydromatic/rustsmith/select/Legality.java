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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.rustsmith.ast.Ast;
import net.hydromatic.rustsmith.ast.Identifier;
import net.hydromatic.rustsmith.compile.GenContext;
import net.hydromatic.rustsmith.type.ArrayType;
import net.hydromatic.rustsmith.type.BoxType;
import net.hydromatic.rustsmith.type.EnumType;
import net.hydromatic.rustsmith.type.OptionType;
import net.hydromatic.rustsmith.type.PrimitiveType;
import net.hydromatic.rustsmith.type.RefType;
import net.hydromatic.rustsmith.type.ResultType;
import net.hydromatic.rustsmith.type.StructType;
import net.hydromatic.rustsmith.type.TupleType;
import net.hydromatic.rustsmith.type.Type;
import net.hydromatic.rustsmith.type.TypeSystem;

/**
 * Decides which productions are legal at a decision point.
 *
 * <p>A production is legal if the generator can complete it within the
 * remaining depth using only the variables and functions in scope. Every
 * selection strategy chooses among the same legal productions.
 */
public class Legality {
  private Legality() {}

  /** Returns the legal kinds of statement, in declaration order. */
  public static List<StatementKind> statementKinds(GenContext cx) {
    final ImmutableList.Builder<StatementKind> b = ImmutableList.builder();
    for (StatementKind kind : StatementKind.values()) {
      if (isLegal(cx, kind)) {
        b.add(kind);
      }
    }
    return b.build();
  }

  /** Whether a kind of statement is legal. */
  public static boolean isLegal(GenContext cx, StatementKind kind) {
    final int d = cx.effectiveDepth();
    switch (kind) {
      case LET:
        return d >= 1;
      case ASSIGN:
        return d >= 1
            && !assignableVariables(cx, d - 1).isEmpty();
      case EXPRESSION:
        return d >= 1
            && cx.functions.stream().anyMatch(f -> isCallable(cx, f, d - 1));
      case HASH:
        return cx.inEntry && !hashableVariables(cx).isEmpty();
      case FOR_LOOP:
      case IF_STATEMENT:
        return d >= 2;
      default:
        throw new AssertionError("unknown statement kind " + kind);
    }
  }

  /**
   * Returns the mutable variables in scope that can be assigned an
   * expression built within a given depth.
   */
  public static List<Identifier> assignableVariables(GenContext cx,
      int depth) {
    return cx.scope.filter(id ->
        id.kind == Identifier.Kind.VARIABLE
            && id.mutable
            && !(id.type instanceof RefType)
            && cx.typeSystem.isConstructible(id.type, depth));
  }

  /** Returns the variables in scope whose value can be hashed. */
  public static List<Identifier> hashableVariables(GenContext cx) {
    return cx.scope.filter(id -> id.kind == Identifier.Kind.VARIABLE);
  }

  /**
   * Whether a function can be called from a context, that is, whether every
   * argument can be built within a given depth.
   */
  public static boolean isCallable(GenContext cx, Ast.FunDecl f, int depth) {
    for (Identifier param : f.params) {
      if (!cx.typeSystem.isConstructible(param.type, depth)) {
        return false;
      }
    }
    return true;
  }

  /** Returns the legal kinds of expression of a given type. */
  public static List<ExpressionKind> expressionKinds(GenContext cx,
      Type type) {
    final ImmutableList.Builder<ExpressionKind> b = ImmutableList.builder();
    for (ExpressionKind kind : ExpressionKind.values()) {
      if (isLegal(cx, kind, type)) {
        b.add(kind);
      }
    }
    return b.build();
  }

  /** Whether a kind of expression can produce a value of a given type. */
  public static boolean isLegal(GenContext cx, ExpressionKind kind,
      Type type) {
    final TypeSystem ts = cx.typeSystem;
    final int d = cx.effectiveDepth(type);
    if (type == PrimitiveType.UNIT) {
      return false;
    }
    if (type instanceof RefType) {
      // A reference is either copied from a variable or borrows a new value.
      switch (kind) {
        case VARIABLE:
          return hasVariable(cx, type);
        case REFERENCE:
          return ts.isConstructible(type, d);
        default:
          return false;
      }
    }
    switch (kind) {
      case BOOL_LITERAL:
        return type == PrimitiveType.BOOL;
      case CHAR_LITERAL:
        return type == PrimitiveType.CHAR;
      case INT_LITERAL:
        return type.isInteger();
      case STRING_LITERAL:
        return type == PrimitiveType.STRING;

      case VARIABLE:
        return hasVariable(cx, type);
      case CLI_ARGUMENT:
        return cx.inEntry
            && type instanceof PrimitiveType
            && type.isExternal();
      case DEREFERENCE:
        return !cx.scope.filter(id ->
            (id.kind == Identifier.Kind.VARIABLE
                || id.kind == Identifier.Kind.PARAMETER)
                && id.type instanceof RefType
                && ((RefType) id.type).elementType.equals(type)).isEmpty();

      case TUPLE:
        return type instanceof TupleType && ts.isConstructible(type, d);
      case ARRAY:
        return type instanceof ArrayType && ts.isConstructible(type, d);
      case STRUCT:
        return type instanceof StructType && ts.isConstructible(type, d);
      case ENUM_VARIANT:
        return type instanceof EnumType && ts.isConstructible(type, d);
      case BOX_NEW:
        return type instanceof BoxType && ts.isConstructible(type, d);
      case SOME:
        return type instanceof OptionType
            && ts.isConstructible(((OptionType) type).elementType, d - 1);
      case NONE:
        return type instanceof OptionType;
      case OK:
        return type instanceof ResultType
            && ts.isConstructible(((ResultType) type).okType, d - 1);
      case ERR:
        return type instanceof ResultType
            && ts.isConstructible(((ResultType) type).errType, d - 1);
      case REFERENCE:
        return false;

      case PLUS:
      case MINUS:
      case TIMES:
      case DIVIDE:
      case MOD:
      case SHL:
      case SHR:
      case TRY_CONVERT:
        return d >= 1 && type.isInteger();
      case NEGATE:
        return d >= 1 && type.isInteger() && type.isSigned();
      case BIT_AND:
      case BIT_OR:
      case BIT_XOR:
      case NOT:
        return d >= 1 && (type.isInteger() || type == PrimitiveType.BOOL);
      case AND_ALSO:
      case OR_ELSE:
      case EQ:
      case NE:
      case LT:
      case LE:
      case GT:
      case GE:
        return d >= 1 && type == PrimitiveType.BOOL;
      case CAST:
        return d >= 1 && !castSources(type).isEmpty();

      case TUPLE_FIELD:
      case INDEX:
      case BOX_DEREF:
        // The container is built one level down, and needs one more level.
        return ts.isConstructible(type, d - 2);
      case FIELD_ACCESS:
        return !structsWithField(cx, type, d - 1).isEmpty();
      case OPTION_UNWRAP:
        return d >= 1;
      case RESULT_UNWRAP:
        return d >= 2;

      case IF:
      case MATCH:
      case BLOCK:
        return ts.isConstructible(type, d - 1);
      case CALL:
        return d >= 1 && !callableFunctions(cx, type, d - 1).isEmpty();

      default:
        throw new AssertionError("unknown expression kind " + kind);
    }
  }

  private static boolean hasVariable(GenContext cx, Type type) {
    for (Identifier id : cx.variables()) {
      if (id.type.equals(type)) {
        return true;
      }
    }
    return false;
  }

  /** Returns the integer types that can be widened to a given type. */
  public static List<PrimitiveType> castSources(Type type) {
    if (!(type instanceof PrimitiveType)) {
      return ImmutableList.of();
    }
    final ImmutableList.Builder<PrimitiveType> b = ImmutableList.builder();
    for (PrimitiveType source : PrimitiveType.INTEGERS) {
      if (((PrimitiveType) type).canWidenFrom(source)) {
        b.add(source);
      }
    }
    return b.build();
  }

  /**
   * Returns the declared structs that have a field of a given type and can
   * be built within a given depth.
   */
  public static List<StructType> structsWithField(GenContext cx, Type type,
      int depth) {
    final ImmutableList.Builder<StructType> b = ImmutableList.builder();
    for (StructType structType : cx.typeSystem.structTypes()) {
      if (structType.fieldTypes.containsValue(type)
          && cx.typeSystem.isConstructible(structType, depth)) {
        b.add(structType);
      }
    }
    return b.build();
  }

  /**
   * Returns the functions that return a given type and whose arguments can
   * be built within a given depth.
   */
  public static List<Ast.FunDecl> callableFunctions(GenContext cx, Type type,
      int depth) {
    final ImmutableList.Builder<Ast.FunDecl> b = ImmutableList.builder();
    for (Ast.FunDecl f : cx.functions) {
      if (f.function.type.equals(type) && isCallable(cx, f, depth)) {
        b.add(f);
      }
    }
    return b.build();
  }

  /** Returns the legal kinds of type. */
  public static List<TypeKind> typeKinds(GenContext cx) {
    final ImmutableList.Builder<TypeKind> b = ImmutableList.builder();
    for (TypeKind kind : TypeKind.values()) {
      if (isLegal(cx, kind)) {
        b.add(kind);
      }
    }
    return b.build();
  }

  /** Whether a kind of type can be chosen within the context's depth. */
  public static boolean isLegal(GenContext cx, TypeKind kind) {
    final int d = cx.effectiveDepth();
    switch (kind) {
      case BOOL:
      case CHAR:
      case INTEGER:
      case STRING:
        return true;
      case ARRAY:
      case TUPLE:
      case BOX:
      case OPTION:
      case RESULT:
        return d >= 1;
      case STRUCT:
        return !constructibleTypes(cx.typeSystem.structTypes(), cx, d)
            .isEmpty();
      case ENUM:
        return !constructibleTypes(cx.typeSystem.enumTypes(), cx, d)
            .isEmpty();
      case REFERENCE:
        return cx.referencesAllowed && d >= 1;
      default:
        throw new AssertionError("unknown type kind " + kind);
    }
  }

  /** Returns the types from a list that can be built within a depth. */
  public static <T extends Type> List<T> constructibleTypes(List<T> types,
      GenContext cx, int depth) {
    final ImmutableList.Builder<T> b = ImmutableList.builder();
    for (T type : types) {
      if (cx.typeSystem.isConstructible(type, depth)) {
        b.add(type);
      }
    }
    return b.build();
  }
}

// End Legality.java
