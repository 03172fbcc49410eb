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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;
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
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Builds syntax tree nodes.
 *
 * <p>Each method checks that its arguments have the types that Rust
 * requires, so a tree built only through this class is well-typed.
 */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient
   * for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  private static void checkType(Type expected, Ast.Exp exp) {
    checkArgument(
        expected.equals(exp.type),
        "expected %s, got %s: %s",
        expected, exp.type, exp);
  }

  // literals

  public Ast.Literal boolLiteral(boolean b) {
    return new Ast.Literal(Op.BOOL_LITERAL, PrimitiveType.BOOL, b);
  }

  public Ast.Literal intLiteral(PrimitiveType type, BigInteger value) {
    checkArgument(type.isInteger(), "not an integer type: %s", type);
    return new Ast.Literal(Op.INT_LITERAL, type, value);
  }

  public Ast.Literal intLiteral(PrimitiveType type, long value) {
    return intLiteral(type, BigInteger.valueOf(value));
  }

  public Ast.Literal charLiteral(char c) {
    return new Ast.Literal(Op.CHAR_LITERAL, PrimitiveType.CHAR, c);
  }

  public Ast.Literal stringLiteral(String s) {
    return new Ast.Literal(Op.STRING_LITERAL, PrimitiveType.STRING, s);
  }

  // identifiers

  public Ast.Id id(Identifier identifier) {
    checkArgument(identifier.kind != Identifier.Kind.FUNCTION);
    return new Ast.Id(identifier);
  }

  public Ast.CliArgument cliArgument(ExternalParameter parameter) {
    return new Ast.CliArgument(parameter.ordinal, parameter.type);
  }

  // operators

  /** Creates a call to a prefix operator, deducing its type. */
  public Ast.PrefixCall prefixCall(Op op, Ast.Exp a) {
    switch (op) {
      case NEGATE:
        checkArgument(a.type.isInteger() && a.type.isSigned(),
            "cannot negate %s", a.type);
        return new Ast.PrefixCall(op, a, a.type);
      case NOT:
        checkArgument(a.type == PrimitiveType.BOOL || a.type.isInteger(),
            "cannot apply '!' to %s", a.type);
        return new Ast.PrefixCall(op, a, a.type);
      case BOX_DEREF:
        checkArgument(a.type instanceof BoxType);
        return new Ast.PrefixCall(op, a, ((BoxType) a.type).elementType);
      case DEREFERENCE:
        checkArgument(a.type instanceof RefType);
        return new Ast.PrefixCall(op, a, ((RefType) a.type).elementType);
      default:
        throw new IllegalArgumentException("not a prefix operator: " + op);
    }
  }

  /** Creates a borrow, "&{a}". */
  public Ast.PrefixCall reference(RefType type, Ast.Exp a) {
    checkType(type.elementType, a);
    return new Ast.PrefixCall(Op.REFERENCE, a, type);
  }

  /** Creates a call to an infix operator, deducing its type. */
  public Ast.InfixCall infixCall(Op op, Ast.Exp a0, Ast.Exp a1) {
    switch (op) {
      case AND_ALSO:
      case OR_ELSE:
        checkType(PrimitiveType.BOOL, a0);
        checkType(PrimitiveType.BOOL, a1);
        return new Ast.InfixCall(op, a0, a1, PrimitiveType.BOOL);
      case EQ:
      case NE:
      case LT:
      case LE:
      case GT:
      case GE:
        checkArgument(PrimitiveType.COMPARABLE.contains(a0.type),
            "not comparable: %s", a0.type);
        checkType(a0.type, a1);
        return new Ast.InfixCall(op, a0, a1, PrimitiveType.BOOL);
      case SHL:
      case SHR:
        checkArgument(a0.type.isInteger());
        checkType(PrimitiveType.U32, a1);
        return new Ast.InfixCall(op, a0, a1, a0.type);
      case BIT_AND:
      case BIT_OR:
      case BIT_XOR:
        checkArgument(a0.type.isInteger() || a0.type == PrimitiveType.BOOL);
        checkType(a0.type, a1);
        return new Ast.InfixCall(op, a0, a1, a0.type);
      case PLUS:
      case MINUS:
      case TIMES:
      case DIVIDE:
      case MOD:
        checkArgument(a0.type.isInteger(), "not an integer: %s", a0.type);
        checkType(a0.type, a1);
        return new Ast.InfixCall(op, a0, a1, a0.type);
      default:
        throw new IllegalArgumentException("not an infix operator: " + op);
    }
  }

  /**
   * Creates a call to an integer method that cannot fail, such as
   * "wrapping_add" or "checked_div(..).unwrap_or(..)".
   */
  public Ast.MethodCall methodCall(Op op, Ast.Exp receiver,
      Ast.@Nullable Exp arg, Ast.@Nullable Exp fallback) {
    checkArgument(receiver.type.isInteger());
    if (arg != null) {
      checkType(op == Op.WRAPPING_SHL || op == Op.WRAPPING_SHR
          ? PrimitiveType.U32 : receiver.type, arg);
    }
    if (fallback != null) {
      checkType(receiver.type, fallback);
    }
    return new Ast.MethodCall(op, receiver, arg, fallback, receiver.type);
  }

  /** Creates a widening cast. */
  public Ast.Cast cast(Ast.Exp a, PrimitiveType type) {
    checkArgument(a.type instanceof PrimitiveType
            && type.canWidenFrom((PrimitiveType) a.type),
        "cannot widen %s to %s", a.type, type);
    return new Ast.Cast(a, type);
  }

  /** Creates a checked conversion, "T::try_from(a).unwrap()". */
  public Ast.Convert convert(Ast.Exp a, PrimitiveType type) {
    checkArgument(a.type.isInteger() && type.isInteger());
    return new Ast.Convert(Op.TRY_CONVERT, a, null, type);
  }

  /** Creates a conversion with a fallback, "T::try_from(a).unwrap_or(b)". */
  public Ast.Convert convertOr(Ast.Exp a, PrimitiveType type,
      Ast.Exp fallback) {
    checkArgument(a.type.isInteger() && type.isInteger());
    checkType(type, fallback);
    return new Ast.Convert(Op.CONVERT_OR, a, fallback, type);
  }

  // value constructors

  public Ast.Tuple tuple(TupleType type, List<? extends Ast.Exp> args) {
    checkArgument(args.size() == type.argTypes.size());
    for (int i = 0; i < args.size(); i++) {
      checkType(type.argType(i), args.get(i));
    }
    return new Ast.Tuple(ImmutableList.copyOf(args), type);
  }

  public Ast.ArrayExp array(ArrayType type, List<? extends Ast.Exp> args) {
    args.forEach(arg -> checkType(type.elementType, arg));
    return new Ast.ArrayExp(ImmutableList.copyOf(args), type);
  }

  public Ast.StructExp struct(StructType type, List<? extends Ast.Exp> args) {
    final List<Type> fieldTypes = type.fieldTypes.values().asList();
    checkArgument(args.size() == fieldTypes.size());
    for (int i = 0; i < args.size(); i++) {
      checkType(fieldTypes.get(i), args.get(i));
    }
    return new Ast.StructExp(type, ImmutableList.copyOf(args));
  }

  public Ast.EnumExp enumVariant(EnumType type, String variant,
      List<? extends Ast.Exp> args) {
    final List<Type> types = type.variants.get(variant);
    checkArgument(types != null, "unknown variant %s", variant);
    checkArgument(args.size() == types.size());
    for (int i = 0; i < args.size(); i++) {
      checkType(types.get(i), args.get(i));
    }
    return new Ast.EnumExp(type, variant, ImmutableList.copyOf(args));
  }

  public Ast.Wrap boxNew(BoxType type, Ast.Exp a) {
    checkType(type.elementType, a);
    return new Ast.Wrap(Op.BOX_NEW, a, type);
  }

  public Ast.Wrap some(OptionType type, Ast.Exp a) {
    checkType(type.elementType, a);
    return new Ast.Wrap(Op.SOME, a, type);
  }

  public Ast.NoneExp none(OptionType type) {
    return new Ast.NoneExp(type);
  }

  public Ast.Wrap ok(ResultType type, Ast.Exp a) {
    checkType(type.okType, a);
    return new Ast.Wrap(Op.OK, a, type);
  }

  public Ast.Wrap err(ResultType type, Ast.Exp a) {
    checkType(type.errType, a);
    return new Ast.Wrap(Op.ERR, a, type);
  }

  // access to components

  public Ast.TupleField tupleField(Ast.Exp a, int index) {
    checkArgument(a.type instanceof TupleType);
    return new Ast.TupleField(a, index, ((TupleType) a.type).argType(index));
  }

  public Ast.FieldAccess fieldAccess(Ast.Exp a, String field) {
    checkArgument(a.type instanceof StructType);
    final Type type = ((StructType) a.type).fieldTypes.get(field);
    checkArgument(type != null, "unknown field %s", field);
    return new Ast.FieldAccess(a, field, type);
  }

  public Ast.Index index(Ast.Exp array, Ast.Exp index) {
    return index(Op.INDEX, array, index);
  }

  /** Creates an index that is reduced modulo the array's size. */
  public Ast.Index safeIndex(Ast.Exp array, Ast.Exp index) {
    return index(Op.SAFE_INDEX, array, index);
  }

  private Ast.Index index(Op op, Ast.Exp array, Ast.Exp index) {
    checkArgument(array.type instanceof ArrayType);
    checkType(PrimitiveType.USIZE, index);
    return new Ast.Index(op, array, index,
        ((ArrayType) array.type).elementType);
  }

  /** Creates "a.unwrap()" on an option or result. */
  public Ast.Unwrap unwrap(Ast.Exp a) {
    if (a.type instanceof OptionType) {
      return new Ast.Unwrap(Op.OPTION_UNWRAP, a, null,
          ((OptionType) a.type).elementType);
    }
    checkArgument(a.type instanceof ResultType, "cannot unwrap %s", a.type);
    return new Ast.Unwrap(Op.RESULT_UNWRAP, a, null,
        ((ResultType) a.type).okType);
  }

  /** Creates "a.unwrap_or(fallback)" on an option or result. */
  public Ast.Unwrap unwrapOr(Ast.Exp a, Ast.Exp fallback) {
    final Type type;
    if (a.type instanceof OptionType) {
      type = ((OptionType) a.type).elementType;
    } else {
      checkArgument(a.type instanceof ResultType, "cannot unwrap %s", a.type);
      type = ((ResultType) a.type).okType;
    }
    checkType(type, fallback);
    return new Ast.Unwrap(Op.UNWRAP_OR, a, fallback, type);
  }

  // control flow

  public Ast.If ifThenElse(Ast.Exp condition, Ast.Block ifTrue,
      Ast.Block ifFalse) {
    return new Ast.If(condition, ifTrue, ifFalse);
  }

  public Ast.Match match(Ast.Exp exp, List<Ast.MatchArm> arms) {
    final Type type = arms.get(0).exp.type;
    arms.forEach(arm -> checkType(type, arm.exp));
    return new Ast.Match(exp, arms, type);
  }

  public Ast.MatchArm matchArm(Ast.Pat pat, Ast.Exp exp) {
    return new Ast.MatchArm(pat, exp);
  }

  public Ast.Block block(List<? extends Ast.Stmt> stmts,
      Ast.@Nullable Exp tail) {
    return new Ast.Block(ImmutableList.copyOf(stmts), tail);
  }

  public Ast.Call call(Identifier function, List<Type> paramTypes,
      List<? extends Ast.Exp> args) {
    checkArgument(paramTypes.size() == args.size(),
        "%s expects %s arguments", function.name, paramTypes.size());
    for (int i = 0; i < args.size(); i++) {
      checkType(paramTypes.get(i), args.get(i));
    }
    return new Ast.Call(function, ImmutableList.copyOf(args));
  }

  // patterns

  public Ast.IdPat idPat(Identifier identifier) {
    return new Ast.IdPat(identifier);
  }

  public Ast.LiteralPat literalPat(Ast.Literal literal) {
    return new Ast.LiteralPat(literal);
  }

  public Ast.WildcardPat wildcardPat() {
    return new Ast.WildcardPat();
  }

  public Ast.ConPat conPat(String constructor, List<? extends Ast.Pat> args) {
    return new Ast.ConPat(constructor, ImmutableList.copyOf(args));
  }

  public Ast.Con0Pat con0Pat(String constructor) {
    return new Ast.Con0Pat(constructor);
  }

  // statements

  public Ast.Let let(Identifier id, Ast.Exp exp) {
    checkArgument(!(id.mutable && id.type instanceof RefType),
        "reference %s must not be mutable", id.name);
    return new Ast.Let(id, exp);
  }

  public Ast.Assign assign(Identifier id, Ast.Exp exp) {
    return new Ast.Assign(id, exp);
  }

  public Ast.ExpStmt expStmt(Ast.Exp exp) {
    return new Ast.ExpStmt(exp);
  }

  public Ast.Hash hash(Identifier identifier) {
    return new Ast.Hash(id(identifier));
  }

  public Ast.ForLoop forLoop(int count, Ast.Block body) {
    return new Ast.ForLoop(count, body);
  }

  public Ast.Conditional conditional(Ast.Exp condition, Ast.Block ifTrue,
      Ast.@Nullable Block ifFalse) {
    return new Ast.Conditional(condition, ifTrue, ifFalse);
  }

  // declarations

  public Ast.StructDecl structDecl(StructType structType) {
    return new Ast.StructDecl(structType);
  }

  public Ast.EnumDecl enumDecl(EnumType enumType) {
    return new Ast.EnumDecl(enumType);
  }

  public Ast.FunDecl funDecl(Identifier function, List<Identifier> params,
      Ast.Block body) {
    checkArgument(function.kind == Identifier.Kind.FUNCTION);
    checkArgument(!function.type.containsReference(),
        "function %s must not return a reference", function.name);
    return new Ast.FunDecl(function, params, body);
  }

  public Ast.Program program(List<? extends Ast.Decl> decls, Ast.FunDecl main,
      List<ExternalParameter> externals, long seed) {
    return new Ast.Program(ImmutableList.copyOf(decls), main, externals,
        seed);
  }
}

// End AstBuilder.java
