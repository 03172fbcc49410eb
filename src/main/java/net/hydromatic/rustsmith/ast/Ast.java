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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import net.hydromatic.rustsmith.type.ArrayType;
import net.hydromatic.rustsmith.type.EnumType;
import net.hydromatic.rustsmith.type.OptionType;
import net.hydromatic.rustsmith.type.PrimitiveType;
import net.hydromatic.rustsmith.type.ResultType;
import net.hydromatic.rustsmith.type.StructType;
import net.hydromatic.rustsmith.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Various sub-classes of AST nodes. */
public class Ast {
  private Ast() {}

  /** Appends ".clone()" if a value of the given type cannot be copied. */
  private static AstWriter cloneIfNeeded(AstWriter w, Type type) {
    return type.isCopy() ? w : w.append(".clone()");
  }

  /** Base class for a pattern. */
  public abstract static class Pat extends AstNode {
    Pat(Op op) {
      super(op);
    }

    @Override
    public abstract Pat accept(Shuttle shuttle);
  }

  /** Named pattern, which binds the matched value to a new variable. */
  public static class IdPat extends Pat {
    public final Identifier identifier;

    IdPat(Identifier identifier) {
      super(Op.ID_PAT);
      this.identifier = requireNonNull(identifier);
    }

    @Override
    public Pat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(identifier.name);
    }
  }

  /** Literal pattern, the pattern version of the {@link Literal} expression. */
  public static class LiteralPat extends Pat {
    public final Literal literal;

    LiteralPat(Literal literal) {
      super(Op.LITERAL_PAT);
      this.literal = requireNonNull(literal);
    }

    @Override
    public Pat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(literal, 0, 0);
    }
  }

  /** Wildcard pattern, "_". */
  public static class WildcardPat extends Pat {
    WildcardPat() {
      super(Op.WILDCARD_PAT);
    }

    @Override
    public Pat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("_");
    }
  }

  /**
   * Pattern that is a constructor applied to arguments, e.g. "Some(var3)" or
   * "Enum1::Variant2(var4, _)".
   */
  public static class ConPat extends Pat {
    public final String constructor;
    public final List<Pat> args;

    ConPat(String constructor, List<Pat> args) {
      super(Op.CON_PAT);
      this.constructor = requireNonNull(constructor);
      this.args = ImmutableList.copyOf(args);
      checkArgument(!this.args.isEmpty());
    }

    @Override
    public Pat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(constructor).append("(").appendAll(args).append(")");
    }

    public ConPat copy(List<Pat> args) {
      return this.args.equals(args) ? this : new ConPat(constructor, args);
    }
  }

  /** Pattern that is a constructor with no arguments, e.g. "None". */
  public static class Con0Pat extends Pat {
    public final String constructor;

    Con0Pat(String constructor) {
      super(Op.CON0_PAT);
      this.constructor = requireNonNull(constructor);
    }

    @Override
    public Pat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(constructor);
    }
  }

  /** Base class of expression ASTs. Every expression has a static type. */
  public abstract static class Exp extends AstNode {
    public final Type type;

    Exp(Op op, Type type) {
      super(op);
      this.type = requireNonNull(type);
    }

    @Override
    public abstract Exp accept(Shuttle shuttle);
  }

  /** Literal of type bool, char, String or integer. */
  public static class Literal extends Exp {
    public final Comparable value;

    Literal(Op op, Type type, Comparable value) {
      super(op, type);
      this.value = requireNonNull(value);
    }

    @Override
    public int hashCode() {
      return Objects.hash(value, type);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
              && value.equals(((Literal) o).value)
              && type.equals(((Literal) o).type);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (value instanceof BigInteger
          && ((BigInteger) value).signum() < 0
          && (left > Op.NEGATE.left || right > Op.NEGATE.right)) {
        // "-5i32.wrapping_add(x)" would negate the result of the call
        return w.append("(").appendLiteral(value, type).append(")");
      }
      return w.appendLiteral(value, type);
    }
  }

  /** Reference to a variable or parameter. */
  public static class Id extends Exp {
    public final Identifier identifier;

    Id(Identifier identifier) {
      super(Op.ID, identifier.type);
      this.identifier = identifier;
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return cloneIfNeeded(w.append(identifier.name), type);
    }
  }

  /**
   * Reference to an external parameter. In an executable, its value is read
   * from the command line; in a library, it is an argument of the entry
   * function.
   */
  public static class CliArgument extends Exp {
    public final int ordinal;

    CliArgument(int ordinal, Type type) {
      super(Op.CLI_ARGUMENT, type);
      checkArgument(ordinal >= 0);
      checkArgument(type.isExternal(), "not an external type: %s", type);
      this.ordinal = ordinal;
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (w.isLibrary()) {
        return cloneIfNeeded(w.append("a").append(String.valueOf(ordinal)), type);
      }
      w.append("cli_args[")
          .append(String.valueOf(ordinal + 1))
          .append("].clone()");
      if (type == PrimitiveType.STRING) {
        return w;
      }
      return w.append(".parse::<").append(type).append(">().unwrap()");
    }
  }

  /**
   * Call to a prefix operator: negation, logical not, dereference of a box or
   * a reference, or borrowing a reference.
   */
  public static class PrefixCall extends Exp {
    public final Exp a;

    PrefixCall(Op op, Exp a, Type type) {
      super(op, type);
      this.a = requireNonNull(a);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      switch (op) {
        case REFERENCE:
          // Borrow a temporary, not the variable itself, so that the
          // variable can be assigned while the reference lives.
          return w.append("&{").append(a, 0, 0).append("}");
        case BOX_DEREF:
        case DEREFERENCE:
          if (!type.isCopy()) {
            return w.append("(*").append(a, op.right, 0).append(").clone()");
          }
          return w.prefix(left, op, a, right);
        default:
          return w.prefix(left, op, a, right);
      }
    }

    public PrefixCall copy(Exp a) {
      return this.a.equals(a) ? this : new PrefixCall(op, a, type);
    }
  }

  /** Call to an infix operator. */
  public static class InfixCall extends Exp {
    public final Exp a0;
    public final Exp a1;

    InfixCall(Op op, Exp a0, Exp a1, Type type) {
      super(op, type);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, a0, op, a1, right);
    }

    /**
     * Creates a copy of this {@code InfixCall} with given contents, or {@code
     * this} if the contents are the same.
     */
    public InfixCall copy(Exp a0, Exp a1) {
      return this.a0.equals(a0) && this.a1.equals(a1)
          ? this
          : new InfixCall(op, a0, a1, type);
    }
  }

  /**
   * Call to an integer method that cannot overflow or panic, such as
   * "a.wrapping_add(b)" or "a.checked_div(b).unwrap_or(0i32)".
   */
  public static class MethodCall extends Exp {
    public final Exp receiver;
    public final @Nullable Exp arg;
    /** Value if a checked operation fails; null for wrapping operations. */
    public final @Nullable Exp fallback;

    MethodCall(
        Op op, Exp receiver, @Nullable Exp arg, @Nullable Exp fallback,
        Type type) {
      super(op, type);
      this.receiver = requireNonNull(receiver);
      this.arg = arg;
      this.fallback = fallback;
      checkArgument((op == Op.WRAPPING_NEG) == (arg == null));
      checkArgument(
          (op == Op.CHECKED_DIV || op == Op.CHECKED_REM) == (fallback != null));
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.postfix(left, receiver, op, right, w2 -> {
        w2.append(op.padded).append("(");
        if (arg != null) {
          w2.append(arg, 0, 0);
        }
        w2.append(")");
        if (fallback != null) {
          w2.append(".unwrap_or(").append(fallback, 0, 0).append(")");
        }
      });
    }

    public MethodCall copy(
        Exp receiver, @Nullable Exp arg, @Nullable Exp fallback) {
      return this.receiver.equals(receiver)
              && Objects.equals(this.arg, arg)
              && Objects.equals(this.fallback, fallback)
          ? this
          : new MethodCall(op, receiver, arg, fallback, type);
    }
  }

  /** Widening cast between integer types, "(e as T)". */
  public static class Cast extends Exp {
    public final Exp a;

    Cast(Exp a, Type type) {
      super(Op.CAST, type);
      this.a = requireNonNull(a);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("(")
          .append(a, 0, Op.NEGATE.left)
          .append(" as ")
          .append(type)
          .append(")");
    }

    public Cast copy(Exp a) {
      return this.a.equals(a) ? this : new Cast(a, type);
    }
  }

  /**
   * Checked conversion between integer types, "T::try_from(e).unwrap()", or
   * after reconditioning, "T::try_from(e).unwrap_or(0T)".
   */
  public static class Convert extends Exp {
    public final Exp a;
    public final @Nullable Exp fallback;

    Convert(Op op, Exp a, @Nullable Exp fallback, Type type) {
      super(op, type);
      this.a = requireNonNull(a);
      this.fallback = fallback;
      checkArgument((op == Op.CONVERT_OR) == (fallback != null));
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(type).append("::try_from(").append(a, 0, 0).append(")");
      if (fallback == null) {
        return w.append(".unwrap()");
      }
      return w.append(".unwrap_or(").append(fallback, 0, 0).append(")");
    }

    public Convert copy(Exp a, @Nullable Exp fallback) {
      return this.a.equals(a) && Objects.equals(this.fallback, fallback)
          ? this
          : new Convert(op, a, fallback, type);
    }
  }

  /** Tuple expression, "(a, b)". */
  public static class Tuple extends Exp {
    public final List<Exp> args;

    Tuple(List<Exp> args, Type type) {
      super(Op.TUPLE, type);
      this.args = ImmutableList.copyOf(args);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("(").appendAll(args).append(")");
    }

    public Tuple copy(List<Exp> args) {
      return this.args.equals(args) ? this : new Tuple(args, type);
    }
  }

  /** Array expression, "[a, b, c]". */
  public static class ArrayExp extends Exp {
    public final List<Exp> args;

    ArrayExp(List<Exp> args, ArrayType type) {
      super(Op.ARRAY, type);
      this.args = ImmutableList.copyOf(args);
      checkArgument(this.args.size() == type.size);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("[").appendAll(args).append("]");
    }

    public ArrayExp copy(List<Exp> args) {
      return this.args.equals(args)
          ? this
          : new ArrayExp(args, (ArrayType) type);
    }
  }

  /** Struct expression, "Struct1 { field2: a, field3: b }". */
  public static class StructExp extends Exp {
    /** Field values, in the order the struct declares its fields. */
    public final List<Exp> args;

    StructExp(StructType type, List<Exp> args) {
      super(Op.STRUCT, type);
      this.args = ImmutableList.copyOf(args);
      checkArgument(this.args.size() == type.fieldTypes.size());
    }

    public StructType structType() {
      return (StructType) type;
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(structType().name).append(" { ");
      final Iterator<Exp> args = this.args.iterator();
      int i = 0;
      for (String field : structType().fieldTypes.keySet()) {
        w.append(i++ > 0 ? ", " : "").append(field).append(": ");
        w.append(args.next(), 0, 0);
      }
      return w.append(" }");
    }

    public StructExp copy(List<Exp> args) {
      return this.args.equals(args) ? this : new StructExp(structType(), args);
    }
  }

  /** Enum variant expression, "Enum1::Variant2(a, b)" or "Enum1::Variant3". */
  public static class EnumExp extends Exp {
    public final String variant;
    public final List<Exp> args;

    EnumExp(EnumType type, String variant, List<Exp> args) {
      super(Op.ENUM_VARIANT, type);
      this.variant = requireNonNull(variant);
      this.args = ImmutableList.copyOf(args);
      final List<Type> types = type.variants.get(variant);
      checkArgument(types != null, "unknown variant %s", variant);
      checkArgument(types.size() == this.args.size());
    }

    public EnumType enumType() {
      return (EnumType) type;
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(enumType().qualify(variant));
      if (args.isEmpty()) {
        return w;
      }
      return w.append("(").appendAll(args).append(")");
    }

    public EnumExp copy(List<Exp> args) {
      return this.args.equals(args)
          ? this
          : new EnumExp(enumType(), variant, args);
    }
  }

  /** Reference to a component of a tuple, "a.1". */
  public static class TupleField extends Exp {
    public final Exp a;
    public final int index;

    TupleField(Exp a, int index, Type type) {
      super(Op.TUPLE_FIELD, type);
      this.a = requireNonNull(a);
      this.index = index;
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.postfix(left, a, op, right, w2 ->
          cloneIfNeeded(w2.append(".").append(String.valueOf(index)), type));
    }

    public TupleField copy(Exp a) {
      return this.a.equals(a) ? this : new TupleField(a, index, type);
    }
  }

  /** Reference to a field of a struct, "a.field3". */
  public static class FieldAccess extends Exp {
    public final Exp a;
    public final String field;

    FieldAccess(Exp a, String field, Type type) {
      super(Op.FIELD_ACCESS, type);
      this.a = requireNonNull(a);
      this.field = requireNonNull(field);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.postfix(left, a, op, right, w2 ->
          cloneIfNeeded(w2.append(".").append(field), type));
    }

    public FieldAccess copy(Exp a) {
      return this.a.equals(a) ? this : new FieldAccess(a, field, type);
    }
  }

  /**
   * Array index, "a[i]", or after reconditioning, "a[(i) % 3usize]", which
   * is always in bounds.
   */
  public static class Index extends Exp {
    public final Exp array;
    public final Exp index;

    Index(Op op, Exp array, Exp index, Type type) {
      super(op, type);
      this.array = requireNonNull(array);
      this.index = requireNonNull(index);
      checkArgument(array.type instanceof ArrayType);
      checkArgument(op == Op.INDEX || op == Op.SAFE_INDEX);
    }

    /** Number of elements in the array. */
    public int size() {
      return ((ArrayType) array.type).size;
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.postfix(left, array, op, right, w2 -> {
        if (op == Op.SAFE_INDEX) {
          w2.append("[(").append(index, 0, 0).append(") % ")
              .append(String.valueOf(size())).append("usize]");
        } else {
          w2.append("[").append(index, 0, 0).append("]");
        }
        cloneIfNeeded(w2, type);
      });
    }

    public Index copy(Exp array, Exp index) {
      return this.array.equals(array) && this.index.equals(index)
          ? this
          : new Index(op, array, index, type);
    }
  }

  /**
   * Expression that wraps a value: "Box::new(a)", "Some(a)", "Ok(a)" or
   * "Err(a)".
   */
  public static class Wrap extends Exp {
    public final Exp a;

    Wrap(Op op, Exp a, Type type) {
      super(op, type);
      this.a = requireNonNull(a);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      switch (op) {
        case BOX_NEW:
          w.append("Box::new(");
          break;
        case SOME:
          w.append("Some(");
          break;
        case OK:
        case ERR:
          // The other type parameter cannot be inferred; state both.
          final ResultType resultType = (ResultType) type;
          w.append(op == Op.OK ? "Ok::<" : "Err::<")
              .append(resultType.okType)
              .append(", ")
              .append(resultType.errType)
              .append(">(");
          break;
        default:
          throw new AssertionError("unexpected " + op);
      }
      return w.append(a, 0, 0).append(")");
    }

    public Wrap copy(Exp a) {
      return this.a.equals(a) ? this : new Wrap(op, a, type);
    }
  }

  /** The empty option, "None::<T>". */
  public static class NoneExp extends Exp {
    NoneExp(OptionType type) {
      super(Op.NONE, type);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("None::<")
          .append(((OptionType) type).elementType)
          .append(">");
    }
  }

  /**
   * Unwrap of an option or result, "a.unwrap()", or after reconditioning,
   * "a.unwrap_or(b)".
   */
  public static class Unwrap extends Exp {
    public final Exp a;
    public final @Nullable Exp fallback;

    Unwrap(Op op, Exp a, @Nullable Exp fallback, Type type) {
      super(op, type);
      this.a = requireNonNull(a);
      this.fallback = fallback;
      checkArgument((op == Op.UNWRAP_OR) == (fallback != null));
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.postfix(left, a, op, right, w2 -> {
        if (fallback == null) {
          w2.append(".unwrap()");
        } else {
          w2.append(".unwrap_or(").append(fallback, 0, 0).append(")");
        }
      });
    }

    public Unwrap copy(Op op, Exp a, @Nullable Exp fallback) {
      return this.op == op
              && this.a.equals(a)
              && Objects.equals(this.fallback, fallback)
          ? this
          : new Unwrap(op, a, fallback, type);
    }
  }

  /** "If ... else" expression. */
  public static class If extends Exp {
    public final Exp condition;
    public final Block ifTrue;
    public final Block ifFalse;

    If(Exp condition, Block ifTrue, Block ifFalse) {
      super(Op.IF, ifTrue.type);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
      checkArgument(condition.type == PrimitiveType.BOOL);
      checkArgument(ifTrue.type.equals(ifFalse.type));
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (AstWriter.needParens(left, op, right)) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append("if (")
          .append(condition, 0, 0)
          .append(") ")
          .append(ifTrue, 0, 0)
          .append(" else ")
          .append(ifFalse, 0, 0);
    }

    /**
     * Creates a copy of this {@code If} with given contents, or {@code this}
     * if the contents are the same.
     */
    public If copy(Exp condition, Block ifTrue, Block ifFalse) {
      return this.condition.equals(condition)
              && this.ifTrue.equals(ifTrue)
              && this.ifFalse.equals(ifFalse)
          ? this
          : new If(condition, ifTrue, ifFalse);
    }
  }

  /** "Match" expression. */
  public static class Match extends Exp {
    public final Exp exp;
    public final List<MatchArm> arms;

    Match(Exp exp, List<MatchArm> arms, Type type) {
      super(Op.MATCH, type);
      this.exp = requireNonNull(exp);
      this.arms = ImmutableList.copyOf(arms);
      checkArgument(!this.arms.isEmpty());
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (AstWriter.needParens(left, op, right)) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      w.append("match (").append(exp, 0, 0).append(") ").begin();
      for (MatchArm arm : arms) {
        w.newline().append(arm, 0, 0);
      }
      return w.end();
    }

    public Match copy(Exp exp, List<MatchArm> arms) {
      return this.exp.equals(exp) && this.arms.equals(arms)
          ? this
          : new Match(exp, arms, type);
    }
  }

  /** One arm of a {@link Match}, "pat => exp,". */
  public static class MatchArm extends AstNode {
    public final Pat pat;
    public final Exp exp;

    MatchArm(Pat pat, Exp exp) {
      super(Op.MATCH_ARM);
      this.pat = requireNonNull(pat);
      this.exp = requireNonNull(exp);
    }

    @Override
    public MatchArm accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(pat, 0, 0).append(" => ").append(exp, 0, 0).append(",");
    }

    public MatchArm copy(Pat pat, Exp exp) {
      return this.pat.equals(pat) && this.exp.equals(exp)
          ? this
          : new MatchArm(pat, exp);
    }
  }

  /**
   * Block, "{ stmt; ... tail }". If there is no tail expression, the type is
   * unit.
   */
  public static class Block extends Exp {
    public final List<Stmt> stmts;
    public final @Nullable Exp tail;

    Block(List<Stmt> stmts, @Nullable Exp tail) {
      super(Op.BLOCK, tail == null ? PrimitiveType.UNIT : tail.type);
      this.stmts = ImmutableList.copyOf(stmts);
      this.tail = tail;
    }

    @Override
    public Block accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (AstWriter.needParens(left, op, right)) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      if (stmts.isEmpty() && tail == null) {
        return w.append("{}");
      }
      w.begin();
      for (Stmt stmt : stmts) {
        w.newline().append(stmt, 0, 0);
      }
      if (tail != null) {
        w.newline().append(tail, 0, 0);
      }
      return w.end();
    }

    public Block copy(List<Stmt> stmts, @Nullable Exp tail) {
      return this.stmts.equals(stmts) && Objects.equals(this.tail, tail)
          ? this
          : new Block(stmts, tail);
    }
  }

  /** Call to a function declared earlier in the program. */
  public static class Call extends Exp {
    public final Identifier function;
    public final List<Exp> args;

    Call(Identifier function, List<Exp> args) {
      super(Op.CALL, function.type);
      checkArgument(function.kind == Identifier.Kind.FUNCTION);
      this.function = function;
      this.args = ImmutableList.copyOf(args);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(function.name).append("(").appendAll(args).append(")");
    }

    public Call copy(List<Exp> args) {
      return this.args.equals(args) ? this : new Call(function, args);
    }
  }

  /** Base class of statements. */
  public abstract static class Stmt extends AstNode {
    Stmt(Op op) {
      super(op);
    }

    @Override
    public abstract Stmt accept(Shuttle shuttle);
  }

  /** Variable declaration, "let mut var1: T = exp;". */
  public static class Let extends Stmt {
    public final Identifier id;
    public final Exp exp;

    Let(Identifier id, Exp exp) {
      super(Op.LET);
      this.id = requireNonNull(id);
      this.exp = requireNonNull(exp);
      checkArgument(
          id.type.equals(exp.type), "%s assigned %s", id.type, exp.type);
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(id.mutable ? "let mut " : "let ")
          .append(id.name)
          .append(": ")
          .append(id.type)
          .append(" = ")
          .append(exp, 0, 0)
          .append(";");
    }

    public Let copy(Exp exp) {
      return this.exp.equals(exp) ? this : new Let(id, exp);
    }
  }

  /** Assignment to a mutable variable, "var1 = exp;". */
  public static class Assign extends Stmt {
    public final Identifier id;
    public final Exp exp;

    Assign(Identifier id, Exp exp) {
      super(Op.ASSIGN);
      this.id = requireNonNull(id);
      this.exp = requireNonNull(exp);
      checkArgument(id.mutable, "not mutable: %s", id.name);
      checkArgument(id.type.equals(exp.type));
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(id.name).append(" = ").append(exp, 0, 0).append(";");
    }

    public Assign copy(Exp exp) {
      return this.exp.equals(exp) ? this : new Assign(id, exp);
    }
  }

  /** Expression evaluated for its effect, "fun3(a, b);". */
  public static class ExpStmt extends Stmt {
    public final Exp exp;

    ExpStmt(Exp exp) {
      super(Op.EXPRESSION_STATEMENT);
      this.exp = requireNonNull(exp);
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(exp, 0, 0).append(";");
    }

    public ExpStmt copy(Exp exp) {
      return this.exp.equals(exp) ? this : new ExpStmt(exp);
    }
  }

  /**
   * Statement that feeds a variable into the program's hasher,
   * "var1.hash(hasher);". The hash is the program's observable output.
   */
  public static class Hash extends Stmt {
    public final Id id;

    Hash(Id id) {
      super(Op.HASH);
      this.id = requireNonNull(id);
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      // Hashing borrows, so no clone is needed
      return w.append(id.identifier.name).append(".hash(hasher);");
    }
  }

  /** Loop with a fixed number of iterations, "for _ in 0..3 { ... }". */
  public static class ForLoop extends Stmt {
    public final int count;
    public final Block body;

    ForLoop(int count, Block body) {
      super(Op.FOR_LOOP);
      checkArgument(count >= 0);
      checkArgument(body.type == PrimitiveType.UNIT);
      this.count = count;
      this.body = requireNonNull(body);
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("for _ in 0..")
          .append(String.valueOf(count))
          .append(" ")
          .append(body, 0, 0);
    }

    public ForLoop copy(Block body) {
      return this.body.equals(body) ? this : new ForLoop(count, body);
    }
  }

  /** Conditional statement, "if (c) { ... } else { ... }". */
  public static class Conditional extends Stmt {
    public final Exp condition;
    public final Block ifTrue;
    public final @Nullable Block ifFalse;

    Conditional(Exp condition, Block ifTrue, @Nullable Block ifFalse) {
      super(Op.IF_STATEMENT);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = ifFalse;
      checkArgument(condition.type == PrimitiveType.BOOL);
      checkArgument(ifTrue.type == PrimitiveType.UNIT);
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("if (").append(condition, 0, 0).append(") ");
      w.append(ifTrue, 0, 0);
      if (ifFalse != null) {
        w.append(" else ").append(ifFalse, 0, 0);
      }
      return w;
    }

    public Conditional copy(
        Exp condition, Block ifTrue, @Nullable Block ifFalse) {
      return this.condition.equals(condition)
              && this.ifTrue.equals(ifTrue)
              && Objects.equals(this.ifFalse, ifFalse)
          ? this
          : new Conditional(condition, ifTrue, ifFalse);
    }
  }

  /** Base class of top-level declarations (items). */
  public abstract static class Decl extends AstNode {
    Decl(Op op) {
      super(op);
    }

    @Override
    public abstract Decl accept(Shuttle shuttle);
  }

  /** Declaration of a struct type. */
  public static class StructDecl extends Decl {
    public final StructType structType;

    StructDecl(StructType structType) {
      super(Op.STRUCT_DECL);
      this.structType = requireNonNull(structType);
    }

    @Override
    public Decl accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(DERIVE).newline();
      w.append("struct ").append(structType.name).append(" ").begin();
      structType.fieldTypes.forEach((name, type) ->
          w.newline().append(name).append(": ").append(type).append(","));
      return w.end();
    }
  }

  /** Declaration of an enum type. */
  public static class EnumDecl extends Decl {
    public final EnumType enumType;

    EnumDecl(EnumType enumType) {
      super(Op.ENUM_DECL);
      this.enumType = requireNonNull(enumType);
    }

    @Override
    public Decl accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(DERIVE).newline();
      w.append("enum ").append(enumType.name).append(" ").begin();
      for (Map.Entry<String, List<Type>> e : enumType.variants.entrySet()) {
        w.newline().append(e.getKey());
        if (!e.getValue().isEmpty()) {
          w.append("(");
          int i = 0;
          for (Type type : e.getValue()) {
            w.append(i++ > 0 ? ", " : "").append(type);
          }
          w.append(")");
        }
        w.append(",");
      }
      return w.end();
    }
  }

  /** Declaration of a function. */
  public static class FunDecl extends Decl {
    public final Identifier function;
    public final List<Identifier> params;
    public final Block body;

    FunDecl(Identifier function, List<Identifier> params, Block body) {
      super(Op.FUN_DECL);
      this.function = requireNonNull(function);
      this.params = ImmutableList.copyOf(params);
      this.body = requireNonNull(body);
      checkArgument(
          function.type.equals(body.type),
          "function %s returns %s but body has type %s",
          function.name, function.type, body.type);
    }

    /** Returns the types of the parameters. */
    public List<Type> paramTypes() {
      final ImmutableList.Builder<Type> b = ImmutableList.builder();
      params.forEach(p -> b.add(p.type));
      return b.build();
    }

    @Override
    public FunDecl accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("fn ").append(function.name).append("(");
      int i = 0;
      for (Identifier param : params) {
        w.append(i++ > 0 ? ", " : "")
            .append(param.name)
            .append(": ")
            .append(param.type);
      }
      w.append(")");
      if (function.type != PrimitiveType.UNIT) {
        w.append(" -> ").append(function.type);
      }
      return w.append(" ").append(body, 0, 0);
    }

    public FunDecl copy(Block body) {
      return this.body.equals(body) ? this : new FunDecl(function, params, body);
    }
  }

  /** Attribute on struct and enum declarations. */
  static final String DERIVE = "#[derive(Debug, Clone, PartialEq, Eq, Hash)]";

  /**
   * A whole program: declarations, the entry function, and the external
   * parameters that the entry function reads.
   */
  public static class Program extends AstNode {
    /** Lints that generated code deliberately triggers. */
    static final String ALLOW =
        "#![allow(warnings, unused, arithmetic_overflow, unconditional_panic,"
            + " overflowing_literals)]";

    public final List<Decl> decls;
    /** Entry function. Its body has no tail; it ends by hashing variables. */
    public final FunDecl main;
    public final List<ExternalParameter> externals;
    public final long seed;

    Program(
        List<Decl> decls, FunDecl main, List<ExternalParameter> externals,
        long seed) {
      super(Op.PROGRAM);
      this.decls = ImmutableList.copyOf(decls);
      this.main = requireNonNull(main);
      this.externals = ImmutableList.copyOf(externals);
      this.seed = seed;
      checkArgument(main.params.isEmpty());
      checkArgument(main.body.tail == null);
      for (int i = 0; i < this.externals.size(); i++) {
        checkArgument(this.externals.get(i).ordinal == i);
      }
    }

    @Override
    public Program accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("// Seed: ").append(String.valueOf(seed)).newline();
      w.append(ALLOW).newline();
      w.append("use std::collections::hash_map::DefaultHasher;").newline();
      w.append("use std::convert::TryFrom;").newline();
      if (!w.isLibrary()) {
        w.append("use std::env;").newline();
      }
      w.append("use std::hash::{Hash, Hasher};").newline();
      for (Decl decl : decls) {
        w.newline().append(decl, 0, 0).newline();
      }
      w.newline();
      if (w.isLibrary()) {
        w.append("pub fn ").append(w.libraryName()).append("(");
        for (ExternalParameter external : externals) {
          w.append(external.ordinal > 0 ? ", " : "")
              .append(external.name())
              .append(": ")
              .append(external.type);
        }
        w.append(") -> u64 ").begin();
      } else {
        w.append("fn main() ").begin();
        w.newline()
            .append("let cli_args: Vec<String> = env::args().collect();");
      }
      w.newline().append("let mut s = DefaultHasher::new();");
      w.newline().append("let hasher = &mut s;");
      for (Stmt stmt : main.body.stmts) {
        w.newline().append(stmt, 0, 0);
      }
      if (w.isLibrary()) {
        w.newline().append("hasher.finish()");
      } else {
        w.newline().append("println!(\"{:?}\", hasher.finish());");
      }
      return w.end().newline();
    }

    public Program copy(List<Decl> decls, FunDecl main) {
      return this.decls.equals(decls) && this.main.equals(main)
          ? this
          : new Program(decls, main, externals, seed);
    }
  }
}

// End Ast.java
