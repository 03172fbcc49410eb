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

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.rustsmith.ast.Ast;
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
import net.hydromatic.rustsmith.type.TypeVisitor;

/**
 * Builds the default value of a type: a tree of literals and constructors
 * that is the same every time.
 *
 * <p>Used as the fallback of operations that would otherwise panic.
 */
public class Defaults {
  private Defaults() {}

  /** Returns a new expression that is the default value of a type. */
  public static Ast.Exp of(Type type) {
    return type.accept(new DefaultVisitor());
  }

  /** Returns the literal zero of an integer type. */
  public static Ast.Literal zero(Type type) {
    return ast.intLiteral((PrimitiveType) type, BigInteger.ZERO);
  }

  /** Computes {@link #of(Type)}. */
  private static class DefaultVisitor extends TypeVisitor<Ast.Exp> {
    private List<Ast.Exp> defaults(List<Type> types) {
      final List<Ast.Exp> list = new ArrayList<>();
      types.forEach(type -> list.add(type.accept(this)));
      return list;
    }

    @Override
    public Ast.Exp visit(PrimitiveType primitiveType) {
      switch (primitiveType) {
        case BOOL:
          return ast.boolLiteral(false);
        case CHAR:
          return ast.charLiteral('a');
        case STRING:
          return ast.stringLiteral("");
        case UNIT:
          throw new IllegalArgumentException("unit has no default");
        default:
          return zero(primitiveType);
      }
    }

    @Override
    public Ast.Exp visit(ArrayType arrayType) {
      final List<Ast.Exp> list = new ArrayList<>();
      for (int i = 0; i < arrayType.size; i++) {
        list.add(arrayType.elementType.accept(this));
      }
      return ast.array(arrayType, list);
    }

    @Override
    public Ast.Exp visit(TupleType tupleType) {
      return ast.tuple(tupleType, defaults(tupleType.argTypes));
    }

    @Override
    public Ast.Exp visit(BoxType boxType) {
      return ast.boxNew(boxType, boxType.elementType.accept(this));
    }

    @Override
    public Ast.Exp visit(OptionType optionType) {
      return ast.none(optionType);
    }

    @Override
    public Ast.Exp visit(ResultType resultType) {
      return ast.ok(resultType, resultType.okType.accept(this));
    }

    @Override
    public Ast.Exp visit(StructType structType) {
      return ast.struct(structType,
          defaults(structType.fieldTypes.values().asList()));
    }

    @Override
    public Ast.Exp visit(EnumType enumType) {
      // Prefer a variant with no fields; otherwise the first variant.
      for (Map.Entry<String, List<Type>> e : enumType.variants.entrySet()) {
        if (e.getValue().isEmpty()) {
          return ast.enumVariant(enumType, e.getKey(), ImmutableList.of());
        }
      }
      final Map.Entry<String, List<Type>> first =
          enumType.variants.entrySet().iterator().next();
      return ast.enumVariant(enumType, first.getKey(),
          defaults(first.getValue()));
    }

    @Override
    public Ast.Exp visit(RefType refType) {
      throw new IllegalArgumentException("reference has no default");
    }
  }
}

// End Defaults.java
