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
package net.hydromatic.rustsmith.type;

import java.util.List;

/**
 * Visitor over {@link Type} objects.
 *
 * @param <R> return type from {@code visit} methods
 * @see Type#accept(TypeVisitor)
 */
public class TypeVisitor<R> {
  /** Visits a {@link PrimitiveType}. */
  public R visit(PrimitiveType primitiveType) {
    return null;
  }

  /** Visits an {@link ArrayType}. */
  public R visit(ArrayType arrayType) {
    return arrayType.elementType.accept(this);
  }

  /** Visits a {@link TupleType}. */
  public R visit(TupleType tupleType) {
    R r = null;
    for (Type argType : tupleType.argTypes) {
      r = argType.accept(this);
    }
    return r;
  }

  /** Visits a {@link BoxType}. */
  public R visit(BoxType boxType) {
    return boxType.elementType.accept(this);
  }

  /** Visits an {@link OptionType}. */
  public R visit(OptionType optionType) {
    return optionType.elementType.accept(this);
  }

  /** Visits a {@link ResultType}. */
  public R visit(ResultType resultType) {
    resultType.okType.accept(this);
    return resultType.errType.accept(this);
  }

  /** Visits a {@link StructType}. */
  public R visit(StructType structType) {
    R r = null;
    for (Type type : structType.fieldTypes.values()) {
      r = type.accept(this);
    }
    return r;
  }

  /** Visits an {@link EnumType}. */
  public R visit(EnumType enumType) {
    R r = null;
    for (List<Type> types : enumType.variants.values()) {
      for (Type type : types) {
        r = type.accept(this);
      }
    }
    return r;
  }

  /** Visits a {@link RefType}. */
  public R visit(RefType refType) {
    return refType.elementType.accept(this);
  }
}

// End TypeVisitor.java
