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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Locale;
import net.hydromatic.rustsmith.ast.Op;

/** Primitive type. */
public enum PrimitiveType implements Type {
  BOOL(0, false),
  CHAR(0, false),
  I8(8, true),
  I16(16, true),
  I32(32, true),
  I64(64, true),
  I128(128, true),
  /** Pointer-sized signed integer; width depends on the target. */
  ISIZE(-1, true),
  U8(8, false),
  U16(16, false),
  U32(32, false),
  U64(64, false),
  U128(128, false),
  /** Pointer-sized unsigned integer; width depends on the target. */
  USIZE(-1, false),
  STRING(0, false) {
    @Override
    public boolean isCopy() {
      return false;
    }
  },
  /** The unit type, "()". The type of a block that has no tail expression. */
  UNIT(0, false) {
    @Override
    public boolean isExternal() {
      return false;
    }
  };

  /** All integer types, in declaration order. */
  public static final ImmutableList<PrimitiveType> INTEGERS =
      ImmutableList.copyOf(
          Arrays.stream(values())
              .filter(PrimitiveType::isInteger)
              .iterator());

  /** Types whose values can be compared with "==" and "<". */
  public static final ImmutableList<PrimitiveType> COMPARABLE =
      ImmutableList.copyOf(
          Arrays.stream(values()).filter(t -> t != UNIT).iterator());

  /** The name in Rust, e.g. {@code i32}, {@code String}. */
  public final String moniker;

  /** Width in bits; 0 if not an integer; -1 if pointer-sized. */
  private final int bits;

  private final boolean signed;

  PrimitiveType(int bits, boolean signed) {
    this.bits = bits;
    this.signed = signed;
    this.moniker =
        name().equals("STRING")
            ? "String"
            : name().equals("UNIT") ? "()" : name().toLowerCase(Locale.ROOT);
  }

  @Override
  public String toString() {
    return moniker;
  }

  @Override
  public String moniker() {
    return moniker;
  }

  @Override
  public Op op() {
    return Op.PRIMITIVE_TYPE;
  }

  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public boolean isCopy() {
    return true;
  }

  @Override
  public boolean isInteger() {
    return bits != 0;
  }

  @Override
  public boolean isSigned() {
    return signed;
  }

  @Override
  public boolean isExternal() {
    return true;
  }

  /** Whether this is a 128-bit integer type. */
  public boolean isWide() {
    return bits == 128;
  }

  /**
   * Returns the width in bits of an integer type.
   *
   * @param usizeWidth Width of {@code isize} and {@code usize}, 32 or 64
   */
  public int bits(int usizeWidth) {
    checkArgument(isInteger(), "not an integer type: %s", this);
    return bits < 0 ? usizeWidth : bits;
  }

  /** Returns the least value of an integer type. */
  public BigInteger minValue(int usizeWidth) {
    if (!signed) {
      return BigInteger.ZERO;
    }
    return BigInteger.ONE.shiftLeft(bits(usizeWidth) - 1).negate();
  }

  /** Returns the greatest value of an integer type. */
  public BigInteger maxValue(int usizeWidth) {
    final int width = signed ? bits(usizeWidth) - 1 : bits(usizeWidth);
    return BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE);
  }

  /**
   * Returns whether every value of integer type {@code source} is also a
   * value of this type, whatever the width of {@code usize}.
   */
  public boolean canWidenFrom(PrimitiveType source) {
    if (!isInteger() || !source.isInteger() || source == this) {
      return false;
    }
    // Pointer-sized types are at least 32 and at most 64 bits wide.
    final int sourceMax = source.bits < 0 ? 64 : source.bits;
    final int targetMin = bits < 0 ? 32 : bits;
    if (signed == source.signed) {
      return sourceMax < targetMin;
    }
    return signed && sourceMax < targetMin;
  }
}

// End PrimitiveType.java
