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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import org.junit.jupiter.api.Test;

/** Tests for types and the type system. */
public class TypeSystemTest {
  @Test
  void testMoniker() {
    final TypeSystem ts = new TypeSystem(64);
    final Type i32 = PrimitiveType.I32;
    assertThat(i32.moniker(), is("i32"));
    assertThat(PrimitiveType.STRING.moniker(), is("String"));
    assertThat(PrimitiveType.UNIT.moniker(), is("()"));
    assertThat(ts.arrayType(PrimitiveType.BOOL, 3).moniker(),
        is("[bool; 3]"));
    assertThat(ts.tupleType(i32, PrimitiveType.CHAR).moniker(),
        is("(i32, char)"));
    assertThat(ts.boxType(ts.optionType(PrimitiveType.U8)).moniker(),
        is("Box<Option<u8>>"));
    assertThat(ts.resultType(i32, PrimitiveType.STRING).moniker(),
        is("Result<i32, String>"));
    assertThat(ts.refType(PrimitiveType.U64).moniker(), is("&u64"));
  }

  @Test
  void testIntern() {
    final TypeSystem ts = new TypeSystem(64);
    final Type t1 = ts.tupleType(PrimitiveType.I8, PrimitiveType.BOOL);
    final Type t2 =
        ts.tupleType(ImmutableList.of(PrimitiveType.I8, PrimitiveType.BOOL));
    assertThat(t1, sameInstance(t2));
    assertThat(ts.lookup("(i8, bool)"), sameInstance(t1));
    assertThat(ts.optionType(t1), sameInstance(ts.optionType(t2)));
  }

  @Test
  void testDeclare() {
    final TypeSystem ts = new TypeSystem(64);
    final StructType s =
        ts.structType("Struct0", ImmutableMap.of("field1", PrimitiveType.I32));
    assertThat(ts.structTypes(), is(ImmutableList.of(s)));
    assertThat(s.fieldTypes.get("field1"), is(PrimitiveType.I32));
    assertThrows(IllegalArgumentException.class, () ->
        ts.structType("Struct0", ImmutableMap.of("field2", PrimitiveType.U8)));

    final EnumType e =
        ts.enumType("Enum2",
            ImmutableMap.of("Variant3", ImmutableList.of(),
                "Variant4", ImmutableList.of(PrimitiveType.BOOL)));
    assertThat(ts.enumTypes(), is(ImmutableList.of(e)));
    assertThat(e.qualify("Variant3"), is("Enum2::Variant3"));
  }

  @Test
  void testMinDepth() {
    final TypeSystem ts = new TypeSystem(64);
    final Type i32 = PrimitiveType.I32;
    final Type array = ts.arrayType(i32, 2);
    assertThat(ts.minDepth(i32), is(0));
    assertThat(ts.minDepth(array), is(1));
    assertThat(ts.minDepth(ts.tupleType(i32, array)), is(2));
    // None is a literal; Err needs only the cheaper side
    assertThat(ts.minDepth(ts.optionType(array)), is(0));
    assertThat(ts.minDepth(ts.resultType(array, PrimitiveType.BOOL)), is(1));
    assertThat(ts.minDepth(ts.boxType(i32)), is(1));
    assertThat(ts.minDepth(ts.refType(i32)), is(1));

    final StructType s =
        ts.structType("Struct0", ImmutableMap.of("field1", ts.boxType(i32)));
    assertThat(ts.minDepth(s), is(2));
    final EnumType e1 =
        ts.enumType("Enum2",
            ImmutableMap.of("Variant3", ImmutableList.of(s),
                "Variant4", ImmutableList.of()));
    assertThat(ts.minDepth(e1), is(0));
    final EnumType e2 =
        ts.enumType("Enum5",
            ImmutableMap.of("Variant6", ImmutableList.of(i32)));
    assertThat(ts.minDepth(e2), is(1));

    assertThat(ts.isConstructible(s, 2), is(true));
    assertThat(ts.isConstructible(s, 1), is(false));
    assertThat(ts.isConstructible(i32, 0), is(true));
    assertThat(ts.isConstructible(i32, -1), is(false));
  }

  @Test
  void testUsizeWidth() {
    assertThat(PrimitiveType.USIZE.bits(32), is(32));
    assertThat(PrimitiveType.USIZE.bits(64), is(64));
    assertThat(PrimitiveType.USIZE.maxValue(32),
        is(BigInteger.valueOf(4294967295L)));
    assertThat(PrimitiveType.ISIZE.minValue(64),
        is(BigInteger.valueOf(Long.MIN_VALUE)));
    assertThat(PrimitiveType.I8.minValue(64), is(BigInteger.valueOf(-128)));
    assertThat(PrimitiveType.U8.maxValue(64), is(BigInteger.valueOf(255)));
    assertThat(PrimitiveType.U128.maxValue(64),
        is(BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE)));
    assertThrows(IllegalArgumentException.class, () -> new TypeSystem(16));
  }

  @Test
  void testWiden() {
    assertThat(PrimitiveType.I32.canWidenFrom(PrimitiveType.I8), is(true));
    assertThat(PrimitiveType.I32.canWidenFrom(PrimitiveType.U16), is(true));
    assertThat(PrimitiveType.I32.canWidenFrom(PrimitiveType.U32), is(false));
    assertThat(PrimitiveType.U32.canWidenFrom(PrimitiveType.I8), is(false));
    assertThat(PrimitiveType.I32.canWidenFrom(PrimitiveType.I32), is(false));
    // usize may be 32 or 64 bits wide, so widening must suit both
    assertThat(PrimitiveType.USIZE.canWidenFrom(PrimitiveType.U16),
        is(true));
    assertThat(PrimitiveType.USIZE.canWidenFrom(PrimitiveType.U32),
        is(false));
    assertThat(PrimitiveType.I64.canWidenFrom(PrimitiveType.ISIZE),
        is(false));
    assertThat(PrimitiveType.I128.canWidenFrom(PrimitiveType.ISIZE),
        is(true));
  }

  @Test
  void testCopy() {
    final TypeSystem ts = new TypeSystem(64);
    assertThat(PrimitiveType.I32.isCopy(), is(true));
    assertThat(PrimitiveType.STRING.isCopy(), is(false));
    assertThat(ts.tupleType(PrimitiveType.I32, PrimitiveType.STRING).isCopy(),
        is(false));
    assertThat(ts.arrayType(PrimitiveType.CHAR, 2).isCopy(), is(true));
    assertThat(ts.boxType(PrimitiveType.I32).isCopy(), is(false));
    assertThat(ts.refType(PrimitiveType.STRING).isCopy(), is(true));
    assertThat(ts.optionType(ts.refType(PrimitiveType.I8)).containsReference(),
        is(true));
  }
}

// End TypeSystemTest.java
