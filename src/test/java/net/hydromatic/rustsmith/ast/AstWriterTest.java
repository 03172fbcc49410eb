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

import static net.hydromatic.rustsmith.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.hydromatic.rustsmith.type.OptionType;
import net.hydromatic.rustsmith.type.PrimitiveType;
import net.hydromatic.rustsmith.type.ResultType;
import net.hydromatic.rustsmith.type.StructType;
import net.hydromatic.rustsmith.type.TypeSystem;
import org.junit.jupiter.api.Test;

/** Tests for {@link AstWriter} and the rendering of syntax trees. */
public class AstWriterTest {
  private final TypeSystem ts = new TypeSystem(64);

  private static Ast.Literal i32(long value) {
    return ast.intLiteral(PrimitiveType.I32, value);
  }

  private static Identifier var(String name, PrimitiveType type) {
    return new Identifier(name, Identifier.Kind.VARIABLE, type, 1, false);
  }

  @Test
  void testPrecedence() {
    final Ast.Exp sum = ast.infixCall(Op.PLUS, i32(1), i32(2));
    assertThat(ast.infixCall(Op.PLUS, i32(1),
            ast.infixCall(Op.TIMES, i32(2), i32(3))).toString(),
        is("1i32 + 2i32 * 3i32"));
    assertThat(ast.infixCall(Op.TIMES, sum, i32(3)).toString(),
        is("(1i32 + 2i32) * 3i32"));
    assertThat(ast.infixCall(Op.MINUS, sum, i32(3)).toString(),
        is("1i32 + 2i32 - 3i32"));
    assertThat(ast.infixCall(Op.MINUS, i32(3), sum).toString(),
        is("3i32 - (1i32 + 2i32)"));
  }

  /** Rust does not allow "a == b == c"; comparisons are parenthesized. */
  @Test
  void testComparisonIsNonAssociative() {
    final Ast.Exp eq =
        ast.infixCall(Op.EQ, ast.boolLiteral(true), ast.boolLiteral(false));
    assertThat(ast.infixCall(Op.EQ, eq, ast.boolLiteral(true)).toString(),
        is("(true == false) == true"));
    assertThat(ast.infixCall(Op.NE, ast.boolLiteral(true), eq).toString(),
        is("true != (true == false)"));
    assertThat(ast.infixCall(Op.AND_ALSO, eq, eq).toString(),
        is("true == false && true == false"));
  }

  @Test
  void testNegativeLiteral() {
    assertThat(i32(-5).toString(), is("-5i32"));
    assertThat(
        ast.methodCall(Op.WRAPPING_ADD, i32(-5), i32(3), null).toString(),
        is("(-5i32).wrapping_add(3i32)"));
    assertThat(ast.cast(i32(-5), PrimitiveType.I64).toString(),
        is("(-5i32 as i64)"));
    assertThat(
        ast.methodCall(Op.CHECKED_DIV, i32(7), i32(0), i32(0)).toString(),
        is("7i32.checked_div(0i32).unwrap_or(0i32)"));
  }

  @Test
  void testLiterals() {
    assertThat(ast.charLiteral('\'').toString(), is("'\\''"));
    assertThat(ast.charLiteral('x').toString(), is("'x'"));
    assertThat(ast.stringLiteral("a\"b").toString(),
        is("String::from(\"a\\\"b\")"));
    assertThat(ast.intLiteral(PrimitiveType.USIZE, 3).toString(),
        is("3usize"));
    assertThat(AstWriter.escape('\n', '"'), is("\\u{a}"));
  }

  /** Values that are not Copy are cloned wherever they are read. */
  @Test
  void testClone() {
    final Identifier s = var("var1", PrimitiveType.STRING);
    final Identifier i = var("var2", PrimitiveType.I32);
    assertThat(ast.id(s).toString(), is("var1.clone()"));
    assertThat(ast.id(i).toString(), is("var2"));

    final Ast.Exp tuple =
        ast.tuple(ts.tupleType(PrimitiveType.STRING, PrimitiveType.I32),
            ImmutableList.of(ast.id(s), ast.id(i)));
    assertThat(ast.tupleField(tuple, 0).toString(),
        is("(var1.clone(), var2).0.clone()"));
    assertThat(ast.tupleField(tuple, 1).toString(),
        is("(var1.clone(), var2).1"));

    final Ast.Exp box = ast.boxNew(ts.boxType(PrimitiveType.STRING),
        ast.stringLiteral("a"));
    assertThat(ast.prefixCall(Op.BOX_DEREF, box).toString(),
        is("(*Box::new(String::from(\"a\"))).clone()"));
    assertThat(
        ast.prefixCall(Op.BOX_DEREF,
            ast.boxNew(ts.boxType(PrimitiveType.I32), i32(4))).toString(),
        is("*Box::new(4i32)"));
  }

  @Test
  void testConstructors() {
    final OptionType option = ts.optionType(PrimitiveType.U8);
    assertThat(ast.none(option).toString(), is("None::<u8>"));
    assertThat(
        ast.some(option, ast.intLiteral(PrimitiveType.U8, 1)).toString(),
        is("Some(1u8)"));
    final ResultType result =
        ts.resultType(PrimitiveType.BOOL, PrimitiveType.CHAR);
    assertThat(ast.err(result, ast.charLiteral('e')).toString(),
        containsString("Err::<bool, char>"));
    assertThat(
        ast.reference(ts.refType(PrimitiveType.I32), i32(1)).toString(),
        is("&{1i32}"));

    final StructType struct =
        ts.structType("Struct0",
            ImmutableMap.of("field1", PrimitiveType.I32,
                "field2", PrimitiveType.BOOL));
    final Ast.Exp s =
        ast.struct(struct, ImmutableList.of(i32(1), ast.boolLiteral(true)));
    assertThat(s.toString(), is("Struct0 { field1: 1i32, field2: true }"));
    assertThat(ast.fieldAccess(s, "field2").toString(),
        is("Struct0 { field1: 1i32, field2: true }.field2"));
  }

  @Test
  void testSafeIndex() {
    final Ast.Exp array =
        ast.array(ts.arrayType(PrimitiveType.I32, 3),
            ImmutableList.of(i32(1), i32(2), i32(3)));
    final Ast.Exp index = ast.intLiteral(PrimitiveType.USIZE, 7);
    assertThat(ast.index(array, index).toString(),
        is("[1i32, 2i32, 3i32][7usize]"));
    assertThat(ast.safeIndex(array, index).toString(),
        is("[1i32, 2i32, 3i32][(7usize) % 3usize]"));
  }

  @Test
  void testTypeChecks() {
    assertThrows(IllegalArgumentException.class, () ->
        ast.infixCall(Op.PLUS, i32(1), ast.intLiteral(PrimitiveType.I64, 1)));
    assertThrows(IllegalArgumentException.class, () ->
        ast.prefixCall(Op.NEGATE, ast.intLiteral(PrimitiveType.U8, 1)));
    assertThrows(IllegalArgumentException.class, () ->
        ast.cast(ast.intLiteral(PrimitiveType.I64, 1), PrimitiveType.I32));
    assertThrows(IllegalArgumentException.class, () ->
        ast.infixCall(Op.SHL, i32(1), i32(2)));
  }

  private Ast.Program program() {
    final Identifier v = var("var0", PrimitiveType.I32);
    final ExternalParameter p =
        new ExternalParameter(0, PrimitiveType.I32, "5");
    final Identifier main =
        new Identifier("main", Identifier.Kind.FUNCTION, PrimitiveType.UNIT, 0,
            false);
    final Ast.Block body =
        ast.block(
            ImmutableList.of(ast.let(v, ast.cliArgument(p)), ast.hash(v)),
            null);
    return ast.program(ImmutableList.of(), ast.funDecl(main,
        ImmutableList.of(), body), ImmutableList.of(p), 7L);
  }

  @Test
  void testProgram() {
    final String s = program().toString();
    assertThat(s, containsString("// Seed: 7\n"));
    assertThat(s, containsString("use std::env;\n"));
    assertThat(s,
        containsString("fn main() {\n"
            + "    let cli_args: Vec<String> = env::args().collect();\n"
            + "    let mut s = DefaultHasher::new();\n"
            + "    let hasher = &mut s;\n"
            + "    let var0: i32 = cli_args[1].clone().parse::<i32>()"
            + ".unwrap();\n"
            + "    var0.hash(hasher);\n"
            + "    println!(\"{:?}\", hasher.finish());\n"
            + "}\n"));
  }

  @Test
  void testLibrary() {
    final String s = program().unparse(AstWriter.library("file3"));
    assertThat(s, not(containsString("use std::env;")));
    assertThat(s, not(containsString("cli_args")));
    assertThat(s,
        containsString("pub fn file3(a0: i32) -> u64 {\n"
            + "    let mut s = DefaultHasher::new();\n"
            + "    let hasher = &mut s;\n"
            + "    let var0: i32 = a0;\n"
            + "    var0.hash(hasher);\n"
            + "    hasher.finish()\n"
            + "}\n"));
  }
}

// End AstWriterTest.java
