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
package net.hydromatic.rustsmith.run;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.google.common.collect.ImmutableList;
import java.io.File;
import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.rustsmith.ast.ExternalParameter;
import net.hydromatic.rustsmith.type.PrimitiveType;
import org.junit.jupiter.api.Test;

/** Tests for {@link Arguments} and {@link Prop}. */
public class ArgumentsTest {
  private static final List<ExternalParameter> EXTERNALS =
      ImmutableList.of(
          new ExternalParameter(0, PrimitiveType.STRING, "a\"b"),
          new ExternalParameter(1, PrimitiveType.CHAR, "x"),
          new ExternalParameter(2, PrimitiveType.I128,
              "-170141183460469231731687303715884105728"),
          new ExternalParameter(3, PrimitiveType.BOOL, "true"),
          new ExternalParameter(4, PrimitiveType.U64, "18446744073709551615"),
          new ExternalParameter(5, PrimitiveType.I8, "-3"));

  @Test
  void testCommandLine() {
    assertThat(Arguments.commandLine(EXTERNALS),
        is("a\"b x -170141183460469231731687303715884105728 true "
            + "18446744073709551615 -3"));
    assertThat(Arguments.commandLine(ImmutableList.of()), is(""));
  }

  @Test
  void testJson() {
    final ArrayNode array = Arguments.toJson(EXTERNALS);
    assertThat(array.toString(),
        is("[\"a\\\"b\",\"x\",\"-170141183460469231731687303715884105728\","
            + "true,18446744073709551615,-3]"));
  }

  @Test
  void testInputFile() throws IOException {
    final JsonNode node =
        new ObjectMapper().readTree(Arguments.inputFile(EXTERNALS));
    final JsonNode args = node.get("args");
    assertThat(args.size(), is(6));
    assertThat(args.get(0).asText(), is("a\"b"));
    // a char is quoted, so that the file is valid JSON
    assertThat(args.get(1).isTextual(), is(true));
    assertThat(args.get(1).asText(), is("x"));
    assertThat(args.get(2).isTextual(), is(true));
    assertThat(args.get(3).isBoolean(), is(true));
    assertThat(args.get(4).isBigInteger(), is(true));
    assertThat(args.get(5).asInt(), is(-3));
  }

  @Test
  void testProp() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThat(Prop.COUNT.intValue(map), is(100));
    assertThat(Prop.THREADS.intValue(map), is(8));
    assertThat(Prop.DIRECTORY.fileValue(map), is(new File("outRust")));
    assertThat(Prop.SEED.longValue(map) == null, is(true));

    Prop.COUNT.setLenient(map, " 12 ");
    Prop.SEED.setLenient(map, "-4");
    Prop.ZKVM.setLenient(map, "TRUE");
    assertThat(Prop.COUNT.intValue(map), is(12));
    assertThat(Prop.SEED.longValue(map), is(-4L));
    assertThat(Prop.ZKVM.booleanValue(map), is(true));

    assertThrows(IllegalArgumentException.class,
        () -> Prop.COUNT.setLenient(map, "many"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.PRINT.setLenient(map, "yes"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.COUNT.set(map, null));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.COUNT.booleanValue(map));
    assertThat(Prop.lookup("usizeWidth"), is(Prop.USIZE_WIDTH));
    assertThat(Prop.lookup("USIZE_WIDTH"), is(Prop.USIZE_WIDTH));
    assertThrows(IllegalArgumentException.class, () -> Prop.lookup("x"));
  }
}

// End ArgumentsTest.java
