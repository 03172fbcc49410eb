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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.util.List;
import net.hydromatic.rustsmith.ast.ExternalParameter;

/** Formats the arguments of a generated program. */
public class Arguments {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private Arguments() {}

  /** Returns the arguments as a command line, separated by spaces. */
  public static String commandLine(List<ExternalParameter> externals) {
    final StringBuilder b = new StringBuilder();
    for (ExternalParameter p : externals) {
      if (b.length() > 0) {
        b.append(' ');
      }
      b.append(p.value);
    }
    return b.toString();
  }

  /**
   * Returns the arguments as a JSON array.
   *
   * <p>Strings and chars are JSON strings. So are 128-bit integers, which
   * many JSON readers cannot hold as numbers. Other integers and booleans
   * are bare.
   */
  public static ArrayNode toJson(List<ExternalParameter> externals) {
    final ArrayNode array = MAPPER.createArrayNode();
    for (ExternalParameter p : externals) {
      switch (p.type) {
        case STRING:
        case CHAR:
        case I128:
        case U128:
          array.add(p.value);
          break;
        case BOOL:
          array.add(Boolean.parseBoolean(p.value));
          break;
        default:
          array.add(new BigInteger(p.value));
          break;
      }
    }
    return array;
  }

  /** Returns the input file of a program, {@code {"args": [...]}}. */
  public static String inputFile(List<ExternalParameter> externals) {
    final ObjectNode node = MAPPER.createObjectNode();
    node.set("args", toJson(externals));
    return toString(node);
  }

  /** Writes an object, such as a map or a JSON node, as indented JSON. */
  static String toString(Object o) {
    try {
      return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(o);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException(e);
    }
  }
}

// End Arguments.java
