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

import static java.util.Objects.requireNonNull;

import com.google.common.base.Strings;
import java.math.BigInteger;
import java.util.List;
import java.util.function.Consumer;
import net.hydromatic.rustsmith.type.PrimitiveType;
import net.hydromatic.rustsmith.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Context for writing an AST out as Rust source text. */
public class AstWriter {
  private final StringBuilder b = new StringBuilder();
  private int indent = 0;
  private final @Nullable String libraryName;

  /** Creates a writer that renders a program as an executable. */
  public AstWriter() {
    this(null);
  }

  private AstWriter(@Nullable String libraryName) {
    this.libraryName = libraryName;
  }

  /**
   * Creates a writer that renders a program as a library function with the
   * given name. The function takes the external parameters as arguments
   * ({@code a0}, {@code a1}, ...) and returns the hash of the program's
   * state as a {@code u64}.
   */
  public static AstWriter library(String name) {
    return new AstWriter(requireNonNull(name));
  }

  /** Whether this writer renders programs as library functions. */
  public boolean isLibrary() {
    return libraryName != null;
  }

  /** Name of the library function. Throws if not in library mode. */
  public String libraryName() {
    if (libraryName == null) {
      throw new IllegalStateException("not in library mode");
    }
    return libraryName;
  }

  /** Appends a string to the output. */
  public AstWriter append(String s) {
    b.append(s);
    return this;
  }

  public AstWriter append(AstNode node, int left, int right) {
    return node.unparse(this, left, right);
  }

  /** Appends a type. */
  public AstWriter append(Type type) {
    return append(type.moniker());
  }

  /** Appends a list of nodes, separated by commas. */
  public AstWriter appendAll(List<? extends AstNode> nodes) {
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) {
        append(", ");
      }
      nodes.get(i).unparse(this, 0, 0);
    }
    return this;
  }

  /** Starts a new line, at the current indentation. */
  public AstWriter newline() {
    b.append('\n').append(Strings.repeat("    ", indent));
    return this;
  }

  /** Appends "{" and increases indentation. */
  public AstWriter begin() {
    ++indent;
    return append("{");
  }

  /** Decreases indentation, and appends "}" on a new line. */
  public AstWriter end() {
    --indent;
    return newline().append("}");
  }

  /** Appends a call to an infix operator. */
  public AstWriter infix(int left, AstNode a0, Op op, AstNode a1, int right) {
    if (needParens(left, op, right)) {
      return append("(").infix(0, a0, op, a1, 0).append(")");
    }
    // Rust rejects "a == b == c"; force parentheses around an operand of the
    // same precedence.
    a0.unparse(this, left, op.nonAssociative ? op.left + 2 : op.left);
    append(op.padded);
    a1.unparse(this, op.right, right);
    return this;
  }

  /** Appends a call to a prefix operator. */
  public AstWriter prefix(int left, Op op, AstNode a, int right) {
    if (needParens(left, op, right)) {
      return append("(").prefix(0, op, a, 0).append(")");
    }
    append(op.padded);
    a.unparse(this, op.right, right);
    return this;
  }

  /**
   * Appends a receiver followed by a postfix operator, such as a method call,
   * field access or index. {@code suffix} writes what follows the receiver.
   */
  public AstWriter postfix(
      int left, AstNode a, Op op, int right, Consumer<AstWriter> suffix) {
    if (needParens(left, op, right)) {
      return append("(").postfix(0, a, op, 0, suffix).append(")");
    }
    a.unparse(this, left, op.left);
    suffix.accept(this);
    return this;
  }

  /** Whether an operator needs parentheses between the given precedences. */
  public static boolean needParens(int left, Op op, int right) {
    return left > op.left || op.right < right;
  }

  /** Appends a literal value of a given type. */
  public AstWriter appendLiteral(Object value, Type type) {
    if (value instanceof Boolean) {
      return append(value.toString());
    }
    if (value instanceof BigInteger) {
      return append(value.toString()).append(type.moniker());
    }
    if (value instanceof Character) {
      return append("'").append(escape((Character) value, '\'')).append("'");
    }
    if (value instanceof String) {
      if (type != PrimitiveType.STRING) {
        throw new AssertionError("string literal of type " + type);
      }
      final StringBuilder buf = new StringBuilder();
      for (char c : ((String) value).toCharArray()) {
        buf.append(escape(c, '"'));
      }
      return append("String::from(\"").append(buf.toString()).append("\")");
    }
    throw new AssertionError("unknown literal " + value);
  }

  /** Escapes a character for use within a quoted Rust literal. */
  static String escape(char c, char quote) {
    if (c == quote || c == '\\') {
      return "\\" + c;
    }
    if (c < ' ' || c > '~') {
      return String.format("\\u{%x}", (int) c);
    }
    return String.valueOf(c);
  }

  @Override
  public String toString() {
    return b.toString();
  }
}

// End AstWriter.java
