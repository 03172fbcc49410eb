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

import net.hydromatic.rustsmith.type.Type;

/**
 * A named entity in a generated program: a variable, parameter or function.
 *
 * <p>Identifiers are not AST nodes. Nodes refer to them by name; a variable
 * reference node holds the identifier that it references.
 */
public class Identifier {
  public final String name;
  public final Kind kind;
  /**
   * Declared type. For a function, the return type; parameter types are held
   * by {@link Ast.FunDecl}.
   */
  public final Type type;
  /** Nesting level of the scope that defines this identifier. */
  public final int level;
  public final boolean mutable;

  public Identifier(
      String name, Kind kind, Type type, int level, boolean mutable) {
    this.name = requireNonNull(name);
    this.kind = requireNonNull(kind);
    this.type = requireNonNull(type);
    this.level = level;
    this.mutable = mutable;
  }

  @Override
  public String toString() {
    return name + ": " + type;
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Identifier
            && name.equals(((Identifier) o).name)
            && type.equals(((Identifier) o).type);
  }

  /** What kind of thing an identifier names. Determines its prefix. */
  public enum Kind {
    VARIABLE("var"),
    PARAMETER("param"),
    FUNCTION("fun"),
    STRUCT("Struct"),
    FIELD("field"),
    ENUM("Enum"),
    VARIANT("Variant");

    /** Prefix of generated names, e.g. "var" in "var12". */
    public final String prefix;

    Kind(String prefix) {
      this.prefix = prefix;
    }
  }
}

// End Identifier.java
