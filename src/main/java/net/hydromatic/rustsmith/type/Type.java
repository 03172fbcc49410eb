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

import net.hydromatic.rustsmith.ast.Op;

/** Type of a Rust value. */
public interface Type {
  /**
   * The type as written in Rust source, e.g. "{@code i32}", "{@code
   * Box<Option<u8>>}", "{@code [bool; 3]}", "{@code Struct4}".
   *
   * <p>Two types are equal if and only if their monikers are equal.
   */
  String moniker();

  /** Type operator. */
  Op op();

  <R> R accept(TypeVisitor<R> typeVisitor);

  /**
   * Whether values of this type are {@code Copy} in Rust; that is, whether a
   * variable of this type can be used more than once without cloning.
   */
  default boolean isCopy() {
    return false;
  }

  /** Whether this is one of the integer types. */
  default boolean isInteger() {
    return false;
  }

  /** Whether this is a signed integer type. */
  default boolean isSigned() {
    return false;
  }

  /**
   * Whether a value of this type can be supplied on the command line, and
   * therefore whether it can be the type of an external parameter.
   */
  default boolean isExternal() {
    return false;
  }

  /** Whether this type is, or contains, a reference. */
  default boolean containsReference() {
    return false;
  }
}

// End Type.java
