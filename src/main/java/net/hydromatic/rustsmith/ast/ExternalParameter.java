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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import net.hydromatic.rustsmith.type.PrimitiveType;

/**
 * A value that a generated program reads from outside: a command-line
 * argument of an executable, or an argument of a library function.
 *
 * <p>The value is held as the text that Rust's {@code str::parse} accepts
 * for the type; for a {@code String}, the string itself.
 */
public class ExternalParameter {
  /** Position among the program's parameters, starting at 0. */
  public final int ordinal;
  public final PrimitiveType type;
  public final String value;

  public ExternalParameter(int ordinal, PrimitiveType type, String value) {
    checkArgument(ordinal >= 0);
    checkArgument(type.isExternal(), "not an external type: %s", type);
    this.ordinal = ordinal;
    this.type = requireNonNull(type);
    this.value = requireNonNull(value);
  }

  /** Name of the parameter in a library function, e.g. "a0". */
  public String name() {
    return "a" + ordinal;
  }

  @Override
  public String toString() {
    return name() + ": " + type + " = " + value;
  }
}

// End ExternalParameter.java
