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
package net.hydromatic.rustsmith.compile;

import net.hydromatic.rustsmith.ast.Identifier;

/**
 * Generates unique names.
 *
 * <p>All kinds share one counter, so "var3" and "fun3" are never both
 * generated in the same attempt. Call {@link #reset()} at the start of each
 * attempt.
 */
public class NameGenerator {
  private int id = 0;

  /** Generates a name that is unique in this program, e.g. "var12". */
  public String next(Identifier.Kind kind) {
    return kind.prefix + id++;
  }

  /** Restarts numbering, for a new program. */
  public void reset() {
    id = 0;
  }
}

// End NameGenerator.java
