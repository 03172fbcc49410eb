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
package net.hydromatic.rustsmith.select;

import net.hydromatic.rustsmith.ast.Op;

/** Kinds of statement. */
public enum StatementKind implements Production {
  LET(Op.LET, true),
  ASSIGN(Op.ASSIGN, false),
  /** Call of a function, for its effect. */
  EXPRESSION(Op.EXPRESSION_STATEMENT, false),
  /** Feeds a variable into the program's hasher; only in "main". */
  HASH(Op.HASH, false),
  FOR_LOOP(Op.FOR_LOOP, false),
  IF_STATEMENT(Op.IF_STATEMENT, false);

  private final Op op;
  private final boolean essential;

  StatementKind(Op op, boolean essential) {
    this.op = op;
    this.essential = essential;
  }

  @Override
  public Op op() {
    return op;
  }

  @Override
  public boolean essential() {
    return essential;
  }
}

// End StatementKind.java
