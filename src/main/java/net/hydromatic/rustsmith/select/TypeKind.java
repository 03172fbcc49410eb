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

/** Kinds of type that can be chosen for a variable, field or parameter. */
public enum TypeKind implements Production {
  BOOL(Op.PRIMITIVE_TYPE, true),
  CHAR(Op.PRIMITIVE_TYPE, true),
  /** One of the integer types, chosen uniformly. */
  INTEGER(Op.PRIMITIVE_TYPE, true),
  STRING(Op.PRIMITIVE_TYPE, true),
  ARRAY(Op.ARRAY_TYPE, false),
  TUPLE(Op.TUPLE_TYPE, false),
  BOX(Op.BOX_TYPE, false),
  OPTION(Op.OPTION_TYPE, false),
  RESULT(Op.RESULT_TYPE, false),
  /** A struct type declared earlier in the program. */
  STRUCT(Op.STRUCT_TYPE, false),
  /** An enum type declared earlier in the program. */
  ENUM(Op.ENUM_TYPE, false),
  REFERENCE(Op.REF_TYPE, false);

  private final Op op;
  private final boolean essential;

  TypeKind(Op op, boolean essential) {
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

// End TypeKind.java
