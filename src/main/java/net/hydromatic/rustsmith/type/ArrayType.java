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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import net.hydromatic.rustsmith.ast.Op;

/** Fixed-size array type, e.g. "{@code [i32; 3]}". */
public class ArrayType extends BaseType {
  public final Type elementType;
  public final int size;

  ArrayType(Type elementType, int size) {
    super(Op.ARRAY_TYPE);
    this.elementType = requireNonNull(elementType);
    this.size = size;
    checkArgument(size > 0, "array must not be empty");
  }

  @Override
  public String moniker() {
    return "[" + elementType.moniker() + "; " + size + "]";
  }

  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public boolean isCopy() {
    return elementType.isCopy();
  }

  @Override
  public boolean containsReference() {
    return elementType.containsReference();
  }
}

// End ArrayType.java
