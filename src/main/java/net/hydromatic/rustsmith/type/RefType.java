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

/**
 * Shared reference type, "{@code &T}".
 *
 * <p>References occur only as the type of a local variable or of a function
 * parameter; they never nest, and never occur inside another type.
 */
public class RefType extends BaseType {
  public final Type elementType;

  RefType(Type elementType) {
    super(Op.REF_TYPE);
    this.elementType = requireNonNull(elementType);
    checkArgument(
        !elementType.containsReference(), "nested reference %s", elementType);
  }

  @Override
  public String moniker() {
    return "&" + elementType.moniker();
  }

  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public boolean isCopy() {
    return true;
  }

  @Override
  public boolean containsReference() {
    return true;
  }
}

// End RefType.java
