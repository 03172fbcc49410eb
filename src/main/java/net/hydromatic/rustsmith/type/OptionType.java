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

import static java.util.Objects.requireNonNull;

import net.hydromatic.rustsmith.ast.Op;

/** Optional type, "{@code Option<T>}". */
public class OptionType extends BaseType {
  public final Type elementType;

  OptionType(Type elementType) {
    super(Op.OPTION_TYPE);
    this.elementType = requireNonNull(elementType);
  }

  @Override
  public String moniker() {
    return "Option<" + elementType.moniker() + ">";
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

// End OptionType.java
