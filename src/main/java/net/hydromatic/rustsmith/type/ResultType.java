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

/** Result type, "{@code Result<T, E>}". */
public class ResultType extends BaseType {
  public final Type okType;
  public final Type errType;

  ResultType(Type okType, Type errType) {
    super(Op.RESULT_TYPE);
    this.okType = requireNonNull(okType);
    this.errType = requireNonNull(errType);
  }

  @Override
  public String moniker() {
    return "Result<" + okType.moniker() + ", " + errType.moniker() + ">";
  }

  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public boolean isCopy() {
    return okType.isCopy() && errType.isCopy();
  }

  @Override
  public boolean containsReference() {
    return okType.containsReference() || errType.containsReference();
  }
}

// End ResultType.java
