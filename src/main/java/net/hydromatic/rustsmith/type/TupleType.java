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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import net.hydromatic.rustsmith.ast.Op;

/** The type of a tuple value, e.g. "{@code (i32, bool)}". */
public class TupleType extends BaseType {
  public final List<Type> argTypes;

  TupleType(List<? extends Type> argTypes) {
    super(Op.TUPLE_TYPE);
    this.argTypes = ImmutableList.copyOf(argTypes);
    checkArgument(this.argTypes.size() >= 2, "tuple needs two or more args");
  }

  @Override
  public String moniker() {
    return argTypes.stream()
        .map(Type::moniker)
        .collect(Collectors.joining(", ", "(", ")"));
  }

  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  public Type argType(int i) {
    return argTypes.get(i);
  }

  @Override
  public boolean isCopy() {
    return argTypes.stream().allMatch(Type::isCopy);
  }

  @Override
  public boolean containsReference() {
    return argTypes.stream().anyMatch(Type::containsReference);
  }
}

// End TupleType.java
