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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.rustsmith.ast.Op;

/**
 * User-defined struct type.
 *
 * <p>Struct types are nominal: two struct types are equal if they have the
 * same name. Fields are kept in declaration order.
 */
public class StructType extends BaseType {
  public final String name;
  public final ImmutableMap<String, Type> fieldTypes;

  StructType(String name, Map<String, ? extends Type> fieldTypes) {
    super(Op.STRUCT_TYPE);
    this.name = requireNonNull(name);
    this.fieldTypes = ImmutableMap.copyOf(fieldTypes);
    checkArgument(!this.fieldTypes.isEmpty(), "struct %s has no fields", name);
    checkArgument(
        this.fieldTypes.values().stream().noneMatch(Type::containsReference),
        "struct %s has a reference field",
        name);
  }

  @Override
  public String moniker() {
    return name;
  }

  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }
}

// End StructType.java
