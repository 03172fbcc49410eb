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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.rustsmith.ast.Op;

/**
 * User-defined enum type.
 *
 * <p>Each variant has zero or more positional fields; a variant with no
 * fields is written "{@code Enum3::Variant4}", a variant with fields
 * "{@code Enum3::Variant5(1i32, true)}".
 */
public class EnumType extends BaseType {
  public final String name;
  public final ImmutableMap<String, List<Type>> variants;

  EnumType(String name, Map<String, ? extends List<? extends Type>> variants) {
    super(Op.ENUM_TYPE);
    this.name = requireNonNull(name);
    final ImmutableMap.Builder<String, List<Type>> b = ImmutableMap.builder();
    variants.forEach((k, v) -> b.put(k, ImmutableList.copyOf(v)));
    this.variants = b.build();
    checkArgument(!this.variants.isEmpty(), "enum %s has no variants", name);
  }

  @Override
  public String moniker() {
    return name;
  }

  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  /** Returns the qualified name of a variant, e.g. "{@code Enum3::Variant4}". */
  public String qualify(String variant) {
    return name + "::" + variant;
  }
}

// End EnumType.java
