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
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A table that contains all types in use in one program, indexed by their
 * moniker (e.g. "{@code Option<i32>}").
 *
 * <p>Also knows the width of the platform-native integer types, and answers
 * the question "can a value of this type be built within a given recursion
 * depth?".
 */
public class TypeSystem {
  final Map<String, Type> typeByName = new HashMap<>();
  private final Map<String, StructType> structs = new LinkedHashMap<>();
  private final Map<String, EnumType> enums = new LinkedHashMap<>();
  private final Map<Type, Integer> minDepths = new HashMap<>();

  /** Width of {@code isize} and {@code usize}, in bits; 32 or 64. */
  public final int usizeWidth;

  public TypeSystem(int usizeWidth) {
    checkArgument(
        usizeWidth == 32 || usizeWidth == 64,
        "usize width must be 32 or 64: %s",
        usizeWidth);
    this.usizeWidth = usizeWidth;
    for (PrimitiveType primitiveType : PrimitiveType.values()) {
      typeByName.put(primitiveType.moniker, primitiveType);
    }
  }

  /** Looks up a type by moniker, returning null if not found. */
  public @Nullable Type lookupOpt(String moniker) {
    return typeByName.get(moniker);
  }

  /** Looks up a type by moniker. */
  public Type lookup(String moniker) {
    final Type type = typeByName.get(moniker);
    if (type == null) {
      throw new AssertionError("unknown type: " + moniker);
    }
    return type;
  }

  /** Returns the canonical instance of a type. */
  @SuppressWarnings("unchecked")
  private <T extends Type> T intern(T type) {
    return (T) typeByName.computeIfAbsent(type.moniker(), m -> type);
  }

  /** Creates an array type. */
  public ArrayType arrayType(Type elementType, int size) {
    return intern(new ArrayType(elementType, size));
  }

  /** Creates a tuple type. */
  public TupleType tupleType(List<? extends Type> argTypes) {
    return intern(new TupleType(argTypes));
  }

  /** Creates a tuple type. */
  public TupleType tupleType(Type... argTypes) {
    return tupleType(ImmutableList.copyOf(argTypes));
  }

  /** Creates a box type. */
  public BoxType boxType(Type elementType) {
    return intern(new BoxType(elementType));
  }

  /** Creates an option type. */
  public OptionType optionType(Type elementType) {
    return intern(new OptionType(elementType));
  }

  /** Creates a result type. */
  public ResultType resultType(Type okType, Type errType) {
    return intern(new ResultType(okType, errType));
  }

  /** Creates a reference type. */
  public RefType refType(Type elementType) {
    return intern(new RefType(elementType));
  }

  /** Declares a struct type. The name must be new. */
  public StructType structType(String name, Map<String, ? extends Type> fields) {
    checkArgument(!typeByName.containsKey(name), "duplicate type %s", name);
    final StructType structType = intern(new StructType(name, fields));
    structs.put(name, structType);
    return structType;
  }

  /** Declares an enum type. The name must be new. */
  public EnumType enumType(
      String name, Map<String, ? extends List<? extends Type>> variants) {
    checkArgument(!typeByName.containsKey(name), "duplicate type %s", name);
    final EnumType enumType = intern(new EnumType(name, variants));
    enums.put(name, enumType);
    return enumType;
  }

  /** Returns the declared struct types, in order of declaration. */
  public List<StructType> structTypes() {
    return ImmutableList.copyOf(structs.values());
  }

  /** Returns the declared enum types, in order of declaration. */
  public List<EnumType> enumTypes() {
    return ImmutableList.copyOf(enums.values());
  }

  /**
   * Returns the least recursion depth at which a value of the given type can
   * be constructed from literals alone.
   *
   * <p>Primitive types have depth 0; so do options (via {@code None}) and
   * enums that have a variant without fields. Other composite types need one
   * more level than their cheapest way to build their components.
   */
  public int minDepth(Type type) {
    final Integer depth = minDepths.get(type);
    if (depth != null) {
      return depth;
    }
    final int d = type.accept(new MinDepthVisitor());
    minDepths.put(type, d);
    return d;
  }

  /**
   * Returns whether a value of the given type can be built within the
   * remaining depth.
   */
  public boolean isConstructible(Type type, int depth) {
    return depth >= 0 && minDepth(type) <= depth;
  }

  /** Computes {@link #minDepth(Type)}. */
  private class MinDepthVisitor extends TypeVisitor<Integer> {
    @Override
    public Integer visit(PrimitiveType primitiveType) {
      return 0;
    }

    @Override
    public Integer visit(ArrayType arrayType) {
      return 1 + minDepth(arrayType.elementType);
    }

    @Override
    public Integer visit(TupleType tupleType) {
      int max = 0;
      for (Type argType : tupleType.argTypes) {
        max = Math.max(max, minDepth(argType));
      }
      return 1 + max;
    }

    @Override
    public Integer visit(BoxType boxType) {
      return 1 + minDepth(boxType.elementType);
    }

    @Override
    public Integer visit(OptionType optionType) {
      return 0;
    }

    @Override
    public Integer visit(ResultType resultType) {
      return 1
          + Math.min(minDepth(resultType.okType), minDepth(resultType.errType));
    }

    @Override
    public Integer visit(StructType structType) {
      int max = 0;
      for (Type type : structType.fieldTypes.values()) {
        max = Math.max(max, minDepth(type));
      }
      return 1 + max;
    }

    @Override
    public Integer visit(EnumType enumType) {
      int min = Integer.MAX_VALUE;
      for (List<Type> types : enumType.variants.values()) {
        min = Math.min(min, variantDepth(types));
      }
      return min;
    }

    @Override
    public Integer visit(RefType refType) {
      return 1 + minDepth(refType.elementType);
    }
  }

  /**
   * Returns the least depth at which an enum variant with the given field
   * types can be constructed.
   */
  public int variantDepth(List<Type> types) {
    if (types.isEmpty()) {
      return 0;
    }
    int max = 0;
    for (Type type : types) {
      max = Math.max(max, minDepth(type));
    }
    return 1 + max;
  }
}

// End TypeSystem.java
