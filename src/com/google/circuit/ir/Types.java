/*
 * Copyright 2024 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.circuit.ir;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Interner;
import com.google.common.collect.Interners;
import java.util.List;

/** Factory methods for interned {@link Type} instances. */
public final class Types {

  private static final Interner<Type> INTERNER = Interners.newWeakInterner();

  public static BitsType bits(int width) {
    checkArgument(width >= 0, "negative bit width %s", width);
    return (BitsType) INTERNER.intern(new BitsType(width));
  }

  public static TupleType tuple(Type... elementTypes) {
    return tuple(ImmutableList.copyOf(elementTypes));
  }

  public static TupleType tuple(List<? extends Type> elementTypes) {
    return (TupleType) INTERNER.intern(new TupleType(ImmutableList.copyOf(elementTypes)));
  }

  public static ArrayType array(int size, Type elementType) {
    checkArgument(size > 0, "arrays must have at least one element, got %s", size);
    return (ArrayType) INTERNER.intern(new ArrayType(size, elementType));
  }

  /**
   * Returns the type reached by following {@code index} from {@code type}.
   *
   * @throws StructuralMismatchException if the index does not address a part of the type.
   */
  public static Type getSubtype(Type type, List<Integer> index) {
    Type current = type;
    for (int i = 0; i < index.size(); i++) {
      int element = index.get(i);
      if (element < 0 || element >= current.getChildCount()) {
        throw new StructuralMismatchException(type, index);
      }
      current = current.getChildType(element);
    }
    return current;
  }

  private Types() {}
}
