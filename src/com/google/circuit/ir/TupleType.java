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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/** An ordered, heterogeneous product of element types. */
public final class TupleType extends Type {
  private final ImmutableList<Type> elementTypes;
  private final int[] leafOffsets;

  TupleType(ImmutableList<Type> elementTypes) {
    this.elementTypes = elementTypes;
    this.leafOffsets = new int[elementTypes.size()];
    int offset = 0;
    for (int i = 0; i < elementTypes.size(); i++) {
      leafOffsets[i] = offset;
      offset += elementTypes.get(i).getLeafCount();
    }
  }

  public ImmutableList<Type> getElementTypes() {
    return elementTypes;
  }

  public int size() {
    return elementTypes.size();
  }

  @Override
  public boolean isTuple() {
    return true;
  }

  @Override
  public int getChildCount() {
    return elementTypes.size();
  }

  @Override
  public Type getChildType(int i) {
    return elementTypes.get(i);
  }

  @Override
  public int getChildLeafOffset(int i) {
    if (i < 0 || i >= leafOffsets.length) {
      throw new IndexOutOfBoundsException("tuple element " + i + " out of range for " + this);
    }
    return leafOffsets[i];
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof TupleType && ((TupleType) o).elementTypes.equals(elementTypes);
  }

  @Override
  public int hashCode() {
    return 31 * elementTypes.hashCode() + 1;
  }

  @Override
  public String toString() {
    return "(" + Joiner.on(", ").join(elementTypes) + ")";
  }
}
