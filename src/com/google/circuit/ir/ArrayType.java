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

import java.util.Objects;

/** A fixed-size sequence of elements sharing one element type. */
public final class ArrayType extends Type {
  private final int size;
  private final Type elementType;

  ArrayType(int size, Type elementType) {
    this.size = size;
    this.elementType = elementType;
  }

  public int getSize() {
    return size;
  }

  public Type getElementType() {
    return elementType;
  }

  @Override
  public boolean isArray() {
    return true;
  }

  @Override
  public int getChildCount() {
    return size;
  }

  @Override
  public Type getChildType(int i) {
    checkElement(i);
    return elementType;
  }

  @Override
  public int getChildLeafOffset(int i) {
    checkElement(i);
    return i * elementType.getLeafCount();
  }

  private void checkElement(int i) {
    if (i < 0 || i >= size) {
      throw new IndexOutOfBoundsException("array element " + i + " out of range for " + this);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof ArrayType)) {
      return false;
    }
    ArrayType that = (ArrayType) o;
    return size == that.size && elementType.equals(that.elementType);
  }

  @Override
  public int hashCode() {
    return Objects.hash(size, elementType);
  }

  @Override
  public String toString() {
    return elementType + "[" + size + "]";
  }
}
