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

/** A scalar bit vector of a fixed width. The only kind of leaf. */
public final class BitsType extends Type {
  private final int width;

  BitsType(int width) {
    this.width = width;
  }

  public int getWidth() {
    return width;
  }

  @Override
  public boolean isBits() {
    return true;
  }

  @Override
  public int getChildCount() {
    return 0;
  }

  @Override
  public Type getChildType(int i) {
    throw new IndexOutOfBoundsException("bits type has no children: " + this);
  }

  @Override
  public int getChildLeafOffset(int i) {
    throw new IndexOutOfBoundsException("bits type has no children: " + this);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof BitsType && ((BitsType) o).width == width;
  }

  @Override
  public int hashCode() {
    return width;
  }

  @Override
  public String toString() {
    return "bits[" + width + "]";
  }
}
