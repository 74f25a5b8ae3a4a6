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

import com.google.circuit.ir.LeafTypeTree.ElementVisitor;
import com.google.common.collect.ImmutableList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A read-only window onto the leaves of a {@link LeafTypeTree} rooted at some tree index.
 *
 * <p>Views compare by type and leaf values, so they may be used as hash keys as long as the
 * underlying tree is not modified while they are.
 */
public class LeafTypeTreeView<T> {
  final Type type;
  final List<T> storage;
  final int offset;

  LeafTypeTreeView(Type type, List<T> storage, int offset) {
    this.type = type;
    this.storage = storage;
    this.offset = offset;
  }

  /** Type of the root of this view. */
  public final Type getType() {
    return type;
  }

  /** Number of leaves in this view. */
  public final int size() {
    return type.getLeafCount();
  }

  /** Leaves of this view in declaration order. */
  public final List<T> elements() {
    return Collections.unmodifiableList(storage.subList(offset, offset + size()));
  }

  /** Returns the {@code i}-th leaf in declaration order. */
  public final T getElement(int i) {
    checkLeafNumber(i);
    return storage.get(offset + i);
  }

  /**
   * Returns the value of the leaf at {@code index}, relative to the root of this view.
   *
   * @throws StructuralMismatchException if the index does not address a leaf.
   */
  public final T get(List<Integer> index) {
    Type leafType = Types.getSubtype(type, index);
    if (!leafType.isBits()) {
      throw new StructuralMismatchException(
          "index " + index + " addresses " + leafType + " in " + type + ", not a leaf");
    }
    return storage.get(offset + leafOffset(index));
  }

  /**
   * Returns a view of the tuple or array at {@code index}, relative to the root of this view.
   *
   * @throws StructuralMismatchException if the index addresses a leaf, descends into a leaf or
   *     is out of range.
   */
  public final LeafTypeTreeView<T> getView(List<Integer> index) {
    return new LeafTypeTreeView<>(aggregateSubtype(index), storage, offset + leafOffset(index));
  }

  /**
   * Like {@link #getView}, but {@code index} may also address a single leaf.
   *
   * @throws StructuralMismatchException if the index descends into a leaf or is out of range.
   */
  public final LeafTypeTreeView<T> getSubtree(List<Integer> index) {
    Type subtype = Types.getSubtype(type, index);
    return new LeafTypeTreeView<>(subtype, storage, offset + leafOffset(index));
  }

  /** Visits every leaf with its type and its index relative to the root of this view. */
  public final void forEachIndex(ElementVisitor<? super T> visitor) {
    ImmutableList<Type> leafTypes = type.getLeafTypes();
    ImmutableList<ImmutableList<Integer>> leafIndices = type.getLeafIndices();
    for (int i = 0; i < leafTypes.size(); i++) {
      visitor.visit(leafTypes.get(i), storage.get(offset + i), leafIndices.get(i));
    }
  }

  /** Copies this view into a new, independent tree. */
  public final LeafTypeTree<T> toTree() {
    return LeafTypeTree.copyOf(this);
  }

  final Type aggregateSubtype(List<Integer> index) {
    Type subtype = Types.getSubtype(type, index);
    if (subtype.isBits()) {
      throw new StructuralMismatchException(
          "index " + index + " addresses leaf " + subtype + " in " + type + ", not a sub-tree");
    }
    return subtype;
  }

  final int leafOffset(List<Integer> index) {
    Type current = type;
    int result = 0;
    for (int element : index) {
      result += current.getChildLeafOffset(element);
      current = current.getChildType(element);
    }
    return result;
  }

  final void checkLeafNumber(int i) {
    if (i < 0 || i >= size()) {
      throw new StructuralMismatchException("leaf " + i + " out of range for " + type);
    }
  }

  @Override
  public final boolean equals(Object o) {
    if (!(o instanceof LeafTypeTreeView)) {
      return false;
    }
    LeafTypeTreeView<?> that = (LeafTypeTreeView<?>) o;
    return type.equals(that.type) && elements().equals(that.elements());
  }

  @Override
  public final int hashCode() {
    return Objects.hash(type, elements());
  }

  @Override
  public final String toString() {
    StringBuilder sb = new StringBuilder();
    appendTo(sb, type, offset);
    return sb.toString();
  }

  private void appendTo(StringBuilder sb, Type subtype, int leafOffset) {
    if (subtype.isBits()) {
      sb.append(storage.get(leafOffset));
      return;
    }
    sb.append(subtype.isTuple() ? '(' : '[');
    for (int i = 0; i < subtype.getChildCount(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      appendTo(sb, subtype.getChildType(i), leafOffset + subtype.getChildLeafOffset(i));
    }
    sb.append(subtype.isTuple() ? ')' : ']');
  }
}
