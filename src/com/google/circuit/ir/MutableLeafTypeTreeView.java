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

import com.google.circuit.ir.LeafTypeTree.ElementUpdater;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/** A writable window onto the leaves of a {@link LeafTypeTree}. */
public final class MutableLeafTypeTreeView<T> extends LeafTypeTreeView<T> {

  MutableLeafTypeTreeView(Type type, List<T> storage, int offset) {
    super(type, storage, offset);
  }

  /** Sets the {@code i}-th leaf in declaration order. */
  public void setElement(int i, T value) {
    checkLeafNumber(i);
    storage.set(offset + i, value);
  }

  /**
   * Sets the value of the leaf at {@code index}, relative to the root of this view.
   *
   * @throws StructuralMismatchException if the index does not address a leaf.
   */
  public void set(List<Integer> index, T value) {
    Type leafType = Types.getSubtype(type, index);
    if (!leafType.isBits()) {
      throw new StructuralMismatchException(
          "index " + index + " addresses " + leafType + " in " + type + ", not a leaf");
    }
    storage.set(offset + leafOffset(index), value);
  }

  /**
   * Returns a writable view of the tuple or array at {@code index}.
   *
   * @throws StructuralMismatchException if the index addresses a leaf or is out of range.
   */
  public MutableLeafTypeTreeView<T> getMutableView(List<Integer> index) {
    return new MutableLeafTypeTreeView<>(
        aggregateSubtype(index), storage, offset + leafOffset(index));
  }

  /** Like {@link #getMutableView}, but {@code index} may also address a single leaf. */
  public MutableLeafTypeTreeView<T> getMutableSubtree(List<Integer> index) {
    Type subtype = Types.getSubtype(type, index);
    return new MutableLeafTypeTreeView<>(subtype, storage, offset + leafOffset(index));
  }

  /**
   * Overwrites every leaf of this view with the corresponding leaf of {@code source}.
   *
   * @throws StructuralMismatchException if the two views have different types.
   */
  public void copyFrom(LeafTypeTreeView<? extends T> source) {
    if (!source.getType().equals(type)) {
      throw new StructuralMismatchException(
          "cannot copy " + source.getType() + " into " + type);
    }
    // The source may overlap this view.
    List<T> elements = new ArrayList<>(source.elements());
    for (int i = 0; i < elements.size(); i++) {
      storage.set(offset + i, elements.get(i));
    }
  }

  /** Replaces every leaf with the value returned by {@code updater}, in declaration order. */
  public void updateEachIndex(ElementUpdater<T> updater) {
    ImmutableList<Type> leafTypes = type.getLeafTypes();
    ImmutableList<ImmutableList<Integer>> leafIndices = type.getLeafIndices();
    for (int i = 0; i < leafTypes.size(); i++) {
      storage.set(
          offset + i,
          updater.update(leafTypes.get(i), storage.get(offset + i), leafIndices.get(i)));
    }
  }
}
