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
import java.util.ArrayList;
import java.util.List;

/**
 * A container holding exactly one value per leaf of a {@link Type}.
 *
 * <p>Leaves are stored in a flat list in declaration order: tuple elements in order, array
 * elements by increasing index. A leaf or sub-tree is addressed by a tree index, the path of
 * tuple/array positions from the root. Views returned by {@link #getView} and {@link
 * #getMutableView} share storage with the tree.
 *
 * <pre>
 *   type:   (bits[8], bits[4][2])
 *   leaves: {0}, {1, 0}, {1, 1}
 * </pre>
 *
 * @param <T> the value stored at each leaf.
 */
public final class LeafTypeTree<T> {

  /** Receives every leaf of a tree in declaration order. */
  @FunctionalInterface
  public interface ElementVisitor<T> {
    void visit(Type elementType, T element, ImmutableList<Integer> index);
  }

  /** Computes a replacement for every leaf of a tree in declaration order. */
  @FunctionalInterface
  public interface ElementUpdater<T> {
    T update(Type elementType, T element, ImmutableList<Integer> index);
  }

  /** Computes the initial value of a leaf. */
  @FunctionalInterface
  public interface LeafFunction<T> {
    T apply(Type elementType, ImmutableList<Integer> index);
  }

  private final MutableLeafTypeTreeView<T> root;
  private final LeafTypeTreeView<T> readOnlyRoot;

  private LeafTypeTree(Type type, List<T> storage) {
    this.root = new MutableLeafTypeTreeView<>(type, storage, 0);
    this.readOnlyRoot = new LeafTypeTreeView<>(type, storage, 0);
  }

  /** Creates a tree with every leaf of {@code type} set to {@code value}. */
  public static <T> LeafTypeTree<T> create(Type type, T value) {
    int size = type.getLeafCount();
    List<T> storage = new ArrayList<>(size);
    for (int i = 0; i < size; i++) {
      storage.add(value);
    }
    return new LeafTypeTree<>(type, storage);
  }

  /** Creates a tree whose leaves are computed from their type and index. */
  public static <T> LeafTypeTree<T> createFromFunction(Type type, LeafFunction<T> function) {
    ImmutableList<Type> leafTypes = type.getLeafTypes();
    ImmutableList<ImmutableList<Integer>> leafIndices = type.getLeafIndices();
    List<T> storage = new ArrayList<>(leafTypes.size());
    for (int i = 0; i < leafTypes.size(); i++) {
      storage.add(function.apply(leafTypes.get(i), leafIndices.get(i)));
    }
    return new LeafTypeTree<>(type, storage);
  }

  /** Creates a tree from its leaves in declaration order. */
  public static <T> LeafTypeTree<T> createFromList(Type type, List<? extends T> elements) {
    checkArgument(
        elements.size() == type.getLeafCount(),
        "%s has %s leaves but %s elements were given",
        type,
        type.getLeafCount(),
        elements.size());
    return new LeafTypeTree<>(type, new ArrayList<>(elements));
  }

  /** Creates an independent copy of the given tree or sub-tree. */
  public static <T> LeafTypeTree<T> copyOf(LeafTypeTreeView<? extends T> view) {
    return createFromList(view.getType(), view.elements());
  }

  public Type getType() {
    return root.getType();
  }

  /** Number of leaves. */
  public int size() {
    return root.size();
  }

  /** Leaves in declaration order. */
  public List<T> elements() {
    return root.elements();
  }

  /** Returns the value of the leaf at {@code index}. */
  public T get(List<Integer> index) {
    return root.get(index);
  }

  /** Sets the value of the leaf at {@code index}. */
  public void set(List<Integer> index, T value) {
    root.set(index, value);
  }

  /** Returns a view of the whole tree that cannot be used to modify it. */
  public LeafTypeTreeView<T> asView() {
    return readOnlyRoot;
  }

  public MutableLeafTypeTreeView<T> asMutableView() {
    return root;
  }

  /**
   * Returns a read-only view of the tuple or array rooted at {@code index}.
   *
   * @throws StructuralMismatchException if the index addresses a leaf or is out of range.
   */
  public LeafTypeTreeView<T> getView(List<Integer> index) {
    return root.getView(index);
  }

  /**
   * Returns a writable view of the tuple or array rooted at {@code index}.
   *
   * @throws StructuralMismatchException if the index addresses a leaf or is out of range.
   */
  public MutableLeafTypeTreeView<T> getMutableView(List<Integer> index) {
    return root.getMutableView(index);
  }

  /** Returns a read-only view of the sub-tree or leaf at {@code index}. */
  public LeafTypeTreeView<T> getSubtree(List<Integer> index) {
    return root.getSubtree(index);
  }

  /** Returns a writable view of the sub-tree or leaf at {@code index}. */
  public MutableLeafTypeTreeView<T> getMutableSubtree(List<Integer> index) {
    return root.getMutableSubtree(index);
  }

  public void forEachIndex(ElementVisitor<? super T> visitor) {
    root.forEachIndex(visitor);
  }

  public void updateEachIndex(ElementUpdater<T> updater) {
    root.updateEachIndex(updater);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof LeafTypeTree && root.equals(((LeafTypeTree<?>) o).root);
  }

  @Override
  public int hashCode() {
    return root.hashCode();
  }

  @Override
  public String toString() {
    return root.toString();
  }
}
