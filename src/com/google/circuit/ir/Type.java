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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * The shape of a value produced by a {@link Node}: a scalar {@link BitsType}, a {@link TupleType}
 * of heterogeneous elements, or an {@link ArrayType} of a fixed number of identically typed
 * elements.
 *
 * <p>Types are immutable and compare structurally. Instances obtained through {@link Types} are
 * interned, so the leaf layout of each distinct type is derived at most once.
 */
public abstract class Type {

  /** Leaf layout, computed on first use. */
  private volatile @Nullable Layout layout;

  Type() {
    // Subclasses in this package only.
  }

  public boolean isBits() {
    return false;
  }

  public boolean isTuple() {
    return false;
  }

  public boolean isArray() {
    return false;
  }

  public final BitsType toBits() {
    checkState(isBits(), "not a bits type: %s", this);
    return (BitsType) this;
  }

  public final TupleType toTuple() {
    checkState(isTuple(), "not a tuple type: %s", this);
    return (TupleType) this;
  }

  public final ArrayType toArray() {
    checkState(isArray(), "not an array type: %s", this);
    return (ArrayType) this;
  }

  /** Number of direct children: the tuple arity, the array size, or zero for bits. */
  public abstract int getChildCount();

  /** Type of the direct child at {@code i}. */
  public abstract Type getChildType(int i);

  /** Offset, in leaves, of the direct child at {@code i} from the first leaf of this type. */
  public abstract int getChildLeafOffset(int i);

  /** Number of scalar leaves in this type. */
  public final int getLeafCount() {
    return getLayout().leafTypes.size();
  }

  /** The scalar type of every leaf, in declaration order. */
  public final ImmutableList<Type> getLeafTypes() {
    return getLayout().leafTypes;
  }

  /** The tree index of every leaf, in declaration order. */
  public final ImmutableList<ImmutableList<Integer>> getLeafIndices() {
    return getLayout().leafIndices;
  }

  private Layout getLayout() {
    Layout result = layout;
    if (result == null) {
      result = new Layout(this);
      layout = result;
    }
    return result;
  }

  private static final class Layout {
    final ImmutableList<Type> leafTypes;
    final ImmutableList<ImmutableList<Integer>> leafIndices;

    Layout(Type type) {
      ImmutableList.Builder<Type> types = ImmutableList.builder();
      ImmutableList.Builder<ImmutableList<Integer>> indices = ImmutableList.builder();
      collect(type, new ArrayList<>(), types, indices);
      this.leafTypes = types.build();
      this.leafIndices = indices.build();
    }

    private static void collect(
        Type type,
        List<Integer> prefix,
        ImmutableList.Builder<Type> types,
        ImmutableList.Builder<ImmutableList<Integer>> indices) {
      if (type.isBits()) {
        types.add(type);
        indices.add(ImmutableList.copyOf(prefix));
        return;
      }
      for (int i = 0; i < type.getChildCount(); i++) {
        prefix.add(i);
        collect(type.getChildType(i), prefix, types, indices);
        prefix.remove(prefix.size() - 1);
      }
    }
  }
}
