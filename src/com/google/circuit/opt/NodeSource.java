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

package com.google.circuit.opt;

import com.google.auto.value.AutoValue;
import com.google.circuit.ir.Node;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * The statically known origin of one leaf: leaf {@code treeIndex} of the value produced by {@code
 * node}. If the origin cannot be determined, the leaf is its own source. For example:
 *
 * <pre>
 *   x: bits[32] = param(x)                  x
 *   y: bits[32] = param(y)                  y
 *   z: (bits[32], bits[32]) = param(z)      (z{0}, z{1})
 *   a: bits[32] = identity(x)               x
 *   b: bits[32] = tuple_index(z, index=1)   z{1}
 *   c: bits[32] = sel(s, x, y)              c
 *   d: bits[32] = sel(s, x, x)              x
 * </pre>
 *
 * Two sources are equal when they name the same node instance and the same tree index. Nodes
 * compare by identity.
 */
@AutoValue
public abstract class NodeSource {

  public static NodeSource create(Node node, List<Integer> treeIndex) {
    return new AutoValue_NodeSource(node, ImmutableList.copyOf(treeIndex));
  }

  public abstract Node getNode();

  public abstract ImmutableList<Integer> getTreeIndex();

  @Override
  public final String toString() {
    if (getTreeIndex().isEmpty()) {
      return getNode().getName();
    }
    return getNode().getName() + "{" + Joiner.on(",").join(getTreeIndex()) + "}";
  }
}
