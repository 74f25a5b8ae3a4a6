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

import com.google.circuit.ir.LeafTypeTree;
import com.google.circuit.ir.LeafTypeTreeView;
import com.google.circuit.ir.Node;
import com.google.circuit.ir.Type;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Computes the {@link NodeSource} of every leaf of every node.
 *
 * <p>Any node the framework does not see through is the source of its own leaves. At a merge, a
 * leaf keeps its source only if every branch agrees on it; otherwise the merging node becomes the
 * source. Since sources compare structurally and the fallback always names the merging node, the
 * result does not depend on the order of the branches.
 */
public class NodeSourceDataflowVisitor extends DataflowVisitor<NodeSource> {

  @Override
  protected void defaultHandler(Node node) {
    setValue(
        node,
        LeafTypeTree.createFromFunction(
            node.getType(), (elementType, index) -> NodeSource.create(node, index)));
  }

  @Override
  protected NodeSource joinElements(
      Type elementType,
      List<NodeSource> dataSources,
      List<LeafTypeTreeView<NodeSource>> controlSources,
      Node node,
      ImmutableList<Integer> index) {
    NodeSource first = dataSources.get(0);
    for (NodeSource source : dataSources) {
      if (!source.equals(first)) {
        return NodeSource.create(node, index);
      }
    }
    return first;
  }
}
