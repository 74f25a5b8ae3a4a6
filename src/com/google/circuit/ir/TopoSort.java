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

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/** Orders the nodes of a function so that every operand precedes its users. */
public final class TopoSort {

  /**
   * Returns every node of {@code function}, including nodes that do not contribute to the return
   * value. The order is deterministic: roots are taken in creation order and operands are
   * explored left to right.
   */
  public static ImmutableList<Node> sort(Function function) {
    ImmutableList.Builder<Node> order = ImmutableList.builder();
    Set<Node> visited = new HashSet<>();
    Deque<Frame> stack = new ArrayDeque<>();
    for (Node root : function.getNodes()) {
      if (!visited.add(root)) {
        continue;
      }
      stack.push(new Frame(root));
      while (!stack.isEmpty()) {
        Frame top = stack.peek();
        if (top.next < top.node.getOperandCount()) {
          Node operand = top.node.getOperand(top.next++);
          if (visited.add(operand)) {
            stack.push(new Frame(operand));
          }
        } else {
          order.add(stack.pop().node);
        }
      }
    }
    return order.build();
  }

  private static final class Frame {
    final Node node;
    int next = 0;

    Frame(Node node) {
      this.node = node;
    }
  }

  private TopoSort() {}
}
