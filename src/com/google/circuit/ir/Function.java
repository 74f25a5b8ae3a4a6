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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A function body: an arena owning every {@link Node} created for it, its parameters, and the
 * node whose value it returns.
 *
 * <p>Nodes are never removed; a node that no longer contributes to the return value is left for a
 * dead code elimination pass.
 */
public final class Function {
  private final String name;
  private final List<Node> nodes = new ArrayList<>();
  private final List<Node> params = new ArrayList<>();
  private @Nullable Node returnValue;
  private int nextId = 1;

  Function(String name) {
    checkArgument(!name.isEmpty());
    this.name = name;
  }

  public String getName() {
    return name;
  }

  /** Every node of the function, in creation order. */
  public ImmutableList<Node> getNodes() {
    return ImmutableList.copyOf(nodes);
  }

  public int getNodeCount() {
    return nodes.size();
  }

  public ImmutableList<Node> getParams() {
    return ImmutableList.copyOf(params);
  }

  public boolean hasReturnValue() {
    return returnValue != null;
  }

  public Node getReturnValue() {
    checkState(returnValue != null, "function %s has no return value", name);
    return returnValue;
  }

  public void setReturnValue(Node node) {
    checkArgument(node.getFunction() == this, "%s is in another function", node);
    this.returnValue = node;
  }

  Node addNode(Op op, Type type, List<Node> operands, long attribute, boolean hasDefault) {
    Node node = new Node(this, nextId++, op, type, operands, attribute, hasDefault);
    for (Node operand : operands) {
      checkArgument(operand.getFunction() == this, "%s is in another function", operand);
      operand.addUser(node);
    }
    nodes.add(node);
    if (op == Op.PARAM) {
      params.add(node);
    }
    return node;
  }

  /**
   * Re-points every use of {@code old}, including the return value, at {@code replacement}.
   *
   * @return whether any use was changed.
   */
  @CanIgnoreReturnValue
  public boolean replaceUsesWith(Node old, Node replacement) {
    checkNotNull(replacement);
    checkArgument(old != replacement, "cannot replace %s with itself", old);
    checkArgument(
        old.getType().equals(replacement.getType()),
        "cannot replace %s with %s: type mismatch",
        old,
        replacement);
    boolean changed = false;
    for (Node user : old.getUsers()) {
      for (int i = 0; i < user.getOperandCount(); i++) {
        if (user.getOperand(i) == old) {
          user.replaceOperandNumber(i, replacement);
          changed = true;
        }
      }
    }
    if (returnValue == old) {
      returnValue = replacement;
      changed = true;
    }
    return changed;
  }

  /** Renders the function in operands-before-users order. */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("fn ").append(name).append('(');
    for (int i = 0; i < params.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(params.get(i).getName()).append(": ").append(params.get(i).getType());
    }
    sb.append(") {\n");
    for (Node node : TopoSort.sort(this)) {
      if (!node.isParam()) {
        sb.append("  ").append(node).append('\n');
      }
    }
    if (returnValue != null) {
      sb.append("  ret ").append(returnValue.getName()).append('\n');
    }
    return sb.append("}\n").toString();
  }
}
