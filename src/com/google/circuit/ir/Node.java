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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.LinkedHashMultiset;
import com.google.common.collect.Multiset;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A single operation in a {@link Function}'s dataflow graph.
 *
 * <p>Nodes are owned by their function and identified by an id that is stable for the lifetime of
 * the function. Operand edges are plain references into the same function; users are tracked with
 * multiplicity so that an operand used twice by one node is counted twice. Nodes are created
 * through {@link FunctionBuilder}.
 */
public final class Node {
  private final Function function;
  private final int id;
  private final Op op;
  private final Type type;
  private @Nullable String name;
  private final List<Node> operands;
  private final Multiset<Node> users = LinkedHashMultiset.create();

  // LITERAL: the value. TUPLE_INDEX: the element index. ARRAY_SLICE: the result width.
  private final long attribute;
  // SEL: whether the last operand is a default value.
  private final boolean hasDefault;

  Node(
      Function function,
      int id,
      Op op,
      Type type,
      List<Node> operands,
      long attribute,
      boolean hasDefault) {
    this.function = function;
    this.id = id;
    this.op = op;
    this.type = type;
    this.operands = new ArrayList<>(operands);
    this.attribute = attribute;
    this.hasDefault = hasDefault;
  }

  public Function getFunction() {
    return function;
  }

  public int getId() {
    return id;
  }

  public Op getOp() {
    return op;
  }

  public Type getType() {
    return type;
  }

  /** Returns the assigned name, or {@code <op>.<id>} if none was assigned. */
  public String getName() {
    return name != null ? name : op.getText() + "." + id;
  }

  public boolean hasAssignedName() {
    return name != null;
  }

  public Node setName(String name) {
    checkArgument(!name.isEmpty());
    this.name = name;
    return this;
  }

  public ImmutableList<Node> getOperands() {
    return ImmutableList.copyOf(operands);
  }

  public Node getOperand(int i) {
    return operands.get(i);
  }

  public int getOperandCount() {
    return operands.size();
  }

  /** Distinct users of this node, in the order they started using it. */
  public ImmutableSet<Node> getUsers() {
    return ImmutableSet.copyOf(users.elementSet());
  }

  public boolean hasUsers() {
    return !users.isEmpty();
  }

  public boolean isLiteral() {
    return op == Op.LITERAL;
  }

  public boolean isParam() {
    return op == Op.PARAM;
  }

  public long getLiteralValue() {
    checkState(op == Op.LITERAL, "not a literal: %s", this);
    return attribute;
  }

  public int getTupleIndex() {
    checkState(op == Op.TUPLE_INDEX, "not a tuple_index: %s", this);
    return (int) attribute;
  }

  public int getSliceWidth() {
    checkState(op == Op.ARRAY_SLICE, "not an array_slice: %s", this);
    return (int) attribute;
  }

  /** The array operand of an array_index, array_update or array_slice. */
  public Node getArray() {
    checkState(
        op == Op.ARRAY_INDEX || op == Op.ARRAY_UPDATE || op == Op.ARRAY_SLICE,
        "not an array access: %s",
        this);
    return operands.get(0);
  }

  /** The index operands of an array_index or array_update, outermost dimension first. */
  public ImmutableList<Node> getIndices() {
    switch (op) {
      case ARRAY_INDEX:
        return ImmutableList.copyOf(operands.subList(1, operands.size()));
      case ARRAY_UPDATE:
        return ImmutableList.copyOf(operands.subList(2, operands.size()));
      default:
        throw new IllegalStateException("not an indexed array access: " + this);
    }
  }

  public Node getUpdateValue() {
    checkState(op == Op.ARRAY_UPDATE, "not an array_update: %s", this);
    return operands.get(1);
  }

  public Node getSliceStart() {
    checkState(op == Op.ARRAY_SLICE, "not an array_slice: %s", this);
    return operands.get(1);
  }

  public Node getSelector() {
    checkState(op.isSelect(), "not a select: %s", this);
    return operands.get(0);
  }

  /** The case operands of a select, excluding any default value. */
  public ImmutableList<Node> getCases() {
    checkState(op.isSelect(), "not a select: %s", this);
    int end = hasDefaultValue() ? operands.size() - 1 : operands.size();
    return ImmutableList.copyOf(operands.subList(1, end));
  }

  public boolean hasDefaultValue() {
    return (op == Op.SEL && hasDefault) || op == Op.PRIORITY_SEL;
  }

  public @Nullable Node getDefaultValue() {
    checkState(op.isSelect(), "not a select: %s", this);
    return hasDefaultValue() ? operands.get(operands.size() - 1) : null;
  }

  /**
   * Replaces operand {@code i} with {@code replacement}, which must have the same type.
   *
   * @return the operand that was replaced.
   */
  public Node replaceOperandNumber(int i, Node replacement) {
    checkArgument(replacement.function == function, "%s is in another function", replacement);
    Node old = operands.get(i);
    checkArgument(
        old.type.equals(replacement.type),
        "cannot replace %s with %s: type mismatch",
        old,
        replacement);
    operands.set(i, replacement);
    old.users.remove(this);
    replacement.users.add(this);
    return old;
  }

  void addUser(Node user) {
    users.add(user);
  }

  @Override
  public String toString() {
    List<String> args = new ArrayList<>();
    for (Node operand : operands) {
      args.add(operand.getName());
    }
    switch (op) {
      case LITERAL:
        args.add("value=" + attribute);
        break;
      case TUPLE_INDEX:
        args.add("index=" + attribute);
        break;
      case ARRAY_SLICE:
        args.add("width=" + attribute);
        break;
      default:
        break;
    }
    return getName() + ": " + type + " = " + op.getText() + "(" + Joiner.on(", ").join(args) + ")";
  }
}
