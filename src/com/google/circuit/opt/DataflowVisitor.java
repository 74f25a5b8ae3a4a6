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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.circuit.ir.ArrayType;
import com.google.circuit.ir.Function;
import com.google.circuit.ir.LeafTypeTree;
import com.google.circuit.ir.LeafTypeTreeView;
import com.google.circuit.ir.MutableLeafTypeTreeView;
import com.google.circuit.ir.Node;
import com.google.circuit.ir.Op;
import com.google.circuit.ir.StructuralMismatchException;
import com.google.circuit.ir.TopoSort;
import com.google.circuit.ir.Type;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * A framework for analyses that compute one fact per leaf of every node's value.
 *
 * <p>Nodes are visited once each, operands before users. The framework propagates facts through
 * the structural operations itself:
 *
 * <ol>
 *   <li>Construction ({@code tuple}, {@code array}, {@code array_concat}) concatenates the
 *       operands' facts.
 *   <li>Projection ({@code tuple_index}, {@code array_index} and {@code array_slice} with literal
 *       indices) and {@code identity} copy the addressed facts.
 *   <li>Merges ({@code sel}, {@code priority_sel}, {@code one_hot_sel} with a one-hot selector,
 *       and array accesses with non-literal indices) call {@link #joinElements} once per leaf with
 *       the facts of every branch that can produce that leaf.
 * </ol>
 *
 * Every other node is handed to {@link #defaultHandler}, which must record a value with {@link
 * #setValue}.
 *
 * <p>Literal operands are the only statically known values. A literal array index past the end
 * addresses the last element, and an {@code array_update} at a literal index past the end leaves
 * the array unchanged.
 *
 * <p>If any handler or join fails, the analysis stops and no value is retained. An instance
 * analyzes one function once; analyzing again, for instance after the function was rewritten,
 * requires a new instance.
 *
 * @param <T> the fact stored for each leaf. {@link #joinElements} must be associative,
 *     commutative and deterministic over the facts it is given.
 */
public abstract class DataflowVisitor<T> {

  private static final Logger logger = Logger.getLogger(DataflowVisitor.class.getName());

  private final Map<Node, LeafTypeTree<T>> values = new HashMap<>();
  private boolean started = false;

  /**
   * Computes a value for every node of {@code function}.
   *
   * @throws PassException if a handler or join fails. No values are available afterwards.
   */
  public final void analyze(Function function) {
    checkState(!started, "an analysis instance analyzes exactly one function");
    started = true;
    try {
      for (Node node : TopoSort.sort(function)) {
        try {
          visit(node);
        } catch (StructuralMismatchException e) {
          throw new PassException(
              DataflowErrors.STRUCTURAL_MISMATCH, e, node.getName(), e.getMessage());
        }
      }
    } catch (RuntimeException e) {
      values.clear();
      throw e;
    }
    logger.fine(
        "Computed dataflow values for " + values.size() + " nodes of " + function.getName());
  }

  /**
   * Computes and records the value of a node whose op the framework does not propagate through.
   */
  protected abstract void defaultHandler(Node node);

  /**
   * Joins the facts that may flow into one leaf of a merging node.
   *
   * @param elementType the type of the leaf.
   * @param dataSources the fact of that leaf in every branch that can produce it, in operand
   *     order. Contains at least two facts.
   * @param controlSources the values of the operands that decide between the branches, such as
   *     the selector or the array indices.
   * @param node the merging node.
   * @param index the index of the leaf within {@code node}'s value.
   */
  protected abstract T joinElements(
      Type elementType,
      List<T> dataSources,
      List<LeafTypeTreeView<T>> controlSources,
      Node node,
      ImmutableList<Integer> index);

  /** Records the value of {@code node}. Each node is recorded exactly once. */
  protected final void setValue(Node node, LeafTypeTree<T> value) {
    checkState(!values.containsKey(node), "value of %s already recorded", node.getName());
    if (!value.getType().equals(node.getType())) {
      throw new PassException(
          DataflowErrors.STRUCTURAL_MISMATCH,
          node.getName(),
          "recorded value has type " + value.getType() + " but the node has type "
              + node.getType());
    }
    values.put(node, value);
  }

  /** Returns the recorded value of {@code node}, which must already have been computed. */
  public final LeafTypeTreeView<T> getValue(Node node) {
    LeafTypeTree<T> value = values.get(node);
    checkState(value != null, "no value computed for %s", node.getName());
    return value.asView();
  }

  public final boolean isComputed(Node node) {
    return values.containsKey(node);
  }

  /** Reports a join that cannot produce a fact. */
  protected final PassException joinFailure(Node node, String reason) {
    return new PassException(DataflowErrors.JOIN_FAILURE, node.getName(), reason);
  }

  private void visit(Node node) {
    switch (node.getOp()) {
      case TUPLE:
      case ARRAY:
      case ARRAY_CONCAT:
        handleConcatenation(node);
        break;
      case TUPLE_INDEX:
        copyValue(
            node,
            getValue(node.getOperand(0)).getSubtree(ImmutableList.of(node.getTupleIndex())));
        break;
      case IDENTITY:
        copyValue(node, getValue(node.getOperand(0)));
        break;
      case ARRAY_INDEX:
        handleArrayIndex(node);
        break;
      case ARRAY_SLICE:
        handleArraySlice(node);
        break;
      case ARRAY_UPDATE:
        handleArrayUpdate(node);
        break;
      case SEL:
        handleSelect(node);
        break;
      case PRIORITY_SEL:
        handlePrioritySelect(node);
        break;
      case ONE_HOT_SEL:
        handleOneHotSelect(node);
        break;
      default:
        invokeDefaultHandler(node);
        break;
    }
  }

  private void invokeDefaultHandler(Node node) {
    defaultHandler(node);
    if (!values.containsKey(node)) {
      throw new PassException(
          DataflowErrors.UNHANDLED_OPERATOR, node.getName(), node.getOp().getText());
    }
  }

  private void copyValue(Node node, LeafTypeTreeView<T> source) {
    setValue(node, source.toTree());
  }

  private void handleConcatenation(Node node) {
    List<T> elements = new ArrayList<>(node.getType().getLeafCount());
    for (Node operand : node.getOperands()) {
      elements.addAll(getValue(operand).elements());
    }
    setValue(node, LeafTypeTree.createFromList(node.getType(), elements));
  }

  private void handleArrayIndex(Node node) {
    LeafTypeTreeView<T> array = getValue(node.getArray());
    ImmutableList<Node> indices = node.getIndices();
    List<LeafTypeTreeView<T>> sources = new ArrayList<>();
    for (ImmutableList<Integer> position : possiblePositions(node.getArray().getType(), indices)) {
      sources.add(array.getSubtree(position));
    }
    setValue(node, join(node, ImmutableList.of(), sources, valuesOf(indices)));
  }

  private void handleArraySlice(Node node) {
    LeafTypeTreeView<T> array = getValue(node.getArray());
    int size = node.getArray().getType().toArray().getSize();
    Node start = node.getSliceStart();
    List<LeafTypeTreeView<T>> control = valuesOf(ImmutableList.of(start));
    List<T> elements = new ArrayList<>(node.getType().getLeafCount());
    for (int i = 0; i < node.getSliceWidth(); i++) {
      if (start.isLiteral()) {
        int position = clampedSum(start.getLiteralValue(), i, size);
        elements.addAll(array.getSubtree(ImmutableList.of(position)).elements());
      } else {
        // Element i may come from any position at or past i.
        List<LeafTypeTreeView<T>> sources = new ArrayList<>();
        for (int position = Math.min(i, size - 1); position < size; position++) {
          sources.add(array.getSubtree(ImmutableList.of(position)));
        }
        elements.addAll(join(node, ImmutableList.of(i), sources, control).elements());
      }
    }
    setValue(node, LeafTypeTree.createFromList(node.getType(), elements));
  }

  private void handleArrayUpdate(Node node) {
    LeafTypeTreeView<T> array = getValue(node.getArray());
    LeafTypeTreeView<T> update = getValue(node.getUpdateValue());
    ImmutableList<Node> indices = node.getIndices();
    if (indices.isEmpty()) {
      copyValue(node, update);
      return;
    }
    LeafTypeTree<T> result = array.toTree();
    if (hasLiteralIndexOutOfBounds(node.getType(), indices)) {
      setValue(node, result);
      return;
    }
    List<ImmutableList<Integer>> positions = possiblePositions(node.getType(), indices);
    if (allLiteral(indices)) {
      result.getMutableSubtree(positions.get(0)).copyFrom(update);
    } else {
      List<LeafTypeTreeView<T>> control = valuesOf(indices);
      for (ImmutableList<Integer> position : positions) {
        joinInto(
            result.getMutableSubtree(position),
            position,
            ImmutableList.of(array.getSubtree(position), update),
            control,
            node);
      }
    }
    setValue(node, result);
  }

  private void handleSelect(Node node) {
    Node selector = node.getSelector();
    ImmutableList<Node> cases = node.getCases();
    @Nullable Node defaultValue = node.getDefaultValue();
    if (selector.isLiteral()) {
      long value = selector.getLiteralValue();
      if (Long.compareUnsigned(value, cases.size()) < 0) {
        copyValue(node, getValue(cases.get((int) value)));
      } else if (defaultValue != null) {
        copyValue(node, getValue(defaultValue));
      } else {
        throw joinFailure(
            node, "selector value " + Long.toUnsignedString(value) + " has no case and no default");
      }
      return;
    }
    List<Node> branches = new ArrayList<>(cases);
    if (defaultValue != null) {
      branches.add(defaultValue);
    }
    setValue(node, joinBranches(node, branches, selector));
  }

  private void handlePrioritySelect(Node node) {
    Node selector = node.getSelector();
    ImmutableList<Node> cases = node.getCases();
    Node defaultValue = node.getDefaultValue();
    if (selector.isLiteral()) {
      long value = selector.getLiteralValue();
      copyValue(
          node,
          getValue(value == 0 ? defaultValue : cases.get(Long.numberOfTrailingZeros(value))));
      return;
    }
    List<Node> branches = new ArrayList<>(cases);
    branches.add(defaultValue);
    setValue(node, joinBranches(node, branches, selector));
  }

  private void handleOneHotSelect(Node node) {
    Node selector = node.getSelector();
    ImmutableList<Node> cases = node.getCases();
    if (selector.isLiteral() && Long.bitCount(selector.getLiteralValue()) == 1) {
      copyValue(node, getValue(cases.get(Long.numberOfTrailingZeros(selector.getLiteralValue()))));
    } else if (selector.getOp() == Op.ONE_HOT) {
      setValue(node, joinBranches(node, cases, selector));
    } else {
      // With zero or several bits set the result is an OR of cases, not any one of them.
      invokeDefaultHandler(node);
    }
  }

  private LeafTypeTree<T> joinBranches(Node node, List<Node> branches, Node selector) {
    return join(node, ImmutableList.of(), valuesOf(branches), valuesOf(ImmutableList.of(selector)));
  }

  /**
   * Joins same-typed sources leaf by leaf into a new tree. A single source is copied.
   *
   * @param prefix the index of the joined sub-tree within {@code node}'s value.
   */
  private LeafTypeTree<T> join(
      Node node,
      ImmutableList<Integer> prefix,
      List<LeafTypeTreeView<T>> sources,
      List<LeafTypeTreeView<T>> control) {
    checkArgument(!sources.isEmpty(), "nothing to join at %s", node.getName());
    LeafTypeTree<T> result = sources.get(0).toTree();
    if (sources.size() > 1) {
      joinInto(result.asMutableView(), prefix, sources, control, node);
    }
    return result;
  }

  private void joinInto(
      MutableLeafTypeTreeView<T> target,
      ImmutableList<Integer> prefix,
      List<LeafTypeTreeView<T>> sources,
      List<LeafTypeTreeView<T>> control,
      Node node) {
    ImmutableList<Type> leafTypes = target.getType().getLeafTypes();
    ImmutableList<ImmutableList<Integer>> leafIndices = target.getType().getLeafIndices();
    List<LeafTypeTreeView<T>> controlSources = Collections.unmodifiableList(control);
    for (int i = 0; i < leafTypes.size(); i++) {
      List<T> facts = new ArrayList<>(sources.size());
      for (LeafTypeTreeView<T> source : sources) {
        facts.add(source.getElement(i));
      }
      ImmutableList<Integer> index =
          ImmutableList.<Integer>builder().addAll(prefix).addAll(leafIndices.get(i)).build();
      T joined =
          joinElements(
              leafTypes.get(i), Collections.unmodifiableList(facts), controlSources, node, index);
      if (joined == null) {
        throw joinFailure(node, "no fact for " + facts + " at " + index);
      }
      target.setElement(i, joined);
    }
  }

  private List<LeafTypeTreeView<T>> valuesOf(List<Node> nodes) {
    List<LeafTypeTreeView<T>> result = new ArrayList<>(nodes.size());
    for (Node n : nodes) {
      result.add(getValue(n));
    }
    return result;
  }

  /**
   * Returns every element position that {@code indices} may address in {@code arrayType}, in
   * increasing order. Literal indices address one position, clamped to the last element.
   */
  private static List<ImmutableList<Integer>> possiblePositions(
      Type arrayType, List<Node> indices) {
    List<ImmutableList<Integer>> positions = new ArrayList<>();
    positions.add(ImmutableList.of());
    Type type = arrayType;
    for (Node index : indices) {
      ArrayType array = type.toArray();
      int size = array.getSize();
      List<Integer> candidates = new ArrayList<>();
      if (index.isLiteral()) {
        candidates.add(clampedSum(index.getLiteralValue(), 0, size));
      } else {
        for (int i = 0; i < size; i++) {
          candidates.add(i);
        }
      }
      List<ImmutableList<Integer>> next = new ArrayList<>();
      for (ImmutableList<Integer> position : positions) {
        for (int candidate : candidates) {
          next.add(ImmutableList.<Integer>builder().addAll(position).add(candidate).build());
        }
      }
      positions = next;
      type = array.getElementType();
    }
    return positions;
  }

  private static boolean hasLiteralIndexOutOfBounds(Type arrayType, List<Node> indices) {
    Type type = arrayType;
    for (Node index : indices) {
      ArrayType array = type.toArray();
      if (index.isLiteral()
          && Long.compareUnsigned(index.getLiteralValue(), array.getSize()) >= 0) {
        return true;
      }
      type = array.getElementType();
    }
    return false;
  }

  private static boolean allLiteral(List<Node> nodes) {
    for (Node n : nodes) {
      if (!n.isLiteral()) {
        return false;
      }
    }
    return true;
  }

  /** Returns {@code start + offset} as an element position, clamped to the last element. */
  private static int clampedSum(long start, int offset, int size) {
    if (Long.compareUnsigned(start, size) >= 0) {
      return size - 1;
    }
    return (int) Math.min(start + offset, size - 1);
  }
}
