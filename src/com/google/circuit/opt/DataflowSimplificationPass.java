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

import com.google.circuit.ir.Function;
import com.google.circuit.ir.FunctionBuilder;
import com.google.circuit.ir.LeafTypeTree;
import com.google.circuit.ir.LeafTypeTreeView;
import com.google.circuit.ir.Node;
import com.google.circuit.ir.Op;
import com.google.circuit.ir.StructuralMismatchException;
import com.google.circuit.ir.TopoSort;
import com.google.circuit.ir.Type;
import com.google.circuit.ir.Types;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * An optimization which uses a lattice-based dataflow analysis to find equivalent nodes in the
 * graph and replace them with a simpler form. The analysis traces through tuples, arrays and
 * selects. Optimizations which can be performed by this pass:
 *
 * <pre>
 *    tuple_index(tuple(x, y), index=1)  =>  y
 *
 *    sel(selector, {z, z})  =>  z
 *
 *    array_index(array_update(A, x, index={42}), index={42})  =>  x
 *
 *    array_index(array_update(A, x, index={3}), index={42})  =>  array_index(A, index={42})
 *
 *    array_update(array(a, b), c, index={1})  =>  array(a, c)
 * </pre>
 *
 * <p>The analysis runs to completion before the function is modified, and every replacement is
 * planned and type checked before the first one is applied, so a failure leaves the function
 * untouched. Replaced nodes are left in place for dead code elimination.
 */
public final class DataflowSimplificationPass implements FunctionPass {

  private static final Logger logger =
      Logger.getLogger(DataflowSimplificationPass.class.getName());

  private final OptimizationPassOptions options;
  private final Supplier<? extends DataflowVisitor<NodeSource>> analysisFactory;

  public DataflowSimplificationPass(OptimizationPassOptions options) {
    this(options, NodeSourceDataflowVisitor::new);
  }

  @VisibleForTesting
  DataflowSimplificationPass(
      OptimizationPassOptions options,
      Supplier<? extends DataflowVisitor<NodeSource>> analysisFactory) {
    this.options = options;
    this.analysisFactory = analysisFactory;
  }

  @Override
  public boolean process(Function function) {
    DataflowVisitor<NodeSource> analysis = analysisFactory.get();
    analysis.analyze(function);

    List<Rewrite> plan;
    try {
      plan = new Planner(function, analysis).plan();
    } catch (StructuralMismatchException e) {
      throw new PassException(
          DataflowErrors.REWRITE_FAILURE, e, function.getName(), "a simpler form", e.getMessage());
    }
    if (plan.isEmpty()) {
      return false;
    }
    apply(function, plan);
    logger.fine("Simplified " + plan.size() + " nodes of " + function.getName());
    return true;
  }

  private enum Kind {
    /** Replace with an existing node computing the same value. */
    EQUIVALENT,
    /** Replace with a tuple_index/array_index chain from {@code operands[0]} along a path. */
    PROJECTION,
    /** Replace with a tuple or array of existing nodes. */
    COMPOSITE,
  }

  /** A planned replacement of one node. */
  private static final class Rewrite {
    final Kind kind;
    final Node node;
    final ImmutableList<Node> operands;
    final ImmutableList<Integer> path;

    Rewrite(Kind kind, Node node, List<Node> operands, List<Integer> path) {
      this.kind = kind;
      this.node = node;
      this.operands = ImmutableList.copyOf(operands);
      this.path = ImmutableList.copyOf(path);
    }
  }

  /**
   * Decides, without modifying the function, how each used node should be replaced. A node is
   * used if it has users or is the return value; replacing the uses of any other node changes
   * nothing.
   */
  private final class Planner {
    private final Function function;
    private final DataflowVisitor<NodeSource> analysis;
    // The first used node, in topological order, with a given source tree.
    private final Map<LeafTypeTreeView<NodeSource>, Node> representatives = new HashMap<>();

    Planner(Function function, DataflowVisitor<NodeSource> analysis) {
      this.function = function;
      this.analysis = analysis;
    }

    List<Rewrite> plan() {
      List<Rewrite> rewrites = new ArrayList<>();
      for (Node node : TopoSort.sort(function)) {
        if (!isUsed(function, node) || node.getType().getLeafCount() == 0) {
          continue;
        }
        LeafTypeTreeView<NodeSource> sources = analysis.getValue(node);
        Node representative = representatives.putIfAbsent(sources, node);
        if (representative != null) {
          rewrites.add(
              new Rewrite(
                  Kind.EQUIVALENT, node, ImmutableList.of(representative), ImmutableList.of()));
          continue;
        }
        Rewrite rewrite = planProjectionOrComposite(node, sources);
        if (rewrite != null) {
          rewrites.add(rewrite);
        }
      }
      return rewrites;
    }

    private @Nullable Rewrite planProjectionOrComposite(
        Node node, LeafTypeTreeView<NodeSource> sources) {
      NodeSource origin = commonOrigin(node, sources);
      if (origin != null) {
        if (!options.shouldMaterializeProjections()) {
          return null;
        }
        return planProjection(node, origin.getNode(), origin.getTreeIndex());
      }
      if (options.shouldRebuildComposites()) {
        return planComposite(node, sources);
      }
      return null;
    }

    /**
     * Returns the node and path whose sub-value every leaf of {@code node} is, if there is one
     * other than {@code node} itself.
     */
    private @Nullable NodeSource commonOrigin(Node node, LeafTypeTreeView<NodeSource> sources) {
      NodeSource first = sources.getElement(0);
      Node origin = first.getNode();
      ImmutableList<Integer> firstIndex = first.getTreeIndex();
      ImmutableList<Integer> firstLeaf = node.getType().getLeafIndices().get(0);
      if (origin == node || firstIndex.size() < firstLeaf.size()) {
        return null;
      }
      int prefixLength = firstIndex.size() - firstLeaf.size();
      if (!firstIndex.subList(prefixLength, firstIndex.size()).equals(firstLeaf)) {
        return null;
      }
      ImmutableList<Integer> prefix = firstIndex.subList(0, prefixLength);
      if (!Types.getSubtype(origin.getType(), prefix).equals(node.getType())
          || !sources.equals(projectionSources(origin, prefix))) {
        return null;
      }
      return NodeSource.create(origin, prefix);
    }

    private @Nullable Rewrite planProjection(Node node, Node origin, List<Integer> path) {
      // Start from the deepest existing node on the way to the target.
      Node start = origin;
      int consumed = 0;
      for (int length = path.size() - 1; length > 0; length--) {
        Node existing = representatives.get(projectionSources(origin, path.subList(0, length)));
        if (existing != null && existing != node) {
          start = existing;
          consumed = length;
          break;
        }
      }
      List<Integer> remaining = path.subList(consumed, path.size());
      if (isDirectProjection(node, start, remaining)) {
        return null;
      }
      Type resultType = Types.getSubtype(start.getType(), remaining);
      if (!resultType.equals(node.getType())) {
        throw new PassException(
            DataflowErrors.REWRITE_FAILURE,
            node.getName(),
            start.getName() + remaining,
            "projection has type " + resultType + " but the node has type " + node.getType());
      }
      return new Rewrite(Kind.PROJECTION, node, ImmutableList.of(start), remaining);
    }

    /**
     * Whether {@code node} is a literal projection whose operand already computes what the
     * projection chain from {@code start} along {@code remaining} would read from.
     */
    private boolean isDirectProjection(Node node, Node start, List<Integer> remaining) {
      List<Integer> projected = new ArrayList<>();
      Node operand;
      switch (node.getOp()) {
        case TUPLE_INDEX:
          operand = node.getOperand(0);
          projected.add(node.getTupleIndex());
          break;
        case ARRAY_INDEX:
          operand = node.getArray();
          for (Node index : node.getIndices()) {
            if (!index.isLiteral() || index.getLiteralValue() > Integer.MAX_VALUE) {
              return false;
            }
            projected.add((int) index.getLiteralValue());
          }
          break;
        default:
          return false;
      }
      int prefixLength = remaining.size() - projected.size();
      if (projected.isEmpty()
          || prefixLength < 0
          || !remaining.subList(prefixLength, remaining.size()).equals(projected)) {
        return false;
      }
      return analysis
          .getValue(operand)
          .equals(analysis.getValue(start).getView(remaining.subList(0, prefixLength)));
    }

    private @Nullable Rewrite planComposite(Node node, LeafTypeTreeView<NodeSource> sources) {
      Type type = node.getType();
      if (type.isBits()
          || (type.isTuple() && node.getOp() == Op.TUPLE)
          || (type.isArray() && node.getOp() == Op.ARRAY)) {
        return null;
      }
      List<Node> elements = new ArrayList<>();
      List<Type> elementTypes = new ArrayList<>();
      for (int i = 0; i < type.getChildCount(); i++) {
        LeafTypeTreeView<NodeSource> element = sources.getSubtree(ImmutableList.of(i));
        Node existing = element.size() == 0 ? null : representatives.get(element);
        if (existing == null || existing == node) {
          return null;
        }
        elements.add(existing);
        elementTypes.add(existing.getType());
      }
      Type rebuilt =
          type.isTuple()
              ? Types.tuple(elementTypes)
              : Types.array(elements.size(), elementTypes.get(0));
      if (!rebuilt.equals(type)) {
        throw new PassException(
            DataflowErrors.REWRITE_FAILURE,
            node.getName(),
            "a composite of " + elements.size() + " elements",
            "composite has type " + rebuilt + " but the node has type " + type);
      }
      return new Rewrite(Kind.COMPOSITE, node, elements, ImmutableList.of());
    }
  }

  /** The sources of the sub-value of {@code origin} at {@code path}. */
  private static LeafTypeTreeView<NodeSource> projectionSources(Node origin, List<Integer> path) {
    Type type = Types.getSubtype(origin.getType(), path);
    return LeafTypeTree.createFromFunction(
            type,
            (elementType, index) ->
                NodeSource.create(
                    origin, ImmutableList.<Integer>builder().addAll(path).addAll(index).build()))
        .asView();
  }

  private static boolean isUsed(Function function, Node node) {
    return node.hasUsers() || (function.hasReturnValue() && function.getReturnValue() == node);
  }

  private static void apply(Function function, List<Rewrite> plan) {
    FunctionBuilder builder = FunctionBuilder.extend(function);
    Map<Node, Node> replacements = new HashMap<>();
    for (Rewrite rewrite : plan) {
      Node replacement;
      switch (rewrite.kind) {
        case EQUIVALENT:
          replacement = resolve(rewrite.operands.get(0), replacements);
          break;
        case PROJECTION:
          replacement = resolve(rewrite.operands.get(0), replacements);
          for (int element : rewrite.path) {
            replacement = project(builder, replacement, element);
          }
          break;
        case COMPOSITE:
          List<Node> elements = new ArrayList<>();
          for (Node element : rewrite.operands) {
            elements.add(resolve(element, replacements));
          }
          replacement =
              rewrite.node.getType().isTuple() ? builder.tuple(elements) : builder.array(elements);
          break;
        default:
          throw new AssertionError(rewrite.kind);
      }
      function.replaceUsesWith(rewrite.node, replacement);
      replacements.put(rewrite.node, replacement);
      logger.fine("Replaced " + rewrite.node + " with " + replacement);
    }
  }

  private static Node project(FunctionBuilder builder, Node value, int element) {
    if (value.getType().isTuple()) {
      return builder.tupleIndex(value, element);
    }
    int size = value.getType().toArray().getSize();
    int width = Math.max(1, 32 - Integer.numberOfLeadingZeros(size - 1));
    return builder.arrayIndex(value, builder.literal(element, width));
  }

  private static Node resolve(Node node, Map<Node, Node> replacements) {
    Node result = node;
    Node next = replacements.get(result);
    while (next != null) {
      result = next;
      next = replacements.get(result);
    }
    return result;
  }
}
