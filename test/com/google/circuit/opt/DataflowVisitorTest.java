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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.circuit.ir.Function;
import com.google.circuit.ir.FunctionBuilder;
import com.google.circuit.ir.LeafTypeTree;
import com.google.circuit.ir.LeafTypeTreeView;
import com.google.circuit.ir.Node;
import com.google.circuit.ir.Op;
import com.google.circuit.ir.Type;
import com.google.circuit.ir.Types;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class DataflowVisitorTest {

  private static final Type BITS8 = Types.bits(8);

  /**
   * Labels each leaf produced by a node it does not see through with the node name and leaf
   * index. Joins to the sorted set of distinct labels.
   */
  private static class LabelVisitor extends DataflowVisitor<String> {
    final List<Node> defaulted = new ArrayList<>();
    final List<Integer> controlCounts = new ArrayList<>();

    @Override
    protected void defaultHandler(Node node) {
      defaulted.add(node);
      setValue(
          node,
          LeafTypeTree.createFromFunction(
              node.getType(),
              (type, index) -> index.isEmpty() ? node.getName() : node.getName() + index));
    }

    @Override
    protected String joinElements(
        Type elementType,
        List<String> dataSources,
        List<LeafTypeTreeView<String>> controlSources,
        Node node,
        ImmutableList<Integer> index) {
      controlCounts.add(controlSources.size());
      TreeSet<String> distinct = new TreeSet<>(dataSources);
      return distinct.size() == 1 ? distinct.first() : "{" + Joiner.on("|").join(distinct) + "}";
    }
  }

  private static LabelVisitor analyze(Function function) {
    LabelVisitor visitor = new LabelVisitor();
    visitor.analyze(function);
    return visitor;
  }

  private static List<String> valueOf(LabelVisitor visitor, Node node) {
    return visitor.getValue(node).elements();
  }

  @Test
  public void testConstructionAndProjectionCopy() {
    FunctionBuilder b = new FunctionBuilder("f");
    Node x = b.param("x", BITS8);
    Node y = b.param("y", Types.tuple(BITS8, BITS8));
    Node t = b.tuple(x, y);
    Node inner = b.tupleIndex(t, 1);
    Node id = b.identity(inner);
    Function f = b.build(id);

    LabelVisitor visitor = analyze(f);
    assertThat(valueOf(visitor, t)).containsExactly("x", "y[0]", "y[1]").inOrder();
    assertThat(valueOf(visitor, inner)).containsExactly("y[0]", "y[1]").inOrder();
    assertThat(visitor.getValue(id)).isEqualTo(visitor.getValue(y));
    assertThat(visitor.defaulted).containsExactly(x, y);
  }

  @Test
  public void testArrayConstructionAndConcat() {
    FunctionBuilder b = new FunctionBuilder("f");
    Node x = b.param("x", BITS8);
    Node a = b.param("a", Types.array(2, BITS8));
    Node array = b.array(x, x);
    Node concat = b.arrayConcat(array, a);
    Function f = b.build(concat);

    assertThat(valueOf(analyze(f), concat)).containsExactly("x", "x", "a[0]", "a[1]").inOrder();
  }

  @Test
  public void testLiteralArrayIndexClampsToLastElement() {
    FunctionBuilder b = new FunctionBuilder("f");
    Node a = b.param("a", Types.array(3, BITS8));
    Node inRange = b.arrayIndex(a, b.literal(1, 4));
    Node pastEnd = b.arrayIndex(a, b.literal(9, 4));
    Function f = b.build(b.tuple(inRange, pastEnd));

    LabelVisitor visitor = analyze(f);
    assertThat(valueOf(visitor, inRange)).containsExactly("a[1]");
    assertThat(valueOf(visitor, pastEnd)).containsExactly("a[2]");
  }

  @Test
  public void testVariableArrayIndexJoinsEveryElement() {
    FunctionBuilder b = new FunctionBuilder("f");
    Node a = b.param("a", Types.array(3, BITS8));
    Node i = b.param("i", Types.bits(2));
    Node index = b.arrayIndex(a, i);
    Function f = b.build(index);

    LabelVisitor visitor = analyze(f);
    assertThat(valueOf(visitor, index)).containsExactly("{a[0]|a[1]|a[2]}");
    assertThat(visitor.controlCounts).containsExactly(1);
  }

  @Test
  public void testMultiDimensionalIndex() {
    FunctionBuilder b = new FunctionBuilder("f");
    Node a = b.param("a", Types.array(2, Types.array(2, BITS8)));
    Node i = b.param("i", Types.bits(1));
    Node index = b.arrayIndex(a, i, b.literal(1, 1));
    Function f = b.build(index);

    assertThat(valueOf(analyze(f), index)).containsExactly("{a[0, 1]|a[1, 1]}");
  }

  @Test
  public void testLiteralArrayUpdate() {
    FunctionBuilder b = new FunctionBuilder("f");
    Node a = b.param("a", Types.array(3, BITS8));
    Node v = b.param("v", BITS8);
    Node update = b.arrayUpdate(a, v, b.literal(1, 2));
    Node outOfBounds = b.arrayUpdate(a, v, b.literal(3, 2));
    Function f = b.build(b.tuple(update, outOfBounds));

    LabelVisitor visitor = analyze(f);
    assertThat(valueOf(visitor, update)).containsExactly("a[0]", "v", "a[2]").inOrder();
    assertThat(visitor.getValue(outOfBounds)).isEqualTo(visitor.getValue(a));
  }

  @Test
  public void testArrayUpdateWithoutIndicesReplacesTheWholeValue() {
    FunctionBuilder b = new FunctionBuilder("f");
    Node a = b.param("a", Types.array(2, BITS8));
    Node other = b.param("other", Types.array(2, BITS8));
    Node update = b.arrayUpdate(a, other, ImmutableList.of());
    Function f = b.build(update);

    assertThat(valueOf(analyze(f), update)).containsExactly("other[0]", "other[1]").inOrder();
  }

  @Test
  public void testVariableArrayUpdateJoinsWithTheOldElement() {
    FunctionBuilder b = new FunctionBuilder("f");
    Node a = b.param("a", Types.array(2, BITS8));
    Node v = b.param("v", BITS8);
    Node i = b.param("i", Types.bits(1));
    Node update = b.arrayUpdate(a, v, i);
    Function f = b.build(update);

    assertThat(valueOf(analyze(f), update)).containsExactly("{a[0]|v}", "{a[1]|v}").inOrder();
  }

  @Test
  public void testArraySlice() {
    FunctionBuilder b = new FunctionBuilder("f");
    Node a = b.param("a", Types.array(3, BITS8));
    Node literal = b.arraySlice(a, b.literal(2, 2), 2);
    Node variable = b.arraySlice(a, b.param("s", Types.bits(2)), 2);
    Function f = b.build(b.tuple(literal, variable));

    LabelVisitor visitor = analyze(f);
    assertThat(valueOf(visitor, literal)).containsExactly("a[2]", "a[2]").inOrder();
    assertThat(valueOf(visitor, variable))
        .containsExactly("{a[0]|a[1]|a[2]}", "{a[1]|a[2]}")
        .inOrder();
  }

  @Test
  public void testSelect() {
    FunctionBuilder b = new FunctionBuilder("f");
    Node s = b.param("s", Types.bits(1));
    Node x = b.param("x", BITS8);
    Node y = b.param("y", BITS8);
    Node variable = b.select(s, ImmutableList.of(x, y), null);
    Node literal = b.select(b.literal(1, 1), ImmutableList.of(x, y), null);
    Node wide = b.param("w", Types.bits(2));
    Node withDefault = b.select(b.literal(3, 2), ImmutableList.of(x, x), y);
    Node variableWithDefault = b.select(wide, ImmutableList.of(x, x), y);
    Function f = b.build(b.tuple(variable, literal, withDefault, variableWithDefault));

    LabelVisitor visitor = analyze(f);
    assertThat(valueOf(visitor, variable)).containsExactly("{x|y}");
    assertThat(valueOf(visitor, literal)).containsExactly("y");
    assertThat(valueOf(visitor, withDefault)).containsExactly("y");
    assertThat(valueOf(visitor, variableWithDefault)).containsExactly("{x|y}");
  }

  @Test
  public void testPrioritySelect() {
    FunctionBuilder b = new FunctionBuilder("f");
    Node x = b.param("x", BITS8);
    Node y = b.param("y", BITS8);
    Node d = b.param("d", BITS8);
    ImmutableList<Node> cases = ImmutableList.of(x, y);
    Node zero = b.prioritySelect(b.literal(0, 2), cases, d);
    Node lowest = b.prioritySelect(b.literal(3, 2), cases, d);
    Node variable = b.prioritySelect(b.param("s", Types.bits(2)), cases, d);
    Function f = b.build(b.tuple(zero, lowest, variable));

    LabelVisitor visitor = analyze(f);
    assertThat(valueOf(visitor, zero)).containsExactly("d");
    assertThat(valueOf(visitor, lowest)).containsExactly("x");
    assertThat(valueOf(visitor, variable)).containsExactly("{d|x|y}");
  }

  @Test
  public void testOneHotSelect() {
    FunctionBuilder b = new FunctionBuilder("f");
    Node x = b.param("x", BITS8);
    Node y = b.param("y", BITS8);
    ImmutableList<Node> cases = ImmutableList.of(x, y);
    Node oneHot = b.oneHot(b.param("s", Types.bits(1)));
    Node joined = b.oneHotSelect(oneHot, cases);
    Node literal = b.oneHotSelect(b.literal(2, 2), cases);
    Node opaque = b.oneHotSelect(b.param("t", Types.bits(2)), cases);
    Node zero = b.oneHotSelect(b.literal(0, 2), cases);
    Function f = b.build(b.tuple(joined, literal, opaque, zero));

    LabelVisitor visitor = analyze(f);
    assertThat(valueOf(visitor, joined)).containsExactly("{x|y}");
    assertThat(valueOf(visitor, literal)).containsExactly("y");
    assertThat(valueOf(visitor, opaque)).containsExactly(opaque.getName());
    assertThat(valueOf(visitor, zero)).containsExactly(zero.getName());
    assertThat(visitor.defaulted).containsAtLeast(oneHot, opaque, zero);
  }

  @Test
  public void testJoinSeesLeafIndexWithinTheNode() {
    FunctionBuilder b = new FunctionBuilder("f");
    Node s = b.param("s", Types.bits(1));
    Type type = Types.tuple(BITS8, Types.array(2, BITS8));
    Node x = b.param("x", type);
    Node y = b.param("y", type);
    Node sel = b.select(s, ImmutableList.of(x, y), null);
    Function f = b.build(sel);

    List<ImmutableList<Integer>> indices = new ArrayList<>();
    DataflowVisitor<String> visitor =
        new LabelVisitor() {
          @Override
          protected String joinElements(
              Type elementType,
              List<String> dataSources,
              List<LeafTypeTreeView<String>> controlSources,
              Node node,
              ImmutableList<Integer> index) {
            assertThat(node).isSameInstanceAs(sel);
            assertThat(elementType).isEqualTo(BITS8);
            indices.add(index);
            return super.joinElements(elementType, dataSources, controlSources, node, index);
          }
        };
    visitor.analyze(f);
    assertThat(indices)
        .containsExactly(ImmutableList.of(0), ImmutableList.of(1, 0), ImmutableList.of(1, 1))
        .inOrder();
  }

  @Test
  public void testUnhandledOperator() {
    FunctionBuilder b = new FunctionBuilder("f");
    Node x = b.param("x", BITS8);
    Node n = b.not(x);
    Function f = b.build(n);

    DataflowVisitor<String> visitor =
        new LabelVisitor() {
          @Override
          protected void defaultHandler(Node node) {
            if (node.getOp() != Op.NOT) {
              super.defaultHandler(node);
            }
          }
        };
    PassException e = assertThrows(PassException.class, () -> visitor.analyze(f));
    assertThat(e.getType()).isEqualTo(DataflowErrors.UNHANDLED_OPERATOR);
    assertThat(e).hasMessageThat().contains("not");
    assertThat(visitor.isComputed(x)).isFalse();
  }

  @Test
  public void testJoinFailure() {
    FunctionBuilder b = new FunctionBuilder("f");
    Node s = b.param("s", Types.bits(1));
    Node x = b.param("x", BITS8);
    Node sel = b.select(s, ImmutableList.of(x, x), null);
    Function f = b.build(sel);

    DataflowVisitor<String> visitor =
        new LabelVisitor() {
          @Override
          protected String joinElements(
              Type elementType,
              List<String> dataSources,
              List<LeafTypeTreeView<String>> controlSources,
              Node node,
              ImmutableList<Integer> index) {
            return null;
          }
        };
    PassException e = assertThrows(PassException.class, () -> visitor.analyze(f));
    assertThat(e.getType()).isEqualTo(DataflowErrors.JOIN_FAILURE);
    assertThat(visitor.isComputed(s)).isFalse();
  }

  @Test
  public void testRecordedValueMustMatchTheType() {
    FunctionBuilder b = new FunctionBuilder("f");
    Node x = b.param("x", BITS8);
    Function f = b.build(x);

    DataflowVisitor<String> visitor =
        new LabelVisitor() {
          @Override
          protected void defaultHandler(Node node) {
            setValue(node, LeafTypeTree.create(Types.tuple(BITS8, BITS8), "?"));
          }
        };
    PassException e = assertThrows(PassException.class, () -> visitor.analyze(f));
    assertThat(e.getType()).isEqualTo(DataflowErrors.STRUCTURAL_MISMATCH);
  }

  @Test
  public void testStructuralMismatchInAHandlerAbortsTheAnalysis() {
    FunctionBuilder b = new FunctionBuilder("f");
    Node x = b.param("x", Types.array(2, BITS8));
    Node n = b.identity(x);
    Function f = b.build(n);

    DataflowVisitor<String> visitor =
        new LabelVisitor() {
          @Override
          protected void defaultHandler(Node node) {
            super.defaultHandler(node);
            getValue(node).getView(ImmutableList.of(5));
          }
        };
    PassException e = assertThrows(PassException.class, () -> visitor.analyze(f));
    assertThat(e.getType()).isEqualTo(DataflowErrors.STRUCTURAL_MISMATCH);
    assertThat(e).hasMessageThat().startsWith("OPT_STRUCTURAL_MISMATCH: ");
    assertThat(e).hasCauseThat().isNotNull();
    assertThat(visitor.isComputed(x)).isFalse();
  }

  @Test
  public void testAnalyzesOnlyOnce() {
    FunctionBuilder b = new FunctionBuilder("f");
    Function f = b.build(b.param("x", BITS8));
    LabelVisitor visitor = analyze(f);
    assertThrows(IllegalStateException.class, () -> visitor.analyze(f));
  }

  @Test
  public void testGetValueOfUncomputedNode() {
    FunctionBuilder b = new FunctionBuilder("f");
    Node x = b.param("x", BITS8);
    Function f = b.build(x);
    LabelVisitor visitor = analyze(f);
    Node late = FunctionBuilder.extend(f).not(x);
    assertThrows(IllegalStateException.class, () -> visitor.getValue(late));
  }

  @Test
  public void testEveryNodeIsComputed() {
    FunctionBuilder b = new FunctionBuilder("f");
    Node x = b.param("x", BITS8);
    Node dead = b.not(x);
    Function f = b.build(b.tuple(x));
    LabelVisitor visitor = analyze(f);
    for (Node node : f.getNodes()) {
      assertThat(visitor.isComputed(node)).isTrue();
    }
    assertThat(visitor.defaulted).containsExactly(x, dead).inOrder();
  }
}
