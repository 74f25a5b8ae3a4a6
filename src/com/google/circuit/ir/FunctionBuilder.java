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
import java.util.Arrays;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Creates type-checked nodes in a {@link Function}.
 *
 * <p>Typical usage:
 *
 * <pre>
 * FunctionBuilder b = new FunctionBuilder("f");
 * Node x = b.param("x", Types.bits(32));
 * Node y = b.param("y", Types.bits(32));
 * Function f = b.build(b.tupleIndex(b.tuple(x, y), 1));
 * </pre>
 *
 * A builder can also {@link #extend} an existing function, which is how passes add nodes.
 */
public final class FunctionBuilder {
  private final Function function;

  public FunctionBuilder(String name) {
    this(new Function(name));
  }

  private FunctionBuilder(Function function) {
    this.function = function;
  }

  /** Returns a builder that adds nodes to an existing function. */
  public static FunctionBuilder extend(Function function) {
    return new FunctionBuilder(function);
  }

  public Function getFunction() {
    return function;
  }

  /** Sets the return value and returns the finished function. */
  public Function build(Node returnValue) {
    function.setReturnValue(returnValue);
    return function;
  }

  public Node param(String name, Type type) {
    return makeNode(Op.PARAM, type, ImmutableList.of(), 0).setName(name);
  }

  /** A bits literal. {@code value} is interpreted as unsigned and must fit in {@code width}. */
  public Node literal(long value, int width) {
    checkArgument(width > 0 && width <= 64, "literal width %s not in [1, 64]", width);
    checkArgument(
        width == 64 || (value >>> width) == 0, "value %s does not fit in %s bits", value, width);
    return makeNode(Op.LITERAL, Types.bits(width), ImmutableList.of(), value);
  }

  public Node tuple(Node... elements) {
    return tuple(Arrays.asList(elements));
  }

  public Node tuple(List<Node> elements) {
    List<Type> types = new ArrayList<>();
    for (Node element : elements) {
      types.add(element.getType());
    }
    return makeNode(Op.TUPLE, Types.tuple(types), elements, 0);
  }

  public Node tupleIndex(Node tuple, int index) {
    Type type = tuple.getType();
    checkArgument(type.isTuple(), "tuple_index operand %s is not a tuple", tuple);
    checkArgument(
        index >= 0 && index < type.toTuple().size(), "index %s out of range for %s", index, type);
    return makeNode(Op.TUPLE_INDEX, type.getChildType(index), ImmutableList.of(tuple), index);
  }

  public Node array(Node... elements) {
    return array(Arrays.asList(elements));
  }

  public Node array(List<Node> elements) {
    checkArgument(!elements.isEmpty(), "arrays must have at least one element");
    Type elementType = elements.get(0).getType();
    for (Node element : elements) {
      checkArgument(
          element.getType().equals(elementType),
          "array element %s does not have type %s",
          element,
          elementType);
    }
    return makeNode(Op.ARRAY, Types.array(elements.size(), elementType), elements, 0);
  }

  /** Indexes {@code array} by one index per dimension, outermost first. */
  public Node arrayIndex(Node array, Node... indices) {
    return arrayIndex(array, Arrays.asList(indices));
  }

  public Node arrayIndex(Node array, List<Node> indices) {
    Type type = indexedType(array, indices);
    return makeNode(Op.ARRAY_INDEX, type, concat(ImmutableList.of(array), indices), 0);
  }

  /** Replaces the element of {@code array} at {@code indices} with {@code value}. */
  public Node arrayUpdate(Node array, Node value, Node... indices) {
    return arrayUpdate(array, value, Arrays.asList(indices));
  }

  public Node arrayUpdate(Node array, Node value, List<Node> indices) {
    Type elementType = indexedType(array, indices);
    checkArgument(
        value.getType().equals(elementType),
        "update value %s does not have type %s",
        value,
        elementType);
    return makeNode(
        Op.ARRAY_UPDATE, array.getType(), concat(ImmutableList.of(array, value), indices), 0);
  }

  /** Takes {@code width} consecutive elements of {@code array} starting at {@code start}. */
  public Node arraySlice(Node array, Node start, int width) {
    checkArgument(array.getType().isArray(), "array_slice operand %s is not an array", array);
    checkArgument(start.getType().isBits(), "array_slice start %s is not bits", start);
    checkArgument(width > 0, "array_slice width must be positive, got %s", width);
    Type type = Types.array(width, array.getType().toArray().getElementType());
    return makeNode(Op.ARRAY_SLICE, type, ImmutableList.of(array, start), width);
  }

  public Node arrayConcat(Node... arrays) {
    return arrayConcat(Arrays.asList(arrays));
  }

  public Node arrayConcat(List<Node> arrays) {
    checkArgument(!arrays.isEmpty(), "array_concat needs at least one operand");
    checkArgument(
        arrays.get(0).getType().isArray(),
        "array_concat operand %s is not an array",
        arrays.get(0));
    Type elementType = arrays.get(0).getType().toArray().getElementType();
    int size = 0;
    for (Node array : arrays) {
      checkArgument(array.getType().isArray(), "array_concat operand %s is not an array", array);
      ArrayType type = array.getType().toArray();
      checkArgument(
          type.getElementType().equals(elementType),
          "array_concat operand %s does not have element type %s",
          array,
          elementType);
      size += type.getSize();
    }
    return makeNode(Op.ARRAY_CONCAT, Types.array(size, elementType), arrays, 0);
  }

  /**
   * A select on a binary-encoded selector. Without a default value there must be exactly one
   * case per selector value.
   */
  public Node select(Node selector, List<Node> cases, @Nullable Node defaultValue) {
    int width = selectorWidth(selector);
    Type type = caseType(cases, defaultValue);
    if (defaultValue == null) {
      checkArgument(
          width < 31 && cases.size() == (1 << width),
          "select without a default needs 2^%s cases, got %s",
          width,
          cases.size());
    } else {
      checkArgument(
          width >= 31 || cases.size() < (1 << width),
          "select with a default must have fewer than 2^%s cases, got %s",
          width,
          cases.size());
    }
    List<Node> operands = new ArrayList<>();
    operands.add(selector);
    operands.addAll(cases);
    if (defaultValue != null) {
      operands.add(defaultValue);
    }
    return makeNode(Op.SEL, type, operands, 0, defaultValue != null);
  }

  /**
   * A select returning the case of the lowest set selector bit, or {@code defaultValue} if no bit
   * is set.
   */
  public Node prioritySelect(Node selector, List<Node> cases, Node defaultValue) {
    checkArgument(
        selectorWidth(selector) == cases.size(),
        "priority_sel needs one selector bit per case");
    Type type = caseType(cases, defaultValue);
    List<Node> operands = new ArrayList<>();
    operands.add(selector);
    operands.addAll(cases);
    operands.add(defaultValue);
    return makeNode(Op.PRIORITY_SEL, type, operands, 0);
  }

  /** A select returning the bitwise OR of every case whose selector bit is set. */
  public Node oneHotSelect(Node selector, List<Node> cases) {
    checkArgument(
        selectorWidth(selector) == cases.size(), "one_hot_sel needs one selector bit per case");
    Type type = caseType(cases, null);
    return makeNode(Op.ONE_HOT_SEL, type, concat(ImmutableList.of(selector), cases), 0);
  }

  /**
   * Sets exactly one bit: that of the lowest set bit of {@code input}, or the extra top bit when
   * {@code input} is zero.
   */
  public Node oneHot(Node input) {
    int width = selectorWidth(input);
    return makeNode(Op.ONE_HOT, Types.bits(width + 1), ImmutableList.of(input), 0);
  }

  public Node identity(Node operand) {
    return makeNode(Op.IDENTITY, operand.getType(), ImmutableList.of(operand), 0);
  }

  public Node binary(Op op, Node lhs, Node rhs) {
    checkArgument(op.isBinary(), "%s is not a binary op", op);
    checkArgument(lhs.getType().isBits(), "%s operand %s is not bits", op, lhs);
    checkArgument(
        lhs.getType().equals(rhs.getType()), "%s operands %s and %s differ in type", op, lhs, rhs);
    Type type = op.isComparison() ? Types.bits(1) : lhs.getType();
    return makeNode(op, type, ImmutableList.of(lhs, rhs), 0);
  }

  public Node unary(Op op, Node operand) {
    checkArgument(op.isUnary(), "%s is not a unary op", op);
    checkArgument(operand.getType().isBits(), "%s operand %s is not bits", op, operand);
    return makeNode(op, operand.getType(), ImmutableList.of(operand), 0);
  }

  public Node add(Node lhs, Node rhs) {
    return binary(Op.ADD, lhs, rhs);
  }

  public Node and(Node lhs, Node rhs) {
    return binary(Op.AND, lhs, rhs);
  }

  public Node eq(Node lhs, Node rhs) {
    return binary(Op.EQ, lhs, rhs);
  }

  public Node not(Node operand) {
    return unary(Op.NOT, operand);
  }

  private Node makeNode(Op op, Type type, List<Node> operands, long attribute) {
    return makeNode(op, type, operands, attribute, false);
  }

  private Node makeNode(
      Op op, Type type, List<Node> operands, long attribute, boolean hasDefault) {
    return function.addNode(op, type, operands, attribute, hasDefault);
  }

  private static Type indexedType(Node array, List<Node> indices) {
    Type type = array.getType();
    for (Node index : indices) {
      checkArgument(type.isArray(), "too many indices for %s", array);
      checkArgument(index.getType().isBits(), "array index %s is not bits", index);
      type = type.toArray().getElementType();
    }
    return type;
  }

  private static int selectorWidth(Node selector) {
    checkArgument(selector.getType().isBits(), "selector %s is not bits", selector);
    return selector.getType().toBits().getWidth();
  }

  private static Type caseType(List<Node> cases, @Nullable Node defaultValue) {
    checkArgument(!cases.isEmpty(), "select needs at least one case");
    Type type = cases.get(0).getType();
    for (Node c : cases) {
      checkArgument(c.getType().equals(type), "case %s does not have type %s", c, type);
    }
    if (defaultValue != null) {
      checkArgument(
          defaultValue.getType().equals(type),
          "default %s does not have type %s",
          defaultValue,
          type);
    }
    return type;
  }

  private static List<Node> concat(List<Node> first, List<Node> second) {
    return ImmutableList.<Node>builder().addAll(first).addAll(second).build();
  }
}
