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

import java.util.Locale;

/** The operation computed by a {@link Node}. */
public enum Op {
  PARAM,
  LITERAL,

  // Composite construction and projection.
  TUPLE,
  TUPLE_INDEX,
  ARRAY,
  ARRAY_INDEX,
  ARRAY_SLICE,
  ARRAY_CONCAT,
  ARRAY_UPDATE,

  // Multi-way selects. Operand 0 is the selector.
  SEL,
  PRIORITY_SEL,
  ONE_HOT_SEL,
  ONE_HOT,

  IDENTITY,

  // Scalar bit operations.
  ADD,
  SUB,
  AND,
  OR,
  XOR,
  NOT,
  NEG,
  EQ,
  NE,
  ULT;

  private final String text;

  Op() {
    this.text = name().toLowerCase(Locale.ROOT);
  }

  /** The name used for this op in textual IR, e.g. {@code tuple_index}. */
  public String getText() {
    return text;
  }

  public boolean isSelect() {
    return this == SEL || this == PRIORITY_SEL || this == ONE_HOT_SEL;
  }

  public boolean isBinary() {
    switch (this) {
      case ADD:
      case SUB:
      case AND:
      case OR:
      case XOR:
      case EQ:
      case NE:
      case ULT:
        return true;
      default:
        return false;
    }
  }

  public boolean isUnary() {
    return this == NOT || this == NEG;
  }

  /** Whether the result is a single bit regardless of the operand width. */
  public boolean isComparison() {
    return this == EQ || this == NE || this == ULT;
  }
}
