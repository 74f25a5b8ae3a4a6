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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class TypesTest {

  @Test
  public void testInterning() {
    assertThat(Types.bits(8)).isSameInstanceAs(Types.bits(8));
    assertThat(Types.tuple(Types.bits(1), Types.bits(2)))
        .isSameInstanceAs(Types.tuple(ImmutableList.of(Types.bits(1), Types.bits(2))));
    assertThat(Types.array(4, Types.bits(8))).isSameInstanceAs(Types.array(4, Types.bits(8)));
    assertThat(Types.bits(8)).isNotEqualTo(Types.bits(9));
  }

  @Test
  public void testToString() {
    assertThat(Types.bits(8).toString()).isEqualTo("bits[8]");
    assertThat(Types.array(4, Types.bits(8)).toString()).isEqualTo("bits[8][4]");
    assertThat(Types.tuple(Types.bits(1), Types.array(2, Types.bits(3))).toString())
        .isEqualTo("(bits[1], bits[3][2])");
    assertThat(Types.tuple().toString()).isEqualTo("()");
  }

  @Test
  public void testLeafLayout() {
    Type type = Types.tuple(Types.bits(8), Types.array(2, Types.bits(4)));
    assertThat(type.getLeafCount()).isEqualTo(3);
    assertThat(type.getLeafTypes())
        .containsExactly(Types.bits(8), Types.bits(4), Types.bits(4))
        .inOrder();
    assertThat(type.getLeafIndices())
        .containsExactly(ImmutableList.of(0), ImmutableList.of(1, 0), ImmutableList.of(1, 1))
        .inOrder();
    assertThat(type.getChildLeafOffset(1)).isEqualTo(1);
  }

  @Test
  public void testScalarHasOneLeafWithEmptyIndex() {
    assertThat(Types.bits(0).getLeafCount()).isEqualTo(1);
    assertThat(Types.bits(32).getLeafIndices()).containsExactly(ImmutableList.of());
  }

  @Test
  public void testEmptyTupleHasNoLeaves() {
    assertThat(Types.tuple().getLeafCount()).isEqualTo(0);
    assertThat(Types.tuple(Types.tuple(), Types.bits(1)).getLeafIndices())
        .containsExactly(ImmutableList.of(1));
  }

  @Test
  public void testGetSubtype() {
    Type type = Types.tuple(Types.bits(8), Types.array(2, Types.tuple(Types.bits(1))));
    assertThat(Types.getSubtype(type, ImmutableList.of())).isSameInstanceAs(type);
    assertThat(Types.getSubtype(type, ImmutableList.of(1, 1, 0))).isEqualTo(Types.bits(1));
    assertThrows(
        StructuralMismatchException.class,
        () -> Types.getSubtype(type, ImmutableList.of(2)));
    assertThrows(
        StructuralMismatchException.class,
        () -> Types.getSubtype(type, ImmutableList.of(0, 0)));
    assertThrows(
        StructuralMismatchException.class,
        () -> Types.getSubtype(type, ImmutableList.of(1, -1)));
  }

  @Test
  public void testInvalidTypes() {
    assertThrows(IllegalArgumentException.class, () -> Types.array(0, Types.bits(1)));
    assertThrows(IllegalArgumentException.class, () -> Types.bits(-1));
  }

  @Test
  public void testConversions() {
    assertThat(Types.array(3, Types.bits(2)).toArray().getSize()).isEqualTo(3);
    assertThat(Types.bits(5).toBits().getWidth()).isEqualTo(5);
    assertThrows(IllegalStateException.class, () -> Types.bits(5).toTuple());
  }
}
