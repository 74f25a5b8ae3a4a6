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
import com.google.circuit.ir.Node;
import com.google.circuit.ir.Program;
import com.google.circuit.ir.Type;
import com.google.circuit.ir.Types;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class PassPipelineTest {

  private static final Type BITS32 = Types.bits(32);

  private OptimizationPassOptions options;
  private List<String> passesRun;

  @Before
  public void setUp() {
    options = new OptimizationPassOptions();
    passesRun = new ArrayList<>();
  }

  /** A pass reporting a change on its first {@code numChanges} runs. */
  private PassFactory createPass(String name, int numChanges, boolean loopable) {
    int[] remaining = {numChanges};
    return PassFactory.builder()
        .setName(name)
        .setRunInFixedPointLoop(loopable)
        .setInternalFactory(
            (o) ->
                (function) -> {
                  passesRun.add(name);
                  return remaining[0]-- > 0;
                })
        .build();
  }

  private static Function simpleFunction(String name) {
    FunctionBuilder b = new FunctionBuilder(name);
    return b.build(b.param("x", BITS32));
  }

  @Test
  public void testOneShotPassesRunOnceInOrder() {
    PassPipeline pipeline =
        new PassPipeline(options)
            .addPass(createPass("a", 5, false))
            .addPass(createPass("b", 0, false));
    assertThat(pipeline.process(simpleFunction("f"))).isTrue();
    assertThat(passesRun).containsExactly("a", "b").inOrder();
  }

  @Test
  public void testLoopRunsUntilNothingChanges() {
    PassPipeline pipeline =
        new PassPipeline(options)
            .addPass(createPass("x", 2, true))
            .addPass(createPass("y", 1, true))
            .addPass(createPass("z", 0, false));
    assertThat(pipeline.process(simpleFunction("f"))).isTrue();
    assertThat(passesRun).containsExactly("x", "y", "x", "y", "x", "y", "z").inOrder();
    assertThat(pipeline.getResults().getInvocationCount()).isEqualTo(7);
    assertThat(pipeline.getResults().getChangeCount("x")).isEqualTo(2);
    assertThat(pipeline.getResults().getChangeCount("y")).isEqualTo(1);
  }

  @Test
  public void testUnchangedFunction() {
    PassPipeline pipeline = new PassPipeline(options).addPass(createPass("x", 0, true));
    assertThat(pipeline.process(simpleFunction("f"))).isFalse();
    assertThat(passesRun).containsExactly("x");
  }

  @Test
  public void testConfiguredIterationLimitStopsTheLoop() {
    options.optimizationLoopMaxIterations = 3;
    PassPipeline pipeline =
        new PassPipeline(options).addPass(createPass("x", Integer.MAX_VALUE, true));
    assertThat(pipeline.process(simpleFunction("f"))).isTrue();
    assertThat(passesRun).containsExactly("x", "x", "x");
  }

  @Test
  public void testLoopThatNeverConvergesIsAnError() {
    PassPipeline pipeline =
        new PassPipeline(options).addPass(createPass("x", Integer.MAX_VALUE, true));
    IllegalStateException e =
        assertThrows(IllegalStateException.class, () -> pipeline.process(simpleFunction("f")));
    assertThat(e).hasMessageThat().isEqualTo(PassPipeline.OPTIMIZE_LOOP_ERROR);
    assertThat(passesRun).hasSize(PassPipeline.MAX_LOOPS);
  }

  @Test
  public void testDuplicatePassNames() {
    PassPipeline pipeline = new PassPipeline(options).addPass(createPass("x", 0, true));
    assertThrows(
        IllegalArgumentException.class, () -> pipeline.addPass(createPass("x", 0, false)));
  }

  @Test
  public void testEveryFunctionOfAProgramIsProcessed() {
    Program program = new Program("p");
    program.addFunction(simpleFunction("f"));
    program.addFunction(simpleFunction("g"));
    PassPipeline pipeline = new PassPipeline(options).addPass(createPass("x", 0, false));

    assertThat(pipeline.process(program)).isFalse();
    ImmutableList<PassResults.Invocation> invocations = pipeline.getResults().getInvocations();
    assertThat(invocations).hasSize(2);
    assertThat(invocations.get(0).getFunctionName()).isEqualTo("f");
    assertThat(invocations.get(1).getFunctionName()).isEqualTo("g");
    assertThat(invocations.get(1).getPassName()).isEqualTo("x");
    assertThat(invocations.get(1).isChanged()).isFalse();
    assertThat(pipeline.getResults().toString())
        .isEqualTo("x on f: unchanged\nx on g: unchanged\n");
  }

  @Test
  public void testDataflowSimplificationReachesAFixedPoint() {
    FunctionBuilder b = new FunctionBuilder("f");
    Node x = b.param("x", BITS32);
    Node y = b.param("y", BITS32);
    Node z = b.tuple(x, y);
    Node sum = b.add(b.tupleIndex(z, 0), b.tupleIndex(z, 1));
    Function f = b.build(sum);

    PassPipeline pipeline = OptimizationPasses.createPipeline(options);
    assertThat(pipeline.process(f)).isTrue();
    assertThat(sum.getOperands()).containsExactly(x, y).inOrder();

    PassResults results = pipeline.getResults();
    assertThat(results.getInvocationCount()).isEqualTo(2);
    assertThat(results.getChangeCount(PassNames.DATAFLOW_SIMPLIFICATION)).isEqualTo(1);
  }
}
