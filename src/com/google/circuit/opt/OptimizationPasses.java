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

import com.google.common.collect.ImmutableList;

/** Pass factories for the circuit optimizer, and the default order in which they run. */
public final class OptimizationPasses {

  /** Simplifies nodes using the canonical sources computed by a dataflow analysis. */
  public static final PassFactory dataflowSimplification =
      PassFactory.builder()
          .setName(PassNames.DATAFLOW_SIMPLIFICATION)
          .setLongName("Dataflow Optimization")
          .setRunInFixedPointLoop(true)
          .setInternalFactory(DataflowSimplificationPass::new)
          .build();

  /** Returns the passes to run, in order. */
  public static ImmutableList<PassFactory> getOptimizations() {
    return ImmutableList.of(dataflowSimplification);
  }

  /** Creates a pipeline running {@link #getOptimizations()} with the given options. */
  public static PassPipeline createPipeline(OptimizationPassOptions options) {
    PassPipeline pipeline = new PassPipeline(options);
    for (PassFactory factory : getOptimizations()) {
      pipeline.addPass(factory);
    }
    return pipeline;
  }

  private OptimizationPasses() {}
}
