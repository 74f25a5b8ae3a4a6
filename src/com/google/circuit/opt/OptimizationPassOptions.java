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

import java.io.Serializable;

/** Options for the optimization pipeline and its passes. */
public class OptimizationPassOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  /**
   * Maximum number of iterations of a fixed-point loop before the pipeline gives up on reaching a
   * fixed point. Values outside {@code [1, PassPipeline.MAX_LOOPS]} mean {@code MAX_LOOPS}, where
   * exceeding the limit is an internal error.
   */
  public int optimizationLoopMaxIterations = 0;

  private boolean dataflowMaterializeProjections = true;

  private boolean dataflowRebuildComposites = true;

  /**
   * Whether dataflow simplification may replace a node whose value is a part of another node's
   * value with a {@code tuple_index}/{@code array_index} chain reading it directly.
   */
  public void setDataflowMaterializeProjections(boolean value) {
    this.dataflowMaterializeProjections = value;
  }

  public boolean shouldMaterializeProjections() {
    return dataflowMaterializeProjections;
  }

  /**
   * Whether dataflow simplification may rebuild a tuple or array from existing nodes equivalent
   * to each of its elements.
   */
  public void setDataflowRebuildComposites(boolean value) {
    this.dataflowRebuildComposites = value;
  }

  public boolean shouldRebuildComposites() {
    return dataflowRebuildComposites;
  }
}
