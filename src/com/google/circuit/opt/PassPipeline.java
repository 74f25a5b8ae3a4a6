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

import com.google.circuit.ir.Function;
import com.google.circuit.ir.Program;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Runs a sequence of passes over every function of a program.
 *
 * <p>Passes whose factory is marked {@link PassFactory#isRunInFixedPointLoop} and that are added
 * consecutively form a loop: the loop is rerun on a function until one full iteration leaves it
 * unchanged. Functions are processed independently of each other.
 */
public final class PassPipeline {

  private static final Logger logger = Logger.getLogger(PassPipeline.class.getName());

  static final int MAX_LOOPS = 100;
  static final String OPTIMIZE_LOOP_ERROR =
      "Fixed point loop exceeded the maximum number of iterations.";

  private final OptimizationPassOptions options;
  private final List<PassFactory> passes = new ArrayList<>();
  private final Set<String> names = new HashSet<>();
  private final PassResults results = new PassResults();

  /** @see OptimizationPassOptions#optimizationLoopMaxIterations */
  private final int optimizationLoopMaxIterations;

  public PassPipeline(OptimizationPassOptions options) {
    this.options = options;
    int maxIterations = options.optimizationLoopMaxIterations;
    if (maxIterations > 0 && maxIterations <= MAX_LOOPS) {
      this.optimizationLoopMaxIterations = maxIterations;
    } else {
      this.optimizationLoopMaxIterations = MAX_LOOPS;
    }
  }

  @CanIgnoreReturnValue
  public PassPipeline addPass(PassFactory factory) {
    String name = factory.getName();
    checkArgument(names.add(name), "Already a pass with name '%s' in this pipeline", name);
    passes.add(factory);
    return this;
  }

  public PassResults getResults() {
    return results;
  }

  /** Runs the pipeline on every function of {@code program}. Returns whether any changed. */
  @CanIgnoreReturnValue
  public boolean process(Program program) {
    boolean changed = false;
    for (Function function : program.getFunctions()) {
      changed |= process(function);
    }
    return changed;
  }

  /** Runs the pipeline on {@code function}. Returns whether it changed. */
  @CanIgnoreReturnValue
  public boolean process(Function function) {
    boolean changed = false;
    int i = 0;
    while (i < passes.size()) {
      if (!passes.get(i).isRunInFixedPointLoop()) {
        changed |= runPass(passes.get(i), function);
        i++;
        continue;
      }
      int end = i;
      while (end < passes.size() && passes.get(end).isRunInFixedPointLoop()) {
        end++;
      }
      changed |= runLoop(passes.subList(i, end), function);
      i = end;
    }
    return changed;
  }

  private boolean runLoop(List<PassFactory> loop, Function function) {
    boolean changed = false;
    int count = 1;
    while (true) {
      if (count > optimizationLoopMaxIterations) {
        if (optimizationLoopMaxIterations < MAX_LOOPS) {
          logger.info(
              "Stopping fixed point loop on " + function.getName() + " after "
                  + optimizationLoopMaxIterations + " iterations");
          return changed;
        }
        throw new IllegalStateException(OPTIMIZE_LOOP_ERROR);
      }
      count++;
      boolean lastIterMadeChanges = false;
      for (PassFactory factory : loop) {
        lastIterMadeChanges |= runPass(factory, function);
      }
      if (!lastIterMadeChanges) {
        return changed;
      }
      changed = true;
    }
  }

  private boolean runPass(PassFactory factory, Function function) {
    String name = factory.getName();
    logger.fine("Running pass " + name + " on " + function.getName());
    boolean changed = factory.create(options).process(function);
    results.record(name, function.getName(), changed);
    return changed;
  }
}
