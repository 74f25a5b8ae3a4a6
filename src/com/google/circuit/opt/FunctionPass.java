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

/**
 * Interface for optimizations that rewrite one function at a time.
 *
 * <p>A pass sees only the function it is given and may be run on distinct functions
 * independently.
 */
public interface FunctionPass {

  /**
   * Optimizes {@code function} in place.
   *
   * @return whether the function was changed, so that a fixed-point loop knows whether to run
   *     again.
   */
  boolean process(Function function);
}
