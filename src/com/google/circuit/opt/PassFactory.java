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

import static com.google.common.base.Preconditions.checkState;

import com.google.auto.value.AutoValue;
import com.google.errorprone.annotations.ForOverride;

/**
 * A factory for creating optimization passes based on the options injected.
 *
 * <p>Contains all meta-data about passes (whether it belongs in a fixed-point loop, a short name
 * for logging and results, a human-readable description for documentation).
 */
@AutoValue
public abstract class PassFactory {

  /** The name of the pass as it will appear in logs and {@link PassResults}. */
  public abstract String getName();

  /** A human-readable description of what the pass does. */
  public abstract String getLongName();

  /** Whether this factory must or must not appear in a {@link PassPipeline} loop. */
  public abstract boolean isRunInFixedPointLoop();

  /**
   * A simple factory function for creating actual pass instances.
   *
   * <p>Users should call {@link #create(OptimizationPassOptions)} rather than use this object
   * directly.
   */
  abstract java.util.function.Function<OptimizationPassOptions, ? extends FunctionPass>
      getInternalFactory();

  public abstract Builder toBuilder();

  PassFactory() {
    // Subclasses in this package only.
  }

  /** A builder for a {@link PassFactory}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setName(String x);

    public abstract Builder setLongName(String x);

    public abstract Builder setRunInFixedPointLoop(boolean b);

    public abstract Builder setInternalFactory(
        java.util.function.Function<OptimizationPassOptions, ? extends FunctionPass> x);

    @ForOverride
    abstract PassFactory autoBuild();

    public final PassFactory build() {
      PassFactory result = autoBuild();
      checkState(!result.getName().isEmpty());
      return result;
    }
  }

  public static Builder builder() {
    return new AutoValue_PassFactory.Builder().setRunInFixedPointLoop(false).setLongName("");
  }

  /** Create a no-op pass that can only run once. */
  public static PassFactory createEmptyPass(String name) {
    return builder().setName(name).setInternalFactory((o) -> (function) -> false).build();
  }

  /** Creates a new pass to be run. */
  final FunctionPass create(OptimizationPassOptions options) {
    return getInternalFactory().apply(options);
  }
}
