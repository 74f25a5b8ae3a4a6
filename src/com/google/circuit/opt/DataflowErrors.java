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

/** Static error constants related to the dataflow analyses and the passes built on them. */
public final class DataflowErrors {

  public static final DiagnosticType STRUCTURAL_MISMATCH =
      DiagnosticType.error(
          "OPT_STRUCTURAL_MISMATCH",
          "Dataflow value of {0} does not match its type structure: {1}");

  public static final DiagnosticType UNHANDLED_OPERATOR =
      DiagnosticType.error(
          "OPT_UNHANDLED_OPERATOR", "No dataflow value was computed for {0} (op {1}).");

  public static final DiagnosticType JOIN_FAILURE =
      DiagnosticType.error("OPT_JOIN_FAILURE", "Cannot join dataflow values at {0}: {1}");

  public static final DiagnosticType REWRITE_FAILURE =
      DiagnosticType.error("OPT_REWRITE_FAILURE", "Cannot replace {0} with {1}: {2}");

  private DataflowErrors() {}
}
