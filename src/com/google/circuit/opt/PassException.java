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

import org.jspecify.annotations.Nullable;

/**
 * Aborts a pass invocation on one function. The function is left exactly as it was before the
 * pass started.
 */
public final class PassException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final DiagnosticType type;

  PassException(DiagnosticType type, Object... arguments) {
    this(type, (Throwable) null, arguments);
  }

  PassException(DiagnosticType type, @Nullable Throwable cause, Object... arguments) {
    super(type.describe(arguments), cause);
    this.type = type;
  }

  public DiagnosticType getType() {
    return type;
  }
}
