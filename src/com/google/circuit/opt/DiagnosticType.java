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
import java.text.MessageFormat;

/**
 * Identifies one kind of optimization failure: a stable key, used in messages and by tests, and a
 * {@link MessageFormat} pattern for its description.
 */
public final class DiagnosticType implements Comparable<DiagnosticType>, Serializable {
  private static final long serialVersionUID = 1;

  /** Stable identifier, e.g. {@code OPT_JOIN_FAILURE}. */
  public final String key;

  /** {@link MessageFormat} pattern taking the arguments given when the failure is raised. */
  public final String format;

  /** Creates an error with the given key and description pattern. */
  public static DiagnosticType error(String key, String format) {
    return new DiagnosticType(key, format);
  }

  private DiagnosticType(String key, String format) {
    this.key = key;
    this.format = format;
  }

  /** Formats the description, prefixed by the key. */
  String describe(Object... arguments) {
    // MessageFormat drops single quotes; patterns must double them.
    return key + ": " + MessageFormat.format(format, arguments);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof DiagnosticType && ((DiagnosticType) o).key.equals(key);
  }

  @Override
  public int hashCode() {
    return key.hashCode();
  }

  @Override
  public int compareTo(DiagnosticType other) {
    return key.compareTo(other.key);
  }

  @Override
  public String toString() {
    return key + ": " + format;
  }
}
