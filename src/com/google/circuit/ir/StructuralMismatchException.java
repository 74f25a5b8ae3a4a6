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

import java.util.List;

/**
 * Thrown when a tree index is inconsistent with the shape of a type: it descends into a leaf, it
 * is out of range for a tuple or array, or it addresses a leaf where a sub-tree was required.
 */
public final class StructuralMismatchException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  StructuralMismatchException(Type type, List<Integer> index) {
    this("index " + index + " does not match the structure of " + type);
  }

  StructuralMismatchException(String message) {
    super(message);
  }
}
