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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** A named collection of functions, the unit handed to a pass pipeline. */
public final class Program {
  private final String name;
  private final Map<String, Function> functions = new LinkedHashMap<>();

  public Program(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  public void addFunction(Function function) {
    checkArgument(
        !functions.containsKey(function.getName()),
        "duplicate function %s",
        function.getName());
    functions.put(function.getName(), function);
  }

  public ImmutableList<Function> getFunctions() {
    return ImmutableList.copyOf(functions.values());
  }

  public @Nullable Function getFunction(String functionName) {
    return functions.get(functionName);
  }
}
