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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/** Records every pass invocation made by a {@link PassPipeline} and whether it changed code. */
public final class PassResults {

  /** One run of one pass on one function. */
  @AutoValue
  public abstract static class Invocation {
    public abstract String getPassName();

    public abstract String getFunctionName();

    public abstract boolean isChanged();

    static Invocation create(String passName, String functionName, boolean changed) {
      return new AutoValue_PassResults_Invocation(passName, functionName, changed);
    }
  }

  private final List<Invocation> invocations = new ArrayList<>();

  void record(String passName, String functionName, boolean changed) {
    invocations.add(Invocation.create(passName, functionName, changed));
  }

  public ImmutableList<Invocation> getInvocations() {
    return ImmutableList.copyOf(invocations);
  }

  public int getInvocationCount() {
    return invocations.size();
  }

  /** Number of runs of {@code passName} that changed a function. */
  public int getChangeCount(String passName) {
    int count = 0;
    for (Invocation invocation : invocations) {
      if (invocation.isChanged() && invocation.getPassName().equals(passName)) {
        count++;
      }
    }
    return count;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Invocation invocation : invocations) {
      sb.append(invocation.getPassName())
          .append(" on ")
          .append(invocation.getFunctionName())
          .append(invocation.isChanged() ? ": changed\n" : ": unchanged\n");
    }
    return sb.toString();
  }
}
