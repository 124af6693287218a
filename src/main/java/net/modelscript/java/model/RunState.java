// Copyright 2026 The ModelScript Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.modelscript.java.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import net.modelscript.java.eval.Model;
import net.modelscript.java.eval.StochasticNode;

/**
 * The state of one run of a model: each stochastic node the model produced, in order, and the
 * value to which the driver resolved it. A value either came from an observation or was drawn.
 *
 * <p>A RunState is an immutable snapshot. The driver accumulates the state of a run in a {@link
 * Recorder}, which belongs to that run alone.
 */
@Immutable
public final class RunState {

  private final ImmutableMap<String, StochasticNode> descriptors;
  private final ImmutableMap<String, Object> values;
  private final ImmutableSet<String> observed;

  private RunState(
      ImmutableMap<String, StochasticNode> descriptors,
      ImmutableMap<String, Object> values,
      ImmutableSet<String> observed) {
    this.descriptors = descriptors;
    this.values = values;
    this.observed = observed;
  }

  /** Returns the stochastic nodes of the run, keyed by name, in the order they were produced. */
  public ImmutableMap<String, StochasticNode> getDescriptors() {
    return descriptors;
  }

  /** Returns the resolved value of each node, keyed by name, in the order they were produced. */
  public ImmutableMap<String, Object> getValues() {
    return values;
  }

  /** Returns the names of the nodes whose values came from observations. */
  public ImmutableSet<String> getObserved() {
    return observed;
  }

  /** Returns the names of all nodes of the run, in order. */
  public ImmutableSet<String> getNames() {
    return descriptors.keySet();
  }

  /** Returns the value of the named node, or null if the run produced no such node. */
  @Nullable
  public Object getValue(String name) {
    return values.get(name);
  }

  public boolean isObserved(String name) {
    return observed.contains(name);
  }

  public int size() {
    return descriptors.size();
  }

  @Override
  public String toString() {
    StringBuilder buf = new StringBuilder("RunState{");
    String sep = "";
    for (Map.Entry<String, Object> e : values.entrySet()) {
      buf.append(sep).append(e.getKey()).append('=').append(Model.repr(e.getValue()));
      if (observed.contains(e.getKey())) {
        buf.append(" (observed)");
      }
      sep = ", ";
    }
    return buf.append('}').toString();
  }

  /** Accumulates the state of a single run. */
  static final class Recorder {
    private final Map<String, StochasticNode> descriptors = new LinkedHashMap<>();
    private final Map<String, Object> values = new LinkedHashMap<>();
    private final Set<String> observed = new LinkedHashSet<>();

    boolean contains(String name) {
      return descriptors.containsKey(name);
    }

    void record(StochasticNode node, Object value, boolean isObserved) {
      String name = node.getName();
      Preconditions.checkState(!contains(name), "duplicate node %s", name);
      descriptors.put(name, node);
      values.put(name, value);
      if (isObserved) {
        observed.add(name);
      }
    }

    RunState snapshot() {
      return new RunState(
          ImmutableMap.copyOf(descriptors),
          ImmutableMap.copyOf(values),
          ImmutableSet.copyOf(observed));
    }
  }
}
