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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSet;
import net.modelscript.java.eval.EvalException;

/**
 * Indicates that a run of a model produced two stochastic nodes of the same name. The run is
 * abandoned at the second node; the exception holds the state of the run before it.
 */
public final class DuplicateNameException extends EvalException {

  private final String duplicateName;
  private final ImmutableSet<String> seenNames;
  private final RunState state;

  DuplicateNameException(String duplicateName, RunState state) {
    super(
        String.format(
            "duplicate stochastic node name '%s' (already seen: %s)",
            duplicateName, Joiner.on(", ").join(state.getNames())));
    this.duplicateName = duplicateName;
    this.seenNames = state.getNames();
    this.state = state;
  }

  /** Returns the name that occurred twice. */
  public String getDuplicateName() {
    return duplicateName;
  }

  /** Returns the names of the nodes resolved before the duplicate, in order. */
  public ImmutableSet<String> getSeenNames() {
    return seenNames;
  }

  /** Returns the state of the run before the duplicate. */
  public RunState getState() {
    return state;
  }
}
