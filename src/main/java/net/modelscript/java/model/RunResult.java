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

import com.google.auto.value.AutoValue;

/** The outcome of one run of a model: its result, and the resolution of its stochastic nodes. */
@AutoValue
public abstract class RunResult {

  /** Returns the value returned by the model body, or None if it returned no value. */
  public abstract Object getResult();

  public abstract RunState getState();

  static RunResult create(Object result, RunState state) {
    return new AutoValue_RunResult(result, state);
  }
}
