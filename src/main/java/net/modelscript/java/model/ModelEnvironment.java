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

import com.google.common.collect.ImmutableMap;
import net.modelscript.java.eval.Module;
import net.modelscript.java.lib.stochastic.StochasticLibrary;

/** The predeclared environment of a file that declares models. */
public final class ModelEnvironment {

  private static final ImmutableMap<String, Object> PREDECLARED =
      ImmutableMap.<String, Object>builder()
          .put(ModelDecorator.NAME, ModelDecorator.INSTANCE)
          .putAll(StochasticLibrary.bindings())
          .build();

  private ModelEnvironment() {} // uninstantiable

  /**
   * Returns the predeclared bindings of a model file: the {@code model} decorator, and the
   * stochastic constructors of {@link StochasticLibrary}.
   */
  public static ImmutableMap<String, Object> predeclared() {
    return PREDECLARED;
  }

  /** Returns a new, empty module whose predeclared bindings are {@link #predeclared}. */
  public static Module newModule() {
    return Module.withPredeclared(PREDECLARED);
  }
}
