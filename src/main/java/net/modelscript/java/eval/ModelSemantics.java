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

package net.modelscript.java.eval;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

/**
 * Options that affect evaluation and the model rewrite: recursion, step budgets, and how decorated
 * model functions are renamed and stripped.
 *
 * <p>For options checked statically, when a file is parsed and resolved, see {@link
 * net.modelscript.java.syntax.FileOptions}.
 */
@AutoValue
public abstract class ModelSemantics {

  /** The semantics in which every option has its default value. */
  public static final ModelSemantics DEFAULT = builder().build();

  /** Whether a function may call itself, directly or indirectly. Off by default. */
  public abstract boolean allowRecursion();

  /**
   * The number of statements and expressions a thread may execute before it fails, or zero for no
   * limit.
   */
  public abstract long maxSteps();

  /** The name under which a rewritten model body is defined. */
  public abstract String internalName();

  /**
   * Decorator names that register a function as a model. A decorator whose last dotted component
   * is one of these is dropped from the rewritten copy.
   */
  public abstract ImmutableSet<String> registrationMarkers();

  /**
   * Whether an augmented or annotated assignment of a stochastic construction is left as it is,
   * with a warning, instead of rejected.
   */
  public abstract boolean passThroughUnsupportedAssignments();

  public abstract Builder toBuilder();

  public static Builder builder() {
    return new AutoValue_ModelSemantics.Builder()
        .allowRecursion(false)
        .maxSteps(0)
        .internalName("_model_body")
        .registrationMarkers(ImmutableSet.of("model"))
        .passThroughUnsupportedAssignments(false);
  }

  /** Builder for {@link ModelSemantics}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder allowRecursion(boolean value);

    public abstract Builder maxSteps(long value);

    public abstract Builder internalName(String value);

    public abstract Builder registrationMarkers(ImmutableSet<String> value);

    public abstract Builder passThroughUnsupportedAssignments(boolean value);

    abstract ModelSemantics autoBuild();

    public ModelSemantics build() {
      ModelSemantics semantics = autoBuild();
      Preconditions.checkArgument(semantics.maxSteps() >= 0, "negative step limit");
      return semantics;
    }
  }
}
