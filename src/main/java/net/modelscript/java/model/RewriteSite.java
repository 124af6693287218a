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
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import net.modelscript.java.syntax.Location;

/** A RewriteSite records what the rewriter did with one call to a stochastic or model callee. */
@AutoValue
public abstract class RewriteSite {

  /** The treatment of a call. */
  public enum Decision {
    /** The assignment of the call's result became a suspension point. */
    SUSPEND,
    /** The assignment of the call's result became a delegation to another model. */
    DELEGATE,
    /** The call is in an assignment form that cannot be rewritten, and was left unchanged. */
    PASS_THROUGH,
    /** The call is not the right-hand side of an assignment, and was left unchanged. */
    IGNORED
  }

  /** Returns the location of the call. */
  public abstract Location getLocation();

  /** Returns the path of names by which the call refers to its callee. */
  public abstract ImmutableList<String> getPath();

  public abstract Decision getDecision();

  static RewriteSite create(Location location, ImmutableList<String> path, Decision decision) {
    return new AutoValue_RewriteSite(location, path, decision);
  }

  @Override
  public final String toString() {
    return String.format(
        "%s: %s: %s", getLocation(), Joiner.on('.').join(getPath()), getDecision());
  }
}
