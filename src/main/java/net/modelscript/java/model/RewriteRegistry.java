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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * A RewriteRegistry classifies the callees of a model body, identified by the path of names by
 * which the body refers to them, such as {@code ["normal"]} for {@code normal(...)} or {@code
 * ["dist", "normal"]} for {@code dist.normal(...)}.
 */
@FunctionalInterface
public interface RewriteRegistry {

  /** Returns the classification of the callee denoted by {@code path}, or null if unknown. */
  @Nullable
  Classification classify(ImmutableList<String> path);

  /** Returns a registry that looks up paths in a fixed table. */
  static RewriteRegistry of(Map<ImmutableList<String>, Classification> table) {
    ImmutableMap<ImmutableList<String>, Classification> copy = ImmutableMap.copyOf(table);
    return copy::get;
  }
}
