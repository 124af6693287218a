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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nullable;
import net.modelscript.java.syntax.Resolver;

/**
 * The global variables of an executed file, together with the predeclared names available to it.
 *
 * <p>A name is looked up among the globals first, then the predeclared names, such as the
 * stochastic primitives of a model file, and last {@link Model#UNIVERSE}.
 */
public final class Module implements Resolver.Environment {

  private final ImmutableMap<String, Object> predeclared;
  private final Map<String, Object> globals = new LinkedHashMap<>();

  private Module(ImmutableMap<String, Object> predeclared) {
    this.predeclared = predeclared;
  }

  /** Creates an empty module in which the given names are predeclared. */
  public static Module withPredeclared(Map<String, Object> predeclared) {
    return new Module(ImmutableMap.copyOf(predeclared));
  }

  /** Creates an empty module in which only the universal names are predeclared. */
  public static Module create() {
    return new Module(ImmutableMap.of());
  }

  /** Returns the value of a global, predeclared or universal name, or null. */
  @Nullable
  public Object get(String name) {
    Object v = globals.get(name);
    if (v == null) {
      v = predeclared.get(name);
    }
    return v != null ? v : Model.UNIVERSE.get(name);
  }

  @Nullable
  public Object getGlobal(String name) {
    return globals.get(name);
  }

  public void setGlobal(String name, Object value) {
    globals.put(name, Preconditions.checkNotNull(value, name));
  }

  /** Returns the globals, in the order they were first assigned. */
  public Map<String, Object> getGlobals() {
    return Collections.unmodifiableMap(globals);
  }

  @Override
  @Nullable
  public Resolver.Scope lookup(String name) {
    if (globals.containsKey(name)) {
      return Resolver.Scope.GLOBAL;
    } else if (predeclared.containsKey(name)) {
      return Resolver.Scope.PREDECLARED;
    } else if (Model.UNIVERSE.containsKey(name)) {
      return Resolver.Scope.UNIVERSAL;
    }
    return null;
  }

  @Override
  public String toString() {
    return "<module with " + globals.size() + " globals>";
  }
}
