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

package net.modelscript.java.lib.stochastic;

import com.google.common.collect.ImmutableMap;
import net.modelscript.java.eval.EvalException;
import net.modelscript.java.eval.Model;
import net.modelscript.java.eval.StochasticConstructor;
import net.modelscript.java.eval.Structure;

/**
 * The reference stochastic constructors {@code normal}, {@code uniform} and {@code bernoulli},
 * bound both directly and as fields of the {@code dist} struct.
 */
public final class StochasticLibrary {

  public static final StochasticConstructor NORMAL = Normal.constructor();
  public static final StochasticConstructor UNIFORM = Uniform.constructor();
  public static final StochasticConstructor BERNOULLI = Bernoulli.constructor();

  private static final ImmutableMap<String, StochasticConstructor> CONSTRUCTORS =
      ImmutableMap.of(
          NORMAL.getName(), NORMAL, UNIFORM.getName(), UNIFORM, BERNOULLI.getName(), BERNOULLI);

  /** The {@code dist} struct, whose fields are the constructors. */
  public static final Structure DIST = Structure.create("dist", CONSTRUCTORS);

  private StochasticLibrary() {} // uninstantiable

  /** Returns the bindings of the library, suitable as predeclared bindings of a module. */
  public static ImmutableMap<String, Object> bindings() {
    return ImmutableMap.<String, Object>builder()
        .putAll(CONSTRUCTORS)
        .put(DIST.getName(), DIST)
        .buildOrThrow();
  }

  static String checkName(String constructor, Object name) throws EvalException {
    if (!(name instanceof String)) {
      throw Model.errorf(
          "%s() parameter name: got %s, want string", constructor, Model.type(name));
    }
    if (((String) name).isEmpty()) {
      throw Model.errorf("%s() parameter name: empty name", constructor);
    }
    return (String) name;
  }
}
