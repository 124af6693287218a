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
import com.google.common.flogger.GoogleLogger;
import javax.annotation.Nullable;
import net.modelscript.java.eval.EvalException;
import net.modelscript.java.eval.HasFields;
import net.modelscript.java.eval.Module;
import net.modelscript.java.eval.StochasticConstructor;

/**
 * A registry that classifies a callee by looking it up in a module, and examining the value found.
 *
 * <p>The first name of a path is looked up among the module's globals, then its predeclared and
 * universal bindings. Each following name selects a field of a value that has fields, such as a
 * struct. A {@link StochasticConstructor} is eligible for suspension; a {@link ModelHandle} is a
 * delegate; any other value is opaque. A path that cannot be followed is unresolved.
 *
 * <p>Lookups happen when the registry is consulted, so a name bound in the module after the model
 * was declared is not seen by that model's rewrite.
 */
public final class ModuleRewriteRegistry implements RewriteRegistry {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final Module module;

  public ModuleRewriteRegistry(Module module) {
    this.module = module;
  }

  @Override
  @Nullable
  public Classification classify(ImmutableList<String> path) {
    Object value = lookup(path);
    if (value == null) {
      return null;
    } else if (value instanceof StochasticConstructor) {
      return Classification.SUSPENSION_ELIGIBLE;
    } else if (value instanceof ModelHandle) {
      return Classification.DELEGATE;
    }
    return Classification.OPAQUE;
  }

  @Nullable
  private Object lookup(ImmutableList<String> path) {
    Object value = module.get(path.get(0));
    for (String field : path.subList(1, path.size())) {
      if (!(value instanceof HasFields)) {
        return null;
      }
      try {
        value = ((HasFields) value).getField(field);
      } catch (EvalException ex) {
        logger.atFine().withCause(ex).log("cannot resolve %s", path);
        return null;
      }
    }
    return value;
  }
}
