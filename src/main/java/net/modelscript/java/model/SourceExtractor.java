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

import net.modelscript.java.eval.BuiltinFunction;
import net.modelscript.java.eval.Model;
import net.modelscript.java.eval.ModelCallable;
import net.modelscript.java.eval.ModelFunction;
import net.modelscript.java.syntax.DefStatement;
import net.modelscript.java.syntax.Resolver;

/**
 * Retrieves the source text of a function value.
 *
 * <p>Only a function declared by a {@code def} statement in source text written by a person has
 * retrievable source. Moreover, the function must not refer to local variables of an enclosing
 * function: its rewritten form is defined anew in the function's module, where such variables do
 * not exist.
 */
public final class SourceExtractor {

  private SourceExtractor() {} // uninstantiable

  /**
   * Returns the source of the function value {@code fn}.
   *
   * @throws ModelException of kind {@code NOT_SUPPORTED} if {@code fn} is not a function, or is a
   *     closure; of kind {@code NOT_AVAILABLE} if {@code fn} is a built-in function, or
   *     was defined by text synthesized by a program.
   */
  public static FunctionSource extract(Object fn) throws ModelException {
    if (fn instanceof BuiltinFunction) {
      throw ModelException.notAvailable(
          "built-in function %s has no source", ((BuiltinFunction) fn).getName());
    }
    if (!(fn instanceof ModelFunction)) {
      if (fn instanceof ModelCallable) {
        throw ModelException.notSupported(
            "cannot make a model of %s; want a function declared by def", Model.repr(fn));
      }
      throw ModelException.notSupported(
          "cannot make a model of a %s value; want a function", Model.type(fn));
    }

    Resolver.Function rfn = ((ModelFunction) fn).getResolvedFunction();
    DefStatement def = rfn.getDefStatement();
    if (def == null) {
      throw ModelException.notSupported("cannot make a model of %s", rfn.getName());
    }
    if (rfn.hasFreeVars()) {
      throw ModelException.notSupported(
          "cannot make a model of %s: it refers to local variables of an enclosing function",
          rfn.getName());
    }
    if (def.isSynthetic()) {
      throw ModelException.notAvailable(
          "source of %s is not available: it was defined by synthesized text", rfn.getName());
    }

    return FunctionSource.create(
        def.getSourceLines(),
        def.getStartLocation(),
        rfn.getFileOptions(),
        rfn.getName(),
        rfn.getDocumentation());
  }
}
