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

import java.util.List;
import java.util.Map;
import javax.annotation.concurrent.Immutable;
import net.modelscript.java.eval.Coroutine;
import net.modelscript.java.eval.EvalException;
import net.modelscript.java.eval.ModelFunction;
import net.modelscript.java.eval.ModelThread;

/**
 * The executable form of a rewritten model: the text printed from the rewritten declaration, and
 * the function defined by that text in the module of the original declaration.
 */
@Immutable
public final class CompiledArtifact {

  private final String text;
  private final ModelFunction function;

  CompiledArtifact(String text, ModelFunction function) {
    this.text = text;
    this.function = function;
  }

  /**
   * Returns the source text from which the function was defined. It is padded with blank lines so
   * that its line numbers match those of the original declaration.
   */
  public String getText() {
    return text;
  }

  /** Returns the function defined by the rewritten declaration. */
  public ModelFunction getFunction() {
    return function;
  }

  /** Returns a new coroutine, not yet started, that runs the function for the given arguments. */
  Coroutine newCoroutine(ModelThread thread, List<Object> positional, Map<String, Object> named)
      throws EvalException {
    return function.newCoroutine(thread, positional, named);
  }
}
