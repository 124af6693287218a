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
import java.util.List;
import java.util.Map;
import javax.annotation.concurrent.Immutable;
import net.modelscript.java.eval.Coroutine;
import net.modelscript.java.eval.EvalException;
import net.modelscript.java.eval.ModelCallable;
import net.modelscript.java.eval.ModelThread;
import net.modelscript.java.eval.Printer;
import net.modelscript.java.syntax.Location;

/**
 * A CoroutineFactory creates the suspendable computations of one model. It is available in
 * ModelScript as the {@code generator} field of a model.
 *
 * <p>Calling the factory binds the arguments to the parameters of the model, which are those of
 * its original declaration, and returns a new coroutine that has not yet executed any part of the
 * model body. Argument errors are reported by the call.
 */
@Immutable
public final class CoroutineFactory implements ModelCallable {

  private final String modelName;
  private final CompiledArtifact artifact;

  CoroutineFactory(String modelName, CompiledArtifact artifact) {
    this.modelName = modelName;
    this.artifact = artifact;
  }

  /** Returns a new coroutine for the model, applied to the given arguments. */
  public Coroutine newCoroutine(
      ModelThread thread, List<Object> positional, Map<String, Object> named)
      throws EvalException {
    return artifact.newCoroutine(thread, positional, named);
  }

  @Override
  public Object call(ModelThread thread, List<Object> positional, Map<String, Object> named)
      throws EvalException {
    return newCoroutine(thread, positional, named);
  }

  /** Returns the names of the model's parameters. */
  public ImmutableList<String> getParameterNames() {
    return artifact.getFunction().getParameterNames();
  }

  @Override
  public String getName() {
    return modelName + "." + ModelHandle.FACTORY_FIELD;
  }

  @Override
  public Location getLocation() {
    return artifact.getFunction().getLocation();
  }

  @Override
  public void repr(Printer printer) {
    printer.append("<coroutine factory ").append(getName()).append(">");
  }

  @Override
  public String toString() {
    return getName();
  }
}
