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
import net.modelscript.java.eval.EvalException;
import net.modelscript.java.eval.Model;
import net.modelscript.java.eval.ModelCallable;
import net.modelscript.java.eval.ModelThread;
import net.modelscript.java.eval.Printer;

/**
 * The {@code model} built-in, used as a decorator to declare a model:
 *
 * <pre>
 * &#64;model
 * def coin(p):
 *     heads = bernoulli("heads", p)
 *     return heads
 * </pre>
 *
 * replaces the function {@code coin} by its {@link ModelHandle}. Callees of the body are classified
 * by the bindings of the module in which the function is defined. A failure to construct the
 * handle is reported as an evaluation error at the decorator, whose cause is the {@link
 * ModelException}.
 */
public final class ModelDecorator implements ModelCallable {

  /** The name under which the decorator is predeclared. */
  public static final String NAME = "model";

  static final ModelDecorator INSTANCE = new ModelDecorator();

  private ModelDecorator() {}

  @Override
  public Object call(ModelThread thread, List<Object> positional, Map<String, Object> named)
      throws EvalException, InterruptedException {
    if (!named.isEmpty()) {
      throw Model.errorf(
          "%s() got unexpected keyword argument '%s'", NAME, named.keySet().iterator().next());
    }
    if (positional.size() != 1) {
      throw Model.errorf(
          "%s() takes exactly one argument (%d given)", NAME, positional.size());
    }
    try {
      return ModelHandle.create(positional.get(0), thread);
    } catch (ModelException ex) {
      throw new EvalException(ex.getMessage(), ex);
    }
  }

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public String typeName() {
    return "builtin_function_or_method";
  }

  @Override
  public void repr(Printer printer) {
    printer.append("<built-in function ").append(NAME).append(">");
  }
}
