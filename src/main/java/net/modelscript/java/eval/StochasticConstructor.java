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

import java.util.List;
import java.util.Map;

/**
 * A StochasticConstructor is a built-in function whose result is always a {@link StochasticNode}.
 *
 * <p>Being a StochasticConstructor is the capability by which the model rewriter recognizes a
 * call whose result the driver of a model must resolve: an assignment {@code x = f(...)} in a
 * model body becomes a suspension point {@code x = yield f(...)} when {@code f} is one.
 */
public final class StochasticConstructor extends BuiltinFunction {

  private StochasticConstructor(BuiltinFunction.Builder builder, Body body) {
    super(builder, body);
  }

  /** Returns a stochastic constructor with the given signature and implementation. */
  public static StochasticConstructor create(BuiltinFunction.Builder builder, Body body) {
    return new StochasticConstructor(builder, body);
  }

  @Override
  public Object call(ModelThread thread, List<Object> positional, Map<String, Object> named)
      throws EvalException, InterruptedException {
    Object node = super.call(thread, positional, named);
    if (!(node instanceof StochasticNode)) {
      throw new IllegalStateException(
          String.format("%s returned %s, want a stochastic node", getName(), Model.type(node)));
    }
    return node;
  }

  @Override
  public String typeName() {
    return "stochastic_constructor";
  }

  @Override
  public void repr(Printer printer) {
    printer.append("<stochastic constructor ").append(getName()).append(">");
  }
}
