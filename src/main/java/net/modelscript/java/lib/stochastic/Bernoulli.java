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

import java.util.Random;
import net.modelscript.java.eval.BuiltinFunction;
import net.modelscript.java.eval.EvalException;
import net.modelscript.java.eval.Model;
import net.modelscript.java.eval.Printer;
import net.modelscript.java.eval.StochasticConstructor;
import net.modelscript.java.eval.StochasticNode;

/** A boolean quantity that is true with probability {@code p}. */
public final class Bernoulli implements StochasticNode {

  private final String name;
  private final double p;

  private Bernoulli(String name, double p) {
    this.name = name;
    this.p = p;
  }

  static StochasticConstructor constructor() {
    return StochasticConstructor.create(
        BuiltinFunction.builder("bernoulli")
            .param("name")
            .optional("p", 0.5)
            .doc("Returns a boolean quantity that is True with probability p."),
        (thread, args) -> create(args[0], args[1]));
  }

  static Bernoulli create(Object name, Object p) throws EvalException {
    String n = StochasticLibrary.checkName("bernoulli", name);
    double prob = Model.toDouble(p, "bernoulli() parameter p");
    if (!(prob >= 0 && prob <= 1)) {
      throw Model.errorf(
          "bernoulli(%s): p must be between 0 and 1, got %s", Model.repr(n), Model.repr(prob));
    }
    return new Bernoulli(n, prob);
  }

  @Override
  public String getName() {
    return name;
  }

  public double getP() {
    return p;
  }

  @Override
  public Object draw(Random random) {
    return random.nextDouble() < p;
  }

  @Override
  public String typeName() {
    return "bernoulli";
  }

  @Override
  public void repr(Printer printer) {
    printer.append("bernoulli(").repr(name).append(", p=").repr(p).append(")");
  }
}
