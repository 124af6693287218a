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

/** A quantity uniformly distributed over {@code [low, high)}. */
public final class Uniform implements StochasticNode {

  private final String name;
  private final double low;
  private final double high;

  private Uniform(String name, double low, double high) {
    this.name = name;
    this.low = low;
    this.high = high;
  }

  static StochasticConstructor constructor() {
    return StochasticConstructor.create(
        BuiltinFunction.builder("uniform")
            .param("name")
            .optional("low", 0.0)
            .optional("high", 1.0)
            .doc("Returns a quantity uniformly distributed between low and high."),
        (thread, args) -> create(args[0], args[1], args[2]));
  }

  static Uniform create(Object name, Object low, Object high) throws EvalException {
    String n = StochasticLibrary.checkName("uniform", name);
    double lo = Model.toDouble(low, "uniform() parameter low");
    double hi = Model.toDouble(high, "uniform() parameter high");
    if (!(lo < hi)) {
      throw Model.errorf(
          "uniform(%s): low must be less than high, got low=%s, high=%s",
          Model.repr(n), Model.repr(lo), Model.repr(hi));
    }
    return new Uniform(n, lo, hi);
  }

  @Override
  public String getName() {
    return name;
  }

  public double getLow() {
    return low;
  }

  public double getHigh() {
    return high;
  }

  @Override
  public Object draw(Random random) {
    return low + (high - low) * random.nextDouble();
  }

  @Override
  public String typeName() {
    return "uniform";
  }

  @Override
  public void repr(Printer printer) {
    printer
        .append("uniform(")
        .repr(name)
        .append(", low=")
        .repr(low)
        .append(", high=")
        .repr(high)
        .append(")");
  }
}
