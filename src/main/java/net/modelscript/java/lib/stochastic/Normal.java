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

/** A normally distributed quantity, {@code normal(name, mu=0.0, sigma=1.0)}. */
public final class Normal implements StochasticNode {

  private final String name;
  private final double mu;
  private final double sigma;

  private Normal(String name, double mu, double sigma) {
    this.name = name;
    this.mu = mu;
    this.sigma = sigma;
  }

  static StochasticConstructor constructor() {
    return StochasticConstructor.create(
        BuiltinFunction.builder("normal")
            .param("name")
            .optional("mu", 0.0)
            .optional("sigma", 1.0)
            .doc("Returns a normally distributed quantity of mean mu and deviation sigma."),
        (thread, args) -> create(args[0], args[1], args[2]));
  }

  static Normal create(Object name, Object mu, Object sigma) throws EvalException {
    String n = StochasticLibrary.checkName("normal", name);
    double m = Model.toDouble(mu, "normal() parameter mu");
    double s = Model.toDouble(sigma, "normal() parameter sigma");
    if (!(s > 0)) {
      throw Model.errorf(
          "normal(%s): sigma must be positive, got %s", Model.repr(n), Model.repr(s));
    }
    return new Normal(n, m, s);
  }

  @Override
  public String getName() {
    return name;
  }

  public double getMu() {
    return mu;
  }

  public double getSigma() {
    return sigma;
  }

  @Override
  public Object draw(Random random) {
    return mu + sigma * random.nextGaussian();
  }

  @Override
  public String typeName() {
    return "normal";
  }

  @Override
  public void repr(Printer printer) {
    printer
        .append("normal(")
        .repr(name)
        .append(", mu=")
        .repr(mu)
        .append(", sigma=")
        .repr(sigma)
        .append(")");
  }
}
