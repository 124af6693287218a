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

import java.util.Random;

/**
 * A StochasticNode describes a named random quantity of a model, such as a normally distributed
 * variable. When a model computation suspends, it produces a StochasticNode; the driver of the
 * computation resolves the node to a value, either an observation or a fresh draw, and resumes the
 * computation with that value.
 */
public interface StochasticNode extends ModelValue {

  /** Returns the name of the quantity, which identifies it among all nodes of one run. */
  String getName();

  /** Returns a value drawn from the node's distribution, using the given source of randomness. */
  Object draw(Random random) throws EvalException;
}
