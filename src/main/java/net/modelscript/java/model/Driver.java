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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.GoogleLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.Supplier;
import javax.annotation.concurrent.Immutable;
import net.modelscript.java.eval.Coroutine;
import net.modelscript.java.eval.EvalException;
import net.modelscript.java.eval.Model;
import net.modelscript.java.eval.ModelSemantics;
import net.modelscript.java.eval.ModelThread;
import net.modelscript.java.eval.StochasticNode;

/**
 * A Driver runs computations of models to completion.
 *
 * <p>Each time a computation suspends, it produces a {@link StochasticNode}. The driver resolves
 * the node to the observation of the same name, if there is one, or else to a value drawn from the
 * node's distribution, and resumes the computation with that value. Nodes produced by nested
 * models, through delegation, are resolved in exactly the same way. The names of the nodes of one
 * run must be distinct.
 *
 * <p>A driver is immutable; each run has its own computation, thread and state. The observations
 * are consulted as each node is resolved, so a caller may add observations to the map between or
 * during runs.
 */
@Immutable
public final class Driver {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final Map<String, ?> observations;
  private final Supplier<Random> random;
  private final ModelSemantics semantics;

  private Driver(Builder builder) {
    this.observations = builder.observations;
    this.random = builder.random;
    this.semantics = builder.semantics;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns a driver with no observations, which draws every value. */
  public static Driver create() {
    return builder().build();
  }

  /** Builder for {@link Driver}. */
  public static final class Builder {
    private Map<String, ?> observations = ImmutableMap.of();
    private Supplier<Random> random = Random::new;
    private ModelSemantics semantics = ModelSemantics.DEFAULT;

    private Builder() {}

    /**
     * Sets the observations, keyed by node name. The map is not copied: it is consulted at each
     * node, and must not be modified while a lookup is in progress.
     */
    @CanIgnoreReturnValue
    public Builder setObservations(Map<String, ?> observations) {
      this.observations = Preconditions.checkNotNull(observations);
      return this;
    }

    /** Sets the supplier of the source of randomness for each run. */
    @CanIgnoreReturnValue
    public Builder setRandom(Supplier<Random> random) {
      this.random = Preconditions.checkNotNull(random);
      return this;
    }

    /** Makes every run draw from a source of randomness with the given seed. */
    @CanIgnoreReturnValue
    public Builder setSeed(long seed) {
      return setRandom(() -> new Random(seed));
    }

    /** Sets the semantics of the thread in which each run executes. */
    @CanIgnoreReturnValue
    public Builder setSemantics(ModelSemantics semantics) {
      this.semantics = Preconditions.checkNotNull(semantics);
      return this;
    }

    public Driver build() {
      return new Driver(this);
    }
  }

  /** Runs the model with no arguments. */
  public RunResult run(ModelHandle model) throws EvalException, InterruptedException {
    return run(model.getFactory(), ImmutableList.of(), ImmutableMap.of());
  }

  /** Runs the model, applied to the given arguments. */
  public RunResult run(ModelHandle model, List<Object> positional, Map<String, Object> named)
      throws EvalException, InterruptedException {
    return run(model.getFactory(), positional, named);
  }

  /**
   * Runs a computation created by {@code factory} from the given arguments.
   *
   * @throws DuplicateNameException if the computation produces two nodes of the same name
   * @throws EvalException if the arguments do not match the model's parameters, if the computation
   *     produces something other than a stochastic node, or if the model body fails
   */
  public RunResult run(CoroutineFactory factory, List<Object> positional, Map<String, Object> named)
      throws EvalException, InterruptedException {
    ModelThread thread = new ModelThread(semantics);
    Coroutine computation = factory.newCoroutine(thread, positional, named);
    RunState.Recorder recorder = new RunState.Recorder();
    Random rand = random.get();

    Object sent = null;
    while (true) {
      Coroutine.Step step = computation.resume(thread, sent);
      if (step.isDone()) {
        RunState state = recorder.snapshot();
        logger.atFine().log("%s: done after %d node(s)", factory.getName(), state.size());
        return RunResult.create(step.getValue(), state);
      }

      Object value = step.getValue();
      if (!(value instanceof StochasticNode)) {
        throw Model.errorf(
            "%s produced a value of type %s, want a stochastic node",
            factory.getName(), Model.type(value));
      }
      StochasticNode node = (StochasticNode) value;
      String name = node.getName();
      if (recorder.contains(name)) {
        throw new DuplicateNameException(name, recorder.snapshot());
      }

      Object observation = observations.get(name);
      boolean observed = observation != null;
      sent = observed ? observation : node.draw(rand);
      recorder.record(node, sent, observed);
      logger.atFinest().log(
          "%s: %s = %s (%s)",
          factory.getName(), name, Model.repr(sent), observed ? "observed" : "drawn");
    }
  }
}
