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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;
import net.modelscript.java.eval.EvalException;
import net.modelscript.java.eval.Model;
import net.modelscript.java.eval.ModelSemantics;
import net.modelscript.java.eval.ModelThread;
import net.modelscript.java.eval.Module;
import net.modelscript.java.lib.stochastic.Normal;
import net.modelscript.java.syntax.FileOptions;
import net.modelscript.java.syntax.ParserInput;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of running models with a {@link Driver}. */
@RunWith(JUnit4.class)
public final class DriverTest {

  private Module module;

  @Before
  public void setUp() throws Exception {
    module = ModelEnvironment.newModule();
    Model.execFile(
        ParserInput.fromString(
            String.join(
                "\n",
                "@model",
                "def flat(mu):",
                "  x = normal(\"x\", mu, 1)",
                "  y = normal(\"y\", x, 1)",
                "  return x + y",
                "",
                "@model",
                "def inner(loc):",
                "  z = normal(\"z\", loc, 1)",
                "  return z",
                "",
                "@model",
                "def outer():",
                "  a = normal(\"a\", 0, 1)",
                "  b = inner(a)",
                "  c = bernoulli(\"c\", 0.5)",
                "  return [a, b, c]",
                "",
                "@model",
                "def twice():",
                "  p = inner(0)",
                "  q = inner(1)",
                "  return p + q",
                "",
                "@model",
                "def dup():",
                "  a = normal(\"a\")",
                "  b = uniform(\"a\")",
                "  return a",
                "",
                "@model",
                "def notnode():",
                "  a = normal(\"a\")",
                "  b = yield 7",
                "  return b",
                "",
                "@model",
                "def fails(n):",
                "  a = normal(\"a\")",
                "  return a // n",
                "",
                "def scale(v):",
                "  return v * 10",
                "",
                "@model",
                "def three():",
                "  u = uniform(\"u\", 0, 1)",
                "  k = 2",
                "  v = uniform(\"v\", 0, 1)",
                "  w = uniform(\"w\", 0, 1)",
                "  return k * (u + v + w)",
                "",
                "@model",
                "def mixed():",
                "  raw = uniform(\"raw\", 0, 1)",
                "  scaled = scale(raw)",
                "  return scaled"),
            "m.ms"),
        FileOptions.DEFAULT,
        module,
        new ModelThread(ModelSemantics.DEFAULT));
  }

  private ModelHandle model(String name) {
    return (ModelHandle) module.getGlobal(name);
  }

  @Test
  public void testObservedRun() throws Exception {
    Driver driver =
        Driver.builder().setObservations(ImmutableMap.of("x", 1.0, "y", 2.5)).build();
    RunResult run = driver.run(model("flat"), ImmutableList.of(0), ImmutableMap.of());
    assertThat(run.getResult()).isEqualTo(3.5);
    RunState state = run.getState();
    assertThat(state.getNames()).containsExactly("x", "y").inOrder();
    assertThat(state.getValues()).containsExactly("x", 1.0, "y", 2.5).inOrder();
    assertThat(state.getObserved()).containsExactly("x", "y");
    assertThat(state.toString()).isEqualTo("RunState{x=1.0 (observed), y=2.5 (observed)}");
  }

  @Test
  public void testDescriptorsCarryParameters() throws Exception {
    Driver driver = Driver.builder().setObservations(ImmutableMap.of("x", 4.0)).setSeed(1).build();
    RunState state = driver.run(model("flat"), ImmutableList.of(2), ImmutableMap.of()).getState();
    Normal x = (Normal) state.getDescriptors().get("x");
    Normal y = (Normal) state.getDescriptors().get("y");
    assertThat(x.getMu()).isEqualTo(2.0);
    // The second node depends on the value given to the first.
    assertThat(y.getMu()).isEqualTo(4.0);
    assertThat(state.isObserved("x")).isTrue();
    assertThat(state.isObserved("y")).isFalse();
  }

  @Test
  public void testSeededRunsAreReproducible() throws Exception {
    Driver driver = Driver.builder().setSeed(5).build();
    RunResult first = driver.run(model("flat"), ImmutableList.of(0), ImmutableMap.of());
    RunResult second = driver.run(model("flat"), ImmutableList.of(0), ImmutableMap.of());
    assertThat(second.getState().getValues()).isEqualTo(first.getState().getValues());

    Random expected = new Random(5);
    double x = 0 + 1.0 * expected.nextGaussian();
    double y = x + 1.0 * expected.nextGaussian();
    assertThat(first.getState().getValue("x")).isEqualTo(x);
    assertThat(first.getState().getValue("y")).isEqualTo(y);
    assertThat(first.getResult()).isEqualTo(x + y);
    assertThat(first.getState().getObserved()).isEmpty();
  }

  @Test
  public void testNamedArguments() throws Exception {
    Driver driver = Driver.builder().setObservations(ImmutableMap.of("x", 0.0, "y", 0.0)).build();
    RunState state =
        driver.run(model("flat"), ImmutableList.of(), ImmutableMap.of("mu", 3)).getState();
    assertThat(((Normal) state.getDescriptors().get("x")).getMu()).isEqualTo(3.0);

    EvalException ex = assertThrows(EvalException.class, () -> driver.run(model("flat")));
    assertThat(ex).hasMessageThat().contains("missing 1 required positional argument: mu");
  }

  @Test
  public void testNestedModelIsFlattened() throws Exception {
    Driver driver =
        Driver.builder()
            .setObservations(ImmutableMap.of("a", 1.0, "z", 2.0, "c", true))
            .build();
    RunResult run = driver.run(model("outer"));
    assertThat(run.getResult()).isEqualTo(Arrays.asList(1.0, 2.0, true));
    assertThat(run.getState().getNames()).containsExactly("a", "z", "c").inOrder();
    Normal z = (Normal) run.getState().getDescriptors().get("z");
    assertThat(z.getMu()).isEqualTo(1.0);
  }

  @Test
  public void testOnlyCallsBecomeNodes() throws Exception {
    assertThat(model("three").getRewriteSites()).hasSize(3);
    RunResult run = Driver.builder().setSeed(11).build().run(model("three"));
    RunState state = run.getState();
    assertThat(state.getNames()).containsExactly("u", "v", "w").inOrder();
    double sum =
        (Double) state.getValue("u") + (Double) state.getValue("v") + (Double) state.getValue("w");
    assertThat((Double) run.getResult()).isWithin(1e-9).of(2 * sum);
  }

  @Test
  public void testRunsAreIndependent() throws Exception {
    int[] seed = {0};
    Driver driver = Driver.builder().setRandom(() -> new Random(++seed[0])).build();
    RunState first = driver.run(model("three")).getState();
    RunState second = driver.run(model("three")).getState();
    assertThat(first.getNames()).containsExactly("u", "v", "w").inOrder();
    assertThat(second.getNames()).containsExactly("u", "v", "w").inOrder();
    assertThat(second.getValue("u")).isNotEqualTo(first.getValue("u"));
  }

  @Test
  public void testDrawsWithoutObservations() throws Exception {
    RunResult run = Driver.builder().setSeed(3).build().run(model("outer"));
    assertThat(run.getState().getValue("a")).isInstanceOf(Double.class);
    assertThat(run.getState().getValue("z")).isInstanceOf(Double.class);
    assertThat(run.getState().getValue("c")).isInstanceOf(Boolean.class);
    assertThat(run.getState().getObserved()).isEmpty();
  }

  @Test
  public void testDuplicateNameInOneModel() throws Exception {
    DuplicateNameException ex =
        assertThrows(DuplicateNameException.class, () -> Driver.create().run(model("dup")));
    assertThat(ex.getDuplicateName()).isEqualTo("a");
    assertThat(ex.getSeenNames()).containsExactly("a");
    assertThat(ex.getState().size()).isEqualTo(1);
    assertThat(ex)
        .hasMessageThat()
        .isEqualTo("duplicate stochastic node name 'a' (already seen: a)");
  }

  @Test
  public void testDuplicateNameAcrossNestedModels() throws Exception {
    DuplicateNameException ex =
        assertThrows(DuplicateNameException.class, () -> Driver.create().run(model("twice")));
    assertThat(ex.getDuplicateName()).isEqualTo("z");
  }

  @Test
  public void testYieldOfOtherValueFails() throws Exception {
    EvalException ex =
        assertThrows(EvalException.class, () -> Driver.create().run(model("notnode")));
    assertThat(ex)
        .hasMessageThat()
        .isEqualTo("notnode.generator produced a value of type int, want a stochastic node");
  }

  @Test
  public void testDriverIsReusableAfterFailure() throws Exception {
    Driver driver =
        Driver.builder().setObservations(ImmutableMap.of("a", 1, "x", 0.0, "y", 0.0)).build();
    EvalException ex =
        assertThrows(
            EvalException.class,
            () -> driver.run(model("fails"), ImmutableList.of(0), ImmutableMap.of()));
    assertThat(ex).hasMessageThat().isEqualTo("integer division by zero");

    assertThat(driver.run(model("fails"), ImmutableList.of(1), ImmutableMap.of()).getResult())
        .isEqualTo(1);
    assertThat(driver.run(model("flat"), ImmutableList.of(0), ImmutableMap.of()).getResult())
        .isEqualTo(0.0);
  }

  @Test
  public void testObservationsAreConsultedAtEachRun() throws Exception {
    Map<String, Object> observations = new HashMap<>();
    Driver driver = Driver.builder().setObservations(observations).setSeed(9).build();
    RunResult drawn = driver.run(model("inner"), ImmutableList.of(0), ImmutableMap.of());
    assertThat(drawn.getState().isObserved("z")).isFalse();

    observations.put("z", 42.0);
    RunResult observed = driver.run(model("inner"), ImmutableList.of(0), ImmutableMap.of());
    assertThat(observed.getResult()).isEqualTo(42.0);
    assertThat(observed.getState().isObserved("z")).isTrue();
  }

  @Test
  public void testOrdinaryCallsRunUnchanged() throws Exception {
    RunResult run =
        Driver.builder()
            .setObservations(ImmutableMap.of("raw", 0.5))
            .build()
            .run(model("mixed"));
    assertThat(run.getResult()).isEqualTo(5.0);
    assertThat(run.getState().getNames()).containsExactly("raw");
  }

  @Test
  public void testRandomSupplierIsCalledPerRun() throws Exception {
    int[] calls = {0};
    Driver driver =
        Driver.builder()
            .setRandom(
                () -> {
                  calls[0]++;
                  return new Random(calls[0]);
                })
            .build();
    driver.run(model("inner"), ImmutableList.of(0), ImmutableMap.of());
    driver.run(model("inner"), ImmutableList.of(0), ImmutableMap.of());
    assertThat(calls[0]).isEqualTo(2);
  }

  @Test
  public void testRunFactoryDirectly() throws Exception {
    Driver driver = Driver.builder().setObservations(ImmutableMap.of("z", 1.5)).build();
    RunResult run =
        driver.run(model("inner").getFactory(), ImmutableList.of(0), ImmutableMap.of());
    assertThat(run.getResult()).isEqualTo(1.5);
  }
}
