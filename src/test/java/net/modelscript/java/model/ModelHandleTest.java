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
import net.modelscript.java.eval.Coroutine;
import net.modelscript.java.eval.EvalException;
import net.modelscript.java.eval.Model;
import net.modelscript.java.eval.ModelSemantics;
import net.modelscript.java.eval.ModelThread;
import net.modelscript.java.eval.Module;
import net.modelscript.java.eval.StochasticNode;
import net.modelscript.java.syntax.FileOptions;
import net.modelscript.java.syntax.Location;
import net.modelscript.java.syntax.ParserInput;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of model declaration through the {@code model} decorator. */
@RunWith(JUnit4.class)
public final class ModelHandleTest {

  private static final String COIN =
      String.join(
          "\n",
          "@model",
          "def coin(p):",
          "  \"\"\"Flips a coin.\"\"\"",
          "  heads = bernoulli(\"heads\", p)",
          "  return heads");

  private Module module;
  private ModelThread thread;

  @Before
  public void setUp() {
    module = ModelEnvironment.newModule();
    thread = new ModelThread(ModelSemantics.DEFAULT);
  }

  private void exec(String... lines) throws Exception {
    Model.execFile(
        ParserInput.fromString(String.join("\n", lines), "m.ms"),
        FileOptions.DEFAULT,
        module,
        thread);
  }

  private Object eval(String expr) throws Exception {
    return Model.eval(ParserInput.fromString(expr, "<expr>"), module, thread);
  }

  private ModelHandle handle(String name) {
    Object value = module.getGlobal(name);
    assertThat(value).isInstanceOf(ModelHandle.class);
    return (ModelHandle) value;
  }

  @Test
  public void testDeclaration() throws Exception {
    exec(COIN);
    ModelHandle coin = handle("coin");
    assertThat(coin.getName()).isEqualTo("coin");
    assertThat(coin.getDocumentation()).isEqualTo("Flips a coin.");
    assertThat(coin.getLocation()).isEqualTo(new Location("m.ms", 1, 1));
    assertThat(Model.type(coin)).isEqualTo("model");
    assertThat(Model.repr(coin)).isEqualTo("<model coin>");
    assertThat(coin.getOriginal().getName()).isEqualTo("coin");
    assertThat(coin.getSource().getText()).isEqualTo(COIN);
    assertThat(coin.getRewriteSites()).hasSize(1);
    assertThat(coin.getRewriteSites().get(0).toString())
        .isEqualTo("m.ms:4:11: bernoulli: SUSPEND");
  }

  @Test
  public void testRewrittenForm() throws Exception {
    exec(COIN);
    ModelHandle coin = handle("coin");
    assertThat(coin.getRewrittenDeclaration().getIdentifier().getName())
        .isEqualTo("_model_body");
    assertThat(coin.getRewrittenDeclaration().getDecorators()).isEmpty();
    assertThat(coin.getRewrittenText()).startsWith("\ndef _model_body(p):\n");
    assertThat(coin.getRewrittenText()).contains("  heads = yield bernoulli(\"heads\", p)\n");
    assertThat(coin.getArtifact().getFunction().getName()).isEqualTo("_model_body");
    assertThat(coin.getArtifact().getFunction().isGenerator()).isTrue();
    // The rewritten body keeps the line numbers of the original.
    assertThat(coin.getArtifact().getFunction().getLocation().line()).isEqualTo(2);
    assertThat(module.getGlobal("_model_body")).isNull();
  }

  @Test
  public void testCallingModelCallsOriginal() throws Exception {
    exec(COIN, "node = coin(0.25)");
    Object node = module.getGlobal("node");
    assertThat(node).isInstanceOf(StochasticNode.class);
    assertThat(Model.repr(node)).isEqualTo("bernoulli(\"heads\", p=0.25)");
  }

  @Test
  public void testComputation() throws Exception {
    exec(COIN);
    Coroutine co = handle("coin").newComputation(thread, ImmutableList.of(0.5), ImmutableMap.of());
    assertThat(co.getState()).isEqualTo(Coroutine.State.CREATED);
    Coroutine.Step step = co.resume(thread, null);
    assertThat(step.isDone()).isFalse();
    assertThat(((StochasticNode) step.getValue()).getName()).isEqualTo("heads");
    step = co.resume(thread, true);
    assertThat(step.isDone()).isTrue();
    assertThat(step.getValue()).isEqualTo(true);
  }

  @Test
  public void testGeneratorField() throws Exception {
    exec(COIN);
    ModelHandle coin = handle("coin");
    assertThat(coin.getFieldNames()).containsExactly("generator");
    assertThat(eval("coin.generator")).isSameInstanceAs(coin.getFactory());

    CoroutineFactory factory = coin.getFactory();
    assertThat(factory.getName()).isEqualTo("coin.generator");
    assertThat(factory.getParameterNames()).containsExactly("p");
    assertThat(Model.repr(factory)).isEqualTo("<coroutine factory coin.generator>");
    assertThat(eval("coin.generator(0.5)")).isInstanceOf(Coroutine.class);

    EvalException ex = assertThrows(EvalException.class, () -> eval("coin.weights"));
    assertThat(ex).hasMessageThat().isEqualTo("model coin has no field 'weights'");
  }

  @Test
  public void testRecreatingFromOriginalIsIdempotent() throws Exception {
    exec(COIN);
    ModelHandle coin = handle("coin");
    ModelHandle again = ModelHandle.create(coin.getOriginal(), thread);
    assertThat(again).isNotSameInstanceAs(coin);
    assertThat(again.getRewrittenText()).isEqualTo(coin.getRewrittenText());
    assertThat(again.getRewriteSites()).isEqualTo(coin.getRewriteSites());
  }

  @Test
  public void testDelegationToEarlierModel() throws Exception {
    exec(
        COIN,
        "@model",
        "def two():",
        "  a = coin(0.5)",
        "  b = dist.normal(\"b\")",
        "  return [a, b]");
    ModelHandle two = handle("two");
    assertThat(two.getRewrittenText()).contains("  a = yield from coin.generator(0.5)\n");
    assertThat(two.getRewrittenText()).contains("  b = yield dist.normal(\"b\")\n");
  }

  @Test
  public void testModelDeclaredInFunction() throws Exception {
    exec(
        "def make():", //
        "  @model",
        "  def inner(mu):",
        "    x = normal(\"x\", mu)",
        "    return x",
        "  return inner",
        "m = make()");
    ModelHandle m = handle("m");
    assertThat(m.getName()).isEqualTo("inner");
    assertThat(m.getLocation()).isEqualTo(new Location("m.ms", 2, 3));
    assertThat(m.getRewrittenText()).contains("  x = yield normal(\"x\", mu)\n");
  }

  @Test
  public void testDefaultNamingEnclosingLocalKeepsItsValue() throws Exception {
    exec(
        "k = 1.0", //
        "def make():",
        "  k = 5.0",
        "  @model",
        "  def inner(mu=k):",
        "    x = normal(\"x\", mu)",
        "    return mu",
        "  return inner",
        "m = make()",
        "direct = m()");
    ModelHandle m = handle("m");
    assertThat(module.getGlobal("direct")).isEqualTo(5.0);
    assertThat(m.getArtifact().getFunction().getDefaultValue(0)).isEqualTo(5.0);

    RunResult driven = Driver.builder().setSeed(1).build().run(m);
    assertThat(driven.getResult()).isEqualTo(5.0);
  }

  @Test
  public void testDecoratorErrors() {
    EvalException ex = assertThrows(EvalException.class, () -> exec("m = model()"));
    assertThat(ex).hasMessageThat().isEqualTo("model() takes exactly one argument (0 given)");

    ex = assertThrows(EvalException.class, () -> exec("def f():", "  pass", "m = model(fn=f)"));
    assertThat(ex).hasMessageThat().isEqualTo("model() got unexpected keyword argument 'fn'");

    ex = assertThrows(EvalException.class, () -> exec("m = model(len)"));
    assertThat(ex).hasCauseThat().isInstanceOf(ModelException.class);
    assertThat(((ModelException) ex.getCause()).getKind())
        .isEqualTo(ModelException.Kind.NOT_AVAILABLE);
    assertThat(ex).hasMessageThat().contains("built-in function len has no source");

    ex = assertThrows(EvalException.class, () -> exec("m = model(1)"));
    assertThat(((ModelException) ex.getCause()).getKind())
        .isEqualTo(ModelException.Kind.NOT_SUPPORTED);
    assertThat(ex).hasMessageThat().contains("cannot make a model of a int value; want a function");
  }

  @Test
  public void testUnsupportedBodyIsReportedAtDeclaration() {
    EvalException ex =
        assertThrows(
            EvalException.class,
            () ->
                exec(
                    "@model", //
                    "def bad():",
                    "  x = 0",
                    "  x += normal(\"x\")",
                    "  return x"));
    assertThat(ex).hasCauseThat().isInstanceOf(ModelException.class);
    ModelException cause = (ModelException) ex.getCause();
    assertThat(cause.getKind()).isEqualTo(ModelException.Kind.NOT_SUPPORTED);
    assertThat(cause.getDeclaration()).isEqualTo("bad");
    assertThat(cause.getLocation().line()).isEqualTo(2);
    assertThat(ex)
        .hasMessageThat()
        .endsWith(
            "in model 'bad': m.ms:4:8: cannot rewrite augmented assignment of a call to normal;"
                + " assign it to a plain variable first");
  }

  @Test
  public void testClosureCannotBeModel() {
    EvalException ex =
        assertThrows(
            EvalException.class,
            () ->
                exec(
                    "def make(mu):", //
                    "  @model",
                    "  def inner():",
                    "    x = normal(\"x\", mu)",
                    "    return x",
                    "  return inner",
                    "m = make(1)"));
    assertThat(((ModelException) ex.getCause()).getKind())
        .isEqualTo(ModelException.Kind.NOT_SUPPORTED);
    assertThat(ex).hasMessageThat().contains("refers to local variables of an enclosing function");
  }
}
