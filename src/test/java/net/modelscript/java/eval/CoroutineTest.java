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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import net.modelscript.java.syntax.FileOptions;
import net.modelscript.java.syntax.ParserInput;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of suspension and resumption of coroutines. */
@RunWith(JUnit4.class)
public final class CoroutineTest {

  private Module module;
  private ModelThread thread;

  @Before
  public void setUp() {
    module = Module.create();
    thread = new ModelThread(ModelSemantics.DEFAULT);
  }

  private void exec(String... lines) throws Exception {
    Model.execFile(ParserInput.fromLines(lines), FileOptions.DEFAULT, module, thread);
  }

  private Coroutine start(String name, Object... args) throws Exception {
    Object co =
        Model.call(thread, module.getGlobal(name), ImmutableList.copyOf(args), ImmutableMap.of());
    assertThat(co).isInstanceOf(Coroutine.class);
    return (Coroutine) co;
  }

  // Resumes the coroutine until done, replying to each yield with the given function of the
  // yielded value, and returns the transcript of steps.
  private List<String> drive(Coroutine co, Function<Object, Object> reply)
      throws Exception {
    List<String> steps = new ArrayList<>();
    Object sent = null;
    while (true) {
      Coroutine.Step step = co.resume(thread, sent);
      steps.add(step.toString());
      if (step.isDone()) {
        return steps;
      }
      sent = reply.apply(step.getValue());
    }
  }

  @Test
  public void testCallingGeneratorDoesNotRunBody() throws Exception {
    List<String> printed = new ArrayList<>();
    thread.setPrintHandler((th, msg) -> printed.add(msg));
    exec(
        "def gen():", //
        "  print('started')",
        "  yield 1");
    Coroutine co = start("gen");
    assertThat(co.getState()).isEqualTo(Coroutine.State.CREATED);
    assertThat(printed).isEmpty();
    assertThat(Model.repr(co)).isEqualTo("<coroutine gen>");

    Coroutine.Step step = co.resume(thread, null);
    assertThat(printed).containsExactly("started");
    assertThat(step.isDone()).isFalse();
    assertThat(step.getValue()).isEqualTo(1);
    assertThat(co.getState()).isEqualTo(Coroutine.State.SUSPENDED);
  }

  @Test
  public void testSentValueBecomesValueOfYield() throws Exception {
    exec(
        "def gen(n):", //
        "  a = yield n",
        "  b = yield a + 1",
        "  return [a, b]");
    assertThat(drive(start("gen", 10), x -> (Integer) x * 2))
        .containsExactly("yielded(10)", "yielded(21)", "done([20, 42])")
        .inOrder();
  }

  @Test
  public void testYieldInsideLoopsAndConditionals() throws Exception {
    exec(
        "def gen(xs):", //
        "  total = 0",
        "  for x in xs:",
        "    if x % 2 == 0:",
        "      continue",
        "    if x > 6:",
        "      break",
        "    v = yield x",
        "    total += v",
        "  return total");
    assertThat(drive(start("gen", ImmutableList.of(1, 2, 3, 4, 5, 6, 7, 8)), x -> x))
        .containsExactly("yielded(1)", "yielded(3)", "yielded(5)", "done(9)")
        .inOrder();
  }

  @Test
  public void testNestedLoops() throws Exception {
    exec(
        "def gen():", //
        "  for i in range(2):",
        "    for j in range(2):",
        "      yield (i, j)",
        "  return 'end'");
    assertThat(drive(start("gen"), x -> null))
        .containsExactly(
            "yielded((0, 0))",
            "yielded((0, 1))",
            "yielded((1, 0))",
            "yielded((1, 1))",
            "done(\"end\")")
        .inOrder();
  }

  @Test
  public void testYieldFromDelegates() throws Exception {
    exec(
        "def inner(x):", //
        "  a = yield x",
        "  b = yield x + 1",
        "  return a + b",
        "def outer():",
        "  yield 'first'",
        "  s = yield from inner(10)",
        "  yield from inner(s)",
        "  return s");
    assertThat(drive(start("outer"), x -> x instanceof Integer ? (Integer) x * 100 : null))
        .containsExactly(
            "yielded(\"first\")",
            "yielded(10)",
            "yielded(11)",
            "yielded(2100)",
            "yielded(2101)",
            "done(2100)")
        .inOrder();
  }

  @Test
  public void testYieldFromCoroutineThatNeverSuspends() throws Exception {
    exec(
        "def f(x):", //
        "  return x * 2",
        "def outer(c):",
        "  y = yield from c",
        "  return y");
    ModelFunction f = (ModelFunction) module.getGlobal("f");
    Coroutine inner = f.newCoroutine(thread, ImmutableList.of(21), ImmutableMap.of());
    assertThat(drive(start("outer", inner), x -> x)).containsExactly("done(42)");
    assertThat(inner.isDone()).isTrue();
  }

  @Test
  public void testYieldFromErrors() throws Exception {
    exec(
        "def inner():", //
        "  yield 1",
        "def notCoroutine():",
        "  yield from 1",
        "def started(c):",
        "  yield from c");
    EvalException ex =
        assertThrows(EvalException.class, () -> start("notCoroutine").resume(thread, null));
    assertThat(ex).hasMessageThat().isEqualTo("'yield from' requires a coroutine, got int");

    Coroutine inner = start("inner");
    inner.resume(thread, null);
    ex = assertThrows(EvalException.class, () -> start("started", inner).resume(thread, null));
    assertThat(ex)
        .hasMessageThat()
        .isEqualTo("'yield from' requires a coroutine that has not yet started");
  }

  @Test
  public void testResumeProtocolErrors() throws Exception {
    exec(
        "def gen():", //
        "  yield 1");
    Coroutine co = start("gen");
    EvalException ex = assertThrows(EvalException.class, () -> co.resume(thread, 5));
    assertThat(ex)
        .hasMessageThat()
        .isEqualTo("can't send non-None value to a just-started coroutine gen");

    co.resume(thread, null);
    assertThat(co.resume(thread, null).isDone()).isTrue();
    assertThat(co.isDone()).isTrue();
    assertThrows(IllegalStateException.class, () -> co.resume(thread, null));
  }

  @Test
  public void testFailureFinishesCoroutine() throws Exception {
    exec(
        "def gen():", //
        "  x = yield 1",
        "  return 1 // x");
    Coroutine co = start("gen");
    co.resume(thread, null);
    EvalException ex = assertThrows(EvalException.class, () -> co.resume(thread, 0));
    assertThat(ex).hasMessageThat().isEqualTo("integer division by zero");
    assertThat(co.getState()).isEqualTo(Coroutine.State.DONE);
  }

  @Test
  public void testNewCoroutineOfOrdinaryFunction() throws Exception {
    exec(
        "def f(a, b=2):", //
        "  return a * b");
    ModelFunction f = (ModelFunction) module.getGlobal("f");
    assertThat(f.isGenerator()).isFalse();
    Coroutine co = f.newCoroutine(thread, ImmutableList.of(4), ImmutableMap.of());
    assertThat(co.getState()).isEqualTo(Coroutine.State.CREATED);
    assertThat(drive(co, x -> x)).containsExactly("done(8)");

    EvalException ex =
        assertThrows(
            EvalException.class,
            () -> f.newCoroutine(thread, ImmutableList.of(), ImmutableMap.of()));
    assertThat(ex).hasMessageThat().isEqualTo("f() missing 1 required positional argument: a");
  }

  @Test
  public void testCoroutinesAreIndependent() throws Exception {
    exec(
        "def counter(n):", //
        "  for i in range(n):",
        "    yield i");
    Coroutine a = start("counter", 3);
    Coroutine b = start("counter", 3);
    assertThat(a.resume(thread, null).getValue()).isEqualTo(0);
    assertThat(a.resume(thread, null).getValue()).isEqualTo(1);
    assertThat(b.resume(thread, null).getValue()).isEqualTo(0);
    assertThat(a.resume(thread, null).getValue()).isEqualTo(2);
    assertThat(a.resume(thread, null).isDone()).isTrue();
    assertThat(b.resume(thread, null).getValue()).isEqualTo(1);
  }
}
