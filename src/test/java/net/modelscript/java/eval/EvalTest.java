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
import net.modelscript.java.syntax.FileOptions;
import net.modelscript.java.syntax.ParserInput;
import net.modelscript.java.syntax.SyntaxError;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of the tree-walking interpreter. */
@RunWith(JUnit4.class)
public final class EvalTest {

  private Module module;
  private ModelThread thread;
  private final List<String> printed = new ArrayList<>();

  @Before
  public void setUp() {
    module = Module.create();
    thread = new ModelThread(ModelSemantics.DEFAULT);
    thread.setPrintHandler((th, msg) -> printed.add(msg));
  }

  private void exec(String... lines) throws Exception {
    Model.execFile(ParserInput.fromLines(lines), FileOptions.DEFAULT, module, thread);
  }

  private Object eval(String expr) throws Exception {
    return Model.eval(ParserInput.fromString(expr, "<expr>"), module, thread);
  }

  private EvalException execFails(String... lines) {
    return assertThrows(EvalException.class, () -> exec(lines));
  }

  @Test
  public void testArithmetic() throws Exception {
    assertThat(eval("1 + 2 * 3")).isEqualTo(7);
    assertThat(eval("7 // 2")).isEqualTo(3);
    assertThat(eval("-7 // 2")).isEqualTo(-4);
    assertThat(eval("7 % 3")).isEqualTo(1);
    assertThat(eval("1 / 2")).isEqualTo(0.5);
    assertThat(eval("1.5 + 1")).isEqualTo(2.5);
    assertThat(eval("2 ** 10")).isEqualTo(1024);
    assertThat(eval("-(3)")).isEqualTo(-3);
  }

  @Test
  public void testArithmeticErrors() {
    EvalException ex = assertThrows(EvalException.class, () -> eval("1 // 0"));
    assertThat(ex).hasMessageThat().isEqualTo("integer division by zero");
    ex = assertThrows(EvalException.class, () -> eval("1 / 0"));
    assertThat(ex).hasMessageThat().isEqualTo("floating-point division by zero");
    ex = assertThrows(EvalException.class, () -> eval("1 + 'a'"));
    assertThat(ex).hasMessageThat().isEqualTo("unsupported binary operation: int + string");
  }

  @Test
  public void testBooleansAndComparisons() throws Exception {
    assertThat(eval("1 < 2 and 2 <= 2")).isEqualTo(true);
    assertThat(eval("not (1 == 1)")).isEqualTo(false);
    assertThat(eval("0 or 'x'")).isEqualTo("x");
    assertThat(eval("2 not in [1, 3]")).isEqualTo(true);
    assertThat(eval("1 == 1.0")).isEqualTo(true);
    assertThat(eval("2 in [1, 2, 3]")).isEqualTo(true);
  }

  @Test
  public void testCollections() throws Exception {
    assertThat(eval("[1, 2, 3][-1]")).isEqualTo(3);
    assertThat(eval("(1, 2)")).isEqualTo(Tuple.of(1, 2));
    assertThat(eval("(1, 2) + (3,)")).isEqualTo(Tuple.of(1, 2, 3));
    assertThat(eval("len([1, 2]) + len('abc')")).isEqualTo(5);
    assertThat(Model.repr(eval("[1, 'a', None, True]"))).isEqualTo("[1, \"a\", None, True]");

    EvalException ex = assertThrows(EvalException.class, () -> eval("[1][5]"));
    assertThat(ex)
        .hasMessageThat()
        .isEqualTo("index out of range (index is 5, but sequence has 1 elements)");
  }

  @Test
  public void testStrAndRepr() throws Exception {
    assertThat(Model.str("a\"b")).isEqualTo("a\"b");
    assertThat(Model.repr("a\"b")).isEqualTo("\"a\\\"b\"");
    assertThat(Model.str(eval("['x', 1.0]"))).isEqualTo("[\"x\", 1.0]");
    assertThat(Model.repr(eval("(1,)"))).isEqualTo("(1,)");
    assertThat(new Printer().append("v=").str("s").append(' ').repr("s").toString())
        .isEqualTo("v=s \"s\"");
  }

  @Test
  public void testAssignmentTargets() throws Exception {
    exec("xs = [1, 2]", "xs[-1] = 5", "xs[0] += 1");
    assertThat(Model.repr(module.getGlobal("xs"))).isEqualTo("[2, 5]");

    assertThat(execFails("t = (1, 2)", "t[0] = 3"))
        .hasMessageThat()
        .isEqualTo("can only assign an element in a list, not in a 'tuple'");
    assertThat(execFails("a, b = 1, 2, 3"))
        .hasMessageThat()
        .isEqualTo("too many values to unpack (got 3, want 2)");
    assertThat(execFails("n = 1", "n.field = 2"))
        .hasMessageThat()
        .isEqualTo("cannot set .field field of int value");
  }

  @Test
  public void testAssignmentAndLoops() throws Exception {
    exec(
        "def total(xs):", //
        "  t = 0",
        "  for x in xs:",
        "    if x == 3:",
        "      continue",
        "    if x > 4:",
        "      break",
        "    t += x",
        "  return t",
        "a, b = 1, 2",
        "r = total(range(10))");
    assertThat(module.getGlobal("a")).isEqualTo(1);
    assertThat(module.getGlobal("b")).isEqualTo(2);
    assertThat(module.getGlobal("r")).isEqualTo(0 + 1 + 2 + 4);
  }

  @Test
  public void testFunctionArguments() throws Exception {
    exec(
        "def f(a, b=10, c=100):", //
        "  return a + b + c",
        "x = f(1)",
        "y = f(1, c=2)",
        "z = f(c=1, b=2, a=3)");
    assertThat(module.getGlobal("x")).isEqualTo(111);
    assertThat(module.getGlobal("y")).isEqualTo(13);
    assertThat(module.getGlobal("z")).isEqualTo(6);
  }

  @Test
  public void testFunctionArgumentErrors() {
    String def = "def f(a, b=1):\n  return a\n";
    assertThat(execFails(def + "f()"))
        .hasMessageThat()
        .isEqualTo("f() missing 1 required positional argument: a");
    assertThat(execFails(def + "f(1, 2, 3)"))
        .hasMessageThat()
        .isEqualTo("f() accepts no more than 2 positional arguments but got 3");
    assertThat(execFails(def + "f(1, a=2)"))
        .hasMessageThat()
        .isEqualTo("f() got multiple values for parameter 'a'");
    assertThat(execFails(def + "f(1, z=2)"))
        .hasMessageThat()
        .isEqualTo("f() got unexpected keyword argument: z");
  }

  @Test
  public void testClosures() throws Exception {
    exec(
        "def adder(n):", //
        "  def add(x):",
        "    return x + n",
        "  return add",
        "add2 = adder(2)",
        "r1 = add2(5)",
        "def scaler(k):",
        "  def scale(x, by=k):",
        "    return x * by",
        "  return scale",
        "r2 = scaler(3)(4)");
    assertThat(module.getGlobal("r1")).isEqualTo(7);
    assertThat(module.getGlobal("r2")).isEqualTo(12);
  }

  @Test
  public void testRecursionIsRejectedByDefault() {
    EvalException ex =
        execFails(
            "def fib(n):", //
            "  if n < 2:",
            "    return n",
            "  return fib(n - 1) + fib(n - 2)",
            "fib(5)");
    assertThat(ex).hasMessageThat().isEqualTo("function 'fib' called recursively");
  }

  @Test
  public void testRecursionAllowedBySemantics() throws Exception {
    thread = new ModelThread(ModelSemantics.builder().allowRecursion(true).build());
    exec(
        "def fib(n):", //
        "  if n < 2:",
        "    return n",
        "  return fib(n - 1) + fib(n - 2)",
        "r = fib(10)");
    assertThat(module.getGlobal("r")).isEqualTo(55);
  }

  @Test
  public void testPrint() throws Exception {
    exec("print('hello', 1, [2])");
    assertThat(printed).containsExactly("hello 1 [2]");
  }

  @Test
  public void testStaticErrorsAreReportedBeforeExecution() {
    SyntaxError.Exception ex =
        assertThrows(SyntaxError.Exception.class, () -> exec("print('x')", "y = undefined"));
    assertThat(ex).hasMessageThat().contains("name 'undefined' is not defined");
    assertThat(printed).isEmpty();
  }

  @Test
  public void testErrorCallStack() {
    EvalException ex =
        execFails(
            "def f():", //
            "  return g()",
            "def g():",
            "  return 1 // 0",
            "f()");
    List<String> names = new ArrayList<>();
    for (ModelThread.CallStackEntry e : ex.getCallStack()) {
      names.add(e.name());
    }
    assertThat(names).containsExactly("<toplevel>", "f", "g").inOrder();
    assertThat(ex.getCallStack().get(2).location().line()).isEqualTo(4);
  }

  @Test
  public void testCallFromJava() throws Exception {
    exec("def f(x, y=2):", "  return x * y");
    Object f = module.getGlobal("f");
    assertThat(Model.call(thread, f, ImmutableList.of(3), ImmutableMap.of())).isEqualTo(6);
    assertThat(Model.call(thread, f, ImmutableList.of(3), ImmutableMap.of("y", 3)))
        .isEqualTo(9);

    EvalException ex =
        assertThrows(
            EvalException.class,
            () -> Model.call(thread, 1, ImmutableList.of(), ImmutableMap.of()));
    assertThat(ex).hasMessageThat().isEqualTo("'int' object is not callable");
  }

  @Test
  public void testStepLimit() {
    thread = new ModelThread(ModelSemantics.builder().maxSteps(100).build());
    EvalException ex =
        execFails(
            "def f():", //
            "  for i in range(1000):",
            "    pass",
            "f()");
    assertThat(ex).hasMessageThat().contains("too many steps");
  }
}
