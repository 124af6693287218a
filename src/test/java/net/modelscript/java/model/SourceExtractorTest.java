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

import net.modelscript.java.eval.Model;
import net.modelscript.java.eval.ModelSemantics;
import net.modelscript.java.eval.ModelThread;
import net.modelscript.java.eval.Module;
import net.modelscript.java.syntax.FileOptions;
import net.modelscript.java.syntax.Location;
import net.modelscript.java.syntax.ParserInput;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link SourceExtractor}. */
@RunWith(JUnit4.class)
public final class SourceExtractorTest {

  private final Module module = Module.create();
  private final ModelThread thread = new ModelThread(ModelSemantics.DEFAULT);

  private void exec(ParserInput input) throws Exception {
    Model.execFile(input, FileOptions.DEFAULT, module, thread);
  }

  private void exec(String... lines) throws Exception {
    exec(ParserInput.fromString(String.join("\n", lines), "m.ms"));
  }

  private ModelException extractFails(Object fn) {
    return assertThrows(ModelException.class, () -> SourceExtractor.extract(fn));
  }

  @Test
  public void testToplevelFunction() throws Exception {
    exec(
        "x = 1", //
        "def f(a):",
        "  \"\"\"Doc.\"\"\"",
        "  return a + x",
        "y = 2");
    FunctionSource src = SourceExtractor.extract(module.getGlobal("f"));
    assertThat(src.getText()).isEqualTo("def f(a):\n  \"\"\"Doc.\"\"\"\n  return a + x");
    assertThat(src.getName()).isEqualTo("f");
    assertThat(src.getDoc()).isEqualTo("Doc.");
    assertThat(src.getLocation()).isEqualTo(new Location("m.ms", 2, 1));
    assertThat(src.getLineOffset()).isEqualTo(1);
    assertThat(src.getOptions()).isEqualTo(FileOptions.DEFAULT);
  }

  @Test
  public void testIndentedFunctionKeepsIndentation() throws Exception {
    exec(
        "def outer():", //
        "  def inner(b):",
        "    return b",
        "  return inner",
        "g = outer()");
    FunctionSource src = SourceExtractor.extract(module.getGlobal("g"));
    assertThat(src.getText()).isEqualTo("  def inner(b):\n    return b");
    assertThat(src.getName()).isEqualTo("inner");
    assertThat(src.getDoc()).isNull();
    assertThat(src.getLocation()).isEqualTo(new Location("m.ms", 2, 3));
  }

  @Test
  public void testDecoratorsAreIncluded() throws Exception {
    exec(
        "def deco(fn):", //
        "  return fn",
        "@deco",
        "def f():",
        "  return 1");
    FunctionSource src = SourceExtractor.extract(module.getGlobal("f"));
    assertThat(src.getText()).isEqualTo("@deco\ndef f():\n  return 1");
    assertThat(src.getLocation().line()).isEqualTo(3);
  }

  @Test
  public void testUnsupportedValues() throws Exception {
    exec(
        "def outer():", //
        "  y = 1",
        "  def closure():",
        "    return y",
        "  return closure",
        "c = outer()");

    ModelException ex = extractFails(ModelDecorator.INSTANCE);
    assertThat(ex.getKind()).isEqualTo(ModelException.Kind.NOT_SUPPORTED);
    assertThat(ex)
        .hasMessageThat()
        .isEqualTo(
            "cannot make a model of <built-in function model>; want a function declared by def");

    ex = extractFails(module.getGlobal("c"));
    assertThat(ex.getKind()).isEqualTo(ModelException.Kind.NOT_SUPPORTED);
    assertThat(ex)
        .hasMessageThat()
        .isEqualTo(
            "cannot make a model of closure: it refers to local variables of an enclosing"
                + " function");

    ex = extractFails(3);
    assertThat(ex.getKind()).isEqualTo(ModelException.Kind.NOT_SUPPORTED);
    assertThat(ex)
        .hasMessageThat()
        .isEqualTo("cannot make a model of a int value; want a function");
  }

  @Test
  public void testSourceNotAvailable() throws Exception {
    ModelException ex = extractFails(Model.UNIVERSE.get("len"));
    assertThat(ex.getKind()).isEqualTo(ModelException.Kind.NOT_AVAILABLE);
    assertThat(ex).hasMessageThat().isEqualTo("built-in function len has no source");

    exec(ParserInput.synthesized("def gen():\n  return 1\n", "gen.ms"));
    ex = extractFails(module.getGlobal("gen"));
    assertThat(ex.getKind()).isEqualTo(ModelException.Kind.NOT_AVAILABLE);
    assertThat(ex)
        .hasMessageThat()
        .isEqualTo("source of gen is not available: it was defined by synthesized text");
  }
}
