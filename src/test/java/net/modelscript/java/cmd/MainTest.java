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
package net.modelscript.java.cmd;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.file.Files;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of the modelscript command. */
@RunWith(JUnit4.class)
public final class MainTest {

  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private final ByteArrayOutputStream err = new ByteArrayOutputStream();

  private static final String MODEL =
      String.join(
          "\n",
          "@model",
          "def sub(loc):",
          "  z = normal(\"z\", loc, 1)",
          "  return z",
          "",
          "@model",
          "def main(scale=1):",
          "  x = normal(\"x\", 0, 1)",
          "  y = sub(x)",
          "  return (x + y) * scale",
          "");

  private String write(String content) throws Exception {
    File f = tmp.newFile("model.ms");
    Files.write(f.toPath(), content.getBytes(UTF_8));
    return f.getPath();
  }

  private int run(String... args) {
    return Main.run(args, new PrintStream(out, true), new PrintStream(err, true));
  }

  private String out() {
    return new String(out.toByteArray(), UTF_8);
  }

  private String err() {
    return new String(err.toByteArray(), UTF_8);
  }

  @Test
  public void testObservedRun() throws Exception {
    String file = write(MODEL);
    assertThat(run("--observe=x=1.0", "--observe=z=2", "--arg=10", file)).isEqualTo(0);
    assertThat(out()).isEqualTo("x = 1.0 (observed)\nz = 2 (observed)\nresult = 30.0\n");
    assertThat(err()).isEmpty();
  }

  @Test
  public void testSeededRunsAreReproducible() throws Exception {
    String file = write(MODEL);
    assertThat(run("--seed=7", "--runs=2", file)).isEqualTo(0);
    String first = out();
    assertThat(first).startsWith("run 1:\nx = ");
    assertThat(first).contains("(drawn)\nresult = ");
    assertThat(first).contains("run 2:\n");

    out.reset();
    assertThat(run("--seed=7", "--runs=2", file)).isEqualTo(0);
    assertThat(out()).isEqualTo(first);
  }

  @Test
  public void testEntryAndPrintRewritten() throws Exception {
    String file = write(MODEL);
    assertThat(run("--entry=sub", "--arg=0", "--observe=z=0.5", "--print_rewritten", file))
        .isEqualTo(0);
    assertThat(out())
        .isEqualTo(
            "\ndef _model_body(loc):\n  z = yield normal(\"z\", loc, 1)\n  return z\n\n"
                + "z = 0.5 (observed)\nresult = 0.5\n");
  }

  @Test
  public void testEntryIsNotModel() throws Exception {
    String file = write(MODEL + "helper = 1\n");
    assertThat(run("--entry=helper", file)).isEqualTo(1);
    assertThat(err()).isEqualTo(file + ": helper is not a model (got int)\n");

    err.reset();
    assertThat(run("--entry=missing", file)).isEqualTo(1);
    assertThat(err()).isEqualTo(file + ": missing is not a model (got nothing)\n");
  }

  @Test
  public void testStaticErrors() throws Exception {
    String file = write("x = undefined\n");
    assertThat(run(file)).isEqualTo(1);
    assertThat(err()).contains("model.ms:1:5: name 'undefined' is not defined");
  }

  @Test
  public void testRunErrors() throws Exception {
    String file = write(MODEL);
    assertThat(run("--observe=x=1.0", "--observe=z=2", "--arg='a'", file)).isEqualTo(1);
    assertThat(err()).contains("unsupported binary operation: float * string");
    assertThat(out()).isEmpty();
  }

  @Test
  public void testUnsupportedAssignment() throws Exception {
    String file =
        write(
            String.join(
                "\n",
                "@model",
                "def main():",
                "  x = 1",
                "  x += normal(\"x\")",
                "  return x",
                ""));
    assertThat(run(file)).isEqualTo(1);
    assertThat(err()).contains("cannot rewrite augmented assignment of a call to normal");

    err.reset();
    assertThat(run("--pass_through_unsupported_assignments", file)).isEqualTo(1);
    assertThat(err()).contains("unsupported binary operation: int + normal");
  }

  @Test
  public void testUsageErrors() throws Exception {
    assertThat(run()).isEqualTo(2);
    assertThat(err()).startsWith("no file specified\nusage: modelscript ");

    err.reset();
    assertThat(run("--bogus", "f.ms")).isEqualTo(2);
    assertThat(err()).startsWith("unknown flag: --bogus\n");

    err.reset();
    assertThat(run("--runs=0", "f.ms")).isEqualTo(2);
    assertThat(err()).startsWith("--runs must be a positive integer, got 0\n");

    err.reset();
    assertThat(run("--seed=x", "f.ms")).isEqualTo(2);
    assertThat(err()).startsWith("--seed wants an integer, got x\n");

    err.reset();
    assertThat(run("--observe=x", "f.ms")).isEqualTo(2);
    assertThat(err()).startsWith("--observe wants NAME=EXPR, got x\n");

    err.reset();
    assertThat(run("--verbose=yes", "f.ms")).isEqualTo(2);
    assertThat(err()).startsWith("--verbose flag takes no value\n");

    err.reset();
    assertThat(run("a.ms", "b.ms")).isEqualTo(2);
    assertThat(err()).startsWith("too many positional arguments\n");
  }

  @Test
  public void testMissingFile() {
    assertThat(run(tmp.getRoot().getPath() + "/absent.ms")).isEqualTo(1);
    assertThat(err()).startsWith("Error reading ");
  }
}
