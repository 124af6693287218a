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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.modelscript.java.eval.Model;
import net.modelscript.java.eval.ModelSemantics;
import net.modelscript.java.eval.ModelThread;
import net.modelscript.java.eval.Module;
import net.modelscript.java.eval.Structure;
import net.modelscript.java.lib.stochastic.StochasticLibrary;
import net.modelscript.java.syntax.FileOptions;
import net.modelscript.java.syntax.ParserInput;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link ModuleRewriteRegistry}. */
@RunWith(JUnit4.class)
public final class ModuleRewriteRegistryTest {

  private Module module;
  private ModuleRewriteRegistry registry;

  @Before
  public void setUp() throws Exception {
    module = ModelEnvironment.newModule();
    Model.execFile(
        ParserInput.fromString(
            String.join(
                "\n",
                "@model",
                "def sub():",
                "  x = normal(\"x\")",
                "  return x",
                "def helper():",
                "  return 1"),
            "m.ms"),
        FileOptions.DEFAULT,
        module,
        new ModelThread(ModelSemantics.DEFAULT));
    module.setGlobal(
        "lib",
        Structure.create(
            "lib", ImmutableMap.of("draw", StochasticLibrary.UNIFORM, "sub", module.get("sub"))));
    registry = new ModuleRewriteRegistry(module);
  }

  private Classification classify(String... path) {
    return registry.classify(ImmutableList.copyOf(path));
  }

  @Test
  public void testStochasticConstructors() {
    assertThat(classify("normal")).isEqualTo(Classification.SUSPENSION_ELIGIBLE);
    assertThat(classify("dist", "bernoulli")).isEqualTo(Classification.SUSPENSION_ELIGIBLE);
    assertThat(classify("lib", "draw")).isEqualTo(Classification.SUSPENSION_ELIGIBLE);
  }

  @Test
  public void testModels() {
    assertThat(module.get("sub")).isInstanceOf(ModelHandle.class);
    assertThat(classify("sub")).isEqualTo(Classification.DELEGATE);
    assertThat(classify("lib", "sub")).isEqualTo(Classification.DELEGATE);
  }

  @Test
  public void testOtherValuesAreOpaque() {
    assertThat(classify("helper")).isEqualTo(Classification.OPAQUE);
    assertThat(classify("len")).isEqualTo(Classification.OPAQUE);
    assertThat(classify("dist")).isEqualTo(Classification.OPAQUE);
    assertThat(classify("model")).isEqualTo(Classification.OPAQUE);
    assertThat(classify("sub", "generator")).isEqualTo(Classification.OPAQUE);
  }

  @Test
  public void testUnresolvablePaths() {
    assertThat(classify("undefined")).isNull();
    assertThat(classify("dist", "gamma")).isNull();
    assertThat(classify("helper", "x")).isNull();
    assertThat(classify("lib", "sub", "generator", "x")).isNull();
  }

  @Test
  public void testLookupsSeeLaterBindings() {
    assertThat(classify("late")).isNull();
    module.setGlobal("late", StochasticLibrary.NORMAL);
    assertThat(classify("late")).isEqualTo(Classification.SUSPENSION_ELIGIBLE);
  }
}
