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

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import java.util.List;
import net.modelscript.java.eval.EvalException;
import net.modelscript.java.eval.Model;
import net.modelscript.java.eval.ModelFunction;
import net.modelscript.java.eval.ModelThread;
import net.modelscript.java.eval.Module;
import net.modelscript.java.syntax.DefStatement;
import net.modelscript.java.syntax.IfStatement;
import net.modelscript.java.syntax.ModelFile;
import net.modelscript.java.syntax.ParserInput;
import net.modelscript.java.syntax.Resolver;
import net.modelscript.java.syntax.Statement;

/**
 * Converts the source of a function declaration to a syntax tree, and a (possibly rewritten) syntax
 * tree back into a function value.
 */
public final class FunctionCompiler {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  // Enclosing block for a fragment whose first line is indented.
  private static final String WRAPPER = "if True:\n";

  private FunctionCompiler() {} // uninstantiable

  /**
   * Parses the source of a function declaration.
   *
   * <p>The source may be excerpted from an indented block, such as the body of an {@code if}
   * statement or of another function. Such a fragment is parsed within a dummy {@code if True:}
   * block, which is then discarded. Locations in the resulting tree, and in any reported error,
   * are those of the original file.
   *
   * @throws ModelException of kind {@code MALFORMED_INPUT} if the source does not parse, or does
   *     not begin with a function declaration
   */
  public static DefStatement parse(FunctionSource source) throws ModelException {
    String text = source.getText();
    String file = source.getLocation().file();
    boolean indented = !text.isEmpty() && (text.charAt(0) == ' ' || text.charAt(0) == '\t');

    ParserInput input =
        indented
            ? ParserInput.fromString(WRAPPER + text, file)
                .withLineOffset(source.getLineOffset() - 1)
            : ParserInput.fromString(text, file).withLineOffset(source.getLineOffset());
    ModelFile parsed = ModelFile.parse(input, source.getOptions());
    if (!parsed.ok()) {
      throw ModelException.malformed(
          String.format("source of %s does not parse", source.getName()), parsed.errors());
    }

    List<Statement> stmts = parsed.getStatements();
    if (indented && !stmts.isEmpty() && stmts.get(0) instanceof IfStatement) {
      stmts = ((IfStatement) stmts.get(0)).getThenBlock();
    }
    if (stmts.isEmpty() || !(stmts.get(0) instanceof DefStatement)) {
      throw ModelException.malformed(
          String.format("source of %s is not a function declaration", source.getName()),
          ImmutableList.of());
    }
    return (DefStatement) stmts.get(0);
  }

  /**
   * Defines the function declared by {@code def}, which is usually a rewritten tree obtained from
   * {@link #parse}, in {@code module}.
   *
   * <p>The tree is printed as text, parsed and resolved again, and then executed in {@code module}
   * so that the names it refers to denote the module's variables. The function's name is not bound
   * in the module. Any decorators remaining on the declaration are applied.
   *
   * @throws ModelException of kind {@code MALFORMED_INPUT} if the printed text does not parse, or
   *     the decorators produce something other than a function
   * @throws EvalException if the evaluation of a default value or decorator fails
   */
  public static CompiledArtifact materialize(
      DefStatement def, FunctionSource source, Module module, ModelThread thread)
      throws ModelException, EvalException, InterruptedException {
    String text = def.toSourceText(source.getLocation().line());
    ModelFile file = reparse(text, source);
    return check(source, text, Model.evalDef(file, module, thread));
  }

  /**
   * Like {@link #materialize(DefStatement, FunctionSource, Module, ModelThread)}, but defines the
   * function in the module of {@code original}, the function {@code def} was extracted from, and
   * gives it the default values of {@code original} rather than evaluating them again. A default
   * that names a local of the function enclosing {@code original} thus keeps its value.
   *
   * @throws ModelException of kind {@code MALFORMED_INPUT} if the printed text does not parse,
   *     declares different parameters, or the decorators produce something other than a function
   */
  public static CompiledArtifact materialize(
      DefStatement def, FunctionSource source, ModelFunction original, ModelThread thread)
      throws ModelException, EvalException, InterruptedException {
    String text = def.toSourceText(source.getLocation().line());
    ModelFile file = reparse(text, source);
    if (def.getParameters().size() != original.getParameterNames().size()) {
      throw ModelException.malformed(
          String.format(
              "rewritten %s has %d parameters, want %d",
              source.getName(), def.getParameters().size(), original.getParameterNames().size()),
          ImmutableList.of());
    }
    return check(source, text, Model.evalDef(file, original, thread));
  }

  private static ModelFile reparse(String text, FunctionSource source) throws ModelException {
    ParserInput input =
        ParserInput.synthesized(text, source.getLocation().file())
            .withLineOffset(source.getLocation().line() - 1);
    ModelFile file = ModelFile.parse(input, source.getOptions());
    if (file.ok()) {
      // Names are looked up in the module when the function runs.
      Resolver.resolveFile(file, Resolver.DYNAMIC_GLOBALS);
    }
    if (!file.ok()) {
      throw ModelException.malformed(
          String.format("rewritten source of %s does not parse", source.getName()),
          file.errors());
    }
    return file;
  }

  private static CompiledArtifact check(FunctionSource source, String text, Object fn)
      throws ModelException {
    if (!(fn instanceof ModelFunction)) {
      throw ModelException.malformed(
          String.format(
              "decorators of %s produced a value of type %s, want function",
              source.getName(), Model.type(fn)),
          ImmutableList.of());
    }
    logger.atFine().log("materialized %s:\n%s", source.getName(), text);
    return new CompiledArtifact(text, (ModelFunction) fn);
  }
}
