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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CheckReturnValue;
import com.google.errorprone.annotations.FormatMethod;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import net.modelscript.java.syntax.DefStatement;
import net.modelscript.java.syntax.Expression;
import net.modelscript.java.syntax.FileOptions;
import net.modelscript.java.syntax.ModelFile;
import net.modelscript.java.syntax.ParserInput;
import net.modelscript.java.syntax.Resolver;
import net.modelscript.java.syntax.SyntaxError;

/** Entry points of the interpreter: executing files, evaluating expressions, calling values. */
public final class Model {

  private Model() {}

  public static final NoneType NONE = NoneType.NONE;

  /** The names predeclared in every file: None, True, False and the built-in functions. */
  public static final ImmutableMap<String, Object> UNIVERSE = MethodLibrary.createUniverse();

  public static boolean truth(Object x) {
    return EvalUtils.truth(x);
  }

  public static String type(Object x) {
    return EvalUtils.type(x);
  }

  public static String str(Object x) {
    return new Printer().str(x).toString();
  }

  public static String repr(Object x) {
    return new Printer().repr(x).toString();
  }

  /** Reports whether {@code x == y}; an int equals a float of the same value. */
  public static boolean equal(Object x, Object y) {
    return EvalUtils.equal(x, y);
  }

  /** Converts an int or float to a double, failing with a message that names {@code what}. */
  public static double toDouble(Object x, String what) throws EvalException {
    return EvalUtils.toDouble(x, what);
  }

  @FormatMethod
  @CheckReturnValue
  public static EvalException errorf(String format, Object... args) {
    return new EvalException(String.format(format, args));
  }

  /**
   * Calls {@code fn} with the given arguments on a new frame of {@code thread}. An EvalException
   * thrown by the call carries the call stack at the point of failure.
   */
  public static Object call(
      ModelThread thread, Object fn, List<Object> positional, Map<String, Object> named)
      throws EvalException, InterruptedException {
    if (!(fn instanceof ModelCallable callable)) {
      throw errorf("'%s' object is not callable", type(fn));
    }
    thread.push(callable);
    try {
      return callable.call(thread, positional, named);
    } catch (EvalException ex) {
      throw ex.ensureStack(thread);
    } finally {
      thread.pop();
    }
  }

  /**
   * Parses, resolves and executes a file, updating the globals of {@code module}.
   *
   * @throws SyntaxError.Exception if the file cannot be parsed or resolved
   */
  public static void execFile(
      ParserInput input, FileOptions options, Module module, ModelThread thread)
      throws SyntaxError.Exception, EvalException, InterruptedException {
    ModelFile file = ModelFile.parse(input, options);
    Resolver.resolveFile(file, module);
    if (!file.ok()) {
      throw new SyntaxError.Exception(file.errors());
    }
    call(thread, toplevel(file, module), ImmutableList.of(), ImmutableMap.of());
  }

  /** Parses, resolves and evaluates an expression in {@code module}. */
  public static Object eval(ParserInput input, Module module, ModelThread thread)
      throws SyntaxError.Exception, EvalException, InterruptedException {
    Expression expr = Expression.parse(input);
    Resolver.Function rfn = Resolver.resolveExpr(expr, module);
    return call(
        thread,
        new ModelFunction(rfn, module, new Object[0], ImmutableList.of()),
        ImmutableList.of(),
        ImmutableMap.of());
  }

  /**
   * Defines the function declared by the single {@code def} of {@code file} in {@code module},
   * applies its decorators, and returns the result. Default values and decorators are evaluated in
   * the module. The function's name is not bound.
   *
   * <p>The file is normally resolved with {@link Resolver#DYNAMIC_GLOBALS}, so that its names are
   * looked up in the module as it executes.
   */
  public static Object evalDef(ModelFile file, Module module, ModelThread thread)
      throws EvalException, InterruptedException {
    return evalDef(file, module, null, thread);
  }

  /**
   * Like {@link #evalDef(ModelFile, Module, ModelThread)}, but defines the function in the module
   * of {@code original}, and gives it the default values {@code original} was created with instead
   * of evaluating its own. This way a default that names a local of the function enclosing the
   * original keeps its value.
   *
   * @throws IllegalArgumentException if the two functions' parameters differ
   */
  public static Object evalDef(ModelFile file, ModelFunction original, ModelThread thread)
      throws EvalException, InterruptedException {
    return evalDef(file, original.getModule(), original.defaultValues, thread);
  }

  private static Object evalDef(
      ModelFile file, Module module, @Nullable Object[] defaults, ModelThread thread)
      throws EvalException, InterruptedException {
    ImmutableList<?> stmts = file.getStatements();
    Preconditions.checkArgument(
        stmts.size() == 1 && stmts.get(0) instanceof DefStatement,
        "file does not consist of a single def statement");
    DefStatement def = (DefStatement) stmts.get(0);
    Preconditions.checkArgument(
        defaults == null || defaults.length == def.getParameters().size(),
        "%s has %s parameters, not %s",
        def.getIdentifier().getName(),
        def.getParameters().size(),
        defaults == null ? 0 : defaults.length);

    ModelFunction toplevel = toplevel(file, module);
    ModelThread.Frame fr = thread.push(toplevel);
    try {
      fr.locals = new Object[0];
      return Eval.evalDef(fr, def, defaults);
    } catch (EvalException ex) {
      throw ex.ensureStack(thread);
    } finally {
      thread.pop();
    }
  }

  private static ModelFunction toplevel(ModelFile file, Module module) {
    Resolver.Function rfn = file.getResolvedFunction();
    Preconditions.checkArgument(rfn != null && file.ok(), "file was not successfully resolved");
    return new ModelFunction(rfn, module, new Object[0], ImmutableList.of());
  }
}
