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

import com.google.common.collect.ImmutableCollection;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import net.modelscript.java.eval.Coroutine;
import net.modelscript.java.eval.EvalException;
import net.modelscript.java.eval.HasFields;
import net.modelscript.java.eval.Model;
import net.modelscript.java.eval.ModelCallable;
import net.modelscript.java.eval.ModelFunction;
import net.modelscript.java.eval.ModelThread;
import net.modelscript.java.eval.Printer;
import net.modelscript.java.syntax.DefStatement;
import net.modelscript.java.syntax.Location;

/**
 * A ModelHandle is the value that stands for a model declaration.
 *
 * <p>A handle is constructed once per declaration, by extracting the source of the declared
 * function, parsing it, rewriting it into a coroutine function, and defining that function in the
 * module of the declaration. Thereafter it offers two ways to run the model:
 *
 * <ul>
 *   <li>calling the handle calls the original function, with no suspension; and
 *   <li>its {@linkplain #getFactory factory}, the {@code generator} field in ModelScript, creates
 *       suspendable computations, to be run by a {@link Driver}.
 * </ul>
 *
 * A handle also carries the declaration's name, docstring and location, and, for inspection, the
 * rewritten source and the treatment of each stochastic or model call.
 */
@Immutable
public final class ModelHandle implements ModelCallable, HasFields {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  /** The name of the field of a model that holds its coroutine factory. */
  public static final String FACTORY_FIELD = "generator";

  private final ModelFunction original;
  private final FunctionSource source;
  private final DefStatement rewritten;
  private final CompiledArtifact artifact;
  private final CoroutineFactory factory;
  private final ImmutableList<RewriteSite> sites;

  private ModelHandle(
      ModelFunction original,
      FunctionSource source,
      DefStatement rewritten,
      CompiledArtifact artifact,
      ImmutableList<RewriteSite> sites) {
    this.original = original;
    this.source = source;
    this.rewritten = rewritten;
    this.artifact = artifact;
    this.factory = new CoroutineFactory(source.getName(), artifact);
    this.sites = sites;
  }

  /**
   * Returns the model for function {@code fn}, classifying the callees of its body by the bindings
   * of the module in which it was defined.
   */
  public static ModelHandle create(Object fn, ModelThread thread)
      throws ModelException, EvalException, InterruptedException {
    RewriteRegistry registry =
        fn instanceof ModelFunction
            ? new ModuleRewriteRegistry(((ModelFunction) fn).getModule())
            : path -> null; // not a function; extraction fails
    return create(fn, registry, thread);
  }

  /**
   * Returns the model for function {@code fn}, classifying the callees of its body by {@code
   * registry}. The rewritten function is defined in the original's module with the original's
   * default values, and any decorators other than registration markers are applied, in {@code
   * thread}.
   *
   * @throws ModelException if the function cannot be made into a model. The exception is tagged
   *     with the function's name and location.
   * @throws EvalException if the evaluation of a default value or decorator of the rewritten
   *     declaration fails
   */
  public static ModelHandle create(Object fn, RewriteRegistry registry, ModelThread thread)
      throws ModelException, EvalException, InterruptedException {
    String name = Model.type(fn);
    Location loc = Location.BUILTIN;
    if (fn instanceof ModelCallable) {
      name = ((ModelCallable) fn).getName();
      loc = ((ModelCallable) fn).getLocation();
    }
    try {
      FunctionSource source = SourceExtractor.extract(fn);
      ModelFunction original = (ModelFunction) fn;
      logger.atFine().log("%s: making model %s", source.getLocation(), name);

      DefStatement def = FunctionCompiler.parse(source);
      ImmutableList<RewriteSite> sites =
          RewriteVisitor.rewrite(def, registry, thread.getSemantics());
      // The rewritten function shares the original's defaults, which may name enclosing locals.
      CompiledArtifact artifact = FunctionCompiler.materialize(def, source, original, thread);
      return new ModelHandle(original, source, def, artifact, sites);
    } catch (ModelException ex) {
      throw ex.tag(name, loc);
    }
  }

  /** Calls the original function, as if the model were an ordinary function. */
  @Override
  public Object call(ModelThread thread, List<Object> positional, Map<String, Object> named)
      throws EvalException, InterruptedException {
    return Model.call(thread, original, positional, named);
  }

  /** Returns a new computation of this model, applied to the given arguments. */
  public Coroutine newComputation(
      ModelThread thread, List<Object> positional, Map<String, Object> named)
      throws EvalException {
    return factory.newCoroutine(thread, positional, named);
  }

  /** Returns the declared name of the model. */
  @Override
  public String getName() {
    return source.getName();
  }

  @Override
  public Location getLocation() {
    return source.getLocation();
  }

  /** Returns the docstring of the declaration, or null if it has none. */
  @Nullable
  public String getDocumentation() {
    return source.getDoc();
  }

  /** Returns the function as originally declared. */
  public ModelFunction getOriginal() {
    return original;
  }

  public FunctionSource getSource() {
    return source;
  }

  /** Returns the syntax tree of the rewritten declaration. */
  public DefStatement getRewrittenDeclaration() {
    return rewritten;
  }

  public CompiledArtifact getArtifact() {
    return artifact;
  }

  /** Returns the source text of the rewritten declaration. */
  public String getRewrittenText() {
    return artifact.getText();
  }

  public CoroutineFactory getFactory() {
    return factory;
  }

  /** Returns the treatment of each stochastic or model call in the body, in source order. */
  public ImmutableList<RewriteSite> getRewriteSites() {
    return sites;
  }

  @Override
  @Nullable
  public Object getField(String name) {
    return name.equals(FACTORY_FIELD) ? factory : null;
  }

  @Override
  public ImmutableCollection<String> getFieldNames() {
    return ImmutableList.of(FACTORY_FIELD);
  }

  @Override
  public String getErrorMessageForUnknownField(String field) {
    return String.format("model %s has no field '%s'", getName(), field);
  }

  @Override
  public String typeName() {
    return "model";
  }

  @Override
  public void repr(Printer printer) {
    printer.append("<model ").append(getName()).append(">");
  }

  @Override
  public String toString() {
    return getName();
  }
}
