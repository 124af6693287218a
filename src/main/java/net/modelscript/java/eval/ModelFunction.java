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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import net.modelscript.java.syntax.Location;
import net.modelscript.java.syntax.Resolver;

/**
 * A ModelFunction is a function value created by a ModelScript {@code def} statement.
 *
 * <p>Calling a function whose body contains {@code yield} does not execute the body: it returns a
 * {@link Coroutine} in its initial state, which runs the body step by step as it is resumed.
 */
public final class ModelFunction implements ModelCallable {

  final Resolver.Function rfn;
  private final Module module; // a function closes over its defining module

  // Default values of the parameters, indexed like rfn.getParameters().
  // Null for required parameters.
  final Object[] defaultValues;

  // Locals arrays of the enclosing functions, innermost first.
  // A FREE binding of depth d refers to element d-1.
  final ImmutableList<Object[]> enclosing;

  ModelFunction(
      Resolver.Function rfn,
      Module module,
      Object[] defaultValues,
      ImmutableList<Object[]> enclosing) {
    this.rfn = rfn;
    this.module = module;
    this.defaultValues =
        defaultValues.length == 0 ? new Object[rfn.getParameters().size()] : defaultValues;
    this.enclosing = enclosing;
  }

  boolean isToplevel() {
    return rfn.isToplevel();
  }

  /** Returns the module in which this function was defined. */
  public Module getModule() {
    return module;
  }

  /** Returns information about the resolved syntax of this function. */
  public Resolver.Function getResolvedFunction() {
    return rfn;
  }

  /** Returns the names of this function's parameters, in declaration order. */
  public ImmutableList<String> getParameterNames() {
    return rfn.getParameterNames();
  }

  /**
   * Returns the default value of the ith parameter ({@code 0 <= i < getParameterNames().size()}),
   * or null if the parameter is required.
   */
  @Nullable
  public Object getDefaultValue(int i) {
    return defaultValues[i];
  }

  /** Returns the value denoted by the function's doc string literal, or null if absent. */
  @Nullable
  public String getDocumentation() {
    return rfn.getDocumentation();
  }

  /** Reports whether this function's body contains {@code yield}. */
  public boolean isGenerator() {
    return rfn.isGenerator();
  }

  /** Reports whether this function refers to local variables of an enclosing function. */
  public boolean hasFreeVars() {
    return rfn.hasFreeVars();
  }

  @Override
  public Location getLocation() {
    return rfn.getLocation();
  }

  @Override
  public String getName() {
    return rfn.getName();
  }

  @Override
  public Object call(ModelThread thread, List<Object> positional, Map<String, Object> named)
      throws EvalException, InterruptedException {
    if (thread.isRecursiveCall(this)) {
      throw Model.errorf("function '%s' called recursively", getName());
    }

    Object[] locals = bindArguments(positional, named);
    if (rfn.isGenerator()) {
      return new Coroutine(this, locals);
    }

    ModelThread.Frame fr = thread.top();
    fr.locals = locals;
    return Eval.execFunctionBody(fr, rfn.getBody());
  }

  /**
   * Binds the arguments to the function's parameters and returns a coroutine, in its initial
   * state, that will execute the function body when resumed. Unlike {@link #call}, this never
   * executes any part of the body, even if it contains no {@code yield}: resuming such a coroutine
   * runs the body to completion and returns its result.
   *
   * @throws EvalException if the arguments do not match the function's parameters
   */
  public Coroutine newCoroutine(
      ModelThread thread, List<Object> positional, Map<String, Object> named)
      throws EvalException {
    return new Coroutine(this, bindArguments(positional, named));
  }

  // Returns a new locals array whose prefix holds the effective parameter values.
  private Object[] bindArguments(List<Object> positional, Map<String, Object> named)
      throws EvalException {
    Object[] locals = new Object[rfn.getLocals().size()];
    Arguments.bind(
        getName(), rfn.getParameterNames(), defaultValues, false, positional, named, locals);
    return locals;
  }

  @Override
  public void repr(Printer printer) {
    printer.append("<function " + getName() + ">");
  }

  @Override
  public String toString() {
    return Model.repr(this);
  }
}
