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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * A BuiltinFunction is a callable implemented in Java.
 *
 * <p>Its signature is a list of named parameters, each either mandatory or optional with a
 * default value, optionally followed by a residual {@code *args} parameter that collects surplus
 * positional arguments into a tuple. Arguments are bound to parameters exactly as for a function
 * declared by {@code def}, and the implementation receives them as an array in parameter order.
 */
public class BuiltinFunction implements ModelCallable {

  /** The Java implementation of a built-in function. */
  @FunctionalInterface
  public interface Body {
    /**
     * Invokes the function.
     *
     * @param args the effective parameter values, in parameter order; the residual parameter, if
     *     any, is a {@link Tuple} in the last position
     */
    Object invoke(ModelThread thread, Object[] args) throws EvalException, InterruptedException;
  }

  private final String name;
  private final ImmutableList<String> params;
  private final Object[] defaults; // null for mandatory parameters
  private final boolean varargs;
  private final Body body;
  @Nullable private final String doc;

  protected BuiltinFunction(Builder builder, Body body) {
    this.name = builder.name;
    this.params = ImmutableList.copyOf(builder.params);
    this.defaults = builder.defaults.toArray();
    this.varargs = builder.varargs;
    this.body = Preconditions.checkNotNull(body);
    this.doc = builder.doc;
  }

  /** Returns a builder for a built-in function of the given name. */
  public static Builder builder(String name) {
    return new Builder(name);
  }

  /** A Builder describes the signature of a built-in function. */
  public static final class Builder {
    private final String name;
    private final List<String> params = new ArrayList<>();
    private final List<Object> defaults = new ArrayList<>();
    private boolean varargs;
    @Nullable private String doc;

    private Builder(String name) {
      this.name = Preconditions.checkNotNull(name);
    }

    /** Adds a mandatory parameter. */
    @CanIgnoreReturnValue
    public Builder param(String param) {
      Preconditions.checkState(!varargs, "parameter %s follows *args", param);
      Preconditions.checkState(
          defaults.isEmpty() || defaults.get(defaults.size() - 1) == null,
          "mandatory parameter %s follows an optional one",
          param);
      params.add(param);
      defaults.add(null);
      return this;
    }

    /** Adds an optional parameter with the given default value. */
    @CanIgnoreReturnValue
    public Builder optional(String param, Object defaultValue) {
      Preconditions.checkState(!varargs, "parameter %s follows *args", param);
      params.add(param);
      defaults.add(Preconditions.checkNotNull(defaultValue));
      return this;
    }

    /** Makes the function accept any number of surplus positional arguments. */
    @CanIgnoreReturnValue
    public Builder varargs() {
      this.varargs = true;
      return this;
    }

    /** Sets the documentation of the function. */
    @CanIgnoreReturnValue
    public Builder doc(String doc) {
      this.doc = doc;
      return this;
    }

    /** Returns the built-in function with this signature and the given implementation. */
    public BuiltinFunction build(Body body) {
      return new BuiltinFunction(this, body);
    }
  }

  @Override
  public String getName() {
    return name;
  }

  /** Returns the names of the function's parameters, excluding the residual one. */
  public ImmutableList<String> getParameterNames() {
    return params;
  }

  /** Returns the function's documentation, or null if none was provided. */
  @Nullable
  public String getDocumentation() {
    return doc;
  }

  @Override
  public Object call(ModelThread thread, List<Object> positional, Map<String, Object> named)
      throws EvalException, InterruptedException {
    Object[] args = new Object[params.size() + (varargs ? 1 : 0)];
    Arguments.bind(name, params, defaults, varargs, positional, named, args);
    return body.invoke(thread, args);
  }

  @Override
  public String typeName() {
    return "builtin_function_or_method";
  }

  @Override
  public void repr(Printer printer) {
    printer.append("<built-in function ").append(name).append(">");
  }

  @Override
  public String toString() {
    return name + "(" + Joiner.on(", ").join(params) + (varargs ? ", *args)" : ")");
  }
}
