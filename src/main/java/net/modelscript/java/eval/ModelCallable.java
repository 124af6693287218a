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

import java.util.List;
import java.util.Map;
import net.modelscript.java.syntax.Location;

/**
 * The ModelCallable interface is implemented by all ModelScript values that may be called from
 * ModelScript like a function, including built-in functions and methods, functions declared by
 * {@code def}, and model handles.
 *
 * <p>Clients should call a callable through {@link Model#call}, which maintains the call stack of
 * the thread, rather than calling {@link #call} directly.
 */
public interface ModelCallable extends ModelValue {

  /**
   * Defines the implementation of the function, given the positional and named arguments of the
   * call. The thread's call stack has already been pushed with a frame for this callable.
   *
   * @param thread the thread in which the call occurs
   * @param positional the positional arguments, in order
   * @param named the keyword arguments, in order of appearance
   */
  Object call(ModelThread thread, List<Object> positional, Map<String, Object> named)
      throws EvalException, InterruptedException;

  /** Returns the form this callable value should take in a stack trace. */
  String getName();

  /**
   * Returns the location of the definition of this callable value, or BUILTIN if it was not
   * defined in ModelScript code.
   */
  default Location getLocation() {
    return Location.BUILTIN;
  }

  @Override
  default String typeName() {
    return "function";
  }
}
