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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Binds call arguments to the parameters of a ModelScript or built-in function. */
final class Arguments {

  private Arguments() {}

  /**
   * Stores the effective parameter values in the first {@code params.size()} elements of {@code
   * slots}. If {@code varargs}, surplus positional arguments are stored as a tuple in the next
   * element.
   *
   * @param defaults default values indexed like params, null for required parameters
   */
  static void bind(
      String fn,
      List<String> params,
      Object[] defaults,
      boolean varargs,
      List<Object> positional,
      Map<String, Object> named,
      Object[] slots)
      throws EvalException {
    int nparams = params.size();
    int npos = positional.size();
    if (npos > nparams && !varargs) {
      if (nparams == 0) {
        throw Model.errorf("%s() does not accept positional arguments, but got %d", fn, npos);
      }
      throw Model.errorf(
          "%s() accepts no more than %d positional argument%s but got %d",
          fn, nparams, plural(nparams), npos);
    }
    for (int i = 0; i < Math.min(npos, nparams); i++) {
      slots[i] = positional.get(i);
    }
    if (varargs) {
      slots[nparams] =
          npos > nparams ? Tuple.copyOf(positional.subList(nparams, npos)) : Tuple.empty();
    }

    List<String> unexpected = new ArrayList<>();
    for (Map.Entry<String, Object> e : named.entrySet()) {
      int i = params.indexOf(e.getKey());
      if (i < 0) {
        unexpected.add(e.getKey());
      } else if (slots[i] != null) {
        throw Model.errorf("%s() got multiple values for parameter '%s'", fn, e.getKey());
      } else {
        slots[i] = e.getValue();
      }
    }
    if (!unexpected.isEmpty()) {
      throw Model.errorf(
          "%s() got unexpected keyword argument%s: %s",
          fn, plural(unexpected.size()), Joiner.on(", ").join(unexpected));
    }

    List<String> missing = new ArrayList<>();
    for (int i = 0; i < nparams; i++) {
      if (slots[i] == null) {
        if (defaults[i] == null) {
          missing.add(params.get(i));
        } else {
          slots[i] = defaults[i];
        }
      }
    }
    if (!missing.isEmpty()) {
      throw Model.errorf(
          "%s() missing %d required positional argument%s: %s",
          fn, missing.size(), plural(missing.size()), Joiner.on(", ").join(missing));
    }
  }

  static String plural(int n) {
    return n == 1 ? "" : "s";
  }
}
