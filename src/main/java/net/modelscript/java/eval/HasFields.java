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

import com.google.common.collect.ImmutableCollection;
import javax.annotation.Nullable;

/**
 * A value with named fields, accessible with the dot operator {@code x.f}.
 *
 * <p>Field lookup does not evaluate ModelScript code, so it is also usable at rewrite time, when a
 * dotted callee path such as {@code dist.normal} is classified without running anything.
 */
public interface HasFields extends ModelValue {

  /** Returns the value of the named field, or null if the value has no such field. */
  @Nullable
  Object getField(String name) throws EvalException;

  /** Returns the names of this value's fields, in some stable order. */
  ImmutableCollection<String> getFieldNames();

  /**
   * Returns the error message to report when a missing field is selected, or null to use the
   * default message.
   */
  @Nullable
  default String getErrorMessageForUnknownField(String field) {
    return null;
  }
}
