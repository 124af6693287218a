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
import com.google.common.collect.ImmutableCollection;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * An immutable, named collection of fields. Structures serve as namespaces for groups of
 * predeclared functions, such as {@code dist}.
 */
@Immutable
public final class Structure implements HasFields {

  private final String name;
  private final ImmutableMap<String, Object> fields;

  private Structure(String name, ImmutableMap<String, Object> fields) {
    this.name = name;
    this.fields = fields;
  }

  /** Returns a structure of the given name whose fields are the entries of {@code fields}. */
  public static Structure create(String name, Map<String, ?> fields) {
    for (String field : fields.keySet()) {
      Preconditions.checkArgument(!field.isEmpty(), "empty field name");
    }
    return new Structure(name, ImmutableMap.copyOf(fields));
  }

  /** Returns the name of the structure. */
  public String getName() {
    return name;
  }

  @Override
  @Nullable
  public Object getField(String field) {
    return fields.get(field);
  }

  @Override
  public ImmutableCollection<String> getFieldNames() {
    return fields.keySet();
  }

  @Override
  public String getErrorMessageForUnknownField(String field) {
    return String.format("'%s' has no field '%s'", name, field);
  }

  @Override
  public String typeName() {
    return "struct";
  }

  @Override
  public void repr(Printer printer) {
    printer.append(name).append('(');
    String sep = "";
    for (Map.Entry<String, Object> e : fields.entrySet()) {
      printer.append(sep).append(e.getKey()).append(" = ").repr(e.getValue());
      sep = ", ";
    }
    printer.append(')');
  }
}
