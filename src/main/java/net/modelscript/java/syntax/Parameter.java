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

package net.modelscript.java.syntax;

import javax.annotation.Nullable;

/**
 * A parameter of a {@code def}: a name, optionally followed by {@code =} and a default value
 * expression. Parameters without defaults are required, and must precede those with defaults.
 */
public final class Parameter extends Node {

  private final Identifier id;
  @Nullable private final Expression defaultValue;

  Parameter(FileLocations locs, Identifier id, @Nullable Expression defaultValue) {
    super(locs);
    this.id = id;
    this.defaultValue = defaultValue;
  }

  public String getName() {
    return id.getName();
  }

  public Identifier getIdentifier() {
    return id;
  }

  /** Returns the default value expression, or null for a required parameter. */
  @Nullable
  public Expression getDefaultValue() {
    return defaultValue;
  }

  public boolean isOptional() {
    return defaultValue != null;
  }

  @Override
  public int getStartOffset() {
    return id.getStartOffset();
  }

  @Override
  public int getEndOffset() {
    return defaultValue != null ? defaultValue.getEndOffset() : id.getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
