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

/** An argument of a call: positional, {@code f(e)}, or named, {@code f(name=e)}. */
public final class Argument extends Node {

  @Nullable private final Identifier keyword;
  private final Expression value;

  Argument(FileLocations locs, @Nullable Identifier keyword, Expression value) {
    super(locs);
    this.keyword = keyword;
    this.value = value;
  }

  /** Returns the keyword of a named argument, or null for a positional one. */
  @Nullable
  public Identifier getKeyword() {
    return keyword;
  }

  /** Returns the parameter name of a named argument, or null for a positional one. */
  @Nullable
  public String getName() {
    return keyword != null ? keyword.getName() : null;
  }

  public boolean isPositional() {
    return keyword == null;
  }

  public Expression getValue() {
    return value;
  }

  @Override
  public int getStartOffset() {
    return keyword != null ? keyword.getStartOffset() : value.getStartOffset();
  }

  @Override
  public int getEndOffset() {
    return value.getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
