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

import com.google.common.base.Preconditions;

/**
 * A literal constant: an int ({@link Integer}), a float ({@link Double}) or a string ({@link
 * String}). The node keeps its source spelling, which the printer reproduces verbatim.
 */
public final class Literal extends Expression {

  private final int start;
  private final String text;
  private final Object value;

  Literal(FileLocations locs, int start, String text, Object value) {
    super(locs, Kind.LITERAL);
    Preconditions.checkArgument(
        value instanceof Integer || value instanceof Double || value instanceof String,
        "not a literal value: %s",
        value);
    this.start = start;
    this.text = text;
    this.value = value;
  }

  /** Returns the Integer, Double or String denoted by the literal. */
  public Object getValue() {
    return value;
  }

  /** Returns the literal as written, including any quotation marks. */
  public String getText() {
    return text;
  }

  public boolean isString() {
    return value instanceof String;
  }

  @Override
  public int getStartOffset() {
    return start;
  }

  @Override
  public int getEndOffset() {
    return start + text.length();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
