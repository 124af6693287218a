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
 * Syntax node for a suspension, {@code yield value} or {@code yield from value}.
 *
 * <p>A yield may appear only as the entire right-hand side of an ordinary assignment, or as an
 * expression statement, within the body of a {@code def}. In the delegating form the value must be
 * a coroutine, whose suspensions are passed through to the caller one by one; the value of the
 * yield expression is the delegate's return value.
 */
public final class YieldExpression extends Expression {

  private final int yieldOffset;
  private final boolean delegating;
  private final Expression value;

  YieldExpression(FileLocations locs, int yieldOffset, boolean delegating, Expression value) {
    super(locs, Kind.YIELD);
    this.yieldOffset = yieldOffset;
    this.delegating = delegating;
    this.value = value;
  }

  /**
   * Returns a new yield expression whose operand is {@code value}. The new node has no source text
   * of its own: it is positioned at the start of {@code value}.
   */
  public static YieldExpression wrap(Expression value, boolean delegating) {
    Preconditions.checkArgument(
        !(value instanceof YieldExpression), "yield operand is already a yield");
    return new YieldExpression(value.locs, value.getStartOffset(), delegating, value);
  }

  /** Reports whether this is a {@code yield from} expression. */
  public boolean isDelegating() {
    return delegating;
  }

  /** Returns the operand whose value is yielded, or delegated to. */
  public Expression getValue() {
    return value;
  }

  @Override
  public int getStartOffset() {
    return yieldOffset;
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
