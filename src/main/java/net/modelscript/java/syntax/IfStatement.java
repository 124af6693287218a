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

import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/**
 * A conditional statement. An {@code elif} clause is represented as an IfStatement, marked as
 * such, that is the only statement of the else block of the preceding clause.
 */
public final class IfStatement extends Statement {

  private final boolean elif;
  private final int start;
  private final Expression condition;
  private final ImmutableList<Statement> thenBlock;
  @Nullable private final ImmutableList<Statement> elseBlock;

  IfStatement(
      FileLocations locs,
      boolean elif,
      int start,
      Expression condition,
      ImmutableList<Statement> thenBlock,
      @Nullable ImmutableList<Statement> elseBlock) {
    super(locs, Kind.IF);
    this.elif = elif;
    this.start = start;
    this.condition = condition;
    this.thenBlock = thenBlock;
    this.elseBlock = elseBlock;
  }

  /** Reports whether this statement was written as an {@code elif} clause. */
  public boolean isElif() {
    return elif;
  }

  public Expression getCondition() {
    return condition;
  }

  public ImmutableList<Statement> getThenBlock() {
    return thenBlock;
  }

  /** Returns the else block, or null if there is no {@code else} or {@code elif} clause. */
  @Nullable
  public ImmutableList<Statement> getElseBlock() {
    return elseBlock;
  }

  @Override
  public int getStartOffset() {
    return start;
  }

  @Override
  public int getEndOffset() {
    return endOfBlock(elseBlock != null ? elseBlock : thenBlock, condition);
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
