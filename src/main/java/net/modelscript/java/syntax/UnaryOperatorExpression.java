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

/** A prefix operation: {@code -x}, {@code +x} or {@code not x}. */
public final class UnaryOperatorExpression extends Expression {

  private final Operator op;
  private final int start;
  private final Expression x;

  UnaryOperatorExpression(FileLocations locs, Operator op, int start, Expression x) {
    super(locs, Kind.UNARY_OPERATOR);
    Preconditions.checkArgument(
        op == Operator.MINUS || op == Operator.PLUS || op == Operator.NOT, "not unary: %s", op);
    this.op = op;
    this.start = start;
    this.x = x;
  }

  public Operator getOperator() {
    return op;
  }

  public Expression getX() {
    return x;
  }

  @Override
  public int getStartOffset() {
    return start;
  }

  @Override
  public int getEndOffset() {
    return x.getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
