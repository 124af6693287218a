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

/** A binary operation, {@code x op y}. */
public final class BinaryOperatorExpression extends Expression {

  private final Expression x;
  private final Operator op;
  private final int opOffset;
  private final Expression y;

  BinaryOperatorExpression(
      FileLocations locs, Expression x, Operator op, int opOffset, Expression y) {
    super(locs, Kind.BINARY_OPERATOR);
    this.x = x;
    this.op = op;
    this.opOffset = opOffset;
    this.y = y;
  }

  public Expression getX() {
    return x;
  }

  public Operator getOperator() {
    return op;
  }

  public Expression getY() {
    return y;
  }

  /** Returns the location of the operator, which is where a failed operation is reported. */
  @Override
  public Location getLocation() {
    return locs.getLocation(opOffset);
  }

  @Override
  public int getStartOffset() {
    return x.getStartOffset();
  }

  @Override
  public int getEndOffset() {
    return y.getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
