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

/** Syntax node for a function call expression. */
public final class CallExpression extends Expression {

  private final Expression function;
  private final int lparenOffset;
  private final ImmutableList<Argument> arguments;
  private final int rparenOffset;

  CallExpression(
      FileLocations locs,
      Expression function,
      int lparenOffset,
      ImmutableList<Argument> arguments,
      int rparenOffset) {
    super(locs, Kind.CALL);
    this.function = function;
    this.lparenOffset = lparenOffset;
    this.arguments = arguments;
    this.rparenOffset = rparenOffset;
  }

  /** Returns the function that is called. */
  public Expression getFunction() {
    return function;
  }

  /** Returns the list of arguments of the call. */
  public ImmutableList<Argument> getArguments() {
    return arguments;
  }

  /**
   * Returns a copy of this call that applies the same arguments to a different callee. The copy
   * shares this call's argument nodes and position.
   */
  public CallExpression withFunction(Expression function) {
    return new CallExpression(locs, function, lparenOffset, arguments, rparenOffset);
  }

  /** Returns the location of the open paren, which is the location reported for the call. */
  public Location getLparenLocation() {
    return locs.getLocation(lparenOffset);
  }

  @Override
  public Location getLocation() {
    return getLparenLocation();
  }

  @Override
  public int getStartOffset() {
    return function.getStartOffset();
  }

  @Override
  public int getEndOffset() {
    return rparenOffset + 1;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
