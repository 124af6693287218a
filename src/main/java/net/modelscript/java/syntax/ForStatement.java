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

/** A loop, {@code for target in iterable: body}. */
public final class ForStatement extends Statement {

  private final int forOffset;
  private final Expression target;
  private final Expression iterable;
  private final ImmutableList<Statement> body;

  ForStatement(
      FileLocations locs,
      int forOffset,
      Expression target,
      Expression iterable,
      ImmutableList<Statement> body) {
    super(locs, Kind.FOR);
    this.forOffset = forOffset;
    this.target = target;
    this.iterable = iterable;
    this.body = body;
  }

  /** Returns what each element is assigned to, such as {@code x} or {@code i, x}. */
  public Expression getTarget() {
    return target;
  }

  /** Returns the list or tuple expression iterated over. */
  public Expression getIterable() {
    return iterable;
  }

  public ImmutableList<Statement> getBody() {
    return body;
  }

  @Override
  public int getStartOffset() {
    return forOffset;
  }

  @Override
  public int getEndOffset() {
    return endOfBlock(body, iterable);
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
