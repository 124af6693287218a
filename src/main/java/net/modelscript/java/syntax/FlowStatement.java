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

/** One of the statements {@code break}, {@code continue} and {@code pass}. */
public final class FlowStatement extends Statement {

  /** The effect of a flow statement on the enclosing loop. */
  public enum Jump {
    BREAK("break"),
    CONTINUE("continue"),
    PASS("pass");

    private final String keyword;

    Jump(String keyword) {
      this.keyword = keyword;
    }

    @Override
    public String toString() {
      return keyword;
    }
  }

  private final Jump jump;
  private final int start;

  FlowStatement(FileLocations locs, Jump jump, int start) {
    super(locs, Kind.FLOW);
    this.jump = jump;
    this.start = start;
  }

  public Jump getJump() {
    return jump;
  }

  @Override
  public int getStartOffset() {
    return start;
  }

  @Override
  public int getEndOffset() {
    return start + jump.toString().length();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
