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

import java.util.List;

/** A statement node. */
public abstract class Statement extends Node {

  /** The concrete class of a statement, for use in switch statements. */
  public enum Kind {
    ASSIGNMENT,
    DEF,
    EXPRESSION,
    FLOW,
    FOR,
    IF,
    RETURN,
  }

  private final Kind kind;

  Statement(FileLocations locs, Kind kind) {
    super(locs);
    this.kind = kind;
  }

  public final Kind kind() {
    return kind;
  }

  // Returns the end offset of a compound statement whose block is body. After a parse error the
  // block may be empty, in which case the header's last node stands in.
  static int endOfBlock(List<Statement> body, Node header) {
    return body.isEmpty() ? header.getEndOffset() : body.get(body.size() - 1).getEndOffset();
  }
}
