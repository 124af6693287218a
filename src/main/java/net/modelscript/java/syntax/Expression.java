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

/**
 * An expression node.
 *
 * <p>Assignment targets ({@code x = ...}, {@code for x in ...}) are identifiers, index and dot
 * expressions, and lists or tuples of targets.
 */
public abstract class Expression extends Node {

  /** The concrete class of an expression, for use in switch statements. */
  public enum Kind {
    BINARY_OPERATOR,
    CALL,
    DOT,
    IDENTIFIER,
    INDEX,
    LIST,
    LITERAL,
    UNARY_OPERATOR,
    YIELD,
  }

  private final Kind kind;

  Expression(FileLocations locs, Kind kind) {
    super(locs);
    this.kind = kind;
  }

  public final Kind kind() {
    return kind;
  }

  /** Parses the input as a single expression, or a tuple of expressions. */
  public static Expression parse(ParserInput input) throws SyntaxError.Exception {
    return Parser.parseExpression(input);
  }
}
