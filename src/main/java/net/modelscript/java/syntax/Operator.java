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

import javax.annotation.Nullable;

/**
 * The operators of ModelScript expressions and augmented assignments.
 *
 * <p>Binary operators carry a precedence; higher binds tighter. All binary operators are
 * left-associative except {@code **}. {@code not} is unary only; {@code +} and {@code -} are both.
 */
public enum Operator {
  OR("or", 1),
  AND("and", 2),
  NOT("not", 0),
  EQ("==", 4),
  NE("!=", 4),
  LT("<", 4),
  LE("<=", 4),
  GT(">", 4),
  GE(">=", 4),
  IN("in", 4),
  NOT_IN("not in", 4),
  PLUS("+", 5),
  MINUS("-", 5),
  STAR("*", 6),
  SLASH("/", 6),
  SLASH_SLASH("//", 6),
  PERCENT("%", 6),
  POW("**", 8);

  // Precedence of the unary '+', '-' and 'not' prefixes, relative to the binary levels above.
  static final int PREFIX_ARITHMETIC = 7;
  static final int PREFIX_NOT = 3;

  private final String symbol;
  private final int precedence;

  Operator(String symbol, int precedence) {
    this.symbol = symbol;
    this.precedence = precedence;
  }

  /** Returns the precedence of the binary form, or zero if the operator is not binary. */
  public int precedence() {
    return precedence;
  }

  public boolean isComparison() {
    return precedence == 4;
  }

  /** Returns the binary operator denoted by a token, or null. */
  @Nullable
  static Operator binary(TokenKind kind) {
    switch (kind) {
      case OR:
        return OR;
      case AND:
        return AND;
      case EQ:
        return EQ;
      case NE:
        return NE;
      case LT:
        return LT;
      case LE:
        return LE;
      case GT:
        return GT;
      case GE:
        return GE;
      case IN:
        return IN;
      case PLUS:
        return PLUS;
      case MINUS:
        return MINUS;
      case STAR:
        return STAR;
      case SLASH:
        return SLASH;
      case SLASH_SLASH:
        return SLASH_SLASH;
      case PERCENT:
        return PERCENT;
      case STAR_STAR:
        return POW;
      default:
        return null;
    }
  }

  /** Returns the operator applied by an augmented assignment token such as {@code +=}. */
  static Operator augmented(TokenKind kind) {
    switch (kind) {
      case PLUS_ASSIGN:
        return PLUS;
      case MINUS_ASSIGN:
        return MINUS;
      case STAR_ASSIGN:
        return STAR;
      case SLASH_ASSIGN:
        return SLASH;
      case SLASH_SLASH_ASSIGN:
        return SLASH_SLASH;
      case PERCENT_ASSIGN:
        return PERCENT;
      default:
        throw new IllegalArgumentException("not an augmented assignment: " + kind);
    }
  }

  @Override
  public String toString() {
    return symbol;
  }
}
