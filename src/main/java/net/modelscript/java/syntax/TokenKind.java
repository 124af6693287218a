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

import com.google.common.collect.ImmutableMap;
import javax.annotation.Nullable;

/** The kinds of token produced by the {@link Lexer}. */
public enum TokenKind {
  // Tokens that carry a value.
  IDENTIFIER("identifier", Group.VALUE),
  INT("integer literal", Group.VALUE),
  FLOAT("float literal", Group.VALUE),
  STRING("string literal", Group.VALUE),

  // Line structure.
  NEWLINE("newline", Group.LAYOUT),
  INDENT("indent", Group.LAYOUT),
  OUTDENT("outdent", Group.LAYOUT),
  EOF("end of file", Group.LAYOUT),

  LPAREN("(", Group.SYMBOL),
  RPAREN(")", Group.SYMBOL),
  LBRACKET("[", Group.SYMBOL),
  RBRACKET("]", Group.SYMBOL),
  COMMA(",", Group.SYMBOL),
  COLON(":", Group.SYMBOL),
  DOT(".", Group.SYMBOL),
  AT("@", Group.SYMBOL),
  ASSIGN("=", Group.SYMBOL),
  PLUS("+", Group.SYMBOL),
  MINUS("-", Group.SYMBOL),
  STAR("*", Group.SYMBOL),
  STAR_STAR("**", Group.SYMBOL),
  SLASH("/", Group.SYMBOL),
  SLASH_SLASH("//", Group.SYMBOL),
  PERCENT("%", Group.SYMBOL),
  EQ("==", Group.SYMBOL),
  NE("!=", Group.SYMBOL),
  LT("<", Group.SYMBOL),
  LE("<=", Group.SYMBOL),
  GT(">", Group.SYMBOL),
  GE(">=", Group.SYMBOL),
  ARROW("->", Group.SYMBOL),
  // Augmented assignment; the operator is the text minus its final '='.
  PLUS_ASSIGN("+=", Group.SYMBOL),
  MINUS_ASSIGN("-=", Group.SYMBOL),
  STAR_ASSIGN("*=", Group.SYMBOL),
  SLASH_ASSIGN("/=", Group.SYMBOL),
  SLASH_SLASH_ASSIGN("//=", Group.SYMBOL),
  PERCENT_ASSIGN("%=", Group.SYMBOL),

  AND("and", Group.KEYWORD),
  BREAK("break", Group.KEYWORD),
  CONTINUE("continue", Group.KEYWORD),
  DEF("def", Group.KEYWORD),
  ELIF("elif", Group.KEYWORD),
  ELSE("else", Group.KEYWORD),
  FOR("for", Group.KEYWORD),
  FROM("from", Group.KEYWORD),
  IF("if", Group.KEYWORD),
  IN("in", Group.KEYWORD),
  NOT("not", Group.KEYWORD),
  OR("or", Group.KEYWORD),
  PASS("pass", Group.KEYWORD),
  RETURN("return", Group.KEYWORD),
  YIELD("yield", Group.KEYWORD),

  // A character that begins no token; the lexer has reported it.
  ILLEGAL("illegal character", Group.LAYOUT);

  enum Group {
    VALUE,
    LAYOUT,
    SYMBOL,
    KEYWORD
  }

  private static final ImmutableMap<String, TokenKind> BY_TEXT;

  static {
    ImmutableMap.Builder<String, TokenKind> b = ImmutableMap.builder();
    for (TokenKind kind : values()) {
      if (kind.group == Group.SYMBOL || kind.group == Group.KEYWORD) {
        b.put(kind.text, kind);
      }
    }
    BY_TEXT = b.buildOrThrow();
  }

  private final String text;
  private final Group group;

  TokenKind(String text, Group group) {
    this.text = text;
    this.group = group;
  }

  Group group() {
    return group;
  }

  /** Returns the keyword spelled {@code word}, or null if it is not a keyword. */
  @Nullable
  static TokenKind keyword(String word) {
    TokenKind kind = BY_TEXT.get(word);
    return kind != null && kind.group == Group.KEYWORD ? kind : null;
  }

  /** Returns the symbol spelled {@code text}, or null if there is none. */
  @Nullable
  static TokenKind symbol(String text) {
    TokenKind kind = BY_TEXT.get(text);
    return kind != null && kind.group == Group.SYMBOL ? kind : null;
  }

  /** Reports whether this is an augmented assignment symbol such as {@code +=}. */
  boolean isAugmentedAssign() {
    return name().endsWith("_ASSIGN");
  }

  /** Returns the source spelling of a symbol or keyword, or a description of other tokens. */
  @Override
  public String toString() {
    return text;
  }
}
