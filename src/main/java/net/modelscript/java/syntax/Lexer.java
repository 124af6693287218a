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
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Splits ModelScript source text into a list of tokens.
 *
 * <p>Line structure is made explicit: each logical line ends with a NEWLINE token, and changes of
 * indentation produce INDENT and OUTDENT tokens. Blank and comment-only lines produce nothing, nor
 * do line breaks inside brackets. The list always ends with NEWLINE (if the input had any tokens),
 * any pending OUTDENTs, and EOF.
 */
final class Lexer {

  /** A token, with its extent in the input and, for literals and identifiers, its value. */
  record Token(TokenKind kind, int start, int end, @Nullable Object value) {

    // Returns the token as it is quoted in parser error messages.
    String describe() {
      switch (kind) {
        case IDENTIFIER:
        case INT:
        case FLOAT:
          return "'" + value + "'";
        case STRING:
          return "string literal";
        default:
          return "'" + kind + "'";
      }
    }
  }

  private final FileLocations locs;
  private final char[] buf;
  private final List<SyntaxError> errors;
  private final List<Token> tokens = new ArrayList<>();
  private final List<Integer> indents = new ArrayList<>(); // indentation widths, outermost first
  private int pos;
  private int brackets; // depth of nesting within (), []

  private Lexer(FileLocations locs, char[] buf, List<SyntaxError> errors) {
    this.locs = locs;
    this.buf = buf;
    this.errors = errors;
    indents.add(0);
  }

  /** Returns the tokens of the input, appending any lexical errors to {@code errors}. */
  static ImmutableList<Token> tokenize(
      FileLocations locs, char[] buf, List<SyntaxError> errors) {
    Lexer lexer = new Lexer(locs, buf, errors);
    lexer.scan();
    return ImmutableList.copyOf(lexer.tokens);
  }

  private void error(int offset, String message) {
    errors.add(new SyntaxError(locs.getLocation(offset), message));
  }

  private void emit(TokenKind kind, int start, int end, @Nullable Object value) {
    tokens.add(new Token(kind, start, end, value));
  }

  private char peek(int ahead) {
    int i = pos + ahead;
    return i < buf.length ? buf[i] : 0;
  }

  private void scan() {
    boolean lineStart = true;
    while (pos < buf.length) {
      if (lineStart && brackets == 0) {
        lineStart = false;
        if (!indentation()) {
          lineStart = true; // blank line
          continue;
        }
      }
      char c = buf[pos];
      if (c == ' ' || c == '\t' || c == '\r') {
        pos++;
      } else if (c == '#') {
        skipComment();
      } else if (c == '\\' && peek(1) == '\n') {
        pos += 2; // explicit line joining
      } else if (c == '\\' && peek(1) == '\r' && peek(2) == '\n') {
        pos += 3;
      } else if (c == '\n') {
        if (brackets == 0) {
          emit(TokenKind.NEWLINE, pos, pos + 1, null);
          lineStart = true;
        }
        pos++;
      } else if (isIdentifierStart(c)) {
        word();
      } else if (isDigit(c) || (c == '.' && isDigit(peek(1)))) {
        number();
      } else if (c == '\'' || c == '"') {
        string(c);
      } else {
        symbol(c);
      }
    }
    endOfInput();
  }

  // Measures the indentation of the line at pos, emitting INDENT or OUTDENT tokens as needed.
  // Returns false, having consumed the line, if the line is blank or holds only a comment.
  private boolean indentation() {
    int start = pos;
    int width = 0;
    while (pos < buf.length && (buf[pos] == ' ' || buf[pos] == '\t')) {
      if (buf[pos] == '\t') {
        error(pos, "use spaces, not tabs, for indentation");
      }
      width++;
      pos++;
    }
    char c = peek(0);
    if (c == 0 || c == '\n' || c == '\r' || c == '#') {
      skipComment();
      if (pos < buf.length) {
        pos++; // newline
      }
      return false;
    }

    int current = indents.get(indents.size() - 1);
    if (width > current) {
      indents.add(width);
      emit(TokenKind.INDENT, start, pos, null);
    } else {
      while (width < indents.get(indents.size() - 1)) {
        indents.remove(indents.size() - 1);
        emit(TokenKind.OUTDENT, pos, pos, null);
      }
      if (width != indents.get(indents.size() - 1)) {
        error(pos, "unindent does not match any outer indentation level");
      }
    }
    return true;
  }

  // Skips to the end of the line, leaving pos at the newline.
  private void skipComment() {
    while (pos < buf.length && buf[pos] != '\n') {
      pos++;
    }
  }

  private void endOfInput() {
    if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).kind() != TokenKind.NEWLINE) {
      emit(TokenKind.NEWLINE, pos, pos, null);
    }
    for (int i = indents.size() - 1; i > 0; i--) {
      emit(TokenKind.OUTDENT, pos, pos, null);
    }
    emit(TokenKind.EOF, pos, pos, null);
  }

  private void word() {
    int start = pos;
    while (pos < buf.length && isIdentifierPart(buf[pos])) {
      pos++;
    }
    String word = new String(buf, start, pos - start);
    TokenKind keyword = TokenKind.keyword(word);
    if (keyword != null) {
      emit(keyword, start, pos, null);
    } else {
      emit(TokenKind.IDENTIFIER, start, pos, word);
    }
  }

  private void number() {
    int start = pos;
    boolean isFloat = false;
    while (isDigit(peek(0))) {
      pos++;
    }
    if (peek(0) == '.') {
      isFloat = true;
      pos++;
      while (isDigit(peek(0))) {
        pos++;
      }
    }
    char e = peek(0);
    if ((e == 'e' || e == 'E')
        && (isDigit(peek(1)) || ((peek(1) == '+' || peek(1) == '-') && isDigit(peek(2))))) {
      isFloat = true;
      pos += 2;
      while (isDigit(peek(0))) {
        pos++;
      }
    }
    String text = new String(buf, start, pos - start);
    if (isIdentifierPart(peek(0))) {
      while (isIdentifierPart(peek(0))) {
        pos++;
      }
      error(start, "invalid numeric literal: " + new String(buf, start, pos - start));
      emit(TokenKind.INT, start, pos, 0);
      return;
    }

    if (isFloat) {
      double value = Double.parseDouble(text);
      if (Double.isInfinite(value)) {
        error(start, "float literal out of range: " + text);
      }
      emit(TokenKind.FLOAT, start, pos, value);
      return;
    }
    int value = 0;
    if (text.length() > 1 && text.charAt(0) == '0') {
      error(start, "leading zeros are not allowed in integer literal " + text);
    } else {
      try {
        value = Integer.parseInt(text);
      } catch (NumberFormatException unused) {
        error(start, "integer literal out of range: " + text);
      }
    }
    emit(TokenKind.INT, start, pos, value);
  }

  // Scans a quoted string. Triple-quoted strings may span lines.
  private void string(char quote) {
    int start = pos;
    boolean triple = peek(1) == quote && peek(2) == quote;
    pos += triple ? 3 : 1;
    StringBuilder value = new StringBuilder();
    while (true) {
      if (pos >= buf.length || (!triple && buf[pos] == '\n')) {
        error(start, "unterminated string literal");
        emit(TokenKind.STRING, start, pos, value.toString());
        return;
      }
      char c = buf[pos];
      if (c == quote && (!triple || (peek(1) == quote && peek(2) == quote))) {
        pos += triple ? 3 : 1;
        emit(TokenKind.STRING, start, pos, value.toString());
        return;
      }
      if (c != '\\') {
        value.append(c);
        pos++;
        continue;
      }
      char next = peek(1);
      pos += 2;
      switch (next) {
        case 'n':
          value.append('\n');
          break;
        case 't':
          value.append('\t');
          break;
        case 'r':
          value.append('\r');
          break;
        case '\\':
        case '\'':
        case '"':
          value.append(next);
          break;
        case '\n':
          break; // the backslash joins the lines
        default:
          if (next == 0) {
            pos--; // reported as unterminated
          } else {
            error(pos - 2, "invalid escape sequence: \\" + next);
          }
      }
    }
  }

  private void symbol(char c) {
    int start = pos;
    if (c == '(' || c == '[') {
      brackets++;
    } else if ((c == ')' || c == ']') && brackets > 0) {
      brackets--;
    }
    for (int len = 3; len > 0; len--) {
      if (start + len <= buf.length) {
        TokenKind kind = TokenKind.symbol(new String(buf, start, len));
        if (kind != null) {
          pos += len;
          emit(kind, start, pos, null);
          return;
        }
      }
    }
    error(start, String.format("invalid character: '%c'", c));
    pos++;
    emit(TokenKind.ILLEGAL, start, pos, null);
  }

  private static boolean isDigit(char c) {
    return '0' <= c && c <= '9';
  }

  private static boolean isIdentifierStart(char c) {
    return ('a' <= c && c <= 'z') || ('A' <= c && c <= 'Z') || c == '_';
  }

  private static boolean isIdentifierPart(char c) {
    return isIdentifierStart(c) || isDigit(c);
  }
}
