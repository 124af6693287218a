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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.base.Joiner;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of the {@link Lexer}. */
@RunWith(JUnit4.class)
public class LexerTest {

  private final List<SyntaxError> errors = new ArrayList<>();
  private FileLocations locs;

  private List<Lexer.Token> tokenize(ParserInput input) {
    errors.clear();
    locs = FileLocations.create(input);
    return Lexer.tokenize(locs, input.getContent(), errors);
  }

  // Returns the kinds of the tokens of src, each followed by its value, if any.
  private String tokens(String src) {
    List<String> words = new ArrayList<>();
    for (Lexer.Token tok : tokenize(ParserInput.fromString(src, "x.ms"))) {
      String word = tok.kind().name();
      words.add(tok.value() == null ? word : word + "(" + tok.value() + ")");
    }
    return Joiner.on(' ').join(words);
  }

  // Returns each error as "line:column: message".
  private List<String> errorStrings() {
    List<String> result = new ArrayList<>();
    for (SyntaxError e : errors) {
      result.add(e.location().line() + ":" + e.location().column() + ": " + e.message());
    }
    return result;
  }

  private void check(String src, String want) {
    assertThat(tokens(src)).isEqualTo(want);
    assertThat(errors).isEmpty();
  }

  @Test
  public void testOperatorsAndPunctuation() {
    check("a = 1", "IDENTIFIER(a) ASSIGN INT(1) NEWLINE EOF");
    check("x += 2.5", "IDENTIFIER(x) PLUS_ASSIGN FLOAT(2.5) NEWLINE EOF");
    check("x //= 2", "IDENTIFIER(x) SLASH_SLASH_ASSIGN INT(2) NEWLINE EOF");
    check("a.b[0]", "IDENTIFIER(a) DOT IDENTIFIER(b) LBRACKET INT(0) RBRACKET NEWLINE EOF");
    check("x // y ** 2", "IDENTIFIER(x) SLASH_SLASH IDENTIFIER(y) STAR_STAR INT(2) NEWLINE EOF");
    check("a != b <= c", "IDENTIFIER(a) NE IDENTIFIER(b) LE IDENTIFIER(c) NEWLINE EOF");
  }

  @Test
  public void testKeywords() {
    check("yield from g", "YIELD FROM IDENTIFIER(g) NEWLINE EOF");
    check("not a in b", "NOT IDENTIFIER(a) IN IDENTIFIER(b) NEWLINE EOF");
    check("@model", "AT IDENTIFIER(model) NEWLINE EOF");
    // Reserved words are rejected by the parser, not here.
    check("lambda", "IDENTIFIER(lambda) NEWLINE EOF");
  }

  @Test
  public void testNumbers() {
    check(
        "0 12 1.5 .5 1e3 2E-2",
        "INT(0) INT(12) FLOAT(1.5) FLOAT(0.5) FLOAT(1000.0) FLOAT(0.02) NEWLINE EOF");

    assertThat(tokens("0123")).isEqualTo("INT(0) NEWLINE EOF");
    assertThat(errorStrings())
        .containsExactly("1:1: leading zeros are not allowed in integer literal 0123");

    assertThat(tokens("99999999999")).isEqualTo("INT(0) NEWLINE EOF");
    assertThat(errorStrings()).containsExactly("1:1: integer literal out of range: 99999999999");

    tokens("x = 12abc");
    assertThat(errorStrings()).containsExactly("1:5: invalid numeric literal: 12abc");
  }

  @Test
  public void testStrings() {
    check("'abc' \"def\"", "STRING(abc) STRING(def) NEWLINE EOF");
    check("'a\\tb'", "STRING(a\tb) NEWLINE EOF");
    check("'it\\'s'", "STRING(it's) NEWLINE EOF");
    check("\"\"\"a\nb\"\"\"", "STRING(a\nb) NEWLINE EOF");

    assertThat(tokens("x = 'abc")).isEqualTo("IDENTIFIER(x) ASSIGN STRING(abc) NEWLINE EOF");
    assertThat(errorStrings()).containsExactly("1:5: unterminated string literal");

    tokens("'\\d'");
    assertThat(errorStrings()).containsExactly("1:2: invalid escape sequence: \\d");
  }

  @Test
  public void testIndentation() {
    check(
        "def f():\n  return 1\n",
        "DEF IDENTIFIER(f) LPAREN RPAREN COLON NEWLINE INDENT RETURN INT(1) NEWLINE OUTDENT EOF");
    check(
        "if a:\n  if b:\n    c\nd",
        "IF IDENTIFIER(a) COLON NEWLINE INDENT IF IDENTIFIER(b) COLON NEWLINE INDENT IDENTIFIER(c)"
            + " NEWLINE OUTDENT OUTDENT IDENTIFIER(d) NEWLINE EOF");
  }

  @Test
  public void testBadIndentation() {
    assertThat(tokens("if a:\n    b\n  c"))
        .isEqualTo(
            "IF IDENTIFIER(a) COLON NEWLINE INDENT IDENTIFIER(b) NEWLINE OUTDENT IDENTIFIER(c)"
                + " NEWLINE EOF");
    assertThat(errorStrings())
        .containsExactly("3:3: unindent does not match any outer indentation level");

    tokens("if a:\n\tb");
    assertThat(errorStrings()).containsExactly("2:1: use spaces, not tabs, for indentation");
  }

  @Test
  public void testLineBreaksInsideBracketsAreIgnored() {
    check("f(1,\n  2)", "IDENTIFIER(f) LPAREN INT(1) COMMA INT(2) RPAREN NEWLINE EOF");
    check("[a,\n b]", "LBRACKET IDENTIFIER(a) COMMA IDENTIFIER(b) RBRACKET NEWLINE EOF");
  }

  @Test
  public void testBackslashJoinsLines() {
    check("x = 1 + \\\n  2", "IDENTIFIER(x) ASSIGN INT(1) PLUS INT(2) NEWLINE EOF");
  }

  @Test
  public void testCommentsAndBlankLines() {
    check(
        "a # comment\n\n  # indented comment\nb",
        "IDENTIFIER(a) NEWLINE IDENTIFIER(b) NEWLINE EOF");
    check("# only a comment\n", "EOF");
  }

  @Test
  public void testInvalidCharacter() {
    assertThat(tokens("x $ y")).isEqualTo("IDENTIFIER(x) ILLEGAL IDENTIFIER(y) NEWLINE EOF");
    assertThat(errorStrings()).containsExactly("1:3: invalid character: '$'");
  }

  @Test
  public void testLineNumbers() {
    List<String> lines = new ArrayList<>();
    for (Lexer.Token tok : tokenize(ParserInput.fromString("foo = 1\nbar = 2\n\nwiz = 3", ""))) {
      lines.add(String.valueOf(locs.getLocation(tok.start()).line()));
    }
    assertThat(Joiner.on(' ').join(lines)).isEqualTo("1 1 1 1 2 2 2 2 4 4 4 4 4");
  }

  @Test
  public void testLineOffset() {
    List<Lexer.Token> toks = tokenize(ParserInput.fromString("a\nb", "f.ms").withLineOffset(10));
    assertThat(locs.getLocation(toks.get(2).start()).toString()).isEqualTo("f.ms:12:1");
  }
}
