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
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import net.modelscript.java.syntax.Lexer.Token;

/**
 * A recursive-descent parser for ModelScript.
 *
 * <p>The grammar, informally:
 *
 * <pre>
 * file       = (NEWLINE | stmt)* EOF
 * stmt       = def | if | for | simple NEWLINE
 * def        = ('@' test NEWLINE)* 'def' IDENTIFIER '(' params? ')' ':' suite
 * if         = ('if' | 'elif') test ':' suite (if | 'else' ':' suite)?
 * for        = 'for' targets 'in' exprs ':' suite
 * suite      = simple NEWLINE | NEWLINE INDENT stmt+ OUTDENT
 * simple     = 'return' exprs? | 'pass' | 'break' | 'continue' | yield
 *            | exprs (('=' (yield | exprs)) | (augop exprs) | (':' test '=' (yield | exprs)))?
 * yield      = 'yield' 'from'? test
 * exprs      = test (',' test)*
 * test       = binary operations, unary '-' '+' 'not', and postfix calls, '.' and '[...]'
 * </pre>
 *
 * Errors do not stop the parse: after the first error in a statement, the rest of the statement
 * (including any indented block it introduces) is skipped.
 */
final class Parser {

  /** The statements of a file, with the errors found scanning and parsing it. */
  static final class ParseResult {
    final FileLocations locs;
    final ImmutableList<Statement> statements;
    final List<SyntaxError> errors;

    private ParseResult(
        FileLocations locs, ImmutableList<Statement> statements, List<SyntaxError> errors) {
      this.locs = locs;
      this.statements = statements;
      this.errors = errors;
    }
  }

  // Words that are keywords in Python but mean nothing in ModelScript.
  private static final ImmutableMap<String, String> RESERVED =
      ImmutableMap.<String, String>builder()
          .put("while", "'while' not supported, use 'for' instead")
          .put("import", "'import' not supported, models are self-contained files")
          .put("lambda", "'lambda' not supported, use 'def' instead")
          .put("class", "'class' not supported")
          .put("as", "'as' is a reserved word")
          .put("assert", "'assert' is a reserved word")
          .put("async", "'async' is a reserved word")
          .put("await", "'await' is a reserved word")
          .put("del", "'del' is a reserved word")
          .put("except", "'except' is a reserved word")
          .put("finally", "'finally' is a reserved word")
          .put("global", "'global' is a reserved word")
          .put("is", "'is' is a reserved word")
          .put("nonlocal", "'nonlocal' is a reserved word")
          .put("raise", "'raise' is a reserved word")
          .put("try", "'try' is a reserved word")
          .put("with", "'with' is a reserved word")
          .buildOrThrow();

  private static final String MISPLACED_YIELD =
      "'yield' may appear only as the right-hand side of an assignment or as a statement";

  // Thrown after an error is recorded, to abandon the current statement.
  private static final class Abandon extends RuntimeException {
    Abandon() {
      super(null, null, false, false);
    }
  }

  private final FileLocations locs;
  private final ImmutableList<Token> tokens;
  private final List<SyntaxError> errors;
  private int next; // index of the current token

  private Parser(FileLocations locs, ImmutableList<Token> tokens, List<SyntaxError> errors) {
    this.locs = locs;
    this.tokens = tokens;
    this.errors = errors;
  }

  private static Parser create(ParserInput input, List<SyntaxError> errors) {
    FileLocations locs = FileLocations.create(input);
    return new Parser(locs, Lexer.tokenize(locs, input.getContent(), errors), errors);
  }

  static ParseResult parseFile(ParserInput input) {
    List<SyntaxError> errors = new ArrayList<>();
    Parser parser = create(input, errors);
    ImmutableList.Builder<Statement> stmts = ImmutableList.builder();
    while (parser.kind() != TokenKind.EOF) {
      if (!parser.accept(TokenKind.NEWLINE)) {
        parser.statementOrSkip(stmts);
      }
    }
    return new ParseResult(parser.locs, stmts.build(), errors);
  }

  static Expression parseExpression(ParserInput input) throws SyntaxError.Exception {
    List<SyntaxError> errors = new ArrayList<>();
    Parser parser = create(input, errors);
    Expression result = null;
    try {
      result = parser.exprs();
      parser.accept(TokenKind.NEWLINE);
      parser.expect(TokenKind.EOF);
    } catch (Abandon unused) {
      // recorded in errors
    }
    if (!errors.isEmpty()) {
      throw new SyntaxError.Exception(errors);
    }
    return result;
  }

  // ---- token access ----

  private Token tok() {
    return tokens.get(next);
  }

  private TokenKind kind() {
    return tokens.get(next).kind();
  }

  private TokenKind peekKind(int ahead) {
    return tokens.get(Math.min(next + ahead, tokens.size() - 1)).kind();
  }

  private Token advance() {
    Token t = tokens.get(next);
    if (t.kind() != TokenKind.EOF) {
      next++;
    }
    return t;
  }

  private boolean accept(TokenKind kind) {
    if (kind() == kind) {
      advance();
      return true;
    }
    return false;
  }

  private Token expect(TokenKind kind) {
    if (kind() != kind) {
      throw fail(tok(), String.format("syntax error at %s: expected '%s'", tok().describe(), kind));
    }
    return advance();
  }

  private void error(Token at, String message) {
    // The lexer has already complained about an illegal character.
    if (at.kind() != TokenKind.ILLEGAL) {
      errors.add(new SyntaxError(locs.getLocation(at.start()), message));
    }
  }

  private Abandon fail(Token at, String message) {
    error(at, message);
    return new Abandon();
  }

  // Skips the rest of a statement in which an error was found, including any block it opens.
  private void skipStatement() {
    if (kind() == TokenKind.OUTDENT) {
      return; // the end of the enclosing block
    }
    int depth = 0;
    while (kind() != TokenKind.EOF) {
      Token t = advance();
      if (t.kind() == TokenKind.INDENT) {
        depth++;
      } else if (t.kind() == TokenKind.OUTDENT) {
        if (--depth <= 0) {
          return;
        }
      } else if (t.kind() == TokenKind.NEWLINE && depth == 0 && kind() != TokenKind.INDENT) {
        return;
      }
    }
  }

  // ---- statements ----

  private void statementOrSkip(ImmutableList.Builder<Statement> out) {
    if (kind() == TokenKind.OUTDENT) {
      // An unmatched dedent; the lexer has reported it.
      advance();
      return;
    }
    try {
      out.add(statement());
    } catch (Abandon unused) {
      skipStatement();
    }
  }

  private Statement statement() {
    switch (kind()) {
      case AT:
      case DEF:
        return def();
      case IF:
        return ifStatement();
      case FOR:
        return forStatement();
      case INDENT:
        throw fail(tok(), "unexpected indentation");
      default:
        Statement stmt = simple();
        expectEndOfLine();
        return stmt;
    }
  }

  private void expectEndOfLine() {
    if (kind() != TokenKind.NEWLINE) {
      throw fail(tok(), String.format("syntax error at %s: expected newline", tok().describe()));
    }
    advance();
  }

  private DefStatement def() {
    int start = tok().start();
    ImmutableList.Builder<Expression> decorators = ImmutableList.builder();
    while (accept(TokenKind.AT)) {
      decorators.add(test());
      expectEndOfLine();
    }
    if (kind() != TokenKind.DEF) {
      throw fail(tok(), "expected 'def' after decorator");
    }
    int defOffset = advance().start();
    Identifier name = identifier();
    expect(TokenKind.LPAREN);
    ImmutableList<Parameter> params = parameters();
    expect(TokenKind.RPAREN);
    if (kind() == TokenKind.ARROW) {
      throw fail(tok(), "return type annotations are not supported");
    }
    expect(TokenKind.COLON);
    return new DefStatement(
        locs, start, decorators.build(), defOffset, name, params, suite());
  }

  private ImmutableList<Parameter> parameters() {
    ImmutableList.Builder<Parameter> params = ImmutableList.builder();
    while (kind() != TokenKind.RPAREN) {
      if (kind() == TokenKind.STAR || kind() == TokenKind.STAR_STAR) {
        throw fail(tok(), "variadic parameters are not supported");
      }
      Identifier id = identifier();
      Expression dflt = accept(TokenKind.ASSIGN) ? test() : null;
      params.add(new Parameter(locs, id, dflt));
      if (!accept(TokenKind.COMMA)) {
        break;
      }
    }
    return params.build();
  }

  private IfStatement ifStatement() {
    Token keyword = advance(); // 'if' or 'elif'
    Expression cond = test();
    expect(TokenKind.COLON);
    ImmutableList<Statement> thenBlock = suite();
    ImmutableList<Statement> elseBlock = null;
    if (kind() == TokenKind.ELIF) {
      elseBlock = ImmutableList.of(ifStatement());
    } else if (accept(TokenKind.ELSE)) {
      expect(TokenKind.COLON);
      elseBlock = suite();
    }
    return new IfStatement(
        locs, keyword.kind() == TokenKind.ELIF, keyword.start(), cond, thenBlock, elseBlock);
  }

  private ForStatement forStatement() {
    int start = advance().start();
    Expression vars = targets();
    expect(TokenKind.IN);
    Expression collection = exprs();
    expect(TokenKind.COLON);
    return new ForStatement(locs, start, vars, collection, suite());
  }

  // Loop variables, which unlike other expressions cannot contain a bare 'in'.
  private Expression targets() {
    Expression first = postfix(primary());
    if (kind() != TokenKind.COMMA) {
      return first;
    }
    ImmutableList.Builder<Expression> elems = ImmutableList.builder();
    elems.add(first);
    while (accept(TokenKind.COMMA) && kind() != TokenKind.IN) {
      elems.add(postfix(primary()));
    }
    return new ListExpression(locs, /* isTuple= */ true, -1, elems.build(), -1);
  }

  // The block following a ':'. A suite that does not begin on a new line is a single simple
  // statement.
  private ImmutableList<Statement> suite() {
    if (!accept(TokenKind.NEWLINE)) {
      Statement stmt = simple();
      expectEndOfLine();
      return ImmutableList.of(stmt);
    }
    if (!accept(TokenKind.INDENT)) {
      error(tok(), "expected an indented block");
      return ImmutableList.of();
    }
    ImmutableList.Builder<Statement> block = ImmutableList.builder();
    while (kind() != TokenKind.OUTDENT && kind() != TokenKind.EOF) {
      if (!accept(TokenKind.NEWLINE)) {
        statementOrSkip(block);
      }
    }
    accept(TokenKind.OUTDENT);
    return block.build();
  }

  private Statement simple() {
    Token first = tok();
    switch (first.kind()) {
      case RETURN:
        advance();
        if (kind() == TokenKind.NEWLINE) {
          return new ReturnStatement(locs, first.start(), null);
        }
        if (kind() == TokenKind.YIELD) {
          throw fail(tok(), MISPLACED_YIELD);
        }
        return new ReturnStatement(locs, first.start(), exprs());
      case PASS:
        advance();
        return new FlowStatement(locs, FlowStatement.Jump.PASS, first.start());
      case BREAK:
        advance();
        return new FlowStatement(locs, FlowStatement.Jump.BREAK, first.start());
      case CONTINUE:
        advance();
        return new FlowStatement(locs, FlowStatement.Jump.CONTINUE, first.start());
      case YIELD:
        return new ExpressionStatement(locs, this.yield());
      default:
        break;
    }

    Expression lhs = exprs();
    Token op = tok();
    if (accept(TokenKind.ASSIGN)) {
      return AssignmentStatement.plain(locs, lhs, op.start(), rightHandSide());
    }
    if (op.kind().isAugmentedAssign()) {
      advance();
      if (kind() == TokenKind.YIELD) {
        throw fail(tok(), MISPLACED_YIELD);
      }
      return AssignmentStatement.augmented(
          locs, lhs, Operator.augmented(op.kind()), op.start(), exprs());
    }
    if (op.kind() == TokenKind.COLON) {
      if (lhs.kind() != Expression.Kind.IDENTIFIER) {
        throw fail(op, "only a simple name may carry a type annotation");
      }
      advance();
      Expression annotation = test();
      if (kind() != TokenKind.ASSIGN) {
        throw fail(tok(), "an annotated name must be assigned a value");
      }
      int eq = advance().start();
      return AssignmentStatement.annotated(
          locs, (Identifier) lhs, annotation, eq, rightHandSide());
    }
    return new ExpressionStatement(locs, lhs);
  }

  private Expression rightHandSide() {
    return kind() == TokenKind.YIELD ? this.yield() : exprs();
  }

  private YieldExpression yield() {
    int start = advance().start();
    boolean delegating = accept(TokenKind.FROM);
    if (kind() == TokenKind.NEWLINE) {
      String near = tok().describe();
      throw fail(tok(), String.format("syntax error at %s: 'yield' requires an operand", near));
    }
    return new YieldExpression(locs, start, delegating, test());
  }

  // ---- expressions ----

  // One or more comma-separated expressions; more than one forms a tuple.
  private Expression exprs() {
    Expression first = test();
    if (kind() != TokenKind.COMMA) {
      return first;
    }
    ImmutableList.Builder<Expression> elems = ImmutableList.builder();
    elems.add(first);
    while (accept(TokenKind.COMMA)) {
      elems.add(test());
    }
    return new ListExpression(locs, /* isTuple= */ true, -1, elems.build(), -1);
  }

  private Expression test() {
    return binary(1);
  }

  // Parses operations whose operators have at least the given precedence.
  private Expression binary(int minPrecedence) {
    Expression x = prefix();
    boolean compared = false;
    while (true) {
      Token opToken = tok();
      Operator op = Operator.binary(opToken.kind());
      int width = 1;
      if (opToken.kind() == TokenKind.NOT && peekKind(1) == TokenKind.IN) {
        op = Operator.NOT_IN;
        width = 2;
      }
      if (op == null || op.precedence() < minPrecedence) {
        return x;
      }
      if (op.isComparison()) {
        if (compared) {
          throw fail(
              opToken, String.format("comparison '%s' cannot follow another comparison", op));
        }
        compared = true;
      }
      for (int i = 0; i < width; i++) {
        advance();
      }
      // '**' groups to the right; everything else to the left.
      Expression y = binary(op == Operator.POW ? op.precedence() : op.precedence() + 1);
      x = new BinaryOperatorExpression(locs, x, op, opToken.start(), y);
    }
  }

  private Expression prefix() {
    Token t = tok();
    switch (t.kind()) {
      case NOT:
        advance();
        return new UnaryOperatorExpression(
            locs, Operator.NOT, t.start(), binary(Operator.PREFIX_NOT));
      case MINUS:
        advance();
        return new UnaryOperatorExpression(
            locs, Operator.MINUS, t.start(), binary(Operator.PREFIX_ARITHMETIC));
      case PLUS:
        advance();
        return new UnaryOperatorExpression(
            locs, Operator.PLUS, t.start(), binary(Operator.PREFIX_ARITHMETIC));
      default:
        return postfix(primary());
    }
  }

  private Expression postfix(Expression x) {
    while (true) {
      switch (kind()) {
        case LPAREN:
          {
            int lparen = advance().start();
            ImmutableList<Argument> args = arguments();
            int rparen = expect(TokenKind.RPAREN).start();
            x = new CallExpression(locs, x, lparen, args, rparen);
            break;
          }
        case DOT:
          {
            int dot = advance().start();
            x = new DotExpression(locs, x, dot, identifier());
            break;
          }
        case LBRACKET:
          {
            int lbracket = advance().start();
            Expression key = test();
            if (kind() == TokenKind.COLON) {
              throw fail(tok(), "slices are not supported");
            }
            int rbracket = expect(TokenKind.RBRACKET).start();
            x = new IndexExpression(locs, x, lbracket, key, rbracket);
            break;
          }
        default:
          return x;
      }
    }
  }

  private ImmutableList<Argument> arguments() {
    ImmutableList.Builder<Argument> args = ImmutableList.builder();
    while (kind() != TokenKind.RPAREN) {
      if (kind() == TokenKind.STAR || kind() == TokenKind.STAR_STAR) {
        throw fail(tok(), "variadic arguments are not supported");
      }
      Identifier keyword = null;
      if (kind() == TokenKind.IDENTIFIER && peekKind(1) == TokenKind.ASSIGN) {
        keyword = identifier();
        advance();
      }
      args.add(new Argument(locs, keyword, test()));
      rejectComprehension();
      if (!accept(TokenKind.COMMA)) {
        break;
      }
    }
    return args.build();
  }

  private void rejectComprehension() {
    if (kind() == TokenKind.FOR) {
      throw fail(tok(), "comprehensions are not supported");
    }
  }

  private Expression primary() {
    Token t = tok();
    switch (t.kind()) {
      case INT:
      case FLOAT:
        advance();
        return literal(t);
      case STRING:
        advance();
        if (kind() == TokenKind.STRING) {
          throw fail(tok(), "adjacent string literals are not concatenated, use the + operator");
        }
        return literal(t);
      case IDENTIFIER:
        return identifier();
      case LPAREN:
        return parenthesized();
      case LBRACKET:
        return list();
      case YIELD:
        throw fail(t, MISPLACED_YIELD);
      default:
        throw fail(t, String.format("syntax error at %s: expected expression", t.describe()));
    }
  }

  private Literal literal(Token t) {
    return new Literal(locs, t.start(), locs.getText(t.start(), t.end()), t.value());
  }

  private Identifier identifier() {
    Token t = tok();
    if (t.kind() != TokenKind.IDENTIFIER) {
      throw fail(t, String.format("syntax error at %s: expected identifier", t.describe()));
    }
    String name = (String) t.value();
    String reserved = RESERVED.get(name);
    if (reserved != null) {
      throw fail(t, reserved);
    }
    advance();
    return new Identifier(locs, name, t.start());
  }

  // '(' ')' | '(' test ')' | '(' test ',' [test (',' test)* ','?] ')'
  private Expression parenthesized() {
    int lparen = advance().start();
    if (kind() == TokenKind.RPAREN) {
      int rparen = advance().start();
      return new ListExpression(locs, /* isTuple= */ true, lparen, ImmutableList.of(), rparen);
    }
    Expression first = test();
    rejectComprehension();
    if (kind() != TokenKind.COMMA) {
      expect(TokenKind.RPAREN);
      return first;
    }
    ImmutableList.Builder<Expression> elems = ImmutableList.builder();
    elems.add(first);
    while (accept(TokenKind.COMMA) && kind() != TokenKind.RPAREN) {
      elems.add(test());
    }
    int rparen = expect(TokenKind.RPAREN).start();
    return new ListExpression(locs, /* isTuple= */ true, lparen, elems.build(), rparen);
  }

  // '[' (test (',' test)* ','?)? ']'
  private Expression list() {
    int lbracket = advance().start();
    ImmutableList.Builder<Expression> elems = ImmutableList.builder();
    while (kind() != TokenKind.RBRACKET) {
      elems.add(test());
      rejectComprehension();
      if (!accept(TokenKind.COMMA)) {
        break;
      }
    }
    int rbracket = expect(TokenKind.RBRACKET).start();
    return new ListExpression(locs, /* isTuple= */ false, lbracket, elems.build(), rbracket);
  }
}
