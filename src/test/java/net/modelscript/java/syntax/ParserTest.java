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
import static org.junit.Assert.assertThrows;

import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of parser behavior. */
@RunWith(JUnit4.class)
public final class ParserTest {

  private static Expression parseExpression(String... lines) throws SyntaxError.Exception {
    return Expression.parse(ParserInput.fromLines(lines));
  }

  private static List<Statement> parseStatements(String... lines) {
    ModelFile file = ModelFile.parse(ParserInput.fromLines(lines));
    assertThat(file.errors()).isEmpty();
    return file.getStatements();
  }

  private static Statement parseStatement(String... lines) {
    List<Statement> stmts = parseStatements(lines);
    assertThat(stmts).hasSize(1);
    return stmts.get(0);
  }

  // Parses the file and returns the message of its first error.
  private static String firstError(String... lines) {
    ModelFile file = ModelFile.parse(ParserInput.fromLines(lines));
    assertThat(file.ok()).isFalse();
    return file.errors().get(0).message();
  }

  @Test
  public void testPrecedenceIsMadeExplicit() throws Exception {
    assertThat(parseExpression("1 + 2 * 3").toString()).isEqualTo("1 + (2 * 3)");
    assertThat(parseExpression("(1 + 2) * 3").toString()).isEqualTo("(1 + 2) * 3");
    assertThat(parseExpression("not a or b").toString()).isEqualTo("(not a) or b");
    assertThat(parseExpression("-x ** 2").toString()).isEqualTo("-(x ** 2)");
  }

  @Test
  public void testExpressions() throws Exception {
    assertThat(parseExpression("f(x, y=1)").toString()).isEqualTo("f(x, y=1)");
    assertThat(parseExpression("a.b.c(d)[0]").toString()).isEqualTo("a.b.c(d)[0]");
    assertThat(parseExpression("(1,)").toString()).isEqualTo("(1,)");
    assertThat(parseExpression("()").toString()).isEqualTo("()");
    assertThat(parseExpression("[1, 'a']").toString()).isEqualTo("[1, \"a\"]");
    assertThat(parseExpression("x not in [1]").toString()).isEqualTo("x not in [1]");
    assertThat(parseExpression("1, 2").toString()).isEqualTo("(1, 2)");
  }

  @Test
  public void testCallArguments() throws Exception {
    CallExpression call = (CallExpression) parseExpression("dist.normal('x', sigma=2)");
    assertThat(call.getFunction().toString()).isEqualTo("dist.normal");
    assertThat(call.getArguments()).hasSize(2);
    assertThat(call.getArguments().get(0).isPositional()).isTrue();
    assertThat(call.getArguments().get(1).isPositional()).isFalse();
    assertThat(call.getArguments().get(1).getName()).isEqualTo("sigma");
  }

  @Test
  public void testAssignmentForms() {
    AssignmentStatement plain = (AssignmentStatement) parseStatement("x = f()");
    assertThat(plain.isAugmented()).isFalse();
    assertThat(plain.isAnnotated()).isFalse();
    assertThat(plain.getRHS()).isInstanceOf(CallExpression.class);

    AssignmentStatement aug = (AssignmentStatement) parseStatement("x += 1");
    assertThat(aug.isAugmented()).isTrue();
    assertThat(aug.getForm()).isEqualTo(AssignmentStatement.Form.AUGMENTED);
    assertThat(aug.getOperator()).isEqualTo(Operator.PLUS);
    assertThat(aug.toString()).isEqualTo("x += 1\n");

    AssignmentStatement annotated = (AssignmentStatement) parseStatement("x: float = 1.0");
    assertThat(annotated.isAnnotated()).isTrue();
    assertThat(annotated.getAnnotation().toString()).isEqualTo("float");
    assertThat(annotated.toString()).isEqualTo("x: float = 1.0\n");

    AssignmentStatement tuple = (AssignmentStatement) parseStatement("a, b = 1, 2");
    assertThat(tuple.getLHS()).isInstanceOf(ListExpression.class);
  }

  @Test
  public void testYieldForms() {
    DefStatement def =
        (DefStatement)
            parseStatement(
                "def f():", //
                "  x = yield g()",
                "  yield from h(x)",
                "  yield x");
    List<Statement> body = def.getBody();

    YieldExpression y0 = (YieldExpression) ((AssignmentStatement) body.get(0)).getRHS();
    assertThat(y0.isDelegating()).isFalse();
    assertThat(y0.getValue().toString()).isEqualTo("g()");

    YieldExpression y1 = (YieldExpression) ((ExpressionStatement) body.get(1)).getExpression();
    assertThat(y1.isDelegating()).isTrue();
    assertThat(y1.toString()).isEqualTo("yield from h(x)");

    YieldExpression y2 = (YieldExpression) ((ExpressionStatement) body.get(2)).getExpression();
    assertThat(y2.isDelegating()).isFalse();
  }

  @Test
  public void testYieldOnlyInStatementPositions() {
    String want =
        "'yield' may appear only as the right-hand side of an assignment or as a statement";
    assertThat(firstError("def f():", "  x = 1 + (yield g())")).isEqualTo(want);
    assertThat(firstError("def f():", "  return yield g()")).isEqualTo(want);
    assertThat(firstError("def f():", "  h(yield g())")).isEqualTo(want);
    assertThat(firstError("def f():", "  x += yield g()")).isEqualTo(want);
  }

  @Test
  public void testYieldRequiresOperand() {
    assertThat(firstError("def f():", "  yield"))
        .isEqualTo("syntax error at 'newline': 'yield' requires an operand");
  }

  @Test
  public void testDefStatement() {
    DefStatement def =
        (DefStatement)
            parseStatement(
                "@model",
                "@a.b(1)",
                "def f(x, y=2):",
                "  \"\"\"Doc.\"\"\"",
                "  return x");
    assertThat(def.getIdentifier().getName()).isEqualTo("f");
    assertThat(def.getDecorators()).hasSize(2);
    assertThat(def.getDecorators().get(1).toString()).isEqualTo("a.b(1)");
    assertThat(def.getParameters()).hasSize(2);
    assertThat(def.getParameters().get(1).getDefaultValue().toString()).isEqualTo("2");
    assertThat(def.getDocString()).isEqualTo("Doc.");
    assertThat(def.toString()).isEqualTo("def f(x, y=2):");
    assertThat(def.getStartLocation().line()).isEqualTo(1);
    assertThat(def.getDefLocation().line()).isEqualTo(3);
  }

  @Test
  public void testDefErrors() {
    assertThat(firstError("@model", "x = 1"))
        .isEqualTo("expected 'def' after decorator");
    assertThat(firstError("def f() -> int:", "  pass"))
        .isEqualTo("return type annotations are not supported");
    assertThat(firstError("def f(*args):", "  pass"))
        .isEqualTo("variadic parameters are not supported");
    assertThat(firstError("def f(x", "  pass"))
        .isEqualTo("syntax error at 'newline': expected ')'");
    assertThat(firstError("def f():", "pass")).isEqualTo("expected an indented block");
  }

  @Test
  public void testUnsupportedConstructs() {
    assertThat(firstError("f(*args)")).isEqualTo("variadic arguments are not supported");
    assertThat(firstError("while x:", "  pass"))
        .isEqualTo("'while' not supported, use 'for' instead");
    assertThat(firstError("import foo"))
        .isEqualTo("'import' not supported, models are self-contained files");
    assertThat(firstError("f = lambda x: x"))
        .isEqualTo("'lambda' not supported, use 'def' instead");
    assertThat(firstError("a.b: int = 1"))
        .isEqualTo("only a simple name may carry a type annotation");
    assertThat(firstError("x: int")).isEqualTo("an annotated name must be assigned a value");
    assertThat(firstError("y = x[1:2]")).isEqualTo("slices are not supported");
    assertThat(firstError("y = [i for i in x]")).isEqualTo("comprehensions are not supported");
    assertThat(firstError("y = {}")).isEqualTo("invalid character: '{'");
    assertThat(firstError("y = 'a' 'b'"))
        .isEqualTo("adjacent string literals are not concatenated, use the + operator");
    assertThat(firstError("y = a < b < c"))
        .isEqualTo("comparison '<' cannot follow another comparison");
  }

  @Test
  public void testParsingContinuesAfterAnError() {
    ModelFile file = ModelFile.parse(ParserInput.fromLines("x = 1 +", "y = *", "z = 3"));
    assertThat(file.errors()).hasSize(2);
    assertThat(file.errors().get(0).message())
        .isEqualTo("syntax error at 'newline': expected expression");
    assertThat(file.errors().get(1).message())
        .isEqualTo("syntax error at '*': expected expression");
    assertThat(file.errors().get(1).location().line()).isEqualTo(2);
    assertThat(file.getStatements()).hasSize(1);
    assertThat(file.getStatements().get(0).toString()).isEqualTo("z = 3\n");
  }

  @Test
  public void testIfElifElse() {
    IfStatement stmt =
        (IfStatement)
            parseStatement(
                "if a:", //
                "  x = 1",
                "elif b:",
                "  x = 2",
                "else:",
                "  x = 3");
    assertThat(stmt.isElif()).isFalse();
    IfStatement elif = (IfStatement) stmt.getElseBlock().get(0);
    assertThat(elif.isElif()).isTrue();
    assertThat(elif.getCondition().toString()).isEqualTo("b");
    assertThat(elif.getElseBlock().get(0).toString()).isEqualTo("x = 3\n");
  }

  @Test
  public void testForStatement() {
    ForStatement stmt = (ForStatement) parseStatement("for i, x in pairs:", "  pass");
    assertThat(stmt.getTarget().toString()).isEqualTo("(i, x)");
    assertThat(stmt.getIterable().toString()).isEqualTo("pairs");
    FlowStatement body = (FlowStatement) stmt.getBody().get(0);
    assertThat(body.getJump()).isEqualTo(FlowStatement.Jump.PASS);
  }

  @Test
  public void testLocationsHonorLineOffset() {
    ModelFile file =
        ModelFile.parse(ParserInput.fromString("x = 1\ny = 2\n", "m.ms").withLineOffset(4));
    assertThat(file.getStatements().get(1).getStartLocation().toString()).isEqualTo("m.ms:6:1");
  }

  @Test
  public void testExpressionSyntaxErrorIsThrown() {
    SyntaxError.Exception ex =
        assertThrows(SyntaxError.Exception.class, () -> parseExpression("1 +"));
    assertThat(ex.errors()).isNotEmpty();
  }
}
