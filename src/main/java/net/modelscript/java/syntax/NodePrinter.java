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
import java.util.List;

/**
 * A pretty-printer for ModelScript syntax trees.
 *
 * <p>In addition to ordinary pretty-printing, used by {@link Node#toString}, the printer has a
 * line-preserving mode in which the output is padded with blank lines so that each statement and
 * decorator starts on the line it occupied in the original source. Text produced in that mode,
 * parsed again with a matching line offset, reports the same line numbers as the original.
 */
final class NodePrinter {

  private final StringBuilder buf;
  private final boolean preserveLines;
  private int indent;
  private int line; // line number of the line being written (line-preserving mode)

  NodePrinter(StringBuilder buf) {
    this.buf = buf;
    this.preserveLines = false;
  }

  /**
   * Returns a line-preserving printer whose output begins at line {@code firstLine} of the
   * original file.
   */
  NodePrinter(StringBuilder buf, int firstLine) {
    this.buf = buf;
    this.preserveLines = true;
    this.line = firstLine;
  }

  // Prints a node of any kind. Statements are followed by a newline.
  void printNode(Node n) {
    if (n instanceof Expression) {
      printExpr((Expression) n);

    } else if (n instanceof Statement) {
      printStmt((Statement) n);

    } else if (n instanceof ModelFile) {
      for (Statement stmt : ((ModelFile) n).getStatements()) {
        printStmt(stmt);
      }

    } else if (n instanceof Parameter) {
      printParameter((Parameter) n);

    } else if (n instanceof Argument) {
      printArgument((Argument) n);

    } else {
      throw new IllegalArgumentException("unexpected: " + n.getClass());
    }
  }

  // Moves to the line of the given node, emitting blank lines as needed.
  private void advanceTo(Node n) {
    if (!preserveLines) {
      return;
    }
    int target = n.getStartLocation().line();
    while (line < target) {
      buf.append('\n');
      line++;
    }
  }

  private void newline() {
    buf.append('\n');
    line++;
  }

  private void printIndent() {
    for (int i = 0; i < indent; i++) {
      buf.append("  ");
    }
  }

  private void printSuite(List<Statement> statements) {
    indent++;
    for (Statement stmt : statements) {
      printStmt(stmt);
    }
    indent--;
  }

  void printDefSignature(DefStatement def) {
    buf.append("def ");
    buf.append(def.getIdentifier().getName());
    buf.append('(');
    printParameters(def.getParameters());
    buf.append("):");
  }

  void printStmt(Statement s) {
    if (!(s instanceof DefStatement)) {
      advanceTo(s);
    }
    switch (s.kind()) {
      case ASSIGNMENT:
        {
          AssignmentStatement stmt = (AssignmentStatement) s;
          printIndent();
          printExpr(stmt.getLHS());
          if (stmt.isAnnotated()) {
            buf.append(": ");
            printExpr(stmt.getAnnotation());
          }
          buf.append(' ');
          if (stmt.isAugmented()) {
            buf.append(stmt.getOperator());
          }
          buf.append("= ");
          printExpr(stmt.getRHS());
          newline();
          break;
        }

      case EXPRESSION:
        printIndent();
        printExpr(((ExpressionStatement) s).getExpression());
        newline();
        break;

      case FLOW:
        printIndent();
        buf.append(((FlowStatement) s).getJump());
        newline();
        break;

      case FOR:
        {
          ForStatement stmt = (ForStatement) s;
          printIndent();
          buf.append("for ");
          printExpr(stmt.getTarget());
          buf.append(" in ");
          printExpr(stmt.getIterable());
          buf.append(':');
          newline();
          printSuite(stmt.getBody());
          break;
        }

      case DEF:
        {
          DefStatement stmt = (DefStatement) s;
          for (Expression decorator : stmt.getDecorators()) {
            advanceTo(decorator);
            printIndent();
            buf.append('@');
            printExpr(decorator);
            newline();
          }
          advanceTo(stmt.getIdentifier());
          printIndent();
          printDefSignature(stmt);
          newline();
          printSuite(stmt.getBody());
          break;
        }

      case IF:
        {
          IfStatement stmt = (IfStatement) s;
          printIndent();
          buf.append(stmt.isElif() ? "elif " : "if ");
          printExpr(stmt.getCondition());
          buf.append(':');
          newline();
          printSuite(stmt.getThenBlock());
          ImmutableList<Statement> elseBlock = stmt.getElseBlock();
          if (elseBlock != null) {
            if (elseBlock.size() == 1
                && elseBlock.get(0) instanceof IfStatement elif
                && elif.isElif()) {
              printStmt(elif);
            } else {
              printIndent();
              buf.append("else:");
              newline();
              printSuite(elseBlock);
            }
          }
          break;
        }

      case RETURN:
        {
          ReturnStatement stmt = (ReturnStatement) s;
          printIndent();
          buf.append("return");
          if (stmt.getResult() != null) {
            buf.append(' ');
            printExpr(stmt.getResult());
          }
          newline();
          break;
        }
    }
  }

  private void printParameters(List<Parameter> params) {
    String sep = "";
    for (Parameter param : params) {
      buf.append(sep);
      printParameter(param);
      sep = ", ";
    }
  }

  private void printParameter(Parameter param) {
    buf.append(param.getName());
    if (param.getDefaultValue() != null) {
      buf.append('=');
      printExpr(param.getDefaultValue());
    }
  }

  private void printArgument(Argument arg) {
    if (!arg.isPositional()) {
      buf.append(arg.getName());
      buf.append('=');
    }
    printExpr(arg.getValue());
  }

  // Prints an operand, parenthesizing it if it is itself a compound operation.
  private void printOperand(Expression x) {
    switch (x.kind()) {
      case BINARY_OPERATOR:
      case UNARY_OPERATOR:
      case YIELD:
        buf.append('(');
        printExpr(x);
        buf.append(')');
        break;
      default:
        printExpr(x);
    }
  }

  void printExpr(Expression expr) {
    switch (expr.kind()) {
      case BINARY_OPERATOR:
        {
          BinaryOperatorExpression binop = (BinaryOperatorExpression) expr;
          printOperand(binop.getX());
          buf.append(' ');
          buf.append(binop.getOperator());
          buf.append(' ');
          printOperand(binop.getY());
          break;
        }

      case CALL:
        {
          CallExpression call = (CallExpression) expr;
          printOperand(call.getFunction());
          buf.append('(');
          String sep = "";
          for (Argument arg : call.getArguments()) {
            buf.append(sep);
            printArgument(arg);
            sep = ", ";
          }
          buf.append(')');
          break;
        }

      case DOT:
        {
          DotExpression dot = (DotExpression) expr;
          printOperand(dot.getObject());
          buf.append('.');
          buf.append(dot.getField().getName());
          break;
        }

      case IDENTIFIER:
        buf.append(((Identifier) expr).getName());
        break;

      case INDEX:
        {
          IndexExpression index = (IndexExpression) expr;
          printOperand(index.getObject());
          buf.append('[');
          printExpr(index.getKey());
          buf.append(']');
          break;
        }

      case LIST:
        {
          ListExpression list = (ListExpression) expr;
          buf.append(list.isTuple() ? '(' : '[');
          String sep = "";
          for (Expression e : list.getElements()) {
            buf.append(sep);
            printExpr(e);
            sep = ", ";
          }
          if (list.isTuple() && list.getElements().size() == 1) {
            buf.append(',');
          }
          buf.append(list.isTuple() ? ')' : ']');
          break;
        }

      case LITERAL:
        {
          Literal literal = (Literal) expr;
          if (literal.isString()) {
            printQuoted((String) literal.getValue());
          } else {
            buf.append(literal.getText());
          }
          break;
        }

      case UNARY_OPERATOR:
        {
          UnaryOperatorExpression unop = (UnaryOperatorExpression) expr;
          buf.append(unop.getOperator());
          if (unop.getOperator() == Operator.NOT) {
            buf.append(' ');
          }
          printOperand(unop.getX());
          break;
        }

      case YIELD:
        {
          YieldExpression yield = (YieldExpression) expr;
          buf.append(yield.isDelegating() ? "yield from " : "yield ");
          printExpr(yield.getValue());
          break;
        }
    }
  }

  private void printQuoted(String s) {
    buf.append('"');
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '"':
          buf.append("\\\"");
          break;
        case '\\':
          buf.append("\\\\");
          break;
        case '\n':
          buf.append("\\n");
          break;
        case '\r':
          buf.append("\\r");
          break;
        case '\t':
          buf.append("\\t");
          break;
        default:
          buf.append(c);
      }
    }
    buf.append('"');
  }
}
