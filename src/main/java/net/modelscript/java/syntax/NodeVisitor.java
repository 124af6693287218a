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
import javax.annotation.Nullable;

/**
 * Walks a syntax tree in source order.
 *
 * <p>Each {@code visit} overload visits the children of its node. A subclass overrides the
 * overloads for the nodes it cares about, calling {@code super.visit(node)} where it still wants
 * the children walked. Callers start a walk with {@link #visit(Node)}, which dispatches on the
 * node's class.
 */
public class NodeVisitor {

  public void visit(Node node) {
    node.accept(this);
  }

  public void visitBlock(List<Statement> block) {
    for (Statement stmt : block) {
      visit(stmt);
    }
  }

  public void visitAll(List<? extends Node> nodes) {
    for (Node node : nodes) {
      visit(node);
    }
  }

  public void visit(ModelFile file) {
    visitBlock(file.getStatements());
  }

  public void visit(Parameter param) {
    visit(param.getIdentifier());
    visitIfPresent(param.getDefaultValue());
  }

  public void visit(Argument arg) {
    visitIfPresent(arg.getKeyword());
    visit(arg.getValue());
  }

  // Statements.

  public void visit(DefStatement def) {
    visitAll(def.getDecorators());
    visit(def.getIdentifier());
    visitAll(def.getParameters());
    visitBlock(def.getBody());
  }

  public void visit(IfStatement stmt) {
    visit(stmt.getCondition());
    visitBlock(stmt.getThenBlock());
    if (stmt.getElseBlock() != null) {
      visitBlock(stmt.getElseBlock());
    }
  }

  public void visit(ForStatement stmt) {
    visit(stmt.getTarget());
    visit(stmt.getIterable());
    visitBlock(stmt.getBody());
  }

  public void visit(AssignmentStatement stmt) {
    visit(stmt.getLHS());
    visitIfPresent(stmt.getAnnotation());
    visit(stmt.getRHS());
  }

  public void visit(ExpressionStatement stmt) {
    visit(stmt.getExpression());
  }

  public void visit(ReturnStatement stmt) {
    visitIfPresent(stmt.getResult());
  }

  public void visit(FlowStatement stmt) {}

  // Expressions.

  public void visit(Identifier id) {}

  public void visit(Literal literal) {}

  public void visit(ListExpression list) {
    visitAll(list.getElements());
  }

  public void visit(CallExpression call) {
    visit(call.getFunction());
    visitAll(call.getArguments());
  }

  public void visit(DotExpression dot) {
    visit(dot.getObject());
    visit(dot.getField());
  }

  public void visit(IndexExpression index) {
    visit(index.getObject());
    visit(index.getKey());
  }

  public void visit(UnaryOperatorExpression unop) {
    visit(unop.getX());
  }

  public void visit(BinaryOperatorExpression binop) {
    visit(binop.getX());
    visit(binop.getY());
  }

  public void visit(YieldExpression yield) {
    visit(yield.getValue());
  }

  private void visitIfPresent(@Nullable Node node) {
    if (node != null) {
      visit(node);
    }
  }
}
