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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/**
 * Syntax node for a function definition, including any decorators that precede it.
 *
 * <p>The identifier and decorator list are mutable so that a rewrite pass may rename the function
 * and remove decorators before the tree is printed again.
 */
public final class DefStatement extends Statement {

  private final int startOffset; // offset of the first '@', or of 'def'
  private final int defOffset;
  private ImmutableList<Expression> decorators;
  private Identifier identifier;
  private final ImmutableList<Parameter> parameters;
  private final ImmutableList<Statement> body; // non-empty if well formed

  // set by resolver
  @Nullable private Resolver.Function resolved;

  DefStatement(
      FileLocations locs,
      int startOffset,
      ImmutableList<Expression> decorators,
      int defOffset,
      Identifier identifier,
      ImmutableList<Parameter> parameters,
      ImmutableList<Statement> body) {
    super(locs, Kind.DEF);
    this.startOffset = startOffset;
    this.decorators = decorators;
    this.defOffset = defOffset;
    this.identifier = identifier;
    this.parameters = Preconditions.checkNotNull(parameters);
    this.body = Preconditions.checkNotNull(body);
  }

  @Override
  public String toString() {
    // "def f(...): \n"
    StringBuilder buf = new StringBuilder();
    new NodePrinter(buf).printDefSignature(this);
    return buf.toString();
  }

  public Identifier getIdentifier() {
    return identifier;
  }

  /** Renames the function. The new identifier occupies the position of the old one. */
  public void setIdentifier(String name) {
    Preconditions.checkArgument(Identifier.isValid(name), "invalid function name: %s", name);
    this.identifier = new Identifier(locs, name, identifier.getStartOffset());
  }

  /** Returns the decorator expressions, outermost first. */
  public ImmutableList<Expression> getDecorators() {
    return decorators;
  }

  public void setDecorators(ImmutableList<Expression> decorators) {
    this.decorators = Preconditions.checkNotNull(decorators);
  }

  public ImmutableList<Statement> getBody() {
    return body;
  }

  public ImmutableList<Parameter> getParameters() {
    return parameters;
  }

  /**
   * Returns the source text of this declaration, printed from its syntax tree and padded with
   * blank lines so that each decorator and statement starts on the line it occupies in its file.
   * The text begins at line {@code firstLine}, which must not follow the first line of the
   * declaration. Parsing the text with a line offset of {@code firstLine - 1} reproduces the
   * original line numbers.
   */
  public String toSourceText(int firstLine) {
    StringBuilder buf = new StringBuilder();
    new NodePrinter(buf, firstLine).printStmt(this);
    return buf.toString();
  }

  /** Returns the location of the {@code def} keyword. */
  public Location getDefLocation() {
    return locs.getLocation(defOffset);
  }

  /** Returns the text of the docstring, or null if the body does not begin with one. */
  @Nullable
  public String getDocString() {
    if (!body.isEmpty()
        && body.get(0) instanceof ExpressionStatement stmt
        && stmt.getExpression() instanceof Literal doc
        && doc.isString()) {
      return (String) doc.getValue();
    }
    return null;
  }

  /**
   * Returns information about the resolved function. Set by {@link Resolver#resolveFile} and its
   * relatives.
   */
  @Nullable
  public Resolver.Function getResolvedFunction() {
    return resolved;
  }

  void setResolvedFunction(Resolver.Function resolved) {
    this.resolved = resolved;
  }

  @Override
  public int getStartOffset() {
    return startOffset;
  }

  @Override
  public int getEndOffset() {
    return endOfBlock(body, identifier);
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
