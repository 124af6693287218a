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

package net.modelscript.java.model;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.GoogleLogger;
import java.util.HashSet;
import java.util.Set;
import javax.annotation.Nullable;
import net.modelscript.java.eval.ModelSemantics;
import net.modelscript.java.syntax.AssignmentStatement;
import net.modelscript.java.syntax.CallExpression;
import net.modelscript.java.syntax.DefStatement;
import net.modelscript.java.syntax.DotExpression;
import net.modelscript.java.syntax.Expression;
import net.modelscript.java.syntax.ForStatement;
import net.modelscript.java.syntax.Identifier;
import net.modelscript.java.syntax.IfStatement;
import net.modelscript.java.syntax.NodeVisitor;
import net.modelscript.java.syntax.Parameter;
import net.modelscript.java.syntax.Statement;
import net.modelscript.java.syntax.YieldExpression;

/**
 * RewriteVisitor turns the declaration of a direct-style model function into the declaration of a
 * coroutine function, in place.
 *
 * <p>The declaration is renamed to {@link ModelSemantics#internalName}, and its registration
 * decorators (those named by {@link ModelSemantics#registrationMarkers}) are removed, so that
 * defining the rewritten declaration does not register it again.
 *
 * <p>Within the function's own body, each ordinary assignment {@code x = f(args)} is rewritten
 * according to the classification of {@code f}:
 *
 * <ul>
 *   <li>if {@code f} constructs stochastic nodes, it becomes {@code x = yield f(args)};
 *   <li>if {@code f} is a model, it becomes {@code x = yield from f.generator(args)};
 *   <li>otherwise, it is unchanged.
 * </ul>
 *
 * An assignment whose right-hand side is already a {@code yield} is unchanged, so rewriting is
 * idempotent. The bodies of nested functions are never rewritten. A stochastic or model call in any
 * other position is left unchanged, with a warning. An augmented or annotated assignment of such a
 * call is an error, unless {@link ModelSemantics#passThroughUnsupportedAssignments} is set.
 */
public final class RewriteVisitor extends NodeVisitor {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final RewriteRegistry registry;
  private final boolean passThroughUnsupported;
  private final Set<String> localNames = new HashSet<>();
  private final ImmutableList.Builder<RewriteSite> sites = ImmutableList.builder();

  private int nesting; // depth of nested function bodies
  @Nullable private CallExpression handled; // a call whose treatment has been decided
  @Nullable private ModelException failure; // the first error

  private RewriteVisitor(RewriteRegistry registry, ModelSemantics semantics) {
    this.registry = registry;
    this.passThroughUnsupported = semantics.passThroughUnsupportedAssignments();
  }

  /**
   * Rewrites the declaration {@code def} in place, and returns the treatment of each call to a
   * stochastic or model callee, in source order.
   *
   * @throws ModelException of kind {@code NOT_SUPPORTED} if the body assigns the result of such a
   *     call in an unsupported form
   */
  public static ImmutableList<RewriteSite> rewrite(
      DefStatement def, RewriteRegistry registry, ModelSemantics semantics)
      throws ModelException {
    RewriteVisitor visitor = new RewriteVisitor(registry, semantics);

    String name = def.getIdentifier().getName();
    def.setIdentifier(semantics.internalName());
    def.setDecorators(stripMarkers(def.getDecorators(), semantics.registrationMarkers()));

    for (Parameter param : def.getParameters()) {
      visitor.localNames.add(param.getName());
    }
    visitor.collectLocalNames(def.getBody());

    visitor.visitBlock(def.getBody());
    if (visitor.failure != null) {
      throw visitor.failure;
    }
    ImmutableList<RewriteSite> sites = visitor.sites.build();
    logger.atFine().log("rewrote %s: %d site(s)", name, sites.size());
    return sites;
  }

  private static ImmutableList<Expression> stripMarkers(
      ImmutableList<Expression> decorators, ImmutableSet<String> markers) {
    ImmutableList.Builder<Expression> kept = ImmutableList.builder();
    for (Expression decorator : decorators) {
      String name = null;
      if (decorator instanceof Identifier) {
        name = ((Identifier) decorator).getName();
      } else if (decorator instanceof DotExpression) {
        name = ((DotExpression) decorator).getField().getName();
      }
      if (name == null || !markers.contains(name)) {
        kept.add(decorator);
      }
    }
    return kept.build();
  }

  // Adds the names bound by a block of the function's own body.
  private void collectLocalNames(Iterable<Statement> stmts) {
    for (Statement stmt : stmts) {
      if (stmt instanceof AssignmentStatement) {
        addBound(((AssignmentStatement) stmt).getLHS());
      } else if (stmt instanceof ForStatement) {
        addBound(((ForStatement) stmt).getTarget());
        collectLocalNames(((ForStatement) stmt).getBody());
      } else if (stmt instanceof IfStatement) {
        IfStatement ifStmt = (IfStatement) stmt;
        collectLocalNames(ifStmt.getThenBlock());
        if (ifStmt.getElseBlock() != null) {
          collectLocalNames(ifStmt.getElseBlock());
        }
      } else if (stmt instanceof DefStatement) {
        localNames.add(((DefStatement) stmt).getIdentifier().getName());
      }
    }
  }

  private void addBound(Expression lhs) {
    for (Identifier id : Identifier.boundIdentifiers(lhs)) {
      localNames.add(id.getName());
    }
  }

  /**
   * Returns the path of names by which {@code callee} refers to a value, or null if it is not an
   * identifier or a chain of field selections from one.
   */
  @Nullable
  static ImmutableList<String> calleePath(Expression callee) {
    if (callee instanceof Identifier) {
      return ImmutableList.of(((Identifier) callee).getName());
    } else if (callee instanceof DotExpression) {
      DotExpression dot = (DotExpression) callee;
      ImmutableList<String> prefix = calleePath(dot.getObject());
      if (prefix != null) {
        return ImmutableList.<String>builder()
            .addAll(prefix)
            .add(dot.getField().getName())
            .build();
      }
    }
    return null;
  }

  @Nullable
  private Classification classify(@Nullable ImmutableList<String> path) {
    if (path == null) {
      return null;
    }
    if (nesting == 0 && localNames.contains(path.get(0))) {
      return Classification.OPAQUE; // a local variable of the model
    }
    return registry.classify(path);
  }

  private static boolean isRewritable(@Nullable Classification c) {
    return c == Classification.SUSPENSION_ELIGIBLE || c == Classification.DELEGATE;
  }

  private void record(CallExpression call, ImmutableList<String> path, RewriteSite.Decision d) {
    RewriteSite site = RewriteSite.create(call.getStartLocation(), path, d);
    logger.atFine().log("%s", site);
    sites.add(site);
  }

  @Override
  public void visit(AssignmentStatement node) {
    Expression rhs = node.getRHS();
    if (nesting > 0 || !(rhs instanceof CallExpression)) {
      // Includes 'x = yield ...', which is already rewritten.
      super.visit(node);
      return;
    }

    CallExpression call = (CallExpression) rhs;
    ImmutableList<String> path = calleePath(call.getFunction());
    Classification c = classify(path);
    if (!isRewritable(c)) {
      super.visit(node);
      return;
    }

    if (node.isAugmented() || node.isAnnotated()) {
      String form = node.isAugmented() ? "augmented" : "annotated";
      if (!passThroughUnsupported) {
        if (failure == null) {
          failure =
              ModelException.notSupported(
                  "%s: cannot rewrite %s assignment of a call to %s; assign it to a plain"
                      + " variable first",
                  call.getStartLocation(), form, Joiner.on('.').join(path));
        }
      } else {
        logger.atWarning().log(
            "%s: %s assignment of a call to %s is left unchanged",
            call.getStartLocation(), form, Joiner.on('.').join(path));
        record(call, path, RewriteSite.Decision.PASS_THROUGH);
      }
      handled = call;
      super.visit(node);
      return;
    }

    CallExpression target;
    if (c == Classification.SUSPENSION_ELIGIBLE) {
      target = call;
      node.setRHS(YieldExpression.wrap(target, /* delegating= */ false));
      record(call, path, RewriteSite.Decision.SUSPEND);
    } else {
      target =
          call.withFunction(DotExpression.select(call.getFunction(), ModelHandle.FACTORY_FIELD));
      node.setRHS(YieldExpression.wrap(target, /* delegating= */ true));
      record(call, path, RewriteSite.Decision.DELEGATE);
    }
    handled = target;
    super.visit(node);
  }

  @Override
  public void visit(YieldExpression node) {
    // The operand of an existing yield is already a suspension or delegation.
    if (node.getValue() instanceof CallExpression) {
      handled = (CallExpression) node.getValue();
    }
    super.visit(node);
  }

  @Override
  public void visit(CallExpression node) {
    if (node == handled) {
      handled = null;
    } else {
      ImmutableList<String> path = calleePath(node.getFunction());
      if (isRewritable(classify(path))) {
        logger.atWarning().log(
            "%s: call to %s is not the right-hand side of an assignment in the model body, and"
                + " is left unchanged",
            node.getStartLocation(), Joiner.on('.').join(path));
        record(node, path, RewriteSite.Decision.IGNORED);
      }
    }
    super.visit(node);
  }

  @Override
  public void visit(DefStatement node) {
    // Decorators and default values belong to the enclosing body.
    visitAll(node.getDecorators());
    visitAll(node.getParameters());
    nesting++;
    visitBlock(node.getBody());
    nesting--;
  }
}
