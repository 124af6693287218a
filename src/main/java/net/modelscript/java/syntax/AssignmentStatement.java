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
import javax.annotation.Nullable;

/**
 * An assignment statement in one of three forms: plain ({@code x = e}), augmented ({@code x += e})
 * or annotated ({@code x: T = e}). A plain assignment may have any assignment target; an augmented
 * one may not assign to a list or tuple, and an annotated one assigns only to a name.
 *
 * <p>The right-hand side may be replaced by a rewriting pass.
 */
public final class AssignmentStatement extends Statement {

  /** The syntactic form of an assignment. */
  public enum Form {
    PLAIN,
    AUGMENTED,
    ANNOTATED
  }

  private final Form form;
  private final Expression lhs;
  @Nullable private final Operator op; // AUGMENTED only
  @Nullable private final Expression annotation; // ANNOTATED only
  private final int opOffset; // offset of '=', '+=', etc.
  private Expression rhs;

  private AssignmentStatement(
      FileLocations locs,
      Form form,
      Expression lhs,
      @Nullable Operator op,
      @Nullable Expression annotation,
      int opOffset,
      Expression rhs) {
    super(locs, Kind.ASSIGNMENT);
    this.form = form;
    this.lhs = lhs;
    this.op = op;
    this.annotation = annotation;
    this.opOffset = opOffset;
    this.rhs = rhs;
  }

  static AssignmentStatement plain(FileLocations locs, Expression lhs, int eq, Expression rhs) {
    return new AssignmentStatement(locs, Form.PLAIN, lhs, null, null, eq, rhs);
  }

  static AssignmentStatement augmented(
      FileLocations locs, Expression lhs, Operator op, int opOffset, Expression rhs) {
    return new AssignmentStatement(locs, Form.AUGMENTED, lhs, op, null, opOffset, rhs);
  }

  static AssignmentStatement annotated(
      FileLocations locs, Identifier lhs, Expression annotation, int eq, Expression rhs) {
    return new AssignmentStatement(locs, Form.ANNOTATED, lhs, null, annotation, eq, rhs);
  }

  public Form getForm() {
    return form;
  }

  public Expression getLHS() {
    return lhs;
  }

  public Expression getRHS() {
    return rhs;
  }

  public void setRHS(Expression rhs) {
    this.rhs = Preconditions.checkNotNull(rhs);
  }

  /** Returns the binary operator applied by an augmented assignment, or null. */
  @Nullable
  public Operator getOperator() {
    return op;
  }

  /** Returns the type annotation of an annotated assignment, or null. */
  @Nullable
  public Expression getAnnotation() {
    return annotation;
  }

  public boolean isAugmented() {
    return form == Form.AUGMENTED;
  }

  public boolean isAnnotated() {
    return form == Form.ANNOTATED;
  }

  public Location getOperatorLocation() {
    return locs.getLocation(opOffset);
  }

  @Override
  public int getStartOffset() {
    return lhs.getStartOffset();
  }

  @Override
  public int getEndOffset() {
    return rhs.getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
