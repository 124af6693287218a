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

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import javax.annotation.Nullable;

/** A name, either a reference to a variable or (in a parameter or keyword argument) a label. */
public final class Identifier extends Expression {

  private static final CharMatcher START =
      CharMatcher.inRange('a', 'z').or(CharMatcher.inRange('A', 'Z')).or(CharMatcher.is('_'));
  private static final CharMatcher PART = START.or(CharMatcher.inRange('0', '9'));

  private final String name;
  private final int start;
  @Nullable private Resolver.Binding binding; // set by the resolver

  Identifier(FileLocations locs, String name, int start) {
    super(locs, Kind.IDENTIFIER);
    this.name = name;
    this.start = start;
  }

  public String getName() {
    return name;
  }

  /** Returns the binding this identifier refers to, or null before resolution. */
  @Nullable
  public Resolver.Binding getBinding() {
    return binding;
  }

  void setBinding(Resolver.Binding binding) {
    Preconditions.checkState(this.binding == null, "%s is already resolved", name);
    this.binding = binding;
  }

  @Override
  public int getStartOffset() {
    return start;
  }

  @Override
  public int getEndOffset() {
    return start + name.length();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  /** Reports whether {@code name} is spelled like an identifier. Keywords are not excluded. */
  public static boolean isValid(String name) {
    return !name.isEmpty() && START.matches(name.charAt(0)) && PART.matchesAllOf(name);
  }

  /**
   * Returns the identifiers that an assignment to {@code target} binds: the target itself if it
   * is an identifier, the identifiers among the elements of a list or tuple target, recursively,
   * and none for an index or dot target.
   */
  public static ImmutableSet<Identifier> boundIdentifiers(Expression target) {
    ImmutableSet.Builder<Identifier> ids = ImmutableSet.builder();
    addBound(target, ids);
    return ids.build();
  }

  private static void addBound(Expression target, ImmutableSet.Builder<Identifier> ids) {
    if (target.kind() == Kind.IDENTIFIER) {
      ids.add((Identifier) target);
    } else if (target.kind() == Kind.LIST) {
      for (Expression elem : ((ListExpression) target).getElements()) {
        addBound(elem, ids);
      }
    }
  }
}
