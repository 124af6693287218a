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

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import javax.annotation.Nullable;

/**
 * The Resolver binds each identifier of a syntax tree to the variable it denotes, and reports the
 * static errors that do not depend on values.
 *
 * <p>Variables have these scopes:
 *
 * <ul>
 *   <li>LOCAL: a parameter of the enclosing function, or a name the function assigns anywhere in
 *       its body;
 *   <li>FREE: a local of an enclosing function;
 *   <li>GLOBAL: a name assigned at the top level of the file, or a global of the module;
 *   <li>PREDECLARED and UNIVERSAL: names supplied by the environment.
 * </ul>
 *
 * Functions, including the implicit function holding a file's top-level statements, are described
 * by {@link Function} objects, which the evaluator uses to allocate frames.
 */
public final class Resolver extends NodeVisitor {

  /** The scope of a binding. */
  public enum Scope {
    LOCAL,
    FREE,
    GLOBAL,
    PREDECLARED,
    UNIVERSAL;

    @Override
    public String toString() {
      return Ascii.toLowerCase(name());
    }
  }

  /**
   * A variable, as denoted by one or more identifiers. For LOCAL and FREE variables, the index is
   * the variable's slot among the locals of the function that declares it, and for FREE variables
   * the depth is the number of function boundaries between the reference and the declaration.
   */
  public static final class Binding {
    private final Scope scope;
    private final String name;
    private final int index;
    private final int depth;
    @Nullable private final Identifier first; // the declaring occurrence, if in this file

    private Binding(Scope scope, String name, int index, int depth, @Nullable Identifier first) {
      this.scope = scope;
      this.name = name;
      this.index = index;
      this.depth = depth;
      this.first = first;
    }

    public Scope getScope() {
      return scope;
    }

    public String getName() {
      return name;
    }

    public int getIndex() {
      return index;
    }

    public int getDepth() {
      return depth;
    }

    /** Returns the identifier that declares the variable, or null if it is not in this file. */
    @Nullable
    public Identifier getFirst() {
      return first;
    }

    @Override
    public String toString() {
      return scope + " " + name;
    }
  }

  /** The static description of a function: its parameters, body and local variables. */
  public static final class Function {
    private final String name;
    private final Location location;
    private final ImmutableList<Parameter> params;
    private final ImmutableList<Statement> body;
    private final ImmutableList<Binding> locals;
    private final boolean toplevel;
    private final boolean generator;
    private final boolean freeVars;
    @Nullable private final String documentation;
    @Nullable private final DefStatement def;
    private final FileOptions options;

    private Function(
        String name,
        Location location,
        ImmutableList<Parameter> params,
        ImmutableList<Statement> body,
        FunctionScope scope,
        @Nullable String documentation,
        @Nullable DefStatement def,
        FileOptions options) {
      this.name = name;
      this.location = location;
      this.params = params;
      this.body = body;
      this.locals = ImmutableList.copyOf(scope.slots);
      this.toplevel = scope.isToplevel();
      this.generator = scope.generator;
      this.freeVars = scope.freeVars;
      this.documentation = documentation;
      this.def = def;
      this.options = options;
    }

    public String getName() {
      return name;
    }

    /** Returns the location of the function's name, or of the start of a file or expression. */
    public Location getLocation() {
      return location;
    }

    public ImmutableList<Parameter> getParameters() {
      return params;
    }

    public ImmutableList<String> getParameterNames() {
      ImmutableList.Builder<String> names = ImmutableList.builderWithExpectedSize(params.size());
      for (Parameter param : params) {
        names.add(param.getName());
      }
      return names.build();
    }

    public ImmutableList<Statement> getBody() {
      return body;
    }

    /** Returns the local variables, parameters first, in slot order. */
    public ImmutableList<Binding> getLocals() {
      return locals;
    }

    /** Reports whether this is the implicit function of a file's or an expression's top level. */
    public boolean isToplevel() {
      return toplevel;
    }

    /** Reports whether the body contains a yield, making a call return a coroutine. */
    public boolean isGenerator() {
      return generator;
    }

    /** Reports whether the body, or that of a nested function, refers to an enclosing local. */
    public boolean hasFreeVars() {
      return freeVars;
    }

    @Nullable
    public String getDocumentation() {
      return documentation;
    }

    /** Returns the declaration of the function, or null for a top-level function. */
    @Nullable
    public DefStatement getDefStatement() {
      return def;
    }

    public FileOptions getFileOptions() {
      return options;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** The names the environment of a file provides. */
  public interface Environment {
    /** Returns the scope of {@code name}, or null if the environment does not define it. */
    @Nullable
    Scope lookup(String name);
  }

  /**
   * An environment that defines every name as a GLOBAL, deferring lookup to run time. It is used to
   * resolve a function excerpted from a file without the rest of the file.
   */
  public static final Environment DYNAMIC_GLOBALS = name -> Scope.GLOBAL;

  /** Returns an environment that predeclares exactly the given names. */
  public static Environment moduleWithPredeclared(String... names) {
    ImmutableSet<String> predeclared = ImmutableSet.copyOf(names);
    return name -> predeclared.contains(name) ? Scope.PREDECLARED : null;
  }

  // The variables of the function being resolved. The top level has no parent and no slots.
  private static final class FunctionScope {
    @Nullable final FunctionScope parent; // null for the top level and its direct children
    final boolean toplevel;
    final Map<String, Binding> locals = new HashMap<>();
    final Map<String, Binding> free = new HashMap<>();
    final List<Binding> slots = new ArrayList<>();
    boolean generator;
    boolean freeVars;
    int loops; // depth of for loops around the current statement

    FunctionScope(@Nullable FunctionScope parent, boolean toplevel) {
      this.parent = parent;
      this.toplevel = toplevel;
    }

    boolean isToplevel() {
      return toplevel;
    }

    void declare(Identifier id) {
      if (!locals.containsKey(id.getName())) {
        Binding b = new Binding(Scope.LOCAL, id.getName(), slots.size(), 0, id);
        locals.put(id.getName(), b);
        slots.add(b);
      }
    }
  }

  private final List<SyntaxError> errors;
  private final FileOptions options;
  private final Environment env;
  private final Map<String, Binding> globals = new LinkedHashMap<>(); // assigned in this file
  private final Map<String, Binding> external = new HashMap<>(); // provided by env
  private FunctionScope scope;

  private Resolver(List<SyntaxError> errors, FileOptions options, Environment env) {
    this.errors = errors;
    this.options = options;
    this.env = env;
    this.scope = new FunctionScope(null, /* toplevel= */ true);
  }

  /**
   * Resolves a parsed file in the given environment, recording errors in the file and a {@link
   * Function} for its top level. A file with parse errors is left unresolved.
   */
  public static void resolveFile(ModelFile file, Environment env) {
    if (!file.ok()) {
      return;
    }
    Resolver r = new Resolver(file.errors, file.getOptions(), env);
    ImmutableList<Statement> stmts = file.getStatements();
    forEachBound(stmts, r::declareGlobal);
    r.visitBlock(stmts);
    file.setResolvedFunction(
        new Function(
            "<toplevel>",
            file.getStartLocation(),
            ImmutableList.of(),
            stmts,
            r.scope,
            null,
            null,
            file.getOptions()));
  }

  /**
   * Resolves an expression in the given environment, returning the function of no parameters
   * whose body returns its value.
   */
  public static Function resolveExpr(Expression expr, Environment env)
      throws SyntaxError.Exception {
    List<SyntaxError> errors = new ArrayList<>();
    Resolver r = new Resolver(errors, FileOptions.DEFAULT, env);
    r.visit(expr);
    if (!errors.isEmpty()) {
      throw new SyntaxError.Exception(errors);
    }
    return new Function(
        "<expr>",
        expr.getStartLocation(),
        ImmutableList.of(),
        ImmutableList.of(ReturnStatement.make(expr)),
        r.scope,
        null,
        null,
        FileOptions.DEFAULT);
  }

  private void error(Node node, String format, Object... args) {
    errors.add(new SyntaxError(node.getStartLocation(), String.format(format, args)));
  }

  // Calls bind for each identifier assigned by the statements of a block, including those in
  // nested if and for blocks, and the names of nested defs, but not within nested def bodies.
  private static void forEachBound(List<Statement> block, Consumer<Identifier> bind) {
    for (Statement stmt : block) {
      switch (stmt.kind()) {
        case ASSIGNMENT:
          Identifier.boundIdentifiers(((AssignmentStatement) stmt).getLHS()).forEach(bind);
          break;
        case DEF:
          bind.accept(((DefStatement) stmt).getIdentifier());
          break;
        case FOR:
          ForStatement loop = (ForStatement) stmt;
          Identifier.boundIdentifiers(loop.getTarget()).forEach(bind);
          forEachBound(loop.getBody(), bind);
          break;
        case IF:
          IfStatement cond = (IfStatement) stmt;
          forEachBound(cond.getThenBlock(), bind);
          if (cond.getElseBlock() != null) {
            forEachBound(cond.getElseBlock(), bind);
          }
          break;
        default:
          break;
      }
    }
  }

  private void declareGlobal(Identifier id) {
    Binding prev = globals.get(id.getName());
    if (prev == null) {
      globals.put(id.getName(), new Binding(Scope.GLOBAL, id.getName(), globals.size(), 0, id));
    } else if (!options.allowToplevelRebinding()) {
      error(id, "cannot reassign global '%s'", id.getName());
      error(prev.getFirst(), "'%s' previously declared here", id.getName());
    }
  }

  // Returns the binding of a name referenced in the current function, or null if undefined.
  @Nullable
  private Binding lookup(String name) {
    Binding local = scope.locals.get(name);
    if (local != null) {
      return local;
    }
    Binding free = scope.free.get(name);
    if (free != null) {
      return free;
    }
    int depth = 0;
    for (FunctionScope outer = scope.parent; outer != null; outer = outer.parent) {
      depth++;
      Binding decl = outer.locals.get(name);
      if (decl != null) {
        for (FunctionScope s = scope; s != outer; s = s.parent) {
          s.freeVars = true;
        }
        free = new Binding(Scope.FREE, name, decl.getIndex(), depth, decl.getFirst());
        scope.free.put(name, free);
        return free;
      }
    }
    Binding global = globals.get(name);
    if (global != null) {
      return global;
    }
    if (!external.containsKey(name)) {
      Scope s = env.lookup(name);
      external.put(name, s == null ? null : new Binding(s, name, -1, 0, null));
    }
    return external.get(name);
  }

  @Override
  public void visit(Identifier id) {
    Binding b = lookup(id.getName());
    if (b == null) {
      error(id, "name '%s' is not defined", id.getName());
    } else {
      id.setBinding(b);
    }
  }

  // Keyword labels and field names are not variables.

  @Override
  public void visit(Argument arg) {
    visit(arg.getValue());
  }

  @Override
  public void visit(DotExpression dot) {
    visit(dot.getObject());
  }

  @Override
  public void visit(CallExpression call) {
    visit(call.getFunction());
    Set<String> keywords = new HashSet<>();
    for (Argument arg : call.getArguments()) {
      if (arg.isPositional()) {
        if (!keywords.isEmpty()) {
          error(arg, "positional argument may not follow keyword argument");
        }
      } else if (!keywords.add(arg.getName())) {
        error(arg, "duplicate keyword argument: %s", arg.getName());
      }
      visit(arg);
    }
  }

  @Override
  public void visit(YieldExpression yield) {
    if (scope.isToplevel()) {
      error(yield, "'yield' outside function");
    }
    scope.generator = true;
    super.visit(yield);
  }

  @Override
  public void visit(ReturnStatement stmt) {
    if (scope.isToplevel()) {
      error(stmt, "return statements must be inside a function");
    }
    super.visit(stmt);
  }

  @Override
  public void visit(FlowStatement stmt) {
    if (stmt.getJump() != FlowStatement.Jump.PASS && scope.loops == 0) {
      error(stmt, "%s statement must be inside a for loop", stmt.getJump());
    }
  }

  @Override
  public void visit(ForStatement loop) {
    visit(loop.getIterable());
    checkTarget(loop.getTarget(), false);
    scope.loops++;
    visitBlock(loop.getBody());
    scope.loops--;
  }

  @Override
  public void visit(AssignmentStatement stmt) {
    // Annotations are documentation only; they are neither resolved nor evaluated.
    visit(stmt.getRHS());
    checkTarget(stmt.getLHS(), stmt.isAugmented());
  }

  // Reports an error unless lhs is a valid assignment target, and resolves its identifiers.
  private void checkTarget(Expression lhs, boolean augmented) {
    switch (lhs.kind()) {
      case IDENTIFIER:
      case INDEX:
      case DOT:
        visit(lhs);
        return;
      case LIST:
        if (augmented) {
          error(lhs, "cannot perform augmented assignment on a list or tuple expression");
          return;
        }
        for (Expression elem : ((ListExpression) lhs).getElements()) {
          checkTarget(elem, false);
        }
        return;
      default:
        error(lhs, "cannot assign to '%s'", lhs);
    }
  }

  @Override
  public void visit(DefStatement def) {
    // Decorators and default values are evaluated in the enclosing function.
    visitAll(def.getDecorators());
    boolean optional = false;
    for (Parameter param : def.getParameters()) {
      if (param.isOptional()) {
        visit(param.getDefaultValue());
        optional = true;
      } else if (optional) {
        error(param, "required parameter %s may not follow an optional parameter", param.getName());
      }
    }
    visit(def.getIdentifier());

    FunctionScope outer = scope;
    scope = new FunctionScope(outer.isToplevel() ? null : outer, /* toplevel= */ false);
    try {
      Set<String> names = new HashSet<>();
      for (Parameter param : def.getParameters()) {
        if (!names.add(param.getName())) {
          error(param, "duplicate parameter: %s", param.getName());
        }
        scope.declare(param.getIdentifier());
      }
      forEachBound(def.getBody(), scope::declare);
      for (Parameter param : def.getParameters()) {
        visit(param.getIdentifier());
      }
      visitBlock(def.getBody());
      def.setResolvedFunction(
          new Function(
              def.getIdentifier().getName(),
              def.getIdentifier().getStartLocation(),
              def.getParameters(),
              def.getBody(),
              scope,
              def.getDocString(),
              def,
              options));
    } finally {
      scope = outer;
    }
  }
}
