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

package net.modelscript.java.eval;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import net.modelscript.java.syntax.Argument;
import net.modelscript.java.syntax.AssignmentStatement;
import net.modelscript.java.syntax.BinaryOperatorExpression;
import net.modelscript.java.syntax.CallExpression;
import net.modelscript.java.syntax.DefStatement;
import net.modelscript.java.syntax.DotExpression;
import net.modelscript.java.syntax.Expression;
import net.modelscript.java.syntax.ExpressionStatement;
import net.modelscript.java.syntax.FlowStatement;
import net.modelscript.java.syntax.ForStatement;
import net.modelscript.java.syntax.Identifier;
import net.modelscript.java.syntax.IfStatement;
import net.modelscript.java.syntax.IndexExpression;
import net.modelscript.java.syntax.ListExpression;
import net.modelscript.java.syntax.Literal;
import net.modelscript.java.syntax.Location;
import net.modelscript.java.syntax.Operator;
import net.modelscript.java.syntax.Parameter;
import net.modelscript.java.syntax.Resolver;
import net.modelscript.java.syntax.ReturnStatement;
import net.modelscript.java.syntax.Statement;
import net.modelscript.java.syntax.UnaryOperatorExpression;

/**
 * The tree-walking evaluator. Every statement executed and expression evaluated counts as one step
 * against the thread's limit. {@link Coroutine} drives the same operations one statement at a
 * time.
 */
final class Eval {

  private Eval() {}

  // How control leaves a statement.
  enum Flow {
    NEXT,
    BREAK,
    CONTINUE,
    RETURN
  }

  static Object execFunctionBody(ModelThread.Frame fr, List<Statement> body)
      throws EvalException, InterruptedException {
    fr.thread.checkInterrupt();
    execBlock(fr, body);
    return fr.result;
  }

  static void step(ModelThread.Frame fr) throws EvalException {
    if (++fr.thread.steps >= fr.thread.stepLimit) {
      throw new EvalException("ModelScript computation cancelled: too many steps");
    }
  }

  private static ModelFunction fn(ModelThread.Frame fr) {
    return (ModelFunction) fr.fn;
  }

  // ---- statements ----

  private static Flow execBlock(ModelThread.Frame fr, List<Statement> block)
      throws EvalException, InterruptedException {
    for (Statement st : block) {
      Flow flow = exec(fr, st);
      if (flow != Flow.NEXT) {
        return flow;
      }
    }
    return Flow.NEXT;
  }

  static Flow exec(ModelThread.Frame fr, Statement st) throws EvalException, InterruptedException {
    step(fr);
    switch (st.kind()) {
      case ASSIGNMENT:
        execAssignment(fr, (AssignmentStatement) st);
        return Flow.NEXT;
      case EXPRESSION:
        eval(fr, ((ExpressionStatement) st).getExpression());
        return Flow.NEXT;
      case DEF:
        DefStatement def = (DefStatement) st;
        assignIdentifier(fr, def.getIdentifier(), evalDef(fr, def, null));
        return Flow.NEXT;
      case IF:
        IfStatement cond = (IfStatement) st;
        if (Model.truth(eval(fr, cond.getCondition()))) {
          return execBlock(fr, cond.getThenBlock());
        }
        return cond.getElseBlock() == null ? Flow.NEXT : execBlock(fr, cond.getElseBlock());
      case FOR:
        return execFor(fr, (ForStatement) st);
      case FLOW:
        switch (((FlowStatement) st).getJump()) {
          case BREAK:
            return Flow.BREAK;
          case CONTINUE:
            return Flow.CONTINUE;
          default:
            return Flow.NEXT;
        }
      case RETURN:
        Expression result = ((ReturnStatement) st).getResult();
        if (result != null) {
          fr.result = eval(fr, result);
        }
        return Flow.RETURN;
    }
    throw new IllegalStateException(st.kind().toString());
  }

  private static Flow execFor(ModelThread.Frame fr, ForStatement loop)
      throws EvalException, InterruptedException {
    for (Object x : iterate(fr, loop)) {
      try {
        assign(fr, loop.getTarget(), x);
      } catch (EvalException ex) {
        fr.setErrorLocation(loop.getStartLocation());
        throw ex;
      }
      Flow flow = execBlock(fr, loop.getBody());
      if (flow == Flow.BREAK) {
        break;
      } else if (flow == Flow.RETURN) {
        return flow;
      }
      fr.thread.checkInterrupt();
    }
    return Flow.NEXT;
  }

  // Returns the elements of the loop's collection, copied so that the body may modify it.
  static Object[] iterate(ModelThread.Frame fr, ForStatement loop)
      throws EvalException, InterruptedException {
    Object collection = eval(fr, loop.getIterable());
    try {
      return EvalUtils.toArray(collection);
    } catch (EvalException ex) {
      fr.setErrorLocation(loop.getStartLocation());
      throw ex;
    }
  }

  private static void execAssignment(ModelThread.Frame fr, AssignmentStatement stmt)
      throws EvalException, InterruptedException {
    try {
      if (stmt.isAugmented()) {
        execAugmented(fr, stmt.getLHS(), stmt.getOperator(), stmt.getRHS());
      } else {
        assign(fr, stmt.getLHS(), eval(fr, stmt.getRHS()));
      }
    } catch (EvalException ex) {
      fr.setErrorLocation(stmt.getOperatorLocation());
      throw ex;
    }
  }

  // x op= y evaluates the operand and index of x only once.
  private static void execAugmented(
      ModelThread.Frame fr, Expression lhs, Operator op, Expression rhs)
      throws EvalException, InterruptedException {
    if (lhs instanceof Identifier id) {
      Object x = eval(fr, id);
      assignIdentifier(fr, id, augment(op, x, eval(fr, rhs)));
    } else if (lhs instanceof IndexExpression index) {
      Object object = eval(fr, index.getObject());
      Object key = eval(fr, index.getKey());
      Object x = EvalUtils.index(object, key);
      EvalUtils.setIndex(object, key, augment(op, x, eval(fr, rhs)));
    } else {
      throw Model.errorf("cannot perform augmented assignment on '%s'", lhs);
    }
  }

  // list += y extends the list in place.
  private static Object augment(Operator op, Object x, Object y) throws EvalException {
    if (op == Operator.PLUS
        && x instanceof ArrayList
        && y instanceof List
        && !(y instanceof Tuple)) {
      @SuppressWarnings("unchecked")
      ArrayList<Object> list = (ArrayList<Object>) x;
      list.addAll((List<?>) y);
      return list;
    }
    return EvalUtils.binaryOp(op, x, y);
  }

  /** Assigns {@code value} to the target {@code lhs}: a name, an element, or a list of targets. */
  static void assign(ModelThread.Frame fr, Expression lhs, Object value)
      throws EvalException, InterruptedException {
    switch (lhs.kind()) {
      case IDENTIFIER:
        assignIdentifier(fr, (Identifier) lhs, value);
        return;
      case INDEX:
        IndexExpression index = (IndexExpression) lhs;
        Object object = eval(fr, index.getObject());
        EvalUtils.setIndex(object, eval(fr, index.getKey()), value);
        return;
      case LIST:
        unpack(fr, ((ListExpression) lhs).getElements(), value);
        return;
      case DOT:
        DotExpression dot = (DotExpression) lhs;
        Object x = eval(fr, dot.getObject());
        fr.setErrorLocation(dot.getDotLocation());
        throw Model.errorf(
            "cannot set .%s field of %s value", dot.getField().getName(), Model.type(x));
      default:
        throw Model.errorf("cannot assign to '%s'", lhs);
    }
  }

  private static void unpack(ModelThread.Frame fr, List<Expression> targets, Object value)
      throws EvalException, InterruptedException {
    if (!(value instanceof List<?> elems)) {
      throw Model.errorf(
          "got '%s' in sequence assignment (want %d-element sequence)",
          Model.type(value), targets.size());
    }
    if (elems.size() != targets.size()) {
      throw Model.errorf(
          "too %s values to unpack (got %d, want %d)",
          elems.size() < targets.size() ? "few" : "many", elems.size(), targets.size());
    }
    Object[] copy = elems.toArray(); // the targets may modify the list
    for (int i = 0; i < copy.length; i++) {
      assign(fr, targets.get(i), copy[i]);
    }
  }

  private static void assignIdentifier(ModelThread.Frame fr, Identifier id, Object value) {
    Resolver.Binding bind = id.getBinding();
    switch (bind.getScope()) {
      case LOCAL:
        fr.locals[bind.getIndex()] = value;
        break;
      case FREE:
        fn(fr).enclosing.get(bind.getDepth() - 1)[bind.getIndex()] = value;
        break;
      case GLOBAL:
        fn(fr).getModule().setGlobal(bind.getName(), value);
        break;
      default:
        throw new IllegalStateException("cannot assign " + bind);
    }
  }

  /**
   * Evaluates the decorators of {@code def}, outermost first, creates the function, and applies
   * the decorators to it, innermost first. If {@code defaults} is null the function's default
   * values are evaluated, otherwise they are taken from it.
   */
  static Object evalDef(ModelThread.Frame fr, DefStatement def, @Nullable Object[] defaults)
      throws EvalException, InterruptedException {
    List<Object> decorators = new ArrayList<>();
    for (Expression d : def.getDecorators()) {
      decorators.add(eval(fr, d));
    }

    Resolver.Function rfn = def.getResolvedFunction();
    if (defaults == null) {
      defaults = new Object[rfn.getParameters().size()];
      for (int i = 0; i < defaults.length; i++) {
        Parameter param = rfn.getParameters().get(i);
        if (param.isOptional()) {
          defaults[i] = eval(fr, param.getDefaultValue());
        }
      }
    } else {
      defaults = Arrays.copyOf(defaults, defaults.length);
    }

    // A nested function sees the locals of each enclosing function, innermost first.
    ModelFunction parent = fn(fr);
    ImmutableList<Object[]> enclosing =
        parent.isToplevel()
            ? ImmutableList.of()
            : ImmutableList.<Object[]>builder().add(fr.locals).addAll(parent.enclosing).build();
    Object result = new ModelFunction(rfn, parent.getModule(), defaults, enclosing);

    for (int i = decorators.size() - 1; i >= 0; i--) {
      Location loc = def.getDecorators().get(i).getStartLocation();
      fr.setLocation(loc);
      try {
        result =
            Model.call(fr.thread, decorators.get(i), ImmutableList.of(result), ImmutableMap.of());
      } catch (EvalException ex) {
        fr.setErrorLocation(loc);
        throw ex;
      }
    }
    return result;
  }

  // ---- expressions ----

  static Object eval(ModelThread.Frame fr, Expression expr)
      throws EvalException, InterruptedException {
    step(fr);
    switch (expr.kind()) {
      case LITERAL:
        return ((Literal) expr).getValue();
      case IDENTIFIER:
        return evalIdentifier(fr, (Identifier) expr);
      case BINARY_OPERATOR:
        return evalBinary(fr, (BinaryOperatorExpression) expr);
      case UNARY_OPERATOR:
        UnaryOperatorExpression unop = (UnaryOperatorExpression) expr;
        Object x = eval(fr, unop.getX());
        try {
          return EvalUtils.unaryOp(unop.getOperator(), x);
        } catch (EvalException ex) {
          fr.setErrorLocation(unop.getStartLocation());
          throw ex;
        }
      case CALL:
        return evalCall(fr, (CallExpression) expr);
      case DOT:
        DotExpression dot = (DotExpression) expr;
        Object object = eval(fr, dot.getObject());
        try {
          return EvalUtils.getAttr(object, dot.getField().getName());
        } catch (EvalException ex) {
          fr.setErrorLocation(dot.getDotLocation());
          throw ex;
        }
      case INDEX:
        IndexExpression index = (IndexExpression) expr;
        Object seq = eval(fr, index.getObject());
        Object key = eval(fr, index.getKey());
        try {
          return EvalUtils.index(seq, key);
        } catch (EvalException ex) {
          fr.setErrorLocation(index.getLocation());
          throw ex;
        }
      case LIST:
        ListExpression list = (ListExpression) expr;
        Object[] elems = new Object[list.getElements().size()];
        for (int i = 0; i < elems.length; i++) {
          elems[i] = eval(fr, list.getElements().get(i));
        }
        return list.isTuple() ? Tuple.wrap(elems) : new ArrayList<>(Arrays.asList(elems));
      case YIELD:
        // Only Coroutine executes yield.
        fr.setErrorLocation(expr.getStartLocation());
        throw Model.errorf("'yield' is not allowed here");
    }
    throw new IllegalStateException(expr.kind().toString());
  }

  private static Object evalIdentifier(ModelThread.Frame fr, Identifier id) throws EvalException {
    Resolver.Binding bind = id.getBinding();
    Object value;
    switch (bind.getScope()) {
      case LOCAL:
        value = fr.locals[bind.getIndex()];
        break;
      case FREE:
        value = fn(fr).enclosing.get(bind.getDepth() - 1)[bind.getIndex()];
        break;
      default:
        value = fn(fr).getModule().get(bind.getName());
        break;
    }
    if (value == null) {
      fr.setErrorLocation(id.getStartLocation());
      throw Model.errorf(
          "%s variable '%s' is referenced before assignment.", bind.getScope(), bind.getName());
    }
    return value;
  }

  private static Object evalBinary(ModelThread.Frame fr, BinaryOperatorExpression binop)
      throws EvalException, InterruptedException {
    Object x = eval(fr, binop.getX());
    if (binop.getOperator() == Operator.AND) {
      return Model.truth(x) ? eval(fr, binop.getY()) : x;
    } else if (binop.getOperator() == Operator.OR) {
      return Model.truth(x) ? x : eval(fr, binop.getY());
    }
    Object y = eval(fr, binop.getY());
    try {
      return EvalUtils.binaryOp(binop.getOperator(), x, y);
    } catch (EvalException ex) {
      fr.setErrorLocation(binop.getLocation());
      throw ex;
    }
  }

  private static Object evalCall(ModelThread.Frame fr, CallExpression call)
      throws EvalException, InterruptedException {
    fr.thread.checkInterrupt();
    Object fn = eval(fr, call.getFunction());

    // Arguments are evaluated left to right; the resolver has checked that keywords come last.
    List<Object> positional = new ArrayList<>();
    Map<String, Object> named = new LinkedHashMap<>();
    for (Argument arg : call.getArguments()) {
      Object value = eval(fr, arg.getValue());
      if (arg.isPositional()) {
        positional.add(value);
      } else {
        named.put(arg.getName(), value);
      }
    }

    Location loc = call.getLparenLocation();
    fr.setLocation(loc);
    try {
      return Model.call(fr.thread, fn, positional, named);
    } catch (EvalException ex) {
      fr.setErrorLocation(loc);
      throw ex;
    }
  }
}
