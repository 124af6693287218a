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

import com.google.common.base.Preconditions;
import java.util.ArrayDeque;
import java.util.List;
import javax.annotation.Nullable;
import net.modelscript.java.syntax.AssignmentStatement;
import net.modelscript.java.syntax.Expression;
import net.modelscript.java.syntax.ExpressionStatement;
import net.modelscript.java.syntax.FlowStatement;
import net.modelscript.java.syntax.ForStatement;
import net.modelscript.java.syntax.IfStatement;
import net.modelscript.java.syntax.ReturnStatement;
import net.modelscript.java.syntax.Statement;
import net.modelscript.java.syntax.YieldExpression;

/**
 * A Coroutine is a suspendable activation of a ModelScript function.
 *
 * <p>A coroutine is created, without executing any part of the function body, by calling a
 * function whose body contains {@code yield}, or by {@link ModelFunction#newCoroutine}. Each call
 * to {@link #resume} runs the body until the next suspension point or until the body finishes:
 *
 * <ul>
 *   <li>At {@code yield e}, the coroutine suspends, producing the value of {@code e}. The value
 *       supplied to the following resume becomes the value of the yield expression.
 *   <li>At {@code yield from c}, where {@code c} is another coroutine, that coroutine is run in
 *       place: each of its suspensions is a suspension of this coroutine, and each resume is
 *       forwarded to it. When it finishes, its result becomes the value of the yield expression.
 *   <li>When the body returns, the coroutine is done, and the step carries the returned value.
 * </ul>
 *
 * <p>A yield may appear only as an expression statement or as the entire right-hand side of an
 * ordinary assignment, so a suspension point always lies between two statements of a block. The
 * coroutine therefore records its position as a stack of block cursors rather than as a Java stack,
 * and holds no resources while suspended.
 *
 * <p>Coroutines are not thread-safe; each must be confined to a single ModelThread at a time.
 */
public final class Coroutine implements ModelValue {

  /** The lifecycle state of a coroutine. */
  public enum State {
    /** Created but not yet resumed. */
    CREATED,
    /** Paused at a suspension point. */
    SUSPENDED,
    /** Currently executing within a call to resume. */
    RUNNING,
    /** The body has returned or failed. */
    DONE
  }

  /** The outcome of a single {@link #resume}: either a yielded value or the final result. */
  public static final class Step {
    private final boolean done;
    private final Object value;

    private Step(boolean done, Object value) {
      this.done = done;
      this.value = Preconditions.checkNotNull(value);
    }

    static Step yielded(Object value) {
      return new Step(false, value);
    }

    static Step done(Object result) {
      return new Step(true, result);
    }

    /** Reports whether the coroutine finished, in which case the value is its result. */
    public boolean isDone() {
      return done;
    }

    /** Returns the yielded value, or the result if {@link #isDone}. */
    public Object getValue() {
      return value;
    }

    @Override
    public String toString() {
      return (done ? "done(" : "yielded(") + Model.repr(value) + ")";
    }
  }

  // A position within a block of statements. A cursor for the body of a
  // for loop also holds the loop's snapshot of elements.
  private static final class Cursor {
    final List<Statement> block;
    int index;
    @Nullable final ForStatement loop;
    @Nullable final Object[] elems;
    int next; // index of the next loop element

    Cursor(List<Statement> block) {
      this.block = block;
      this.loop = null;
      this.elems = null;
    }

    Cursor(ForStatement loop, Object[] elems) {
      this.block = loop.getBody();
      this.index = block.size(); // the first element must be assigned before the body runs
      this.loop = loop;
      this.elems = elems;
    }
  }

  private final ModelFunction fn;
  private final Object[] locals;
  private final ArrayDeque<Cursor> cursors = new ArrayDeque<>();
  private State state = State.CREATED;

  // The statement containing the yield at which the coroutine is suspended, if any.
  @Nullable private Statement pending;

  // The coroutine to which resumes are forwarded, during 'yield from'.
  @Nullable private Coroutine delegate;

  Coroutine(ModelFunction fn, Object[] locals) {
    this.fn = fn;
    this.locals = locals;
    cursors.push(new Cursor(fn.rfn.getBody()));
  }

  /** Returns the function whose body this coroutine executes. */
  public ModelFunction getFunction() {
    return fn;
  }

  /** Returns the current state of this coroutine. */
  public State getState() {
    return state;
  }

  /** Reports whether the coroutine has finished. */
  public boolean isDone() {
    return state == State.DONE;
  }

  /**
   * Runs the coroutine until its next suspension point, or until its body returns.
   *
   * @param thread the thread in which to execute the body. A frame for the function is pushed on
   *     its call stack for the duration of the call.
   * @param sent the value of the pending yield expression. It must be null or None on the first
   *     resume.
   * @throws EvalException if the body fails, or the coroutine is already running. A coroutine that
   *     fails is done.
   * @throws IllegalStateException if the coroutine is already done.
   */
  public Step resume(ModelThread thread, @Nullable Object sent)
      throws EvalException, InterruptedException {
    switch (state) {
      case DONE:
        throw new IllegalStateException("coroutine " + fn.getName() + " has already finished");
      case RUNNING:
        throw Model.errorf("coroutine %s is already running", fn.getName());
      case CREATED:
        if (sent != null && sent != Model.NONE) {
          throw Model.errorf(
              "can't send non-None value to a just-started coroutine %s", fn.getName());
        }
        break;
      case SUSPENDED:
        break;
    }
    if (sent == null) {
      sent = Model.NONE;
    }

    state = State.RUNNING;
    boolean done = true; // unless suspended
    ModelThread.Frame fr = thread.push(fn);
    try {
      fr.locals = locals;
      fr.thread.checkInterrupt();
      Step step = run(fr, sent);
      done = step.isDone();
      return step;
    } catch (EvalException ex) {
      throw ex.ensureStack(thread);
    } finally {
      thread.pop();
      state = done ? State.DONE : State.SUSPENDED;
      if (done) {
        cursors.clear();
        pending = null;
        delegate = null;
      }
    }
  }

  private Step run(ModelThread.Frame fr, Object sent) throws EvalException, InterruptedException {
    // Complete the suspended statement.
    if (delegate != null) {
      fr.setLocation(pending.getStartLocation());
      Step step = delegate.resume(fr.thread, sent);
      if (!step.isDone()) {
        return step;
      }
      delegate = null;
      sent = step.getValue();
    }
    if (pending != null) {
      complete(fr, sent);
    }

    while (!cursors.isEmpty()) {
      Cursor c = cursors.peek();
      if (c.index >= c.block.size()) {
        if (c.loop != null && c.next < c.elems.length) {
          // next loop iteration
          fr.thread.checkInterrupt();
          assign(fr, c.loop, c.loop.getTarget(), c.elems[c.next++]);
          c.index = 0;
        } else {
          cursors.pop();
        }
        continue;
      }

      Statement st = c.block.get(c.index++);
      switch (st.kind()) {
        case IF:
          {
            Eval.step(fr);
            IfStatement ifStmt = (IfStatement) st;
            if (Model.truth(Eval.eval(fr, ifStmt.getCondition()))) {
              cursors.push(new Cursor(ifStmt.getThenBlock()));
            } else if (ifStmt.getElseBlock() != null) {
              cursors.push(new Cursor(ifStmt.getElseBlock()));
            }
            continue;
          }

        case FOR:
          {
            Eval.step(fr);
            ForStatement forStmt = (ForStatement) st;
            cursors.push(new Cursor(forStmt, Eval.iterate(fr, forStmt)));
            continue;
          }

        case FLOW:
          Eval.step(fr);
          switch (((FlowStatement) st).getJump()) {
            case BREAK:
              // Pop through the innermost loop.
              Cursor popped;
              do {
                popped = cursors.pop();
              } while (popped.loop == null);
              break;
            case CONTINUE:
              // Pop to the innermost loop and advance it.
              while (cursors.peek().loop == null) {
                cursors.pop();
              }
              Cursor loop = cursors.peek();
              loop.index = loop.block.size();
              break;
            default: // pass
          }
          continue;

        case RETURN:
          {
            Eval.step(fr);
            Expression result = ((ReturnStatement) st).getResult();
            return Step.done(result == null ? Model.NONE : Eval.eval(fr, result));
          }

        case ASSIGNMENT:
        case EXPRESSION:
          YieldExpression yield = yieldOf(st);
          if (yield != null) {
            Eval.step(fr);
            Step step = suspend(fr, st, yield);
            if (step != null) {
              return step;
            }
            continue;
          }
          break;

        case DEF:
          break;
      }

      // A statement without a suspension point.
      Eval.exec(fr, st);
    }
    return Step.done(Model.NONE);
  }

  // Returns the yield expression of a statement that is a suspension point, or null.
  @Nullable
  private static YieldExpression yieldOf(Statement st) {
    Expression e;
    if (st instanceof AssignmentStatement) {
      e = ((AssignmentStatement) st).getRHS();
    } else if (st instanceof ExpressionStatement) {
      e = ((ExpressionStatement) st).getExpression();
    } else {
      return null;
    }
    return e instanceof YieldExpression ? (YieldExpression) e : null;
  }

  // Evaluates the operand of a yield and suspends, returning the step to produce.
  // Returns null if a delegate finished without suspending, in which case the
  // statement has been completed.
  @Nullable
  private Step suspend(ModelThread.Frame fr, Statement st, YieldExpression yield)
      throws EvalException, InterruptedException {
    Object value = Eval.eval(fr, yield.getValue());
    pending = st;
    if (!yield.isDelegating()) {
      return Step.yielded(value);
    }

    if (!(value instanceof Coroutine)) {
      fr.setErrorLocation(yield.getStartLocation());
      throw Model.errorf("'yield from' requires a coroutine, got %s", Model.type(value));
    }
    Coroutine co = (Coroutine) value;
    if (co.state != State.CREATED) {
      fr.setErrorLocation(yield.getStartLocation());
      throw Model.errorf("'yield from' requires a coroutine that has not yet started");
    }
    Step step;
    fr.setLocation(yield.getStartLocation());
    try {
      step = co.resume(fr.thread, null);
    } catch (EvalException ex) {
      fr.setErrorLocation(yield.getStartLocation());
      throw ex;
    }
    if (!step.isDone()) {
      delegate = co;
      return step;
    }
    complete(fr, step.getValue());
    return null;
  }

  // Completes the pending statement, using the given value as that of its yield expression.
  private void complete(ModelThread.Frame fr, Object value)
      throws EvalException, InterruptedException {
    Statement st = pending;
    pending = null;
    if (st instanceof AssignmentStatement) {
      AssignmentStatement assignment = (AssignmentStatement) st;
      assign(fr, assignment, assignment.getLHS(), value);
    }
  }

  private static void assign(ModelThread.Frame fr, Statement st, Expression lhs, Object value)
      throws EvalException, InterruptedException {
    try {
      Eval.assign(fr, lhs, value);
    } catch (EvalException ex) {
      fr.setErrorLocation(st.getStartLocation());
      throw ex;
    }
  }

  @Override
  public String typeName() {
    return "coroutine";
  }

  @Override
  public void repr(Printer printer) {
    printer.append("<coroutine " + fn.getName() + ">");
  }

  @Override
  public String toString() {
    return Model.repr(this);
  }
}
