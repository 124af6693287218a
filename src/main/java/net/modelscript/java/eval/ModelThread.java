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
import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import javax.annotation.Nullable;
import net.modelscript.java.syntax.Location;

/**
 * The state of one evaluation: its semantics, its stack of active calls, its step counter and
 * where {@code print} output goes.
 *
 * <p>A coroutine's frame is on the stack only while the coroutine is being resumed. A thread is
 * confined to the Java thread that uses it.
 */
public final class ModelThread {

  /** The name of the implicit function that runs the top-level statements of a file. */
  public static final String TOP_LEVEL = "<toplevel>";

  /** Receives the output of the built-in {@code print}. */
  @FunctionalInterface
  public interface PrintHandler {
    void print(ModelThread thread, String msg);
  }

  /** The name of an active call, and where in its code it is. */
  public record CallStackEntry(String name, Location location) {
    public CallStackEntry {
      Preconditions.checkNotNull(name);
      Preconditions.checkNotNull(location);
    }

    @Override
    public String toString() {
      return name + "@" + location;
    }
  }

  /** An active call. */
  static final class Frame {
    final ModelThread thread;
    final ModelCallable fn;

    // The locals of a ModelFunction call, shared with any function it defines.
    @Nullable Object[] locals;

    Object result = Model.NONE; // set by return

    private Location loc; // updated at calls and on error
    private boolean errorLocationSet;

    private Frame(ModelThread thread, ModelCallable fn) {
      this.thread = thread;
      this.fn = fn;
      this.loc = fn.getLocation();
    }

    void setLocation(Location loc) {
      this.loc = loc;
    }

    // The first error location wins, so that an error is reported at the innermost expression.
    void setErrorLocation(Location loc) {
      if (!errorLocationSet) {
        errorLocationSet = true;
        this.loc = loc;
      }
    }

    Location getLocation() {
      return loc;
    }

    @Override
    public String toString() {
      return fn.getName() + "@" + loc;
    }
  }

  private final ModelSemantics semantics;
  private final Deque<Frame> callstack = new ArrayDeque<>(); // innermost first
  private PrintHandler printHandler = (thread, msg) -> System.err.println(msg);

  long steps;
  final long stepLimit;

  /** Creates a thread. A nonzero {@link ModelSemantics#maxSteps} bounds its execution. */
  public ModelThread(ModelSemantics semantics) {
    this.semantics = semantics;
    this.stepLimit = semantics.maxSteps() > 0 ? semantics.maxSteps() : Long.MAX_VALUE;
  }

  public ModelSemantics getSemantics() {
    return semantics;
  }

  /** Returns the number of statements executed and expressions evaluated so far. */
  public long getExecutedSteps() {
    return steps;
  }

  public void setPrintHandler(PrintHandler handler) {
    this.printHandler = Preconditions.checkNotNull(handler);
  }

  PrintHandler getPrintHandler() {
    return printHandler;
  }

  void checkInterrupt() throws InterruptedException {
    if (Thread.interrupted()) {
      throw new InterruptedException();
    }
  }

  Frame push(ModelCallable fn) {
    Frame fr = new Frame(this, fn);
    callstack.push(fr);
    return fr;
  }

  void pop() {
    callstack.pop();
  }

  /** Returns the innermost frame. */
  Frame top() {
    return callstack.peek();
  }

  /**
   * Returns the location of the call that invoked the current function, or {@link
   * Location#BUILTIN} if there is no such call.
   */
  public Location getCallerLocation() {
    Iterator<Frame> it = callstack.iterator();
    if (!it.hasNext()) {
      return Location.BUILTIN;
    }
    it.next();
    return it.hasNext() ? it.next().getLocation() : Location.BUILTIN;
  }

  // Reports whether the code of fn, which is on top of the stack, is also active further down.
  // Code is compared rather than closures, so that a fresh closure cannot evade the check.
  boolean isRecursiveCall(ModelFunction fn) {
    if (semantics.allowRecursion()) {
      return false;
    }
    Iterator<Frame> it = callstack.iterator();
    it.next();
    while (it.hasNext()) {
      if (it.next().fn instanceof ModelFunction caller && caller.rfn.equals(fn.rfn)) {
        return true;
      }
    }
    return false;
  }

  /** Returns the active calls, outermost first. */
  public ImmutableList<CallStackEntry> getCallStack() {
    ImmutableList.Builder<CallStackEntry> stack =
        ImmutableList.builderWithExpectedSize(callstack.size());
    for (Iterator<Frame> it = callstack.descendingIterator(); it.hasNext(); ) {
      Frame fr = it.next();
      stack.add(new CallStackEntry(fr.fn.getName(), fr.getLocation()));
    }
    return stack.build();
  }

  @Override
  public String toString() {
    return "<ModelThread " + semantics + ">";
  }
}
