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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import com.google.common.io.Files;
import java.io.File;
import java.io.IOException;
import java.util.List;
import javax.annotation.Nullable;
import net.modelscript.java.syntax.Location;

/**
 * An EvalException reports a failure during evaluation: a type error, a failed built-in, or a
 * value a model construct cannot accept.
 *
 * <p>An exception thrown out of a function call records the thread's call stack at the point it
 * was first thrown; one created by an operation on values outside any thread has none.
 */
public class EvalException extends Exception {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  @Nullable private ImmutableList<ModelThread.CallStackEntry> callstack;

  /** Constructs an EvalException. See {@link Model#errorf} for a formatting variant. */
  public EvalException(String message) {
    super(message);
  }

  /** Constructs an EvalException whose message and cause are given separately. */
  public EvalException(String message, @Nullable Throwable cause) {
    super(message, cause);
  }

  /** Constructs an EvalException that carries the message of its cause. */
  public EvalException(Throwable cause) {
    super(cause.getMessage() != null ? cause.getMessage() : cause.toString(), cause);
  }

  /** Returns the call stack at the point of failure, outermost call first, or an empty list. */
  public final ImmutableList<ModelThread.CallStackEntry> getCallStack() {
    return callstack == null ? ImmutableList.of() : callstack;
  }

  @Override
  public String toString() {
    return getMessageWithStack();
  }

  /**
   * Returns the message preceded by a traceback of the call stack, if any. Each entry is followed
   * by its source line when the file can be read.
   */
  public final String getMessageWithStack() {
    if (callstack == null || callstack.isEmpty()) {
      return getMessage();
    }
    return formatCallStack(callstack, getMessage());
  }

  static String formatCallStack(List<ModelThread.CallStackEntry> stack, String message) {
    StringBuilder buf = new StringBuilder();
    int n = stack.size();
    String prefix = "Error: ";
    // A failing built-in is named in the message instead of having its own entry.
    ModelThread.CallStackEntry top = stack.get(n - 1);
    if (top.location().equals(Location.BUILTIN)) {
      prefix = "Error in " + top.name() + ": ";
      n--;
    }
    if (n > 0) {
      buf.append("Traceback (most recent call last):\n");
      for (ModelThread.CallStackEntry e : stack.subList(0, n)) {
        buf.append("\tFile \"").append(e.location().file()).append('"');
        if (e.location().line() > 0) {
          buf.append(", line ").append(e.location().line());
          if (e.location().column() > 0) {
            buf.append(", column ").append(e.location().column());
          }
        }
        buf.append(", in ").append(e.name()).append('\n');
        String line = sourceLine(e.location());
        if (line != null) {
          buf.append("\t\t").append(line.trim()).append('\n');
        }
      }
    }
    return buf.append(prefix).append(message).toString();
  }

  @Nullable
  private static String sourceLine(Location loc) {
    File file = new File(loc.file());
    if (loc.line() <= 0 || !file.isFile()) {
      return null;
    }
    try {
      List<String> lines = Files.asCharSource(file, UTF_8).readLines();
      return loc.line() <= lines.size() ? lines.get(loc.line() - 1) : null;
    } catch (IOException ex) {
      logger.atFine().withCause(ex).log("cannot read source line for %s", loc);
      return null;
    }
  }

  // Records the thread's current call stack, unless a stack was already recorded.
  final EvalException ensureStack(ModelThread thread) {
    if (callstack == null) {
      callstack = thread.getCallStack();
    }
    return this;
  }
}
