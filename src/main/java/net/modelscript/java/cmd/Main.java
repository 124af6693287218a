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
package net.modelscript.java.cmd;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import net.modelscript.java.eval.EvalException;
import net.modelscript.java.eval.Model;
import net.modelscript.java.eval.ModelSemantics;
import net.modelscript.java.eval.ModelThread;
import net.modelscript.java.eval.Module;
import net.modelscript.java.model.Driver;
import net.modelscript.java.model.ModelEnvironment;
import net.modelscript.java.model.ModelHandle;
import net.modelscript.java.model.RunResult;
import net.modelscript.java.syntax.FileOptions;
import net.modelscript.java.syntax.ParserInput;
import net.modelscript.java.syntax.SyntaxError;

/**
 * Main executes a ModelScript file and runs one of the models it declares, printing the value of
 * each stochastic node and the result of each run.
 */
class Main {

  static final String USAGE =
      "usage: modelscript [--entry=NAME] [--seed=N] [--observe=NAME=EXPR]... [--arg=EXPR]..."
          + " [--runs=N] [--print_rewritten] [--pass_through_unsupported_assignments]"
          + " [--verbose] FILE";

  private static final FileOptions OPTIONS = FileOptions.DEFAULT;

  // Held so that the configured level is not lost to garbage collection.
  private static final Logger rootLogger = Logger.getLogger("net.modelscript");

  /** A UsageException reports a malformed command line. */
  private static final class UsageException extends Exception {
    UsageException(String message) {
      super(message);
    }
  }

  private final PrintStream out;
  private final PrintStream err;

  // flags
  private String entry = "main";
  @Nullable private Long seed;
  private int runs = 1;
  private boolean printRewritten;
  private boolean passThroughUnsupported;
  private boolean verbose;
  private final Map<String, String> observe = new LinkedHashMap<>();
  private final List<String> argExprs = new ArrayList<>();
  @Nullable private String file;

  private Main(PrintStream out, PrintStream err) {
    this.out = out;
    this.err = err;
  }

  private void parseFlags(String[] args) throws UsageException {
    int i;
    for (i = 0; i < args.length; i++) {
      String arg = args[i];
      if (!arg.startsWith("-")) {
        break;
      }
      if (arg.equals("--")) {
        i++;
        break;
      }
      int eq = arg.indexOf('=');
      String name = eq < 0 ? arg : arg.substring(0, eq);
      String value = eq < 0 ? null : arg.substring(eq + 1);
      switch (name) {
        case "--entry":
          entry = requireValue(name, value);
          break;
        case "--seed":
          seed = parseLong(name, requireValue(name, value));
          break;
        case "--runs":
          long n = parseLong(name, requireValue(name, value));
          if (n < 1 || n > Integer.MAX_VALUE) {
            throw new UsageException("--runs must be a positive integer, got " + n);
          }
          runs = (int) n;
          break;
        case "--observe":
          String binding = requireValue(name, value);
          int sep = binding.indexOf('=');
          if (sep <= 0) {
            throw new UsageException("--observe wants NAME=EXPR, got " + binding);
          }
          observe.put(binding.substring(0, sep), binding.substring(sep + 1));
          break;
        case "--arg":
          argExprs.add(requireValue(name, value));
          break;
        case "--print_rewritten":
          printRewritten = noValue(name, value);
          break;
        case "--pass_through_unsupported_assignments":
          passThroughUnsupported = noValue(name, value);
          break;
        case "--verbose":
          verbose = noValue(name, value);
          break;
        default:
          throw new UsageException("unknown flag: " + arg);
      }
    }

    // positional arguments
    if (i == args.length) {
      throw new UsageException("no file specified");
    }
    if (i + 1 < args.length) {
      throw new UsageException("too many positional arguments");
    }
    file = args[i];
  }

  private static String requireValue(String flag, String value) throws UsageException {
    if (value == null) {
      throw new UsageException(flag + " flag needs a value");
    }
    return value;
  }

  private static boolean noValue(String flag, String value) throws UsageException {
    if (value != null) {
      throw new UsageException(flag + " flag takes no value");
    }
    return true;
  }

  private static long parseLong(String flag, String value) throws UsageException {
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      throw new UsageException(flag + " wants an integer, got " + value);
    }
  }

  private int execute() {
    if (verbose) {
      rootLogger.setLevel(Level.FINE);
      ConsoleHandler handler = new ConsoleHandler();
      handler.setLevel(Level.FINE);
      rootLogger.addHandler(handler);
    }

    ParserInput input;
    try {
      input = ParserInput.readFile(file);
    } catch (IOException e) {
      err.format("Error reading %s: %s\n", file, e);
      return 1;
    }

    ModelSemantics semantics =
        ModelSemantics.builder()
            .passThroughUnsupportedAssignments(passThroughUnsupported)
            .build();
    Module module = ModelEnvironment.newModule();
    ModelThread thread = new ModelThread(semantics);
    thread.setPrintHandler((th, msg) -> out.println(msg));

    try {
      Model.execFile(input, OPTIONS, module, thread);

      Object value = module.getGlobal(entry);
      if (!(value instanceof ModelHandle)) {
        err.format(
            "%s: %s is not a model (got %s)\n",
            file, entry, value == null ? "nothing" : Model.type(value));
        return 1;
      }
      ModelHandle model = (ModelHandle) value;
      if (printRewritten) {
        out.println(model.getRewrittenText());
      }

      Map<String, Object> observations = new LinkedHashMap<>();
      for (Map.Entry<String, String> e : observe.entrySet()) {
        observations.put(e.getKey(), evalFlag("--observe " + e.getKey(), e.getValue(), module));
      }
      ImmutableList.Builder<Object> positional = ImmutableList.builder();
      for (String expr : argExprs) {
        positional.add(evalFlag("--arg", expr, module));
      }

      Driver.Builder driver =
          Driver.builder().setObservations(observations).setSemantics(semantics);
      if (seed != null) {
        Random random = new Random(seed); // shared by all runs
        driver.setRandom(() -> random);
      }
      Driver d = driver.build();

      for (int i = 0; i < runs; i++) {
        if (runs > 1) {
          out.format("run %d:\n", i + 1);
        }
        RunResult result = d.run(model, positional.build(), ImmutableMap.of());
        for (Map.Entry<String, Object> e : result.getState().getValues().entrySet()) {
          out.format(
              "%s = %s (%s)\n",
              e.getKey(),
              Model.repr(e.getValue()),
              result.getState().isObserved(e.getKey()) ? "observed" : "drawn");
        }
        out.format("result = %s\n", Model.repr(result.getResult()));
      }
      return 0;
    } catch (SyntaxError.Exception ex) {
      for (SyntaxError error : ex.errors()) {
        err.println(error);
      }
      return 1;
    } catch (EvalException ex) {
      err.println(ex.getMessageWithStack());
      return 1;
    } catch (InterruptedException e) {
      err.println("Interrupted");
      return 1;
    }
  }

  // Evaluates the expression given by a flag, in the module of the file.
  private Object evalFlag(String flag, String expr, Module module)
      throws SyntaxError.Exception, EvalException, InterruptedException {
    ParserInput input = ParserInput.fromString(expr, "<" + flag + ">");
    return Model.eval(input, module, new ModelThread(ModelSemantics.DEFAULT));
  }

  /** Runs the command with the given arguments, and returns its exit status. */
  static int run(String[] args, PrintStream out, PrintStream err) {
    Main main = new Main(out, err);
    try {
      main.parseFlags(args);
    } catch (UsageException ex) {
      err.println(ex.getMessage());
      err.println(USAGE);
      return 2;
    }
    return main.execute();
  }

  public static void main(String[] args) {
    System.exit(run(args, System.out, System.err));
  }
}
