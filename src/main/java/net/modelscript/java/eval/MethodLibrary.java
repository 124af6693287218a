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

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import javax.annotation.Nullable;
import net.modelscript.java.syntax.Operator;

/** The universal built-in functions of ModelScript, and the methods of its core data types. */
final class MethodLibrary {

  private MethodLibrary() {} // uninstantiable

  // This class must not hold static state that depends on Model,
  // whose initialization calls createUniverse.

  /** Returns the bindings of the universe: None, True, False and the built-in functions. */
  static ImmutableMap<String, Object> createUniverse() {
    ImmutableMap.Builder<String, Object> env = ImmutableMap.builder();
    env.put("None", NoneType.NONE);
    env.put("True", true);
    env.put("False", false);
    for (BuiltinFunction fn :
        Arrays.asList(
            abs(), bool(), exp(), floatFn(), intFn(), len(), list(), log(), max(), min(), print(),
            range(), repr(), sqrt(), str(), sum(), tuple(), type())) {
      env.put(fn.getName(), fn);
    }
    return env.buildOrThrow();
  }

  private static BuiltinFunction abs() {
    return BuiltinFunction.builder("abs")
        .param("x")
        .doc("Returns the absolute value of a number.")
        .build(
            (thread, args) -> {
              Object x = args[0];
              if (x instanceof Integer) {
                int i = (Integer) x;
                if (i == Integer.MIN_VALUE) {
                  throw Model.errorf("integer overflow");
                }
                return Math.abs(i);
              } else if (x instanceof Double) {
                return Math.abs((Double) x);
              }
              throw Model.errorf("got %s for abs(), want int or float", EvalUtils.type(x));
            });
  }

  private static BuiltinFunction bool() {
    return BuiltinFunction.builder("bool")
        .optional("x", false)
        .doc("Returns the truth value of x.")
        .build((thread, args) -> EvalUtils.truth(args[0]));
  }

  private static BuiltinFunction intFn() {
    return BuiltinFunction.builder("int")
        .param("x")
        .doc("Converts a number or string to an int, truncating floats towards zero.")
        .build(
            (thread, args) -> {
              Object x = args[0];
              if (x instanceof Boolean) {
                return ((Boolean) x) ? 1 : 0;
              } else if (x instanceof Integer) {
                return x;
              } else if (x instanceof Double) {
                double d = (Double) x;
                if (Double.isNaN(d) || Double.isInfinite(d)) {
                  throw Model.errorf("cannot convert float %s to int", Printer.formatDouble(d));
                }
                if (d >= 0x1p31 || d < -0x1p31) {
                  throw Model.errorf("integer overflow");
                }
                return (int) d;
              } else if (x instanceof String) {
                try {
                  return Integer.parseInt(((String) x).trim());
                } catch (NumberFormatException ex) {
                  throw Model.errorf("invalid literal for int(): %s", Model.repr(x));
                }
              }
              throw Model.errorf(
                  "got %s for int(), want string, int, float or bool", Model.type(x));
            });
  }

  private static BuiltinFunction floatFn() {
    return BuiltinFunction.builder("float")
        .optional("x", 0.0)
        .doc("Converts a number or string to a float.")
        .build(
            (thread, args) -> {
              Object x = args[0];
              if (x instanceof Boolean) {
                return ((Boolean) x) ? 1.0 : 0.0;
              } else if (x instanceof Integer) {
                return (double) (Integer) x;
              } else if (x instanceof Double) {
                return x;
              } else if (x instanceof String) {
                try {
                  return Double.parseDouble(((String) x).trim());
                } catch (NumberFormatException ex) {
                  throw Model.errorf("invalid float literal: %s", x);
                }
              }
              throw Model.errorf(
                  "got %s for float(), want string, int, float or bool", Model.type(x));
            });
  }

  private static BuiltinFunction len() {
    return BuiltinFunction.builder("len")
        .param("x")
        .doc("Returns the length of a string, list or tuple.")
        .build(
            (thread, args) -> {
              int n = EvalUtils.len(args[0]);
              if (n < 0) {
                throw Model.errorf("%s is not iterable", Model.type(args[0]));
              }
              return n;
            });
  }

  private static BuiltinFunction list() {
    return BuiltinFunction.builder("list")
        .optional("x", Tuple.empty())
        .doc("Returns a new list with the same elements as the given iterable.")
        .build((thread, args) -> new ArrayList<>(Arrays.asList(EvalUtils.toArray(args[0]))));
  }

  private static BuiltinFunction tuple() {
    return BuiltinFunction.builder("tuple")
        .optional("x", Tuple.empty())
        .doc("Returns a tuple with the same elements as the given iterable.")
        .build((thread, args) -> Tuple.wrap(EvalUtils.toArray(args[0])));
  }

  private static BuiltinFunction max() {
    return BuiltinFunction.builder("max")
        .varargs()
        .doc("Returns the largest of its arguments, or of the elements of a single iterable.")
        .build((thread, args) -> findExtreme("max", (Tuple) args[0], +1));
  }

  private static BuiltinFunction min() {
    return BuiltinFunction.builder("min")
        .varargs()
        .doc("Returns the smallest of its arguments, or of the elements of a single iterable.")
        .build((thread, args) -> findExtreme("min", (Tuple) args[0], -1));
  }

  private static Object findExtreme(String name, Tuple args, int sign) throws EvalException {
    Object[] items = args.size() == 1 ? EvalUtils.toArray(args.get(0)) : args.toArray();
    if (items.length == 0) {
      throw Model.errorf("%s() expected at least one item", name);
    }
    Object best = items[0];
    for (int i = 1; i < items.length; i++) {
      if (sign * EvalUtils.compare(items[i], best) > 0) {
        best = items[i];
      }
    }
    return best;
  }

  private static BuiltinFunction print() {
    return BuiltinFunction.builder("print")
        .varargs()
        .doc("Prints its arguments, separated by spaces, using the thread's print handler.")
        .build(
            (thread, args) -> {
              Printer p = new Printer();
              String sep = "";
              for (Object x : (Tuple) args[0]) {
                p.append(sep).str(x);
                sep = " ";
              }
              thread.getPrintHandler().print(thread, p.toString());
              return Model.NONE;
            });
  }

  private static BuiltinFunction range() {
    return BuiltinFunction.builder("range")
        .param("start_or_stop")
        .optional("stop", NoneType.NONE)
        .optional("step", 1)
        .doc("Returns a list of integers from start (inclusive) to stop (exclusive).")
        .build(
            (thread, args) -> {
              int start;
              int stop;
              if (args[1] == NoneType.NONE) {
                start = 0;
                stop = EvalUtils.toInt(args[0], "stop");
              } else {
                start = EvalUtils.toInt(args[0], "start");
                stop = EvalUtils.toInt(args[1], "stop");
              }
              int step = EvalUtils.toInt(args[2], "step");
              if (step == 0) {
                throw Model.errorf("step cannot be 0");
              }
              ArrayList<Object> result = new ArrayList<>();
              for (long i = start; step > 0 ? i < stop : i > stop; i += step) {
                result.add((int) i);
              }
              return result;
            });
  }

  private static BuiltinFunction repr() {
    return BuiltinFunction.builder("repr")
        .param("x")
        .doc("Returns the string representation of x, as it would be written in source.")
        .build((thread, args) -> Model.repr(args[0]));
  }

  private static BuiltinFunction str() {
    return BuiltinFunction.builder("str")
        .param("x")
        .doc("Returns the string form of x.")
        .build((thread, args) -> Model.str(args[0]));
  }

  private static BuiltinFunction type() {
    return BuiltinFunction.builder("type")
        .param("x")
        .doc("Returns the name of the type of x.")
        .build((thread, args) -> EvalUtils.type(args[0]));
  }

  private static BuiltinFunction sum() {
    return BuiltinFunction.builder("sum")
        .param("iterable")
        .optional("start", 0)
        .doc("Returns the sum of the elements of an iterable, added to start.")
        .build(
            (thread, args) -> {
              Object total = args[1];
              for (Object x : EvalUtils.toArray(args[0])) {
                total = EvalUtils.binaryOp(Operator.PLUS, total, x);
              }
              return total;
            });
  }

  private static BuiltinFunction sqrt() {
    return BuiltinFunction.builder("sqrt")
        .param("x")
        .doc("Returns the square root of x.")
        .build(
            (thread, args) -> {
              double x = EvalUtils.toDouble(args[0], "sqrt()");
              if (x < 0) {
                throw Model.errorf("math domain error: sqrt(%s)", Printer.formatDouble(x));
              }
              return Math.sqrt(x);
            });
  }

  private static BuiltinFunction exp() {
    return BuiltinFunction.builder("exp")
        .param("x")
        .doc("Returns e raised to the power x.")
        .build((thread, args) -> Math.exp(EvalUtils.toDouble(args[0], "exp()")));
  }

  private static BuiltinFunction log() {
    return BuiltinFunction.builder("log")
        .param("x")
        .doc("Returns the natural logarithm of x.")
        .build(
            (thread, args) -> {
              double x = EvalUtils.toDouble(args[0], "log()");
              if (x <= 0) {
                throw Model.errorf("math domain error: log(%s)", Printer.formatDouble(x));
              }
              return Math.log(x);
            });
  }

  // ---- methods ----

  /**
   * Returns the method {@code name} of value {@code x}, bound to x, or null if x has no such
   * method.
   */
  @Nullable
  static BuiltinFunction getMethod(Object x, String name) {
    if (x instanceof String) {
      return stringMethod((String) x, name);
    } else if (x instanceof ArrayList) {
      @SuppressWarnings("unchecked")
      List<Object> list = (List<Object>) x;
      return listMethod(list, name);
    }
    return null;
  }

  @Nullable
  private static BuiltinFunction listMethod(List<Object> list, String name) {
    switch (name) {
      case "append":
        return BuiltinFunction.builder(name)
            .param("x")
            .build(
                (thread, args) -> {
                  list.add(args[0]);
                  return Model.NONE;
                });
      case "extend":
        return BuiltinFunction.builder(name)
            .param("x")
            .build(
                (thread, args) -> {
                  list.addAll(Arrays.asList(EvalUtils.toArray(args[0])));
                  return Model.NONE;
                });
      case "pop":
        return BuiltinFunction.builder(name)
            .optional("i", -1)
            .build(
                (thread, args) -> {
                  int i = EvalUtils.toInt(args[0], "pop()");
                  if (list.isEmpty()) {
                    throw Model.errorf("pop from empty list");
                  }
                  return list.remove(EvalUtils.getSequenceIndex(i, list.size()));
                });
      default:
        return null;
    }
  }

  @Nullable
  private static BuiltinFunction stringMethod(String s, String name) {
    switch (name) {
      case "join":
        return BuiltinFunction.builder(name)
            .param("elements")
            .build(
                (thread, args) -> {
                  StringBuilder buf = new StringBuilder();
                  Object[] elems = EvalUtils.toArray(args[0]);
                  for (int i = 0; i < elems.length; i++) {
                    if (!(elems[i] instanceof String)) {
                      throw Model.errorf(
                          "join: in list, for element %d, got %s, want string",
                          i, Model.type(elems[i]));
                    }
                    if (i > 0) {
                      buf.append(s);
                    }
                    buf.append((String) elems[i]);
                  }
                  return buf.toString();
                });
      case "upper":
        return BuiltinFunction.builder(name).build((thread, args) -> s.toUpperCase());
      case "lower":
        return BuiltinFunction.builder(name).build((thread, args) -> s.toLowerCase());
      case "startswith":
        return BuiltinFunction.builder(name)
            .param("prefix")
            .build(
                (thread, args) -> {
                  if (!(args[0] instanceof String)) {
                    throw Model.errorf(
                        "got %s for startswith(), want string", Model.type(args[0]));
                  }
                  return s.startsWith((String) args[0]);
                });
      default:
        return null;
    }
  }
}
