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

import com.google.common.base.Strings;
import com.google.common.collect.Iterables;
import com.google.common.math.IntMath;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.modelscript.java.syntax.Operator;

/** The semantics of the operators on values: arithmetic, comparison, indexing, attributes. */
final class EvalUtils {

  private EvalUtils() {}

  static String type(Object x) {
    if (x instanceof ModelValue value) {
      return value.typeName();
    } else if (x instanceof String) {
      return "string";
    } else if (x instanceof Integer) {
      return "int";
    } else if (x instanceof Double) {
      return "float";
    } else if (x instanceof Boolean) {
      return "bool";
    } else if (x instanceof List) {
      return "list";
    }
    return x.getClass().getSimpleName();
  }

  static boolean truth(Object x) {
    if (x instanceof Boolean b) {
      return b;
    } else if (x instanceof ModelValue value) {
      return value.truth();
    } else if (x instanceof Number n) {
      return n.doubleValue() != 0;
    } else if (x instanceof String s) {
      return !s.isEmpty();
    } else if (x instanceof List<?> list) {
      return !list.isEmpty();
    }
    throw new IllegalArgumentException("not a ModelScript value: " + x.getClass());
  }

  /** Returns the length of a string, list or tuple, or -1 for other values. */
  static int len(Object x) {
    if (x instanceof String s) {
      return s.length();
    } else if (x instanceof List<?> list) {
      return list.size();
    }
    return -1;
  }

  /** Returns a copy of the elements of a list or tuple, so a loop may mutate the original. */
  static Object[] toArray(Object x) throws EvalException {
    if (x instanceof List<?> list) {
      return list.toArray();
    }
    throw Model.errorf("type '%s' is not iterable", type(x));
  }

  static int toInt(Object x, String what) throws EvalException {
    if (x instanceof Integer i) {
      return i;
    }
    throw Model.errorf("got %s for %s, want int", type(x), what);
  }

  static double toDouble(Object x, String what) throws EvalException {
    if (isNumber(x)) {
      return ((Number) x).doubleValue();
    }
    throw Model.errorf("got %s for %s, want float or int", type(x), what);
  }

  /** Maps a possibly negative index into [0, length), counting negative indices from the end. */
  static int getSequenceIndex(int index, int length) throws EvalException {
    int i = index < 0 ? index + length : index;
    if (i < 0 || i >= length) {
      throw Model.errorf(
          "index out of range (index is %d, but sequence has %d elements)", index, length);
    }
    return i;
  }

  // ---- equality and ordering ----

  /** Numbers compare by value across int and float; a list never equals a tuple. */
  static boolean equal(Object x, Object y) {
    if (x == y) {
      return true;
    } else if (isNumber(x) && isNumber(y)) {
      return x instanceof Integer && y instanceof Integer
          ? x.equals(y)
          : ((Number) x).doubleValue() == ((Number) y).doubleValue();
    } else if (x instanceof List<?> xs && y instanceof List<?> ys) {
      if ((x instanceof Tuple) != (y instanceof Tuple) || xs.size() != ys.size()) {
        return false;
      }
      for (int i = 0; i < xs.size(); i++) {
        if (!equal(xs.get(i), ys.get(i))) {
          return false;
        }
      }
      return true;
    }
    return x.equals(y);
  }

  static int compare(Object x, Object y) throws EvalException {
    if (x instanceof Integer i && y instanceof Integer j) {
      return Integer.compare(i, j);
    } else if (isNumber(x) && isNumber(y)) {
      return Double.compare(((Number) x).doubleValue(), ((Number) y).doubleValue());
    } else if (x instanceof String s && y instanceof String t) {
      return s.compareTo(t);
    } else if (x instanceof List<?> xs
        && y instanceof List<?> ys
        && (x instanceof Tuple) == (y instanceof Tuple)) {
      // lexicographic
      int n = Math.min(xs.size(), ys.size());
      for (int i = 0; i < n; i++) {
        if (!equal(xs.get(i), ys.get(i))) {
          return compare(xs.get(i), ys.get(i));
        }
      }
      return Integer.compare(xs.size(), ys.size());
    }
    throw Model.errorf("unsupported comparison: %s <=> %s", type(x), type(y));
  }

  // ---- operators ----

  /** Applies a binary operator other than {@code and} and {@code or}. */
  static Object binaryOp(Operator op, Object x, Object y) throws EvalException {
    switch (op) {
      case EQ:
        return equal(x, y);
      case NE:
        return !equal(x, y);
      case LT:
        return compare(x, y) < 0;
      case LE:
        return compare(x, y) <= 0;
      case GT:
        return compare(x, y) > 0;
      case GE:
        return compare(x, y) >= 0;
      case IN:
        return contains(y, x);
      case NOT_IN:
        return !contains(y, x);
      default:
        break;
    }
    Object z;
    if (x instanceof Integer i && y instanceof Integer j) {
      z = intOp(op, i, j);
    } else if (isNumber(x) && isNumber(y)) {
      z = floatOp(op, ((Number) x).doubleValue(), ((Number) y).doubleValue());
    } else {
      z = sequenceOp(op, x, y);
    }
    if (z == null) {
      throw Model.errorf("unsupported binary operation: %s %s %s", type(x), op, type(y));
    }
    return z;
  }

  private static Object intOp(Operator op, int x, int y) throws EvalException {
    try {
      switch (op) {
        case PLUS:
          return Math.addExact(x, y);
        case MINUS:
          return Math.subtractExact(x, y);
        case STAR:
          return Math.multiplyExact(x, y);
        case SLASH:
          return floatOp(op, x, y);
        case SLASH_SLASH:
          if (y == 0) {
            throw Model.errorf("integer division by zero");
          }
          if (x == Integer.MIN_VALUE && y == -1) {
            throw Model.errorf("integer overflow");
          }
          return Math.floorDiv(x, y);
        case PERCENT:
          if (y == 0) {
            throw Model.errorf("integer modulo by zero");
          }
          return Math.floorMod(x, y);
        case POW:
          return y < 0 ? floatOp(op, x, y) : IntMath.checkedPow(x, y);
        default:
          return null;
      }
    } catch (ArithmeticException ex) {
      throw Model.errorf("integer overflow");
    }
  }

  private static Object floatOp(Operator op, double x, double y) throws EvalException {
    switch (op) {
      case PLUS:
        return x + y;
      case MINUS:
        return x - y;
      case STAR:
        return x * y;
      case SLASH:
        if (y == 0) {
          throw Model.errorf("floating-point division by zero");
        }
        return x / y;
      case SLASH_SLASH:
        if (y == 0) {
          throw Model.errorf("floating-point division by zero");
        }
        return Math.floor(x / y);
      case PERCENT:
        if (y == 0) {
          throw Model.errorf("floating-point modulo by zero");
        }
        double r = x % y;
        return r != 0 && (r < 0) != (y < 0) ? r + y : r; // sign of the divisor
      case POW:
        if (x == 0 && y < 0) {
          throw Model.errorf("zero cannot be raised to a negative power");
        }
        return Math.pow(x, y);
      default:
        return null;
    }
  }

  // Concatenation and repetition of strings, lists and tuples.
  private static Object sequenceOp(Operator op, Object x, Object y) {
    if (op == Operator.PLUS) {
      if (x instanceof String s && y instanceof String t) {
        return s + t;
      } else if (x instanceof Tuple s && y instanceof Tuple t) {
        return Tuple.concat(s, t);
      } else if (isList(x) && isList(y)) {
        ArrayList<Object> z = new ArrayList<>((List<?>) x);
        z.addAll((List<?>) y);
        return z;
      }
    } else if (op == Operator.STAR) {
      if (y instanceof Integer n) {
        return repeat(x, n);
      } else if (x instanceof Integer n) {
        return repeat(y, n);
      }
    }
    return null;
  }

  private static Object repeat(Object x, int n) {
    if (x instanceof String s) {
      return Strings.repeat(s, Math.max(n, 0));
    } else if (isList(x)) {
      ArrayList<Object> z = new ArrayList<>();
      Iterables.addAll(z, Iterables.concat(Collections.nCopies(Math.max(n, 0), (List<?>) x)));
      return z;
    }
    return null;
  }

  private static boolean contains(Object y, Object x) throws EvalException {
    if (y instanceof String s) {
      if (!(x instanceof String sub)) {
        throw Model.errorf("'in <string>' requires string as left operand, not '%s'", type(x));
      }
      return s.contains(sub);
    } else if (y instanceof List<?> list) {
      for (Object elem : list) {
        if (equal(x, elem)) {
          return true;
        }
      }
      return false;
    }
    throw Model.errorf("unsupported binary operation: %s in %s", type(x), type(y));
  }

  /** Applies {@code not}, unary minus or unary plus. */
  static Object unaryOp(Operator op, Object x) throws EvalException {
    if (op == Operator.NOT) {
      return !truth(x);
    }
    if (x instanceof Integer i) {
      if (op == Operator.PLUS) {
        return i;
      }
      if (i == Integer.MIN_VALUE) {
        throw Model.errorf("integer overflow");
      }
      return -i;
    } else if (x instanceof Double d) {
      return op == Operator.PLUS ? d : -d;
    }
    throw Model.errorf("unsupported unary operation: %s%s", op, type(x));
  }

  // ---- indexing and attributes ----

  static Object index(Object x, Object key) throws EvalException {
    if (x instanceof List<?> list) {
      return list.get(getSequenceIndex(toInt(key, type(x) + " index"), list.size()));
    } else if (x instanceof String s) {
      int i = getSequenceIndex(toInt(key, "string index"), s.length());
      return s.substring(i, i + 1);
    }
    throw Model.errorf("type '%s' has no operator [](%s)", type(x), type(key));
  }

  static void setIndex(Object x, Object key, Object value) throws EvalException {
    if (!isList(x)) {
      throw Model.errorf("can only assign an element in a list, not in a '%s'", type(x));
    }
    @SuppressWarnings("unchecked")
    List<Object> list = (List<Object>) x;
    list.set(getSequenceIndex(toInt(key, "list index"), list.size()), value);
  }

  /** Returns the field or method {@code name} of x. */
  static Object getAttr(Object x, String name) throws EvalException {
    if (x instanceof HasFields struct) {
      Object field = struct.getField(name);
      if (field != null) {
        return field;
      }
      String error = struct.getErrorMessageForUnknownField(name);
      if (error != null) {
        throw new EvalException(error);
      }
    } else {
      BuiltinFunction method = MethodLibrary.getMethod(x, name);
      if (method != null) {
        return method;
      }
    }
    throw Model.errorf("'%s' value has no field or method '%s'", type(x), name);
  }

  private static boolean isNumber(Object x) {
    return x instanceof Integer || x instanceof Double;
  }

  private static boolean isList(Object x) {
    return x instanceof List && !(x instanceof Tuple);
  }
}
