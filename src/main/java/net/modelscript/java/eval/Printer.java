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

import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Renders values as text. {@link #repr} gives the form of a value as it would be written in
 * ModelScript, where it has one; {@link #str} differs only in printing a top-level string as is.
 */
public class Printer {

  private static final Escaper ESCAPER;

  static {
    Escapers.Builder escapes =
        Escapers.builder()
            .addEscape('"', "\\\"")
            .addEscape('\\', "\\\\")
            .addEscape('\n', "\\n")
            .addEscape('\r', "\\r")
            .addEscape('\t', "\\t");
    for (char c = 0; c < ' '; c++) {
      if (c != '\n' && c != '\r' && c != '\t') {
        escapes.addEscape(c, String.format("\\x%02x", (int) c));
      }
    }
    ESCAPER = escapes.build();
  }

  private final StringBuilder buffer;

  // Compound values being printed; one met again is part of a cycle.
  private final Set<Object> active = Collections.newSetFromMap(new IdentityHashMap<>());

  public Printer(StringBuilder buffer) {
    this.buffer = buffer;
  }

  public Printer() {
    this(new StringBuilder());
  }

  @CanIgnoreReturnValue
  public final Printer append(char c) {
    buffer.append(c);
    return this;
  }

  @CanIgnoreReturnValue
  public final Printer append(CharSequence s) {
    buffer.append(s);
    return this;
  }

  /** Appends the repr of each element of {@code elems} between the given delimiters. */
  @CanIgnoreReturnValue
  public Printer printList(Iterable<?> elems, String open, String separator, String close) {
    append(open);
    String sep = "";
    for (Object elem : elems) {
      append(sep).repr(elem);
      sep = separator;
    }
    return append(close);
  }

  @CanIgnoreReturnValue
  public Printer str(Object x) {
    if (x instanceof String s) {
      return append(s);
    } else if (x instanceof ModelValue value) {
      value.str(this);
      return this;
    }
    return repr(x);
  }

  @CanIgnoreReturnValue
  public Printer repr(Object x) {
    if (x instanceof String s) {
      return append('"').append(ESCAPER.escape(s)).append('"');
    } else if (x instanceof Boolean b) {
      return append(b ? "True" : "False");
    } else if (x instanceof Integer) {
      return append(x.toString());
    } else if (x instanceof Double d) {
      return append(formatDouble(d));
    } else if (x == null) {
      return append("null"); // not a value, but partly built structures may hold it
    }

    if (!active.add(x)) {
      return append("...");
    }
    try {
      if (x instanceof ModelValue value) {
        value.repr(this);
      } else if (x instanceof List<?> list) {
        printList(list, "[", ", ", "]");
      } else {
        append(x.toString());
      }
    } finally {
      active.remove(x);
    }
    return this;
  }

  /**
   * Formats a float as Python's repr does: integral values end in {@code .0}, and exponents are
   * written {@code e+NN} or {@code e-NN}.
   */
  static String formatDouble(double d) {
    if (Double.isNaN(d)) {
      return "nan";
    }
    if (Double.isInfinite(d)) {
      return d > 0 ? "+inf" : "-inf";
    }
    if (d == Math.rint(d) && Math.abs(d) < 1e16) {
      return (long) d + ".0";
    }
    String s = Double.toString(d);
    int e = s.indexOf('E');
    if (e < 0) {
      return s;
    }
    String mantissa = s.substring(0, e);
    if (mantissa.endsWith(".0")) {
      mantissa = mantissa.substring(0, e - 2);
    }
    String exp = s.substring(e + 1);
    return mantissa + (exp.startsWith("-") ? "e" : "e+") + exp;
  }

  @Override
  public final String toString() {
    return buffer.toString();
  }
}
