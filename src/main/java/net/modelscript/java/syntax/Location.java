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

import com.google.common.base.Preconditions;
import javax.annotation.concurrent.Immutable;

/**
 * A Location denotes a position within a ModelScript file: a file name, a 1-based line number, and
 * a 1-based column number. A line or column of zero means "unknown".
 */
@Immutable
public record Location(String file, int line, int column) implements Comparable<Location> {

  /** The location reported for built-in functions and values. */
  public static final Location BUILTIN = new Location("<builtin>", 0, 0);

  public Location {
    Preconditions.checkNotNull(file);
  }

  /** Returns a Location for the given file, with an unknown line and column. */
  public static Location fromFile(String file) {
    return new Location(file, 0, 0);
  }

  /** Returns a Location for the given file and line, with an unknown column. */
  public static Location fromFileLine(String file, int line) {
    return new Location(file, line, 0);
  }

  /** Returns the location in the format "file:line:column", omitting unknown parts. */
  @Override
  public String toString() {
    StringBuilder buf = new StringBuilder();
    buf.append(file);
    if (line != 0) {
      buf.append(':').append(line);
      if (column != 0) {
        buf.append(':').append(column);
      }
    }
    return buf.toString();
  }

  @Override
  public int compareTo(Location that) {
    int cmp = this.file.compareTo(that.file);
    if (cmp != 0) {
      return cmp;
    }
    return Long.compare(
        ((long) this.line << 32) | this.column, ((long) that.line << 32) | that.column);
  }
}
