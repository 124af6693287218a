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
import java.util.Arrays;
import javax.annotation.concurrent.Immutable;

/**
 * FileLocations maps each source offset within a file to a Location. It also retains the file's
 * text, so that the source of any node can be recovered later, and records whether the text was
 * written by a person or synthesized by a program.
 *
 * <p>A line offset shifts every reported line number; it is used when a fragment excerpted from a
 * larger file is parsed on its own.
 */
@Immutable
final class FileLocations {

  private final int[] linestart; // maps line index (0-based) to start offset
  private final String file;
  private final char[] buffer;
  private final int lineOffset;
  private final boolean synthetic;

  private FileLocations(
      int[] linestart, String file, char[] buffer, int lineOffset, boolean synthetic) {
    this.linestart = linestart;
    this.file = file;
    this.buffer = buffer;
    this.lineOffset = lineOffset;
    this.synthetic = synthetic;
  }

  static FileLocations create(ParserInput input) {
    char[] buffer = input.getContent();
    int[] linestart = new int[256];
    int n = 0;
    linestart[n++] = 0;
    for (int i = 0; i < buffer.length; i++) {
      if (buffer[i] == '\n') {
        if (n == linestart.length) {
          linestart = Arrays.copyOf(linestart, 2 * n);
        }
        linestart[n++] = i + 1;
      }
    }
    return new FileLocations(
        Arrays.copyOf(linestart, n),
        input.getFile(),
        buffer,
        input.getLineOffset(),
        input.isSynthetic());
  }

  String file() {
    return file;
  }

  int lineOffset() {
    return lineOffset;
  }

  boolean isSynthetic() {
    return synthetic;
  }

  // Returns the number of chars in the file.
  int size() {
    return buffer.length;
  }

  // Returns the 0-based index of the line containing the specified offset.
  private int getLineAt(int offset) {
    Preconditions.checkArgument(offset >= 0, "illegal offset %s", offset);
    int i = Arrays.binarySearch(linestart, offset);
    if (i < 0) {
      i = -i - 2; // insertion point minus one
    }
    return i;
  }

  Location getLocation(int offset) {
    int line = getLineAt(offset);
    int column = offset - linestart[line] + 1;
    return new Location(file, line + 1 + lineOffset, column);
  }

  /**
   * Returns the full lines of text that contain the offsets [start, end), without the final line's
   * terminating newline.
   */
  String getLines(int start, int end) {
    int first = linestart[getLineAt(start)];
    int last = Math.max(start, end - 1);
    int lineIndex = getLineAt(Math.min(last, buffer.length));
    int stop =
        lineIndex + 1 < linestart.length ? linestart[lineIndex + 1] - 1 : buffer.length;
    if (stop > first && buffer[stop - 1] == '\r') {
      stop--;
    }
    return new String(buffer, first, stop - first);
  }

  /** Returns the source text in the range [start, end). */
  String getText(int start, int end) {
    return new String(buffer, start, end - start);
  }
}
