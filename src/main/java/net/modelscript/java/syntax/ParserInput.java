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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

/**
 * The apparent name and contents of a source file, for consumption by the parser.
 *
 * <p>Input may be marked <i>synthetic</i>, meaning it was produced by a program (for example, a
 * re-serialized syntax tree) rather than read from a file. Functions defined by synthetic input
 * have no retrievable source.
 */
public final class ParserInput {

  private final String file;
  private final char[] content;
  private final int lineOffset;
  private final boolean synthetic;

  private ParserInput(char[] content, String file, int lineOffset, boolean synthetic) {
    this.content = content;
    this.file = Preconditions.checkNotNull(file);
    this.lineOffset = lineOffset;
    this.synthetic = synthetic;
  }

  /** Returns the content of the input source. Callers must not modify the result. */
  char[] getContent() {
    return content;
  }

  /** Returns the (non-null) file name of the input source. */
  public String getFile() {
    return file;
  }

  /** Returns the number of lines that precede the first line of this input in its file. */
  public int getLineOffset() {
    return lineOffset;
  }

  /** Reports whether this input was synthesized by a program rather than written in a file. */
  public boolean isSynthetic() {
    return synthetic;
  }

  /**
   * Returns an input identical to this one except that its line numbers are shifted by {@code
   * lineOffset}. A negative offset is permitted; it is used to compensate for wrapper lines.
   */
  public ParserInput withLineOffset(int lineOffset) {
    return new ParserInput(content, file, lineOffset, synthetic);
  }

  /** Returns an unnamed input source that reads from a list of strings, joined by newlines. */
  public static ParserInput fromLines(String... lines) {
    return fromString(Joiner.on("\n").join(lines), "");
  }

  /** Returns an input source that reads from a UTF-8 encoded file. */
  public static ParserInput readFile(String file) throws IOException {
    byte[] bytes = Files.readAllBytes(Paths.get(file));
    return fromString(new String(bytes, StandardCharsets.UTF_8), file);
  }

  /** Returns an input source that reads from the given string, with the specified file name. */
  public static ParserInput fromString(String content, String file) {
    return new ParserInput(content.toCharArray(), file, 0, /* synthetic= */ false);
  }

  /**
   * Returns a synthetic input source for text produced by a program, with the specified apparent
   * file name.
   */
  public static ParserInput synthesized(String content, String file) {
    return new ParserInput(content.toCharArray(), file, 0, /* synthetic= */ true);
  }
}
