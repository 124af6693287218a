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
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * A SyntaxError represents a static error associated with a specific location in a file, reported
 * by the scanner, parser or resolver.
 */
public record SyntaxError(Location location, String message) {

  /** Returns a string of the form {@code "foo.ms:1:2: oops"}. */
  @Override
  public String toString() {
    return location + ": " + message;
  }

  /**
   * A SyntaxError.Exception is an exception holding one or more syntax errors.
   *
   * <p>SyntaxError.Exception is thrown only by the convenience functions that parse and resolve
   * in one step, such as {@code Model.execFile}. Clients that want to inspect each error should
   * use {@link ModelFile#errors} instead.
   */
  public static final class Exception extends java.lang.Exception {

    private final ImmutableList<SyntaxError> errors;

    /** Constructs a SyntaxError.Exception from a non-empty list of errors. */
    public Exception(List<SyntaxError> errors) {
      if (errors.isEmpty()) {
        throw new IllegalArgumentException("no errors");
      }
      this.errors = ImmutableList.copyOf(errors);
    }

    /** Returns an immutable non-empty list of errors. */
    public ImmutableList<SyntaxError> errors() {
      return errors;
    }

    @Override
    public String getMessage() {
      String first = errors.get(0).message();
      if (errors.size() > 1) {
        return String.format("%s (+ %d more)", first, errors.size() - 1);
      }
      return first;
    }

    /** Returns every error, one per line, each prefixed by its location. */
    public String getMessageWithLocations() {
      return Joiner.on('\n').join(errors);
    }
  }
}
