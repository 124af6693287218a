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

package net.modelscript.java.model;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.CheckReturnValue;
import com.google.errorprone.annotations.FormatMethod;
import java.util.List;
import javax.annotation.Nullable;
import net.modelscript.java.syntax.Location;
import net.modelscript.java.syntax.SyntaxError;

/**
 * A ModelException indicates that a function could not be turned into a model: its source is not
 * available, it uses a feature that the rewrite does not support, or its source, or the source of
 * its rewritten form, does not parse.
 *
 * <p>A ModelException arising while a {@link ModelHandle} is constructed is tagged with the name
 * and location of the declaration being processed.
 */
public final class ModelException extends Exception {

  /** The category of a failure. */
  public enum Kind {
    /** The value is a kind of function, or uses a construct, that cannot be rewritten. */
    NOT_SUPPORTED,
    /** The function has no retrievable source text. */
    NOT_AVAILABLE,
    /** The source text could not be parsed into a function declaration. */
    MALFORMED_INPUT
  }

  private final Kind kind;
  private final ImmutableList<SyntaxError> errors;
  @Nullable private String declaration;
  @Nullable private Location location;

  private ModelException(Kind kind, String message, List<SyntaxError> errors) {
    super(message);
    this.kind = kind;
    this.errors = ImmutableList.copyOf(errors);
  }

  @FormatMethod
  @CheckReturnValue
  static ModelException notSupported(String format, Object... args) {
    return new ModelException(Kind.NOT_SUPPORTED, String.format(format, args), ImmutableList.of());
  }

  @FormatMethod
  @CheckReturnValue
  static ModelException notAvailable(String format, Object... args) {
    return new ModelException(Kind.NOT_AVAILABLE, String.format(format, args), ImmutableList.of());
  }

  @CheckReturnValue
  static ModelException malformed(String message, List<SyntaxError> errors) {
    return new ModelException(Kind.MALFORMED_INPUT, message, errors);
  }

  // Records the declaration being processed, unless already recorded.
  @CanIgnoreReturnValue
  ModelException tag(String declaration, Location location) {
    if (this.declaration == null) {
      this.declaration = declaration;
      this.location = location;
    }
    return this;
  }

  /** Returns the category of the failure. */
  public Kind getKind() {
    return kind;
  }

  /** Returns the name of the declaration that could not be processed, or null if untagged. */
  @Nullable
  public String getDeclaration() {
    return declaration;
  }

  /** Returns the location of the declaration that could not be processed, or null if untagged. */
  @Nullable
  public Location getLocation() {
    return location;
  }

  /** Returns the syntax errors underlying a {@link Kind#MALFORMED_INPUT} failure. */
  public ImmutableList<SyntaxError> getSyntaxErrors() {
    return errors;
  }

  @Override
  public String getMessage() {
    String message = super.getMessage();
    if (!errors.isEmpty()) {
      message += ":\n" + Joiner.on('\n').join(errors);
    }
    if (declaration != null) {
      message = String.format("%s: in model '%s': %s", location, declaration, message);
    }
    return message;
  }
}
