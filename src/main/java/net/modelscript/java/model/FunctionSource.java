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

import com.google.auto.value.AutoValue;
import javax.annotation.Nullable;
import net.modelscript.java.syntax.FileOptions;
import net.modelscript.java.syntax.Location;

/**
 * The source text of one function declaration, as excerpted from the file that declares it.
 *
 * <p>The text consists of the full lines of the declaration, from its first decorator through the
 * last line of its body, with their original indentation. It is accompanied by enough information
 * to parse it again as it was parsed the first time: the location of its first line, and the
 * options of the declaring file.
 */
@AutoValue
public abstract class FunctionSource {

  /** Returns the source lines of the declaration. */
  public abstract String getText();

  /** Returns the location of the start of the declaration (its first decorator, or its def). */
  public abstract Location getLocation();

  /** Returns the number of lines of the declaring file that precede the declaration's text. */
  public abstract int getLineOffset();

  /** Returns the options with which the declaring file was parsed. */
  public abstract FileOptions getOptions();

  /** Returns the declared name of the function. */
  public abstract String getName();

  /** Returns the function's docstring, or null if it has none. */
  @Nullable
  public abstract String getDoc();

  static FunctionSource create(
      String text, Location location, FileOptions options, String name, @Nullable String doc) {
    return new AutoValue_FunctionSource(
        text, location, location.line() - 1, options, name, doc);
  }
}
