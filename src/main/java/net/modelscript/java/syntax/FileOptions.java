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

import com.google.auto.value.AutoValue;

/**
 * Options that govern the static checks applied to one file.
 *
 * <p>The options a file was parsed with travel with the source of each function extracted from it,
 * so that the function is checked the same way when its source is parsed again.
 */
@AutoValue
public abstract class FileOptions {

  public static final FileOptions DEFAULT = builder().build();

  /**
   * Whether a global variable may be assigned more than once, as is useful when a file is executed
   * piecemeal. Off by default.
   */
  public abstract boolean allowToplevelRebinding();

  public static Builder builder() {
    return new AutoValue_FileOptions.Builder().allowToplevelRebinding(false);
  }

  /** Builder for {@link FileOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder allowToplevelRebinding(boolean value);

    public abstract FileOptions build();
  }
}
