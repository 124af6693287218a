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

/**
 * A value implemented by a Java class of its own. Ints, floats, bools, strings and lists are
 * represented by the corresponding Java types instead.
 */
public interface ModelValue {

  /** Appends the form of this value that {@code repr} shows. */
  default void repr(Printer printer) {
    printer.append("<").append(typeName()).append(">");
  }

  /** Appends the form of this value that {@code str} and {@code print} show. */
  default void str(Printer printer) {
    repr(printer);
  }

  /** Returns false if the value counts as false in a condition. */
  default boolean truth() {
    return true;
  }

  /** Returns the name {@code type(x)} reports. */
  String typeName();
}
