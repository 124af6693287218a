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

import javax.annotation.concurrent.Immutable;

/** The class of {@code None}, the result of a function that returns nothing. */
@Immutable
public final class NoneType implements ModelValue {

  static final NoneType NONE = new NoneType();

  private NoneType() {}

  @Override
  public String typeName() {
    return "NoneType";
  }

  @Override
  public boolean truth() {
    return false;
  }

  @Override
  public void repr(Printer printer) {
    printer.append("None");
  }

  @Override
  public String toString() {
    return "None";
  }
}
