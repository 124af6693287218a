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

import com.google.common.collect.ObjectArrays;
import java.util.AbstractList;
import java.util.Arrays;
import java.util.Collection;

/** An immutable sequence, written {@code (a, b)}. A tuple never equals a list. */
public final class Tuple extends AbstractList<Object> implements ModelValue {

  private static final Tuple EMPTY = new Tuple(new Object[0]);

  private final Object[] elems; // never modified

  private Tuple(Object[] elems) {
    this.elems = elems;
  }

  public static Tuple empty() {
    return EMPTY;
  }

  // The caller gives up the array.
  static Tuple wrap(Object[] elems) {
    return elems.length == 0 ? EMPTY : new Tuple(elems);
  }

  public static Tuple of(Object... elems) {
    return wrap(elems.clone());
  }

  public static Tuple copyOf(Collection<?> elems) {
    return elems instanceof Tuple t ? t : wrap(elems.toArray());
  }

  public static Tuple concat(Tuple x, Tuple y) {
    return wrap(ObjectArrays.concat(x.elems, y.elems, Object.class));
  }

  @Override
  public Object get(int i) {
    return elems[i];
  }

  @Override
  public int size() {
    return elems.length;
  }

  @Override
  public Object[] toArray() {
    return elems.clone();
  }

  @Override
  public String typeName() {
    return "tuple";
  }

  @Override
  public boolean truth() {
    return elems.length > 0;
  }

  @Override
  public void repr(Printer printer) {
    // A 1-tuple needs its trailing comma.
    printer.printList(this, "(", ", ", elems.length == 1 ? ",)" : ")");
  }

  @Override
  public boolean equals(Object that) {
    return that instanceof Tuple t && Arrays.equals(elems, t.elems);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(elems) + 7;
  }

  @Override
  public String toString() {
    return Model.repr(this);
  }
}
