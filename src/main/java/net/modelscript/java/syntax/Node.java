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

/** A Node is a node in a ModelScript syntax tree. */
public abstract class Node {

  // The locs field holds the file name, the mapping from offsets to line numbers, and the text of
  // the file. Nodes synthesized by a rewrite borrow the locs of the node they replace.
  final FileLocations locs;

  Node(FileLocations locs) {
    this.locs = Preconditions.checkNotNull(locs);
  }

  /**
   * Returns the node's start offset, as a char index (zero-based count of UTF-16 codes) from the
   * start of the file.
   */
  public abstract int getStartOffset();

  /** Returns the char offset of the source position immediately after this node. */
  public abstract int getEndOffset();

  /** Returns the location of the start of this syntax node. */
  public final Location getStartLocation() {
    return locs.getLocation(getStartOffset());
  }

  /** Returns the location of the end of this syntax node. */
  public final Location getEndLocation() {
    return locs.getLocation(getEndOffset());
  }

  /**
   * Returns node's start location. Subclasses such as CallExpression override this to report a
   * more precise position.
   */
  public Location getLocation() {
    return getStartLocation();
  }

  /** Returns the name of the file containing this node. */
  public final String getFile() {
    return locs.file();
  }

  /**
   * Reports whether this node was parsed from text synthesized by a program rather than read from
   * a source file.
   */
  public final boolean isSynthetic() {
    return locs.isSynthetic();
  }

  /** Returns the number of lines that preceded the parsed text in its original file. */
  public final int getLineOffset() {
    return locs.lineOffset();
  }

  /**
   * Returns the full source lines spanned by this node, with their original indentation. Lines
   * that start before the node (for example, the indentation before a {@code def}) are included
   * from their first column.
   */
  public String getSourceLines() {
    return locs.getLines(getStartOffset(), getEndOffset());
  }

  /** Returns a pretty-printed representation of this syntax tree. */
  @Override
  public String toString() {
    StringBuilder buf = new StringBuilder();
    new NodePrinter(buf).printNode(this);
    return buf.toString();
  }

  /**
   * Implements the double dispatch by calling into the node specific <code>visit</code> method of
   * the {@link NodeVisitor}
   *
   * @param visitor the {@link NodeVisitor} instance to dispatch to.
   */
  public abstract void accept(NodeVisitor visitor);
}
