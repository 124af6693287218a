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

import com.google.common.collect.ImmutableList;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Syntax tree for a ModelScript file, such as a script or a library of model declarations.
 *
 * <p>A ModelFile is the result of parsing; it may then be resolved (see {@link Resolver}) and
 * executed. Errors found by the scanner, parser or resolver are accumulated in {@link #errors}
 * rather than thrown.
 */
public final class ModelFile extends Node {

  private final ImmutableList<Statement> statements;
  private final FileOptions options;
  final List<SyntaxError> errors; // appended to by Resolver

  // set by resolver
  @Nullable private Resolver.Function resolved;

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  private ModelFile(
      FileLocations locs,
      ImmutableList<Statement> statements,
      FileOptions options,
      List<SyntaxError> errors) {
    super(locs);
    this.statements = statements;
    this.options = options;
    this.errors = errors;
  }

  /**
   * Parse a ModelScript file.
   *
   * <p>A syntax tree is always returned, even in case of error. Errors are recorded in the tree.
   * Callers must check whether {@link #ok} before executing the file.
   */
  public static ModelFile parse(ParserInput input, FileOptions options) {
    Parser.ParseResult result = Parser.parseFile(input);
    return new ModelFile(result.locs, result.statements, options, result.errors);
  }

  /** Parse a ModelScript file with default options. */
  public static ModelFile parse(ParserInput input) {
    return parse(input, FileOptions.DEFAULT);
  }

  /** Returns the options specified when parsing this file. */
  public FileOptions getOptions() {
    return options;
  }

  /** Returns an unmodifiable view of the list of scanner, parser, and (perhaps) resolver errors. */
  public List<SyntaxError> errors() {
    return Collections.unmodifiableList(errors);
  }

  /** Returns true if there were no errors during scanning, parsing or resolution. */
  public boolean ok() {
    return errors.isEmpty();
  }

  /** Returns the top-level statements of the file. */
  public ImmutableList<Statement> getStatements() {
    return statements;
  }

  /** Returns the name of this file, as specified to the parser. */
  public String getName() {
    return locs.file();
  }

  /**
   * Returns information about the implicit function containing the top-level statements of the
   * file. Set by {@link Resolver#resolveFile}.
   */
  @Nullable
  public Resolver.Function getResolvedFunction() {
    return resolved;
  }

  void setResolvedFunction(Resolver.Function resolved) {
    this.resolved = resolved;
  }

  @Override
  public int getStartOffset() {
    return 0;
  }

  @Override
  public int getEndOffset() {
    return locs.size();
  }

  @Override
  public String toString() {
    return "<ModelFile file=" + locs.file() + ">";
  }
}
