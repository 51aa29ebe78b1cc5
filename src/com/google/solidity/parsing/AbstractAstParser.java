/*
 * Copyright 2026 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.solidity.parsing;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.solidity.ast.Node;
import com.google.solidity.ast.SourceUnit;
import com.google.solidity.parsing.AstParseException.ErrorKind;
import java.util.List;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * Recursive-descent conversion of one JSON AST format into {@link Node}s.
 *
 * <p>Each subclass maps the kind tags of its format to one extraction method per kind. {@link
 * #parse(RawNode)} is the single dispatch boundary: it looks up the extraction method, enforces the
 * nesting limit, and turns any low-level failure inside the extraction into an {@link
 * AstParseException} naming the node. A failure is wrapped exactly once, by the innermost boundary;
 * enclosing boundaries let it through unchanged.
 *
 * <p>Instances keep track of the current nesting depth and must not be shared between threads.
 */
abstract class AbstractAstParser {
  /** Converts a raw node of one kind. */
  @FunctionalInterface
  interface NodeExtractor {
    Node extract(RawNode raw) throws AstParseException;
  }

  private final AstFormat format;
  private final ParserOptions options;
  private int depth = 0;

  AbstractAstParser(AstFormat format, ParserOptions options) {
    this.format = format;
    this.options = options;
  }

  final AstFormat getFormat() {
    return format;
  }

  /** Returns the kind tags that have an extraction method. */
  abstract ImmutableSet<String> supportedKinds();

  /** Returns the extraction method for a kind tag, or null if the kind is unsupported. */
  abstract @Nullable NodeExtractor extractorFor(String kind);

  /** Reads the kind tag of a raw node. */
  abstract String kindOf(RawNode raw);

  /** Returns the kind tags of the children of a raw node, for diagnostics. */
  ImmutableList<String> childKindsOf(RawNode raw) {
    return ImmutableList.of();
  }

  /** Parses the root of a document, which must be a source unit. */
  final SourceUnit parseSourceUnit(RawNode root) throws AstParseException {
    Node node = parse(root);
    if (!(node instanceof SourceUnit)) {
      throw error(
          ErrorKind.MALFORMED_NODE,
          node.getKind().getTag(),
          root,
          "the root of a document must be a SourceUnit",
          null);
    }
    return (SourceUnit) node;
  }

  final Node parse(RawNode raw) throws AstParseException {
    String kind;
    try {
      kind = kindOf(raw);
    } catch (MalformedNodeException e) {
      throw error(e.getErrorKind(), null, raw, e.getMessage(), e);
    }

    NodeExtractor extractor = extractorFor(kind);
    if (extractor == null) {
      throw error(ErrorKind.UNSUPPORTED_NODE_KIND, kind, raw, "unsupported node kind", null);
    }
    if (depth >= options.getMaxNestingDepth()) {
      throw error(
          ErrorKind.NESTING_TOO_DEEP,
          kind,
          raw,
          "nodes are nested more than " + options.getMaxNestingDepth() + " levels deep",
          null);
    }

    depth++;
    try {
      return extractor.extract(raw);
    } catch (MalformedNodeException e) {
      throw error(e.getErrorKind(), kind, raw, e.getMessage(), e);
    } catch (RuntimeException e) {
      // Anything else thrown from an extraction method is a field access that the typed accessors
      // did not anticipate.
      throw error(ErrorKind.MALFORMED_NODE, kind, raw, e.toString(), e);
    } finally {
      depth--;
    }
  }

  /** Parses a child that must belong to the given node class. */
  final <T extends Node> T parse(RawNode raw, Class<T> expected, String role)
      throws AstParseException {
    return expect(parse(raw), expected, role);
  }

  final <T extends Node> @Nullable T parseOptional(
      @Nullable RawNode raw, Class<T> expected, String role) throws AstParseException {
    return raw == null ? null : parse(raw, expected, role);
  }

  final <T extends Node> ImmutableList<T> parseAll(
      List<RawNode> raws, Class<T> expected, String role) throws AstParseException {
    ImmutableList.Builder<T> result = ImmutableList.builder();
    for (RawNode raw : raws) {
      result.add(parse(raw, expected, role));
    }
    return result.build();
  }

  /** Parses a list whose empty slots are kept in place. */
  final <T extends Node> ImmutableList<Optional<T>> parseSlots(
      List<Optional<RawNode>> raws, Class<T> expected, String role) throws AstParseException {
    ImmutableList.Builder<Optional<T>> result = ImmutableList.builder();
    for (Optional<RawNode> raw : raws) {
      if (raw.isPresent()) {
        result.add(Optional.of(parse(raw.get(), expected, role)));
      } else {
        result.add(Optional.empty());
      }
    }
    return result.build();
  }

  /**
   * Checks that a parsed child belongs to the node class its position requires. A mismatch is
   * reported against the parent node.
   */
  static <T extends Node> T expect(Node node, Class<T> expected, String role) {
    if (!expected.isInstance(node)) {
      throw new MalformedNodeException(
          String.format(
              "%s must be %s but is %s",
              role, expected.getSimpleName(), node.getKind().getTag()));
    }
    return expected.cast(node);
  }

  private AstParseException error(
      ErrorKind errorKind,
      @Nullable String kind,
      RawNode raw,
      String detail,
      @Nullable Throwable cause) {
    return new AstParseException(
        errorKind, format, kind, raw.fieldNames(), childKindsOf(raw), detail, cause);
  }
}
