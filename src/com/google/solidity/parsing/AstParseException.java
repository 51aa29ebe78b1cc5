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
import org.jspecify.annotations.Nullable;

/**
 * Thrown when a JSON AST cannot be converted. Parsing is all-or-nothing: the first failure aborts
 * the whole document.
 *
 * <p>The exception records enough of the offending raw node to add support for a missing node kind
 * without re-running the compiler: the node's kind tag, the names of its fields and, for the legacy
 * format, the kinds of its children. Lower-level failures are available through {@link
 * #getCause()}.
 */
public final class AstParseException extends Exception {
  private static final long serialVersionUID = 1L;

  /** Classifies a parse failure. */
  public enum ErrorKind {
    /** No extraction rule exists for the node's kind tag. */
    UNSUPPORTED_NODE_KIND,
    /**
     * A required field is missing or has the wrong JSON type, or a child is not of the kind its
     * position requires.
     */
    MALFORMED_NODE,
    /** A legacy child list does not fit the arity of its node kind. */
    AMBIGUOUS_CHILD_LIST,
    /** The document is nested more deeply than {@link ParserOptions#getMaxNestingDepth}. */
    NESTING_TOO_DEEP,
    /** The input is not a JSON object in either AST format. */
    INVALID_DOCUMENT
  }

  private final ErrorKind errorKind;
  private final @Nullable AstFormat format;
  private final @Nullable String nodeKind;
  private final ImmutableSet<String> fieldNames;
  private final ImmutableList<String> childKinds;

  AstParseException(
      ErrorKind errorKind,
      @Nullable AstFormat format,
      @Nullable String nodeKind,
      ImmutableSet<String> fieldNames,
      ImmutableList<String> childKinds,
      String detail,
      @Nullable Throwable cause) {
    super(formatMessage(format, nodeKind, detail, fieldNames, childKinds), cause);
    this.errorKind = errorKind;
    this.format = format;
    this.nodeKind = nodeKind;
    this.fieldNames = fieldNames;
    this.childKinds = childKinds;
  }

  static AstParseException invalidDocument(String detail, @Nullable Throwable cause) {
    return new AstParseException(
        ErrorKind.INVALID_DOCUMENT,
        null,
        null,
        ImmutableSet.of(),
        ImmutableList.of(),
        detail,
        cause);
  }

  private static String formatMessage(
      @Nullable AstFormat format,
      @Nullable String nodeKind,
      String detail,
      ImmutableSet<String> fieldNames,
      ImmutableList<String> childKinds) {
    StringBuilder sb = new StringBuilder("could not parse ");
    if (format != null) {
      sb.append(format.getDisplayName()).append(' ');
    }
    if (nodeKind == null) {
      return sb.append("AST: ").append(detail).toString();
    }
    sb.append("AST node of kind ").append(nodeKind).append(": ").append(detail);
    sb.append(" (fields: ").append(fieldNames);
    if (!childKinds.isEmpty()) {
      sb.append(", children: ").append(childKinds);
    }
    return sb.append(')').toString();
  }

  public ErrorKind getErrorKind() {
    return errorKind;
  }

  /** Returns the format being parsed, or null if the failure preceded format selection. */
  public @Nullable AstFormat getFormat() {
    return format;
  }

  /** Returns the kind tag of the node that could not be parsed, if it had one. */
  public @Nullable String getNodeKind() {
    return nodeKind;
  }

  /** Returns the names of the fields present on the offending raw node. */
  public ImmutableSet<String> getFieldNames() {
    return fieldNames;
  }

  /** Returns the kind tags of the node's children. Always empty for the compact format. */
  public ImmutableList<String> getChildKinds() {
    return childKinds;
  }
}
