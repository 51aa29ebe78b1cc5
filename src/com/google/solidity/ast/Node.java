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

package com.google.solidity.ast;

import com.google.common.base.MoreObjects;
import com.google.errorprone.annotations.Immutable;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Base class of every node of the Solidity AST.
 *
 * <p>Nodes are created once by one of the JSON AST parsers and never mutated afterwards. Two nodes
 * are equal when they are of the same kind and all of their fields, including their children, are
 * equal.
 */
@Immutable
public abstract class Node {
  /** Identifier given to the root of a legacy document, which carries no identifier of its own. */
  public static final int SYNTHETIC_ID = -1;

  private final int id;
  private final String sourceRange;

  Node(BaseProperties properties) {
    this.id = properties.getId();
    this.sourceRange = properties.getSourceRange();
  }

  /** Returns the compiler-assigned identifier of this node. */
  public final int getId() {
    return id;
  }

  /**
   * Returns the source range of this node, encoded by the compiler as {@code
   * offset:length:fileIndex}. The value is carried through uninterpreted.
   */
  public final String getSourceRange() {
    return sourceRange;
  }

  public abstract NodeKind getKind();

  /** Values of the fields that are specific to this node, in declaration order. */
  abstract List<?> fieldValues();

  @Override
  public final boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || o.getClass() != getClass()) {
      return false;
    }
    Node that = (Node) o;
    return id == that.id
        && sourceRange.equals(that.sourceRange)
        && fieldValues().equals(that.fieldValues());
  }

  @Override
  public final int hashCode() {
    return Objects.hash(getClass(), id, sourceRange, fieldValues());
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(getKind().getTag())
        .add("id", id)
        .add("src", sourceRange)
        .add("fields", fieldValues())
        .toString();
  }
}
