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

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * The root of a compilation unit. Its name is the absolute path of the unit, or empty when the
 * compiler did not report one.
 */
public final class SourceUnit extends Declaration {
  private final ImmutableList<Node> nodes;

  private SourceUnit(DeclarationProperties properties, ImmutableList<Node> nodes) {
    super(properties);
    this.nodes = nodes;
  }

  public static SourceUnit create(DeclarationProperties properties, List<? extends Node> nodes) {
    return new SourceUnit(properties, ImmutableList.copyOf(nodes));
  }

  /** Returns the top-level pragmas, imports and definitions, in document order. */
  public ImmutableList<Node> getNodes() {
    return nodes;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.SOURCE_UNIT;
  }

  @Override
  List<?> declarationFieldValues() {
    return nodes;
  }
}
