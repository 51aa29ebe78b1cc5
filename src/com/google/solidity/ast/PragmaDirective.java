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

/** A {@code pragma} directive, kept as the list of its literal tokens. */
public final class PragmaDirective extends Node {
  private final ImmutableList<String> literals;

  private PragmaDirective(BaseProperties properties, ImmutableList<String> literals) {
    super(properties);
    this.literals = literals;
  }

  public static PragmaDirective create(BaseProperties properties, List<String> literals) {
    return new PragmaDirective(properties, ImmutableList.copyOf(literals));
  }

  public ImmutableList<String> getLiterals() {
    return literals;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.PRAGMA_DIRECTIVE;
  }

  @Override
  List<?> fieldValues() {
    return literals;
  }
}
