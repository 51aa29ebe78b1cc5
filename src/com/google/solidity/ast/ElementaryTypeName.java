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

import java.util.Arrays;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** A built-in type such as {@code uint256} or {@code address payable}. */
public final class ElementaryTypeName extends TypeName {
  private final String name;
  private final @Nullable String stateMutability;

  private ElementaryTypeName(
      BaseProperties properties, String name, @Nullable String stateMutability) {
    super(properties);
    this.name = name;
    this.stateMutability = stateMutability;
  }

  public static ElementaryTypeName create(
      BaseProperties properties, String name, @Nullable String stateMutability) {
    return new ElementaryTypeName(properties, name, stateMutability);
  }

  public String getName() {
    return name;
  }

  /** Returns the mutability qualifier, only ever set for {@code address}. */
  public @Nullable String getStateMutability() {
    return stateMutability;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.ELEMENTARY_TYPE_NAME;
  }

  @Override
  List<?> fieldValues() {
    return Arrays.asList(name, stateMutability);
  }
}
