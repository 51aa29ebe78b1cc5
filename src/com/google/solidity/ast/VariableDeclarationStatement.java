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
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * A local variable declaration, possibly destructuring a tuple. Skipped tuple components, as in
 * {@code (, uint b) = f();}, are kept as empty slots.
 */
public final class VariableDeclarationStatement extends Statement {
  private final ImmutableList<Optional<VariableDeclaration>> declarations;
  private final @Nullable Expression initialValue;

  private VariableDeclarationStatement(
      BaseProperties properties,
      ImmutableList<Optional<VariableDeclaration>> declarations,
      @Nullable Expression initialValue) {
    super(properties);
    this.declarations = declarations;
    this.initialValue = initialValue;
  }

  public static VariableDeclarationStatement create(
      BaseProperties properties,
      List<Optional<VariableDeclaration>> declarations,
      @Nullable Expression initialValue) {
    return new VariableDeclarationStatement(
        properties, ImmutableList.copyOf(declarations), initialValue);
  }

  public ImmutableList<Optional<VariableDeclaration>> getDeclarations() {
    return declarations;
  }

  public @Nullable Expression getInitialValue() {
    return initialValue;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.VARIABLE_DECLARATION_STATEMENT;
  }

  @Override
  List<?> fieldValues() {
    return Arrays.asList(declarations, initialValue);
  }
}
