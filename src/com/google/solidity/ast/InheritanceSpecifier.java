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
import org.jspecify.annotations.Nullable;

/** One entry of the inheritance list of a contract, with optional base constructor arguments. */
public final class InheritanceSpecifier extends Node {
  private final UserDefinedTypeName baseName;
  private final @Nullable ImmutableList<Expression> arguments;

  private InheritanceSpecifier(
      BaseProperties properties,
      UserDefinedTypeName baseName,
      @Nullable ImmutableList<Expression> arguments) {
    super(properties);
    this.baseName = baseName;
    this.arguments = arguments;
  }

  public static InheritanceSpecifier create(
      BaseProperties properties,
      UserDefinedTypeName baseName,
      @Nullable List<Expression> arguments) {
    return new InheritanceSpecifier(
        properties, baseName, arguments == null ? null : ImmutableList.copyOf(arguments));
  }

  public UserDefinedTypeName getBaseName() {
    return baseName;
  }

  /** Returns the constructor arguments, or null when none were given. */
  public @Nullable ImmutableList<Expression> getArguments() {
    return arguments;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.INHERITANCE_SPECIFIER;
  }

  @Override
  List<?> fieldValues() {
    return Arrays.asList(baseName, arguments);
  }
}
