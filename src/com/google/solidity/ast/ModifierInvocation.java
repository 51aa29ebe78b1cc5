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

/** The application of a modifier, or of a base constructor, in a function header. */
public final class ModifierInvocation extends Node {
  private final Identifier modifierName;
  private final @Nullable ImmutableList<Expression> arguments;

  private ModifierInvocation(
      BaseProperties properties,
      Identifier modifierName,
      @Nullable ImmutableList<Expression> arguments) {
    super(properties);
    this.modifierName = modifierName;
    this.arguments = arguments;
  }

  public static ModifierInvocation create(
      BaseProperties properties, Identifier modifierName, @Nullable List<Expression> arguments) {
    return new ModifierInvocation(
        properties, modifierName, arguments == null ? null : ImmutableList.copyOf(arguments));
  }

  public Identifier getModifierName() {
    return modifierName;
  }

  /** Returns the arguments, or null when the invocation has none. */
  public @Nullable ImmutableList<Expression> getArguments() {
    return arguments;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.MODIFIER_INVOCATION;
  }

  @Override
  List<?> fieldValues() {
    return Arrays.asList(modifierName, arguments);
  }
}
