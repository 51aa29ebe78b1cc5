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

/** A function, constructor, fallback or receive function. */
public final class FunctionDefinition extends CallableDeclaration {
  private final String stateMutability;
  private final String functionKind;
  private final ImmutableList<ModifierInvocation> modifiers;
  private final @Nullable Block body;

  private FunctionDefinition(
      CallProperties properties,
      String stateMutability,
      String functionKind,
      ImmutableList<ModifierInvocation> modifiers,
      @Nullable Block body) {
    super(properties);
    this.stateMutability = stateMutability;
    this.functionKind = functionKind;
    this.modifiers = modifiers;
    this.body = body;
  }

  public static FunctionDefinition create(
      CallProperties properties,
      String stateMutability,
      String functionKind,
      List<ModifierInvocation> modifiers,
      @Nullable Block body) {
    return new FunctionDefinition(
        properties, stateMutability, functionKind, ImmutableList.copyOf(modifiers), body);
  }

  /** Returns the state mutability as reported by the compiler, e.g. {@code view}. */
  public String getStateMutability() {
    return stateMutability;
  }

  /** Returns one of {@code function}, {@code constructor}, {@code fallback} or {@code receive}. */
  public String getFunctionKind() {
    return functionKind;
  }

  public ImmutableList<ModifierInvocation> getModifiers() {
    return modifiers;
  }

  /** Returns the body, or null if the function is not implemented. */
  public @Nullable Block getBody() {
    return body;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.FUNCTION_DEFINITION;
  }

  @Override
  List<?> callableFieldValues() {
    return Arrays.asList(stateMutability, functionKind, modifiers, body);
  }
}
