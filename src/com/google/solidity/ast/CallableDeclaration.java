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

/** A declaration with a parameter list: a function, a modifier or an event. */
public abstract class CallableDeclaration extends Declaration {
  private final ParameterList parameters;
  private final @Nullable ParameterList returnParameters;

  CallableDeclaration(CallProperties properties) {
    super(properties.getDeclaration());
    this.parameters = properties.getParameters();
    this.returnParameters = properties.getReturnParameters();
  }

  public final ParameterList getParameters() {
    return parameters;
  }

  /** Returns the return parameters, or null for modifiers and events. */
  public final @Nullable ParameterList getReturnParameters() {
    return returnParameters;
  }

  @Override
  final List<?> declarationFieldValues() {
    return Arrays.asList(parameters, returnParameters, callableFieldValues());
  }

  abstract List<?> callableFieldValues();
}
