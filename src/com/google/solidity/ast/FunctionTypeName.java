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

/** A function type, e.g. {@code function (uint) external returns (bool)}. */
public final class FunctionTypeName extends TypeName {
  private final ParameterList parameterTypes;
  private final ParameterList returnParameterTypes;
  private final String stateMutability;
  private final String visibility;

  private FunctionTypeName(
      BaseProperties properties,
      ParameterList parameterTypes,
      ParameterList returnParameterTypes,
      String stateMutability,
      String visibility) {
    super(properties);
    this.parameterTypes = parameterTypes;
    this.returnParameterTypes = returnParameterTypes;
    this.stateMutability = stateMutability;
    this.visibility = visibility;
  }

  public static FunctionTypeName create(
      BaseProperties properties,
      ParameterList parameterTypes,
      ParameterList returnParameterTypes,
      String stateMutability,
      String visibility) {
    return new FunctionTypeName(
        properties, parameterTypes, returnParameterTypes, stateMutability, visibility);
  }

  public ParameterList getParameterTypes() {
    return parameterTypes;
  }

  public ParameterList getReturnParameterTypes() {
    return returnParameterTypes;
  }

  public String getStateMutability() {
    return stateMutability;
  }

  public String getVisibility() {
    return visibility;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.FUNCTION_TYPE_NAME;
  }

  @Override
  List<?> fieldValues() {
    return Arrays.asList(parameterTypes, returnParameterTypes, stateMutability, visibility);
  }
}
