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
import java.util.Optional;

/**
 * An ordered list of parameters.
 *
 * <p>Some legacy documents leave a slot empty instead of describing an unnamed parameter. Such a
 * slot is kept as an empty {@link Optional} at its position, so that the list always has one entry
 * per declared parameter.
 */
public final class ParameterList extends Node {
  private final ImmutableList<Optional<VariableDeclaration>> parameters;

  private ParameterList(
      BaseProperties properties, ImmutableList<Optional<VariableDeclaration>> parameters) {
    super(properties);
    this.parameters = parameters;
  }

  public static ParameterList create(
      BaseProperties properties, List<Optional<VariableDeclaration>> parameters) {
    return new ParameterList(properties, ImmutableList.copyOf(parameters));
  }

  public ImmutableList<Optional<VariableDeclaration>> getParameters() {
    return parameters;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.PARAMETER_LIST;
  }

  @Override
  List<?> fieldValues() {
    return parameters;
  }
}
