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

/** A node that produces a value. */
public abstract class Expression extends Node {
  private final String typeString;
  private final boolean constant;
  private final boolean pure;

  Expression(ExpressionProperties properties) {
    super(properties.getBase());
    this.typeString = properties.getTypeString();
    this.constant = properties.isConstant();
    this.pure = properties.isPure();
  }

  /**
   * Returns the compiler's description of the type of this expression. Empty when the compiler did
   * not resolve one.
   */
  public final String getTypeString() {
    return typeString;
  }

  public final boolean isConstant() {
    return constant;
  }

  public final boolean isPure() {
    return pure;
  }

  @Override
  final List<?> fieldValues() {
    return Arrays.asList(typeString, constant, pure, expressionFieldValues());
  }

  abstract List<?> expressionFieldValues();
}
