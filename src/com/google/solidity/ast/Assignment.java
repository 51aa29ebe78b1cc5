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

/** An assignment, including compound assignments such as {@code +=}. */
public final class Assignment extends Expression {
  private final Expression leftHandSide;
  private final String operator;
  private final Expression rightHandSide;

  private Assignment(
      ExpressionProperties properties,
      Expression leftHandSide,
      String operator,
      Expression rightHandSide) {
    super(properties);
    this.leftHandSide = leftHandSide;
    this.operator = operator;
    this.rightHandSide = rightHandSide;
  }

  public static Assignment create(
      ExpressionProperties properties,
      Expression leftHandSide,
      String operator,
      Expression rightHandSide) {
    return new Assignment(properties, leftHandSide, operator, rightHandSide);
  }

  public Expression getLeftHandSide() {
    return leftHandSide;
  }

  /** Returns the operator token exactly as the compiler reported it. */
  public String getOperator() {
    return operator;
  }

  public Expression getRightHandSide() {
    return rightHandSide;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.ASSIGNMENT;
  }

  @Override
  List<?> expressionFieldValues() {
    return Arrays.asList(leftHandSide, operator, rightHandSide);
  }
}
