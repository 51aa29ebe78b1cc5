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

/** An infix operation such as {@code a + b} or {@code a && b}. */
public final class BinaryOperation extends Expression {
  private final Expression leftExpression;
  private final String operator;
  private final Expression rightExpression;

  private BinaryOperation(
      ExpressionProperties properties,
      Expression leftExpression,
      String operator,
      Expression rightExpression) {
    super(properties);
    this.leftExpression = leftExpression;
    this.operator = operator;
    this.rightExpression = rightExpression;
  }

  public static BinaryOperation create(
      ExpressionProperties properties,
      Expression leftExpression,
      String operator,
      Expression rightExpression) {
    return new BinaryOperation(properties, leftExpression, operator, rightExpression);
  }

  public Expression getLeftExpression() {
    return leftExpression;
  }

  /** Returns the operator token exactly as the compiler reported it. */
  public String getOperator() {
    return operator;
  }

  public Expression getRightExpression() {
    return rightExpression;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.BINARY_OPERATION;
  }

  @Override
  List<?> expressionFieldValues() {
    return Arrays.asList(leftExpression, operator, rightExpression);
  }
}
