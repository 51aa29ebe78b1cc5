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

/** A prefix or postfix operation such as {@code !a}, {@code delete x} or {@code i++}. */
public final class UnaryOperation extends Expression {
  private final String operator;
  private final Expression subExpression;
  private final boolean prefix;

  private UnaryOperation(
      ExpressionProperties properties, String operator, Expression subExpression, boolean prefix) {
    super(properties);
    this.operator = operator;
    this.subExpression = subExpression;
    this.prefix = prefix;
  }

  public static UnaryOperation create(
      ExpressionProperties properties, String operator, Expression subExpression, boolean prefix) {
    return new UnaryOperation(properties, operator, subExpression, prefix);
  }

  /** Returns the operator token exactly as the compiler reported it. */
  public String getOperator() {
    return operator;
  }

  public Expression getSubExpression() {
    return subExpression;
  }

  public boolean isPrefix() {
    return prefix;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.UNARY_OPERATION;
  }

  @Override
  List<?> expressionFieldValues() {
    return Arrays.asList(operator, subExpression, prefix);
  }
}
