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

/** A {@code cond ? a : b} expression. */
public final class Conditional extends Expression {
  private final Expression condition;
  private final Expression trueExpression;
  private final Expression falseExpression;

  private Conditional(
      ExpressionProperties properties,
      Expression condition,
      Expression trueExpression,
      Expression falseExpression) {
    super(properties);
    this.condition = condition;
    this.trueExpression = trueExpression;
    this.falseExpression = falseExpression;
  }

  public static Conditional create(
      ExpressionProperties properties,
      Expression condition,
      Expression trueExpression,
      Expression falseExpression) {
    return new Conditional(properties, condition, trueExpression, falseExpression);
  }

  public Expression getCondition() {
    return condition;
  }

  public Expression getTrueExpression() {
    return trueExpression;
  }

  public Expression getFalseExpression() {
    return falseExpression;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.CONDITIONAL;
  }

  @Override
  List<?> expressionFieldValues() {
    return Arrays.asList(condition, trueExpression, falseExpression);
  }
}
