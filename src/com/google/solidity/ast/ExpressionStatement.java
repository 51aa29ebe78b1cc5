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

import java.util.Collections;
import java.util.List;

/** An expression evaluated for its side effects. */
public final class ExpressionStatement extends Statement {
  private final Expression expression;

  private ExpressionStatement(BaseProperties properties, Expression expression) {
    super(properties);
    this.expression = expression;
  }

  public static ExpressionStatement create(BaseProperties properties, Expression expression) {
    return new ExpressionStatement(properties, expression);
  }

  public Expression getExpression() {
    return expression;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.EXPRESSION_STATEMENT;
  }

  @Override
  List<?> fieldValues() {
    return Collections.singletonList(expression);
  }
}
