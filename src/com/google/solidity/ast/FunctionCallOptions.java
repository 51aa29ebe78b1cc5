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

/** Call options such as {@code f{value: 1, gas: 2}}, applied to the callee before the call. */
public final class FunctionCallOptions extends Expression {
  private final Expression expression;
  private final ImmutableList<String> names;
  private final ImmutableList<Expression> options;

  private FunctionCallOptions(
      ExpressionProperties properties,
      Expression expression,
      ImmutableList<String> names,
      ImmutableList<Expression> options) {
    super(properties);
    this.expression = expression;
    this.names = names;
    this.options = options;
  }

  public static FunctionCallOptions create(
      ExpressionProperties properties,
      Expression expression,
      List<String> names,
      List<Expression> options) {
    return new FunctionCallOptions(
        properties, expression, ImmutableList.copyOf(names), ImmutableList.copyOf(options));
  }

  public Expression getExpression() {
    return expression;
  }

  /** Returns the option names, parallel to {@link #getOptions}. */
  public ImmutableList<String> getNames() {
    return names;
  }

  public ImmutableList<Expression> getOptions() {
    return options;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.FUNCTION_CALL_OPTIONS;
  }

  @Override
  List<?> expressionFieldValues() {
    return Arrays.asList(expression, names, options);
  }
}
