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

/**
 * A call. Besides ordinary function calls this also covers type conversions such as {@code
 * uint8(x)} and struct constructor calls, distinguished by {@link #getCallKind}.
 */
public final class FunctionCall extends Expression {
  public static final String FUNCTION_CALL = "functionCall";
  public static final String TYPE_CONVERSION = "typeConversion";
  public static final String STRUCT_CONSTRUCTOR_CALL = "structConstructorCall";

  private final String callKind;
  private final Expression expression;
  private final ImmutableList<String> names;
  private final ImmutableList<Expression> arguments;

  private FunctionCall(
      ExpressionProperties properties,
      String callKind,
      Expression expression,
      ImmutableList<String> names,
      ImmutableList<Expression> arguments) {
    super(properties);
    this.callKind = callKind;
    this.expression = expression;
    this.names = names;
    this.arguments = arguments;
  }

  public static FunctionCall create(
      ExpressionProperties properties,
      String callKind,
      Expression expression,
      List<String> names,
      List<Expression> arguments) {
    return new FunctionCall(
        properties,
        callKind,
        expression,
        ImmutableList.copyOf(names),
        ImmutableList.copyOf(arguments));
  }

  /**
   * Returns one of {@link #FUNCTION_CALL}, {@link #TYPE_CONVERSION} or {@link
   * #STRUCT_CONSTRUCTOR_CALL}.
   */
  public String getCallKind() {
    return callKind;
  }

  /** Returns the callee. */
  public Expression getExpression() {
    return expression;
  }

  /** Returns the argument names of a {@code f({a: 1, b: 2})} call, empty for positional calls. */
  public ImmutableList<String> getNames() {
    return names;
  }

  public ImmutableList<Expression> getArguments() {
    return arguments;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.FUNCTION_CALL;
  }

  @Override
  List<?> expressionFieldValues() {
    return Arrays.asList(callKind, expression, names, arguments);
  }
}
