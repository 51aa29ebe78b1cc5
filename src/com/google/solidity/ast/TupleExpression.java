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
import java.util.Optional;

/**
 * A parenthesized tuple such as {@code (a, , b)}, or an inline array {@code [a, b]}. Omitted
 * components are kept as empty slots.
 */
public final class TupleExpression extends Expression {
  private final ImmutableList<Optional<Expression>> components;
  private final boolean inlineArray;

  private TupleExpression(
      ExpressionProperties properties,
      ImmutableList<Optional<Expression>> components,
      boolean inlineArray) {
    super(properties);
    this.components = components;
    this.inlineArray = inlineArray;
  }

  public static TupleExpression create(
      ExpressionProperties properties,
      List<Optional<Expression>> components,
      boolean inlineArray) {
    return new TupleExpression(properties, ImmutableList.copyOf(components), inlineArray);
  }

  public ImmutableList<Optional<Expression>> getComponents() {
    return components;
  }

  public boolean isInlineArray() {
    return inlineArray;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.TUPLE_EXPRESSION;
  }

  @Override
  List<?> expressionFieldValues() {
    return Arrays.asList(components, inlineArray);
  }
}
