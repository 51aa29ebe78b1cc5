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
import org.jspecify.annotations.Nullable;

/**
 * An {@code base[index]} access. The index is null when the expression denotes an array type, as
 * in {@code abi.decode(data, (uint[]))}.
 */
public final class IndexAccess extends Expression {
  private final Expression baseExpression;
  private final @Nullable Expression indexExpression;

  private IndexAccess(
      ExpressionProperties properties,
      Expression baseExpression,
      @Nullable Expression indexExpression) {
    super(properties);
    this.baseExpression = baseExpression;
    this.indexExpression = indexExpression;
  }

  public static IndexAccess create(
      ExpressionProperties properties,
      Expression baseExpression,
      @Nullable Expression indexExpression) {
    return new IndexAccess(properties, baseExpression, indexExpression);
  }

  public Expression getBaseExpression() {
    return baseExpression;
  }

  public @Nullable Expression getIndexExpression() {
    return indexExpression;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.INDEX_ACCESS;
  }

  @Override
  List<?> expressionFieldValues() {
    return Arrays.asList(baseExpression, indexExpression);
  }
}
