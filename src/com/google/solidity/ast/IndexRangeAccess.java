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

/** A slice {@code base[start:end]} of a calldata array. */
public final class IndexRangeAccess extends Expression {
  private final Expression baseExpression;
  private final @Nullable Expression startExpression;
  private final @Nullable Expression endExpression;

  private IndexRangeAccess(
      ExpressionProperties properties,
      Expression baseExpression,
      @Nullable Expression startExpression,
      @Nullable Expression endExpression) {
    super(properties);
    this.baseExpression = baseExpression;
    this.startExpression = startExpression;
    this.endExpression = endExpression;
  }

  public static IndexRangeAccess create(
      ExpressionProperties properties,
      Expression baseExpression,
      @Nullable Expression startExpression,
      @Nullable Expression endExpression) {
    return new IndexRangeAccess(properties, baseExpression, startExpression, endExpression);
  }

  public Expression getBaseExpression() {
    return baseExpression;
  }

  public @Nullable Expression getStartExpression() {
    return startExpression;
  }

  public @Nullable Expression getEndExpression() {
    return endExpression;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.INDEX_RANGE_ACCESS;
  }

  @Override
  List<?> expressionFieldValues() {
    return Arrays.asList(baseExpression, startExpression, endExpression);
  }
}
