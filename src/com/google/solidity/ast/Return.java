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
import org.jspecify.annotations.Nullable;

/** A {@code return} statement, with or without a value. */
public final class Return extends Statement {
  private final @Nullable Expression expression;

  private Return(BaseProperties properties, @Nullable Expression expression) {
    super(properties);
    this.expression = expression;
  }

  public static Return create(BaseProperties properties, @Nullable Expression expression) {
    return new Return(properties, expression);
  }

  public @Nullable Expression getExpression() {
    return expression;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.RETURN;
  }

  @Override
  List<?> fieldValues() {
    return Collections.singletonList(expression);
  }
}
