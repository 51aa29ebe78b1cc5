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

/** A {@code for} loop. Each of the three header parts may be omitted. */
public final class ForStatement extends Statement {
  private final @Nullable Statement initializationExpression;
  private final @Nullable Expression condition;
  private final @Nullable ExpressionStatement loopExpression;
  private final Statement body;

  private ForStatement(
      BaseProperties properties,
      @Nullable Statement initializationExpression,
      @Nullable Expression condition,
      @Nullable ExpressionStatement loopExpression,
      Statement body) {
    super(properties);
    this.initializationExpression = initializationExpression;
    this.condition = condition;
    this.loopExpression = loopExpression;
    this.body = body;
  }

  public static ForStatement create(
      BaseProperties properties,
      @Nullable Statement initializationExpression,
      @Nullable Expression condition,
      @Nullable ExpressionStatement loopExpression,
      Statement body) {
    return new ForStatement(properties, initializationExpression, condition, loopExpression, body);
  }

  public @Nullable Statement getInitializationExpression() {
    return initializationExpression;
  }

  public @Nullable Expression getCondition() {
    return condition;
  }

  public @Nullable ExpressionStatement getLoopExpression() {
    return loopExpression;
  }

  public Statement getBody() {
    return body;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.FOR_STATEMENT;
  }

  @Override
  List<?> fieldValues() {
    return Arrays.asList(initializationExpression, condition, loopExpression, body);
  }
}
