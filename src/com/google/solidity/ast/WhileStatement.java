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

/** A {@code while} or {@code do ... while} loop. */
public final class WhileStatement extends Statement {
  private final Expression condition;
  private final Statement body;
  private final boolean doWhile;

  private WhileStatement(
      BaseProperties properties, Expression condition, Statement body, boolean doWhile) {
    super(properties);
    this.condition = condition;
    this.body = body;
    this.doWhile = doWhile;
  }

  public static WhileStatement create(
      BaseProperties properties, Expression condition, Statement body, boolean doWhile) {
    return new WhileStatement(properties, condition, body, doWhile);
  }

  public Expression getCondition() {
    return condition;
  }

  public Statement getBody() {
    return body;
  }

  /** Whether the body runs once before the condition is first evaluated. */
  public boolean isDoWhile() {
    return doWhile;
  }

  @Override
  public NodeKind getKind() {
    return doWhile ? NodeKind.DO_WHILE_STATEMENT : NodeKind.WHILE_STATEMENT;
  }

  @Override
  List<?> fieldValues() {
    return Arrays.asList(condition, body, doWhile);
  }
}
