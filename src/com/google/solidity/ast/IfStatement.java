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

/** An {@code if} statement. The false body is null when there is no {@code else} branch. */
public final class IfStatement extends Statement {
  private final Expression condition;
  private final Statement trueBody;
  private final @Nullable Statement falseBody;

  private IfStatement(
      BaseProperties properties,
      Expression condition,
      Statement trueBody,
      @Nullable Statement falseBody) {
    super(properties);
    this.condition = condition;
    this.trueBody = trueBody;
    this.falseBody = falseBody;
  }

  public static IfStatement create(
      BaseProperties properties,
      Expression condition,
      Statement trueBody,
      @Nullable Statement falseBody) {
    return new IfStatement(properties, condition, trueBody, falseBody);
  }

  public Expression getCondition() {
    return condition;
  }

  public Statement getTrueBody() {
    return trueBody;
  }

  public @Nullable Statement getFalseBody() {
    return falseBody;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.IF_STATEMENT;
  }

  @Override
  List<?> fieldValues() {
    return Arrays.asList(condition, trueBody, falseBody);
  }
}
