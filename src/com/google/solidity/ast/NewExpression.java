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

/** A {@code new T} expression; the call that follows it is a separate {@link FunctionCall}. */
public final class NewExpression extends Expression {
  private final TypeName typeName;

  private NewExpression(ExpressionProperties properties, TypeName typeName) {
    super(properties);
    this.typeName = typeName;
  }

  public static NewExpression create(ExpressionProperties properties, TypeName typeName) {
    return new NewExpression(properties, typeName);
  }

  public TypeName getTypeName() {
    return typeName;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.NEW_EXPRESSION;
  }

  @Override
  List<?> expressionFieldValues() {
    return Collections.singletonList(typeName);
  }
}
