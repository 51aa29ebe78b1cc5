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

/** An {@code expression.member} access. */
public final class MemberAccess extends Expression {
  private final Expression expression;
  private final String memberName;

  private MemberAccess(ExpressionProperties properties, Expression expression, String memberName) {
    super(properties);
    this.expression = expression;
    this.memberName = memberName;
  }

  public static MemberAccess create(
      ExpressionProperties properties, Expression expression, String memberName) {
    return new MemberAccess(properties, expression, memberName);
  }

  public Expression getExpression() {
    return expression;
  }

  public String getMemberName() {
    return memberName;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.MEMBER_ACCESS;
  }

  @Override
  List<?> expressionFieldValues() {
    return Arrays.asList(expression, memberName);
  }
}
