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

/** A {@code try} statement around an external call. */
public final class TryStatement extends Statement {
  private final Expression externalCall;
  private final ImmutableList<TryCatchClause> clauses;

  private TryStatement(
      BaseProperties properties, Expression externalCall, ImmutableList<TryCatchClause> clauses) {
    super(properties);
    this.externalCall = externalCall;
    this.clauses = clauses;
  }

  public static TryStatement create(
      BaseProperties properties, Expression externalCall, List<TryCatchClause> clauses) {
    return new TryStatement(properties, externalCall, ImmutableList.copyOf(clauses));
  }

  public Expression getExternalCall() {
    return externalCall;
  }

  public ImmutableList<TryCatchClause> getClauses() {
    return clauses;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.TRY_STATEMENT;
  }

  @Override
  List<?> fieldValues() {
    return Arrays.asList(externalCall, clauses);
  }
}
