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
 * One clause of a {@link TryStatement}: the success clause (empty error name) or a {@code catch}
 * clause.
 */
public final class TryCatchClause extends Statement {
  private final String errorName;
  private final @Nullable ParameterList parameters;
  private final Block block;

  private TryCatchClause(
      BaseProperties properties,
      String errorName,
      @Nullable ParameterList parameters,
      Block block) {
    super(properties);
    this.errorName = errorName;
    this.parameters = parameters;
    this.block = block;
  }

  public static TryCatchClause create(
      BaseProperties properties,
      String errorName,
      @Nullable ParameterList parameters,
      Block block) {
    return new TryCatchClause(properties, errorName, parameters, block);
  }

  /** Returns {@code Error}, {@code Panic}, or empty for the success and catch-all clauses. */
  public String getErrorName() {
    return errorName;
  }

  public @Nullable ParameterList getParameters() {
    return parameters;
  }

  public Block getBlock() {
    return block;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.TRY_CATCH_CLAUSE;
  }

  @Override
  List<?> fieldValues() {
    return Arrays.asList(errorName, parameters, block);
  }
}
