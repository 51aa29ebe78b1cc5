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

import com.google.auto.value.AutoValue;

/** Properties common to all expressions. */
@AutoValue
public abstract class ExpressionProperties {
  public abstract BaseProperties getBase();

  /** The compiler's textual description of the expression type, e.g. {@code uint256}. */
  public abstract String getTypeString();

  public abstract boolean isConstant();

  public abstract boolean isPure();

  public static ExpressionProperties create(
      BaseProperties base, String typeString, boolean constant, boolean pure) {
    return new AutoValue_ExpressionProperties(base, typeString, constant, pure);
  }
}
