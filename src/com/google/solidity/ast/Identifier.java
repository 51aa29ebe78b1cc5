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

/** A reference to a declaration by name. */
public final class Identifier extends Expression {
  private final String name;

  private Identifier(ExpressionProperties properties, String name) {
    super(properties);
    this.name = name;
  }

  public static Identifier create(ExpressionProperties properties, String name) {
    return new Identifier(properties, name);
  }

  public String getName() {
    return name;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.IDENTIFIER;
  }

  @Override
  List<?> expressionFieldValues() {
    return Collections.singletonList(name);
  }
}
