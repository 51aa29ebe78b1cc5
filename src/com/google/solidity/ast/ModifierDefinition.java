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

/** A {@code modifier} definition. Modifiers have no return parameters. */
public final class ModifierDefinition extends CallableDeclaration {
  private final @Nullable Block body;

  private ModifierDefinition(CallProperties properties, @Nullable Block body) {
    super(properties);
    this.body = body;
  }

  public static ModifierDefinition create(CallProperties properties, @Nullable Block body) {
    return new ModifierDefinition(properties, body);
  }

  public @Nullable Block getBody() {
    return body;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.MODIFIER_DEFINITION;
  }

  @Override
  List<?> callableFieldValues() {
    return Collections.singletonList(body);
  }
}
