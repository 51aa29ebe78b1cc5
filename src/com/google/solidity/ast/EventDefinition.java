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

/** An {@code event} definition. Events have no return parameters. */
public final class EventDefinition extends CallableDeclaration {
  private final boolean anonymous;

  private EventDefinition(CallProperties properties, boolean anonymous) {
    super(properties);
    this.anonymous = anonymous;
  }

  public static EventDefinition create(CallProperties properties, boolean anonymous) {
    return new EventDefinition(properties, anonymous);
  }

  public boolean isAnonymous() {
    return anonymous;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.EVENT_DEFINITION;
  }

  @Override
  List<?> callableFieldValues() {
    return Collections.singletonList(anonymous);
  }
}
