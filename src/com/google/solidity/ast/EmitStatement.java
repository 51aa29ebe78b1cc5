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

/** An {@code emit} statement. */
public final class EmitStatement extends Statement {
  private final FunctionCall eventCall;

  private EmitStatement(BaseProperties properties, FunctionCall eventCall) {
    super(properties);
    this.eventCall = eventCall;
  }

  public static EmitStatement create(BaseProperties properties, FunctionCall eventCall) {
    return new EmitStatement(properties, eventCall);
  }

  public FunctionCall getEventCall() {
    return eventCall;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.EMIT_STATEMENT;
  }

  @Override
  List<?> fieldValues() {
    return Collections.singletonList(eventCall);
  }
}
