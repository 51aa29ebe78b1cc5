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

/**
 * An {@code assembly { ... }} block. The assembly itself is not parsed: older compilers report it
 * as source text, newer ones as a separate JSON tree, which is kept here in its serialized form.
 */
public final class InlineAssembly extends Statement {
  private final String operations;

  private InlineAssembly(BaseProperties properties, String operations) {
    super(properties);
    this.operations = operations;
  }

  public static InlineAssembly create(BaseProperties properties, String operations) {
    return new InlineAssembly(properties, operations);
  }

  public String getOperations() {
    return operations;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.INLINE_ASSEMBLY;
  }

  @Override
  List<?> fieldValues() {
    return Collections.singletonList(operations);
  }
}
