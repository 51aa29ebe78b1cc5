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
import java.util.List;

/** An {@code enum} definition. */
public final class EnumDefinition extends Declaration {
  private final ImmutableList<EnumValue> members;

  private EnumDefinition(DeclarationProperties properties, ImmutableList<EnumValue> members) {
    super(properties);
    this.members = members;
  }

  public static EnumDefinition create(DeclarationProperties properties, List<EnumValue> members) {
    return new EnumDefinition(properties, ImmutableList.copyOf(members));
  }

  public ImmutableList<EnumValue> getMembers() {
    return members;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.ENUM_DEFINITION;
  }

  @Override
  List<?> declarationFieldValues() {
    return members;
  }
}
