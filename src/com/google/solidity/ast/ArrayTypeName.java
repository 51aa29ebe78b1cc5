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

/** An array type. The length is null for dynamically-sized arrays. */
public final class ArrayTypeName extends TypeName {
  private final TypeName baseType;
  private final @Nullable Expression length;

  private ArrayTypeName(BaseProperties properties, TypeName baseType, @Nullable Expression length) {
    super(properties);
    this.baseType = baseType;
    this.length = length;
  }

  public static ArrayTypeName create(
      BaseProperties properties, TypeName baseType, @Nullable Expression length) {
    return new ArrayTypeName(properties, baseType, length);
  }

  public TypeName getBaseType() {
    return baseType;
  }

  public @Nullable Expression getLength() {
    return length;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.ARRAY_TYPE_NAME;
  }

  @Override
  List<?> fieldValues() {
    return Arrays.asList(baseType, length);
  }
}
