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

/** A {@code mapping(K => V)} type. */
public final class Mapping extends TypeName {
  private final TypeName keyType;
  private final TypeName valueType;

  private Mapping(BaseProperties properties, TypeName keyType, TypeName valueType) {
    super(properties);
    this.keyType = keyType;
    this.valueType = valueType;
  }

  public static Mapping create(BaseProperties properties, TypeName keyType, TypeName valueType) {
    return new Mapping(properties, keyType, valueType);
  }

  public TypeName getKeyType() {
    return keyType;
  }

  public TypeName getValueType() {
    return valueType;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.MAPPING;
  }

  @Override
  List<?> fieldValues() {
    return Arrays.asList(keyType, valueType);
  }
}
