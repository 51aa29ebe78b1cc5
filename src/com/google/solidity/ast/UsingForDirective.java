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

/** A {@code using L for T} directive. The type name is null for {@code using L for *}. */
public final class UsingForDirective extends Node {
  private final UserDefinedTypeName libraryName;
  private final @Nullable TypeName typeName;

  private UsingForDirective(
      BaseProperties properties, UserDefinedTypeName libraryName, @Nullable TypeName typeName) {
    super(properties);
    this.libraryName = libraryName;
    this.typeName = typeName;
  }

  public static UsingForDirective create(
      BaseProperties properties, UserDefinedTypeName libraryName, @Nullable TypeName typeName) {
    return new UsingForDirective(properties, libraryName, typeName);
  }

  public UserDefinedTypeName getLibraryName() {
    return libraryName;
  }

  public @Nullable TypeName getTypeName() {
    return typeName;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.USING_FOR_DIRECTIVE;
  }

  @Override
  List<?> fieldValues() {
    return Arrays.asList(libraryName, typeName);
  }
}
