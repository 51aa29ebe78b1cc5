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

/** A node that declares a name. */
public abstract class Declaration extends Node {
  private final String name;
  private final @Nullable String canonicalName;
  private final @Nullable String visibility;

  Declaration(DeclarationProperties properties) {
    super(properties.getBase());
    this.name = properties.getName();
    this.canonicalName = properties.getCanonicalName();
    this.visibility = properties.getVisibility();
  }

  public final String getName() {
    return name;
  }

  /**
   * Returns the qualified name of the declaration. Empty if the compiler did not provide one, and
   * null for structs and enums produced by compilers that predate canonical names.
   */
  public final @Nullable String getCanonicalName() {
    return canonicalName;
  }

  /**
   * Returns one of {@code public}, {@code private}, {@code internal} or {@code external}, or null
   * when the document leaves it unset.
   */
  public final @Nullable String getVisibility() {
    return visibility;
  }

  @Override
  final List<?> fieldValues() {
    return Arrays.asList(name, canonicalName, visibility, declarationFieldValues());
  }

  abstract List<?> declarationFieldValues();
}
