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

import com.google.auto.value.AutoValue;
import org.jspecify.annotations.Nullable;

/** Properties common to all declarations. */
@AutoValue
public abstract class DeclarationProperties {
  public abstract BaseProperties getBase();

  public abstract String getName();

  public abstract @Nullable String getCanonicalName();

  public abstract @Nullable String getVisibility();

  public static DeclarationProperties create(
      BaseProperties base,
      String name,
      @Nullable String canonicalName,
      @Nullable String visibility) {
    return new AutoValue_DeclarationProperties(base, name, canonicalName, visibility);
  }

  /** Returns a copy of these properties with the canonical name replaced. */
  public DeclarationProperties withCanonicalName(@Nullable String canonicalName) {
    return create(getBase(), getName(), canonicalName, getVisibility());
  }
}
