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

/** Properties of call-shaped declarations: functions, modifiers and events. */
@AutoValue
public abstract class CallProperties {
  public abstract DeclarationProperties getDeclaration();

  public abstract ParameterList getParameters();

  /** Absent for modifiers and events. */
  public abstract @Nullable ParameterList getReturnParameters();

  public static CallProperties create(
      DeclarationProperties declaration,
      ParameterList parameters,
      @Nullable ParameterList returnParameters) {
    return new AutoValue_CallProperties(declaration, parameters, returnParameters);
  }
}
