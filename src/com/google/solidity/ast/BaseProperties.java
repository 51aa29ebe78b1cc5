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

/** The header shared by every node: its identifier and its source range. */
@AutoValue
public abstract class BaseProperties {
  public abstract int getId();

  public abstract String getSourceRange();

  public static BaseProperties create(int id, String sourceRange) {
    return new AutoValue_BaseProperties(id, sourceRange);
  }

  /** Returns the header of a root node that has no identifier or source range of its own. */
  public static BaseProperties synthetic() {
    return create(Node.SYNTHETIC_ID, "");
  }
}
