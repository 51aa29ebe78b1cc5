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

package com.google.solidity.parsing;

import com.google.gson.JsonObject;
import org.jspecify.annotations.Nullable;

/** The two JSON shapes in which the Solidity compiler emits its AST. */
public enum AstFormat {
  /**
   * The self-describing format introduced in solc 0.4.12: every node has a {@code nodeType} tag and
   * named fields.
   */
  COMPACT("compact"),

  /**
   * The older format, dropped in solc 0.8: every node has a {@code name} tag, an
   * {@code attributes} mapping and a flat {@code children} list.
   */
  LEGACY("legacy");

  private final String displayName;

  AstFormat(String displayName) {
    this.displayName = displayName;
  }

  public String getDisplayName() {
    return displayName;
  }

  /**
   * Guesses the format of a document from its root node, or returns null if the root looks like
   * neither format.
   */
  public static @Nullable AstFormat detect(JsonObject root) {
    if (root.has("nodeType")) {
      return COMPACT;
    }
    if (root.has("name") && (root.has("children") || root.has("attributes"))) {
      return LEGACY;
    }
    return null;
  }

  @Override
  public String toString() {
    return displayName;
  }
}
