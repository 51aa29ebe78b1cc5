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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.errorprone.annotations.Immutable;

/** Options controlling how a JSON AST is parsed. */
@AutoValue
@Immutable
public abstract class ParserOptions {
  /** Default value of {@link #getMaxNestingDepth}. */
  public static final int DEFAULT_MAX_NESTING_DEPTH = 512;

  /**
   * Returns how deeply nodes may be nested before parsing fails. Guards against stack exhaustion on
   * pathological documents such as thousands of nested parentheses.
   */
  public abstract int getMaxNestingDepth();

  public abstract Builder toBuilder();

  public static ParserOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_ParserOptions.Builder().setMaxNestingDepth(DEFAULT_MAX_NESTING_DEPTH);
  }

  /** Builder for {@link ParserOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setMaxNestingDepth(int maxNestingDepth);

    abstract ParserOptions autoBuild();

    public ParserOptions build() {
      ParserOptions options = autoBuild();
      checkArgument(
          options.getMaxNestingDepth() > 0,
          "maxNestingDepth must be positive: %s",
          options.getMaxNestingDepth());
      return options;
    }
  }
}
