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

/** An {@code import} directive. */
public final class ImportDirective extends Node {
  private final String absolutePath;
  private final @Nullable String file;
  private final String unitAlias;

  private ImportDirective(
      BaseProperties properties, String absolutePath, @Nullable String file, String unitAlias) {
    super(properties);
    this.absolutePath = absolutePath;
    this.file = file;
    this.unitAlias = unitAlias;
  }

  public static ImportDirective create(
      BaseProperties properties, String absolutePath, @Nullable String file, String unitAlias) {
    return new ImportDirective(properties, absolutePath, file, unitAlias);
  }

  /** Returns the resolved path of the imported unit. */
  public String getAbsolutePath() {
    return absolutePath;
  }

  /** Returns the path as written in the source, if the document records it. */
  public @Nullable String getFile() {
    return file;
  }

  /** Returns the alias in {@code import "x" as alias}, or empty. */
  public String getUnitAlias() {
    return unitAlias;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.IMPORT_DIRECTIVE;
  }

  @Override
  List<?> fieldValues() {
    return Arrays.asList(absolutePath, file, unitAlias);
  }
}
