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

/** A number, string, boolean or hex literal. All of its parts are kept verbatim. */
public final class Literal extends Expression {
  private final String literalKind;
  private final @Nullable String value;
  private final String hexValue;
  private final @Nullable String subdenomination;

  private Literal(
      ExpressionProperties properties,
      String literalKind,
      @Nullable String value,
      String hexValue,
      @Nullable String subdenomination) {
    super(properties);
    this.literalKind = literalKind;
    this.value = value;
    this.hexValue = hexValue;
    this.subdenomination = subdenomination;
  }

  public static Literal create(
      ExpressionProperties properties,
      String literalKind,
      @Nullable String value,
      String hexValue,
      @Nullable String subdenomination) {
    return new Literal(properties, literalKind, value, hexValue, subdenomination);
  }

  /** Returns {@code number}, {@code string}, {@code bool}, {@code hexString} or similar. */
  public String getLiteralKind() {
    return literalKind;
  }

  /** Returns the literal as written, or null if it is not valid UTF-8. */
  public @Nullable String getValue() {
    return value;
  }

  /** Returns the hex encoding of the literal's bytes. */
  public String getHexValue() {
    return hexValue;
  }

  /** Returns a unit such as {@code ether} or {@code days}, if one was given. */
  public @Nullable String getSubdenomination() {
    return subdenomination;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.LITERAL;
  }

  @Override
  List<?> expressionFieldValues() {
    return Arrays.asList(literalKind, value, hexValue, subdenomination);
  }
}
