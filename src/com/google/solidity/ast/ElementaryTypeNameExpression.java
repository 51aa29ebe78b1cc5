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

/**
 * An elementary type used as an expression, typically the callee of a conversion such as {@code
 * address(x)}.
 *
 * <p>Compilers before 0.6 describe the type only by its name; later ones attach a full {@link
 * ElementaryTypeName} node. {@link #getTypeNameText} is available in both cases.
 */
public final class ElementaryTypeNameExpression extends Expression {
  private final String typeNameText;
  private final @Nullable ElementaryTypeName typeName;

  private ElementaryTypeNameExpression(
      ExpressionProperties properties, String typeNameText, @Nullable ElementaryTypeName typeName) {
    super(properties);
    this.typeNameText = typeNameText;
    this.typeName = typeName;
  }

  public static ElementaryTypeNameExpression create(
      ExpressionProperties properties, ElementaryTypeName typeName) {
    return new ElementaryTypeNameExpression(properties, typeName.getName(), typeName);
  }

  public static ElementaryTypeNameExpression createFromText(
      ExpressionProperties properties, String typeNameText) {
    return new ElementaryTypeNameExpression(properties, typeNameText, null);
  }

  public String getTypeNameText() {
    return typeNameText;
  }

  public @Nullable ElementaryTypeName getTypeName() {
    return typeName;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.ELEMENTARY_TYPE_NAME_EXPRESSION;
  }

  @Override
  List<?> expressionFieldValues() {
    return Arrays.asList(typeNameText, typeName);
  }
}
