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
 * A variable: a state variable, a local variable, a struct member, or a function, modifier or
 * event parameter.
 */
public final class VariableDeclaration extends Declaration {
  private final @Nullable TypeName typeName;
  private final @Nullable Expression value;
  private final String typeString;
  private final boolean constant;
  private final @Nullable String storageLocation;
  private final boolean stateVariable;
  private final boolean indexed;

  private VariableDeclaration(Builder builder) {
    super(builder.properties);
    this.typeName = builder.typeName;
    this.value = builder.value;
    this.typeString = builder.typeString;
    this.constant = builder.constant;
    this.storageLocation = builder.storageLocation;
    this.stateVariable = builder.stateVariable;
    this.indexed = builder.indexed;
  }

  public static Builder builder(DeclarationProperties properties, String typeString) {
    return new Builder(properties, typeString);
  }

  /** Returns the declared type, or null for variables declared with {@code var}. */
  public @Nullable TypeName getTypeName() {
    return typeName;
  }

  /** Returns the initial value given in the declaration itself, if any. */
  public @Nullable Expression getValue() {
    return value;
  }

  public String getTypeString() {
    return typeString;
  }

  public boolean isConstant() {
    return constant;
  }

  /** Returns {@code storage}, {@code memory}, {@code calldata} or {@code default}, if known. */
  public @Nullable String getStorageLocation() {
    return storageLocation;
  }

  public boolean isStateVariable() {
    return stateVariable;
  }

  /** Whether this is an {@code indexed} event parameter. */
  public boolean isIndexed() {
    return indexed;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.VARIABLE_DECLARATION;
  }

  @Override
  List<?> declarationFieldValues() {
    return Arrays.asList(
        typeName, value, typeString, constant, storageLocation, stateVariable, indexed);
  }

  /** Builder for {@link VariableDeclaration}. */
  public static final class Builder {
    private final DeclarationProperties properties;
    private final String typeString;
    private @Nullable TypeName typeName;
    private @Nullable Expression value;
    private boolean constant;
    private @Nullable String storageLocation;
    private boolean stateVariable;
    private boolean indexed;

    private Builder(DeclarationProperties properties, String typeString) {
      this.properties = properties;
      this.typeString = typeString;
    }

    public Builder setTypeName(@Nullable TypeName typeName) {
      this.typeName = typeName;
      return this;
    }

    public Builder setValue(@Nullable Expression value) {
      this.value = value;
      return this;
    }

    public Builder setConstant(boolean constant) {
      this.constant = constant;
      return this;
    }

    public Builder setStorageLocation(@Nullable String storageLocation) {
      this.storageLocation = storageLocation;
      return this;
    }

    public Builder setStateVariable(boolean stateVariable) {
      this.stateVariable = stateVariable;
      return this;
    }

    public Builder setIndexed(boolean indexed) {
      this.indexed = indexed;
      return this;
    }

    public VariableDeclaration build() {
      return new VariableDeclaration(this);
    }
  }
}
