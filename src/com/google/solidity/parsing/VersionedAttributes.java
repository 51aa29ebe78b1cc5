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

import org.jspecify.annotations.Nullable;

/**
 * Resolves node attributes whose encoding changed between compiler releases.
 *
 * <p>Each method decides from which fields are present, never from a compiler version string. The
 * methods are shared by both parsers: compact documents from early 0.4 releases lack some of the
 * fields later releases added, just like legacy documents do.
 */
final class VersionedAttributes {
  static final String STRUCT_TYPE_PREFIX = "struct ";

  /**
   * Resolves the state mutability of a function: the explicit {@code stateMutability} (0.4.16+),
   * else the {@code payable} flag (0.4.5+), else {@code payable}.
   */
  static String functionMutability(RawNode attributes) {
    if (attributes.isPresent("stateMutability")) {
      return attributes.getString("stateMutability");
    }
    if (attributes.isPresent("payable")) {
      return attributes.getBoolean("payable") ? "payable" : "nonpayable";
    }
    // Functions of these releases may be declared constant and still write to storage, so assume
    // the least restrictive mutability.
    return "payable";
  }

  /**
   * Resolves the kind of a function: the explicit {@code kind} (0.5+), else {@code constructor}
   * when {@code isConstructor} is set (0.4.12+), else {@code fallback} for an unnamed function.
   */
  static String functionKind(RawNode attributes, String name) {
    if (attributes.isPresent("kind")) {
      return attributes.getString("kind");
    }
    if (attributes.getBoolean("isConstructor", false)) {
      return "constructor";
    }
    return name.isEmpty() ? "fallback" : "function";
  }

  /**
   * Resolves the kind of a contract: the explicit {@code contractKind} (0.4.12+), else derived from
   * the {@code isLibrary} and {@code fullyImplemented} flags.
   */
  static String contractKind(RawNode attributes) {
    if (attributes.isPresent("contractKind")) {
      return attributes.getString("contractKind");
    }
    if (attributes.getBoolean("isLibrary")) {
      return "library";
    }
    return attributes.getBoolean("fullyImplemented") ? "contract" : "interface";
  }

  /**
   * Resolves the kind of a function call: the explicit {@code kind}, else the {@code
   * isStructConstructorCall} flag (0.4.12+) together with {@code type_conversion}, else {@code
   * type_conversion} and the {@code struct } prefix of the resulting type.
   */
  static String functionCallKind(RawNode attributes, String typeString) {
    if (attributes.isPresent("kind")) {
      return attributes.getString("kind");
    }
    boolean typeConversion = attributes.getBoolean("type_conversion", false);
    if (attributes.isPresent("isStructConstructorCall")) {
      if (attributes.getBoolean("isStructConstructorCall")) {
        return "structConstructorCall";
      }
      return typeConversion ? "typeConversion" : "functionCall";
    }
    if (typeConversion) {
      return "typeConversion";
    }
    if (typeString.startsWith(STRUCT_TYPE_PREFIX)) {
      return "structConstructorCall";
    }
    return "functionCall";
  }

  /**
   * Returns the canonical name of a struct or enum, which releases before 0.4.12 omit. Enum values,
   * modifiers and events never carry one.
   */
  static @Nullable String canonicalName(RawNode attributes) {
    return attributes.getOptionalString("canonicalName");
  }

  /**
   * Resolves the mutability qualifier of an elementary type. Before 0.5 every {@code address} was
   * payable and the qualifier was not reported.
   */
  static @Nullable String elementaryTypeMutability(RawNode attributes, String typeName) {
    if (attributes.isPresent("stateMutability")) {
      return attributes.getString("stateMutability");
    }
    return typeName.equals("address") ? "payable" : null;
  }

  /**
   * Resolves whether a variable is constant: the {@code constant} flag (0.4.11+), else a {@code
   * mutability} of {@code constant}, else false.
   */
  static boolean variableConstant(RawNode attributes) {
    if (attributes.isPresent("constant")) {
      return attributes.getBoolean("constant");
    }
    return "constant".equals(attributes.getOptionalString("mutability"));
  }

  private VersionedAttributes() {}
}
