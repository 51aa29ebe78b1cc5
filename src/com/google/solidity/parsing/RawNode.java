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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * Typed, read-only access to the fields of one raw JSON node.
 *
 * <p>Every accessor for a required field throws {@link MalformedNodeException} when the field is
 * missing, null or of the wrong JSON type. Accessors for optional fields treat a missing field and
 * an explicit JSON {@code null} alike.
 */
final class RawNode {
  private static final RawNode EMPTY = new RawNode(new JsonObject());

  private final JsonObject json;

  private RawNode(JsonObject json) {
    this.json = checkNotNull(json);
  }

  static RawNode of(JsonObject json) {
    return new RawNode(json);
  }

  static RawNode of(JsonElement element, String description) {
    if (!element.isJsonObject()) {
      throw new MalformedNodeException(
          String.format("expected a JSON object for %s but found %s", description, element));
    }
    return new RawNode(element.getAsJsonObject());
  }

  /** Returns a node without fields, standing in for an omitted {@code attributes} mapping. */
  static RawNode empty() {
    return EMPTY;
  }

  JsonObject getJson() {
    return json;
  }

  ImmutableSet<String> fieldNames() {
    return ImmutableSet.copyOf(json.keySet());
  }

  /** Whether the field exists, even if its value is JSON {@code null}. */
  boolean has(String name) {
    return json.has(name);
  }

  /** Whether the field exists and is not JSON {@code null}. */
  boolean isPresent(String name) {
    JsonElement element = json.get(name);
    return element != null && !element.isJsonNull();
  }

  JsonElement getElement(String name) {
    JsonElement element = json.get(name);
    if (element == null) {
      throw new MalformedNodeException("missing required field '" + name + "'");
    }
    if (element.isJsonNull()) {
      throw new MalformedNodeException("required field '" + name + "' is null");
    }
    return element;
  }

  String getString(String name) {
    JsonElement element = getElement(name);
    if (!isString(element)) {
      throw wrongType(name, "a string", element);
    }
    return element.getAsString();
  }

  @Nullable String getOptionalString(String name) {
    return isPresent(name) ? getString(name) : null;
  }

  String getString(String name, String defaultValue) {
    return isPresent(name) ? getString(name) : defaultValue;
  }

  boolean getBoolean(String name) {
    JsonElement element = getElement(name);
    if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isBoolean()) {
      throw wrongType(name, "a boolean", element);
    }
    return element.getAsBoolean();
  }

  boolean getBoolean(String name, boolean defaultValue) {
    return isPresent(name) ? getBoolean(name) : defaultValue;
  }

  int getInt(String name) {
    return toInt(name, getElement(name), "an integer");
  }

  /** Returns the node's {@code id}, which must be a non-negative integer. */
  int getId() {
    int id = getInt("id");
    if (id < 0) {
      throw new MalformedNodeException("field 'id' should be non-negative but is " + id);
    }
    return id;
  }

  RawNode getObject(String name) {
    JsonElement element = getElement(name);
    if (!element.isJsonObject()) {
      throw wrongType(name, "an object", element);
    }
    return new RawNode(element.getAsJsonObject());
  }

  @Nullable RawNode getOptionalObject(String name) {
    return isPresent(name) ? getObject(name) : null;
  }

  /** Returns the elements of a required array of objects, none of which may be null. */
  ImmutableList<RawNode> getObjectList(String name) {
    ImmutableList.Builder<RawNode> result = ImmutableList.builder();
    for (JsonElement element : getArray(name)) {
      result.add(toObject(name, element));
    }
    return result.build();
  }

  /** Like {@link #getObjectList}, but a missing or null array reads as empty. */
  ImmutableList<RawNode> getObjectListOrEmpty(String name) {
    return isPresent(name) ? getObjectList(name) : ImmutableList.of();
  }

  /**
   * Returns the elements of a required array of objects, in which null elements stand for omitted
   * entries and are kept as empty slots.
   */
  ImmutableList<Optional<RawNode>> getSlotList(String name) {
    ImmutableList.Builder<Optional<RawNode>> result = ImmutableList.builder();
    for (JsonElement element : getArray(name)) {
      result.add(
          element.isJsonNull() ? Optional.empty() : Optional.of(toObject(name, element)));
    }
    return result.build();
  }

  ImmutableList<String> getStringList(String name) {
    ImmutableList.Builder<String> result = ImmutableList.builder();
    for (JsonElement element : getArray(name)) {
      if (!isString(element)) {
        throw wrongType(name, "an array of strings", element);
      }
      result.add(element.getAsString());
    }
    return result.build();
  }

  ImmutableList<String> getStringListOrEmpty(String name) {
    return isPresent(name) ? getStringList(name) : ImmutableList.of();
  }

  ImmutableList<Integer> getIntList(String name) {
    ImmutableList.Builder<Integer> result = ImmutableList.builder();
    for (JsonElement element : getArray(name)) {
      result.add(toInt(name, element, "an array of integers"));
    }
    return result.build();
  }

  private JsonArray getArray(String name) {
    JsonElement element = getElement(name);
    if (!element.isJsonArray()) {
      throw wrongType(name, "an array", element);
    }
    return element.getAsJsonArray();
  }

  private static RawNode toObject(String name, JsonElement element) {
    if (!element.isJsonObject()) {
      throw wrongType(name, "an array of objects", element);
    }
    return new RawNode(element.getAsJsonObject());
  }

  /** Converts a JSON number to an int, rejecting fractions and values outside the int range. */
  private static int toInt(String name, JsonElement element, String expected) {
    if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
      throw wrongType(name, expected, element);
    }
    try {
      return element.getAsJsonPrimitive().getAsBigDecimal().intValueExact();
    } catch (ArithmeticException e) {
      throw wrongType(name, expected, element);
    }
  }

  private static boolean isString(JsonElement element) {
    return element.isJsonPrimitive() && ((JsonPrimitive) element).isString();
  }

  private static MalformedNodeException wrongType(
      String name, String expected, JsonElement actual) {
    return new MalformedNodeException(
        String.format("field '%s' should be %s but is %s", name, expected, actual));
  }

  @Override
  public String toString() {
    return json.toString();
  }
}
