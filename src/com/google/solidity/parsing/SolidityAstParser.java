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

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.solidity.ast.SourceUnit;
import java.io.Reader;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Converts the JSON AST that solc emits for one compilation unit into a {@link SourceUnit}.
 *
 * <p>Both the compact format ({@code --ast-compact-json}, nodes tagged by {@code nodeType}) and the
 * legacy format ({@code --ast-json} before 0.8, nodes tagged by {@code name} with flat child lists)
 * are accepted. Instances hold only their options and may be shared between threads; every call
 * parses with a fresh format parser.
 *
 * <pre>{@code
 * SourceUnit unit = new SolidityAstParser().parse(json, AstFormat.COMPACT);
 * }</pre>
 */
public final class SolidityAstParser {
  private static final Logger logger = Logger.getLogger(SolidityAstParser.class.getName());

  private final ParserOptions options;

  public SolidityAstParser() {
    this(ParserOptions.defaults());
  }

  public SolidityAstParser(ParserOptions options) {
    this.options = checkNotNull(options);
  }

  public ParserOptions getOptions() {
    return options;
  }

  /** Parses a document whose format is detected from the shape of its root node. */
  public SourceUnit parse(String json) throws AstParseException {
    JsonObject root = readDocument(json);
    AstFormat format = AstFormat.detect(root);
    if (format == null) {
      throw AstParseException.invalidDocument(
          "the root node is in neither the compact nor the legacy format", null);
    }
    return parse(root, format);
  }

  public SourceUnit parse(String json, AstFormat format) throws AstParseException {
    return parse(readDocument(json), format);
  }

  public SourceUnit parse(Reader json, AstFormat format) throws AstParseException {
    JsonElement document;
    try {
      document = JsonParser.parseReader(json);
    } catch (JsonParseException e) {
      throw AstParseException.invalidDocument("the document is not valid JSON", e);
    }
    return parse(asObject(document), format);
  }

  public SourceUnit parse(JsonObject root, AstFormat format) throws AstParseException {
    checkNotNull(root);
    AbstractAstParser parser = newParser(checkNotNull(format));
    SourceUnit unit = parser.parseSourceUnit(RawNode.of(root));
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(
          String.format(
              "Parsed %s AST of %s with %d top-level nodes",
              parser.getFormat(), describe(unit), unit.getNodes().size()));
    }
    return unit;
  }

  private AbstractAstParser newParser(AstFormat format) {
    switch (format) {
      case COMPACT:
        return new CompactAstParser(options);
      case LEGACY:
        return new LegacyAstParser(options);
    }
    throw new AssertionError(format);
  }

  private static JsonObject readDocument(String json) throws AstParseException {
    checkNotNull(json);
    try {
      return asObject(JsonParser.parseString(json));
    } catch (JsonParseException e) {
      throw AstParseException.invalidDocument("the document is not valid JSON", e);
    }
  }

  private static JsonObject asObject(JsonElement document) throws AstParseException {
    if (!document.isJsonObject()) {
      throw AstParseException.invalidDocument(
          "the document root must be a JSON object but is " + describe(document), null);
    }
    return document.getAsJsonObject();
  }

  private static String describe(JsonElement document) {
    if (document.isJsonNull()) {
      return "null";
    }
    return document.isJsonArray() ? "an array" : "a primitive";
  }

  private static String describe(SourceUnit unit) {
    return unit.getName().isEmpty() ? "an unnamed source unit" : unit.getName();
  }
}
