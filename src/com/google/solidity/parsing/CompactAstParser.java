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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.gson.JsonElement;
import com.google.solidity.ast.ArrayTypeName;
import com.google.solidity.ast.Assignment;
import com.google.solidity.ast.BaseProperties;
import com.google.solidity.ast.BinaryOperation;
import com.google.solidity.ast.Block;
import com.google.solidity.ast.Break;
import com.google.solidity.ast.CallProperties;
import com.google.solidity.ast.Conditional;
import com.google.solidity.ast.Continue;
import com.google.solidity.ast.ContractDefinition;
import com.google.solidity.ast.DeclarationProperties;
import com.google.solidity.ast.ElementaryTypeName;
import com.google.solidity.ast.ElementaryTypeNameExpression;
import com.google.solidity.ast.EmitStatement;
import com.google.solidity.ast.EnumDefinition;
import com.google.solidity.ast.EnumValue;
import com.google.solidity.ast.EventDefinition;
import com.google.solidity.ast.Expression;
import com.google.solidity.ast.ExpressionProperties;
import com.google.solidity.ast.ExpressionStatement;
import com.google.solidity.ast.ForStatement;
import com.google.solidity.ast.FunctionCall;
import com.google.solidity.ast.FunctionCallOptions;
import com.google.solidity.ast.FunctionDefinition;
import com.google.solidity.ast.FunctionTypeName;
import com.google.solidity.ast.Identifier;
import com.google.solidity.ast.IfStatement;
import com.google.solidity.ast.ImportDirective;
import com.google.solidity.ast.IndexAccess;
import com.google.solidity.ast.IndexRangeAccess;
import com.google.solidity.ast.InheritanceSpecifier;
import com.google.solidity.ast.InlineAssembly;
import com.google.solidity.ast.Literal;
import com.google.solidity.ast.Mapping;
import com.google.solidity.ast.MemberAccess;
import com.google.solidity.ast.ModifierDefinition;
import com.google.solidity.ast.ModifierInvocation;
import com.google.solidity.ast.NewExpression;
import com.google.solidity.ast.Node;
import com.google.solidity.ast.ParameterList;
import com.google.solidity.ast.PlaceholderStatement;
import com.google.solidity.ast.PragmaDirective;
import com.google.solidity.ast.Return;
import com.google.solidity.ast.SourceUnit;
import com.google.solidity.ast.Statement;
import com.google.solidity.ast.StructDefinition;
import com.google.solidity.ast.Throw;
import com.google.solidity.ast.TryCatchClause;
import com.google.solidity.ast.TryStatement;
import com.google.solidity.ast.TupleExpression;
import com.google.solidity.ast.TypeName;
import com.google.solidity.ast.UnaryOperation;
import com.google.solidity.ast.UserDefinedTypeName;
import com.google.solidity.ast.UsingForDirective;
import com.google.solidity.ast.VariableDeclaration;
import com.google.solidity.ast.VariableDeclarationStatement;
import com.google.solidity.ast.WhileStatement;
import org.jspecify.annotations.Nullable;

/**
 * Parses the compact JSON AST. Every raw node carries a {@code nodeType} tag, an {@code id}, a
 * {@code src} range and named fields, so children are read by name and optional children are
 * simply null or missing.
 */
final class CompactAstParser extends AbstractAstParser {
  private final ImmutableMap<String, NodeExtractor> extractors;

  CompactAstParser(ParserOptions options) {
    super(AstFormat.COMPACT, options);
    this.extractors =
        ImmutableMap.<String, NodeExtractor>builder()
            .put("SourceUnit", this::parseSourceUnitNode)
            .put("PragmaDirective", this::parsePragmaDirective)
            .put("ImportDirective", this::parseImportDirective)
            .put("ContractDefinition", this::parseContractDefinition)
            .put("InheritanceSpecifier", this::parseInheritanceSpecifier)
            .put("UsingForDirective", this::parseUsingForDirective)
            .put("StructDefinition", this::parseStructDefinition)
            .put("EnumDefinition", this::parseEnumDefinition)
            .put("EnumValue", this::parseEnumValue)
            .put("ParameterList", this::parseParameterList)
            .put("FunctionDefinition", this::parseFunctionDefinition)
            .put("VariableDeclaration", this::parseVariableDeclaration)
            .put("ModifierDefinition", this::parseModifierDefinition)
            .put("ModifierInvocation", this::parseModifierInvocation)
            .put("EventDefinition", this::parseEventDefinition)
            .put("ElementaryTypeName", this::parseElementaryTypeName)
            .put("UserDefinedTypeName", this::parseUserDefinedTypeName)
            .put("FunctionTypeName", this::parseFunctionTypeName)
            .put("Mapping", this::parseMapping)
            .put("ArrayTypeName", this::parseArrayTypeName)
            .put("InlineAssembly", this::parseInlineAssembly)
            .put("Block", this::parseBlock)
            .put("PlaceholderStatement", this::parsePlaceholderStatement)
            .put("IfStatement", this::parseIfStatement)
            .put("TryCatchClause", this::parseTryCatchClause)
            .put("TryStatement", this::parseTryStatement)
            .put("WhileStatement", raw -> parseWhileStatement(raw, false))
            .put("DoWhileStatement", raw -> parseWhileStatement(raw, true))
            .put("ForStatement", this::parseForStatement)
            .put("Continue", raw -> Continue.create(base(raw)))
            .put("Break", raw -> Break.create(base(raw)))
            .put("Return", this::parseReturn)
            .put("Throw", raw -> Throw.create(base(raw)))
            .put("EmitStatement", this::parseEmitStatement)
            .put("VariableDeclarationStatement", this::parseVariableDeclarationStatement)
            .put("ExpressionStatement", this::parseExpressionStatement)
            .put("Conditional", this::parseConditional)
            .put("Assignment", this::parseAssignment)
            .put("TupleExpression", this::parseTupleExpression)
            .put("UnaryOperation", this::parseUnaryOperation)
            .put("BinaryOperation", this::parseBinaryOperation)
            .put("FunctionCall", this::parseFunctionCall)
            .put("FunctionCallOptions", this::parseFunctionCallOptions)
            .put("NewExpression", this::parseNewExpression)
            .put("MemberAccess", this::parseMemberAccess)
            .put("IndexAccess", this::parseIndexAccess)
            .put("IndexRangeAccess", this::parseIndexRangeAccess)
            .put("Identifier", this::parseIdentifier)
            .put("ElementaryTypeNameExpression", this::parseElementaryTypeNameExpression)
            .put("Literal", this::parseLiteral)
            .buildOrThrow();
  }

  @Override
  ImmutableSet<String> supportedKinds() {
    return extractors.keySet();
  }

  @Override
  @Nullable NodeExtractor extractorFor(String kind) {
    return extractors.get(kind);
  }

  @Override
  String kindOf(RawNode raw) {
    return raw.getString("nodeType");
  }

  // Properties shared by groups of node kinds.

  static BaseProperties base(RawNode raw) {
    return BaseProperties.create(raw.getId(), raw.getString("src"));
  }

  static ExpressionProperties expr(RawNode raw) {
    // Identifiers and a few other kinds never report isConstant and isPure.
    return ExpressionProperties.create(
        base(raw),
        typeString(raw),
        raw.getBoolean("isConstant", false),
        raw.getBoolean("isPure", false));
  }

  static DeclarationProperties decl(RawNode raw) {
    return DeclarationProperties.create(
        base(raw),
        raw.getString("name"),
        raw.getString("canonicalName", ""),
        raw.getOptionalString("visibility"));
  }

  /** Declaration properties of structs, enums, enum values, modifiers and events. */
  static DeclarationProperties memberDecl(RawNode raw) {
    return decl(raw).withCanonicalName(VersionedAttributes.canonicalName(raw));
  }

  CallProperties call(RawNode raw) throws AstParseException {
    return call(raw, decl(raw));
  }

  private CallProperties call(RawNode raw, DeclarationProperties declaration)
      throws AstParseException {
    ParameterList parameters =
        parse(raw.getObject("parameters"), ParameterList.class, "parameters");
    ParameterList returnParameters =
        raw.has("returnParameters")
            ? parse(raw.getObject("returnParameters"), ParameterList.class, "returnParameters")
            : null;
    return CallProperties.create(declaration, parameters, returnParameters);
  }

  private static String typeString(RawNode raw) {
    return raw.getObject("typeDescriptions").getString("typeString", "");
  }

  // Source units and directives.

  private SourceUnit parseSourceUnitNode(RawNode raw) throws AstParseException {
    DeclarationProperties properties =
        DeclarationProperties.create(base(raw), raw.getString("absolutePath", ""), "", null);
    return SourceUnit.create(properties, parseAll(raw.getObjectList("nodes"), Node.class, "node"));
  }

  private PragmaDirective parsePragmaDirective(RawNode raw) {
    return PragmaDirective.create(base(raw), raw.getStringList("literals"));
  }

  private ImportDirective parseImportDirective(RawNode raw) {
    return ImportDirective.create(
        base(raw),
        raw.getString("absolutePath"),
        raw.getOptionalString("file"),
        raw.getString("unitAlias", ""));
  }

  // Contracts and their members.

  private ContractDefinition parseContractDefinition(RawNode raw) throws AstParseException {
    return ContractDefinition.create(
        decl(raw),
        VersionedAttributes.contractKind(raw),
        raw.getIntList("linearizedBaseContracts"),
        parseAll(
            raw.getObjectListOrEmpty("baseContracts"),
            InheritanceSpecifier.class,
            "base contract"),
        parseAll(raw.getObjectList("nodes"), Node.class, "contract member"));
  }

  private InheritanceSpecifier parseInheritanceSpecifier(RawNode raw) throws AstParseException {
    UserDefinedTypeName baseName =
        parse(raw.getObject("baseName"), UserDefinedTypeName.class, "baseName");
    return InheritanceSpecifier.create(base(raw), baseName, parseArguments(raw));
  }

  private UsingForDirective parseUsingForDirective(RawNode raw) throws AstParseException {
    UserDefinedTypeName libraryName =
        parse(raw.getObject("libraryName"), UserDefinedTypeName.class, "libraryName");
    TypeName typeName =
        parseOptional(raw.getOptionalObject("typeName"), TypeName.class, "typeName");
    return UsingForDirective.create(base(raw), libraryName, typeName);
  }

  private StructDefinition parseStructDefinition(RawNode raw) throws AstParseException {
    return StructDefinition.create(
        memberDecl(raw),
        parseAll(raw.getObjectList("members"), VariableDeclaration.class, "struct member"));
  }

  private EnumDefinition parseEnumDefinition(RawNode raw) throws AstParseException {
    return EnumDefinition.create(
        memberDecl(raw),
        parseAll(raw.getObjectList("members"), EnumValue.class, "enum member"));
  }

  private EnumValue parseEnumValue(RawNode raw) {
    return EnumValue.create(memberDecl(raw));
  }

  private ParameterList parseParameterList(RawNode raw) throws AstParseException {
    return ParameterList.create(
        base(raw),
        parseSlots(raw.getSlotList("parameters"), VariableDeclaration.class, "parameter"));
  }

  private FunctionDefinition parseFunctionDefinition(RawNode raw) throws AstParseException {
    CallProperties properties = call(raw);
    return FunctionDefinition.create(
        properties,
        VersionedAttributes.functionMutability(raw),
        VersionedAttributes.functionKind(raw, properties.getDeclaration().getName()),
        parseAll(raw.getObjectList("modifiers"), ModifierInvocation.class, "modifier"),
        parseOptional(raw.getOptionalObject("body"), Block.class, "body"));
  }

  private VariableDeclaration parseVariableDeclaration(RawNode raw) throws AstParseException {
    return VariableDeclaration.builder(decl(raw), typeString(raw))
        .setTypeName(parseOptional(raw.getOptionalObject("typeName"), TypeName.class, "typeName"))
        .setValue(parseOptional(raw.getOptionalObject("value"), Expression.class, "value"))
        .setConstant(VersionedAttributes.variableConstant(raw))
        .setStorageLocation(raw.getOptionalString("storageLocation"))
        .setStateVariable(raw.getBoolean("stateVariable", false))
        .setIndexed(raw.getBoolean("indexed", false))
        .build();
  }

  private ModifierDefinition parseModifierDefinition(RawNode raw) throws AstParseException {
    return ModifierDefinition.create(
        call(raw, memberDecl(raw)),
        parseOptional(raw.getOptionalObject("body"), Block.class, "body"));
  }

  private ModifierInvocation parseModifierInvocation(RawNode raw) throws AstParseException {
    Identifier modifierName =
        parse(raw.getObject("modifierName"), Identifier.class, "modifierName");
    return ModifierInvocation.create(base(raw), modifierName, parseArguments(raw));
  }

  private EventDefinition parseEventDefinition(RawNode raw) throws AstParseException {
    return EventDefinition.create(call(raw, memberDecl(raw)), raw.getBoolean("anonymous", false));
  }

  /** Reads an {@code arguments} list that is null, or empty, when no arguments were given. */
  private @Nullable ImmutableList<Expression> parseArguments(RawNode raw)
      throws AstParseException {
    ImmutableList<RawNode> arguments = raw.getObjectListOrEmpty("arguments");
    return arguments.isEmpty() ? null : parseAll(arguments, Expression.class, "argument");
  }

  // Type names.

  private ElementaryTypeName parseElementaryTypeName(RawNode raw) {
    String name = raw.getString("name");
    return ElementaryTypeName.create(
        base(raw), name, VersionedAttributes.elementaryTypeMutability(raw, name));
  }

  private UserDefinedTypeName parseUserDefinedTypeName(RawNode raw) {
    // Since 0.8 the name is only given through the path node.
    String name =
        raw.isPresent("name") ? raw.getString("name") : raw.getObject("pathNode").getString("name");
    return UserDefinedTypeName.create(base(raw), name);
  }

  private FunctionTypeName parseFunctionTypeName(RawNode raw) throws AstParseException {
    return FunctionTypeName.create(
        base(raw),
        parse(raw.getObject("parameterTypes"), ParameterList.class, "parameterTypes"),
        parse(raw.getObject("returnParameterTypes"), ParameterList.class, "returnParameterTypes"),
        VersionedAttributes.functionMutability(raw),
        raw.getString("visibility"));
  }

  private Mapping parseMapping(RawNode raw) throws AstParseException {
    return Mapping.create(
        base(raw),
        parse(raw.getObject("keyType"), TypeName.class, "keyType"),
        parse(raw.getObject("valueType"), TypeName.class, "valueType"));
  }

  private ArrayTypeName parseArrayTypeName(RawNode raw) throws AstParseException {
    return ArrayTypeName.create(
        base(raw),
        parse(raw.getObject("baseType"), TypeName.class, "baseType"),
        parseOptional(raw.getOptionalObject("length"), Expression.class, "length"));
  }

  // Statements.

  private InlineAssembly parseInlineAssembly(RawNode raw) {
    String operations;
    if (raw.isPresent("AST")) {
      JsonElement yul = raw.getElement("AST");
      operations = yul.toString();
    } else {
      operations = raw.getString("operations");
    }
    return InlineAssembly.create(base(raw), operations);
  }

  private Block parseBlock(RawNode raw) throws AstParseException {
    return Block.create(
        base(raw), parseAll(raw.getObjectList("statements"), Statement.class, "statement"));
  }

  private PlaceholderStatement parsePlaceholderStatement(RawNode raw) {
    return PlaceholderStatement.create(base(raw));
  }

  private IfStatement parseIfStatement(RawNode raw) throws AstParseException {
    return IfStatement.create(
        base(raw),
        parse(raw.getObject("condition"), Expression.class, "condition"),
        parse(raw.getObject("trueBody"), Statement.class, "trueBody"),
        parseOptional(raw.getOptionalObject("falseBody"), Statement.class, "falseBody"));
  }

  private TryCatchClause parseTryCatchClause(RawNode raw) throws AstParseException {
    return TryCatchClause.create(
        base(raw),
        raw.getString("errorName"),
        parseOptional(raw.getOptionalObject("parameters"), ParameterList.class, "parameters"),
        parse(raw.getObject("block"), Block.class, "block"));
  }

  private TryStatement parseTryStatement(RawNode raw) throws AstParseException {
    return TryStatement.create(
        base(raw),
        parse(raw.getObject("externalCall"), Expression.class, "externalCall"),
        parseAll(raw.getObjectList("clauses"), TryCatchClause.class, "clause"));
  }

  private WhileStatement parseWhileStatement(RawNode raw, boolean doWhile)
      throws AstParseException {
    return WhileStatement.create(
        base(raw),
        parse(raw.getObject("condition"), Expression.class, "condition"),
        parse(raw.getObject("body"), Statement.class, "body"),
        doWhile);
  }

  private ForStatement parseForStatement(RawNode raw) throws AstParseException {
    return ForStatement.create(
        base(raw),
        parseOptional(
            raw.getOptionalObject("initializationExpression"),
            Statement.class,
            "initializationExpression"),
        parseOptional(raw.getOptionalObject("condition"), Expression.class, "condition"),
        parseOptional(
            raw.getOptionalObject("loopExpression"),
            ExpressionStatement.class,
            "loopExpression"),
        parse(raw.getObject("body"), Statement.class, "body"));
  }

  private Return parseReturn(RawNode raw) throws AstParseException {
    return Return.create(
        base(raw),
        parseOptional(raw.getOptionalObject("expression"), Expression.class, "expression"));
  }

  private EmitStatement parseEmitStatement(RawNode raw) throws AstParseException {
    return EmitStatement.create(
        base(raw), parse(raw.getObject("eventCall"), FunctionCall.class, "eventCall"));
  }

  private VariableDeclarationStatement parseVariableDeclarationStatement(RawNode raw)
      throws AstParseException {
    return VariableDeclarationStatement.create(
        base(raw),
        parseSlots(raw.getSlotList("declarations"), VariableDeclaration.class, "declaration"),
        parseOptional(raw.getOptionalObject("initialValue"), Expression.class, "initialValue"));
  }

  private ExpressionStatement parseExpressionStatement(RawNode raw) throws AstParseException {
    return ExpressionStatement.create(
        base(raw), parse(raw.getObject("expression"), Expression.class, "expression"));
  }

  // Expressions.

  private Conditional parseConditional(RawNode raw) throws AstParseException {
    return Conditional.create(
        expr(raw),
        parse(raw.getObject("condition"), Expression.class, "condition"),
        parse(raw.getObject("trueExpression"), Expression.class, "trueExpression"),
        parse(raw.getObject("falseExpression"), Expression.class, "falseExpression"));
  }

  private Assignment parseAssignment(RawNode raw) throws AstParseException {
    return Assignment.create(
        expr(raw),
        parse(raw.getObject("leftHandSide"), Expression.class, "leftHandSide"),
        raw.getString("operator"),
        parse(raw.getObject("rightHandSide"), Expression.class, "rightHandSide"));
  }

  private TupleExpression parseTupleExpression(RawNode raw) throws AstParseException {
    return TupleExpression.create(
        expr(raw),
        parseSlots(raw.getSlotList("components"), Expression.class, "component"),
        raw.getBoolean("isInlineArray", false));
  }

  private UnaryOperation parseUnaryOperation(RawNode raw) throws AstParseException {
    return UnaryOperation.create(
        expr(raw),
        raw.getString("operator"),
        parse(raw.getObject("subExpression"), Expression.class, "subExpression"),
        raw.getBoolean("prefix"));
  }

  private BinaryOperation parseBinaryOperation(RawNode raw) throws AstParseException {
    return BinaryOperation.create(
        expr(raw),
        parse(raw.getObject("leftExpression"), Expression.class, "leftExpression"),
        raw.getString("operator"),
        parse(raw.getObject("rightExpression"), Expression.class, "rightExpression"));
  }

  private FunctionCall parseFunctionCall(RawNode raw) throws AstParseException {
    ExpressionProperties properties = expr(raw);
    return FunctionCall.create(
        properties,
        VersionedAttributes.functionCallKind(raw, properties.getTypeString()),
        parse(raw.getObject("expression"), Expression.class, "expression"),
        raw.getStringListOrEmpty("names"),
        parseAll(raw.getObjectList("arguments"), Expression.class, "argument"));
  }

  private FunctionCallOptions parseFunctionCallOptions(RawNode raw) throws AstParseException {
    return FunctionCallOptions.create(
        expr(raw),
        parse(raw.getObject("expression"), Expression.class, "expression"),
        raw.getStringList("names"),
        parseAll(raw.getObjectList("options"), Expression.class, "option"));
  }

  private NewExpression parseNewExpression(RawNode raw) throws AstParseException {
    return NewExpression.create(
        expr(raw), parse(raw.getObject("typeName"), TypeName.class, "typeName"));
  }

  private MemberAccess parseMemberAccess(RawNode raw) throws AstParseException {
    return MemberAccess.create(
        expr(raw),
        parse(raw.getObject("expression"), Expression.class, "expression"),
        raw.getString("memberName"));
  }

  private IndexAccess parseIndexAccess(RawNode raw) throws AstParseException {
    return IndexAccess.create(
        expr(raw),
        parse(raw.getObject("baseExpression"), Expression.class, "baseExpression"),
        parseOptional(
            raw.getOptionalObject("indexExpression"), Expression.class, "indexExpression"));
  }

  private IndexRangeAccess parseIndexRangeAccess(RawNode raw) throws AstParseException {
    return IndexRangeAccess.create(
        expr(raw),
        parse(raw.getObject("baseExpression"), Expression.class, "baseExpression"),
        parseOptional(
            raw.getOptionalObject("startExpression"), Expression.class, "startExpression"),
        parseOptional(raw.getOptionalObject("endExpression"), Expression.class, "endExpression"));
  }

  private Identifier parseIdentifier(RawNode raw) {
    return Identifier.create(expr(raw), raw.getString("name"));
  }

  private ElementaryTypeNameExpression parseElementaryTypeNameExpression(RawNode raw)
      throws AstParseException {
    JsonElement typeName = raw.getElement("typeName");
    if (typeName.isJsonObject()) {
      return ElementaryTypeNameExpression.create(
          expr(raw), parse(raw.getObject("typeName"), ElementaryTypeName.class, "typeName"));
    }
    // Before 0.6 the type is given by name only.
    return ElementaryTypeNameExpression.createFromText(expr(raw), raw.getString("typeName"));
  }

  private Literal parseLiteral(RawNode raw) {
    return Literal.create(
        expr(raw),
        raw.getString("kind"),
        raw.getOptionalString("value"),
        raw.getString("hexValue"),
        raw.getOptionalString("subdenomination"));
  }
}
