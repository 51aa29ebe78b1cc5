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

import static com.google.solidity.parsing.LegacyChildLayouts.hasOptionalChild;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
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
import com.google.solidity.parsing.LegacyChildLayouts.ForChild;
import com.google.solidity.parsing.LegacyChildLayouts.ForLayout;
import com.google.solidity.parsing.LegacyChildLayouts.FunctionLayout;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Parses the legacy JSON AST. A raw node carries a {@code name} tag, an {@code id}, a {@code src}
 * range, an optional {@code attributes} mapping and a flat {@code children} list. Absent optional
 * children are left out of that list, so each kind lays out its children by the arity rules of
 * {@link LegacyChildLayouts}.
 */
final class LegacyAstParser extends AbstractAstParser {
  private static final Logger logger = Logger.getLogger(LegacyAstParser.class.getName());

  private final ImmutableMap<String, NodeExtractor> extractors;

  LegacyAstParser(ParserOptions options) {
    super(AstFormat.LEGACY, options);
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
            .put("PlaceholderStatement", raw -> PlaceholderStatement.create(base(raw)))
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
            // Releases up to 0.4.6 use this name for the same statement.
            .put("VariableDefinitionStatement", this::parseVariableDeclarationStatement)
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
    return raw.getString("name");
  }

  @Override
  ImmutableList<String> childKindsOf(RawNode raw) {
    if (!raw.isPresent("children") || !raw.getElement("children").isJsonArray()) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<String> kinds = ImmutableList.builder();
    for (JsonElement child : raw.getElement("children").getAsJsonArray()) {
      if (child.isJsonObject()
          && child.getAsJsonObject().has("name")
          && child.getAsJsonObject().get("name").isJsonPrimitive()) {
        kinds.add(child.getAsJsonObject().get("name").getAsString());
      } else {
        kinds.add(String.valueOf(child));
      }
    }
    return kinds.build();
  }

  // Properties shared by groups of node kinds.

  static RawNode attributes(RawNode raw) {
    // Releases before 0.4.12 omit the mapping on nodes without attributes.
    return raw.isPresent("attributes") ? raw.getObject("attributes") : RawNode.empty();
  }

  static BaseProperties base(RawNode raw) {
    return BaseProperties.create(raw.getId(), raw.getString("src"));
  }

  static ExpressionProperties expr(RawNode raw) {
    RawNode attributes = attributes(raw);
    return ExpressionProperties.create(
        base(raw),
        attributes.getString("type"),
        attributes.getBoolean("isConstant", false),
        attributes.getBoolean("isPure", false));
  }

  /** Declaration properties of functions, variables and contracts, which default to public. */
  static DeclarationProperties decl(RawNode raw) {
    return decl(raw, "public");
  }

  static DeclarationProperties decl(RawNode raw, @Nullable String defaultVisibility) {
    RawNode attributes = attributes(raw);
    String visibility = attributes.getOptionalString("visibility");
    return DeclarationProperties.create(
        base(raw),
        attributes.getString("name"),
        attributes.getString("canonicalName", ""),
        visibility == null ? defaultVisibility : visibility);
  }

  /**
   * Declaration properties of structs, enums, enum values, modifiers and events, which have no
   * default visibility and no canonical name unless the document gives one.
   */
  static DeclarationProperties memberDecl(RawNode raw) {
    return decl(raw, null).withCanonicalName(VersionedAttributes.canonicalName(attributes(raw)));
  }

  // Child access.

  private static ImmutableList<RawNode> children(RawNode raw) {
    return raw.getObjectListOrEmpty("children");
  }

  /** Returns the children of a kind whose child list may hold nulls for omitted entries. */
  private static ImmutableList<Optional<RawNode>> childSlots(RawNode raw) {
    return raw.isPresent("children") ? raw.getSlotList("children") : ImmutableList.of();
  }

  private ImmutableList<Node> parseChildren(RawNode raw) throws AstParseException {
    return parseAll(children(raw), Node.class, "child");
  }

  private <T extends Node> ImmutableList<T> parseChildren(
      RawNode raw, Class<T> expected, String role) throws AstParseException {
    return parseAll(children(raw), expected, role);
  }

  /** Parses the children of a kind whose child list has a fixed length. */
  private ImmutableList<Node> parseChildren(RawNode raw, int count) throws AstParseException {
    ImmutableList<RawNode> children = children(raw);
    LegacyChildLayouts.exactly(kindOf(raw), children.size(), count);
    return parseAll(children, Node.class, "child");
  }

  private static <T extends Node> ImmutableList<T> expectAll(
      List<Node> nodes, Class<T> expected, String role) {
    ImmutableList.Builder<T> result = ImmutableList.builder();
    for (Node node : nodes) {
      result.add(expect(node, expected, role));
    }
    return result.build();
  }

  private static @Nullable ImmutableList<Expression> argumentsOrNull(List<Node> arguments) {
    return arguments.isEmpty() ? null : expectAll(arguments, Expression.class, "argument");
  }

  // Source units and directives.

  private SourceUnit parseSourceUnitNode(RawNode raw) throws AstParseException {
    // The root carries no usable id or source range in this format.
    DeclarationProperties properties =
        DeclarationProperties.create(
            BaseProperties.synthetic(),
            attributes(raw).getString("absolutePath", ""),
            "",
            null);
    return SourceUnit.create(properties, parseChildren(raw));
  }

  private PragmaDirective parsePragmaDirective(RawNode raw) {
    return PragmaDirective.create(base(raw), attributes(raw).getStringList("literals"));
  }

  private ImportDirective parseImportDirective(RawNode raw) {
    RawNode attributes = attributes(raw);
    return ImportDirective.create(
        base(raw),
        attributes.getString("absolutePath"),
        attributes.getOptionalString("file"),
        attributes.getString("unitAlias", ""));
  }

  // Contracts and their members.

  private ContractDefinition parseContractDefinition(RawNode raw) throws AstParseException {
    RawNode attributes = attributes(raw);
    // Inheritance specifiers lead the child list, ahead of the contract members.
    ImmutableList.Builder<InheritanceSpecifier> baseContracts = ImmutableList.builder();
    ImmutableList.Builder<Node> nodes = ImmutableList.builder();
    for (Node child : parseChildren(raw)) {
      if (child instanceof InheritanceSpecifier) {
        baseContracts.add((InheritanceSpecifier) child);
      } else {
        nodes.add(child);
      }
    }
    return ContractDefinition.create(
        decl(raw),
        VersionedAttributes.contractKind(attributes),
        attributes.getIntList("linearizedBaseContracts"),
        baseContracts.build(),
        nodes.build());
  }

  private InheritanceSpecifier parseInheritanceSpecifier(RawNode raw) throws AstParseException {
    ImmutableList<Node> children = parseChildren(raw);
    LegacyChildLayouts.atLeast("InheritanceSpecifier", children.size(), 1);
    return InheritanceSpecifier.create(
        base(raw),
        expect(children.get(0), UserDefinedTypeName.class, "baseName"),
        argumentsOrNull(children.subList(1, children.size())));
  }

  private UsingForDirective parseUsingForDirective(RawNode raw) throws AstParseException {
    ImmutableList<Node> children = parseChildren(raw);
    boolean typeNamePresent = hasOptionalChild("UsingForDirective", children.size(), 1);
    return UsingForDirective.create(
        base(raw),
        expect(children.get(0), UserDefinedTypeName.class, "libraryName"),
        typeNamePresent ? expect(children.get(1), TypeName.class, "typeName") : null);
  }

  private StructDefinition parseStructDefinition(RawNode raw) throws AstParseException {
    return StructDefinition.create(
        memberDecl(raw), parseChildren(raw, VariableDeclaration.class, "struct member"));
  }

  private EnumDefinition parseEnumDefinition(RawNode raw) throws AstParseException {
    return EnumDefinition.create(
        memberDecl(raw), parseChildren(raw, EnumValue.class, "enum member"));
  }

  private EnumValue parseEnumValue(RawNode raw) {
    return EnumValue.create(memberDecl(raw));
  }

  private ParameterList parseParameterList(RawNode raw) throws AstParseException {
    return ParameterList.create(
        base(raw), parseSlots(childSlots(raw), VariableDeclaration.class, "parameter"));
  }

  private FunctionDefinition parseFunctionDefinition(RawNode raw) throws AstParseException {
    RawNode attributes = attributes(raw);
    DeclarationProperties declaration = decl(raw);
    ImmutableList<Node> children = parseChildren(raw);
    boolean lastIsBlock = !children.isEmpty() && Iterables.getLast(children) instanceof Block;
    FunctionLayout layout = LegacyChildLayouts.functionDefinition(children.size(), lastIsBlock);

    int modifiersEnd = 2 + layout.getModifierCount();
    CallProperties properties =
        CallProperties.create(
            declaration,
            expect(children.get(0), ParameterList.class, "parameters"),
            expect(children.get(1), ParameterList.class, "returnParameters"));
    return FunctionDefinition.create(
        properties,
        VersionedAttributes.functionMutability(attributes),
        VersionedAttributes.functionKind(attributes, declaration.getName()),
        expectAll(children.subList(2, modifiersEnd), ModifierInvocation.class, "modifier"),
        layout.isBodyPresent() ? (Block) children.get(modifiersEnd) : null);
  }

  private VariableDeclaration parseVariableDeclaration(RawNode raw) throws AstParseException {
    RawNode attributes = attributes(raw);
    ImmutableList<Node> children = parseChildren(raw);
    LegacyChildLayouts.between("VariableDeclaration", children.size(), 0, 2);

    // A variable declared with var has no type name, only an optional value.
    TypeName typeName = null;
    Expression value = null;
    if (children.size() == 2) {
      typeName = expect(children.get(0), TypeName.class, "typeName");
      value = expect(children.get(1), Expression.class, "value");
    } else if (children.size() == 1) {
      if (children.get(0) instanceof TypeName) {
        typeName = (TypeName) children.get(0);
      } else {
        value = expect(children.get(0), Expression.class, "value");
      }
    }
    return VariableDeclaration.builder(decl(raw), attributes.getString("type"))
        .setTypeName(typeName)
        .setValue(value)
        .setConstant(VersionedAttributes.variableConstant(attributes))
        .setStorageLocation(attributes.getOptionalString("storageLocation"))
        .setStateVariable(attributes.getBoolean("stateVariable", false))
        .setIndexed(attributes.getBoolean("indexed", false))
        .build();
  }

  private ModifierDefinition parseModifierDefinition(RawNode raw) throws AstParseException {
    ImmutableList<Node> children = parseChildren(raw);
    boolean bodyPresent = hasOptionalChild("ModifierDefinition", children.size(), 1);
    CallProperties properties =
        CallProperties.create(
            memberDecl(raw), expect(children.get(0), ParameterList.class, "parameters"), null);
    return ModifierDefinition.create(
        properties, bodyPresent ? expect(children.get(1), Block.class, "body") : null);
  }

  private ModifierInvocation parseModifierInvocation(RawNode raw) throws AstParseException {
    ImmutableList<Node> children = parseChildren(raw);
    LegacyChildLayouts.atLeast("ModifierInvocation", children.size(), 1);
    return ModifierInvocation.create(
        base(raw),
        expect(children.get(0), Identifier.class, "modifierName"),
        argumentsOrNull(children.subList(1, children.size())));
  }

  private EventDefinition parseEventDefinition(RawNode raw) throws AstParseException {
    ImmutableList<Node> children = parseChildren(raw, 1);
    CallProperties properties =
        CallProperties.create(
            memberDecl(raw), expect(children.get(0), ParameterList.class, "parameters"), null);
    return EventDefinition.create(properties, attributes(raw).getBoolean("anonymous", false));
  }

  // Type names.

  private ElementaryTypeName parseElementaryTypeName(RawNode raw) {
    RawNode attributes = attributes(raw);
    String name = attributes.getString("name");
    return ElementaryTypeName.create(
        base(raw), name, VersionedAttributes.elementaryTypeMutability(attributes, name));
  }

  private UserDefinedTypeName parseUserDefinedTypeName(RawNode raw) {
    return UserDefinedTypeName.create(base(raw), attributes(raw).getString("name"));
  }

  private FunctionTypeName parseFunctionTypeName(RawNode raw) throws AstParseException {
    RawNode attributes = attributes(raw);
    ImmutableList<Node> children = parseChildren(raw, 2);
    return FunctionTypeName.create(
        base(raw),
        expect(children.get(0), ParameterList.class, "parameterTypes"),
        expect(children.get(1), ParameterList.class, "returnParameterTypes"),
        VersionedAttributes.functionMutability(attributes),
        attributes.getString("visibility"));
  }

  private Mapping parseMapping(RawNode raw) throws AstParseException {
    ImmutableList<Node> children = parseChildren(raw, 2);
    return Mapping.create(
        base(raw),
        expect(children.get(0), TypeName.class, "keyType"),
        expect(children.get(1), TypeName.class, "valueType"));
  }

  private ArrayTypeName parseArrayTypeName(RawNode raw) throws AstParseException {
    ImmutableList<Node> children = parseChildren(raw);
    boolean lengthPresent = hasOptionalChild("ArrayTypeName", children.size(), 1);
    return ArrayTypeName.create(
        base(raw),
        expect(children.get(0), TypeName.class, "baseType"),
        lengthPresent ? expect(children.get(1), Expression.class, "length") : null);
  }

  // Statements.

  private InlineAssembly parseInlineAssembly(RawNode raw) {
    return InlineAssembly.create(base(raw), attributes(raw).getString("operations"));
  }

  private Block parseBlock(RawNode raw) throws AstParseException {
    return Block.create(base(raw), parseChildren(raw, Statement.class, "statement"));
  }

  private IfStatement parseIfStatement(RawNode raw) throws AstParseException {
    ImmutableList<Node> children = parseChildren(raw);
    boolean falseBodyPresent = hasOptionalChild("IfStatement", children.size(), 2);
    return IfStatement.create(
        base(raw),
        expect(children.get(0), Expression.class, "condition"),
        expect(children.get(1), Statement.class, "trueBody"),
        falseBodyPresent ? expect(children.get(2), Statement.class, "falseBody") : null);
  }

  private TryCatchClause parseTryCatchClause(RawNode raw) throws AstParseException {
    ImmutableList<Node> children = parseChildren(raw);
    // The parameter list leads the block and is absent for a catch-all clause.
    boolean parametersPresent = hasOptionalChild("TryCatchClause", children.size(), 1);
    return TryCatchClause.create(
        base(raw),
        attributes(raw).getString("errorName", ""),
        parametersPresent ? expect(children.get(0), ParameterList.class, "parameters") : null,
        expect(children.get(children.size() - 1), Block.class, "block"));
  }

  private TryStatement parseTryStatement(RawNode raw) throws AstParseException {
    ImmutableList<Node> children = parseChildren(raw);
    LegacyChildLayouts.atLeast("TryStatement", children.size(), 2);
    return TryStatement.create(
        base(raw),
        expect(children.get(0), Expression.class, "externalCall"),
        expectAll(children.subList(1, children.size()), TryCatchClause.class, "clause"));
  }

  private WhileStatement parseWhileStatement(RawNode raw, boolean doWhile)
      throws AstParseException {
    ImmutableList<Node> children = parseChildren(raw, 2);
    return WhileStatement.create(
        base(raw),
        expect(children.get(0), Expression.class, "condition"),
        expect(children.get(1), Statement.class, "body"),
        doWhile);
  }

  private ForStatement parseForStatement(RawNode raw) throws AstParseException {
    ImmutableList<Node> children = parseChildren(raw);
    List<ForChild> shape = new ArrayList<>();
    for (Node child : children) {
      if (child instanceof ExpressionStatement) {
        shape.add(ForChild.EXPRESSION_STATEMENT);
      } else if (child instanceof Statement) {
        shape.add(ForChild.OTHER_STATEMENT);
      } else {
        shape.add(ForChild.EXPRESSION);
      }
    }
    ForLayout layout = LegacyChildLayouts.forStatement(shape);
    if (layout.getConditionIndex() == ForLayout.ABSENT
        && layout.getInitializationIndex() != ForLayout.ABSENT
        && layout.getLoopExpressionIndex() == ForLayout.ABSENT
        && shape.get(layout.getInitializationIndex()) == ForChild.EXPRESSION_STATEMENT) {
      logger.log(
          Level.FINER,
          "ForStatement {0} has a single header statement, taken as the initialization",
          raw.getString("src"));
    }
    return ForStatement.create(
        base(raw),
        childAt(children, layout.getInitializationIndex(), Statement.class, "initialization"),
        childAt(children, layout.getConditionIndex(), Expression.class, "condition"),
        childAt(
            children, layout.getLoopExpressionIndex(), ExpressionStatement.class, "loopExpression"),
        expect(children.get(layout.getBodyIndex()), Statement.class, "body"));
  }

  private static <T extends Node> @Nullable T childAt(
      List<Node> children, int index, Class<T> expected, String role) {
    return index == ForLayout.ABSENT ? null : expect(children.get(index), expected, role);
  }

  private Return parseReturn(RawNode raw) throws AstParseException {
    ImmutableList<Node> children = parseChildren(raw);
    boolean expressionPresent = hasOptionalChild("Return", children.size(), 0);
    return Return.create(
        base(raw),
        expressionPresent ? expect(children.get(0), Expression.class, "expression") : null);
  }

  private EmitStatement parseEmitStatement(RawNode raw) throws AstParseException {
    ImmutableList<Node> children = parseChildren(raw, 1);
    return EmitStatement.create(
        base(raw), expect(children.get(0), FunctionCall.class, "eventCall"));
  }

  private VariableDeclarationStatement parseVariableDeclarationStatement(RawNode raw)
      throws AstParseException {
    ImmutableList<Optional<Node>> children = parseSlots(childSlots(raw), Node.class, "child");
    // An omitted entry can only stand for a declared variable, never for the initial value.
    boolean lastIsDeclaration =
        !children.isEmpty()
            && Iterables.getLast(children).map(VariableDeclaration.class::isInstance).orElse(true);
    int declarationCount = LegacyChildLayouts.declarationCount(children.size(), lastIsDeclaration);

    ImmutableList.Builder<Optional<VariableDeclaration>> declarations = ImmutableList.builder();
    for (Optional<Node> child : children.subList(0, declarationCount)) {
      if (child.isPresent()) {
        declarations.add(
            Optional.of(expect(child.get(), VariableDeclaration.class, "declaration")));
      } else {
        declarations.add(Optional.empty());
      }
    }
    Expression initialValue = null;
    if (declarationCount < children.size()) {
      initialValue =
          expect(children.get(declarationCount).get(), Expression.class, "initialValue");
    }
    return VariableDeclarationStatement.create(base(raw), declarations.build(), initialValue);
  }

  private ExpressionStatement parseExpressionStatement(RawNode raw) throws AstParseException {
    ImmutableList<Node> children = parseChildren(raw, 1);
    return ExpressionStatement.create(
        base(raw), expect(children.get(0), Expression.class, "expression"));
  }

  // Expressions.

  private Conditional parseConditional(RawNode raw) throws AstParseException {
    ImmutableList<Node> children = parseChildren(raw, 3);
    return Conditional.create(
        expr(raw),
        expect(children.get(0), Expression.class, "condition"),
        expect(children.get(1), Expression.class, "trueExpression"),
        expect(children.get(2), Expression.class, "falseExpression"));
  }

  private Assignment parseAssignment(RawNode raw) throws AstParseException {
    ImmutableList<Node> children = parseChildren(raw, 2);
    return Assignment.create(
        expr(raw),
        expect(children.get(0), Expression.class, "leftHandSide"),
        attributes(raw).getString("operator"),
        expect(children.get(1), Expression.class, "rightHandSide"));
  }

  private TupleExpression parseTupleExpression(RawNode raw) throws AstParseException {
    return TupleExpression.create(
        expr(raw),
        parseSlots(childSlots(raw), Expression.class, "component"),
        attributes(raw).getBoolean("isInlineArray", false));
  }

  private UnaryOperation parseUnaryOperation(RawNode raw) throws AstParseException {
    RawNode attributes = attributes(raw);
    ImmutableList<Node> children = parseChildren(raw, 1);
    return UnaryOperation.create(
        expr(raw),
        attributes.getString("operator"),
        expect(children.get(0), Expression.class, "subExpression"),
        attributes.getBoolean("prefix"));
  }

  private BinaryOperation parseBinaryOperation(RawNode raw) throws AstParseException {
    ImmutableList<Node> children = parseChildren(raw, 2);
    return BinaryOperation.create(
        expr(raw),
        expect(children.get(0), Expression.class, "leftExpression"),
        attributes(raw).getString("operator"),
        expect(children.get(1), Expression.class, "rightExpression"));
  }

  private FunctionCall parseFunctionCall(RawNode raw) throws AstParseException {
    RawNode attributes = attributes(raw);
    ExpressionProperties properties = expr(raw);
    ImmutableList<Node> children = parseChildren(raw);
    LegacyChildLayouts.atLeast("FunctionCall", children.size(), 1);
    return FunctionCall.create(
        properties,
        VersionedAttributes.functionCallKind(attributes, properties.getTypeString()),
        expect(children.get(0), Expression.class, "expression"),
        attributes.getStringListOrEmpty("names"),
        expectAll(children.subList(1, children.size()), Expression.class, "argument"));
  }

  private FunctionCallOptions parseFunctionCallOptions(RawNode raw) throws AstParseException {
    ImmutableList<Node> children = parseChildren(raw);
    LegacyChildLayouts.atLeast("FunctionCallOptions", children.size(), 1);
    return FunctionCallOptions.create(
        expr(raw),
        expect(children.get(0), Expression.class, "expression"),
        attributes(raw).getStringList("names"),
        expectAll(children.subList(1, children.size()), Expression.class, "option"));
  }

  private NewExpression parseNewExpression(RawNode raw) throws AstParseException {
    ImmutableList<Node> children = parseChildren(raw, 1);
    return NewExpression.create(expr(raw), expect(children.get(0), TypeName.class, "typeName"));
  }

  private MemberAccess parseMemberAccess(RawNode raw) throws AstParseException {
    ImmutableList<Node> children = parseChildren(raw, 1);
    return MemberAccess.create(
        expr(raw),
        expect(children.get(0), Expression.class, "expression"),
        attributes(raw).getString("member_name"));
  }

  private IndexAccess parseIndexAccess(RawNode raw) throws AstParseException {
    ImmutableList<Node> children = parseChildren(raw);
    boolean indexPresent = hasOptionalChild("IndexAccess", children.size(), 1);
    return IndexAccess.create(
        expr(raw),
        expect(children.get(0), Expression.class, "baseExpression"),
        indexPresent ? expect(children.get(1), Expression.class, "indexExpression") : null);
  }

  private IndexRangeAccess parseIndexRangeAccess(RawNode raw) throws AstParseException {
    ImmutableList<Node> children = parseChildren(raw);
    boolean endPresent = hasOptionalChild("IndexRangeAccess", children.size(), 2);
    return IndexRangeAccess.create(
        expr(raw),
        expect(children.get(0), Expression.class, "baseExpression"),
        expect(children.get(1), Expression.class, "startExpression"),
        endPresent ? expect(children.get(2), Expression.class, "endExpression") : null);
  }

  private Identifier parseIdentifier(RawNode raw) {
    return Identifier.create(expr(raw), attributes(raw).getString("value"));
  }

  private ElementaryTypeNameExpression parseElementaryTypeNameExpression(RawNode raw)
      throws AstParseException {
    ImmutableList<Node> children = parseChildren(raw);
    LegacyChildLayouts.between("ElementaryTypeNameExpression", children.size(), 0, 1);
    if (children.isEmpty()) {
      // Before 0.5 the type is given by name only.
      return ElementaryTypeNameExpression.createFromText(
          expr(raw), attributes(raw).getString("value"));
    }
    return ElementaryTypeNameExpression.create(
        expr(raw), expect(children.get(0), ElementaryTypeName.class, "typeName"));
  }

  private Literal parseLiteral(RawNode raw) {
    RawNode attributes = attributes(raw);
    return Literal.create(
        expr(raw),
        attributes.getString("token"),
        attributes.getOptionalString("value"),
        attributes.getString("hexvalue"),
        attributes.getOptionalString("subdenomination"));
  }
}
