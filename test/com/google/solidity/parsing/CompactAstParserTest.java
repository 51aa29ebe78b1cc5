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

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.gson.JsonObject;
import com.google.solidity.ast.ArrayTypeName;
import com.google.solidity.ast.Assignment;
import com.google.solidity.ast.BinaryOperation;
import com.google.solidity.ast.Conditional;
import com.google.solidity.ast.ContractDefinition;
import com.google.solidity.ast.ElementaryTypeName;
import com.google.solidity.ast.ElementaryTypeNameExpression;
import com.google.solidity.ast.EmitStatement;
import com.google.solidity.ast.EnumDefinition;
import com.google.solidity.ast.EventDefinition;
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
import com.google.solidity.ast.NodeKind;
import com.google.solidity.ast.ParameterList;
import com.google.solidity.ast.PragmaDirective;
import com.google.solidity.ast.Return;
import com.google.solidity.ast.SourceUnit;
import com.google.solidity.ast.StructDefinition;
import com.google.solidity.ast.TryStatement;
import com.google.solidity.ast.TupleExpression;
import com.google.solidity.ast.UnaryOperation;
import com.google.solidity.ast.UserDefinedTypeName;
import com.google.solidity.ast.UsingForDirective;
import com.google.solidity.ast.VariableDeclaration;
import com.google.solidity.ast.VariableDeclarationStatement;
import com.google.solidity.ast.WhileStatement;
import com.google.solidity.parsing.AstParseException.ErrorKind;
import java.util.Arrays;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link CompactAstParser}. */
@RunWith(JUnit4.class)
public final class CompactAstParserTest {

  private static <T extends Node> T parse(TestNodeBuilder node, Class<T> expected)
      throws AstParseException {
    return parse(node, expected, ParserOptions.defaults());
  }

  private static <T extends Node> T parse(
      TestNodeBuilder node, Class<T> expected, ParserOptions options) throws AstParseException {
    Node result = new CompactAstParser(options).parse(node.buildRaw());
    assertThat(result).isInstanceOf(expected);
    return expected.cast(result);
  }

  private static AstParseException parseFailure(TestNodeBuilder node) {
    return assertThrows(
        AstParseException.class,
        () -> new CompactAstParser(ParserOptions.defaults()).parse(node.buildRaw()));
  }

  private static TestNodeBuilder identifier(int id, String name) {
    return TestNodeBuilder.compact("Identifier", id).set("name", name).type("uint256");
  }

  private static TestNodeBuilder number(int id, String value) {
    return TestNodeBuilder.compact("Literal", id)
        .set("kind", "number")
        .set("value", value)
        .set("hexValue", "3" + value)
        .set("subdenomination", null)
        .type("int_const " + value);
  }

  private static TestNodeBuilder elementary(int id, String name) {
    return TestNodeBuilder.compact("ElementaryTypeName", id).set("name", name);
  }

  private static TestNodeBuilder variable(int id, String name) {
    return TestNodeBuilder.compact("VariableDeclaration", id)
        .set("name", name)
        .set("visibility", "internal")
        .set("typeName", elementary(id + 100, "uint256"))
        .set("value", null)
        .set("constant", false)
        .set("stateVariable", false)
        .set("storageLocation", "default")
        .type("uint256");
  }

  private static TestNodeBuilder parameters(int id, Object... parameters) {
    return TestNodeBuilder.compact("ParameterList", id).set("parameters", parameters);
  }

  private static TestNodeBuilder block(int id, Object... statements) {
    return TestNodeBuilder.compact("Block", id).set("statements", statements);
  }

  private static TestNodeBuilder expressionStatement(int id, TestNodeBuilder expression) {
    return TestNodeBuilder.compact("ExpressionStatement", id).set("expression", expression);
  }

  private static TestNodeBuilder call(int id, TestNodeBuilder callee, Object... arguments) {
    return TestNodeBuilder.compact("FunctionCall", id)
        .set("kind", "functionCall")
        .set("expression", callee)
        .set("names", ImmutableList.of())
        .set("arguments", arguments)
        .type("tuple()");
  }

  private static TestNodeBuilder userType(int id, String name) {
    return TestNodeBuilder.compact("UserDefinedTypeName", id).set("name", name);
  }

  /** Returns the smallest well-formed node of the given kind. */
  private static TestNodeBuilder minimalNode(String nodeType) {
    TestNodeBuilder node = TestNodeBuilder.compact(nodeType, 1);
    switch (nodeType) {
      case "SourceUnit":
        return node.set("nodes", ImmutableList.of());
      case "PragmaDirective":
        return node.set("literals", ImmutableList.of("solidity"));
      case "ImportDirective":
        return node.set("absolutePath", "a.sol");
      case "ContractDefinition":
        return node.set("name", "C")
            .set("contractKind", "contract")
            .set("linearizedBaseContracts", ImmutableList.of(1))
            .set("nodes", ImmutableList.of());
      case "InheritanceSpecifier":
        return node.set("baseName", userType(2, "B"));
      case "UsingForDirective":
        return node.set("libraryName", userType(2, "L"));
      case "StructDefinition":
      case "EnumDefinition":
        return node.set("name", "T").set("members", ImmutableList.of());
      case "EnumValue":
        return node.set("name", "A");
      case "ParameterList":
        return parameters(1);
      case "FunctionDefinition":
        return node.set("name", "f")
            .set("kind", "function")
            .set("stateMutability", "nonpayable")
            .set("parameters", parameters(2))
            .set("returnParameters", parameters(3))
            .set("modifiers", ImmutableList.of())
            .set("body", null);
      case "VariableDeclaration":
        return variable(1, "x");
      case "ModifierDefinition":
        return node.set("name", "m").set("parameters", parameters(2)).set("body", block(3));
      case "ModifierInvocation":
        return node.set("modifierName", identifier(2, "m"));
      case "EventDefinition":
        return node.set("name", "E").set("parameters", parameters(2));
      case "ElementaryTypeName":
        return elementary(1, "uint256");
      case "UserDefinedTypeName":
        return userType(1, "T");
      case "FunctionTypeName":
        return node.set("parameterTypes", parameters(2))
            .set("returnParameterTypes", parameters(3))
            .set("stateMutability", "view")
            .set("visibility", "internal");
      case "Mapping":
        return node.set("keyType", elementary(2, "address"))
            .set("valueType", elementary(3, "uint256"));
      case "ArrayTypeName":
        return node.set("baseType", elementary(2, "uint256"));
      case "InlineAssembly":
        return node.set("operations", "{}");
      case "Block":
        return block(1);
      case "IfStatement":
      case "WhileStatement":
      case "DoWhileStatement":
        return node.set("condition", identifier(2, "c"))
            .set(nodeType.equals("IfStatement") ? "trueBody" : "body", block(3));
      case "TryCatchClause":
        return node.set("errorName", "").set("block", block(2));
      case "TryStatement":
        return node.set("externalCall", call(2, identifier(3, "f")))
            .set(
                "clauses",
                ImmutableList.of(
                    TestNodeBuilder.compact("TryCatchClause", 4)
                        .set("errorName", "")
                        .set("block", block(5))));
      case "ForStatement":
        return node.set("body", block(2));
      case "EmitStatement":
        return node.set("eventCall", call(2, identifier(3, "E")));
      case "VariableDeclarationStatement":
        return node.set("declarations", ImmutableList.of(variable(2, "x")));
      case "ExpressionStatement":
        return expressionStatement(1, identifier(2, "x"));
      case "Conditional":
        return node.set("condition", identifier(2, "c"))
            .set("trueExpression", number(3, "1"))
            .set("falseExpression", number(4, "2"))
            .type("uint8");
      case "Assignment":
        return node.set("leftHandSide", identifier(2, "x"))
            .set("operator", "=")
            .set("rightHandSide", number(3, "1"))
            .type("uint256");
      case "TupleExpression":
        return node.set("components", ImmutableList.of()).type("tuple()");
      case "UnaryOperation":
        return node.set("operator", "-")
            .set("subExpression", identifier(2, "x"))
            .set("prefix", true)
            .type("uint256");
      case "BinaryOperation":
        return node.set("leftExpression", identifier(2, "x"))
            .set("operator", "+")
            .set("rightExpression", number(3, "1"))
            .type("uint256");
      case "FunctionCall":
        return call(1, identifier(2, "f"));
      case "FunctionCallOptions":
        return node.set("expression", identifier(2, "f"))
            .set("names", ImmutableList.of())
            .set("options", ImmutableList.of())
            .type("function ()");
      case "NewExpression":
        return node.set("typeName", userType(2, "C")).type("function () returns (contract C)");
      case "MemberAccess":
        return node.set("expression", identifier(2, "x"))
            .set("memberName", "length")
            .type("uint256");
      case "IndexAccess":
      case "IndexRangeAccess":
        return node.set("baseExpression", identifier(2, "x")).type("uint256");
      case "Identifier":
        return identifier(1, "x");
      case "ElementaryTypeNameExpression":
        return node.set("typeName", "uint256").type("type(uint256)");
      case "Literal":
        return number(1, "1");
      default:
        // Continue, Break, Throw and PlaceholderStatement carry nothing beyond id and src.
        return node;
    }
  }

  @Test
  public void testEveryNodeKindIsSupported() {
    ImmutableSet<String> supported =
        new CompactAstParser(ParserOptions.defaults()).supportedKinds();

    for (NodeKind kind : NodeKind.values()) {
      assertThat(supported).contains(kind.getTag());
    }
    assertThat(supported).hasSize(NodeKind.values().length);
  }

  @Test
  public void testEveryNodeKindParsesFromMinimalNode() throws Exception {
    for (String nodeType : new CompactAstParser(ParserOptions.defaults()).supportedKinds()) {
      Node node = parse(minimalNode(nodeType), Node.class);

      assertWithMessage(nodeType).that(node.getKind().getTag()).isEqualTo(nodeType);
      assertWithMessage(nodeType).that(node.getId()).isEqualTo(1);
    }
  }

  @Test
  public void testLiteral() throws Exception {
    Literal literal = parse(number(5, "1").set("src", "0:1:0"), Literal.class);

    assertThat(literal.getId()).isEqualTo(5);
    assertThat(literal.getSourceRange()).isEqualTo("0:1:0");
    assertThat(literal.getLiteralKind()).isEqualTo("number");
    assertThat(literal.getValue()).isEqualTo("1");
    assertThat(literal.getHexValue()).isEqualTo("31");
    assertThat(literal.getSubdenomination()).isNull();
    assertThat(literal.getTypeString()).isEqualTo("int_const 1");
    assertThat(literal.isConstant()).isFalse();
    assertThat(literal.isPure()).isFalse();
  }

  @Test
  public void testLiteral_valueMayBeNull() throws Exception {
    Literal literal =
        parse(
            TestNodeBuilder.compact("Literal", 1)
                .set("kind", "unicodeString")
                .set("value", null)
                .set("hexValue", "e29883")
                .type("literal_string"),
            Literal.class);

    assertThat(literal.getValue()).isNull();
    assertThat(literal.getSubdenomination()).isNull();
  }

  @Test
  public void testIdentifier_flagsDefaultToFalse() throws Exception {
    Identifier identifier = parse(identifier(3, "count"), Identifier.class);

    assertThat(identifier.getName()).isEqualTo("count");
    assertThat(identifier.getTypeString()).isEqualTo("uint256");
    assertThat(identifier.isConstant()).isFalse();
    assertThat(identifier.isPure()).isFalse();
  }

  @Test
  public void testExpressionFlags() throws Exception {
    Identifier identifier =
        parse(identifier(3, "LIMIT").set("isConstant", true).set("isPure", true), Identifier.class);

    assertThat(identifier.isConstant()).isTrue();
    assertThat(identifier.isPure()).isTrue();
  }

  @Test
  public void testMissingTypeStringDefaultsToEmpty() throws Exception {
    Identifier identifier =
        parse(
            TestNodeBuilder.compact("Identifier", 3)
                .set("name", "x")
                .set("typeDescriptions", new JsonObject()),
            Identifier.class);

    assertThat(identifier.getTypeString()).isEmpty();
  }

  @Test
  public void testSourceUnit() throws Exception {
    SourceUnit unit =
        parse(
            TestNodeBuilder.compact("SourceUnit", 20)
                .set("absolutePath", "Counter.sol")
                .set(
                    "nodes",
                    ImmutableList.of(
                        TestNodeBuilder.compact("PragmaDirective", 1)
                            .set("literals", ImmutableList.of("solidity", "^", "0.8", ".0")))),
            SourceUnit.class);

    assertThat(unit.getId()).isEqualTo(20);
    assertThat(unit.getName()).isEqualTo("Counter.sol");
    assertThat(unit.getCanonicalName()).isEmpty();
    assertThat(unit.getVisibility()).isNull();
    assertThat(unit.getNodes()).hasSize(1);
    PragmaDirective pragma = (PragmaDirective) unit.getNodes().get(0);
    assertThat(pragma.getLiterals()).containsExactly("solidity", "^", "0.8", ".0").inOrder();
  }

  @Test
  public void testImportDirective() throws Exception {
    ImportDirective directive =
        parse(
            TestNodeBuilder.compact("ImportDirective", 2)
                .set("absolutePath", "lib/Math.sol")
                .set("file", "./Math.sol")
                .set("unitAlias", ""),
            ImportDirective.class);

    assertThat(directive.getAbsolutePath()).isEqualTo("lib/Math.sol");
    assertThat(directive.getFile()).isEqualTo("./Math.sol");
    assertThat(directive.getUnitAlias()).isEmpty();
  }

  @Test
  public void testContractDefinition() throws Exception {
    TestNodeBuilder baseName =
        TestNodeBuilder.compact("UserDefinedTypeName", 11)
            .set("pathNode", TestNodeBuilder.compact("IdentifierPath", 10).set("name", "Owned"))
            .type("contract Owned");
    ContractDefinition contract =
        parse(
            TestNodeBuilder.compact("ContractDefinition", 12)
                .set("name", "Token")
                .set("contractKind", "contract")
                .set("linearizedBaseContracts", ImmutableList.of(12, 9))
                .set(
                    "baseContracts",
                    ImmutableList.of(
                        TestNodeBuilder.compact("InheritanceSpecifier", 13)
                            .set("baseName", baseName)
                            .set("arguments", null)))
                .set("nodes", ImmutableList.of(variable(14, "supply"))),
            ContractDefinition.class);

    assertThat(contract.getName()).isEqualTo("Token");
    assertThat(contract.getContractKind()).isEqualTo("contract");
    assertThat(contract.getLinearizedBaseContracts()).containsExactly(12, 9).inOrder();
    InheritanceSpecifier specifier = contract.getBaseContracts().get(0);
    assertThat(specifier.getBaseName().getName()).isEqualTo("Owned");
    assertThat(specifier.getArguments()).isNull();
    assertThat(contract.getNodes()).hasSize(1);
    assertThat(contract.getNodes().get(0)).isInstanceOf(VariableDeclaration.class);
  }

  @Test
  public void testContractDefinition_kindResolvedFromFlags() throws Exception {
    ContractDefinition contract =
        parse(
            TestNodeBuilder.compact("ContractDefinition", 1)
                .set("name", "L")
                .set("isLibrary", true)
                .set("fullyImplemented", true)
                .set("linearizedBaseContracts", ImmutableList.of(1))
                .set("nodes", ImmutableList.of()),
            ContractDefinition.class);

    assertThat(contract.getContractKind()).isEqualTo("library");
    assertThat(contract.getBaseContracts()).isEmpty();
  }

  @Test
  public void testUsingForDirective_wildcard() throws Exception {
    UsingForDirective directive =
        parse(
            TestNodeBuilder.compact("UsingForDirective", 1)
                .set(
                    "libraryName",
                    TestNodeBuilder.compact("UserDefinedTypeName", 2).set("name", "SafeMath"))
                .set("typeName", null),
            UsingForDirective.class);

    assertThat(directive.getLibraryName().getName()).isEqualTo("SafeMath");
    assertThat(directive.getTypeName()).isNull();
  }

  @Test
  public void testStructDefinition() throws Exception {
    StructDefinition struct =
        parse(
            TestNodeBuilder.compact("StructDefinition", 1)
                .set("name", "Point")
                .set("canonicalName", "Shapes.Point")
                .set("visibility", "public")
                .set("members", ImmutableList.of(variable(2, "x"), variable(3, "y"))),
            StructDefinition.class);

    assertThat(struct.getCanonicalName()).isEqualTo("Shapes.Point");
    assertThat(struct.getMembers()).hasSize(2);
    assertThat(struct.getMembers().get(1).getName()).isEqualTo("y");
  }

  @Test
  public void testEnumDefinition_withoutCanonicalName() throws Exception {
    EnumDefinition definition =
        parse(
            TestNodeBuilder.compact("EnumDefinition", 1)
                .set("name", "State")
                .set(
                    "members",
                    ImmutableList.of(
                        TestNodeBuilder.compact("EnumValue", 2).set("name", "Open"),
                        TestNodeBuilder.compact("EnumValue", 3).set("name", "Closed"))),
            EnumDefinition.class);

    assertThat(definition.getCanonicalName()).isNull();
    assertThat(definition.getMembers()).hasSize(2);
    assertThat(definition.getMembers().get(0).getName()).isEqualTo("Open");
    assertThat(definition.getMembers().get(0).getCanonicalName()).isNull();
  }

  @Test
  public void testParameterList_keepsEmptySlots() throws Exception {
    ParameterList list =
        parse(
            TestNodeBuilder.compact("ParameterList", 1)
                .set("parameters", Arrays.asList(variable(2, "a"), null, variable(3, "c"))),
            ParameterList.class);

    assertThat(list.getParameters()).hasSize(3);
    assertThat(list.getParameters().get(1)).isEmpty();
    assertThat(list.getParameters().get(2).get().getName()).isEqualTo("c");
  }

  @Test
  public void testFunctionDefinition() throws Exception {
    FunctionDefinition function =
        parse(
            TestNodeBuilder.compact("FunctionDefinition", 30)
                .set("name", "increment")
                .set("visibility", "public")
                .set("stateMutability", "nonpayable")
                .set("kind", "function")
                .set("parameters", parameters(31, variable(32, "by")))
                .set("returnParameters", parameters(33))
                .set(
                    "modifiers",
                    ImmutableList.of(
                        TestNodeBuilder.compact("ModifierInvocation", 34)
                            .set("modifierName", identifier(35, "onlyOwner"))
                            .set("arguments", ImmutableList.of())))
                .set("body", block(36)),
            FunctionDefinition.class);

    assertThat(function.getName()).isEqualTo("increment");
    assertThat(function.getVisibility()).isEqualTo("public");
    assertThat(function.getStateMutability()).isEqualTo("nonpayable");
    assertThat(function.getFunctionKind()).isEqualTo("function");
    assertThat(function.getParameters().getParameters()).hasSize(1);
    assertThat(function.getReturnParameters().getParameters()).isEmpty();
    ModifierInvocation modifier = function.getModifiers().get(0);
    assertThat(modifier.getModifierName().getName()).isEqualTo("onlyOwner");
    assertThat(modifier.getArguments()).isNull();
    assertThat(function.getBody().getStatements()).isEmpty();
  }

  @Test
  public void testFunctionDefinition_unimplementedOldRelease() throws Exception {
    FunctionDefinition function =
        parse(
            TestNodeBuilder.compact("FunctionDefinition", 1)
                .set("name", "")
                .set("visibility", "public")
                .set("payable", false)
                .set("isConstructor", false)
                .set("parameters", parameters(2))
                .set("returnParameters", parameters(3))
                .set("modifiers", ImmutableList.of())
                .set("body", null),
            FunctionDefinition.class);

    assertThat(function.getStateMutability()).isEqualTo("nonpayable");
    assertThat(function.getFunctionKind()).isEqualTo("fallback");
    assertThat(function.getBody()).isNull();
  }

  @Test
  public void testModifierAndEventDefinitions() throws Exception {
    ModifierDefinition modifier =
        parse(
            TestNodeBuilder.compact("ModifierDefinition", 1)
                .set("name", "onlyOwner")
                .set("visibility", "internal")
                .set("parameters", parameters(2))
                .set(
                    "body",
                    block(3, TestNodeBuilder.compact("PlaceholderStatement", 4))),
            ModifierDefinition.class);
    EventDefinition event =
        parse(
            TestNodeBuilder.compact("EventDefinition", 5)
                .set("name", "Transfer")
                .set("anonymous", true)
                .set("parameters", parameters(6, variable(7, "amount").set("indexed", true))),
            EventDefinition.class);

    assertThat(modifier.getReturnParameters()).isNull();
    assertThat(modifier.getBody().getStatements().get(0).getKind())
        .isEqualTo(NodeKind.PLACEHOLDER_STATEMENT);
    assertThat(event.isAnonymous()).isTrue();
    assertThat(event.getParameters().getParameters().get(0).get().isIndexed()).isTrue();
    assertThat(modifier.getCanonicalName()).isNull();
    assertThat(event.getCanonicalName()).isNull();
  }

  @Test
  public void testVariableDeclaration() throws Exception {
    VariableDeclaration declaration =
        parse(
            variable(1, "MAX")
                .set("constant", true)
                .set("stateVariable", true)
                .set("value", number(2, "9")),
            VariableDeclaration.class);

    assertThat(declaration.getName()).isEqualTo("MAX");
    assertThat(declaration.getTypeString()).isEqualTo("uint256");
    assertThat(((ElementaryTypeName) declaration.getTypeName()).getName()).isEqualTo("uint256");
    assertThat(declaration.getValue()).isInstanceOf(Literal.class);
    assertThat(declaration.isConstant()).isTrue();
    assertThat(declaration.isStateVariable()).isTrue();
    assertThat(declaration.getStorageLocation()).isEqualTo("default");
  }

  @Test
  public void testVariableDeclaration_constantFromMutability() throws Exception {
    VariableDeclaration declaration =
        parse(
            variable(1, "MAX").remove("constant").set("mutability", "constant"),
            VariableDeclaration.class);

    assertThat(declaration.isConstant()).isTrue();
  }

  @Test
  public void testTypeNames() throws Exception {
    Mapping mapping =
        parse(
            TestNodeBuilder.compact("Mapping", 1)
                .set("keyType", elementary(2, "address"))
                .set(
                    "valueType",
                    TestNodeBuilder.compact("ArrayTypeName", 3)
                        .set("baseType", elementary(4, "uint8"))
                        .set("length", number(5, "4"))),
            Mapping.class);
    FunctionTypeName functionType =
        parse(
            TestNodeBuilder.compact("FunctionTypeName", 6)
                .set("parameterTypes", parameters(7))
                .set("returnParameterTypes", parameters(8))
                .set("stateMutability", "view")
                .set("visibility", "external"),
            FunctionTypeName.class);

    // Before 0.5 an address is payable without saying so.
    assertThat(((ElementaryTypeName) mapping.getKeyType()).getStateMutability())
        .isEqualTo("payable");
    ArrayTypeName array = (ArrayTypeName) mapping.getValueType();
    assertThat(array.getLength()).isInstanceOf(Literal.class);
    assertThat(functionType.getStateMutability()).isEqualTo("view");
    assertThat(functionType.getVisibility()).isEqualTo("external");
  }

  @Test
  public void testUserDefinedTypeName_nameFromPathNode() throws Exception {
    UserDefinedTypeName typeName =
        parse(
            TestNodeBuilder.compact("UserDefinedTypeName", 1)
                .set(
                    "pathNode",
                    TestNodeBuilder.compact("IdentifierPath", 2).set("name", "IERC20")),
            UserDefinedTypeName.class);

    assertThat(typeName.getName()).isEqualTo("IERC20");
  }

  @Test
  public void testInlineAssembly() throws Exception {
    JsonObject yul = new JsonObject();
    yul.addProperty("nodeType", "YulBlock");
    InlineAssembly withAst =
        parse(TestNodeBuilder.compact("InlineAssembly", 1).set("AST", yul), InlineAssembly.class);
    InlineAssembly withText =
        parse(
            TestNodeBuilder.compact("InlineAssembly", 2).set("operations", "{ mstore(0, 1) }"),
            InlineAssembly.class);

    assertThat(withAst.getOperations()).isEqualTo("{\"nodeType\":\"YulBlock\"}");
    assertThat(withText.getOperations()).isEqualTo("{ mstore(0, 1) }");
  }

  @Test
  public void testControlFlowStatements() throws Exception {
    IfStatement ifStatement =
        parse(
            TestNodeBuilder.compact("IfStatement", 1)
                .set("condition", identifier(2, "ok"))
                .set("trueBody", TestNodeBuilder.compact("Break", 3))
                .set("falseBody", null),
            IfStatement.class);
    WhileStatement doWhile =
        parse(
            TestNodeBuilder.compact("DoWhileStatement", 4)
                .set("condition", identifier(5, "ok"))
                .set("body", TestNodeBuilder.compact("Continue", 6)),
            WhileStatement.class);
    ForStatement forStatement =
        parse(
            TestNodeBuilder.compact("ForStatement", 7)
                .set("initializationExpression", null)
                .set("condition", identifier(8, "ok"))
                .set("loopExpression", null)
                .set("body", block(9)),
            ForStatement.class);

    assertThat(ifStatement.getTrueBody().getKind()).isEqualTo(NodeKind.BREAK);
    assertThat(ifStatement.getFalseBody()).isNull();
    assertThat(doWhile.isDoWhile()).isTrue();
    assertThat(doWhile.getKind()).isEqualTo(NodeKind.DO_WHILE_STATEMENT);
    assertThat(forStatement.getInitializationExpression()).isNull();
    assertThat(forStatement.getCondition()).isInstanceOf(Identifier.class);
    assertThat(forStatement.getLoopExpression()).isNull();
  }

  @Test
  public void testTryStatement() throws Exception {
    TryStatement statement =
        parse(
            TestNodeBuilder.compact("TryStatement", 1)
                .set("externalCall", call(2, identifier(3, "transfer")))
                .set(
                    "clauses",
                    ImmutableList.of(
                        TestNodeBuilder.compact("TryCatchClause", 4)
                            .set("errorName", "")
                            .set("parameters", null)
                            .set("block", block(5)),
                        TestNodeBuilder.compact("TryCatchClause", 6)
                            .set("errorName", "Error")
                            .set("parameters", parameters(7, variable(8, "reason")))
                            .set("block", block(9)))),
            TryStatement.class);

    assertThat(statement.getClauses()).hasSize(2);
    assertThat(statement.getClauses().get(0).getParameters()).isNull();
    assertThat(statement.getClauses().get(1).getErrorName()).isEqualTo("Error");
  }

  @Test
  public void testReturnEmitAndDeclarationStatements() throws Exception {
    Return bareReturn =
        parse(TestNodeBuilder.compact("Return", 1).set("expression", null), Return.class);
    EmitStatement emit =
        parse(
            TestNodeBuilder.compact("EmitStatement", 2)
                .set("eventCall", call(3, identifier(4, "Transfer"), number(5, "1"))),
            EmitStatement.class);
    VariableDeclarationStatement declarations =
        parse(
            TestNodeBuilder.compact("VariableDeclarationStatement", 6)
                .set("declarations", Arrays.asList(null, variable(7, "b")))
                .set("initialValue", call(8, identifier(9, "pair"))),
            VariableDeclarationStatement.class);

    assertThat(bareReturn.getExpression()).isNull();
    assertThat(emit.getEventCall().getArguments()).hasSize(1);
    assertThat(declarations.getDeclarations()).hasSize(2);
    assertThat(declarations.getDeclarations().get(0)).isEmpty();
    assertThat(declarations.getDeclarations().get(1).get().getName()).isEqualTo("b");
    assertThat(declarations.getInitialValue()).isInstanceOf(FunctionCall.class);
  }

  @Test
  public void testOperators() throws Exception {
    Assignment assignment =
        parse(
            TestNodeBuilder.compact("Assignment", 1)
                .set("leftHandSide", identifier(2, "count"))
                .set("operator", "+=")
                .set("rightHandSide", number(3, "1"))
                .type("uint256"),
            Assignment.class);
    BinaryOperation binary =
        parse(
            TestNodeBuilder.compact("BinaryOperation", 4)
                .set("leftExpression", identifier(5, "a"))
                .set("operator", "<")
                .set("rightExpression", identifier(6, "b"))
                .type("bool"),
            BinaryOperation.class);
    UnaryOperation unary =
        parse(
            TestNodeBuilder.compact("UnaryOperation", 7)
                .set("operator", "++")
                .set("prefix", false)
                .set("subExpression", identifier(8, "i"))
                .type("uint256"),
            UnaryOperation.class);
    Conditional conditional =
        parse(
            TestNodeBuilder.compact("Conditional", 9)
                .set("condition", identifier(10, "flag"))
                .set("trueExpression", number(11, "1"))
                .set("falseExpression", number(12, "2"))
                .type("uint8"),
            Conditional.class);

    assertThat(assignment.getOperator()).isEqualTo("+=");
    assertThat(binary.getOperator()).isEqualTo("<");
    assertThat(binary.getTypeString()).isEqualTo("bool");
    assertThat(unary.isPrefix()).isFalse();
    assertThat(((Identifier) conditional.getCondition()).getName()).isEqualTo("flag");
    assertThat(((Literal) conditional.getFalseExpression()).getValue()).isEqualTo("2");
  }

  @Test
  public void testTupleExpression() throws Exception {
    TupleExpression tuple =
        parse(
            TestNodeBuilder.compact("TupleExpression", 1)
                .set("components", Arrays.asList(number(2, "1"), null))
                .set("isInlineArray", true)
                .type("uint8[2] memory"),
            TupleExpression.class);

    assertThat(tuple.isInlineArray()).isTrue();
    assertThat(tuple.getComponents()).hasSize(2);
    assertThat(tuple.getComponents().get(1)).isEmpty();
  }

  @Test
  public void testFunctionCallKinds() throws Exception {
    FunctionCall explicit = parse(call(1, identifier(2, "f")), FunctionCall.class);
    FunctionCall structConstructor =
        parse(
            call(3, identifier(4, "Point")).remove("kind").type("struct Shapes.Point memory"),
            FunctionCall.class);
    FunctionCall conversion =
        parse(
            call(5, identifier(6, "uint8"), number(7, "1"))
                .remove("kind")
                .set("isStructConstructorCall", false)
                .set("type_conversion", true),
            FunctionCall.class);

    assertThat(explicit.getCallKind()).isEqualTo(FunctionCall.FUNCTION_CALL);
    assertThat(structConstructor.getCallKind()).isEqualTo(FunctionCall.STRUCT_CONSTRUCTOR_CALL);
    assertThat(conversion.getCallKind()).isEqualTo(FunctionCall.TYPE_CONVERSION);
  }

  @Test
  public void testFunctionCallOptionsAndNewExpression() throws Exception {
    FunctionCallOptions options =
        parse(
            TestNodeBuilder.compact("FunctionCallOptions", 1)
                .set(
                    "expression",
                    TestNodeBuilder.compact("NewExpression", 2)
                        .set(
                            "typeName",
                            TestNodeBuilder.compact("UserDefinedTypeName", 3).set("name", "Pool"))
                        .type("function () payable returns (contract Pool)"))
                .set("names", ImmutableList.of("value", "salt"))
                .set("options", ImmutableList.of(number(4, "1"), identifier(5, "salt")))
                .type("function () payable returns (contract Pool)"),
            FunctionCallOptions.class);

    assertThat(options.getNames()).containsExactly("value", "salt").inOrder();
    assertThat(options.getOptions()).hasSize(2);
    NewExpression newExpression = (NewExpression) options.getExpression();
    assertThat(((UserDefinedTypeName) newExpression.getTypeName()).getName()).isEqualTo("Pool");
  }

  @Test
  public void testAccessExpressions() throws Exception {
    MemberAccess member =
        parse(
            TestNodeBuilder.compact("MemberAccess", 1)
                .set("expression", identifier(2, "msg"))
                .set("memberName", "sender")
                .type("address"),
            MemberAccess.class);
    IndexAccess index =
        parse(
            TestNodeBuilder.compact("IndexAccess", 3)
                .set("baseExpression", identifier(4, "balances"))
                .set("indexExpression", null)
                .type("type(uint256[] memory)"),
            IndexAccess.class);
    IndexRangeAccess range =
        parse(
            TestNodeBuilder.compact("IndexRangeAccess", 5)
                .set("baseExpression", identifier(6, "data"))
                .set("startExpression", null)
                .set("endExpression", number(7, "4"))
                .type("bytes calldata slice"),
            IndexRangeAccess.class);

    assertThat(member.getMemberName()).isEqualTo("sender");
    assertThat(index.getIndexExpression()).isNull();
    assertThat(range.getStartExpression()).isNull();
    assertThat(range.getEndExpression()).isInstanceOf(Literal.class);
  }

  @Test
  public void testElementaryTypeNameExpression() throws Exception {
    ElementaryTypeNameExpression current =
        parse(
            TestNodeBuilder.compact("ElementaryTypeNameExpression", 1)
                .set("typeName", elementary(2, "uint256"))
                .type("type(uint256)"),
            ElementaryTypeNameExpression.class);
    ElementaryTypeNameExpression old =
        parse(
            TestNodeBuilder.compact("ElementaryTypeNameExpression", 3)
                .set("typeName", "uint256")
                .type("type(uint256)"),
            ElementaryTypeNameExpression.class);

    assertThat(current.getTypeName().getName()).isEqualTo("uint256");
    assertThat(current.getTypeNameText()).isEqualTo("uint256");
    assertThat(old.getTypeName()).isNull();
    assertThat(old.getTypeNameText()).isEqualTo("uint256");
  }

  @Test
  public void testSameDocumentParsesToEqualTrees() throws Exception {
    TestNodeBuilder statement =
        expressionStatement(1, call(2, identifier(3, "f"), number(4, "1"), number(5, "2")));

    assertThat(parse(statement, ExpressionStatement.class))
        .isEqualTo(parse(statement, ExpressionStatement.class));
  }

  @Test
  public void testUnsupportedKind() {
    AstParseException e = parseFailure(TestNodeBuilder.compact("NotARealKind", 1).set("foo", 1));

    assertThat(e.getErrorKind()).isEqualTo(ErrorKind.UNSUPPORTED_NODE_KIND);
    assertThat(e.getFormat()).isEqualTo(AstFormat.COMPACT);
    assertThat(e.getNodeKind()).isEqualTo("NotARealKind");
    assertThat(e.getFieldNames()).containsExactly("nodeType", "id", "src", "foo");
    assertThat(e.getChildKinds()).isEmpty();
    assertThat(e)
        .hasMessageThat()
        .startsWith("could not parse compact AST node of kind NotARealKind: unsupported node kind");
  }

  @Test
  public void testMissingRequiredField() {
    AstParseException e = parseFailure(number(1, "1").remove("hexValue"));

    assertThat(e.getErrorKind()).isEqualTo(ErrorKind.MALFORMED_NODE);
    assertThat(e.getNodeKind()).isEqualTo("Literal");
    assertThat(e).hasMessageThat().contains("missing required field 'hexValue'");
    assertThat(e).hasCauseThat().isInstanceOf(MalformedNodeException.class);
  }

  @Test
  public void testWrongFieldType() {
    AstParseException e = parseFailure(identifier(1, "x").set("id", "one"));

    assertThat(e.getErrorKind()).isEqualTo(ErrorKind.MALFORMED_NODE);
    assertThat(e).hasMessageThat().contains("field 'id' should be an integer");
  }

  @Test
  public void testInexactIdIsRejected() {
    for (Object id : ImmutableList.of(1.5, 4294967297L)) {
      AstParseException e = parseFailure(identifier(1, "x").set("id", id));

      assertThat(e.getErrorKind()).isEqualTo(ErrorKind.MALFORMED_NODE);
      assertThat(e).hasMessageThat().contains("field 'id' should be an integer but is " + id);
    }
  }

  @Test
  public void testNegativeIdIsRejected() {
    AstParseException e = parseFailure(identifier(1, "x").set("id", -7));

    assertThat(e.getErrorKind()).isEqualTo(ErrorKind.MALFORMED_NODE);
    assertThat(e).hasMessageThat().contains("field 'id' should be non-negative but is -7");
  }

  @Test
  public void testChildInWrongGrammarPosition() {
    AstParseException e = parseFailure(expressionStatement(1, block(2)));

    assertThat(e.getErrorKind()).isEqualTo(ErrorKind.MALFORMED_NODE);
    assertThat(e.getNodeKind()).isEqualTo("ExpressionStatement");
    assertThat(e).hasMessageThat().contains("expression must be Expression but is Block");
  }

  @Test
  public void testNestedFailureIsReportedAtInnermostNode() {
    TestNodeBuilder broken = number(4, "1").remove("kind");
    AstParseException e =
        parseFailure(
            expressionStatement(
                1,
                TestNodeBuilder.compact("BinaryOperation", 2)
                    .set("leftExpression", identifier(3, "a"))
                    .set("operator", "+")
                    .set("rightExpression", broken)
                    .type("uint256")));

    assertThat(e.getNodeKind()).isEqualTo("Literal");
    assertThat(e).hasCauseThat().isInstanceOf(MalformedNodeException.class);
  }

  @Test
  public void testNestingLimit() throws Exception {
    TestNodeBuilder nested = number(100, "1");
    for (int i = 0; i < 5; i++) {
      nested =
          TestNodeBuilder.compact("TupleExpression", i)
              .set("components", ImmutableList.of(nested))
              .set("isInlineArray", false)
              .type("uint8");
    }
    TestNodeBuilder statement = expressionStatement(200, nested);
    ParserOptions shallow = ParserOptions.builder().setMaxNestingDepth(3).build();

    AstParseException e =
        assertThrows(AstParseException.class, () -> parse(statement, Node.class, shallow));
    assertThat(e.getErrorKind()).isEqualTo(ErrorKind.NESTING_TOO_DEEP);
    assertThat(e.getNodeKind()).isEqualTo("TupleExpression");
    assertThat(parse(statement, ExpressionStatement.class)).isNotNull();
  }
}
