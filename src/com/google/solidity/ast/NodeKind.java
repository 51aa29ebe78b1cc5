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

/**
 * The closed set of node kinds understood by the parsers. Each constant corresponds to exactly one
 * {@link Node} subclass.
 */
public enum NodeKind {
  SOURCE_UNIT("SourceUnit"),
  PRAGMA_DIRECTIVE("PragmaDirective"),
  IMPORT_DIRECTIVE("ImportDirective"),
  CONTRACT_DEFINITION("ContractDefinition"),
  INHERITANCE_SPECIFIER("InheritanceSpecifier"),
  USING_FOR_DIRECTIVE("UsingForDirective"),
  STRUCT_DEFINITION("StructDefinition"),
  ENUM_DEFINITION("EnumDefinition"),
  ENUM_VALUE("EnumValue"),
  PARAMETER_LIST("ParameterList"),
  FUNCTION_DEFINITION("FunctionDefinition"),
  VARIABLE_DECLARATION("VariableDeclaration"),
  MODIFIER_DEFINITION("ModifierDefinition"),
  MODIFIER_INVOCATION("ModifierInvocation"),
  EVENT_DEFINITION("EventDefinition"),

  // Type names
  ELEMENTARY_TYPE_NAME("ElementaryTypeName"),
  USER_DEFINED_TYPE_NAME("UserDefinedTypeName"),
  FUNCTION_TYPE_NAME("FunctionTypeName"),
  MAPPING("Mapping"),
  ARRAY_TYPE_NAME("ArrayTypeName"),

  // Statements
  INLINE_ASSEMBLY("InlineAssembly"),
  BLOCK("Block"),
  PLACEHOLDER_STATEMENT("PlaceholderStatement"),
  IF_STATEMENT("IfStatement"),
  TRY_CATCH_CLAUSE("TryCatchClause"),
  TRY_STATEMENT("TryStatement"),
  WHILE_STATEMENT("WhileStatement"),
  DO_WHILE_STATEMENT("DoWhileStatement"),
  FOR_STATEMENT("ForStatement"),
  CONTINUE("Continue"),
  BREAK("Break"),
  RETURN("Return"),
  THROW("Throw"),
  EMIT_STATEMENT("EmitStatement"),
  VARIABLE_DECLARATION_STATEMENT("VariableDeclarationStatement"),
  EXPRESSION_STATEMENT("ExpressionStatement"),

  // Expressions
  CONDITIONAL("Conditional"),
  ASSIGNMENT("Assignment"),
  TUPLE_EXPRESSION("TupleExpression"),
  UNARY_OPERATION("UnaryOperation"),
  BINARY_OPERATION("BinaryOperation"),
  FUNCTION_CALL("FunctionCall"),
  FUNCTION_CALL_OPTIONS("FunctionCallOptions"),
  NEW_EXPRESSION("NewExpression"),
  MEMBER_ACCESS("MemberAccess"),
  INDEX_ACCESS("IndexAccess"),
  INDEX_RANGE_ACCESS("IndexRangeAccess"),
  IDENTIFIER("Identifier"),
  ELEMENTARY_TYPE_NAME_EXPRESSION("ElementaryTypeNameExpression"),
  LITERAL("Literal");

  private final String tag;

  NodeKind(String tag) {
    this.tag = tag;
  }

  /** Returns the name the compiler uses for this kind in the compact AST. */
  public String getTag() {
    return tag;
  }
}
