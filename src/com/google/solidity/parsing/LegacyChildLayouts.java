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

import com.google.auto.value.AutoValue;
import java.util.List;

/**
 * Arity rules for the flat child lists of the legacy format.
 *
 * <p>A legacy node lists its children in grammar order but leaves out optional children that are
 * absent, without a placeholder. Which child plays which role therefore follows from the number of
 * children and, for a few kinds, from what the trailing children are. Each rule takes the child
 * count (and, where needed, a classification of the children) and either describes the layout or
 * throws an {@code AMBIGUOUS_CHILD_LIST} failure.
 */
final class LegacyChildLayouts {

  /** Requires exactly {@code expected} children. */
  static void exactly(String kind, int count, int expected) {
    if (count != expected) {
      throw MalformedNodeException.ambiguousChildList(kind, "exactly " + expected, count);
    }
  }

  /** Requires at least {@code minimum} children. */
  static void atLeast(String kind, int count, int minimum) {
    if (count < minimum) {
      throw MalformedNodeException.ambiguousChildList(kind, "at least " + minimum, count);
    }
  }

  /** Requires between {@code minimum} and {@code maximum} children, inclusive. */
  static void between(String kind, int count, int minimum, int maximum) {
    if (count < minimum || count > maximum) {
      throw MalformedNodeException.ambiguousChildList(
          kind, "between " + minimum + " and " + maximum, count);
    }
  }

  /**
   * For kinds laid out as {@code required} children plus one optional child, returns whether the
   * optional child is present. Where the optional child sits is up to the caller.
   */
  static boolean hasOptionalChild(String kind, int count, int required) {
    between(kind, count, required, required + 1);
    return count > required;
  }

  /**
   * Lays out a FunctionDefinition: parameters, return parameters, any number of modifier
   * invocations, then the body unless the function is unimplemented.
   *
   * @param lastIsBlock whether the last child is a Block
   */
  static FunctionLayout functionDefinition(int count, boolean lastIsBlock) {
    atLeast("FunctionDefinition", count, 2);
    boolean bodyPresent = lastIsBlock && count > 2;
    return new AutoValue_LegacyChildLayouts_FunctionLayout(
        count - 2 - (bodyPresent ? 1 : 0), bodyPresent);
  }

  /**
   * Returns how many leading children of a VariableDeclarationStatement are declared variables. All
   * children but the last always are; the last one is a declared variable too, unless it is the
   * initial value.
   *
   * @param lastIsDeclaration whether the last child is a VariableDeclaration
   */
  static int declarationCount(int count, boolean lastIsDeclaration) {
    atLeast("VariableDeclarationStatement", count, 1);
    int declarations = lastIsDeclaration ? count : count - 1;
    if (declarations == 0) {
      throw MalformedNodeException.ambiguousChildList(
          "VariableDeclarationStatement", "at least one declared variable among", count);
    }
    return declarations;
  }

  /** What a child of a legacy ForStatement is. */
  enum ForChild {
    /** An expression, which can only be the loop condition. */
    EXPRESSION,
    /** An ExpressionStatement: the initialization, the loop expression or the body. */
    EXPRESSION_STATEMENT,
    /** Any other statement: the initialization or the body. */
    OTHER_STATEMENT
  }

  /**
   * Lays out a ForStatement, whose initialization, condition and loop expression may each be
   * missing. The body is always last and the condition is the only child that is not a statement.
   * Without a condition, a single header statement is taken as the initialization.
   */
  static ForLayout forStatement(List<ForChild> children) {
    int count = children.size();
    between("ForStatement", count, 1, 4);
    int body = count - 1;
    if (children.get(body) == ForChild.EXPRESSION) {
      throw new MalformedNodeException("body of ForStatement must be a statement");
    }

    int condition = children.subList(0, body).indexOf(ForChild.EXPRESSION);
    if (condition != children.subList(0, body).lastIndexOf(ForChild.EXPRESSION)) {
      throw MalformedNodeException.ambiguousChildList(
          "ForStatement", "at most one condition among", count);
    }

    int initialization = ForLayout.ABSENT;
    int loopExpression = ForLayout.ABSENT;
    if (condition != ForLayout.ABSENT) {
      int before = condition;
      int after = body - condition - 1;
      if (before > 1 || after > 1) {
        throw MalformedNodeException.ambiguousChildList(
            "ForStatement", "at most one statement on each side of the condition among", count);
      }
      initialization = before == 1 ? 0 : ForLayout.ABSENT;
      loopExpression = after == 1 ? condition + 1 : ForLayout.ABSENT;
    } else if (body == 1) {
      initialization = 0;
    } else if (body == 2) {
      initialization = 0;
      loopExpression = 1;
    } else if (body > 2) {
      throw MalformedNodeException.ambiguousChildList(
          "ForStatement", "at most two header statements without a condition among", count);
    }

    if (loopExpression != ForLayout.ABSENT
        && children.get(loopExpression) != ForChild.EXPRESSION_STATEMENT) {
      throw new MalformedNodeException(
          "loop expression of ForStatement must be an ExpressionStatement");
    }
    return new AutoValue_LegacyChildLayouts_ForLayout(
        initialization, condition, loopExpression, body);
  }

  /** Positions of the children of a FunctionDefinition. */
  @AutoValue
  abstract static class FunctionLayout {
    /** Modifier invocations occupy the children from index 2 on. */
    abstract int getModifierCount();

    abstract boolean isBodyPresent();
  }

  /** Positions of the children of a ForStatement, {@link #ABSENT} for missing parts. */
  @AutoValue
  abstract static class ForLayout {
    static final int ABSENT = -1;

    abstract int getInitializationIndex();

    abstract int getConditionIndex();

    abstract int getLoopExpressionIndex();

    abstract int getBodyIndex();
  }

  private LegacyChildLayouts() {}
}
