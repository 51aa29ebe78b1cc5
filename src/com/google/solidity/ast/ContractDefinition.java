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

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;

/** A contract, interface or library. */
public final class ContractDefinition extends Declaration {
  private final String contractKind;
  private final ImmutableList<Integer> linearizedBaseContracts;
  private final ImmutableList<InheritanceSpecifier> baseContracts;
  private final ImmutableList<Node> nodes;

  private ContractDefinition(
      DeclarationProperties properties,
      String contractKind,
      ImmutableList<Integer> linearizedBaseContracts,
      ImmutableList<InheritanceSpecifier> baseContracts,
      ImmutableList<Node> nodes) {
    super(properties);
    this.contractKind = contractKind;
    this.linearizedBaseContracts = linearizedBaseContracts;
    this.baseContracts = baseContracts;
    this.nodes = nodes;
  }

  public static ContractDefinition create(
      DeclarationProperties properties,
      String contractKind,
      List<Integer> linearizedBaseContracts,
      List<InheritanceSpecifier> baseContracts,
      List<? extends Node> nodes) {
    return new ContractDefinition(
        properties,
        contractKind,
        ImmutableList.copyOf(linearizedBaseContracts),
        ImmutableList.copyOf(baseContracts),
        ImmutableList.copyOf(nodes));
  }

  /** Returns one of {@code contract}, {@code interface} or {@code library}. */
  public String getContractKind() {
    return contractKind;
  }

  /** Returns the ids of the contracts in the C3 linearization, starting with this contract. */
  public ImmutableList<Integer> getLinearizedBaseContracts() {
    return linearizedBaseContracts;
  }

  /** Returns the {@code is A, B(1)} clauses, in declaration order. */
  public ImmutableList<InheritanceSpecifier> getBaseContracts() {
    return baseContracts;
  }

  /** Returns the members of the contract body, in declaration order. */
  public ImmutableList<Node> getNodes() {
    return nodes;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.CONTRACT_DEFINITION;
  }

  @Override
  List<?> declarationFieldValues() {
    return Arrays.asList(contractKind, linearizedBaseContracts, baseContracts, nodes);
  }
}
