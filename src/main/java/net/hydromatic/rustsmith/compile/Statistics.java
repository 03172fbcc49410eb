/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.rustsmith.compile;

import com.google.common.base.CaseFormat;
import com.google.common.collect.EnumMultiset;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Multiset;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.rustsmith.ast.Ast;
import net.hydromatic.rustsmith.ast.AstNode;
import net.hydromatic.rustsmith.ast.Identifier;
import net.hydromatic.rustsmith.ast.Op;
import net.hydromatic.rustsmith.ast.Visitor;

/**
 * Counts the nodes of a program, by {@link Op}, and the number of times each
 * identifier is used.
 */
public class Statistics extends Visitor {
  private final Multiset<Op> counts = EnumMultiset.create(Op.class);
  /** Uses of each declared identifier, by name, in declaration order. */
  private final Map<String, Integer> uses = new LinkedHashMap<>();

  private Statistics() {}

  /** Computes the statistics of a program. */
  public static Statistics of(AstNode node) {
    final Statistics statistics = new Statistics();
    statistics.accept(node);
    return statistics;
  }

  @Override
  protected <E extends AstNode> void accept(E e) {
    counts.add(e.op);
    super.accept(e);
  }

  /** Returns the number of nodes of a given kind. */
  public int count(Op op) {
    return counts.count(op);
  }

  /** Returns the total number of nodes. */
  public int nodeCount() {
    return counts.size();
  }

  /** Returns the number of times an identifier is used. */
  public int useCount(String name) {
    return uses.getOrDefault(name, 0);
  }

  /**
   * Returns the mean number of uses per declared identifier, or 0 if no
   * identifier is declared.
   */
  public double averageIdentifierUse() {
    if (uses.isEmpty()) {
      return 0d;
    }
    int total = 0;
    for (int n : uses.values()) {
      total += n;
    }
    return (double) total / uses.size();
  }

  /** Converts to a map, suitable for writing as JSON. */
  public Map<String, Object> toMap() {
    final Map<String, Integer> nodes = new LinkedHashMap<>();
    for (Multiset.Entry<Op> entry : counts.entrySet()) {
      nodes.put(
          CaseFormat.UPPER_UNDERSCORE.to(CaseFormat.LOWER_CAMEL,
              entry.getElement().name()),
          entry.getCount());
    }
    return ImmutableMap.of("nodeCount", nodeCount(),
        "nodes", nodes,
        "identifierUses", new LinkedHashMap<>(uses),
        "averageIdentifierUse", averageIdentifierUse());
  }

  @Override
  public String toString() {
    return toMap().toString();
  }

  private void declare(Identifier identifier) {
    uses.putIfAbsent(identifier.name, 0);
  }

  private void use(Identifier identifier) {
    uses.merge(identifier.name, 1, Integer::sum);
  }

  @Override
  protected void visit(Ast.IdPat idPat) {
    declare(idPat.identifier);
  }

  @Override
  protected void visit(Ast.Id id) {
    use(id.identifier);
  }

  @Override
  protected void visit(Ast.Call call) {
    use(call.function);
    super.visit(call);
  }

  @Override
  protected void visit(Ast.Let let) {
    declare(let.id);
    super.visit(let);
  }

  @Override
  protected void visit(Ast.FunDecl funDecl) {
    declare(funDecl.function);
    funDecl.params.forEach(this::declare);
    super.visit(funDecl);
  }
}

// End Statistics.java
