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
package net.hydromatic.rustsmith.ast;

import org.checkerframework.checker.nullness.qual.Nullable;

/** Visits syntax trees. */
public class Visitor {

  /**
   * Visits a child node. Every child passes through this method, so a
   * sub-class can override it to act on each node.
   */
  protected <E extends AstNode> void accept(E e) {
    e.accept(this);
  }

  protected void acceptOpt(@Nullable AstNode node) {
    if (node != null) {
      accept(node);
    }
  }

  // patterns

  protected void visit(Ast.IdPat idPat) {}

  protected void visit(Ast.LiteralPat literalPat) {
    accept(literalPat.literal);
  }

  protected void visit(Ast.WildcardPat wildcardPat) {}

  protected void visit(Ast.ConPat conPat) {
    conPat.args.forEach(this::accept);
  }

  protected void visit(Ast.Con0Pat con0Pat) {}

  // expressions

  protected void visit(Ast.Literal literal) {}

  protected void visit(Ast.Id id) {}

  protected void visit(Ast.CliArgument cliArgument) {}

  protected void visit(Ast.NoneExp noneExp) {}

  protected void visit(Ast.PrefixCall prefixCall) {
    accept(prefixCall.a);
  }

  protected void visit(Ast.InfixCall infixCall) {
    accept(infixCall.a0);
    accept(infixCall.a1);
  }

  protected void visit(Ast.MethodCall methodCall) {
    accept(methodCall.receiver);
    acceptOpt(methodCall.arg);
    acceptOpt(methodCall.fallback);
  }

  protected void visit(Ast.Cast cast) {
    accept(cast.a);
  }

  protected void visit(Ast.Convert convert) {
    accept(convert.a);
    acceptOpt(convert.fallback);
  }

  // value constructors

  protected void visit(Ast.Tuple tuple) {
    tuple.args.forEach(this::accept);
  }

  protected void visit(Ast.ArrayExp arrayExp) {
    arrayExp.args.forEach(this::accept);
  }

  protected void visit(Ast.StructExp structExp) {
    structExp.args.forEach(this::accept);
  }

  protected void visit(Ast.EnumExp enumExp) {
    enumExp.args.forEach(this::accept);
  }

  protected void visit(Ast.Wrap wrap) {
    accept(wrap.a);
  }

  // access to components

  protected void visit(Ast.TupleField tupleField) {
    accept(tupleField.a);
  }

  protected void visit(Ast.FieldAccess fieldAccess) {
    accept(fieldAccess.a);
  }

  protected void visit(Ast.Index index) {
    accept(index.array);
    accept(index.index);
  }

  protected void visit(Ast.Unwrap unwrap) {
    accept(unwrap.a);
    acceptOpt(unwrap.fallback);
  }

  // control flow

  protected void visit(Ast.If anIf) {
    accept(anIf.condition);
    accept(anIf.ifTrue);
    accept(anIf.ifFalse);
  }

  protected void visit(Ast.Match match) {
    accept(match.exp);
    match.arms.forEach(this::accept);
  }

  protected void visit(Ast.MatchArm matchArm) {
    accept(matchArm.pat);
    accept(matchArm.exp);
  }

  protected void visit(Ast.Block block) {
    block.stmts.forEach(this::accept);
    acceptOpt(block.tail);
  }

  protected void visit(Ast.Call call) {
    call.args.forEach(this::accept);
  }

  // statements

  protected void visit(Ast.Let let) {
    accept(let.exp);
  }

  protected void visit(Ast.Assign assign) {
    accept(assign.exp);
  }

  protected void visit(Ast.ExpStmt expStmt) {
    accept(expStmt.exp);
  }

  protected void visit(Ast.Hash hash) {
    accept(hash.id);
  }

  protected void visit(Ast.ForLoop forLoop) {
    accept(forLoop.body);
  }

  protected void visit(Ast.Conditional conditional) {
    accept(conditional.condition);
    accept(conditional.ifTrue);
    acceptOpt(conditional.ifFalse);
  }

  // declarations

  protected void visit(Ast.StructDecl structDecl) {}

  protected void visit(Ast.EnumDecl enumDecl) {}

  protected void visit(Ast.FunDecl funDecl) {
    accept(funDecl.body);
  }

  protected void visit(Ast.Program program) {
    program.decls.forEach(this::accept);
    accept(program.main);
  }
}

// End Visitor.java
