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

import java.util.ArrayList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Visits and transforms syntax trees.
 *
 * <p>The default implementation of each method rebuilds its node from the
 * transformed children, returning the original node if no child changed.
 * Thus a shuttle that changes nothing returns the same tree.
 */
public class Shuttle {
  /** Creates a Shuttle. */
  public Shuttle() {}

  protected <E extends AstNode> List<E> visitList(List<E> nodes) {
    final List<E> list = new ArrayList<>();
    for (E node : nodes) {
      //noinspection unchecked
      list.add((E) node.accept(this));
    }
    return list;
  }

  protected Ast.@Nullable Exp visitOpt(Ast.@Nullable Exp exp) {
    return exp == null ? null : exp.accept(this);
  }

  // patterns

  protected Ast.Pat visit(Ast.IdPat idPat) {
    return idPat; // leaf
  }

  protected Ast.Pat visit(Ast.LiteralPat literalPat) {
    return literalPat; // leaf
  }

  protected Ast.Pat visit(Ast.WildcardPat wildcardPat) {
    return wildcardPat; // leaf
  }

  protected Ast.Pat visit(Ast.ConPat conPat) {
    return conPat.copy(visitList(conPat.args));
  }

  protected Ast.Pat visit(Ast.Con0Pat con0Pat) {
    return con0Pat; // leaf
  }

  // expressions

  protected Ast.Exp visit(Ast.Literal literal) {
    return literal; // leaf
  }

  protected Ast.Exp visit(Ast.Id id) {
    return id; // leaf
  }

  protected Ast.Exp visit(Ast.CliArgument cliArgument) {
    return cliArgument; // leaf
  }

  protected Ast.Exp visit(Ast.NoneExp noneExp) {
    return noneExp; // leaf
  }

  protected Ast.Exp visit(Ast.PrefixCall prefixCall) {
    return prefixCall.copy(prefixCall.a.accept(this));
  }

  protected Ast.Exp visit(Ast.InfixCall infixCall) {
    return infixCall.copy(
        infixCall.a0.accept(this), infixCall.a1.accept(this));
  }

  protected Ast.Exp visit(Ast.MethodCall methodCall) {
    return methodCall.copy(
        methodCall.receiver.accept(this),
        visitOpt(methodCall.arg),
        visitOpt(methodCall.fallback));
  }

  protected Ast.Exp visit(Ast.Cast cast) {
    return cast.copy(cast.a.accept(this));
  }

  protected Ast.Exp visit(Ast.Convert convert) {
    return convert.copy(convert.a.accept(this), visitOpt(convert.fallback));
  }

  // value constructors

  protected Ast.Exp visit(Ast.Tuple tuple) {
    return tuple.copy(visitList(tuple.args));
  }

  protected Ast.Exp visit(Ast.ArrayExp arrayExp) {
    return arrayExp.copy(visitList(arrayExp.args));
  }

  protected Ast.Exp visit(Ast.StructExp structExp) {
    return structExp.copy(visitList(structExp.args));
  }

  protected Ast.Exp visit(Ast.EnumExp enumExp) {
    return enumExp.copy(visitList(enumExp.args));
  }

  protected Ast.Exp visit(Ast.Wrap wrap) {
    return wrap.copy(wrap.a.accept(this));
  }

  // access to components

  protected Ast.Exp visit(Ast.TupleField tupleField) {
    return tupleField.copy(tupleField.a.accept(this));
  }

  protected Ast.Exp visit(Ast.FieldAccess fieldAccess) {
    return fieldAccess.copy(fieldAccess.a.accept(this));
  }

  protected Ast.Exp visit(Ast.Index index) {
    return index.copy(index.array.accept(this), index.index.accept(this));
  }

  protected Ast.Exp visit(Ast.Unwrap unwrap) {
    return unwrap.copy(
        unwrap.op, unwrap.a.accept(this), visitOpt(unwrap.fallback));
  }

  // control flow

  protected Ast.Exp visit(Ast.If anIf) {
    return anIf.copy(
        anIf.condition.accept(this),
        anIf.ifTrue.accept(this),
        anIf.ifFalse.accept(this));
  }

  protected Ast.Exp visit(Ast.Match match) {
    return match.copy(match.exp.accept(this), visitList(match.arms));
  }

  protected Ast.MatchArm visit(Ast.MatchArm matchArm) {
    return matchArm.copy(
        matchArm.pat.accept(this), matchArm.exp.accept(this));
  }

  protected Ast.Block visit(Ast.Block block) {
    return block.copy(visitList(block.stmts), visitOpt(block.tail));
  }

  protected Ast.Exp visit(Ast.Call call) {
    return call.copy(visitList(call.args));
  }

  // statements

  protected Ast.Stmt visit(Ast.Let let) {
    return let.copy(let.exp.accept(this));
  }

  protected Ast.Stmt visit(Ast.Assign assign) {
    return assign.copy(assign.exp.accept(this));
  }

  protected Ast.Stmt visit(Ast.ExpStmt expStmt) {
    return expStmt.copy(expStmt.exp.accept(this));
  }

  protected Ast.Stmt visit(Ast.Hash hash) {
    return hash; // leaf
  }

  protected Ast.Stmt visit(Ast.ForLoop forLoop) {
    return forLoop.copy(forLoop.body.accept(this));
  }

  protected Ast.Stmt visit(Ast.Conditional conditional) {
    return conditional.copy(
        conditional.condition.accept(this),
        conditional.ifTrue.accept(this),
        conditional.ifFalse == null ? null : conditional.ifFalse.accept(this));
  }

  // declarations

  protected Ast.Decl visit(Ast.StructDecl structDecl) {
    return structDecl;
  }

  protected Ast.Decl visit(Ast.EnumDecl enumDecl) {
    return enumDecl;
  }

  protected Ast.FunDecl visit(Ast.FunDecl funDecl) {
    return funDecl.copy(funDecl.body.accept(this));
  }

  protected Ast.Program visit(Ast.Program program) {
    return program.copy(visitList(program.decls), program.main.accept(this));
  }
}

// End Shuttle.java
