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

import static net.hydromatic.rustsmith.ast.AstBuilder.ast;
import static net.hydromatic.rustsmith.select.SelectionManager.pick;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import net.hydromatic.rustsmith.ast.Ast;
import net.hydromatic.rustsmith.ast.ExternalParameter;
import net.hydromatic.rustsmith.ast.Identifier;
import net.hydromatic.rustsmith.ast.Op;
import net.hydromatic.rustsmith.select.ExpressionKind;
import net.hydromatic.rustsmith.select.Legality;
import net.hydromatic.rustsmith.select.SelectionManager;
import net.hydromatic.rustsmith.select.StatementKind;
import net.hydromatic.rustsmith.type.ArrayType;
import net.hydromatic.rustsmith.type.BoxType;
import net.hydromatic.rustsmith.type.EnumType;
import net.hydromatic.rustsmith.type.OptionType;
import net.hydromatic.rustsmith.type.PrimitiveType;
import net.hydromatic.rustsmith.type.RefType;
import net.hydromatic.rustsmith.type.ResultType;
import net.hydromatic.rustsmith.type.StructType;
import net.hydromatic.rustsmith.type.TupleType;
import net.hydromatic.rustsmith.type.Type;
import net.hydromatic.rustsmith.type.TypeSystem;
import net.hydromatic.rustsmith.util.Outcome;

/**
 * Generates a random, well-typed Rust program.
 *
 * <p>Generation is recursive descent, directed by the type that each
 * expression must have. Every descent decreases the remaining depth, so
 * generation terminates. At each decision point the {@link SelectionManager}
 * chooses among the productions that are legal there; if none is legal,
 * the result is a dead-end and the whole program is discarded.
 *
 * <p>A generator is good for one attempt. Use {@link #generateProgram}.
 */
public class Generator {
  private static final String ALPHANUMERIC =
      "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";

  private final long seed;
  private final NameGenerator names;
  private final SelectionManager selectionManager;
  private final GenerationConfig config;
  private final Random random;
  private final TypeSystem typeSystem;
  private final List<ExternalParameter> externals = new ArrayList<>();

  private Generator(long seed, NameGenerator names,
      SelectionManager selectionManager, GenerationConfig config) {
    this.seed = seed;
    this.names = names;
    this.selectionManager = selectionManager;
    this.config = config;
    this.random = new Random(seed);
    this.typeSystem = new TypeSystem(config.usizeWidth);
  }

  /**
   * Generates a program.
   *
   * <p>The same seed, strategy and configuration always yield the same
   * program.
   *
   * @param seed Seed of the random source
   * @param names Allocator of identifiers; reset before use
   * @param selectionManager Chooses productions; reset before use
   * @param config Limits and switches
   * @return A program and its external parameters, or a dead-end
   */
  public static Outcome<GeneratedProgram> generateProgram(long seed,
      NameGenerator names, SelectionManager selectionManager,
      GenerationConfig config) {
    return new Generator(seed, names, selectionManager, config).generate();
  }

  private Outcome<GeneratedProgram> generate() {
    names.reset();
    selectionManager.startAttempt(random);
    final GenContext cx =
        GenContext.create(random, typeSystem, config.maxNodes,
            config.maxDepth);
    final List<Ast.Decl> decls = new ArrayList<>();

    final int structCount = random.nextInt(config.maxStructs + 1);
    for (int i = 0; i < structCount; i++) {
      final Outcome<Ast.StructDecl> structDecl = declareStruct(cx);
      if (structDecl.isDeadEnd()) {
        return structDecl.propagate();
      }
      decls.add(structDecl.get());
    }

    final int enumCount = random.nextInt(config.maxEnums + 1);
    for (int i = 0; i < enumCount; i++) {
      final Outcome<Ast.EnumDecl> enumDecl = declareEnum(cx);
      if (enumDecl.isDeadEnd()) {
        return enumDecl.propagate();
      }
      decls.add(enumDecl.get());
    }

    // A function may only call functions declared before it, so there is no
    // recursion.
    final List<Ast.FunDecl> functions = new ArrayList<>();
    final int functionCount = random.nextInt(config.maxFunctions + 1);
    for (int i = 0; i < functionCount; i++) {
      final Outcome<Ast.FunDecl> funDecl =
          declareFunction(cx.withFunctions(functions));
      if (funDecl.isDeadEnd()) {
        return funDecl.propagate();
      }
      functions.add(funDecl.get());
      decls.add(funDecl.get());
    }

    final Outcome<Ast.FunDecl> main =
        declareMain(cx.withFunctions(functions).withEntry(true));
    if (main.isDeadEnd()) {
      return main.propagate();
    }
    return Outcome.of(
        new GeneratedProgram(ast.program(decls, main.get(),
            ImmutableList.copyOf(externals), seed)));
  }

  /** Returns a context for choosing a type whose values can be built
   * within the context's depth. */
  private GenContext typeContext(GenContext cx, boolean references) {
    return cx.withDepth(Math.min(cx.depth, config.maxTypeDepth))
        .withReferences(references);
  }

  private Outcome<Ast.StructDecl> declareStruct(GenContext cx) {
    final String name = names.next(Identifier.Kind.STRUCT);
    final int fieldCount = 1 + random.nextInt(config.maxFields);
    final Map<String, Type> fields = new LinkedHashMap<>();
    for (int i = 0; i < fieldCount; i++) {
      final Outcome<Type> type =
          selectionManager.chooseType(typeContext(cx, false));
      if (type.isDeadEnd()) {
        return type.propagate();
      }
      fields.put(names.next(Identifier.Kind.FIELD), type.get());
    }
    return Outcome.of(ast.structDecl(typeSystem.structType(name, fields)));
  }

  private Outcome<Ast.EnumDecl> declareEnum(GenContext cx) {
    final String name = names.next(Identifier.Kind.ENUM);
    final int variantCount = 1 + random.nextInt(config.maxFields);
    final Map<String, List<Type>> variants = new LinkedHashMap<>();
    for (int i = 0; i < variantCount; i++) {
      final int fieldCount = random.nextInt(3);
      final List<Type> types = new ArrayList<>();
      for (int j = 0; j < fieldCount; j++) {
        final Outcome<Type> type =
            selectionManager.chooseType(typeContext(cx, false));
        if (type.isDeadEnd()) {
          return type.propagate();
        }
        types.add(type.get());
      }
      variants.put(names.next(Identifier.Kind.VARIANT), types);
    }
    return Outcome.of(ast.enumDecl(typeSystem.enumType(name, variants)));
  }

  private Outcome<Ast.FunDecl> declareFunction(GenContext cx) {
    final String name = names.next(Identifier.Kind.FUNCTION);
    final Outcome<Type> returnType =
        selectionManager.chooseType(typeContext(cx, false));
    if (returnType.isDeadEnd()) {
      return returnType.propagate();
    }
    Scope scope = cx.scope.enter();
    final List<Identifier> params = new ArrayList<>();
    final int paramCount = random.nextInt(config.maxParams + 1);
    for (int i = 0; i < paramCount; i++) {
      final Outcome<Type> type =
          selectionManager.chooseType(typeContext(cx, true));
      if (type.isDeadEnd()) {
        return type.propagate();
      }
      final Identifier param =
          new Identifier(names.next(Identifier.Kind.PARAMETER),
              Identifier.Kind.PARAMETER, type.get(), scope.level, false);
      params.add(param);
      scope = scope.bind(param);
    }
    final Identifier function =
        new Identifier(name, Identifier.Kind.FUNCTION, returnType.get(),
            cx.scope.level, false);
    final GenContext bodyContext = cx.withScope(scope).withEntry(false);
    final Outcome<Ast.Block> body =
        generateBody(bodyContext, returnType.get());
    return body.map(b -> ast.funDecl(function, params, b));
  }

  private Outcome<Ast.FunDecl> declareMain(GenContext cx) {
    final Scope scope = cx.scope.enter();
    final List<Ast.Stmt> stmts = new ArrayList<>();
    final int count = 1 + random.nextInt(config.maxStatements);
    final Outcome<Scope> scope2 =
        generateStatements(cx.withScope(scope), count, stmts);
    if (scope2.isDeadEnd()) {
      return scope2.propagate();
    }
    // The hash of every live top-level variable, in declaration order, is
    // the program's output.
    for (Identifier id : Lists.reverse(scope2.get().local())) {
      stmts.add(ast.hash(id));
    }
    final Identifier main =
        new Identifier("main", Identifier.Kind.FUNCTION, PrimitiveType.UNIT,
            cx.scope.level, false);
    return Outcome.of(
        ast.funDecl(main, ImmutableList.of(), ast.block(stmts, null)));
  }

  /** Generates the body of a function: statements, then a tail of the
   * return type. Unlike a nested block, does not descend. */
  private Outcome<Ast.Block> generateBody(GenContext cx, Type returnType) {
    final List<Ast.Stmt> stmts = new ArrayList<>();
    final int count = 1 + random.nextInt(config.maxStatements);
    final Outcome<Scope> scope = generateStatements(cx, count, stmts);
    if (scope.isDeadEnd()) {
      return scope.propagate();
    }
    return generateExpression(cx.withScope(scope.get()), returnType)
        .map(tail -> ast.block(stmts, tail));
  }

  /**
   * Generates a nested block, whose variables are not visible after it. The
   * caller has already descended.
   */
  private Outcome<Ast.Block> generateBlock(GenContext cx, Type tailType) {
    final GenContext inner = cx.withScope(cx.scope.enter());
    final List<Ast.Stmt> stmts = new ArrayList<>();
    final int count = random.nextInt(config.maxStatements / 2 + 1);
    final Outcome<Scope> scope = generateStatements(inner, count, stmts);
    if (scope.isDeadEnd()) {
      return scope.propagate();
    }
    if (tailType == PrimitiveType.UNIT) {
      return Outcome.of(ast.block(stmts, null));
    }
    return generateExpression(inner.withScope(scope.get()), tailType)
        .map(tail -> ast.block(stmts, tail));
  }

  /**
   * Generates up to {@code count} statements, adding them to a list, and
   * returns the scope after the last of them. Stops early if the node budget
   * is exhausted.
   */
  private Outcome<Scope> generateStatements(GenContext cx, int count,
      List<Ast.Stmt> stmts) {
    Scope scope = cx.scope;
    for (int i = 0; i < count && !cx.isExhausted(); i++) {
      final Outcome<Ast.Stmt> stmt = generateStatement(cx.withScope(scope));
      if (stmt.isDeadEnd()) {
        return stmt.propagate();
      }
      stmts.add(stmt.get());
      if (stmt.get() instanceof Ast.Let) {
        scope = scope.bind(((Ast.Let) stmt.get()).id);
      }
    }
    return Outcome.of(scope);
  }

  private Outcome<Ast.Stmt> generateStatement(GenContext cx) {
    final Outcome<StatementKind> kind =
        selectionManager.chooseStatementKind(cx);
    if (kind.isDeadEnd()) {
      return kind.propagate();
    }
    ++cx.budget.used;
    switch (kind.get()) {
      case LET:
        final GenContext down = cx.descend();
        final Outcome<Type> type =
            selectionManager.chooseType(typeContext(down, true));
        if (type.isDeadEnd()) {
          return type.propagate();
        }
        final boolean mutable =
            !(type.get() instanceof RefType) && random.nextBoolean();
        final Identifier id =
            new Identifier(names.next(Identifier.Kind.VARIABLE),
                Identifier.Kind.VARIABLE, type.get(), cx.scope.level,
                mutable);
        return generateExpression(down, type.get())
            .map(e -> ast.let(id, e));

      case ASSIGN:
        final Identifier target =
            pick(random, Legality.assignableVariables(cx, cx.depth - 1));
        return generateExpression(cx.descend(), target.type)
            .map(e -> ast.assign(target, e));

      case EXPRESSION:
        final List<Ast.FunDecl> functions = new ArrayList<>();
        for (Ast.FunDecl f : cx.functions) {
          if (Legality.isCallable(cx, f, cx.depth - 1)) {
            functions.add(f);
          }
        }
        return generateCall(cx.descend(), pick(random, functions))
            .map(ast::expStmt);

      case HASH:
        return Outcome.of(
            ast.hash(pick(random, Legality.hashableVariables(cx))));

      case FOR_LOOP:
        final int iterations = 1 + random.nextInt(config.maxLoopIterations);
        return generateBlock(cx.descend(), PrimitiveType.UNIT)
            .map(body -> ast.forLoop(iterations, body));

      case IF_STATEMENT:
        final Outcome<Ast.Exp> condition =
            generateExpression(cx.descend(), PrimitiveType.BOOL);
        if (condition.isDeadEnd()) {
          return condition.propagate();
        }
        final Outcome<Ast.Block> ifTrue =
            generateBlock(cx.descend(), PrimitiveType.UNIT);
        if (ifTrue.isDeadEnd()) {
          return ifTrue.propagate();
        }
        if (random.nextBoolean()) {
          return Outcome.of(
              ast.conditional(condition.get(), ifTrue.get(), null));
        }
        return generateBlock(cx.descend(), PrimitiveType.UNIT)
            .map(ifFalse ->
                ast.conditional(condition.get(), ifTrue.get(), ifFalse));

      default:
        throw new AssertionError("unknown statement kind " + kind.get());
    }
  }

  /**
   * Generates an expression of a given type.
   *
   * <p>If the chosen production dead-ends and the configuration does not
   * fail fast, restores the state of the attempt and tries another
   * production, up to the retry limit.
   */
  Outcome<Ast.Exp> generateExpression(GenContext cx, Type type) {
    final int attempts = config.failFast ? 1 : 1 + config.retryLimit;
    final List<ExpressionKind> tried = new ArrayList<>();
    Outcome<Ast.Exp> result = Outcome.deadEnd("no expression of " + type);
    for (int i = 0; i < attempts; i++) {
      final Outcome<ExpressionKind> kind =
          selectionManager.chooseExpressionKind(cx, type, tried);
      if (kind.isDeadEnd()) {
        if (i == 0) {
          return kind.propagate();
        }
        break;
      }
      // Legality was decided at this depth; spending a node must not
      // reduce it.
      final int d = cx.effectiveDepth(type);
      final int used = cx.budget.used;
      final int externalCount = externals.size();
      ++cx.budget.used;
      result = generateExpression(cx, type, kind.get(), d);
      if (!result.isDeadEnd()) {
        return result;
      }
      cx.budget.used = used;
      while (externals.size() > externalCount) {
        externals.remove(externals.size() - 1);
      }
      tried.add(kind.get());
    }
    return result;
  }

  private Outcome<Ast.Exp> generateExpression(GenContext cx, Type type,
      ExpressionKind kind, int d) {
    switch (kind) {
      case BOOL_LITERAL:
        return Outcome.of(ast.boolLiteral(random.nextBoolean()));
      case CHAR_LITERAL:
        return Outcome.of(ast.charLiteral(randomChar()));
      case INT_LITERAL:
        return Outcome.of(
            ast.intLiteral((PrimitiveType) type,
                randomInteger((PrimitiveType) type)));
      case STRING_LITERAL:
        return Outcome.of(ast.stringLiteral(randomString(0)));

      case VARIABLE:
        final List<Identifier> variables = new ArrayList<>();
        for (Identifier id : cx.variables()) {
          if (id.type.equals(type)) {
            variables.add(id);
          }
        }
        return Outcome.of(ast.id(pick(random, variables)));
      case CLI_ARGUMENT:
        return Outcome.of(
            ast.cliArgument(externalParameter((PrimitiveType) type)));
      case DEREFERENCE:
        final List<Identifier> references = new ArrayList<>();
        for (Identifier id : cx.variables()) {
          if (id.type instanceof RefType
              && ((RefType) id.type).elementType.equals(type)) {
            references.add(id);
          }
        }
        return Outcome.of(
            ast.prefixCall(Op.DEREFERENCE,
                ast.id(pick(random, references))));
    }

    // Every other production has operands, built one level down.
    final GenContext down = cx.withDepth(d - 1);
    switch (kind) {
      case TUPLE:
        final TupleType tupleType = (TupleType) type;
        return generateAll(down, tupleType.argTypes)
            .map(args -> ast.tuple(tupleType, args));
      case ARRAY:
        final ArrayType arrayType = (ArrayType) type;
        return generateAll(down,
            Collections.nCopies(arrayType.size, arrayType.elementType))
            .map(args -> ast.array(arrayType, args));
      case STRUCT:
        final StructType structType = (StructType) type;
        return generateAll(down, structType.fieldTypes.values().asList())
            .map(args -> ast.struct(structType, args));
      case ENUM_VARIANT:
        final EnumType enumType = (EnumType) type;
        final List<String> variants = new ArrayList<>();
        enumType.variants.forEach((name, types) -> {
          if (typeSystem.variantDepth(types) <= d) {
            variants.add(name);
          }
        });
        final String variant = pick(random, variants);
        return generateAll(down, enumType.variants.get(variant))
            .map(args -> ast.enumVariant(enumType, variant, args));
      case BOX_NEW:
        final BoxType boxType = (BoxType) type;
        return generateExpression(down, boxType.elementType)
            .map(e -> ast.boxNew(boxType, e));
      case SOME:
        final OptionType optionType = (OptionType) type;
        return generateExpression(down, optionType.elementType)
            .map(e -> ast.some(optionType, e));
      case NONE:
        return Outcome.of(ast.none((OptionType) type));
      case OK:
        final ResultType okResultType = (ResultType) type;
        return generateExpression(down, okResultType.okType)
            .map(e -> ast.ok(okResultType, e));
      case ERR:
        final ResultType errResultType = (ResultType) type;
        return generateExpression(down, errResultType.errType)
            .map(e -> ast.err(errResultType, e));
      case REFERENCE:
        final RefType refType = (RefType) type;
        return generateExpression(down, refType.elementType)
            .map(e -> ast.reference(refType, e));

      case PLUS:
      case MINUS:
      case TIMES:
      case DIVIDE:
      case MOD:
      case BIT_AND:
      case BIT_OR:
      case BIT_XOR:
      case AND_ALSO:
      case OR_ELSE:
        return generateInfix(down, kind.op(), type, type);
      case SHL:
      case SHR:
        return generateInfix(down, kind.op(), type, PrimitiveType.U32);
      case EQ:
      case NE:
      case LT:
      case LE:
      case GT:
      case GE:
        final PrimitiveType operandType =
            pick(random, PrimitiveType.COMPARABLE);
        return generateInfix(down, kind.op(), operandType, operandType);
      case NEGATE:
      case NOT:
        return generateExpression(down, type)
            .map(e -> ast.prefixCall(kind.op(), e));
      case CAST:
        final PrimitiveType castSource =
            pick(random, Legality.castSources(type));
        return generateExpression(down, castSource)
            .map(e -> ast.cast(e, (PrimitiveType) type));
      case TRY_CONVERT:
        final PrimitiveType convertSource =
            pick(random, PrimitiveType.INTEGERS);
        return generateExpression(down, convertSource)
            .map(e -> ast.convert(e, (PrimitiveType) type));

      case TUPLE_FIELD:
        final int arity = 2 + random.nextInt(2);
        final int index = random.nextInt(arity);
        final List<Type> argTypes = new ArrayList<>();
        for (int i = 0; i < arity; i++) {
          argTypes.add(i == index ? type
              : pick(random, PrimitiveType.COMPARABLE));
        }
        return generateExpression(down, typeSystem.tupleType(argTypes))
            .map(e -> ast.tupleField(e, index));
      case FIELD_ACCESS:
        final StructType owner =
            pick(random, Legality.structsWithField(cx, type, d - 1));
        final List<String> fields = new ArrayList<>();
        owner.fieldTypes.forEach((name, fieldType) -> {
          if (fieldType.equals(type)) {
            fields.add(name);
          }
        });
        final String field = pick(random, fields);
        return generateExpression(down, owner)
            .map(e -> ast.fieldAccess(e, field));
      case INDEX:
        final ArrayType indexedType =
            typeSystem.arrayType(type, 1 + random.nextInt(4));
        final Outcome<Ast.Exp> array = generateExpression(down, indexedType);
        if (array.isDeadEnd()) {
          return array;
        }
        return generateExpression(down, PrimitiveType.USIZE)
            .map(i -> ast.index(array.get(), i));
      case BOX_DEREF:
        return generateExpression(down, typeSystem.boxType(type))
            .map(e -> ast.prefixCall(Op.BOX_DEREF, e));
      case OPTION_UNWRAP:
        return generateExpression(down, typeSystem.optionType(type))
            .map(ast::unwrap);
      case RESULT_UNWRAP:
        final PrimitiveType errType = pick(random, PrimitiveType.COMPARABLE);
        return generateExpression(down, typeSystem.resultType(type, errType))
            .map(ast::unwrap);

      case IF:
        final Outcome<Ast.Exp> condition =
            generateExpression(down, PrimitiveType.BOOL);
        if (condition.isDeadEnd()) {
          return condition;
        }
        final Outcome<Ast.Block> ifTrue = generateBlock(down, type);
        if (ifTrue.isDeadEnd()) {
          return ifTrue.propagate();
        }
        return generateBlock(down, type)
            .map(ifFalse ->
                ast.ifThenElse(condition.get(), ifTrue.get(), ifFalse));
      case MATCH:
        return generateMatch(down, type);
      case BLOCK:
        return generateBlock(down, type).map(b -> b);
      case CALL:
        final Ast.FunDecl f =
            pick(random, Legality.callableFunctions(cx, type, d - 1));
        return generateCall(down, f);

      default:
        throw new AssertionError("unknown expression kind " + kind);
    }
  }

  /** Generates one expression for each of a list of types. */
  private Outcome<List<Ast.Exp>> generateAll(GenContext cx,
      List<Type> types) {
    final List<Ast.Exp> list = new ArrayList<>();
    for (Type type : types) {
      final Outcome<Ast.Exp> exp = generateExpression(cx, type);
      if (exp.isDeadEnd()) {
        return exp.propagate();
      }
      list.add(exp.get());
    }
    return Outcome.of(list);
  }

  private Outcome<Ast.Exp> generateInfix(GenContext cx, Op op, Type type0,
      Type type1) {
    final Outcome<Ast.Exp> a0 = generateExpression(cx, type0);
    if (a0.isDeadEnd()) {
      return a0;
    }
    return generateExpression(cx, type1)
        .map(a1 -> ast.infixCall(op, a0.get(), a1));
  }

  private Outcome<Ast.Exp> generateCall(GenContext cx, Ast.FunDecl f) {
    return generateAll(cx, f.paramTypes())
        .map(args -> ast.call(f.function, f.paramTypes(), args));
  }

  /**
   * Generates a "match" expression. The arms' patterns depend on the type
   * of the value being matched; every match is exhaustive.
   */
  private Outcome<Ast.Exp> generateMatch(GenContext cx, Type type) {
    final Outcome<Type> scrutineeType =
        selectionManager.chooseType(typeContext(cx, false));
    if (scrutineeType.isDeadEnd()) {
      return scrutineeType.propagate();
    }
    final Outcome<Ast.Exp> scrutinee =
        generateExpression(cx, scrutineeType.get());
    if (scrutinee.isDeadEnd()) {
      return scrutinee;
    }
    final Scope armScope = cx.scope.enter();
    final List<Ast.Pat> pats = new ArrayList<>();
    final List<Scope> scopes = new ArrayList<>();
    final Type t = scrutineeType.get();
    if (t == PrimitiveType.BOOL
        || t == PrimitiveType.CHAR
        || t.isInteger()) {
      final int n = 1 + random.nextInt(3);
      for (int i = 0; i < n; i++) {
        pats.add(ast.literalPat(randomLiteral((PrimitiveType) t)));
        scopes.add(armScope);
      }
      pats.add(ast.wildcardPat());
      scopes.add(armScope);
    } else if (t instanceof OptionType) {
      final Identifier v = patternVariable(armScope,
          ((OptionType) t).elementType);
      pats.add(ast.conPat("Some", ImmutableList.of(ast.idPat(v))));
      scopes.add(armScope.bind(v));
      pats.add(ast.con0Pat("None"));
      scopes.add(armScope);
    } else if (t instanceof ResultType) {
      final Identifier ok = patternVariable(armScope,
          ((ResultType) t).okType);
      pats.add(ast.conPat("Ok", ImmutableList.of(ast.idPat(ok))));
      scopes.add(armScope.bind(ok));
      final Identifier err = patternVariable(armScope,
          ((ResultType) t).errType);
      pats.add(ast.conPat("Err", ImmutableList.of(ast.idPat(err))));
      scopes.add(armScope.bind(err));
    } else if (t instanceof EnumType) {
      final EnumType enumType = (EnumType) t;
      enumType.variants.forEach((variant, types) -> {
        if (types.isEmpty()) {
          pats.add(ast.con0Pat(enumType.qualify(variant)));
          scopes.add(armScope);
        } else {
          Scope scope = armScope;
          final List<Ast.Pat> args = new ArrayList<>();
          for (Type fieldType : types) {
            final Identifier v = patternVariable(armScope, fieldType);
            args.add(ast.idPat(v));
            scope = scope.bind(v);
          }
          pats.add(ast.conPat(enumType.qualify(variant), args));
          scopes.add(scope);
        }
      });
    } else {
      pats.add(ast.wildcardPat());
      scopes.add(armScope);
    }

    final List<Ast.MatchArm> arms = new ArrayList<>();
    for (int i = 0; i < pats.size(); i++) {
      final Outcome<Ast.Exp> exp =
          generateExpression(cx.withScope(scopes.get(i)), type);
      if (exp.isDeadEnd()) {
        return exp;
      }
      arms.add(ast.matchArm(pats.get(i), exp.get()));
    }
    return Outcome.of(ast.match(scrutinee.get(), arms));
  }

  private Identifier patternVariable(Scope scope, Type type) {
    return new Identifier(names.next(Identifier.Kind.VARIABLE),
        Identifier.Kind.VARIABLE, type, scope.level, false);
  }

  /**
   * Returns an external parameter of a given type: an existing one, or a
   * new one with a random value.
   */
  private ExternalParameter externalParameter(PrimitiveType type) {
    final List<ExternalParameter> sameType = new ArrayList<>();
    for (ExternalParameter p : externals) {
      if (p.type == type) {
        sameType.add(p);
      }
    }
    if (!sameType.isEmpty() && random.nextBoolean()) {
      return pick(random, sameType);
    }
    final ExternalParameter p =
        new ExternalParameter(externals.size(), type, randomValue(type));
    externals.add(p);
    return p;
  }

  /** Returns a random value of a primitive type, as program input text. */
  private String randomValue(PrimitiveType type) {
    switch (type) {
      case BOOL:
        return String.valueOf(random.nextBoolean());
      case CHAR:
        return String.valueOf(randomChar());
      case STRING:
        // An empty command-line argument is easily lost; never generate one.
        return randomString(1);
      default:
        return randomInteger(type).toString();
    }
  }

  private Ast.Literal randomLiteral(PrimitiveType type) {
    switch (type) {
      case BOOL:
        return ast.boolLiteral(random.nextBoolean());
      case CHAR:
        return ast.charLiteral(randomChar());
      default:
        return ast.intLiteral(type, randomInteger(type));
    }
  }

  private char randomChar() {
    return ALPHANUMERIC.charAt(random.nextInt(ALPHANUMERIC.length()));
  }

  private String randomString(int minLength) {
    final int length = minLength + random.nextInt(9 - minLength);
    final StringBuilder b = new StringBuilder();
    for (int i = 0; i < length; i++) {
      b.append(randomChar());
    }
    return b.toString();
  }

  /**
   * Returns a random value of an integer type. Small values and the
   * extremes of the type's range are more likely than others.
   */
  private BigInteger randomInteger(PrimitiveType type) {
    final BigInteger min = type.minValue(typeSystem.usizeWidth);
    final BigInteger max = type.maxValue(typeSystem.usizeWidth);
    switch (random.nextInt(4)) {
      case 0:
        return BigInteger.valueOf(random.nextInt(11));
      case 1:
        return random.nextBoolean() ? min : max;
      default:
        final int bits = type.bits(typeSystem.usizeWidth);
        return new BigInteger(bits, random).add(min);
    }
  }
}

// End Generator.java
