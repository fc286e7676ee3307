package quark;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.google.common.base.Ascii;
import com.google.common.base.Joiner;
import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

/**
 * Flow-insensitive type inference over a parsed tree.
 *
 * <p>Analysis never stops early: every problem is recorded as a {@link CompilerException.Kind#TYPE}
 * error, the offending expression is typed {@code any}, and analysis carries on so that all errors
 * in a file are reported in one run. A variable's type is a single cell, so the last assignment
 * analyzed wins regardless of control flow.
 *
 * <p>An analyzer instance handles exactly one tree.
 */
public class Analyzer extends ErrorCollector {
  private final Builtins builtins;
  private final Scope globalScope;
  private Scope scope;

  private final Map<String, Scope> modules = new HashMap<>();
  // Lowered names of named functions, unique across the program.
  private final Map<Symbol, String> functionSymbols = new HashMap<>();
  private final Set<String> loweredFunctionNames = new HashSet<>();
  private final Map<Node, String> functionNames = Maps.newIdentityHashMap();
  // Enclosing module and function names, outermost first.
  private final Deque<String> qualifiers = new ArrayDeque<>();
  private final Set<String> globals = new LinkedHashSet<>();
  private final Map<Node, ImmutableList<String>> captures = Maps.newIdentityHashMap();
  private final Set<Node> declarations = Sets.newIdentityHashSet();
  private final Map<Node, Analysis.Binding> bindings = Maps.newIdentityHashMap();

  // Names declared inside each lambda being analyzed, innermost last.
  private final Deque<Set<String>> lambdaLocals = new ArrayDeque<>();

  public Analyzer(Builtins builtins) {
    this.builtins = builtins;
    Scope builtinScope = new Scope(null, Scope.Kind.BUILTIN);
    for (Builtins.Builtin b : builtins.all()) {
      List<Type> params = new ArrayList<>();
      for (int i = 0; i < b.minArity(); i++) {
        params.add(Type.any());
      }
      builtinScope.define(
          new Symbol(b.name(), Symbol.Kind.BUILTIN, Type.function(params, Type.any()), false));
    }
    this.globalScope = new Scope(builtinScope, Scope.Kind.GLOBAL);
    this.scope = globalScope;
  }

  public Analysis analyzeTree(Node root) {
    analyzeStatements(root.children());
    Verify.verify(
        scope == globalScope && lambdaLocals.isEmpty() && qualifiers.isEmpty(),
        "unbalanced scopes");
    return Analysis.create(
        root, captures, declarations, bindings, functionNames, globals, errors());
  }

  private void error(Node node, String msg) {
    logError(CompilerException.at(CompilerException.Kind.TYPE, node, msg));
  }

  private Type typed(Node node, Type type) {
    node.setType(type);
    return type;
  }

  private void push(Scope.Kind kind) {
    scope = new Scope(scope, kind);
  }

  private Scope pop() {
    Scope popped = scope;
    scope = scope.parent().get();
    return popped;
  }

  private void defineVariable(Node at, String name, Type type) {
    if (!scope.define(Symbol.variable(name, type))) {
      error(at, String.format("duplicate definition of '%s' in this scope", name));
      return;
    }
    if (!lambdaLocals.isEmpty()) {
      lambdaLocals.peek().add(name);
    }
    if (scope.kind().isGlobal()) {
      globals.add(name);
    }
  }

  private Analysis.Binding storageBinding(Scope where) {
    return where.kind().isGlobal() ? Analysis.Binding.GLOBAL : Analysis.Binding.LOCAL;
  }

  // True if resolving from the current scope to 'where' leaves a named function's body.
  private boolean crossesFunction(Scope where) {
    for (Scope s = scope; s != where; s = s.parent().get()) {
      if (s.kind() == Scope.Kind.FUNCTION) {
        return true;
      }
    }
    return false;
  }

  // --- Statements ---

  private Type analyzeStatements(List<Node> statements) {
    predeclareFunctions(statements);
    Type last = Type.voidType();
    for (Node stmt : statements) {
      last = analyze(stmt);
    }
    return last;
  }

  private Type analyzeScopedBlock(Node block) {
    push(Scope.Kind.BLOCK);
    Type result = analyzeStatements(block.children());
    pop();
    return typed(block, result);
  }

  private void predeclareFunctions(List<Node> statements) {
    for (Node stmt : statements) {
      if (!stmt.is(NodeKind.FUNCTION)) {
        continue;
      }
      Node name = stmt.child(0);
      List<Type> params = new ArrayList<>();
      stmt.child(1).children().forEach(p -> params.add(Type.any()));
      Symbol symbol =
          new Symbol(
              name.literal(), Symbol.Kind.FUNCTION, Type.function(params, Type.any()), false);

      if (!scope.define(symbol)) {
        error(name, String.format("duplicate definition of '%s' in this scope", name.literal()));
        continue;
      }
      String lowered = qualify(name.literal());
      functionSymbols.put(symbol, lowered);
      functionNames.put(stmt, lowered);
    }
  }

  // The enclosing names joined with the function's own, numbered when already taken.
  private String qualify(String name) {
    String base = Joiner.on('_').join(Iterables.concat(qualifiers, ImmutableList.of(name)));
    String lowered = base;
    for (int i = 2; !loweredFunctionNames.add(lowered); i++) {
      lowered = base + "_" + i;
    }
    return lowered;
  }

  private void referenceFunction(Node node, Symbol symbol) {
    bindings.put(node, Analysis.Binding.FUNCTION);
    functionNames.put(node, Verify.verifyNotNull(functionSymbols.get(symbol)));
  }

  Type analyze(Node node) {
    switch (node.kind()) {
      case LITERAL:
        return typed(node, literalType(node));
      case IDENTIFIER:
        return typed(node, analyzeIdentifier(node));
      case WILDCARD:
        error(node, "'_' is only allowed as a pattern");
        return typed(node, Type.any());
      case OPERATOR:
        return typed(node, analyzeOperator(node));
      case UNARY:
        return typed(node, analyzeUnary(node));
      case TERNARY:
        {
          analyze(node.child(0));
          return typed(node, Type.merge(analyze(node.child(1)), analyze(node.child(2))));
        }
      case PIPE:
        return typed(node, analyzePipe(node));
      case CALL:
        {
          List<Type> args = new ArrayList<>();
          node.child(1).children().forEach(a -> args.add(analyze(a)));
          return typed(node, analyzeCall(node, node.child(0), args));
        }
      case INDEX:
        return typed(node, analyzeIndex(node, analyze(node.child(0)), analyze(node.child(1))));
      case LIST:
        {
          List<Type> elems = new ArrayList<>();
          node.children().forEach(e -> elems.add(analyze(e)));
          return typed(node, Type.listOf(elems.isEmpty() ? Type.any() : Type.merge(elems)));
        }
      case VECTOR:
        return typed(node, analyzeVector(node));
      case DICT:
        return typed(node, analyzeDict(node));
      case RESULT:
        analyze(node.child(0));
        return typed(node, Type.any());
      case LAMBDA:
        return typed(node, analyzeLambda(node));
      case IF:
        return typed(node, analyzeIf(node));
      case WHEN:
        return typed(node, analyzeWhen(node));
      case FOR:
        analyzeFor(node);
        return typed(node, Type.voidType());
      case WHILE:
        analyze(node.child(0));
        analyzeScopedBlock(node.child(1));
        return typed(node, Type.voidType());
      case FUNCTION:
        analyzeFunction(node);
        return Type.voidType();
      case VAR_DECL:
        return typed(node, analyzeVarDecl(node));
      case MODULE:
        analyzeModule(node);
        return Type.voidType();
      case USE:
        analyzeUse(node);
        return Type.voidType();
      case BLOCK:
        return analyzeScopedBlock(node);
      default:
        return typed(node, Type.any());
    }
  }

  private static Type literalType(Node node) {
    switch (node.tokenKind()) {
      case INT:
        return Type.intType();
      case FLOAT:
        return Type.floatType();
      case STRING:
        return Type.strType();
      case TRUE:
      case FALSE:
        return Type.boolType();
      case NULL:
        return Type.nullType();
      default:
        return Type.any();
    }
  }

  private Type analyzeIdentifier(Node node) {
    String name = node.literal();
    Optional<Scope.Resolution> resolution = scope.resolve(name);
    if (!resolution.isPresent()) {
      error(node, String.format("undefined symbol '%s'", name));
      return Type.any();
    }

    Symbol symbol = resolution.get().symbol();
    switch (symbol.kind()) {
      case BUILTIN:
        bindings.put(node, Analysis.Binding.BUILTIN);
        return symbol.type();
      case FUNCTION:
        referenceFunction(node, symbol);
        return symbol.type();
      default:
        break;
    }

    Scope where = resolution.get().scope();
    if (!where.kind().isGlobal() && crossesFunction(where)) {
      error(
          node,
          String.format(
              "'%s' belongs to an enclosing function; named functions cannot capture it", name));
      return Type.any();
    }
    bindings.put(node, storageBinding(where));
    return symbol.type();
  }

  private void analyzeFunction(Node node) {
    Node name = node.child(0);
    Optional<Symbol> symbol =
        scope.lookupLocal(name.literal()).filter(s -> s.kind() == Symbol.Kind.FUNCTION);

    qualifiers.addLast(name.literal());
    push(Scope.Kind.FUNCTION);
    lambdaLocals.push(new HashSet<>());
    List<Type> params = new ArrayList<>();
    for (Node param : node.child(1).children()) {
      Type type = Type.any();
      if (param.childCount() > 0) {
        type = declaredType(param.child(0));
      }
      params.add(type);
      defineVariable(param, param.literal(), type);
    }
    Type returnType = typed(node.child(2), analyzeStatements(node.child(2).children()));
    lambdaLocals.pop();
    pop();
    qualifiers.removeLast();

    Type fnType = Type.function(params, returnType);
    symbol.ifPresent(s -> s.setType(fnType));
    node.setType(fnType);
  }

  private Type analyzeLambda(Node node) {
    Scope enclosing = scope;
    push(Scope.Kind.LAMBDA);
    lambdaLocals.push(new HashSet<>());
    Set<String> params = new HashSet<>();
    List<Type> paramTypes = new ArrayList<>();
    for (Node param : node.child(0).children()) {
      if (!scope.define(Symbol.variable(param.literal(), Type.any()))) {
        error(param, String.format("duplicate parameter '%s'", param.literal()));
      }
      params.add(param.literal());
      paramTypes.add(Type.any());
    }

    Node body = node.child(1);
    Type returnType =
        body.is(NodeKind.BLOCK)
            ? typed(body, analyzeStatements(body.children()))
            : analyze(body);
    Set<String> locals = lambdaLocals.pop();
    pop();

    captures.put(
        node,
        CaptureCollector.collect(
            node,
            builtins,
            Sets.difference(locals, params),
            name ->
                enclosing
                    .lookup(name)
                    .map(s -> s.kind() == Symbol.Kind.VARIABLE)
                    .orElse(false)));
    return Type.function(paramTypes, returnType);
  }

  private Type declaredType(Node typeNode) {
    Optional<Type> type = Type.named(typeNode.literal());
    if (!type.isPresent()) {
      error(typeNode, String.format("unknown type '%s'", typeNode.literal()));
      return Type.any();
    }
    return typed(typeNode, type.get());
  }

  private Type analyzeVarDecl(Node node) {
    String name = node.literal();
    Type declared = declaredType(node.child(0));
    Type value = analyze(node.child(1));
    if (!declared.accepts(value)) {
      error(
          node,
          String.format("cannot assign %s to '%s' declared as %s", value, name, declared));
    }
    if (scope.lookupLocal(name).isPresent()) {
      error(node, String.format("duplicate definition of '%s' in this scope", name));
      return declared;
    }
    defineVariable(node, name, declared);
    declarations.add(node);
    bindings.put(node, storageBinding(scope));
    return declared;
  }

  private void analyzeModule(Node node) {
    String name = node.child(0).literal();
    qualifiers.addLast(name);
    push(Scope.Kind.MODULE);
    analyzeStatements(node.child(1).children());
    Scope moduleScope = pop();
    qualifiers.removeLast();
    if (modules.putIfAbsent(name, moduleScope) != null) {
      error(node.child(0), String.format("duplicate module '%s'", name));
    }
  }

  private void analyzeUse(Node node) {
    Node target = node.child(0);
    if (target.is(NodeKind.LITERAL)) {
      error(target, String.format("cannot import '%s': file imports were not resolved", target.literal()));
      return;
    }
    Scope module = modules.get(target.literal());
    if (module == null) {
      error(target, String.format("undefined module '%s'", target.literal()));
      return;
    }
    for (Symbol symbol : module.symbols().values()) {
      Optional<Symbol> existing = scope.lookupLocal(symbol.name());
      if (existing.isPresent() && existing.get() != symbol) {
        error(
            target,
            String.format(
                "'%s' imported from module '%s' conflicts with an existing definition",
                symbol.name(), target.literal()));
      } else if (!existing.isPresent()) {
        scope.define(symbol);
      }
    }
  }

  private Type analyzeIf(Node node) {
    List<Type> branches = new ArrayList<>();
    int i = 0;
    for (; i + 1 < node.childCount(); i += 2) {
      analyze(node.child(i));
      branches.add(analyzeScopedBlock(node.child(i + 1)));
    }
    if (i < node.childCount()) {
      branches.add(analyzeScopedBlock(node.child(i)));
    } else {
      branches.add(Type.nullType());
    }
    return Type.merge(branches);
  }

  private Type analyzeWhen(Node node) {
    analyze(node.child(0));
    List<Type> arms = new ArrayList<>();
    boolean exhaustive = false;
    for (Node pattern : node.children().subList(1, node.childCount())) {
      push(Scope.Kind.BLOCK);
      for (Node part : pattern.children().subList(0, pattern.childCount() - 1)) {
        if (part.is(NodeKind.WILDCARD)) {
          exhaustive = true;
        } else if (part.is(NodeKind.RESULT_PATTERN)) {
          defineVariable(part.child(0), part.child(0).literal(), Type.any());
        } else {
          analyze(part);
        }
      }
      Node result = pattern.lastChild();
      Type type =
          result.is(NodeKind.BLOCK)
              ? typed(result, analyzeStatements(result.children()))
              : analyze(result);
      pop();
      arms.add(typed(pattern, type));
    }
    if (!exhaustive) {
      // No arm matched: the result is null.
      arms.add(Type.nullType());
    }
    return Type.merge(arms);
  }

  private void analyzeFor(Node node) {
    Type iterable = analyze(node.child(1));
    Type elem;
    if (iterable.isAny()) {
      elem = Type.any();
    } else if (iterable instanceof Type.ListType) {
      elem = ((Type.ListType) iterable).elem();
    } else if (iterable instanceof Type.VectorType) {
      elem = ((Type.VectorType) iterable).elem();
    } else if (iterable.isStringLike() || iterable instanceof Type.DictType) {
      elem = Type.strType();
    } else {
      error(node.child(1), String.format("value of type %s is not iterable", iterable));
      elem = Type.any();
    }

    push(Scope.Kind.BLOCK);
    defineVariable(node.child(0), node.child(0).literal(), elem);
    node.child(0).setType(elem);
    typed(node.child(2), analyzeStatements(node.child(2).children()));
    pop();
  }

  // --- Expressions ---

  private Type analyzeOperator(Node node) {
    switch (node.tokenKind()) {
      case EQUALS:
        return analyzeAssignment(node);
      case DOT:
        return analyzeMember(node, analyze(node.child(0)));
      case COMMA:
        analyze(node.child(0));
        return analyze(node.child(1));
      default:
        return binary(node, node.tokenKind(), analyze(node.child(0)), analyze(node.child(1)));
    }
  }

  private Type analyzeAssignment(Node node) {
    Node target = node.child(0);
    Type value = analyze(node.child(1));
    switch (target.kind()) {
      case IDENTIFIER:
        assignVariable(node, target, value);
        break;
      case INDEX:
        analyzeIndex(target, analyze(target.child(0)), analyze(target.child(1)));
        break;
      case OPERATOR:
        if (target.tokenKind() == TokenKind.DOT) {
          analyzeMember(target, analyze(target.child(0)));
          break;
        }
        error(target, "invalid assignment target");
        break;
      default:
        error(target, "invalid assignment target");
        break;
    }
    return value;
  }

  private void assignVariable(Node assignment, Node target, Type value) {
    String name = target.literal();
    target.setType(value);
    Optional<Scope.Resolution> resolution = scope.resolve(name);
    if (!resolution.isPresent()) {
      defineVariable(target, name, value);
      declarations.add(assignment);
      bindings.put(target, storageBinding(scope));
      return;
    }

    Symbol symbol = resolution.get().symbol();
    Scope where = resolution.get().scope();
    if (!symbol.mutable()) {
      error(
          target,
          String.format(
              "cannot assign to %s '%s'", Ascii.toLowerCase(symbol.kind().name()), name));
      return;
    }
    if (!where.kind().isGlobal() && crossesFunction(where)) {
      error(
          target,
          String.format(
              "'%s' belongs to an enclosing function; named functions cannot assign it", name));
      return;
    }
    symbol.setType(value);
    bindings.put(target, storageBinding(where));
  }

  private Type analyzeMember(Node node, Type object) {
    String member = node.child(1).literal();
    if (object.isAny()) {
      return Type.any();
    }
    if (object instanceof Type.DictType) {
      return ((Type.DictType) object).value();
    }
    error(node, String.format("value of type %s has no member '%s'", object, member));
    return Type.any();
  }

  private Type analyzeIndex(Node node, Type target, Type index) {
    if (target.isAny()) {
      return Type.any();
    }
    if (target instanceof Type.DictType) {
      if (!index.isAny() && !index.isStringLike()) {
        error(node.child(1), String.format("dict key must be str, got %s", index));
      }
      return ((Type.DictType) target).value();
    }

    Type elem;
    if (target instanceof Type.ListType) {
      elem = ((Type.ListType) target).elem();
    } else if (target instanceof Type.VectorType) {
      elem = ((Type.VectorType) target).elem();
    } else if (target.isStringLike()) {
      elem = Type.strType();
    } else {
      error(node, String.format("value of type %s is not indexable", target));
      return Type.any();
    }
    if (!index.isAny() && !index.isInteger()) {
      error(node.child(1), String.format("index must be int, got %s", index));
    }
    return elem;
  }

  private Type analyzeVector(Node node) {
    if (node.childCount() == 0) {
      return Type.vectorOf(Type.floatType());
    }
    Type first = null;
    boolean valid = true;
    for (Node elem : node.children()) {
      Type t = analyze(elem);
      if (!valid) {
        continue;
      }
      if (t.isAny()) {
        first = Type.any();
      } else if (first == null) {
        first = t;
      } else if (!first.isAny() && !first.equals(t)) {
        error(
            elem,
            String.format("heterogeneous vector literal: found %s and %s", first, t));
        valid = false;
      }
    }
    if (!valid) {
      return Type.any();
    }
    if (!first.isAny() && !first.is(Type.BasicKind.INT) && !first.is(Type.BasicKind.FLOAT)) {
      error(node, String.format("vector elements must be numeric, got %s", first));
      return Type.any();
    }
    return Type.vectorOf(first);
  }

  private Type analyzeDict(Node node) {
    Set<String> keys = new HashSet<>();
    List<Type> values = new ArrayList<>();
    for (Node pair : node.children()) {
      Node key = pair.child(0);
      if (!keys.add(key.literal())) {
        error(key, String.format("duplicate dict key '%s'", key.literal()));
      }
      key.setType(Type.strType());
      values.add(analyze(pair.child(1)));
    }
    return Type.dictOf(Type.strType(), values.isEmpty() ? Type.any() : Type.merge(values));
  }

  private Type analyzeUnary(Node node) {
    Type operand = analyze(node.child(0));
    if (node.tokenKind() != TokenKind.MINUS) {
      return Type.boolType();
    }
    if (operand.isAny() || operand.isNumeric()) {
      return operand;
    }
    if (operand instanceof Type.VectorType
        && ((Type.VectorType) operand).elem().isNumeric()) {
      return operand;
    }
    error(node, String.format("operator '-' requires a numeric operand, got %s", operand));
    return Type.any();
  }

  private Type analyzePipe(Node node) {
    Type input = analyze(node.child(0));
    Node target = node.child(1);
    List<Type> args = new ArrayList<>();
    args.add(input);
    if (target.is(NodeKind.CALL)) {
      target.child(1).children().forEach(a -> args.add(analyze(a)));
      return typed(target, analyzeCall(target, target.child(0), args));
    }
    if (target.is(NodeKind.IDENTIFIER)) {
      return analyzeCall(node, target, args);
    }
    analyze(target);
    error(target, "pipe target must be a function call");
    return Type.any();
  }

  private Type analyzeCall(Node call, Node callee, List<Type> args) {
    if (callee.is(NodeKind.IDENTIFIER)) {
      Optional<Symbol> symbol = scope.lookup(callee.literal());
      if (symbol.isPresent() && symbol.get().kind() == Symbol.Kind.BUILTIN) {
        bindings.put(callee, Analysis.Binding.BUILTIN);
        return builtinCall(call, builtins.lookup(callee.literal()).get(), args);
      }
      if (symbol.isPresent() && symbol.get().kind() == Symbol.Kind.FUNCTION) {
        referenceFunction(callee, symbol.get());
        Type.FunctionType fn = (Type.FunctionType) symbol.get().type();
        callee.setType(fn);
        if (fn.params().size() != args.size()) {
          error(
              call,
              String.format(
                  "function '%s' expects %d argument%s, got %d",
                  callee.literal(),
                  fn.params().size(),
                  fn.params().size() == 1 ? "" : "s",
                  args.size()));
          return Type.any();
        }
        return fn.returnType();
      }
    }

    Type fn = analyze(callee);
    if (fn.isAny()) {
      return Type.any();
    }
    if (!fn.isCallable()) {
      error(call, String.format("value of type %s is not callable", fn));
      return Type.any();
    }
    if (fn instanceof Type.FunctionType) {
      return ((Type.FunctionType) fn).returnType();
    }
    List<Type> returns = new ArrayList<>();
    ((Type.UnionType) fn)
        .options()
        .forEach(o -> returns.add(((Type.FunctionType) o).returnType()));
    return Type.merge(returns);
  }

  private Type builtinCall(Node call, Builtins.Builtin builtin, List<Type> args) {
    if (!builtin.acceptsArity(args.size())) {
      error(call, builtin.arityError(args.size()));
      return Type.any();
    }
    try {
      return builtin.returnRule().apply(ImmutableList.copyOf(args));
    } catch (CompilerException ex) {
      error(call, ex.errorMsg());
      return Type.any();
    }
  }

  private Type binary(Node node, TokenKind op, Type left, Type right) {
    switch (op) {
      case PLUS:
      case MINUS:
      case MULTIPLY:
      case DIVIDE:
      case DOUBLESTAR:
        return arithmetic(node, op, left, right);
      case MODULO:
        if (left.isAny() || right.isAny()) {
          return Type.any();
        }
        if (left.isInteger() && right.isInteger()) {
          return Type.intType();
        }
        return operandError(node, op, "integer operands", left, right);
      case LT:
      case GT:
      case LTE:
      case GTE:
        if (left.isAny() || right.isAny()) {
          return Type.boolType();
        }
        if (left instanceof Type.VectorType || right instanceof Type.VectorType) {
          if (elementOrSelf(left).isNumeric() && elementOrSelf(right).isNumeric()) {
            return Type.vectorOf(Type.boolType());
          }
        } else if (left.isComparable() && right.isComparable()) {
          return Type.boolType();
        }
        return operandError(node, op, "comparable operands", left, right);
      case DEQ:
      case NE:
        return left instanceof Type.VectorType || right instanceof Type.VectorType
            ? Type.vectorOf(Type.boolType())
            : Type.boolType();
      case AND:
      case OR:
        if ((left.isAny() || left.isBooleanLike()) && (right.isAny() || right.isBooleanLike())) {
          return Type.boolType();
        }
        return operandError(node, op, "boolean operands", left, right);
      case DOTDOT:
        if ((left.isAny() || left.isInteger()) && (right.isAny() || right.isInteger())) {
          return Type.listOf(Type.intType());
        }
        return operandError(node, op, "integer operands", left, right);
      default:
        error(node, String.format("unsupported operator '%s'", op.repr()));
        return Type.any();
    }
  }

  private Type arithmetic(Node node, TokenKind op, Type left, Type right) {
    if (left.isAny() || right.isAny()) {
      return Type.any();
    }
    boolean division = op == TokenKind.DIVIDE;
    if (left instanceof Type.VectorType || right instanceof Type.VectorType) {
      Type l = elementOrSelf(left);
      Type r = elementOrSelf(right);
      if (l.isAny() || r.isAny()) {
        return Type.vectorOf(Type.any());
      }
      if (l.isNumeric() && r.isNumeric()) {
        return Type.vectorOf(division ? Type.floatType() : promote(l, r));
      }
      return operandError(node, op, "numeric operands", left, right);
    }
    if (left.isNumeric() && right.isNumeric()) {
      return division ? Type.floatType() : promote(left, right);
    }
    if (op == TokenKind.PLUS && left.isStringLike() && right.isStringLike()) {
      return Type.strType();
    }
    return operandError(node, op, "numeric operands", left, right);
  }

  private static Type promote(Type left, Type right) {
    return left.isFloatLike() || right.isFloatLike() ? Type.floatType() : Type.intType();
  }

  private static Type elementOrSelf(Type type) {
    return type instanceof Type.VectorType ? ((Type.VectorType) type).elem() : type;
  }

  private Type operandError(Node node, TokenKind op, String what, Type left, Type right) {
    error(
        node,
        String.format("operator '%s' requires %s, got %s and %s", op.repr(), what, left, right));
    return Type.any();
  }
}
