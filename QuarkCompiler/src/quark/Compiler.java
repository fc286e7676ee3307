package quark;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;
import java.util.regex.Pattern;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;

/**
 * Lowers an analyzed tree to target source through a {@link ValueAbi}.
 *
 * <p>Output order is fixed: prelude, global storage, prototypes, function bodies, then the entry
 * point running the top-level statements. Named functions and lambdas are all hoisted to file
 * scope and share the signature {@code (env, params...)}. Lowering is a single deterministic pass
 * and requires an analysis without errors.
 */
public class Compiler {
  private static final Logger LOG = Logger.getLogger(Compiler.class.getName());

  private static final Pattern PLAIN_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private final Analysis analysis;
  private final Builtins builtins;
  private final ValueAbi abi;

  private final List<String> prototypes = new ArrayList<>();
  private final StringBuilder functions = new StringBuilder();
  private final Deque<FunctionWriter> writers = new ArrayDeque<>();
  private int lambdaCount = 0;
  private int tempCount = 0;

  public Compiler(Analysis analysis, Builtins builtins, ValueAbi abi) {
    Preconditions.checkArgument(
        !analysis.hasErrors(), "cannot lower a tree with %s errors", analysis.errors().size());
    this.analysis = analysis;
    this.builtins = builtins;
    this.abi = abi;
  }

  private static final class FunctionWriter {
    private final StringBuilder out = new StringBuilder();
    private int depth = 1;

    void line(String text) {
      out.append(Strings.repeat("    ", depth)).append(text).append('\n');
    }

    void open(String header) {
      line(header + " {");
      depth++;
    }

    void reopen(String header) {
      depth--;
      line("} " + header + " {");
      depth++;
    }

    void close() {
      depth--;
      line("}");
    }

    @Override
    public String toString() {
      return out.toString();
    }
  }

  public String compile() {
    FunctionWriter main = new FunctionWriter();
    writers.push(main);
    main.line(abi.runtimeInit());
    lowerStatements(analysis.root().children(), false);
    main.line("return 0;");
    writers.pop();
    Verify.verify(writers.isEmpty(), "unbalanced function writers");

    StringBuilder out = new StringBuilder(abi.prelude()).append('\n');
    if (!analysis.globals().isEmpty()) {
      for (String global : analysis.globals()) {
        out.append(String.format(
            "%s %s = %s;\n", abi.valueType(), abi.identifier(global), abi.nullValue()));
      }
      out.append('\n');
    }
    if (!prototypes.isEmpty()) {
      prototypes.forEach(p -> out.append(p).append(";\n"));
      out.append('\n');
    }
    out.append(functions);
    out.append("int main() {\n").append(main).append("}\n");

    LOG.fine(
        String.format(
            "lowered %d globals, %d functions, %d lambdas",
            analysis.globals().size(), prototypes.size() - lambdaCount, lambdaCount));
    return out.toString();
  }

  private FunctionWriter writer() {
    return writers.peek();
  }

  private String newTemp() {
    return "_t" + tempCount++;
  }

  // Binds a non-trivial expression to a temporary so it is evaluated exactly once.
  private String temp(String expr) {
    if (PLAIN_NAME.matcher(expr).matches()) {
      return expr;
    }
    String name = newTemp();
    writer().line(String.format("%s %s = %s;", abi.valueType(), name, expr));
    return name;
  }

  private String resultTemp() {
    String name = newTemp();
    writer().line(String.format("%s %s = %s;", abi.valueType(), name, abi.nullValue()));
    return name;
  }

  // --- Statements ---

  /** Lowers a statement list; returns the last statement's value when {@code wantValue}. */
  private String lowerStatements(List<Node> statements, boolean wantValue) {
    String value = abi.nullValue();
    for (int i = 0; i < statements.size(); i++) {
      boolean last = i == statements.size() - 1;
      String v = lowerStatement(statements.get(i), wantValue && last);
      if (wantValue && last) {
        value = v;
      }
    }
    return value;
  }

  private String lowerStatement(Node node, boolean wantValue) {
    switch (node.kind()) {
      case FUNCTION:
        lowerFunction(node);
        return abi.nullValue();
      case MODULE:
        lowerStatements(node.child(1).children(), false);
        return abi.nullValue();
      case USE:
        return abi.nullValue();
      case FOR:
        lowerFor(node);
        return abi.nullValue();
      case WHILE:
        lowerWhile(node);
        return abi.nullValue();
      case VAR_DECL:
        return store(node, node.literal(), lowerExpr(node.child(1)));
      default:
        String value = lowerExpr(node);
        if (wantValue) {
          return value;
        }
        if (!PLAIN_NAME.matcher(value).matches()) {
          writer().line(value + ";");
        }
        return abi.nullValue();
    }
  }

  private String signature(String name, List<Node> params) {
    List<String> parts = new ArrayList<>();
    parts.add(abi.environmentType() + " _env");
    params.forEach(p -> parts.add(abi.valueType() + " " + abi.identifier(p.literal())));
    return String.format("%s %s(%s)", abi.valueType(), name, Joiner.on(", ").join(parts));
  }

  private void emitFunction(String signature, FunctionWriter body) {
    prototypes.add(signature);
    functions.append(signature).append(" {\n").append(body).append("}\n\n");
  }

  private void lowerFunction(Node node) {
    String signature =
        signature(abi.namedFunction(analysis.functionNameOf(node)), node.child(1).children());
    FunctionWriter body = new FunctionWriter();
    writers.push(body);
    String result = lowerStatements(node.child(2).children(), true);
    body.line("return " + result + ";");
    writers.pop();
    emitFunction(signature, body);
  }

  private void lowerFor(Node node) {
    String var = abi.identifier(node.child(0).literal());
    Node iterable = node.child(1);
    FunctionWriter w = writer();
    String one = abi.intValue("1");

    if (iterable.is(NodeKind.OPERATOR) && iterable.tokenKind() == TokenKind.DOTDOT) {
      String start = lowerExpr(iterable.child(0));
      String end = temp(lowerExpr(iterable.child(1)));
      w.open(
          String.format(
              "for (%s %s = %s; %s; %s = %s)",
              abi.valueType(),
              var,
              start,
              abi.truthy(abi.binary(TokenKind.LT, false, var, end)),
              var,
              abi.binary(TokenKind.PLUS, false, var, one)));
    } else {
      String items = temp(lowerExpr(iterable));
      String index = openIndexLoop(items);
      w.line(String.format("%s %s = %s;", abi.valueType(), var, abi.iterGet(items, index)));
    }
    lowerStatements(node.child(2).children(), false);
    w.close();
  }

  // Opens a loop over the positions of 'items' and returns the index variable.
  private String openIndexLoop(String items) {
    FunctionWriter w = writer();
    String count = newTemp();
    w.line(String.format("%s %s = %s;", abi.valueType(), count, abi.iterLength(items)));
    String index = newTemp();
    w.open(
        String.format(
            "for (%s %s = %s; %s; %s = %s)",
            abi.valueType(),
            index,
            abi.intValue("0"),
            abi.truthy(abi.binary(TokenKind.LT, false, index, count)),
            index,
            abi.binary(TokenKind.PLUS, false, index, abi.intValue("1"))));
    return index;
  }

  // The runtime has no to_vector; the items are pushed into a new vector one by one.
  private String lowerToVector(String iterable) {
    String items = temp(iterable);
    String vector = newTemp();
    writer().line(String.format("%s %s = %s;", abi.valueType(), vector, abi.newVector()));
    String index = openIndexLoop(items);
    writer().line(abi.vectorPush(vector, abi.iterGet(items, index)) + ";");
    writer().close();
    return vector;
  }

  private void lowerWhile(Node node) {
    FunctionWriter w = writer();
    w.open("while (true)");
    String cond = lowerExpr(node.child(0));
    w.line("if (!" + abi.truthy(cond) + ") break;");
    lowerStatements(node.child(1).children(), false);
    w.close();
  }

  // Assigns a variable, declaring it when the analyzer recorded this node as its declaration.
  private String store(Node declaration, String name, String value) {
    Node bindingSite = declaration.is(NodeKind.VAR_DECL) ? declaration : declaration.child(0);
    String id = abi.identifier(name);
    boolean local =
        analysis.declares(declaration)
            && analysis.bindingOf(bindingSite).orElse(Analysis.Binding.LOCAL)
                == Analysis.Binding.LOCAL;
    writer().line(local
        ? String.format("%s %s = %s;", abi.valueType(), id, value)
        : String.format("%s = %s;", id, value));
    return id;
  }

  // --- Expressions ---

  private String lowerExpr(Node node) {
    switch (node.kind()) {
      case LITERAL:
        return lowerLiteral(node);
      case IDENTIFIER:
        return lowerIdentifier(node);
      case OPERATOR:
        return lowerOperator(node);
      case UNARY:
        return abi.unary(node.tokenKind(), lowerExpr(node.child(0)));
      case TERNARY:
        return lowerTernary(node);
      case PIPE:
        return lowerPipe(node);
      case CALL:
        return lowerCall(node.child(0), lowerArguments(node.child(1).children()));
      case INDEX:
        {
          String target = lowerExpr(node.child(0));
          String index = lowerExpr(node.child(1));
          return node.child(0).type() instanceof Type.DictType
              ? abi.dictIndexGet(target, index)
              : abi.indexGet(target, index);
        }
      case LIST:
        return lowerSequence(node, abi.newList(), false);
      case VECTOR:
        return lowerSequence(node, abi.newVector(), true);
      case DICT:
        return lowerDict(node);
      case RESULT:
        {
          String value = lowerExpr(node.child(0));
          return node.tokenKind() == TokenKind.OK ? abi.ok(value) : abi.err(value);
        }
      case LAMBDA:
        return lowerLambda(node);
      case IF:
        {
          String result = resultTemp();
          lowerIfChain(node, 0, result);
          return result;
        }
      case WHEN:
        return lowerWhen(node);
      case BLOCK:
        return lowerStatements(node.children(), true);
      default:
        return abi.nullValue();
    }
  }

  private String lowerLiteral(Node node) {
    switch (node.tokenKind()) {
      case INT:
        return abi.intValue(node.literal());
      case FLOAT:
        return abi.floatValue(node.literal());
      case STRING:
        return abi.stringValue(node.literal());
      case TRUE:
        return abi.boolValue(true);
      case FALSE:
        return abi.boolValue(false);
      default:
        return abi.nullValue();
    }
  }

  private String lowerIdentifier(Node node) {
    Analysis.Binding binding = analysis.bindingOf(node).orElse(Analysis.Binding.LOCAL);
    switch (binding) {
      case FUNCTION:
        return abi.functionValue(abi.allocClosure(abi.namedFunction(analysis.functionNameOf(node)), 0));
      case BUILTIN:
        // Builtins have no function value.
        return abi.nullValue();
      default:
        return abi.identifier(node.literal());
    }
  }

  private ImmutableList<String> lowerArguments(List<Node> args) {
    ImmutableList.Builder<String> lowered = ImmutableList.builder();
    args.forEach(a -> lowered.add(lowerExpr(a)));
    return lowered.build();
  }

  private String lowerOperator(Node node) {
    TokenKind op = node.tokenKind();
    switch (op) {
      case EQUALS:
        return lowerAssignment(node);
      case DOT:
        return abi.memberGet(lowerExpr(node.child(0)), node.child(1).literal());
      case COMMA:
        lowerStatement(node.child(0), false);
        return lowerExpr(node.child(1));
      case DOTDOT:
        return builtinCall(
            "range", ImmutableList.of(lowerExpr(node.child(0)), lowerExpr(node.child(1))));
      default:
        {
          Node left = node.child(0);
          Node right = node.child(1);
          boolean vector =
              left.type() instanceof Type.VectorType || right.type() instanceof Type.VectorType;
          return abi.binary(op, vector, lowerExpr(left), lowerExpr(right));
        }
    }
  }

  private String lowerAssignment(Node node) {
    Node target = node.child(0);
    String value = lowerExpr(node.child(1));
    switch (target.kind()) {
      case IDENTIFIER:
        return store(node, target.literal(), value);
      case INDEX:
        {
          String object = lowerExpr(target.child(0));
          String index = lowerExpr(target.child(1));
          String v = temp(value);
          writer().line(
              (target.child(0).type() instanceof Type.DictType
                      ? abi.dictIndexSet(object, index, v)
                      : abi.indexSet(object, index, v))
                  + ";");
          return v;
        }
      case OPERATOR:
        {
          String object = lowerExpr(target.child(0));
          String v = temp(value);
          writer().line(abi.memberSet(object, target.child(1).literal(), v) + ";");
          return v;
        }
      default:
        return abi.nullValue();
    }
  }

  private String lowerSequence(Node node, String constructor, boolean vector) {
    String seq = newTemp();
    writer().line(String.format("%s %s = %s;", abi.valueType(), seq, constructor));
    for (Node elem : node.children()) {
      String value = lowerExpr(elem);
      writer().line((vector ? abi.vectorPush(seq, value) : abi.listPush(seq, value)) + ";");
    }
    return seq;
  }

  private String lowerDict(Node node) {
    String dict = newTemp();
    writer().line(String.format("%s %s = %s;", abi.valueType(), dict, abi.newDict()));
    for (Node pair : node.children()) {
      String value = lowerExpr(pair.child(1));
      writer().line(abi.dictLiteralSet(dict, pair.child(0).literal(), value) + ";");
    }
    return dict;
  }

  private String lowerTernary(Node node) {
    String result = resultTemp();
    FunctionWriter w = writer();
    String cond = lowerExpr(node.child(0));
    w.open("if (" + abi.truthy(cond) + ")");
    w.line(result + " = " + lowerExpr(node.child(1)) + ";");
    w.reopen("else");
    w.line(result + " = " + lowerExpr(node.child(2)) + ";");
    w.close();
    return result;
  }

  // Children come in (condition, block) pairs with an optional trailing else block.
  private void lowerIfChain(Node node, int index, String result) {
    FunctionWriter w = writer();
    if (index + 1 >= node.childCount()) {
      w.line(result + " = " + lowerStatements(node.child(index).children(), true) + ";");
      return;
    }
    String cond = lowerExpr(node.child(index));
    w.open("if (" + abi.truthy(cond) + ")");
    w.line(result + " = " + lowerStatements(node.child(index + 1).children(), true) + ";");
    if (index + 2 < node.childCount()) {
      w.reopen("else");
      lowerIfChain(node, index + 2, result);
    }
    w.close();
  }

  private String lowerWhen(Node node) {
    String scrutinee = newTemp();
    writer().line(String.format(
        "%s %s = %s;", abi.valueType(), scrutinee, lowerExpr(node.child(0))));
    String result = resultTemp();
    lowerArms(node, 1, scrutinee, result);
    return result;
  }

  private void lowerArms(Node node, int index, String scrutinee, String result) {
    if (index >= node.childCount()) {
      return;
    }
    FunctionWriter w = writer();
    Node pattern = node.child(index);
    List<Node> parts = pattern.children().subList(0, pattern.childCount() - 1);
    Node first = parts.get(0);

    String cond;
    if (first.is(NodeKind.WILDCARD)) {
      cond = "true";
    } else if (first.is(NodeKind.RESULT_PATTERN)) {
      cond = first.tokenKind() == TokenKind.OK ? abi.isOk(scrutinee) : abi.isErr(scrutinee);
    } else {
      List<String> tests = new ArrayList<>();
      for (Node alternative : parts) {
        tests.add(
            abi.truthy(abi.binary(TokenKind.DEQ, false, scrutinee, lowerExpr(alternative))));
      }
      cond = Joiner.on(" || ").join(tests);
    }

    w.open("if (" + cond + ")");
    if (first.is(NodeKind.RESULT_PATTERN)) {
      String extract =
          first.tokenKind() == TokenKind.OK
              ? abi.resultValue(scrutinee)
              : abi.resultError(scrutinee);
      w.line(String.format(
          "%s %s = %s;", abi.valueType(), abi.identifier(first.child(0).literal()), extract));
    }
    w.line(result + " = " + lowerExpr(pattern.lastChild()) + ";");
    if (index + 1 < node.childCount()) {
      w.reopen("else");
      lowerArms(node, index + 1, scrutinee, result);
    }
    w.close();
  }

  private String lowerPipe(Node node) {
    String input = lowerExpr(node.child(0));
    Node target = node.child(1);
    if (target.is(NodeKind.CALL)) {
      List<String> args = new ArrayList<>();
      args.add(input);
      args.addAll(lowerArguments(target.child(1).children()));
      return lowerCall(target.child(0), args);
    }
    return lowerCall(target, ImmutableList.of(input));
  }

  private String lowerCall(Node callee, List<String> args) {
    if (callee.is(NodeKind.IDENTIFIER)) {
      Analysis.Binding binding = analysis.bindingOf(callee).orElse(Analysis.Binding.LOCAL);
      if (binding == Analysis.Binding.BUILTIN) {
        return builtinCall(callee.literal(), args);
      }
      if (binding == Analysis.Binding.FUNCTION) {
        return abi.directCall(abi.namedFunction(analysis.functionNameOf(callee)), args);
      }
    }
    return abi.dynamicCall(lowerExpr(callee), args);
  }

  // Pads missing optional arguments with null and drops extras.
  private String builtinCall(String name, List<String> args) {
    if (name.equals(Builtins.TO_VECTOR)) {
      return lowerToVector(args.get(0));
    }
    int arity = builtins.lookup(name).map(Builtins.Builtin::maxArity).orElse(args.size());
    List<String> padded = new ArrayList<>(args.subList(0, Math.min(arity, args.size())));
    while (padded.size() < arity) {
      padded.add(abi.nullValue());
    }
    return abi.builtinCall(name, padded);
  }

  private String lowerLambda(Node node) {
    int index = lambdaCount++;
    String name = abi.lambdaFunction(index);
    String signature = signature(name, node.child(0).children());
    ImmutableList<String> captures = analysis.capturesOf(node);

    FunctionWriter body = new FunctionWriter();
    writers.push(body);
    for (int i = 0; i < captures.size(); i++) {
      body.line(String.format(
          "%s %s = %s;",
          abi.valueType(), abi.identifier(captures.get(i)), abi.environmentCapture(i)));
    }
    body.line("return " + lowerExpr(node.child(1)) + ";");
    writers.pop();
    emitFunction(signature, body);

    String closure = "_c" + index;
    FunctionWriter w = writer();
    w.line(String.format(
        "%s %s = %s;", abi.environmentType(), closure, abi.allocClosure(name, captures.size())));
    for (int i = 0; i < captures.size(); i++) {
      w.line(String.format(
          "%s = %s;", abi.captureSlot(closure, i), abi.identifier(captures.get(i))));
    }
    return abi.functionValue(closure);
  }
}
