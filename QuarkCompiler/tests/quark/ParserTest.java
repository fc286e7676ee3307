package quark;

import static com.google.common.truth.Truth.assertThat;

import java.util.Arrays;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class ParserTest {

  private static Parser parser(String... lines) {
    String source = Arrays.asList(lines).stream().collect(Collectors.joining("\n")) + "\n";
    return new Parser(new Tokenizer(source).tokenize());
  }

  private static Node parse(String... lines) {
    Parser parser = parser(lines);
    Node root = parser.parse();
    assertThat(parser.errors()).isEmpty();
    return root;
  }

  private static ImmutableList<CompilerException> errors(String... lines) {
    Parser parser = parser(lines);
    parser.parse();
    return parser.errors();
  }

  // Renders an expression as a compact s-expression.
  private static String sexpr(Node node) {
    switch (node.kind()) {
      case IDENTIFIER:
      case NAME:
      case LITERAL:
      case PARAMETER:
        return node.literal();
      case WILDCARD:
        return "_";
      case OPERATOR:
      case UNARY:
      case PIPE:
        return "(" + node.literal() + " " + children(node) + ")";
      case CALL:
        return "(call " + sexpr(node.child(0)) + prefixed(node.child(1)) + ")";
      case TERNARY:
        return "(?: " + children(node) + ")";
      default:
        return "(" + node.kind().name().toLowerCase() + prefixed(node) + ")";
    }
  }

  private static String children(Node node) {
    return node.children().stream().map(ParserTest::sexpr).collect(Collectors.joining(" "));
  }

  private static String prefixed(Node node) {
    return node.children().stream().map(c -> " " + sexpr(c)).collect(Collectors.joining());
  }

  private static String expr(String source) {
    Node root = parse(source);
    assertThat(root.children()).hasSize(1);
    return sexpr(root.child(0));
  }

  @Test
  public void emptyProgram() {
    assertThat(parse().children()).isEmpty();
  }

  @Test
  public void arithmeticPrecedence() {
    assertThat(expr("1 + 2 * 3")).isEqualTo("(+ 1 (* 2 3))");
    assertThat(expr("(1 + 2) * 3")).isEqualTo("(* (+ 1 2) 3)");
    assertThat(expr("1 - 2 - 3")).isEqualTo("(- (- 1 2) 3)");
    assertThat(expr("a < b and c or d")).isEqualTo("(or (and (< a b) c) d)");
  }

  @Test
  public void exponentIsRightAssociative() {
    assertThat(expr("2 ** 3 ** 2")).isEqualTo("(** 2 (** 3 2))");
  }

  @Test
  public void unaryBindsTighterThanBinary() {
    assertThat(expr("-a * b")).isEqualTo("(* (- a) b)");
    assertThat(expr("not a and b")).isEqualTo("(and (not a) b)");
  }

  @Test
  public void applicationTakesAdditiveArgument() {
    assertThat(expr("fact n - 1")).isEqualTo("(call fact (- n 1))");
    assertThat(expr("n * fact n - 1")).isEqualTo("(* n (call fact (- n 1)))");
    assertThat(expr("n - fact m")).isEqualTo("(- n (call fact m))");
  }

  @Test
  public void applicationWithSeveralArguments() {
    assertThat(expr("add 1, 2")).isEqualTo("(call add 1 2)");
    assertThat(expr("print len xs")).isEqualTo("(call print (call len xs))");
  }

  @Test
  public void binaryMinusIsNotApplication() {
    assertThat(expr("a * b - 1")).isEqualTo("(- (* a b) 1)");
    assertThat(expr("a - 1")).isEqualTo("(- a 1)");
    assertThat(expr("n -1")).isEqualTo("(- n 1)");
    assertThat(expr("f(-1)")).isEqualTo("(call f (- 1))");
  }

  @Test
  public void explicitCallsNeedAdjacentParenthesis() {
    assertThat(expr("f(a, b)")).isEqualTo("(call f a b)");
    assertThat(expr("f(a)(b)")).isEqualTo("(call (call f a) b)");
    assertThat(expr("f (a)")).isEqualTo("(call f a)");
    assertThat(expr("f()")).isEqualTo("(call f)");
  }

  @Test
  public void ternary() {
    assertThat(expr("a if c else b")).isEqualTo("(?: c a b)");
    assertThat(expr("x = 1 if a > b else 2")).isEqualTo("(= x (?: (> a b) 1 2))");
  }

  @Test
  public void pipes() {
    assertThat(expr("xs | map f | sum")).isEqualTo("(| (| xs (call map f)) sum)");
  }

  @Test
  public void pipeContinuesOnNextLine() {
    assertThat(sexpr(parse("xs", "| sum").child(0))).isEqualTo("(| xs sum)");
  }

  @Test
  public void assignmentIsRightAssociative() {
    assertThat(expr("a = b = 1")).isEqualTo("(= a (= b 1))");
  }

  @Test
  public void accessForms() {
    assertThat(expr("d.key")).isEqualTo("(. d key)");
    assertThat(expr("xs[i + 1]")).isEqualTo("(index xs (+ i 1))");
    assertThat(expr("xs[0] = 2")).isEqualTo("(= (index xs 0) 2)");
  }

  @Test
  public void literals() {
    assertThat(expr("[1, 2, 3]")).isEqualTo("(list 1 2 3)");
    assertThat(expr("list []")).isEqualTo("(list)");
    assertThat(expr("vector [1.0, 2.0]")).isEqualTo("(vector 1.0 2.0)");
    assertThat(expr("{a: 1, 'b': 2}")).isEqualTo("(dict (: a 1) (: b 2))");
    assertThat(expr("dict {}")).isEqualTo("(dict)");
    assertThat(expr("ok 1")).isEqualTo("(result 1)");
  }

  @Test
  public void rangeBindsLooserThanArithmetic() {
    assertThat(expr("0..n + 1")).isEqualTo("(.. 0 (+ n 1))");
  }

  @Test
  public void lambdas() {
    assertThat(expr("fn x -> x + 1")).isEqualTo("(lambda (parameters x) (+ x 1))");
    assertThat(expr("fn (a, b) -> a * b")).isEqualTo("(lambda (parameters a b) (* a b))");
    assertThat(expr("map fn x -> x, xs"))
        .isEqualTo("(call map (lambda (parameters x) x) xs)");
  }

  @Test
  public void lambdaWithBlockBody() {
    Node lambda = parse("f = fn x ->", "    y = x * 2", "    y + 1").child(0).child(1);

    assertThat(lambda.kind()).isEqualTo(NodeKind.LAMBDA);
    assertThat(lambda.child(1).kind()).isEqualTo(NodeKind.BLOCK);
    assertThat(lambda.child(1).children()).hasSize(2);
  }

  @Test
  public void functionDefinition() {
    Node fn = parse("fn add(a, b: int) ->", "    a + b").child(0);

    assertThat(sexpr(fn))
        .isEqualTo("(function add (parameters a b) (block (+ a b)))");
    assertThat(fn.child(1).child(1).child(0).literal()).isEqualTo("int");
  }

  @Test
  public void inlineFunctionBody() {
    assertThat(sexpr(parse("fn sq(x) -> x * x").child(0)))
        .isEqualTo("(function sq (parameters x) (block (* x x)))");
  }

  @Test
  public void ifChain() {
    Node node =
        parse("if a:", "    1", "elseif b:", "    2", "else:", "    3").child(0);

    assertThat(sexpr(node)).isEqualTo("(if a (block 1) b (block 2) (block 3))");
  }

  @Test
  public void forLoop() {
    assertThat(sexpr(parse("for i in 0..10:", "    print i").child(0)))
        .isEqualTo("(for i (.. 0 10) (block (call print i)))");
  }

  @Test
  public void whenPatterns() {
    Node when =
        parse(
                "when x:",
                "    1 or 2 -> 'small'",
                "    ok v -> v",
                "    err e -> e",
                "    _ -> 'other'")
            .child(0);

    assertThat(sexpr(when))
        .isEqualTo(
            "(when x (pattern 1 2 small) (pattern (result_pattern v) v)"
                + " (pattern (result_pattern e) e) (pattern _ other))");
  }

  @Test
  public void whenAsExpression() {
    Node root = parse("y = when x:", "    1 -> 'one'", "    _ -> 'many'", "print y");

    assertThat(root.children()).hasSize(2);
    assertThat(root.child(0).child(1).kind()).isEqualTo(NodeKind.WHEN);
  }

  @Test
  public void typedDeclaration() {
    assertThat(sexpr(parse("x: float = 1").child(0))).isEqualTo("(var_decl (type) 1)");
    assertThat(parse("x: float = 1").child(0).literal()).isEqualTo("x");
  }

  @Test
  public void modulesAndUses() {
    Node root = parse("module math:", "    fn sq(x) -> x * x", "use math", "use './lib/util'");

    assertThat(root.child(0).kind()).isEqualTo(NodeKind.MODULE);
    assertThat(root.child(1).child(0).kind()).isEqualTo(NodeKind.NAME);
    assertThat(root.child(2).child(0).kind()).isEqualTo(NodeKind.LITERAL);
    assertThat(root.child(2).child(0).literal()).isEqualTo("./lib/util");
  }

  @Test
  public void missingTokenReported() {
    ImmutableList<CompilerException> errors = errors("for i 0..3:", "    print i");

    assertThat(errors).isNotEmpty();
    assertThat(errors.get(0).kind()).isEqualTo(CompilerException.Kind.PARSE);
    assertThat(errors.get(0)).hasMessageThat().contains("expected 'in' but got INT '0'");
    assertThat(errors.get(0).line()).isEqualTo(1);
  }

  @Test
  public void illegalTokensBecomeLexErrors() {
    ImmutableList<CompilerException> errors = errors("if x:", "y");

    assertThat(errors).hasSize(1);
    assertThat(errors.get(0).kind()).isEqualTo(CompilerException.Kind.LEX);
    assertThat(errors.get(0)).hasMessageThat().isEqualTo("expected indented block");
  }

  @Test
  public void parsingContinuesAfterError() {
    ImmutableList<CompilerException> errors = errors("x = )", "y = 2", "z = ]");

    assertThat(errors).hasSize(2);
    assertThat(errors.get(0).line()).isEqualTo(1);
    assertThat(errors.get(1).line()).isEqualTo(3);
  }

  @Test
  public void treeDump() {
    assertThat(parse("x = 1 + 2").toTreeString())
        .isEqualTo(
            "COMPILATION_UNIT\n"
                + "  OPERATOR =\n"
                + "    IDENTIFIER x\n"
                + "    OPERATOR +\n"
                + "      LITERAL 1\n"
                + "      LITERAL 2\n");
  }
}
