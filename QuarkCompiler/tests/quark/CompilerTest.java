package quark;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.junit.jupiter.api.Test;

import com.google.common.base.Joiner;

public class CompilerTest {

  private static final Pattern RUNTIME_CALL = Pattern.compile("\\bqv?_[a-z0-9_]+(?=\\()");

  private static String compile(String... lines) throws CompilerException {
    return Compilation.compileOrThrow(
        Joiner.on('\n').join(lines) + "\n", CompilerOptions.defaults());
  }

  @Test
  public void helloWorld() throws Exception {
    assertThat(compile("print 'hi'"))
        .isEqualTo(
            "#include \"quark/quark.hpp\"\n"
                + "\n"
                + "int main() {\n"
                + "    q_gc_init();\n"
                + "    q_print(qv_string(\"hi\"));\n"
                + "    return 0;\n"
                + "}\n");
  }

  @Test
  public void globalsAreDeclaredAtFileScope() throws Exception {
    assertThat(compile("x = 1", "x = x + 2"))
        .isEqualTo(
            "#include \"quark/quark.hpp\"\n"
                + "\n"
                + "QValue x = qv_null();\n"
                + "\n"
                + "int main() {\n"
                + "    q_gc_init();\n"
                + "    x = qv_int(1LL);\n"
                + "    x = q_add(x, qv_int(2LL));\n"
                + "    return 0;\n"
                + "}\n");
  }

  @Test
  public void builtinCallsArePaddedToMaximumArity() throws Exception {
    String out = compile("print()", "range 5");

    assertThat(out).contains("    q_print(qv_null());\n");
    assertThat(out).contains("    q_range(qv_int(5LL), qv_null(), qv_null());\n");
  }

  @Test
  public void rangeOperatorLowersToRangeBuiltin() throws Exception {
    assertThat(compile("xs = 0..4")).contains("xs = q_range(qv_int(0LL), qv_int(4LL), qv_null());");
  }

  @Test
  public void namedFunctions() throws Exception {
    String out = compile("fn sq(x) -> x * x", "print sq 3");

    assertThat(out).contains("QValue quark_fn_sq(QClosure* _env, QValue x);\n");
    assertThat(out)
        .contains("QValue quark_fn_sq(QClosure* _env, QValue x) {\n    return q_mul(x, x);\n}\n");
    assertThat(out).contains("    q_print(quark_fn_sq(nullptr, qv_int(3LL)));\n");
  }

  @Test
  public void spacedMinusAfterParameterSubtracts() throws Exception {
    String out = compile("fn dec(n) -> n -1");

    assertThat(out).contains("    return q_sub(n, qv_int(1LL));\n");
    assertThat(out).doesNotContain("q_call1");
  }

  @Test
  public void functionLocalsAreDeclaredOnce() throws Exception {
    String out = compile("fn f(a) ->", "    y = a", "    y = y + 1", "    y");

    assertThat(out).contains("    QValue y = a;\n    y = q_add(y, qv_int(1LL));\n    return y;\n");
  }

  @Test
  public void functionsAsValues() throws Exception {
    String out = compile("fn inc(x) -> x + 1", "f = inc", "print f(1)");

    assertThat(out).contains("f = qv_func(q_alloc_closure((void*)quark_fn_inc, 0));");
    assertThat(out).contains("q_print(q_call1(f, qv_int(1LL)));");
  }

  @Test
  public void closuresCopyCapturesIntoEnvironment() throws Exception {
    String out =
        compile("fn adder(n) ->", "    fn x -> x + n", "add2 = adder 2", "print add2(3)");

    assertThat(out)
        .contains(
            "QValue quark_lambda_0(QClosure* _env, QValue x) {\n"
                + "    QValue n = _env->captures[0];\n"
                + "    return q_add(x, n);\n"
                + "}\n");
    assertThat(out)
        .contains(
            "    QClosure* _c0 = q_alloc_closure((void*)quark_lambda_0, 1);\n"
                + "    _c0->captures[0] = n;\n"
                + "    return qv_func(_c0);\n");
    assertThat(out).contains("q_print(q_call1(add2, qv_int(3LL)));");
  }

  @Test
  public void manyArgumentsUseVariadicCall() throws Exception {
    String out = compile("f = fn (a, b, c, d, e) -> a", "f(1, 2, 3, 4, 5)");

    assertThat(out)
        .contains(
            "q_calln(f, 5, {qv_int(1LL), qv_int(2LL), qv_int(3LL), qv_int(4LL), qv_int(5LL)});");
  }

  @Test
  public void pipesPrependTheirInput() throws Exception {
    String out = compile("fn add(a, b) -> a + b", "x = 1 | add 2", "y = [1, 2] | sum");

    assertThat(out).contains("x = quark_fn_add(nullptr, qv_int(1LL), qv_int(2LL));");
    assertThat(out).contains("y = q_sum(_t0);");
  }

  @Test
  public void ternaryUsesResultTemporary() throws Exception {
    assertThat(compile("x = 1 if true else 2"))
        .contains(
            "    QValue _t0 = qv_null();\n"
                + "    if (q_truthy(qv_bool(true))) {\n"
                + "        _t0 = qv_int(1LL);\n"
                + "    } else {\n"
                + "        _t0 = qv_int(2LL);\n"
                + "    }\n"
                + "    x = _t0;\n");
  }

  @Test
  public void ifChainNestsElseBranches() throws Exception {
    String out =
        compile("n = 5", "if n < 0:", "    print 'neg'", "elseif n == 0:", "    print 'zero'",
            "else:", "    print 'pos'");

    assertThat(out).contains("    if (q_truthy(q_lt(n, qv_int(0LL)))) {\n");
    assertThat(out).contains("    } else {\n        if (q_truthy(q_eq(n, qv_int(0LL)))) {\n");
    assertThat(out).contains("q_print(qv_string(\"pos\"))");
  }

  @Test
  public void whenLowersToComparisonLadder() throws Exception {
    String out = compile("x = 2", "y = when x:", "    1 or 2 -> 'small'", "    _ -> 'big'");

    assertThat(out)
        .contains(
            "    QValue _t0 = x;\n"
                + "    QValue _t1 = qv_null();\n"
                + "    if (q_truthy(q_eq(_t0, qv_int(1LL))) || q_truthy(q_eq(_t0, qv_int(2LL)))) {\n"
                + "        _t1 = qv_string(\"small\");\n"
                + "    } else {\n"
                + "        if (true) {\n"
                + "            _t1 = qv_string(\"big\");\n"
                + "        }\n"
                + "    }\n"
                + "    y = _t1;\n");
  }

  @Test
  public void resultPatternsBindTheirPayload() throws Exception {
    String out = compile("r = ok 1", "when r:", "    ok v -> print v", "    err e -> print e");

    assertThat(out).contains("r = qv_ok(qv_int(1LL));");
    assertThat(out).contains("if (q_is_ok(_t0)) {\n        QValue v = q_result_value(_t0);\n");
    assertThat(out).contains("if (!q_is_ok(_t0)) {\n            QValue e = q_result_error(_t0);\n");
  }

  @Test
  public void rangeLoop() throws Exception {
    assertThat(compile("for i in 0..3:", "    print i"))
        .contains(
            "    QValue _t0 = qv_int(3LL);\n"
                + "    for (QValue i = qv_int(0LL); q_truthy(q_lt(i, _t0));"
                + " i = q_add(i, qv_int(1LL))) {\n"
                + "        q_print(i);\n"
                + "    }\n");
  }

  @Test
  public void collectionLoop() throws Exception {
    assertThat(compile("xs = [1, 2]", "for x in xs:", "    print x"))
        .contains(
            "    QValue _t1 = q_len(xs);\n"
                + "    for (QValue _t2 = qv_int(0LL); q_truthy(q_lt(_t2, _t1));"
                + " _t2 = q_add(_t2, qv_int(1LL))) {\n"
                + "        QValue x = q_iter_get(xs, _t2);\n"
                + "        q_print(x);\n"
                + "    }\n");
  }

  @Test
  public void whileLoopChecksConditionEachIteration() throws Exception {
    assertThat(compile("n = 0", "while n < 3:", "    n = n + 1"))
        .contains(
            "    while (true) {\n"
                + "        if (!q_truthy(q_lt(n, qv_int(3LL)))) break;\n"
                + "        n = q_add(n, qv_int(1LL));\n"
                + "    }\n");
  }

  @Test
  public void containers() throws Exception {
    String out = compile("xs = [1, 'a']", "d = {a: 1}", "v = vector [1.5, .5]");

    assertThat(out).contains("    QValue _t0 = qv_list();\n    q_push(_t0, qv_int(1LL));\n");
    assertThat(out).contains("q_push(_t0, qv_string(\"a\"));");
    assertThat(out).contains("q_dict_set(_t1, qv_string(\"a\"), qv_int(1LL));");
    assertThat(out).contains("q_vec_push(_t2, qv_float(0.5));");
  }

  @Test
  public void accessAndMutation() throws Exception {
    String out =
        compile("xs = [1]", "xs[0] = 2", "d = {a: 1}", "d.a = 2", "d['b'] = 3", "print d.a",
            "print d['b'] + xs[0]");

    assertThat(out).contains("q_set(xs, qv_int(0LL), _t1);");
    assertThat(out).contains("q_member_set(d, \"a\", _t3);");
    assertThat(out).contains("q_dset(d, qv_string(\"b\"), _t4);");
    assertThat(out).contains("q_print(q_member_get(d, \"a\"));");
    assertThat(out).contains("q_print(q_add(q_dget(d, qv_string(\"b\")), q_get(xs, qv_int(0LL))));");
  }

  @Test
  public void vectorOperatorsUseElementWiseForms() throws Exception {
    String out = compile("v = vector [1, 2] + vector [3, 4]", "w = v * 2", "b = v < 2");

    assertThat(out).contains("v = q_vec_add(_t0, _t1);");
    assertThat(out).contains("w = q_vec_mul(v, qv_int(2LL));");
    assertThat(out).contains("b = q_lt(v, qv_int(2LL));");
  }

  @Test
  public void unaryOperators() throws Exception {
    String out = compile("a = -1", "b = not true");

    assertThat(out).contains("a = q_neg(qv_int(1LL));");
    assertThat(out).contains("b = q_not(qv_bool(true));");
  }

  @Test
  public void reservedNamesAreMangled() throws Exception {
    String out = compile("class = 1", "_hidden = class", "print _hidden");

    assertThat(out).contains("QValue qk_class = qv_null();");
    assertThat(out).contains("qk__hidden = qk_class;");
  }

  @Test
  public void modulesShareFileScope() throws Exception {
    String out =
        compile("module geometry:", "    unit = 2", "    fn twice(x) -> x * unit", "use geometry",
            "print twice 3");

    assertThat(out).contains("QValue unit = qv_null();");
    assertThat(out).contains("QValue quark_fn_geometry_twice(QClosure* _env, QValue x) {");
    assertThat(out).contains("q_print(quark_fn_geometry_twice(nullptr, qv_int(3LL)));");
  }

  @Test
  public void sameFunctionNameInSeparateScopes() throws Exception {
    String out =
        compile("fn init() -> 0", "module a:", "    fn init() -> 1", "fn f(x) ->",
            "    fn init() -> 2", "    init()", "print init()");

    assertThat(out).contains("QValue quark_fn_init(QClosure* _env) {");
    assertThat(out).contains("QValue quark_fn_a_init(QClosure* _env) {");
    assertThat(out).contains("QValue quark_fn_f_init(QClosure* _env) {");
    assertThat(out).contains("q_print(quark_fn_init(nullptr));");
  }

  @Test
  public void outputCallsOnlyRuntimeEntryPoints() throws Exception {
    String out =
        compile(
            "fn fact(n) -> 1 if n <= 1 else n * fact n - 1",
            "xs = [1, 2, 3] | push 4",
            "d = {total: sum xs}",
            "v = to_vector([1.0, 2.0]) / 2",
            "r = err 'bad'",
            "msg = when r:",
            "    ok v -> v",
            "    err e -> e",
            "    _ -> null",
            "f = fn x -> x ** 2 % 3",
            "for c in 'abc':",
            "    print upper c",
            "print fact(5)",
            "print f(2)",
            "print d.total",
            "print msg");

    Matcher m = RUNTIME_CALL.matcher(out);
    int calls = 0;
    while (m.find()) {
      assertThat(CppValueAbiTest.RUNTIME_FUNCTIONS).contains(m.group());
      calls++;
    }
    assertThat(calls).isGreaterThan(20);
  }

  @Test
  public void toVectorCopiesItemsIntoNewVector() throws Exception {
    String out = compile("xs = [1, 2]", "v = to_vector(xs)");

    assertThat(out)
        .contains(
            "    QValue _t1 = qv_vector();\n"
                + "    QValue _t2 = q_len(xs);\n"
                + "    for (QValue _t3 = qv_int(0LL); q_truthy(q_lt(_t3, _t2));"
                + " _t3 = q_add(_t3, qv_int(1LL))) {\n"
                + "        q_vec_push(_t1, q_iter_get(xs, _t3));\n"
                + "    }\n"
                + "    v = _t1;\n");
    assertThat(out).doesNotContain("q_to_vector");
  }

  @Test
  public void refusesAnalysisWithErrors() {
    Node root = new Parser(new Tokenizer("print y\n").tokenize()).parse();
    Analysis analysis = new Analyzer(Builtins.defaults()).analyzeTree(root);

    assertThrows(
        IllegalArgumentException.class,
        () -> new Compiler(analysis, Builtins.defaults(), CppValueAbi.create()));
  }
}
