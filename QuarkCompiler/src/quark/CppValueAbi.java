package quark;

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/** Emits C++ against the {@code quark/quark.hpp} runtime header. */
public final class CppValueAbi implements ValueAbi {
  private static final Joiner ARGS = Joiner.on(", ");

  private static final ImmutableMap<TokenKind, String> BINARY =
      ImmutableMap.<TokenKind, String>builder()
          .put(TokenKind.PLUS, "q_add")
          .put(TokenKind.MINUS, "q_sub")
          .put(TokenKind.MULTIPLY, "q_mul")
          .put(TokenKind.DIVIDE, "q_div")
          .put(TokenKind.MODULO, "q_mod")
          .put(TokenKind.DOUBLESTAR, "q_pow")
          .put(TokenKind.LT, "q_lt")
          .put(TokenKind.LTE, "q_lte")
          .put(TokenKind.GT, "q_gt")
          .put(TokenKind.GTE, "q_gte")
          .put(TokenKind.DEQ, "q_eq")
          .put(TokenKind.NE, "q_neq")
          .put(TokenKind.AND, "q_and")
          .put(TokenKind.OR, "q_or")
          .build();

  private static final ImmutableMap<TokenKind, String> VECTOR_BINARY =
      ImmutableMap.of(
          TokenKind.PLUS, "q_vec_add",
          TokenKind.MINUS, "q_vec_sub",
          TokenKind.MULTIPLY, "q_vec_mul",
          TokenKind.DIVIDE, "q_vec_div");

  private static final ImmutableSet<String> CORE_ENTRY_POINTS =
      ImmutableSet.<String>builder()
          .add("qv_int", "qv_float", "qv_string", "qv_bool", "qv_null")
          .add("qv_list", "qv_vector", "qv_dict", "qv_ok", "qv_err", "qv_func")
          .addAll(BINARY.values())
          .addAll(VECTOR_BINARY.values())
          .add("q_neg", "q_not", "q_truthy")
          .add("q_vec_push", "q_vec_sum", "q_vec_min", "q_vec_max")
          .add("q_push", "q_get", "q_set", "q_dget", "q_dset", "q_dict_get", "q_dict_set")
          .add("q_member_get", "q_member_set")
          .add("q_is_ok", "q_result_value", "q_result_error")
          .add("q_len", "q_iter_get")
          .add("q_call0", "q_call1", "q_call2", "q_call3", "q_call4", "q_calln")
          .add("q_alloc_closure", "q_gc_init", "q_range")
          .build();

  private static final ImmutableSet<String> RESERVED_WORDS =
      ImmutableSet.of(
          "alignas", "alignof", "asm", "auto", "bool", "break", "case", "catch", "char",
          "class", "const", "constexpr", "const_cast", "continue", "decltype", "default",
          "delete", "do", "double", "dynamic_cast", "enum", "explicit", "export", "extern",
          "false", "float", "for", "friend", "goto", "if", "inline", "int", "long", "main",
          "mutable", "namespace", "new", "noexcept", "nullptr", "operator", "private",
          "protected", "public", "register", "reinterpret_cast", "return", "short", "signed",
          "sizeof", "static", "static_assert", "static_cast", "struct", "switch", "template",
          "this", "throw", "true", "try", "typedef", "typeid", "typename", "union", "unsigned",
          "using", "virtual", "void", "volatile", "while", "QValue", "QClosure");

  private static final ImmutableSet<String> RESERVED_PREFIXES =
      ImmutableSet.of("q_", "qv_", "qk_", "quark_", "_");

  private final ImmutableSet<String> entryPoints;

  public CppValueAbi(Builtins builtins) {
    ImmutableSet.Builder<String> names = ImmutableSet.<String>builder().addAll(CORE_ENTRY_POINTS);
    builtins.names().stream()
        .filter(n -> !n.equals(Builtins.TO_VECTOR))
        .forEach(n -> names.add("q_" + n));
    this.entryPoints = names.build();
  }

  public static CppValueAbi create() {
    return new CppValueAbi(Builtins.defaults());
  }

  private static String call(String function, String... args) {
    return function + "(" + ARGS.join(args) + ")";
  }

  private static String call(String function, List<String> args) {
    return function + "(" + ARGS.join(args) + ")";
  }

  @Override
  public String prelude() {
    return "#include \"quark/quark.hpp\"\n";
  }

  @Override
  public String valueType() {
    return "QValue";
  }

  @Override
  public String environmentType() {
    return "QClosure*";
  }

  @Override
  public String intValue(String literal) {
    return call("qv_int", literal + "LL");
  }

  @Override
  public String floatValue(String literal) {
    String text = literal;
    if (text.startsWith(".")) {
      text = "0" + text;
    }
    if (text.endsWith(".")) {
      text = text + "0";
    }
    return call("qv_float", text);
  }

  @Override
  public String stringValue(String value) {
    return call("qv_string", quote(value));
  }

  static String quote(String value) {
    StringBuilder sb = new StringBuilder("\"");
    for (char c : value.toCharArray()) {
      switch (c) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\t':
          sb.append("\\t");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '?':
          // Avoids trigraphs.
          sb.append("\\?");
          break;
        default:
          if (c < 0x20 || c == 0x7f) {
            sb.append(String.format("\\%03o", (int) c));
          } else {
            sb.append(c);
          }
      }
    }
    return sb.append('"').toString();
  }

  @Override
  public String boolValue(boolean value) {
    return call("qv_bool", Boolean.toString(value));
  }

  @Override
  public String nullValue() {
    return "qv_null()";
  }

  @Override
  public String newList() {
    return "qv_list()";
  }

  @Override
  public String listPush(String list, String value) {
    return call("q_push", list, value);
  }

  @Override
  public String newVector() {
    return "qv_vector()";
  }

  @Override
  public String vectorPush(String vector, String value) {
    return call("q_vec_push", vector, value);
  }

  @Override
  public String newDict() {
    return "qv_dict()";
  }

  @Override
  public String dictLiteralSet(String dict, String key, String value) {
    return call("q_dict_set", dict, stringValue(key), value);
  }

  @Override
  public String dictIndexGet(String dict, String key) {
    return call("q_dget", dict, key);
  }

  @Override
  public String dictIndexSet(String dict, String key, String value) {
    return call("q_dset", dict, key, value);
  }

  @Override
  public String indexGet(String target, String index) {
    return call("q_get", target, index);
  }

  @Override
  public String indexSet(String target, String index, String value) {
    return call("q_set", target, index, value);
  }

  @Override
  public String memberGet(String object, String member) {
    return call("q_member_get", object, quote(member));
  }

  @Override
  public String memberSet(String object, String member, String value) {
    return call("q_member_set", object, quote(member), value);
  }

  @Override
  public String binary(TokenKind op, boolean vector, String left, String right) {
    String function = vector ? VECTOR_BINARY.get(op) : null;
    if (function == null) {
      function = BINARY.get(op);
    }
    Preconditions.checkArgument(function != null, "not a binary operator: %s", op);
    return call(function, left, right);
  }

  @Override
  public String unary(TokenKind op, String operand) {
    switch (op) {
      case MINUS:
        return call("q_neg", operand);
      case BANG:
      case NOT:
        return call("q_not", operand);
      default:
        throw new IllegalArgumentException("not a unary operator: " + op);
    }
  }

  @Override
  public String truthy(String value) {
    return call("q_truthy", value);
  }

  @Override
  public String ok(String value) {
    return call("qv_ok", value);
  }

  @Override
  public String err(String value) {
    return call("qv_err", value);
  }

  @Override
  public String isOk(String value) {
    return call("q_is_ok", value);
  }

  @Override
  public String isErr(String value) {
    return "!" + isOk(value);
  }

  @Override
  public String resultValue(String value) {
    return call("q_result_value", value);
  }

  @Override
  public String resultError(String value) {
    return call("q_result_error", value);
  }

  @Override
  public String iterLength(String iterable) {
    return call("q_len", iterable);
  }

  @Override
  public String iterGet(String iterable, String index) {
    return call("q_iter_get", iterable, index);
  }

  @Override
  public String builtinCall(String name, List<String> args) {
    return call("q_" + name, args);
  }

  @Override
  public String dynamicCall(String function, List<String> args) {
    if (args.size() <= 4) {
      return "q_call" + args.size() + "(" + function + (args.isEmpty() ? "" : ", ")
          + ARGS.join(args) + ")";
    }
    return call("q_calln", function, Integer.toString(args.size()), "{" + ARGS.join(args) + "}");
  }

  @Override
  public String directCall(String function, List<String> args) {
    return function + "(nullptr" + (args.isEmpty() ? "" : ", ") + ARGS.join(args) + ")";
  }

  @Override
  public String allocClosure(String function, int captureCount) {
    return call("q_alloc_closure", "(void*)" + function, Integer.toString(captureCount));
  }

  @Override
  public String captureSlot(String closure, int index) {
    return closure + "->captures[" + index + "]";
  }

  @Override
  public String environmentCapture(int index) {
    return "_env->captures[" + index + "]";
  }

  @Override
  public String functionValue(String closure) {
    return call("qv_func", closure);
  }

  @Override
  public String identifier(String name) {
    if (RESERVED_WORDS.contains(name)
        || RESERVED_PREFIXES.stream().anyMatch(name::startsWith)) {
      return "qk_" + name;
    }
    return name;
  }

  @Override
  public String namedFunction(String name) {
    return "quark_fn_" + name;
  }

  @Override
  public String lambdaFunction(int index) {
    return "quark_lambda_" + index;
  }

  @Override
  public String runtimeInit() {
    return "q_gc_init();";
  }

  @Override
  public ImmutableSet<String> entryPoints() {
    return entryPoints;
  }
}
