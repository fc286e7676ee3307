package quark;

import java.util.List;

import com.google.common.collect.ImmutableSet;

/**
 * The dynamic-value runtime that emitted code calls into.
 *
 * <p>Each method returns target source text for one entry point. Arguments are already-lowered
 * expressions; implementations only arrange them. Lowering never names a runtime function
 * directly.
 */
public interface ValueAbi {

  /** Text placed before everything else in the output. */
  String prelude();

  /** The declared type of every value. */
  String valueType();

  /** The type of a function's environment parameter. */
  String environmentType();

  String intValue(String literal);

  String floatValue(String literal);

  /** @param value the decoded string contents */
  String stringValue(String value);

  String boolValue(boolean value);

  String nullValue();

  String newList();

  String listPush(String list, String value);

  String newVector();

  String vectorPush(String vector, String value);

  String newDict();

  String dictLiteralSet(String dict, String key, String value);

  String dictIndexGet(String dict, String key);

  String dictIndexSet(String dict, String key, String value);

  String indexGet(String target, String index);

  String indexSet(String target, String index, String value);

  String memberGet(String object, String member);

  String memberSet(String object, String member, String value);

  /**
   * A binary operator.
   *
   * @param vector whether an operand is statically a vector, selecting the element-wise form
   */
  String binary(TokenKind op, boolean vector, String left, String right);

  String unary(TokenKind op, String operand);

  /** A native boolean condition for a value. */
  String truthy(String value);

  String ok(String value);

  String err(String value);

  /** A native boolean condition. */
  String isOk(String value);

  /** A native boolean condition. */
  String isErr(String value);

  String resultValue(String value);

  String resultError(String value);

  String iterLength(String iterable);

  String iterGet(String iterable, String index);

  /** @param args exactly as many as the builtin's maximum arity */
  String builtinCall(String name, List<String> args);

  /** An indirect call through a function value. */
  String dynamicCall(String function, List<String> args);

  /** A direct call of a hoisted named function. */
  String directCall(String function, List<String> args);

  String allocClosure(String function, int captureCount);

  /** An assignable slot of an allocated closure. */
  String captureSlot(String closure, int index);

  /** A captured value read from inside the function body. */
  String environmentCapture(int index);

  /** Wraps a closure as a function value. */
  String functionValue(String closure);

  /** The target-safe spelling of a user identifier. */
  String identifier(String name);

  String namedFunction(String name);

  String lambdaFunction(int index);

  /** The statement that starts the runtime at the top of the entry point. */
  String runtimeInit();

  /** Every runtime function name this ABI can emit. */
  ImmutableSet<String> entryPoints();
}
