package quark;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * The registry of builtin functions: arity bounds and a return-type rule for each.
 *
 * <p>A registry is an immutable value; analyzers receive one at construction.
 */
public final class Builtins {
  /** Lowered inline from vector pushes rather than through a runtime call. */
  public static final String TO_VECTOR = "to_vector";

  @FunctionalInterface
  public interface ReturnRule {
    /**
     * Computes the result type from the argument types. Only called with an argument count inside
     * the builtin's bounds. Throws to report an argument the builtin cannot accept.
     */
    Type apply(ImmutableList<Type> args) throws CompilerException;
  }

  @AutoValue
  public abstract static class Builtin {
    public abstract String name();

    public abstract int minArity();

    public abstract int maxArity();

    public abstract ReturnRule returnRule();

    public static Builtin create(String name, int minArity, int maxArity, ReturnRule returnRule) {
      return new AutoValue_Builtins_Builtin(name, minArity, maxArity, returnRule);
    }

    public boolean acceptsArity(int count) {
      return count >= minArity() && count <= maxArity();
    }

    public String arityError(int actual) {
      String expected =
          minArity() == maxArity()
              ? Integer.toString(minArity())
              : String.format("%d to %d", minArity(), maxArity());
      return String.format(
          "builtin '%s' expects %s argument%s, got %d",
          name(), expected, maxArity() == 1 ? "" : "s", actual);
    }
  }

  private final ImmutableMap<String, Builtin> builtins;

  private Builtins(ImmutableMap<String, Builtin> builtins) {
    this.builtins = builtins;
  }

  public Optional<Builtin> lookup(String name) {
    return Optional.ofNullable(builtins.get(name));
  }

  public boolean contains(String name) {
    return builtins.containsKey(name);
  }

  public ImmutableSet<String> names() {
    return builtins.keySet();
  }

  public ImmutableList<Builtin> all() {
    return builtins.values().asList();
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private final ImmutableMap.Builder<String, Builtin> builtins = ImmutableMap.builder();

    public Builder add(String name, int minArity, int maxArity, ReturnRule rule) {
      builtins.put(name, Builtin.create(name, minArity, maxArity, rule));
      return this;
    }

    public Builder add(String name, int arity, ReturnRule rule) {
      return add(name, arity, arity, rule);
    }

    public Builtins build() {
      return new Builtins(builtins.build());
    }
  }

  private static CompilerException mismatch(String msg) {
    return new CompilerException(CompilerException.Kind.TYPE, 0, 0, msg);
  }

  private static ReturnRule returns(Type type) {
    return args -> type;
  }

  private static ReturnRule sameAsArg(int index) {
    return args -> args.get(index);
  }

  // The element type of a list or vector, or any.
  private static Type elementOf(Type container) {
    if (container instanceof Type.ListType) {
      return ((Type.ListType) container).elem();
    }
    if (container instanceof Type.VectorType) {
      return ((Type.VectorType) container).elem();
    }
    return Type.any();
  }

  private static Type promote(Type a, Type b) {
    if (a.isAny() || b.isAny()) {
      return Type.any();
    }
    return a.isFloatLike() || b.isFloatLike() ? Type.floatType() : Type.intType();
  }

  private static Type abs(ImmutableList<Type> args) throws CompilerException {
    Type t = args.get(0);
    if (t.isAny() || t.isNumeric()) {
      return t;
    }
    if (t instanceof Type.VectorType) {
      return t;
    }
    throw mismatch("builtin 'abs' requires a numeric argument, got " + t);
  }

  // min and max: a reduction over one container, or the smaller/larger of two numbers.
  private static Type extremum(ImmutableList<Type> args) {
    if (args.size() == 1) {
      return elementOf(args.get(0));
    }
    return promote(args.get(0), args.get(1));
  }

  private static Type sum(ImmutableList<Type> args) {
    Type elem = elementOf(args.get(0));
    if (elem.isAny()) {
      return Type.any();
    }
    return elem.isFloatLike() ? Type.floatType() : Type.intType();
  }

  private static Type concat(ImmutableList<Type> args) {
    Type a = args.get(0);
    Type b = args.get(1);
    if (a.isStringLike() && b.isStringLike()) {
      return Type.strType();
    }
    if (a instanceof Type.ListType && b instanceof Type.ListType) {
      return Type.listOf(Type.merge(elementOf(a), elementOf(b)));
    }
    return Type.any();
  }

  private static Type push(ImmutableList<Type> args) {
    Type list = args.get(0);
    if (list instanceof Type.ListType) {
      return Type.listOf(Type.merge(elementOf(list), args.get(1)));
    }
    return list;
  }

  private static Type pop(ImmutableList<Type> args) {
    return elementOf(args.get(0));
  }

  private static Type dget(ImmutableList<Type> args) {
    Type dict = args.get(0);
    return dict instanceof Type.DictType ? ((Type.DictType) dict).value() : Type.any();
  }

  private static Type toVector(ImmutableList<Type> args) throws CompilerException {
    Type source = args.get(0);
    if (source.isAny()) {
      return Type.vectorOf(Type.any());
    }
    if (source instanceof Type.VectorType) {
      return source;
    }
    if (!(source instanceof Type.ListType)) {
      throw mismatch("builtin 'to_vector' requires a list, got " + source);
    }
    Type elem = elementOf(source);
    if (elem.isAny()) {
      return Type.vectorOf(Type.any());
    }
    if (elem.is(Type.BasicKind.INT) || elem.is(Type.BasicKind.FLOAT)) {
      return Type.vectorOf(elem);
    }
    throw mismatch(
        "builtin 'to_vector' requires a homogeneous numeric list, got " + source);
  }

  private static final Builtins DEFAULTS =
      builder()
          // I/O
          .add("print", 0, 1, returns(Type.voidType()))
          .add("println", 0, 1, returns(Type.voidType()))
          .add("input", 0, 1, returns(Type.strType()))
          // Conversions
          .add("len", 1, returns(Type.intType()))
          .add("str", 1, returns(Type.strType()))
          .add("int", 1, returns(Type.intType()))
          .add("float", 1, returns(Type.floatType()))
          .add("bool", 1, returns(Type.boolType()))
          .add("type", 1, returns(Type.strType()))
          // Math
          .add("range", 1, 3, returns(Type.listOf(Type.intType())))
          .add("abs", 1, Builtins::abs)
          .add("min", 1, 2, Builtins::extremum)
          .add("max", 1, 2, Builtins::extremum)
          .add("sum", 1, Builtins::sum)
          .add("sqrt", 1, returns(Type.floatType()))
          .add("floor", 1, returns(Type.intType()))
          .add("ceil", 1, returns(Type.intType()))
          .add("round", 1, returns(Type.intType()))
          // Strings
          .add("upper", 1, returns(Type.strType()))
          .add("lower", 1, returns(Type.strType()))
          .add("trim", 1, returns(Type.strType()))
          .add("contains", 2, returns(Type.boolType()))
          .add("startswith", 2, returns(Type.boolType()))
          .add("endswith", 2, returns(Type.boolType()))
          .add("replace", 3, returns(Type.strType()))
          .add("concat", 2, Builtins::concat)
          .add("split", 2, returns(Type.listOf(Type.strType())))
          // Lists
          .add("push", 2, Builtins::push)
          .add("pop", 1, Builtins::pop)
          .add("get", 2, Builtins::pop)
          .add("set", 3, sameAsArg(2))
          .add("insert", 3, sameAsArg(0))
          .add("remove", 2, Builtins::pop)
          .add("slice", 3, sameAsArg(0))
          .add("reverse", 1, sameAsArg(0))
          // Dicts
          .add("dget", 2, Builtins::dget)
          .add("dset", 3, sameAsArg(0))
          // Vectors
          .add(TO_VECTOR, 1, Builtins::toVector)
          .add("vadd_inplace", 2, sameAsArg(0))
          .add("fillna", 2, sameAsArg(0))
          .add("astype", 2, returns(Type.vectorOf(Type.any())))
          .build();

  /** The standard library every program sees. */
  public static Builtins defaults() {
    return DEFAULTS;
  }
}
