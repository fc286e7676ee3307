package quark;

import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import com.google.common.collect.Maps;

/** Static types inferred by the analyzer. */
public abstract class Type {

  public enum BasicKind {
    INT("int"),
    FLOAT("float"),
    STR("str"),
    BOOL("bool"),
    NULL("null"),
    ANY("any"),
    VOID("void");

    private final String repr;

    BasicKind(String repr) {
      this.repr = repr;
    }

    public String repr() {
      return repr;
    }

    private static final ImmutableMap<String, BasicKind> REPR_MAP =
        Maps.uniqueIndex(Arrays.asList(values()), BasicKind::repr);

    public static Optional<BasicKind> parse(String name) {
      return Optional.ofNullable(REPR_MAP.get(name));
    }
  }

  public static final class Basic extends Type {
    private final BasicKind kind;

    private Basic(BasicKind kind) {
      this.kind = kind;
    }

    public BasicKind kind() {
      return kind;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Basic && ((Basic) o).kind == kind;
    }

    @Override
    public int hashCode() {
      return kind.hashCode();
    }

    @Override
    public String toString() {
      return kind.repr();
    }
  }

  public static final class ListType extends Type {
    private final Type elem;

    private ListType(Type elem) {
      this.elem = elem;
    }

    public Type elem() {
      return elem;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof ListType && ((ListType) o).elem.equals(elem);
    }

    @Override
    public int hashCode() {
      return Objects.hash("list", elem);
    }

    @Override
    public String toString() {
      return "list[" + elem + "]";
    }
  }

  public static final class VectorType extends Type {
    private final Type elem;

    private VectorType(Type elem) {
      this.elem = elem;
    }

    public Type elem() {
      return elem;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof VectorType && ((VectorType) o).elem.equals(elem);
    }

    @Override
    public int hashCode() {
      return Objects.hash("vector", elem);
    }

    @Override
    public String toString() {
      return "vector[" + elem + "]";
    }
  }

  public static final class DictType extends Type {
    private final Type key;
    private final Type value;

    private DictType(Type key, Type value) {
      this.key = key;
      this.value = value;
    }

    public Type key() {
      return key;
    }

    public Type value() {
      return value;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof DictType)) {
        return false;
      }
      DictType other = (DictType) o;
      return other.key.equals(key) && other.value.equals(value);
    }

    @Override
    public int hashCode() {
      return Objects.hash("dict", key, value);
    }

    @Override
    public String toString() {
      return "dict[" + key + ", " + value + "]";
    }
  }

  public static final class FunctionType extends Type {
    private final ImmutableList<Type> params;
    private final Type returnType;

    private FunctionType(ImmutableList<Type> params, Type returnType) {
      this.params = params;
      this.returnType = returnType;
    }

    public ImmutableList<Type> params() {
      return params;
    }

    public Type returnType() {
      return returnType;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof FunctionType)) {
        return false;
      }
      FunctionType other = (FunctionType) o;
      return other.params.equals(params) && other.returnType.equals(returnType);
    }

    @Override
    public int hashCode() {
      return Objects.hash("fn", params, returnType);
    }

    @Override
    public String toString() {
      return params.stream().map(Type::toString).collect(Collectors.joining(", ", "fn(", ")"))
          + " -> "
          + returnType;
    }
  }

  /** A flat set of alternatives; never nested, never containing {@code any}. */
  public static final class UnionType extends Type {
    private final ImmutableSet<Type> options;

    private UnionType(ImmutableSet<Type> options) {
      this.options = options;
    }

    /** Options in canonical display order. */
    public ImmutableSet<Type> options() {
      return options;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof UnionType && ((UnionType) o).options.equals(options);
    }

    @Override
    public int hashCode() {
      return options.hashCode();
    }

    @Override
    public String toString() {
      return options.stream().map(Type::toString).collect(Collectors.joining(" | ", "union[", "]"));
    }
  }

  private static final Basic INT = new Basic(BasicKind.INT);
  private static final Basic FLOAT = new Basic(BasicKind.FLOAT);
  private static final Basic STR = new Basic(BasicKind.STR);
  private static final Basic BOOL = new Basic(BasicKind.BOOL);
  private static final Basic NULL = new Basic(BasicKind.NULL);
  private static final Basic ANY = new Basic(BasicKind.ANY);
  private static final Basic VOID = new Basic(BasicKind.VOID);

  public static Type intType() {
    return INT;
  }

  public static Type floatType() {
    return FLOAT;
  }

  public static Type strType() {
    return STR;
  }

  public static Type boolType() {
    return BOOL;
  }

  public static Type nullType() {
    return NULL;
  }

  public static Type any() {
    return ANY;
  }

  public static Type voidType() {
    return VOID;
  }

  public static Type basic(BasicKind kind) {
    switch (kind) {
      case INT:
        return INT;
      case FLOAT:
        return FLOAT;
      case STR:
        return STR;
      case BOOL:
        return BOOL;
      case NULL:
        return NULL;
      case VOID:
        return VOID;
      default:
        return ANY;
    }
  }

  public static Type listOf(Type elem) {
    return new ListType(Preconditions.checkNotNull(elem));
  }

  public static Type vectorOf(Type elem) {
    return new VectorType(Preconditions.checkNotNull(elem));
  }

  public static Type dictOf(Type key, Type value) {
    return new DictType(Preconditions.checkNotNull(key), Preconditions.checkNotNull(value));
  }

  public static Type function(List<Type> params, Type returnType) {
    return new FunctionType(ImmutableList.copyOf(params), Preconditions.checkNotNull(returnType));
  }

  /**
   * Combines branch types. Unions are flattened and deduplicated; any {@code any} poisons the
   * result; no types give {@code void} and a single distinct type is returned as-is.
   */
  public static Type merge(Iterable<Type> types) {
    Set<Type> flat = new LinkedHashSet<>();
    for (Type t : types) {
      if (t instanceof UnionType) {
        flat.addAll(((UnionType) t).options);
      } else {
        flat.add(t);
      }
    }
    if (flat.contains(ANY)) {
      return ANY;
    }
    if (flat.isEmpty()) {
      return VOID;
    }
    if (flat.size() == 1) {
      return Iterables.getOnlyElement(flat);
    }
    return new UnionType(
        flat.stream()
            .sorted(Comparator.comparing(Type::toString))
            .collect(ImmutableSet.toImmutableSet()));
  }

  public static Type merge(Type... types) {
    return merge(Arrays.asList(types));
  }

  public boolean isAny() {
    return this.equals(ANY);
  }

  public boolean is(BasicKind kind) {
    return this instanceof Basic && ((Basic) this).kind == kind;
  }

  // True if this type, or every option of this union, satisfies the predicate.
  private boolean all(Predicate<Type> predicate) {
    if (this instanceof UnionType) {
      return ((UnionType) this).options.stream().allMatch(predicate);
    }
    return predicate.test(this);
  }

  private boolean anyOption(Predicate<Type> predicate) {
    if (this instanceof UnionType) {
      return ((UnionType) this).options.stream().anyMatch(predicate);
    }
    return predicate.test(this);
  }

  public boolean isNumeric() {
    return all(t -> t.is(BasicKind.INT) || t.is(BasicKind.FLOAT));
  }

  /** Numeric and possibly a float. */
  public boolean isFloatLike() {
    return isNumeric() && anyOption(t -> t.is(BasicKind.FLOAT));
  }

  public boolean isInteger() {
    return all(t -> t.is(BasicKind.INT));
  }

  public boolean isStringLike() {
    return all(t -> t.is(BasicKind.STR));
  }

  public boolean isBooleanLike() {
    return all(t -> t.is(BasicKind.BOOL));
  }

  public boolean isComparable() {
    return all(
        t ->
            t.is(BasicKind.INT)
                || t.is(BasicKind.FLOAT)
                || t.is(BasicKind.STR)
                || t.is(BasicKind.BOOL));
  }

  public boolean isCallable() {
    return all(t -> t instanceof FunctionType);
  }

  /** Whether a value of type {@code value} may be stored where this type is declared. */
  public boolean accepts(Type value) {
    if (isAny() || value.isAny() || equals(value)) {
      return true;
    }
    if (is(BasicKind.FLOAT) && value.isInteger()) {
      return true;
    }
    if (this instanceof ListType && value instanceof ListType) {
      return ((ListType) this).elem.accepts(((ListType) value).elem);
    }
    if (this instanceof VectorType && value instanceof VectorType) {
      return ((VectorType) this).elem.accepts(((VectorType) value).elem);
    }
    if (this instanceof DictType && value instanceof DictType) {
      return ((DictType) this).value.accepts(((DictType) value).value);
    }
    if (this instanceof UnionType) {
      return value.all(v -> ((UnionType) this).options.stream().anyMatch(o -> o.accepts(v)));
    }
    return false;
  }

  /**
   * Resolves a declared type name. Container names without parameters take {@code any}
   * elements.
   */
  public static Optional<Type> named(String name) {
    switch (name) {
      case "list":
        return Optional.of(listOf(ANY));
      case "vector":
        return Optional.of(vectorOf(ANY));
      case "dict":
        return Optional.of(dictOf(STR, ANY));
      default:
        return BasicKind.parse(name).map(Type::basic);
    }
  }
}
