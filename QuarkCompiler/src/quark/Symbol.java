package quark;

import com.google.common.base.Preconditions;

/** A named binding. Its type is a single mutable cell: the last assignment wins. */
public final class Symbol {
  public enum Kind {
    BUILTIN,
    FUNCTION,
    VARIABLE;
  }

  private final String name;
  private final Kind kind;
  private final boolean mutable;
  private Type type;

  public Symbol(String name, Kind kind, Type type, boolean mutable) {
    this.name = name;
    this.kind = kind;
    this.type = Preconditions.checkNotNull(type);
    this.mutable = mutable;
  }

  public static Symbol variable(String name, Type type) {
    return new Symbol(name, Kind.VARIABLE, type, true);
  }

  public String name() {
    return name;
  }

  public Kind kind() {
    return kind;
  }

  public Type type() {
    return type;
  }

  public void setType(Type type) {
    this.type = Preconditions.checkNotNull(type);
  }

  /** Whether assignment may rebind this name; only variables can be reassigned. */
  public boolean mutable() {
    return mutable;
  }

  @Override
  public String toString() {
    return name + ": " + type;
  }
}
