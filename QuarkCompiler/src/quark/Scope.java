package quark;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;

/** One level of the lexical scope chain used during analysis. */
public final class Scope {
  public enum Kind {
    BUILTIN,
    GLOBAL,
    MODULE,
    FUNCTION,
    LAMBDA,
    BLOCK;

    /** Whether variables declared at this level outlive any single function call. */
    public boolean isGlobal() {
      return this == GLOBAL || this == MODULE;
    }
  }

  private final Optional<Scope> parent;
  private final Kind kind;
  private final Map<String, Symbol> symbols = new LinkedHashMap<>();

  public Scope(Scope parent, Kind kind) {
    this.parent = Optional.ofNullable(parent);
    this.kind = kind;
  }

  public Optional<Scope> parent() {
    return parent;
  }

  public Kind kind() {
    return kind;
  }

  /** Defines {@code symbol} here, shadowing outer definitions. Returns false on a duplicate. */
  public boolean define(Symbol symbol) {
    return symbols.putIfAbsent(symbol.name(), symbol) == null;
  }

  public Optional<Symbol> lookupLocal(String name) {
    return Optional.ofNullable(symbols.get(name));
  }

  public Optional<Symbol> lookup(String name) {
    return resolve(name).map(r -> r.symbol);
  }

  /** The symbol for {@code name} together with the scope that defines it. */
  public Optional<Resolution> resolve(String name) {
    for (Scope s = this; s != null; s = s.parent.orElse(null)) {
      Symbol symbol = s.symbols.get(name);
      if (symbol != null) {
        return Optional.of(new Resolution(symbol, s));
      }
    }
    return Optional.empty();
  }

  public ImmutableMap<String, Symbol> symbols() {
    return ImmutableMap.copyOf(symbols);
  }

  public static final class Resolution {
    private final Symbol symbol;
    private final Scope scope;

    Resolution(Symbol symbol, Scope scope) {
      this.symbol = symbol;
      this.scope = scope;
    }

    public Symbol symbol() {
      return symbol;
    }

    public Scope scope() {
      return scope;
    }
  }
}
