package quark;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * The analyzer's output: the annotated tree plus the identity-keyed side tables lowering reads.
 *
 * <p>Every table is keyed by node identity ({@link Node} does not override {@code equals}).
 */
@AutoValue
public abstract class Analysis {

  /** How an identifier, assignment target or declaration resolved. */
  public enum Binding {
    BUILTIN,
    FUNCTION,
    GLOBAL,
    LOCAL;
  }

  public abstract Node root();

  /** Free variables of each lambda, in first-reference order. */
  public abstract ImmutableMap<Node, ImmutableList<String>> captures();

  /** Assignments and typed declarations that introduce new storage. */
  public abstract ImmutableSet<Node> declarations();

  public abstract ImmutableMap<Node, Binding> bindings();

  /**
   * Program-unique name of each named function, keyed by its definition and by every identifier
   * that refers to it. Functions in modules and function bodies are prefixed with the enclosing
   * names, so {@code fn init} in {@code module m} is {@code m_init}.
   */
  public abstract ImmutableMap<Node, String> functionNames();

  /** Variables declared at the top level or in a module body, in declaration order. */
  public abstract ImmutableSet<String> globals();

  public abstract ImmutableList<CompilerException> errors();

  static Analysis create(
      Node root,
      Map<Node, ImmutableList<String>> captures,
      Set<Node> declarations,
      Map<Node, Binding> bindings,
      Map<Node, String> functionNames,
      Iterable<String> globals,
      Iterable<CompilerException> errors) {
    return new AutoValue_Analysis(
        root,
        ImmutableMap.copyOf(captures),
        ImmutableSet.copyOf(declarations),
        ImmutableMap.copyOf(bindings),
        ImmutableMap.copyOf(functionNames),
        ImmutableSet.copyOf(globals),
        ImmutableList.copyOf(errors));
  }

  public ImmutableList<String> capturesOf(Node lambda) {
    return captures().getOrDefault(lambda, ImmutableList.of());
  }

  public boolean declares(Node node) {
    return declarations().contains(node);
  }

  public Optional<Binding> bindingOf(Node node) {
    return Optional.ofNullable(bindings().get(node));
  }

  public String functionNameOf(Node node) {
    return Preconditions.checkNotNull(
        functionNames().get(node), "no named function at %s", node.kind());
  }

  public boolean hasErrors() {
    return !errors().isEmpty();
  }
}
