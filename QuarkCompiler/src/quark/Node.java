package quark;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A generic tagged tree node, shared by every compiler stage.
 *
 * <p>Nodes compare by identity: two structurally identical lambdas are distinct entries in the
 * analyzer's side tables.
 *
 * <p>Child layout by kind:
 *
 * <ul>
 *   <li>{@code FUNCTION}: name, parameters, body block
 *   <li>{@code LAMBDA}: parameters, body (an expression or a block)
 *   <li>{@code IF}: condition and block pairs, then an optional trailing else block
 *   <li>{@code WHEN}: scrutinee, then patterns; a {@code PATTERN}'s last child is its result
 *   <li>{@code FOR}: loop variable name, iterable, body block
 *   <li>{@code CALL}: callee, arguments
 *   <li>{@code OPERATOR}: left, right; member access is an operator on {@code .} with a name
 *   <li>{@code DICT}: {@code :} operators holding key and value
 * </ul>
 */
public final class Node {
  private final NodeKind kind;
  private final Optional<Token> token;
  private final List<Node> children = new ArrayList<>();
  private Type type = Type.any();

  public Node(NodeKind kind, Token token, Node... children) {
    this.kind = Preconditions.checkNotNull(kind);
    this.token = Optional.ofNullable(token);
    this.children.addAll(Arrays.asList(children));
  }

  public NodeKind kind() {
    return kind;
  }

  public boolean is(NodeKind kind) {
    return this.kind == kind;
  }

  public Optional<Token> token() {
    return token;
  }

  /** Kind of the token, or {@link TokenKind#ILLEGAL} for token-less nodes. */
  public TokenKind tokenKind() {
    return token.map(Token::kind).orElse(TokenKind.ILLEGAL);
  }

  public String literal() {
    return token.map(Token::literal).orElse("");
  }

  public ImmutableList<Node> children() {
    return ImmutableList.copyOf(children);
  }

  public Node child(int index) {
    return children.get(index);
  }

  public int childCount() {
    return children.size();
  }

  public Node lastChild() {
    return children.get(children.size() - 1);
  }

  void addChild(Node child) {
    children.add(Preconditions.checkNotNull(child));
  }

  void replaceChildren(List<Node> replacement) {
    children.clear();
    children.addAll(replacement);
  }

  /** The inferred type; {@code any} until the analyzer has visited this node. */
  public Type type() {
    return type;
  }

  void setType(Type type) {
    this.type = Preconditions.checkNotNull(type);
  }

  /** The first source line covered by this node, or 0 if it has no tokens. */
  public int line() {
    if (token.isPresent()) {
      return token.get().line();
    }
    return children.stream().mapToInt(Node::line).filter(l -> l > 0).findFirst().orElse(0);
  }

  public int column() {
    if (token.isPresent()) {
      return token.get().column();
    }
    return children.stream().mapToInt(Node::column).filter(c -> c > 0).findFirst().orElse(0);
  }

  /** An indented, one-node-per-line dump of this tree. */
  public String toTreeString() {
    StringBuilder sb = new StringBuilder();
    appendTree(sb, 0, false);
    return sb.toString();
  }

  /** Like {@link #toTreeString()}, with each node's inferred type appended. */
  public String toTypedTreeString() {
    StringBuilder sb = new StringBuilder();
    appendTree(sb, 0, true);
    return sb.toString();
  }

  private void appendTree(StringBuilder sb, int depth, boolean withTypes) {
    for (int i = 0; i < depth; i++) {
      sb.append("  ");
    }
    sb.append(this);
    if (withTypes) {
      sb.append(" : ").append(type);
    }
    sb.append('\n');
    children.forEach(c -> c.appendTree(sb, depth + 1, withTypes));
  }

  @Override
  public String toString() {
    if (!token.isPresent() || token.get().is(TokenKind.NEWLINE)) {
      return kind.toString();
    }
    String literal = token.get().literal();
    if (literal.isEmpty()) {
      return kind.toString();
    }
    return kind + " " + (token.get().is(TokenKind.STRING) ? quoted(literal) : literal);
  }

  private static String quoted(String literal) {
    return "'" + literal.replace("\\", "\\\\").replace("\n", "\\n").replace("'", "\\'") + "'";
  }
}
