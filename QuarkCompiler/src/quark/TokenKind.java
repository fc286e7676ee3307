package quark;

import java.util.Arrays;
import java.util.Optional;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

public enum TokenKind {
  ILLEGAL,
  EOF,
  NEWLINE,
  INDENT,
  DEDENT,
  // Leading whitespace; consumed by the indentation filter and never emitted.
  WS,

  ID,
  INT,
  FLOAT,
  STRING,

  // Operators
  PLUS("+"),
  MINUS("-"),
  MULTIPLY("*"),
  DIVIDE("/"),
  MODULO("%"),
  DOUBLESTAR("**"),
  BANG("!"),
  EQUALS("="),
  LT("<"),
  GT(">"),
  LTE("<="),
  GTE(">="),
  DEQ("=="),
  NE("!="),
  ARROW("->"),
  AMPER("&"),
  DOTDOT(".."),

  // Delimiters
  LPAR("("),
  RPAR(")"),
  LBRACKET("["),
  RBRACKET("]"),
  LBRACE("{"),
  RBRACE("}"),
  DOT("."),
  COMMA(","),
  PIPE("|"),
  COLON(":"),
  UNDERSCORE("_"),

  // Keywords
  USE("use", true),
  MODULE("module", true),
  IN("in", true),
  AND("and", true),
  OR("or", true),
  NOT("not", true),
  IF("if", true),
  ELSEIF("elseif", true),
  ELSE("else", true),
  FOR("for", true),
  WHILE("while", true),
  WHEN("when", true),
  FN("fn", true),
  TRUE("true", true),
  FALSE("false", true),
  NULL("null", true),
  OK("ok", true),
  ERR("err", true),
  LIST("list", true),
  DICT("dict", true),
  VECTOR("vector", true);

  private final String repr;
  private final boolean keyword;

  TokenKind() {
    this(null, false);
  }

  TokenKind(String repr) {
    this(repr, false);
  }

  TokenKind(String repr, boolean keyword) {
    this.repr = repr;
    this.keyword = keyword;
  }

  /** The fixed source text of this kind, or the kind name for value-carrying kinds. */
  public String repr() {
    return repr != null ? repr : name();
  }

  public boolean isKeyword() {
    return keyword;
  }

  private static final ImmutableMap<String, TokenKind> KEYWORDS =
      Maps.uniqueIndex(
          Arrays.stream(values()).filter(TokenKind::isKeyword).iterator(), TokenKind::repr);

  public static Optional<TokenKind> keyword(String identifier) {
    return Optional.ofNullable(KEYWORDS.get(identifier));
  }

  // Longest operators first so multi-char forms win over their prefixes.
  private static final ImmutableList<TokenKind> OPERATORS =
      Arrays.stream(values())
          .filter(k -> k.repr != null && !k.keyword && k != UNDERSCORE)
          .sorted((a, b) -> Integer.compare(b.repr.length(), a.repr.length()))
          .collect(ImmutableList.toImmutableList());

  static ImmutableList<TokenKind> operatorsLongestFirst() {
    return OPERATORS;
  }
}
