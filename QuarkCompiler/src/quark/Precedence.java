package quark;

import java.util.Optional;

import com.google.common.collect.ImmutableMap;

/** Binding strengths for the expression parser, weakest first. */
public enum Precedence {
  LOWEST,
  ASSIGNMENT,
  PIPE,
  COMMA,
  TERNARY,
  OR,
  AND,
  BITWISE_AND,
  EQUALITY,
  COMPARISON,
  RANGE,
  TERM,
  FACTOR,
  EXPONENT,
  UNARY,
  APPLICATION,
  ACCESS;

  private static final ImmutableMap<TokenKind, Precedence> INFIX =
      ImmutableMap.<TokenKind, Precedence>builder()
          .put(TokenKind.EQUALS, ASSIGNMENT)
          .put(TokenKind.PIPE, PIPE)
          .put(TokenKind.COMMA, COMMA)
          .put(TokenKind.IF, TERNARY)
          .put(TokenKind.OR, OR)
          .put(TokenKind.AND, AND)
          .put(TokenKind.AMPER, BITWISE_AND)
          .put(TokenKind.DEQ, EQUALITY)
          .put(TokenKind.NE, EQUALITY)
          .put(TokenKind.LT, COMPARISON)
          .put(TokenKind.GT, COMPARISON)
          .put(TokenKind.LTE, COMPARISON)
          .put(TokenKind.GTE, COMPARISON)
          .put(TokenKind.DOTDOT, RANGE)
          .put(TokenKind.PLUS, TERM)
          .put(TokenKind.MINUS, TERM)
          .put(TokenKind.MULTIPLY, FACTOR)
          .put(TokenKind.DIVIDE, FACTOR)
          .put(TokenKind.MODULO, FACTOR)
          .put(TokenKind.DOUBLESTAR, EXPONENT)
          .put(TokenKind.DOT, ACCESS)
          .put(TokenKind.LBRACKET, ACCESS)
          .put(TokenKind.LPAR, ACCESS)
          .build();

  /** The infix binding strength of {@code kind}, if it continues an expression. */
  public static Optional<Precedence> infix(TokenKind kind) {
    return Optional.ofNullable(INFIX.get(kind));
  }

  public Precedence next() {
    return values()[Math.min(ordinal() + 1, values().length - 1)];
  }

  public boolean atMost(Precedence other) {
    return compareTo(other) <= 0;
  }
}
