package quark;

import com.google.auto.value.AutoValue;

@AutoValue
public abstract class Token {
  public abstract TokenKind kind();

  /** Source text; unescaped contents for strings, the message for {@link TokenKind#ILLEGAL}. */
  public abstract String literal();

  /** 1-based. */
  public abstract int line();

  /** 1-based. */
  public abstract int column();

  public static Token create(TokenKind kind, String literal, int line, int column) {
    return new AutoValue_Token(kind, literal, line, column);
  }

  public boolean is(TokenKind kind) {
    return kind() == kind;
  }

  @Override
  public final String toString() {
    switch (kind()) {
      case ID:
      case INT:
      case FLOAT:
      case STRING:
      case ILLEGAL:
        return kind() + "(" + literal() + ")";
      default:
        return kind().name();
    }
  }
}
