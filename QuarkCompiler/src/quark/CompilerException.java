package quark;

import java.io.PrintStream;

public class CompilerException extends Exception {
  private static final long serialVersionUID = 1L;

  public enum Kind {
    LEX,
    PARSE,
    TYPE,
    IMPORT;
  }

  private final Kind kind;
  private final int line;
  private final int column;
  private final String errorMsg;

  public CompilerException(Kind kind, int line, int column, String errorMsg) {
    super(errorMsg);
    this.kind = kind;
    this.line = line;
    this.column = column;
    this.errorMsg = errorMsg;
  }

  public static CompilerException at(Kind kind, Node node, String errorMsg) {
    return new CompilerException(kind, node.line(), node.column(), errorMsg);
  }

  public static CompilerException at(Kind kind, Token token, String errorMsg) {
    return new CompilerException(kind, token.line(), token.column(), errorMsg);
  }

  public Kind kind() {
    return kind;
  }

  public int line() {
    return line;
  }

  public int column() {
    return column;
  }

  public String errorMsg() {
    return errorMsg;
  }

  /** The line-annotated form used in diagnostics lists, e.g. {@code line 3: undefined symbol 'x'}. */
  public String describe() {
    return String.format("line %d: %s", line, errorMsg);
  }

  public void print(String file, PrintStream out) {
    out.println(String.format("ERROR: %s@%d:%d %s", file, line, column, errorMsg));
  }

  @Override
  public String toString() {
    return kind + " " + describe();
  }
}
