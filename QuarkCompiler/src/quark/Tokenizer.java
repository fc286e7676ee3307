package quark;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Produces an indentation-normalized tokenization of the input.
 *
 * <p>Tokenizing never fails: malformed input is reported through {@link TokenKind#ILLEGAL} tokens
 * whose literal is the error message, and the parser turns those into diagnostics.
 */
public class Tokenizer {
  private static final int TAB_WIDTH = 4;

  private enum IndentState {
    NO_INDENT,
    MAY_INDENT,
    MUST_INDENT;
  }

  private static class TrackedToken {
    private final Token token;
    private final boolean atLineStart;
    private final boolean mustIndent;

    TrackedToken(Token token, boolean atLineStart, boolean mustIndent) {
      this.token = token;
      this.atLineStart = atLineStart;
      this.mustIndent = mustIndent;
    }
  }

  private final String input;

  private int pos = 0;
  private int line = 1;
  private int column = 1;
  private int nesting = 0;
  private boolean atLineStart = true;

  public Tokenizer(String input) {
    this.input = input;
  }

  public ImmutableList<Token> tokenize() {
    return indentationFilter(trackTokens(scan()));
  }

  private char peek(int offset) {
    int i = pos + offset;
    return i < input.length() ? input.charAt(i) : '\0';
  }

  private boolean atEnd() {
    return pos >= input.length();
  }

  private char advance() {
    char c = input.charAt(pos++);
    if (c == '\n') {
      line++;
      column = 1;
    } else {
      column++;
    }
    return c;
  }

  private List<Token> scan() {
    List<Token> tokens = new ArrayList<>();
    while (true) {
      Token token = nextRawToken();
      tokens.add(token);
      if (token.is(TokenKind.EOF)) {
        return tokens;
      }
    }
  }

  private Token nextRawToken() {
    while (true) {
      if (atEnd()) {
        return Token.create(TokenKind.EOF, "", line, column);
      }

      char c = peek(0);
      int startLine = line;
      int startColumn = column;

      if (c == ' ' || c == '\t') {
        if (atLineStart && nesting == 0) {
          return readWhitespace();
        }
        advance();
        continue;
      }

      if (c == '/' && peek(1) == '/') {
        while (!atEnd() && peek(0) != '\n' && peek(0) != '\r') {
          advance();
        }
        continue;
      }

      if (c == '\n' || c == '\r') {
        advance();
        if (c == '\r') {
          // A bare \r does not move advance() to the next line.
          if (peek(0) == '\n') {
            advance();
          } else {
            line++;
            column = 1;
          }
        }
        if (nesting > 0) {
          continue;
        }
        atLineStart = true;
        return Token.create(TokenKind.NEWLINE, "\n", startLine, startColumn);
      }

      atLineStart = false;

      if (c == '\'') {
        return readString();
      }
      if (isDigit(c) || (c == '.' && isDigit(peek(1)))) {
        return readNumber();
      }
      if (isLetter(c) || (c == '_' && isIdentifierPart(peek(1)))) {
        String word = readIdentifier();
        TokenKind kind = TokenKind.keyword(word).orElse(TokenKind.ID);
        return Token.create(kind, word, startLine, startColumn);
      }

      for (TokenKind op : TokenKind.operatorsLongestFirst()) {
        if (input.startsWith(op.repr(), pos)) {
          for (int i = 0; i < op.repr().length(); i++) {
            advance();
          }
          updateNesting(op);
          return Token.create(op, op.repr(), startLine, startColumn);
        }
      }
      if (c == '_') {
        advance();
        return Token.create(TokenKind.UNDERSCORE, "_", startLine, startColumn);
      }

      advance();
      return Token.create(
          TokenKind.ILLEGAL,
          String.format("unexpected character '%c'", c),
          startLine,
          startColumn);
    }
  }

  private void updateNesting(TokenKind kind) {
    switch (kind) {
      case LPAR:
      case LBRACKET:
      case LBRACE:
        nesting++;
        break;
      case RPAR:
      case RBRACKET:
      case RBRACE:
        if (nesting > 0) {
          nesting--;
        }
        break;
      default:
        break;
    }
  }

  private Token readWhitespace() {
    int startLine = line;
    int startColumn = column;
    int width = 0;
    while (peek(0) == ' ' || peek(0) == '\t') {
      width += advance() == '\t' ? TAB_WIDTH : 1;
    }
    return Token.create(TokenKind.WS, Integer.toString(width), startLine, startColumn);
  }

  private String readIdentifier() {
    int start = pos;
    while (!atEnd() && isIdentifierPart(peek(0))) {
      advance();
    }
    return input.substring(start, pos);
  }

  private Token readNumber() {
    int startLine = line;
    int startColumn = column;
    int start = pos;
    boolean isFloat = false;

    while (isDigit(peek(0))) {
      advance();
    }
    if (peek(0) == '.' && isDigit(peek(1))) {
      isFloat = true;
      advance();
      while (isDigit(peek(0))) {
        advance();
      }
    } else if (peek(0) == '.' && peek(1) != '.' && pos > start) {
      // "2." is a float, but "2..5" is a range.
      isFloat = true;
      advance();
    }

    return Token.create(
        isFloat ? TokenKind.FLOAT : TokenKind.INT,
        input.substring(start, pos),
        startLine,
        startColumn);
  }

  private Token readString() {
    int startLine = line;
    int startColumn = column;
    advance();

    StringBuilder sb = new StringBuilder();
    while (!atEnd() && peek(0) != '\'' && peek(0) != '\n' && peek(0) != '\r') {
      char c = advance();
      if (c != '\\' || atEnd()) {
        sb.append(c);
        continue;
      }

      char escaped = peek(0);
      switch (escaped) {
        case '\'':
          sb.append('\'');
          break;
        case 'n':
          sb.append('\n');
          break;
        case 't':
          sb.append('\t');
          break;
        case '\\':
          sb.append('\\');
          break;
        case 'r':
          sb.append('\r');
          break;
        case '0':
          sb.append('\0');
          break;
        default:
          // Unknown escapes are kept verbatim.
          sb.append('\\');
          continue;
      }
      advance();
    }

    if (peek(0) != '\'') {
      return Token.create(TokenKind.ILLEGAL, "unterminated string", startLine, startColumn);
    }
    advance();
    return Token.create(TokenKind.STRING, sb.toString(), startLine, startColumn);
  }

  private static List<TrackedToken> trackTokens(List<Token> tokens) {
    List<TrackedToken> tracked = new ArrayList<>(tokens.size());
    boolean lineStart = true;
    IndentState state = IndentState.NO_INDENT;

    for (Token token : tokens) {
      boolean mustIndent = false;
      boolean tokenAtLineStart = lineStart;
      switch (token.kind()) {
        case COLON:
        case ARROW:
          lineStart = false;
          state = IndentState.MAY_INDENT;
          break;
        case NEWLINE:
          lineStart = true;
          if (state == IndentState.MAY_INDENT) {
            state = IndentState.MUST_INDENT;
          }
          break;
        case WS:
          break;
        default:
          mustIndent = state == IndentState.MUST_INDENT;
          lineStart = false;
          state = IndentState.NO_INDENT;
          break;
      }
      tracked.add(new TrackedToken(token, tokenAtLineStart, mustIndent));
    }
    return tracked;
  }

  private static ImmutableList<Token> indentationFilter(List<TrackedToken> tracked) {
    ImmutableList.Builder<Token> result = ImmutableList.builder();
    List<Integer> levels = new ArrayList<>();
    levels.add(0);
    int depth = 0;
    boolean prevWasWhitespace = false;
    Token eof = null;

    for (TrackedToken tt : tracked) {
      Token token = tt.token;
      if (token.is(TokenKind.WS)) {
        depth = Integer.parseInt(token.literal());
        prevWasWhitespace = true;
        continue;
      }
      if (token.is(TokenKind.NEWLINE)) {
        depth = 0;
        // Blank lines never reach the parser.
        if (!prevWasWhitespace && !tt.atLineStart) {
          result.add(token);
        }
        continue;
      }
      if (token.is(TokenKind.EOF) && prevWasWhitespace) {
        // A whitespace-only last line is blank.
        depth = 0;
      }
      prevWasWhitespace = false;

      int top = levels.get(levels.size() - 1);
      if (tt.mustIndent) {
        if (depth <= top) {
          result.add(illegal("expected indented block", token));
        } else {
          levels.add(depth);
          result.add(Token.create(TokenKind.INDENT, "", token.line(), token.column()));
        }
      } else if (tt.atLineStart && depth != top) {
        if (depth > top) {
          result.add(illegal("unexpected indent", token));
        } else if (!levels.contains(depth)) {
          result.add(illegal("inconsistent indentation", token));
        } else {
          while (levels.get(levels.size() - 1) != depth) {
            levels.remove(levels.size() - 1);
            result.add(Token.create(TokenKind.DEDENT, "", token.line(), token.column()));
          }
        }
      }

      if (token.is(TokenKind.EOF)) {
        eof = token;
      } else {
        result.add(token);
      }
    }

    for (int i = 1; i < levels.size(); i++) {
      result.add(Token.create(TokenKind.DEDENT, "", eof.line(), eof.column()));
    }
    result.add(eof);
    return result.build();
  }

  private static Token illegal(String message, Token at) {
    return Token.create(TokenKind.ILLEGAL, message, at.line(), at.column());
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isLetter(char c) {
    return Character.isLetter(c);
  }

  private static boolean isIdentifierPart(char c) {
    return isLetter(c) || isDigit(c) || c == '_';
  }
}
