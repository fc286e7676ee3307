package quark;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableSet;

/**
 * Statement grammar plus a precedence-climbing expression engine.
 *
 * <p>Errors are collected rather than thrown. A failed subtree comes back as {@code null} and the
 * statement loop resynchronizes by skipping a single token, so later errors in the same file are
 * still reported.
 */
public class Parser extends ErrorCollector {

  private static final ImmutableSet<TokenKind> EXPRESSION_STARTERS =
      ImmutableSet.of(
          TokenKind.ID,
          TokenKind.INT,
          TokenKind.FLOAT,
          TokenKind.STRING,
          TokenKind.TRUE,
          TokenKind.FALSE,
          TokenKind.NULL,
          TokenKind.LPAR,
          TokenKind.LBRACKET,
          TokenKind.LBRACE,
          TokenKind.BANG,
          TokenKind.NOT,
          TokenKind.MINUS,
          TokenKind.FN,
          TokenKind.OK,
          TokenKind.ERR,
          TokenKind.LIST,
          TokenKind.DICT,
          TokenKind.VECTOR);

  // Expressions that may be applied to a space-separated argument.
  private static final ImmutableSet<NodeKind> APPLICABLE =
      ImmutableSet.of(NodeKind.IDENTIFIER, NodeKind.CALL, NodeKind.INDEX, NodeKind.LAMBDA);

  private final List<Token> tokens;
  private int pos = 0;

  public Parser(List<Token> tokens) {
    this.tokens = tokens;
  }

  public Node parse() {
    for (Token token : tokens) {
      if (token.is(TokenKind.ILLEGAL)) {
        logError(CompilerException.at(CompilerException.Kind.LEX, token, token.literal()));
      }
    }

    Node root = new Node(NodeKind.COMPILATION_UNIT, null);
    while (!cur().is(TokenKind.EOF)) {
      if (cur().is(TokenKind.NEWLINE)) {
        next();
        continue;
      }
      Node stmt = parseStatement();
      if (stmt != null) {
        root.addChild(stmt);
      } else {
        next();
      }
    }
    return root;
  }

  // --- Token cursor ---

  private Token cur() {
    return peek(0);
  }

  private Token peek(int offset) {
    int i = pos + offset;
    return i < tokens.size() ? tokens.get(i) : tokens.get(tokens.size() - 1);
  }

  private Token previous() {
    return pos > 0 ? tokens.get(pos - 1) : tokens.get(0);
  }

  private Token next() {
    Token t = cur();
    if (!t.is(TokenKind.EOF)) {
      pos++;
    }
    return t;
  }

  private boolean expect(TokenKind kind) {
    if (cur().is(kind)) {
      next();
      return true;
    }
    error(cur(), String.format("expected %s but got %s", describe(kind), describe(cur())));
    return false;
  }

  private void error(Token at, String msg) {
    // Illegal tokens have already been reported as lex errors.
    if (!at.is(TokenKind.ILLEGAL)) {
      logError(CompilerException.at(CompilerException.Kind.PARSE, at, msg));
    }
  }

  private static String describe(TokenKind kind) {
    return kind.repr().equals(kind.name()) ? kind.name() : "'" + kind.repr() + "'";
  }

  private static String describe(Token token) {
    switch (token.kind()) {
      case ID:
      case INT:
      case FLOAT:
        return token.kind() + " '" + token.literal() + "'";
      default:
        return describe(token.kind());
    }
  }

  // --- Statements ---

  private Node parseStatement() {
    switch (cur().kind()) {
      case MODULE:
        return parseModule();
      case USE:
        return parseUse();
      case IF:
        return parseIf();
      case WHEN:
        return parseWhen();
      case FOR:
        return parseFor();
      case WHILE:
        return parseWhile();
      case FN:
        if (peek(1).is(TokenKind.ID) && peek(2).is(TokenKind.LPAR)) {
          return parseFunction();
        }
        return parseExpressionStatement();
      case ID:
        if (peek(1).is(TokenKind.COLON)) {
          return parseVarDecl();
        }
        return parseExpressionStatement();
      case INDENT:
        error(cur(), "unexpected indented block");
        return null;
      case DEDENT:
      case ILLEGAL:
        return null;
      default:
        return parseExpressionStatement();
    }
  }

  private Node parseExpressionStatement() {
    Node expr = parseExpression(Precedence.LOWEST);
    if (expr == null) {
      return null;
    }
    if (!atStatementEnd()) {
      error(cur(), String.format("unexpected %s after expression", describe(cur())));
      while (!atStatementEnd()) {
        next();
      }
    }
    return expr;
  }

  private boolean atStatementEnd() {
    switch (cur().kind()) {
      case NEWLINE:
      case EOF:
      case DEDENT:
        return true;
      default:
        return previous().is(TokenKind.DEDENT);
    }
  }

  private Node parseModule() {
    Token tok = next();
    if (!cur().is(TokenKind.ID)) {
      expect(TokenKind.ID);
      return null;
    }
    Node name = new Node(NodeKind.NAME, next());
    if (!expect(TokenKind.COLON)) {
      return null;
    }
    Node body = parseBlock();
    return body == null ? null : new Node(NodeKind.MODULE, tok, name, body);
  }

  private Node parseUse() {
    Token tok = next();
    if (cur().is(TokenKind.ID)) {
      return new Node(NodeKind.USE, tok, new Node(NodeKind.NAME, next()));
    }
    if (cur().is(TokenKind.STRING)) {
      return new Node(NodeKind.USE, tok, new Node(NodeKind.LITERAL, next()));
    }
    error(cur(), String.format("expected module name or path but got %s", describe(cur())));
    return null;
  }

  private Node parseFunction() {
    Token tok = next();
    Node name = new Node(NodeKind.NAME, next());
    if (!expect(TokenKind.LPAR)) {
      return null;
    }

    Node params = new Node(NodeKind.PARAMETERS, null);
    while (!cur().is(TokenKind.RPAR)) {
      if (!cur().is(TokenKind.ID)) {
        expect(TokenKind.ID);
        return null;
      }
      Node param = new Node(NodeKind.PARAMETER, next());
      if (cur().is(TokenKind.COLON)) {
        next();
        Node type = parseType();
        if (type == null) {
          return null;
        }
        param.addChild(type);
      }
      params.addChild(param);
      if (!cur().is(TokenKind.COMMA)) {
        break;
      }
      next();
    }
    if (!expect(TokenKind.RPAR) || !expect(TokenKind.ARROW)) {
      return null;
    }

    Node body = parseBlock();
    return body == null ? null : new Node(NodeKind.FUNCTION, tok, name, params, body);
  }

  private Node parseType() {
    switch (cur().kind()) {
      case ID:
      case LIST:
      case DICT:
      case VECTOR:
      case NULL:
        return new Node(NodeKind.TYPE, next());
      default:
        error(cur(), String.format("expected type name but got %s", describe(cur())));
        return null;
    }
  }

  private Node parseVarDecl() {
    Token name = next();
    next(); // ':'
    Node type = parseType();
    if (type == null || !expect(TokenKind.EQUALS)) {
      return null;
    }
    Node value = parseExpression(Precedence.ASSIGNMENT.next());
    return value == null ? null : new Node(NodeKind.VAR_DECL, name, type, value);
  }

  private Node parseIf() {
    Node node = new Node(NodeKind.IF, next());
    if (!parseConditionalBlock(node)) {
      return null;
    }

    while (true) {
      if (cur().is(TokenKind.NEWLINE)
          && (peek(1).is(TokenKind.ELSEIF) || peek(1).is(TokenKind.ELSE))) {
        next();
      }
      if (cur().is(TokenKind.ELSEIF)) {
        next();
        if (!parseConditionalBlock(node)) {
          return null;
        }
      } else if (cur().is(TokenKind.ELSE)) {
        next();
        if (!expect(TokenKind.COLON)) {
          return null;
        }
        Node block = parseBlock();
        if (block == null) {
          return null;
        }
        node.addChild(block);
        return node;
      } else {
        return node;
      }
    }
  }

  private boolean parseConditionalBlock(Node node) {
    Node cond = parseExpression(Precedence.LOWEST);
    if (cond == null || !expect(TokenKind.COLON)) {
      return false;
    }
    Node block = parseBlock();
    if (block == null) {
      return false;
    }
    node.addChild(cond);
    node.addChild(block);
    return true;
  }

  private Node parseFor() {
    Token tok = next();
    if (!cur().is(TokenKind.ID)) {
      expect(TokenKind.ID);
      return null;
    }
    Node var = new Node(NodeKind.NAME, next());
    if (!expect(TokenKind.IN)) {
      return null;
    }
    Node iterable = parseExpression(Precedence.LOWEST);
    if (iterable == null || !expect(TokenKind.COLON)) {
      return null;
    }
    Node body = parseBlock();
    return body == null ? null : new Node(NodeKind.FOR, tok, var, iterable, body);
  }

  private Node parseWhile() {
    Token tok = next();
    Node cond = parseExpression(Precedence.LOWEST);
    if (cond == null || !expect(TokenKind.COLON)) {
      return null;
    }
    Node body = parseBlock();
    return body == null ? null : new Node(NodeKind.WHILE, tok, cond, body);
  }

  /**
   * Parses the block after a {@code :} or {@code ->}: an indented block, an empty block when a
   * newline is not followed by an indent, or the rest of the current line.
   */
  private Node parseBlock() {
    Node block = new Node(NodeKind.BLOCK, cur());
    if (!cur().is(TokenKind.NEWLINE)) {
      Node stmt = parseStatement();
      if (stmt == null) {
        return null;
      }
      block.addChild(stmt);
      return block;
    }

    if (!peek(1).is(TokenKind.INDENT)) {
      next();
      return block;
    }

    next();
    next();
    while (!cur().is(TokenKind.DEDENT) && !cur().is(TokenKind.EOF)) {
      if (cur().is(TokenKind.NEWLINE)) {
        next();
        continue;
      }
      Node stmt = parseStatement();
      if (stmt != null) {
        block.addChild(stmt);
      } else {
        next();
      }
    }
    expect(TokenKind.DEDENT);
    return block;
  }

  private Node parseWhen() {
    Token tok = next();
    Node scrutinee = parseExpression(Precedence.LOWEST);
    if (scrutinee == null
        || !expect(TokenKind.COLON)
        || !expect(TokenKind.NEWLINE)
        || !expect(TokenKind.INDENT)) {
      return null;
    }

    Node node = new Node(NodeKind.WHEN, tok, scrutinee);
    while (!cur().is(TokenKind.DEDENT) && !cur().is(TokenKind.EOF)) {
      if (cur().is(TokenKind.NEWLINE)) {
        next();
        continue;
      }
      Node pattern = parsePattern();
      if (pattern == null) {
        // Skip the rest of the broken arm.
        while (!cur().is(TokenKind.NEWLINE)
            && !cur().is(TokenKind.DEDENT)
            && !cur().is(TokenKind.EOF)) {
          next();
        }
        continue;
      }
      node.addChild(pattern);
    }
    expect(TokenKind.DEDENT);
    return node;
  }

  private Node parsePattern() {
    List<Node> parts = new ArrayList<>();
    Token start = cur();
    if ((start.is(TokenKind.OK) || start.is(TokenKind.ERR)) && peek(1).is(TokenKind.ID)) {
      next();
      parts.add(new Node(NodeKind.RESULT_PATTERN, start, new Node(NodeKind.NAME, next())));
    } else if (start.is(TokenKind.UNDERSCORE)) {
      parts.add(new Node(NodeKind.WILDCARD, next()));
    } else {
      while (true) {
        Node alternative = parseExpression(Precedence.AND);
        if (alternative == null) {
          return null;
        }
        parts.add(alternative);
        if (!cur().is(TokenKind.OR)) {
          break;
        }
        next();
      }
    }

    Token arrow = cur();
    if (!expect(TokenKind.ARROW)) {
      return null;
    }
    Node result;
    if (cur().is(TokenKind.NEWLINE) && peek(1).is(TokenKind.INDENT)) {
      result = parseBlock();
    } else {
      result = parseExpression(Precedence.LOWEST);
    }
    if (result == null) {
      return null;
    }
    parts.add(result);
    return new Node(NodeKind.PATTERN, arrow, parts.toArray(new Node[0]));
  }

  // --- Expressions ---

  public Node parseExpression(Precedence precedence) {
    if (cur().is(TokenKind.IF)) {
      error(cur(), "unexpected 'if' at start of expression");
      return null;
    }

    Node left = parsePrefix(precedence);
    if (left == null) {
      return null;
    }

    while (!isEndOfExpression()) {
      Token tok = cur();
      if (tok.is(TokenKind.NEWLINE)) {
        // Only reachable when a pipe continues on the next line.
        next();
        continue;
      }

      if (startsApplication(left, tok, precedence)) {
        left = parseApplication(left, precedence);
      } else {
        Optional<Precedence> infix = infixPrecedence(tok);
        if (!infix.isPresent() || infix.get().compareTo(precedence) < 0) {
          break;
        }
        left = parseInfix(left, infix.get());
      }
      if (left == null) {
        return null;
      }
    }
    return left;
  }

  private boolean isEndOfExpression() {
    switch (cur().kind()) {
      case NEWLINE:
        return !peek(1).is(TokenKind.PIPE);
      case RPAR:
      case RBRACKET:
      case RBRACE:
      case COLON:
      case EOF:
      case INDENT:
      case DEDENT:
        return true;
      default:
        // A block-bodied expression already consumed its terminating newline.
        return previous().is(TokenKind.DEDENT);
    }
  }

  private Optional<Precedence> infixPrecedence(Token tok) {
    if (tok.is(TokenKind.LPAR) && !touchesPrevious(tok)) {
      return Optional.empty();
    }
    return Precedence.infix(tok.kind());
  }

  // True when tok directly follows the previous token, as in f(x) rather than f (x).
  private boolean touchesPrevious(Token tok) {
    Token prev = previous();
    boolean callable =
        prev.is(TokenKind.ID) || prev.is(TokenKind.RPAR) || prev.is(TokenKind.RBRACKET);
    return callable
        && prev.line() == tok.line()
        && prev.column() + prev.literal().length() == tok.column();
  }

  /**
   * Function application is implied by adjacency: it applies when the current token can start an
   * expression and no infix reading of that token binds at the ambient precedence.
   */
  private boolean startsApplication(Node left, Token tok, Precedence precedence) {
    if (!EXPRESSION_STARTERS.contains(tok.kind())
        || !precedence.atMost(Precedence.APPLICATION)
        || !APPLICABLE.contains(left.kind())) {
      return false;
    }
    Optional<Precedence> infix = infixPrecedence(tok);
    return !infix.isPresent() || infix.get().compareTo(precedence) < 0;
  }

  private Node parseApplication(Node callee, Precedence precedence) {
    Node args = new Node(NodeKind.ARGUMENTS, null);
    Node arg = parseExpression(Precedence.TERM);
    if (arg == null) {
      return null;
    }
    args.addChild(arg);

    // Further comma-separated arguments bind only where a comma would not mean something else.
    while (precedence.atMost(Precedence.COMMA)
        && cur().is(TokenKind.COMMA)
        && EXPRESSION_STARTERS.contains(peek(1).kind())) {
      next();
      arg = parseExpression(Precedence.TERM);
      if (arg == null) {
        return null;
      }
      args.addChild(arg);
    }
    return new Node(NodeKind.CALL, null, callee, args);
  }

  private Node parsePrefix(Precedence precedence) {
    Token tok = cur();
    switch (tok.kind()) {
      case ID:
        next();
        return new Node(NodeKind.IDENTIFIER, tok);
      case INT:
      case FLOAT:
      case STRING:
      case TRUE:
      case FALSE:
      case NULL:
        next();
        return new Node(NodeKind.LITERAL, tok);
      case UNDERSCORE:
        next();
        return new Node(NodeKind.WILDCARD, tok);
      case LPAR:
        return parseGrouped();
      case LBRACKET:
        return parseSequence(NodeKind.LIST, tok);
      case LBRACE:
        return parseDict(tok);
      case LIST:
      case VECTOR:
        next();
        if (!cur().is(TokenKind.LBRACKET)) {
          expect(TokenKind.LBRACKET);
          return null;
        }
        return parseSequence(tok.is(TokenKind.LIST) ? NodeKind.LIST : NodeKind.VECTOR, tok);
      case DICT:
        next();
        if (!cur().is(TokenKind.LBRACE)) {
          expect(TokenKind.LBRACE);
          return null;
        }
        return parseDict(tok);
      case BANG:
      case NOT:
      case MINUS:
        {
          next();
          Node operand = parseExpression(Precedence.UNARY);
          return operand == null ? null : new Node(NodeKind.UNARY, tok, operand);
        }
      case FN:
        return parseLambda(precedence);
      case OK:
      case ERR:
        {
          next();
          Node value = parseExpression(Precedence.ASSIGNMENT);
          return value == null ? null : new Node(NodeKind.RESULT, tok, value);
        }
      case WHEN:
        return parseWhen();
      case ILLEGAL:
        return null;
      default:
        error(tok, String.format("unexpected %s", describe(tok)));
        return null;
    }
  }

  private Node parseGrouped() {
    next();
    Node expr = parseExpression(Precedence.LOWEST);
    if (expr == null || !expect(TokenKind.RPAR)) {
      return null;
    }
    return expr;
  }

  private Node parseSequence(NodeKind kind, Token tok) {
    next(); // '['
    Node node = new Node(kind, tok);
    while (!cur().is(TokenKind.RBRACKET)) {
      Node elem = parseExpression(Precedence.TERNARY);
      if (elem == null) {
        return null;
      }
      node.addChild(elem);
      if (!cur().is(TokenKind.COMMA)) {
        break;
      }
      next();
    }
    return expect(TokenKind.RBRACKET) ? node : null;
  }

  private Node parseDict(Token tok) {
    next(); // '{'
    Node node = new Node(NodeKind.DICT, tok);
    while (!cur().is(TokenKind.RBRACE)) {
      Token keyTok = cur();
      Node key;
      if (keyTok.is(TokenKind.ID)) {
        key = new Node(NodeKind.NAME, next());
      } else if (keyTok.is(TokenKind.STRING)) {
        key = new Node(NodeKind.LITERAL, next());
      } else {
        error(keyTok, String.format("expected dict key but got %s", describe(keyTok)));
        return null;
      }
      Token colon = cur();
      if (!expect(TokenKind.COLON)) {
        return null;
      }
      Node value = parseExpression(Precedence.TERNARY);
      if (value == null) {
        return null;
      }
      node.addChild(new Node(NodeKind.OPERATOR, colon, key, value));
      if (!cur().is(TokenKind.COMMA)) {
        break;
      }
      next();
    }
    return expect(TokenKind.RBRACE) ? node : null;
  }

  private Node parseLambda(Precedence precedence) {
    Token tok = next();
    Node params = new Node(NodeKind.PARAMETERS, null);
    boolean parenthesized = cur().is(TokenKind.LPAR);
    if (parenthesized) {
      next();
    }
    while (cur().is(TokenKind.ID)) {
      params.addChild(new Node(NodeKind.PARAMETER, next()));
      if (!cur().is(TokenKind.COMMA)) {
        break;
      }
      next();
    }
    if ((parenthesized && !expect(TokenKind.RPAR)) || !expect(TokenKind.ARROW)) {
      return null;
    }

    Node body;
    if (cur().is(TokenKind.NEWLINE) && peek(1).is(TokenKind.INDENT)) {
      body = parseBlock();
    } else {
      // Inside an argument or a literal the body stops at the next comma.
      body = parseExpression(precedence.compareTo(Precedence.TERNARY) > 0
          ? Precedence.TERNARY
          : precedence);
    }
    return body == null ? null : new Node(NodeKind.LAMBDA, tok, params, body);
  }

  private Node parseInfix(Node left, Precedence precedence) {
    Token tok = next();
    switch (tok.kind()) {
      case IF:
        {
          Node cond = parseExpression(Precedence.TERNARY.next());
          if (cond == null || !expect(TokenKind.ELSE)) {
            return null;
          }
          Node otherwise = parseExpression(Precedence.TERNARY);
          return otherwise == null ? null : new Node(NodeKind.TERNARY, tok, cond, left, otherwise);
        }
      case PIPE:
        {
          Node target = parseExpression(Precedence.PIPE.next());
          return target == null ? null : new Node(NodeKind.PIPE, tok, left, target);
        }
      case DOT:
        {
          if (!cur().is(TokenKind.ID)) {
            expect(TokenKind.ID);
            return null;
          }
          return new Node(NodeKind.OPERATOR, tok, left, new Node(NodeKind.NAME, next()));
        }
      case LBRACKET:
        {
          Node index = parseExpression(Precedence.LOWEST);
          if (index == null || !expect(TokenKind.RBRACKET)) {
            return null;
          }
          return new Node(NodeKind.INDEX, tok, left, index);
        }
      case LPAR:
        return parseCallArguments(left);
      case DOUBLESTAR:
      case EQUALS:
        // Right-associative.
        {
          Node right = parseExpression(precedence);
          return right == null ? null : new Node(NodeKind.OPERATOR, tok, left, right);
        }
      default:
        {
          Node right = parseExpression(precedence.next());
          return right == null ? null : new Node(NodeKind.OPERATOR, tok, left, right);
        }
    }
  }

  private Node parseCallArguments(Node callee) {
    Node args = new Node(NodeKind.ARGUMENTS, null);
    while (!cur().is(TokenKind.RPAR)) {
      Node arg = parseExpression(Precedence.TERNARY);
      if (arg == null) {
        return null;
      }
      args.addChild(arg);
      if (!cur().is(TokenKind.COMMA)) {
        break;
      }
      next();
    }
    return expect(TokenKind.RPAR) ? new Node(NodeKind.CALL, null, callee, args) : null;
  }
}
