package quark;

public enum NodeKind {
  COMPILATION_UNIT,
  BLOCK,
  MODULE,
  USE,

  // Definitions
  FUNCTION,
  PARAMETERS,
  PARAMETER,
  TYPE,
  VAR_DECL,
  LAMBDA,

  // Control flow
  IF,
  WHEN,
  PATTERN,
  RESULT_PATTERN,
  WILDCARD,
  FOR,
  WHILE,

  // Expressions
  IDENTIFIER,
  // A name that is declared or selected rather than looked up: function, parameter, binding and
  // member names.
  NAME,
  LITERAL,
  OPERATOR,
  UNARY,
  TERNARY,
  PIPE,
  CALL,
  ARGUMENTS,
  INDEX,
  LIST,
  DICT,
  VECTOR,
  RESULT;
}
