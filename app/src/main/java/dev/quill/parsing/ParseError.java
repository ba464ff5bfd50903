package dev.quill.parsing;

/**
 * The first structural mismatch found by the {@link Parser}.
 *
 * <p>Thrown inside the parser to unwind the whole recursive descent at once,
 * then handed to callers inside a {@link ParseResult}.
 */
public class ParseError extends RuntimeException {
  public enum Kind { UNEXPECTED_TOKEN, EXPECTED_EXPRESSION }

  public final Kind kind;
  // the token the parser was looking at when it gave up
  public final Token found;
  // only set for UNEXPECTED_TOKEN
  public final TokenType expected;

  private ParseError(
      Kind kind, Token found, TokenType expected, String message
  ) {
    super(message);
    this.kind = kind;
    this.found = found;
    this.expected = expected;
  }

  static ParseError unexpectedToken(
      Token found, TokenType expected, String message
  ) {
    return new ParseError(Kind.UNEXPECTED_TOKEN, found, expected, message);
  }

  static ParseError expectedExpression(Token found, String message) {
    return new ParseError(
        Kind.EXPECTED_EXPRESSION, found, /* expected: */ null, message
    );
  }
}
