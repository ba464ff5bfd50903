package dev.quill.parsing;

import java.util.Objects;

/** Either the expression tree of a successful parse or its first error. */
public final class ParseResult {
  private final Expr expression;
  private final ParseError error;

  private ParseResult(Expr expression, ParseError error) {
    this.expression = expression;
    this.error = error;
  }

  public static ParseResult success(Expr expression) {
    return new ParseResult(Objects.requireNonNull(expression, "expression"), null);
  }

  public static ParseResult failure(ParseError error) {
    return new ParseResult(null, Objects.requireNonNull(error, "error"));
  }

  public boolean isSuccess() { return expression != null; }

  // pre-condition: isSuccess()
  public Expr expression() {
    if (!isSuccess())
      throw new IllegalStateException("Parse failed: " + error.getMessage());
    return expression;
  }

  // pre-condition: !isSuccess()
  public ParseError error() {
    if (isSuccess())
      throw new IllegalStateException("Parse succeeded, there is no error.");
    return error;
  }
}
