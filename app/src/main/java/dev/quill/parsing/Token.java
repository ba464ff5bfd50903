package dev.quill.parsing;

public class Token {
  // `Token` is just a data structure with no behavior so it's okay for
  // its fields to be public
  public final TokenType type;
  public final String lexeme;
  // null when the token carries no literal (operators, identifiers, ...)
  public final Value literal;
  public final int line;

  public Token(TokenType type, String lexeme, Value literal, int line) {
    this.type = type;
    this.lexeme = lexeme;
    this.literal = literal;
    this.line = line;
  }

  public Token(TokenType type, String lexeme) {
    this(type, lexeme, /*literal:*/ null, /*line:*/ 1);
  }

  @Override
  public String toString() {
    return type + " " + lexeme + " " + literal;
  }
}
