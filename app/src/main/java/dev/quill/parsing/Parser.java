package dev.quill.parsing;

import static dev.quill.parsing.TokenType.*;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

public class Parser {
  private final List<Token> tokens;
  // indexes the token currently being looked at
  private int current = 0;

  public Parser(List<Token> tokens) { this.tokens = withoutTrivia(tokens); }

  // Parses the whole token list as a single expression.
  //
  // The first mismatch aborts the parse; no partial tree is returned.
  public ParseResult parse() {
    try {
      Expr expr = expression();
      consume(EOF, "Expected end of input after expression.");
      return ParseResult.success(expr);
    } catch (ParseError error) {
      return ParseResult.failure(error);
    }
  }

  // expression -> comma
  Expr expression() { return comma(); }

  // comma -> ternary ( "," ternary )*
  private Expr comma() { return binary(() -> ternary(), COMMA); }

  // The "then" branch accepts any expression (even a comma or another
  // conditional) since it is delimited by "?" and ":"; the "else" branch
  // recurses into `ternary` to make conditionals right-associative:
  //    a ? b : c ? d : e  ==  a ? b : (c ? d : e)
  //
  // ternary -> equality ( "?" expression ":" ternary )?
  private Expr ternary() {
    Expr condition = equality();

    if (match(QUESTION)) {
      Expr thenExpression = expression();
      consume(
          COLON, "Expected ':' after the then branch of a conditional."
      );
      Expr elseExpression = ternary();
      return new Expr.Condition(condition, thenExpression, elseExpression);
    }
    return condition;
  }

  // equality -> comparison ( ( "!=" | "==" ) comparison )*
  private Expr equality() {
    return binary(() -> comparison(), BANG_EQUAL, EQUAL_EQUAL);
  }

  // comparison -> term ( ( ">" | ">=" | "<" | "<=" ) term )*
  private Expr comparison() {
    return binary(() -> term(), GREATER, GREATER_EQUAL, LESS, LESS_EQUAL);
  }

  // term -> factor ( ( "-" | "+" ) factor )*
  private Expr term() { return binary(() -> factor(), MINUS, PLUS); }

  // factor -> unary ( ( "/" | "*" ) unary )*
  private Expr factor() { return binary(() -> unary(), SLASH, STAR); }

  // unary -> ( "!" | "-" ) unary
  //        | primary
  private Expr unary() {
    if (match(BANG, MINUS)) {
      Token operator = previous();
      Expr right = unary();
      return new Expr.Unary(operator, right);
    }
    return primary();
  }

  // primary -> NUMBER | STRING | "true" | "false" | "nil"
  //          | "(" expression ")"
  private Expr primary() {
    // literal values were materialized by the scanner
    if (match(NUMBER, STRING, TRUE, FALSE, NIL)) {
      Token literal = previous();
      // only possible with hand-built tokens; scanned ones always carry one
      if (literal.literal == null)
        throw ParseError.expectedExpression(
            literal, "Literal token carries no value."
        );
      return new Expr.Literal(literal.literal);
    }
    if (match(LEFT_PAREN)) {
      Expr expr = expression();
      consume(
          RIGHT_PAREN,
          String.format(
              "Expected ')' after expression: %s", new AstPrinter().print(expr)
          )
      );
      return new Expr.Grouping(expr);
    }
    throw ParseError.expectedExpression(peek(), "Expected expression.");
  }

  // binary -> subunit ( ONE_OF<tokenTypes> subunit )*
  private Expr binary(Supplier<Expr> subunitParser, TokenType... tokenTypes) {
    Expr expr = subunitParser.get();
    while (match(tokenTypes)) {
      Token operator = previous();
      Expr right = subunitParser.get();
      expr = new Expr.Binary(expr, operator, right);
    }
    return expr;
  }

  // returns true if it was able to consume the next token
  // consumes the next token if it matches one of `expectedTypes`
  private boolean match(TokenType... expectedTypes) {
    for (TokenType type : expectedTypes) {
      if (check(type)) {
        advance();
        return true;
      }
    }
    return false;
  }

  private Token consume(TokenType type, String message) {
    if (check(type))
      return advance();
    throw ParseError.unexpectedToken(peek(), type, message);
  }

  // EOF is its own sentinel: it only matches a request for EOF itself
  private boolean check(TokenType expectedType) {
    return peek().type == expectedType;
  }

  private Token advance() {
    if (!isAtEnd())
      current++;
    return previous();
  }

  private boolean isAtEnd() { return peek().type == EOF; }

  private Token peek() { return tokens.get(current); }

  private Token previous() { return tokens.get(current - 1); }

  // skips as many tokens as necessary to get out of the current
  // state of confusion (i.e., we've failed to parse a rule but
  // we want to tolerate errors, so we try to move past to the
  // begining of the next statement.)
  //
  // pre-condition: the current token "breaks" the current grammar
  // rule being parsed.
  //
  // post-condition: all tokens in the previous statement have been
  // discarded, and the current token is now at the beginning of the
  // next statement or at EOF
  void synchronize() {
    if (isAtEnd())
      return;
    advance();

    while (!isAtEnd()) {
      if (previous().type == SEMICOLON)
        return;
      switch (peek().type) {
      case CLASS:
      case FN:
      case VAR:
      case FOR:
      case IF:
      case PRINT:
      case WHILE:
      case RETURN:
        return;
      default:
        advance();
      }
    }
  }

  // Comments carry no grammatical meaning, so the parser never sees them.
  // A list that does not end in EOF gets one, so that `peek` always has a
  // sentinel to stop at.
  private static List<Token> withoutTrivia(List<Token> tokens) {
    List<Token> significant = new ArrayList<>(tokens.size() + 1);
    for (Token token : tokens) {
      if (token.type != COMMENT)
        significant.add(token);
    }
    if (significant.isEmpty() ||
        significant.get(significant.size() - 1).type != EOF) {
      int line =
          significant.isEmpty() ? 1 : significant.get(significant.size() - 1).line;
      significant.add(new Token(EOF, /* lexeme: */ "", /* literal: */ null, line));
    }
    return significant;
  }
}
