package dev.quill.parsing;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class AstPrinterTest {
  private final AstPrinter printer = new AstPrinter();

  @Test
  void canPrintAST() {
    Expr expression = new Expr.Binary(
        new Expr.Unary(new Token(TokenType.MINUS, "-"),
                       new Expr.Literal(Value.number(123))),
        new Token(TokenType.STAR, "*"),
        new Expr.Grouping(new Expr.Literal(Value.number(45.67))));

    assertEquals("-123.0 * ( 45.67 )", printer.print(expression));
  }

  @Test
  void canPrintConditions() {
    Expr expression = new Expr.Condition(
        new Expr.Unary(new Token(TokenType.BANG, "!"),
                       new Expr.Literal(Value.FALSE)),
        new Expr.Literal(Value.string("yes")), new Expr.Literal(Value.NIL));

    assertEquals("!false ? yes : nil", printer.print(expression));
  }

  @Test
  void shouldOnlyShowGroupingsFromTheSource() {
    String ast = printer.print(ParserTest.parseExpression("(1 + 2) * 3 - 4 * 5"));

    assertEquals("( 1.0 + 2.0 ) * 3.0 - 4.0 * 5.0", ast);
  }

  @Test
  void canPrintCommaExpressions() {
    String ast = printer.print(ParserTest.parseExpression("1, true ? 2 : 3"));

    assertEquals("1.0 , true ? 2.0 : 3.0", ast);
  }
}
