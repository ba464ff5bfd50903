package dev.quill.parsing;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class RPNPrinterTest {
  @Test
  void canPrintInRPN() {
    Expr expression = ParserTest.parseExpression("(1 + 2) * (4 - 3)");
    RPNPrinter printer = new RPNPrinter();
    String rpn = printer.print(expression);

    assertEquals("1.0 2.0 +  4.0 3.0 -  *", rpn);
  }

  @Test
  void shouldDistinguishNegationFromSubtraction() {
    Expr expression = ParserTest.parseExpression("-1 - !true");

    assertEquals("1.0 neg true ! -", new RPNPrinter().print(expression));
  }

  @Test
  void canPrintConditionsInRPN() {
    Expr expression = ParserTest.parseExpression("1 >= 2 ? \"a\" : nil");

    assertEquals("1.0 2.0 >= a nil ?:", new RPNPrinter().print(expression));
  }
}
