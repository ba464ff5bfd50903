package dev.quill.parsing;

// RPN stands for Reverse Polish Notation
// See https://en.wikipedia.org/wiki/Reverse_Polish_notation
//
public class RPNPrinter implements Expr.Visitor<String> {
  public String print(Expr expr) { return expr.accept(this); }

  @Override
  public String visitBinaryExpr(Expr.Binary expr) {
    return toRPN(expr.operator.lexeme, expr.left, expr.right);
  }

  @Override
  public String visitConditionExpr(Expr.Condition expr) {
    return toRPN(
        "?:", expr.expression, expr.thenExpression, expr.elseExpression
    );
  }

  @Override
  public String visitGroupingExpr(Expr.Grouping expr) {
    // parentheses only exist to override precedence, which RPN doesn't need
    return toRPN("", expr.expression);
  }

  @Override
  public String visitLiteralExpr(Expr.Literal expr) {
    return expr.value.toString();
  }

  @Override
  public String visitUnaryExpr(Expr.Unary expr) {
    // "-" would be ambiguous with subtraction
    String operator =
        expr.operator.type == TokenType.MINUS ? "neg" : expr.operator.lexeme;
    return toRPN(operator, expr.expression);
  }

  private String toRPN(String operator, Expr... operands) {
    StringBuilder builder = new StringBuilder();
    for (Expr operand : operands) {
      builder.append(operand.accept(this));
      builder.append(" ");
    }
    builder.append(operator);
    return builder.toString();
  }
}
