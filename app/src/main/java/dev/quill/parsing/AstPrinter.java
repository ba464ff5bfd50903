package dev.quill.parsing;

/**
 * Renders an expression tree in infix form for debugging.
 *
 * <p>Groupings show up exactly where the source had parentheses; no others are
 * added, so the output is not guaranteed to parse back into the same tree.
 */
public class AstPrinter implements Expr.Visitor<String> {
  public String print(Expr expr) { return expr.accept(this); }

  @Override
  public String visitBinaryExpr(Expr.Binary expr) {
    return infix(expr.left, expr.operator.lexeme, expr.right);
  }

  @Override
  public String visitConditionExpr(Expr.Condition expr) {
    return String.join(
        " ", print(expr.expression), "?", print(expr.thenExpression), ":",
        print(expr.elseExpression)
    );
  }

  @Override
  public String visitGroupingExpr(Expr.Grouping expr) {
    return "( " + print(expr.expression) + " )";
  }

  @Override
  public String visitLiteralExpr(Expr.Literal expr) {
    return expr.value.toString();
  }

  @Override
  public String visitUnaryExpr(Expr.Unary expr) {
    return expr.operator.lexeme + print(expr.expression);
  }

  private String infix(Expr left, String operator, Expr right) {
    StringBuilder builder = new StringBuilder();

    builder.append(print(left));
    builder.append(" ").append(operator).append(" ");
    builder.append(print(right));

    return builder.toString();
  }
}
