package dev.quill.parsing;

import java.util.Objects;

/**
 * A literal value attached to a token and carried by {@link Expr.Literal}.
 *
 * <p>Quill has four kinds of literal: double precision numbers, strings,
 * booleans and {@code nil}. Instances are immutable and compare by content.
 */
public final class Value {
  public enum Kind { NUMBER, STRING, BOOLEAN, NIL }

  public static final Value NIL = new Value(Kind.NIL, null);
  public static final Value TRUE = new Value(Kind.BOOLEAN, Boolean.TRUE);
  public static final Value FALSE = new Value(Kind.BOOLEAN, Boolean.FALSE);

  public final Kind kind;
  // Double, String or Boolean depending on `kind`; null for NIL
  private final Object payload;

  private Value(Kind kind, Object payload) {
    this.kind = kind;
    this.payload = payload;
  }

  public static Value number(double number) {
    return new Value(Kind.NUMBER, number);
  }

  public static Value string(String text) {
    return new Value(Kind.STRING, Objects.requireNonNull(text, "text"));
  }

  public static Value bool(boolean value) { return value ? TRUE : FALSE; }

  @Override
  public boolean equals(Object other) {
    if (this == other)
      return true;
    if (!(other instanceof Value))
      return false;
    Value that = (Value)other;
    return kind == that.kind && Objects.equals(payload, that.payload);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, payload);
  }

  // the text a printer shows for this value
  @Override
  public String toString() {
    if (kind == Kind.NIL)
      return "nil";
    return payload.toString();
  }
}
