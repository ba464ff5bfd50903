package dev.quill.parsing;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ValueTest {
  @Test
  void shouldCompareByContent() {
    assertEquals(Value.number(1.5), Value.number(1.5));
    assertEquals(Value.string("a"), Value.string("a"));
    assertEquals(Value.TRUE, Value.bool(true));
    assertEquals(Value.number(2).hashCode(), Value.number(2).hashCode());

    assertNotEquals(Value.number(1), Value.string("1.0"));
    assertNotEquals(Value.NIL, Value.FALSE);
  }

  @Test
  void shouldRenderDefaultTextForm() {
    assertEquals("3.0", Value.number(3).toString());
    assertEquals("0.25", Value.number(0.25).toString());
    assertEquals("text", Value.string("text").toString());
    assertEquals("true", Value.TRUE.toString());
    assertEquals("nil", Value.NIL.toString());
  }
}
