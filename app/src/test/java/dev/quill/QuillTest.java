package dev.quill;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

import dev.quill.parsing.AstPrinter;
import dev.quill.parsing.ParseResult;
import dev.quill.parsing.Parser;
import dev.quill.parsing.RPNPrinter;
import dev.quill.parsing.Scanner;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class QuillTest {
  private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();
  private PrintStream originalErr;

  @BeforeEach
  void captureStderr() {
    originalErr = System.err;
    System.setErr(new PrintStream(stderr, true, StandardCharsets.UTF_8));
    Errors.reset();
  }

  @AfterEach
  void restoreStderr() {
    System.setErr(originalErr);
    Errors.reset();
  }

  @Test
  void canRenderParsedExpression() {
    String tree = Quill.run("1 + 2 * 3", new AstPrinter());

    assertEquals("1.0 + 2.0 * 3.0", tree);
    assertFalse(Errors.hadError());
    assertEquals("", stderr.toString(StandardCharsets.UTF_8));
  }

  @Test
  void canRenderInRPN() {
    assertEquals("1.0 2.0 3.0 * +", Quill.run("1 + 2 * 3", new RPNPrinter()));
  }

  @Test
  void shouldReportEveryLexicalError() {
    String tree = Quill.run("1 @ + # 2", new AstPrinter());

    assertNull(tree);
    assertTrue(Errors.hadError());
    String output = stderr.toString(StandardCharsets.UTF_8);
    assertThat(output, containsString(
        "Scanning Error: [line 1, column 3] Unexpected character: <@>."));
    assertThat(output, containsString(
        "Scanning Error: [line 1, column 7] Unexpected character: <#>."));
  }

  @Test
  void shouldReportParseErrors() {
    String tree = Quill.run("(1 + 2", new AstPrinter());

    assertNull(tree);
    assertTrue(Errors.hadError());
    assertThat(stderr.toString(StandardCharsets.UTF_8),
               startsWith("Parsing Error: [line 1] Error at end: Expected ')'"));
  }

  @Test
  void shouldFormatParseErrorsAtTheOffendingToken() {
    ParseResult result = new Parser(new Scanner("1 +\n) ").scanTokens()).parse();

    assertEquals(
        "Parsing Error: [line 2] Error at ')': Expected expression.",
        Errors.format(result.error()));
  }

  @Test
  void resetShouldClearTheErrorFlag() {
    Quill.run("\"open", new AstPrinter());
    assertTrue(Errors.hadError());

    Errors.reset();
    assertEquals("true", Quill.run("true", new AstPrinter()));
    assertFalse(Errors.hadError());
  }
}
