package dev.quill;

import dev.quill.parsing.ParseError;
import dev.quill.parsing.ScanError;
import dev.quill.parsing.Token;
import dev.quill.parsing.TokenType;
import java.util.List;

// Turns scanner and parser diagnostics into one-line messages on stderr and
// remembers whether anything went wrong during the current run.
public class Errors {
  static boolean hadError = false;

  public static boolean hadError() { return hadError; }

  public static void reset() { hadError = false; }

  public static void report(List<ScanError> errors) {
    for (ScanError error : errors)
      report(error);
  }

  public static void report(ScanError error) {
    emit(format(error));
  }

  public static void report(ParseError error) {
    emit(format(error));
  }

  static String format(ScanError error) {
    return String.format(
        "Scanning Error: [line %d, column %d] %s", error.line, error.column,
        error.message
    );
  }

  static String format(ParseError error) {
    return "Parsing Error: [line " + error.found.line + "] Error" +
        where(error.found) + ": " + error.getMessage();
  }

  private static String where(Token token) {
    if (token.type == TokenType.EOF)
      return " at end";
    return String.format(" at '%s'", token.lexeme);
  }

  private static void emit(String message) {
    System.err.println(message);
    System.err.flush();
    hadError = true;
  }
}
