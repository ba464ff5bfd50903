package dev.quill.parsing;

/**
 * A lexical problem found by the {@link Scanner}.
 *
 * <p>Scan errors are data, not exceptions: the scanner records one and keeps
 * going so that a single pass reports every problem in the source.
 */
public final class ScanError {
  public enum Kind {
    UNTERMINATED_STRING,
    UNTERMINATED_BLOCK_COMMENT,
    UNEXPECTED_CHARACTER,
    INVALID_NUMBER
  }

  public final Kind kind;
  // 1-based position where the offending token started
  public final int line;
  public final int column;
  public final String message;

  public ScanError(Kind kind, int line, int column, String message) {
    this.kind = kind;
    this.line = line;
    this.column = column;
    this.message = message;
  }

  @Override
  public String toString() {
    return String.format(
        "%s [line %d, column %d] %s", kind, line, column, message
    );
  }
}
