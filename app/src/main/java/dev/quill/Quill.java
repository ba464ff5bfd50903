package dev.quill;

import dev.quill.parsing.AstPrinter;
import dev.quill.parsing.Expr;
import dev.quill.parsing.ParseResult;
import dev.quill.parsing.Parser;
import dev.quill.parsing.RPNPrinter;
import dev.quill.parsing.Scanner;
import dev.quill.parsing.Token;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.jline.reader.Completer;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.reader.impl.completer.AggregateCompleter;
import org.jline.reader.impl.completer.StringsCompleter;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;

public class Quill {
  static final String RPN_FLAG = "--rpn";

  public static void main(String[] args) throws IOException {
    List<String> arguments = new ArrayList<>(Arrays.asList(args));
    boolean rpn = arguments.remove(RPN_FLAG);
    Expr.Visitor<String> printer = rpn ? new RPNPrinter() : new AstPrinter();

    if (arguments.size() > 1) {
      System.out.println("Usage: quill [" + RPN_FLAG + "] [script]");
      System.exit(64);
    } else if (arguments.size() == 1) {
      runFile(arguments.get(0), printer);
    } else {
      runPrompt(printer);
    }
  }

  private static void runFile(String path, Expr.Visitor<String> printer)
      throws IOException {
    byte[] bytes = Files.readAllBytes(Paths.get(path));
    String tree = run(new String(bytes, StandardCharsets.UTF_8), printer);
    if (tree != null)
      System.out.println(tree);
    if (Errors.hadError())
      System.exit(65);
  }

  private static void runPrompt(Expr.Visitor<String> printer)
      throws IOException {
    Terminal terminal = TerminalBuilder.builder().build();

    showBannerAndHelp(terminal);
    // keep diagnostics and trees on the same channel so that an error
    // message never lands after the next prompt
    System.setErr(System.out);

    LineReader reader = createReplReader(terminal);
    while (true) {
      try {
        String line = reader.readLine(">>> ");
        if (line == null)
          break;
        line = line.trim();
        if (line.equals("quit"))
          break;

        if (line.isEmpty())
          continue;

        String tree = run(line, printer);
        if (tree != null)
          System.out.println(tree);

        // if the user makes a mistake, we don't kill the session
        Errors.reset();

      } catch (UserInterruptException e) {
        break;
      } catch (EndOfFileException e) {
        break;
      }
    }
  }

  // Runs one scan + parse cycle over `source` and renders the resulting tree
  // with `printer`. Every diagnostic is reported through `Errors`; the result
  // is null when any was found.
  static String run(String source, Expr.Visitor<String> printer) {
    Scanner scanner = new Scanner(source);
    List<Token> tokens = scanner.scanTokens();
    Errors.report(scanner.errors());

    ParseResult result = new Parser(tokens).parse();
    if (!result.isSuccess())
      Errors.report(result.error());

    // stop if there was a lexical or syntax error
    if (Errors.hadError())
      return null;

    return result.expression().accept(printer);
  }

  private static void showBannerAndHelp(Terminal terminal) {
    String logo =
        new AttributedStringBuilder()
            .style(AttributedStyle.DEFAULT.foreground(AttributedStyle.YELLOW))
            .style(AttributedStyle.BOLD)
            .append("Welcome to the Quill REPL.")
            .style(AttributedStyle.DEFAULT)
            .toAnsi();
    terminal.writer().println(logo);

    terminal.writer().println("- Type an expression to see its syntax tree.");
    terminal.writer().println("- Type \"quit\" to quit. (or use «ctrl-d»)");
    terminal.writer().println("- Use «tab» for word completion");
    terminal.writer().println("- Use «ctrl-r» to search the history");
    terminal.writer().println();

    terminal.writer().flush();
  }

  private static LineReader createReplReader(Terminal terminal) {
    // provide completions (triggered via TAB) for all keywords
    Completer completer = new AggregateCompleter(
        new StringsCompleter("quit"),
        new StringsCompleter(Scanner.keywords.keySet())
    );

    return LineReaderBuilder.builder()
        .terminal(terminal)
        .parser(new DefaultParser())
        .completer(completer)
        .build();
  }
}
