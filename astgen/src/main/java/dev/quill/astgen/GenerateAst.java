package dev.quill.astgen;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

// Emits `Expr.java`: an abstract base class with a visitor interface and one
// final nested class per node variant, each with public final fields.
public class GenerateAst {
  static final String PACKAGE = "dev.quill.parsing";
  static final String BASE_NAME = "Expr";

  /* clang-format off */
  static final List<String> NODES = Arrays.asList(
      "Binary    : Expr left, Token operator, Expr right",
      "Condition : Expr expression, Expr thenExpression, Expr elseExpression",
      "Grouping  : Expr expression",
      "Literal   : Value value",
      "Unary     : Token operator, Expr expression"
  );
  /* clang-format on */

  private final StringBuilder out = new StringBuilder();
  private int depth = 0;

  public static void main(String[] args) throws IOException {
    if (args.length != 1) {
      System.err.println("Usage: generate_ast <output directory>");
      System.exit(64);
    }
    Path directory = Paths.get(args[0]);
    Files.createDirectories(directory);

    String source = new GenerateAst().render(BASE_NAME, NODES);
    Files.write(
        directory.resolve(BASE_NAME + ".java"),
        source.getBytes(StandardCharsets.UTF_8)
    );
  }

  String render(String baseName, List<String> nodes) {
    line("package " + PACKAGE + ";");
    line("");
    open("public abstract class " + baseName);

    open("public interface Visitor<R>");
    for (String node : nodes) {
      String name = nameOf(node);
      line(String.format(
          "R visit%s%s(%s %s);", name, baseName, name, baseName.toLowerCase()
      ));
    }
    close();
    line("");
    line("public abstract <R> R accept(Visitor<R> visitor);");

    for (String node : nodes) {
      line("");
      node(baseName, nameOf(node), fieldsOf(node));
    }

    close();
    return out.toString();
  }

  // a node: constructor (every field required), visitor dispatch, fields
  private void node(String baseName, String name, List<String[]> fields) {
    open(String.format("public static final class %s extends %s", name, baseName));

    List<String> parameters = new ArrayList<>();
    for (String[] field : fields)
      parameters.add(field[0] + " " + field[1]);
    open(String.format("public %s(%s)", name, String.join(", ", parameters)));
    for (String[] field : fields) {
      line(String.format(
          "this.%1$s = java.util.Objects.requireNonNull(%1$s, \"%1$s\");",
          field[1]
      ));
    }
    close();
    line("");

    line("@Override");
    open("public <R> R accept(Visitor<R> visitor)");
    line(String.format("return visitor.visit%s%s(this);", name, baseName));
    close();
    line("");

    for (String[] field : fields)
      line(String.format("public final %s %s;", field[0], field[1]));
    close();
  }

  // "Name : Type a, Type b" -> "Name"
  private static String nameOf(String node) {
    return node.split(":")[0].trim();
  }

  // "Name : Type a, Type b" -> [[Type, a], [Type, b]]
  private static List<String[]> fieldsOf(String node) {
    List<String[]> fields = new ArrayList<>();
    for (String field : node.split(":")[1].trim().split(",\\s*"))
      fields.add(field.trim().split("\\s+"));
    return fields;
  }

  private void open(String header) {
    line(header + " {");
    depth++;
  }

  private void close() {
    depth--;
    line("}");
  }

  private void line(String text) {
    if (!text.isEmpty())
      out.append("  ".repeat(depth)).append(text);
    out.append('\n');
  }
}
