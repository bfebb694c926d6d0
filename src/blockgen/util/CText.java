package blockgen.util;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Helpers for producing C source text: identifiers, literals and comments.
 */
public class CText {
  public static final String tab = "    ";

  private static final Set<String> keywords =
      Set.of("auto", "break", "case", "char", "const", "continue", "default", "do", "double", "else", "enum", "extern", "float", "for",
             "goto", "if", "inline", "int", "long", "register", "restrict", "return", "short", "signed", "sizeof", "static", "struct",
             "switch", "typedef", "union", "unsigned", "void", "volatile", "while", "_Bool", "_Complex", "_Imaginary", "bool", "true",
             "false", "NULL");

  /**
   * Turns an arbitrary user-facing name into a valid C identifier.
   * Characters outside [A-Za-z0-9_] become '_', a leading digit gets a '_' prefix, C keywords get a '_' suffix.
   * @param name display name, may be null
   * @return identifier, "signal" for empty input
   */
  public static String sanitizeIdentifier(String name) {
    if (name == null || name.isEmpty())
      return "signal";
    StringBuilder ret = new StringBuilder(name.length() + 1);
    for (char c : name.toCharArray()) {
      boolean legal = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
      ret.append(legal ? c : '_');
    }
    if (Character.isDigit(ret.charAt(0)))
      ret.insert(0, '_');
    String ident = ret.toString();
    if (keywords.contains(ident))
      ident += "_";
    return ident;
  }

  public static boolean isKeyword(String ident) { return keywords.contains(ident); }

  /** Renders a double as a C floating literal that always carries a fraction or exponent. */
  public static String formatDouble(double value) {
    if (Double.isNaN(value))
      return "NAN";
    if (Double.isInfinite(value))
      return value > 0 ? "INFINITY" : "(-INFINITY)";
    if (value == Math.rint(value) && Math.abs(value) < 1e15)
      return String.valueOf((long)value) + ".0";
    String ret = Double.toString(value);
    if (!ret.contains(".") && !ret.contains("E"))
      ret += ".0";
    return ret;
  }

  /** Renders a brace-enclosed initializer list, e.g. "{1.0, 2.5}". */
  public static String initializer(List<Double> values) {
    return values.stream().map(CText::formatDouble).collect(Collectors.joining(", ", "{", "}"));
  }

  /** Block comment with comment terminators neutralized. */
  public static String comment(String text) { return "/* " + text.replace("*/", "* /") + " */"; }

  public static String headerGuard(String modelName) { return sanitizeIdentifier(modelName).toUpperCase() + "_H"; }
}
