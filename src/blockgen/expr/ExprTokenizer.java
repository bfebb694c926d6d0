package blockgen.expr;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits an expression into number, identifier and operator tokens.
 * Integer literals may be decimal, octal (leading 0) or hexadecimal (0x); C suffixes u, l and f are accepted.
 */
public class ExprTokenizer {

  public enum TokenKind { Number, Identifier, Operator, End }

  public record Token(TokenKind kind, String text, double value, boolean isFloat, int position) {
    public boolean is(String operatorText) { return kind == TokenKind.Operator && text.equals(operatorText); }
  }

  private static final String[] twoCharOperators = {"<<", ">>", "<=", ">=", "==", "!=", "&&", "||", "++", "--"};
  private static final String singleCharOperators = "+-*/%<>&|^!~?:(),";

  public static List<Token> tokenize(String expression) {
    List<Token> tokens = new ArrayList<>();
    int pos = 0;
    int len = expression.length();
    while (pos < len) {
      char c = expression.charAt(pos);
      if (Character.isWhitespace(c)) {
        ++pos;
        continue;
      }
      if (Character.isDigit(c) || (c == '.' && pos + 1 < len && Character.isDigit(expression.charAt(pos + 1)))) {
        pos = readNumber(expression, pos, tokens);
        continue;
      }
      if (Character.isLetter(c) || c == '_') {
        int start = pos;
        while (pos < len && (Character.isLetterOrDigit(expression.charAt(pos)) || expression.charAt(pos) == '_'))
          ++pos;
        tokens.add(new Token(TokenKind.Identifier, expression.substring(start, pos), 0.0, false, start));
        continue;
      }
      String two = (pos + 1 < len) ? expression.substring(pos, pos + 2) : "";
      boolean matched = false;
      for (String op : twoCharOperators) {
        if (op.equals(two)) {
          tokens.add(new Token(TokenKind.Operator, op, 0.0, false, pos));
          pos += 2;
          matched = true;
          break;
        }
      }
      if (matched)
        continue;
      if (singleCharOperators.indexOf(c) >= 0) {
        tokens.add(new Token(TokenKind.Operator, String.valueOf(c), 0.0, false, pos));
        ++pos;
        continue;
      }
      throw new ExpressionSyntaxException("Unexpected character '" + c + "'", expression, pos);
    }
    tokens.add(new Token(TokenKind.End, "", 0.0, false, len));
    return tokens;
  }

  private static int readNumber(String expression, int start, List<Token> tokens) {
    int len = expression.length();
    int pos = start;
    if (expression.startsWith("0x", pos) || expression.startsWith("0X", pos)) {
      pos += 2;
      int digitsStart = pos;
      while (pos < len && Character.digit(expression.charAt(pos), 16) >= 0)
        ++pos;
      if (pos == digitsStart)
        throw new ExpressionSyntaxException("Hexadecimal literal without digits", expression, start);
      long value;
      try {
        value = Long.parseLong(expression.substring(digitsStart, pos), 16);
      } catch (NumberFormatException e) {
        throw new ExpressionSyntaxException("Hexadecimal literal out of range", expression, start);
      }
      pos = skipSuffix(expression, pos, "uUlL");
      tokens.add(new Token(TokenKind.Number, expression.substring(start, pos), value, false, start));
      return pos;
    }
    boolean isFloat = false;
    while (pos < len && Character.isDigit(expression.charAt(pos)))
      ++pos;
    if (pos < len && expression.charAt(pos) == '.') {
      isFloat = true;
      ++pos;
      while (pos < len && Character.isDigit(expression.charAt(pos)))
        ++pos;
    }
    if (pos < len && (expression.charAt(pos) == 'e' || expression.charAt(pos) == 'E')) {
      int expStart = pos;
      ++pos;
      if (pos < len && (expression.charAt(pos) == '+' || expression.charAt(pos) == '-'))
        ++pos;
      if (pos >= len || !Character.isDigit(expression.charAt(pos)))
        throw new ExpressionSyntaxException("Malformed exponent", expression, expStart);
      while (pos < len && Character.isDigit(expression.charAt(pos)))
        ++pos;
      isFloat = true;
    }
    String digits = expression.substring(start, pos);
    int suffixStart = pos;
    pos = skipSuffix(expression, pos, "uUlLfF");
    String suffix = expression.substring(suffixStart, pos);
    if (suffix.contains("f") || suffix.contains("F"))
      isFloat = true;
    double value;
    if (isFloat) {
      value = Double.parseDouble(digits);
    } else if (digits.length() > 1 && digits.startsWith("0")) {
      try {
        value = Long.parseLong(digits, 8);
      } catch (NumberFormatException e) {
        throw new ExpressionSyntaxException("Invalid octal literal '" + digits + "'", expression, start);
      }
    } else {
      // integer literals are emitted as C integer constants and must fit a long
      try {
        value = Long.parseLong(digits);
      } catch (NumberFormatException e) {
        throw new ExpressionSyntaxException("Integer literal out of range", expression, start);
      }
    }
    if (pos < len && (Character.isLetterOrDigit(expression.charAt(pos)) || expression.charAt(pos) == '_'))
      throw new ExpressionSyntaxException("Invalid numeric literal", expression, start);
    tokens.add(new Token(TokenKind.Number, expression.substring(start, pos), value, isFloat, start));
    return pos;
  }

  private static int skipSuffix(String expression, int pos, String allowed) {
    while (pos < expression.length() && allowed.indexOf(expression.charAt(pos)) >= 0)
      ++pos;
    return pos;
  }
}
