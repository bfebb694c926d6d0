package blockgen.blocks;

import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * C data type of a signal: a base type with an optional vector length or matrix shape.
 * rows = 0 means scalar, cols = 0 with rows &gt; 0 means vector.
 */
public record SignalType(String baseType, int rows, int cols) {
  private static final Set<String> baseTypes = Set.of("double", "float", "int", "long", "bool");
  private static final Pattern typePattern = Pattern.compile("\\s*(\\w+)\\s*(?:\\[\\s*(\\d+)\\s*\\])?\\s*(?:\\[\\s*(\\d+)\\s*\\])?\\s*");

  public static final SignalType DOUBLE = new SignalType("double", 0, 0);
  public static final SignalType BOOL = new SignalType("bool", 0, 0);

  public SignalType {
    if (!baseTypes.contains(baseType))
      throw new IllegalArgumentException("Unsupported signal base type '" + baseType + "', expected one of " + baseTypes);
    if (rows < 0 || cols < 0 || (rows == 0 && cols != 0))
      throw new IllegalArgumentException("Invalid signal shape [" + rows + "][" + cols + "]");
  }

  public static SignalType scalar(String baseType) { return new SignalType(baseType, 0, 0); }

  public static SignalType vector(String baseType, int length) { return new SignalType(baseType, length, 0); }

  public static SignalType matrix(String baseType, int rows, int cols) { return new SignalType(baseType, rows, cols); }

  /**
   * Parses "double", "double[3]" or "double[2][3]".
   */
  public static SignalType parse(String text) {
    Matcher matcher = typePattern.matcher(text == null ? "" : text);
    if (!matcher.matches())
      throw new IllegalArgumentException("Malformed signal type '" + text + "'");
    int rows = (matcher.group(2) == null) ? 0 : Integer.parseInt(matcher.group(2));
    int cols = (matcher.group(3) == null) ? 0 : Integer.parseInt(matcher.group(3));
    return new SignalType(matcher.group(1), rows, cols);
  }

  /**
   * Shape of an element-wise result: the first non-scalar input shape with base double, scalar double if all inputs are scalars.
   * Null entries stand for unconnected inputs.
   */
  public static SignalType broadcast(List<SignalType> inputTypes) {
    for (SignalType type : inputTypes) {
      if (type != null && !type.isScalar())
        return type.withBase("double");
    }
    return DOUBLE;
  }

  public boolean isScalar() { return rows == 0; }

  public boolean isVector() { return rows > 0 && cols == 0; }

  public boolean isMatrix() { return cols > 0; }

  public boolean isBool() { return baseType.equals("bool"); }

  /** Number of scalar elements. */
  public int size() { return isScalar() ? 1 : isVector() ? rows : rows * cols; }

  public SignalType withBase(String newBase) { return new SignalType(newBase, rows, cols); }

  /** Array suffix of a declaration, e.g. "[2][3]". */
  public String dimensions() { return isScalar() ? "" : isVector() ? "[" + rows + "]" : "[" + rows + "][" + cols + "]"; }

  /** C member declaration, e.g. "double gain_out[3];". */
  public String declare(String identifier) { return baseType + " " + identifier + dimensions() + ";"; }

  /** Index suffix addressing flat element k in row-major order, empty for scalars. */
  public String elementSuffix(int k) { return isScalar() ? "" : isVector() ? "[" + k + "]" : "[" + (k / cols) + "][" + (k % cols) + "]"; }

  @Override
  public String toString() {
    return baseType + dimensions();
  }
}
