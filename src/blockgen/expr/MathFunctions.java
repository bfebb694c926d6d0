package blockgen.expr;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * The closed set of library functions a custom expression may call, with their arities.
 */
public class MathFunctions {
  private static final Map<String, Integer> arities = new TreeMap<>();
  static {
    for (String name : new String[] {"sqrt", "sin", "cos", "tan", "asin", "acos", "atan", "ceil", "floor", "trunc", "round", "lround", "log",
                                     "log2", "log10", "abs", "labs", "fabs", "signbit"})
      arities.put(name, 1);
    for (String name : new String[] {"pow", "atan2", "fmax", "fmin"})
      arities.put(name, 2);
  }

  /** Functions whose C result type is integral. */
  private static final Set<String> integerResults = Set.of("abs", "labs", "lround", "signbit");
  /** Functions declared in stdlib.h rather than math.h. */
  private static final Set<String> stdlibFunctions = Set.of("abs", "labs");

  public static boolean isSupported(String name) { return arities.containsKey(name); }

  public static int arity(String name) {
    Integer ret = arities.get(name);
    if (ret == null)
      throw new IllegalArgumentException("Unknown function '" + name + "'");
    return ret;
  }

  public static boolean returnsInteger(String name) { return integerResults.contains(name); }

  public static boolean needsMathHeader(String name) { return isSupported(name) && !stdlibFunctions.contains(name); }

  public static String supportedList() { return String.join(", ", arities.keySet()); }
}
