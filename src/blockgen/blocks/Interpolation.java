package blockgen.blocks;

/**
 * Piecewise-linear and bilinear table interpolation. Each Java routine has a static C twin (lookup_segment, lookup_1d, lookup_2d) performing
 * the same floating point operations in the same order.
 */
public class Interpolation {
  public static final String segmentHelperKey = "lookup_segment";
  public static final String lookup1DHelperKey = "lookup_1d";
  public static final String lookup2DHelperKey = "lookup_2d";

  /** Interval index and fraction of a breakpoint search. */
  record Segment(int index, double fraction) {}

  /**
   * Locates u among ascending breakpoints.
   * Below the first or above the last breakpoint the fraction is 0 or 1 when clamping and linear beyond that otherwise.
   */
  static Segment segment(double[] x, double u, boolean extrapolate) {
    int n = x.length;
    if (n < 2)
      return new Segment(0, 0.0);
    if (u <= x[0])
      return new Segment(0, extrapolate ? fraction(x[0], x[1], u) : 0.0);
    if (u >= x[n - 1])
      return new Segment(n - 2, extrapolate ? fraction(x[n - 2], x[n - 1], u) : 1.0);
    int i = 0;
    while (i < n - 2 && u > x[i + 1])
      i++;
    return new Segment(i, fraction(x[i], x[i + 1], u));
  }

  private static double fraction(double lo, double hi, double u) { return (hi == lo) ? 0.0 : (u - lo) / (hi - lo); }

  /** @return 0.0 for an empty table */
  public static double lookup1D(double[] x, double[] y, double u, boolean extrapolate) {
    if (x.length == 0)
      return 0.0;
    Segment seg = segment(x, u, extrapolate);
    int i1 = (x.length > 1) ? seg.index() + 1 : seg.index();
    return y[seg.index()] + seg.fraction() * (y[i1] - y[seg.index()]);
  }

  /**
   * @param table row-major, table[i * x2.length + j] belongs to (x1[i], x2[j])
   */
  public static double lookup2D(double[] x1, double[] x2, double[] table, double u1, double u2, boolean extrapolate) {
    if (x1.length == 0 || x2.length == 0)
      return 0.0;
    int n2 = x2.length;
    Segment s = segment(x1, u1, extrapolate);
    Segment t = segment(x2, u2, extrapolate);
    int i = s.index();
    int j = t.index();
    int i1 = (x1.length > 1) ? i + 1 : i;
    int j1 = (n2 > 1) ? j + 1 : j;
    double v00 = table[i * n2 + j];
    double v01 = table[i * n2 + j1];
    double v10 = table[i1 * n2 + j];
    double v11 = table[i1 * n2 + j1];
    double a = s.fraction();
    double b = t.fraction();
    return (1.0 - a) * (1.0 - b) * v00 + (1.0 - a) * b * v01 + a * (1.0 - b) * v10 + a * b * v11;
  }

  static String segmentHelper() {
    return String.join("\n",
        "static void lookup_segment(const double* x, int n, double u, int extrapolate, int* index, double* frac)",
        "{",
        "    int i = 0;",
        "    *index = 0;",
        "    *frac = 0.0;",
        "    if (n < 2)",
        "        return;",
        "    if (u <= x[0]) {",
        "        *frac = (extrapolate && x[1] != x[0]) ? (u - x[0]) / (x[1] - x[0]) : 0.0;",
        "        return;",
        "    }",
        "    if (u >= x[n - 1]) {",
        "        *index = n - 2;",
        "        *frac = extrapolate ? ((x[n - 1] == x[n - 2]) ? 0.0 : (u - x[n - 2]) / (x[n - 1] - x[n - 2])) : 1.0;",
        "        return;",
        "    }",
        "    while (i < n - 2 && u > x[i + 1])",
        "        i++;",
        "    *index = i;",
        "    *frac = (x[i + 1] == x[i]) ? 0.0 : (u - x[i]) / (x[i + 1] - x[i]);",
        "}");
  }

  static String lookup1DHelper() {
    return String.join("\n",
        "static double lookup_1d(const double* x, const double* y, int n, double u, int extrapolate)",
        "{",
        "    int i;",
        "    double t;",
        "    if (n == 0)",
        "        return 0.0;",
        "    lookup_segment(x, n, u, extrapolate, &i, &t);",
        "    return y[i] + t * (y[(n > 1) ? i + 1 : i] - y[i]);",
        "}");
  }

  static String lookup2DHelper() {
    return String.join("\n",
        "static double lookup_2d(const double* x1, int n1, const double* x2, int n2, const double* table, double u1, double u2,",
        "                        int extrapolate)",
        "{",
        "    int i, j, i1, j1;",
        "    double a, b;",
        "    if (n1 == 0 || n2 == 0)",
        "        return 0.0;",
        "    lookup_segment(x1, n1, u1, extrapolate, &i, &a);",
        "    lookup_segment(x2, n2, u2, extrapolate, &j, &b);",
        "    i1 = (n1 > 1) ? i + 1 : i;",
        "    j1 = (n2 > 1) ? j + 1 : j;",
        "    return (1.0 - a) * (1.0 - b) * table[i * n2 + j] + (1.0 - a) * b * table[i * n2 + j1] +",
        "           a * (1.0 - b) * table[i1 * n2 + j] + a * b * table[i1 * n2 + j1];",
        "}");
  }
}
