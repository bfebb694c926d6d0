package blockgen.blocks;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class InterpolationTest {
  static final double[] x = {0.0, 1.0, 2.0};
  static final double[] y = {0.0, 10.0, 40.0};

  @ParameterizedTest
  @CsvSource({
    "0.5,  false, 5",
    "1.5,  false, 25",
    "1.0,  false, 10",
    "-1.0, false, 0",
    "3.0,  false, 40",
    "-1.0, true,  -10",
    "3.0,  true,  70",
  })
  void lookup1D(double u, boolean extrapolate, double expected) {
    assertEquals(expected, Interpolation.lookup1D(x, y, u, extrapolate), 1e-12);
  }

  @Test
  void degenerateTables() {
    assertEquals(0.0, Interpolation.lookup1D(new double[0], new double[0], 3.0, true));
    assertEquals(7.0, Interpolation.lookup1D(new double[] {5.0}, new double[] {7.0}, 1.0, true));
    assertEquals(0.0, Interpolation.lookup2D(new double[0], x, new double[0], 1.0, 1.0, false));
  }

  @Test
  void lookup2DIsBilinear() {
    double[] axis = {0.0, 1.0};
    double[] table = {0.0, 1.0, 2.0, 3.0};
    assertEquals(1.5, Interpolation.lookup2D(axis, axis, table, 0.5, 0.5, false), 1e-12);
    assertEquals(2.0, Interpolation.lookup2D(axis, axis, table, 1.0, 0.0, false), 1e-12);
    assertEquals(3.0, Interpolation.lookup2D(axis, axis, table, 5.0, 5.0, false), 1e-12);
    assertEquals(0.5, Interpolation.lookup2D(axis, axis, table, 0.0, 0.5, false), 1e-12);
  }

  @Test
  void segmentSearch() {
    var seg = Interpolation.segment(x, 1.25, false);
    assertEquals(1, seg.index());
    assertEquals(0.25, seg.fraction(), 1e-12);
  }

  @Test
  void helpersAreStatic() {
    assertTrue(Interpolation.lookup1DHelper().startsWith("static double lookup_1d("));
    assertTrue(Interpolation.lookup2DHelper().contains("lookup_segment(x2, n2, u2, extrapolate, &j, &b);"));
    assertTrue(Interpolation.segmentHelper().startsWith("static void lookup_segment("));
  }
}
