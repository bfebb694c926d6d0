package blockgen.blocks;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import blockgen.blocks.TransferFunctionModule.StateSpace;
import java.util.List;
import org.junit.jupiter.api.Test;

class TransferFunctionModuleTest {

  @Test
  void integrator() {
    StateSpace ss = TransferFunctionModule.realize("tf", List.of(1.0), List.of(1.0, 0.0));
    assertEquals(1, ss.order());
    assertArrayEquals(new double[] {0.0}, ss.a());
    assertArrayEquals(new double[] {1.0}, ss.c());
    assertEquals(0.0, ss.d());
    assertFalse(ss.hasFeedthrough());
  }

  @Test
  void secondOrder() {
    // (s + 2) / (s^2 + 3s + 2)
    StateSpace ss = TransferFunctionModule.realize("tf", List.of(1.0, 2.0), List.of(1.0, 3.0, 2.0));
    assertEquals(2, ss.order());
    assertArrayEquals(new double[] {2.0, 3.0}, ss.a());
    assertArrayEquals(new double[] {2.0, 1.0}, ss.c());
    assertEquals(0.0, ss.d());
  }

  @Test
  void biproperHasFeedthrough() {
    // (2s + 1) / (s + 1) = 2 - 1 / (s + 1)
    StateSpace ss = TransferFunctionModule.realize("tf", List.of(2.0, 1.0), List.of(1.0, 1.0));
    assertEquals(2.0, ss.d());
    assertArrayEquals(new double[] {-1.0}, ss.c());
    assertTrue(ss.hasFeedthrough());
  }

  @Test
  void normalizesLeadingCoefficient() {
    StateSpace ss = TransferFunctionModule.realize("tf", List.of(4.0), List.of(0.0, 2.0, 4.0));
    assertEquals(1, ss.order());
    assertArrayEquals(new double[] {2.0}, ss.a());
    assertArrayEquals(new double[] {2.0}, ss.c());
  }

  @Test
  void staticGain() {
    StateSpace ss = TransferFunctionModule.realize("tf", List.of(3.0), List.of(2.0));
    assertEquals(0, ss.order());
    assertEquals(1.5, ss.d());
    assertTrue(ss.hasFeedthrough());
  }

  @Test
  void rejectsBadPolynomials() {
    var zero = assertThrows(IllegalArgumentException.class, () -> TransferFunctionModule.realize("tf", List.of(1.0), List.of(0.0, 0.0)));
    assertEquals("Transfer function tf has an all-zero denominator", zero.getMessage());
    var improper = assertThrows(IllegalArgumentException.class, () -> TransferFunctionModule.realize("tf", List.of(1.0, 0.0, 0.0), List.of(1.0, 1.0)));
    assertEquals("Transfer function tf is improper: numerator degree 2 exceeds denominator degree 1", improper.getMessage());
  }
}
