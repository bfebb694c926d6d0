package blockgen.blocks;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SignalTypeTest {

  @Test
  void parsesShapes() {
    assertEquals(SignalType.DOUBLE, SignalType.parse("double"));
    assertEquals(SignalType.vector("int", 4), SignalType.parse(" int [4] "));
    SignalType matrix = SignalType.parse("float[2][3]");
    assertTrue(matrix.isMatrix());
    assertEquals(6, matrix.size());
    assertEquals("float[2][3]", matrix.toString());
  }

  @ParameterizedTest
  @ValueSource(strings = {"complex", "double[", "double[0][3]", "", "double[2]x"})
  void rejectsMalformed(String text) {
    assertThrows(IllegalArgumentException.class, () -> SignalType.parse(text));
  }

  @Test
  void declaresAndIndexes() {
    SignalType matrix = SignalType.matrix("double", 2, 3);
    assertEquals("double gain_out[2][3];", matrix.declare("gain_out"));
    assertEquals("[1][2]", matrix.elementSuffix(5));
    assertEquals("[2]", SignalType.vector("double", 3).elementSuffix(2));
    assertEquals("", SignalType.BOOL.elementSuffix(0));
  }

  @Test
  void broadcastTakesFirstNonScalar() {
    SignalType vec = SignalType.vector("int", 3);
    assertEquals(SignalType.vector("double", 3), SignalType.broadcast(Arrays.asList(SignalType.BOOL, null, vec, SignalType.vector("double", 5))));
    assertEquals(SignalType.DOUBLE, SignalType.broadcast(Arrays.asList(SignalType.BOOL, null)));
  }
}
