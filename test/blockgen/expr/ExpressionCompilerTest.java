package blockgen.expr;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import blockgen.expr.ExprCodeGen.GeneratedExpression;
import blockgen.expr.ExpressionCompiler.CompiledExpression;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class ExpressionCompilerTest {

  @Test
  void euclideanNorm() {
    CompiledExpression expr = ExpressionCompiler.compile("sqrt(pow(in(0),2) + pow(in(1),2))", 2);
    assertEquals(5.0, expr.evaluate(3.0, 4.0), 1e-12);
    GeneratedExpression code = expr.generateCode(List.of("a", "b"));
    assertEquals("sqrt(pow(a, 2) + pow(b, 2))", code.code());
    assertTrue(code.needsMath());
    assertEquals(List.of(0, 1), List.copyOf(expr.validation().usedInputs()));
  }

  @ParameterizedTest
  @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
    "1 + 2 * 3            | 7",
    "(1 + 2) * 3          | 9",
    "7 / 2                | 3",
    "7.0 / 2              | 3.5",
    "-7 / 2               | -3",
    "10 % 3               | 1",
    "0x1F                 | 31",
    "010                  | 8",
    "2.5e1                | 25",
    "6 & 3                | 2",
    "1 << 4               | 16",
    "5 ^ 1                | 4",
    "~0                   | -1",
    "!3                   | 0",
    "1 ? 2 : 3            | 2",
    "0 ? 1 : 0 ? 2 : 3    | 3",
    "1 < 2 && 2 < 3       | 1",
    "\"0 || 0\"           | 0",
    "round(2.5)           | 3",
    "round(-2.5)          | -3",
    "trunc(-1.7)          | -1",
    "fmax(1, 4)           | 4",
    "abs(-3.9)            | 3",
    "signbit(-0.0)        | 1",
    "log2(8)              | 3",
  })
  void evaluatesConstantExpressions(String text, double expected) {
    assertEquals(expected, ExpressionCompiler.compile(text, 0).evaluate(), 1e-12, text);
  }

  @Test
  void inputsAreDouble() {
    assertEquals(3.5, ExpressionCompiler.compile("in(0) / 2", 1).evaluate(7.0), 1e-12);
    assertEquals(1.5, ExpressionCompiler.compile("in(0) % 2", 1).evaluate(5.5), 1e-12);
  }

  @Test
  void comparisonsTolerateRounding() {
    CompiledExpression eq = ExpressionCompiler.compile("in(0) == 0.3", 1);
    assertEquals(1.0, eq.evaluate(0.1 + 0.2));
    assertEquals(0.0, eq.evaluate(0.31));
    assertEquals(0.0, ExpressionCompiler.compile("in(0) < 0.3", 1).evaluate(0.1 + 0.2));
  }

  @Test
  void divisionByZeroAtRuntime() {
    CompiledExpression expr = ExpressionCompiler.compile("in(0) / in(1)", 2);
    assertThrows(DivisionByZeroException.class, () -> expr.evaluate(1.0, 0.0));
    assertEquals(0.5, expr.evaluate(1.0, 2.0));
  }

  @ParameterizedTest
  @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
    "1 / 0        | 1 | Division by zero detected",
    "in(2)        | 2 | in(2) is out of range. Valid range is 0 to 1",
    "in(0.5)      | 1 | in() requires exactly one integer literal index",
    "x + 1        | 1 | Unknown identifier 'x'. Inputs are referenced as in(0), in(1), ...",
    "pow(1)       | 0 | pow() requires exactly 2 argument(s), got 1",
    "in(0)++      | 1 | Operator '++' not allowed in evaluate expressions",
  })
  void reportsValidationErrors(String text, int numInputs, String error) {
    var e = assertThrows(ExpressionValidationException.class, () -> ExpressionCompiler.compile(text, numInputs));
    assertTrue(e.getErrors().contains(error), e.getErrors().toString());
  }

  @Test
  void unknownFunctionListsSupported() {
    var e = assertThrows(ExpressionValidationException.class, () -> ExpressionCompiler.compile("foo(1)", 0));
    assertTrue(e.getErrors().get(0).startsWith("Unknown function 'foo'. Supported: "), e.getErrors().get(0));
    assertTrue(e.getErrors().get(0).contains("sqrt"));
  }

  @Test
  void reportsWarnings() {
    assertEquals(List.of("sqrt() of negative value -1.0 produces NaN"), ExpressionCompiler.compile("sqrt(-1)", 0).warnings());
    List<String> bitwise = ExpressionCompiler.compile("1.5 & 1", 0).warnings();
    assertEquals(1, bitwise.size());
    assertTrue(bitwise.get(0).startsWith("Bitwise operator '&'"));
    assertTrue(ExpressionCompiler.compile("in(0) + 1", 1).warnings().isEmpty());
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "   ", "1 +", "(1", "1 2", "1 $ 2", "0x", "1e", "09", "max(1,", "3abc", "0xFFFFFFFFFFFFFFFFF + in(0)",
                          "in(0) + 10000000000000000000"})
  void rejectsMalformedText(String text) {
    assertThrows(ExpressionSyntaxException.class, () -> ExpressionCompiler.compile(text, 1));
  }

  @Test
  void outOfRangeLiteralsAreNamed() {
    var hex = assertThrows(ExpressionSyntaxException.class, () -> ExpressionCompiler.compile("0xFFFFFFFFFFFFFFFFF + in(0)", 1));
    assertTrue(hex.getMessage().startsWith("Hexadecimal literal out of range"), hex.getMessage());
    assertEquals(0, hex.getPosition());
    var decimal = assertThrows(ExpressionSyntaxException.class, () -> ExpressionCompiler.compile("in(0) + 10000000000000000000", 1));
    assertTrue(decimal.getMessage().startsWith("Integer literal out of range"), decimal.getMessage());
    assertEquals(8, decimal.getPosition());
    // the largest long still agrees between evaluator and C
    CompiledExpression max = ExpressionCompiler.compile("9223372036854775807", 0);
    assertEquals("9223372036854775807", max.generateCode(List.of()).code());
    assertEquals(9.223372036854775807e18, max.evaluate());
    // a float literal of the same size is rendered as a double
    assertEquals("(a + 1.0E19)", ExpressionCompiler.compile("in(0) + 1e19", 1).generateCode(List.of("a")).code());
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 50, 120})
  void acceptsNestingWithinLimit(int levels) {
    String text = "(".repeat(levels) + "in(0)" + ")".repeat(levels);
    assertEquals(2.0, ExpressionCompiler.compile(text, 1).evaluate(2.0));
  }

  @ParameterizedTest
  @ValueSource(strings = {"(", "-", "!"})
  void rejectsExcessiveNesting(String opener) {
    String closer = opener.equals("(") ? ")" : "";
    String text = opener.repeat(20000) + "1" + closer.repeat(20000);
    var e = assertThrows(ExpressionSyntaxException.class, () -> ExprParser.parse(text));
    assertTrue(e.getMessage().startsWith("Expression nested deeper than " + ExprParser.MAX_NESTING_DEPTH + " levels"), e.getMessage().substring(0, 80));
  }

  @Test
  void rejectsOverlongOperatorChain() {
    String text = "1" + " + 1".repeat(20000);
    var e = assertThrows(ExpressionSyntaxException.class, () -> ExprParser.parse(text));
    assertTrue(e.getMessage().startsWith("Expression nested deeper than"), e.getMessage().substring(0, 80));
    assertEquals(201.0, ExpressionCompiler.compile("1" + " + 1".repeat(200), 0).evaluate());
  }

  @Test
  void syntaxErrorCarriesPosition() {
    var e = assertThrows(ExpressionSyntaxException.class, () -> ExprParser.parse("(1"));
    assertEquals("Unexpected end of expression, expected ')' (at position 2 in '(1')", e.getMessage());
    assertEquals(2, e.getPosition());
    var wrapped = e.inBlock("Calc");
    assertEquals("Block Calc: " + e.getMessage(), wrapped.getMessage());
    assertEquals(e, wrapped.getCause());
    assertEquals("(1", wrapped.getExpression());
  }

  @ParameterizedTest
  @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
    "in(0) + 1                | (a + 1)                         | false",
    "in(0) * 2.5              | (a * 2.5)                       | false",
    "in(0) % 2                | fmod(a, 2)                      | true",
    "7 % 2                    | (7 % 2)                         | false",
    "abs(in(0))               | abs((int)(a))                   | false",
    "in(0) & 3                | ((long)(a) & 3)                 | false",
    "in(0) > 0 ? 1 : -1       | ((a > 0) ? (1) : ((-1)))        | false",
    "sin(in(1)) * cos(in(0))  | (sin(b) * cos(a))               | true",
  })
  void generatesC(String text, String expected, boolean needsMath) {
    GeneratedExpression code = ExpressionCompiler.compile(text, 2).generateCode(List.of("a", "b"));
    assertEquals(expected, code.code());
    assertEquals(needsMath, code.needsMath());
  }

  @Test
  void codeNeedsEveryInputName() {
    CompiledExpression expr = ExpressionCompiler.compile("in(1)", 2);
    assertThrows(IllegalArgumentException.class, () -> expr.generateCode(List.of("a")));
    assertFalse(expr.validation().usedInputs().contains(0));
  }
}
