package blockgen.expr;

/**
 * Runtime division or remainder by zero while evaluating an expression.
 */
public class DivisionByZeroException extends ArithmeticException {
  private static final long serialVersionUID = 1L;

  public DivisionByZeroException(String message) { super(message); }
}
