package blockgen.expr;

import java.util.List;

/**
 * Thrown when a syntactically valid expression fails semantic validation.
 */
public class ExpressionValidationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String expression;
  private final List<String> errors;

  public ExpressionValidationException(String expression, List<String> errors) {
    super("Invalid expression '" + expression + "': " + String.join("; ", errors));
    this.expression = expression;
    this.errors = List.copyOf(errors);
  }

  private ExpressionValidationException(String blockName, ExpressionValidationException cause) {
    super("Block " + blockName + ": " + cause.getMessage(), cause);
    this.expression = cause.expression;
    this.errors = cause.errors;
  }

  public ExpressionValidationException inBlock(String blockName) { return new ExpressionValidationException(blockName, this); }

  public String getExpression() { return expression; }

  public List<String> getErrors() { return errors; }
}
