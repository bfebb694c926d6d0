package blockgen.expr;

/**
 * Thrown when an expression cannot be tokenized or parsed.
 */
public class ExpressionSyntaxException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String expression;
  private final int position;

  public ExpressionSyntaxException(String message, String expression, int position) {
    super(message + " (at position " + position + " in '" + expression + "')");
    this.expression = expression;
    this.position = position;
  }

  private ExpressionSyntaxException(String blockName, ExpressionSyntaxException cause) {
    super("Block " + blockName + ": " + cause.getMessage(), cause);
    this.expression = cause.expression;
    this.position = cause.position;
  }

  /** Same error, message prefixed with the block that owns the expression. */
  public ExpressionSyntaxException inBlock(String blockName) { return new ExpressionSyntaxException(blockName, this); }

  public String getExpression() { return expression; }

  public int getPosition() { return position; }
}
