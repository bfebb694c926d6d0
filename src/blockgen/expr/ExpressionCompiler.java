package blockgen.expr;

import blockgen.expr.ExprCodeGen.GeneratedExpression;
import blockgen.expr.ExprValidator.ValidationResult;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Parse, validate, evaluate and emit custom expressions in one place.
 */
public class ExpressionCompiler {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** A parsed expression that passed validation. */
  public record CompiledExpression(String text, ExprNode root, int numInputs, ValidationResult validation) {

    public double evaluate(double... inputs) { return ExprEvaluator.evaluate(root, inputs); }

    public GeneratedExpression generateCode(List<String> inputNames) { return ExprCodeGen.generate(root, inputNames); }

    public List<String> warnings() { return validation.warnings(); }
  }

  /**
   * @throws ExpressionSyntaxException if the text does not parse
   * @throws ExpressionValidationException if validation reports errors
   */
  public static CompiledExpression compile(String text, int numInputs) {
    ExprNode root = ExprParser.parse(text);
    ValidationResult validation = ExprValidator.validate(root, numInputs);
    if (!validation.isValid())
      throw new ExpressionValidationException(text, validation.errors());
    validation.warnings().forEach(warning -> logger.debug("Expression '{}': {}", text, warning));
    return new CompiledExpression(text, root, numInputs, validation);
  }
}
