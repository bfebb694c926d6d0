package blockgen.blocks;

import blockgen.flatten.FlattenedBlock;
import blockgen.util.CText;
import java.util.List;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compares its input element-wise against a constant, e.g. "&gt; 0.5", and outputs booleans.
 */
public class ConditionModule implements BlockModule {
  private static final Pattern conditionPattern = Pattern.compile("^\\s*(>=|<=|==|!=|>|<)\\s*(.+)$");

  record Comparison(String operator, double threshold) {

    boolean test(double value) {
      switch (operator) {
      case ">":
        return value > threshold;
      case "<":
        return value < threshold;
      case ">=":
        return value >= threshold;
      case "<=":
        return value <= threshold;
      case "==":
        return value == threshold;
      default:
        return value != threshold;
      }
    }
  }

  /**
   * @throws IllegalArgumentException if the text is not "&lt;operator&gt; &lt;number&gt;"
   */
  static Comparison parse(String blockName, String text) {
    Matcher matcher = conditionPattern.matcher(text);
    if (!matcher.matches())
      throw new IllegalArgumentException("Condition block " + blockName + " has malformed condition '" + text
                                         + "'; expected one of >, <, >=, <=, ==, != followed by a number");
    try {
      return new Comparison(matcher.group(1), Double.parseDouble(matcher.group(2).trim()));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Condition block " + blockName + " compares against non-numeric value '" + matcher.group(2).trim() + "'", e);
    }
  }

  @Override
  public int inputCount(FlattenedBlock block, int connectedPorts) { return 1; }

  @Override
  public List<SignalType> outputTypes(FlattenedBlock block, List<SignalType> inputTypes) {
    SignalType input = inputTypes.isEmpty() ? SignalType.DOUBLE : inputTypes.get(0);
    return List.of(input.withBase("bool"));
  }

  @Override
  public Object prepare(FlattenedBlock block, List<SignalType> inputTypes, Consumer<String> warn) {
    return parse(block.flattenedName(), block.block().getString("condition", "> 0"));
  }

  @Override
  public void emitStep(PlannedBlock block, CEmitter out) {
    Comparison comparison = block.preparedAs(Comparison.class);
    int size = block.outputTypes().get(0).size();
    for (int k = 0; k < size; ++k)
      out.line(out.outputElement(0, k) + " = (" + out.inputElement(0, k) + " " + comparison.operator() + " " + CText.formatDouble(comparison.threshold())
               + ");");
  }

  @Override
  public void simulateStep(PlannedBlock block, SimFrame frame) {
    Comparison comparison = block.preparedAs(Comparison.class);
    double[] result = new double[block.outputTypes().get(0).size()];
    for (int k = 0; k < result.length; ++k)
      result[k] = comparison.test(frame.inputElement(0, k)) ? 1.0 : 0.0;
    frame.setOutput(0, result);
  }
}
