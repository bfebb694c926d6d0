package blockgen.blocks;

import blockgen.flatten.FlattenedBlock;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Consumer;

/**
 * Element-wise trigonometric function. "atan2" takes (y, x); "sincos" produces sin on its first and cos on its second output.
 */
public class TrigModule implements BlockModule {
  private static final Set<String> functions = Set.of("sin", "cos", "tan", "asin", "acos", "atan", "atan2", "sincos");

  private static String function(FlattenedBlock block) { return block.block().getString("function", "sin").trim().toLowerCase(); }

  @Override
  public int inputCount(FlattenedBlock block, int connectedPorts) { return function(block).equals("atan2") ? 2 : 1; }

  @Override
  public List<SignalType> outputTypes(FlattenedBlock block, List<SignalType> inputTypes) {
    SignalType shape = SignalType.broadcast(inputTypes);
    return function(block).equals("sincos") ? List.of(shape, shape) : List.of(shape);
  }

  @Override
  public String outputSuffix(FlattenedBlock block, int k, int count) { return (k == 1 && function(block).equals("sincos")) ? "_cos" : ""; }

  /**
   * @throws IllegalArgumentException for an unknown function name
   */
  @Override
  public Object prepare(FlattenedBlock block, List<SignalType> inputTypes, Consumer<String> warn) {
    String function = function(block);
    if (!functions.contains(function))
      throw new IllegalArgumentException("Trig block " + block.flattenedName() + " has unknown function '" + function + "'. Supported: "
                                         + String.join(", ", new TreeSet<>(functions)));
    return function;
  }

  @Override
  public void emitStep(PlannedBlock block, CEmitter out) {
    String function = block.preparedAs(String.class);
    int size = block.outputTypes().get(0).size();
    for (int k = 0; k < size; ++k) {
      String u = out.inputElement(0, k);
      switch (function) {
      case "sincos":
        out.line(out.outputElement(0, k) + " = sin(" + u + ");");
        out.line(out.outputElement(1, k) + " = cos(" + u + ");");
        break;
      case "atan2":
        out.line(out.outputElement(0, k) + " = atan2(" + u + ", " + out.inputElement(1, k) + ");");
        break;
      default:
        out.line(out.outputElement(0, k) + " = " + function + "(" + u + ");");
        break;
      }
    }
  }

  private static double apply(String function, double u) {
    switch (function) {
    case "sin":
      return Math.sin(u);
    case "cos":
      return Math.cos(u);
    case "tan":
      return Math.tan(u);
    case "asin":
      return Math.asin(u);
    case "acos":
      return Math.acos(u);
    default:
      return Math.atan(u);
    }
  }

  @Override
  public void simulateStep(PlannedBlock block, SimFrame frame) {
    String function = block.preparedAs(String.class);
    int size = block.outputTypes().get(0).size();
    double[] first = new double[size];
    double[] second = new double[size];
    for (int k = 0; k < size; ++k) {
      double u = frame.inputElement(0, k);
      switch (function) {
      case "sincos":
        first[k] = Math.sin(u);
        second[k] = Math.cos(u);
        break;
      case "atan2":
        first[k] = Math.atan2(u, frame.inputElement(1, k));
        break;
      default:
        first[k] = apply(function, u);
        break;
      }
    }
    frame.setOutput(0, first);
    if (function.equals("sincos"))
      frame.setOutput(1, second);
  }
}
