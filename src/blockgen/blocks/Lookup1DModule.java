package blockgen.blocks;

import blockgen.flatten.FlattenedBlock;
import blockgen.util.CText;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Piecewise-linear 1D table. Breakpoints "inputValues" must ascend; "extrapolation" is clamp or extrapolate.
 */
public class Lookup1DModule implements BlockModule {

  record Table(double[] x, double[] y, boolean extrapolate) {}

  @Override
  public int inputCount(FlattenedBlock block, int connectedPorts) { return 1; }

  @Override
  public List<SignalType> outputTypes(FlattenedBlock block, List<SignalType> inputTypes) { return List.of(SignalType.DOUBLE); }

  @Override
  public Object prepare(FlattenedBlock block, List<SignalType> inputTypes, Consumer<String> warn) {
    var params = block.block();
    List<Double> x = params.hasParameter("inputValues") ? params.getDoubleList("inputValues") : List.of(0.0, 1.0);
    List<Double> y = params.hasParameter("outputValues") ? params.getDoubleList("outputValues") : List.of(0.0, 1.0);
    if (x.size() != y.size()) {
      warn.accept("Lookup " + block.flattenedName() + " has " + x.size() + " input values but " + y.size() + " output values; the longer list is truncated");
      int n = Math.min(x.size(), y.size());
      x = x.subList(0, n);
      y = y.subList(0, n);
    }
    if (x.isEmpty())
      warn.accept("Lookup " + block.flattenedName() + " has an empty table; it outputs 0");
    checkAscending(block.flattenedName(), "inputValues", x, warn);
    return new Table(toArray(x), toArray(y), isExtrapolating(params.getString("extrapolation", "clamp")));
  }

  static boolean isExtrapolating(String mode) { return mode.trim().equalsIgnoreCase("extrapolate"); }

  static void checkAscending(String blockName, String key, List<Double> breakpoints, Consumer<String> warn) {
    for (int i = 1; i < breakpoints.size(); ++i) {
      if (breakpoints.get(i) < breakpoints.get(i - 1)) {
        warn.accept("Lookup " + blockName + " has non-ascending " + key + "; interpolation results are undefined");
        return;
      }
    }
  }

  static double[] toArray(List<Double> values) { return values.stream().mapToDouble(Double::doubleValue).toArray(); }

  static List<Double> toList(double[] values) {
    List<Double> ret = new ArrayList<>();
    for (double value : values)
      ret.add(value);
    return ret;
  }

  static void requireHelpers(CEmitter out, boolean twoDimensional) {
    out.requireHelper(Interpolation.segmentHelperKey, Interpolation.segmentHelper());
    if (twoDimensional)
      out.requireHelper(Interpolation.lookup2DHelperKey, Interpolation.lookup2DHelper());
    else
      out.requireHelper(Interpolation.lookup1DHelperKey, Interpolation.lookup1DHelper());
  }

  @Override
  public void emitDefinitions(PlannedBlock block, CEmitter out) {
    Table table = block.preparedAs(Table.class);
    if (table.x().length == 0)
      return;
    requireHelpers(out, false);
    out.line("static const double " + out.uniqueIdentifier("x") + "[" + table.x().length + "] = " + CText.initializer(toList(table.x())) + ";");
    out.line("static const double " + out.uniqueIdentifier("y") + "[" + table.y().length + "] = " + CText.initializer(toList(table.y())) + ";");
  }

  @Override
  public void emitStep(PlannedBlock block, CEmitter out) {
    Table table = block.preparedAs(Table.class);
    if (table.x().length == 0) {
      out.line(out.output(0) + " = 0.0;");
      return;
    }
    out.line(out.output(0) + " = lookup_1d(" + out.uniqueIdentifier("x") + ", " + out.uniqueIdentifier("y") + ", " + table.x().length + ", "
             + out.inputElement(0, 0) + ", " + (table.extrapolate() ? 1 : 0) + ");");
  }

  @Override
  public void simulateStep(PlannedBlock block, SimFrame frame) {
    Table table = block.preparedAs(Table.class);
    frame.setOutput(0, new double[] {Interpolation.lookup1D(table.x(), table.y(), frame.inputElement(0, 0), table.extrapolate())});
  }
}
