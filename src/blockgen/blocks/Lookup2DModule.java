package blockgen.blocks;

import blockgen.flatten.FlattenedBlock;
import blockgen.util.CText;
import java.util.List;
import java.util.function.Consumer;

/**
 * Bilinear 2D table: "outputTable" row i belongs to input1Values[i], column j to input2Values[j].
 */
public class Lookup2DModule implements BlockModule {

  record Table(double[] x1, double[] x2, double[] values, boolean extrapolate) {}

  @Override
  public int inputCount(FlattenedBlock block, int connectedPorts) { return 2; }

  @Override
  public List<SignalType> outputTypes(FlattenedBlock block, List<SignalType> inputTypes) { return List.of(SignalType.DOUBLE); }

  @Override
  public Object prepare(FlattenedBlock block, List<SignalType> inputTypes, Consumer<String> warn) {
    var params = block.block();
    List<Double> x1 = params.hasParameter("input1Values") ? params.getDoubleList("input1Values") : List.of(0.0, 1.0);
    List<Double> x2 = params.hasParameter("input2Values") ? params.getDoubleList("input2Values") : List.of(0.0, 1.0);
    List<List<Double>> rows = params.hasParameter("outputTable") ? params.getDoubleMatrix("outputTable") : List.of(List.of(0.0, 0.0), List.of(0.0, 1.0));
    Lookup1DModule.checkAscending(block.flattenedName(), "input1Values", x1, warn);
    Lookup1DModule.checkAscending(block.flattenedName(), "input2Values", x2, warn);
    boolean shapeMismatch = rows.size() != x1.size();
    double[] values = new double[x1.size() * x2.size()];
    for (int i = 0; i < x1.size(); ++i) {
      List<Double> row = (i < rows.size()) ? rows.get(i) : List.of();
      shapeMismatch |= row.size() != x2.size();
      for (int j = 0; j < x2.size(); ++j)
        values[i * x2.size() + j] = (j < row.size()) ? row.get(j) : 0.0;
    }
    if (shapeMismatch)
      warn.accept("Lookup " + block.flattenedName() + " has an output table that is not " + x1.size() + "x" + x2.size() + "; missing entries read as 0");
    if (values.length == 0)
      warn.accept("Lookup " + block.flattenedName() + " has an empty table; it outputs 0");
    return new Table(Lookup1DModule.toArray(x1), Lookup1DModule.toArray(x2), values, Lookup1DModule.isExtrapolating(params.getString("extrapolation", "clamp")));
  }

  @Override
  public void emitDefinitions(PlannedBlock block, CEmitter out) {
    Table table = block.preparedAs(Table.class);
    if (table.values().length == 0)
      return;
    Lookup1DModule.requireHelpers(out, true);
    out.line("static const double " + out.uniqueIdentifier("x1") + "[" + table.x1().length + "] = " + CText.initializer(Lookup1DModule.toList(table.x1())) + ";");
    out.line("static const double " + out.uniqueIdentifier("x2") + "[" + table.x2().length + "] = " + CText.initializer(Lookup1DModule.toList(table.x2())) + ";");
    out.line("static const double " + out.uniqueIdentifier("table") + "[" + table.values().length + "] = "
             + CText.initializer(Lookup1DModule.toList(table.values())) + ";");
  }

  @Override
  public void emitStep(PlannedBlock block, CEmitter out) {
    Table table = block.preparedAs(Table.class);
    if (table.values().length == 0) {
      out.line(out.output(0) + " = 0.0;");
      return;
    }
    out.line(out.output(0) + " = lookup_2d(" + out.uniqueIdentifier("x1") + ", " + table.x1().length + ", " + out.uniqueIdentifier("x2") + ", "
             + table.x2().length + ", " + out.uniqueIdentifier("table") + ", " + out.inputElement(0, 0) + ", " + out.inputElement(1, 0) + ", "
             + (table.extrapolate() ? 1 : 0) + ");");
  }

  @Override
  public void simulateStep(PlannedBlock block, SimFrame frame) {
    Table table = block.preparedAs(Table.class);
    frame.setOutput(0, new double[] {Interpolation.lookup2D(table.x1(), table.x2(), table.values(), frame.inputElement(0, 0), frame.inputElement(1, 0),
                                                            table.extrapolate())});
  }
}
