package blockgen.blocks;

import blockgen.flatten.FlattenedBlock;
import java.util.List;

/** Matrix transpose; a vector of length n becomes an n x 1 matrix, a scalar passes through. */
public class TransposeModule implements BlockModule {

  @Override
  public int inputCount(FlattenedBlock block, int connectedPorts) { return 1; }

  @Override
  public List<SignalType> outputTypes(FlattenedBlock block, List<SignalType> inputTypes) {
    SignalType input = inputTypes.isEmpty() ? SignalType.DOUBLE : inputTypes.get(0);
    if (input.isMatrix())
      return List.of(SignalType.matrix(input.baseType(), input.cols(), input.rows()));
    if (input.isVector())
      return List.of(SignalType.matrix(input.baseType(), input.rows(), 1));
    return List.of(input);
  }

  /** Flat input index feeding flat output element k. */
  private static int sourceIndex(PlannedBlock block, int k) {
    SignalType input = block.inputTypes().get(0);
    if (!input.isMatrix())
      return k;
    int outCols = input.rows();
    int row = k / outCols;
    int col = k % outCols;
    return col * input.cols() + row;
  }

  @Override
  public void emitStep(PlannedBlock block, CEmitter out) {
    for (int k = 0; k < block.outputTypes().get(0).size(); ++k)
      out.line(out.outputElement(0, k) + " = " + out.inputElement(0, sourceIndex(block, k)) + ";");
  }

  @Override
  public void simulateStep(PlannedBlock block, SimFrame frame) {
    double[] result = new double[block.outputTypes().get(0).size()];
    for (int k = 0; k < result.length; ++k)
      result[k] = frame.inputElement(0, sourceIndex(block, k));
    frame.setOutput(0, result);
  }
}
