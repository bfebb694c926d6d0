package blockgen.blocks;

import blockgen.flatten.FlattenedBlock;
import java.util.List;

/**
 * Packs rows * cols scalar inputs row-major into one signal: a scalar for 1x1, a vector if rows or cols is 1, a matrix otherwise.
 */
public class MuxModule implements BlockModule {

  private static int rows(FlattenedBlock block) { return Math.max(1, block.block().getInt("rows", 2)); }

  private static int cols(FlattenedBlock block) { return Math.max(1, block.block().getInt("cols", 1)); }

  @Override
  public int inputCount(FlattenedBlock block, int connectedPorts) { return rows(block) * cols(block); }

  @Override
  public List<SignalType> outputTypes(FlattenedBlock block, List<SignalType> inputTypes) {
    int rows = rows(block);
    int cols = cols(block);
    String base = block.block().getString("outputType", "double");
    if (rows == 1 && cols == 1)
      return List.of(SignalType.scalar(base));
    if (rows == 1 || cols == 1)
      return List.of(SignalType.vector(base, rows * cols));
    return List.of(SignalType.matrix(base, rows, cols));
  }

  @Override
  public void emitStep(PlannedBlock block, CEmitter out) {
    for (int k = 0; k < block.inputCount(); ++k)
      out.line(out.outputElement(0, k) + " = " + out.inputElement(k, 0) + ";");
  }

  @Override
  public void simulateStep(PlannedBlock block, SimFrame frame) {
    double[] result = new double[block.inputCount()];
    for (int k = 0; k < result.length; ++k)
      result[k] = frame.inputElement(k, 0);
    frame.setOutput(0, result);
  }
}
