package blockgen.blocks;

import blockgen.flatten.FlattenedBlock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits a vector or matrix row-major into scalar outputs named &lt;block&gt;_0, &lt;block&gt;_1, ...
 */
public class DemuxModule implements BlockModule {

  @Override
  public int inputCount(FlattenedBlock block, int connectedPorts) { return 1; }

  @Override
  public List<SignalType> outputTypes(FlattenedBlock block, List<SignalType> inputTypes) {
    SignalType input = inputTypes.isEmpty() ? SignalType.DOUBLE : inputTypes.get(0);
    return new ArrayList<>(Collections.nCopies(input.size(), SignalType.scalar(input.baseType())));
  }

  @Override
  public String outputSuffix(FlattenedBlock block, int k, int count) { return "_" + k; }

  @Override
  public void emitStep(PlannedBlock block, CEmitter out) {
    for (int k = 0; k < block.outputTypes().size(); ++k)
      out.line(out.output(k) + " = " + out.inputElement(0, k) + ";");
  }

  @Override
  public void simulateStep(PlannedBlock block, SimFrame frame) {
    for (int k = 0; k < block.outputTypes().size(); ++k)
      frame.setOutput(k, new double[] {frame.inputElement(0, k)});
  }
}
