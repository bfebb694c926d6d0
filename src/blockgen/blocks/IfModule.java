package blockgen.blocks;

import blockgen.flatten.FlattenedBlock;
import java.util.List;

/**
 * Selects between two signals: inputs are (input1, control, input2) and the output is control ? input2 : input1.
 */
public class IfModule implements BlockModule {

  @Override
  public int inputCount(FlattenedBlock block, int connectedPorts) { return 3; }

  @Override
  public List<SignalType> outputTypes(FlattenedBlock block, List<SignalType> inputTypes) {
    if (inputTypes.size() < 3)
      return List.of(SignalType.DOUBLE);
    return List.of(SignalType.broadcast(List.of(inputTypes.get(0), inputTypes.get(2))));
  }

  @Override
  public void emitStep(PlannedBlock block, CEmitter out) {
    int size = block.outputTypes().get(0).size();
    for (int k = 0; k < size; ++k)
      out.line(out.outputElement(0, k) + " = (" + out.inputElement(1, 0) + ") ? " + out.inputElement(2, k) + " : " + out.inputElement(0, k) + ";");
  }

  @Override
  public void simulateStep(PlannedBlock block, SimFrame frame) {
    double[] result = new double[block.outputTypes().get(0).size()];
    boolean control = frame.inputElement(1, 0) != 0.0;
    for (int k = 0; k < result.length; ++k)
      result[k] = control ? frame.inputElement(2, k) : frame.inputElement(0, k);
    frame.setOutput(0, result);
  }
}
