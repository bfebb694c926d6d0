package blockgen.blocks;

import blockgen.flatten.FlattenedBlock;
import java.util.List;
import java.util.function.Consumer;

/** Cross product of two 3-vectors. */
public class CrossProductModule implements BlockModule {

  @Override
  public int inputCount(FlattenedBlock block, int connectedPorts) { return 2; }

  @Override
  public List<SignalType> outputTypes(FlattenedBlock block, List<SignalType> inputTypes) { return List.of(SignalType.vector("double", 3)); }

  @Override
  public Object prepare(FlattenedBlock block, List<SignalType> inputTypes, Consumer<String> warn) {
    for (SignalType type : inputTypes) {
      if (!type.isVector() || type.size() != 3) {
        warn.accept("Cross product " + block.flattenedName() + " expects 3-element vectors but receives " + type);
        break;
      }
    }
    return null;
  }

  @Override
  public void emitStep(PlannedBlock block, CEmitter out) {
    for (int k = 0; k < 3; ++k) {
      int i = (k + 1) % 3;
      int j = (k + 2) % 3;
      out.line(out.outputElement(0, k) + " = " + out.inputElement(0, i) + " * " + out.inputElement(1, j) + " - " + out.inputElement(0, j) + " * "
               + out.inputElement(1, i) + ";");
    }
  }

  @Override
  public void simulateStep(PlannedBlock block, SimFrame frame) {
    double[] result = new double[3];
    for (int k = 0; k < 3; ++k) {
      int i = (k + 1) % 3;
      int j = (k + 2) % 3;
      result[k] = frame.inputElement(0, i) * frame.inputElement(1, j) - frame.inputElement(0, j) * frame.inputElement(1, i);
    }
    frame.setOutput(0, result);
  }
}
