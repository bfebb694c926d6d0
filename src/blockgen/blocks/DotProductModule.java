package blockgen.blocks;

import blockgen.flatten.FlattenedBlock;
import java.util.List;
import java.util.function.Consumer;

public class DotProductModule implements BlockModule {

  @Override
  public int inputCount(FlattenedBlock block, int connectedPorts) { return 2; }

  @Override
  public List<SignalType> outputTypes(FlattenedBlock block, List<SignalType> inputTypes) { return List.of(SignalType.DOUBLE); }

  @Override
  public Object prepare(FlattenedBlock block, List<SignalType> inputTypes, Consumer<String> warn) {
    if (inputTypes.size() == 2 && inputTypes.get(0).size() != inputTypes.get(1).size())
      warn.accept("Dot product " + block.flattenedName() + " has inputs of different length " + inputTypes.get(0) + " and " + inputTypes.get(1));
    return null;
  }

  private static int length(PlannedBlock block) { return Math.max(block.inputTypes().get(0).size(), block.inputTypes().get(1).size()); }

  @Override
  public void emitStep(PlannedBlock block, CEmitter out) {
    StringBuilder sum = new StringBuilder();
    for (int k = 0; k < length(block); ++k) {
      if (k > 0)
        sum.append(" + ");
      sum.append(out.inputElement(0, k)).append(" * ").append(out.inputElement(1, k));
    }
    out.line(out.output(0) + " = " + sum + ";");
  }

  @Override
  public void simulateStep(PlannedBlock block, SimFrame frame) {
    double sum = 0.0;
    for (int k = 0; k < length(block); ++k)
      sum = (k == 0) ? frame.inputElement(0, k) * frame.inputElement(1, k) : sum + frame.inputElement(0, k) * frame.inputElement(1, k);
    frame.setOutput(0, new double[] {sum});
  }
}
