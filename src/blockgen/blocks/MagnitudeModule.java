package blockgen.blocks;

import blockgen.flatten.FlattenedBlock;
import java.util.List;

/** Euclidean norm of a vector or matrix (Frobenius); absolute value of a scalar. */
public class MagnitudeModule implements BlockModule {

  @Override
  public int inputCount(FlattenedBlock block, int connectedPorts) { return 1; }

  @Override
  public List<SignalType> outputTypes(FlattenedBlock block, List<SignalType> inputTypes) { return List.of(SignalType.DOUBLE); }

  @Override
  public void emitStep(PlannedBlock block, CEmitter out) {
    StringBuilder sum = new StringBuilder();
    for (int k = 0; k < block.inputTypes().get(0).size(); ++k) {
      if (k > 0)
        sum.append(" + ");
      String u = out.inputElement(0, k);
      sum.append(u).append(" * ").append(u);
    }
    out.line(out.output(0) + " = sqrt(" + sum + ");");
  }

  @Override
  public void simulateStep(PlannedBlock block, SimFrame frame) {
    double sum = 0.0;
    for (int k = 0; k < block.inputTypes().get(0).size(); ++k) {
      double u = frame.inputElement(0, k);
      sum = (k == 0) ? u * u : sum + u * u;
    }
    frame.setOutput(0, new double[] {Math.sqrt(sum)});
  }
}
