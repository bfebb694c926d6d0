package blockgen.blocks;

import blockgen.flatten.FlattenedBlock;
import java.util.List;

public class InputPortModule extends PortModule {

  @Override
  public int inputCount(FlattenedBlock block, int connectedPorts) { return 0; }

  @Override
  public SignalType externalType(FlattenedBlock block, List<SignalType> inputTypes) {
    SignalType declared = declaredType(block);
    return (declared == null) ? SignalType.DOUBLE : declared;
  }

  @Override
  public List<SignalType> outputTypes(FlattenedBlock block, List<SignalType> inputTypes) { return List.of(externalType(block, inputTypes)); }

  @Override
  public void emitStep(PlannedBlock block, CEmitter out) {
    SignalType type = block.outputTypes().get(0);
    for (int k = 0; k < type.size(); ++k) {
      String value = isExternal(block.block()) ? out.externalPort() + type.elementSuffix(k) : "0";
      out.line(out.outputElement(0, k) + " = " + value + ";");
    }
  }

  @Override
  public void simulateStep(PlannedBlock block, SimFrame frame) {
    double[] value = new double[block.outputTypes().get(0).size()];
    if (isExternal(block.block())) {
      double[] applied = frame.externalInput();
      System.arraycopy(applied, 0, value, 0, Math.min(applied.length, value.length));
    }
    frame.setOutput(0, value);
  }
}
