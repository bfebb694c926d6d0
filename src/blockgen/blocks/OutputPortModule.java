package blockgen.blocks;

import blockgen.flatten.FlattenedBlock;
import java.util.List;

public class OutputPortModule extends PortModule {

  @Override
  public int inputCount(FlattenedBlock block, int connectedPorts) { return 1; }

  @Override
  public SignalType externalType(FlattenedBlock block, List<SignalType> inputTypes) {
    SignalType declared = declaredType(block);
    if (declared != null)
      return declared;
    return (inputTypes.isEmpty() || inputTypes.get(0) == null) ? SignalType.DOUBLE : inputTypes.get(0);
  }

  @Override
  public List<SignalType> outputTypes(FlattenedBlock block, List<SignalType> inputTypes) { return List.of(); }

  @Override
  public void emitStep(PlannedBlock block, CEmitter out) {
    if (!isExternal(block.block()))
      return;
    SignalType type = externalType(block.block(), block.inputTypes());
    for (int k = 0; k < type.size(); ++k)
      out.line(out.externalPort() + type.elementSuffix(k) + " = " + out.inputElement(0, k) + ";");
  }

  @Override
  public void simulateStep(PlannedBlock block, SimFrame frame) {
    if (!isExternal(block.block()))
      return;
    SignalType type = externalType(block.block(), block.inputTypes());
    double[] value = new double[type.size()];
    for (int k = 0; k < value.length; ++k)
      value[k] = frame.inputElement(0, k);
    frame.setExternalOutput(value);
  }
}
