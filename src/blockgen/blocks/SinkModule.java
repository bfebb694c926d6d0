package blockgen.blocks;

import blockgen.flatten.FlattenedBlock;
import java.util.List;

/**
 * Signal display and signal logger. They produce no C code; the simulator records their input every step.
 */
public class SinkModule implements BlockModule {

  @Override
  public int inputCount(FlattenedBlock block, int connectedPorts) { return Math.max(connectedPorts, 1); }

  @Override
  public List<SignalType> outputTypes(FlattenedBlock block, List<SignalType> inputTypes) { return List.of(); }

  @Override
  public void emitStep(PlannedBlock block, CEmitter out) {}

  @Override
  public void simulateStep(PlannedBlock block, SimFrame frame) { frame.record(frame.input(0).clone()); }
}
