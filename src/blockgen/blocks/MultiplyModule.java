package blockgen.blocks;

import blockgen.flatten.FlattenedBlock;
import java.util.List;

/** Element-wise product of all inputs. */
public class MultiplyModule extends ElementWiseModule {

  @Override
  public int inputCount(FlattenedBlock block, int connectedPorts) {
    return Math.max(connectedPorts, block.block().getInt("numInputs", 2));
  }

  @Override
  protected String combineC(PlannedBlock block, List<String> elements) { return String.join(" * ", elements); }

  @Override
  protected double combine(PlannedBlock block, double[] elements) {
    double ret = elements[0];
    for (int port = 1; port < elements.length; ++port)
      ret *= elements[port];
    return ret;
  }
}
