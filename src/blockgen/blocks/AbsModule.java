package blockgen.blocks;

import blockgen.flatten.FlattenedBlock;
import java.util.List;

public class AbsModule extends ElementWiseModule {

  @Override
  public int inputCount(FlattenedBlock block, int connectedPorts) { return 1; }

  @Override
  protected String combineC(PlannedBlock block, List<String> elements) { return "fabs(" + elements.get(0) + ")"; }

  @Override
  protected double combine(PlannedBlock block, double[] elements) { return Math.abs(elements[0]); }
}
