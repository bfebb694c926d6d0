package blockgen.blocks;

import blockgen.flatten.FlattenedBlock;
import blockgen.util.CText;
import java.util.List;

/** Multiplies its input by the "gain" parameter. */
public class ScaleModule extends ElementWiseModule {

  @Override
  public int inputCount(FlattenedBlock block, int connectedPorts) { return 1; }

  private static double gain(PlannedBlock block) { return block.params().getDouble("gain", 1.0); }

  @Override
  protected String combineC(PlannedBlock block, List<String> elements) { return CText.formatDouble(gain(block)) + " * " + elements.get(0); }

  @Override
  protected double combine(PlannedBlock block, double[] elements) { return gain(block) * elements[0]; }
}
