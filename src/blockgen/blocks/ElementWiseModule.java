package blockgen.blocks;

import blockgen.flatten.FlattenedBlock;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Base of blocks that combine their inputs element by element into one output.
 * Scalar inputs are broadcast over the shape of the first non-scalar input; loops are unrolled.
 */
public abstract class ElementWiseModule implements BlockModule {

  @Override
  public List<SignalType> outputTypes(FlattenedBlock block, List<SignalType> inputTypes) {
    return List.of(SignalType.broadcast(inputTypes));
  }

  @Override
  public Object prepare(FlattenedBlock block, List<SignalType> inputTypes, Consumer<String> warn) {
    SignalType shape = SignalType.broadcast(inputTypes);
    for (SignalType type : inputTypes) {
      if (type != null && !type.isScalar() && type.size() != shape.size())
        warn.accept("Block " + block.flattenedName() + " (" + block.type() + ") combines inputs of different shapes " + shape + " and " + type
                    + "; missing elements read as 0");
    }
    return null;
  }

  /** C expression combining one element of every input. */
  protected abstract String combineC(PlannedBlock block, List<String> elements);

  /** Java twin of {@link #combineC}. */
  protected abstract double combine(PlannedBlock block, double[] elements);

  @Override
  public void emitStep(PlannedBlock block, CEmitter out) {
    int size = block.outputTypes().get(0).size();
    for (int k = 0; k < size; ++k) {
      List<String> elements = new ArrayList<>();
      for (int port = 0; port < block.inputCount(); ++port)
        elements.add(out.inputElement(port, k));
      out.line(out.outputElement(0, k) + " = " + combineC(block, elements) + ";");
    }
  }

  @Override
  public void simulateStep(PlannedBlock block, SimFrame frame) {
    double[] result = new double[block.outputTypes().get(0).size()];
    double[] elements = new double[block.inputCount()];
    for (int k = 0; k < result.length; ++k) {
      for (int port = 0; port < elements.length; ++port)
        elements[port] = frame.inputElement(port, k);
      result[k] = combine(block, elements);
    }
    frame.setOutput(0, result);
  }
}
