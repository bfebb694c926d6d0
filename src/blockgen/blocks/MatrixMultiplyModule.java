package blockgen.blocks;

import blockgen.flatten.FlattenedBlock;
import java.util.List;
import java.util.function.Consumer;

/**
 * Product of two signals. Scalars scale the other operand, a vector is a column on the right of a matrix and a row on
 * its left, two vectors of equal length multiply element-wise.
 */
public class MatrixMultiplyModule implements BlockModule {

  /**
   * Both operands as matrices: out[i][j] = sum over p of left[i][p] * right[p][j].
   * Element-wise mode multiplies flat elements directly.
   */
  record Shape(int rows, int inner, int cols, boolean elementWise, boolean compatible) {

    int leftIndex(int i, int p) { return i * inner + p; }

    int rightIndex(int p, int j) { return p * cols + j; }
  }

  private static Shape shape(List<SignalType> inputTypes) {
    SignalType a = inputTypes.size() < 2 ? SignalType.DOUBLE : inputTypes.get(0);
    SignalType b = inputTypes.size() < 2 ? SignalType.DOUBLE : inputTypes.get(1);
    if (a.isScalar() && b.isScalar())
      return new Shape(1, 1, 1, true, true);
    if (a.isScalar() || b.isScalar() || (a.isVector() && b.isVector() && a.size() == b.size()))
      return new Shape(1, 1, Math.max(a.size(), b.size()), true, true);
    if (a.isMatrix() && b.isVector() && a.cols() == b.rows())
      return new Shape(a.rows(), a.cols(), 1, false, true);
    if (a.isVector() && b.isMatrix() && a.rows() == b.rows())
      return new Shape(1, a.rows(), b.cols(), false, true);
    if (a.isMatrix() && b.isMatrix() && a.cols() == b.rows())
      return new Shape(a.rows(), a.cols(), b.cols(), false, true);
    return new Shape(1, 1, 1, true, false);
  }

  @Override
  public int inputCount(FlattenedBlock block, int connectedPorts) { return 2; }

  @Override
  public List<SignalType> outputTypes(FlattenedBlock block, List<SignalType> inputTypes) {
    Shape shape = shape(inputTypes);
    if (!shape.compatible())
      return List.of(SignalType.DOUBLE);
    SignalType a = inputTypes.get(0);
    SignalType b = inputTypes.get(1);
    if (shape.elementWise())
      return List.of(SignalType.broadcast(List.of(a, b)));
    if (a.isMatrix() && b.isVector())
      return List.of(SignalType.vector("double", a.rows()));
    if (a.isVector())
      return List.of(SignalType.vector("double", b.cols()));
    return List.of(SignalType.matrix("double", a.rows(), b.cols()));
  }

  @Override
  public Object prepare(FlattenedBlock block, List<SignalType> inputTypes, Consumer<String> warn) {
    Shape shape = shape(inputTypes);
    if (!shape.compatible())
      warn.accept("Matrix multiply " + block.flattenedName() + " has incompatible operands " + inputTypes.get(0) + " and " + inputTypes.get(1)
                  + "; it outputs 0");
    return shape;
  }

  @Override
  public void emitStep(PlannedBlock block, CEmitter out) {
    Shape shape = block.preparedAs(Shape.class);
    if (!shape.compatible()) {
      out.line(out.output(0) + " = 0.0;");
      return;
    }
    if (shape.elementWise()) {
      for (int k = 0; k < block.outputTypes().get(0).size(); ++k)
        out.line(out.outputElement(0, k) + " = " + out.inputElement(0, k) + " * " + out.inputElement(1, k) + ";");
      return;
    }
    for (int i = 0; i < shape.rows(); ++i) {
      for (int j = 0; j < shape.cols(); ++j) {
        StringBuilder sum = new StringBuilder();
        for (int p = 0; p < shape.inner(); ++p) {
          if (p > 0)
            sum.append(" + ");
          sum.append(out.inputElement(0, shape.leftIndex(i, p))).append(" * ").append(out.inputElement(1, shape.rightIndex(p, j)));
        }
        out.line(out.outputElement(0, i * shape.cols() + j) + " = " + sum + ";");
      }
    }
  }

  @Override
  public void simulateStep(PlannedBlock block, SimFrame frame) {
    Shape shape = block.preparedAs(Shape.class);
    double[] result = new double[block.outputTypes().get(0).size()];
    if (!shape.compatible()) {
      frame.setOutput(0, result);
      return;
    }
    if (shape.elementWise()) {
      for (int k = 0; k < result.length; ++k)
        result[k] = frame.inputElement(0, k) * frame.inputElement(1, k);
      frame.setOutput(0, result);
      return;
    }
    for (int i = 0; i < shape.rows(); ++i) {
      for (int j = 0; j < shape.cols(); ++j) {
        double sum = 0.0;
        for (int p = 0; p < shape.inner(); ++p) {
          double term = frame.inputElement(0, shape.leftIndex(i, p)) * frame.inputElement(1, shape.rightIndex(p, j));
          sum = (p == 0) ? term : sum + term;
        }
        result[i * shape.cols() + j] = sum;
      }
    }
    frame.setOutput(0, result);
  }
}
