package blockgen.blocks;

import blockgen.flatten.FlattenedBlock;
import blockgen.util.CText;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Continuous transfer function num(s)/den(s), coefficients highest power first.
 * Order n = len(den) - 1 after stripping leading zeros. n = 0 is a static gain; otherwise the block is realized in
 * controllable canonical form with state x[n]:
 * dx[i] = x[i+1] for i &lt; n-1, dx[n-1] = u - sum(a[i] * x[i]), y = sum(c[i] * x[i]) + d * u.
 */
public class TransferFunctionModule implements BlockModule {

  /**
   * Normalized realization.
   * @param a denominator coefficients a[i] of s^i, monic leading coefficient removed
   * @param c output coefficients
   * @param d direct feedthrough
   */
  public record StateSpace(int order, double[] a, double[] c, double d) {

    public boolean hasFeedthrough() { return order == 0 || d != 0.0; }
  }

  /**
   * @throws IllegalArgumentException if the denominator is zero or the numerator degree exceeds the denominator degree
   */
  public static StateSpace realize(String blockName, List<Double> numerator, List<Double> denominator) {
    List<Double> den = stripLeadingZeros(denominator);
    List<Double> num = stripLeadingZeros(numerator);
    if (den.isEmpty())
      throw new IllegalArgumentException("Transfer function " + blockName + " has an all-zero denominator");
    if (num.size() > den.size())
      throw new IllegalArgumentException("Transfer function " + blockName + " is improper: numerator degree " + (num.size() - 1)
                                         + " exceeds denominator degree " + (den.size() - 1));
    int n = den.size() - 1;
    double den0 = den.get(0);
    if (n == 0)
      return new StateSpace(0, new double[0], new double[0], num.isEmpty() ? 0.0 : num.get(0) / den0);
    double[] numPadded = new double[n + 1];
    for (int i = 0; i < num.size(); ++i)
      numPadded[n + 1 - num.size() + i] = num.get(i);
    double[] a = new double[n];
    double[] b = new double[n + 1];
    for (int i = 0; i < n; ++i)
      a[i] = den.get(n - i) / den0;
    for (int i = 0; i <= n; ++i)
      b[i] = numPadded[n - i] / den0;
    double d = b[n];
    double[] c = new double[n];
    for (int i = 0; i < n; ++i)
      c[i] = b[i] - a[i] * d;
    return new StateSpace(n, a, c, d);
  }

  private static List<Double> stripLeadingZeros(List<Double> coefficients) {
    int first = 0;
    while (first < coefficients.size() && coefficients.get(first) == 0.0)
      first++;
    return new ArrayList<>(coefficients.subList(first, coefficients.size()));
  }

  private static StateSpace realize(FlattenedBlock block) {
    List<Double> num = block.block().hasParameter("numerator") ? block.block().getDoubleList("numerator") : List.of(1.0);
    List<Double> den = block.block().hasParameter("denominator") ? block.block().getDoubleList("denominator") : List.of(1.0, 1.0);
    return realize(block.flattenedName(), num, den);
  }

  @Override
  public int inputCount(FlattenedBlock block, int connectedPorts) { return 1; }

  @Override
  public List<SignalType> outputTypes(FlattenedBlock block, List<SignalType> inputTypes) { return List.of(SignalType.DOUBLE); }

  @Override
  public int stateOrder(FlattenedBlock block) { return realize(block).order(); }

  @Override
  public boolean hasDirectFeedthrough(FlattenedBlock block) { return realize(block).hasFeedthrough(); }

  @Override
  public Object prepare(FlattenedBlock block, List<SignalType> inputTypes, Consumer<String> warn) {
    if (!inputTypes.isEmpty() && inputTypes.get(0) != null && !inputTypes.get(0).isScalar())
      warn.accept("Transfer function " + block.flattenedName() + " expects a scalar input but receives " + inputTypes.get(0)
                  + "; only element 0 is used");
    return realize(block);
  }

  @Override
  public void emitStep(PlannedBlock block, CEmitter out) {
    StateSpace ss = block.preparedAs(StateSpace.class);
    String u = out.inputElement(0, 0);
    if (ss.order() == 0) {
      out.line(out.output(0) + " = " + CText.formatDouble(ss.d()) + " * " + u + ";");
      return;
    }
    StringBuilder y = new StringBuilder();
    for (int i = 0; i < ss.order(); ++i) {
      if (i > 0)
        y.append(" + ");
      y.append(CText.formatDouble(ss.c()[i])).append(" * ").append(out.state(i));
    }
    if (ss.d() != 0.0)
      y.append(" + ").append(CText.formatDouble(ss.d())).append(" * ").append(u);
    out.line(out.output(0) + " = " + y + ";");
  }

  @Override
  public void emitDerivatives(PlannedBlock block, CEmitter out) {
    StateSpace ss = block.preparedAs(StateSpace.class);
    int n = ss.order();
    for (int i = 0; i < n - 1; ++i)
      out.line(out.derivative(i) + " = " + out.state(i + 1) + ";");
    StringBuilder last = new StringBuilder(out.inputElement(0, 0));
    for (int i = 0; i < n; ++i)
      last.append(" - ").append(CText.formatDouble(ss.a()[i])).append(" * ").append(out.state(i));
    out.line(out.derivative(n - 1) + " = " + last + ";");
  }

  @Override
  public void simulateStep(PlannedBlock block, SimFrame frame) {
    StateSpace ss = block.preparedAs(StateSpace.class);
    double u = frame.inputElement(0, 0);
    if (ss.order() == 0) {
      frame.setOutput(0, new double[] {ss.d() * u});
      return;
    }
    double[] x = frame.state();
    double y = 0.0;
    for (int i = 0; i < ss.order(); ++i)
      y = (i == 0) ? ss.c()[i] * x[i] : y + ss.c()[i] * x[i];
    if (ss.d() != 0.0)
      y += ss.d() * u;
    frame.setOutput(0, new double[] {y});
  }

  @Override
  public void simulateDerivatives(PlannedBlock block, SimFrame frame, double[] state, double[] derivative) {
    StateSpace ss = block.preparedAs(StateSpace.class);
    int n = ss.order();
    for (int i = 0; i < n - 1; ++i)
      derivative[i] = state[i + 1];
    double last = frame.inputElement(0, 0);
    for (int i = 0; i < n; ++i)
      last -= ss.a()[i] * state[i];
    derivative[n - 1] = last;
  }
}
