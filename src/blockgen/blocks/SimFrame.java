package blockgen.blocks;

/**
 * Values visible to one block while it is simulated.
 */
public interface SimFrame {

  /** Current value of an input port; zeros sized by the input type when unconnected. */
  double[] input(int port);

  /** Element k of an input; scalars are broadcast. */
  double inputElement(int port, int k);

  void setOutput(int k, double[] values);

  double time();

  /** Current state vector of a stateful block. */
  double[] state();

  /** Value applied to the model input that a top-level input port block reads. */
  double[] externalInput();

  /** Publishes the value of a top-level output port block. */
  void setExternalOutput(double[] values);

  /** Records one sample for sink blocks. */
  void record(double[] values);
}
