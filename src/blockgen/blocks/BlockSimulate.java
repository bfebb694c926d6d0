package blockgen.blocks;

/**
 * In-process execution capability of a block module. Must compute the same values as the emitted C.
 */
public interface BlockSimulate {

  void simulateStep(PlannedBlock block, SimFrame frame);

  /**
   * Right-hand side of the block's dynamics; only called for stateful blocks.
   * @param state state vector to evaluate at
   * @param derivative receives d(state)/dt
   */
  default void simulateDerivatives(PlannedBlock block, SimFrame frame, double[] state, double[] derivative) {}
}
