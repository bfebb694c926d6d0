package blockgen.blocks;

/**
 * C emission capability of a block module.
 */
public interface BlockCodegen {

  /** Statements computing the block's outputs inside the step function. */
  void emitStep(PlannedBlock block, CEmitter out);

  /** File-scope definitions such as constant tables; emitted once per block before the functions. */
  default void emitDefinitions(PlannedBlock block, CEmitter out) {}

  /** Statements filling the state derivative inside the derivatives function; only called for stateful blocks. */
  default void emitDerivatives(PlannedBlock block, CEmitter out) {}
}
