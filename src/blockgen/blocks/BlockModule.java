package blockgen.blocks;

import blockgen.flatten.FlattenedBlock;
import java.util.List;
import java.util.function.Consumer;

/**
 * Behavior of one block type: typing, classification and both execution capabilities.
 */
public interface BlockModule extends BlockCodegen, BlockSimulate {

  /**
   * @param connectedPorts one more than the highest input port index that has a wire
   * @return number of input ports the block has
   */
  default int inputCount(FlattenedBlock block, int connectedPorts) { return connectedPorts; }

  /** Output signal types given the resolved input types; an empty list for pure sinks. */
  List<SignalType> outputTypes(FlattenedBlock block, List<SignalType> inputTypes);

  /** Suffix appended to the flattened name to form the C field of output k. */
  default String outputSuffix(FlattenedBlock block, int k, int count) { return (k == 0) ? "" : "_" + k; }

  /** Length of the continuous state vector; 0 for stateless blocks. */
  default int stateOrder(FlattenedBlock block) { return 0; }

  /** Whether the current outputs depend on the current inputs (constrains execution order). */
  default boolean hasDirectFeedthrough(FlattenedBlock block) { return true; }

  /**
   * Validates parameters once per plan and builds module specific data.
   * @param warn receives recoverable problems
   * @return data available later as {@link PlannedBlock#prepared()}, may be null
   */
  default Object prepare(FlattenedBlock block, List<SignalType> inputTypes, Consumer<String> warn) { return null; }
}
