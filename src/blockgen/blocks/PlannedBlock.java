package blockgen.blocks;

import blockgen.flatten.FlattenedBlock;
import blockgen.frontend.Block;
import blockgen.frontend.BlockType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A flattened block with everything code generation and simulation need: its module, the source of each input port,
 * resolved signal types and the C field names of its outputs.
 *
 * @param inputs one entry per input port, null where the port is unconnected
 * @param prepared module specific data built once per plan (compiled expression, coefficients, tables)
 */
public record PlannedBlock(FlattenedBlock block, BlockType type, BlockModule module, List<InputSource> inputs, List<SignalType> inputTypes,
                           List<SignalType> outputTypes, List<String> outputFields, int stateOrder, Object prepared) {

  /** Output port of another block feeding one input port. */
  public record InputSource(String blockId, int port) {}

  public PlannedBlock {
    inputs = Collections.unmodifiableList(new ArrayList<>(inputs));
    inputTypes = List.copyOf(inputTypes);
    outputTypes = List.copyOf(outputTypes);
    outputFields = List.copyOf(outputFields);
  }

  public String id() { return block.id(); }

  public String flattenedName() { return block.flattenedName(); }

  /** Parameter view of the underlying block. */
  public Block params() { return block.block(); }

  public int inputCount() { return inputs.size(); }

  public boolean isConnected(int port) { return port < inputs.size() && inputs.get(port) != null; }

  public boolean isStateful() { return stateOrder > 0; }

  public <T> T preparedAs(Class<T> clazz) { return clazz.cast(prepared); }
}
