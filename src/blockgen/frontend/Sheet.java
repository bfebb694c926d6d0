package blockgen.frontend;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Flat container of blocks and wires. Nesting happens only through subsystem blocks.
 */
public record Sheet(String id, String name, List<Block> blocks, List<Connection> connections) {

  public Sheet {
    Objects.requireNonNull(id, "sheet id");
    if (name == null)
      name = id;
    blocks = (blocks == null) ? List.of() : List.copyOf(blocks);
    connections = (connections == null) ? List.of() : List.copyOf(connections);
  }

  public Optional<Block> GetBlock(String blockId) { return blocks.stream().filter(block -> block.id().equals(blockId)).findFirst(); }
}
