package blockgen.flatten;

import blockgen.frontend.Connection;
import java.util.List;
import java.util.Optional;

/**
 * Flat intermediate representation: no subsystems, no sheet labels, globally unique names.
 */
public record FlattenedModel(List<FlattenedBlock> blocks, List<Connection> connections, List<SubsystemEnableInfo> subsystemEnableInfo,
                             Metadata metadata) {

  public record Metadata(String modelName, int subsystemCount, int totalBlocks, int totalConnections, int maxNestingDepth) {}

  public FlattenedModel {
    blocks = List.copyOf(blocks);
    connections = List.copyOf(connections);
    subsystemEnableInfo = List.copyOf(subsystemEnableInfo);
  }

  public Optional<FlattenedBlock> GetBlock(String id) { return blocks.stream().filter(block -> block.id().equals(id)).findFirst(); }

  public Optional<FlattenedBlock> GetBlockByName(String flattenedName) {
    return blocks.stream().filter(block -> block.flattenedName().equals(flattenedName)).findFirst();
  }

  public Optional<SubsystemEnableInfo> GetEnableInfo(String subsystemId) {
    return subsystemEnableInfo.stream().filter(info -> info.subsystemId().equals(subsystemId)).findFirst();
  }

  public Optional<SubsystemEnableInfo> GetEnableInfoByName(String subsystemName) {
    return subsystemEnableInfo.stream().filter(info -> info.subsystemName().equals(subsystemName)).findFirst();
  }
}
