package blockgen.flatten;

import blockgen.frontend.Block;
import java.util.List;
import java.util.Optional;

/**
 * A block copied out of its subsystem instance.
 * The wrapped block carries the instance id, which is the original id at top level and
 * "&lt;enclosing instance id&gt;/&lt;original id&gt;" inside subsystems.
 *
 * @param flattenedName unique C-compatible name, underscore-joined ancestor path plus block name
 * @param subsystemPath names of the enclosing subsystems, outermost first
 * @param enableScope instance id of the nearest enclosing subsystem with its own enable input, or null
 */
public record FlattenedBlock(Block block, String originalId, String flattenedName, List<String> subsystemPath, String enableScope) {

  public FlattenedBlock {
    subsystemPath = List.copyOf(subsystemPath);
  }

  public String id() { return block.id(); }

  public String type() { return block.type(); }

  public String name() { return block.name(); }

  public Optional<String> GetEnableScope() { return Optional.ofNullable(enableScope); }

  public int nestingDepth() { return subsystemPath.size(); }

  @Override
  public String toString() {
    return flattenedName + " (" + block.type() + ")";
  }
}
