package blockgen.flatten;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Assigns each leaf block the nearest enclosing subsystem that declares its own enable input.
 * Subsystems without an enable input pass the current enabling ancestor through unchanged.
 */
public class EnableScopeResolver {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /**
   * Node of the subsystem nesting tree. The root stands for the top level and has a null id.
   */
  public static class ScopeNode {
    public final String id;
    public final boolean hasEnableInput;
    public final List<String> blockIds = new ArrayList<>();
    public final List<ScopeNode> children = new ArrayList<>();

    public ScopeNode(String id, boolean hasEnableInput) {
      this.id = id;
      this.hasEnableInput = hasEnableInput;
    }

    public static ScopeNode root() { return new ScopeNode(null, false); }

    public ScopeNode addChild(ScopeNode child) {
      children.add(child);
      return child;
    }
  }

  /**
   * @param blockScopes block id to the id of its enabling subsystem; blocks without one are absent
   * @param enabledAncestors subsystem id to the nearest strictly enclosing subsystem with an enable input; absent if none
   * @param truncated set if the walk hit the depth bound or a node already on the current path
   */
  public record Result(Map<String, String> blockScopes, Map<String, String> enabledAncestors, boolean truncated) {}

  private final int maxDepth;

  public EnableScopeResolver(int maxDepth) { this.maxDepth = maxDepth; }

  public Result resolve(ScopeNode root) {
    Map<String, String> blockScopes = new HashMap<>();
    Map<String, String> enabledAncestors = new HashMap<>();
    Set<ScopeNode> onPath = Collections.newSetFromMap(new IdentityHashMap<>());
    boolean truncated = walk(root, null, 0, onPath, blockScopes, enabledAncestors);
    if (truncated)
      logger.warn("Subsystem nesting is cyclic or deeper than {}; enable scopes beyond that point are not assigned", maxDepth);
    return new Result(blockScopes, enabledAncestors, truncated);
  }

  private boolean walk(ScopeNode node, String enablingAncestor, int depth, Set<ScopeNode> onPath, Map<String, String> blockScopes,
                       Map<String, String> enabledAncestors) {
    if (depth > maxDepth || !onPath.add(node))
      return true;
    if (node.id != null && enablingAncestor != null)
      enabledAncestors.put(node.id, enablingAncestor);
    String current = (node.id != null && node.hasEnableInput) ? node.id : enablingAncestor;
    if (current != null) {
      for (String blockId : node.blockIds)
        blockScopes.put(blockId, current);
    }
    boolean truncated = false;
    for (ScopeNode child : node.children)
      truncated |= walk(child, current, depth + 1, onPath, blockScopes, enabledAncestors);
    onPath.remove(node);
    return truncated;
  }
}
