package blockgen.flatten;

import blockgen.flatten.SheetLabelIssue.IssueType;
import blockgen.frontend.Block;
import blockgen.frontend.BlockType;
import blockgen.frontend.Connection;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Matches sheet label sinks with sources of the same signal name within one scope
 * and replaces both by direct wires.
 */
public class SheetLabelResolver {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** A source block reading the signal that a sink block publishes. */
  public record Match(Block source, Block sink, String signalName) {}

  public record Resolution(List<Match> matches, List<SheetLabelIssue> issues) {
    public Resolution {
      matches = List.copyOf(matches);
      issues = List.copyOf(issues);
    }
  }

  /**
   * Matches all sheet label blocks of one scope. The first sink declared for a name wins.
   * @param scopeBlocks blocks of every sheet of the scope, in declaration order
   */
  public Resolution resolve(List<Block> scopeBlocks) {
    List<SheetLabelIssue> issues = new ArrayList<>();
    Map<String, Block> sinksByName = new LinkedHashMap<>();
    for (Block block : scopeBlocks) {
      if (!block.isOfType(BlockType.SheetLabelSink))
        continue;
      String signalName = block.getString("signalName", "");
      if (signalName.isEmpty()) {
        issues.add(new SheetLabelIssue(IssueType.EmptySignalName, block.id(), block.name(), signalName,
                                       "Sheet Label Sink \"" + block.name() + "\" has no signal name configured"));
        continue;
      }
      if (sinksByName.containsKey(signalName)) {
        issues.add(new SheetLabelIssue(IssueType.DuplicateSink, block.id(), block.name(), signalName,
                                       "Multiple Sheet Label Sinks use signal name \"" + signalName + "\""));
        continue;
      }
      sinksByName.put(signalName, block);
    }

    List<Match> matches = new ArrayList<>();
    for (Block block : scopeBlocks) {
      if (!block.isOfType(BlockType.SheetLabelSource))
        continue;
      String signalName = block.getString("signalName", "");
      if (signalName.isEmpty()) {
        issues.add(new SheetLabelIssue(IssueType.EmptySignalName, block.id(), block.name(), signalName,
                                       "Sheet Label Source \"" + block.name() + "\" has no signal name configured"));
        continue;
      }
      Block sink = sinksByName.get(signalName);
      if (sink == null) {
        issues.add(new SheetLabelIssue(IssueType.UnmatchedSource, block.id(), block.name(), signalName,
                                       "Sheet Label Source \"" + block.name() + "\" references non-existent signal \"" + signalName + "\""));
        continue;
      }
      logger.debug("Sheet label '{}': {} -> {}", signalName, sink.name(), block.name());
      matches.add(new Match(block, sink, signalName));
    }
    return new Resolution(matches, issues);
  }

  /**
   * Removes every connection touching a sheet label block and adds, for each matched pair, one wire per combination of a
   * segment into the sink and a segment out of the source. The joined wire takes its connection type from the upstream segment.
   * @param connections wires of the scope, in declaration order
   * @param scopeBlocks blocks of the scope
   * @param resolution result of {@link #resolve(List)} for the same blocks
   */
  public List<Connection> rewire(List<Connection> connections, List<Block> scopeBlocks, Resolution resolution) {
    Set<String> labelIds = new HashSet<>();
    for (Block block : scopeBlocks) {
      if (block.isOfType(BlockType.SheetLabelSink) || block.isOfType(BlockType.SheetLabelSource))
        labelIds.add(block.id());
    }
    Map<String, String> sinkBySourceId = new HashMap<>();
    for (Match match : resolution.matches())
      sinkBySourceId.put(match.source().id(), match.sink().id());

    List<Connection> ret = new ArrayList<>();
    for (Connection conn : connections) {
      if (!labelIds.contains(conn.sourceBlockId()) && !labelIds.contains(conn.targetBlockId())) {
        ret.add(conn);
        continue;
      }
      if (labelIds.contains(conn.targetBlockId()))
        continue; // segment into a sink, joined when its downstream segment is visited
      String sinkId = sinkBySourceId.get(conn.sourceBlockId());
      if (sinkId == null)
        continue;
      for (Connection upstream : upstreamOf(sinkId, connections, labelIds, sinkBySourceId, new HashSet<>())) {
        ret.add(new Connection(upstream.id() + "+" + conn.id(), upstream.sourceBlockId(), upstream.sourcePortIndex(), conn.targetBlockId(),
                               conn.targetPortIndex(), upstream.connectionType()));
      }
    }
    return ret;
  }

  /** Segments carrying the true upstream value into a sink, following label-to-label chains. */
  private List<Connection> upstreamOf(String sinkId, List<Connection> connections, Set<String> labelIds, Map<String, String> sinkBySourceId,
                                      Set<String> visitedSinks) {
    List<Connection> ret = new ArrayList<>();
    if (!visitedSinks.add(sinkId))
      return ret;
    for (Connection conn : connections) {
      if (!conn.targetBlockId().equals(sinkId))
        continue;
      if (!labelIds.contains(conn.sourceBlockId())) {
        ret.add(conn);
        continue;
      }
      String chainedSink = sinkBySourceId.get(conn.sourceBlockId());
      if (chainedSink != null)
        ret.addAll(upstreamOf(chainedSink, connections, labelIds, sinkBySourceId, visitedSinks));
    }
    return ret;
  }
}
