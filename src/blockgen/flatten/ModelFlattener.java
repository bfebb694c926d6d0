package blockgen.flatten;

import blockgen.flatten.EnableScopeResolver.ScopeNode;
import blockgen.frontend.Block;
import blockgen.frontend.BlockType;
import blockgen.frontend.Connection;
import blockgen.frontend.Sheet;
import blockgen.util.CText;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Turns a nest of sheets and subsystems into one flat block and wire list.
 * Every subsystem instance gets its own copy of its internal blocks. Boundary ports and sheet labels are replaced by direct wires.
 * Instances are independent: each call keeps its state in a fresh {@link Run}.
 */
public class ModelFlattener {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final int DEFAULT_MAX_NESTING_DEPTH = 64;

  /** Types that are legitimately left without wires (pure sources and sinks). */
  private static final Set<String> unconnectedAllowed =
      Set.of(BlockType.Source.serialName, BlockType.InputPort.serialName, BlockType.OutputPort.serialName,
             BlockType.SignalDisplay.serialName, BlockType.SignalLogger.serialName);

  private final int maxNestingDepth;
  private final SheetLabelResolver labelResolver = new SheetLabelResolver();

  public ModelFlattener() { this(DEFAULT_MAX_NESTING_DEPTH); }

  public ModelFlattener(int maxNestingDepth) {
    if (maxNestingDepth < 1)
      throw new IllegalArgumentException("maxNestingDepth must be at least 1, got " + maxNestingDepth);
    this.maxNestingDepth = maxNestingDepth;
  }

  public FlatteningResult flatten(List<Sheet> sheets) { return flatten("model", sheets); }

  public FlatteningResult flatten(String modelName, List<Sheet> sheets) { return new Run(modelName).execute(sheets); }

  // Where one end of a scope-local wire ends up after subsystem boundaries are removed.
  private interface Endpoint {}
  private record BlockEnd(String blockId, int port) implements Endpoint {}
  private record BoundaryIn(String portName) implements Endpoint {}
  private record BoundaryOut(String portName) implements Endpoint {}
  private record EnableEnd(String subsystemId) implements Endpoint {}

  /** What a scope exposes at its boundary ports. */
  private static class ScopeResult {
    final Map<String, List<Endpoint>> inputMap = new LinkedHashMap<>();
    final Map<String, Endpoint> outputMap = new LinkedHashMap<>();
  }

  private record Scope(String instancePrefix, String namePrefix, List<String> path, List<String> ancestorIds, ScopeNode node, Block subsystem,
                       int depth) {
    String instanceId(String localId) { return (instancePrefix == null) ? localId : instancePrefix + "/" + localId; }
  }

  private record ChildSubsystem(Block definition, String instanceId, List<String> inputPorts, List<String> outputPorts, ScopeResult result) {}

  private record PendingBlock(Block block, String originalId, String flattenedName, List<String> path) {}

  private static class InfoBuilder {
    final String subsystemId;
    final String subsystemName;
    final boolean hasEnableInput;
    final int depth;
    Connection enableWire = null;
    final List<String> controlledBlockIds = new ArrayList<>();

    InfoBuilder(String subsystemId, String subsystemName, boolean hasEnableInput, int depth) {
      this.subsystemId = subsystemId;
      this.subsystemName = subsystemName;
      this.hasEnableInput = hasEnableInput;
      this.depth = depth;
    }
  }

  private class Run {
    final String modelName;
    final List<String> warnings = new ArrayList<>();
    final List<SheetLabelIssue> labelIssues = new ArrayList<>();
    final List<PendingBlock> pending = new ArrayList<>();
    final List<Connection> connections = new ArrayList<>();
    final Map<String, InfoBuilder> infos = new LinkedHashMap<>();
    final Set<String> usedNames = new HashSet<>();
    final Set<Block> activeSubsystems = Collections.newSetFromMap(new IdentityHashMap<>());
    final ScopeNode rootNode = ScopeNode.root();
    int connectionsRemapped = 0;
    int sheetLabelsResolved = 0;
    int enableScopesCreated = 0;

    Run(String modelName) { this.modelName = modelName; }

    FlatteningResult execute(List<Sheet> sheets) {
      logger.debug("Flattening model '{}' with {} top-level sheet(s)", modelName, sheets.size());
      processScope(sheets, new Scope(null, "", List.of(), List.of(), rootNode, null, 0));

      var scopes = new EnableScopeResolver(maxNestingDepth + 1).resolve(rootNode);
      List<FlattenedBlock> blocks = new ArrayList<>();
      for (PendingBlock entry : pending)
        blocks.add(new FlattenedBlock(entry.block, entry.originalId, entry.flattenedName, entry.path, scopes.blockScopes().get(entry.block.id())));

      List<SubsystemEnableInfo> enableInfo = new ArrayList<>();
      for (InfoBuilder info : infos.values()) {
        enableInfo.add(new SubsystemEnableInfo(info.subsystemId, info.subsystemName, info.hasEnableInput, info.enableWire,
                                               scopes.enabledAncestors().get(info.subsystemId), info.controlledBlockIds, info.depth));
      }

      CheckConnectivity(blocks, enableInfo);

      int maxDepth = blocks.stream().mapToInt(FlattenedBlock::nestingDepth).max().orElse(0);
      maxDepth = Math.max(maxDepth, infos.values().stream().mapToInt(info -> info.depth).max().orElse(0));
      var metadata = new FlattenedModel.Metadata(modelName, infos.size(), blocks.size(), connections.size(), maxDepth);
      var model = new FlattenedModel(blocks, connections, enableInfo, metadata);
      var diagnostics =
          new FlatteningResult.Diagnostics(blocks.size(), connectionsRemapped, infos.size(), sheetLabelsResolved, enableScopesCreated);
      logger.debug("Flattened '{}': {} blocks, {} connections, {} subsystems, {} warning(s)", modelName, blocks.size(), connections.size(),
                   infos.size(), warnings.size());
      return new FlatteningResult(model, warnings, diagnostics, labelIssues);
    }

    void warn(String message) {
      logger.warn(message);
      warnings.add(message);
    }

    ScopeResult processScope(List<Sheet> sheets, Scope scope) {
      List<Block> scopeBlocks = new ArrayList<>();
      List<Connection> scopeConns = new ArrayList<>();
      for (Sheet sheet : sheets) {
        scopeBlocks.addAll(sheet.blocks());
        scopeConns.addAll(sheet.connections());
      }

      var resolution = labelResolver.resolve(scopeBlocks);
      resolution.issues().forEach(issue -> {
        labelIssues.add(issue);
        warn(issue.message());
      });
      sheetLabelsResolved += resolution.matches().size();
      scopeConns = labelResolver.rewire(scopeConns, scopeBlocks, resolution);

      List<String> declaredInputs = (scope.subsystem == null) ? List.of() : scope.subsystem.getStringList("inputPorts");
      List<String> declaredOutputs = (scope.subsystem == null) ? List.of() : scope.subsystem.getStringList("outputPorts");
      Map<String, Block> localBlocks = new HashMap<>();
      Map<String, String> boundaryIn = new HashMap<>();
      Map<String, String> boundaryOut = new HashMap<>();
      Map<String, ChildSubsystem> children = new HashMap<>();

      for (Block block : scopeBlocks) {
        if (block.isOfType(BlockType.SheetLabelSink) || block.isOfType(BlockType.SheetLabelSource))
          continue;
        String instanceId = scope.instanceId(block.id());
        if (block.isSubsystem()) {
          children.put(block.id(), processSubsystem(block, instanceId, scope));
          continue;
        }
        String portName = block.getString("portName", block.name());
        if (block.isOfType(BlockType.InputPort) && declaredInputs.contains(portName)) {
          boundaryIn.put(block.id(), portName);
          continue;
        }
        if (block.isOfType(BlockType.OutputPort) && declaredOutputs.contains(portName)) {
          boundaryOut.put(block.id(), portName);
          continue;
        }
        localBlocks.put(block.id(), block);
        String flattenedName = uniqueName(scope.namePrefix, block.name());
        pending.add(new PendingBlock(new Block(instanceId, block.type(), block.name(), block.parameters()), block.id(), flattenedName, scope.path));
        scope.node.blockIds.add(instanceId);
        for (String ancestorId : scope.ancestorIds)
          infos.get(ancestorId).controlledBlockIds.add(instanceId);
      }

      ScopeResult result = new ScopeResult();
      for (Connection conn : scopeConns) {
        boolean sourceKnown = localBlocks.containsKey(conn.sourceBlockId()) || children.containsKey(conn.sourceBlockId()) ||
                              boundaryIn.containsKey(conn.sourceBlockId());
        boolean targetKnown = localBlocks.containsKey(conn.targetBlockId()) || children.containsKey(conn.targetBlockId()) ||
                              boundaryOut.containsKey(conn.targetBlockId());
        if (!sourceKnown || !targetKnown) {
          logger.debug("Dropping connection {} with an endpoint outside the current scope", conn);
          continue;
        }
        Endpoint source = resolveSource(conn.sourceBlockId(), conn.sourcePortIndex(), scopeConns, children, localBlocks, boundaryIn, scope, 0);
        if (source == null)
          continue;
        List<Endpoint> targets = resolveTargets(conn, children, localBlocks, boundaryOut, scope);
        String connectionType = conn.connectionType();
        if (children.containsKey(conn.sourceBlockId()))
          connectionType = Connection.SUBSYSTEM_OUTPUT;
        else if (children.containsKey(conn.targetBlockId()))
          connectionType = Connection.SUBSYSTEM_INPUT;
        int expansion = 0;
        for (Endpoint target : targets) {
          String connId = scope.instanceId(conn.id()) + ((expansion == 0) ? "" : "_" + expansion);
          if (link(source, target, connId, connectionType, !connectionType.equals(conn.connectionType()), result))
            ++expansion;
        }
      }
      return result;
    }

    ChildSubsystem processSubsystem(Block definition, String instanceId, Scope scope) {
      String flattenedName = uniqueName(scope.namePrefix, definition.name());
      List<String> path = append(scope.path, definition.name());
      boolean hasEnableInput = definition.getBoolean("showEnableInput", false);
      if (hasEnableInput)
        ++enableScopesCreated;
      infos.put(instanceId, new InfoBuilder(instanceId, flattenedName, hasEnableInput, path.size()));
      ScopeNode node = scope.node.addChild(new ScopeNode(instanceId, hasEnableInput));
      Scope childScope = new Scope(instanceId, flattenedName, path, append(scope.ancestorIds, instanceId), node, definition, scope.depth + 1);
      logger.debug("Entering subsystem {} (instance {}, enable input: {})", flattenedName, instanceId, hasEnableInput);

      ScopeResult result;
      if (childScope.depth > maxNestingDepth) {
        warn("Subsystem " + flattenedName + " exceeds the maximum nesting depth of " + maxNestingDepth + "; its contents are skipped");
        result = new ScopeResult();
      } else if (!activeSubsystems.add(definition)) {
        warn("Subsystem " + flattenedName + " contains itself; its contents are skipped");
        result = new ScopeResult();
      } else {
        result = processScope(definition.getSubsystemSheets(), childScope);
        activeSubsystems.remove(definition);
      }
      return new ChildSubsystem(definition, instanceId, definition.getStringList("inputPorts"), definition.getStringList("outputPorts"),
                                result);
    }

    Endpoint resolveSource(String localId, int port, List<Connection> scopeConns, Map<String, ChildSubsystem> children,
                           Map<String, Block> localBlocks, Map<String, String> boundaryIn, Scope scope, int hops) {
      if (boundaryIn.containsKey(localId))
        return new BoundaryIn(boundaryIn.get(localId));
      if (localBlocks.containsKey(localId))
        return new BlockEnd(scope.instanceId(localId), port);
      ChildSubsystem child = children.get(localId);
      if (child == null || port < 0 || port >= child.outputPorts.size())
        return null;
      Endpoint inner = child.result.outputMap.get(child.outputPorts.get(port));
      if (!(inner instanceof BoundaryIn))
        return inner;
      // Output wired straight to an input inside the child: continue with whatever feeds that input here.
      int inputIndex = child.inputPorts.indexOf(((BoundaryIn)inner).portName());
      if (hops > children.size())
        return null;
      for (Connection feeding : scopeConns) {
        if (feeding.targetBlockId().equals(localId) && feeding.targetPortIndex() == inputIndex)
          return resolveSource(feeding.sourceBlockId(), feeding.sourcePortIndex(), scopeConns, children, localBlocks, boundaryIn, scope, hops + 1);
      }
      return null;
    }

    List<Endpoint> resolveTargets(Connection conn, Map<String, ChildSubsystem> children, Map<String, Block> localBlocks,
                                  Map<String, String> boundaryOut, Scope scope) {
      String localId = conn.targetBlockId();
      int port = conn.targetPortIndex();
      if (boundaryOut.containsKey(localId))
        return List.of(new BoundaryOut(boundaryOut.get(localId)));
      if (localBlocks.containsKey(localId)) {
        if (port == Connection.ENABLE_PORT) {
          warn("Connection " + conn.id() + " targets the enable port of " + localBlocks.get(localId).name() + ", which is not a subsystem");
          return List.of();
        }
        return List.of(new BlockEnd(scope.instanceId(localId), port));
      }
      ChildSubsystem child = children.get(localId);
      if (port == Connection.ENABLE_PORT)
        return List.of(new EnableEnd(child.instanceId));
      if (port < 0 || port >= child.inputPorts.size()) {
        warn("Connection " + conn.id() + " targets undeclared input port " + port + " of subsystem " + child.definition.name());
        return List.of();
      }
      return child.result.inputMap.getOrDefault(child.inputPorts.get(port), List.of());
    }

    boolean link(Endpoint source, Endpoint target, String connId, String connectionType, boolean remapped, ScopeResult result) {
      if (target instanceof BoundaryOut) {
        result.outputMap.putIfAbsent(((BoundaryOut)target).portName(), source);
        return false;
      }
      if (source instanceof BoundaryIn) {
        result.inputMap.computeIfAbsent(((BoundaryIn)source).portName(), name -> new ArrayList<>()).add(target);
        return false;
      }
      BlockEnd from = (BlockEnd)source;
      if (target instanceof EnableEnd) {
        InfoBuilder info = infos.get(((EnableEnd)target).subsystemId());
        if (info.enableWire != null) {
          warn("Subsystem " + info.subsystemName + " has more than one enable wire; using " + info.enableWire.id());
          return false;
        }
        info.enableWire = new Connection(connId, from.blockId(), from.port(), info.subsystemId, Connection.ENABLE_PORT, Connection.ENABLE);
        return true;
      }
      BlockEnd to = (BlockEnd)target;
      if (remapped)
        ++connectionsRemapped;
      connections.add(new Connection(connId, from.blockId(), from.port(), to.blockId(), to.port(), connectionType));
      return true;
    }

    String uniqueName(String prefix, String name) {
      String base = prefix.isEmpty() ? CText.sanitizeIdentifier(name) : prefix + "_" + CText.sanitizeIdentifier(name);
      String ret = base;
      for (int suffix = 2; !usedNames.add(ret); ++suffix)
        ret = base + "_" + suffix;
      if (!ret.equals(base))
        warn("Flattened name " + base + " is already taken; using " + ret);
      return ret;
    }

    void CheckConnectivity(List<FlattenedBlock> blocks, List<SubsystemEnableInfo> enableInfo) {
      Set<String> wired = new HashSet<>();
      for (Connection conn : connections) {
        wired.add(conn.sourceBlockId());
        wired.add(conn.targetBlockId());
      }
      enableInfo.stream().flatMap(info -> info.GetEnableWire().stream()).forEach(wire -> wired.add(wire.sourceBlockId()));
      for (FlattenedBlock block : blocks) {
        if (!wired.contains(block.id()) && !unconnectedAllowed.contains(block.type()))
          warn("Block " + block.flattenedName() + " (" + block.type() + ") has no connections");
      }
      for (SubsystemEnableInfo info : enableInfo) {
        if (info.hasEnableInput() && info.enableWire() == null)
          warn("Subsystem " + info.subsystemName() + " has enable input but no enable wire connected");
      }
    }
  }

  private static List<String> append(List<String> list, String entry) {
    return Stream.concat(list.stream(), Stream.of(entry)).toList();
  }
}
