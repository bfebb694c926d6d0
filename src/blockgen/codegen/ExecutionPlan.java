package blockgen.codegen;

import blockgen.blocks.BlockModule;
import blockgen.blocks.BlockModuleRegistry;
import blockgen.blocks.PlannedBlock;
import blockgen.blocks.PlannedBlock.InputSource;
import blockgen.blocks.PortModule;
import blockgen.blocks.SignalType;
import blockgen.flatten.FlattenedBlock;
import blockgen.flatten.FlattenedModel;
import blockgen.flatten.SubsystemEnableInfo;
import blockgen.frontend.BlockType;
import blockgen.frontend.Connection;
import blockgen.util.CText;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Everything the C generator and the simulator share about a flat model: execution order, signal types, C field names,
 * external ports and enable evaluation order.
 */
public class ExecutionPlan {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Field of the model inputs or outputs struct. */
  public record ExternalPort(String blockId, String fieldName, SignalType type, boolean isInput) {}

  private final FlattenedModel model;
  private final String modelName;
  private final List<PlannedBlock> blocks = new ArrayList<>();
  private final Map<String, PlannedBlock> blocksById = new HashMap<>();
  private final List<ExternalPort> inputPorts = new ArrayList<>();
  private final List<ExternalPort> outputPorts = new ArrayList<>();
  private final Map<String, ExternalPort> portsByBlock = new HashMap<>();
  private final List<SubsystemEnableInfo> enableOrder = new ArrayList<>();
  private final Map<String, String> enableFlags = new HashMap<>();
  private final Map<String, InputSource> enableSources = new HashMap<>();
  private final List<String> warnings = new ArrayList<>();

  private ExecutionPlan(FlattenedModel model) {
    this.model = model;
    this.modelName = CText.sanitizeIdentifier(model.metadata().modelName());
  }

  /**
   * @throws blockgen.blocks.UnsupportedBlockTypeException if a block has no module
   */
  public static ExecutionPlan Build(FlattenedModel model) {
    ExecutionPlan plan = new ExecutionPlan(model);
    plan.build();
    return plan;
  }

  private void warn(String message) {
    logger.warn(message);
    warnings.add(message);
  }

  private void build() {
    List<FlattenedBlock> declared = model.blocks();
    Map<String, BlockModule> modules = new HashMap<>();
    Map<String, Integer> declarationIndex = new HashMap<>();
    for (int i = 0; i < declared.size(); ++i) {
      FlattenedBlock block = declared.get(i);
      modules.put(block.id(), BlockModuleRegistry.ResolveModule(block));
      declarationIndex.put(block.id(), i);
    }

    // Wiring per target port
    Map<String, TreeMap<Integer, InputSource>> wiring = new HashMap<>();
    for (Connection conn : model.connections()) {
      if (conn.isEnableWire() || conn.targetPortIndex() < 0)
        continue;
      if (!modules.containsKey(conn.sourceBlockId()) || !modules.containsKey(conn.targetBlockId())) {
        warn("Connection " + conn.id() + " references a block that is not part of the flattened model; it is ignored");
        continue;
      }
      var ports = wiring.computeIfAbsent(conn.targetBlockId(), key -> new TreeMap<>());
      if (ports.containsKey(conn.targetPortIndex())) {
        warn("Input " + conn.targetPortIndex() + " of block " + flattenedName(conn.targetBlockId()) + " has more than one connection; using the first");
        continue;
      }
      ports.put(conn.targetPortIndex(), new InputSource(conn.sourceBlockId(), conn.sourcePortIndex()));
    }

    Map<String, List<InputSource>> inputs = new HashMap<>();
    for (FlattenedBlock block : declared) {
      var ports = wiring.getOrDefault(block.id(), new TreeMap<>());
      int connectedPorts = ports.isEmpty() ? 0 : ports.lastKey() + 1;
      int count = modules.get(block.id()).inputCount(block, connectedPorts);
      List<InputSource> sources = new ArrayList<>(Collections.nCopies(count, (InputSource)null));
      for (var entry : ports.entrySet()) {
        if (entry.getKey() < count)
          sources.set(entry.getKey(), entry.getValue());
        else
          warn("Block " + block.flattenedName() + " (" + block.type() + ") has " + count + " input(s); the connection to input " + entry.getKey()
               + " is ignored");
      }
      inputs.put(block.id(), sources);
    }

    List<FlattenedBlock> order = schedule(declared, modules, inputs, declarationIndex);

    // Forward references (into blocks without feedthrough) are typed in a second pass
    Map<String, List<SignalType>> outputTypes = new HashMap<>();
    for (int pass = 0; pass < 2; ++pass) {
      for (FlattenedBlock block : order)
        outputTypes.put(block.id(), modules.get(block.id()).outputTypes(block, inputTypes(inputs.get(block.id()), outputTypes)));
    }

    Set<String> usedFields = new HashSet<>();
    for (FlattenedBlock block : order) {
      BlockModule module = modules.get(block.id());
      List<SignalType> blockInputTypes = inputTypes(inputs.get(block.id()), outputTypes);
      List<SignalType> types = outputTypes.get(block.id());
      Object prepared = module.prepare(block, blockInputTypes, this::warn);
      List<String> fields = new ArrayList<>();
      for (int k = 0; k < types.size(); ++k)
        fields.add(uniqueField(usedFields, block.flattenedName() + module.outputSuffix(block, k, types.size())));
      BlockType type = block.block().GetBlockType().orElseThrow();
      PlannedBlock planned = new PlannedBlock(block, type, module, inputs.get(block.id()), blockInputTypes, types, fields, module.stateOrder(block), prepared);
      blocks.add(planned);
      blocksById.put(block.id(), planned);
      if (module instanceof PortModule && PortModule.isExternal(block))
        addExternalPort(planned, (PortModule)module);
    }

    planEnables();
    logger.debug("Execution order of {}: {}", modelName, blocks.stream().map(PlannedBlock::flattenedName).collect(Collectors.joining(", ")));
  }

  private String flattenedName(String blockId) { return model.GetBlock(blockId).map(FlattenedBlock::flattenedName).orElse(blockId); }

  private static String uniqueField(Set<String> used, String field) {
    String ret = field;
    for (int n = 2; used.contains(ret); ++n)
      ret = field + "_" + n;
    used.add(ret);
    return ret;
  }

  private static List<SignalType> inputTypes(List<InputSource> sources, Map<String, List<SignalType>> outputTypes) {
    List<SignalType> ret = new ArrayList<>();
    for (InputSource source : sources) {
      SignalType type = SignalType.DOUBLE;
      if (source != null) {
        List<SignalType> sourceTypes = outputTypes.get(source.blockId());
        if (sourceTypes != null && source.port() >= 0 && source.port() < sourceTypes.size())
          type = sourceTypes.get(source.port());
      }
      ret.add(type);
    }
    return ret;
  }

  /**
   * Kahn's algorithm; among ready blocks the earliest declared goes first. Wires into blocks without direct feedthrough
   * do not constrain the order. Blocks left in a cycle are appended in declaration order.
   */
  private List<FlattenedBlock> schedule(List<FlattenedBlock> declared, Map<String, BlockModule> modules, Map<String, List<InputSource>> inputs,
                                        Map<String, Integer> declarationIndex) {
    Map<String, Integer> pending = new HashMap<>();
    Map<String, List<String>> successors = new HashMap<>();
    for (FlattenedBlock block : declared) {
      pending.put(block.id(), 0);
      successors.put(block.id(), new ArrayList<>());
    }
    for (FlattenedBlock block : declared) {
      if (!modules.get(block.id()).hasDirectFeedthrough(block))
        continue;
      for (InputSource source : inputs.get(block.id())) {
        if (source == null)
          continue;
        successors.get(source.blockId()).add(block.id());
        pending.merge(block.id(), 1, Integer::sum);
      }
    }
    PriorityQueue<String> ready = new PriorityQueue<>(Comparator.comparing(declarationIndex::get));
    pending.forEach((id, count) -> {
      if (count == 0)
        ready.add(id);
    });
    List<FlattenedBlock> ret = new ArrayList<>();
    Set<String> scheduled = new HashSet<>();
    while (!ready.isEmpty()) {
      String id = ready.poll();
      ret.add(declared.get(declarationIndex.get(id)));
      scheduled.add(id);
      for (String next : successors.get(id)) {
        if (pending.merge(next, -1, Integer::sum) == 0)
          ready.add(next);
      }
    }
    if (ret.size() < declared.size()) {
      List<FlattenedBlock> remaining = declared.stream().filter(block -> !scheduled.contains(block.id())).collect(Collectors.toList());
      warn("Algebraic loop detected among blocks " + remaining.stream().map(FlattenedBlock::flattenedName).collect(Collectors.joining(", "))
           + "; they are scheduled in declaration order");
      ret.addAll(remaining);
    }
    return ret;
  }

  private void addExternalPort(PlannedBlock planned, PortModule module) {
    boolean isInput = planned.type() == BlockType.InputPort;
    List<ExternalPort> ports = isInput ? inputPorts : outputPorts;
    String requested = PortModule.portName(planned.block());
    String field = requested;
    for (int n = 2; fieldTaken(ports, field); ++n)
      field = requested + "_" + n;
    if (!field.equals(requested))
      warn("Port name " + requested + " is used by more than one " + (isInput ? "input" : "output") + " port; using " + field);
    ExternalPort port = new ExternalPort(planned.id(), field, module.externalType(planned.block(), planned.inputTypes()), isInput);
    ports.add(port);
    portsByBlock.put(planned.id(), port);
  }

  private static boolean fieldTaken(List<ExternalPort> ports, String field) { return ports.stream().anyMatch(port -> port.fieldName().equals(field)); }

  /** Non-trivial subsystems ordered parent first; resolves each own enable wire to a planned output. */
  private void planEnables() {
    List<SubsystemEnableInfo> nonTrivial =
        new ArrayList<>(model.subsystemEnableInfo().stream().filter(SubsystemEnableInfo::isNonTrivial).collect(Collectors.toList()));
    nonTrivial.sort(Comparator.comparingInt(SubsystemEnableInfo::depth));
    Set<String> usedFlags = new HashSet<>();
    for (SubsystemEnableInfo info : nonTrivial) {
      enableOrder.add(info);
      enableFlags.put(info.subsystemId(), uniqueField(usedFlags, CText.sanitizeIdentifier(info.subsystemName()) + "_enabled"));
      if (!info.hasEnableInput() || info.enableWire() == null)
        continue;
      Connection wire = info.enableWire();
      PlannedBlock source = blocksById.get(wire.sourceBlockId());
      if (source == null || wire.sourcePortIndex() < 0 || wire.sourcePortIndex() >= source.outputTypes().size()) {
        warn("Enable wire of subsystem " + info.subsystemName() + " is not driven by a block output; the subsystem is always enabled");
        continue;
      }
      SignalType type = source.outputTypes().get(wire.sourcePortIndex());
      if (!type.isBool())
        warn("Enable input of subsystem " + info.subsystemName() + " is driven by " + type + " signal " + source.outputFields().get(wire.sourcePortIndex())
             + "; it is coerced with != 0");
      else if (!type.isScalar())
        warn("Enable input of subsystem " + info.subsystemName() + " is driven by " + type + " signal; only element 0 is used");
      enableSources.put(info.subsystemId(), new InputSource(source.id(), wire.sourcePortIndex()));
    }
  }

  public FlattenedModel getModel() { return model; }

  /** Sanitized model name, the prefix of every generated type and function. */
  public String getModelName() { return modelName; }

  /** Blocks in execution order. */
  public List<PlannedBlock> GetBlocks() { return Collections.unmodifiableList(blocks); }

  public PlannedBlock GetBlock(String id) { return blocksById.get(id); }

  public List<PlannedBlock> GetStatefulBlocks() { return blocks.stream().filter(PlannedBlock::isStateful).collect(Collectors.toList()); }

  public List<ExternalPort> GetInputPorts() { return Collections.unmodifiableList(inputPorts); }

  public List<ExternalPort> GetOutputPorts() { return Collections.unmodifiableList(outputPorts); }

  public Optional<ExternalPort> GetExternalPort(String blockId) { return Optional.ofNullable(portsByBlock.get(blockId)); }

  /** Subsystems that need an enable flag, parents before children. */
  public List<SubsystemEnableInfo> GetEnableOrder() { return Collections.unmodifiableList(enableOrder); }

  /** Field of enable_states_t for a subsystem, null if the subsystem needs none. */
  public String enableFlag(String subsystemId) { return enableFlags.get(subsystemId); }

  /** Output that drives a subsystem's own enable input; empty if the subsystem has no such wire. */
  public Optional<InputSource> GetEnableSource(String subsystemId) { return Optional.ofNullable(enableSources.get(subsystemId)); }

  /** Enable flag gating a block's state, null if the block is not inside an enabled subsystem. */
  public String blockEnableFlag(PlannedBlock block) {
    String scope = block.block().enableScope();
    return (scope == null) ? null : enableFlags.get(scope);
  }

  /** Parent flag a subsystem's effective flag is combined with, null at the top. */
  public String parentEnableFlag(SubsystemEnableInfo info) {
    return (info.parentSubsystemId() == null) ? null : enableFlags.get(info.parentSubsystemId());
  }

  public List<String> GetWarnings() { return Collections.unmodifiableList(warnings); }

  /** Total number of scalar state elements. */
  public int stateCount() { return blocks.stream().mapToInt(PlannedBlock::stateOrder).sum(); }

  /** Struct member holding the state vector of a stateful block. */
  public static String stateField(PlannedBlock block) { return block.flattenedName() + "_states"; }
}
