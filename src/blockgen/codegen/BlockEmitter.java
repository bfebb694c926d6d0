package blockgen.codegen;

import blockgen.blocks.CEmitter;
import blockgen.blocks.PlannedBlock;
import blockgen.blocks.PlannedBlock.InputSource;
import blockgen.blocks.SignalType;
import blockgen.codegen.ExecutionPlan.ExternalPort;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * {@link CEmitter} bound to one block and one generated function. The function decides how signals, states and time
 * are addressed.
 */
class BlockEmitter implements CEmitter {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Generated function the text ends up in. */
  enum Target {
    /** File scope, before the functions. */
    Definitions("model->signals.", "model->states.", null, "model->time"),
    /** Body of &lt;model&gt;_step. */
    Step("model->signals.", "model->states.", null, "model->time"),
    /** Body of &lt;model&gt;_derivatives. */
    Derivatives("signals->", "current_states->", "state_derivatives->", "t");

    final String signals;
    final String states;
    final String derivatives;
    final String time;

    private Target(String signals, String states, String derivatives, String time) {
      this.signals = signals;
      this.states = states;
      this.derivatives = derivatives;
      this.time = time;
    }
  }

  private final ExecutionPlan plan;
  private final PlannedBlock block;
  private final Target target;
  private final CCodeBuilder code;
  private final Map<String, String> helpers;
  private final List<String> warnings;

  BlockEmitter(ExecutionPlan plan, PlannedBlock block, Target target, CCodeBuilder code, Map<String, String> helpers, List<String> warnings) {
    this.plan = plan;
    this.block = block;
    this.target = target;
    this.code = code;
    this.helpers = helpers;
    this.warnings = warnings;
  }

  /** C expression of a signal field in the given function. */
  static String signalField(ExecutionPlan plan, InputSource source, Target target) {
    PlannedBlock producer = plan.GetBlock(source.blockId());
    return target.signals + producer.outputFields().get(source.port());
  }

  private InputSource source(int port) {
    if (!block.isConnected(port))
      return null;
    InputSource source = block.inputs().get(port);
    PlannedBlock producer = plan.GetBlock(source.blockId());
    if (producer == null || source.port() < 0 || source.port() >= producer.outputFields().size())
      return null;
    return source;
  }

  @Override
  public String input(int port) {
    InputSource source = source(port);
    return (source == null) ? "0.0" : signalField(plan, source, target);
  }

  @Override
  public String inputElement(int port, int k) {
    InputSource source = source(port);
    if (source == null)
      return "0.0";
    SignalType type = plan.GetBlock(source.blockId()).outputTypes().get(source.port());
    if (type.isScalar())
      return signalField(plan, source, target);
    if (k >= type.size())
      return "0.0";
    return signalField(plan, source, target) + type.elementSuffix(k);
  }

  @Override
  public String output(int k) {
    return target.signals + block.outputFields().get(k);
  }

  @Override
  public String outputElement(int k, int element) {
    return output(k) + block.outputTypes().get(k).elementSuffix(element);
  }

  @Override
  public String state(int i) {
    return target.states + ExecutionPlan.stateField(block) + "[" + i + "]";
  }

  @Override
  public String derivative(int i) {
    if (target.derivatives == null)
      throw new IllegalStateException("State derivatives are only available in the derivatives function");
    return target.derivatives + ExecutionPlan.stateField(block) + "[" + i + "]";
  }

  @Override
  public String time() {
    return target.time;
  }

  @Override
  public String externalPort() {
    ExternalPort port = plan.GetExternalPort(block.id())
                            .orElseThrow(() -> new IllegalStateException("Block " + block.flattenedName() + " is not a top-level port"));
    return (port.isInput() ? "model->inputs." : "model->outputs.") + port.fieldName();
  }

  @Override
  public String uniqueIdentifier(String suffix) {
    return plan.getModelName() + "_" + block.flattenedName() + "_" + suffix;
  }

  @Override
  public void line(String text) {
    code.line(text);
  }

  @Override
  public void open(String header) {
    code.open(header);
  }

  @Override
  public void close() {
    code.close();
  }

  @Override
  public void requireHelper(String key, String helperCode) {
    helpers.putIfAbsent(key, helperCode);
  }

  @Override
  public void warn(String message) {
    logger.warn(message);
    warnings.add(message);
  }
}
