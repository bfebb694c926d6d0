package blockgen.sim;

import blockgen.blocks.PlannedBlock;
import blockgen.blocks.PlannedBlock.InputSource;
import blockgen.blocks.SignalType;
import blockgen.blocks.SimFrame;
import blockgen.codegen.ExecutionPlan;
import blockgen.codegen.ExecutionPlan.ExternalPort;
import blockgen.codegen.IntegrationMethod;
import blockgen.flatten.FlatteningResult;
import blockgen.flatten.ModelFlattener;
import blockgen.flatten.SubsystemEnableInfo;
import blockgen.frontend.Sheet;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Executes an {@link ExecutionPlan} in process with the semantics of the generated C: the same block order, the same
 * parent-first enable evaluation, Euler or classic RK4 with signals held over the step and state freezing in disabled subsystems.
 * Values are stored as doubles and converted to the declared C type whenever they are written.
 */
public class ModelSimulator {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final ExecutionPlan plan;
  private final double dt;
  private final IntegrationMethod method;
  private final Map<String, double[][]> signals = new HashMap<>();
  private final Map<String, double[]> states = new HashMap<>();
  private final Map<String, double[]> externalInputs = new HashMap<>();
  private final Map<String, double[]> externalOutputs = new HashMap<>();
  private final Map<String, Boolean> enableFlags = new HashMap<>();
  private final Map<String, List<double[]>> logged = new HashMap<>();
  private double time = 0.0;

  public ModelSimulator(ExecutionPlan plan, double dt) { this(plan, dt, IntegrationMethod.RK4); }

  /**
   * @param dt fixed step size in seconds
   */
  public ModelSimulator(ExecutionPlan plan, double dt, IntegrationMethod method) {
    if (!(dt > 0.0))
      throw new IllegalArgumentException("Step size must be positive, got " + dt);
    this.plan = plan;
    this.dt = dt;
    this.method = method;
    for (PlannedBlock block : plan.GetBlocks()) {
      double[][] outputs = new double[block.outputTypes().size()][];
      for (int k = 0; k < outputs.length; ++k)
        outputs[k] = new double[block.outputTypes().get(k).size()];
      signals.put(block.id(), outputs);
      if (block.isStateful())
        states.put(block.id(), new double[block.stateOrder()]);
    }
    for (ExternalPort port : plan.GetInputPorts())
      externalInputs.put(port.fieldName(), new double[port.type().size()]);
    for (ExternalPort port : plan.GetOutputPorts())
      externalOutputs.put(port.fieldName(), new double[port.type().size()]);
    for (SubsystemEnableInfo info : plan.GetEnableOrder())
      enableFlags.put(info.subsystemId(), true);
  }

  /** Flattens and plans the sheets, then creates a simulator. */
  public static ModelSimulator Create(List<Sheet> sheets, double dt) {
    FlatteningResult flattened = new ModelFlattener().flatten(sheets);
    flattened.warnings().forEach(warning -> logger.debug("Flattening: {}", warning));
    return new ModelSimulator(ExecutionPlan.Build(flattened.model()), dt);
  }

  /** Converts to the C type a value is stored in. */
  static double convert(String baseType, double value) {
    switch (baseType) {
    case "bool":
      return (value != 0.0) ? 1.0 : 0.0;
    case "int":
      return (int)value;
    case "long":
      return (long)value;
    case "float":
      return (float)value;
    default:
      return value;
    }
  }

  private static double[] convert(SignalType type, double[] values) {
    double[] ret = new double[type.size()];
    for (int k = 0; k < ret.length; ++k) {
      double value = (values.length == 1) ? values[0] : (k < values.length) ? values[k] : 0.0;
      ret[k] = convert(type.baseType(), value);
    }
    return ret;
  }

  /**
   * Applies a value to a top-level input port; a single value is broadcast over vector ports.
   * @throws IllegalArgumentException if the model has no such input
   */
  public void setInput(String portName, double... value) {
    ExternalPort port = plan.GetInputPorts().stream().filter(candidate -> candidate.fieldName().equals(portName)).findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Model " + plan.getModelName() + " has no input port " + portName));
    externalInputs.put(port.fieldName(), convert(port.type(), value));
  }

  /** Advances the model by one step. */
  public void step() {
    for (PlannedBlock block : plan.GetBlocks())
      block.module().simulateStep(block, new Frame(block, time, states.get(block.id())));
    evaluateEnableStates();

    List<PlannedBlock> stateful = plan.GetStatefulBlocks();
    if (!stateful.isEmpty() && method == IntegrationMethod.Euler) {
      Map<String, double[]> dx = derivatives(time, states);
      for (PlannedBlock block : stateful) {
        if (!isActive(block))
          continue;
        double[] x = states.get(block.id());
        for (int i = 0; i < x.length; ++i)
          x[i] += dt * dx.get(block.id())[i];
      }
    } else if (!stateful.isEmpty()) {
      Map<String, double[]> k1 = derivatives(time, states);
      Map<String, double[]> k2 = derivatives(time + 0.5 * dt, stage(stateful, 0.5 * dt, k1));
      Map<String, double[]> k3 = derivatives(time + 0.5 * dt, stage(stateful, 0.5 * dt, k2));
      Map<String, double[]> k4 = derivatives(time + dt, stage(stateful, dt, k3));
      for (PlannedBlock block : stateful) {
        if (!isActive(block))
          continue;
        double[] x = states.get(block.id());
        String id = block.id();
        for (int i = 0; i < x.length; ++i)
          x[i] = x[i] + dt / 6.0 * (k1.get(id)[i] + 2.0 * k2.get(id)[i] + 2.0 * k3.get(id)[i] + k4.get(id)[i]);
      }
    }
    time += dt;
  }

  public void run(int steps) {
    for (int i = 0; i < steps; ++i)
      step();
  }

  private Map<String, double[]> stage(List<PlannedBlock> stateful, double factor, Map<String, double[]> k) {
    Map<String, double[]> ret = new HashMap<>();
    for (PlannedBlock block : stateful) {
      double[] x = states.get(block.id());
      double[] temp = new double[x.length];
      for (int i = 0; i < x.length; ++i)
        temp[i] = x[i] + factor * k.get(block.id())[i];
      ret.put(block.id(), temp);
    }
    return ret;
  }

  private Map<String, double[]> derivatives(double t, Map<String, double[]> current) {
    Map<String, double[]> ret = new HashMap<>();
    for (PlannedBlock block : plan.GetStatefulBlocks()) {
      double[] derivative = new double[block.stateOrder()];
      if (isActive(block)) {
        double[] state = current.get(block.id());
        block.module().simulateDerivatives(block, new Frame(block, t, state), state, derivative);
      }
      ret.put(block.id(), derivative);
    }
    return ret;
  }

  private boolean isActive(PlannedBlock block) {
    String scope = block.block().enableScope();
    return scope == null || enableFlags.getOrDefault(scope, true);
  }

  private void evaluateEnableStates() {
    for (SubsystemEnableInfo info : plan.GetEnableOrder()) {
      Boolean parent = (info.parentSubsystemId() == null) ? null : enableFlags.get(info.parentSubsystemId());
      boolean effective;
      if (!info.hasEnableInput()) {
        effective = (parent == null) || parent;
      } else {
        boolean own = true;
        Optional<InputSource> source = plan.GetEnableSource(info.subsystemId());
        if (source.isPresent())
          own = signals.get(source.get().blockId())[source.get().port()][0] != 0.0;
        effective = (parent == null) ? own : parent && own;
      }
      enableFlags.put(info.subsystemId(), effective);
    }
  }

  public double getTime() { return time; }

  /**
   * @param field C field of a block output, the flattened block name for single-output blocks
   * @throws IllegalArgumentException if no block has such an output
   */
  public double[] getSignal(String field) {
    for (PlannedBlock block : plan.GetBlocks()) {
      int k = block.outputFields().indexOf(field);
      if (k >= 0)
        return signals.get(block.id())[k].clone();
    }
    throw new IllegalArgumentException("Model " + plan.getModelName() + " has no signal " + field);
  }

  public double[] getOutput(String portName) {
    double[] value = externalOutputs.get(portName);
    if (value == null)
      throw new IllegalArgumentException("Model " + plan.getModelName() + " has no output port " + portName);
    return value.clone();
  }

  public double[] getState(String flattenedName) {
    for (PlannedBlock block : plan.GetStatefulBlocks()) {
      if (block.flattenedName().equals(flattenedName))
        return states.get(block.id()).clone();
    }
    throw new IllegalArgumentException("Model " + plan.getModelName() + " has no stateful block " + flattenedName);
  }

  /** Effective enable flag of a subsystem; true for subsystems that are not gated at all. */
  public boolean isEnabled(String subsystemName) {
    return plan.getModel().GetEnableInfoByName(subsystemName).map(info -> enableFlags.getOrDefault(info.subsystemId(), true))
        .orElseThrow(() -> new IllegalArgumentException("Model " + plan.getModelName() + " has no subsystem " + subsystemName));
  }

  /** Samples a signal display or logger recorded, one per step. */
  public List<double[]> getLoggedSamples(String flattenedName) {
    for (PlannedBlock block : plan.GetBlocks()) {
      if (block.flattenedName().equals(flattenedName))
        return Collections.unmodifiableList(logged.getOrDefault(block.id(), new ArrayList<>()));
    }
    throw new IllegalArgumentException("Model " + plan.getModelName() + " has no block " + flattenedName);
  }

  private class Frame implements SimFrame {
    private final PlannedBlock block;
    private final double frameTime;
    private final double[] state;

    Frame(PlannedBlock block, double frameTime, double[] state) {
      this.block = block;
      this.frameTime = frameTime;
      this.state = state;
    }

    private double[] source(int port) {
      if (!block.isConnected(port))
        return null;
      InputSource source = block.inputs().get(port);
      double[][] outputs = signals.get(source.blockId());
      if (outputs == null || source.port() < 0 || source.port() >= outputs.length)
        return null;
      return outputs[source.port()];
    }

    @Override
    public double[] input(int port) {
      double[] value = source(port);
      if (value == null)
        return new double[(port < block.inputTypes().size()) ? block.inputTypes().get(port).size() : 1];
      return value;
    }

    @Override
    public double inputElement(int port, int k) {
      double[] value = source(port);
      if (value == null)
        return 0.0;
      SignalType type = plan.GetBlock(block.inputs().get(port).blockId()).outputTypes().get(block.inputs().get(port).port());
      if (type.isScalar())
        return value[0];
      return (k < value.length) ? value[k] : 0.0;
    }

    @Override
    public void setOutput(int k, double[] values) {
      signals.get(block.id())[k] = convert(block.outputTypes().get(k), values);
    }

    @Override
    public double time() {
      return frameTime;
    }

    @Override
    public double[] state() {
      return state;
    }

    @Override
    public double[] externalInput() {
      return plan.GetExternalPort(block.id()).map(port -> externalInputs.get(port.fieldName()).clone()).orElse(new double[0]);
    }

    @Override
    public void setExternalOutput(double[] values) {
      plan.GetExternalPort(block.id()).ifPresent(port -> externalOutputs.put(port.fieldName(), convert(port.type(), values)));
    }

    @Override
    public void record(double[] values) {
      logged.computeIfAbsent(block.id(), key -> new ArrayList<>()).add(values);
    }
  }
}
