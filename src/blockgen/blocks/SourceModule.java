package blockgen.blocks;

import blockgen.flatten.FlattenedBlock;
import blockgen.util.CText;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;

/**
 * Signal generator driven by model time: constant, sine, step or ramp.
 */
public class SourceModule implements BlockModule {

  enum Waveform {
    Constant, Sine, Step, Ramp
  }

  /** Resolved generator settings. */
  record Settings(Waveform waveform, double[] values, double amplitude, double frequency, double phase, double stepTime,
                  double stepValue, double slope, double startTime) {}

  @Override
  public int inputCount(FlattenedBlock block, int connectedPorts) { return 0; }

  @Override
  public List<SignalType> outputTypes(FlattenedBlock block, List<SignalType> inputTypes) {
    String dataType = block.block().getString("dataType", "");
    if (!dataType.isBlank())
      return List.of(SignalType.parse(dataType));
    if (waveform(block) == Waveform.Constant) {
      Object value = block.block().getParameter("value");
      if (value instanceof List && !((List<?>)value).isEmpty()) {
        List<?> list = (List<?>)value;
        if (list.get(0) instanceof List)
          return List.of(SignalType.matrix("double", list.size(), ((List<?>)list.get(0)).size()));
        return List.of(SignalType.vector("double", list.size()));
      }
    }
    return List.of(SignalType.DOUBLE);
  }

  private static Waveform waveform(FlattenedBlock block) {
    switch (block.block().getString("signalType", "constant").trim().toLowerCase()) {
    case "sine":
      return Waveform.Sine;
    case "step":
      return Waveform.Step;
    case "ramp":
      return Waveform.Ramp;
    case "constant":
      return Waveform.Constant;
    default:
      return null;
    }
  }

  @Override
  public Object prepare(FlattenedBlock block, List<SignalType> inputTypes, Consumer<String> warn) {
    Waveform waveform = waveform(block);
    if (waveform == null) {
      warn.accept("Source " + block.flattenedName() + " has unknown signal type '" + block.block().getString("signalType", "")
                  + "'; it outputs 0");
      waveform = Waveform.Constant;
    }
    SignalType type = outputTypes(block, inputTypes).get(0);
    double[] values = new double[type.size()];
    if (waveform == Waveform.Constant && block.block().hasParameter("value")) {
      List<Double> flat = new ArrayList<>();
      Object value = block.block().getParameter("value");
      if (value instanceof List && !((List<?>)value).isEmpty() && ((List<?>)value).get(0) instanceof List)
        block.block().getDoubleMatrix("value").forEach(flat::addAll);
      else
        flat.addAll(block.block().getDoubleList("value"));
      for (int k = 0; k < values.length; ++k)
        values[k] = (flat.size() == 1) ? flat.get(0) : (k < flat.size()) ? flat.get(k) : 0.0;
    }
    var params = block.block();
    return new Settings(waveform, values, params.getDouble("amplitude", 1.0), params.getDouble("frequency", 1.0), params.getDouble("phase", 0.0),
                        params.getDouble("stepTime", 1.0), params.getDouble("stepValue", 1.0), params.getDouble("slope", 1.0),
                        params.getDouble("startTime", 0.0));
  }

  @Override
  public void emitStep(PlannedBlock block, CEmitter out) {
    Settings settings = block.preparedAs(Settings.class);
    String t = out.time();
    String value;
    switch (settings.waveform()) {
    case Sine:
      value = CText.formatDouble(settings.amplitude()) + " * sin(2.0 * M_PI * " + CText.formatDouble(settings.frequency()) + " * " + t + " + "
              + CText.formatDouble(settings.phase()) + ")";
      break;
    case Step:
      value = "(" + t + " >= " + CText.formatDouble(settings.stepTime()) + ") ? " + CText.formatDouble(settings.stepValue()) + " : 0.0";
      break;
    case Ramp:
      value = "(" + t + " >= " + CText.formatDouble(settings.startTime()) + ") ? " + CText.formatDouble(settings.slope()) + " * (" + t + " - "
              + CText.formatDouble(settings.startTime()) + ") : 0.0";
      break;
    default:
      for (int k = 0; k < settings.values().length; ++k)
        out.line(out.outputElement(0, k) + " = " + CText.formatDouble(settings.values()[k]) + ";");
      return;
    }
    for (int k = 0; k < settings.values().length; ++k)
      out.line(out.outputElement(0, k) + " = " + value + ";");
  }

  @Override
  public void simulateStep(PlannedBlock block, SimFrame frame) {
    Settings settings = block.preparedAs(Settings.class);
    double t = frame.time();
    double value;
    switch (settings.waveform()) {
    case Sine:
      value = settings.amplitude() * Math.sin(2.0 * Math.PI * settings.frequency() * t + settings.phase());
      break;
    case Step:
      value = (t >= settings.stepTime()) ? settings.stepValue() : 0.0;
      break;
    case Ramp:
      value = (t >= settings.startTime()) ? settings.slope() * (t - settings.startTime()) : 0.0;
      break;
    default:
      frame.setOutput(0, settings.values().clone());
      return;
    }
    double[] result = new double[settings.values().length];
    Arrays.fill(result, value);
    frame.setOutput(0, result);
  }
}
