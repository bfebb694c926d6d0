package blockgen.codegen;

import blockgen.flatten.SubsystemEnableInfo;

/**
 * Emits &lt;model&gt;_init: zeroes every struct, sets time and step size and enables all subsystems.
 */
public class InitFunctionGenerator {

  public static void Generate(ExecutionPlan plan, CCodeBuilder code) {
    code.function(HeaderGenerator.initSignature(plan));
    for (String part : new String[] {"inputs", "outputs", "signals", "states", "enable_states"})
      code.line("memset(&model->" + part + ", 0, sizeof(model->" + part + "));");
    code.line("model->time = 0.0;");
    code.line("model->dt = dt;");
    for (SubsystemEnableInfo info : plan.GetEnableOrder())
      code.line("model->enable_states." + plan.enableFlag(info.subsystemId()) + " = true;");
    code.close();
  }
}
