package blockgen.codegen;

import blockgen.blocks.PlannedBlock;
import blockgen.codegen.BlockEmitter.Target;
import java.util.List;
import java.util.Map;

/**
 * Emits &lt;model&gt;_step: block outputs in execution order, enable evaluation, one Euler or classic RK4 step over all
 * continuous states and the time update. Inputs and signals are held constant across the RK4 stages. The final state
 * update of a block inside an enabled subsystem is additionally guarded by its flag, so disabled states do not move.
 */
public class StepFunctionGenerator {

  public static void Generate(ExecutionPlan plan, IntegrationMethod method, CCodeBuilder code, Map<String, String> helpers,
                              List<String> warnings) {
    String model = plan.getModelName();
    code.function(HeaderGenerator.stepSignature(plan));
    for (PlannedBlock block : plan.GetBlocks()) {
      code.comment(block.flattenedName() + " (" + block.type() + ")");
      block.module().emitStep(block, new BlockEmitter(plan, block, Target.Step, code, helpers, warnings));
    }
    code.blank();
    code.line(model + "_evaluate_enable_states(model);");

    List<PlannedBlock> stateful = plan.GetStatefulBlocks();
    if (!stateful.isEmpty() && method == IntegrationMethod.Euler) {
      code.blank();
      code.comment("Euler integration");
      code.open("");
      code.line(HeaderGenerator.typeName(plan, "states") + " dx;");
      code.line("const double dt = model->dt;");
      code.line("memset(&dx, 0, sizeof(dx));");
      derivativesCall(code, model, "model->time", "&model->states", "dx");
      for (PlannedBlock block : stateful) {
        String flag = plan.blockEnableFlag(block);
        if (flag != null)
          code.open("if (model->enable_states." + flag + ")");
        for (int i = 0; i < block.stateOrder(); ++i)
          code.line(DerivativesGenerator.stateElement("model->states.", block, i) + " += dt * " + DerivativesGenerator.stateElement("dx.", block, i)
                    + ";");
        if (flag != null)
          code.close();
      }
      code.close();
    } else if (!stateful.isEmpty()) {
      code.blank();
      code.comment("RK4 integration");
      code.open("");
      code.line(HeaderGenerator.typeName(plan, "states") + " k1, k2, k3, k4, temp_states;");
      code.line("const double dt = model->dt;");
      code.line("memset(&temp_states, 0, sizeof(temp_states));");
      derivativesCall(code, model, "model->time", "&model->states", "k1");
      stage(code, stateful, "0.5 * dt", "k1");
      derivativesCall(code, model, "model->time + 0.5 * dt", "&temp_states", "k2");
      stage(code, stateful, "0.5 * dt", "k2");
      derivativesCall(code, model, "model->time + 0.5 * dt", "&temp_states", "k3");
      stage(code, stateful, "dt", "k3");
      derivativesCall(code, model, "model->time + dt", "&temp_states", "k4");
      for (PlannedBlock block : stateful) {
        String flag = plan.blockEnableFlag(block);
        if (flag != null)
          code.open("if (model->enable_states." + flag + ")");
        for (int i = 0; i < block.stateOrder(); ++i) {
          String state = DerivativesGenerator.stateElement("model->states.", block, i);
          code.line(state + " = " + state + " + dt / 6.0 * (" + DerivativesGenerator.stateElement("k1.", block, i) + " + 2.0 * "
                    + DerivativesGenerator.stateElement("k2.", block, i) + " + 2.0 * " + DerivativesGenerator.stateElement("k3.", block, i) + " + "
                    + DerivativesGenerator.stateElement("k4.", block, i) + ");");
        }
        if (flag != null)
          code.close();
      }
      code.close();
    }
    code.blank();
    code.line("model->time += model->dt;");
    code.close();
  }

  private static void derivativesCall(CCodeBuilder code, String model, String time, String states, String result) {
    code.line(model + "_derivatives(" + time + ", &model->inputs, &model->signals, " + states + ", &" + result + ", &model->enable_states);");
  }

  /** temp_states = states + factor * k */
  private static void stage(CCodeBuilder code, List<PlannedBlock> stateful, String factor, String k) {
    for (PlannedBlock block : stateful) {
      for (int i = 0; i < block.stateOrder(); ++i)
        code.line(DerivativesGenerator.stateElement("temp_states.", block, i) + " = " + DerivativesGenerator.stateElement("model->states.", block, i) + " + "
                  + factor + " * " + DerivativesGenerator.stateElement(k + ".", block, i) + ";");
    }
  }
}
