package blockgen.codegen;

import blockgen.blocks.PlannedBlock;
import blockgen.codegen.ExecutionPlan.ExternalPort;
import blockgen.flatten.SubsystemEnableInfo;
import blockgen.util.CText;
import java.util.List;

/**
 * Emits &lt;model&gt;.h: the model structs and the prototypes of the four model functions.
 */
public class HeaderGenerator {

  public static String typeName(ExecutionPlan plan, String part) { return plan.getModelName() + "_" + part + "_t"; }

  public static String modelType(ExecutionPlan plan) { return plan.getModelName() + "_t"; }

  static String initSignature(ExecutionPlan plan) { return "void " + plan.getModelName() + "_init(" + modelType(plan) + "* model, double dt)"; }

  static String stepSignature(ExecutionPlan plan) { return "void " + plan.getModelName() + "_step(" + modelType(plan) + "* model)"; }

  static String enableSignature(ExecutionPlan plan) {
    return "void " + plan.getModelName() + "_evaluate_enable_states(" + modelType(plan) + "* model)";
  }

  static String derivativesSignature(ExecutionPlan plan) {
    return "void " + plan.getModelName() + "_derivatives(double t, const " + typeName(plan, "inputs") + "* inputs, const " + typeName(plan, "signals")
        + "* signals, const " + typeName(plan, "states") + "* current_states, " + typeName(plan, "states")
        + "* state_derivatives, const enable_states_t* enable_states)";
  }

  public static String Generate(ExecutionPlan plan) {
    String guard = CText.headerGuard(plan.getModelName());
    CCodeBuilder code = new CCodeBuilder();
    code.comment("Generated model " + plan.getModel().metadata().modelName() + ". Do not edit.");
    code.line("#ifndef " + guard);
    code.line("#define " + guard);
    code.blank();
    for (String header : List.of("stdint.h", "stdbool.h", "stdlib.h", "string.h", "math.h"))
      code.line("#include <" + header + ">");
    code.blank();
    code.line("#ifdef __cplusplus");
    code.line("extern \"C\" {");
    code.line("#endif");
    code.blank();

    code.comment("External inputs");
    code.open("typedef struct");
    for (ExternalPort port : plan.GetInputPorts())
      code.line(port.type().declare(port.fieldName()));
    dummyIfEmpty(code, plan.GetInputPorts().isEmpty());
    code.close(" " + typeName(plan, "inputs") + ";");
    code.blank();

    code.comment("External outputs");
    code.open("typedef struct");
    for (ExternalPort port : plan.GetOutputPorts())
      code.line(port.type().declare(port.fieldName()));
    dummyIfEmpty(code, plan.GetOutputPorts().isEmpty());
    code.close(" " + typeName(plan, "outputs") + ";");
    code.blank();

    code.comment("Block output signals");
    code.open("typedef struct");
    boolean empty = true;
    for (PlannedBlock block : plan.GetBlocks()) {
      for (int k = 0; k < block.outputFields().size(); ++k) {
        code.line(block.outputTypes().get(k).declare(block.outputFields().get(k)));
        empty = false;
      }
    }
    dummyIfEmpty(code, empty);
    code.close(" " + typeName(plan, "signals") + ";");
    code.blank();

    code.comment("Continuous states");
    code.open("typedef struct");
    List<PlannedBlock> stateful = plan.GetStatefulBlocks();
    for (PlannedBlock block : stateful)
      code.line("double " + ExecutionPlan.stateField(block) + "[" + block.stateOrder() + "];");
    dummyIfEmpty(code, stateful.isEmpty());
    code.close(" " + typeName(plan, "states") + ";");
    code.blank();

    code.comment("Effective enable state of each subsystem");
    code.open("typedef struct");
    for (SubsystemEnableInfo info : plan.GetEnableOrder())
      code.line("bool " + plan.enableFlag(info.subsystemId()) + ";");
    dummyIfEmpty(code, plan.GetEnableOrder().isEmpty());
    code.close(" enable_states_t;");
    code.blank();

    code.open("typedef struct");
    code.line(typeName(plan, "inputs") + " inputs;");
    code.line(typeName(plan, "outputs") + " outputs;");
    code.line(typeName(plan, "signals") + " signals;");
    code.line(typeName(plan, "states") + " states;");
    code.line("enable_states_t enable_states;");
    code.line("double time;");
    code.line("double dt;");
    code.close(" " + modelType(plan) + ";");
    code.blank();

    code.line(initSignature(plan) + ";");
    code.line(stepSignature(plan) + ";");
    code.line(enableSignature(plan) + ";");
    code.line(derivativesSignature(plan) + ";");
    code.blank();
    code.line("#ifdef __cplusplus");
    code.line("}");
    code.line("#endif");
    code.blank();
    code.line("#endif " + CText.comment(guard));
    return code.toString();
  }

  /** C99 forbids empty structs. */
  private static void dummyIfEmpty(CCodeBuilder code, boolean empty) {
    if (empty)
      code.line("char _unused;");
  }
}
