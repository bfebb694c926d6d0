package blockgen.codegen;

import blockgen.blocks.PlannedBlock;
import blockgen.codegen.BlockEmitter.Target;
import java.util.List;
import java.util.Map;

/**
 * Emits &lt;model&gt;_derivatives, the right-hand side the RK4 stages evaluate. Derivatives of blocks inside an enabled
 * subsystem are only computed while its flag is set and stay zero otherwise.
 */
public class DerivativesGenerator {

  public static void Generate(ExecutionPlan plan, CCodeBuilder code, Map<String, String> helpers, List<String> warnings) {
    code.function(HeaderGenerator.derivativesSignature(plan));
    code.line("(void)t;");
    code.line("(void)inputs;");
    code.line("(void)signals;");
    code.line("(void)current_states;");
    code.line("(void)enable_states;");
    code.line("memset(state_derivatives, 0, sizeof(*state_derivatives));");
    for (PlannedBlock block : plan.GetStatefulBlocks()) {
      code.comment(block.flattenedName() + " (" + block.type() + ")");
      String flag = plan.blockEnableFlag(block);
      if (flag != null)
        code.open("if (enable_states->" + flag + ")");
      block.module().emitDerivatives(block, new BlockEmitter(plan, block, Target.Derivatives, code, helpers, warnings));
      if (flag != null)
        code.close();
    }
    code.close();
  }

  static String stateElement(String prefix, PlannedBlock block, int i) { return prefix + ExecutionPlan.stateField(block) + "[" + i + "]"; }
}
