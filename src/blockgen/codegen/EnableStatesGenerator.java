package blockgen.codegen;

import blockgen.blocks.PlannedBlock;
import blockgen.blocks.PlannedBlock.InputSource;
import blockgen.blocks.SignalType;
import blockgen.codegen.BlockEmitter.Target;
import blockgen.flatten.SubsystemEnableInfo;
import java.util.Optional;

/**
 * Emits &lt;model&gt;_evaluate_enable_states. Flags are assigned parent first, so each subsystem combines its own enable
 * signal with the already updated effective flag of its nearest enabled ancestor. Each flag is assigned once per step
 * from signals computed earlier in the step, also under cyclic enable wiring.
 */
public class EnableStatesGenerator {

  public static void Generate(ExecutionPlan plan, CCodeBuilder code) {
    code.function(HeaderGenerator.enableSignature(plan));
    if (plan.GetEnableOrder().isEmpty())
      code.line("(void)model;");
    for (SubsystemEnableInfo info : plan.GetEnableOrder()) {
      String flag = "model->enable_states." + plan.enableFlag(info.subsystemId());
      String parentFlag = plan.parentEnableFlag(info);
      String parentName = parentName(plan, info);
      if (!info.hasEnableInput()) {
        code.comment(info.subsystemName() + " inherits enable state from parent " + parentName);
        code.line(flag + " = " + ((parentFlag == null) ? "true" : "model->enable_states." + parentFlag) + ";");
        continue;
      }
      String own = ownEnable(plan, info);
      if (parentFlag == null) {
        code.comment(info.subsystemName() + ": own enable input");
        code.line(flag + " = " + own + ";");
      } else {
        code.comment(info.subsystemName() + ": own enable input and parent " + parentName);
        code.line(flag + " = model->enable_states." + parentFlag + " && " + own + ";");
      }
    }
    code.close();
  }

  private static String parentName(ExecutionPlan plan, SubsystemEnableInfo info) {
    if (info.parentSubsystemId() == null)
      return "";
    return plan.getModel().GetEnableInfo(info.parentSubsystemId()).map(SubsystemEnableInfo::subsystemName).orElse(info.parentSubsystemId());
  }

  private static String ownEnable(ExecutionPlan plan, SubsystemEnableInfo info) {
    Optional<InputSource> source = plan.GetEnableSource(info.subsystemId());
    if (source.isEmpty())
      return "true";
    PlannedBlock producer = plan.GetBlock(source.get().blockId());
    SignalType type = producer.outputTypes().get(source.get().port());
    String value = BlockEmitter.signalField(plan, source.get(), Target.Step) + type.elementSuffix(0);
    return type.isBool() ? value : "(" + value + " != 0)";
  }
}
