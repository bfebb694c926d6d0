package blockgen.codegen;

import blockgen.blocks.PlannedBlock;
import blockgen.codegen.BlockEmitter.Target;
import blockgen.flatten.FlatteningResult;
import blockgen.flatten.ModelFlattener;
import blockgen.frontend.Sheet;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Turns sheets into a standalone C99 header and source.
 */
public class CodeGenerator {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final ModelFlattener flattener;
  private final IntegrationMethod integrationMethod;

  public CodeGenerator() { this(new ModelFlattener()); }

  public CodeGenerator(ModelFlattener flattener) { this(flattener, IntegrationMethod.RK4); }

  public CodeGenerator(ModelFlattener flattener, IntegrationMethod integrationMethod) {
    this.flattener = flattener;
    this.integrationMethod = integrationMethod;
  }

  /**
   * Flattens and generates.
   * @throws blockgen.blocks.UnsupportedBlockTypeException for a block type without C support
   * @throws blockgen.expr.ExpressionSyntaxException for an evaluate block whose expression does not parse
   * @throws blockgen.expr.ExpressionValidationException for an evaluate block whose expression is invalid
   */
  public GeneratedCode generate(String modelName, List<Sheet> sheets) {
    FlatteningResult flattened = flattener.flatten(modelName, sheets);
    List<String> warnings = new ArrayList<>(flattened.warnings());
    ExecutionPlan plan = ExecutionPlan.Build(flattened.model());
    warnings.addAll(plan.GetWarnings());
    return generate(plan, warnings);
  }

  public GeneratedCode generate(List<Sheet> sheets) { return generate("model", sheets); }

  /**
   * Generates from an existing plan.
   * @param warnings earlier warnings to report first; emission warnings are appended
   */
  public GeneratedCode generate(ExecutionPlan plan, List<String> warnings) {
    List<String> allWarnings = new ArrayList<>(warnings);
    String header = HeaderGenerator.Generate(plan);
    String source = GenerateSource(plan, integrationMethod, allWarnings);
    logger.debug("Generated {} with {} block(s), {} state(s), {} warning(s)", plan.getModelName(), plan.GetBlocks().size(), plan.stateCount(),
                 allWarnings.size());
    return new GeneratedCode(plan.getModelName(), header, source, allWarnings, plan.GetBlocks().size(), plan.stateCount());
  }

  private static String GenerateSource(ExecutionPlan plan, IntegrationMethod integrationMethod, List<String> warnings) {
    Map<String, String> helpers = new LinkedHashMap<>();
    CCodeBuilder definitions = new CCodeBuilder();
    for (PlannedBlock block : plan.GetBlocks())
      block.module().emitDefinitions(block, new BlockEmitter(plan, block, Target.Definitions, definitions, helpers, warnings));

    CCodeBuilder functions = new CCodeBuilder();
    InitFunctionGenerator.Generate(plan, functions);
    functions.blank();
    EnableStatesGenerator.Generate(plan, functions);
    functions.blank();
    DerivativesGenerator.Generate(plan, functions, helpers, warnings);
    functions.blank();
    StepFunctionGenerator.Generate(plan, integrationMethod, functions, helpers, warnings);

    CCodeBuilder code = new CCodeBuilder();
    code.comment("Generated model " + plan.getModel().metadata().modelName() + ". Do not edit.");
    code.line("#include \"" + plan.getModelName() + ".h\"");
    code.blank();
    code.line("#ifndef M_PI");
    code.line("#define M_PI 3.14159265358979323846");
    code.line("#endif");
    code.blank();
    for (String helper : helpers.values()) {
      code.raw(helper);
      code.blank();
    }
    if (!definitions.isEmpty()) {
      code.raw(definitions.toString());
      code.blank();
    }
    code.raw(functions.toString());
    return code.toString();
  }
}
