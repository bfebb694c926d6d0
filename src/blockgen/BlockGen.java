package blockgen;

import blockgen.codegen.CodeGenerator;
import blockgen.codegen.ExecutionPlan;
import blockgen.codegen.GeneratedCode;
import blockgen.flatten.FlatteningResult;
import blockgen.flatten.ModelFlattener;
import blockgen.frontend.Sheet;
import blockgen.sim.ModelSimulator;
import blockgen.ui.BlockGenConfig;
import blockgen.util.FileWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Entry point for callers: flatten a model, generate its C code, simulate it or write the artifacts to disk.
 */
public class BlockGen {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final String manifestFileName = "manifest.yaml";

  private final BlockGenConfig config;

  public BlockGen() { this(new BlockGenConfig()); }

  public BlockGen(BlockGenConfig config) { this.config = config; }

  public BlockGenConfig getConfig() { return config; }

  private ModelFlattener flattener() { return new ModelFlattener(config.maxNestingDepth); }

  public FlatteningResult flatten(List<Sheet> sheets) { return flattener().flatten(config.modelName, sheets); }

  /** @see CodeGenerator#generate(String, List) */
  public GeneratedCode generate(List<Sheet> sheets) {
    return new CodeGenerator(flattener(), config.integrationMethod).generate(config.modelName, sheets);
  }

  /** Simulator over the flattened model with the configured step size. */
  public ModelSimulator simulate(List<Sheet> sheets) {
    return new ModelSimulator(ExecutionPlan.Build(flatten(sheets).model()), config.simulationDt, config.integrationMethod);
  }

  /**
   * Generates the model and writes &lt;model&gt;.h, &lt;model&gt;.c and optionally the manifest into outPath.
   * @return false if warnings are treated as errors and there were any, or if writing failed
   */
  public boolean Generate(List<Sheet> sheets, String outPath) {
    GeneratedCode code = generate(sheets);
    if (config.warningsAsErrors && !code.warnings().isEmpty()) {
      logger.error("Generation produced {} warning(s), which are treated as errors; no files written", code.warnings().size());
      return false;
    }
    FileWriter writer = new FileWriter(outPath);
    writer.AddFile(code.headerFileName(), code.header());
    writer.AddFile(code.sourceFileName(), code.source());
    if (config.writeManifest)
      writer.AddYaml(manifestFileName, manifest(code));
    return writer.WriteFiles();
  }

  Map<String, Object> manifest(GeneratedCode code) {
    Map<String, Object> ret = new LinkedHashMap<>();
    ret.put("model", code.modelName());
    ret.put("files", List.of(code.headerFileName(), code.sourceFileName()));
    ret.put("blocks", code.blockCount());
    ret.put("states", code.stateCount());
    ret.put("integration", config.integrationMethod.serialName);
    ret.put("warnings", new ArrayList<>(code.warnings()));
    return ret;
  }
}
