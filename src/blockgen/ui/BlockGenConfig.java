package blockgen.ui;

import blockgen.codegen.IntegrationMethod;
import blockgen.flatten.ModelFlattener;

/**
 * Data-Class to hold tool options.
 */
public class BlockGenConfig {

  /** Base name of the generated files and prefix of every generated C symbol. */
  public String modelName = "model";
  /** Subsystems nested deeper than this are skipped with a warning. */
  public int maxNestingDepth = ModelFlattener.DEFAULT_MAX_NESTING_DEPTH;
  /** Treat any modeling warning as a failure. */
  public boolean warningsAsErrors = false;
  public boolean writeManifest = true;
  /** Scheme of the generated step function and of the simulator. */
  public IntegrationMethod integrationMethod = IntegrationMethod.RK4;
  /** Step size used by the simulator when none is given. */
  public double simulationDt = 0.01;
}
