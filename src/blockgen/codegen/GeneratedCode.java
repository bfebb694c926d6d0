package blockgen.codegen;

import java.util.List;

/**
 * Result of one generation: the two C artifacts plus everything recoverable that went wrong on the way.
 *
 * @param modelName sanitized model name, the base name of both files
 */
public record GeneratedCode(String modelName, String header, String source, List<String> warnings, int blockCount, int stateCount) {

  public GeneratedCode {
    warnings = List.copyOf(warnings);
  }

  public String headerFileName() { return modelName + ".h"; }

  public String sourceFileName() { return modelName + ".c"; }
}
