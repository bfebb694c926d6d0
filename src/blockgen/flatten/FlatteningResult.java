package blockgen.flatten;

import java.util.List;

/**
 * Output of one flatten invocation.
 */
public record FlatteningResult(FlattenedModel model, List<String> warnings, Diagnostics diagnostics, List<SheetLabelIssue> sheetLabelIssues) {

  public record Diagnostics(int blocksFlattened, int connectionsRemapped, int subsystemsProcessed, int sheetLabelsResolved,
                            int enableScopesCreated) {}

  public FlatteningResult {
    warnings = List.copyOf(warnings);
    sheetLabelIssues = List.copyOf(sheetLabelIssues);
  }
}
