package blockgen.flatten;

/**
 * Problem found while matching sheet label sinks and sources inside one scope.
 */
public record SheetLabelIssue(IssueType issueType, String blockId, String blockName, String signalName, String message) {

  public enum IssueType {
    DuplicateSink("duplicate_sink"),
    UnmatchedSource("unmatched_source"),
    EmptySignalName("empty_signal_name");

    public final String serialName;

    private IssueType(String serialName) { this.serialName = serialName; }

    @Override
    public String toString() {
      return serialName;
    }
  }
}
