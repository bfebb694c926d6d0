package blockgen.frontend;

import java.util.Objects;

/**
 * Directed wire between an output port of one block and an input port of another.
 * A target port index of {@link #ENABLE_PORT} addresses the enable port of a subsystem block.
 * connectionType is free-form metadata; wires drawn by the user carry {@link #DIRECT}.
 */
public record Connection(String id, String sourceBlockId, int sourcePortIndex, String targetBlockId, int targetPortIndex,
                         String connectionType) {
  public static final int ENABLE_PORT = -1;

  public static final String DIRECT = "direct";
  public static final String SUBSYSTEM_INPUT = "subsystem_input";
  public static final String SUBSYSTEM_OUTPUT = "subsystem_output";
  public static final String ENABLE = "enable";

  public Connection {
    Objects.requireNonNull(id, "connection id");
    Objects.requireNonNull(sourceBlockId, "sourceBlockId of connection " + id);
    Objects.requireNonNull(targetBlockId, "targetBlockId of connection " + id);
    if (connectionType == null)
      connectionType = DIRECT;
  }

  public Connection(String id, String sourceBlockId, int sourcePortIndex, String targetBlockId, int targetPortIndex) {
    this(id, sourceBlockId, sourcePortIndex, targetBlockId, targetPortIndex, DIRECT);
  }

  public boolean isEnableWire() { return targetPortIndex == ENABLE_PORT; }

  @Override
  public String toString() {
    return String.format("%s: %s[%d] -> %s[%d] (%s)", id, sourceBlockId, sourcePortIndex, targetBlockId, targetPortIndex, connectionType);
  }
}
