package blockgen;

import blockgen.frontend.Block;
import blockgen.frontend.Connection;
import blockgen.frontend.Sheet;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds one sheet of blocks and wires for tests. Block names default to their ids.
 */
public class TestModelBuilder {
  private final String sheetId;
  private final List<Block> blocks = new ArrayList<>();
  private final List<Connection> connections = new ArrayList<>();

  public TestModelBuilder() { this("main"); }

  public TestModelBuilder(String sheetId) { this.sheetId = sheetId; }

  /** Parameters from alternating keys and values. */
  public static Map<String, Object> params(Object... keyValues) {
    Map<String, Object> ret = new LinkedHashMap<>();
    for (int i = 0; i + 1 < keyValues.length; i += 2)
      ret.put(keyValues[i].toString(), keyValues[i + 1]);
    return ret;
  }

  public TestModelBuilder block(String id, String type, Object... keyValues) { return named(id, type, id, keyValues); }

  public TestModelBuilder named(String id, String type, String name, Object... keyValues) {
    blocks.add(new Block(id, type, name, params(keyValues)));
    return this;
  }

  /** Adds a subsystem whose body is the given sheets. */
  public TestModelBuilder subsystem(String id, String name, boolean showEnableInput, List<String> inputPorts, List<String> outputPorts,
                                    List<Sheet> body) {
    blocks.add(new Block(id, "subsystem", name,
                         params("sheets", body, "inputPorts", inputPorts, "outputPorts", outputPorts, "showEnableInput", showEnableInput)));
    return this;
  }

  public TestModelBuilder wire(String from, int fromPort, String to, int toPort) {
    connections.add(new Connection(sheetId + "_c" + connections.size(), from, fromPort, to, toPort));
    return this;
  }

  public TestModelBuilder wire(String from, String to) { return wire(from, 0, to, 0); }

  public TestModelBuilder wire(String from, String to, int toPort) { return wire(from, 0, to, toPort); }

  public TestModelBuilder enable(String from, String subsystemId) { return wire(from, 0, subsystemId, Connection.ENABLE_PORT); }

  public Sheet sheet() { return new Sheet(sheetId, sheetId, blocks, connections); }

  public List<Sheet> sheets() { return List.of(sheet()); }
}
