package blockgen.frontend;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import blockgen.frontend.ModelReader.LoadedModel;
import java.util.List;
import org.junit.jupiter.api.Test;

class ModelReaderTest {

  static final String nestedModel = """
      name: plant
      sheets:
        - id: main
          blocks:
            - id: src
              type: source
              parameters: {value: 1.0}
            - id: sub
              type: subsystem
              name: Inner
              parameters:
                inputPorts: [u]
                outputPorts: [y]
                sheets:
                  - id: inner
                    blocks:
                      - {id: in, type: input_port, name: u}
                      - {id: k, type: scale, parameters: {gain: 2}}
                      - {id: out, type: output_port, name: y}
                    connections:
                      - {sourceBlockId: in, targetBlockId: k}
                      - {sourceBlockId: k, targetBlockId: out}
          connections:
            - {id: w1, sourceBlockId: src, sourcePortIndex: 0, targetBlockId: sub, targetPortIndex: 0}
      """;

  @Test
  void readsNestedSubsystem() {
    LoadedModel model = new ModelReader().ReadModel(nestedModel, "fallback");
    assertEquals("plant", model.name());
    assertEquals(1, model.sheets().size());
    Sheet main = model.sheets().get(0);
    assertEquals(2, main.blocks().size());
    Block sub = main.GetBlock("sub").orElseThrow();
    assertTrue(sub.isSubsystem());
    assertEquals("Inner", sub.name());
    assertEquals(List.of("u"), sub.getStringList("inputPorts"));
    List<Sheet> inner = sub.getSubsystemSheets();
    assertEquals(1, inner.size());
    assertEquals(3, inner.get(0).blocks().size());
    assertEquals(2.0, inner.get(0).GetBlock("k").orElseThrow().getDouble("gain", 0.0));

    Connection wire = main.connections().get(0);
    assertEquals("w1", wire.id());
    assertEquals(Connection.DIRECT, wire.connectionType());
    // generated ids for wires without one
    assertEquals("inner_conn0", inner.get(0).connections().get(0).id());
  }

  @Test
  void blockNameDefaultsToId() {
    LoadedModel model = new ModelReader().ReadModel(nestedModel, "fallback");
    assertEquals("src", model.sheets().get(0).GetBlock("src").orElseThrow().name());
  }

  @Test
  void listDocumentUsesFallbackName() {
    String text = "- id: s1\n  blocks:\n    - {id: a, type: source}\n";
    LoadedModel model = new ModelReader().ReadModel(text, "fallback");
    assertEquals("fallback", model.name());
    assertEquals("a", model.sheets().get(0).blocks().get(0).id());
  }

  @Test
  void enableWireUsesNegativePort() {
    String text = "- id: s1\n  connections:\n    - {sourceBlockId: a, targetBlockId: b, targetPortIndex: -1}\n";
    Connection wire = new ModelReader().ReadModel(text, "m").sheets().get(0).connections().get(0);
    assertTrue(wire.isEnableWire());
    assertFalse(new Connection("c", "a", 0, "b", 0).isEnableWire());
  }

  @Test
  void rejectsRecursiveSubsystem() {
    String text = """
        name: loop
        sheets: &top
          - id: main
            blocks:
              - id: sub
                type: subsystem
                parameters:
                  sheets: *top
        """;
    var e = assertThrows(ModelFormatException.class, () -> new ModelReader().ReadModel(text, "m"));
    assertTrue(e.getMessage().contains("cannot contain itself"), e.getMessage());
  }

  @Test
  void rejectsInvalidYaml() {
    assertThrows(ModelFormatException.class, () -> new ModelReader().ReadModel("sheets: [ {id: a", "m"));
  }

  @Test
  void rejectsMissingBlockType() {
    String text = "- id: s1\n  blocks:\n    - {id: a}\n";
    var e = assertThrows(ModelFormatException.class, () -> new ModelReader().ReadModel(text, "m"));
    assertEquals("Missing 'type' in block a", e.getMessage());
  }

  @Test
  void rejectsScalarDocument() {
    assertThrows(ModelFormatException.class, () -> new ModelReader().ReadModel("42", "m"));
  }
}
