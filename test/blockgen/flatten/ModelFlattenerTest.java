package blockgen.flatten;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import blockgen.TestModelBuilder;
import blockgen.flatten.SheetLabelIssue.IssueType;
import blockgen.frontend.Block;
import blockgen.frontend.Connection;
import blockgen.frontend.Sheet;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ModelFlattenerTest {

  /** Subsystem body passing input port u through a gain to output port y. */
  static List<Sheet> gainBody(String sheetId, double gain) {
    return new TestModelBuilder(sheetId)
        .named("in", "input_port", "u")
        .block("k", "scale", "gain", gain)
        .named("out", "output_port", "y")
        .wire("in", "k")
        .wire("k", "out")
        .sheets();
  }

  static FlattenedBlock byName(FlatteningResult result, String flattenedName) {
    return result.model().GetBlockByName(flattenedName).orElseThrow(() -> new AssertionError("no block " + flattenedName));
  }

  @Test
  void warnsAboutEnableInputWithoutWire() {
    var sheets = new TestModelBuilder().subsystem("sub", "EnabledSub", true, List.of(), List.of(), List.of()).sheets();
    FlatteningResult result = new ModelFlattener().flatten(sheets);
    assertEquals(List.of("Subsystem EnabledSub has enable input but no enable wire connected"), result.warnings());
    SubsystemEnableInfo info = result.model().GetEnableInfo("sub").orElseThrow();
    assertTrue(info.hasEnableInput());
    assertTrue(info.GetEnableWire().isEmpty());
  }

  @Test
  void nestedEnabledSubsystems() {
    var grandchild = new TestModelBuilder("g_sheet").block("src", "source").block("leaf", "signal_display").wire("src", "leaf").sheets();
    var child = new TestModelBuilder("c_sheet").subsystem("g", "Grandchild", true, List.of(), List.of(), grandchild).sheets();
    var parent = new TestModelBuilder("p_sheet").subsystem("c", "Child", true, List.of(), List.of(), child).sheets();
    var sheets = new TestModelBuilder().subsystem("p", "Parent", true, List.of(), List.of(), parent).sheets();
    FlatteningResult result = new ModelFlattener().flatten(sheets);
    FlattenedModel model = result.model();

    assertEquals(List.of("Parent", "Parent_Child", "Parent_Child_Grandchild"),
                 model.subsystemEnableInfo().stream().map(SubsystemEnableInfo::subsystemName).toList());
    assertNull(model.GetEnableInfo("p").orElseThrow().parentSubsystemId());
    assertEquals("p", model.GetEnableInfo("p/c").orElseThrow().parentSubsystemId());
    assertEquals("p/c", model.GetEnableInfo("p/c/g").orElseThrow().parentSubsystemId());
    assertEquals(3, model.GetEnableInfo("p/c/g").orElseThrow().depth());

    FlattenedBlock leaf = byName(result, "Parent_Child_Grandchild_leaf");
    assertEquals("p/c/g/leaf", leaf.id());
    assertEquals("leaf", leaf.originalId());
    assertEquals("p/c/g", leaf.enableScope());
    assertEquals(List.of("Parent", "Child", "Grandchild"), leaf.subsystemPath());
    assertEquals(3, model.metadata().maxNestingDepth());
    // every level controls the leaf
    for (String subId : List.of("p", "p/c", "p/c/g"))
      assertTrue(model.GetEnableInfo(subId).orElseThrow().controlledBlockIds().contains(leaf.id()), subId);
  }

  @Test
  void subsystemWithoutEnableInheritsScope() {
    var inner = new TestModelBuilder("m_sheet").block("x", "source").sheets();
    var mid = new TestModelBuilder("o_sheet").subsystem("m", "Mid", false, List.of(), List.of(), inner).sheets();
    var sheets = new TestModelBuilder()
                     .block("en", "source")
                     .subsystem("o", "Outer", true, List.of(), List.of(), mid)
                     .enable("en", "o")
                     .sheets();
    FlatteningResult result = new ModelFlattener().flatten(sheets);
    assertEquals("o", byName(result, "Outer_Mid_x").enableScope());
    SubsystemEnableInfo midInfo = result.model().GetEnableInfo("o/m").orElseThrow();
    assertTrue(midInfo.inheritsEnable());
    assertEquals("o", midInfo.parentSubsystemId());
    assertNull(byName(result, "en").enableScope());

    Connection enableWire = result.model().GetEnableInfo("o").orElseThrow().enableWire();
    assertNotNull(enableWire);
    assertEquals("en", enableWire.sourceBlockId());
    assertEquals(Connection.ENABLE, enableWire.connectionType());
    // enable wires are not part of the signal connections
    assertTrue(result.model().connections().stream().noneMatch(Connection::isEnableWire));
    assertTrue(result.warnings().isEmpty(), result.warnings().toString());
  }

  @Test
  void instancesOfOneDefinitionAreIndependent() {
    var body = gainBody("inner", 3.0);
    var sheets = new TestModelBuilder()
                     .block("src", "source")
                     .subsystem("s1", "A", false, List.of("u"), List.of("y"), body)
                     .subsystem("s2", "B", false, List.of("u"), List.of("y"), body)
                     .block("d1", "signal_display")
                     .block("d2", "signal_display")
                     .wire("src", "s1")
                     .wire("src", "s2")
                     .wire("s1", "d1")
                     .wire("s2", "d2")
                     .sheets();
    FlatteningResult result = new ModelFlattener().flatten(sheets);
    assertEquals("s1/k", byName(result, "A_k").id());
    assertEquals("s2/k", byName(result, "B_k").id());
    assertEquals(5, result.model().blocks().size());
    assertEquals(4, result.model().connections().size());
    assertTrue(result.warnings().isEmpty(), result.warnings().toString());
  }

  @Test
  void boundaryPortsBecomeDirectWires() {
    var sheets = new TestModelBuilder()
                     .block("src", "source")
                     .subsystem("sub", "Sub", false, List.of("u"), List.of("y"), gainBody("inner", 2.0))
                     .block("disp", "signal_display")
                     .wire("src", "sub")
                     .wire("sub", "disp")
                     .sheets();
    FlatteningResult result = new ModelFlattener().flatten(sheets);
    List<Connection> conns = result.model().connections();
    assertEquals(2, conns.size());

    Connection into = conns.get(0);
    assertEquals("src", into.sourceBlockId());
    assertEquals("sub/k", into.targetBlockId());
    assertEquals(Connection.SUBSYSTEM_INPUT, into.connectionType());

    Connection out = conns.get(1);
    assertEquals("sub/k", out.sourceBlockId());
    assertEquals("disp", out.targetBlockId());
    assertEquals(Connection.SUBSYSTEM_OUTPUT, out.connectionType());

    // port blocks of the subsystem boundary are gone
    assertTrue(result.model().blocks().stream().noneMatch(block -> block.type().endsWith("_port")));
    assertEquals(2, result.diagnostics().connectionsRemapped());
  }

  @Test
  void sheetLabelsAreReplacedByWires() {
    var sheets = new TestModelBuilder()
                     .block("src", "source")
                     .block("sink", "sheet_label_sink", "signalName", "speed")
                     .block("lsrc", "sheet_label_source", "signalName", "speed")
                     .block("disp", "signal_display")
                     .wire("src", "sink")
                     .wire("lsrc", "disp")
                     .sheets();
    FlatteningResult result = new ModelFlattener().flatten(sheets);
    assertEquals(2, result.model().blocks().size());
    List<Connection> conns = result.model().connections();
    assertEquals(1, conns.size());
    assertEquals("src", conns.get(0).sourceBlockId());
    assertEquals("disp", conns.get(0).targetBlockId());
    assertEquals(1, result.diagnostics().sheetLabelsResolved());
    assertTrue(result.sheetLabelIssues().isEmpty());
  }

  @Test
  void unmatchedSheetLabelSourceIsReported() {
    var sheets = new TestModelBuilder()
                     .block("lsrc", "sheet_label_source", "signalName", "nope")
                     .block("disp", "signal_display")
                     .wire("lsrc", "disp")
                     .sheets();
    FlatteningResult result = new ModelFlattener().flatten(sheets);
    assertEquals(1, result.sheetLabelIssues().size());
    assertEquals(IssueType.UnmatchedSource, result.sheetLabelIssues().get(0).issueType());
    assertTrue(result.warnings().contains("Sheet Label Source \"lsrc\" references non-existent signal \"nope\""), result.warnings().toString());
    assertTrue(result.model().connections().isEmpty());
  }

  @Test
  void blockWithoutWiresIsReported() {
    FlatteningResult result = new ModelFlattener().flatten(new TestModelBuilder().block("k", "scale").sheets());
    assertEquals(List.of("Block k (scale) has no connections"), result.warnings());
  }

  @Test
  void duplicateNamesGetSuffix() {
    var sheets = new TestModelBuilder()
                     .named("a", "source", "gain")
                     .named("b", "source", "gain")
                     .sheets();
    FlatteningResult result = new ModelFlattener().flatten(sheets);
    assertEquals("gain", result.model().GetBlock("a").orElseThrow().flattenedName());
    assertEquals("gain_2", result.model().GetBlock("b").orElseThrow().flattenedName());
    assertTrue(result.warnings().contains("Flattened name gain is already taken; using gain_2"));
  }

  @Test
  void selfContainingSubsystemIsSkipped() {
    List<Sheet> body = new ArrayList<>();
    Block self = new Block("self", "subsystem", "Self", TestModelBuilder.params("sheets", body));
    body.add(new Sheet("inner", "inner", List.of(self), List.of()));
    FlatteningResult result = assertDoesNotThrow(() -> new ModelFlattener().flatten(List.of(new Sheet("main", "main", List.of(self), List.of()))));
    assertTrue(result.warnings().contains("Subsystem Self_Self contains itself; its contents are skipped"), result.warnings().toString());
  }

  @Test
  void cyclicEnableWiringFlattens() {
    var body = new TestModelBuilder("inner").block("s", "source").named("out", "output_port", "y").wire("s", "out").sheets();
    var sheets = new TestModelBuilder()
                     .subsystem("a", "A", true, List.of(), List.of("y"), body)
                     .subsystem("b", "B", true, List.of(), List.of("y"), body)
                     .enable("a", "b")
                     .enable("b", "a")
                     .sheets();
    FlatteningResult result = assertDoesNotThrow(() -> new ModelFlattener().flatten(sheets));
    assertEquals("b/s", result.model().GetEnableInfo("a").orElseThrow().enableWire().sourceBlockId());
    assertEquals("a/s", result.model().GetEnableInfo("b").orElseThrow().enableWire().sourceBlockId());
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 2, 3})
  void nestingDepthIsBounded(int maxDepth) {
    List<Sheet> body = new TestModelBuilder("leaf").block("x", "source").sheets();
    for (int level = 4; level >= 1; --level)
      body = new TestModelBuilder("l" + level).subsystem("s" + level, "S" + level, false, List.of(), List.of(), body).sheets();
    FlatteningResult result = new ModelFlattener(maxDepth).flatten(body);
    assertTrue(result.warnings().stream().anyMatch(warning -> warning.contains("exceeds the maximum nesting depth of " + maxDepth)),
               result.warnings().toString());
    assertFalse(result.model().blocks().stream().anyMatch(block -> block.originalId().equals("x")));
  }

  @Test
  void rejectsZeroDepth() { assertThrows(IllegalArgumentException.class, () -> new ModelFlattener(0)); }

  @Test
  void runsAreIndependent() {
    var flattener = new ModelFlattener();
    var sheets = new TestModelBuilder().block("a", "source").sheets();
    flattener.flatten(sheets);
    FlatteningResult second = flattener.flatten(sheets);
    assertEquals("a", second.model().blocks().get(0).flattenedName());
    assertTrue(second.warnings().isEmpty());
  }

  // Random nests of subsystems with colliding names keep every flattened name and id unique.
  @RepeatedTest(64)
  void flattenedNamesAreUniqueRandom() {
    long seed = new Random().nextLong();
    try {
      flattenedNamesAreUnique(seed);
    } catch (Throwable e) {
      System.out.println("FAILED flattenedNamesAreUnique with seed " + seed);
      throw e;
    }
  }

  @ParameterizedTest
  @ValueSource(longs = {0L, 1L, 42L, -7093417413617519541L})
  void flattenedNamesAreUnique(long seed) {
    Random rand = new Random(seed);
    List<Sheet> sheets = randomSheets(rand, "top", 0);
    FlatteningResult result = new ModelFlattener().flatten(sheets);
    Set<String> names = new HashSet<>();
    Set<String> ids = new HashSet<>();
    for (FlattenedBlock block : result.model().blocks()) {
      assertTrue(names.add(block.flattenedName()), "duplicate name " + block.flattenedName());
      assertTrue(ids.add(block.id()), "duplicate id " + block.id());
    }
    for (SubsystemEnableInfo info : result.model().subsystemEnableInfo())
      assertTrue(names.add(info.subsystemName()), "duplicate name " + info.subsystemName());
  }

  static final String[] namePool = {"x", "x_2", "x 2", "y", "Sub"};

  static List<Sheet> randomSheets(Random rand, String sheetId, int depth) {
    var builder = new TestModelBuilder(sheetId);
    int count = 1 + rand.nextInt(4);
    for (int i = 0; i < count; ++i) {
      String name = namePool[rand.nextInt(namePool.length)];
      if (depth < 3 && rand.nextInt(3) == 0)
        builder.subsystem("b" + i, name, rand.nextBoolean(), List.of(), List.of(), randomSheets(rand, sheetId + i, depth + 1));
      else
        builder.named("b" + i, "source", name);
    }
    return builder.sheets();
  }
}
