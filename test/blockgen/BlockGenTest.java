package blockgen;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import blockgen.codegen.IntegrationMethod;
import blockgen.ui.BlockGenConfig;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.yaml.snakeyaml.Yaml;

class BlockGenTest {

  @TempDir
  Path outDir;

  static BlockGen withName(String modelName) {
    BlockGenConfig config = new BlockGenConfig();
    config.modelName = modelName;
    return new BlockGen(config);
  }

  @Test
  void writesHeaderSourceAndManifest() throws IOException {
    assertTrue(withName("plant").Generate(TestModels.gatedIntegrators(), outDir.toString()));

    String header = Files.readString(outDir.resolve("plant.h"), StandardCharsets.UTF_8);
    assertTrue(header.contains("#ifndef PLANT_H"), header);
    assertTrue(Files.readString(outDir.resolve("plant.c")).contains("#include \"plant.h\""));

    Map<String, Object> manifest = new Yaml().load(Files.readString(outDir.resolve(BlockGen.manifestFileName)));
    assertEquals("plant", manifest.get("model"));
    assertEquals(List.of("plant.h", "plant.c"), manifest.get("files"));
    assertEquals(2, manifest.get("states"));
    assertTrue(((List<?>)manifest.get("warnings")).contains("Enable input of subsystem X is driven by double signal enable; it is coerced with != 0"),
               manifest.toString());
  }

  @Test
  void integrationMethodComesFromConfig() throws IOException {
    BlockGen gen = withName("plant");
    gen.getConfig().integrationMethod = IntegrationMethod.Euler;
    assertTrue(gen.Generate(TestModels.gatedIntegrators(), outDir.toString()));
    assertTrue(Files.readString(outDir.resolve("plant.c")).contains("/* Euler integration */"));
    Map<String, Object> manifest = new Yaml().load(Files.readString(outDir.resolve(BlockGen.manifestFileName)));
    assertEquals("euler", manifest.get("integration"));

    var sim = gen.simulate(TestModels.gatedIntegrators());
    sim.setInput("enable", 1.0);
    sim.run(3);
    // a constant derivative integrates exactly under Euler
    assertEquals(3 * gen.getConfig().simulationDt, sim.getState("X_TF")[0], 1e-12);
    assertEquals(IntegrationMethod.Euler, IntegrationMethod.fromSerialName(" EULER ").orElseThrow());
    assertTrue(IntegrationMethod.fromSerialName("midpoint").isEmpty());
  }

  @Test
  void manifestCanBeSkipped() {
    BlockGen gen = withName("plant");
    gen.getConfig().writeManifest = false;
    assertTrue(gen.Generate(TestModels.portedGain(), outDir.toString()));
    assertTrue(Files.exists(outDir.resolve("plant.c")));
    assertFalse(Files.exists(outDir.resolve(BlockGen.manifestFileName)));
  }

  @Test
  void manifestListsWarnings() throws IOException {
    var sheets = new TestModelBuilder().block("lonely", "scale").sheets();
    assertTrue(withName("model").Generate(sheets, outDir.toString()));
    Map<String, Object> manifest = new Yaml().load(Files.readString(outDir.resolve(BlockGen.manifestFileName)));
    assertEquals(List.of("Block lonely (scale) has no connections"), manifest.get("warnings"));
  }

  @Test
  void warningsAsErrorsWritesNothing() throws IOException {
    BlockGen gen = withName("model");
    gen.getConfig().warningsAsErrors = true;
    var sheets = new TestModelBuilder().block("lonely", "scale").sheets();
    assertFalse(gen.Generate(sheets, outDir.toString()));
    try (var listing = Files.list(outDir)) {
      assertEquals(0, listing.count());
    }
    // a clean model still passes
    assertTrue(gen.Generate(TestModels.portedGain(), outDir.toString()));
  }

  @Test
  void createsMissingOutputDirectory() {
    Path nested = outDir.resolve("a").resolve("b");
    assertTrue(withName("model").Generate(TestModels.portedGain(), nested.toString()));
    assertTrue(Files.exists(nested.resolve("model.h")));
  }

  @Test
  void simulatorUsesConfiguredStep() {
    BlockGen gen = new BlockGen();
    gen.getConfig().simulationDt = 0.25;
    var sim = gen.simulate(TestModels.gatedIntegrators());
    sim.setInput("enable", 1.0);
    sim.run(4);
    assertEquals(1.0, sim.getTime(), 1e-12);
    assertEquals(1.0, sim.getState("X_TF")[0], 1e-9);
  }

  @Test
  void nestingDepthComesFromConfig() {
    BlockGen gen = new BlockGen();
    gen.getConfig().maxNestingDepth = 1;
    var result = gen.flatten(TestModels.gatedIntegrators());
    assertTrue(result.warnings().contains("Subsystem X_Inner exceeds the maximum nesting depth of 1; its contents are skipped"), result.warnings().toString());
  }
}
