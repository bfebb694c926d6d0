package blockgen.codegen;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import blockgen.TestModelBuilder;
import blockgen.TestModels;
import blockgen.blocks.UnsupportedBlockTypeException;
import blockgen.expr.ExpressionSyntaxException;
import blockgen.expr.ExpressionValidationException;
import blockgen.flatten.ModelFlattener;
import java.util.List;
import org.junit.jupiter.api.Test;

class CodeGeneratorTest {

  static void assertContains(String text, String expected) {
    assertTrue(text.contains(expected), () -> "Missing '" + expected + "' in:\n" + text);
  }

  static void assertBefore(String text, String first, String second) {
    assertContains(text, first);
    assertContains(text, second);
    assertTrue(text.indexOf(first) < text.indexOf(second), () -> "'" + first + "' should come before '" + second + "'");
  }

  @Test
  void gatedIntegratorHeader() {
    GeneratedCode code = new CodeGenerator().generate("gated", TestModels.gatedIntegrators());
    String header = code.header();
    assertEquals("gated.h", code.headerFileName());
    assertContains(header, "#ifndef GATED_H");
    assertContains(header, "#include <math.h>");
    assertContains(header, "extern \"C\" {");
    assertContains(header, "} enable_states_t;");
    assertContains(header, "bool X_enabled;");
    assertContains(header, "bool X_Inner_enabled;");
    assertContains(header, "double X_TF_states[1];");
    assertContains(header, "double X_Inner_TF2_states[1];");
    assertContains(header, "} gated_states_t;");
    assertContains(header, "double enable;");
    assertContains(header, "void gated_init(gated_t* model, double dt);");
    assertContains(header, "void gated_step(gated_t* model);");
    assertContains(header, "void gated_evaluate_enable_states(gated_t* model);");
    assertContains(header, "void gated_derivatives(double t, const gated_inputs_t* inputs, const gated_signals_t* signals, "
                           + "const gated_states_t* current_states, gated_states_t* state_derivatives, const enable_states_t* enable_states);");
    // no output ports
    assertBefore(header, "char _unused;", "} gated_outputs_t;");
    assertEquals(2, code.stateCount());
    assertEquals(5, code.blockCount());
  }

  @Test
  void disabledSubsystemGuardsItsStates() {
    GeneratedCode code = new CodeGenerator().generate("gated", TestModels.gatedIntegrators());
    String source = code.source();
    assertContains(source, "#include \"gated.h\"");
    assertContains(source, "if (enable_states->X_enabled) {");
    assertContains(source, "state_derivatives->X_TF_states[0] = signals->X_u - 0.0 * current_states->X_TF_states[0];");
    assertContains(source, "model->signals.X_TF = 1.0 * model->states.X_TF_states[0];");
    assertContains(source, "if (model->enable_states.X_enabled) {");
    assertContains(source, "model->states.X_TF_states[0] = model->states.X_TF_states[0] + dt / 6.0 * (k1.X_TF_states[0] + 2.0 * k2.X_TF_states[0]"
                           + " + 2.0 * k3.X_TF_states[0] + k4.X_TF_states[0]);");
    assertContains(source, "temp_states.X_TF_states[0] = model->states.X_TF_states[0] + 0.5 * dt * k1.X_TF_states[0];");
    assertContains(source, "temp_states.X_TF_states[0] = model->states.X_TF_states[0] + dt * k3.X_TF_states[0];");
    assertContains(source, "gated_derivatives(model->time + dt, &model->inputs, &model->signals, &temp_states, &k4, &model->enable_states);");
  }

  @Test
  void enableFlagsAreEvaluatedParentFirst() {
    GeneratedCode code = new CodeGenerator().generate("gated", TestModels.gatedIntegrators());
    String source = code.source();
    assertContains(source, "model->enable_states.X_enabled = (model->signals.enable != 0);");
    assertContains(source, "/* X_Inner inherits enable state from parent X */");
    assertBefore(source, "model->enable_states.X_enabled = (", "model->enable_states.X_Inner_enabled = model->enable_states.X_enabled;");
    assertContains(source, "model->enable_states.X_enabled = true;");
    assertTrue(code.warnings().contains("Enable input of subsystem X is driven by double signal enable; it is coerced with != 0"),
               code.warnings().toString());
  }

  @Test
  void sourceLayout() {
    String source = new CodeGenerator().generate("gated", TestModels.gatedIntegrators()).source();
    assertBefore(source, "#define M_PI", "void gated_init(gated_t* model, double dt)");
    assertBefore(source, "void gated_init(", "void gated_evaluate_enable_states(");
    assertBefore(source, "void gated_evaluate_enable_states(", "void gated_derivatives(");
    assertBefore(source, "void gated_derivatives(", "void gated_step(");
    // block outputs, then enable evaluation, then integration, then time
    int step = source.indexOf("void gated_step(");
    int outputs = source.indexOf("model->signals.X_TF =", step);
    int enables = source.indexOf("gated_evaluate_enable_states(model);", step);
    int rk4 = source.indexOf("/* RK4 integration */", step);
    int time = source.indexOf("model->time += model->dt;", step);
    assertTrue(step < outputs && outputs < enables && enables < rk4 && rk4 < time, source);
  }

  @Test
  void statelessModelHasNoIntegration() {
    GeneratedCode code = new CodeGenerator().generate("ported", TestModels.portedGain());
    String source = code.source();
    assertFalse(source.contains("RK4"));
    assertContains(source, "(void)model;");
    assertContains(source, "model->signals.a = model->inputs.a;");
    assertContains(source, "model->signals.diff = model->signals.a - model->signals.b;");
    assertContains(source, "model->signals.Gain_k = 2.0 * model->signals.diff;");
    assertContains(source, "const double _eval_in0 = model->signals.Gain_k;");
    assertContains(source, "model->signals.sq = (_eval_in0 * _eval_in0);");
    assertContains(source, "model->outputs.y = model->signals.Gain_k;");
    assertContains(source, "model->outputs.y2 = model->signals.sq;");
    assertBefore(code.header(), "char _unused;", "} ported_states_t;");
    assertTrue(code.warnings().isEmpty(), code.warnings().toString());
  }

  @Test
  void modelNameIsSanitized() {
    GeneratedCode code = new CodeGenerator().generate("my model", new TestModelBuilder().block("c", "source").sheets());
    assertEquals("my_model", code.modelName());
    assertEquals("my_model.c", code.sourceFileName());
    assertContains(code.header(), "} my_model_t;");
  }

  @Test
  void unsupportedBlockType() {
    var sheets = new TestModelBuilder().block("w", "wormhole").sheets();
    var e = assertThrows(UnsupportedBlockTypeException.class, () -> new CodeGenerator().generate(sheets));
    assertEquals("wormhole", e.getBlockType());
    assertEquals("Unsupported block type 'wormhole' (block w)", e.getMessage());
  }

  @Test
  void invalidExpressionNamesItsBlock() {
    var sheets = new TestModelBuilder().block("src", "source").block("calc", "evaluate", "expression", "in(3)").wire("src", "calc").sheets();
    var e = assertThrows(ExpressionValidationException.class, () -> new CodeGenerator().generate(sheets));
    assertTrue(e.getMessage().startsWith("Block calc: "), e.getMessage());
    assertEquals(1, e.getErrors().size());

    var broken = new TestModelBuilder().block("src", "source").block("calc", "evaluate", "expression", "in(0) +").wire("src", "calc").sheets();
    assertThrows(ExpressionSyntaxException.class, () -> new CodeGenerator().generate(broken));
  }

  @Test
  void algebraicLoopIsReported() {
    var sheets = new TestModelBuilder()
                     .block("src", "source")
                     .block("a", "sum")
                     .block("b", "scale", "gain", 0.5)
                     .wire("src", "a", 0)
                     .wire("b", "a", 1)
                     .wire("a", "b")
                     .sheets();
    GeneratedCode code = new CodeGenerator().generate(sheets);
    assertTrue(code.warnings().contains("Algebraic loop detected among blocks a, b; they are scheduled in declaration order"),
               code.warnings().toString());
    assertBefore(code.source(), "model->signals.a =", "model->signals.b =");
  }

  @Test
  void integratorFeedbackIsNoLoop() {
    var sheets = new TestModelBuilder()
                     .block("tf", "transfer_function", "denominator", List.of(1.0, 0.0))
                     .block("neg", "unary_minus")
                     .wire("tf", "neg")
                     .wire("neg", "tf")
                     .sheets();
    GeneratedCode code = new CodeGenerator().generate(sheets);
    assertTrue(code.warnings().isEmpty(), code.warnings().toString());
    assertBefore(code.source(), "model->signals.tf =", "model->signals.neg =");
  }

  @Test
  void duplicateWireIntoOnePortKeepsFirst() {
    var sheets = new TestModelBuilder()
                     .block("p", "source", "value", 1.0)
                     .block("q", "source", "value", 2.0)
                     .block("k", "scale")
                     .wire("p", "k")
                     .wire("q", "k")
                     .sheets();
    GeneratedCode code = new CodeGenerator().generate(sheets);
    assertTrue(code.warnings().contains("Input 0 of block k has more than one connection; using the first"), code.warnings().toString());
    assertContains(code.source(), "model->signals.k = 1.0 * model->signals.p;");
  }

  @Test
  void consumerDeclaredFirstIsScheduledAfterItsSource() {
    var sheets = new TestModelBuilder()
                     .block("k", "scale", "gain", 3.0)
                     .block("s", "source", "value", 2.0)
                     .block("y", "output_port")
                     .wire("k", "y")
                     .wire("s", "k")
                     .sheets();
    GeneratedCode code = new CodeGenerator().generate(sheets);
    assertTrue(code.warnings().isEmpty(), code.warnings().toString());
    assertBefore(code.source(), "model->signals.s =", "model->signals.k =");
    assertBefore(code.source(), "model->signals.k =", "model->outputs.y =");
  }

  @Test
  void eulerStepKeepsEnableGuards() {
    GeneratedCode code = new CodeGenerator(new ModelFlattener(), IntegrationMethod.Euler).generate("gated", TestModels.gatedIntegrators());
    String source = code.source();
    assertContains(source, "/* Euler integration */");
    assertContains(source, "gated_derivatives(model->time, &model->inputs, &model->signals, &model->states, &dx, &model->enable_states);");
    assertBefore(source, "if (model->enable_states.X_enabled) {", "model->states.X_TF_states[0] += dt * dx.X_TF_states[0];");
    assertContains(source, "model->states.X_Inner_TF2_states[0] += dt * dx.X_Inner_TF2_states[0];");
    assertFalse(source.contains("RK4"));
    assertFalse(source.contains("k4"));
    assertBefore(source, "+= dt * dx.", "model->time += model->dt;");
  }

  @Test
  void rk4IsTheDefault() {
    String source = new CodeGenerator().generate("gated", TestModels.gatedIntegrators()).source();
    assertContains(source, "/* RK4 integration */");
    assertFalse(source.contains("Euler"));
  }
}
