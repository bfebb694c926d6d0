package blockgen.blocks;

import blockgen.expr.ExprCodeGen.GeneratedExpression;
import blockgen.expr.ExpressionCompiler;
import blockgen.expr.ExpressionCompiler.CompiledExpression;
import blockgen.expr.ExpressionSyntaxException;
import blockgen.expr.ExpressionValidationException;
import blockgen.flatten.FlattenedBlock;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Custom C expression over in(0) .. in(numInputs-1). Inputs are bound to local temporaries so the expression text
 * stays short and each input is read once.
 */
public class EvaluateModule implements BlockModule {

  static final String inputPrefix = "_eval_in";

  @Override
  public int inputCount(FlattenedBlock block, int connectedPorts) {
    return Math.max(connectedPorts, block.block().getInt("numInputs", 1));
  }

  @Override
  public List<SignalType> outputTypes(FlattenedBlock block, List<SignalType> inputTypes) { return List.of(SignalType.DOUBLE); }

  /**
   * @throws ExpressionSyntaxException if the expression does not parse, naming the block
   * @throws ExpressionValidationException if the expression is invalid for the block's input count
   */
  @Override
  public Object prepare(FlattenedBlock block, List<SignalType> inputTypes, Consumer<String> warn) {
    String text = block.block().getString("expression", "in(0)");
    CompiledExpression compiled;
    try {
      compiled = ExpressionCompiler.compile(text, inputTypes.size());
    } catch (ExpressionSyntaxException e) {
      throw e.inBlock(block.flattenedName());
    } catch (ExpressionValidationException e) {
      throw e.inBlock(block.flattenedName());
    }
    for (String warning : compiled.warnings())
      warn.accept("Evaluate block " + block.flattenedName() + ": " + warning);
    for (int port = 0; port < inputTypes.size(); ++port) {
      if (inputTypes.get(port) != null && !inputTypes.get(port).isScalar())
        warn.accept("Evaluate block " + block.flattenedName() + " input " + port + " is " + inputTypes.get(port) + "; only element 0 is used");
    }
    return compiled;
  }

  @Override
  public void emitStep(PlannedBlock block, CEmitter out) {
    CompiledExpression compiled = block.preparedAs(CompiledExpression.class);
    List<String> names = new ArrayList<>();
    out.open("");
    for (int port = 0; port < block.inputCount(); ++port) {
      String name = inputPrefix + port;
      names.add(name);
      if (compiled.validation().usedInputs().contains(port))
        out.line("const double " + name + " = " + out.inputElement(port, 0) + ";");
    }
    GeneratedExpression generated = compiled.generateCode(names);
    out.line(out.output(0) + " = " + generated.code() + ";");
    out.close();
  }

  @Override
  public void simulateStep(PlannedBlock block, SimFrame frame) {
    CompiledExpression compiled = block.preparedAs(CompiledExpression.class);
    double[] values = new double[block.inputCount()];
    for (int port = 0; port < values.length; ++port)
      values[port] = frame.inputElement(port, 0);
    frame.setOutput(0, new double[] {compiled.evaluate(values)});
  }
}
