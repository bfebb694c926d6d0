package blockgen.expr;

import blockgen.expr.ExprNode.BinaryExpression;
import blockgen.expr.ExprNode.ConditionalExpression;
import blockgen.expr.ExprNode.FunctionCall;
import blockgen.expr.ExprNode.Identifier;
import blockgen.expr.ExprNode.NumberLiteral;
import blockgen.expr.ExprNode.UnaryExpression;
import blockgen.util.CText;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders an expression tree as one C expression.
 * Binary expressions are parenthesized except when they form a complete function argument.
 */
public class ExprCodeGen {

  /** @param needsMath set if the code calls anything declared in math.h */
  public record GeneratedExpression(String code, boolean needsMath) {}

  private final List<String> inputNames;
  private boolean needsMath = false;

  private ExprCodeGen(List<String> inputNames) { this.inputNames = inputNames; }

  /**
   * @param inputNames C expressions to substitute for in(0), in(1), ...
   */
  public static GeneratedExpression generate(ExprNode root, List<String> inputNames) {
    ExprCodeGen gen = new ExprCodeGen(inputNames);
    String code = gen.render(root, false);
    return new GeneratedExpression(code, gen.needsMath);
  }

  private String render(ExprNode node, boolean asArgument) {
    if (node instanceof NumberLiteral) {
      var literal = (NumberLiteral)node;
      return literal.isFloat() ? CText.formatDouble(literal.value()) : Long.toString((long)literal.value());
    }
    if (node instanceof Identifier)
      return ((Identifier)node).name();
    if (node instanceof FunctionCall)
      return renderCall((FunctionCall)node);
    if (node instanceof UnaryExpression) {
      var unary = (UnaryExpression)node;
      if (unary.operator().equals("++") || unary.operator().equals("--"))
        throw new IllegalArgumentException("Operator '" + unary.operator() + "' not allowed in evaluate expressions");
      if (unary.operator().equals("~") && !unary.operand().isIntegerTyped())
        return "(~(long)(" + render(unary.operand(), true) + "))";
      return "(" + unary.operator() + render(unary.operand(), false) + ")";
    }
    if (node instanceof BinaryExpression)
      return renderBinary((BinaryExpression)node, asArgument);
    if (node instanceof ConditionalExpression) {
      var cond = (ConditionalExpression)node;
      return "((" + render(cond.test(), true) + ") ? (" + render(cond.consequent(), true) + ") : (" + render(cond.alternate(), true) + "))";
    }
    throw new IllegalArgumentException("Unsupported expression node " + node);
  }

  private String renderCall(FunctionCall call) {
    if (call.isInputReference()) {
      int idx = (int)((NumberLiteral)call.arguments().get(0)).value();
      if (idx < 0 || idx >= inputNames.size())
        throw new IllegalArgumentException("in(" + idx + ") has no input variable; " + inputNames.size() + " name(s) given");
      return inputNames.get(idx);
    }
    if (MathFunctions.needsMathHeader(call.name()))
      needsMath = true;
    switch (call.name()) {
    case "abs":
      return "abs((int)(" + render(call.arguments().get(0), true) + "))";
    case "labs":
      return "labs((long)(" + render(call.arguments().get(0), true) + "))";
    case "signbit":
      return "(signbit(" + render(call.arguments().get(0), true) + ") ? 1 : 0)";
    default:
      return call.name() + call.arguments().stream().map(arg -> render(arg, true)).collect(Collectors.joining(", ", "(", ")"));
    }
  }

  private String renderBinary(BinaryExpression binary, boolean asArgument) {
    String op = binary.operator();
    if (op.equals("%") && !binary.isIntegerTyped()) {
      needsMath = true;
      return "fmod(" + render(binary.left(), true) + ", " + render(binary.right(), true) + ")";
    }
    String left = render(binary.left(), false);
    String right = render(binary.right(), false);
    if (ExprNode.bitwiseOperators.contains(op)) {
      if (!binary.left().isIntegerTyped())
        left = "(long)(" + left + ")";
      if (!binary.right().isIntegerTyped())
        right = "(long)(" + right + ")";
    }
    String text = left + " " + op + " " + right;
    return asArgument ? text : "(" + text + ")";
  }
}
