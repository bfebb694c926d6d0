package blockgen.expr;

import blockgen.expr.ExprNode.BinaryExpression;
import blockgen.expr.ExprNode.ConditionalExpression;
import blockgen.expr.ExprNode.FunctionCall;
import blockgen.expr.ExprNode.Identifier;
import blockgen.expr.ExprNode.NumberLiteral;
import blockgen.expr.ExprNode.UnaryExpression;

/**
 * Interprets an expression tree with C semantics: integer-typed division truncates, bitwise operators truncate their
 * operands, booleans are 0 and 1. Comparisons treat values closer than {@link #EPSILON} as equal.
 */
public class ExprEvaluator {
  public static final double EPSILON = 1e-10;

  public static double evaluate(ExprNode node, double[] inputs) {
    if (node instanceof NumberLiteral)
      return ((NumberLiteral)node).value();
    if (node instanceof FunctionCall)
      return evaluateCall((FunctionCall)node, inputs);
    if (node instanceof UnaryExpression)
      return evaluateUnary((UnaryExpression)node, inputs);
    if (node instanceof BinaryExpression)
      return evaluateBinary((BinaryExpression)node, inputs);
    if (node instanceof ConditionalExpression) {
      var cond = (ConditionalExpression)node;
      return (evaluate(cond.test(), inputs) != 0.0) ? evaluate(cond.consequent(), inputs) : evaluate(cond.alternate(), inputs);
    }
    if (node instanceof Identifier)
      throw new IllegalArgumentException("Unknown identifier '" + ((Identifier)node).name() + "'");
    throw new IllegalArgumentException("Unsupported expression node " + node);
  }

  private static double evaluateCall(FunctionCall call, double[] inputs) {
    if (call.isInputReference()) {
      int idx = (int)((NumberLiteral)call.arguments().get(0)).value();
      if (idx < 0 || idx >= inputs.length)
        throw new IllegalArgumentException("in(" + idx + ") is out of range. Valid range is 0 to " + (inputs.length - 1));
      return inputs[idx];
    }
    double a = evaluate(call.arguments().get(0), inputs);
    switch (call.name()) {
    case "sqrt":
      return Math.sqrt(a);
    case "sin":
      return Math.sin(a);
    case "cos":
      return Math.cos(a);
    case "tan":
      return Math.tan(a);
    case "asin":
      return Math.asin(a);
    case "acos":
      return Math.acos(a);
    case "atan":
      return Math.atan(a);
    case "ceil":
      return Math.ceil(a);
    case "floor":
      return Math.floor(a);
    case "trunc":
      return truncate(a);
    case "round":
    case "lround":
      return roundHalfAwayFromZero(a);
    case "log":
      return Math.log(a);
    case "log2":
      return Math.log(a) / Math.log(2.0);
    case "log10":
      return Math.log10(a);
    case "abs":
      return Math.abs((int)a);
    case "labs":
      return Math.abs((long)a);
    case "fabs":
      return Math.abs(a);
    case "signbit":
      return (a < 0 || (a == 0.0 && 1.0 / a < 0)) ? 1.0 : 0.0;
    default:
      break;
    }
    double b = evaluate(call.arguments().get(1), inputs);
    switch (call.name()) {
    case "pow":
      return Math.pow(a, b);
    case "atan2":
      return Math.atan2(a, b);
    case "fmax":
      return Double.isNaN(a) ? b : Double.isNaN(b) ? a : Math.max(a, b);
    case "fmin":
      return Double.isNaN(a) ? b : Double.isNaN(b) ? a : Math.min(a, b);
    default:
      throw new IllegalArgumentException("Unknown function '" + call.name() + "'. Supported: " + MathFunctions.supportedList());
    }
  }

  private static double evaluateUnary(UnaryExpression unary, double[] inputs) {
    switch (unary.operator()) {
    case "-":
      return -evaluate(unary.operand(), inputs);
    case "+":
      return evaluate(unary.operand(), inputs);
    case "!":
      return (evaluate(unary.operand(), inputs) == 0.0) ? 1.0 : 0.0;
    case "~":
      return ~(long)evaluate(unary.operand(), inputs);
    default:
      throw new UnsupportedOperationException("Operator '" + unary.operator() + "' not allowed in evaluate expressions");
    }
  }

  private static double evaluateBinary(BinaryExpression binary, double[] inputs) {
    String op = binary.operator();
    if (op.equals("&&"))
      return (evaluate(binary.left(), inputs) != 0.0 && evaluate(binary.right(), inputs) != 0.0) ? 1.0 : 0.0;
    if (op.equals("||"))
      return (evaluate(binary.left(), inputs) != 0.0 || evaluate(binary.right(), inputs) != 0.0) ? 1.0 : 0.0;
    double l = evaluate(binary.left(), inputs);
    double r = evaluate(binary.right(), inputs);
    switch (op) {
    case "+":
      return l + r;
    case "-":
      return l - r;
    case "*":
      return l * r;
    case "/":
      if (r == 0.0)
        throw new DivisionByZeroException("Division by zero");
      return binary.isIntegerTyped() ? (double)((long)l / (long)r) : l / r;
    case "%":
      if (r == 0.0 || (binary.isIntegerTyped() && (long)r == 0))
        throw new DivisionByZeroException("Division by zero");
      return binary.isIntegerTyped() ? (double)((long)l % (long)r) : l % r;
    case "&":
      return (long)l & (long)r;
    case "|":
      return (long)l | (long)r;
    case "^":
      return (long)l ^ (long)r;
    case "<<":
      return (long)l << (int)(long)r;
    case ">>":
      return (long)l >> (int)(long)r;
    case "==":
      return approximatelyEqual(l, r) ? 1.0 : 0.0;
    case "!=":
      return approximatelyEqual(l, r) ? 0.0 : 1.0;
    case "<":
      return (l < r && !approximatelyEqual(l, r)) ? 1.0 : 0.0;
    case "<=":
      return (l < r || approximatelyEqual(l, r)) ? 1.0 : 0.0;
    case ">":
      return (l > r && !approximatelyEqual(l, r)) ? 1.0 : 0.0;
    case ">=":
      return (l > r || approximatelyEqual(l, r)) ? 1.0 : 0.0;
    default:
      throw new IllegalArgumentException("Unknown operator '" + op + "'");
    }
  }

  static boolean approximatelyEqual(double a, double b) { return a == b || Math.abs(a - b) < EPSILON; }

  static double truncate(double value) { return (value < 0) ? Math.ceil(value) : Math.floor(value); }

  static double roundHalfAwayFromZero(double value) {
    if (Double.isNaN(value) || Double.isInfinite(value))
      return value;
    return Math.signum(value) * Math.floor(Math.abs(value) + 0.5);
  }
}
