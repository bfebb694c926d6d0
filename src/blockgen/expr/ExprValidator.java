package blockgen.expr;

import blockgen.expr.ExprNode.BinaryExpression;
import blockgen.expr.ExprNode.ConditionalExpression;
import blockgen.expr.ExprNode.FunctionCall;
import blockgen.expr.ExprNode.Identifier;
import blockgen.expr.ExprNode.NumberLiteral;
import blockgen.expr.ExprNode.UnaryExpression;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Semantic checks of a parsed expression against the number of inputs of its block.
 */
public class ExprValidator {

  public record ValidationResult(List<String> errors, List<String> warnings, SortedSet<Integer> usedInputs, boolean usesMathFunctions,
                                 boolean hasFloatOperations) {
    public ValidationResult {
      errors = List.copyOf(errors);
      warnings = List.copyOf(warnings);
      usedInputs = Collections.unmodifiableSortedSet(new TreeSet<>(usedInputs));
    }

    public boolean isValid() { return errors.isEmpty(); }
  }

  private final int numInputs;
  private final List<String> errors = new ArrayList<>();
  private final List<String> warnings = new ArrayList<>();
  private final SortedSet<Integer> usedInputs = new TreeSet<>();
  private boolean usesMathFunctions = false;
  private boolean hasFloatOperations = false;
  private String firstBitwiseOperator = null;

  private ExprValidator(int numInputs) { this.numInputs = numInputs; }

  /**
   * @param numInputs number of inputs available to in(i)
   */
  public static ValidationResult validate(ExprNode root, int numInputs) {
    ExprValidator validator = new ExprValidator(numInputs);
    validator.visit(root);
    if (validator.firstBitwiseOperator != null && validator.hasFloatOperations)
      validator.warnings.add("Bitwise operator '" + validator.firstBitwiseOperator +
                             "' used in an expression with floating-point values; operands are truncated to integers");
    return new ValidationResult(validator.errors, validator.warnings, validator.usedInputs, validator.usesMathFunctions,
                                validator.hasFloatOperations);
  }

  private void visit(ExprNode node) {
    if (node instanceof NumberLiteral) {
      if (((NumberLiteral)node).isFloat())
        hasFloatOperations = true;
    } else if (node instanceof Identifier) {
      errors.add("Unknown identifier '" + ((Identifier)node).name() + "'. Inputs are referenced as in(0), in(1), ...");
    } else if (node instanceof FunctionCall) {
      visitCall((FunctionCall)node);
    } else if (node instanceof UnaryExpression) {
      var unary = (UnaryExpression)node;
      if (unary.operator().equals("++") || unary.operator().equals("--"))
        errors.add("Operator '" + unary.operator() + "' not allowed in evaluate expressions");
      if (unary.operator().equals("~"))
        noteBitwise("~");
      visit(unary.operand());
    } else if (node instanceof BinaryExpression) {
      var binary = (BinaryExpression)node;
      if (ExprNode.bitwiseOperators.contains(binary.operator()))
        noteBitwise(binary.operator());
      if (binary.operator().equals("/") || binary.operator().equals("%")) {
        Double divisor = literalValue(binary.right());
        if (divisor != null && divisor == 0.0)
          errors.add("Division by zero detected");
      }
      visit(binary.left());
      visit(binary.right());
    } else if (node instanceof ConditionalExpression) {
      var cond = (ConditionalExpression)node;
      visit(cond.test());
      visit(cond.consequent());
      visit(cond.alternate());
    }
  }

  private void visitCall(FunctionCall call) {
    if (call.isInputReference()) {
      Double index = (call.arguments().size() == 1 && call.arguments().get(0) instanceof NumberLiteral)
                         ? ((NumberLiteral)call.arguments().get(0)).value()
                         : null;
      if (index == null || index != Math.rint(index)) {
        errors.add("in() requires exactly one integer literal index");
        return;
      }
      int idx = index.intValue();
      if (idx < 0 || idx >= numInputs)
        errors.add("in(" + idx + ") is out of range. Valid range is 0 to " + (numInputs - 1));
      else
        usedInputs.add(idx);
      return;
    }
    String name = call.name();
    if (!MathFunctions.isSupported(name)) {
      errors.add("Unknown function '" + name + "'. Supported: " + MathFunctions.supportedList());
    } else {
      usesMathFunctions = true;
      if (!MathFunctions.returnsInteger(name))
        hasFloatOperations = true;
      int arity = MathFunctions.arity(name);
      if (call.arguments().size() != arity)
        errors.add(name + "() requires exactly " + arity + " argument(s), got " + call.arguments().size());
      else
        checkDomain(name, call.arguments());
    }
    call.arguments().forEach(this::visit);
  }

  private void checkDomain(String name, List<ExprNode> args) {
    Double arg = literalValue(args.get(0));
    if (arg == null)
      return;
    if (name.equals("sqrt") && arg < 0)
      warnings.add("sqrt() of negative value " + arg + " produces NaN");
    if ((name.equals("log") || name.equals("log2") || name.equals("log10")) && arg <= 0)
      warnings.add(name + "() of non-positive value " + arg + " is undefined");
    if ((name.equals("asin") || name.equals("acos")) && Math.abs(arg) > 1)
      warnings.add(name + "() of value " + arg + " outside [-1, 1] produces NaN");
  }

  private void noteBitwise(String operator) {
    if (firstBitwiseOperator == null)
      firstBitwiseOperator = operator;
  }

  /** Value of a literal, optionally behind unary sign operators; null for anything else. */
  static Double literalValue(ExprNode node) {
    if (node instanceof NumberLiteral)
      return ((NumberLiteral)node).value();
    if (node instanceof UnaryExpression) {
      var unary = (UnaryExpression)node;
      Double inner = literalValue(unary.operand());
      if (inner == null)
        return null;
      if (unary.operator().equals("-"))
        return -inner;
      if (unary.operator().equals("+"))
        return inner;
    }
    return null;
  }
}
