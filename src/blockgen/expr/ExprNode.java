package blockgen.expr;

import java.util.List;
import java.util.Set;

/**
 * Syntax tree of a custom expression.
 * {@link #isIntegerTyped()} follows the C typing of the generated code: literals without fraction are int,
 * input references are double.
 */
public interface ExprNode {

  boolean isIntegerTyped();

  Set<String> arithmeticOperators = Set.of("+", "-", "*", "/", "%");
  Set<String> bitwiseOperators = Set.of("&", "|", "^", "<<", ">>");

  record NumberLiteral(double value, boolean isFloat) implements ExprNode {
    @Override
    public boolean isIntegerTyped() {
      return !isFloat;
    }
  }

  /** Bare name; never valid on its own, kept so the validator can report it. */
  record Identifier(String name) implements ExprNode {
    @Override
    public boolean isIntegerTyped() {
      return false;
    }
  }

  /** Function call, including the input reference in(i). */
  record FunctionCall(String name, List<ExprNode> arguments) implements ExprNode {
    public FunctionCall {
      arguments = List.copyOf(arguments);
    }

    public boolean isInputReference() { return name.equals("in"); }

    @Override
    public boolean isIntegerTyped() {
      return !isInputReference() && MathFunctions.returnsInteger(name);
    }
  }

  record BinaryExpression(String operator, ExprNode left, ExprNode right) implements ExprNode {
    @Override
    public boolean isIntegerTyped() {
      if (arithmeticOperators.contains(operator))
        return left.isIntegerTyped() && right.isIntegerTyped();
      return true; // relational, logical and bitwise results are int in C
    }
  }

  /** Unary operator; prefix is false only for postfix increment and decrement. */
  record UnaryExpression(String operator, ExprNode operand, boolean prefix) implements ExprNode {
    @Override
    public boolean isIntegerTyped() {
      if (operator.equals("!") || operator.equals("~"))
        return true;
      return operand.isIntegerTyped();
    }
  }

  record ConditionalExpression(ExprNode test, ExprNode consequent, ExprNode alternate) implements ExprNode {
    @Override
    public boolean isIntegerTyped() {
      return consequent.isIntegerTyped() && alternate.isIntegerTyped();
    }
  }
}
