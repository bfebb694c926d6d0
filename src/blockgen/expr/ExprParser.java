package blockgen.expr;

import blockgen.expr.ExprNode.BinaryExpression;
import blockgen.expr.ExprNode.ConditionalExpression;
import blockgen.expr.ExprNode.FunctionCall;
import blockgen.expr.ExprNode.Identifier;
import blockgen.expr.ExprNode.NumberLiteral;
import blockgen.expr.ExprNode.UnaryExpression;
import blockgen.expr.ExprTokenizer.Token;
import blockgen.expr.ExprTokenizer.TokenKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Recursive descent parser with C operator precedence. Binary operators associate left, the conditional operator right.
 */
public class ExprParser {

  private static final Map<String, Integer> precedence = Map.ofEntries(
      Map.entry("||", 1), Map.entry("&&", 2), Map.entry("|", 3), Map.entry("^", 4), Map.entry("&", 5), Map.entry("==", 6), Map.entry("!=", 6),
      Map.entry("<", 7), Map.entry(">", 7), Map.entry("<=", 7), Map.entry(">=", 7), Map.entry("<<", 8), Map.entry(">>", 8), Map.entry("+", 9),
      Map.entry("-", 9), Map.entry("*", 10), Map.entry("/", 10), Map.entry("%", 10));

  /** Deepest operator nesting accepted; bounds the recursion of the parser and of every tree walk after it. */
  public static final int MAX_NESTING_DEPTH = 256;

  private final String expression;
  private final List<Token> tokens;
  private int current = 0;
  private int depth = 0;

  private ExprParser(String expression) {
    this.expression = expression;
    this.tokens = ExprTokenizer.tokenize(expression);
  }

  /**
   * Parses one complete expression.
   * @throws ExpressionSyntaxException on malformed or truncated input
   */
  public static ExprNode parse(String expression) {
    if (expression == null || expression.isBlank())
      throw new ExpressionSyntaxException("Empty expression", expression == null ? "" : expression, 0);
    ExprParser parser = new ExprParser(expression);
    ExprNode ret = parser.parseConditional();
    Token trailing = parser.peek();
    if (trailing.kind() != TokenKind.End)
      throw parser.error("Unexpected token '" + trailing.text() + "'", trailing);
    return ret;
  }

  private void enter(int extra) {
    if (depth + extra > MAX_NESTING_DEPTH)
      throw error("Expression nested deeper than " + MAX_NESTING_DEPTH + " levels", peek());
  }

  private ExprNode parseConditional() {
    enter(1);
    ++depth;
    try {
      ExprNode test = parseBinary(1);
      if (!peek().is("?"))
        return test;
      advance();
      ExprNode consequent = parseConditional();
      expect(":");
      ExprNode alternate = parseConditional();
      return new ConditionalExpression(test, consequent, alternate);
    } finally {
      --depth;
    }
  }

  private ExprNode parseBinary(int minPrecedence) {
    ExprNode left = parseUnary();
    // each operator in a left-associative chain adds one level to the tree
    int chain = 0;
    while (true) {
      Token op = peek();
      Integer prec = (op.kind() == TokenKind.Operator) ? precedence.get(op.text()) : null;
      if (prec == null || prec < minPrecedence)
        return left;
      enter(++chain);
      advance();
      ExprNode right = parseBinary(prec + 1);
      left = new BinaryExpression(op.text(), left, right);
    }
  }

  private ExprNode parseUnary() {
    enter(1);
    ++depth;
    try {
      Token token = peek();
      if (token.kind() == TokenKind.Operator &&
          (token.is("-") || token.is("+") || token.is("!") || token.is("~") || token.is("++") || token.is("--"))) {
        advance();
        return new UnaryExpression(token.text(), parseUnary(), true);
      }
      ExprNode ret = parsePrimary();
      int chain = 0;
      while (peek().is("++") || peek().is("--")) {
        enter(++chain);
        ret = new UnaryExpression(advance().text(), ret, false);
      }
      return ret;
    } finally {
      --depth;
    }
  }

  private ExprNode parsePrimary() {
    Token token = advance();
    switch (token.kind()) {
    case Number:
      return new NumberLiteral(token.value(), token.isFloat());
    case Identifier:
      if (!peek().is("("))
        return new Identifier(token.text());
      advance();
      List<ExprNode> args = new ArrayList<>();
      if (!peek().is(")")) {
        args.add(parseConditional());
        while (peek().is(",")) {
          advance();
          args.add(parseConditional());
        }
      }
      expect(")");
      return new FunctionCall(token.text(), args);
    case Operator:
      if (token.is("(")) {
        ExprNode inner = parseConditional();
        expect(")");
        return inner;
      }
      throw error("Unexpected token '" + token.text() + "'", token);
    default:
      throw error("Unexpected end of expression", token);
    }
  }

  private Token peek() { return tokens.get(current); }

  private Token advance() {
    Token ret = tokens.get(current);
    if (ret.kind() != TokenKind.End)
      ++current;
    return ret;
  }

  private void expect(String operator) {
    Token token = advance();
    if (!token.is(operator))
      throw error(token.kind() == TokenKind.End ? "Unexpected end of expression, expected '" + operator + "'"
                                                : "Expected '" + operator + "' but found '" + token.text() + "'",
                  token);
  }

  private ExpressionSyntaxException error(String message, Token token) {
    return new ExpressionSyntaxException(message, expression, token.position());
  }
}
