package ai.statues;

import java.util.List;
import java.util.function.BinaryOperator;
import java.util.function.UnaryOperator;

import com.google.common.base.Preconditions;

import ai.statues.util.Values;

/**
 * Tagged operators applicable to distribution values. Each operator carries
 * the symbol used when displaying expression trees.
 */
public enum Operation {
  ADD("+", Values::add),
  SUBTRACT("-", Values::subtract),
  MULTIPLY("*", Values::multiply),
  DIVIDE("/", Values::divide),
  FLOOR_DIVIDE("//", Values::floorDivide),
  MOD("%", Values::mod),
  POW("**", Values::pow),
  NEGATE("neg", Values::negate),
  ABS("abs", Values::abs),
  LT("<", (a, b) -> Values.compare(a, b) < 0),
  LE("<=", (a, b) -> Values.compare(a, b) <= 0),
  EQ("==", (a, b) -> Values.equal(a, b)),
  NE("!=", (a, b) -> !Values.equal(a, b)),
  GT(">", (a, b) -> Values.compare(a, b) > 0),
  GE(">=", (a, b) -> Values.compare(a, b) >= 0),
  AND("&", (a, b) -> Values.toBoolean(a) & Values.toBoolean(b)),
  OR("|", (a, b) -> Values.toBoolean(a) | Values.toBoolean(b)),
  XOR("^", (a, b) -> Values.toBoolean(a) ^ Values.toBoolean(b)),
  NOT("~", a -> !Values.toBoolean(a));

  private final String symbol;
  private final UnaryOperator<Object> unary;
  private final BinaryOperator<Object> binary;

  private Operation(final String symbol, final UnaryOperator<Object> unary) {
    this.symbol = symbol;
    this.unary = unary;
    this.binary = null;
  }

  private Operation(final String symbol, final BinaryOperator<Object> binary) {
    this.symbol = symbol;
    this.unary = null;
    this.binary = binary;
  }

  public String symbol() {
    return symbol;
  }

  public int arity() {
    return unary == null ? 2 : 1;
  }

  public boolean isComparison() {
    return compareTo(LT) >= 0 && compareTo(GE) <= 0;
  }

  public Object apply(final Object operand) {
    Preconditions.checkState(unary != null, "%s is a binary operator", symbol);
    return unary.apply(operand);
  }

  public Object apply(final Object left, final Object right) {
    Preconditions.checkState(binary != null, "%s is a unary operator", symbol);
    return binary.apply(left, right);
  }

  public Object apply(final List<?> operands) {
    Preconditions.checkArgument(operands.size() == arity(), "%s expects %s operands, got %s", symbol, arity(),
        operands.size());
    return arity() == 1 ? apply(operands.get(0)) : apply(operands.get(0), operands.get(1));
  }

  public static Operation ofSymbol(final String symbol) {
    for (final Operation op : values()) {
      if (op.symbol.equals(symbol)) {
        return op;
      }
    }
    throw new IllegalArgumentException("unknown operator " + symbol);
  }

  @Override
  public String toString() {
    return symbol;
  }
}
