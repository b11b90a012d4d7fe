package ai.statues.util;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

import ai.statues.EvaluationException;
import ai.statues.NumericCapabilityException;
import lombok.experimental.UtilityClass;

/**
 * Arithmetic, logic and ordering over the plain values carried by
 * distributions. Numbers follow a small promotion ladder (int, long,
 * BigInteger, BigDecimal, double); integral results are narrowed back to the
 * widest operand kind when they fit, so {@code Integer + Integer} stays an
 * {@code Integer} unless it overflows.
 */
@UtilityClass
public final class Values {
  private enum Kind {
    INT, LONG, BIG_INTEGER, BIG_DECIMAL, DOUBLE
  }

  private static final MathContext CONTEXT = MathContext.DECIMAL128;

  /**
   * Natural value order: numbers by numeric value, lists lexicographically,
   * other values by their own {@link Comparable} implementation when both are
   * of the same class.
   */
  public static final Comparator<Object> ORDER = Values::compare;

  private Kind kind(final Object value) {
    if (value instanceof Integer || value instanceof Short || value instanceof Byte || value instanceof Boolean) {
      return Kind.INT;
    } else if (value instanceof Long) {
      return Kind.LONG;
    } else if (value instanceof BigInteger) {
      return Kind.BIG_INTEGER;
    } else if (value instanceof BigDecimal) {
      return Kind.BIG_DECIMAL;
    } else if (value instanceof Double || value instanceof Float) {
      return Kind.DOUBLE;
    }
    return null;
  }

  public boolean isNumber(final Object value) {
    return value instanceof Number || value instanceof Boolean;
  }

  private BigInteger bigInteger(final Object value) {
    if (value instanceof Boolean b) {
      return b ? BigInteger.ONE : BigInteger.ZERO;
    } else if (value instanceof BigInteger i) {
      return i;
    }
    return BigInteger.valueOf(((Number) value).longValue());
  }

  private BigDecimal bigDecimal(final Object value) {
    if (value instanceof BigDecimal d) {
      return d;
    } else if (value instanceof Double || value instanceof Float) {
      return BigDecimal.valueOf(((Number) value).doubleValue());
    }
    return new BigDecimal(bigInteger(value));
  }

  /**
   * Converts a numeric value to a double.
   *
   * @throws NumericCapabilityException if the value is not a number
   */
  public double toDouble(final Object value) {
    if (value instanceof Boolean b) {
      return b ? 1 : 0;
    } else if (value instanceof Number n) {
      return n.doubleValue();
    }
    throw new NumericCapabilityException("value '" + value + "' is not a number");
  }

  /**
   * Unwraps a boolean value.
   *
   * @throws EvaluationException if the value is not a boolean
   */
  public boolean toBoolean(final Object value) {
    if (value instanceof Boolean b) {
      return b;
    }
    throw new EvaluationException("boolean expected, got '" + value + "'");
  }

  private Kind widest(final Object a, final Object b) {
    final Kind ka = kind(a), kb = kind(b);
    if (ka == null || kb == null) {
      return null;
    }
    return ka.compareTo(kb) >= 0 ? ka : kb;
  }

  private Object narrow(final BigInteger value, final Kind kind) {
    if (kind == Kind.INT && value.bitLength() < Integer.SIZE) {
      return value.intValue();
    } else if (kind.compareTo(Kind.LONG) <= 0 && value.bitLength() < Long.SIZE) {
      return value.longValue();
    }
    return value;
  }

  private NumericCapabilityException unsupported(final String op, final Object a, final Object b) {
    return new NumericCapabilityException("unsupported operand values for " + op + ": '" + a + "' and '" + b + "'");
  }

  public Object add(final Object a, final Object b) {
    if (a instanceof String sa && b instanceof String sb) {
      return sa + sb;
    }
    if (a instanceof List<?> la && b instanceof List<?> lb) {
      return ImmutableList.builder().addAll(la).addAll(lb).build();
    }
    final Kind kind = widest(a, b);
    if (kind == null) {
      throw unsupported("+", a, b);
    }
    switch (kind) {
      case DOUBLE:
        return toDouble(a) + toDouble(b);
      case BIG_DECIMAL:
        return bigDecimal(a).add(bigDecimal(b));
      default:
        return narrow(bigInteger(a).add(bigInteger(b)), kind);
    }
  }

  public Object subtract(final Object a, final Object b) {
    final Kind kind = widest(a, b);
    if (kind == null) {
      throw unsupported("-", a, b);
    }
    switch (kind) {
      case DOUBLE:
        return toDouble(a) - toDouble(b);
      case BIG_DECIMAL:
        return bigDecimal(a).subtract(bigDecimal(b));
      default:
        return narrow(bigInteger(a).subtract(bigInteger(b)), kind);
    }
  }

  public Object multiply(final Object a, final Object b) {
    final Kind kind = widest(a, b);
    if (kind == null) {
      throw unsupported("*", a, b);
    }
    switch (kind) {
      case DOUBLE:
        return toDouble(a) * toDouble(b);
      case BIG_DECIMAL:
        return bigDecimal(a).multiply(bigDecimal(b));
      default:
        return narrow(bigInteger(a).multiply(bigInteger(b)), kind);
    }
  }

  /**
   * True division. Integral operands give a double, decimal operands a
   * decimal rounded to 34 digits.
   */
  public Object divide(final Object a, final Object b) {
    final Kind kind = widest(a, b);
    if (kind == null) {
      throw unsupported("/", a, b);
    }
    if (kind == Kind.BIG_DECIMAL) {
      return bigDecimal(a).divide(bigDecimal(b), CONTEXT);
    }
    if (kind != Kind.DOUBLE && bigInteger(b).signum() == 0) {
      throw new ArithmeticException("division by zero");
    }
    return toDouble(a) / toDouble(b);
  }

  /**
   * Division rounded towards negative infinity.
   */
  public Object floorDivide(final Object a, final Object b) {
    final Kind kind = widest(a, b);
    if (kind == null) {
      throw unsupported("//", a, b);
    }
    switch (kind) {
      case DOUBLE:
        return Math.floor(toDouble(a) / toDouble(b));
      case BIG_DECIMAL:
        return bigDecimal(a).divide(bigDecimal(b), 0, RoundingMode.FLOOR);
      default: {
        final BigInteger[] qr = bigInteger(a).divideAndRemainder(bigInteger(b));
        final BigInteger q = qr[1].signum() != 0 && qr[1].signum() != bigInteger(b).signum()
            ? qr[0].subtract(BigInteger.ONE)
            : qr[0];
        return narrow(q, kind);
      }
    }
  }

  /**
   * Modulo whose result takes the sign of the divisor.
   */
  public Object mod(final Object a, final Object b) {
    final Kind kind = widest(a, b);
    if (kind == null) {
      throw unsupported("%", a, b);
    }
    switch (kind) {
      case DOUBLE: {
        final double d = toDouble(b), r = toDouble(a) % d;
        return r != 0 && (r < 0) != (d < 0) ? r + d : r;
      }
      case BIG_DECIMAL: {
        final BigDecimal d = bigDecimal(b), r = bigDecimal(a).remainder(d);
        return r.signum() != 0 && r.signum() != d.signum() ? r.add(d) : r;
      }
      default: {
        final BigInteger d = bigInteger(b), r = bigInteger(a).mod(d.abs());
        return narrow(d.signum() < 0 && r.signum() != 0 ? r.add(d) : r, kind);
      }
    }
  }

  public Object pow(final Object a, final Object b) {
    final Kind kind = widest(a, b);
    if (kind == null) {
      throw unsupported("**", a, b);
    }
    final Kind exponentKind = kind(b);
    if (exponentKind.compareTo(Kind.BIG_INTEGER) <= 0 && bigInteger(b).signum() >= 0
        && bigInteger(b).bitLength() < Integer.SIZE) {
      final int exponent = bigInteger(b).intValue();
      switch (kind(a)) {
        case DOUBLE:
          return Math.pow(toDouble(a), exponent);
        case BIG_DECIMAL:
          return bigDecimal(a).pow(exponent, CONTEXT);
        default:
          return narrow(bigInteger(a).pow(exponent), kind);
      }
    }
    return Math.pow(toDouble(a), toDouble(b));
  }

  public Object negate(final Object a) {
    final Kind kind = kind(a);
    if (kind == null) {
      throw new NumericCapabilityException("unsupported operand value for neg: '" + a + "'");
    }
    switch (kind) {
      case DOUBLE:
        return -toDouble(a);
      case BIG_DECIMAL:
        return bigDecimal(a).negate();
      default:
        return narrow(bigInteger(a).negate(), kind);
    }
  }

  public Object abs(final Object a) {
    final Kind kind = kind(a);
    if (kind == null) {
      throw new NumericCapabilityException("unsupported operand value for abs: '" + a + "'");
    }
    switch (kind) {
      case DOUBLE:
        return Math.abs(toDouble(a));
      case BIG_DECIMAL:
        return bigDecimal(a).abs();
      default:
        return narrow(bigInteger(a).abs(), kind);
    }
  }

  /**
   * Equality where numbers of different classes compare by value, so that
   * {@code 1}, {@code 1L} and {@code 1.0} are equal.
   */
  public boolean equal(final Object a, final Object b) {
    if (a instanceof Number && b instanceof Number && a.getClass() != b.getClass()) {
      return compareNumbers(a, b) == 0;
    }
    if (a instanceof List<?> la && b instanceof List<?> lb) {
      if (la.size() != lb.size()) {
        return false;
      }
      for (int i = 0; i < la.size(); ++i) {
        if (!equal(la.get(i), lb.get(i))) {
          return false;
        }
      }
      return true;
    }
    return Objects.equals(a, b);
  }

  private int compareNumbers(final Object a, final Object b) {
    final Kind kind = widest(a, b);
    if (kind == Kind.DOUBLE) {
      final double da = toDouble(a), db = toDouble(b);
      if (Double.isNaN(da) || Double.isNaN(db) || Double.isInfinite(da) || Double.isInfinite(db)) {
        return Double.compare(da, db);
      }
    }
    return bigDecimal(a).compareTo(bigDecimal(b));
  }

  /**
   * Whether {@link #ORDER} defines an order between {@code a} and {@code b}.
   */
  public boolean isComparable(final Object a, final Object b) {
    if (a instanceof Number && b instanceof Number) {
      return kind(a) != null && kind(b) != null;
    }
    if (a instanceof List<?> la && b instanceof List<?> lb) {
      final int n = Math.min(la.size(), lb.size());
      for (int i = 0; i < n; ++i) {
        if (!isComparable(la.get(i), lb.get(i))) {
          return false;
        }
      }
      return true;
    }
    return a instanceof Comparable && a.getClass() == b.getClass();
  }

  /**
   * Whether every value of the collection can be ordered against every other.
   */
  public boolean isSortable(final Collection<?> values) {
    final List<?> list = new ArrayList<>(values);
    for (int i = 0; i < list.size(); ++i) {
      for (int j = i + 1; j < list.size(); ++j) {
        if (!isComparable(list.get(i), list.get(j))) {
          return false;
        }
      }
    }
    return true;
  }

  /**
   * A key under which values that are {@link #equal} collide: numbers map to
   * their stripped decimal value, lists to the list of their element keys.
   */
  public Object key(final Object value) {
    if (value instanceof Number && kind(value) != null) {
      if (kind(value) == Kind.DOUBLE) {
        final double d = toDouble(value);
        if (Double.isNaN(d) || Double.isInfinite(d)) {
          return d;
        }
      }
      final BigDecimal d = bigDecimal(value);
      return d.signum() == 0 ? BigDecimal.ZERO : d.stripTrailingZeros();
    }
    if (value instanceof List<?> list) {
      final List<Object> keys = new ArrayList<>(list.size());
      for (final Object element : list) {
        keys.add(key(element));
      }
      return keys;
    }
    return value;
  }

  /**
   * The values without duplicates under {@link #equal}, keeping the first
   * representative of each in order of occurrence.
   */
  public <T> List<T> distinct(final Iterable<? extends T> values) {
    final Map<Object, T> seen = new LinkedHashMap<>();
    for (final T value : values) {
      seen.putIfAbsent(key(value), value);
    }
    return new ArrayList<>(seen.values());
  }

  @SuppressWarnings({ "unchecked", "rawtypes" })
  public int compare(final Object a, final Object b) {
    if (a instanceof Number && b instanceof Number) {
      return compareNumbers(a, b);
    }
    if (a instanceof List<?> la && b instanceof List<?> lb) {
      final int n = Math.min(la.size(), lb.size());
      for (int i = 0; i < n; ++i) {
        final int c = compare(la.get(i), lb.get(i));
        if (c != 0) {
          return c;
        }
      }
      return Integer.compare(la.size(), lb.size());
    }
    if (a instanceof Comparable ca && a.getClass() == b.getClass()) {
      return ca.compareTo(b);
    }
    throw new NumericCapabilityException("values '" + a + "' and '" + b + "' have no natural order");
  }
}
