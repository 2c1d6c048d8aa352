/*
 * Copyright 2025 The Pyrite Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.pyrite.code;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;

/**
 * Static helpers for the values that can appear in a constant pool or a literal expression.
 *
 * <p>Constant values are represented by
 *
 * <ul>
 *   <li>{@link BigInteger} for ints,
 *   <li>{@link Double} for floats,
 *   <li>{@link String} for strs,
 *   <li>{@link Boolean} for bools,
 *   <li>{@link #NONE} for None, and
 *   <li>{@link ImmutableList} (of constant values) for tuples.
 * </ul>
 *
 * The {@code str}, {@code repr} and {@code ascii} methods produce the same text as the
 * corresponding builtins would at runtime.
 */
public final class Constants {

  /** The None value. */
  public static final Object NONE =
      new Object() {
        @Override
        public String toString() {
          return "None";
        }
      };

  public static final ImmutableList<Object> EMPTY_TUPLE = ImmutableList.of();

  private Constants() {}

  /** Returns the canonical representation of a Java value, e.g. a BigInteger for an Integer. */
  public static Object of(Object value) {
    if (value instanceof Integer || value instanceof Long) {
      return BigInteger.valueOf(((Number) value).longValue());
    } else if (value instanceof List<?> list && !(value instanceof ImmutableList)) {
      return list.stream().map(Constants::of).collect(ImmutableList.toImmutableList());
    }
    checkValid(value);
    return value;
  }

  /** Throws an IllegalArgumentException if {@code value} is not a constant value. */
  public static void checkValid(Object value) {
    if (value instanceof ImmutableList<?> tuple) {
      tuple.forEach(Constants::checkValid);
    } else {
      Preconditions.checkArgument(
          value == NONE
              || value instanceof BigInteger
              || value instanceof Double
              || value instanceof String
              || value instanceof Boolean,
          "Not a constant value: %s",
          value);
    }
  }

  /**
   * True if two constant values are interchangeable: they must have the same type as well as
   * compare equal, so {@code True}, {@code 1} and {@code 1.0} are all distinct (as are {@code 0.0}
   * and {@code -0.0}).
   */
  public static boolean sameConstant(Object x, Object y) {
    if (x instanceof ImmutableList<?> xs && y instanceof ImmutableList<?> ys) {
      if (xs.size() != ys.size()) {
        return false;
      }
      for (int i = 0; i < xs.size(); i++) {
        if (!sameConstant(xs.get(i), ys.get(i))) {
          return false;
        }
      }
      return true;
    }
    return x.getClass() == y.getClass() && x.equals(y);
  }

  /** Returns the name of the runtime type of {@code value}. */
  public static String typeName(Object value) {
    if (value == NONE) {
      return "NoneType";
    } else if (value instanceof BigInteger) {
      return "int";
    } else if (value instanceof Double) {
      return "float";
    } else if (value instanceof String) {
      return "str";
    } else if (value instanceof Boolean) {
      return "bool";
    } else if (value instanceof ImmutableList) {
      return "tuple";
    }
    throw new IllegalArgumentException("Not a constant value: " + value);
  }

  /** Returns the truth value of {@code value}. */
  public static boolean isTruthy(Object value) {
    if (value == NONE) {
      return false;
    } else if (value instanceof Boolean b) {
      return b;
    } else if (value instanceof BigInteger i) {
      return i.signum() != 0;
    } else if (value instanceof Double d) {
      return d != 0;
    } else if (value instanceof String s) {
      return !s.isEmpty();
    } else {
      return !((ImmutableList<?>) value).isEmpty();
    }
  }

  /** True for ints and bools, the values usable as an integer index. */
  public static boolean isIntegral(Object value) {
    return value instanceof BigInteger || value instanceof Boolean;
  }

  /** Returns the integer value of an int or bool. */
  public static BigInteger asBigInteger(Object value) {
    if (value instanceof Boolean b) {
      return b ? BigInteger.ONE : BigInteger.ZERO;
    }
    return (BigInteger) value;
  }

  /** Equivalent to {@code str(value)}. */
  public static String str(Object value) {
    return (value instanceof String s) ? s : repr(value);
  }

  /** Equivalent to {@code repr(value)}. */
  public static String repr(Object value) {
    if (value instanceof String s) {
      return reprString(s, false);
    } else if (value instanceof Boolean b) {
      return b ? "True" : "False";
    } else if (value instanceof Double d) {
      return floatRepr(d);
    } else if (value instanceof ImmutableList<?> tuple) {
      return reprTuple(tuple, false);
    }
    return value.toString();
  }

  /** Equivalent to {@code ascii(value)}: {@code repr(value)} with non-ASCII characters escaped. */
  public static String ascii(Object value) {
    if (value instanceof String s) {
      return reprString(s, true);
    } else if (value instanceof ImmutableList<?> tuple) {
      return reprTuple(tuple, true);
    }
    // No other repr can contain non-ASCII characters.
    return repr(value);
  }

  private static String reprTuple(ImmutableList<?> tuple, boolean asciiOnly) {
    StringBuilder sb = new StringBuilder("(");
    for (int i = 0; i < tuple.size(); i++) {
      if (i != 0) {
        sb.append(", ");
      }
      sb.append(asciiOnly ? ascii(tuple.get(i)) : repr(tuple.get(i)));
    }
    if (tuple.size() == 1) {
      sb.append(',');
    }
    return sb.append(')').toString();
  }

  private static String reprString(String s, boolean asciiOnly) {
    char quote = (s.indexOf('\'') >= 0 && s.indexOf('"') < 0) ? '"' : '\'';
    StringBuilder sb = new StringBuilder().append(quote);
    s.codePoints()
        .forEach(
            cp -> {
              if (cp == quote || cp == '\\') {
                sb.append('\\').appendCodePoint(cp);
              } else if (cp == '\t') {
                sb.append("\\t");
              } else if (cp == '\n') {
                sb.append("\\n");
              } else if (cp == '\r') {
                sb.append("\\r");
              } else if (cp < ' ' || cp == 0x7f || (cp > 0x7f && (asciiOnly || !isPrintable(cp)))) {
                appendEscape(sb, cp);
              } else {
                sb.appendCodePoint(cp);
              }
            });
    return sb.append(quote).toString();
  }

  private static void appendEscape(StringBuilder sb, int cp) {
    if (cp <= 0xff) {
      sb.append(String.format("\\x%02x", cp));
    } else if (cp <= 0xffff) {
      sb.append(String.format("\\u%04x", cp));
    } else {
      sb.append(String.format("\\U%08x", cp));
    }
  }

  /**
   * True if {@code cp} is printable in the sense used by repr: everything except control, format,
   * surrogate, private-use, unassigned and separator characters (other than space).
   */
  private static boolean isPrintable(int cp) {
    return switch (Character.getType(cp)) {
      case Character.CONTROL,
          Character.FORMAT,
          Character.SURROGATE,
          Character.PRIVATE_USE,
          Character.UNASSIGNED,
          Character.LINE_SEPARATOR,
          Character.PARAGRAPH_SEPARATOR ->
          false;
      case Character.SPACE_SEPARATOR -> cp == ' ';
      default -> true;
    };
  }

  /**
   * Returns the shortest decimal representation of {@code d} that reads back as the same double,
   * formatted as {@code repr} does: fixed-point for exponents from -4 to 15, otherwise scientific
   * notation with at least two exponent digits.
   */
  public static String floatRepr(double d) {
    if (Double.isNaN(d)) {
      return "nan";
    } else if (Double.isInfinite(d)) {
      return d > 0 ? "inf" : "-inf";
    } else if (d == 0) {
      return (1 / d < 0) ? "-0.0" : "0.0";
    }
    BigDecimal exact = new BigDecimal(d);
    BigDecimal shortest = exact;
    for (int precision = 1; precision <= 17; precision++) {
      BigDecimal candidate = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
      if (candidate.doubleValue() == d) {
        shortest = candidate;
        break;
      }
    }
    shortest = shortest.stripTrailingZeros();
    String digits = shortest.unscaledValue().abs().toString();
    // The value is 0.<digits> * 10^decimalPoint.
    int decimalPoint = digits.length() - shortest.scale();
    int exponent = decimalPoint - 1;
    StringBuilder sb = new StringBuilder();
    if (d < 0) {
      sb.append('-');
    }
    if (exponent >= -4 && exponent < 16) {
      if (decimalPoint <= 0) {
        sb.append("0.").append("0".repeat(-decimalPoint)).append(digits);
      } else if (decimalPoint >= digits.length()) {
        sb.append(digits).append("0".repeat(decimalPoint - digits.length())).append(".0");
      } else {
        sb.append(digits, 0, decimalPoint).append('.');
        sb.append(digits, decimalPoint, digits.length());
      }
    } else {
      sb.append(digits.charAt(0));
      if (digits.length() > 1) {
        sb.append('.').append(digits, 1, digits.length());
      }
      sb.append(exponent < 0 ? "e-" : "e+");
      sb.append(String.format("%02d", Math.abs(exponent)));
    }
    return sb.toString();
  }
}
