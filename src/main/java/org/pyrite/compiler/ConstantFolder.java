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

package org.pyrite.compiler;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import org.jspecify.annotations.Nullable;
import org.pyrite.code.Constants;

/**
 * Evaluates operators on constant values at compile time.
 *
 * <p>Each method returns null if the operation would raise an exception at runtime, is not
 * modeled here, or would produce a result too large to be worth storing in the constant pool;
 * the caller then leaves the expression to be evaluated at runtime.
 */
final class ConstantFolder {
  /** Integer results are limited to this many bits. */
  static final int MAX_INT_SIZE = 128;

  /** Tuple results are limited to this many elements. */
  static final int MAX_COLLECTION_SIZE = 256;

  /** String results of repetition are limited to this many characters. */
  static final int MAX_STR_SIZE = 4096;

  /** Doubles can represent every integer with at most this many bits. */
  private static final int EXACT_DOUBLE_BITS = 53;

  private ConstantFolder() {}

  /** Returns {@code left op right}, or null. */
  static @Nullable Object binary(Operator op, Object left, Object right) {
    if (isNumber(left) && isNumber(right)) {
      if (left instanceof Double || right instanceof Double) {
        Double x = toDouble(left);
        Double y = toDouble(right);
        return (x == null || y == null) ? null : floatOp(op, x, y);
      }
      BigInteger x = Constants.asBigInteger(left);
      BigInteger y = Constants.asBigInteger(right);
      if (left instanceof Boolean && right instanceof Boolean) {
        // Bitwise operators on two bools return a bool.
        switch (op) {
          case BIT_AND:
            return (Boolean) left & (Boolean) right;
          case BIT_OR:
            return (Boolean) left | (Boolean) right;
          case BIT_XOR:
            return (Boolean) left ^ (Boolean) right;
          default:
            break;
        }
      }
      return intOp(op, x, y);
    } else if (op == Operator.ADD) {
      if (left instanceof String x && right instanceof String y) {
        return x + y;
      } else if (left instanceof ImmutableList<?> x && right instanceof ImmutableList<?> y) {
        return (x.size() + y.size() > MAX_COLLECTION_SIZE)
            ? null
            : ImmutableList.builder().addAll(x).addAll(y).build();
      }
    } else if (op == Operator.MULT) {
      if (Constants.isIntegral(right)) {
        return repeat(left, Constants.asBigInteger(right));
      } else if (Constants.isIntegral(left)) {
        return repeat(right, Constants.asBigInteger(left));
      }
    }
    // Includes str % x, which is handled by PrintfRewriter.
    return null;
  }

  /** Returns {@code op operand}, or null. */
  static @Nullable Object unary(Expr.UnaryOp.Kind op, Object operand) {
    if (op == Expr.UnaryOp.Kind.NOT) {
      return !Constants.isTruthy(operand);
    } else if (operand instanceof Double d) {
      return switch (op) {
        case PLUS -> d;
        case MINUS -> -d;
        default -> null;
      };
    } else if (Constants.isIntegral(operand)) {
      BigInteger i = Constants.asBigInteger(operand);
      return switch (op) {
        case PLUS -> i;
        case MINUS -> i.negate();
        case INVERT -> i.not();
        default -> null;
      };
    }
    return null;
  }

  private static boolean isNumber(Object value) {
    return Constants.isIntegral(value) || value instanceof Double;
  }

  /** Converts an int, bool or float to a double, or returns null if it is too large. */
  private static @Nullable Double toDouble(Object value) {
    if (value instanceof Double d) {
      return d;
    }
    double d = Constants.asBigInteger(value).doubleValue();
    return Double.isInfinite(d) ? null : d;
  }

  private static @Nullable Object repeat(Object sequence, BigInteger count) {
    int n = (count.signum() <= 0) ? 0 : count.min(BigInteger.valueOf(Integer.MAX_VALUE)).intValue();
    if (sequence instanceof String s) {
      return ((long) s.length() * n > MAX_STR_SIZE) ? null : s.repeat(n);
    } else if (sequence instanceof ImmutableList<?> tuple) {
      if ((long) tuple.size() * n > MAX_COLLECTION_SIZE) {
        return null;
      }
      ImmutableList.Builder<Object> builder = ImmutableList.builder();
      for (int i = 0; i < n; i++) {
        builder.addAll(tuple);
      }
      return builder.build();
    }
    return null;
  }

  private static @Nullable Object intOp(Operator op, BigInteger x, BigInteger y) {
    switch (op) {
      case ADD:
        return x.add(y);
      case SUB:
        return x.subtract(y);
      case MULT:
        if (x.signum() != 0 && y.signum() != 0 && x.bitLength() + y.bitLength() > MAX_INT_SIZE) {
          return null;
        }
        return x.multiply(y);
      case DIV:
        if (y.signum() == 0
            || x.bitLength() > EXACT_DOUBLE_BITS
            || y.bitLength() > EXACT_DOUBLE_BITS) {
          // Only fold divisions whose operands convert to double exactly, so the quotient is
          // correctly rounded.
          return null;
        }
        return x.doubleValue() / y.doubleValue();
      case FLOOR_DIV:
        return (y.signum() == 0) ? null : floorDivMod(x, y)[0];
      case MOD:
        return (y.signum() == 0) ? null : floorDivMod(x, y)[1];
      case POW:
        if (y.signum() < 0 || y.bitLength() >= Integer.SIZE) {
          return null;
        } else if (x.abs().bitLength() > 1 && (long) x.bitLength() * y.intValue() > MAX_INT_SIZE) {
          return null;
        }
        return x.pow(y.intValue());
      case LSHIFT:
        if (y.signum() < 0) {
          return null;
        } else if (x.signum() == 0) {
          return x;
        } else if (y.bitLength() >= Integer.SIZE || x.bitLength() + y.intValue() > MAX_INT_SIZE) {
          return null;
        }
        return x.shiftLeft(y.intValue());
      case RSHIFT:
        if (y.signum() < 0) {
          return null;
        } else if (y.bitLength() >= Integer.SIZE) {
          return (x.signum() < 0) ? BigInteger.ONE.negate() : BigInteger.ZERO;
        }
        return x.shiftRight(y.intValue());
      case BIT_AND:
        return x.and(y);
      case BIT_OR:
        return x.or(y);
      case BIT_XOR:
        return x.xor(y);
      default:
        return null;
    }
  }

  /** Returns the quotient rounded towards negative infinity and the corresponding remainder. */
  private static BigInteger[] floorDivMod(BigInteger x, BigInteger y) {
    BigInteger[] qr = x.divideAndRemainder(y);
    if (qr[1].signum() != 0 && qr[1].signum() != y.signum()) {
      qr[0] = qr[0].subtract(BigInteger.ONE);
      qr[1] = qr[1].add(y);
    }
    return qr;
  }

  private static @Nullable Object floatOp(Operator op, double x, double y) {
    switch (op) {
      case ADD:
        return x + y;
      case SUB:
        return x - y;
      case MULT:
        return x * y;
      case DIV:
        return (y == 0) ? null : x / y;
      case FLOOR_DIV:
        return (y == 0) ? null : floatDivMod(x, y)[0];
      case MOD:
        return (y == 0) ? null : floatDivMod(x, y)[1];
      default:
        // Includes POW, since Math.pow is not always correctly rounded.
        return null;
    }
  }

  /** Returns the floor quotient and remainder of two doubles, with the remainder's sign of y. */
  private static double[] floatDivMod(double x, double y) {
    double mod = x % y;
    double div = (x - mod) / y;
    if (mod != 0) {
      if ((y < 0) != (mod < 0)) {
        mod += y;
        div -= 1.0;
      }
    } else {
      mod = Math.copySign(0.0, y);
    }
    double floorDiv;
    if (div != 0) {
      floorDiv = Math.floor(div);
      if (div - floorDiv > 0.5) {
        floorDiv += 1.0;
      }
    } else {
      floorDiv = Math.copySign(0.0, x / y);
    }
    return new double[] {floorDiv, mod};
  }
}
