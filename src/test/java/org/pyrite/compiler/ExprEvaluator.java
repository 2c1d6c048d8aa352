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
import com.google.common.collect.ImmutableMap;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;
import java.util.Map;
import org.pyrite.code.Constants;

/**
 * Evaluates an Expr the way the runtime would, for the subset of operations that the optimizer
 * produces: constant arithmetic, the {@code %} operator on strings, tuples and subscripts,
 * f-strings (with the common parts of the format spec mini-language), and the {@code _mod_*}
 * helper methods called by {@link PrintfRewriter}.
 */
final class ExprEvaluator implements Expr.Visitor<Object> {

  /** Thrown where the runtime would raise an exception. */
  static final class EvaluationError extends RuntimeException {
    EvaluationError(String message) {
      super(message);
    }
  }

  private final ImmutableMap<String, Object> variables;

  private ExprEvaluator(Map<String, ?> variables) {
    ImmutableMap.Builder<String, Object> builder = ImmutableMap.builder();
    variables.forEach((k, v) -> builder.put(k, Constants.of(v)));
    this.variables = builder.buildOrThrow();
  }

  /** Returns the value of {@code expr}, or throws an EvaluationError. */
  static Object evaluate(Expr expr, Map<String, ?> variables) {
    return expr.accept(new ExprEvaluator(variables));
  }

  /** Returns the value of {@code expr}, or null if evaluating it would raise an exception. */
  static Object evaluateOrNull(Expr expr, Map<String, ?> variables) {
    try {
      return evaluate(expr, variables);
    } catch (EvaluationError e) {
      return null;
    }
  }

  private Object eval(Expr expr) {
    return expr.accept(this);
  }

  @Override
  public Object visitConstant(Expr.Constant node) {
    return node.value;
  }

  @Override
  public Object visitName(Expr.Name node) {
    Object value = variables.get(node.id);
    if (value == null) {
      throw new EvaluationError("NameError: " + node.id);
    }
    return value;
  }

  @Override
  public Object visitBinOp(Expr.BinOp node) {
    Object left = eval(node.left);
    Object right = eval(node.right);
    Object result;
    if (node.op == Operator.MOD && left instanceof String format) {
      result = PercentFormat.format(format, right);
    } else {
      result = ConstantFolder.binary(node.op, left, right);
    }
    if (result == null) {
      throw new EvaluationError("Can't evaluate " + node);
    }
    return result;
  }

  @Override
  public Object visitUnaryOp(Expr.UnaryOp node) {
    Object result = ConstantFolder.unary(node.op, eval(node.operand));
    if (result == null) {
      throw new EvaluationError("Can't evaluate " + node);
    }
    return result;
  }

  @Override
  public Object visitTuple(Expr.Tuple node) {
    return node.elements.stream().map(this::eval).collect(ImmutableList.toImmutableList());
  }

  @Override
  public Object visitCall(Expr.Call node) {
    if (!(node.func instanceof Expr.Attribute method
        && method.value instanceof Expr.Constant receiver
        && "".equals(receiver.value)
        && node.args.size() == 1)) {
      throw new EvaluationError("Unsupported call " + node);
    }
    Object arg = eval(node.args.get(0));
    switch (method.attr) {
      case PrintfRewriter.CONVERT_NUMBER_INT:
        if (Constants.isIntegral(arg)) {
          return Constants.asBigInteger(arg);
        } else if (arg instanceof Double d && Double.isFinite(d)) {
          return new BigDecimal(d).toBigInteger();
        }
        throw new EvaluationError("TypeError: %d format: a real number is required");
      case PrintfRewriter.CONVERT_NUMBER_INDEX:
        if (Constants.isIntegral(arg)) {
          return Constants.asBigInteger(arg);
        }
        throw new EvaluationError("TypeError: %x format: an integer is required");
      case PrintfRewriter.CHECK_SINGLE_ARG:
        if (!(arg instanceof ImmutableList<?> tuple)) {
          return ImmutableList.of(arg);
        } else if (tuple.size() == 1) {
          return tuple;
        }
        throw new EvaluationError("TypeError: wrong number of arguments for format string");
      default:
        throw new EvaluationError("AttributeError: " + method.attr);
    }
  }

  @Override
  public Object visitAttribute(Expr.Attribute node) {
    throw new EvaluationError("Unsupported attribute " + node);
  }

  @Override
  public Object visitSubscript(Expr.Subscript node) {
    Object value = eval(node.value);
    Object index = eval(node.index);
    if (value instanceof ImmutableList<?> tuple && Constants.isIntegral(index)) {
      int i = Constants.asBigInteger(index).intValueExact();
      if (i >= 0 && i < tuple.size()) {
        return tuple.get(i);
      }
    }
    throw new EvaluationError("Can't evaluate " + node);
  }

  @Override
  public Object visitFormattedValue(Expr.FormattedValue node) {
    Object value = eval(node.value);
    Object converted =
        switch (node.conversion) {
          case NONE -> value;
          case STR -> Constants.str(value);
          case REPR -> Constants.repr(value);
          case ASCII -> Constants.ascii(value);
        };
    String spec = (node.formatSpec == null) ? "" : (String) eval(node.formatSpec);
    return format(converted, spec);
  }

  @Override
  public Object visitJoinedStr(Expr.JoinedStr node) {
    StringBuilder sb = new StringBuilder();
    node.values.forEach(v -> sb.append((String) eval(v)));
    return sb.toString();
  }

  /**
   * Equivalent to {@code format(value, spec)} for strs and ints, supporting fill, alignment,
   * sign, {@code #}, {@code 0}, width, and the {@code s}, {@code d}, {@code o}, {@code x} and
   * {@code X} types.
   */
  static String format(Object value, String spec) {
    if (spec.isEmpty()) {
      return Constants.str(value);
    }
    char fill = ' ';
    char align = 0;
    int i = 0;
    if (spec.length() >= 2 && "<>^=".indexOf(spec.charAt(1)) >= 0) {
      fill = spec.charAt(0);
      align = spec.charAt(1);
      i = 2;
    } else if ("<>^=".indexOf(spec.charAt(0)) >= 0) {
      align = spec.charAt(0);
      i = 1;
    }
    char sign = 0;
    if (i < spec.length() && "+- ".indexOf(spec.charAt(i)) >= 0) {
      sign = spec.charAt(i++);
    }
    boolean alt = (i < spec.length() && spec.charAt(i) == '#');
    if (alt) {
      i++;
    }
    boolean zero = (i < spec.length() && spec.charAt(i) == '0');
    if (zero) {
      i++;
    }
    int widthStart = i;
    while (i < spec.length() && Character.isDigit(spec.charAt(i))) {
      i++;
    }
    int width = (i > widthStart) ? Integer.parseInt(spec.substring(widthStart, i)) : 0;
    String type = spec.substring(i);
    if (type.length() > 1) {
      throw new EvaluationError("ValueError: Invalid format specifier " + spec);
    }
    if (zero && align == 0) {
      fill = '0';
      align = (value instanceof String) ? '<' : '=';
    }
    if (value instanceof String s) {
      if (!(type.isEmpty() || type.equals("s")) || sign != 0 || alt || align == '=') {
        throw new EvaluationError("ValueError: Invalid format specifier " + spec);
      }
      return pad(s, "", fill, (align == 0) ? '<' : align, width);
    } else if (value instanceof BigInteger n) {
      int radix;
      String prefix;
      switch (type) {
        case "", "d" -> {
          radix = 10;
          prefix = "";
        }
        case "o" -> {
          radix = 8;
          prefix = "0o";
        }
        case "x", "X" -> {
          radix = 16;
          prefix = "0" + type;
        }
        default -> throw new EvaluationError("ValueError: Unknown format code " + type);
      }
      String digits = n.abs().toString(radix);
      if (type.equals("X")) {
        digits = digits.toUpperCase(Locale.ROOT);
      }
      String signText = (n.signum() < 0) ? "-" : (sign == '+' || sign == ' ') ? "" + sign : "";
      return pad(digits, signText + (alt ? prefix : ""), fill, (align == 0) ? '>' : align, width);
    }
    throw new EvaluationError("Unsupported format of " + Constants.typeName(value));
  }

  /** Pads {@code prefix + s} to {@code width}; {@code =} alignment pads after the prefix. */
  private static String pad(String s, String prefix, char fill, char align, int width) {
    int padding = width - prefix.length() - s.codePointCount(0, s.length());
    if (padding <= 0) {
      return prefix + s;
    }
    String fillText = String.valueOf(fill);
    return switch (align) {
      case '<' -> prefix + s + fillText.repeat(padding);
      case '^' ->
          fillText.repeat(padding / 2) + prefix + s + fillText.repeat(padding - padding / 2);
      case '=' -> prefix + fillText.repeat(padding) + s;
      default -> fillText.repeat(padding) + prefix + s;
    };
  }
}
