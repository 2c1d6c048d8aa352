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
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;
import org.pyrite.code.Constants;

/**
 * Parses printf-style format strings and applies them to constant values, producing the same
 * result as the {@code %} operator on a str would at runtime.
 *
 * <p>Every method returns null rather than a result if the runtime operation would raise an
 * exception, or if it uses a feature that is not implemented here ({@code *} widths and the
 * {@code g} conversions).
 */
public final class PercentFormat {

  private PercentFormat() {}

  /** One piece of a parsed format string. */
  public interface Segment {}

  /** Text that is copied unchanged; a {@code %%} contributes a single {@code %}. */
  public record Literal(String text) implements Segment {}

  /**
   * A conversion specifier.
   *
   * @param key the mapping key, if the specifier has the form {@code %(key)...}
   * @param flags any of {@code "-+ #0"}, in the order they appeared
   * @param width the minimum field width, or -1
   * @param precision the precision, or -1
   * @param conversion the conversion character
   */
  public record Spec(
      @Nullable String key, String flags, int width, int precision, char conversion)
      implements Segment {

    public boolean hasFlag(char flag) {
      return flags.indexOf(flag) >= 0;
    }
  }

  /** The conversion characters accepted by the {@code %} operator. */
  private static final String CONVERSIONS = "diouxXeEfFgGcrsa%";

  /** Returns the segments of {@code format}, or null if it is not a valid format string. */
  public static @Nullable ImmutableList<Segment> parse(String format) {
    ImmutableList.Builder<Segment> result = ImmutableList.builder();
    StringBuilder literal = new StringBuilder();
    int length = format.length();
    int i = 0;
    while (i < length) {
      char c = format.charAt(i++);
      if (c != '%') {
        literal.append(c);
        continue;
      }
      if (i == length) {
        // "incomplete format"
        return null;
      }
      if (format.charAt(i) == '%') {
        literal.append('%');
        i++;
        continue;
      }
      String key = null;
      if (format.charAt(i) == '(') {
        int close = format.indexOf(')', i);
        if (close < 0) {
          return null;
        }
        key = format.substring(i + 1, close);
        i = close + 1;
      }
      int flagsStart = i;
      while (i < length && "-+ #0".indexOf(format.charAt(i)) >= 0) {
        i++;
      }
      String flags = format.substring(flagsStart, i);
      int width = -1;
      int digitsStart = i;
      while (i < length && isDigit(format.charAt(i))) {
        i++;
      }
      if (i > digitsStart) {
        width = parseSize(format.substring(digitsStart, i));
      }
      int precision = -1;
      if (i < length && format.charAt(i) == '.') {
        digitsStart = ++i;
        while (i < length && isDigit(format.charAt(i))) {
          i++;
        }
        precision = (i > digitsStart) ? parseSize(format.substring(digitsStart, i)) : 0;
      }
      if (i < length && "hlL".indexOf(format.charAt(i)) >= 0) {
        i++;
      }
      if (i == length || width == -2 || precision == -2) {
        return null;
      }
      char conversion = format.charAt(i++);
      if (CONVERSIONS.indexOf(conversion) < 0) {
        // "unsupported format character", which also covers '*'
        return null;
      }
      if (literal.length() != 0) {
        result.add(new Literal(literal.toString()));
        literal.setLength(0);
      }
      result.add(new Spec(key, flags, width, precision, conversion));
    }
    if (literal.length() != 0) {
      result.add(new Literal(literal.toString()));
    }
    return result.build();
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  /** Parses a width or precision; returns -2 if it is too large. */
  private static int parseSize(String digits) {
    return (digits.length() > 9) ? -2 : Integer.parseInt(digits);
  }

  /** Equivalent to {@code format % value}, or null if that would raise an exception. */
  public static @Nullable String format(String format, Object value) {
    List<Segment> segments = parse(format);
    if (segments == null) {
      return null;
    }
    List<?> args = (value instanceof ImmutableList<?> tuple) ? tuple : ImmutableList.of(value);
    StringBuilder sb = new StringBuilder();
    int next = 0;
    for (Segment segment : segments) {
      if (segment instanceof Literal literal) {
        sb.append(literal.text());
        continue;
      }
      Spec spec = (Spec) segment;
      if (spec.key() != null) {
        // Constant folding never sees a mapping.
        return null;
      } else if (spec.conversion() == '%') {
        sb.append('%');
        continue;
      } else if (next == args.size()) {
        // "not enough arguments for format string"
        return null;
      }
      String converted = convert(spec, args.get(next++));
      if (converted == null) {
        return null;
      }
      sb.append(converted);
    }
    // Otherwise "not all arguments converted during string formatting"
    return (next == args.size()) ? sb.toString() : null;
  }

  /** Returns the result of formatting {@code value} with {@code spec}, or null. */
  static @Nullable String convert(Spec spec, Object value) {
    return switch (spec.conversion()) {
      case 's' -> pad(spec, truncate(Constants.str(value), spec.precision()));
      case 'r' -> pad(spec, truncate(Constants.repr(value), spec.precision()));
      case 'a' -> pad(spec, truncate(Constants.ascii(value), spec.precision()));
      case 'c' -> {
        String c = asChar(value);
        yield (c == null) ? null : pad(spec, c);
      }
      case 'd', 'i', 'u' -> {
        BigInteger i = asInteger(value, true);
        yield (i == null) ? null : formatInteger(spec, i, 10, "");
      }
      case 'o', 'x', 'X' -> {
        BigInteger i = asInteger(value, false);
        if (i == null) {
          yield null;
        }
        int radix = (spec.conversion() == 'o') ? 8 : 16;
        String prefix = spec.hasFlag('#') ? "0" + spec.conversion() : "";
        yield formatInteger(spec, i, radix, prefix);
      }
      case 'e', 'E', 'f', 'F' -> {
        Double d = asDouble(value);
        yield (d == null) ? null : formatFloat(spec, d);
      }
      // 'g' and 'G'
      default -> null;
    };
  }

  private static String truncate(String s, int precision) {
    if (precision < 0 || s.codePointCount(0, s.length()) <= precision) {
      return s;
    }
    return s.substring(0, s.offsetByCodePoints(0, precision));
  }

  /** Pads a non-numeric result to the spec's width; the {@code 0} flag has no effect. */
  private static String pad(Spec spec, String s) {
    int padding = spec.width() - s.codePointCount(0, s.length());
    if (padding <= 0) {
      return s;
    }
    String spaces = " ".repeat(padding);
    return spec.hasFlag('-') ? s + spaces : spaces + s;
  }

  private static @Nullable String asChar(Object value) {
    if (value instanceof String s) {
      return (s.codePointCount(0, s.length()) == 1) ? s : null;
    } else if (Constants.isIntegral(value)) {
      BigInteger i = Constants.asBigInteger(value);
      if (i.signum() < 0 || i.compareTo(BigInteger.valueOf(Character.MAX_CODE_POINT)) > 0) {
        return null;
      }
      return new String(Character.toChars(i.intValue()));
    }
    return null;
  }

  /**
   * Returns the integer value of an int or bool, or (if {@code allowFloat}) the truncated value
   * of a finite float; otherwise null.
   */
  private static @Nullable BigInteger asInteger(Object value, boolean allowFloat) {
    if (Constants.isIntegral(value)) {
      return Constants.asBigInteger(value);
    } else if (allowFloat && value instanceof Double d && Double.isFinite(d)) {
      return new BigDecimal(d).toBigInteger();
    }
    return null;
  }

  private static @Nullable Double asDouble(Object value) {
    if (value instanceof Double d) {
      return d;
    } else if (Constants.isIntegral(value)) {
      double d = Constants.asBigInteger(value).doubleValue();
      // "int too large to convert to float"
      return Double.isInfinite(d) ? null : d;
    }
    return null;
  }

  private static String formatInteger(Spec spec, BigInteger value, int radix, String prefix) {
    String digits = value.abs().toString(radix);
    if (spec.conversion() == 'X') {
      digits = digits.toUpperCase(Locale.ROOT);
    }
    if (spec.precision() > digits.length()) {
      digits = "0".repeat(spec.precision() - digits.length()) + digits;
    }
    return padNumber(spec, sign(spec, value.signum() < 0) + prefix, digits, true);
  }

  private static String sign(Spec spec, boolean negative) {
    if (negative) {
      return "-";
    } else if (spec.hasFlag('+')) {
      return "+";
    } else if (spec.hasFlag(' ')) {
      return " ";
    }
    return "";
  }

  /**
   * Combines a sign and prefix with the digits of a number, padding to the spec's width: with
   * spaces on the right if the {@code -} flag is present, with zeros between the prefix and the
   * digits if the {@code 0} flag is present (and {@code zeroPadAllowed}), otherwise with spaces
   * on the left.
   */
  private static String padNumber(Spec spec, String prefix, String digits, boolean zeroPadAllowed) {
    int padding = spec.width() - prefix.length() - digits.length();
    if (padding <= 0) {
      return prefix + digits;
    } else if (spec.hasFlag('-')) {
      return prefix + digits + " ".repeat(padding);
    } else if (spec.hasFlag('0') && zeroPadAllowed) {
      return prefix + "0".repeat(padding) + digits;
    }
    return " ".repeat(padding) + prefix + digits;
  }

  private static String formatFloat(Spec spec, double d) {
    boolean upper = Character.isUpperCase(spec.conversion());
    boolean negative = (Double.doubleToRawLongBits(d) < 0) && !Double.isNaN(d);
    String prefix = sign(spec, negative);
    if (!Double.isFinite(d)) {
      String text = Double.isNaN(d) ? "nan" : "inf";
      return padNumber(spec, prefix, upper ? text.toUpperCase(Locale.ROOT) : text, false);
    }
    int precision = (spec.precision() < 0) ? 6 : spec.precision();
    BigDecimal abs = new BigDecimal(Math.abs(d));
    String digits;
    if (Character.toLowerCase(spec.conversion()) == 'f') {
      digits = abs.setScale(precision, RoundingMode.HALF_EVEN).toPlainString();
      if (precision == 0 && spec.hasFlag('#')) {
        digits += ".";
      }
    } else {
      digits = exponentForm(abs, precision, spec.hasFlag('#'), upper ? 'E' : 'e');
    }
    return padNumber(spec, prefix, digits, true);
  }

  /** Formats a non-negative value as {@code d.ddde+XX} with {@code precision} fraction digits. */
  private static String exponentForm(BigDecimal abs, int precision, boolean alt, char e) {
    String unscaled;
    int exponent;
    if (abs.signum() == 0) {
      unscaled = "0";
      exponent = 0;
    } else {
      BigDecimal rounded = abs.round(new MathContext(precision + 1, RoundingMode.HALF_EVEN));
      unscaled = rounded.unscaledValue().toString();
      exponent = unscaled.length() - 1 - rounded.scale();
    }
    // unscaled may have fewer than precision + 1 digits if the value is exact.
    StringBuilder sb = new StringBuilder().append(unscaled.charAt(0));
    if (precision > 0 || alt) {
      sb.append('.');
    }
    for (int i = 1; i <= precision; i++) {
      sb.append(i < unscaled.length() ? unscaled.charAt(i) : '0');
    }
    sb.append(e).append(exponent < 0 ? '-' : '+');
    String expDigits = Integer.toString(Math.abs(exponent));
    if (expDigits.length() < 2) {
      sb.append('0');
    }
    return sb.append(expDigits).toString();
  }
}
