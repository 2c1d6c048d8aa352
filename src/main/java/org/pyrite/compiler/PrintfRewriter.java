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
import com.google.common.flogger.FluentLogger;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.pyrite.compiler.Expr.FormattedValue.Conversion;
import org.pyrite.compiler.PercentFormat.Literal;
import org.pyrite.compiler.PercentFormat.Segment;
import org.pyrite.compiler.PercentFormat.Spec;

/**
 * Rewrites {@code 'format' % args} into an equivalent {@link Expr.JoinedStr}, which avoids
 * parsing the format string at runtime.
 *
 * <p>Only the simplest specifiers are rewritten: {@code %s}, {@code %r} and {@code %a} with an
 * optional width, and {@code %d}, {@code %i}, {@code %u}, {@code %o}, {@code %x} and {@code %X}
 * with an optional {@code 0} flag and width. Numeric values are first passed through one of the
 * helper methods below (called on the empty string) which raise the same TypeError as the {@code
 * %} operator for values of the wrong type and otherwise return an int.
 */
final class PrintfRewriter {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Converts a value for {@code %d}, {@code %i} or {@code %u}; accepts floats (truncating). */
  static final String CONVERT_NUMBER_INT = "_mod_convert_number_int";

  /** Converts a value for {@code %o}, {@code %x} or {@code %X}; requires an integer index. */
  static final String CONVERT_NUMBER_INDEX = "_mod_convert_number_index";

  /**
   * Returns a 1-tuple containing its argument, raising TypeError (as {@code %} would) if the
   * argument is a tuple whose length is not 1, and unwrapping it if it has length 1.
   */
  static final String CHECK_SINGLE_ARG = "_mod_check_single_arg";

  private PrintfRewriter() {}

  /**
   * Returns an expression equivalent to {@code format % rhs}, or null if it should be left as it
   * is. If {@code fold} is true and {@code rhs} is a constant, tries to compute the result.
   */
  static @Nullable Expr rewrite(String format, Expr rhs, boolean fold) {
    if (fold && rhs instanceof Expr.Constant constant) {
      String folded = PercentFormat.format(format, constant.value);
      if (folded != null) {
        return new Expr.Constant(folded);
      }
    }
    ImmutableList<Segment> segments = PercentFormat.parse(format);
    if (segments == null) {
      logger.atFinest().log("Not rewriting %s: invalid format", format);
      return null;
    }
    int numSpecs = 0;
    for (Segment segment : segments) {
      if (segment instanceof Spec spec) {
        String reason = unsupported(spec);
        if (reason != null) {
          logger.atFinest().log("Not rewriting %s: %s", format, reason);
          return null;
        }
        numSpecs++;
      }
    }
    List<Expr> args = arguments(rhs, numSpecs);
    if (args == null) {
      logger.atFinest().log("Not rewriting %s: arguments don't match", format);
      return null;
    }
    List<Expr> parts = new ArrayList<>();
    StringBuilder text = new StringBuilder();
    int next = 0;
    for (Segment segment : segments) {
      if (segment instanceof Literal literal) {
        text.append(literal.text());
        continue;
      }
      if (text.length() != 0) {
        parts.add(new Expr.Constant(text.toString()));
        text.setLength(0);
      }
      parts.add(formattedValue((Spec) segment, args.get(next++)));
    }
    if (text.length() != 0) {
      parts.add(new Expr.Constant(text.toString()));
    }
    return new Expr.JoinedStr(parts);
  }

  /** Returns a description of why {@code spec} can't be rewritten, or null if it can. */
  private static @Nullable String unsupported(Spec spec) {
    if (spec.key() != null) {
      return "mapping key";
    } else if (spec.precision() >= 0) {
      return "precision";
    } else if (!spec.flags().isEmpty() && !spec.flags().chars().allMatch(c -> c == '0')) {
      return "flags " + spec.flags();
    }
    switch (spec.conversion()) {
      case 's', 'r', 'a' -> {
        // A format spec would pad strings with zeros, while % pads them with spaces.
        return spec.flags().isEmpty() ? null : "zero-padded string";
      }
      case 'd', 'i', 'u', 'o', 'x', 'X' -> {
        return null;
      }
      default -> {
        return "conversion " + spec.conversion();
      }
    }
  }

  /**
   * Returns the expressions to be formatted, or null if they can't be determined statically or
   * their number doesn't match the number of specifiers.
   */
  private static @Nullable List<Expr> arguments(Expr rhs, int numSpecs) {
    List<Expr> args;
    if (rhs instanceof Expr.Tuple tuple) {
      args = tuple.elements;
    } else if (rhs instanceof Expr.Constant c && c.value instanceof ImmutableList<?> tuple) {
      args = tuple.stream().<Expr>map(Expr.Constant::new).collect(ImmutableList.toImmutableList());
    } else if (numSpecs == 1) {
      // rhs might evaluate to a tuple, so its value is unwrapped at runtime.
      Expr check = new Expr.Call(helper(CHECK_SINGLE_ARG), List.of(rhs));
      args = List.of(new Expr.Subscript(check, new Expr.Constant(0)));
    } else {
      return null;
    }
    return (args.size() == numSpecs) ? args : null;
  }

  private static Expr helper(String name) {
    return new Expr.Attribute(new Expr.Constant(""), name);
  }

  private static Expr formattedValue(Spec spec, Expr value) {
    String width = (spec.width() >= 0) ? Integer.toString(spec.width()) : "";
    switch (spec.conversion()) {
      case 's', 'r', 'a' -> {
        // % right-aligns, while the default for strings is to left-align.
        Expr formatSpec = width.isEmpty() ? null : new Expr.Constant(">" + width);
        return new Expr.FormattedValue(value, Conversion.forCode(spec.conversion()), formatSpec);
      }
      case 'd', 'i', 'u' -> {
        Expr converted = new Expr.Call(helper(CONVERT_NUMBER_INT), List.of(value));
        String formatSpec = spec.flags() + width;
        return new Expr.FormattedValue(
            converted,
            Conversion.NONE,
            formatSpec.isEmpty() ? null : new Expr.Constant(formatSpec));
      }
      default -> {
        Expr converted = new Expr.Call(helper(CONVERT_NUMBER_INDEX), List.of(value));
        String formatSpec = spec.flags() + width + spec.conversion();
        return new Expr.FormattedValue(converted, Conversion.NONE, new Expr.Constant(formatSpec));
      }
    }
  }
}
