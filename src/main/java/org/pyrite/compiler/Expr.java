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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.pyrite.code.Constants;

/**
 * A node of an expression tree, as produced by the parser. Nodes are immutable; optimizations
 * return new nodes.
 *
 * <p>{@link #toString} renders the node as source text, with a {@link JoinedStr} written as an
 * f-string.
 */
public abstract class Expr {

  private Expr() {}

  public abstract <T> T accept(Visitor<T> visitor);

  /** A Visitor has one method for each type of Expr. */
  public interface Visitor<T> {
    T visitConstant(Constant node);

    T visitName(Name node);

    T visitBinOp(BinOp node);

    T visitUnaryOp(UnaryOp node);

    T visitTuple(Tuple node);

    T visitCall(Call node);

    T visitAttribute(Attribute node);

    T visitSubscript(Subscript node);

    T visitFormattedValue(FormattedValue node);

    T visitJoinedStr(JoinedStr node);
  }

  /** A literal; see {@link Constants} for the representation of its value. */
  public static final class Constant extends Expr {
    public final Object value;

    public Constant(Object value) {
      this.value = Constants.of(value);
    }

    /** Returns the value if it is a string, or null. */
    public @Nullable String stringValue() {
      return (value instanceof String s) ? s : null;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitConstant(this);
    }

    @Override
    public String toString() {
      return Constants.repr(value);
    }
  }

  /** A reference to a variable. */
  public static final class Name extends Expr {
    public final String id;

    public Name(String id) {
      this.id = id;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitName(this);
    }

    @Override
    public String toString() {
      return id;
    }
  }

  public static final class BinOp extends Expr {
    public final Expr left;
    public final Operator op;
    public final Expr right;

    public BinOp(Expr left, Operator op, Expr right) {
      this.left = left;
      this.op = op;
      this.right = right;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitBinOp(this);
    }

    @Override
    public String toString() {
      return String.format("(%s %s %s)", left, op.symbol, right);
    }
  }

  public static final class UnaryOp extends Expr {
    /** The unary operators. */
    public enum Kind {
      PLUS("+"),
      MINUS("-"),
      INVERT("~"),
      NOT("not ");

      public final String symbol;

      Kind(String symbol) {
        this.symbol = symbol;
      }
    }

    public final Kind op;
    public final Expr operand;

    public UnaryOp(Kind op, Expr operand) {
      this.op = op;
      this.operand = operand;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitUnaryOp(this);
    }

    @Override
    public String toString() {
      return "(" + op.symbol + operand + ")";
    }
  }

  public static final class Tuple extends Expr {
    public final ImmutableList<Expr> elements;

    public Tuple(List<? extends Expr> elements) {
      this.elements = ImmutableList.copyOf(elements);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitTuple(this);
    }

    @Override
    public String toString() {
      if (elements.size() == 1) {
        return "(" + elements.get(0) + ",)";
      }
      return elements.stream().map(Expr::toString).collect(Collectors.joining(", ", "(", ")"));
    }
  }

  public static final class Call extends Expr {
    public final Expr func;
    public final ImmutableList<Expr> args;

    public Call(Expr func, List<? extends Expr> args) {
      this.func = func;
      this.args = ImmutableList.copyOf(args);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitCall(this);
    }

    @Override
    public String toString() {
      return func + args.stream().map(Expr::toString).collect(Collectors.joining(", ", "(", ")"));
    }
  }

  public static final class Attribute extends Expr {
    public final Expr value;
    public final String attr;

    public Attribute(Expr value, String attr) {
      this.value = value;
      this.attr = attr;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitAttribute(this);
    }

    @Override
    public String toString() {
      return value + "." + attr;
    }
  }

  public static final class Subscript extends Expr {
    public final Expr value;
    public final Expr index;

    public Subscript(Expr value, Expr index) {
      this.value = value;
      this.index = index;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitSubscript(this);
    }

    @Override
    public String toString() {
      return value + "[" + index + "]";
    }
  }

  /**
   * One interpolated value of a {@link JoinedStr}: the value is converted (by {@code str()},
   * {@code repr()} or {@code ascii()}, if requested) and then formatted with the format spec.
   */
  public static final class FormattedValue extends Expr {
    /** The conversion applied before formatting. */
    public enum Conversion {
      NONE(-1),
      STR('s'),
      REPR('r'),
      ASCII('a');

      /** The conversion character, or -1 for none. */
      public final int code;

      Conversion(int code) {
        this.code = code;
      }

      /** Returns the Conversion for a conversion character. */
      public static Conversion forCode(int code) {
        for (Conversion c : values()) {
          if (c.code == code) {
            return c;
          }
        }
        throw new IllegalArgumentException("No conversion " + (char) code);
      }
    }

    public final Expr value;
    public final Conversion conversion;

    /** A string Constant or a JoinedStr, or null if there is no format spec. */
    public final @Nullable Expr formatSpec;

    public FormattedValue(Expr value, Conversion conversion, @Nullable Expr formatSpec) {
      this.value = value;
      this.conversion = conversion;
      this.formatSpec = formatSpec;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitFormattedValue(this);
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder("{").append(value);
      if (conversion != Conversion.NONE) {
        sb.append('!').append((char) conversion.code);
      }
      if (formatSpec != null) {
        sb.append(':');
        appendFStringPart(sb, formatSpec);
      }
      return sb.append('}').toString();
    }
  }

  /** The concatenation of string Constants and FormattedValues. */
  public static final class JoinedStr extends Expr {
    public final ImmutableList<Expr> values;

    public JoinedStr(List<? extends Expr> values) {
      for (Expr value : values) {
        Preconditions.checkArgument(
            value instanceof FormattedValue
                || (value instanceof Constant c && c.stringValue() != null),
            "Not a string part: %s",
            value);
      }
      this.values = ImmutableList.copyOf(values);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitJoinedStr(this);
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder("f'");
      for (Expr value : values) {
        appendFStringPart(sb, value);
      }
      return sb.append('\'').toString();
    }
  }

  /** Appends the f-string text for a part of a JoinedStr or a format spec. */
  private static void appendFStringPart(StringBuilder sb, Expr part) {
    if (part instanceof Constant c && c.stringValue() != null) {
      String repr = Constants.repr(c.stringValue());
      String text = repr.substring(1, repr.length() - 1);
      if (repr.charAt(0) == '"') {
        text = text.replace("'", "\\'");
      }
      sb.append(text.replace("{", "{{").replace("}", "}}"));
    } else if (part instanceof JoinedStr joined) {
      joined.values.forEach(v -> appendFStringPart(sb, v));
    } else if (part instanceof FormattedValue) {
      sb.append(part);
    } else {
      sb.append('{').append(part).append('}');
    }
  }
}
