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
import org.pyrite.compiler.Expr.Constant;

/**
 * An Expr.Visitor that returns an optimized version of each node it visits: operators applied to
 * constants are folded, and printf-style interpolations of a constant format string are rewritten
 * by {@link PrintfRewriter}.
 *
 * <p>Children are optimized before their parents. A node none of whose children changed and which
 * could not itself be optimized is returned unchanged (the same instance).
 */
final class AstOptimizer implements Expr.Visitor<Expr> {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Options options;

  AstOptimizer(Options options) {
    this.options = options;
  }

  Expr optimize(Expr node) {
    return node.accept(this);
  }

  /** Returns {@code nodes} optimized, or {@code nodes} itself if none of them changed. */
  private ImmutableList<Expr> optimizeAll(ImmutableList<Expr> nodes) {
    ImmutableList.Builder<Expr> result = null;
    for (int i = 0; i < nodes.size(); i++) {
      Expr node = nodes.get(i);
      Expr optimized = optimize(node);
      if (result == null && optimized != node) {
        result = ImmutableList.builderWithExpectedSize(nodes.size());
        result.addAll(nodes.subList(0, i));
      }
      if (result != null) {
        result.add(optimized);
      }
    }
    return (result == null) ? nodes : result.build();
  }

  @Override
  public Expr visitConstant(Constant node) {
    return node;
  }

  @Override
  public Expr visitName(Expr.Name node) {
    return node;
  }

  @Override
  public Expr visitBinOp(Expr.BinOp node) {
    Expr left = optimize(node.left);
    Expr right = optimize(node.right);
    if (options.foldConstants && left instanceof Constant x && right instanceof Constant y) {
      Object folded = ConstantFolder.binary(node.op, x.value, y.value);
      if (folded != null) {
        return folded(node, folded);
      }
    }
    if (node.op == Operator.MOD && left instanceof Constant x && x.stringValue() != null) {
      Expr rewritten = null;
      if (options.rewritePrintf) {
        rewritten = PrintfRewriter.rewrite(x.stringValue(), right, options.foldConstants);
      } else if (options.foldConstants && right instanceof Constant y) {
        String formatted = PercentFormat.format(x.stringValue(), y.value);
        rewritten = (formatted == null) ? null : new Constant(formatted);
      }
      if (rewritten != null) {
        logger.atFine().log("Rewrote %s as %s", node, rewritten);
        return rewritten;
      }
    }
    if (left == node.left && right == node.right) {
      return node;
    }
    return new Expr.BinOp(left, node.op, right);
  }

  @Override
  public Expr visitUnaryOp(Expr.UnaryOp node) {
    Expr operand = optimize(node.operand);
    if (options.foldConstants && operand instanceof Constant c) {
      Object folded = ConstantFolder.unary(node.op, c.value);
      if (folded != null) {
        return folded(node, folded);
      }
    }
    return (operand == node.operand) ? node : new Expr.UnaryOp(node.op, operand);
  }

  @Override
  public Expr visitTuple(Expr.Tuple node) {
    ImmutableList<Expr> elements = optimizeAll(node.elements);
    if (options.foldConstants
        && elements.size() <= ConstantFolder.MAX_COLLECTION_SIZE
        && elements.stream().allMatch(e -> e instanceof Constant)) {
      return folded(node, elements.stream().map(e -> ((Constant) e).value).toList());
    }
    return (elements == node.elements) ? node : new Expr.Tuple(elements);
  }

  @Override
  public Expr visitCall(Expr.Call node) {
    Expr func = optimize(node.func);
    ImmutableList<Expr> args = optimizeAll(node.args);
    return (func == node.func && args == node.args) ? node : new Expr.Call(func, args);
  }

  @Override
  public Expr visitAttribute(Expr.Attribute node) {
    Expr value = optimize(node.value);
    return (value == node.value) ? node : new Expr.Attribute(value, node.attr);
  }

  @Override
  public Expr visitSubscript(Expr.Subscript node) {
    Expr value = optimize(node.value);
    Expr index = optimize(node.index);
    return (value == node.value && index == node.index) ? node : new Expr.Subscript(value, index);
  }

  @Override
  public Expr visitFormattedValue(Expr.FormattedValue node) {
    Expr value = optimize(node.value);
    Expr formatSpec = (node.formatSpec == null) ? null : optimize(node.formatSpec);
    if (value == node.value && formatSpec == node.formatSpec) {
      return node;
    }
    return new Expr.FormattedValue(value, node.conversion, formatSpec);
  }

  @Override
  public Expr visitJoinedStr(Expr.JoinedStr node) {
    ImmutableList<Expr> values = optimizeAll(node.values);
    return (values == node.values) ? node : new Expr.JoinedStr(values);
  }

  private static Expr folded(Expr node, Object value) {
    Constant result = new Constant(value);
    logger.atFinest().log("Folded %s to %s", node, result);
    return result;
  }
}
