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

import static com.google.common.flogger.LazyArgs.lazy;

import com.google.common.flogger.FluentLogger;
import org.jspecify.annotations.Nullable;
import org.pyrite.code.CodeInfo;
import org.pyrite.code.CodeUnit;
import org.pyrite.code.DefiniteAssignment;
import org.pyrite.code.Disassembler;
import org.pyrite.code.InstructionStream;
import org.pyrite.code.StoreElimination;
import org.pyrite.ssa.SsaBuilder;
import org.pyrite.ssa.SsaGraph;

/** Runs the optimization passes selected by an {@link Options} on expressions and code units. */
public final class Compiler {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  // Static methods only
  private Compiler() {}

  /** Returns an optimized equivalent of {@code expr}, or {@code expr} itself if nothing changed. */
  public static Expr optimize(Expr expr, Options options) {
    if (!(options.foldConstants || options.rewritePrintf)) {
      return expr;
    }
    return new AstOptimizer(options).optimize(expr);
  }

  /**
   * Runs the local-slot passes on {@code code}, modifying it in place. Returns true if any
   * instruction was changed.
   *
   * <p>Dead-store elimination runs first, so that the stores it removes are no longer counted as
   * assignments by the definite-assignment analysis.
   */
  public static boolean optimizeCode(CodeInfo info, InstructionStream code, Options options) {
    boolean changed = false;
    if (options.eliminateDeadStores) {
      changed = StoreElimination.run(info, code) != 0;
    }
    if (options.checkDefiniteAssignment) {
      changed |= DefiniteAssignment.optimize(info, code);
    }
    logger.atFine().log("%s: %s", info, changed ? "optimized" : "unchanged");
    if (changed) {
      logger.atFinest().log("%s", lazy(() -> Disassembler.disassemble(info, code)));
    }
    return changed;
  }

  /** Equivalent to {@code optimizeCode(unit.info(), unit.code(), options)}. */
  public static boolean optimizeCode(CodeUnit unit, Options options) {
    return optimizeCode(unit.info(), unit.code(), options);
  }

  /** Returns the SSA form of {@code unit}, or null if {@link Options#buildSsa} is false. */
  public static @Nullable SsaGraph buildSsa(CodeUnit unit, Options options) {
    return options.buildSsa ? SsaBuilder.build(unit.info(), unit.code()) : null;
  }
}
