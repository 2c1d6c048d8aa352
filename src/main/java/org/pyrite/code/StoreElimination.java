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

import com.google.common.flogger.FluentLogger;
import org.pyrite.util.Bits;

/**
 * Replaces stores to local slots that are never read or deleted with {@link Opcode#POP_TOP}.
 *
 * <p>This runs before {@link DefiniteAssignment}, which then has fewer stores to renumber.
 */
public final class StoreElimination {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private StoreElimination() {}

  /** Rewrites dead stores in {@code code}; returns the number of stores that were removed. */
  public static int run(CodeInfo info, InstructionStream code) {
    if (info.mayUseLocals()) {
      logger.atFine().log("Not eliminating stores in %s: it may call locals()", info);
      return 0;
    }
    Bits.Builder used = new Bits.Builder();
    for (Instruction inst : code.instructions()) {
      Opcode opcode = inst.opcode();
      if (opcode.loadsLocal() || opcode.deletesLocal()) {
        used.set(info.slotOf(code, inst.position()));
      }
    }
    int removed = 0;
    for (int p = 0; p < code.size(); p++) {
      if (code.get(p).opcode().storesLocal()
          && !used.test(info.slotOf(code, p))
          && code.prefixCount(p) == 0) {
        code.set(p, Opcode.POP_TOP, 0);
        removed++;
      }
    }
    if (removed != 0) {
      logger.atFine().log("Removed %s dead stores from %s", removed, info);
    }
    return removed;
  }
}
