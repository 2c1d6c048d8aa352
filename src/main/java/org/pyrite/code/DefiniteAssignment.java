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

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.pyrite.util.Bits;

/**
 * A forward dataflow analysis that determines which local slots are definitely assigned at each
 * point of a code unit, and uses the result to rewrite the code:
 *
 * <ul>
 *   <li>a {@link Opcode#LOAD_FAST} of a slot that is definitely assigned becomes {@link
 *       Opcode#LOAD_FAST_REVERSE_UNCHECKED}, which skips the check for an unbound local;
 *   <li>every {@link Opcode#STORE_FAST} becomes {@link Opcode#STORE_FAST_REVERSE}; and
 *   <li>each non-argument slot that is read where it might not be assigned is explicitly unbound
 *       by a {@link Opcode#DELETE_FAST_REVERSE_UNCHECKED} at the start of the code, so that the
 *       checked read fails as it should rather than finding a stale value in the frame.
 * </ul>
 *
 * <p>The state of each block is the set of slots assigned on every path to its exit. States start
 * at "all slots" and the meet is intersection, so the iteration only ever removes slots and
 * terminates after at most {@code blocks * slots + 1} sweeps.
 *
 * <p>Exception handlers are reached by the taken edge of the {@link Opcode#SETUP_FINALLY} or
 * {@link Opcode#SETUP_WITH} that opens them, but may actually be entered from anywhere in the
 * protected region; their entry state also excludes any slot that is deleted anywhere in the code.
 *
 * <p>If the rewritten code cannot be encoded (a renumbered slot or shifted jump no longer fits its
 * operand width) or the code may call {@code locals()}, the code is left unchanged.
 */
public final class DefiniteAssignment {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** If true, {@link #history} records the exit states after each sweep. */
  public boolean verbose;

  private final CodeInfo info;
  private final FlowGraph graph;
  private final InstructionStream code;

  /** The state on entry to the code unit: just the argument slots. */
  private final Bits argSlots;

  /** Every slot deleted somewhere in the code unit. */
  private final Bits deletedAnywhere;

  /** Indexed by block index; true for the handler blocks of SETUP_* instructions. */
  private final boolean[] isHandler;

  /** Indexed by block index. */
  private final Bits[] exitStates;

  private int sweeps;
  private final List<ImmutableList<Bits>> history = new ArrayList<>();

  public DefiniteAssignment(CodeInfo info, FlowGraph graph) {
    this.info = info;
    this.graph = graph;
    this.code = graph.code;
    this.argSlots = Bits.forRange(0, info.totalArgs() - 1);
    int numBlocks = graph.blocks().size();
    this.isHandler = new boolean[numBlocks];
    this.exitStates = new Bits[numBlocks];
    Bits.Builder deleted = new Bits.Builder();
    for (Instruction inst : code.instructions()) {
      if (inst.opcode().deletesLocal()) {
        deleted.set(info.slotOf(code, inst.position()));
      }
    }
    this.deletedAnywhere = deleted.build();
    for (Block block : graph.blocks()) {
      if (code.get(block.last()).opcode().opensHandler()) {
        isHandler[graph.blockAt(graph.targetOf(block)).index] = true;
      }
    }
  }

  /**
   * Runs the analysis on {@code code} and rewrites it. Returns false if the code was left
   * unchanged because it could not be safely rewritten.
   */
  @CanIgnoreReturnValue
  public static boolean optimize(CodeInfo info, InstructionStream code) {
    if (info.mayUseLocals()) {
      logger.atFine().log("Not checking definite assignment in %s: it may call locals()", info);
      return false;
    }
    FlowGraph graph = FlowGraph.build(code);
    if (graph == null) {
      return false;
    }
    return new DefiniteAssignment(info, graph).computeAndRewrite();
  }

  /**
   * Computes the fixed point and then rewrites the graph's instruction stream; the graph's blocks
   * are stale afterwards. Returns false if the stream was left unchanged.
   */
  @CanIgnoreReturnValue
  public boolean computeAndRewrite() {
    if (info.mayUseLocals()) {
      return false;
    }
    computeFixedPoint();
    InstructionStream result = code.copy();
    Rewriter rewriter = new Rewriter(result);
    for (Block block : graph.blocks()) {
      var unused = transfer(block, entryState(block), rewriter);
      if (rewriter.failed) {
        logger.atFine().log("Not rewriting %s: a renumbered slot does not fit", info);
        return false;
      }
    }
    if (!rewriter.addPrelude()) {
      logger.atFine().log("Not rewriting %s: prelude does not fit", info);
      return false;
    }
    code.replaceAll(result.instructions());
    logger.atFine().log(
        "Rewrote %s after %s sweeps: %s unchecked loads, unbinding %s on entry",
        info, sweeps, rewriter.uncheckedLoads, rewriter.conditionallyAssigned);
    return true;
  }

  /** Iterates until no block's exit state changes. */
  void computeFixedPoint() {
    Bits top = Bits.forRange(0, info.numFastLocals() - 1);
    Arrays.fill(exitStates, top);
    int limit = graph.blocks().size() * info.numFastLocals() + 1;
    boolean changed;
    do {
      changed = false;
      for (Block block : graph.blocks()) {
        Bits out = transfer(block, entryState(block), null);
        if (!out.equals(exitStates[block.index])) {
          assert exitStates[block.index].testAll(out);
          exitStates[block.index] = out;
          changed = true;
        }
      }
      sweeps++;
      if (verbose) {
        history.add(ImmutableList.copyOf(exitStates));
      }
      assert sweeps <= limit;
    } while (changed);
  }

  /** Returns the slots definitely assigned when {@code block} is entered. */
  public Bits entryState(Block block) {
    Bits result = null;
    for (Block pred : block.predecessors()) {
      Bits out = exitStates[pred.index];
      result = (result == null) ? out : Bits.Op.INTERSECTION.apply(result, out);
    }
    if (block.index == 0) {
      // The function entry is an additional predecessor of the first block.
      result = (result == null) ? argSlots : Bits.Op.INTERSECTION.apply(result, argSlots);
    } else if (result == null) {
      // Unreachable; any choice is sound.
      result = argSlots;
    }
    if (isHandler[block.index]) {
      result = Bits.Op.DIFFERENCE.apply(result, deletedAnywhere);
    }
    return result;
  }

  /** Returns the slots definitely assigned when {@code block} is exited. */
  public Bits exitState(Block block) {
    return exitStates[block.index];
  }

  /** Returns the number of sweeps taken to reach the fixed point. */
  public int sweeps() {
    return sweeps;
  }

  /** If {@link #verbose} was set, returns the exit states after each sweep. */
  public ImmutableList<ImmutableList<Bits>> history() {
    return ImmutableList.copyOf(history);
  }

  /**
   * Applies the effect of {@code block}'s instructions to {@code in} and returns the resulting
   * state; if {@code rewriter} is non-null, also passes it each local access.
   */
  private Bits transfer(Block block, Bits in, @Nullable Rewriter rewriter) {
    Bits.Builder state = new Bits.Builder(in);
    for (int p = block.start; p < block.end; p++) {
      Opcode opcode = code.get(p).opcode();
      if (!opcode.accessesLocal()) {
        continue;
      }
      int slot = info.slotOf(code, p);
      if (opcode == Opcode.LOAD_FAST) {
        if (rewriter != null) {
          rewriter.load(p, slot, state.test(slot));
        }
      } else if (opcode.storesLocal()) {
        state.set(slot);
        if (rewriter != null && opcode == Opcode.STORE_FAST) {
          rewriter.store(p, slot);
        }
      } else if (opcode.deletesLocal()) {
        state.clear(slot);
      }
    }
    return state.build();
  }

  /** Accumulates the rewrites in a copy of the instruction stream. */
  private class Rewriter {
    final InstructionStream result;
    final Bits.Builder conditionallyAssigned = new Bits.Builder();
    int uncheckedLoads;
    boolean failed;

    Rewriter(InstructionStream result) {
      this.result = result;
    }

    void load(int position, int slot, boolean assigned) {
      if (assigned) {
        rewrite(position, Opcode.LOAD_FAST_REVERSE_UNCHECKED, slot);
        uncheckedLoads++;
      } else if (slot >= info.totalArgs()) {
        conditionallyAssigned.set(slot);
      }
    }

    void store(int position, int slot) {
      rewrite(position, Opcode.STORE_FAST_REVERSE, slot);
    }

    private void rewrite(int position, Opcode opcode, int slot) {
      Instruction inst = result.get(position);
      result.set(position, opcode, inst.operand());
      if (!result.setOperand(position, info.reverseIndex(slot))) {
        failed = true;
      }
    }

    /**
     * Inserts the instructions that unbind each conditionally-assigned slot, and shifts absolute
     * jump targets past them. Returns false if a shifted operand does not fit.
     */
    boolean addPrelude() {
      Bits slots = conditionallyAssigned.build();
      if (slots.isEmpty()) {
        return true;
      }
      List<Instruction> prelude = new ArrayList<>();
      for (int slot : slots) {
        int reverse = info.reverseIndex(slot);
        if (reverse > 0xff) {
          return false;
        }
        prelude.add(new Instruction(Opcode.DELETE_FAST_REVERSE_UNCHECKED, reverse, prelude.size()));
      }
      int shift = prelude.size() * InstructionStream.CODE_UNIT_SIZE;
      for (int p = 0; p < result.size(); p++) {
        if (result.get(p).opcode().target == Opcode.Target.ABSOLUTE
            && !result.setOperand(p, result.fullOperand(p) + shift)) {
          return false;
        }
      }
      result.prepend(prelude);
      return true;
    }
  }
}
