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

package org.pyrite.ssa;

import static com.google.common.flogger.LazyArgs.lazy;

import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Table;
import com.google.common.flogger.FluentLogger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.pyrite.code.Block;
import org.pyrite.code.CodeInfo;
import org.pyrite.code.FlowGraph;
import org.pyrite.code.Instruction;
import org.pyrite.code.InstructionStream;
import org.pyrite.code.MalformedCodeException;
import org.pyrite.code.Opcode;

/**
 * Translates a code unit into an {@link SsaGraph}.
 *
 * <p>Each basic block is translated by simulating the operand stack with SSA values. Local
 * variables are resolved on demand: a read with no definition earlier in the block looks in the
 * block's predecessors, creating a phi where several predecessors meet. A phi is registered as the
 * variable's definition before its operands are resolved, so reads that come back around a loop
 * find it rather than recursing forever.
 *
 * <p>A block is sealed once all of its predecessors have been translated; reads in a block that is
 * not yet sealed (a loop header, before its back edge has been seen) create a phi whose operands
 * are added when the block is sealed.
 *
 * <p>Values left on the operand stack at the end of a block are passed to its successors the same
 * way, as variables numbered after the local slots.
 *
 * <p>Unreachable blocks are translated but are not predecessors of any block, and a read in one
 * that has no definition earlier in the block is Undefined.
 *
 * <p>Exception regions are not supported.
 */
public final class SsaBuilder {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final CodeInfo info;
  private final FlowGraph cfg;
  private final InstructionStream code;
  private final SsaGraph graph = new SsaGraph();

  /** Indexed by the index of the source block. */
  private final SsaBlock[] blocks;

  /** Indexed by the index of the source block; -1 for unreachable blocks. */
  private final int[] entryDepths;

  /** The value of each variable at the end of each block, for blocks translated so far. */
  private final Table<Integer, SsaBlock, SsaValue> currentDef = HashBasedTable.create();

  /** Phis in unsealed blocks, each waiting for its operands. */
  private final Map<SsaBlock, Map<Integer, SsaValue>> incompletePhis = new HashMap<>();

  private final Set<SsaBlock> sealed = new HashSet<>();
  private final Set<SsaBlock> filled = new HashSet<>();

  /** The Undefined value of each variable that was read without a definition. */
  private final Map<Integer, SsaValue> undefined = new HashMap<>();

  private SsaBuilder(CodeInfo info, FlowGraph cfg) {
    this.info = info;
    this.cfg = cfg;
    this.code = cfg.code;
    this.blocks = new SsaBlock[cfg.blocks().size()];
    this.entryDepths = new int[cfg.blocks().size()];
  }

  /**
   * Returns the SSA form of {@code code}.
   *
   * @throws MalformedCodeException if {@code code} has no valid control-flow graph
   */
  public static SsaGraph build(CodeInfo info, InstructionStream code) {
    FlowGraph cfg = FlowGraph.build(code);
    if (cfg == null) {
      throw new MalformedCodeException(-1, "A jump target splits an EXTENDED_ARG prefix");
    }
    return build(info, cfg);
  }

  /**
   * Returns the SSA form of the code in {@code cfg}.
   *
   * @throws MalformedCodeException if stack depths are inconsistent, a block ends without a
   *     terminator or a single successor, or the code uses exception regions
   */
  public static SsaGraph build(CodeInfo info, FlowGraph cfg) {
    SsaGraph result = new SsaBuilder(info, cfg).run();
    logger.atFine().log("SSA for %s:\n%s", info, lazy(result::toString));
    return result;
  }

  private SsaGraph run() {
    for (Block block : cfg.blocks()) {
      blocks[block.index] = graph.newBlock(block);
    }
    computeEntryDepths();
    SsaBlock entry = graph.entry();
    for (Block block : cfg.blocks()) {
      SsaBlock ssaBlock = blocks[block.index];
      if (block.index == 0) {
        ssaBlock.addPredecessor(entry);
      }
      for (Block pred : block.predecessors()) {
        // Values from unreachable code never flow into a phi.
        if (entryDepths[pred.index] >= 0) {
          ssaBlock.addPredecessor(blocks[pred.index]);
        }
      }
    }
    for (int i = 0; i < info.totalArgs(); i++) {
      String opname = String.format("LoadArg<%s; %s>", i, info.varnames.get(i));
      SsaValue arg = graph.newValue(entry, opname, ImmutableList.of(), null, ImmutableList.of());
      entry.add(arg);
      writeVariable(i, entry, arg);
    }
    entry.terminate(branch(entry, blocks[0]));
    filled.add(entry);
    sealed.add(entry);
    for (Block block : cfg.blocks()) {
      SsaBlock ssaBlock = blocks[block.index];
      trySeal(ssaBlock);
      translate(block, ssaBlock);
      filled.add(ssaBlock);
      for (Block succ : block.successors()) {
        trySeal(blocks[succ.index]);
      }
    }
    assert incompletePhis.isEmpty();
    return graph;
  }

  /** Returns the variable used to pass the {@code depth}'th stack entry between blocks. */
  private int stackVariable(int depth) {
    return info.numFastLocals() + depth;
  }

  private String variableName(int variable) {
    int slots = info.numFastLocals();
    return (variable < slots) ? info.varnames.get(variable) : "stack" + (variable - slots);
  }

  void writeVariable(int variable, SsaBlock block, SsaValue value) {
    currentDef.put(variable, block, value);
  }

  /** After a delete, reads of the variable in this block and its successors are Undefined. */
  void deleteVariable(int variable, SsaBlock block) {
    writeVariable(variable, block, undefined(variable));
  }

  SsaValue readVariable(int variable, SsaBlock block) {
    SsaValue value = currentDef.get(variable, block);
    return (value != null) ? value : readVariableRecursive(variable, block);
  }

  private SsaValue readVariableRecursive(int variable, SsaBlock block) {
    SsaValue result;
    List<SsaBlock> preds = block.predecessors();
    if (!sealed.contains(block)) {
      result = newPhi(block);
      incompletePhis.computeIfAbsent(block, k -> new LinkedHashMap<>()).put(variable, result);
    } else if (block == graph.entry()) {
      result = undefined(variable);
    } else if (preds.isEmpty()) {
      // Unreachable code
      result = undefined(variable);
    } else if (preds.size() == 1) {
      result = readVariable(variable, preds.get(0));
    } else {
      result = newPhi(block);
      // Record the phi first, so that a cycle back to this block finds it.
      writeVariable(variable, block, result);
      addPhiOperands(variable, result);
    }
    writeVariable(variable, block, result);
    return result;
  }

  private SsaValue newPhi(SsaBlock block) {
    SsaValue phi =
        graph.newValue(block, SsaValue.PHI, ImmutableList.of(), null, ImmutableList.of());
    block.addPhi(phi);
    return phi;
  }

  private void addPhiOperands(int variable, SsaValue phi) {
    for (SsaBlock pred : phi.block.predecessors()) {
      phi.addOperand(readVariable(variable, pred));
    }
  }

  /** Returns the Undefined value for {@code variable}, creating it in the entry block if needed. */
  private SsaValue undefined(int variable) {
    return undefined.computeIfAbsent(
        variable,
        v -> {
          SsaBlock entry = graph.entry();
          String opname = "Undefined<" + variableName(v) + ">";
          SsaValue value =
              graph.newValue(entry, opname, ImmutableList.of(), null, ImmutableList.of());
          entry.add(value);
          return value;
        });
  }

  private void trySeal(SsaBlock block) {
    if (!sealed.contains(block) && filled.containsAll(block.predecessors())) {
      Map<Integer, SsaValue> phis = incompletePhis.remove(block);
      if (phis != null) {
        phis.forEach(this::addPhiOperands);
      }
      sealed.add(block);
    }
  }

  private SsaValue branch(SsaBlock block, SsaBlock target) {
    return graph.newValue(block, "Branch", ImmutableList.of(), null, ImmutableList.of(target));
  }

  /**
   * Determines the operand stack depth on entry to each block, and checks that every path to a
   * block agrees on it.
   */
  private void computeEntryDepths() {
    Arrays.fill(entryDepths, -1);
    entryDepths[0] = 0;
    ArrayDeque<Block> worklist = new ArrayDeque<>();
    worklist.add(cfg.entry());
    while (!worklist.isEmpty()) {
      Block block = worklist.remove();
      int depth = entryDepths[block.index];
      for (int p = block.start; p < block.last(); p++) {
        depth += stackEffect(p, false);
        if (depth < 0) {
          throw new MalformedCodeException(p, "Operand stack underflow");
        }
      }
      List<Block> succs = block.successors();
      Opcode last = code.get(block.last()).opcode();
      for (int i = 0; i < succs.size(); i++) {
        // A branch's second successor is its taken edge.
        boolean taken = (last.kind == Opcode.Kind.BRANCH && i == 1);
        int succDepth = depth + stackEffect(block.last(), taken);
        Block succ = succs.get(i);
        if (entryDepths[succ.index] < 0) {
          entryDepths[succ.index] = succDepth;
          worklist.add(succ);
        } else if (entryDepths[succ.index] != succDepth) {
          throw new MalformedCodeException(
              succ.start,
              "Inconsistent stack depth (%s from %s, %s before)",
              succDepth,
              block,
              entryDepths[succ.index]);
        }
      }
    }
  }

  private int stackEffect(int position, boolean taken) {
    return code.get(position).opcode().stackEffect(code.fullOperand(position), taken);
  }

  private void translate(Block block, SsaBlock ssaBlock) {
    List<SsaValue> stack = new ArrayList<>();
    int depth = Math.max(0, entryDepths[block.index]);
    for (int i = 0; i < depth; i++) {
      stack.add(readVariable(stackVariable(i), ssaBlock));
    }
    for (int p = block.start; p < block.end; p++) {
      Instruction inst = code.get(p);
      Opcode opcode = inst.opcode();
      int operand = code.fullOperand(p);
      switch (opcode) {
        case NOP, EXTENDED_ARG -> {}
        case POP_TOP -> pop(stack, p);
        case DUP_TOP -> stack.add(peek(stack, p));
        case ROT_TWO -> {
          SsaValue top = pop(stack, p);
          SsaValue second = pop(stack, p);
          stack.add(top);
          stack.add(second);
        }
        case LOAD_FAST, LOAD_FAST_REVERSE_UNCHECKED ->
            stack.add(readVariable(info.slotOf(code, p), ssaBlock));
        case STORE_FAST, STORE_FAST_REVERSE ->
            writeVariable(info.slotOf(code, p), ssaBlock, pop(stack, p));
        case DELETE_FAST, DELETE_FAST_REVERSE_UNCHECKED ->
            deleteVariable(info.slotOf(code, p), ssaBlock);
        case LOAD_METHOD -> {
          SsaValue receiver = pop(stack, p);
          SsaValue method = emit(ssaBlock, opname(opcode, operand), List.of(receiver), inst);
          stack.add(method);
          stack.add(receiver);
        }
        case FOR_ITER -> {
          // The taken edge pops the iterator; successors only read the entries they expect.
          SsaValue next = terminate(ssaBlock, block, List.of(peek(stack, p)), inst);
          stack.add(next);
        }
        case JUMP_IF_FALSE_OR_POP, JUMP_IF_TRUE_OR_POP ->
            // The condition stays on the stack for the taken edge.
            terminate(ssaBlock, block, List.of(peek(stack, p)), inst);
        case POP_JUMP_IF_FALSE, POP_JUMP_IF_TRUE ->
            terminate(ssaBlock, block, List.of(pop(stack, p)), inst);
        case JUMP_FORWARD, JUMP_ABSOLUTE -> terminate(ssaBlock, block, List.of(), inst);
        case RETURN_VALUE, RAISE_VARARGS ->
            terminate(ssaBlock, block, popN(stack, opcode.pops(operand), p), inst);
        case SETUP_FINALLY, SETUP_WITH, POP_BLOCK, POP_EXCEPT, END_FINALLY ->
            throw new MalformedCodeException(p, "%s: exception regions are not supported", opcode);
        default -> {
          List<SsaValue> args = popN(stack, opcode.pops(operand), p);
          SsaValue value = emit(ssaBlock, opname(opcode, operand), args, inst);
          int pushes = opcode.pushes(operand);
          assert pushes <= 1;
          if (pushes == 1) {
            stack.add(value);
          }
        }
      }
    }
    if (ssaBlock.terminator() == null) {
      // The last instruction was ordinary; make the fallthrough explicit.
      List<Block> succs = block.successors();
      if (succs.size() != 1) {
        throw new MalformedCodeException(block.last(), "%s has no terminator", block);
      }
      ssaBlock.terminate(branch(ssaBlock, blocks[succs.get(0).index]));
    }
    for (int i = 0; i < stack.size(); i++) {
      writeVariable(stackVariable(i), ssaBlock, stack.get(i));
    }
  }

  private static String opname(Opcode opcode, int operand) {
    return opcode.hasArg() ? opcode + "<" + operand + ">" : opcode.toString();
  }

  private SsaValue emit(
      SsaBlock ssaBlock, String opname, List<SsaValue> args, @Nullable Instruction inst) {
    SsaValue value = graph.newValue(ssaBlock, opname, args, inst, ImmutableList.of());
    ssaBlock.add(value);
    return value;
  }

  /** Adds the terminator for a jump, branch, return or raise, targeting the block's successors. */
  private SsaValue terminate(
      SsaBlock ssaBlock, Block block, List<SsaValue> args, Instruction inst) {
    ImmutableList<SsaBlock> targets =
        block.successors().stream()
            .map(succ -> blocks[succ.index])
            .collect(ImmutableList.toImmutableList());
    SsaValue value = graph.newValue(ssaBlock, inst.opcode().toString(), args, inst, targets);
    ssaBlock.terminate(value);
    return value;
  }

  private static SsaValue pop(List<SsaValue> stack, int position) {
    if (stack.isEmpty()) {
      throw new MalformedCodeException(position, "Operand stack underflow");
    }
    return stack.remove(stack.size() - 1);
  }

  private static SsaValue peek(List<SsaValue> stack, int position) {
    if (stack.isEmpty()) {
      throw new MalformedCodeException(position, "Operand stack underflow");
    }
    return stack.get(stack.size() - 1);
  }

  /** Removes the top {@code n} entries from the stack and returns them, bottom first. */
  private static List<SsaValue> popN(List<SsaValue> stack, int n, int position) {
    if (stack.size() < n) {
      throw new MalformedCodeException(position, "Operand stack underflow");
    }
    List<SsaValue> top = stack.subList(stack.size() - n, stack.size());
    ImmutableList<SsaValue> result = ImmutableList.copyOf(top);
    top.clear();
    return result;
  }
}
