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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import java.util.Arrays;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.pyrite.util.Bits;

/**
 * The control-flow graph of an {@link InstructionStream}: its partition into {@link Block}s and
 * the edges between them.
 */
public final class FlowGraph {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  public final InstructionStream code;

  /** Ordered by start position; they exactly partition the stream. */
  private final ImmutableList<Block> blocks;

  /** The block start positions. */
  private final Bits starts;

  /** {@code blockIndex[p]} is the index of the block containing position {@code p}. */
  private final int[] blockIndex;

  private FlowGraph(InstructionStream code, Bits starts) {
    this.code = code;
    this.starts = starts;
    int[] startArray = starts.stream().toArray();
    ImmutableList.Builder<Block> builder = ImmutableList.builderWithExpectedSize(startArray.length);
    blockIndex = new int[code.size()];
    for (int i = 0; i < startArray.length; i++) {
      int end = (i + 1 < startArray.length) ? startArray[i + 1] : code.size();
      builder.add(new Block(i, startArray[i], end));
      Arrays.fill(blockIndex, startArray[i], end, i);
    }
    blocks = builder.build();
  }

  /**
   * Partitions {@code code} into basic blocks and links them.
   *
   * <p>Returns null if a block would have to start between an {@link Opcode#EXTENDED_ARG} prefix
   * and the instruction it extends; callers should leave such code unoptimized.
   *
   * @throws MalformedCodeException if the code is empty, a jump target is outside the stream, or
   *     control can fall off the end of the stream
   */
  public static @Nullable FlowGraph build(InstructionStream code) {
    int size = code.size();
    if (size == 0) {
      throw new MalformedCodeException(0, "Empty code unit");
    }
    Bits.Builder starts = new Bits.Builder();
    starts.set(0);
    for (int p = 0; p < size; p++) {
      Opcode opcode = code.get(p).opcode();
      if (opcode.hasTarget()) {
        starts.set(checkedTarget(code, p));
      }
      if (opcode.kind != Opcode.Kind.ORDINARY && p + 1 < size) {
        starts.set(p + 1);
      }
    }
    Bits startBits = starts.build();
    for (int start : startBits) {
      if (start > 0 && code.get(start - 1).opcode() == Opcode.EXTENDED_ARG) {
        logger.atFine().log("Block boundary at %s splits an EXTENDED_ARG prefix", start);
        return null;
      }
    }
    FlowGraph result = new FlowGraph(code, startBits);
    result.link();
    return result;
  }

  private static int checkedTarget(InstructionStream code, int position) {
    int target = code.jumpTarget(position);
    if (target < 0 || target >= code.size()) {
      throw new MalformedCodeException(position, "Jump target %s is outside the code", target);
    }
    return target;
  }

  private void link() {
    for (Block block : blocks) {
      int last = block.last();
      Opcode opcode = code.get(last).opcode();
      switch (opcode.kind) {
        case ORDINARY -> block.addSuccessor(fallthrough(block));
        case JUMP -> block.addSuccessor(blockAt(code.jumpTarget(last)));
        case BRANCH -> {
          block.addSuccessor(fallthrough(block));
          block.addSuccessor(blockAt(code.jumpTarget(last)));
        }
        case TERMINATOR -> {}
      }
    }
  }

  private Block fallthrough(Block block) {
    if (block.end == code.size()) {
      throw new MalformedCodeException(block.last(), "Control falls off the end of the code");
    }
    return blocks.get(block.index + 1);
  }

  /** Returns all blocks, ordered by start position. */
  public ImmutableList<Block> blocks() {
    return blocks;
  }

  /** Returns the block containing position 0. */
  public Block entry() {
    return blocks.get(0);
  }

  /** Returns the set of positions at which blocks start. */
  public Bits starts() {
    return starts;
  }

  /** Returns the block that starts at {@code position}. */
  public Block blockAt(int position) {
    Preconditions.checkArgument(starts.test(position), "No block starts at %s", position);
    return blocks.get(blockIndex[position]);
  }

  /** Returns the block containing {@code position}. */
  public Block blockContaining(int position) {
    return blocks.get(blockIndex[position]);
  }

  /** Returns the position that the jump or branch ending {@code block} transfers control to. */
  public int targetOf(Block block) {
    return code.jumpTarget(block.last());
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Block block : blocks) {
      sb.append(block)
          .append(" [")
          .append(block.start)
          .append(", ")
          .append(block.end)
          .append(")");
      if (!block.successors().isEmpty()) {
        String successors =
            block.successors().stream().map(Block::toString).collect(Collectors.joining(", "));
        sb.append(" -> ").append(successors);
      }
      sb.append('\n');
    }
    return sb.toString();
  }
}
