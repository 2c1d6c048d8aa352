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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A basic block: a maximal run of instructions that is only entered at its first instruction and
 * only left after its last.
 *
 * <p>Blocks are created by {@link FlowGraph#build}, and describe the stream as it was at that
 * time; a pass that changes the stream's length or jump targets invalidates them.
 */
public final class Block {
  /** This block's index in {@link FlowGraph#blocks}; the entry block has index 0. */
  public final int index;

  /** The position of this block's first instruction. */
  public final int start;

  /** The position following this block's last instruction. */
  public final int end;

  /** If the last instruction is a branch, the fallthrough block comes first. */
  private final List<Block> successors = new ArrayList<>(2);

  /** Ordered by index. */
  private final Set<Block> predecessors = new LinkedHashSet<>();

  Block(int index, int start, int end) {
    assert start < end;
    this.index = index;
    this.start = start;
    this.end = end;
  }

  void addSuccessor(Block successor) {
    successors.add(successor);
    successor.predecessors.add(this);
  }

  /**
   * Returns the blocks that may execute next: none after a terminator, the target of a jump, the
   * fallthrough and target (in that order) of a branch, or the next block.
   */
  public List<Block> successors() {
    return Collections.unmodifiableList(successors);
  }

  /** Returns the blocks that have this block as a successor, in order of their index. */
  public Set<Block> predecessors() {
    return Collections.unmodifiableSet(predecessors);
  }

  /** Returns the number of instructions in this block. */
  public int size() {
    return end - start;
  }

  /** Returns the position of this block's last instruction. */
  public int last() {
    return end - 1;
  }

  /** True if this block begins at position {@code position} or includes it. */
  public boolean contains(int position) {
    return position >= start && position < end;
  }

  @Override
  public String toString() {
    return "b" + index;
  }
}
