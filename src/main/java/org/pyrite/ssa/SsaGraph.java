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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.pyrite.code.Block;
import org.pyrite.code.Instruction;

/**
 * The SSA form of a code unit. Block {@code bb0} is a synthetic entry that defines the arguments
 * (and the Undefined values) and branches to the block at position 0; each remaining block
 * corresponds to one basic block of the source code.
 */
public final class SsaGraph {
  private final Numbering numbering = new Numbering();
  private final SsaBlock entry;
  private final List<SsaBlock> blocks = new ArrayList<>();

  /** Keyed by the start position of the source block. */
  private final Map<Integer, SsaBlock> byStart = new HashMap<>();

  SsaGraph() {
    entry = newBlock(null);
  }

  SsaBlock newBlock(@Nullable Block source) {
    SsaBlock block = new SsaBlock(numbering.newBlockId(), source);
    blocks.add(block);
    if (source != null) {
      byStart.put(source.start, block);
    }
    return block;
  }

  SsaValue newValue(
      SsaBlock block,
      String opname,
      List<SsaValue> operands,
      @Nullable Instruction source,
      List<SsaBlock> targets) {
    return new SsaValue(numbering.newValueId(), opname, block, operands, source, targets);
  }

  public SsaBlock entry() {
    return entry;
  }

  /** Returns the block translated from the basic block starting at {@code position}. */
  public SsaBlock blockAt(int position) {
    SsaBlock result = byStart.get(position);
    Preconditions.checkArgument(result != null, "No block at %s", position);
    return result;
  }

  /** Returns all blocks, ordered by id. */
  public ImmutableList<SsaBlock> blocks() {
    return ImmutableList.copyOf(blocks);
  }

  /** Returns the number of values in this graph. */
  public int numValues() {
    return numbering.numValues();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (SsaBlock block : blocks) {
      sb.append(block).append(":\n");
      for (SsaValue value : block.values()) {
        sb.append("  ").append(value.definition()).append('\n');
      }
      sb.append('\n');
    }
    return sb.toString();
  }
}
