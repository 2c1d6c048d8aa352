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
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.pyrite.code.Instruction;

/**
 * A value in SSA form: the result of one operation applied to previously-defined values.
 *
 * <p>Values are immutable except that a phi's operands are appended as its block's predecessors
 * are resolved.
 */
public final class SsaValue {
  /** The opname of phi values. */
  public static final String PHI = "Phi";

  public final int id;

  /** The operation, including any immediate operand, e.g. {@code "LOAD_CONST<0>"}. */
  public final String opname;

  /** The block this value is defined in. */
  public final SsaBlock block;

  /** The instruction this value was translated from, if any. */
  public final @Nullable Instruction source;

  /** For branches, the blocks that control may transfer to. */
  public final ImmutableList<SsaBlock> targets;

  private final List<SsaValue> operands;

  SsaValue(
      int id,
      String opname,
      SsaBlock block,
      List<SsaValue> operands,
      @Nullable Instruction source,
      List<SsaBlock> targets) {
    this.id = id;
    this.opname = opname;
    this.block = block;
    this.operands = new ArrayList<>(operands);
    this.source = source;
    this.targets = ImmutableList.copyOf(targets);
  }

  public boolean isPhi() {
    return opname.equals(PHI);
  }

  public List<SsaValue> operands() {
    return Collections.unmodifiableList(operands);
  }

  void addOperand(SsaValue operand) {
    Preconditions.checkState(isPhi(), "Only phis have operands added");
    operands.add(operand);
  }

  /** Returns the textual form of this value's definition, e.g. {@code "v3 = BINARY_ADD v1 v2"}. */
  public String definition() {
    StringBuilder sb = new StringBuilder().append(this).append(" = ").append(opname);
    if (!targets.isEmpty()) {
      sb.append(
          targets.stream().map(SsaBlock::toString).collect(Collectors.joining(", ", "<", ">")));
    }
    for (SsaValue operand : operands) {
      sb.append(' ').append(operand);
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return "v" + id;
  }
}
