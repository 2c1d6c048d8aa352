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

/**
 * One code unit of an {@link InstructionStream}: an opcode, its operand byte, and its index in the
 * stream.
 *
 * <p>Instructions are values; passes that rewrite code replace the Instruction at a position
 * rather than modifying it, so anything that kept a reference (e.g. an SSA value recording its
 * provenance) continues to see the instruction as it was.
 */
public record Instruction(Opcode opcode, int operand, int position) {

  public Instruction {
    Preconditions.checkArgument(operand >= 0 && operand <= 0xff, "Bad operand: %s", operand);
  }

  /** Returns an Instruction with the same position and a different opcode and operand. */
  public Instruction replace(Opcode newOpcode, int newOperand) {
    return new Instruction(newOpcode, newOperand, position);
  }

  /** Returns an Instruction with the same opcode and operand at a different position. */
  public Instruction moveTo(int newPosition) {
    return (newPosition == position) ? this : new Instruction(opcode, operand, newPosition);
  }

  @Override
  public String toString() {
    return opcode.hasArg() ? opcode + " " + operand : opcode.toString();
  }
}
