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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The instructions of one code unit, addressed by position (the index of a code unit).
 *
 * <p>The packed form uses two bytes per code unit: the opcode and the operand byte. Operands
 * wider than a byte are encoded by preceding the instruction with one or more {@link
 * Opcode#EXTENDED_ARG} units, each supplying the next more-significant byte. Those prefixes are
 * kept as separate instructions; {@link #fullOperand} combines them.
 *
 * <p>An InstructionStream is mutable, but is owned by one pass at a time; passes that may give up
 * compute their changes on a copy and {@link #replaceAll commit} them only if they succeed.
 */
public final class InstructionStream {
  /** The number of bytes in one code unit; jump operands are byte offsets. */
  public static final int CODE_UNIT_SIZE = 2;

  private final List<Instruction> instructions;

  InstructionStream(List<Instruction> instructions) {
    this.instructions = new ArrayList<>(instructions);
    assert positionsAreConsistent();
  }

  /**
   * Decodes a packed instruction stream.
   *
   * @throws MalformedCodeException if the encoding is truncated or contains an unknown opcode
   */
  public static InstructionStream decode(byte[] packed) {
    if (packed.length % CODE_UNIT_SIZE != 0) {
      throw new MalformedCodeException(
          packed.length / CODE_UNIT_SIZE, "Truncated code unit (%s bytes)", packed.length);
    }
    List<Instruction> result = new ArrayList<>(packed.length / CODE_UNIT_SIZE);
    for (int i = 0; i < packed.length; i += CODE_UNIT_SIZE) {
      int position = i / CODE_UNIT_SIZE;
      Opcode opcode = Opcode.fromCode(packed[i] & 0xff, position);
      result.add(new Instruction(opcode, packed[i + 1] & 0xff, position));
    }
    return new InstructionStream(result);
  }

  /** Returns the packed encoding of this stream. */
  public byte[] encode() {
    byte[] result = new byte[instructions.size() * CODE_UNIT_SIZE];
    for (Instruction inst : instructions) {
      result[inst.position() * CODE_UNIT_SIZE] = (byte) inst.opcode().code;
      result[inst.position() * CODE_UNIT_SIZE + 1] = (byte) inst.operand();
    }
    return result;
  }

  /** Returns the number of instructions (code units) in this stream. */
  public int size() {
    return instructions.size();
  }

  public Instruction get(int position) {
    return instructions.get(position);
  }

  /** Returns an unmodifiable view of the instructions in this stream. */
  public List<Instruction> instructions() {
    return Collections.unmodifiableList(instructions);
  }

  /** Returns an independent copy of this stream. */
  public InstructionStream copy() {
    return new InstructionStream(instructions);
  }

  /**
   * Replaces the contents of this stream with the given instructions, whose positions must match
   * their indices.
   */
  public void replaceAll(List<Instruction> newInstructions) {
    instructions.clear();
    instructions.addAll(newInstructions);
    Preconditions.checkArgument(positionsAreConsistent());
  }

  /** Replaces the instruction at {@code position}. */
  public void set(int position, Opcode opcode, int operand) {
    instructions.set(position, instructions.get(position).replace(opcode, operand));
  }

  /**
   * Inserts the given opcode/operand pairs at the start of the stream, renumbering all existing
   * instructions. Jump operands are not adjusted.
   */
  public void prepend(List<Instruction> prelude) {
    List<Instruction> result = new ArrayList<>(prelude.size() + instructions.size());
    for (Instruction inst : prelude) {
      result.add(inst.moveTo(result.size()));
    }
    for (Instruction inst : instructions) {
      result.add(inst.moveTo(result.size()));
    }
    replaceAll(result);
  }

  /** Returns the number of {@link Opcode#EXTENDED_ARG} units just before {@code position}. */
  public int prefixCount(int position) {
    int count = 0;
    while (position - count > 0 && get(position - count - 1).opcode() == Opcode.EXTENDED_ARG) {
      count++;
    }
    return count;
  }

  /** Returns the operand of the instruction at {@code position}, including any prefixes. */
  public int fullOperand(int position) {
    int prefixes = prefixCount(position);
    int result = 0;
    for (int p = position - prefixes; p <= position; p++) {
      result = (result << 8) | get(p).operand();
    }
    return result;
  }

  /**
   * Changes the full operand of the instruction at {@code position}, rewriting its prefixes as
   * well. Returns false (and changes nothing) if the new value needs more prefixes than the
   * instruction already has.
   */
  @CanIgnoreReturnValue
  public boolean setOperand(int position, int value) {
    Preconditions.checkArgument(value >= 0);
    int prefixes = prefixCount(position);
    // Java shifts are mod 32, so a value with 4 or more bytes always fits.
    if (prefixes < 3 && (value >>> (8 * (prefixes + 1))) != 0) {
      return false;
    }
    for (int p = position; p >= position - prefixes; p--) {
      Instruction inst = get(p);
      instructions.set(p, inst.replace(inst.opcode(), value & 0xff));
      value >>>= 8;
    }
    return true;
  }

  /**
   * Returns the position that the jump or branch at {@code position} transfers control to. The
   * result is not checked against the bounds of the stream.
   *
   * @throws MalformedCodeException if the operand is not a whole number of code units
   */
  public int jumpTarget(int position) {
    Instruction inst = get(position);
    Preconditions.checkArgument(inst.opcode().hasTarget(), "Not a jump: %s", inst);
    int offset = fullOperand(position);
    if (offset % CODE_UNIT_SIZE != 0) {
      throw new MalformedCodeException(position, "Misaligned jump operand %s", offset);
    }
    int units = offset / CODE_UNIT_SIZE;
    return (inst.opcode().target == Opcode.Target.RELATIVE) ? position + 1 + units : units;
  }

  private boolean positionsAreConsistent() {
    for (int i = 0; i < instructions.size(); i++) {
      if (instructions.get(i).position() != i) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Instruction inst : instructions) {
      sb.append(inst.position()).append(": ").append(inst).append('\n');
    }
    return sb.toString();
  }
}
