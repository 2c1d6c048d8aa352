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

import org.jspecify.annotations.Nullable;

/** Renders an {@link InstructionStream} as text, resolving operands to the names they denote. */
public final class Disassembler {

  private Disassembler() {}

  /** Returns one line per instruction, e.g. {@code "LOAD_FAST x\nRETURN_VALUE\n"}. */
  public static String disassemble(CodeInfo info, InstructionStream code) {
    return disassemble(info, code, false);
  }

  /**
   * Returns one line per instruction; if {@code withPositions} is true, each line starts with the
   * instruction's byte offset.
   */
  public static String disassemble(CodeInfo info, InstructionStream code, boolean withPositions) {
    StringBuilder sb = new StringBuilder();
    for (Instruction inst : code.instructions()) {
      if (withPositions) {
        sb.append(String.format("%4d ", inst.position() * InstructionStream.CODE_UNIT_SIZE));
      }
      sb.append(inst.opcode());
      String operand = operand(info, code, inst);
      if (operand != null) {
        sb.append(' ').append(operand);
      }
      sb.append('\n');
    }
    return sb.toString();
  }

  private static @Nullable String operand(CodeInfo info, InstructionStream code, Instruction inst) {
    Opcode opcode = inst.opcode();
    if (!opcode.hasArg()) {
      return null;
    }
    int operand = code.fullOperand(inst.position());
    try {
      if (opcode.accessesLocal()) {
        return info.slotName(info.slotOf(code, inst.position()));
      } else if (opcode == Opcode.LOAD_CONST) {
        return Constants.repr(info.consts.get(operand));
      }
      return switch (opcode) {
        case LOAD_NAME, STORE_NAME, LOAD_GLOBAL, LOAD_ATTR, LOAD_METHOD -> info.names.get(operand);
        default -> String.valueOf(operand);
      };
    } catch (IndexOutOfBoundsException e) {
      return operand + " (invalid)";
    }
  }
}
