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

/**
 * The instruction set understood by the compiler core.
 *
 * <p>Numeric codes follow the conventional stack-machine layout: codes below {@link
 * #HAVE_ARGUMENT} ignore their operand byte. The local-slot variants that address slots from the
 * end of the frame ({@code *_REVERSE*}) are our own extensions and are numbered above the range
 * used by the code generator.
 */
public enum Opcode {
  POP_TOP(1, 1, 0),
  ROT_TWO(2, 2, 2),
  DUP_TOP(4, 1, 2),
  NOP(9, 0, 0),
  UNARY_POSITIVE(10, 1, 1),
  UNARY_NEGATIVE(11, 1, 1),
  UNARY_NOT(12, 1, 1),
  UNARY_INVERT(15, 1, 1),
  BINARY_POWER(19, 2, 1),
  BINARY_MULTIPLY(20, 2, 1),
  BINARY_MODULO(22, 2, 1),
  BINARY_ADD(23, 2, 1),
  BINARY_SUBTRACT(24, 2, 1),
  BINARY_SUBSCR(25, 2, 1),
  BINARY_FLOOR_DIVIDE(26, 2, 1),
  BINARY_TRUE_DIVIDE(27, 2, 1),
  GET_ITER(68, 1, 1),
  RETURN_VALUE(83, Kind.TERMINATOR, Target.NONE, 1, 0, 0),
  POP_BLOCK(87, 0, 0),
  END_FINALLY(88, 1, 0),
  POP_EXCEPT(89, 3, 0),
  STORE_NAME(90, 1, 0),
  /** Pushes the next item of the iterator on top of the stack, or pops it and jumps. */
  FOR_ITER(93, Kind.BRANCH, Target.RELATIVE, 1, 2, -2),
  LOAD_CONST(100, 0, 1),
  LOAD_NAME(101, 0, 1),
  BUILD_TUPLE(102, Opcode.VARIABLE, 1) {
    @Override
    public int pops(int operand) {
      return operand;
    }
  },
  BUILD_LIST(103, Opcode.VARIABLE, 1) {
    @Override
    public int pops(int operand) {
      return operand;
    }
  },
  LOAD_ATTR(106, 1, 1),
  COMPARE_OP(107, 2, 1),
  JUMP_FORWARD(110, Kind.JUMP, Target.RELATIVE, 0, 0, 0),
  /** Leaves the condition on the stack if the jump is taken, otherwise pops it. */
  JUMP_IF_FALSE_OR_POP(111, Kind.BRANCH, Target.ABSOLUTE, 1, 0, 1),
  JUMP_IF_TRUE_OR_POP(112, Kind.BRANCH, Target.ABSOLUTE, 1, 0, 1),
  JUMP_ABSOLUTE(113, Kind.JUMP, Target.ABSOLUTE, 0, 0, 0),
  POP_JUMP_IF_FALSE(114, Kind.BRANCH, Target.ABSOLUTE, 1, 0, 0),
  POP_JUMP_IF_TRUE(115, Kind.BRANCH, Target.ABSOLUTE, 1, 0, 0),
  LOAD_GLOBAL(116, 0, 1),
  /** The taken edge leads to the exception handler, entered with the exception state pushed. */
  SETUP_FINALLY(122, Kind.BRANCH, Target.RELATIVE, 0, 0, 6),
  LOAD_FAST(124, 0, 1),
  STORE_FAST(125, 1, 0),
  DELETE_FAST(126, 0, 0),
  RAISE_VARARGS(130, Kind.TERMINATOR, Target.NONE, Opcode.VARIABLE, 0, 0) {
    @Override
    public int pops(int operand) {
      return operand;
    }
  },
  CALL_FUNCTION(131, Opcode.VARIABLE, 1) {
    @Override
    public int pops(int operand) {
      return operand + 1;
    }
  },
  SETUP_WITH(143, Kind.BRANCH, Target.RELATIVE, 1, 2, 5),
  EXTENDED_ARG(144, 0, 0),
  FORMAT_VALUE(155, Opcode.VARIABLE, 1) {
    @Override
    public int pops(int operand) {
      // Bit 2 of the operand says that a format spec is on the stack above the value.
      return (operand & 0x04) != 0 ? 2 : 1;
    }
  },
  BUILD_STRING(157, Opcode.VARIABLE, 1) {
    @Override
    public int pops(int operand) {
      return operand;
    }
  },
  /** Pushes the method and the receiver, which are both consumed by {@link #CALL_METHOD}. */
  LOAD_METHOD(160, 1, 2),
  CALL_METHOD(161, Opcode.VARIABLE, 1) {
    @Override
    public int pops(int operand) {
      return operand + 2;
    }
  },
  /** Reads a slot that is known to be assigned; the operand counts back from the last slot. */
  LOAD_FAST_REVERSE_UNCHECKED(200, 0, 1),
  /** Stores to a slot; the operand counts back from the last slot. */
  STORE_FAST_REVERSE(201, 1, 0),
  /** Unbinds a slot without checking that it was bound; the operand counts back from the end. */
  DELETE_FAST_REVERSE_UNCHECKED(202, 0, 0);

  /** Opcodes with a code at least this large use their operand. */
  public static final int HAVE_ARGUMENT = 90;

  /** Marks a pop count that depends on the operand; such opcodes override {@link #pops}. */
  private static final int VARIABLE = -1;

  /** How an instruction with this opcode passes control to the following instructions. */
  public enum Kind {
    /** Always continues with the next instruction. */
    ORDINARY,
    /** Always continues at its target. */
    JUMP,
    /** Continues either with the next instruction or at its target. */
    BRANCH,
    /** Leaves the code unit; nothing follows. */
    TERMINATOR
  }

  /** How the operand of a jump or branch encodes its target. */
  public enum Target {
    NONE,
    /** A byte offset counted from the start of the following instruction. */
    RELATIVE,
    /** A byte offset from the start of the code unit. */
    ABSOLUTE
  }

  private static final Opcode[] BY_CODE = new Opcode[256];

  static {
    for (Opcode op : values()) {
      assert BY_CODE[op.code] == null;
      BY_CODE[op.code] = op;
    }
  }

  public final int code;
  public final Kind kind;
  public final Target target;
  private final int pops;
  private final int pushes;

  /** The change to the stack depth when a branch is taken, relative to falling through. */
  private final int takenAdjustment;

  Opcode(int code, int pops, int pushes) {
    this(code, Kind.ORDINARY, Target.NONE, pops, pushes, 0);
  }

  Opcode(int code, Kind kind, Target target, int pops, int pushes, int takenAdjustment) {
    this.code = code;
    this.kind = kind;
    this.target = target;
    this.pops = pops;
    this.pushes = pushes;
    this.takenAdjustment = takenAdjustment;
  }

  /**
   * Returns the Opcode with the given numeric code.
   *
   * @throws MalformedCodeException if there is no such opcode
   */
  public static Opcode fromCode(int code, int position) {
    Opcode result = (code >= 0 && code < BY_CODE.length) ? BY_CODE[code] : null;
    if (result == null) {
      throw new MalformedCodeException(position, "Unknown opcode %s", code);
    }
    return result;
  }

  /** True if instructions with this opcode use their operand. */
  public boolean hasArg() {
    return code >= HAVE_ARGUMENT;
  }

  /** True for jumps and branches, i.e. opcodes whose operand encodes a target. */
  public boolean hasTarget() {
    return target != Target.NONE;
  }

  /** True for the opcodes that push an exception handler; their target is the handler. */
  public boolean opensHandler() {
    return this == SETUP_FINALLY || this == SETUP_WITH;
  }

  /** True for the opcodes whose operand is a local slot. */
  public boolean accessesLocal() {
    return loadsLocal() || storesLocal() || deletesLocal();
  }

  public boolean loadsLocal() {
    return this == LOAD_FAST || this == LOAD_FAST_REVERSE_UNCHECKED;
  }

  public boolean storesLocal() {
    return this == STORE_FAST || this == STORE_FAST_REVERSE;
  }

  public boolean deletesLocal() {
    return this == DELETE_FAST || this == DELETE_FAST_REVERSE_UNCHECKED;
  }

  /** True for the local-slot opcodes whose operand counts back from the last slot. */
  public boolean isReversed() {
    return this == LOAD_FAST_REVERSE_UNCHECKED
        || this == STORE_FAST_REVERSE
        || this == DELETE_FAST_REVERSE_UNCHECKED;
  }

  /** Returns the number of values this opcode pops from the operand stack. */
  public int pops(int operand) {
    assert pops != VARIABLE;
    return pops;
  }

  /** Returns the number of values this opcode pushes when it falls through. */
  public int pushes(int operand) {
    return pushes;
  }

  /**
   * Returns the net change to the operand stack depth when an instruction with this opcode and
   * operand completes; {@code taken} selects the effect on the jump edge of a branch.
   */
  public int stackEffect(int operand, boolean taken) {
    int effect = pushes(operand) - pops(operand);
    return taken ? effect + takenAdjustment : effect;
  }
}
