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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;

/**
 * The metadata that accompanies the instructions of a code unit: its local variable names, how
 * many of them are arguments, and the constant and name pools that operands index into.
 *
 * <p>Local slots are numbered in the order {@link #varnames}, {@link #cellvars}, {@link
 * #freevars}; the first {@link #totalArgs} varnames are the arguments.
 */
public final class CodeInfo {
  /** Flag bit: the code unit takes a variadic positional argument. */
  public static final int CO_VARARGS = 0x04;

  /** Flag bit: the code unit takes a variadic keyword argument. */
  public static final int CO_VARKEYWORDS = 0x08;

  /** The name of the reflective builtin that reads all local bindings. */
  public static final String LOCALS = "locals";

  public final String name;
  public final int argCount;
  public final int kwOnlyArgCount;
  public final int flags;
  public final ImmutableList<String> varnames;
  public final ImmutableList<String> cellvars;
  public final ImmutableList<String> freevars;

  /** Global, attribute and method names. */
  public final ImmutableList<String> names;

  /** Constant values; see {@link Constants} for the representation. */
  public final ImmutableList<Object> consts;

  private CodeInfo(Builder builder) {
    this.name = builder.name;
    this.argCount = builder.argCount;
    this.kwOnlyArgCount = builder.kwOnlyArgCount;
    this.flags = builder.flags;
    this.varnames = ImmutableList.copyOf(builder.varnames);
    this.cellvars = ImmutableList.copyOf(builder.cellvars);
    this.freevars = ImmutableList.copyOf(builder.freevars);
    this.names = ImmutableList.copyOf(builder.names);
    this.consts = ImmutableList.copyOf(builder.consts);
    Preconditions.checkArgument(
        totalArgs() <= varnames.size(), "%s arguments but only %s varnames", totalArgs(), varnames);
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  /**
   * Returns the number of argument slots: positional and keyword-only arguments plus one for each
   * of the variadic positional and keyword arguments, if present.
   */
  public int totalArgs() {
    return argCount
        + kwOnlyArgCount
        + ((flags & CO_VARARGS) != 0 ? 1 : 0)
        + ((flags & CO_VARKEYWORDS) != 0 ? 1 : 0);
  }

  /** Returns the number of local slots addressable by the {@code *_FAST} opcodes. */
  public int numFastLocals() {
    return varnames.size();
  }

  /** Returns the size of the frame's locals area, including cell and free variables. */
  public int totalLocals() {
    return varnames.size() + cellvars.size() + freevars.size();
  }

  /** Returns the operand used by the {@code *_REVERSE} opcodes to address {@code slot}. */
  public int reverseIndex(int slot) {
    return totalLocals() - slot - 1;
  }

  /** Returns the slot corresponding to an operand of a {@code *_REVERSE} opcode. */
  public int slotForReverseIndex(int reverseIndex) {
    return totalLocals() - reverseIndex - 1;
  }

  /**
   * Returns the local slot accessed by the local-access instruction at {@code position}, undoing
   * reversed numbering.
   */
  public int slotOf(InstructionStream code, int position) {
    Opcode opcode = code.get(position).opcode();
    Preconditions.checkArgument(opcode.accessesLocal(), "Not a local access: %s", opcode);
    int operand = code.fullOperand(position);
    return opcode.isReversed() ? slotForReverseIndex(operand) : operand;
  }

  /** Returns the name of local slot {@code slot}. */
  public String slotName(int slot) {
    if (slot < varnames.size()) {
      return varnames.get(slot);
    }
    slot -= varnames.size();
    return (slot < cellvars.size()) ? cellvars.get(slot) : freevars.get(slot - cellvars.size());
  }

  /**
   * True if this code unit may call {@code locals()}; local-slot rewrites would change what that
   * call observes.
   */
  public boolean mayUseLocals() {
    return varnames.contains(LOCALS) || names.contains(LOCALS);
  }

  @Override
  public String toString() {
    return name;
  }

  /** Accumulates the fields of a CodeInfo. */
  public static final class Builder {
    private final String name;
    private int argCount;
    private int kwOnlyArgCount;
    private int flags;
    private final List<String> varnames = new ArrayList<>();
    private final List<String> cellvars = new ArrayList<>();
    private final List<String> freevars = new ArrayList<>();
    private final List<String> names = new ArrayList<>();
    private final List<Object> consts = new ArrayList<>();

    private Builder(String name) {
      this.name = name;
    }

    /**
     * Adds positional arguments. All arguments must be added (in the order positional,
     * keyword-only, variadic positional, variadic keyword) before other locals.
     */
    @CanIgnoreReturnValue
    public Builder args(String... args) {
      checkNoPlainLocals();
      for (String arg : args) {
        varnames.add(arg);
        argCount++;
      }
      return this;
    }

    @CanIgnoreReturnValue
    public Builder kwOnlyArgs(String... args) {
      checkNoPlainLocals();
      for (String arg : args) {
        varnames.add(arg);
        kwOnlyArgCount++;
      }
      return this;
    }

    @CanIgnoreReturnValue
    public Builder varArgs(String arg) {
      checkNoPlainLocals();
      Preconditions.checkState((flags & (CO_VARARGS | CO_VARKEYWORDS)) == 0);
      varnames.add(arg);
      flags |= CO_VARARGS;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder varKeywords(String arg) {
      checkNoPlainLocals();
      Preconditions.checkState((flags & CO_VARKEYWORDS) == 0);
      varnames.add(arg);
      flags |= CO_VARKEYWORDS;
      return this;
    }

    private void checkNoPlainLocals() {
      int args =
          argCount
              + kwOnlyArgCount
              + ((flags & CO_VARARGS) != 0 ? 1 : 0)
              + ((flags & CO_VARKEYWORDS) != 0 ? 1 : 0);
      Preconditions.checkState(varnames.size() == args, "Arguments must precede other locals");
    }

    /** Adds a local variable (if not already present) and returns its slot. */
    @CanIgnoreReturnValue
    public int local(String local) {
      return indexOf(varnames, local);
    }

    @CanIgnoreReturnValue
    public Builder cellvars(String... cells) {
      cellvars.addAll(List.of(cells));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder freevars(String... frees) {
      freevars.addAll(List.of(frees));
      return this;
    }

    /** Adds a name (if not already present) and returns its index. */
    @CanIgnoreReturnValue
    public int name(String nameToAdd) {
      return indexOf(names, nameToAdd);
    }

    /** Adds a constant (if an equal one is not already present) and returns its index. */
    @CanIgnoreReturnValue
    public int constant(Object value) {
      Constants.checkValid(value);
      for (int i = 0; i < consts.size(); i++) {
        if (Constants.sameConstant(consts.get(i), value)) {
          return i;
        }
      }
      consts.add(value);
      return consts.size() - 1;
    }

    private static <T> int indexOf(List<T> list, T value) {
      int index = list.indexOf(value);
      if (index < 0) {
        list.add(value);
        index = list.size() - 1;
      }
      return index;
    }

    public CodeInfo build() {
      return new CodeInfo(this);
    }
  }
}
