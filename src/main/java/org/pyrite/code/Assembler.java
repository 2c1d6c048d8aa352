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

import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToIntFunction;
import org.jspecify.annotations.Nullable;

/**
 * Builds a {@link CodeUnit} one instruction at a time, resolving symbolic jump targets and adding
 * {@link Opcode#EXTENDED_ARG} prefixes to operands that don't fit in a byte.
 *
 * <p>{@link #parse} accepts the same instructions in a line-oriented text form:
 *
 * <pre>
 * .name f
 * .args cond
 *     LOAD_FAST cond
 *     POP_JUMP_IF_FALSE done
 *     LOAD_CONST 3
 *     STORE_FAST x
 * done:
 *     LOAD_FAST x
 *     RETURN_VALUE
 * </pre>
 *
 * Local-slot operands are variable names (new names become locals), {@code LOAD_CONST} takes a
 * literal ({@code None}, {@code True}, {@code False}, an int, a float, or a quoted string), the
 * name-table opcodes take a name, jumps take a label, and all other operands are integers.
 * Directives ({@code .args}, {@code .kwonly}, {@code .varargs}, {@code .varkw}, {@code .locals},
 * {@code .cells}, {@code .frees}, {@code .names}) must precede the instructions; {@code #} starts
 * a comment.
 */
public final class Assembler {

  /** A jump target. */
  public static final class Label {
    final String name;

    /** The index of the item this label precedes, or -1 if not yet bound. */
    int item = -1;

    Label(String name) {
      this.name = name;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** An instruction whose operand may not be known until the CodeInfo and labels are final. */
  private record Item(
      Opcode opcode, @Nullable ToIntFunction<CodeInfo> operand, @Nullable Label target) {}

  private static final Splitter WORDS = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

  private final CodeInfo.Builder info;
  private final List<Item> items = new ArrayList<>();
  private final Map<String, Label> labels = new HashMap<>();

  public Assembler(CodeInfo.Builder info) {
    this.info = info;
  }

  /** Returns the builder for this unit's metadata. */
  public CodeInfo.Builder info() {
    return info;
  }

  /** Returns the label with the given name, creating it if necessary. */
  public Label label(String name) {
    return labels.computeIfAbsent(name, Label::new);
  }

  /** Binds {@code label} to the position of the next instruction. */
  @CanIgnoreReturnValue
  public Assembler bind(Label label) {
    Preconditions.checkState(label.item < 0, "Label %s bound twice", label);
    label.item = items.size();
    return this;
  }

  @CanIgnoreReturnValue
  public Assembler emit(Opcode opcode) {
    return emit(opcode, 0);
  }

  @CanIgnoreReturnValue
  public Assembler emit(Opcode opcode, int operand) {
    Preconditions.checkArgument(!opcode.hasTarget(), "Use jump() for %s", opcode);
    Preconditions.checkArgument(operand >= 0);
    items.add(new Item(opcode, unused -> operand, null));
    return this;
  }

  /** Emits an instruction that addresses the local slot of {@code local}. */
  @CanIgnoreReturnValue
  public Assembler emitLocal(Opcode opcode, String local) {
    Preconditions.checkArgument(opcode.accessesLocal(), "%s does not access a local", opcode);
    int slot = info.local(local);
    items.add(new Item(opcode, ci -> opcode.isReversed() ? ci.reverseIndex(slot) : slot, null));
    return this;
  }

  /** Emits an instruction whose operand is an index into the name table. */
  @CanIgnoreReturnValue
  public Assembler emitName(Opcode opcode, String name) {
    return emit(opcode, info.name(name));
  }

  /** Emits a {@code LOAD_CONST} of the given value. */
  @CanIgnoreReturnValue
  public Assembler emitConst(Object value) {
    return emit(Opcode.LOAD_CONST, info.constant(Constants.of(value)));
  }

  /** Emits a jump or branch to {@code target}. */
  @CanIgnoreReturnValue
  public Assembler jump(Opcode opcode, Label target) {
    Preconditions.checkArgument(opcode.hasTarget(), "%s is not a jump", opcode);
    items.add(new Item(opcode, null, target));
    return this;
  }

  /**
   * Returns the assembled code unit.
   *
   * @throws IllegalStateException if a label is used but never bound, or a relative jump is
   *     backwards
   */
  public CodeUnit build() {
    CodeInfo codeInfo = info.build();
    int[] operands = new int[items.size()];
    for (int i = 0; i < items.size(); i++) {
      Item item = items.get(i);
      if (item.target == null) {
        operands[i] = item.operand.applyAsInt(codeInfo);
      } else {
        Preconditions.checkState(item.target.item >= 0, "Label %s is not bound", item.target);
      }
    }
    // Adding a prefix moves everything after it, which may make a jump operand wider, so repeat
    // until no more prefixes are needed.
    int[] prefixes = new int[items.size()];
    int[] starts = new int[items.size() + 1];
    boolean changed;
    do {
      changed = false;
      for (int i = 0; i < items.size(); i++) {
        starts[i + 1] = starts[i] + prefixes[i] + 1;
      }
      for (int i = 0; i < items.size(); i++) {
        Item item = items.get(i);
        if (item.target != null) {
          operands[i] = jumpOperand(item, starts[i + 1], starts[item.target.item]);
        }
        int needed = prefixesNeeded(operands[i]);
        if (needed > prefixes[i]) {
          prefixes[i] = needed;
          changed = true;
        }
      }
    } while (changed);
    List<Instruction> result = new ArrayList<>(starts[items.size()]);
    for (int i = 0; i < items.size(); i++) {
      for (int shift = 8 * prefixes[i]; shift > 0; shift -= 8) {
        result.add(
            new Instruction(Opcode.EXTENDED_ARG, (operands[i] >>> shift) & 0xff, result.size()));
      }
      result.add(new Instruction(items.get(i).opcode, operands[i] & 0xff, result.size()));
    }
    return new CodeUnit(codeInfo, new InstructionStream(result));
  }

  private static int jumpOperand(Item item, int next, int target) {
    if (item.opcode.target == Opcode.Target.ABSOLUTE) {
      return target * InstructionStream.CODE_UNIT_SIZE;
    }
    Preconditions.checkState(
        target >= next, "Relative jump %s to %s must be forward", item.opcode, item.target);
    return (target - next) * InstructionStream.CODE_UNIT_SIZE;
  }

  private static int prefixesNeeded(int operand) {
    int result = 0;
    while ((operand >>>= 8) != 0) {
      result++;
    }
    return result;
  }

  /**
   * Assembles the text form described in the class comment.
   *
   * @throws IllegalArgumentException if the text cannot be parsed
   */
  public static CodeUnit parse(String text) {
    CodeInfo.Builder info = null;
    String name = "<module>";
    Assembler asm = null;
    int lineNum = 0;
    for (String line : Splitter.on('\n').split(text)) {
      lineNum++;
      int comment = line.indexOf('#');
      if (comment >= 0 && !insideQuotes(line, comment)) {
        line = line.substring(0, comment);
      }
      List<String> words = WORDS.splitToList(line);
      if (words.isEmpty()) {
        continue;
      }
      String first = words.get(0);
      try {
        if (first.equals(".name")) {
          Preconditions.checkArgument(info == null, ".name must come first");
          name = words.get(1);
        } else if (first.startsWith(".")) {
          Preconditions.checkArgument(asm == null, "Directives must precede instructions");
          if (info == null) {
            info = CodeInfo.builder(name);
          }
          directive(info, first, words.subList(1, words.size()));
        } else {
          if (asm == null) {
            asm = new Assembler(info != null ? info : CodeInfo.builder(name));
          }
          if (first.endsWith(":") && words.size() == 1) {
            asm.bind(asm.label(first.substring(0, first.length() - 1)));
          } else {
            asm.instruction(first, line.trim().substring(first.length()).trim());
          }
        }
      } catch (RuntimeException e) {
        throw new IllegalArgumentException(
            String.format("Line %s: %s (%s)", lineNum, e.getMessage(), line.trim()), e);
      }
    }
    Preconditions.checkArgument(asm != null, "No instructions");
    return asm.build();
  }

  private static boolean insideQuotes(String line, int index) {
    int quotes = 0;
    for (int i = 0; i < index; i++) {
      if (line.charAt(i) == '\'' || line.charAt(i) == '"') {
        quotes++;
      }
    }
    return quotes % 2 != 0;
  }

  private static void directive(CodeInfo.Builder info, String directive, List<String> args) {
    String[] argArray = args.toArray(new String[0]);
    switch (directive) {
      case ".args" -> info.args(argArray);
      case ".kwonly" -> info.kwOnlyArgs(argArray);
      case ".varargs" -> info.varArgs(args.get(0));
      case ".varkw" -> info.varKeywords(args.get(0));
      case ".locals" -> args.forEach(info::local);
      case ".cells" -> info.cellvars(argArray);
      case ".frees" -> info.freevars(argArray);
      case ".names" -> args.forEach(info::name);
      default -> throw new IllegalArgumentException("Unknown directive " + directive);
    }
  }

  private void instruction(String mnemonic, String operand) {
    Opcode opcode = Opcode.valueOf(Ascii.toUpperCase(mnemonic));
    if (opcode.hasTarget()) {
      jump(opcode, label(operand));
    } else if (opcode.accessesLocal()) {
      emitLocal(opcode, operand);
    } else if (opcode == Opcode.LOAD_CONST) {
      emitConst(parseLiteral(operand));
    } else if (usesName(opcode)) {
      emitName(opcode, operand);
    } else {
      emit(opcode, operand.isEmpty() ? 0 : Integer.parseInt(operand));
    }
  }

  private static boolean usesName(Opcode opcode) {
    return switch (opcode) {
      case LOAD_NAME, STORE_NAME, LOAD_GLOBAL, LOAD_ATTR, LOAD_METHOD -> true;
      default -> false;
    };
  }

  /** Parses a literal constant: None, True, False, an int, a float, or a quoted string. */
  static Object parseLiteral(String literal) {
    switch (literal) {
      case "None":
        return Constants.NONE;
      case "True":
        return true;
      case "False":
        return false;
      case "()":
        return ImmutableList.of();
      default:
        break;
    }
    char first = literal.isEmpty() ? ' ' : literal.charAt(0);
    if (first == '\'' || first == '"') {
      Preconditions.checkArgument(
          literal.length() >= 2 && literal.charAt(literal.length() - 1) == first,
          "Unterminated string");
      return unescape(literal.substring(1, literal.length() - 1));
    } else if (literal.contains(".") || literal.contains("e") || literal.contains("inf")) {
      return Double.parseDouble(literal.replace("inf", "Infinity"));
    }
    return new BigInteger(literal);
  }

  private static String unescape(String s) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c != '\\' || i + 1 == s.length()) {
        sb.append(c);
        continue;
      }
      char next = s.charAt(++i);
      switch (next) {
        case 'n' -> sb.append('\n');
        case 't' -> sb.append('\t');
        case 'r' -> sb.append('\r');
        case 'u' -> {
          sb.append((char) Integer.parseInt(s.substring(i + 1, i + 5), 16));
          i += 4;
        }
        default -> sb.append(next);
      }
    }
    return sb.toString();
  }
}
