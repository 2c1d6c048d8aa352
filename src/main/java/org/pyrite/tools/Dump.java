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

package org.pyrite.tools;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.pyrite.code.Assembler;
import org.pyrite.code.CodeUnit;
import org.pyrite.code.Disassembler;
import org.pyrite.code.MalformedCodeException;
import org.pyrite.compiler.Compiler;
import org.pyrite.compiler.Options;
import org.pyrite.ssa.SsaGraph;

/**
 * A simple command-line tool that assembles a single code unit, optimizes it, and prints the
 * results.
 *
 * <p>The passes run are selected by {@code -Dpyrite.<option>=false} (see {@link
 * Options#fromSystemProperties}); {@code -Dpositions=true} prefixes each instruction with its byte
 * offset.
 */
public class Dump {
  private Dump() {}

  private static void checkUsage(boolean condition) {
    if (!condition) {
      System.err.println("Use: dump <fileName>");
      System.exit(1);
    }
  }

  public static void main(String[] args) throws IOException {
    boolean positions = Boolean.parseBoolean(System.getProperty("positions", "false"));
    checkUsage(args.length == 1);
    Options options = Options.fromSystemProperties();
    CodeUnit unit;
    try {
      unit = Assembler.parse(Files.readString(Path.of(args[0])));
    } catch (IllegalArgumentException e) {
      System.err.println(args[0] + ": " + e.getMessage());
      System.exit(1);
      return;
    }
    System.out.printf("/* %s\n", unit.info().name);
    System.out.print(Disassembler.disassemble(unit.info(), unit.code(), positions));
    boolean changed = Compiler.optimizeCode(unit, options);
    System.out.println("--- OPTIMIZED" + (changed ? "" : " (unchanged)"));
    if (changed) {
      System.out.print(Disassembler.disassemble(unit.info(), unit.code(), positions));
    }
    try {
      SsaGraph ssa = Compiler.buildSsa(unit, options);
      if (ssa != null) {
        System.out.println("--- SSA");
        System.out.print(ssa);
      }
    } catch (MalformedCodeException | IllegalArgumentException e) {
      System.out.println("--- SSA ERRORS\n  " + e.getMessage());
    }
    System.out.println("*/");
  }
}
