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

package org.pyrite.compiler;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertSame;

import java.util.List;
import org.junit.After;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.pyrite.code.Assembler;
import org.pyrite.code.CodeUnit;

@RunWith(JUnit4.class)
public class CompilerTest {

  private static final String[] OPTIONS = {
    "foldConstants", "rewritePrintf", "eliminateDeadStores", "checkDefiniteAssignment", "buildSsa"
  };

  @After
  public void clearProperties() {
    for (String option : OPTIONS) {
      System.clearProperty(Options.PROPERTY_PREFIX + option);
    }
  }

  private static final String DEAD_STORE =
      """
      .args a
          LOAD_FAST a
          STORE_FAST unused
          LOAD_CONST 2
          STORE_FAST a
          LOAD_FAST a
          STORE_FAST y
          LOAD_FAST y
          RETURN_VALUE
      """;

  /** Assembles {@code text}, runs the code passes on it, and returns the disassembled result. */
  private static String optimizeCode(String text, Options options) {
    CodeUnit unit = Assembler.parse(text);
    boolean changed = Compiler.optimizeCode(unit, options);
    String result = unit.toString();
    assertThat(changed).isEqualTo(!result.equals(Assembler.parse(text).toString()));
    return result;
  }

  @Test
  public void allCodePasses() {
    assertThat(optimizeCode(DEAD_STORE, Options.defaults()))
        .isEqualTo(
            """
            LOAD_FAST_REVERSE_UNCHECKED a
            POP_TOP
            LOAD_CONST 2
            STORE_FAST_REVERSE a
            LOAD_FAST_REVERSE_UNCHECKED a
            STORE_FAST_REVERSE y
            LOAD_FAST_REVERSE_UNCHECKED y
            RETURN_VALUE
            """);
  }

  @Test
  public void selectedCodePasses() {
    assertThat(optimizeCode(DEAD_STORE, Options.builder().eliminateDeadStores(false).build()))
        .isEqualTo(
            """
            LOAD_FAST_REVERSE_UNCHECKED a
            STORE_FAST_REVERSE unused
            LOAD_CONST 2
            STORE_FAST_REVERSE a
            LOAD_FAST_REVERSE_UNCHECKED a
            STORE_FAST_REVERSE y
            LOAD_FAST_REVERSE_UNCHECKED y
            RETURN_VALUE
            """);
    assertThat(optimizeCode(DEAD_STORE, Options.builder().checkDefiniteAssignment(false).build()))
        .isEqualTo(
            """
            LOAD_FAST a
            POP_TOP
            LOAD_CONST 2
            STORE_FAST a
            LOAD_FAST a
            STORE_FAST y
            LOAD_FAST y
            RETURN_VALUE
            """);
    Options none =
        Options.builder().eliminateDeadStores(false).checkDefiniteAssignment(false).build();
    assertThat(optimizeCode(DEAD_STORE, none)).isEqualTo(Assembler.parse(DEAD_STORE).toString());
  }

  @Test
  public void ssaOfOptimizedCode() {
    CodeUnit unit =
        Assembler.parse(
            """
            .args cond
                LOAD_FAST cond
                POP_JUMP_IF_FALSE else
                LOAD_CONST 1
                STORE_FAST x
                JUMP_FORWARD done
            else:
                LOAD_CONST 2
                STORE_FAST x
            done:
                LOAD_FAST x
                RETURN_VALUE
            """);
    String before = Compiler.buildSsa(unit, Options.defaults()).toString();
    assertThat(Compiler.optimizeCode(unit, Options.defaults())).isTrue();
    assertThat(unit.toString()).contains("LOAD_FAST_REVERSE_UNCHECKED x");
    // Renumbering slots doesn't change the SSA form.
    assertThat(Compiler.buildSsa(unit, Options.defaults()).toString()).isEqualTo(before);
    assertThat(before)
        .isEqualTo(
            """
            bb0:
              v0 = LoadArg<0; cond>
              v1 = Branch<bb1>

            bb1:
              v2 = POP_JUMP_IF_FALSE<bb2, bb3> v0

            bb2:
              v3 = LOAD_CONST<0>
              v4 = JUMP_FORWARD<bb4>

            bb3:
              v5 = LOAD_CONST<1>
              v6 = Branch<bb4>

            bb4:
              v7 = Phi v3 v5
              v8 = RETURN_VALUE v7

            """);
    assertThat(Compiler.buildSsa(unit, Options.builder().buildSsa(false).build())).isNull();
  }

  @Test
  public void optimizeExpr() {
    Expr expr =
        new Expr.BinOp(
            new Expr.Constant("%s=%d"),
            Operator.MOD,
            new Expr.Tuple(
                List.of(
                    new Expr.Name("k"),
                    new Expr.BinOp(new Expr.Constant(6), Operator.MULT, new Expr.Constant(7)))));
    assertThat(Compiler.optimize(expr, Options.defaults()).toString())
        .isEqualTo("f'{k!s}={''._mod_convert_number_int(42)}'");
    Options none = Options.builder().foldConstants(false).rewritePrintf(false).build();
    assertSame(expr, Compiler.optimize(expr, none));
  }

  @Test
  public void options() {
    Options defaults = Options.defaults();
    assertThat(defaults.toString())
        .isEqualTo(
            "Options(foldConstants=true, rewritePrintf=true, eliminateDeadStores=true,"
                + " checkDefiniteAssignment=true, buildSsa=true)");
    Options options = defaults.toBuilder().rewritePrintf(false).buildSsa(false).build();
    assertThat(options.foldConstants).isTrue();
    assertThat(options.rewritePrintf).isFalse();
    assertThat(options.buildSsa).isFalse();
    assertThat(options.toBuilder().build().toString()).isEqualTo(options.toString());
  }

  @Test
  public void optionsFromSystemProperties() {
    assertThat(Options.fromSystemProperties().toString()).isEqualTo(Options.defaults().toString());
    System.setProperty("pyrite.eliminateDeadStores", "false");
    System.setProperty("pyrite.foldConstants", "no");
    Options options = Options.fromSystemProperties();
    assertThat(options.eliminateDeadStores).isFalse();
    // Anything but "true" (ignoring case) is false.
    assertThat(options.foldConstants).isFalse();
    assertThat(options.rewritePrintf).isTrue();
    assertThat(options.checkDefiniteAssignment).isTrue();
    assertThat(options.buildSsa).isTrue();
  }
}
