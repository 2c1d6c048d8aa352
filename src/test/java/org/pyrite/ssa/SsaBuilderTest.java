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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.pyrite.code.Assembler;
import org.pyrite.code.CodeUnit;
import org.pyrite.code.DefiniteAssignment;
import org.pyrite.code.MalformedCodeException;

@RunWith(JUnit4.class)
public class SsaBuilderTest {

  private static SsaGraph build(String text) {
    CodeUnit unit = Assembler.parse(text);
    return SsaBuilder.build(unit.info(), unit.code());
  }

  private static final String IF_ELSE =
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
      """;

  private static final String IF_ELSE_SSA =
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

      """;

  @Test
  public void diamond() {
    SsaGraph graph = build(IF_ELSE);
    assertThat(graph.toString()).isEqualTo(IF_ELSE_SSA);
    SsaBlock merge = graph.blockAt(7);
    assertThat(merge.predecessors())
        .containsExactly(graph.blockAt(2), graph.blockAt(5))
        .inOrder();
    SsaValue phi = merge.phis().get(0);
    assertThat(phi.isPhi()).isTrue();
    assertThat(phi.operands()).hasSize(merge.predecessors().size());
    assertThat(phi.operands().get(0).block).isSameInstanceAs(graph.blockAt(2));
    assertThat(merge.terminator().source.position()).isEqualTo(8);
  }

  @Test
  public void loop() {
    SsaGraph graph =
        build(
            """
            .args n
                LOAD_CONST 0
                STORE_FAST i
            loop:
                LOAD_FAST i
                LOAD_FAST n
                COMPARE_OP 0
                POP_JUMP_IF_FALSE done
                LOAD_FAST i
                LOAD_CONST 1
                BINARY_ADD
                STORE_FAST i
                JUMP_ABSOLUTE loop
            done:
                LOAD_FAST i
                RETURN_VALUE
            """);
    // n is not changed in the loop, so its phi refers to itself.
    assertThat(graph.toString())
        .isEqualTo(
            """
            bb0:
              v0 = LoadArg<0; n>
              v1 = Branch<bb1>

            bb1:
              v2 = LOAD_CONST<0>
              v3 = Branch<bb2>

            bb2:
              v4 = Phi v2 v9
              v5 = Phi v0 v5
              v6 = COMPARE_OP<0> v4 v5
              v7 = POP_JUMP_IF_FALSE<bb3, bb4> v6

            bb3:
              v8 = LOAD_CONST<1>
              v9 = BINARY_ADD v4 v8
              v10 = JUMP_ABSOLUTE<bb2>

            bb4:
              v11 = RETURN_VALUE v4

            """);
    assertThat(graph.numValues()).isEqualTo(12);
    assertThat(graph.blocks()).hasSize(5);
  }

  @Test
  public void readBeforeAssignment() {
    SsaGraph graph =
        build(
            """
            .args cond
                LOAD_FAST cond
                POP_JUMP_IF_FALSE done
                LOAD_CONST 1
                STORE_FAST x
            done:
                LOAD_FAST x
                RETURN_VALUE
            """);
    assertThat(graph.toString())
        .isEqualTo(
            """
            bb0:
              v0 = LoadArg<0; cond>
              v6 = Undefined<x>
              v1 = Branch<bb1>

            bb1:
              v2 = POP_JUMP_IF_FALSE<bb2, bb3> v0

            bb2:
              v3 = LOAD_CONST<0>
              v4 = Branch<bb3>

            bb3:
              v5 = Phi v6 v3
              v7 = RETURN_VALUE v5

            """);
  }

  @Test
  public void readAfterDelete() {
    SsaGraph graph =
        build(
            """
            .args a
                LOAD_FAST a
                STORE_FAST x
                DELETE_FAST x
                LOAD_FAST x
                RETURN_VALUE
            """);
    assertThat(graph.toString())
        .isEqualTo(
            """
            bb0:
              v0 = LoadArg<0; a>
              v2 = Undefined<x>
              v1 = Branch<bb1>

            bb1:
              v3 = RETURN_VALUE v2

            """);
  }

  @Test
  public void stackEntriesCrossBlocks() {
    // a if cond else b
    SsaGraph graph =
        build(
            """
            .args cond a b
                LOAD_FAST cond
                POP_JUMP_IF_FALSE else
                LOAD_FAST a
                JUMP_FORWARD done
            else:
                LOAD_FAST b
            done:
                RETURN_VALUE
            """);
    assertThat(graph.toString())
        .isEqualTo(
            """
            bb0:
              v0 = LoadArg<0; cond>
              v1 = LoadArg<1; a>
              v2 = LoadArg<2; b>
              v3 = Branch<bb1>

            bb1:
              v4 = POP_JUMP_IF_FALSE<bb2, bb3> v0

            bb2:
              v5 = JUMP_FORWARD<bb4>

            bb3:
              v6 = Branch<bb4>

            bb4:
              v7 = Phi v1 v2
              v8 = RETURN_VALUE v7

            """);
  }

  @Test
  public void forLoop() {
    SsaGraph graph =
        build(
            """
            .args seq
                LOAD_FAST seq
                GET_ITER
            loop:
                FOR_ITER done
                STORE_FAST x
                JUMP_ABSOLUTE loop
            done:
                LOAD_CONST None
                RETURN_VALUE
            """);
    // The iterator stays on the stack around the loop.
    assertThat(graph.toString())
        .isEqualTo(
            """
            bb0:
              v0 = LoadArg<0; seq>
              v1 = Branch<bb1>

            bb1:
              v2 = GET_ITER v0
              v3 = Branch<bb2>

            bb2:
              v4 = Phi v2 v4
              v5 = FOR_ITER<bb3, bb4> v4

            bb3:
              v6 = JUMP_ABSOLUTE<bb2>

            bb4:
              v7 = LOAD_CONST<0>
              v8 = RETURN_VALUE v7

            """);
    assertThat(graph.blockAt(2).predecessors())
        .containsExactly(graph.blockAt(0), graph.blockAt(3))
        .inOrder();
  }

  @Test
  public void methodCall() {
    SsaGraph graph =
        build(
            """
            .args obj
                LOAD_FAST obj
                LOAD_METHOD append
                LOAD_CONST 1
                CALL_METHOD 1
                RETURN_VALUE
            """);
    assertThat(graph.blockAt(0).values().stream().map(SsaValue::definition).toList())
        .containsExactly(
            "v2 = LOAD_METHOD<0> v0",
            "v3 = LOAD_CONST<0>",
            "v4 = CALL_METHOD<1> v2 v0 v3",
            "v5 = RETURN_VALUE v4")
        .inOrder();
  }

  @Test
  public void numberingIsPerGraph() {
    assertThat(build(IF_ELSE).toString()).isEqualTo(IF_ELSE_SSA);
    assertThat(build(IF_ELSE).toString()).isEqualTo(IF_ELSE_SSA);
  }

  @Test
  public void renumberedSlotsGiveTheSameGraph() {
    CodeUnit unit = Assembler.parse(IF_ELSE);
    assertThat(DefiniteAssignment.optimize(unit.info(), unit.code())).isTrue();
    assertThat(unit.toString()).contains("LOAD_FAST_REVERSE_UNCHECKED x");
    assertThat(SsaBuilder.build(unit.info(), unit.code()).toString()).isEqualTo(IF_ELSE_SSA);
  }

  @Test
  public void inconsistentStackDepth() {
    MalformedCodeException e =
        assertThrows(
            MalformedCodeException.class,
            () ->
                build(
                    """
                    .args cond
                        LOAD_FAST cond
                        POP_JUMP_IF_FALSE done
                        LOAD_CONST 1
                    done:
                        RETURN_VALUE
                    """));
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("Inconsistent stack depth (1 from b1, 0 before) (at 3)");
  }

  @Test
  public void stackUnderflow() {
    assertThrows(MalformedCodeException.class, () -> build("POP_TOP\nRETURN_VALUE\n"));
  }

  @Test
  public void exceptionRegionsAreRejected() {
    MalformedCodeException e =
        assertThrows(
            MalformedCodeException.class,
            () ->
                build(
                    """
                        SETUP_FINALLY handler
                        POP_BLOCK
                        LOAD_CONST None
                        RETURN_VALUE
                    handler:
                        POP_TOP
                        LOAD_CONST None
                        RETURN_VALUE
                    """));
    assertThat(e).hasMessageThat().contains("SETUP_FINALLY");
  }

  @Test
  public void unreachableBackEdgeIsNotAPredecessor() {
    SsaGraph graph =
        build(
            """
            .args seq
                LOAD_FAST seq
                GET_ITER
            loop:
                FOR_ITER done
                STORE_FAST x
                LOAD_FAST x
                RETURN_VALUE
                JUMP_ABSOLUTE loop
            done:
                LOAD_CONST None
                RETURN_VALUE
            """);
    assertThat(graph.toString())
        .isEqualTo(
            """
            bb0:
              v0 = LoadArg<0; seq>
              v1 = Branch<bb1>

            bb1:
              v2 = GET_ITER v0
              v3 = Branch<bb2>

            bb2:
              v4 = FOR_ITER<bb3, bb5> v2

            bb3:
              v5 = RETURN_VALUE v4

            bb4:
              v6 = JUMP_ABSOLUTE<bb2>

            bb5:
              v7 = LOAD_CONST<0>
              v8 = RETURN_VALUE v7

            """);
    assertThat(graph.blockAt(2).predecessors()).containsExactly(graph.blockAt(0));
  }

  @Test
  public void unreachableReadIsUndefined() {
    SsaGraph graph =
        build(
            """
            .args a
                LOAD_FAST a
                RETURN_VALUE
                LOAD_FAST a
                RETURN_VALUE
            """);
    assertThat(graph.toString())
        .isEqualTo(
            """
            bb0:
              v0 = LoadArg<0; a>
              v3 = Undefined<a>
              v1 = Branch<bb1>

            bb1:
              v2 = RETURN_VALUE v0

            bb2:
              v4 = RETURN_VALUE v3

            """);
    assertThat(graph.blockAt(2).predecessors()).isEmpty();
  }
}
