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

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class StoreEliminationTest {

  @Test
  public void unreadStoresArePopped() {
    CodeUnit unit =
        Assembler.parse(
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
            """);
    assertThat(StoreElimination.run(unit.info(), unit.code())).isEqualTo(1);
    assertThat(unit.toString())
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
  }

  @Test
  public void deletedSlotsAreKept() {
    CodeUnit unit =
        Assembler.parse(
            """
                LOAD_CONST 1
                STORE_FAST x
                DELETE_FAST x
                LOAD_CONST 2
                STORE_FAST a
                LOAD_CONST None
                RETURN_VALUE
            """);
    assertThat(StoreElimination.run(unit.info(), unit.code())).isEqualTo(1);
    assertThat(unit.toString())
        .isEqualTo(
            """
            LOAD_CONST 1
            STORE_FAST x
            DELETE_FAST x
            LOAD_CONST 2
            POP_TOP
            LOAD_CONST None
            RETURN_VALUE
            """);
  }

  @Test
  public void mayUseLocals() {
    CodeUnit unit =
        Assembler.parse(
            """
            .names locals
                LOAD_CONST 1
                STORE_FAST x
                LOAD_CONST None
                RETURN_VALUE
            """);
    byte[] before = unit.code().encode();
    assertThat(StoreElimination.run(unit.info(), unit.code())).isEqualTo(0);
    assertThat(unit.code().encode()).isEqualTo(before);
  }

  @Test
  public void runsBeforeDefiniteAssignment() {
    CodeUnit unit =
        Assembler.parse(
            """
            .args cond
                LOAD_FAST cond
                POP_JUMP_IF_FALSE done
                LOAD_CONST 3
                STORE_FAST x
            done:
                LOAD_CONST None
                RETURN_VALUE
            """);
    assertThat(StoreElimination.run(unit.info(), unit.code())).isEqualTo(1);
    assertThat(DefiniteAssignment.optimize(unit.info(), unit.code())).isTrue();
    assertThat(unit.toString())
        .isEqualTo(
            """
            LOAD_FAST_REVERSE_UNCHECKED cond
            POP_JUMP_IF_FALSE 8
            LOAD_CONST 3
            POP_TOP
            LOAD_CONST None
            RETURN_VALUE
            """);
  }
}
