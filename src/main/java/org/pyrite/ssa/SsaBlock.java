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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.pyrite.code.Block;

/**
 * A block of an {@link SsaGraph}: phis, then the values computed in order, then a terminator that
 * makes every transfer of control explicit.
 */
public final class SsaBlock {
  public final int id;

  /** The basic block this was built from, or null for the synthetic entry block. */
  public final @Nullable Block source;

  /** The synthetic entry block (if any) comes first, then the others in order of position. */
  private final List<SsaBlock> predecessors = new ArrayList<>();

  private final List<SsaValue> phis = new ArrayList<>();
  private final List<SsaValue> body = new ArrayList<>();
  private @Nullable SsaValue terminator;

  SsaBlock(int id, @Nullable Block source) {
    this.id = id;
    this.source = source;
  }

  void addPredecessor(SsaBlock pred) {
    predecessors.add(pred);
  }

  void addPhi(SsaValue phi) {
    phis.add(phi);
  }

  void add(SsaValue value) {
    body.add(value);
  }

  void terminate(SsaValue value) {
    Preconditions.checkState(terminator == null, "%s already terminated", this);
    terminator = value;
  }

  public List<SsaBlock> predecessors() {
    return Collections.unmodifiableList(predecessors);
  }

  public List<SsaValue> phis() {
    return Collections.unmodifiableList(phis);
  }

  /** Returns the values that are neither phis nor the terminator. */
  public List<SsaValue> body() {
    return Collections.unmodifiableList(body);
  }

  /** Returns the value that ends this block, or null if it has not been translated yet. */
  public @Nullable SsaValue terminator() {
    return terminator;
  }

  /** Returns all values of this block, in order. */
  public ImmutableList<SsaValue> values() {
    ImmutableList.Builder<SsaValue> builder = ImmutableList.builder();
    builder.addAll(phis).addAll(body);
    if (terminator != null) {
      builder.add(terminator);
    }
    return builder.build();
  }

  @Override
  public String toString() {
    return "bb" + id;
  }
}
