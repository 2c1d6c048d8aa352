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

/**
 * Assigns the ids of the values and blocks of one {@link SsaGraph}. Each graph has its own
 * Numbering, so independent builds produce identical output.
 */
final class Numbering {
  private int nextValue;
  private int nextBlock;

  int newValueId() {
    return nextValue++;
  }

  int newBlockId() {
    return nextBlock++;
  }

  /** Returns the number of values created so far. */
  int numValues() {
    return nextValue;
  }
}
