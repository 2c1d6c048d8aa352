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

import com.google.errorprone.annotations.FormatMethod;

/**
 * Thrown when an instruction stream could not have been produced by a correct code generator: a
 * jump outside the stream, a block that falls off its end, an unknown opcode, or operand-stack
 * depths that disagree where control flow merges.
 */
public class MalformedCodeException extends RuntimeException {
  /** The instruction position at which the problem was detected, or -1 if not known. */
  public final int position;

  public MalformedCodeException(int position, String msg) {
    super(msg);
    this.position = position;
  }

  @FormatMethod
  public MalformedCodeException(int position, String fmt, Object... fmtArgs) {
    this(position, String.format(fmt, fmtArgs));
  }

  @Override
  public String getMessage() {
    String msg = super.getMessage();
    return (position < 0) ? msg : String.format("%s (at %s)", msg, position);
  }
}
