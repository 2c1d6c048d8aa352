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

import com.google.errorprone.annotations.CanIgnoreReturnValue;

/** Selects which of the optimization passes {@link Compiler} runs. */
public final class Options {
  /** The prefix of the system properties read by {@link #fromSystemProperties}. */
  public static final String PROPERTY_PREFIX = "pyrite.";

  private static final Options DEFAULTS = builder().build();

  /** Fold operators applied to constants. */
  public final boolean foldConstants;

  /** Rewrite {@code 'format' % args} as an f-string. */
  public final boolean rewritePrintf;

  /** Replace stores to locals that are never read with POP_TOP. */
  public final boolean eliminateDeadStores;

  /** Replace reads of definitely-assigned locals with unchecked reads. */
  public final boolean checkDefiniteAssignment;

  /** Build the SSA form of each code unit. */
  public final boolean buildSsa;

  private Options(Builder builder) {
    this.foldConstants = builder.foldConstants;
    this.rewritePrintf = builder.rewritePrintf;
    this.eliminateDeadStores = builder.eliminateDeadStores;
    this.checkDefiniteAssignment = builder.checkDefiniteAssignment;
    this.buildSsa = builder.buildSsa;
  }

  /** Returns Options with every pass enabled. */
  public static Options defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns Options configured from the system properties {@code pyrite.foldConstants}, {@code
   * pyrite.rewritePrintf}, {@code pyrite.eliminateDeadStores}, {@code
   * pyrite.checkDefiniteAssignment} and {@code pyrite.buildSsa}; any that are not set default to
   * true.
   */
  public static Options fromSystemProperties() {
    return builder()
        .foldConstants(property("foldConstants"))
        .rewritePrintf(property("rewritePrintf"))
        .eliminateDeadStores(property("eliminateDeadStores"))
        .checkDefiniteAssignment(property("checkDefiniteAssignment"))
        .buildSsa(property("buildSsa"))
        .build();
  }

  private static boolean property(String name) {
    return Boolean.parseBoolean(System.getProperty(PROPERTY_PREFIX + name, "true"));
  }

  /** Returns a Builder initialized with these Options. */
  public Builder toBuilder() {
    return builder()
        .foldConstants(foldConstants)
        .rewritePrintf(rewritePrintf)
        .eliminateDeadStores(eliminateDeadStores)
        .checkDefiniteAssignment(checkDefiniteAssignment)
        .buildSsa(buildSsa);
  }

  @Override
  public String toString() {
    return String.format(
        "Options(foldConstants=%s, rewritePrintf=%s, eliminateDeadStores=%s,"
            + " checkDefiniteAssignment=%s, buildSsa=%s)",
        foldConstants, rewritePrintf, eliminateDeadStores, checkDefiniteAssignment, buildSsa);
  }

  public static final class Builder {
    private boolean foldConstants = true;
    private boolean rewritePrintf = true;
    private boolean eliminateDeadStores = true;
    private boolean checkDefiniteAssignment = true;
    private boolean buildSsa = true;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder foldConstants(boolean value) {
      foldConstants = value;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder rewritePrintf(boolean value) {
      rewritePrintf = value;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder eliminateDeadStores(boolean value) {
      eliminateDeadStores = value;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder checkDefiniteAssignment(boolean value) {
      checkDefiniteAssignment = value;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder buildSsa(boolean value) {
      buildSsa = value;
      return this;
    }

    public Options build() {
      return new Options(this);
    }
  }
}
