/*
 * Copyright 2025 The Irfuzz Authors
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

package org.irfuzz.fuzz;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * The settings of a {@link FuzzPass}. Instances are immutable; use {@link #builder} to create one,
 * or {@link #fromSystemProperties} to pick up overrides from {@code -Dirfuzz.*} flags.
 */
public final class FuzzOptions {
  public static final long DEFAULT_SEED = 42;
  public static final int DEFAULT_REPLACE_PERCENT = 5;
  public static final int DEFAULT_DIVERGENT_PERCENT = 5;
  public static final int DEFAULT_MAX_BLOCK_SIZE = 5;

  public static final FuzzOptions DEFAULT = builder().build();

  private final long seed;
  private final int budget;
  private final int replacePercent;
  private final int divergentPercent;
  private final int maxBlockSize;

  private FuzzOptions(Builder builder) {
    this.seed = builder.seed;
    this.budget = builder.budget;
    this.replacePercent = builder.replacePercent;
    this.divergentPercent = builder.divergentPercent;
    this.maxBlockSize = builder.maxBlockSize;
  }

  /** The seed of the {@link DecisionSource}. */
  public long seed() {
    return seed;
  }

  /** The maximum number of nodes to synthesize per function. */
  public int budget() {
    return budget;
  }

  /** The probability (in percent) that the mutator replaces any given node. */
  public int replacePercent() {
    return replacePercent;
  }

  /**
   * The probability (in percent) that a synthesis step produces an unreachable node regardless of
   * the requested type.
   */
  public int divergentPercent() {
    return divergentPercent;
  }

  /** The maximum number of elements in a synthesized block. */
  public int maxBlockSize() {
    return maxBlockSize;
  }

  public Builder toBuilder() {
    return builder()
        .setSeed(seed)
        .setBudget(budget)
        .setReplacePercent(replacePercent)
        .setDivergentPercent(divergentPercent)
        .setMaxBlockSize(maxBlockSize);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns options read from the system properties {@code irfuzz.seed}, {@code irfuzz.budget},
   * {@code irfuzz.replacePercent}, {@code irfuzz.divergentPercent} and {@code irfuzz.maxBlockSize};
   * any that are not set keep their default values.
   */
  public static FuzzOptions fromSystemProperties() {
    return builder()
        .setSeed(Long.getLong("irfuzz.seed", DEFAULT_SEED))
        .setBudget(Integer.getInteger("irfuzz.budget", Budget.DEFAULT_LIMIT))
        .setReplacePercent(Integer.getInteger("irfuzz.replacePercent", DEFAULT_REPLACE_PERCENT))
        .setDivergentPercent(
            Integer.getInteger("irfuzz.divergentPercent", DEFAULT_DIVERGENT_PERCENT))
        .setMaxBlockSize(Integer.getInteger("irfuzz.maxBlockSize", DEFAULT_MAX_BLOCK_SIZE))
        .build();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("seed", seed)
        .add("budget", budget)
        .add("replacePercent", replacePercent)
        .add("divergentPercent", divergentPercent)
        .add("maxBlockSize", maxBlockSize)
        .toString();
  }

  public static final class Builder {
    private long seed = DEFAULT_SEED;
    private int budget = Budget.DEFAULT_LIMIT;
    private int replacePercent = DEFAULT_REPLACE_PERCENT;
    private int divergentPercent = DEFAULT_DIVERGENT_PERCENT;
    private int maxBlockSize = DEFAULT_MAX_BLOCK_SIZE;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder setSeed(long seed) {
      this.seed = seed;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setBudget(int budget) {
      this.budget = budget;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setReplacePercent(int replacePercent) {
      this.replacePercent = replacePercent;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setDivergentPercent(int divergentPercent) {
      this.divergentPercent = divergentPercent;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setMaxBlockSize(int maxBlockSize) {
      this.maxBlockSize = maxBlockSize;
      return this;
    }

    public FuzzOptions build() {
      Preconditions.checkArgument(budget > 0, "budget must be positive: %s", budget);
      checkPercent(replacePercent, "replacePercent");
      checkPercent(divergentPercent, "divergentPercent");
      Preconditions.checkArgument(
          maxBlockSize > 0, "maxBlockSize must be positive: %s", maxBlockSize);
      return new FuzzOptions(this);
    }

    private static void checkPercent(int percent, String name) {
      Preconditions.checkArgument(
          percent >= 0 && percent <= 100, "%s must be between 0 and 100: %s", name, percent);
    }
  }
}
