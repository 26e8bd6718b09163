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

import com.google.common.base.Preconditions;

/**
 * Bounds the number of nodes synthesized for one function. Every synthesis attempt calls {@link
 * #take} first, and gives up (returning an unreachable node) once it returns false; since a budget
 * is never replenished, this is what guarantees that recursive synthesis terminates.
 */
public final class Budget {
  public static final int DEFAULT_LIMIT = 1000;

  private final int limit;
  private int remaining;

  public Budget(int limit) {
    Preconditions.checkArgument(limit > 0, "Budget must be positive: %s", limit);
    this.limit = limit;
    this.remaining = limit;
  }

  /**
   * Decrements the remaining budget; returns false if it has reached zero (whether with this call
   * or an earlier one).
   */
  public boolean take() {
    if (remaining <= 0) {
      return false;
    }
    return --remaining > 0;
  }

  public boolean isExhausted() {
    return remaining <= 0;
  }

  /** The number of units taken so far; never more than {@link #limit}. */
  public int spent() {
    return limit - remaining;
  }

  public int limit() {
    return limit;
  }

  @Override
  public String toString() {
    return spent() + "/" + limit;
  }
}
