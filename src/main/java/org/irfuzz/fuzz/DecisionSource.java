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
import java.util.List;
import java.util.Random;
import org.irfuzz.ir.Literal;
import org.irfuzz.ir.Type;

/**
 * The source of every random decision made while fuzzing. It is seeded once, so a given seed and
 * input module always produce the same sequence of decisions (and hence the same output); any
 * change to the order in which decisions are requested changes the output.
 */
public final class DecisionSource {
  private final Random random;

  public DecisionSource(long seed) {
    this.random = new Random(seed);
  }

  /** Returns true with probability {@code percent}/100. */
  public boolean chance(int percent) {
    return random.nextInt(100) < percent;
  }

  /** Returns an int uniformly distributed in {@code [0, bound)}. */
  public int pick(int bound) {
    Preconditions.checkArgument(bound > 0, "Cannot pick from %s choices", bound);
    return random.nextInt(bound);
  }

  /** Returns one of the given (non-empty) list's elements, chosen uniformly. */
  public <T> T pick(List<T> choices) {
    return choices.get(pick(choices.size()));
  }

  /**
   * Returns a random constant of the given numeric type. Half of the time the constant is small
   * (between -16 and 16), since those are more likely to exercise interesting cases.
   */
  public Literal literal(Type type) {
    boolean small = chance(50);
    return switch (type) {
      case I32 -> Literal.ofInt(small ? pick(33) - 16 : random.nextInt());
      case I64 -> Literal.ofLong(small ? pick(33) - 16 : random.nextLong());
      case F32 -> Literal.ofFloat(small ? pick(33) - 16 : random.nextFloat());
      case F64 -> Literal.ofDouble(small ? pick(33) - 16 : random.nextDouble());
      case NONE, UNREACHABLE -> throw new IllegalArgumentException("No literal of type " + type);
    };
  }
}
