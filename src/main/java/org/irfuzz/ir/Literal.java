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

package org.irfuzz.ir;

import com.google.common.base.Preconditions;

/**
 * A constant of one of the numeric types. {@code value} is an Integer, Long, Float or Double
 * matching {@code type}.
 */
public record Literal(Type type, Number value) {

  public Literal {
    Preconditions.checkArgument(
        switch (type) {
          case I32 -> value instanceof Integer;
          case I64 -> value instanceof Long;
          case F32 -> value instanceof Float;
          case F64 -> value instanceof Double;
          case NONE, UNREACHABLE -> false;
        },
        "Bad literal %s for %s",
        value,
        type);
  }

  public static Literal ofInt(int i) {
    return new Literal(Type.I32, i);
  }

  public static Literal ofLong(long l) {
    return new Literal(Type.I64, l);
  }

  public static Literal ofFloat(float f) {
    return new Literal(Type.F32, f);
  }

  public static Literal ofDouble(double d) {
    return new Literal(Type.F64, d);
  }

  /**
   * Parses the text form of a literal of the given type; throws NumberFormatException if it is not
   * well formed.
   */
  public static Literal parse(Type type, String text) {
    return switch (type) {
      case I32 -> ofInt(Integer.parseInt(text));
      case I64 -> ofLong(Long.parseLong(text));
      case F32 -> ofFloat(Float.parseFloat(text));
      case F64 -> ofDouble(Double.parseDouble(text));
      case NONE, UNREACHABLE -> throw new NumberFormatException("No literal of type " + type);
    };
  }

  /** Returns the text form of the value, which {@link #parse} will read back unchanged. */
  @Override
  public String toString() {
    return value.toString();
  }
}
