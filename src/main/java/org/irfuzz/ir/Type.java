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

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * The static result type of an {@link Expr}. The set is closed: four numeric types, {@link #NONE}
 * for expressions that produce no value, and {@link #UNREACHABLE} for expressions that never
 * complete normally.
 */
public enum Type {
  I32("i32"),
  I64("i64"),
  F32("f32"),
  F64("f64"),
  NONE("none"),
  /**
   * The type of an expression through which control never falls (a branch, a return, a trap). An
   * UNREACHABLE expression may be used wherever any other type is expected.
   */
  UNREACHABLE("unreachable");

  /** The four types that carry a value. */
  public static final ImmutableList<Type> NUMERIC = ImmutableList.of(I32, I64, F32, F64);

  /** The name used for this type in the text format. */
  public final String text;

  Type(String text) {
    this.text = text;
  }

  /** True for the four numeric types. */
  public boolean isConcrete() {
    return this != NONE && this != UNREACHABLE;
  }

  /**
   * Returns true if an expression of type {@code actual} may appear where {@code expected} is
   * required.
   */
  public static boolean isCompatible(Type actual, Type expected) {
    return actual == expected || actual == UNREACHABLE;
  }

  /** Returns the Type with the given text name, or null if there is none. */
  public static @Nullable Type fromText(String text) {
    for (Type type : values()) {
      if (type.text.equals(text)) {
        return type;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return text;
  }
}
