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

import static org.irfuzz.ir.Type.F32;
import static org.irfuzz.ir.Type.F64;
import static org.irfuzz.ir.Type.I32;
import static org.irfuzz.ir.Type.I64;

import org.jspecify.annotations.Nullable;

/** The operators of a {@link Expr.Unary}, each with a fixed operand type and result type. */
public enum UnaryOp {
  CLZ_I32("i32.clz", I32, I32),
  CTZ_I32("i32.ctz", I32, I32),
  POPCNT_I32("i32.popcnt", I32, I32),
  EQZ_I32("i32.eqz", I32, I32),
  CLZ_I64("i64.clz", I64, I64),
  EQZ_I64("i64.eqz", I64, I32),
  NEG_F32("f32.neg", F32, F32),
  ABS_F32("f32.abs", F32, F32),
  SQRT_F32("f32.sqrt", F32, F32),
  NEG_F64("f64.neg", F64, F64),
  ABS_F64("f64.abs", F64, F64),
  SQRT_F64("f64.sqrt", F64, F64),
  WRAP_I64("i32.wrap/i64", I64, I32),
  EXTEND_S_I32("i64.extend_s/i32", I32, I64),
  EXTEND_U_I32("i64.extend_u/i32", I32, I64),
  TRUNC_S_F64_TO_I32("i32.trunc_s/f64", F64, I32),
  CONVERT_S_I32_TO_F64("f64.convert_s/i32", I32, F64),
  DEMOTE_F64("f32.demote/f64", F64, F32),
  PROMOTE_F32("f64.promote/f32", F32, F64),
  REINTERPRET_F32("i32.reinterpret/f32", F32, I32);

  /** The operator's name in the text format. */
  public final String text;

  public final Type operand;
  public final Type result;

  UnaryOp(String text, Type operand, Type result) {
    this.text = text;
    this.operand = operand;
    this.result = result;
  }

  /** Returns the operator with the given text name, or null if there is none. */
  public static @Nullable UnaryOp fromText(String text) {
    for (UnaryOp op : values()) {
      if (op.text.equals(text)) {
        return op;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return text;
  }
}
