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

/**
 * The operators of a {@link Expr.Binary}. Both operands have the same type; comparisons return
 * {@link Type#I32}.
 */
public enum BinaryOp {
  ADD_I32("i32.add", I32, I32),
  SUB_I32("i32.sub", I32, I32),
  MUL_I32("i32.mul", I32, I32),
  DIV_S_I32("i32.div_s", I32, I32),
  AND_I32("i32.and", I32, I32),
  OR_I32("i32.or", I32, I32),
  XOR_I32("i32.xor", I32, I32),
  SHL_I32("i32.shl", I32, I32),
  EQ_I32("i32.eq", I32, I32),
  NE_I32("i32.ne", I32, I32),
  LT_S_I32("i32.lt_s", I32, I32),
  GT_U_I32("i32.gt_u", I32, I32),
  ADD_I64("i64.add", I64, I64),
  SUB_I64("i64.sub", I64, I64),
  MUL_I64("i64.mul", I64, I64),
  EQ_I64("i64.eq", I64, I32),
  LT_S_I64("i64.lt_s", I64, I32),
  ADD_F32("f32.add", F32, F32),
  MUL_F32("f32.mul", F32, F32),
  LT_F32("f32.lt", F32, I32),
  ADD_F64("f64.add", F64, F64),
  DIV_F64("f64.div", F64, F64),
  MIN_F64("f64.min", F64, F64),
  EQ_F64("f64.eq", F64, I32);

  /** The operator's name in the text format. */
  public final String text;

  /** The type of both operands. */
  public final Type operand;

  public final Type result;

  BinaryOp(String text, Type operand, Type result) {
    this.text = text;
    this.operand = operand;
    this.result = result;
  }

  /** Returns the operator with the given text name, or null if there is none. */
  public static @Nullable BinaryOp fromText(String text) {
    for (BinaryOp op : values()) {
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
