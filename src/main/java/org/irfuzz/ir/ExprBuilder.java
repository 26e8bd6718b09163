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
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Creates {@link Expr}s. Each method checks that the types of the given children are compatible
 * with the positions they are put in, and computes the new node's type; a mismatch is reported
 * with an IllegalArgumentException.
 *
 * <p>Calls, imports and globals are resolved against the Module passed to the constructor. Labels
 * and locals are not checked here, since that needs the enclosing function; see {@link
 * Validator}.
 */
public class ExprBuilder {
  private final Module module;

  public ExprBuilder(Module module) {
    this.module = module;
  }

  private static void checkChild(Expr child, Type expected, String position) {
    Preconditions.checkArgument(
        Type.isCompatible(child.type, expected),
        "%s has type %s, expected %s",
        position,
        child.type,
        expected);
  }

  private static void checkOperands(List<Expr> operands, List<Type> params, String callee) {
    Preconditions.checkArgument(
        operands.size() == params.size(),
        "%s expects %s operands, got %s",
        callee,
        params.size(),
        operands.size());
    for (int i = 0; i < params.size(); i++) {
      checkChild(operands.get(i), params.get(i), "Operand " + i + " of " + callee);
    }
  }

  /** Returns a block whose type is the type of its last element ({@link Type#NONE} if empty). */
  public Expr.Block makeBlock(@Nullable String label, List<Expr> list) {
    Type type = list.isEmpty() ? Type.NONE : list.get(list.size() - 1).type;
    return makeBlock(label, list, type);
  }

  /**
   * Returns a block with the given type; every element but the last must have type {@link
   * Type#NONE} (or be unreachable), and the last must be compatible with {@code type}.
   */
  public Expr.Block makeBlock(@Nullable String label, List<Expr> list, Type type) {
    for (int i = 0; i < list.size() - 1; i++) {
      checkChild(list.get(i), Type.NONE, "Block element " + i);
    }
    if (list.isEmpty()) {
      Preconditions.checkArgument(type == Type.NONE, "An empty block must have type none");
    } else {
      checkChild(list.get(list.size() - 1), type, "Last block element");
    }
    return new Expr.Block(label, list, type);
  }

  public Expr.Loop makeLoop(@Nullable String label, Expr body, Type type) {
    checkChild(body, type, "Loop body");
    return new Expr.Loop(label, body, type);
  }

  /** Returns a one-armed if, which has type {@link Type#NONE}. */
  public Expr.If makeIf(Expr condition, Expr ifTrue) {
    checkChild(condition, Type.I32, "If condition");
    checkChild(ifTrue, Type.NONE, "One-armed if");
    return new Expr.If(condition, ifTrue, null, Type.NONE);
  }

  /**
   * Returns an if/else whose type is the common type of its arms; if one arm is unreachable the
   * other arm's type is used.
   */
  public Expr.If makeIf(Expr condition, Expr ifTrue, Expr ifFalse) {
    Type type = (ifTrue.type == Type.UNREACHABLE) ? ifFalse.type : ifTrue.type;
    return makeIf(condition, ifTrue, ifFalse, type);
  }

  public Expr.If makeIf(Expr condition, Expr ifTrue, Expr ifFalse, Type type) {
    checkChild(condition, Type.I32, "If condition");
    checkChild(ifTrue, type, "If arm");
    checkChild(ifFalse, type, "Else arm");
    return new Expr.If(condition, ifTrue, ifFalse, type);
  }

  /**
   * Returns a branch to the given label. An unconditional branch has type {@link
   * Type#UNREACHABLE}; a conditional branch has the type of its value, or {@link Type#NONE} if it
   * has none.
   */
  public Expr.Break makeBreak(String target, @Nullable Expr value, @Nullable Expr condition) {
    if (value != null) {
      Preconditions.checkArgument(
          value.type != Type.NONE, "A branch value cannot have type none");
    }
    if (condition != null) {
      checkChild(condition, Type.I32, "Branch condition");
    }
    Type type;
    if (condition == null) {
      type = Type.UNREACHABLE;
    } else if (value != null) {
      type = value.type;
    } else {
      type = Type.NONE;
    }
    return new Expr.Break(target, value, condition, type);
  }

  public Expr.Switch makeSwitch(
      List<String> targets, String defaultTarget, @Nullable Expr value, Expr condition) {
    if (value != null) {
      Preconditions.checkArgument(
          value.type != Type.NONE, "A branch value cannot have type none");
    }
    checkChild(condition, Type.I32, "Switch condition");
    return new Expr.Switch(ImmutableList.copyOf(targets), defaultTarget, value, condition);
  }

  public Expr.Call makeCall(String target, List<Expr> operands) {
    Function callee = module.getFunction(target);
    Preconditions.checkArgument(callee != null, "No function named %s", target);
    checkOperands(operands, callee.params, target);
    return new Expr.Call(target, operands, callee.result);
  }

  public Expr.CallImport makeCallImport(String target, List<Expr> operands) {
    FunctionImport callee = module.getImport(target);
    Preconditions.checkArgument(callee != null, "No import named %s", target);
    checkOperands(operands, callee.signature().params(), target);
    return new Expr.CallImport(target, operands, callee.signature().result());
  }

  public Expr.CallIndirect makeCallIndirect(Signature signature, List<Expr> operands, Expr target) {
    checkOperands(operands, signature.params(), "call_indirect");
    checkChild(target, Type.I32, "Indirect call target");
    return new Expr.CallIndirect(signature, operands, target);
  }

  public Expr.GetLocal makeGetLocal(int index, Type type) {
    Preconditions.checkArgument(type.isConcrete(), "Local %s must be numeric", index);
    return new Expr.GetLocal(index, type);
  }

  public Expr.SetLocal makeSetLocal(int index, Expr value) {
    Preconditions.checkArgument(value.type != Type.NONE, "Cannot store none in local %s", index);
    return new Expr.SetLocal(index, value);
  }

  public Expr.GetGlobal makeGetGlobal(String name) {
    Global global = module.getGlobal(name);
    Preconditions.checkArgument(global != null, "No global named %s", name);
    return new Expr.GetGlobal(name, global.type());
  }

  public Expr.SetGlobal makeSetGlobal(String name, Expr value) {
    Global global = module.getGlobal(name);
    Preconditions.checkArgument(global != null, "No global named %s", name);
    checkChild(value, global.type(), "Value of " + name);
    return new Expr.SetGlobal(name, value);
  }

  public Expr.Load makeLoad(Type type, Expr ptr) {
    Preconditions.checkArgument(type.isConcrete(), "Cannot load %s", type);
    checkChild(ptr, Type.I32, "Load address");
    return new Expr.Load(type, ptr);
  }

  public Expr.Store makeStore(Type valueType, Expr ptr, Expr value) {
    Preconditions.checkArgument(valueType.isConcrete(), "Cannot store %s", valueType);
    checkChild(ptr, Type.I32, "Store address");
    checkChild(value, valueType, "Stored value");
    return new Expr.Store(valueType, ptr, value);
  }

  public Expr.Const makeConst(Literal value) {
    return new Expr.Const(value);
  }

  public Expr.Unary makeUnary(UnaryOp op, Expr value) {
    checkChild(value, op.operand, "Operand of " + op);
    return new Expr.Unary(op, value);
  }

  public Expr.Binary makeBinary(BinaryOp op, Expr left, Expr right) {
    checkChild(left, op.operand, "Left operand of " + op);
    checkChild(right, op.operand, "Right operand of " + op);
    return new Expr.Binary(op, left, right);
  }

  public Expr.Select makeSelect(Expr ifTrue, Expr ifFalse, Expr condition) {
    Type type = (ifTrue.type == Type.UNREACHABLE) ? ifFalse.type : ifTrue.type;
    Preconditions.checkArgument(type != Type.NONE, "Cannot select none");
    checkChild(ifFalse, type, "Select arm");
    checkChild(condition, Type.I32, "Select condition");
    return new Expr.Select(ifTrue, ifFalse, condition, type);
  }

  public Expr.Drop makeDrop(Expr value) {
    Preconditions.checkArgument(value.type != Type.NONE, "Cannot drop none");
    return new Expr.Drop(value);
  }

  public Expr.Return makeReturn(@Nullable Expr value) {
    return new Expr.Return(value);
  }

  public Expr.Host makeHost(Expr.Host.Op op, List<Expr> operands) {
    Preconditions.checkArgument(
        operands.size() == op.numOperands,
        "%s expects %s operands, got %s",
        op.text,
        op.numOperands,
        operands.size());
    for (Expr operand : operands) {
      checkChild(operand, Type.I32, "Operand of " + op.text);
    }
    return new Expr.Host(op, operands);
  }

  public Expr.Nop makeNop() {
    return new Expr.Nop();
  }

  public Expr.Unreachable makeUnreachable() {
    return new Expr.Unreachable();
  }
}
