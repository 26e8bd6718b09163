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
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * An Expr is one node of a function body. Every Expr has a {@link Kind} and a declared {@link
 * Type}; the concrete subclasses (one per Kind) are nested here.
 *
 * <p>Each Expr exposes its children through {@link #numChildren}, {@link #child} and {@link
 * #setChild}, in evaluation order. Code that doesn't care which kind of node it is looking at (e.g.
 * {@link ExprWalker}) should only use those methods.
 *
 * <p>Exprs are created by an {@link ExprBuilder}, which checks that each child's type is compatible
 * with what its position requires. {@link #setChild} does not repeat that check; callers that
 * replace children are responsible for preserving types (the {@link Validator} can confirm that
 * they did).
 */
public abstract sealed class Expr {

  /** Identifies the concrete subclass of an Expr. */
  public enum Kind {
    BLOCK,
    LOOP,
    IF,
    BREAK,
    SWITCH,
    CALL,
    CALL_IMPORT,
    CALL_INDIRECT,
    GET_LOCAL,
    SET_LOCAL,
    GET_GLOBAL,
    SET_GLOBAL,
    LOAD,
    STORE,
    CONST,
    UNARY,
    BINARY,
    SELECT,
    DROP,
    RETURN,
    HOST,
    NOP,
    UNREACHABLE
  }

  public final Type type;

  Expr(Type type) {
    this.type = type;
  }

  public abstract Kind kind();

  /** Returns the number of children of this node. The default implementation returns zero. */
  public int numChildren() {
    return 0;
  }

  /** Returns one of this node's children; {@code index} must be less than {@link #numChildren}. */
  public Expr child(int index) {
    throw new AssertionError();
  }

  /**
   * Replaces one of this node's children; {@code index} must be less than {@link #numChildren}.
   */
  public void setChild(int index, Expr child) {
    throw new AssertionError();
  }

  /**
   * If this node is a labeled construct that nested branches may target, returns its label;
   * otherwise returns null.
   */
  public @Nullable String label() {
    return null;
  }

  @Override
  public String toString() {
    return ModulePrinter.print(this);
  }

  /** A sequence of expressions, optionally labeled; the last one provides the block's value. */
  public static final class Block extends Expr {
    public final @Nullable String label;
    final List<Expr> list;

    Block(@Nullable String label, List<Expr> list, Type type) {
      super(type);
      this.label = label;
      this.list = new ArrayList<>(list);
    }

    @Override
    public Kind kind() {
      return Kind.BLOCK;
    }

    @Override
    public int numChildren() {
      return list.size();
    }

    @Override
    public Expr child(int index) {
      return list.get(index);
    }

    @Override
    public void setChild(int index, Expr child) {
      list.set(index, child);
    }

    @Override
    public @Nullable String label() {
      return label;
    }
  }

  /**
   * A loop. Control only returns to the top of the loop if a nested branch targets its label;
   * otherwise the loop completes with the value of its body.
   */
  public static final class Loop extends Expr {
    public final @Nullable String label;
    Expr body;

    Loop(@Nullable String label, Expr body, Type type) {
      super(type);
      this.label = label;
      this.body = body;
    }

    @Override
    public Kind kind() {
      return Kind.LOOP;
    }

    @Override
    public int numChildren() {
      return 1;
    }

    @Override
    public Expr child(int index) {
      assert index == 0;
      return body;
    }

    @Override
    public void setChild(int index, Expr child) {
      assert index == 0;
      body = child;
    }

    @Override
    public @Nullable String label() {
      return label;
    }
  }

  /** A conditional; without an else arm its type is {@link Type#NONE}. */
  public static final class If extends Expr {
    Expr condition;
    Expr ifTrue;
    @Nullable Expr ifFalse;

    If(Expr condition, Expr ifTrue, @Nullable Expr ifFalse, Type type) {
      super(type);
      this.condition = condition;
      this.ifTrue = ifTrue;
      this.ifFalse = ifFalse;
    }

    public boolean hasElse() {
      return ifFalse != null;
    }

    @Override
    public Kind kind() {
      return Kind.IF;
    }

    @Override
    public int numChildren() {
      return hasElse() ? 3 : 2;
    }

    @Override
    public Expr child(int index) {
      return switch (index) {
        case 0 -> condition;
        case 1 -> ifTrue;
        case 2 -> {
          assert ifFalse != null;
          yield ifFalse;
        }
        default -> throw new AssertionError();
      };
    }

    @Override
    public void setChild(int index, Expr child) {
      switch (index) {
        case 0 -> condition = child;
        case 1 -> ifTrue = child;
        case 2 -> {
          assert ifFalse != null;
          ifFalse = child;
        }
        default -> throw new AssertionError();
      }
    }
  }

  /**
   * A branch to an enclosing labeled block (leaving it, optionally with a value) or loop
   * (continuing it). With a condition the branch is only taken if the condition is non-zero, and
   * otherwise the value (if any) is passed through.
   */
  public static final class Break extends Expr {
    public final String target;
    @Nullable Expr value;
    @Nullable Expr condition;

    Break(String target, @Nullable Expr value, @Nullable Expr condition, Type type) {
      super(type);
      this.target = target;
      this.value = value;
      this.condition = condition;
    }

    public boolean hasValue() {
      return value != null;
    }

    public boolean isConditional() {
      return condition != null;
    }

    @Override
    public Kind kind() {
      return Kind.BREAK;
    }

    @Override
    public int numChildren() {
      return (hasValue() ? 1 : 0) + (isConditional() ? 1 : 0);
    }

    @Override
    public Expr child(int index) {
      if (index == 0 && value != null) {
        return value;
      }
      assert condition != null && index == numChildren() - 1;
      return condition;
    }

    @Override
    public void setChild(int index, Expr child) {
      if (index == 0 && value != null) {
        value = child;
      } else {
        assert condition != null && index == numChildren() - 1;
        condition = child;
      }
    }
  }

  /** A branch to one of several targets, chosen by an index. */
  public static final class Switch extends Expr {
    public final ImmutableList<String> targets;
    public final String defaultTarget;
    @Nullable Expr value;
    Expr condition;

    Switch(
        ImmutableList<String> targets,
        String defaultTarget,
        @Nullable Expr value,
        Expr condition) {
      super(Type.UNREACHABLE);
      this.targets = targets;
      this.defaultTarget = defaultTarget;
      this.value = value;
      this.condition = condition;
    }

    public boolean hasValue() {
      return value != null;
    }

    @Override
    public Kind kind() {
      return Kind.SWITCH;
    }

    @Override
    public int numChildren() {
      return hasValue() ? 2 : 1;
    }

    @Override
    public Expr child(int index) {
      if (index == 0 && value != null) {
        return value;
      }
      assert index == numChildren() - 1;
      return condition;
    }

    @Override
    public void setChild(int index, Expr child) {
      if (index == 0 && value != null) {
        value = child;
      } else {
        assert index == numChildren() - 1;
        condition = child;
      }
    }
  }

  /**
   * Common superclass of the three call kinds, whose children are their operands (followed, for
   * {@link CallIndirect}, by the index of the callee in the table).
   */
  public abstract static sealed class AbstractCall extends Expr {
    final List<Expr> operands;

    AbstractCall(List<Expr> operands, Type type) {
      super(type);
      this.operands = new ArrayList<>(operands);
    }

    public int numOperands() {
      return operands.size();
    }

    @Override
    public int numChildren() {
      return operands.size();
    }

    @Override
    public Expr child(int index) {
      return operands.get(index);
    }

    @Override
    public void setChild(int index, Expr child) {
      operands.set(index, child);
    }
  }

  /** A direct call to a function defined in the module. */
  public static final class Call extends AbstractCall {
    public final String target;

    Call(String target, List<Expr> operands, Type type) {
      super(operands, type);
      this.target = target;
    }

    @Override
    public Kind kind() {
      return Kind.CALL;
    }
  }

  /** A call to an imported function. */
  public static final class CallImport extends AbstractCall {
    public final String target;

    CallImport(String target, List<Expr> operands, Type type) {
      super(operands, type);
      this.target = target;
    }

    @Override
    public Kind kind() {
      return Kind.CALL_IMPORT;
    }
  }

  /** A call through the module's table; the callee is selected at runtime by {@link #target}. */
  public static final class CallIndirect extends AbstractCall {
    public final Signature signature;
    Expr target;

    CallIndirect(Signature signature, List<Expr> operands, Expr target) {
      super(operands, signature.result());
      this.signature = signature;
      this.target = target;
    }

    @Override
    public Kind kind() {
      return Kind.CALL_INDIRECT;
    }

    @Override
    public int numChildren() {
      return operands.size() + 1;
    }

    @Override
    public Expr child(int index) {
      return (index == operands.size()) ? target : operands.get(index);
    }

    @Override
    public void setChild(int index, Expr child) {
      if (index == operands.size()) {
        target = child;
      } else {
        operands.set(index, child);
      }
    }
  }

  /** Reads a local (parameters first, then the function's vars). */
  public static final class GetLocal extends Expr {
    public final int index;

    GetLocal(int index, Type type) {
      super(type);
      this.index = index;
    }

    @Override
    public Kind kind() {
      return Kind.GET_LOCAL;
    }
  }

  /** Base class for the kinds that have exactly one child. */
  abstract static sealed class SingleChild extends Expr {
    Expr value;

    SingleChild(Expr value, Type type) {
      super(type);
      this.value = value;
    }

    @Override
    public int numChildren() {
      return 1;
    }

    @Override
    public Expr child(int index) {
      assert index == 0;
      return value;
    }

    @Override
    public void setChild(int index, Expr child) {
      assert index == 0;
      value = child;
    }
  }

  /** Writes a local. */
  public static final class SetLocal extends SingleChild {
    public final int index;

    SetLocal(int index, Expr value) {
      super(value, Type.NONE);
      this.index = index;
    }

    @Override
    public Kind kind() {
      return Kind.SET_LOCAL;
    }
  }

  /** Reads a global. */
  public static final class GetGlobal extends Expr {
    public final String name;

    GetGlobal(String name, Type type) {
      super(type);
      this.name = name;
    }

    @Override
    public Kind kind() {
      return Kind.GET_GLOBAL;
    }
  }

  /** Writes a global. */
  public static final class SetGlobal extends SingleChild {
    public final String name;

    SetGlobal(String name, Expr value) {
      super(value, Type.NONE);
      this.name = name;
    }

    @Override
    public Kind kind() {
      return Kind.SET_GLOBAL;
    }
  }

  /** Loads a value of the declared type from memory; the child is the address. */
  public static final class Load extends SingleChild {
    Load(Type type, Expr ptr) {
      super(ptr, type);
    }

    @Override
    public Kind kind() {
      return Kind.LOAD;
    }
  }

  /** Stores a value of type {@link #valueType} to memory. */
  public static final class Store extends Expr {
    public final Type valueType;
    Expr ptr;
    Expr value;

    Store(Type valueType, Expr ptr, Expr value) {
      super(Type.NONE);
      this.valueType = valueType;
      this.ptr = ptr;
      this.value = value;
    }

    @Override
    public Kind kind() {
      return Kind.STORE;
    }

    @Override
    public int numChildren() {
      return 2;
    }

    @Override
    public Expr child(int index) {
      return switch (index) {
        case 0 -> ptr;
        case 1 -> value;
        default -> throw new AssertionError();
      };
    }

    @Override
    public void setChild(int index, Expr child) {
      switch (index) {
        case 0 -> ptr = child;
        case 1 -> value = child;
        default -> throw new AssertionError();
      }
    }
  }

  public static final class Const extends Expr {
    public final Literal value;

    Const(Literal value) {
      super(value.type());
      this.value = value;
    }

    @Override
    public Kind kind() {
      return Kind.CONST;
    }
  }

  public static final class Unary extends SingleChild {
    public final UnaryOp op;

    Unary(UnaryOp op, Expr value) {
      super(value, op.result);
      this.op = op;
    }

    @Override
    public Kind kind() {
      return Kind.UNARY;
    }
  }

  public static final class Binary extends Expr {
    public final BinaryOp op;
    Expr left;
    Expr right;

    Binary(BinaryOp op, Expr left, Expr right) {
      super(op.result);
      this.op = op;
      this.left = left;
      this.right = right;
    }

    @Override
    public Kind kind() {
      return Kind.BINARY;
    }

    @Override
    public int numChildren() {
      return 2;
    }

    @Override
    public Expr child(int index) {
      return switch (index) {
        case 0 -> left;
        case 1 -> right;
        default -> throw new AssertionError();
      };
    }

    @Override
    public void setChild(int index, Expr child) {
      switch (index) {
        case 0 -> left = child;
        case 1 -> right = child;
        default -> throw new AssertionError();
      }
    }
  }

  /** Evaluates both arms and the condition, then returns one of the arms. */
  public static final class Select extends Expr {
    Expr ifTrue;
    Expr ifFalse;
    Expr condition;

    Select(Expr ifTrue, Expr ifFalse, Expr condition, Type type) {
      super(type);
      this.ifTrue = ifTrue;
      this.ifFalse = ifFalse;
      this.condition = condition;
    }

    @Override
    public Kind kind() {
      return Kind.SELECT;
    }

    @Override
    public int numChildren() {
      return 3;
    }

    @Override
    public Expr child(int index) {
      return switch (index) {
        case 0 -> ifTrue;
        case 1 -> ifFalse;
        case 2 -> condition;
        default -> throw new AssertionError();
      };
    }

    @Override
    public void setChild(int index, Expr child) {
      switch (index) {
        case 0 -> ifTrue = child;
        case 1 -> ifFalse = child;
        case 2 -> condition = child;
        default -> throw new AssertionError();
      }
    }
  }

  /** Evaluates its child and discards the result. */
  public static final class Drop extends SingleChild {
    Drop(Expr value) {
      super(value, Type.NONE);
    }

    @Override
    public Kind kind() {
      return Kind.DROP;
    }
  }

  public static final class Return extends Expr {
    @Nullable Expr value;

    Return(@Nullable Expr value) {
      super(Type.UNREACHABLE);
      this.value = value;
    }

    public boolean hasValue() {
      return value != null;
    }

    @Override
    public Kind kind() {
      return Kind.RETURN;
    }

    @Override
    public int numChildren() {
      return hasValue() ? 1 : 0;
    }

    @Override
    public Expr child(int index) {
      assert index == 0 && value != null;
      return value;
    }

    @Override
    public void setChild(int index, Expr child) {
      assert index == 0 && value != null;
      value = child;
    }
  }

  /** Operations on the host environment; both return {@link Type#I32}. */
  public static final class Host extends Expr {
    public enum Op {
      CURRENT_MEMORY("current_memory", 0),
      GROW_MEMORY("grow_memory", 1);

      public final String text;
      public final int numOperands;

      Op(String text, int numOperands) {
        this.text = text;
        this.numOperands = numOperands;
      }

      public static @Nullable Op fromText(String text) {
        for (Op op : values()) {
          if (op.text.equals(text)) {
            return op;
          }
        }
        return null;
      }
    }

    public final Op op;
    final List<Expr> operands;

    Host(Op op, List<Expr> operands) {
      super(Type.I32);
      this.op = op;
      this.operands = new ArrayList<>(operands);
    }

    @Override
    public Kind kind() {
      return Kind.HOST;
    }

    @Override
    public int numChildren() {
      return operands.size();
    }

    @Override
    public Expr child(int index) {
      return operands.get(index);
    }

    @Override
    public void setChild(int index, Expr child) {
      operands.set(index, child);
    }
  }

  public static final class Nop extends Expr {
    Nop() {
      super(Type.NONE);
    }

    @Override
    public Kind kind() {
      return Kind.NOP;
    }
  }

  /** Traps if executed; the divergent terminal node, which fits wherever any type is expected. */
  public static final class Unreachable extends Expr {
    Unreachable() {
      super(Type.UNREACHABLE);
    }

    @Override
    public Kind kind() {
      return Kind.UNREACHABLE;
    }
  }
}
