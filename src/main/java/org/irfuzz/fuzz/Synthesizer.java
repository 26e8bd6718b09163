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

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.irfuzz.ir.Expr;
import org.irfuzz.ir.ExprBuilder;
import org.irfuzz.ir.Function;
import org.irfuzz.ir.FunctionImport;
import org.irfuzz.ir.Global;
import org.irfuzz.ir.Type;
import org.jspecify.annotations.Nullable;

/**
 * Builds random expressions of a requested type.
 *
 * <p>{@link #synthesize} is total: whenever the chosen form has no valid instance (no branch target
 * of the right type, no function with the right result, no table) it returns an unreachable node,
 * which is acceptable wherever any type is expected. Each call charges the context's {@link
 * Budget}, and returns an unreachable node without recursing once the budget is exhausted.
 */
public final class Synthesizer {

  /** The forms that a synthesized expression can take. */
  enum Form {
    BLOCK,
    LOOP,
    IF,
    BREAK,
    SWITCH,
    CALL,
    CALL_IMPORT,
    CALL_INDIRECT,
    /** A node built without recursive synthesis; see {@link #makeLeaf}. */
    LEAF
  }

  private static final ImmutableList<Form> NUMERIC_FORMS =
      ImmutableList.of(
          Form.BLOCK,
          Form.LOOP,
          Form.IF,
          Form.BREAK,
          Form.CALL,
          Form.CALL_IMPORT,
          Form.CALL_INDIRECT);

  private static final ImmutableList<Form> NONE_FORMS =
      ImmutableList.<Form>builder().addAll(NUMERIC_FORMS).add(Form.LEAF).build();

  private static final ImmutableList<Form> UNREACHABLE_FORMS =
      ImmutableList.of(Form.BLOCK, Form.LOOP, Form.BREAK, Form.SWITCH, Form.LEAF);

  /** The maximum number of targets (not counting the default) of a synthesized switch. */
  private static final int MAX_SWITCH_TARGETS = 3;

  private final FuzzOptions options;

  public Synthesizer(FuzzOptions options) {
    this.options = options;
  }

  /** Returns the forms that may be chosen when synthesizing an expression of the given type. */
  static ImmutableList<Form> eligibleForms(Type type) {
    return switch (type) {
      case I32, I64, F32, F64 -> NUMERIC_FORMS;
      case NONE -> NONE_FORMS;
      case UNREACHABLE -> UNREACHABLE_FORMS;
    };
  }

  /**
   * Returns a new expression whose type is {@code type} (or {@link Type#UNREACHABLE}). Only
   * branches to the constructs currently in {@code ctx.scopes} are generated.
   */
  public Expr synthesize(FuzzContext ctx, Type type) {
    if (!ctx.budget.take()) {
      return ctx.builder.makeUnreachable();
    }
    if (ctx.decisions.chance(options.divergentPercent())) {
      return ctx.builder.makeUnreachable();
    }
    Form form = ctx.decisions.pick(eligibleForms(type));
    return switch (form) {
      case BLOCK -> makeBlock(ctx, type);
      case LOOP -> makeLoop(ctx, type);
      case IF -> makeIf(ctx, type);
      case BREAK -> makeBreak(ctx, type);
      case SWITCH -> makeSwitch(ctx);
      case CALL -> makeCall(ctx, type);
      case CALL_IMPORT -> makeCallImport(ctx, type);
      case CALL_INDIRECT -> makeCallIndirect(ctx, type);
      case LEAF -> makeLeaf(ctx, type);
    };
  }

  private List<Expr> synthesizeAll(FuzzContext ctx, List<Type> types) {
    List<Expr> result = new ArrayList<>(types.size());
    for (Type type : types) {
      result.add(synthesize(ctx, type));
    }
    return result;
  }

  /**
   * A labeled block of 1 to {@link FuzzOptions#maxBlockSize} elements; all but the last have type
   * none.
   */
  private Expr makeBlock(FuzzContext ctx, Type type) {
    String label = ctx.names.allocate();
    int size = ctx.decisions.pick(options.maxBlockSize()) + 1;
    List<Expr> list = new ArrayList<>(size);
    try (ScopeStack.Entry scope = ctx.scopes.enterBlock(label, type)) {
      for (int i = 0; i < size - 1; i++) {
        list.add(synthesize(ctx, Type.NONE));
      }
      list.add(synthesize(ctx, type));
    }
    return ctx.builder.makeBlock(label, list, type);
  }

  /** A labeled loop; nested code may continue it with a valueless branch. */
  private Expr makeLoop(FuzzContext ctx, Type type) {
    String label = ctx.names.allocate();
    Expr body;
    try (ScopeStack.Entry scope = ctx.scopes.enterLoop(label)) {
      body = synthesize(ctx, type);
    }
    return ctx.builder.makeLoop(label, body, type);
  }

  private Expr makeIf(FuzzContext ctx, Type type) {
    Expr condition = synthesize(ctx, Type.I32);
    Expr ifTrue = synthesize(ctx, type);
    Expr ifFalse = synthesize(ctx, type);
    return ctx.builder.makeIf(condition, ifTrue, ifFalse, type);
  }

  /**
   * A branch of the given type. A numeric type is produced by a conditional branch carrying a value
   * of that type, and none by a conditional branch without a value; an unconditional branch (which
   * is unreachable) may target any enclosing construct.
   */
  private Expr makeBreak(FuzzContext ctx, Type type) {
    ExprBuilder builder = ctx.builder;
    if (type == Type.UNREACHABLE) {
      ImmutableList<ScopeStack.Entry> targets = ctx.scopes.allTargets();
      if (targets.isEmpty()) {
        return builder.makeUnreachable();
      }
      ScopeStack.Entry target = ctx.decisions.pick(targets);
      Expr value = target.carriesValue() ? synthesize(ctx, target.type) : null;
      return builder.makeBreak(target.label, value, null);
    }
    ImmutableList<ScopeStack.Entry> targets =
        ctx.scopes.eligibleTargets(type.isConcrete() ? type : null);
    if (targets.isEmpty()) {
      return builder.makeUnreachable();
    }
    ScopeStack.Entry target = ctx.decisions.pick(targets);
    Expr value = type.isConcrete() ? synthesize(ctx, type) : null;
    Expr condition = synthesize(ctx, Type.I32);
    return builder.makeBreak(target.label, value, condition);
  }

  /** A valueless multi-way branch; always unreachable. */
  private Expr makeSwitch(FuzzContext ctx) {
    ImmutableList<ScopeStack.Entry> candidates = ctx.scopes.eligibleTargets(null);
    if (candidates.isEmpty()) {
      return ctx.builder.makeUnreachable();
    }
    int numTargets = ctx.decisions.pick(MAX_SWITCH_TARGETS) + 1;
    List<String> targets = new ArrayList<>(numTargets);
    for (int i = 0; i < numTargets; i++) {
      targets.add(ctx.decisions.pick(candidates).label);
    }
    String defaultTarget = ctx.decisions.pick(candidates).label;
    Expr condition = synthesize(ctx, Type.I32);
    return ctx.builder.makeSwitch(targets, defaultTarget, null, condition);
  }

  private Expr makeCall(FuzzContext ctx, Type type) {
    ImmutableList<Function> candidates =
        ctx.module.functions().stream().filter(f -> f.result == type).collect(toImmutableList());
    if (candidates.isEmpty()) {
      return ctx.builder.makeUnreachable();
    }
    Function callee = ctx.decisions.pick(candidates);
    return ctx.builder.makeCall(callee.name, synthesizeAll(ctx, callee.params));
  }

  private Expr makeCallImport(FuzzContext ctx, Type type) {
    ImmutableList<FunctionImport> candidates =
        ctx.module.imports().stream()
            .filter(imp -> imp.signature().result() == type)
            .collect(toImmutableList());
    if (candidates.isEmpty()) {
      return ctx.builder.makeUnreachable();
    }
    FunctionImport callee = ctx.decisions.pick(candidates);
    return ctx.builder.makeCallImport(
        callee.name(), synthesizeAll(ctx, callee.signature().params()));
  }

  /**
   * An indirect call to one of the table's functions with the right result type, each function
   * counted once however often the table lists it; the operands are followed by a random index
   * into the table.
   */
  @VisibleForTesting
  Expr makeCallIndirect(FuzzContext ctx, Type type) {
    if (!ctx.module.hasTable()) {
      return ctx.builder.makeUnreachable();
    }
    ImmutableList<Function> candidates =
        ctx.module.table().stream()
            .distinct()
            .map(ctx.module::getFunction)
            .filter(f -> f != null && f.result == type)
            .collect(toImmutableList());
    if (candidates.isEmpty()) {
      return ctx.builder.makeUnreachable();
    }
    Function callee = ctx.decisions.pick(candidates);
    List<Expr> operands = synthesizeAll(ctx, callee.params);
    Expr target = synthesize(ctx, Type.I32);
    return ctx.builder.makeCallIndirect(callee.signature(), operands, target);
  }

  /**
   * An expression of type none or unreachable built directly, without recursive synthesis. Any
   * operands it needs are constants, each of which is charged to the budget; if the budget runs out
   * (or a form needs a local or global the function or module doesn't have) the result is a nop or
   * an unreachable.
   */
  private Expr makeLeaf(FuzzContext ctx, Type type) {
    ExprBuilder builder = ctx.builder;
    switch (type) {
      case I32, I64, F32, F64 -> throw new AssertionError("no leaf form for " + type);
      case NONE -> {
        Expr leaf =
            switch (ctx.decisions.pick(5)) {
              case 0 -> builder.makeNop();
              case 1 -> makeDrop(ctx);
              case 2 -> makeSetLocal(ctx);
              case 3 -> makeSetGlobal(ctx);
              default -> makeStore(ctx);
            };
        return (leaf != null) ? leaf : builder.makeNop();
      }
      case UNREACHABLE -> {
        if (ctx.decisions.chance(50)) {
          Type result = ctx.function.result;
          if (result == Type.NONE) {
            return builder.makeReturn(null);
          }
          Expr value = constant(ctx, result);
          if (value != null) {
            return builder.makeReturn(value);
          }
        }
        return builder.makeUnreachable();
      }
    }
    throw new AssertionError();
  }

  /** Returns a random constant, or null if the budget is exhausted. */
  private static @Nullable Expr constant(FuzzContext ctx, Type type) {
    if (!ctx.budget.take()) {
      return null;
    }
    return ctx.builder.makeConst(ctx.decisions.literal(type));
  }

  private static @Nullable Expr makeDrop(FuzzContext ctx) {
    Expr value = constant(ctx, ctx.decisions.pick(Type.NUMERIC));
    return (value == null) ? null : ctx.builder.makeDrop(value);
  }

  private static @Nullable Expr makeSetLocal(FuzzContext ctx) {
    Function fn = ctx.function;
    if (fn.numLocals() == 0) {
      return null;
    }
    int index = ctx.decisions.pick(fn.numLocals());
    Expr value = constant(ctx, fn.localType(index));
    return (value == null) ? null : ctx.builder.makeSetLocal(index, value);
  }

  private static @Nullable Expr makeSetGlobal(FuzzContext ctx) {
    if (ctx.module.globals().isEmpty()) {
      return null;
    }
    Global global = ctx.decisions.pick(ImmutableList.copyOf(ctx.module.globals()));
    Expr value = constant(ctx, global.type());
    return (value == null) ? null : ctx.builder.makeSetGlobal(global.name(), value);
  }

  private static @Nullable Expr makeStore(FuzzContext ctx) {
    Type valueType = ctx.decisions.pick(Type.NUMERIC);
    Expr ptr = constant(ctx, Type.I32);
    if (ptr == null) {
      return null;
    }
    Expr value = constant(ctx, valueType);
    return (value == null) ? null : ctx.builder.makeStore(valueType, ptr, value);
  }
}
