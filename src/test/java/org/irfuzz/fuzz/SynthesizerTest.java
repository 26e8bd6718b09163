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

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;
import org.irfuzz.ir.Expr;
import org.irfuzz.ir.ExprBuilder;
import org.irfuzz.ir.ExprWalker;
import org.irfuzz.ir.Function;
import org.irfuzz.ir.Literal;
import org.irfuzz.ir.Module;
import org.irfuzz.ir.ModuleParser;
import org.irfuzz.ir.Type;
import org.irfuzz.ir.Validator;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class SynthesizerTest {

  /** A module that offers a witness for every form: locals, globals, calls, imports, a table. */
  private static final String RICH_MODULE =
      """
      (module
        (global $gi i32)
        (global $gf f64)
        (import $imp (param i64) (result f32))
        (import $log (param i32) (result none))
        (table $callee $side)
        (func $callee (param i32 f64) (result i32) (get_local 0))
        (func $side (param) (result i32) (i32.const 0))
        (func $target (param i32 i64) (result i64) (local f32 f64)
          (get_local 1)))
      """;

  private static final ImmutableList<Type> ALL_TYPES =
      ImmutableList.of(Type.I32, Type.I64, Type.F32, Type.F64, Type.NONE, Type.UNREACHABLE);

  private final Synthesizer synthesizer = new Synthesizer(FuzzOptions.DEFAULT);

  private static int countReachableKinds(Expr expr) {
    int[] count = new int[1];
    new ExprWalker() {
      @Override
      protected void visit(Expr e) {
        if (e.kind() != Expr.Kind.UNREACHABLE) {
          count[0]++;
        }
      }
    }.walk(expr);
    return count[0];
  }

  @Test
  public void budgetOfOneYieldsUnreachable() throws Exception {
    Module module =
        ModuleParser.parseModule("(module (func $f (param) (result i32) (i32.const 0)))");
    Function fn = module.getFunction("f");
    for (long seed = 0; seed < 50; seed++) {
      FuzzContext ctx = new FuzzContext(module, fn, new DecisionSource(seed), 1);
      Expr expr = synthesizer.synthesize(ctx, Type.I32);
      assertThat(expr.kind()).isEqualTo(Expr.Kind.UNREACHABLE);
      assertThat(ctx.budget.isExhausted()).isTrue();
    }
  }

  @Test
  public void eligibleForms() {
    assertThat(Synthesizer.eligibleForms(Type.UNREACHABLE)).contains(Synthesizer.Form.SWITCH);
    assertThat(Synthesizer.eligibleForms(Type.UNREACHABLE)).doesNotContain(Synthesizer.Form.IF);
    assertThat(Synthesizer.eligibleForms(Type.UNREACHABLE))
        .doesNotContain(Synthesizer.Form.CALL);
    assertThat(Synthesizer.eligibleForms(Type.UNREACHABLE)).contains(Synthesizer.Form.LEAF);
    assertThat(Synthesizer.eligibleForms(Type.NONE)).contains(Synthesizer.Form.LEAF);
    for (Type type : Type.NUMERIC) {
      assertThat(Synthesizer.eligibleForms(type)).doesNotContain(Synthesizer.Form.SWITCH);
      assertThat(Synthesizer.eligibleForms(type)).doesNotContain(Synthesizer.Form.LEAF);
      assertThat(Synthesizer.eligibleForms(type)).contains(Synthesizer.Form.CALL_INDIRECT);
    }
  }

  /** A function listed several times in the table is no more likely to be called than another. */
  @Test
  public void callIndirectCountsEachTableFunctionOnce() throws Exception {
    Module module =
        ModuleParser.parseModule(
            """
            (module
              (table $wide $narrow $wide $wide)
              (func $wide (param i32 i32) (result i32) (get_local 0))
              (func $narrow (param) (result i32) (i32.const 0)))
            """);
    Function fn = module.getFunction("narrow");
    DecisionSource decisions = new DecisionSource(7);
    int trials = 4000;
    int wide = 0;
    for (int i = 0; i < trials; i++) {
      FuzzContext ctx = new FuzzContext(module, fn, decisions, 50);
      Expr expr = synthesizer.makeCallIndirect(ctx, Type.I32);
      assertThat(expr.kind()).isEqualTo(Expr.Kind.CALL_INDIRECT);
      if (((Expr.CallIndirect) expr).signature.params().size() == 2) {
        wide++;
      }
    }
    assertThat(wide).isIn(Range.closed(trials * 45 / 100, trials * 55 / 100));
  }

  /** With no functions, imports, table, globals, locals or scopes, every form falls back. */
  @Test
  public void synthesisIsTotalInAnEmptyContext() throws Exception {
    Module module = ModuleParser.parseModule("(module (func $f (param) (result none) (nop)))");
    Function fn = module.getFunction("f");
    for (long seed = 0; seed < 100; seed++) {
      FuzzContext ctx = new FuzzContext(module, fn, new DecisionSource(seed), 100);
      for (Type type : ALL_TYPES) {
        Expr expr = synthesizer.synthesize(ctx, type);
        assertWithMessage("seed %s, %s", seed, expr)
            .that(Type.isCompatible(expr.type, type))
            .isTrue();
        assertThat(ctx.scopes.isEmpty()).isTrue();
      }
    }
  }

  /**
   * Synthesizes each type inside an open {@code block $out i32} and {@code loop $top}, installs
   * the result in a matching function body, and validates it.
   */
  @Test
  public void synthesizedCodeValidates() throws Exception {
    Module module = ModuleParser.parseModule(RICH_MODULE);
    Function fn = module.getFunction("target");
    ExprBuilder builder = new ExprBuilder(module);
    for (long seed = 0; seed < 100; seed++) {
      for (Type type : ALL_TYPES) {
        FuzzContext ctx = new FuzzContext(module, fn, new DecisionSource(seed), 200);
        Expr expr;
        try (ScopeStack.Entry out = ctx.scopes.enterBlock("out", Type.I32);
            ScopeStack.Entry top = ctx.scopes.enterLoop("top")) {
          expr = synthesizer.synthesize(ctx, type);
        }
        assertThat(ctx.scopes.isEmpty()).isTrue();
        assertThat(Type.isCompatible(expr.type, type)).isTrue();

        Expr inLoop = type.isConcrete() ? builder.makeDrop(expr) : expr;
        Expr out =
            builder.makeBlock(
                "out",
                ImmutableList.of(
                    builder.makeLoop("top", inLoop, Type.NONE),
                    builder.makeConst(Literal.ofInt(0))),
                Type.I32);
        fn.setBody(
            builder.makeBlock(
                null,
                ImmutableList.of(builder.makeDrop(out), builder.makeConst(Literal.ofLong(0))),
                Type.I64));
        assertWithMessage("seed %s, type %s:\n%s", seed, type, fn.body())
            .that(Validator.validate(module, fn))
            .isEmpty();
      }
    }
  }

  @Test
  public void nodesCreatedStayWithinBudget() throws Exception {
    Module module = ModuleParser.parseModule(RICH_MODULE);
    Function fn = module.getFunction("target");
    for (int limit : new int[] {1, 2, 10, 100}) {
      for (long seed = 0; seed < 20; seed++) {
        FuzzContext ctx = new FuzzContext(module, fn, new DecisionSource(seed), limit);
        int created = 0;
        // Keep asking until the budget runs out.
        while (!ctx.budget.isExhausted()) {
          created += countReachableKinds(synthesizer.synthesize(ctx, Type.I64));
        }
        assertThat(created).isLessThan(limit);
        assertThat(ctx.budget.spent()).isEqualTo(limit);
      }
    }
  }

  @Test
  public void divergentPercentOfOneHundredAlwaysDiverges() throws Exception {
    Module module = ModuleParser.parseModule(RICH_MODULE);
    Synthesizer alwaysUnreachable =
        new Synthesizer(FuzzOptions.builder().setDivergentPercent(100).build());
    FuzzContext ctx =
        new FuzzContext(module, module.getFunction("target"), new DecisionSource(9), 100);
    for (Type type : ALL_TYPES) {
      assertThat(alwaysUnreachable.synthesize(ctx, type).kind())
          .isEqualTo(Expr.Kind.UNREACHABLE);
    }
  }
}
