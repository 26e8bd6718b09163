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
import static org.junit.Assert.assertThrows;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.irfuzz.ir.Expr;
import org.irfuzz.ir.ExprWalker;
import org.irfuzz.ir.Function;
import org.irfuzz.ir.Module;
import org.irfuzz.ir.ModuleParser;
import org.irfuzz.ir.Validator;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class FuzzPassTest {

  private static final String MODULE =
      """
      (module
        (global $counter i32)
        (import $log (param i32) (result none))
        (table $fib)
        (func $fib (param i32) (result i32) (local i32 i32)
          (block $fuzz$1 i32
            (set_local 2 (i32.const 1))
            (loop $again none
              (block $body none
                (br_if $body
                  (i32.lt_s (get_local 0) (i32.const 1)))
                (set_local 2 (i32.add (get_local 1) (get_local 2)))
                (set_local 0 (i32.sub (get_local 0) (i32.const 1)))
                (br $again)))
            (call_import $log (get_local 2))
            (get_local 2)))
        (func $main (param) (result none)
          (set_global $counter (call $fib (i32.const 10)))))
      """;

  private static Module mutate(String text, FuzzOptions options) throws Exception {
    Module module = ModuleParser.parseModule(text);
    new FuzzPass(options).run(module);
    return module;
  }

  private static List<String> labels(Expr body) {
    List<String> labels = new ArrayList<>();
    new ExprWalker() {
      @Override
      protected void visit(Expr expr) {
        if (expr.label() != null) {
          labels.add(expr.label());
        }
      }
    }.walk(body);
    return labels;
  }

  @Test
  public void mutatedModulesValidate() throws Exception {
    for (int replace : new int[] {5, 30, 100}) {
      for (long seed = 0; seed < 50; seed++) {
        FuzzOptions options =
            FuzzOptions.builder().setSeed(seed).setReplacePercent(replace).build();
        Module module = mutate(MODULE, options);
        assertWithMessage("%s:\n%s", options, module)
            .that(Validator.validate(module))
            .isEmpty();
      }
    }
  }

  @Test
  public void mutatorClosesScopesInOrder() throws Exception {
    Module module =
        ModuleParser.parseModule(
            "(module (func $f (param) (result none) (block $outer none (nop))))");
    Function fn = module.getFunction("f");
    FuzzContext ctx = new FuzzContext(module, fn, new DecisionSource(1), 10);
    FuzzPass.Mutator mutator = new FuzzPass(FuzzOptions.DEFAULT).new Mutator(ctx);
    Expr outer = fn.body();

    mutator.enter(outer);
    assertThat(ctx.scopes.allTargets().get(0).label).isEqualTo("outer");
    mutator.exit(outer);
    assertThat(ctx.scopes.isEmpty()).isTrue();

    // A scope left open inside the block makes the block's exit fail rather than pop it.
    mutator.enter(outer);
    ctx.scopes.enterLoop("stray");
    assertThrows(IllegalStateException.class, () -> mutator.exit(outer));
  }

  @Test
  public void sameSeedSameOutput() throws Exception {
    FuzzOptions options = FuzzOptions.builder().setSeed(1234).setReplacePercent(40).build();
    assertThat(mutate(MODULE, options).toString())
        .isEqualTo(mutate(MODULE, options).toString());
  }

  @Test
  public void differentSeedsDiverge() throws Exception {
    Set<String> outputs = new HashSet<>();
    for (long seed = 0; seed < 10; seed++) {
      outputs.add(
          mutate(MODULE, FuzzOptions.builder().setSeed(seed).setReplacePercent(50).build())
              .toString());
    }
    assertThat(outputs.size()).isGreaterThan(1);
  }

  @Test
  public void noReplacementsLeavesModuleUnchanged() throws Exception {
    Module module = mutate(MODULE, FuzzOptions.builder().setReplacePercent(0).build());
    assertThat(module.toString()).isEqualTo(ModuleParser.parseModule(MODULE).toString());
  }

  @Test
  public void labelsStayUnique() throws Exception {
    for (long seed = 0; seed < 50; seed++) {
      Module module =
          mutate(MODULE, FuzzOptions.builder().setSeed(seed).setReplacePercent(60).build());
      for (Function fn : module.functions()) {
        List<String> labels = labels(fn.body());
        assertWithMessage("seed %s: %s", seed, labels)
            .that(labels)
            .containsNoDuplicates();
      }
    }
  }

  /**
   * A labeled block of three leaves, with every node replaced: each leaf is replaced but the block
   * and its label survive.
   */
  @Test
  public void fullReplacementKeepsLabeledBlock() throws Exception {
    Module module =
        ModuleParser.parseModule(
            """
            (module
              (func $f (param) (result none)
                (block $keep none (nop) (nop) (nop))))
            """);
    Function fn = module.getFunction("f");
    Expr block = fn.body();
    List<Expr> leaves = new ArrayList<>();
    for (int i = 0; i < 3; i++) {
      leaves.add(block.child(i));
    }

    new FuzzPass(FuzzOptions.builder().setReplacePercent(100).build()).run(module);

    assertThat(fn.body()).isSameInstanceAs(block);
    assertThat(block.label()).isEqualTo("keep");
    assertThat(block.numChildren()).isEqualTo(3);
    for (int i = 0; i < 3; i++) {
      assertThat(block.child(i)).isNotSameInstanceAs(leaves.get(i));
    }
    assertThat(Validator.validate(module)).isEmpty();
  }

  @Test
  public void growthIsBoundedByBudget() throws Exception {
    int budget = 25;
    Module original = ModuleParser.parseModule(MODULE);
    Module module =
        mutate(
            MODULE,
            FuzzOptions.builder().setSeed(5).setReplacePercent(100).setBudget(budget).build());
    for (Function fn : module.functions()) {
      int before = countReachableKinds(original.getFunction(fn.name).body());
      int after = countReachableKinds(fn.body());
      assertThat(after).isLessThan(before + budget);
    }
  }

  /** Counts the nodes other than {@code unreachable}, each of which used up some budget. */
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
}
