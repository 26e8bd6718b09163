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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.flogger.FluentLogger;
import java.util.ArrayDeque;
import java.util.Deque;
import org.irfuzz.ir.Expr;
import org.irfuzz.ir.ExprWalker;
import org.irfuzz.ir.Function;
import org.irfuzz.ir.Module;
import org.irfuzz.pass.Pass;

/**
 * Randomly replaces expressions with newly synthesized expressions of the same type.
 *
 * <p>Each function's body is walked once; every node is considered for replacement after its
 * children have been walked, with probability {@link FuzzOptions#replacePercent}. A replacement is
 * never revisited, and can only branch to the labeled constructs that strictly enclose the node it
 * replaces. Blocks and loops that define a label are never replaced, so that existing branches to
 * them stay valid.
 *
 * <p>The functions are mutated in module order, drawing from a single {@link DecisionSource}
 * seeded with {@link FuzzOptions#seed}, so running the pass twice on equal modules with equal
 * options produces equal results.
 */
public final class FuzzPass implements Pass {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final FuzzOptions options;
  private final Synthesizer synthesizer;

  public FuzzPass(FuzzOptions options) {
    this.options = options;
    this.synthesizer = new Synthesizer(options);
  }

  @Override
  public String name() {
    return "fuzz";
  }

  public FuzzOptions options() {
    return options;
  }

  @Override
  public void run(Module module) {
    DecisionSource decisions = new DecisionSource(options.seed());
    for (Function fn : module.functions()) {
      mutateFunction(module, fn, decisions);
    }
  }

  private void mutateFunction(Module module, Function fn, DecisionSource decisions) {
    FuzzContext ctx = new FuzzContext(module, fn, decisions, options.budget());
    ctx.names.scan(fn.body());
    Mutator mutator = new Mutator(ctx);
    mutator.walkFunction(fn);
    Preconditions.checkState(ctx.scopes.isEmpty(), "Unbalanced scopes after %s", fn.name);
    logger.atFine().log(
        "%s: %s replacements, budget %s", fn.name, mutator.replacements, ctx.budget);
  }

  /** Walks a function body, replacing nodes and tracking the labeled constructs around them. */
  @VisibleForTesting
  class Mutator extends ExprWalker {
    final FuzzContext ctx;
    int replacements;

    /** The entries for the labeled constructs currently being walked, innermost first. */
    private final Deque<ScopeStack.Entry> open = new ArrayDeque<>();

    Mutator(FuzzContext ctx) {
      this.ctx = ctx;
    }

    @Override
    protected void enter(Expr expr) {
      String label = expr.label();
      if (label == null) {
        return;
      }
      open.push(
          (expr.kind() == Expr.Kind.LOOP)
              ? ctx.scopes.enterLoop(label)
              : ctx.scopes.enterBlock(label, expr.type));
    }

    @Override
    protected void exit(Expr expr) {
      if (expr.label() != null) {
        ScopeStack.Entry entry = open.pop();
        Preconditions.checkState(
            entry.label.equals(expr.label()), "Exiting $%s inside %s", expr.label(), entry);
        entry.close();
      }
    }

    @Override
    protected void visit(Expr expr) {
      if (!ctx.decisions.chance(options.replacePercent()) || expr.label() != null) {
        return;
      }
      replaceCurrent(synthesizer.synthesize(ctx, expr.type));
      replacements++;
    }
  }
}
