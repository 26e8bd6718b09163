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

import org.irfuzz.ir.ExprBuilder;
import org.irfuzz.ir.Function;
import org.irfuzz.ir.Module;

/**
 * The mutable state used while mutating a single function, passed explicitly through every
 * synthesis step. The {@link DecisionSource} is shared by all the functions of a run; everything
 * else is created fresh for each function.
 */
public final class FuzzContext {
  public final Module module;
  public final Function function;
  public final ExprBuilder builder;
  public final DecisionSource decisions;
  public final Budget budget;
  public final ScopeStack scopes = new ScopeStack();
  public final NameRegistry names = new NameRegistry();

  public FuzzContext(Module module, Function function, DecisionSource decisions, int budget) {
    this.module = module;
    this.function = function;
    this.builder = new ExprBuilder(module);
    this.decisions = decisions;
    this.budget = new Budget(budget);
  }
}
