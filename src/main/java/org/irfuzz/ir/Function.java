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

/**
 * A function defined in a {@link Module}. The function's name, parameters, result and vars are
 * fixed; only its {@link #body} may be changed.
 */
public final class Function {
  public final String name;
  public final ImmutableList<Type> params;
  public final Type result;

  /** Additional locals, numbered after the parameters. */
  public final ImmutableList<Type> vars;

  private Expr body;

  public Function(
      String name, ImmutableList<Type> params, Type result, ImmutableList<Type> vars, Expr body) {
    Preconditions.checkArgument(
        params.stream().allMatch(Type::isConcrete) && vars.stream().allMatch(Type::isConcrete),
        "Locals of %s must be numeric",
        name);
    Preconditions.checkArgument(result != Type.UNREACHABLE, "%s cannot return unreachable", name);
    this.name = name;
    this.params = params;
    this.result = result;
    this.vars = vars;
    this.body = body;
  }

  public Signature signature() {
    return new Signature(params, result);
  }

  public Expr body() {
    return body;
  }

  public void setBody(Expr body) {
    this.body = Preconditions.checkNotNull(body);
  }

  /** The number of locals, including parameters. */
  public int numLocals() {
    return params.size() + vars.size();
  }

  /** Returns the type of the local with the given index. */
  public Type localType(int index) {
    Preconditions.checkElementIndex(index, numLocals());
    return (index < params.size()) ? params.get(index) : vars.get(index - params.size());
  }

  @Override
  public String toString() {
    return name + signature();
  }
}
