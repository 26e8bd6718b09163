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

import java.util.HashSet;
import java.util.Set;
import org.irfuzz.ir.Expr;
import org.irfuzz.ir.ExprWalker;

/**
 * Hands out labels for synthesized blocks and loops. Each label is {@link #PREFIX} followed by a
 * counter; labels that were already present in the function (see {@link #scan}) or that have
 * already been allocated are skipped.
 */
public final class NameRegistry {
  public static final String PREFIX = "fuzz$";

  private final Set<String> names = new HashSet<>();
  private int next;

  /** Records every label defined in the given tree. */
  public void scan(Expr body) {
    new ExprWalker() {
      @Override
      protected void visit(Expr expr) {
        String label = expr.label();
        if (label != null) {
          names.add(label);
        }
      }
    }.walk(body);
  }

  /** Returns a label that is distinct from every recorded or previously allocated label. */
  public String allocate() {
    for (; ; ) {
      String name = PREFIX + next++;
      if (names.add(name)) {
        return name;
      }
    }
  }

  public boolean contains(String name) {
    return names.contains(name);
  }
}
