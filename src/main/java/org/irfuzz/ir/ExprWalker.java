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
import org.jspecify.annotations.Nullable;

/**
 * An ExprWalker visits every node of an expression tree exactly once, in post-order: a node's
 * children are walked left to right (in evaluation order) and then the node itself is passed to
 * {@link #visit}. A visit may call {@link #replaceCurrent} to substitute a different node at the
 * current position; the substitute is not walked.
 *
 * <p>{@link #enter} and {@link #exit} bracket the walk of each node's children, which is where
 * subclasses that track enclosing constructs should push and pop them. Both are called before the
 * node itself is visited.
 */
public abstract class ExprWalker {
  /** The node being visited, or its replacement. Null when not inside {@link #visit}. */
  private @Nullable Expr current;

  /**
   * Walks the tree rooted at {@code root} and returns its root, which will differ from {@code
   * root} if the root was replaced.
   */
  public final Expr walk(Expr root) {
    return walkNode(root);
  }

  /** Walks the function's body, updating it if the root was replaced. */
  public final void walkFunction(Function fn) {
    fn.setBody(walk(fn.body()));
  }

  private Expr walkNode(Expr expr) {
    enter(expr);
    for (int i = 0; i < expr.numChildren(); i++) {
      Expr child = expr.child(i);
      Expr replacement = walkNode(child);
      if (replacement != child) {
        expr.setChild(i, replacement);
      }
    }
    exit(expr);
    assert current == null;
    current = expr;
    try {
      visit(expr);
      return current;
    } finally {
      current = null;
    }
  }

  /** Called before the children of {@code expr} are walked. The default does nothing. */
  protected void enter(Expr expr) {}

  /**
   * Called after the children of {@code expr} have been walked and before {@code expr} is visited.
   * The default does nothing.
   */
  protected void exit(Expr expr) {}

  /** Called once for each node in the tree. */
  protected abstract void visit(Expr expr);

  /** Only valid during {@link #visit}; replaces the node being visited. */
  protected final void replaceCurrent(Expr replacement) {
    Preconditions.checkState(current != null, "replaceCurrent() called outside of visit()");
    current = Preconditions.checkNotNull(replacement);
  }
}
