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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Deque;
import org.irfuzz.ir.Type;
import org.jspecify.annotations.Nullable;

/**
 * The labeled blocks and loops that enclose the current position, innermost first. Control flow
 * nesting is lexical, so entries are strictly pushed on entry to a construct and popped on exit.
 *
 * <p>{@link #enterBlock} and {@link #enterLoop} return an {@link Entry} whose {@link Entry#close}
 * pops it, so that a try-with-resources statement keeps the stack balanced on every exit path.
 */
public final class ScopeStack {

  public enum Kind {
    BLOCK,
    LOOP
  }

  /** One open labeled construct. */
  public final class Entry implements AutoCloseable {
    public final String label;
    public final Kind kind;

    /** The block's type; always {@link Type#NONE} for a loop. */
    public final Type type;

    private Entry(String label, Kind kind, Type type) {
      this.label = label;
      this.kind = kind;
      this.type = type;
    }

    /** True if a branch to this construct must carry a value. */
    public boolean carriesValue() {
      return kind == Kind.BLOCK && type.isConcrete();
    }

    /** Pops this entry, which must be the innermost one. */
    @Override
    public void close() {
      Preconditions.checkState(entries.peek() == this, "Scope %s closed out of order", label);
      entries.pop();
    }

    @Override
    public String toString() {
      return (kind == Kind.LOOP) ? "loop $" + label : "block $" + label + " " + type;
    }
  }

  private final Deque<Entry> entries = new ArrayDeque<>();

  public Entry enterBlock(String label, Type type) {
    return push(new Entry(label, Kind.BLOCK, type));
  }

  public Entry enterLoop(String label) {
    return push(new Entry(label, Kind.LOOP, Type.NONE));
  }

  private Entry push(Entry entry) {
    entries.push(entry);
    return entry;
  }

  /** Pops the innermost entry. */
  public void exit() {
    Preconditions.checkState(!entries.isEmpty(), "exit() without a matching enter()");
    entries.pop();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public int size() {
    return entries.size();
  }

  /**
   * Returns the constructs that a branch may target, innermost first. If {@code valueType} is
   * non-null the branch carries a value of that type, and only blocks of the same type qualify;
   * otherwise loops and blocks of type {@link Type#NONE} qualify.
   */
  public ImmutableList<Entry> eligibleTargets(@Nullable Type valueType) {
    return entries.stream()
        .filter(
            e ->
                (valueType == null)
                    ? (e.kind == Kind.LOOP || e.type == Type.NONE)
                    : (e.kind == Kind.BLOCK && e.type == valueType))
        .collect(toImmutableList());
  }

  /**
   * Returns every construct that some branch could target (with a value if {@link
   * Entry#carriesValue}, without one otherwise), innermost first. Only blocks of type {@link
   * Type#UNREACHABLE} are excluded.
   */
  public ImmutableList<Entry> allTargets() {
    return entries.stream()
        .filter(e -> e.type != Type.UNREACHABLE)
        .collect(toImmutableList());
  }

  @Override
  public String toString() {
    return entries.toString();
  }
}
