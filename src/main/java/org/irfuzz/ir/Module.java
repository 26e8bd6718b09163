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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A Module is a collection of named functions, function imports and globals, plus an optional
 * table that indirect calls index into. Iteration order is always the order in which the entries
 * were added.
 */
public final class Module {
  private final Map<String, Function> functions = new LinkedHashMap<>();
  private final Map<String, FunctionImport> imports = new LinkedHashMap<>();
  private final Map<String, Global> globals = new LinkedHashMap<>();

  /** The names of the functions in the table, or null if this module has no table. */
  private @Nullable ImmutableList<String> table;

  @CanIgnoreReturnValue
  public Function addFunction(Function fn) {
    Preconditions.checkArgument(
        functions.putIfAbsent(fn.name, fn) == null, "Duplicate function %s", fn.name);
    return fn;
  }

  @CanIgnoreReturnValue
  public FunctionImport addImport(FunctionImport imp) {
    Preconditions.checkArgument(
        imports.putIfAbsent(imp.name(), imp) == null, "Duplicate import %s", imp.name());
    return imp;
  }

  @CanIgnoreReturnValue
  public Global addGlobal(Global global) {
    Preconditions.checkArgument(
        globals.putIfAbsent(global.name(), global) == null, "Duplicate global %s", global.name());
    return global;
  }

  /**
   * Sets the table. Entries are resolved lazily, so the named functions may be added before or
   * after this call.
   */
  public void setTable(ImmutableList<String> table) {
    this.table = Preconditions.checkNotNull(table);
  }

  public boolean hasTable() {
    return table != null;
  }

  /** Returns the table's entries; should only be called if {@link #hasTable} is true. */
  public ImmutableList<String> table() {
    Preconditions.checkState(table != null, "Module has no table");
    return table;
  }

  public Collection<Function> functions() {
    return Collections.unmodifiableCollection(functions.values());
  }

  public Collection<FunctionImport> imports() {
    return Collections.unmodifiableCollection(imports.values());
  }

  public Collection<Global> globals() {
    return Collections.unmodifiableCollection(globals.values());
  }

  public @Nullable Function getFunction(String name) {
    return functions.get(name);
  }

  public @Nullable FunctionImport getImport(String name) {
    return imports.get(name);
  }

  public @Nullable Global getGlobal(String name) {
    return globals.get(name);
  }

  @Override
  public String toString() {
    return ModulePrinter.print(this);
  }
}
