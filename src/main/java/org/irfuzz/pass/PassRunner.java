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

package org.irfuzz.pass;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.flogger.FluentLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.irfuzz.fuzz.FuzzOptions;
import org.irfuzz.fuzz.FuzzPass;
import org.irfuzz.ir.Module;
import org.irfuzz.ir.Validator;

/**
 * Runs a sequence of passes over a module, optionally validating the module after each one.
 *
 * <p>Passes are added either directly or by name; {@link #passNames} lists the names that {@link
 * #add(String)} accepts.
 */
public final class PassRunner {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Creates each named pass from the options it should use. */
  private static final ImmutableSortedMap<String, Function<FuzzOptions, Pass>> REGISTRY =
      ImmutableSortedMap.of("fuzz", FuzzPass::new);

  private final FuzzOptions options;
  private final List<Pass> passes = new ArrayList<>();
  private boolean validate = true;

  public PassRunner(FuzzOptions options) {
    this.options = options;
  }

  public static ImmutableList<String> passNames() {
    return REGISTRY.keySet().asList();
  }

  @CanIgnoreReturnValue
  public PassRunner add(Pass pass) {
    passes.add(Preconditions.checkNotNull(pass));
    return this;
  }

  /** Adds the pass with the given name; throws IllegalArgumentException if there is none. */
  @CanIgnoreReturnValue
  public PassRunner add(String name) {
    Function<FuzzOptions, Pass> factory = REGISTRY.get(name);
    Preconditions.checkArgument(
        factory != null, "Unknown pass '%s' (expected one of %s)", name, passNames());
    return add(factory.apply(options));
  }

  /** If true (the default), the module is validated after each pass. */
  @CanIgnoreReturnValue
  public PassRunner setValidate(boolean validate) {
    this.validate = validate;
    return this;
  }

  public ImmutableList<Pass> passes() {
    return ImmutableList.copyOf(passes);
  }

  /**
   * Runs each pass in turn. If validation is enabled and the module is invalid after some pass,
   * throws an IllegalStateException listing the problems.
   */
  public void run(Module module) {
    for (Pass pass : passes) {
      logger.atFine().log("Running %s", pass.name());
      pass.run(module);
      if (validate) {
        ImmutableList<String> errors = Validator.validate(module);
        if (!errors.isEmpty()) {
          logger.atWarning().log("%s produced an invalid module:\n%s", pass.name(), module);
          throw new IllegalStateException(
              String.format(
                  "Invalid module after %s:\n  %s", pass.name(), String.join("\n  ", errors)));
        }
      }
    }
  }
}
