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

package org.irfuzz.tools;

import com.google.common.base.Splitter;
import com.google.common.flogger.FluentLogger;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.irfuzz.fuzz.FuzzOptions;
import org.irfuzz.ir.Module;
import org.irfuzz.ir.ModuleParser;
import org.irfuzz.pass.PassRunner;
import org.jspecify.annotations.Nullable;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

/**
 * Reads a module in text form, runs a sequence of passes over it, and prints the result.
 *
 * <pre>
 * FuzzMain [--seed=N] [--budget=N] [--replace=N] [--divergent=N] [--passes=fuzz,...]
 *     [--no-validate] [-o OUTPUT] INPUT
 * </pre>
 *
 * Options that are not given default to the {@code irfuzz.*} system properties read by {@link
 * FuzzOptions#fromSystemProperties}.
 */
public final class FuzzMain {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  @Option(name = "--seed", usage = "Seed for the pseudorandom decisions")
  private @Nullable Long seed;

  @Option(name = "--budget", usage = "Maximum number of nodes synthesized per function")
  private @Nullable Integer budget;

  @Option(name = "--replace", usage = "Percent chance that each node is replaced")
  private @Nullable Integer replacePercent;

  @Option(name = "--divergent", usage = "Percent chance that a synthesized node is unreachable")
  private @Nullable Integer divergentPercent;

  @Option(name = "--passes", usage = "Comma-separated list of passes to run")
  private String passes = "fuzz";

  @Option(name = "--no-validate", usage = "Don't validate the module after each pass")
  private boolean noValidate = false;

  @Option(name = "-o", aliases = "--output", usage = "Write the result here instead of stdout")
  private @Nullable Path output;

  @Argument(metaVar = "INPUT", required = true, usage = "The module to transform")
  private Path input;

  public static void main(String[] args) {
    System.exit(new FuzzMain().run(args, System.out, System.err));
  }

  /** Runs the tool and returns its exit status. */
  int run(String[] args, PrintStream out, PrintStream err) {
    CmdLineParser parser = new CmdLineParser(this);
    try {
      parser.parseArgument(args);
    } catch (CmdLineException e) {
      err.println(e.getMessage());
      err.println("Usage: FuzzMain [options] INPUT");
      parser.printUsage(err);
      return 1;
    }
    try {
      String text = Files.readString(input, StandardCharsets.UTF_8);
      Module module = ModuleParser.parseModule(text);
      PassRunner runner = new PassRunner(options()).setValidate(!noValidate);
      for (String name : Splitter.on(',').trimResults().omitEmptyStrings().split(passes)) {
        runner.add(name);
      }
      logger.atInfo().log("Running %s on %s", passes, input);
      runner.run(module);
      String result = module.toString();
      if (output == null) {
        out.print(result);
      } else {
        Files.writeString(output, result, StandardCharsets.UTF_8);
      }
      return 0;
    } catch (IOException e) {
      err.println("I/O error: " + e.getMessage());
    } catch (ModuleParser.ParseException e) {
      err.println(input + ":" + e.getMessage());
    } catch (IllegalArgumentException | IllegalStateException e) {
      err.println(e.getMessage());
    }
    return 1;
  }

  private FuzzOptions options() {
    FuzzOptions.Builder builder = FuzzOptions.fromSystemProperties().toBuilder();
    if (seed != null) {
      builder.setSeed(seed);
    }
    if (budget != null) {
      builder.setBudget(budget);
    }
    if (replacePercent != null) {
      builder.setReplacePercent(replacePercent);
    }
    if (divergentPercent != null) {
      builder.setDivergentPercent(divergentPercent);
    }
    return builder.build();
  }
}
