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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.irfuzz.ir.Module;
import org.irfuzz.ir.ModuleParser;
import org.irfuzz.ir.Validator;
import org.irfuzz.testing.TestdataScanner;
import org.irfuzz.testing.TestdataScanner.TestModule;
import org.junit.Test;
import org.junit.runner.RunWith;

/** Mutates each module in the testdata directory with several seeds. */
@RunWith(TestParameterInjector.class)
public class FuzzPassTestdataTest {

  private static final Path TESTDATA = Path.of("src/test/java/org/irfuzz/fuzz/testdata");

  /**
   * Each module is followed by a comment "{@code (; FUZZ ;)}", optionally listing option overrides
   * such as {@code replace=20 divergent=0 budget=50}.
   */
  private static final Pattern COMMENT_PATTERN =
      Pattern.compile("\n\\(; FUZZ(.*?);\\)\n*", Pattern.DOTALL);

  private static final Pattern OPTION_PATTERN = Pattern.compile("(\\w+)=(\\d+)");

  public static final class AllModules extends TestdataScanner {
    public AllModules() {
      super(TESTDATA, COMMENT_PATTERN);
    }
  }

  private static FuzzOptions options(String comment, long seed) {
    FuzzOptions.Builder builder = FuzzOptions.builder().setSeed(seed);
    Matcher matcher = OPTION_PATTERN.matcher(comment);
    while (matcher.find()) {
      int value = Integer.parseInt(matcher.group(2));
      switch (matcher.group(1)) {
        case "replace" -> builder.setReplacePercent(value);
        case "divergent" -> builder.setDivergentPercent(value);
        case "budget" -> builder.setBudget(value);
        case "blockSize" -> builder.setMaxBlockSize(value);
        default -> throw new AssertionError("Unknown option " + matcher.group());
      }
    }
    return builder.build();
  }

  @Test
  public void fuzzTestdata(
      @TestParameter(valuesProvider = AllModules.class) TestModule testModule,
      @TestParameter({"1", "42", "20251018"}) long seed)
      throws Exception {
    checkNotNull(testModule.comment(), "No FUZZ comment found");
    FuzzOptions options = options(testModule.comment(), seed);

    Module module = ModuleParser.parseModule(testModule.text());
    assertWithMessage("input is invalid").that(Validator.validate(module)).isEmpty();
    new FuzzPass(options).run(module);
    String printed = module.toString();
    assertWithMessage("%s:\n%s", options, printed).that(Validator.validate(module)).isEmpty();

    // The output can be read back, and mutating again from scratch gives the same result.
    assertThat(ModuleParser.parseModule(printed).toString()).isEqualTo(printed);
    Module again = ModuleParser.parseModule(testModule.text());
    new FuzzPass(options).run(again);
    assertThat(again.toString()).isEqualTo(printed);
  }
}
