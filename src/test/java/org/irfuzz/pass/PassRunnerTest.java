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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.irfuzz.fuzz.FuzzOptions;
import org.irfuzz.fuzz.FuzzPass;
import org.irfuzz.ir.ExprBuilder;
import org.irfuzz.ir.Module;
import org.irfuzz.ir.ModuleParser;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class PassRunnerTest {

  private static final String MODULE =
      """
      (module
        (func $f (param i32) (result i32)
          (block $b i32
            (drop (get_local 0))
            (i32.add (get_local 0) (i32.const 1)))))
      """;

  /** Replaces every function body with a nop, which is only valid for functions returning none. */
  private static final class ClearBodies implements Pass {
    @Override
    public String name() {
      return "clear";
    }

    @Override
    public void run(Module module) {
      ExprBuilder builder = new ExprBuilder(module);
      module.functions().forEach(fn -> fn.setBody(builder.makeNop()));
    }
  }

  @Test
  public void namedPasses() {
    assertThat(PassRunner.passNames()).containsExactly("fuzz");
    FuzzOptions options = FuzzOptions.builder().setSeed(3).build();
    PassRunner runner = new PassRunner(options).add("fuzz");
    assertThat(runner.passes()).hasSize(1);
    assertThat(((FuzzPass) runner.passes().get(0)).options()).isSameInstanceAs(options);
  }

  @Test
  public void unknownPassName() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class, () -> new PassRunner(FuzzOptions.DEFAULT).add("nope"));
    assertThat(e).hasMessageThat().contains("Unknown pass 'nope'");
  }

  @Test
  public void runsFuzzRepeatedly() throws Exception {
    Module module = ModuleParser.parseModule(MODULE);
    new PassRunner(FuzzOptions.builder().setReplacePercent(50).build())
        .add("fuzz")
        .add("fuzz")
        .run(module);
    assertThat(module.getFunction("f").body().label()).isEqualTo("b");
  }

  @Test
  public void invalidResultIsReported() throws Exception {
    Module module = ModuleParser.parseModule(MODULE);
    PassRunner runner = new PassRunner(FuzzOptions.DEFAULT).add(new ClearBodies());
    IllegalStateException e = assertThrows(IllegalStateException.class, () -> runner.run(module));
    assertThat(e).hasMessageThat().contains("Invalid module after clear");
    assertThat(e).hasMessageThat().contains("f: function body has type none, expected i32");
  }

  @Test
  public void validationCanBeDisabled() throws Exception {
    Module module = ModuleParser.parseModule(MODULE);
    new PassRunner(FuzzOptions.DEFAULT).add(new ClearBodies()).setValidate(false).run(module);
    assertThat(module.getFunction("f").body().toString()).isEqualTo("(nop)");
  }
}
