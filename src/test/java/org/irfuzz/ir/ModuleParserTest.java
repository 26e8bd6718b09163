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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ModuleParserTest {

  private static final String PRINTED =
      """
      (module
        (global $g i32)
        (import $log (param i32) (result none))
        (table $f)
        (func $f (param i32) (result i32) (local i64)
          (block $b i32
            (set_local 1 (i64.const -3))
            (call_import $log (get_global $g))
            (loop $l none
              (br_if $l
                (i32.eqz (get_local 0))))
            (if i32 (get_local 0) (i32.const 1) (i32.const 2))))
      )
      """;

  @Test
  public void printsWhatItParsed() throws Exception {
    Module module = ModuleParser.parseModule(PRINTED);
    assertThat(module.toString()).isEqualTo(PRINTED);
    assertThat(Validator.validate(module)).isEmpty();
  }

  @Test
  public void readsDeclarations() throws Exception {
    Module module = ModuleParser.parseModule(PRINTED);
    assertThat(module.getGlobal("g")).isEqualTo(new Global("g", Type.I32));
    assertThat(module.getImport("log").signature()).isEqualTo(Signature.of(Type.NONE, Type.I32));
    assertThat(module.table()).containsExactly("f");
    Function fn = module.getFunction("f");
    assertThat(fn.numLocals()).isEqualTo(2);
    assertThat(fn.localType(1)).isEqualTo(Type.I64);
    assertThat(fn.body().label()).isEqualTo("b");
  }

  @Test
  public void callsMayReferToLaterFunctions() throws Exception {
    Module module =
        ModuleParser.parseModule(
            """
            (module
              (func $a (param) (result f64) (call $b (f32.const 1.5)))
              (func $b (param f32) (result f64) (f64.const 2.25)))
            """);
    assertThat(module.getFunction("a").body().type).isEqualTo(Type.F64);
    assertThat(module.getFunction("a").body().toString()).isEqualTo("(call $b (f32.const 1.5))");
  }

  @Test
  public void skipsComments() throws Exception {
    Module module =
        ModuleParser.parseModule(
            """
            ;; leading
            (module (; a (; nested ;) comment ;)
              (func $f (param) (result none) (nop))) ;; trailing
            """);
    assertThat(module.functions()).hasSize(1);
  }

  @Test
  public void reportsPosition() {
    ModuleParser.ParseException e =
        assertThrows(
            ModuleParser.ParseException.class,
            () -> ModuleParser.parseModule("(module (global $g i128))"));
    assertThat(e).hasMessageThat().isEqualTo("1:20: unknown type i128");
    assertThat(e.line).isEqualTo(1);
    assertThat(e.column).isEqualTo(20);
  }

  @Test
  public void reportsWrongArity() {
    ModuleParser.ParseException e =
        assertThrows(
            ModuleParser.ParseException.class,
            () ->
                ModuleParser.parseModule(
                    "(module\n  (func $f (param) (result i32)\n    (i32.add (i32.const 1))))"));
    assertThat(e).hasMessageThat().isEqualTo("3:5: wrong number of items in (i32.add ...)");
  }

  @Test
  public void reportsTypeErrors() {
    ModuleParser.ParseException e =
        assertThrows(
            ModuleParser.ParseException.class,
            () ->
                ModuleParser.parseModule(
                    "(module (func $f (param) (result i32)"
                        + " (i32.add (i32.const 1) (i64.const 2))))"));
    assertThat(e).hasMessageThat().contains("Right operand of i32.add has type i64, expected i32");
  }

  @Test
  public void reportsUnterminatedComment() {
    ModuleParser.ParseException e =
        assertThrows(
            ModuleParser.ParseException.class, () -> ModuleParser.parseModule("(module (; oops"));
    assertThat(e).hasMessageThat().isEqualTo("1:9: unterminated comment");
  }

  @Test
  public void skipsNestedComments() throws Exception {
    Module module =
        ModuleParser.parseModule(
            """
            ;; leading
            (module (; outer (; inner ;) still outer ;)
              (global $g i64) ;; trailing
            )
            """);
    assertThat(module.getGlobal("g")).isEqualTo(new Global("g", Type.I64));
  }

  @Test
  public void reportsSyntaxErrorPosition() {
    ModuleParser.ParseException e =
        assertThrows(
            ModuleParser.ParseException.class, () -> ModuleParser.parseModule("(module (nop)"));
    assertThat(e.line).isEqualTo(1);
    assertThat(e.column).isEqualTo(14);
    assertThat(e).hasMessageThat().startsWith("1:14: ");
  }

  @Test
  public void rejectsBadNames() {
    assertThrows(
        ModuleParser.ParseException.class,
        () -> ModuleParser.parseModule("(module (func $a/b (param) (result none) (nop)))"));
  }
}
