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

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ExprWalkerTest {

  private static Module parse(String text) throws ModuleParser.ParseException {
    return ModuleParser.parseModule(text);
  }

  @Test
  public void visitsChildrenBeforeParents() throws Exception {
    Module module =
        parse(
            """
            (module
              (func $f (param) (result i32)
                (block $b i32 (nop) (i32.add (i32.const 1) (i32.const 2)))))
            """);
    List<String> events = new ArrayList<>();
    new ExprWalker() {
      @Override
      protected void enter(Expr expr) {
        events.add("enter " + expr.kind());
      }

      @Override
      protected void exit(Expr expr) {
        events.add("exit " + expr.kind());
      }

      @Override
      protected void visit(Expr expr) {
        events.add("visit " + expr.kind());
      }
    }.walk(module.getFunction("f").body());
    assertThat(events)
        .containsExactly(
            "enter BLOCK",
            "enter NOP",
            "exit NOP",
            "visit NOP",
            "enter BINARY",
            "enter CONST",
            "exit CONST",
            "visit CONST",
            "enter CONST",
            "exit CONST",
            "visit CONST",
            "exit BINARY",
            "visit BINARY",
            "exit BLOCK",
            "visit BLOCK")
        .inOrder();
  }

  @Test
  public void replacementsAreNotWalked() throws Exception {
    Module module =
        parse(
            """
            (module
              (func $f (param) (result i32)
                (i32.add (i32.const 1) (i32.const 2))))
            """);
    Function fn = module.getFunction("f");
    ExprBuilder builder = new ExprBuilder(module);
    List<Expr.Kind> visited = new ArrayList<>();
    new ExprWalker() {
      @Override
      protected void visit(Expr expr) {
        visited.add(expr.kind());
        if (expr.kind() == Expr.Kind.CONST) {
          replaceCurrent(
              builder.makeUnary(UnaryOp.EQZ_I32, builder.makeConst(Literal.ofInt(0))));
        }
      }
    }.walkFunction(fn);
    assertThat(visited)
        .containsExactly(Expr.Kind.CONST, Expr.Kind.CONST, Expr.Kind.BINARY)
        .inOrder();
    assertThat(fn.body().toString())
        .isEqualTo(
            "(i32.add\n  (i32.eqz (i32.const 0))\n  (i32.eqz (i32.const 0)))");
  }

  @Test
  public void rootCanBeReplaced() throws Exception {
    Module module = parse("(module (func $f (param) (result none) (nop)))");
    Function fn = module.getFunction("f");
    new ExprWalker() {
      @Override
      protected void visit(Expr expr) {
        replaceCurrent(new ExprBuilder(module).makeUnreachable());
      }
    }.walkFunction(fn);
    assertThat(fn.body().kind()).isEqualTo(Expr.Kind.UNREACHABLE);
  }
}
