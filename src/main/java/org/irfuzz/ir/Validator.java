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

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Checks that functions are well formed: each child's type is compatible with its position, each
 * branch targets an enclosing labeled construct of a matching type, labels are unique within a
 * function, and references to locals, globals, functions and imports resolve.
 *
 * <p>Rather than stopping at the first problem, the Validator returns a description of each one;
 * an empty list means the module is valid.
 */
public final class Validator {

  private Validator() {}

  /** Validates every function of the module. */
  public static ImmutableList<String> validate(Module module) {
    ImmutableList.Builder<String> errors = ImmutableList.builder();
    if (module.hasTable()) {
      for (String name : module.table()) {
        if (module.getFunction(name) == null) {
          errors.add("table: no function named " + name);
        }
      }
    }
    for (Function fn : module.functions()) {
      errors.addAll(validate(module, fn));
    }
    return errors.build();
  }

  /** Validates a single function of the module. */
  public static ImmutableList<String> validate(Module module, Function fn) {
    FunctionChecker checker = new FunctionChecker(module, fn);
    checker.walk(fn.body());
    checker.check(fn.body(), fn.result, "function body");
    assert checker.scopes.isEmpty();
    return checker.errors.build();
  }

  private static class FunctionChecker extends ExprWalker {
    final Module module;
    final Function fn;
    final ImmutableList.Builder<String> errors = ImmutableList.builder();

    /** Labeled blocks and loops enclosing the current position, innermost first. */
    final Deque<Expr> scopes = new ArrayDeque<>();

    final Set<String> labels = new HashSet<>();

    FunctionChecker(Module module, Function fn) {
      this.module = module;
      this.fn = fn;
    }

    void error(String format, Object... args) {
      errors.add(fn.name + ": " + String.format(format, args));
    }

    void check(Expr child, Type expected, String position) {
      if (!Type.isCompatible(child.type, expected)) {
        error("%s has type %s, expected %s", position, child.type, expected);
      }
    }

    void checkOperands(Expr call, List<Type> params, String callee) {
      int numOperands = ((Expr.AbstractCall) call).numOperands();
      if (numOperands != params.size()) {
        error("%s expects %s operands, got %s", callee, params.size(), numOperands);
        return;
      }
      for (int i = 0; i < numOperands; i++) {
        check(call.child(i), params.get(i), "operand " + i + " of " + callee);
      }
    }

    @Override
    protected void enter(Expr expr) {
      String label = expr.label();
      if (label != null) {
        if (!labels.add(label)) {
          error("duplicate label %s", label);
        }
        scopes.push(expr);
      }
    }

    @Override
    protected void exit(Expr expr) {
      if (expr.label() != null) {
        Expr popped = scopes.pop();
        assert popped == expr;
      }
    }

    /**
     * Checks a branch to {@code target}: it must name an enclosing construct, a loop may only be
     * targeted without a value, and a block is targeted with a value of its (numeric) type or, if
     * its type is none, without one.
     */
    void checkTarget(String target, @Nullable Expr value) {
      Expr scope = null;
      for (Expr s : scopes) {
        if (target.equals(s.label())) {
          scope = s;
          break;
        }
      }
      if (scope == null) {
        error("branch to %s, which is not an enclosing label", target);
      } else if (scope.kind() == Expr.Kind.LOOP) {
        if (value != null) {
          error("branch to loop %s cannot carry a value", target);
        }
      } else if (value == null) {
        if (scope.type != Type.NONE) {
          error("branch to %s (type %s) needs a value", target, scope.type);
        }
      } else if (!scope.type.isConcrete()) {
        error("branch to %s (type %s) cannot carry a value", target, scope.type);
      } else {
        check(value, scope.type, "value of branch to " + target);
      }
    }

    @Override
    protected void visit(Expr expr) {
      switch (expr.kind()) {
        case BLOCK -> {
          int n = expr.numChildren();
          for (int i = 0; i < n - 1; i++) {
            check(expr.child(i), Type.NONE, "block element " + i);
          }
          if (n == 0) {
            if (expr.type != Type.NONE) {
              error("empty block has type %s", expr.type);
            }
          } else {
            check(expr.child(n - 1), expr.type, "last block element");
          }
        }
        case LOOP -> check(expr.child(0), expr.type, "loop body");
        case IF -> {
          Expr.If ifExpr = (Expr.If) expr;
          check(ifExpr.condition, Type.I32, "if condition");
          check(ifExpr.ifTrue, expr.type, "if arm");
          if (ifExpr.ifFalse != null) {
            check(ifExpr.ifFalse, expr.type, "else arm");
          } else if (expr.type != Type.NONE) {
            error("one-armed if has type %s", expr.type);
          }
        }
        case BREAK -> {
          Expr.Break br = (Expr.Break) expr;
          checkTarget(br.target, br.value);
          if (br.condition != null) {
            check(br.condition, Type.I32, "branch condition");
          }
          Type expected;
          if (br.condition == null) {
            expected = Type.UNREACHABLE;
          } else if (br.value != null) {
            expected = br.value.type;
          } else {
            expected = Type.NONE;
          }
          // A child that became unreachable makes the branch unreachable too, but the declared type
          // may still be the one it was built with.
          if (expr.type != expected && expected != Type.UNREACHABLE) {
            error("branch to %s has type %s, expected %s", br.target, expr.type, expected);
          }
        }
        case SWITCH -> {
          Expr.Switch sw = (Expr.Switch) expr;
          for (String target : sw.targets) {
            checkTarget(target, sw.value);
          }
          checkTarget(sw.defaultTarget, sw.value);
          check(sw.condition, Type.I32, "switch condition");
        }
        case CALL -> {
          Expr.Call call = (Expr.Call) expr;
          Function callee = module.getFunction(call.target);
          if (callee == null) {
            error("call to unknown function %s", call.target);
          } else {
            checkOperands(call, callee.params, call.target);
            if (expr.type != callee.result) {
              error("call to %s has type %s, expected %s", call.target, expr.type, callee.result);
            }
          }
        }
        case CALL_IMPORT -> {
          Expr.CallImport call = (Expr.CallImport) expr;
          FunctionImport callee = module.getImport(call.target);
          if (callee == null) {
            error("call to unknown import %s", call.target);
          } else {
            checkOperands(call, callee.signature().params(), call.target);
            if (expr.type != callee.signature().result()) {
              error("call to import %s has type %s", call.target, expr.type);
            }
          }
        }
        case CALL_INDIRECT -> {
          Expr.CallIndirect call = (Expr.CallIndirect) expr;
          if (!module.hasTable()) {
            error("call_indirect in a module without a table");
          }
          checkOperands(call, call.signature.params(), "call_indirect");
          check(call.target, Type.I32, "call_indirect target");
        }
        case GET_LOCAL -> {
          Expr.GetLocal get = (Expr.GetLocal) expr;
          if (get.index < 0 || get.index >= fn.numLocals()) {
            error("no local %s", get.index);
          } else if (expr.type != fn.localType(get.index)) {
            error("local %s has type %s, not %s", get.index, fn.localType(get.index), expr.type);
          }
        }
        case SET_LOCAL -> {
          Expr.SetLocal set = (Expr.SetLocal) expr;
          if (set.index < 0 || set.index >= fn.numLocals()) {
            error("no local %s", set.index);
          } else {
            check(set.value, fn.localType(set.index), "value of local " + set.index);
          }
        }
        case GET_GLOBAL -> {
          Expr.GetGlobal get = (Expr.GetGlobal) expr;
          Global global = module.getGlobal(get.name);
          if (global == null) {
            error("no global %s", get.name);
          } else if (expr.type != global.type()) {
            error("global %s has type %s, not %s", get.name, global.type(), expr.type);
          }
        }
        case SET_GLOBAL -> {
          Expr.SetGlobal set = (Expr.SetGlobal) expr;
          Global global = module.getGlobal(set.name);
          if (global == null) {
            error("no global %s", set.name);
          } else {
            check(set.value, global.type(), "value of global " + set.name);
          }
        }
        case LOAD -> check(expr.child(0), Type.I32, "load address");
        case STORE -> {
          Expr.Store store = (Expr.Store) expr;
          check(store.ptr, Type.I32, "store address");
          check(store.value, store.valueType, "stored value");
        }
        case CONST, NOP, UNREACHABLE -> {}
        case UNARY -> {
          Expr.Unary unary = (Expr.Unary) expr;
          check(unary.value, unary.op.operand, "operand of " + unary.op);
        }
        case BINARY -> {
          Expr.Binary binary = (Expr.Binary) expr;
          check(binary.left, binary.op.operand, "left operand of " + binary.op);
          check(binary.right, binary.op.operand, "right operand of " + binary.op);
        }
        case SELECT -> {
          Expr.Select select = (Expr.Select) expr;
          check(select.ifTrue, expr.type, "select arm");
          check(select.ifFalse, expr.type, "select arm");
          check(select.condition, Type.I32, "select condition");
        }
        case DROP -> {
          if (expr.child(0).type == Type.NONE) {
            error("dropped value has type none");
          }
        }
        case RETURN -> {
          Expr.Return ret = (Expr.Return) expr;
          if (fn.result == Type.NONE) {
            if (ret.value != null) {
              error("return with a value from a function returning none");
            }
          } else if (ret.value == null) {
            error("return without a value from a function returning %s", fn.result);
          } else {
            check(ret.value, fn.result, "return value");
          }
        }
        case HOST -> {
          for (int i = 0; i < expr.numChildren(); i++) {
            check(expr.child(i), Type.I32, "operand of " + ((Expr.Host) expr).op.text);
          }
        }
      }
    }
  }
}
