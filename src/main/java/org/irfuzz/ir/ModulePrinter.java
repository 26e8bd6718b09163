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

import org.irfuzz.util.StringUtil;
import org.jspecify.annotations.Nullable;

/**
 * Renders a Module or Expr in the text format read by {@link ModuleParser}. The output
 * depends only on the tree's contents, so two structurally identical trees always print
 * identically.
 *
 * <p>A node whose children are all leaves is printed on one line; otherwise each child starts a new
 * line, indented two spaces more than its parent.
 */
public final class ModulePrinter {
  private static final String INDENT = "  ";

  private final StringBuilder sb = new StringBuilder();

  private ModulePrinter() {}

  public static String print(Module module) {
    ModulePrinter printer = new ModulePrinter();
    printer.printModule(module);
    return printer.sb.toString();
  }

  public static String print(Expr expr) {
    ModulePrinter printer = new ModulePrinter();
    printer.printExpr(expr, "");
    return printer.sb.toString();
  }

  private void printModule(Module module) {
    sb.append("(module\n");
    for (Global global : module.globals()) {
      sb.append(INDENT)
          .append("(global $")
          .append(global.name())
          .append(' ')
          .append(global.type())
          .append(")\n");
    }
    for (FunctionImport imp : module.imports()) {
      sb.append(INDENT)
          .append("(import $")
          .append(imp.name())
          .append(' ')
          .append(imp.signature())
          .append(")\n");
    }
    if (module.hasTable()) {
      sb.append(INDENT)
          .append(
              StringUtil.joinElements(
                  "", "(table", ")", module.table().size(), i -> " $" + module.table().get(i)))
          .append('\n');
    }
    for (Function fn : module.functions()) {
      sb.append(INDENT);
      printFunction(fn, INDENT);
      sb.append('\n');
    }
    sb.append(")\n");
  }

  private void printFunction(Function fn, String indent) {
    sb.append("(func $").append(fn.name).append(' ').append(fn.signature());
    if (!fn.vars.isEmpty()) {
      sb.append(
          StringUtil.joinElements("", " (local", ")", fn.vars.size(), i -> " " + fn.vars.get(i)));
    }
    String childIndent = indent + INDENT;
    sb.append('\n').append(childIndent);
    printExpr(fn.body(), childIndent);
    sb.append(')');
  }

  private void printExpr(Expr expr, String indent) {
    sb.append('(');
    printHead(expr);
    int n = expr.numChildren();
    boolean inline = true;
    for (int i = 0; i < n; i++) {
      if (expr.child(i).numChildren() != 0) {
        inline = false;
        break;
      }
    }
    String childIndent = indent + INDENT;
    for (int i = 0; i < n; i++) {
      if (inline) {
        sb.append(' ');
      } else {
        sb.append('\n').append(childIndent);
      }
      printExpr(expr.child(i), childIndent);
    }
    sb.append(')');
  }

  /** Appends everything that comes before a node's children. */
  private void printHead(Expr expr) {
    switch (expr.kind()) {
      case BLOCK -> {
        sb.append("block");
        appendLabel(expr.label());
        sb.append(' ').append(expr.type);
      }
      case LOOP -> {
        sb.append("loop");
        appendLabel(expr.label());
        sb.append(' ').append(expr.type);
      }
      case IF -> sb.append("if ").append(expr.type);
      case BREAK -> {
        Expr.Break br = (Expr.Break) expr;
        sb.append(br.isConditional() ? "br_if" : "br");
        appendLabel(br.target);
      }
      case SWITCH -> {
        Expr.Switch sw = (Expr.Switch) expr;
        sb.append("br_table");
        sw.targets.forEach(this::appendLabel);
        appendLabel(sw.defaultTarget);
      }
      case CALL -> {
        sb.append("call");
        appendLabel(((Expr.Call) expr).target);
      }
      case CALL_IMPORT -> {
        sb.append("call_import");
        appendLabel(((Expr.CallImport) expr).target);
      }
      case CALL_INDIRECT ->
          sb.append("call_indirect ").append(((Expr.CallIndirect) expr).signature);
      case GET_LOCAL -> sb.append("get_local ").append(((Expr.GetLocal) expr).index);
      case SET_LOCAL -> sb.append("set_local ").append(((Expr.SetLocal) expr).index);
      case GET_GLOBAL -> {
        sb.append("get_global");
        appendLabel(((Expr.GetGlobal) expr).name);
      }
      case SET_GLOBAL -> {
        sb.append("set_global");
        appendLabel(((Expr.SetGlobal) expr).name);
      }
      case LOAD -> sb.append(expr.type).append(".load");
      case STORE -> sb.append(((Expr.Store) expr).valueType).append(".store");
      case CONST -> {
        Expr.Const c = (Expr.Const) expr;
        sb.append(c.type).append(".const ").append(c.value);
      }
      case UNARY -> sb.append(((Expr.Unary) expr).op);
      case BINARY -> sb.append(((Expr.Binary) expr).op);
      case SELECT -> sb.append("select");
      case DROP -> sb.append("drop");
      case RETURN -> sb.append("return");
      case HOST -> sb.append(((Expr.Host) expr).op.text);
      case NOP -> sb.append("nop");
      case UNREACHABLE -> sb.append("unreachable");
    }
  }

  private void appendLabel(@Nullable String label) {
    if (label != null) {
      sb.append(" $").append(label);
    }
  }
}
