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
import java.util.ArrayList;
import java.util.List;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.irfuzz.ir.WastParser.ItemContext;
import org.irfuzz.ir.WastParser.SexprContext;
import org.irfuzz.util.StringUtil;
import org.jspecify.annotations.Nullable;

/**
 * Reads the text format written by {@link ModulePrinter}. Line comments start with {@code ;;} and
 * block comments are enclosed in {@code (;} and {@code ;)}.
 *
 * <p>Parsing happens in two steps: the generated {@link WastParser} splits the text into a tree of
 * s-expressions, which is then converted to a Module. All functions are declared before any body
 * is converted, so calls may refer to functions defined later in the text.
 */
public final class ModuleParser {

  /** Thrown for malformed input; the message includes the line and column of the problem. */
  public static class ParseException extends Exception {
    public final int line;
    public final int column;

    ParseException(String message, int line, int column) {
      super(String.format("%d:%d: %s", line, column, message));
      this.line = line;
      this.column = column;
    }
  }

  /** Remembers the first syntax error reported by the lexer or the parser. */
  private static class FirstErrorListener extends BaseErrorListener {
    @Nullable ParseException error;

    @Override
    public void syntaxError(
        Recognizer<?, ?> recognizer,
        Object offendingSymbol,
        int line,
        int charPositionInLine,
        String msg,
        RecognitionException e) {
      if (error != null) {
        return;
      }
      if (offendingSymbol instanceof Token token
          && token.getType() == WastLexer.UNTERMINATED_COMMENT) {
        msg = "unterminated comment";
      }
      error = new ParseException(msg, line, charPositionInLine + 1);
    }
  }

  private ModuleParser() {}

  /** Parses a complete {@code (module ...)}. */
  public static Module parseModule(String source) throws ParseException {
    FirstErrorListener errors = new FirstErrorListener();
    WastLexer lexer = new WastLexer(CharStreams.fromString(source));
    lexer.removeErrorListeners();
    lexer.addErrorListener(errors);
    WastParser parser = new WastParser(new CommonTokenStream(lexer));
    parser.removeErrorListeners();
    parser.addErrorListener(errors);
    SexprContext top = parser.top().sexpr();
    if (errors.error != null) {
      throw errors.error;
    }
    return new ModuleConverter().convert(top);
  }

  /** Converts the parse tree to a Module. */
  private static class ModuleConverter {
    final Module module = new Module();
    final ExprBuilder builder = new ExprBuilder(module);

    static ParseException error(ParserRuleContext node, String format, Object... args) {
      Token start = node.getStart();
      return new ParseException(
          String.format(format, args), start.getLine(), start.getCharPositionInLine() + 1);
    }

    static SexprContext asList(ItemContext node) throws ParseException {
      if (node.sexpr() != null) {
        return node.sexpr();
      }
      throw error(node, "expected '('");
    }

    static String atom(ItemContext node) throws ParseException {
      if (node.ATOM() != null) {
        return node.ATOM().getText();
      }
      throw error(node, "expected an atom");
    }

    static int size(SexprContext list) {
      return list.item().size();
    }

    /** Returns the text of the list's first item, which must be an atom. */
    static String head(SexprContext list) throws ParseException {
      if (size(list) == 0) {
        throw error(list, "empty list");
      }
      return atom(list.item(0));
    }

    static boolean isName(ItemContext node) {
      if (node.ATOM() == null) {
        return false;
      }
      String text = node.ATOM().getText();
      return text.startsWith("$") && StringUtil.isPlainName(text.substring(1));
    }

    static String name(ItemContext node) throws ParseException {
      if (!isName(node)) {
        throw error(node, "expected a $name");
      }
      return node.ATOM().getText().substring(1);
    }

    static Type type(ItemContext node) throws ParseException {
      Type type = Type.fromText(atom(node));
      if (type == null) {
        throw error(node, "unknown type %s", atom(node));
      }
      return type;
    }

    static int integer(ItemContext node) throws ParseException {
      try {
        return Integer.parseInt(atom(node));
      } catch (NumberFormatException e) {
        throw error(node, "expected an integer");
      }
    }

    static void checkSize(SexprContext list, int min, int max) throws ParseException {
      if (size(list) < min || size(list) > max) {
        throw error(list, "wrong number of items in (%s ...)", head(list));
      }
    }

    /** Builder-style holder for a {@code (param ...) (result ...) (local ...)} sequence. */
    static final class Header {
      final List<Type> params = new ArrayList<>();
      final List<Type> locals = new ArrayList<>();
      Type result = Type.NONE;

      /**
       * Consumes param, result and local lists starting at {@code from}; returns the index of the
       * first item that isn't one of those.
       */
      int read(SexprContext list, int from) throws ParseException {
        int i = from;
        for (; i < size(list); i++) {
          SexprContext sub = list.item(i).sexpr();
          if (sub == null || size(sub) == 0) {
            break;
          }
          String head = head(sub);
          List<Type> target;
          if (head.equals("param")) {
            target = params;
          } else if (head.equals("local")) {
            target = locals;
          } else if (head.equals("result")) {
            checkSize(sub, 2, 2);
            result = type(sub.item(1));
            continue;
          } else {
            break;
          }
          for (int j = 1; j < size(sub); j++) {
            target.add(type(sub.item(j)));
          }
        }
        return i;
      }

      Signature signature(ParserRuleContext where) throws ParseException {
        try {
          return new Signature(ImmutableList.copyOf(params), result);
        } catch (IllegalArgumentException e) {
          throw error(where, "%s", e.getMessage());
        }
      }
    }

    Module convert(SexprContext top) throws ParseException {
      if (!head(top).equals("module")) {
        throw error(top, "expected (module ...)");
      }
      // Declare everything first, remembering the function bodies to convert afterwards.
      List<Function> functions = new ArrayList<>();
      List<ItemContext> bodies = new ArrayList<>();
      for (int i = 1; i < size(top); i++) {
        SexprContext item = asList(top.item(i));
        switch (head(item)) {
          case "global" -> {
            checkSize(item, 3, 3);
            if (module.getGlobal(name(item.item(1))) != null) {
              throw error(item, "duplicate global");
            }
            Type type = type(item.item(2));
            if (!type.isConcrete()) {
              throw error(item, "a global must be numeric");
            }
            module.addGlobal(new Global(name(item.item(1)), type));
          }
          case "import" -> {
            checkSize(item, 2, Integer.MAX_VALUE);
            String name = name(item.item(1));
            Header header = new Header();
            if (header.read(item, 2) != size(item) || !header.locals.isEmpty()) {
              throw error(item, "malformed import");
            }
            if (module.getImport(name) != null) {
              throw error(item, "duplicate import %s", name);
            }
            module.addImport(new FunctionImport(name, header.signature(item)));
          }
          case "table" -> {
            ImmutableList.Builder<String> entries = ImmutableList.builder();
            for (int j = 1; j < size(item); j++) {
              entries.add(name(item.item(j)));
            }
            module.setTable(entries.build());
          }
          case "func" -> {
            checkSize(item, 3, Integer.MAX_VALUE);
            String name = name(item.item(1));
            Header header = new Header();
            int bodyIndex = header.read(item, 2);
            if (bodyIndex != size(item) - 1) {
              throw error(item, "a function must have exactly one body expression");
            }
            if (module.getFunction(name) != null) {
              throw error(item, "duplicate function %s", name);
            }
            Signature signature = header.signature(item);
            if (!header.locals.stream().allMatch(Type::isConcrete)) {
              throw error(item, "locals must be numeric");
            }
            Function fn =
                new Function(
                    name,
                    signature.params(),
                    signature.result(),
                    ImmutableList.copyOf(header.locals),
                    builder.makeNop());
            module.addFunction(fn);
            functions.add(fn);
            bodies.add(item.item(bodyIndex));
          }
          default -> throw error(item, "unexpected (%s ...)", head(item));
        }
      }
      for (int i = 0; i < functions.size(); i++) {
        Function fn = functions.get(i);
        fn.setBody(expr(asList(bodies.get(i)), fn));
      }
      return module;
    }

    List<Expr> children(SexprContext list, int from, Function fn) throws ParseException {
      List<Expr> result = new ArrayList<>();
      for (int i = from; i < size(list); i++) {
        result.add(expr(asList(list.item(i)), fn));
      }
      return result;
    }

    Expr expr(SexprContext list, Function fn) throws ParseException {
      try {
        return convertExpr(list, fn);
      } catch (IllegalArgumentException e) {
        // Type errors reported by the builder
        throw error(list, "%s", e.getMessage());
      }
    }

    private Expr convertExpr(SexprContext list, Function fn) throws ParseException {
      String head = head(list);
      switch (head) {
        case "block" -> {
          int i = 1;
          String label = null;
          if (size(list) > 1 && isName(list.item(1))) {
            label = name(list.item(1));
            i++;
          }
          checkSize(list, i + 1, Integer.MAX_VALUE);
          Type type = type(list.item(i));
          return builder.makeBlock(label, children(list, i + 1, fn), type);
        }
        case "loop" -> {
          int i = 1;
          String label = null;
          if (size(list) > 1 && isName(list.item(1))) {
            label = name(list.item(1));
            i++;
          }
          checkSize(list, i + 2, i + 2);
          Type type = type(list.item(i));
          return builder.makeLoop(label, expr(asList(list.item(i + 1)), fn), type);
        }
        case "if" -> {
          checkSize(list, 4, 5);
          Type type = type(list.item(1));
          List<Expr> children = children(list, 2, fn);
          if (children.size() == 2 && type != Type.NONE) {
            throw error(list, "a one-armed if must have type none");
          }
          return (children.size() == 2)
              ? builder.makeIf(children.get(0), children.get(1))
              : builder.makeIf(children.get(0), children.get(1), children.get(2), type);
        }
        case "br", "br_if" -> {
          boolean conditional = head.equals("br_if");
          checkSize(list, conditional ? 3 : 2, conditional ? 4 : 3);
          String target = name(list.item(1));
          List<Expr> children = children(list, 2, fn);
          Expr condition = conditional ? children.remove(children.size() - 1) : null;
          Expr value = children.isEmpty() ? null : children.get(0);
          return builder.makeBreak(target, value, condition);
        }
        case "br_table" -> {
          int i = 1;
          List<String> targets = new ArrayList<>();
          while (i < size(list) && isName(list.item(i))) {
            targets.add(name(list.item(i++)));
          }
          if (targets.isEmpty()) {
            throw error(list, "br_table needs a default target");
          }
          checkSize(list, i + 1, i + 2);
          String defaultTarget = targets.remove(targets.size() - 1);
          List<Expr> children = children(list, i, fn);
          Expr condition = children.remove(children.size() - 1);
          Expr value = children.isEmpty() ? null : children.get(0);
          return builder.makeSwitch(targets, defaultTarget, value, condition);
        }
        case "call" -> {
          checkSize(list, 2, Integer.MAX_VALUE);
          return builder.makeCall(name(list.item(1)), children(list, 2, fn));
        }
        case "call_import" -> {
          checkSize(list, 2, Integer.MAX_VALUE);
          return builder.makeCallImport(name(list.item(1)), children(list, 2, fn));
        }
        case "call_indirect" -> {
          Header header = new Header();
          int i = header.read(list, 1);
          if (!header.locals.isEmpty() || i >= size(list)) {
            throw error(list, "malformed call_indirect");
          }
          List<Expr> children = children(list, i, fn);
          Expr target = children.remove(children.size() - 1);
          return builder.makeCallIndirect(header.signature(list), children, target);
        }
        case "get_local" -> {
          checkSize(list, 2, 2);
          int index = local(list.item(1), fn);
          return builder.makeGetLocal(index, fn.localType(index));
        }
        case "set_local" -> {
          checkSize(list, 3, 3);
          int index = local(list.item(1), fn);
          Expr value = expr(asList(list.item(2)), fn);
          if (!Type.isCompatible(value.type, fn.localType(index))) {
            throw error(list, "local %s has type %s", index, fn.localType(index));
          }
          return builder.makeSetLocal(index, value);
        }
        case "get_global" -> {
          checkSize(list, 2, 2);
          return builder.makeGetGlobal(name(list.item(1)));
        }
        case "set_global" -> {
          checkSize(list, 3, 3);
          return builder.makeSetGlobal(name(list.item(1)), expr(asList(list.item(2)), fn));
        }
        case "select" -> {
          checkSize(list, 4, 4);
          List<Expr> children = children(list, 1, fn);
          return builder.makeSelect(children.get(0), children.get(1), children.get(2));
        }
        case "drop" -> {
          checkSize(list, 2, 2);
          return builder.makeDrop(expr(asList(list.item(1)), fn));
        }
        case "return" -> {
          checkSize(list, 1, 2);
          return builder.makeReturn(size(list) == 1 ? null : expr(asList(list.item(1)), fn));
        }
        case "nop" -> {
          checkSize(list, 1, 1);
          return builder.makeNop();
        }
        case "unreachable" -> {
          checkSize(list, 1, 1);
          return builder.makeUnreachable();
        }
        default -> {
          return operator(list, head, fn);
        }
      }
    }

    /** Converts the kinds whose head names an operator, a host operation, or a typed memory op. */
    private Expr operator(SexprContext list, String head, Function fn) throws ParseException {
      Expr.Host.Op hostOp = Expr.Host.Op.fromText(head);
      if (hostOp != null) {
        return builder.makeHost(hostOp, children(list, 1, fn));
      }
      UnaryOp unaryOp = UnaryOp.fromText(head);
      if (unaryOp != null) {
        checkSize(list, 2, 2);
        return builder.makeUnary(unaryOp, expr(asList(list.item(1)), fn));
      }
      BinaryOp binaryOp = BinaryOp.fromText(head);
      if (binaryOp != null) {
        checkSize(list, 3, 3);
        List<Expr> children = children(list, 1, fn);
        return builder.makeBinary(binaryOp, children.get(0), children.get(1));
      }
      int dot = head.indexOf('.');
      Type type = (dot < 0) ? null : Type.fromText(head.substring(0, dot));
      if (type != null && type.isConcrete()) {
        switch (head.substring(dot + 1)) {
          case "const" -> {
            checkSize(list, 2, 2);
            try {
              return builder.makeConst(Literal.parse(type, atom(list.item(1))));
            } catch (NumberFormatException e) {
              throw error(list.item(1), "bad %s literal", type);
            }
          }
          case "load" -> {
            checkSize(list, 2, 2);
            return builder.makeLoad(type, expr(asList(list.item(1)), fn));
          }
          case "store" -> {
            checkSize(list, 3, 3);
            List<Expr> children = children(list, 1, fn);
            return builder.makeStore(type, children.get(0), children.get(1));
          }
          default -> {}
        }
      }
      throw error(list, "unknown expression (%s ...)", head);
    }

    private static int local(ItemContext node, Function fn) throws ParseException {
      int index = integer(node);
      if (index < 0 || index >= fn.numLocals()) {
        throw error(node, "no local %s in %s", index, fn.name);
      }
      return index;
    }
  }
}
