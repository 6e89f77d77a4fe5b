/*
 * Copyright 2026 The Closure Compiler Authors.
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

package org.purescript.pcc.codegen;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.purescript.pcc.ast.Comment;
import org.purescript.pcc.ast.Node;

/**
 * CodeGenerator generates C++ code from an AST.
 *
 * <p>Operator nodes are printed through the {@link OperatorTable}; everything the table does not
 * cover (literals, declarations and statements) is printed here.
 */
final class CodeGenerator {
  private static final Joiner COMMA_JOINER = Joiner.on(", ");

  private final CompilerOptions options;
  private final OperatorTable table;
  private final PrinterState state;

  // A memoizer for formatting strings as C++ string literals.
  private final Map<String, String> escapedStrings = new HashMap<>();

  CodeGenerator(CompilerOptions options) {
    this.options = options;
    this.table = OperatorTable.cpp();
    this.state = new PrinterState(options.getIndentUnit());
  }

  /** Whether {@code n} is a statement that prints as nothing. */
  static boolean isNoOpStatement(Node n) {
    if (n.isNoOp()) {
      return true;
    }
    Node value = n.isVar() ? n.getFirstChild() : null;
    return value != null && value.isNoOp();
  }

  /** Prints a single node, statement or expression, without a trailing semicolon. */
  String print(Node n) {
    return table.print(this, n);
  }

  List<String> printAll(List<Node> nodes) {
    List<String> result = new ArrayList<>(nodes.size());
    for (Node n : nodes) {
      result.add(print(n));
    }
    return result;
  }

  /** Prints {@code n} with a fresh generator that starts at indentation zero. */
  String printDetached(Node n) {
    return new CodeGenerator(options).print(n);
  }

  /**
   * Prints each statement on its own line at the current indentation, terminated by a semicolon.
   * Statements that print as nothing are dropped, line and all.
   */
  String printStatements(List<Node> statements) {
    String indent = state.currentIndent();
    List<String> lines = new ArrayList<>();
    for (Node statement : statements) {
      if (!isNoOpStatement(statement)) {
        lines.add(indent + print(statement) + ";");
      }
    }
    return Joiner.on('\n').join(lines);
  }

  /**
   * Prints the nodes that are not operator applications. Returns null for a node this method does
   * not handle.
   */
  @Nullable String printLiteral(Node n) {
    switch (n.getToken()) {
      case NUMBER:
        return n.getNumber().toString();
      case STRING:
        return cppString(n.getString());
      case TRUE:
        return "true";
      case FALSE:
        return "false";
      case ARRAYLIT:
        return "[ " + COMMA_JOINER.join(printAll(n.children())) + " ]";
      case OBJECTLIT:
        return printObjectLit(n);
      case BLOCK:
        return printBlock("{", n.children());
      case NAMESPACE:
        return printBlock("namespace " + n.getString() + " {", n.children());
      case NAME:
        return stripSourceSuffix(n.getString());
      case VAR:
        return printVar(n);
      case ASSIGN:
        return print(n.getFirstChild()) + " = " + print(n.getSecondChild());
      case WHILE:
        return "while (" + print(n.getFirstChild()) + ") " + print(n.getSecondChild());
      case FOR:
        {
          String v = n.getString();
          return "for (auto "
              + v
              + " = "
              + print(n.getChildAtIndex(0))
              + "; "
              + v
              + " < "
              + print(n.getChildAtIndex(1))
              + "; "
              + v
              + "++) "
              + print(n.getChildAtIndex(2));
        }
      case FOR_IN:
        return "for (auto "
            + n.getString()
            + " : "
            + print(n.getFirstChild())
            + ") "
            + print(n.getSecondChild());
      case IF:
        {
          String result = "if (" + print(n.getFirstChild()) + ") " + print(n.getSecondChild());
          if (n.getChildCount() > 2) {
            result += " else " + print(n.getChildAtIndex(2));
          }
          return result;
        }
      case RETURN:
        return n.hasChildren() ? "return " + print(n.getFirstChild()) : "return";
      case THROW:
        return "throw " + print(n.getFirstChild());
      case BREAK:
        return n.hasChildren() ? "break " + n.getFirstChild().getString() : "break";
      case CONTINUE:
        return n.hasChildren() ? "continue " + n.getFirstChild().getString() : "continue";
      case LABEL:
        return n.getFirstChild().getString() + ": " + print(n.getSecondChild());
      case COMMENT:
        return printComment(n);
      case RAW:
        return n.getString();
      default:
        return null;
    }
  }

  // Names may carry a source annotation after '@'.
  private static String stripSourceSuffix(String name) {
    int at = name.indexOf('@');
    return at < 0 ? name : name.substring(0, at);
  }

  private String printBlock(String opening, List<Node> statements) {
    String body = state.withIndent(() -> printStatements(statements));
    return opening + "\n" + body + "\n" + state.currentIndent() + "}";
  }

  private String printObjectLit(Node n) {
    if (!n.hasChildren()) {
      return "{}";
    }
    ImmutableList<String> keys = n.getKeys();
    String body =
        state.withIndent(
            () -> {
              String indent = state.currentIndent();
              List<String> entries = new ArrayList<>();
              for (int i = 0; i < keys.size(); i++) {
                String key = keys.get(i);
                String printedKey = NameMangler.needsEscaping(key) ? cppString(key) : key;
                entries.add(indent + printedKey + ": " + print(n.getChildAtIndex(i)));
              }
              return Joiner.on(", \n").join(entries);
            });
    return "{\n" + body + "\n" + state.currentIndent() + "}";
  }

  private String printVar(Node n) {
    String name = n.getString();
    Node value = n.getFirstChild();
    if (value == null) {
      return "auto " + name;
    }
    if (value.isNamespace()) {
      return printBlock("namespace " + name + " {", value.children());
    }
    if (value.isFunction() && value.getFunctionName() != null) {
      return printFunctionDeclaration(value, "");
    }
    if (value.isData()) {
      return printDataDeclaration(value);
    }
    return "auto " + name + " = " + print(value);
  }

  private String templateLine(List<String> typeParameters) {
    if (typeParameters.isEmpty()) {
      return "";
    }
    List<String> classes = new ArrayList<>(typeParameters.size());
    for (String typeParameter : typeParameters) {
      classes.add("class " + typeParameter);
    }
    return "template<" + COMMA_JOINER.join(classes) + ">\n" + state.currentIndent();
  }

  /**
   * Prints a named function as a declaration, {@code auto f(params) -> R { ... }}, preceded by
   * its template line when it is generic.
   */
  private String printFunctionDeclaration(Node fn, String modifiers) {
    StringBuilder sb = new StringBuilder();
    sb.append(templateLine(fn.getTypeParameters()))
        .append(modifiers)
        .append("auto ")
        .append(fn.getFunctionName())
        .append('(')
        .append(COMMA_JOINER.join(fn.getParameters()))
        .append(')');
    if (fn.getReturnType() != null) {
      sb.append(" -> ").append(fn.getReturnType());
    }
    sb.append(' ').append(print(fn.getFirstChild()));
    return sb.toString();
  }

  private String printDataDeclaration(Node data) {
    String name = data.getConstructorName();
    ImmutableList<Node.Field> fields = data.getFields();
    StringBuilder sb = new StringBuilder();
    sb.append(templateLine(ImmutableSortedSet.copyOf(data.getTypeParameters()).asList()))
        .append("struct ")
        .append(name)
        .append(" : public ")
        .append(data.getOwnerType())
        .append(" {\n");
    sb.append(
        state.withIndent(
            () -> {
              String indent = state.currentIndent();
              StringBuilder members = new StringBuilder();
              for (Node.Field field : fields) {
                members.append(indent).append(field).append(";\n");
              }
              members.append(indent).append(name).append('(').append(COMMA_JOINER.join(fields));
              members.append(')');
              if (!fields.isEmpty()) {
                List<String> initializers = new ArrayList<>(fields.size());
                for (Node.Field field : fields) {
                  initializers.add(field.name() + "(" + field.name() + ")");
                }
                members.append(" : ").append(COMMA_JOINER.join(initializers));
              }
              members.append(" {}");
              Node staticMember = data.getFirstChild();
              if (!isNoOpStatement(staticMember)) {
                members.append('\n').append(indent).append(printStaticMember(staticMember));
              }
              return members.toString();
            }));
    sb.append('\n').append(state.currentIndent()).append('}');
    return sb.toString();
  }

  private String printStaticMember(Node member) {
    Node value = member.isVar() ? member.getFirstChild() : null;
    if (value != null && value.isFunction() && value.getFunctionName() != null) {
      return printFunctionDeclaration(value, "static ");
    }
    return "static " + print(member);
  }

  private String printComment(Node n) {
    Node inner = n.getFirstChild();
    if (!options.shouldPreserveComments()) {
      return print(inner);
    }
    String indent = state.currentIndent();
    StringBuilder sb = new StringBuilder();
    sb.append('\n').append(indent).append("/**\n");
    for (Comment comment : n.getComments()) {
      for (String line : comment.getLines()) {
        sb.append(indent).append(" * ").append(removeCommentEnd(line)).append('\n');
      }
    }
    sb.append(indent).append(" */\n").append(indent).append(print(inner));
    return sb.toString();
  }

  private static String removeCommentEnd(String line) {
    String result = line;
    while (result.contains("*/")) {
      result = result.replace("*/", "");
    }
    return result;
  }

  /**
   * Formats {@code s} as a double-quoted C++ string literal.
   *
   * @throws IllegalArgumentException if {@code s} holds an unpaired surrogate
   */
  String cppString(String s) {
    String escaped = escapedStrings.get(s);
    if (escaped == null) {
      escaped = strEscape(s);
      escapedStrings.put(s, escaped);
    }
    return escaped;
  }

  static String strEscape(String s) {
    StringBuilder sb = new StringBuilder(s.length() + 2);
    sb.append('"');
    for (int i = 0; i < s.length(); ) {
      int cp = s.codePointAt(i);
      checkArgument(
          cp < Character.MIN_SURROGATE || cp > Character.MAX_SURROGATE,
          "Unpaired surrogate U+%s at index %s has no C++ spelling",
          Integer.toHexString(cp).toUpperCase(Locale.ROOT),
          i);
      i += Character.charCount(cp);
      switch (cp) {
        case '\b':
          sb.append("\\b");
          break;
        case '\t':
          sb.append("\\t");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case 0x0B:
          sb.append("\\v");
          break;
        case '\f':
          sb.append("\\f");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        default:
          if (cp > 0xFFFF) {
            sb.append(String.format("\\U%08x", cp));
          } else if (cp > 0xFF) {
            sb.append(String.format("\\u%04x", cp));
          } else {
            sb.appendCodePoint(cp);
          }
      }
    }
    sb.append('"');
    return sb.toString();
  }
}
