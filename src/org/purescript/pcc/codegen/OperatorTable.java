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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Predicate;
import org.purescript.pcc.ast.Node;
import org.purescript.pcc.ast.Token;

/**
 * The precedence table that decides how expressions are printed and where they need
 * parentheses.
 *
 * <p>Levels are ordered from the tightest binding to the loosest. A node is printed by the first
 * rule, searching level by level, whose shape it has. The rule prints its operands with a
 * restricted table: an operand may use the same rule again (on the side the rule associates to)
 * or any rule of a tighter level. An operand that needs a looser rule falls through to the base
 * case, which prints literals and statements directly and parenthesizes everything else.
 */
final class OperatorTable {

  private static final Joiner COMMA_JOINER = Joiner.on(", ");
  private static final Splitter WORD_SPLITTER =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

  /** Prints a node that a wrap rule matched, given its already printed operand. */
  interface WrapPrinter {
    String print(CodeGenerator cg, Node n, String operand);
  }

  /** Combines the printed operands of a binary rule. */
  interface InfixPrinter {
    String print(String left, String right);
  }

  /** One rule of the table. */
  abstract static class Operator {
    private final Predicate<Node> matcher;

    Operator(Predicate<Node> matcher) {
      this.matcher = matcher;
    }

    final boolean matches(Node n) {
      return matcher.test(n);
    }

    /** Prints {@code n}, which this rule matches and which sits at {@code level}. */
    abstract String print(OperatorTable table, CodeGenerator cg, Node n, int level);

    /** Prints an operand with this rule if it fits, otherwise with the tighter levels. */
    final String printWithSelf(OperatorTable table, CodeGenerator cg, Node operand, int level) {
      return matches(operand)
          ? print(table, cg, operand, level)
          : table.print(cg, operand, level - 1);
    }
  }

  /** A rule with a single operand, its first child, surrounded by fixed text. */
  static final class Wrap extends Operator {
    private final WrapPrinter printer;

    Wrap(Predicate<Node> matcher, WrapPrinter printer) {
      super(matcher);
      this.printer = printer;
    }

    @Override
    String print(OperatorTable table, CodeGenerator cg, Node n, int level) {
      String operand = printWithSelf(table, cg, n.getFirstChild(), level);
      return printer.print(cg, n, operand);
    }
  }

  /** A binary rule whose left operand may repeat the rule: {@code a - b - c}. */
  static final class AssocL extends Operator {
    private final InfixPrinter printer;

    AssocL(Predicate<Node> matcher, InfixPrinter printer) {
      super(matcher);
      this.printer = printer;
    }

    @Override
    String print(OperatorTable table, CodeGenerator cg, Node n, int level) {
      String left = printWithSelf(table, cg, n.getFirstChild(), level);
      String right = table.print(cg, n.getSecondChild(), level - 1);
      return printer.print(left, right);
    }
  }

  /** A binary rule whose right operand may repeat the rule. */
  static final class AssocR extends Operator {
    private final InfixPrinter printer;

    AssocR(Predicate<Node> matcher, InfixPrinter printer) {
      super(matcher);
      this.printer = printer;
    }

    @Override
    String print(OperatorTable table, CodeGenerator cg, Node n, int level) {
      String left = table.print(cg, n.getFirstChild(), level - 1);
      String right = printWithSelf(table, cg, n.getSecondChild(), level);
      return printer.print(left, right);
    }
  }

  private static final OperatorTable CPP = createCppTable();

  private final ImmutableList<ImmutableList<Operator>> levels;

  OperatorTable(List<? extends List<Operator>> levels) {
    ImmutableList.Builder<ImmutableList<Operator>> builder = ImmutableList.builder();
    for (List<Operator> level : levels) {
      checkState(!level.isEmpty(), "Empty precedence level");
      builder.add(ImmutableList.copyOf(level));
    }
    this.levels = builder.build();
  }

  /** The table for the C++ subset this back end emits. */
  static OperatorTable cpp() {
    return CPP;
  }

  int getLevelCount() {
    return levels.size();
  }

  /** Prints {@code n} with every level available. */
  String print(CodeGenerator cg, Node n) {
    return print(cg, n, levels.size() - 1);
  }

  /**
   * Prints {@code n} using only the levels up to and including {@code maxLevel}; a node that needs
   * a looser level is left to the base case.
   */
  String print(CodeGenerator cg, Node n, int maxLevel) {
    for (int level = 0; level <= maxLevel; level++) {
      for (Operator op : levels.get(level)) {
        if (op.matches(n)) {
          return op.print(this, cg, n, level);
        }
      }
    }
    return printBase(cg, n);
  }

  /** Returns the level whose rules match {@code n}, or -1 if it is not an operator node. */
  int findLevel(Node n) {
    for (int level = 0; level < levels.size(); level++) {
      for (Operator op : levels.get(level)) {
        if (op.matches(n)) {
          return level;
        }
      }
    }
    return -1;
  }

  private String printBase(CodeGenerator cg, Node n) {
    String literal = cg.printLiteral(n);
    if (literal != null) {
      return literal;
    }
    if (findLevel(n) < 0) {
      throw new UnsupportedNodeException(n);
    }
    return "(" + print(cg, n) + ")";
  }

  private static Predicate<Node> is(Token token) {
    return n -> n.getToken() == token;
  }

  private static Operator unary(Token token, String prefix) {
    return new Wrap(is(token), (cg, n, operand) -> prefix + operand);
  }

  /** A prefix sign, spaced away from an operand that starts with the same sign. */
  private static Operator signPrefix(Token token, String sign) {
    // "- -x" and "- -5", never the decrement "--x"
    return new Wrap(
        is(token),
        (cg, n, operand) -> (operand.startsWith(sign) ? sign + " " : sign) + operand);
  }

  private static Operator binary(Token token, String op) {
    return new AssocL(is(token), (left, right) -> left + " " + op + " " + right);
  }

  private static ImmutableList<Operator> level(Operator... operators) {
    return ImmutableList.copyOf(operators);
  }

  private static String lambdaParameter(String parameter) {
    return WORD_SPLITTER.splitToList(parameter).size() < 2 ? "auto " + parameter : parameter;
  }

  private static OperatorTable createCppTable() {
    return new OperatorTable(
        ImmutableList.of(
            level(
                new Wrap(is(Token.GETPROP), (cg, n, target) -> target + "." + n.getString())),
            level(
                new Wrap(
                    is(Token.GETELEM),
                    (cg, n, target) -> target + "[" + cg.print(n.getSecondChild()) + "]")),
            level(
                new Wrap(
                    is(Token.CALL),
                    (cg, n, callee) -> {
                      List<Node> args = n.children().subList(1, n.getChildCount());
                      return callee + "(" + COMMA_JOINER.join(cg.printAll(args)) + ")";
                    })),
            level(unary(Token.NEW, "new ")),
            level(
                new Wrap(
                    is(Token.FUNCTION),
                    (cg, n, body) ->
                        "[=]("
                            + COMMA_JOINER.join(
                                n.getParameters().stream()
                                    .map(OperatorTable::lambdaParameter)
                                    .iterator())
                            + ") "
                            + body)),
            level(
                new Wrap(
                    is(Token.CAST),
                    (cg, n, value) -> "cast<" + n.getString() + ">(" + value + ")")),
            level(binary(Token.LT, "<")),
            level(binary(Token.LE, "<=")),
            level(binary(Token.GT, ">")),
            level(binary(Token.GE, ">=")),
            level(new Wrap(is(Token.TYPEOF), (cg, n, operand) -> "typeof " + operand)),
            level(
                new AssocR(
                    is(Token.INSTANCEOF),
                    (value, type) -> "instance_of<" + type + ">(" + value + ")")),
            level(unary(Token.NOT, "!")),
            level(unary(Token.BITNOT, "~")),
            level(signPrefix(Token.NEG, "-")),
            level(signPrefix(Token.POS, "+")),
            level(
                binary(Token.MUL, "*"), binary(Token.DIV, "/"), binary(Token.MOD, "%")),
            level(binary(Token.ADD, "+"), binary(Token.SUB, "-")),
            level(binary(Token.LSH, "<<")),
            level(binary(Token.RSH, ">>")),
            level(binary(Token.URSH, ">>>")),
            level(binary(Token.EQ, "==")),
            level(binary(Token.NE, "!=")),
            level(binary(Token.BITAND, "&")),
            level(binary(Token.BITXOR, "^")),
            level(binary(Token.BITOR, "|")),
            level(binary(Token.AND, "&&")),
            level(binary(Token.OR, "||")),
            level(
                new Wrap(
                    is(Token.HOOK),
                    (cg, n, cond) ->
                        cond
                            + " ? "
                            + cg.printDetached(n.getSecondChild())
                            + " : "
                            + cg.printDetached(n.getLastChild())))));
  }
}
