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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.List;
import java.util.logging.Logger;
import org.purescript.pcc.ast.Node;

/**
 * CodePrinter prints out C++ code from an AST.
 *
 * <p>Output is deterministic: the same tree and options always give the same text.
 */
public final class CodePrinter {
  private static final Logger logger = Logger.getLogger(CodePrinter.class.getName());

  private CodePrinter() {}

  /** Prints a single node, with default options, without a trailing semicolon. */
  public static String printExpression(Node n) {
    return printExpression(n, new CompilerOptions());
  }

  public static String printExpression(Node n, CompilerOptions options) {
    options.validate();
    return new CodeGenerator(options).print(n);
  }

  /** Prints a list of top-level statements, one per line. */
  public static String printStatements(List<Node> statements) {
    return new Builder(statements).build();
  }

  /** Builder for the code printer. */
  public static final class Builder {
    private final ImmutableList<Node> statements;
    private CompilerOptions options = new CompilerOptions();

    /**
     * Sets the statements from which to generate the source code.
     *
     * @param statements the top-level statements, in output order
     */
    public Builder(List<Node> statements) {
      this.statements = ImmutableList.copyOf(statements);
    }

    /** Sets the output options. */
    @CanIgnoreReturnValue
    public Builder setCompilerOptions(CompilerOptions options) {
      this.options = checkNotNull(options);
      return this;
    }

    /**
     * Generates the source code and returns it.
     *
     * @throws UnsupportedNodeException if a node has no printed form
     * @throws CompilerOptions.InvalidOptionsException if the options are inconsistent
     */
    public String build() {
      options.validate();
      int skipped = 0;
      for (Node statement : statements) {
        if (CodeGenerator.isNoOpStatement(statement)) {
          skipped++;
        }
      }
      logger.fine(
          "Printing " + statements.size() + " statement(s), " + skipped + " of them empty");
      return new CodeGenerator(options).printStatements(statements);
    }
  }
}
