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

import com.google.common.base.CharMatcher;
import java.io.Serializable;

/** Output options for the C++ code printer. */
public class CompilerOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  /** The default text printed once per nesting level. */
  public static final String DEFAULT_INDENT_UNIT = "  ";

  private static final CharMatcher INDENT_CHARS = CharMatcher.anyOf(" \t");

  private String indentUnit = DEFAULT_INDENT_UNIT;

  private boolean preserveComments = true;

  public String getIndentUnit() {
    return indentUnit;
  }

  /** Sets the text printed once per nesting level. Spaces and tabs only. */
  public void setIndentUnit(String indentUnit) {
    this.indentUnit = indentUnit;
  }

  public boolean shouldPreserveComments() {
    return preserveComments;
  }

  /**
   * Whether comments attached to nodes are printed as doc blocks. When off, only the commented
   * node is printed.
   */
  public void setPreserveComments(boolean preserveComments) {
    this.preserveComments = preserveComments;
  }

  /** Checks for options that would produce malformed output. */
  public void validate() {
    if (indentUnit.isEmpty() || !INDENT_CHARS.matchesAllOf(indentUnit)) {
      throw new InvalidOptionsException(
          "Indent unit must be one or more spaces or tabs, got \"%s\"", indentUnit);
    }
  }

  /** Exception to indicate invalid options in the CompilerOptions. */
  public static class InvalidOptionsException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private InvalidOptionsException(String message, Object... args) {
      super(String.format(message, args));
    }
  }
}
