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

import com.google.common.base.Strings;
import java.util.function.Supplier;

/**
 * The mutable part of a single print: the current indentation depth. Each top-level print owns
 * its own instance.
 */
final class PrinterState {
  private final String indentUnit;
  private int indent = 0;

  PrinterState(String indentUnit) {
    this.indentUnit = indentUnit;
  }

  int getIndent() {
    return indent;
  }

  /** The whitespace that starts a line at the current depth. */
  String currentIndent() {
    return Strings.repeat(indentUnit, indent);
  }

  /** Runs {@code printer} one level deeper, restoring the depth even if it throws. */
  String withIndent(Supplier<String> printer) {
    indent++;
    try {
      return printer.get();
    } finally {
      indent--;
    }
  }
}
