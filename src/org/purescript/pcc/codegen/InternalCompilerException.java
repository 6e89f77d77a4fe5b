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

/**
 * Thrown when code generation finds the compiler's own invariants broken, for example a data
 * constructor the type checker should have recorded is missing from the environment. This is never
 * a problem with the user's program.
 */
public class InternalCompilerException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  InternalCompilerException(String message, Object... args) {
    super("Internal compiler error: " + String.format(message, args));
  }
}
