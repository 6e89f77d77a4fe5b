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

import org.purescript.pcc.ast.Node;
import org.purescript.pcc.ast.Token;

/**
 * Thrown when no printing rule accepts a node: either the tree is malformed or the printer has a
 * gap. Code generation for the enclosing compilation unit cannot continue.
 */
public class UnsupportedNodeException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final Token token;

  UnsupportedNodeException(Node n) {
    super("Unsupported construct: " + n.getToken() + " (" + n + ")");
    this.token = n.getToken();
  }

  /** The kind of the node that could not be printed. */
  public Token getToken() {
    return token;
  }
}
