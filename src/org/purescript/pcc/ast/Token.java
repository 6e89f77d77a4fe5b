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

package org.purescript.pcc.ast;

/**
 * The kinds of node in the C++ syntax tree.
 *
 * <p>Operator tokens double as the operator tag of unary and binary nodes, so matching a specific
 * operator is a token comparison.
 */
public enum Token {
  // Literals
  NUMBER,
  STRING,
  TRUE,
  FALSE,
  ARRAYLIT,
  OBJECTLIT,

  // Scoping
  BLOCK,
  NAMESPACE,

  // Bindings
  NAME,
  VAR,
  ASSIGN,

  // Control flow
  WHILE,
  FOR,
  FOR_IN,
  IF,
  RETURN,
  THROW,
  BREAK,
  CONTINUE,
  LABEL,
  LABEL_NAME,

  // Functions and data
  FUNCTION,
  DATA,

  // Postfix forms
  GETPROP,
  GETELEM,
  CALL,

  // Unary operators
  NOT,
  BITNOT,
  NEG,
  POS,
  NEW,
  TYPEOF,

  // Binary operators
  LT,
  LE,
  GT,
  GE,
  MUL,
  DIV,
  MOD,
  ADD,
  SUB,
  LSH,
  RSH,
  URSH,
  EQ,
  NE,
  BITAND,
  BITXOR,
  BITOR,
  AND,
  OR,

  // Type-directed forms
  HOOK,
  CAST,
  INSTANCEOF,

  // Passthrough
  RAW,
  COMMENT;

  /** Whether nodes of this kind are unary operator applications. */
  public boolean isUnaryOperator() {
    switch (this) {
      case NOT:
      case BITNOT:
      case NEG:
      case POS:
      case NEW:
        return true;
      default:
        return false;
    }
  }

  /** Whether nodes of this kind are binary operator applications. */
  public boolean isBinaryOperator() {
    switch (this) {
      case LT:
      case LE:
      case GT:
      case GE:
      case MUL:
      case DIV:
      case MOD:
      case ADD:
      case SUB:
      case LSH:
      case RSH:
      case URSH:
      case EQ:
      case NE:
      case BITAND:
      case BITXOR:
      case BITOR:
      case AND:
      case OR:
        return true;
      default:
        return false;
    }
  }
}
