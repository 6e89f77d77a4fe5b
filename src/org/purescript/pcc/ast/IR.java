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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** An AST construction helper class. */
public class IR {

  /** Allocates a managed value; bound to a collector or to reference counting at build time. */
  public static final String MAKE_MANAGED = "make_managed";

  /** Allocates a managed value and registers its destructor as a finalizer. */
  public static final String MAKE_MANAGED_AND_FINALIZED = "make_managed_and_finalized";

  /** The managed handle type alias. */
  public static final String MANAGED = "managed";

  private IR() {}

  public static Node number(long value) {
    return Node.newNumber(value);
  }

  public static Node number(double value) {
    checkState(!Double.isNaN(value) && !Double.isInfinite(value), "Not a finite literal: %s", value);
    return Node.newNumber(value);
  }

  public static Node string(String value) {
    checkState(isWellFormed(value), "String literal has an unpaired surrogate: %s", value);
    return Node.newString(Token.STRING, value);
  }

  public static Node trueNode() {
    return new Node(Token.TRUE, ImmutableList.of());
  }

  public static Node falseNode() {
    return new Node(Token.FALSE, ImmutableList.of());
  }

  public static Node booleanNode(boolean value) {
    return value ? trueNode() : falseNode();
  }

  public static Node arraylit(Node... elements) {
    return arraylit(ImmutableList.copyOf(elements));
  }

  public static Node arraylit(List<Node> elements) {
    for (Node element : elements) {
      mayBeExpression(element);
    }
    return new Node(Token.ARRAYLIT, ImmutableList.copyOf(elements));
  }

  public static Node objectlit() {
    return Node.newObjectLit(ImmutableList.of(), ImmutableList.of());
  }

  /** Creates an object literal; properties are emitted in the map's iteration order. */
  public static Node objectlit(Map<String, Node> properties) {
    ImmutableList.Builder<String> keys = ImmutableList.builder();
    ImmutableList.Builder<Node> values = ImmutableList.builder();
    for (Map.Entry<String, Node> property : properties.entrySet()) {
      mayBeExpression(property.getValue());
      keys.add(property.getKey());
      values.add(property.getValue());
    }
    return Node.newObjectLit(keys.build(), values.build());
  }

  public static Node block(Node... statements) {
    return block(ImmutableList.copyOf(statements));
  }

  public static Node block(List<Node> statements) {
    for (Node statement : statements) {
      mayBeStatement(statement);
    }
    return new Node(Token.BLOCK, ImmutableList.copyOf(statements));
  }

  public static Node namespace(String name, List<Node> statements) {
    checkIdentifier(name);
    for (Node statement : statements) {
      mayBeStatement(statement);
    }
    return Node.newString(Token.NAMESPACE, name, ImmutableList.copyOf(statements));
  }

  /**
   * A reference to a variable. Anything after the first {@code @} in {@code name} is a
   * disambiguation suffix and is not printed.
   */
  public static Node name(String name) {
    checkIdentifier(name);
    return Node.newString(Token.NAME, name);
  }

  public static Node var(String name) {
    checkIdentifier(name);
    return Node.newString(Token.VAR, name);
  }

  public static Node var(String name, Node value) {
    checkIdentifier(name);
    checkNotNull(value);
    return Node.newString(Token.VAR, name, value);
  }

  public static Node assign(Node target, Node value) {
    mayBeExpression(target);
    mayBeExpression(value);
    return new Node(Token.ASSIGN, ImmutableList.of(target, value));
  }

  public static Node whileNode(Node cond, Node body) {
    mayBeExpression(cond);
    mayBeStatement(body);
    return new Node(Token.WHILE, ImmutableList.of(cond, body));
  }

  /** A counted loop: {@code variable} runs from {@code start} up to, excluding, {@code end}. */
  public static Node forNode(String variable, Node start, Node end, Node body) {
    checkIdentifier(variable);
    mayBeExpression(start);
    mayBeExpression(end);
    mayBeStatement(body);
    return Node.newString(Token.FOR, variable, start, end, body);
  }

  public static Node forIn(String variable, Node collection, Node body) {
    checkIdentifier(variable);
    mayBeExpression(collection);
    mayBeStatement(body);
    return Node.newString(Token.FOR_IN, variable, collection, body);
  }

  public static Node ifNode(Node cond, Node then) {
    mayBeExpression(cond);
    mayBeStatement(then);
    return new Node(Token.IF, ImmutableList.of(cond, then));
  }

  public static Node ifNode(Node cond, Node then, Node elseNode) {
    mayBeExpression(cond);
    mayBeStatement(then);
    mayBeStatement(elseNode);
    return new Node(Token.IF, ImmutableList.of(cond, then, elseNode));
  }

  public static Node returnNode() {
    return new Node(Token.RETURN, ImmutableList.of());
  }

  public static Node returnNode(Node value) {
    mayBeExpression(value);
    return new Node(Token.RETURN, ImmutableList.of(value));
  }

  public static Node throwNode(Node value) {
    mayBeExpression(value);
    return new Node(Token.THROW, ImmutableList.of(value));
  }

  public static Node breakNode() {
    return new Node(Token.BREAK, ImmutableList.of());
  }

  public static Node breakNode(String label) {
    return new Node(Token.BREAK, ImmutableList.of(labelName(label)));
  }

  public static Node continueNode() {
    return new Node(Token.CONTINUE, ImmutableList.of());
  }

  public static Node continueNode(String label) {
    return new Node(Token.CONTINUE, ImmutableList.of(labelName(label)));
  }

  public static Node label(String label, Node statement) {
    mayBeStatement(statement);
    return new Node(Token.LABEL, ImmutableList.of(labelName(label), statement));
  }

  public static Node labelName(String label) {
    checkIdentifier(label);
    return Node.newString(Token.LABEL_NAME, label);
  }

  /** An anonymous function, printed as a capture-by-value lambda. */
  public static Node function(List<String> parameters, Node body) {
    return function(null, ImmutableList.of(), null, parameters, body);
  }

  public static Node function(String name, List<String> parameters, Node body) {
    checkIdentifier(name);
    return function(name, ImmutableList.of(), null, parameters, body);
  }

  /**
   * A function with explicit generic type parameters and an optional trailing return type.
   *
   * @param parameters parameter declarations; a bare name is printed with an {@code auto} type
   *     when the function is used as a lambda
   */
  public static Node function(
      @Nullable String name,
      List<String> typeParameters,
      @Nullable String returnType,
      List<String> parameters,
      Node body) {
    checkState(name == null || !name.isEmpty(), "Function names must not be empty");
    checkState(returnType == null || !returnType.isEmpty(), "Return types must not be empty");
    checkState(body.isBlock(), body);
    for (String typeParameter : typeParameters) {
      checkIdentifier(typeParameter);
    }
    for (String parameter : parameters) {
      checkState(!parameter.isBlank(), "Parameters must not be blank");
    }
    return Node.newFunction(
        name,
        ImmutableList.copyOf(typeParameters),
        returnType,
        ImmutableList.copyOf(parameters),
        body);
  }

  /**
   * A constructor of an algebraic data type, printed as a struct deriving from {@code ownerType}
   * with one member per field and {@code staticMethod} embedded as a static member.
   */
  public static Node data(
      String constructorName,
      String ownerType,
      List<String> typeParameters,
      List<Node.Field> fields,
      Node staticMethod) {
    checkIdentifier(constructorName);
    checkIdentifier(ownerType);
    for (String typeParameter : typeParameters) {
      checkIdentifier(typeParameter);
    }
    checkNotNull(staticMethod);
    return Node.newData(
        constructorName,
        ownerType,
        ImmutableList.copyOf(typeParameters),
        ImmutableList.copyOf(fields),
        staticMethod);
  }

  public static Node getprop(Node target, String property) {
    mayBeExpression(target);
    checkIdentifier(property);
    return Node.newString(Token.GETPROP, property, target);
  }

  public static Node getelem(Node target, Node index) {
    mayBeExpression(target);
    mayBeExpression(index);
    return new Node(Token.GETELEM, ImmutableList.of(target, index));
  }

  public static Node call(Node callee, Node... args) {
    return call(callee, ImmutableList.copyOf(args));
  }

  public static Node call(Node callee, List<Node> args) {
    mayBeExpression(callee);
    ImmutableList.Builder<Node> children = ImmutableList.builder();
    children.add(callee);
    for (Node arg : args) {
      mayBeExpression(arg);
      children.add(arg);
    }
    return new Node(Token.CALL, children.build());
  }

  public static Node unaryOp(Token token, Node operand) {
    checkState(token.isUnaryOperator(), "%s is not a unary operator", token);
    mayBeExpression(operand);
    return new Node(token, ImmutableList.of(operand));
  }

  public static Node not(Node operand) {
    return unaryOp(Token.NOT, operand);
  }

  public static Node bitnot(Node operand) {
    return unaryOp(Token.BITNOT, operand);
  }

  public static Node neg(Node operand) {
    return unaryOp(Token.NEG, operand);
  }

  public static Node pos(Node operand) {
    return unaryOp(Token.POS, operand);
  }

  public static Node newNode(Node operand) {
    return unaryOp(Token.NEW, operand);
  }

  public static Node typeof(Node operand) {
    mayBeExpression(operand);
    return new Node(Token.TYPEOF, ImmutableList.of(operand));
  }

  public static Node binaryOp(Token token, Node left, Node right) {
    checkState(token.isBinaryOperator(), "%s is not a binary operator", token);
    mayBeExpression(left);
    mayBeExpression(right);
    return new Node(token, ImmutableList.of(left, right));
  }

  public static Node add(Node left, Node right) {
    return binaryOp(Token.ADD, left, right);
  }

  public static Node sub(Node left, Node right) {
    return binaryOp(Token.SUB, left, right);
  }

  public static Node mul(Node left, Node right) {
    return binaryOp(Token.MUL, left, right);
  }

  public static Node div(Node left, Node right) {
    return binaryOp(Token.DIV, left, right);
  }

  public static Node mod(Node left, Node right) {
    return binaryOp(Token.MOD, left, right);
  }

  public static Node lt(Node left, Node right) {
    return binaryOp(Token.LT, left, right);
  }

  public static Node le(Node left, Node right) {
    return binaryOp(Token.LE, left, right);
  }

  public static Node gt(Node left, Node right) {
    return binaryOp(Token.GT, left, right);
  }

  public static Node ge(Node left, Node right) {
    return binaryOp(Token.GE, left, right);
  }

  public static Node eq(Node left, Node right) {
    return binaryOp(Token.EQ, left, right);
  }

  public static Node ne(Node left, Node right) {
    return binaryOp(Token.NE, left, right);
  }

  public static Node and(Node left, Node right) {
    return binaryOp(Token.AND, left, right);
  }

  public static Node or(Node left, Node right) {
    return binaryOp(Token.OR, left, right);
  }

  public static Node bitand(Node left, Node right) {
    return binaryOp(Token.BITAND, left, right);
  }

  public static Node bitor(Node left, Node right) {
    return binaryOp(Token.BITOR, left, right);
  }

  public static Node bitxor(Node left, Node right) {
    return binaryOp(Token.BITXOR, left, right);
  }

  public static Node lsh(Node left, Node right) {
    return binaryOp(Token.LSH, left, right);
  }

  public static Node rsh(Node left, Node right) {
    return binaryOp(Token.RSH, left, right);
  }

  public static Node ursh(Node left, Node right) {
    return binaryOp(Token.URSH, left, right);
  }

  public static Node hook(Node cond, Node then, Node elseNode) {
    mayBeExpression(cond);
    mayBeExpression(then);
    mayBeExpression(elseNode);
    return new Node(Token.HOOK, ImmutableList.of(cond, then, elseNode));
  }

  public static Node cast(String type, Node value) {
    checkState(!type.isBlank(), "Cast target type must not be blank");
    mayBeExpression(value);
    return Node.newString(Token.CAST, type, value);
  }

  public static Node instanceOf(Node value, Node type) {
    mayBeExpression(value);
    mayBeExpression(type);
    return new Node(Token.INSTANCEOF, ImmutableList.of(value, type));
  }

  /** Verbatim target code. */
  public static Node raw(String code) {
    return Node.newString(Token.RAW, code);
  }

  /** The statement that prints as nothing at all. */
  public static Node noOp() {
    return raw("");
  }

  public static Node comment(List<Comment> comments, Node inner) {
    checkNotNull(inner);
    return Node.newComment(ImmutableList.copyOf(comments), inner);
  }

  /** {@code make_managed<type>(args...)} */
  public static Node makeManaged(String type, Node... args) {
    return call(name(MAKE_MANAGED + "<" + type + ">"), ImmutableList.copyOf(args));
  }

  /** {@code make_managed_and_finalized<type>(args...)} */
  public static Node makeManagedAndFinalized(String type, Node... args) {
    return call(name(MAKE_MANAGED_AND_FINALIZED + "<" + type + ">"), ImmutableList.copyOf(args));
  }

  /** The managed handle type for {@code type}, for use in casts, fields and parameters. */
  public static String managedType(String type) {
    checkState(!type.isBlank(), "Managed type must not be blank");
    return MANAGED + "<" + type + ">";
  }

  private static boolean isWellFormed(String value) {
    for (int i = 0; i < value.length(); ) {
      int cp = value.codePointAt(i);
      if (cp >= Character.MIN_SURROGATE && cp <= Character.MAX_SURROGATE) {
        return false;
      }
      i += Character.charCount(cp);
    }
    return true;
  }

  private static void checkIdentifier(String name) {
    checkState(!name.isEmpty(), "Identifiers must not be empty");
  }

  private static void mayBeStatement(Node n) {
    checkState(!n.isLabelName(), n);
  }

  private static void mayBeExpression(Node n) {
    switch (n.getToken()) {
      case BLOCK:
      case NAMESPACE:
      case LABEL_NAME:
      case DATA:
        throw new IllegalStateException(n + " cannot be used as an expression");
      default:
        break;
    }
  }
}
