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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * This class implements the root of the C++ syntax tree.
 *
 * <p>Nodes are immutable once built by {@link IR}. Every node has a {@link Token} and an ordered
 * list of children; the few kinds that carry more than children (literals, names, functions, data
 * declarations, object literals and comments) keep it in a private subclass and expose it through
 * the typed getters below, which throw {@link UnsupportedOperationException} on any other kind.
 */
public class Node {

  /** A member of a data declaration: its C++ type and its name. */
  public record Field(String type, String name) {
    public Field {
      checkArgument(!type.isBlank(), "Field type must not be blank");
      checkArgument(!name.isEmpty(), "Field name must not be empty");
    }

    @Override
    public String toString() {
      return type + " " + name;
    }
  }

  private static final class NumberNode extends Node {
    private final Number number;

    NumberNode(Number number) {
      super(Token.NUMBER, ImmutableList.of());
      checkArgument(
          number instanceof Long || number instanceof Double,
          "Numeric literals are either Long or Double, got %s",
          number.getClass());
      this.number = number;
    }

    @Override
    public Number getNumber() {
      return number;
    }

    @Override
    boolean isPayloadEquivalentTo(Node node) {
      return number.equals(node.getNumber());
    }

    @Override
    String payloadToString() {
      return number.toString();
    }
  }

  private static final class StringNode extends Node {
    private final String str;

    StringNode(Token token, String str, ImmutableList<Node> children) {
      super(token, children);
      this.str = checkNotNull(str);
    }

    @Override
    public String getString() {
      return str;
    }

    @Override
    boolean isPayloadEquivalentTo(Node node) {
      return str.equals(node.getString());
    }

    @Override
    String payloadToString() {
      return str;
    }
  }

  private static final class FunctionNode extends Node {
    private final @Nullable String name;
    private final ImmutableList<String> typeParameters;
    private final @Nullable String returnType;
    private final ImmutableList<String> parameters;

    FunctionNode(
        @Nullable String name,
        ImmutableList<String> typeParameters,
        @Nullable String returnType,
        ImmutableList<String> parameters,
        Node body) {
      super(Token.FUNCTION, ImmutableList.of(body));
      this.name = name;
      this.typeParameters = typeParameters;
      this.returnType = returnType;
      this.parameters = parameters;
    }

    @Override
    public @Nullable String getFunctionName() {
      return name;
    }

    @Override
    public ImmutableList<String> getTypeParameters() {
      return typeParameters;
    }

    @Override
    public @Nullable String getReturnType() {
      return returnType;
    }

    @Override
    public ImmutableList<String> getParameters() {
      return parameters;
    }

    @Override
    boolean isPayloadEquivalentTo(Node node) {
      return Objects.equals(name, node.getFunctionName())
          && typeParameters.equals(node.getTypeParameters())
          && Objects.equals(returnType, node.getReturnType())
          && parameters.equals(node.getParameters());
    }

    @Override
    String payloadToString() {
      return (name == null ? "<anonymous>" : name) + "(" + Joiner.on(", ").join(parameters) + ")";
    }
  }

  private static final class DataNode extends Node {
    private final String constructorName;
    private final String ownerType;
    private final ImmutableList<String> typeParameters;
    private final ImmutableList<Field> fields;

    DataNode(
        String constructorName,
        String ownerType,
        ImmutableList<String> typeParameters,
        ImmutableList<Field> fields,
        Node staticMethod) {
      super(Token.DATA, ImmutableList.of(staticMethod));
      this.constructorName = constructorName;
      this.ownerType = ownerType;
      this.typeParameters = typeParameters;
      this.fields = fields;
    }

    @Override
    public String getConstructorName() {
      return constructorName;
    }

    @Override
    public String getOwnerType() {
      return ownerType;
    }

    @Override
    public ImmutableList<String> getTypeParameters() {
      return typeParameters;
    }

    @Override
    public ImmutableList<Field> getFields() {
      return fields;
    }

    @Override
    boolean isPayloadEquivalentTo(Node node) {
      return constructorName.equals(node.getConstructorName())
          && ownerType.equals(node.getOwnerType())
          && typeParameters.equals(node.getTypeParameters())
          && fields.equals(node.getFields());
    }

    @Override
    String payloadToString() {
      return constructorName + " : " + ownerType;
    }
  }

  private static final class ObjectLitNode extends Node {
    private final ImmutableList<String> keys;

    ObjectLitNode(ImmutableList<String> keys, ImmutableList<Node> values) {
      super(Token.OBJECTLIT, values);
      checkArgument(
          keys.size() == values.size(),
          "Object literal has %s keys but %s values",
          keys.size(),
          values.size());
      this.keys = keys;
    }

    @Override
    public ImmutableList<String> getKeys() {
      return keys;
    }

    @Override
    boolean isPayloadEquivalentTo(Node node) {
      return keys.equals(node.getKeys());
    }

    @Override
    String payloadToString() {
      return keys.toString();
    }
  }

  private static final class CommentNode extends Node {
    private final ImmutableList<Comment> comments;

    CommentNode(ImmutableList<Comment> comments, Node inner) {
      super(Token.COMMENT, ImmutableList.of(inner));
      this.comments = comments;
    }

    @Override
    public ImmutableList<Comment> getComments() {
      return comments;
    }

    @Override
    boolean isPayloadEquivalentTo(Node node) {
      return comments.equals(node.getComments());
    }

    @Override
    String payloadToString() {
      return comments.size() + " comment(s)";
    }
  }

  private final Token token;
  private final ImmutableList<Node> children;

  Node(Token token, ImmutableList<Node> children) {
    this.token = checkNotNull(token);
    this.children = checkNotNull(children);
  }

  static Node newNumber(Number number) {
    return new NumberNode(number);
  }

  static Node newString(Token token, String str, Node... children) {
    return new StringNode(token, str, ImmutableList.copyOf(children));
  }

  static Node newString(Token token, String str, ImmutableList<Node> children) {
    return new StringNode(token, str, children);
  }

  static Node newFunction(
      @Nullable String name,
      ImmutableList<String> typeParameters,
      @Nullable String returnType,
      ImmutableList<String> parameters,
      Node body) {
    return new FunctionNode(name, typeParameters, returnType, parameters, body);
  }

  static Node newData(
      String constructorName,
      String ownerType,
      ImmutableList<String> typeParameters,
      ImmutableList<Field> fields,
      Node staticMethod) {
    return new DataNode(constructorName, ownerType, typeParameters, fields, staticMethod);
  }

  static Node newObjectLit(ImmutableList<String> keys, ImmutableList<Node> values) {
    return new ObjectLitNode(keys, values);
  }

  static Node newComment(ImmutableList<Comment> comments, Node inner) {
    return new CommentNode(comments, inner);
  }

  public final Token getToken() {
    return token;
  }

  public final ImmutableList<Node> children() {
    return children;
  }

  public final int getChildCount() {
    return children.size();
  }

  public final boolean hasChildren() {
    return !children.isEmpty();
  }

  public final @Nullable Node getFirstChild() {
    return children.isEmpty() ? null : children.get(0);
  }

  public final @Nullable Node getSecondChild() {
    return children.size() < 2 ? null : children.get(1);
  }

  public final @Nullable Node getLastChild() {
    return children.isEmpty() ? null : children.get(children.size() - 1);
  }

  public final Node getChildAtIndex(int i) {
    return children.get(i);
  }

  /** Returns the value of a NUMBER node. */
  public Number getNumber() {
    throw new UnsupportedOperationException(this + " is not a number node");
  }

  /**
   * Returns the string payload of STRING, NAME, NAMESPACE, VAR, FOR, FOR_IN, GETPROP, CAST,
   * LABEL_NAME and RAW nodes.
   */
  public String getString() {
    throw new UnsupportedOperationException(this + " is not a string node");
  }

  public @Nullable String getFunctionName() {
    throw new UnsupportedOperationException(this + " is not a function node");
  }

  /** Type parameter names of a FUNCTION or DATA node, in declaration order. */
  public ImmutableList<String> getTypeParameters() {
    throw new UnsupportedOperationException(this + " has no type parameters");
  }

  public @Nullable String getReturnType() {
    throw new UnsupportedOperationException(this + " is not a function node");
  }

  public ImmutableList<String> getParameters() {
    throw new UnsupportedOperationException(this + " is not a function node");
  }

  public String getConstructorName() {
    throw new UnsupportedOperationException(this + " is not a data declaration");
  }

  public String getOwnerType() {
    throw new UnsupportedOperationException(this + " is not a data declaration");
  }

  public ImmutableList<Field> getFields() {
    throw new UnsupportedOperationException(this + " is not a data declaration");
  }

  public ImmutableList<String> getKeys() {
    throw new UnsupportedOperationException(this + " is not an object literal");
  }

  public ImmutableList<Comment> getComments() {
    throw new UnsupportedOperationException(this + " is not a comment node");
  }

  /** Whether this is the RAW node with empty text used to mark "emit nothing". */
  public final boolean isNoOp() {
    return token == Token.RAW && getString().isEmpty();
  }

  public final boolean isRaw() {
    return token == Token.RAW;
  }

  public final boolean isName() {
    return token == Token.NAME;
  }

  public final boolean isVar() {
    return token == Token.VAR;
  }

  public final boolean isBlock() {
    return token == Token.BLOCK;
  }

  public final boolean isNamespace() {
    return token == Token.NAMESPACE;
  }

  public final boolean isFunction() {
    return token == Token.FUNCTION;
  }

  public final boolean isData() {
    return token == Token.DATA;
  }

  public final boolean isLabelName() {
    return token == Token.LABEL_NAME;
  }

  public final boolean isNeg() {
    return token == Token.NEG;
  }

  /** Structural equality: same token, same payload and equivalent children. */
  public final boolean isEquivalentTo(Node node) {
    if (node == this) {
      return true;
    }
    if (token != node.token
        || getClass() != node.getClass()
        || children.size() != node.children.size()
        || !isPayloadEquivalentTo(node)) {
      return false;
    }
    for (int i = 0; i < children.size(); i++) {
      if (!children.get(i).isEquivalentTo(node.children.get(i))) {
        return false;
      }
    }
    return true;
  }

  boolean isPayloadEquivalentTo(Node node) {
    return true;
  }

  String payloadToString() {
    return "";
  }

  @Override
  public String toString() {
    String payload = payloadToString();
    return payload.isEmpty() ? token.toString() : token + " " + payload;
  }

  /** Returns an indented tree dump, for debugging. */
  public String toStringTree() {
    StringBuilder sb = new StringBuilder();
    toStringTreeHelper(this, 0, sb);
    return sb.toString();
  }

  private static void toStringTreeHelper(Node n, int level, StringBuilder sb) {
    for (int i = 0; i < level; i++) {
      sb.append("    ");
    }
    sb.append(n).append('\n');
    for (Node child : n.children) {
      toStringTreeHelper(child, level + 1, sb);
    }
  }
}
