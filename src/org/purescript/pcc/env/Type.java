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

package org.purescript.pcc.env;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.Immutable;

/**
 * The part of the source type language that code generation inspects: enough to see through
 * quantifiers and count function arrows.
 */
@Immutable
public interface Type {

  /** {@code Prim.Function}, the constructor of {@code a -> b}. */
  Type FUNCTION = new TypeConstructor(QualifiedName.of(ModuleName.of("Prim"), "Function"));

  /** A named type such as {@code Prim.Int} or {@code Data.Maybe.Maybe}. */
  record TypeConstructor(QualifiedName name) implements Type {
    public TypeConstructor {
      checkNotNull(name);
    }

    @Override
    public String toString() {
      return name.toString();
    }
  }

  /** A type variable. */
  record TypeVar(String name) implements Type {
    public TypeVar {
      checkArgument(!name.isEmpty(), "Empty type variable");
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** Type application: {@code function argument}. */
  record TypeApp(Type function, Type argument) implements Type {
    public TypeApp {
      checkNotNull(function);
      checkNotNull(argument);
    }

    @Override
    public String toString() {
      return "(" + function + " " + argument + ")";
    }
  }

  /** Universal quantification of {@code variable} over {@code body}. */
  record ForAll(String variable, Type body) implements Type {
    public ForAll {
      checkArgument(!variable.isEmpty(), "Empty quantified variable");
      checkNotNull(body);
    }

    @Override
    public String toString() {
      return "(forall " + variable + ". " + body + ")";
    }
  }

  static Type constructor(String dottedName) {
    return new TypeConstructor(QualifiedName.parse(dottedName));
  }

  static Type typeVar(String name) {
    return new TypeVar(name);
  }

  static Type app(Type function, Type argument) {
    return new TypeApp(function, argument);
  }

  static Type forAll(String variable, Type body) {
    return new ForAll(variable, body);
  }

  /** {@code argument -> result} */
  static Type function(Type argument, Type result) {
    return app(app(FUNCTION, argument), result);
  }

  /** {@code t1 -> t2 -> ... -> result}, right-nested. */
  static Type curried(Type result, Type... arguments) {
    Type type = result;
    for (int i = arguments.length - 1; i >= 0; i--) {
      type = function(arguments[i], type);
    }
    return type;
  }
}
