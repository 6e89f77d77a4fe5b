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

import java.util.Map;
import org.purescript.pcc.env.DataConstructor;
import org.purescript.pcc.env.DataDeclType;
import org.purescript.pcc.env.Environment;
import org.purescript.pcc.env.ModuleName;
import org.purescript.pcc.env.QualifiedName;
import org.purescript.pcc.env.Type;

/**
 * Queries about data constructors that code generation needs when emitting constructor
 * applications and pattern matches.
 *
 * <p>Every query assumes the constructor exists: the type checker guarantees it, so a missing
 * entry is an {@link InternalCompilerException}.
 */
public final class DataConstructors {

  private DataConstructors() {}

  /** Finds the value stored for a data constructor in the environment. */
  public static DataConstructor lookupConstructor(Environment env, QualifiedName ctor) {
    DataConstructor constructor = env.getDataConstructor(ctor);
    if (constructor == null) {
      throw new InternalCompilerException("Data constructor not found: %s", ctor);
    }
    return constructor;
  }

  /**
   * Checks whether a data constructor is the only constructor of its type, in which case
   * binders can skip the runtime constructor check.
   */
  public static boolean isOnlyConstructor(Environment env, QualifiedName ctor) {
    DataConstructor constructor = lookupConstructor(env, ctor);
    ModuleName moduleName = definingModule(ctor);
    int count = 0;
    for (Map.Entry<QualifiedName, DataConstructor> entry :
        env.getDataConstructors().entrySet()) {
      if (moduleName.equals(definingModule(entry.getKey()))
          && constructor.getTypeName().equals(entry.getValue().getTypeName())) {
        count++;
      }
    }
    return count == 1;
  }

  /** Checks whether a data constructor belongs to a newtype. */
  public static boolean isNewtypeConstructor(Environment env, QualifiedName ctor) {
    return lookupConstructor(env, ctor).getDeclType() == DataDeclType.NEWTYPE;
  }

  /** Returns the number of curried arguments a data constructor accepts. */
  public static int getConstructorArity(Environment env, QualifiedName ctor) {
    return countArguments(lookupConstructor(env, ctor).getType());
  }

  /** Checks whether a data constructor takes no arguments, like {@code Nothing}. */
  public static boolean isNullaryConstructor(Environment env, QualifiedName ctor) {
    return getConstructorArity(env, ctor) == 0;
  }

  static int countArguments(Type type) {
    int arity = 0;
    while (true) {
      if (type instanceof Type.ForAll forAll) {
        type = forAll.body();
      } else if (type instanceof Type.TypeApp app
          && app.function() instanceof Type.TypeApp arrow
          && arrow.function().equals(Type.FUNCTION)) {
        arity++;
        type = app.argument();
      } else {
        return arity;
      }
    }
  }

  private static ModuleName definingModule(QualifiedName ctor) {
    ModuleName moduleName = ctor.getModuleName();
    if (moduleName == null) {
      throw new InternalCompilerException(
          "Data constructor %s is not qualified by its defining module", ctor);
    }
    return moduleName;
  }
}
