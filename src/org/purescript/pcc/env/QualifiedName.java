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

import com.google.auto.value.AutoValue;
import com.google.errorprone.annotations.Immutable;
import org.jspecify.annotations.Nullable;

/** A proper name, optionally qualified by the module that defines it. */
@AutoValue
@Immutable
public abstract class QualifiedName {
  /** The defining module, or null for a name that is local to the current module. */
  public abstract @Nullable ModuleName getModuleName();

  public abstract String getName();

  public static QualifiedName of(ModuleName moduleName, String name) {
    checkArgument(!name.isEmpty(), "Empty name");
    return new AutoValue_QualifiedName(moduleName, name);
  }

  public static QualifiedName unqualified(String name) {
    checkArgument(!name.isEmpty(), "Empty name");
    return new AutoValue_QualifiedName(null, name);
  }

  /** Parses {@code Data.Maybe.Just} as the name {@code Just} in module {@code Data.Maybe}. */
  public static QualifiedName parse(String dotted) {
    int dot = dotted.lastIndexOf('.');
    if (dot == -1) {
      return unqualified(dotted);
    }
    return of(ModuleName.parse(dotted.substring(0, dot)), dotted.substring(dot + 1));
  }

  public final boolean isQualified() {
    return getModuleName() != null;
  }

  @Override
  public final String toString() {
    ModuleName moduleName = getModuleName();
    return moduleName == null ? getName() : moduleName + "." + getName();
  }
}
