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

import com.google.auto.value.AutoValue;
import com.google.errorprone.annotations.Immutable;

/** What the type checker recorded about one data constructor. */
@AutoValue
@Immutable
public abstract class DataConstructor {
  public abstract DataDeclType getDeclType();

  /** The proper name of the type this constructor builds. */
  public abstract String getTypeName();

  /** The constructor's curried function type, possibly under quantifiers. */
  public abstract Type getType();

  public static DataConstructor create(DataDeclType declType, String typeName, Type type) {
    return new AutoValue_DataConstructor(declType, typeName, type);
  }
}
