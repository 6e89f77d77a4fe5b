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

import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.Immutable;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * The compiled environment handed over by the type checker. Code generation only reads the data
 * constructor table; the environment is passed explicitly to every query that needs it.
 */
@Immutable
public final class Environment {
  private static final Logger logger = Logger.getLogger(Environment.class.getName());

  private final ImmutableMap<QualifiedName, DataConstructor> dataConstructors;

  private Environment(ImmutableMap<QualifiedName, DataConstructor> dataConstructors) {
    this.dataConstructors = dataConstructors;
  }

  public static Environment empty() {
    return new Environment(ImmutableMap.of());
  }

  public static Builder builder() {
    return new Builder();
  }

  /** All data constructors, keyed by qualified constructor name, in registration order. */
  public ImmutableMap<QualifiedName, DataConstructor> getDataConstructors() {
    return dataConstructors;
  }

  public @Nullable DataConstructor getDataConstructor(QualifiedName name) {
    return dataConstructors.get(name);
  }

  /** Builder for {@link Environment}. Registering the same constructor twice is an error. */
  public static final class Builder {
    private final ImmutableMap.Builder<QualifiedName, DataConstructor> dataConstructors =
        ImmutableMap.builder();

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder addDataConstructor(QualifiedName name, DataConstructor constructor) {
      dataConstructors.put(name, constructor);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addDataConstructor(
        QualifiedName name, DataDeclType declType, String typeName, Type type) {
      return addDataConstructor(name, DataConstructor.create(declType, typeName, type));
    }

    public Environment build() {
      ImmutableMap<QualifiedName, DataConstructor> built = dataConstructors.buildOrThrow();
      logger.fine("Environment built with " + built.size() + " data constructors");
      return new Environment(built);
    }
  }
}
