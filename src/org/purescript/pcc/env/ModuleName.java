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
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.Immutable;

/** A module name, made of one or more proper-name segments: {@code Data.Maybe}. */
@AutoValue
@Immutable
public abstract class ModuleName {
  public abstract ImmutableList<String> getSegments();

  public static ModuleName of(String... segments) {
    return of(ImmutableList.copyOf(segments));
  }

  public static ModuleName of(Iterable<String> segments) {
    ImmutableList<String> parts = ImmutableList.copyOf(segments);
    checkArgument(!parts.isEmpty(), "A module name needs at least one segment");
    for (String part : parts) {
      checkArgument(!part.isEmpty(), "Empty module name segment in %s", parts);
    }
    return new AutoValue_ModuleName(parts);
  }

  /** Parses a dotted module name such as {@code Data.Maybe}. */
  public static ModuleName parse(String dotted) {
    return of(Splitter.on('.').split(dotted));
  }

  @Override
  public final String toString() {
    return Joiner.on('.').join(getSegments());
  }
}
