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

import com.google.auto.value.AutoValue;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.Immutable;

/** A source comment carried through to the generated code. */
@AutoValue
@Immutable
public abstract class Comment {

  /** Comment styles of the source language. */
  public enum Kind {
    LINE,
    BLOCK
  }

  private static final Splitter LINE_SPLITTER = Splitter.on('\n');

  public abstract Kind getKind();

  public abstract String getText();

  public static Comment line(String text) {
    return new AutoValue_Comment(Kind.LINE, text);
  }

  public static Comment block(String text) {
    return new AutoValue_Comment(Kind.BLOCK, text);
  }

  /**
   * Returns the lines this comment contributes to a doc block. A line comment is always one
   * line; a block comment is split on line breaks.
   */
  public ImmutableList<String> getLines() {
    if (getKind() == Kind.LINE) {
      return ImmutableList.of(getText());
    }
    String text = getText();
    if (text.isEmpty()) {
      return ImmutableList.of();
    }
    if (text.endsWith("\n")) {
      text = text.substring(0, text.length() - 1);
    }
    return ImmutableList.copyOf(LINE_SPLITTER.split(text));
  }
}
