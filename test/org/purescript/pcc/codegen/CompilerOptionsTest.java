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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CompilerOptionsTest {

  @Test
  public void testDefaults() {
    CompilerOptions options = new CompilerOptions();
    assertThat(options.getIndentUnit()).isEqualTo("  ");
    assertThat(options.shouldPreserveComments()).isTrue();
    options.validate();
  }

  @Test
  public void testTabsAndSpacesAreValid() {
    CompilerOptions options = new CompilerOptions();
    options.setIndentUnit("\t");
    options.validate();
    options.setIndentUnit("    ");
    options.validate();
  }

  @Test
  public void testInvalidIndentUnit() {
    CompilerOptions options = new CompilerOptions();
    options.setIndentUnit("");
    assertThrows(CompilerOptions.InvalidOptionsException.class, options::validate);

    options.setIndentUnit(" x");
    CompilerOptions.InvalidOptionsException e =
        assertThrows(CompilerOptions.InvalidOptionsException.class, options::validate);
    assertThat(e).hasMessageThat().contains("\" x\"");
  }
}
