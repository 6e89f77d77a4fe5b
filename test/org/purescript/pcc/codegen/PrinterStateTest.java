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
public final class PrinterStateTest {

  @Test
  public void testWithIndent() {
    PrinterState state = new PrinterState("  ");
    assertThat(state.currentIndent()).isEmpty();
    String nested =
        state.withIndent(() -> state.currentIndent() + "|" + state.withIndent(state::currentIndent));
    assertThat(nested).isEqualTo("  |    ");
    assertThat(state.getIndent()).isEqualTo(0);
  }

  @Test
  public void testDepthRestoredWhenPrinterThrows() {
    PrinterState state = new PrinterState("\t");
    assertThrows(
        IllegalStateException.class,
        () ->
            state.withIndent(
                () -> {
                  throw new IllegalStateException("boom");
                }));
    assertThat(state.getIndent()).isEqualTo(0);
    assertThat(state.currentIndent()).isEmpty();
  }
}
