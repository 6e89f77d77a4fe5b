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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class QualifiedNameTest {

  @Test
  public void testParseQualified() {
    QualifiedName name = QualifiedName.parse("Data.Maybe.Just");
    assertThat(name.isQualified()).isTrue();
    assertThat(name.getModuleName()).isEqualTo(ModuleName.of("Data", "Maybe"));
    assertThat(name.getName()).isEqualTo("Just");
    assertThat(name.toString()).isEqualTo("Data.Maybe.Just");
  }

  @Test
  public void testParseUnqualified() {
    QualifiedName name = QualifiedName.parse("Just");
    assertThat(name.isQualified()).isFalse();
    assertThat(name.getModuleName()).isNull();
    assertThat(name).isEqualTo(QualifiedName.unqualified("Just"));
  }

  @Test
  public void testModuleName() {
    ModuleName name = ModuleName.parse("Control.Monad.Eff");
    assertThat(name.getSegments()).containsExactly("Control", "Monad", "Eff").inOrder();
    assertThat(name.toString()).isEqualTo("Control.Monad.Eff");
    assertThrows(IllegalArgumentException.class, () -> ModuleName.parse("Data..Maybe"));
    assertThrows(IllegalArgumentException.class, () -> ModuleName.of());
  }

  @Test
  public void testCurriedTypes() {
    Type a = Type.typeVar("a");
    Type b = Type.typeVar("b");
    Type r = Type.constructor("Main.R");
    assertThat(Type.curried(r, a, b)).isEqualTo(Type.function(a, Type.function(b, r)));
    assertThat(Type.curried(r)).isEqualTo(r);
  }
}
