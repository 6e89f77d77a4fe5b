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
public final class EnvironmentTest {
  private static final QualifiedName UNIT = QualifiedName.parse("Data.Unit.Unit");

  @Test
  public void testEmpty() {
    assertThat(Environment.empty().getDataConstructors()).isEmpty();
    assertThat(Environment.empty().getDataConstructor(UNIT)).isNull();
  }

  @Test
  public void testLookup() {
    DataConstructor unit =
        DataConstructor.create(DataDeclType.DATA, "Unit", Type.constructor("Data.Unit.Unit"));
    Environment env = Environment.builder().addDataConstructor(UNIT, unit).build();
    assertThat(env.getDataConstructor(UNIT)).isEqualTo(unit);
    assertThat(env.getDataConstructor(QualifiedName.parse("Other.Unit"))).isNull();
  }

  @Test
  public void testDuplicateConstructorsRejected() {
    Environment.Builder builder =
        Environment.builder()
            .addDataConstructor(UNIT, DataDeclType.DATA, "Unit", Type.typeVar("a"))
            .addDataConstructor(UNIT, DataDeclType.DATA, "Unit", Type.typeVar("a"));
    assertThrows(IllegalArgumentException.class, builder::build);
  }
}
