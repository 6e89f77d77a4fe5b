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
import static com.google.common.truth.Truth.assertWithMessage;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.purescript.pcc.env.ModuleName;

@RunWith(JUnit4.class)
public final class NameManglerTest {

  @Test
  public void testAlphanumericNamesAreUnchanged() {
    assertThat(NameMangler.mangle("foo")).isEqualTo("foo");
    assertThat(NameMangler.mangle("x1")).isEqualTo("x1");
    assertThat(NameMangler.mangle("λx")).isEqualTo("λx");
    assertThat(NameMangler.needsEscaping("foo")).isFalse();
  }

  @Test
  public void testMangleIsIdempotentOnSafeNames() {
    for (String name : new String[] {"map", "foldl1", "Just", "value0"}) {
      String once = NameMangler.mangle(name);
      assertThat(NameMangler.mangle(once)).isEqualTo(once);
    }
  }

  @Test
  public void testPrimes() {
    assertThat(NameMangler.mangle("foo'")).isEqualTo("foo_");
    assertThat(NameMangler.mangle("foo''")).isEqualTo("foo__");
    assertThat(NameMangler.needsEscaping("foo'")).isTrue();
  }

  @Test
  public void testNamedSymbols() {
    assertThat(NameMangler.mangle("a_b")).isEqualTo("a_symbol_b");
    assertThat(NameMangler.mangle("$")).isEqualTo("dollar_symbol_");
    assertThat(NameMangler.mangleOperator("<>")).isEqualTo("less_symbol_greater_symbol_");
    assertThat(NameMangler.mangleOperator("<<<")).isEqualTo(
        "less_symbol_less_symbol_less_symbol_");
    assertThat(NameMangler.mangleOperator("+")).isEqualTo("plus_symbol_");
    for (char c : NameMangler.namedSymbols()) {
      assertThat(NameMangler.escapeCodePoint(c)).endsWith("_symbol_");
    }
  }

  @Test
  public void testUnnamedSymbolsUseTheirCodePoint() {
    assertThat(NameMangler.mangle("a b")).isEqualTo("a32__b");
    assertThat(NameMangler.mangle("€")).isEqualTo("8364__");
    assertThat(NameMangler.escapeCodePoint(0x1F600)).isEqualTo("128512__");
  }

  @Test
  public void testReservedNames() {
    assertThat(NameMangler.mangle("class")).isEqualTo("class__");
    assertThat(NameMangler.mangle("namespace")).isEqualTo("namespace__");
    assertThat(NameMangler.mangle("main")).isEqualTo("main__");
    assertThat(NameMangler.mangle("PureScript")).isEqualTo("PureScript__");
    assertThat(NameMangler.isReserved("Class")).isFalse();
    assertThat(NameMangler.needsEscaping("delete")).isTrue();
  }

  @Test
  public void testEveryReservedWordGetsSuffix() {
    assertThat(NameMangler.reservedNames()).contains("xor_eq");
    for (String word : NameMangler.reservedNames()) {
      assertWithMessage(word).that(NameMangler.isReserved(word)).isTrue();
      assertWithMessage(word).that(NameMangler.mangle(word)).isEqualTo(word + "__");
      assertWithMessage(word).that(NameMangler.needsEscaping(word)).isTrue();
    }
  }

  @Test
  public void testNeedsEscapingAgreesWithMangle() {
    ImmutableList<String> names =
        ImmutableList.<String>builder()
            .add("foo", "Foo1", "λx", "x'", "a_b", "<>", "a b", "€", "😀", "", "8364__")
            .add("Data.Maybe", "$", "_", "'", "café", "class", "classy", "std", "Std")
            .addAll(NameMangler.reservedNames())
            .build();
    for (String name : names) {
      assertWithMessage(name)
          .that(NameMangler.needsEscaping(name))
          .isEqualTo(!NameMangler.mangle(name).equals(name));
    }
    for (char c : NameMangler.namedSymbols()) {
      String name = "x" + c;
      assertWithMessage(name).that(NameMangler.needsEscaping(name)).isTrue();
    }
  }

  @Test
  public void testOperatorsAreNotCheckedForReservedWords() {
    assertThat(NameMangler.mangleOperator("and")).isEqualTo("and");
  }

  @Test
  public void testKnownCollisions() {
    assertThat(NameMangler.mangle("a'symbol'")).isEqualTo(NameMangler.mangle("a_"));
    assertThat(NameMangler.mangle("€")).isEqualTo(NameMangler.mangle("8364''"));
  }

  @Test
  public void testModuleNameToCpp() {
    assertThat(NameMangler.moduleNameToCpp(ModuleName.parse("Data.Maybe")))
        .isEqualTo("Data_Maybe");
    assertThat(NameMangler.moduleNameToCpp(ModuleName.of("Main"))).isEqualTo("Main");
  }
}
