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

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.purescript.pcc.ast.IR;
import org.purescript.pcc.ast.Node;

@RunWith(JUnit4.class)
public final class OperatorTableTest {
  private final OperatorTable table = OperatorTable.cpp();

  private int level(Node n) {
    return table.findLevel(n);
  }

  @Test
  public void testLevelOrder() {
    Node x = IR.name("x");
    assertThat(table.getLevelCount()).isEqualTo(29);
    assertThat(level(IR.getprop(x, "p"))).isEqualTo(0);
    assertThat(level(IR.call(x))).isLessThan(level(IR.newNode(x)));
    assertThat(level(IR.lt(x, x))).isLessThan(level(IR.not(x)));
    assertThat(level(IR.mul(x, x))).isLessThan(level(IR.add(x, x)));
    assertThat(level(IR.add(x, x))).isEqualTo(level(IR.sub(x, x)));
    assertThat(level(IR.and(x, x))).isLessThan(level(IR.or(x, x)));
    assertThat(level(IR.hook(x, x, x))).isEqualTo(table.getLevelCount() - 1);
  }

  @Test
  public void testNonOperatorsHaveNoLevel() {
    assertThat(level(IR.name("x"))).isEqualTo(-1);
    assertThat(level(IR.number(1))).isEqualTo(-1);
    assertThat(level(IR.block())).isEqualTo(-1);
    assertThat(level(IR.raw("x"))).isEqualTo(-1);
  }

  @Test
  public void testLambdaIsAnOperator() {
    Node fn = IR.function(ImmutableList.of("x"), IR.block());
    assertThat(level(fn)).isEqualTo(4);
  }

  @Test
  public void testRestrictedLevelsParenthesize() {
    CodeGenerator cg = new CodeGenerator(new CompilerOptions());
    Node sum = IR.add(IR.name("a"), IR.name("b"));
    assertThat(table.print(cg, sum)).isEqualTo("a + b");
    assertThat(table.print(cg, sum, level(sum))).isEqualTo("a + b");
    assertThat(table.print(cg, sum, level(sum) - 1)).isEqualTo("(a + b)");
    assertThat(table.print(cg, IR.name("a"), 0)).isEqualTo("a");
  }
}
