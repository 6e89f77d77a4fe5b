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

import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.purescript.pcc.env.DataDeclType;
import org.purescript.pcc.env.Environment;
import org.purescript.pcc.env.QualifiedName;
import org.purescript.pcc.env.Type;

@RunWith(JUnit4.class)
public final class DataConstructorsTest {
  private static final QualifiedName JUST = QualifiedName.parse("Data.Maybe.Just");
  private static final QualifiedName NOTHING = QualifiedName.parse("Data.Maybe.Nothing");
  private static final QualifiedName TUPLE = QualifiedName.parse("Data.Tuple.Tuple");
  private static final QualifiedName WRAP = QualifiedName.parse("Data.Wrap.Wrap");
  private static final QualifiedName OTHER_MAYBE = QualifiedName.parse("Data.Other.OnlyMaybe");

  private Environment env;

  @Before
  public void setUp() {
    Type a = Type.typeVar("a");
    Type b = Type.typeVar("b");
    Type maybeA = Type.app(Type.constructor("Data.Maybe.Maybe"), a);
    Type tupleAB = Type.app(Type.app(Type.constructor("Data.Tuple.Tuple"), a), b);
    env =
        Environment.builder()
            .addDataConstructor(
                JUST, DataDeclType.DATA, "Maybe", Type.forAll("a", Type.function(a, maybeA)))
            .addDataConstructor(NOTHING, DataDeclType.DATA, "Maybe", Type.forAll("a", maybeA))
            .addDataConstructor(
                TUPLE,
                DataDeclType.DATA,
                "Tuple",
                Type.forAll("a", Type.forAll("b", Type.curried(tupleAB, a, b))))
            .addDataConstructor(
                WRAP,
                DataDeclType.NEWTYPE,
                "Wrap",
                Type.function(Type.constructor("Prim.Int"), Type.constructor("Data.Wrap.Wrap")))
            .addDataConstructor(
                OTHER_MAYBE, DataDeclType.DATA, "Maybe", Type.constructor("Data.Other.Maybe"))
            .build();
  }

  @Test
  public void testLookupConstructor() {
    assertThat(DataConstructors.lookupConstructor(env, JUST).getTypeName()).isEqualTo("Maybe");
  }

  @Test
  public void testMissingConstructorIsAnInternalError() {
    InternalCompilerException e =
        assertThrows(
            InternalCompilerException.class,
            () -> DataConstructors.lookupConstructor(env, QualifiedName.parse("Data.Maybe.Some")));
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("Internal compiler error: Data constructor not found: Data.Maybe.Some");
    assertThrows(
        InternalCompilerException.class,
        () -> DataConstructors.getConstructorArity(Environment.empty(), JUST));
  }

  @Test
  public void testIsOnlyConstructor() {
    assertThat(DataConstructors.isOnlyConstructor(env, JUST)).isFalse();
    assertThat(DataConstructors.isOnlyConstructor(env, NOTHING)).isFalse();
    assertThat(DataConstructors.isOnlyConstructor(env, TUPLE)).isTrue();
    assertThat(DataConstructors.isOnlyConstructor(env, WRAP)).isTrue();
  }

  @Test
  public void testIsOnlyConstructorComparesDefiningModules() {
    // Same type name as Data.Maybe.Maybe, different module.
    assertThat(DataConstructors.isOnlyConstructor(env, OTHER_MAYBE)).isTrue();
  }

  @Test
  public void testIsOnlyConstructorNeedsQualifiedNames() {
    QualifiedName local = QualifiedName.unqualified("Local");
    Environment withLocal =
        Environment.builder()
            .addDataConstructor(local, DataDeclType.DATA, "Local", Type.constructor("Local"))
            .build();
    InternalCompilerException e =
        assertThrows(
            InternalCompilerException.class,
            () -> DataConstructors.isOnlyConstructor(withLocal, local));
    assertThat(e).hasMessageThat().contains("not qualified");
  }

  @Test
  public void testIsNewtypeConstructor() {
    assertThat(DataConstructors.isNewtypeConstructor(env, WRAP)).isTrue();
    assertThat(DataConstructors.isNewtypeConstructor(env, JUST)).isFalse();
  }

  @Test
  public void testConstructorArity() {
    assertThat(DataConstructors.getConstructorArity(env, NOTHING)).isEqualTo(0);
    assertThat(DataConstructors.getConstructorArity(env, JUST)).isEqualTo(1);
    assertThat(DataConstructors.getConstructorArity(env, TUPLE)).isEqualTo(2);
    assertThat(DataConstructors.getConstructorArity(env, WRAP)).isEqualTo(1);
  }

  @Test
  public void testIsNullaryConstructor() {
    assertThat(DataConstructors.isNullaryConstructor(env, NOTHING)).isTrue();
    assertThat(DataConstructors.isNullaryConstructor(env, JUST)).isFalse();
  }

  @Test
  public void testCountArgumentsCountsEveryArrow() {
    Type result = Type.constructor("Main.Result");
    Type t1 = Type.constructor("Main.T1");
    Type t2 = Type.constructor("Main.T2");
    Type t3 = Type.constructor("Main.T3");
    assertThat(DataConstructors.countArguments(Type.curried(result, t1, t2, t3))).isEqualTo(3);
    // A function-typed argument is still one argument.
    assertThat(
            DataConstructors.countArguments(Type.function(Type.function(t1, t2), result)))
        .isEqualTo(1);
    // Applications of other constructors are not arrows.
    assertThat(DataConstructors.countArguments(Type.app(Type.app(t1, t2), t3))).isEqualTo(0);
  }
}
