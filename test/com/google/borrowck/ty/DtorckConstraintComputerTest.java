/*
 * Copyright 2018 The Closure Compiler Authors.
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
package com.google.borrowck.ty;

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class DtorckConstraintComputerTest {

  private static final Region R1 = Region.var(1);

  private final DtorckConstraintComputer computer = new DtorckConstraintComputer();

  /** {@code struct Guard<'a> { r: &'a u32 }} with a destructor. */
  private static AdtDef guard(boolean mayDangle) {
    AdtDef.Builder builder = AdtDef.builder("Guard");
    Region a = builder.addRegionParam("'a", Variance.COVARIANT, mayDangle);
    return builder.addField(Ty.ref(a, Ty.U32)).setHasDestructor(true).build();
  }

  @Test
  public void testReferencesHaveNoDropGlue() {
    DropckOutlivesResult result = computer.dropckOutlives(Ty.ref(R1, Ty.U32)).value();
    assertThat(result.kinds()).isEmpty();
    assertThat(result.hasOverflowed()).isFalse();
  }

  @Test
  public void testDestructorRequiresArgumentsLive() {
    DropckOutlivesResult result = computer.dropckOutlives(Ty.adt(guard(false), R1)).value();
    assertThat(result.kinds()).containsExactly(R1);
  }

  @Test
  public void testMayDangleParameterIsExempt() {
    DropckOutlivesResult result = computer.dropckOutlives(Ty.adt(guard(true), R1)).value();
    assertThat(result.kinds()).isEmpty();
  }

  @Test
  public void testPhantomDataOwnsItsParameter() {
    AdtDef.Builder builder = AdtDef.builder("PhantomData");
    builder.addTypeParam("T", Variance.COVARIANT, false);
    AdtDef phantom = builder.setPhantomData(true).build();

    Ty guardTy = Ty.adt(guard(false), R1);
    DropckOutlivesResult result = computer.dropckOutlives(Ty.adt(phantom, guardTy)).value();
    assertThat(result.kinds()).containsExactly(guardTy);
  }

  @Test
  public void testTuplesAndPlainStructsRecurse() {
    AdtDef.Builder builder = AdtDef.builder("Holder");
    Ty t = builder.addTypeParam("T", Variance.COVARIANT, false);
    AdtDef holder = builder.addField(t).build();

    Ty ty = Ty.tuple(Ty.U32, Ty.adt(holder, Ty.adt(guard(false), R1)));
    assertThat(computer.dropckOutlives(ty).value().kinds()).containsExactly(R1);
  }

  @Test
  public void testTypeParametersMustOutliveTheDrop() {
    Ty param = Ty.param(0, "T");
    assertThat(computer.dropckOutlives(Ty.tuple(param)).value().kinds()).containsExactly(param);
  }

  @Test
  public void testDeepNestingOverflows() {
    DtorckConstraintComputer shallow = new DtorckConstraintComputer(2);
    Ty innermost = Ty.tuple(Ty.U32);
    Ty ty = Ty.tuple(Ty.tuple(Ty.tuple(innermost)));

    DropckOutlivesResult result = shallow.dropckOutlives(ty).value();
    assertThat(result.hasOverflowed()).isTrue();
    assertThat(result.overflows()).containsExactly(innermost);
  }
}
