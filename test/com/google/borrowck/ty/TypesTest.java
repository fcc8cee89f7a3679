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
import static org.junit.Assert.assertThrows;

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class TypesTest {

  private static final Region R1 = Region.var(1);
  private static final Region R2 = Region.var(2);

  /** {@code for<'x> fn(&'x u32) -> &'_#1r u32}. */
  private static final Ty HIGHER_RANKED_FN =
      Ty.fnPtr(
          Binder.bind(FnSig.of(Ty.ref(R1, Ty.U32), Ty.ref(Region.lateBound(0, "x"), Ty.U32))));

  @Test
  public void testForEachFreeRegionSkipsRegionsBoundInside() {
    List<Region> free = new ArrayList<>();
    Types.forEachFreeRegion(HIGHER_RANKED_FN, free::add);
    assertThat(free).containsExactly(R1);
  }

  @Test
  public void testForEachFreeRegionVisitsAdtArguments() {
    AdtDef.Builder builder = AdtDef.builder("Pair");
    Region a = builder.addRegionParam("'a", Variance.COVARIANT, false);
    Ty t = builder.addTypeParam("T", Variance.COVARIANT, false);
    AdtDef pair = builder.addField(Ty.ref(a, t)).build();

    List<Region> free = new ArrayList<>();
    Types.forEachFreeRegion(Ty.adt(pair, R1, Ty.ref(R2, Ty.BOOL)), free::add);
    assertThat(free).containsExactly(R1, R2).inOrder();
  }

  @Test
  public void testEscapingBoundRegions() {
    assertThat(Types.hasEscapingBoundRegions(Ty.ref(Region.lateBound(0, "x"), Ty.U32))).isTrue();
    assertThat(Types.hasEscapingBoundRegions(HIGHER_RANKED_FN)).isFalse();
    assertThat(Types.hasEscapingBoundRegions(Ty.ref(R1, Ty.U32))).isFalse();
  }

  @Test
  public void testContainsRegion() {
    assertThat(Types.containsRegion(HIGHER_RANKED_FN, RegionVid.of(1))).isTrue();
    assertThat(Types.containsRegion(HIGHER_RANKED_FN, RegionVid.of(2))).isFalse();
  }

  @Test
  public void testFoldRegionsLeavesInnerBindersAlone() {
    Ty folded =
        Types.foldRegions(
            HIGHER_RANKED_FN,
            (region, outer) ->
                region instanceof Region.LateBound lateBound && lateBound.debruijn().equals(outer)
                    ? R2
                    : region);
    assertThat(folded).isEqualTo(HIGHER_RANKED_FN);
  }

  @Test
  public void testFoldRegionsOfUnwrappedSignature() {
    Ty input = ((Ty.FnPtr) HIGHER_RANKED_FN).sig().skipBinder().inputs().get(0);
    Ty folded =
        Types.foldRegions(
            input,
            (region, outer) ->
                region instanceof Region.LateBound lateBound && lateBound.debruijn().equals(outer)
                    ? R2
                    : region);
    assertThat(folded).isEqualTo(Ty.ref(R2, Ty.U32));
  }

  @Test
  public void testSubstitute() {
    AdtDef.Builder builder = AdtDef.builder("Wrapper");
    Region a = builder.addRegionParam("'a", Variance.COVARIANT, false);
    Ty t = builder.addTypeParam("T", Variance.COVARIANT, false);
    AdtDef wrapper = builder.addField(Ty.refMut(a, Ty.tuple(t, Ty.BOOL))).build();

    Ty field = Types.substitute(wrapper.getFields().get(0), List.of(R1, Ty.U32));
    assertThat(field).isEqualTo(Ty.refMut(R1, Ty.tuple(Ty.U32, Ty.BOOL)));
  }

  @Test
  public void testSubstituteRejectsKindMismatch() {
    AdtDef.Builder builder = AdtDef.builder("Wrapper");
    Ty t = builder.addTypeParam("T", Variance.COVARIANT, false);
    AdtDef wrapper = builder.addField(t).build();

    assertThrows(
        IllegalArgumentException.class,
        () -> Types.substitute(wrapper.getFields().get(0), List.of(R1)));
  }
}
