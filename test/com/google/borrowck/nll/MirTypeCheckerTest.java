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
package com.google.borrowck.nll;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.borrowck.mir.Body;
import com.google.borrowck.mir.Local;
import com.google.borrowck.mir.Location;
import com.google.borrowck.mir.Operand;
import com.google.borrowck.mir.Place;
import com.google.borrowck.mir.Rvalue;
import com.google.borrowck.mir.SourceSpan;
import com.google.borrowck.mir.Terminator;
import com.google.borrowck.ty.AdtDef;
import com.google.borrowck.ty.DtorckConstraintComputer;
import com.google.borrowck.ty.Mutability;
import com.google.borrowck.ty.Region;
import com.google.borrowck.ty.RegionVid;
import com.google.borrowck.ty.Ty;
import com.google.borrowck.ty.Variance;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class MirTypeCheckerTest {

  private RegionVariables vars;
  private UniversalRegions universalRegions;
  private BorrowCheckContext cx;

  @Before
  public void setUp() {
    vars = new RegionVariables();
    universalRegions = UniversalRegions.builder(vars).build();
  }

  private static SourceSpan line(int lineno) {
    return SourceSpan.of("test.rs", lineno, 1, 1);
  }

  private static RegionVid vid(Region region) {
    return ((Region.Var) region).vid();
  }

  private void typeCheck(Body body) {
    cx =
        new BorrowCheckContext(
            body, universalRegions, new DtorckConstraintComputer(), new BorrowckOptions());
    MirTypeChecker.typeCheck(cx);
  }

  private @Nullable Locations locationsOf(Region sup, Region sub) {
    for (OutlivesConstraint constraint : cx.constraints) {
      if (constraint.sup.equals(vid(sup)) && constraint.sub.equals(vid(sub))) {
        return constraint.locations;
      }
    }
    return null;
  }

  /** {@code r = &'t (**p)} with {@code p: &'m mut &'s u32}. */
  @Test
  public void testReborrowStopsAtSharedReference() {
    Region m = vars.newVar();
    Region s = vars.newVar();
    Region rr = vars.newVar();
    Region t = vars.newVar();

    Body.Builder builder = Body.builder("reborrow", Ty.UNIT);
    Local p = builder.addArg("p", Ty.refMut(m, Ty.ref(s, Ty.U32)), line(1));
    Local r = builder.addLocal("r", Ty.ref(rr, Ty.U32), line(2));
    int bb0 = builder.newBlock();
    builder.assign(
        bb0,
        Place.of(r),
        new Rvalue.Ref(t, Mutability.NOT, Place.of(p).deref().deref()),
        line(10));
    builder.terminate(bb0, new Terminator.Return(line(11)));
    typeCheck(builder.build());

    assertThat(locationsOf(s, t)).isEqualTo(Locations.boring(Location.of(0, 0)));
    assertThat(cx.constraints.contains(vid(m), vid(t))).isFalse();
    assertThat(locationsOf(t, rr)).isEqualTo(Locations.interesting(Location.of(0, 0)));
  }

  /** {@code r = &'t mut (**p)} with {@code p: &'m mut &'s mut u32}. */
  @Test
  public void testReborrowThroughMutableReferencesConstrainsEveryReference() {
    Region m = vars.newVar();
    Region s = vars.newVar();
    Region rr = vars.newVar();
    Region t = vars.newVar();

    Body.Builder builder = Body.builder("reborrow_mut", Ty.UNIT);
    Local p = builder.addArg("p", Ty.refMut(m, Ty.refMut(s, Ty.U32)), line(1));
    Local r = builder.addLocal("r", Ty.refMut(rr, Ty.U32), line(2));
    int bb0 = builder.newBlock();
    builder.assign(
        bb0,
        Place.of(r),
        new Rvalue.Ref(t, Mutability.MUT, Place.of(p).deref().deref()),
        line(10));
    builder.terminate(bb0, new Terminator.Return(line(11)));
    typeCheck(builder.build());

    assertThat(locationsOf(s, t)).isEqualTo(Locations.boring(Location.of(0, 0)));
    assertThat(locationsOf(m, t)).isEqualTo(Locations.boring(Location.of(0, 0)));
  }

  @Test
  public void testAggregateFieldsAreRelatedToSubstitutedAdtFields() {
    AdtDef.Builder adtBuilder = AdtDef.builder("Wrapper");
    Region param = adtBuilder.addRegionParam("'a", Variance.CONTRAVARIANT, false);
    AdtDef wrapper = adtBuilder.addField(Ty.ref(param, Ty.U32)).build();
    Region rx = vars.newVar();
    Region w = vars.newVar();
    Region rp = vars.newVar();

    Body.Builder builder = Body.builder("aggregate", Ty.UNIT);
    Local x = builder.addArg("x", Ty.ref(rx, Ty.U32), line(1));
    Local p = builder.addLocal("p", Ty.adt(wrapper, rp), line(2));
    int bb0 = builder.newBlock();
    builder.assign(
        bb0,
        Place.of(p),
        new Rvalue.Aggregate(
            Ty.adt(wrapper, w), ImmutableList.of(Operand.copy(Place.of(x)))),
        line(10));
    builder.terminate(bb0, new Terminator.Return(line(11)));
    typeCheck(builder.build());

    assertThat(cx.constraints.contains(vid(rx), vid(w))).isTrue();
    assertThat(cx.constraints.contains(vid(w), vid(rp))).isTrue();
    assertThat(cx.constraints.contains(vid(rp), vid(w))).isFalse();
  }

  @Test
  public void testTupleAggregate() {
    Region rx = vars.newVar();
    Region e = vars.newVar();
    Region rp = vars.newVar();

    Body.Builder builder = Body.builder("tuple", Ty.UNIT);
    Local x = builder.addArg("x", Ty.ref(rx, Ty.U32), line(1));
    Local p = builder.addLocal("p", Ty.tuple(Ty.ref(rp, Ty.U32), Ty.BOOL), line(2));
    int bb0 = builder.newBlock();
    builder.assign(
        bb0,
        Place.of(p),
        new Rvalue.Aggregate(
            Ty.tuple(Ty.ref(e, Ty.U32), Ty.BOOL),
            ImmutableList.of(Operand.copy(Place.of(x)), Operand.constant(Ty.BOOL, "true"))),
        line(10));
    builder.terminate(bb0, new Terminator.Return(line(11)));
    typeCheck(builder.build());

    assertThat(cx.constraints.contains(vid(rx), vid(e))).isTrue();
    assertThat(cx.constraints.contains(vid(e), vid(rp))).isTrue();
  }

  @Test
  public void testReferenceCastRelatesOperandToTarget() {
    Region rx = vars.newVar();
    Region c = vars.newVar();
    Region ry = vars.newVar();

    Body.Builder builder = Body.builder("cast", Ty.UNIT);
    Local x = builder.addArg("x", Ty.ref(rx, Ty.U32), line(1));
    Local y = builder.addLocal("y", Ty.ref(ry, Ty.U32), line(2));
    int bb0 = builder.newBlock();
    builder.assign(
        bb0, Place.of(y), new Rvalue.Cast(Operand.copy(Place.of(x)), Ty.ref(c, Ty.U32)), line(10));
    builder.terminate(bb0, new Terminator.Return(line(11)));
    typeCheck(builder.build());

    assertThat(locationsOf(rx, c)).isEqualTo(Locations.interesting(Location.of(0, 0)));
    assertThat(locationsOf(c, ry)).isEqualTo(Locations.interesting(Location.of(0, 0)));
  }

  @Test
  public void testCallOfNonFunctionIsBrokenMir() {
    Body.Builder builder = Body.builder("call", Ty.UNIT);
    Local f = builder.addArg("f", Ty.U32, line(1));
    int bb0 = builder.newBlock();
    int bb1 = builder.newBlock();
    builder.terminate(
        bb0,
        new Terminator.Call(Operand.copy(Place.of(f)), ImmutableList.of(), null, bb1, line(10)));
    builder.terminate(bb1, new Terminator.Return(line(11)));
    Body body = builder.build();

    assertThrows(IllegalStateException.class, () -> typeCheck(body));
  }
}
