/*
 * Copyright 2017 The Closure Compiler Authors.
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

import com.google.borrowck.mir.Body;
import com.google.borrowck.mir.Local;
import com.google.borrowck.mir.Location;
import com.google.borrowck.mir.Operand;
import com.google.borrowck.mir.Place;
import com.google.borrowck.mir.Rvalue;
import com.google.borrowck.mir.SourceSpan;
import com.google.borrowck.mir.Terminator;
import com.google.borrowck.ty.AdtDef;
import com.google.borrowck.ty.Mutability;
import com.google.borrowck.ty.Region;
import com.google.borrowck.ty.Ty;
import com.google.borrowck.ty.Variance;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.BitSet;
import java.util.HashMap;
import java.util.Map;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class LiveVariablesAnalysisTest {

  private static final SourceSpan SPAN = SourceSpan.of("live.rs", 1, 1, 1);

  private RegionVariables vars;
  private UniversalRegions universalRegions;

  @Before
  public void setUp() {
    vars = new RegionVariables();
    universalRegions = UniversalRegions.builder(vars).build();
  }

  private NllLivenessMap mapOf(Body body) {
    return NllLivenessMap.compute(body, universalRegions, ImmutableSet.of(), false);
  }

  /** Records the live locals before each location of {@code block}. */
  private static Map<Location, ImmutableSet<Local>> simulate(
      LiveVariablesAnalysis analysis, NllLivenessMap map, int block) {
    Map<Location, ImmutableSet<Local>> result = new HashMap<>();
    analysis.simulateBlock(
        block,
        (location, live) -> {
          ImmutableSet.Builder<Local> locals = ImmutableSet.builder();
          for (int v = live.nextSetBit(0); v >= 0; v = live.nextSetBit(v + 1)) {
            locals.add(map.fromLiveVar(v));
          }
          result.put(location, locals.build());
        });
    return result;
  }

  @Test
  public void testRegularLiveness() {
    // bb0[0]: y = const 1
    // bb0[1]: x = &'?t y
    // bb0[2]: z = copy x
    // bb0[3]: return
    Body.Builder builder = Body.builder("f", Ty.UNIT);
    Local x = builder.addLocal("x", Ty.ref(vars.newVar(), Ty.U32), SPAN);
    Local y = builder.addLocal("y", Ty.U32, SPAN);
    Local z = builder.addLocal("z", Ty.ref(vars.newVar(), Ty.U32), SPAN);
    int bb0 = builder.newBlock();
    builder.assign(bb0, Place.of(y), new Rvalue.Use(Operand.constant(Ty.U32, "1")), SPAN);
    builder.assign(
        bb0, Place.of(x), new Rvalue.Ref(vars.newVar(), Mutability.NOT, Place.of(y)), SPAN);
    builder.assign(bb0, Place.of(z), new Rvalue.Use(Operand.copy(Place.of(x))), SPAN);
    builder.terminate(bb0, new Terminator.Return(SPAN));
    Body body = builder.build();

    NllLivenessMap map = mapOf(body);
    assertThat(map.fromLocal(y)).isEqualTo(-1);
    LiveVariablesAnalysis.Results results = LiveVariablesAnalysis.compute(body, map, 1000);
    Map<Location, ImmutableSet<Local>> live = simulate(results.regular(), map, bb0);

    assertThat(live.get(Location.of(0, 1))).isEmpty();
    assertThat(live.get(Location.of(0, 2))).containsExactly(x);
    assertThat(live.get(Location.of(0, 3))).isEmpty();
  }

  @Test
  public void testLivenessAcrossLoop() {
    // bb0: x = &'?t y; goto bb1
    // bb1: z = copy x; switchInt(const) -> [bb1, bb2]
    // bb2: return
    Body.Builder builder = Body.builder("loop", Ty.UNIT);
    Local x = builder.addLocal("x", Ty.ref(vars.newVar(), Ty.U32), SPAN);
    Local y = builder.addLocal("y", Ty.U32, SPAN);
    Local z = builder.addLocal("z", Ty.ref(vars.newVar(), Ty.U32), SPAN);
    int bb0 = builder.newBlock();
    int bb1 = builder.newBlock();
    int bb2 = builder.newBlock();
    builder.assign(
        bb0, Place.of(x), new Rvalue.Ref(vars.newVar(), Mutability.NOT, Place.of(y)), SPAN);
    builder.terminate(bb0, new Terminator.Goto(bb1, SPAN));
    builder.assign(bb1, Place.of(z), new Rvalue.Use(Operand.copy(Place.of(x))), SPAN);
    builder.terminate(
        bb1,
        new Terminator.SwitchInt(
            Operand.constant(Ty.BOOL, "true"), ImmutableList.of(bb1, bb2), SPAN));
    builder.terminate(bb2, new Terminator.Return(SPAN));
    Body body = builder.build();

    NllLivenessMap map = mapOf(body);
    LiveVariablesAnalysis regular = LiveVariablesAnalysis.compute(body, map, 1000).regular();
    assertThat(regular.isLiveOnEntry(bb1, map.fromLocal(x))).isTrue();
    assertThat(regular.isLiveOnEntry(bb2, map.fromLocal(x))).isFalse();
    assertThat(regular.isLiveOnEntry(bb0, map.fromLocal(x))).isFalse();
    assertThat(regular.isLiveOnEntry(bb1, map.fromLocal(z))).isFalse();
  }

  @Test
  public void testDropIsOnlySeenByDropLiveness() {
    AdtDef.Builder guardBuilder = AdtDef.builder("Guard");
    Region param = guardBuilder.addRegionParam("'a", Variance.COVARIANT, false);
    AdtDef guard = guardBuilder.addField(Ty.ref(param, Ty.U32)).setHasDestructor(true).build();

    // bb0[0]: g = Guard { copy r }
    // bb0[1]: drop(g) -> bb1
    // bb1[0]: return
    Body.Builder builder = Body.builder("drop", Ty.UNIT);
    Local r = builder.addArg("r", Ty.ref(vars.newVar(), Ty.U32), SPAN);
    Ty guardTy = Ty.adt(guard, vars.newVar());
    Local g = builder.addLocal("g", guardTy, SPAN);
    int bb0 = builder.newBlock();
    int bb1 = builder.newBlock();
    builder.assign(
        bb0,
        Place.of(g),
        new Rvalue.Aggregate(guardTy, ImmutableList.of(Operand.copy(Place.of(r)))),
        SPAN);
    builder.terminate(bb0, new Terminator.Drop(Place.of(g), bb1, SPAN));
    builder.terminate(bb1, new Terminator.Return(SPAN));
    Body body = builder.build();

    NllLivenessMap map = mapOf(body);
    LiveVariablesAnalysis.Results results = LiveVariablesAnalysis.compute(body, map, 1000);
    Map<Location, ImmutableSet<Local>> regular = simulate(results.regular(), map, bb0);
    Map<Location, ImmutableSet<Local>> drop = simulate(results.drop(), map, bb0);

    assertThat(regular.get(Location.of(0, 1))).doesNotContain(g);
    assertThat(drop.get(Location.of(0, 1))).containsExactly(g);
    assertThat(drop.get(Location.of(0, 0))).isEmpty();
    assertThat(regular.get(Location.of(0, 0))).containsExactly(r);
  }

  @Test
  public void testCallDestinationStaysLiveWhenUsedAsArgument() {
    // bb0: x = f(copy x) -> bb1
    Body.Builder builder = Body.builder("call", Ty.UNIT);
    Ty refTy = Ty.ref(Region.STATIC, Ty.U32);
    Local x = builder.addArg("x", Ty.ref(vars.newVar(), Ty.U32), SPAN);
    int bb0 = builder.newBlock();
    int bb1 = builder.newBlock();
    builder.terminate(
        bb0,
        new Terminator.Call(
            Operand.constant(Ty.fnPtr(refTy, refTy), "f"),
            ImmutableList.of(Operand.copy(Place.of(x))),
            Place.of(x),
            bb1,
            SPAN));
    builder.terminate(bb1, new Terminator.Return(SPAN));
    Body body = builder.build();

    NllLivenessMap map = mapOf(body);
    BitSet entry = new BitSet();
    LiveVariablesAnalysis regular = LiveVariablesAnalysis.compute(body, map, 1000).regular();
    entry.set(map.fromLocal(x));
    assertThat(regular.getEntryState(bb0)).isEqualTo(entry);
  }
}
