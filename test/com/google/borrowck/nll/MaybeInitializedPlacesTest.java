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
import com.google.borrowck.mir.Statement;
import com.google.borrowck.mir.Terminator;
import com.google.borrowck.ty.Ty;
import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class MaybeInitializedPlacesTest {

  private static final SourceSpan SPAN = SourceSpan.of("init.rs", 1, 1, 1);
  private static final Ty PAIR = Ty.tuple(Ty.U32, Ty.U32);

  private static MaybeInitializedPlaces analyze(Body body) {
    MaybeInitializedPlaces flowInits =
        new MaybeInitializedPlaces(body, MoveData.gather(body), 1000);
    flowInits.analyze();
    return flowInits;
  }

  @Test
  public void testAssignmentAndMove() {
    // bb0[0]: x = const 1
    // bb0[1]: y = move x
    // bb0[2]: StorageDead(y)
    // bb0[3]: return
    Body.Builder builder = Body.builder("f", Ty.UNIT);
    Local a = builder.addArg("a", Ty.U32, SPAN);
    Local x = builder.addLocal("x", Ty.U32, SPAN);
    Local y = builder.addLocal("y", Ty.U32, SPAN);
    int bb0 = builder.newBlock();
    builder.assign(bb0, Place.of(x), new Rvalue.Use(Operand.constant(Ty.U32, "1")), SPAN);
    builder.assign(bb0, Place.of(y), new Rvalue.Use(Operand.move(Place.of(x))), SPAN);
    builder.push(bb0, new Statement.StorageDead(y, SPAN));
    builder.terminate(bb0, new Terminator.Return(SPAN));
    Body body = builder.build();

    MaybeInitializedPlaces flowInits = analyze(body);
    MoveData moveData = flowInits.getMoveData();
    int mpA = moveData.findLocal(a);
    int mpX = moveData.findLocal(x);
    int mpY = moveData.findLocal(y);

    flowInits.resetToEntryOf(bb0);
    assertThat(flowInits.isInitializedAtCursor(mpA)).isTrue();
    assertThat(flowInits.isInitializedAtCursor(mpX)).isFalse();

    flowInits.applyEffectAt(Location.of(0, 0));
    assertThat(flowInits.isInitializedAtCursor(mpX)).isTrue();

    flowInits.applyEffectAt(Location.of(0, 1));
    assertThat(flowInits.isInitializedAtCursor(mpX)).isFalse();
    assertThat(flowInits.isInitializedAtCursor(mpY)).isTrue();

    flowInits.applyEffectAt(Location.of(0, 2));
    assertThat(flowInits.isInitializedAtCursor(mpY)).isFalse();
  }

  @Test
  public void testPartialInitialization() {
    // bb0[0]: t.0 = const 1
    // bb0[1]: u = move t.0
    // bb0[2]: return
    Body.Builder builder = Body.builder("partial", Ty.UNIT);
    Local t = builder.addLocal("t", PAIR, SPAN);
    Local u = builder.addLocal("u", Ty.U32, SPAN);
    int bb0 = builder.newBlock();
    builder.assign(
        bb0, Place.of(t).field(0), new Rvalue.Use(Operand.constant(Ty.U32, "1")), SPAN);
    builder.assign(bb0, Place.of(u), new Rvalue.Use(Operand.move(Place.of(t).field(0))), SPAN);
    builder.terminate(bb0, new Terminator.Return(SPAN));
    Body body = builder.build();

    MaybeInitializedPlaces flowInits = analyze(body);
    MoveData moveData = flowInits.getMoveData();
    int mpT = moveData.findLocal(t);
    int mpT0 = moveData.lookupExact(Place.of(t).field(0));
    assertThat(moveData.children(mpT)).containsExactly(mpT0);

    flowInits.resetToEntryOf(bb0);
    assertThat(flowInits.hasAnyChildOf(mpT)).isEqualTo(-1);
    flowInits.applyEffectAt(Location.of(0, 0));
    assertThat(flowInits.isInitializedAtCursor(mpT)).isFalse();
    assertThat(flowInits.hasAnyChildOf(mpT)).isEqualTo(mpT0);
    flowInits.applyEffectAt(Location.of(0, 1));
    assertThat(flowInits.hasAnyChildOf(mpT)).isEqualTo(-1);
  }

  @Test
  public void testJoinIsMaybe() {
    // bb0: switchInt(const) -> [bb1, bb2]
    // bb1: x = const 1; goto bb2
    // bb2: drop(x) -> bb3
    // bb3: return
    Body.Builder builder = Body.builder("join", Ty.UNIT);
    Local x = builder.addLocal("x", Ty.U32, SPAN);
    int bb0 = builder.newBlock();
    int bb1 = builder.newBlock();
    int bb2 = builder.newBlock();
    int bb3 = builder.newBlock();
    builder.terminate(
        bb0,
        new Terminator.SwitchInt(
            Operand.constant(Ty.BOOL, "c"), ImmutableList.of(bb1, bb2), SPAN));
    builder.assign(bb1, Place.of(x), new Rvalue.Use(Operand.constant(Ty.U32, "1")), SPAN);
    builder.terminate(bb1, new Terminator.Goto(bb2, SPAN));
    builder.terminate(bb2, new Terminator.Drop(Place.of(x), bb3, SPAN));
    builder.terminate(bb3, new Terminator.Return(SPAN));
    Body body = builder.build();

    MaybeInitializedPlaces flowInits = analyze(body);
    int mpX = flowInits.getMoveData().findLocal(x);
    flowInits.resetToEntryOf(bb2);
    assertThat(flowInits.isInitializedAtCursor(mpX)).isTrue();
    flowInits.resetToEntryOf(bb3);
    assertThat(flowInits.isInitializedAtCursor(mpX)).isFalse();
  }

  @Test
  public void testCursorMustBePositioned() {
    Body.Builder builder = Body.builder("f", Ty.UNIT);
    int bb0 = builder.newBlock();
    builder.terminate(bb0, new Terminator.Return(SPAN));
    MaybeInitializedPlaces flowInits = analyze(builder.build());
    assertThrows(IllegalStateException.class, () -> flowInits.hasAnyChildOf(0));
  }
}
