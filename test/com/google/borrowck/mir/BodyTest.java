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
package com.google.borrowck.mir;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.borrowck.ty.Region;
import com.google.borrowck.ty.Ty;
import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class BodyTest {

  private static final SourceSpan SPAN = SourceSpan.of("test.rs", 3, 5, 1);

  /**
   * <pre>
   * bb0: x = const 1; switchInt(x) -> [bb1, bb2]
   * bb1: goto bb2
   * bb2: return
   * </pre>
   */
  private static Body diamond() {
    Body.Builder builder = Body.builder("diamond", Ty.UNIT);
    Local x = builder.addLocal("x", Ty.U32, SPAN);
    int bb0 = builder.newBlock();
    int bb1 = builder.newBlock();
    int bb2 = builder.newBlock();
    builder.assign(bb0, Place.of(x), new Rvalue.Use(Operand.constant(Ty.U32, "1")), SPAN);
    builder.terminate(
        bb0, new Terminator.SwitchInt(Operand.copy(Place.of(x)), ImmutableList.of(bb1, bb2), SPAN));
    builder.terminate(bb1, new Terminator.Goto(bb2, SourceSpan.UNKNOWN));
    builder.terminate(bb2, new Terminator.Return(SourceSpan.UNKNOWN));
    return builder.build();
  }

  @Test
  public void testNavigation() {
    Body body = diamond();
    assertThat(body.blockCount()).isEqualTo(3);
    assertThat(body.numLocations()).isEqualTo(4);
    assertThat(body.terminatorLocation(0)).isEqualTo(Location.of(0, 1));
    assertThat(body.isTerminatorLocation(Location.of(0, 1))).isTrue();
    assertThat(body.statementAt(Location.of(0, 1))).isNull();
    assertThat(body.successors(Location.of(0, 0))).containsExactly(Location.of(0, 1));
    assertThat(body.successors(Location.of(0, 1)))
        .containsExactly(Location.of(1, 0), Location.of(2, 0))
        .inOrder();
    assertThat(body.predecessors(2)).containsExactly(0, 1);
    assertThat(body.sourceSpan(Location.of(0, 0))).isEqualTo(SPAN);
  }

  @Test
  public void testArgumentsComeFirst() {
    Body.Builder builder = Body.builder("f", Ty.UNIT);
    builder.addArg("a", Ty.U32, SPAN);
    builder.addLocal("x", Ty.U32, SPAN);
    assertThrows(IllegalStateException.class, () -> builder.addArg("b", Ty.U32, SPAN));
  }

  @Test
  public void testUnterminatedBlockIsRejected() {
    Body.Builder builder = Body.builder("f", Ty.UNIT);
    builder.newBlock();
    assertThrows(IllegalStateException.class, builder::build);
  }

  @Test
  public void testJumpToUnknownBlockIsRejected() {
    Body.Builder builder = Body.builder("f", Ty.UNIT);
    int bb0 = builder.newBlock();
    builder.terminate(bb0, new Terminator.Goto(7, SPAN));
    assertThrows(IllegalStateException.class, builder::build);
  }

  @Test
  public void testClosureEnvironment() {
    Ty upvarTy = Ty.refMut(Region.var(1), Ty.I32);
    Body.Builder builder = Body.builder("closure", Ty.UNIT);
    builder.addUpvar("x", upvarTy, true, SPAN);
    Local env = builder.addClosureEnv();
    Local y = builder.addArg("y", Ty.I32, SPAN);
    int bb0 = builder.newBlock();
    builder.terminate(bb0, new Terminator.Return(SPAN));
    Body body = builder.build();

    assertThat(body.isClosure()).isTrue();
    assertThat(body.args()).containsExactly(env, y).inOrder();
    assertThat(body.localDecl(env).ty()).isEqualTo(Ty.tuple(upvarTy));
    assertThat(Place.of(env).field(0).deref().ty(body)).isEqualTo(Ty.I32);
  }

  @Test
  public void testPlaceTypes() {
    Body.Builder builder = Body.builder("f", Ty.UNIT);
    Local r = builder.addLocal("r", Ty.ref(Region.var(0), Ty.tuple(Ty.U32, Ty.BOOL)), SPAN);
    int bb0 = builder.newBlock();
    builder.terminate(bb0, new Terminator.Return(SPAN));
    Body body = builder.build();

    Place place = Place.of(r).deref().field(1);
    assertThat(place.ty(body)).isEqualTo(Ty.BOOL);
    assertThat(place.parent()).isEqualTo(Place.of(r).deref());
    assertThat(place.toString()).isEqualTo("(*_1).1");
    assertThrows(IllegalArgumentException.class, () -> Place.of(r).field(0).ty(body));
  }
}
