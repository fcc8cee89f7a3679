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

import com.google.borrowck.mir.BasicBlockData;
import com.google.borrowck.mir.Body;
import com.google.borrowck.mir.Local;
import com.google.borrowck.mir.Location;
import com.google.borrowck.mir.MirVisitor;
import com.google.borrowck.mir.PlaceContext;
import java.util.BitSet;
import java.util.function.BiConsumer;

/**
 * Computes which locals of a {@link NllLivenessMap} are live before each location.
 *
 * <p>Runs in one of two modes. In {@link Mode#REGULAR} a local is live where its current value may
 * later be used; drops do not count. In {@link Mode#DROP} a local is live where its current value
 * may later be dropped; other uses do not count. In both modes a store to the whole local,
 * including {@code StorageLive} and {@code StorageDead}, ends the value.
 *
 * <p>The lattice is the power set of the mapped locals, represented as a {@link BitSet} indexed by
 * live-variable index.
 */
final class LiveVariablesAnalysis extends DataFlowAnalysis<BitSet> {

  enum Mode {
    REGULAR,
    DROP
  }

  private static final class LiveVariableJoinOp implements FlowJoiner<BitSet> {
    private final BitSet result = new BitSet();

    @Override
    public void joinFlow(BitSet input) {
      result.or(input);
    }

    @Override
    public BitSet finish() {
      return result;
    }
  }

  private final NllLivenessMap map;
  private final Mode mode;

  LiveVariablesAnalysis(Body body, NllLivenessMap map, Mode mode, int maxStepsPerBlock) {
    super(body, maxStepsPerBlock);
    this.map = map;
    this.mode = mode;
  }

  /** Runs both analyses over {@code body}. */
  static Results compute(Body body, NllLivenessMap map, int maxStepsPerBlock) {
    LiveVariablesAnalysis regular =
        new LiveVariablesAnalysis(body, map, Mode.REGULAR, maxStepsPerBlock);
    regular.analyze();
    LiveVariablesAnalysis drop = new LiveVariablesAnalysis(body, map, Mode.DROP, maxStepsPerBlock);
    drop.analyze();
    return new Results(regular, drop);
  }

  /** Regular and drop liveness of one body. */
  record Results(LiveVariablesAnalysis regular, LiveVariablesAnalysis drop) {}

  @Override
  boolean isForward() {
    return false;
  }

  @Override
  FlowJoiner<BitSet> createFlowJoiner() {
    return new LiveVariableJoinOp();
  }

  @Override
  BitSet createInitialEstimateLattice() {
    return new BitSet(map.numVariables());
  }

  @Override
  BitSet createEntryLattice() {
    return new BitSet(map.numVariables());
  }

  @Override
  BitSet flowThrough(int block, BitSet input) {
    BitSet bits = (BitSet) input.clone();
    BasicBlockData data = getBody().block(block);
    for (int i = data.terminatorIndex(); i >= 0; i--) {
      defsUses(Location.of(block, i)).apply(bits);
    }
    return bits;
  }

  /**
   * Walks {@code block} backwards, invoking {@code callback} with each location and the set of
   * variables live on entry to it. The set is reused between calls and must not be retained.
   */
  void simulateBlock(int block, BiConsumer<Location, BitSet> callback) {
    BitSet bits = (BitSet) getExitState(block).clone();
    BasicBlockData data = getBody().block(block);
    for (int i = data.terminatorIndex(); i >= 0; i--) {
      Location location = Location.of(block, i);
      defsUses(location).apply(bits);
      callback.accept(location, bits);
    }
  }

  /** Whether the local with live-variable index {@code liveVar} is live on entry to block. */
  boolean isLiveOnEntry(int block, int liveVar) {
    return getEntryState(block).get(liveVar);
  }

  private DefsUses defsUses(Location location) {
    DefsUses visitor = new DefsUses();
    Body body = getBody();
    if (body.isTerminatorLocation(location)) {
      visitor.visitTerminator(body.block(location.block()).terminator(), location);
    } else {
      visitor.visitStatement(body.statementAt(location), location);
    }
    return visitor;
  }

  /** The locals defined and used at one location. */
  private final class DefsUses extends MirVisitor {
    final BitSet defs = new BitSet();
    final BitSet uses = new BitSet();

    void apply(BitSet bits) {
      bits.andNot(defs);
      bits.or(uses);
    }

    @Override
    public void visitLocal(Local local, PlaceContext context, Location location) {
      int liveVar = map.fromLocal(local);
      if (liveVar < 0) {
        return;
      }
      if (context.isDef()) {
        // The last context reported wins. Destinations are reported before the operands read
        // into them, so x = f(x) leaves x live.
        uses.clear(liveVar);
        defs.set(liveVar);
      } else if (context.isDrop() ? mode == Mode.DROP : mode == Mode.REGULAR) {
        defs.clear(liveVar);
        uses.set(liveVar);
      }
    }
  }
}
