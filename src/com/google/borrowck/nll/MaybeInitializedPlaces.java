/*
 * Copyright 2009 The Closure Compiler Authors.
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

import static com.google.common.base.Preconditions.checkState;

import com.google.borrowck.mir.BasicBlockData;
import com.google.borrowck.mir.Body;
import com.google.borrowck.mir.Local;
import com.google.borrowck.mir.Location;
import com.google.borrowck.mir.Operand;
import com.google.borrowck.mir.Place;
import com.google.borrowck.mir.Statement;
import com.google.borrowck.mir.Terminator;
import java.util.BitSet;
import org.jspecify.annotations.Nullable;

/**
 * Forward analysis of the move paths that may be initialized at each point. Arguments are
 * initialized on entry; a store initializes the whole subtree of its place; a move, a drop and the
 * end of storage deinitialize it.
 *
 * <p>Besides the block states it keeps a cursor that can be positioned at the start of a block and
 * advanced one location at a time.
 */
final class MaybeInitializedPlaces extends DataFlowAnalysis<BitSet> {

  private static final class UnionJoiner implements FlowJoiner<BitSet> {
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

  private final MoveData moveData;
  private @Nullable BitSet cursor;

  MaybeInitializedPlaces(Body body, MoveData moveData, int maxStepsPerBlock) {
    super(body, maxStepsPerBlock);
    this.moveData = moveData;
  }

  MoveData getMoveData() {
    return moveData;
  }

  @Override
  boolean isForward() {
    return true;
  }

  @Override
  FlowJoiner<BitSet> createFlowJoiner() {
    return new UnionJoiner();
  }

  @Override
  BitSet createInitialEstimateLattice() {
    return new BitSet(moveData.size());
  }

  @Override
  BitSet createEntryLattice() {
    BitSet entry = new BitSet(moveData.size());
    for (Local arg : getBody().args()) {
      moveData.forEachInSubtree(moveData.findLocal(arg), entry::set);
    }
    return entry;
  }

  @Override
  BitSet flowThrough(int block, BitSet input) {
    BitSet state = (BitSet) input.clone();
    BasicBlockData data = getBody().block(block);
    for (int i = 0; i <= data.terminatorIndex(); i++) {
      applyEffect(Location.of(block, i), state);
    }
    return state;
  }

  private void applyEffect(Location location, BitSet state) {
    Statement statement = getBody().statementAt(location);
    if (statement != null) {
      if (statement instanceof Statement.Assign assign) {
        for (Operand operand : assign.rvalue().operands()) {
          killIfMoved(operand, state);
        }
        gen(assign.place(), state);
      } else if (statement instanceof Statement.StorageDead storageDead) {
        kill(Place.of(storageDead.local()), state);
      }
      return;
    }
    Terminator terminator = getBody().block(location.block()).terminator();
    if (terminator instanceof Terminator.Call call) {
      killIfMoved(call.func(), state);
      for (Operand arg : call.args()) {
        killIfMoved(arg, state);
      }
      if (call.destination() != null) {
        gen(call.destination(), state);
      }
    } else if (terminator instanceof Terminator.Drop drop) {
      kill(drop.place(), state);
    } else if (terminator instanceof Terminator.DropAndReplace replace) {
      killIfMoved(replace.value(), state);
      gen(replace.place(), state);
    }
  }

  private void killIfMoved(Operand operand, BitSet state) {
    if (operand instanceof Operand.Move move) {
      kill(move.place(), state);
    }
  }

  private void kill(Place place, BitSet state) {
    int mpi = moveData.lookupExact(place);
    if (mpi >= 0) {
      moveData.forEachInSubtree(mpi, state::clear);
    }
  }

  private void gen(Place place, BitSet state) {
    int mpi = moveData.lookupExact(place);
    if (mpi >= 0) {
      moveData.forEachInSubtree(mpi, state::set);
    }
  }

  /** Positions the cursor at the start of {@code block}. */
  void resetToEntryOf(int block) {
    cursor = (BitSet) getEntryState(block).clone();
  }

  /** Advances the cursor over the statement or terminator at {@code location}. */
  void applyEffectAt(Location location) {
    applyEffect(location, checkCursor());
  }

  /**
   * Returns {@code mpi} or one of its descendants that may be initialized at the cursor, or -1 if
   * there is none.
   */
  int hasAnyChildOf(int mpi) {
    BitSet state = checkCursor();
    int[] found = {-1};
    moveData.forEachInSubtree(
        mpi,
        index -> {
          if (found[0] < 0 && state.get(index)) {
            found[0] = index;
          }
        });
    return found[0];
  }

  boolean isInitializedAtCursor(int mpi) {
    return checkCursor().get(mpi);
  }

  private BitSet checkCursor() {
    checkState(cursor != null, "cursor not positioned; call resetToEntryOf first");
    return cursor;
  }
}
