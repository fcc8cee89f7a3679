/*
 * Copyright 2008 The Closure Compiler Authors.
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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.borrowck.mir.Body;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.PriorityQueue;
import java.util.Queue;

/**
 * A framework to help writing dataflow analyses over the basic blocks of a MIR body.
 *
 * <p>A subclass gives the direction, the lattice of flow states (which must have a meaningful
 * {@code equals}), how states are joined and how a whole block transforms a state. {@link
 * #analyze()} then iterates to a fixed point with a worklist of blocks. In a forward analysis the
 * entry state flows into block 0; in a backward analysis it flows into every block without
 * successors.
 *
 * <p>Flow functions must treat their input as read-only.
 *
 * @param <L> the lattice element type
 */
abstract class DataFlowAnalysis<L> {

  private final Body body;
  private final int maxStepsPerBlock;
  private final UniqueQueue<Integer> workQueue;
  private final List<LinearFlowState<L>> states = new ArrayList<>();

  DataFlowAnalysis(Body body, int maxStepsPerBlock) {
    checkArgument(maxStepsPerBlock > 0, "maxStepsPerBlock must be positive");
    this.body = body;
    this.maxStepsPerBlock = maxStepsPerBlock;
    Comparator<Integer> order =
        isForward() ? Comparator.<Integer>naturalOrder() : Comparator.<Integer>reverseOrder();
    this.workQueue = new UniqueQueue<>(order);
  }

  final Body getBody() {
    return body;
  }

  /**
   * Checks whether the analysis is a forward flow analysis or backward flow analysis.
   *
   * @return {@code true} if it is a forward analysis.
   */
  abstract boolean isForward();

  /**
   * Gets a new joiner for an analysis step.
   *
   * <p>The joiner is invoked once for each input edge and then the final joined result is
   * retrieved.
   */
  abstract FlowJoiner<L> createFlowJoiner();

  /** A reducer that joins flow states from distinct input states into a single input state. */
  interface FlowJoiner<L> {
    void joinFlow(L input);

    L finish();
  }

  /**
   * Computes the output state of a whole block given its input state. For a backward analysis the
   * input is the state on exit of the block and the output the state on entry.
   */
  abstract L flowThrough(int block, L input);

  /** Gets the state of the initial estimation at each block. */
  abstract L createInitialEstimateLattice();

  /** Gets the state flowing into the body: at its start if forward, at its exits if backward. */
  abstract L createEntryLattice();

  /** Finds a fixed-point solution, replacing the states of any previous run. */
  final void analyze() {
    initialize();
    while (!workQueue.isEmpty()) {
      int block = workQueue.removeFirst();
      LinearFlowState<L> state = states.get(block);
      if (state.stepCount++ > maxStepsPerBlock) {
        throw new IllegalStateException(
            "Dataflow analysis appears to diverge around: bb" + block + " of " + body);
      }
      joinInputs(block);
      if (flow(block)) {
        List<Integer> nextBlocks =
            isForward() ? body.block(block).terminator().successors() : body.predecessors(block);
        for (int next : nextBlocks) {
          workQueue.add(next);
        }
      }
    }
  }

  private void initialize() {
    workQueue.clear();
    states.clear();
    for (int block = 0; block < body.blockCount(); block++) {
      states.add(
          new LinearFlowState<>(createInitialEstimateLattice(), createInitialEstimateLattice()));
      workQueue.add(block);
    }
  }

  /**
   * Performs a single flow through a block.
   *
   * @return {@code true} if the flow state differs from the previous state.
   */
  private boolean flow(int block) {
    LinearFlowState<L> state = states.get(block);
    if (isForward()) {
      L outBefore = state.getOut();
      state.setOut(flowThrough(block, state.getIn()));
      return !outBefore.equals(state.getOut());
    } else {
      L inBefore = state.getIn();
      state.setIn(flowThrough(block, state.getOut()));
      return !inBefore.equals(state.getIn());
    }
  }

  /** Merges the states flowing into {@code block} from its predecessors (successors). */
  private void joinInputs(int block) {
    LinearFlowState<L> state = states.get(block);
    ImmutableList<Integer> inputs =
        isForward() ? body.predecessors(block) : body.block(block).terminator().successors();
    boolean takesEntry = isForward() ? block == 0 : inputs.isEmpty();

    final L result;
    if (takesEntry && inputs.isEmpty()) {
      result = createEntryLattice();
    } else if (!takesEntry && inputs.size() == 1) {
      result = getInputFrom(inputs.get(0));
    } else {
      FlowJoiner<L> joiner = createFlowJoiner();
      if (takesEntry) {
        joiner.joinFlow(createEntryLattice());
      }
      for (int input : inputs) {
        joiner.joinFlow(getInputFrom(input));
      }
      result = joiner.finish();
    }

    if (isForward()) {
      state.setIn(result);
    } else {
      state.setOut(result);
    }
  }

  private L getInputFrom(int block) {
    LinearFlowState<L> state = states.get(block);
    return isForward() ? state.getOut() : state.getIn();
  }

  /** The state on entry of {@code block}, once {@link #analyze()} has run. */
  final L getEntryState(int block) {
    checkState(!states.isEmpty(), "analyze() has not run");
    return states.get(block).getIn();
  }

  /** The state on exit of {@code block}, once {@link #analyze()} has run. */
  final L getExitState(int block) {
    checkState(!states.isEmpty(), "analyze() has not run");
    return states.get(block).getOut();
  }

  /** The in and out states of a block. */
  static final class LinearFlowState<L> {
    private int stepCount = 0;
    private L in;
    private L out;

    private LinearFlowState(L in, L out) {
      this.in = checkNotNull(in);
      this.out = checkNotNull(out);
    }

    L getIn() {
      return in;
    }

    private void setIn(L in) {
      this.in = checkNotNull(in);
    }

    L getOut() {
      return out;
    }

    private void setOut(L out) {
      this.out = checkNotNull(out);
    }

    @Override
    public String toString() {
      return "IN: " + in + " OUT: " + out;
    }
  }

  private static final class UniqueQueue<T> {
    private final LinkedHashSet<T> seenSet = new LinkedHashSet<>();
    private final Queue<T> queue;

    UniqueQueue(Comparator<T> priority) {
      this.queue = new PriorityQueue<>(priority);
    }

    boolean isEmpty() {
      return queue.isEmpty();
    }

    T removeFirst() {
      T t = queue.poll();
      seenSet.remove(t);
      return t;
    }

    void add(T t) {
      if (seenSet.add(t)) {
        queue.add(t);
      }
    }

    void clear() {
      seenSet.clear();
      queue.clear();
    }
  }
}
