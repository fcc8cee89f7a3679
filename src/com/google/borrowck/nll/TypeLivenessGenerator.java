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

import com.google.borrowck.mir.Body;
import com.google.borrowck.mir.Local;
import com.google.borrowck.mir.Location;
import com.google.borrowck.ty.DropckOutlivesResult;
import com.google.borrowck.ty.GenericArg;
import com.google.borrowck.ty.RegionVid;
import com.google.borrowck.ty.Ty;
import com.google.borrowck.ty.TypeOpOutput;
import com.google.borrowck.ty.Types;
import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Adds liveness constraints to a {@link BorrowCheckContext}.
 *
 * <p>If a variable is live at a point, because its value may later be used, all regions in its
 * type must include the point. If it is only drop-live, because its value may later be dropped
 * while some part of it may still be initialized, the regions the destructor may touch must
 * include the point; which ones is answered by the {@code dropck_outlives} query, whose results
 * are memoized per type for the whole pass.
 */
final class TypeLivenessGenerator {
  private static final Logger logger = Logger.getLogger(TypeLivenessGenerator.class.getName());

  /** What dropping a value of some type requires. */
  private static final class DropData {
    final DropckOutlivesResult dropckResult;
    final TypeOpOutput<DropckOutlivesResult> output;
    boolean overflowReported = false;

    DropData(TypeOpOutput<DropckOutlivesResult> output) {
      this.output = output;
      this.dropckResult = output.value();
    }
  }

  private final BorrowCheckContext cx;
  private final Body body;
  private final LiveVariablesAnalysis.Results liveness;
  private final MaybeInitializedPlaces flowInits;
  private final NllLivenessMap map;
  private final Map<Ty, DropData> dropData = new HashMap<>();

  private TypeLivenessGenerator(
      BorrowCheckContext cx,
      LiveVariablesAnalysis.Results liveness,
      MaybeInitializedPlaces flowInits,
      NllLivenessMap map) {
    this.cx = cx;
    this.body = cx.body;
    this.liveness = liveness;
    this.flowInits = flowInits;
    this.map = map;
  }

  /**
   * Computes liveness for the locals that need it and adds the resulting constraints to {@code
   * cx}. Must run after the type check walk, whose constraints decide which locals can be left
   * out.
   */
  static void generate(BorrowCheckContext cx) {
    TypeLivenessGenerator generator = create(cx);
    for (int block = 0; block < cx.body.blockCount(); block++) {
      generator.addLivenessConstraints(block);
    }
    logger.fine(
        "liveness for " + cx.body + ": " + cx.livenessConstraints.size() + " live points, "
            + generator.dropData.size() + " dropped types");
  }

  /** Runs the dataflow analyses a generator needs. No constraint is added yet. */
  static TypeLivenessGenerator create(BorrowCheckContext cx) {
    Set<RegionVid> freeRegions =
        regionsThatOutliveFreeRegions(
            cx.variables().size(), cx.universalRegions, cx.constraints);
    NllLivenessMap map =
        NllLivenessMap.compute(
            cx.body,
            cx.universalRegions,
            freeRegions,
            cx.options.getSkipLivenessForFreeRegionOutlivers());
    int maxSteps = cx.options.getMaxDataflowStepsPerBlock();
    LiveVariablesAnalysis.Results liveness =
        LiveVariablesAnalysis.compute(cx.body, map, maxSteps);
    MaybeInitializedPlaces flowInits =
        new MaybeInitializedPlaces(cx.body, MoveData.gather(cx.body), maxSteps);
    flowInits.analyze();
    return new TypeLivenessGenerator(cx, liveness, flowInits, map);
  }

  /**
   * Finds the free regions and every region forced to outlive one of them, by a depth-first
   * search from the free regions over the reverse constraint graph.
   */
  static Set<RegionVid> regionsThatOutliveFreeRegions(
      int regionCount, UniversalRegions universalRegions, ConstraintSet constraints) {
    ConstraintGraph reverseGraph = ConstraintGraph.reverse(constraints, regionCount);
    Deque<RegionVid> stack = new ArrayDeque<>(universalRegions.universalRegions());
    Set<RegionVid> outlivesFreeRegion = new HashSet<>(stack);
    while (!stack.isEmpty()) {
      RegionVid subRegion = stack.pop();
      for (RegionVid r : reverseGraph.outgoingRegions(subRegion)) {
        if (outlivesFreeRegion.add(r)) {
          stack.push(r);
        }
      }
    }
    return outlivesFreeRegion;
  }

  /** Adds the regular and drop liveness constraints of the points of {@code block}. */
  void addLivenessConstraints(int block) {
    liveness
        .regular()
        .simulateBlock(
            block,
            (location, liveLocals) -> {
              for (int v = liveLocals.nextSetBit(0); v >= 0; v = liveLocals.nextSetBit(v + 1)) {
                Local local = map.fromLiveVar(v);
                pushTypeLiveConstraint(
                    body.localDecl(local).ty(), location, new Cause.LiveVar(local, location));
              }
            });

    List<Location> locations = new ArrayList<>();
    List<BitSet> liveSets = new ArrayList<>();
    liveness
        .drop()
        .simulateBlock(
            block,
            (location, liveLocals) -> {
              locations.add(location);
              liveSets.add((BitSet) liveLocals.clone());
            });

    // Replay the locations forward so that the initializedness cursor can follow.
    flowInits.resetToEntryOf(block);
    for (int i = locations.size() - 1; i >= 0; i--) {
      Location location = locations.get(i);
      BitSet liveLocals = liveSets.get(i);
      for (int v = liveLocals.nextSetBit(0); v >= 0; v = liveLocals.nextSetBit(v + 1)) {
        Local local = map.fromLiveVar(v);
        int mpi = flowInits.getMoveData().findLocal(local);
        int initializedChild = flowInits.hasAnyChildOf(mpi);
        if (initializedChild >= 0) {
          if (logger.isLoggable(Level.FINER)) {
            logger.finer(
                "add_liveness_constraints: " + location + " " + local + " has initialized child "
                    + flowInits.getMoveData().get(initializedChild));
          }
          addDropLiveConstraint(local, body.localDecl(local).ty(), location);
        }
      }
      flowInits.applyEffectAt(location);
    }
  }

  /** Requires every free region of {@code value} to contain {@code location}. */
  private void pushTypeLiveConstraint(GenericArg value, Location location, Cause cause) {
    Types.forEachFreeRegion(
        value,
        liveRegion ->
            cx.livenessConstraints.addElement(
                cx.universalRegions.toRegionVid(liveRegion), location, cause));
  }

  private void addDropLiveConstraint(Local droppedLocal, Ty droppedTy, Location location) {
    DropData data = dropData.computeIfAbsent(droppedTy, this::computeDropData);

    if (!data.output.regionConstraints().isEmpty()) {
      cx.pushRegionConstraints(Locations.boring(location), data.output.regionConstraints());
    }

    if (data.dropckResult.hasOverflowed() && !data.overflowReported) {
      data.overflowReported = true;
      ImmutableList<Ty> overflows = data.dropckResult.overflows();
      BorrowckError.builder(
              NllDiagnostics.NLL_DROPCK_OVERFLOW, body.sourceSpan(location), droppedTy)
          .addNote("overflowed on " + overflows.get(0))
          .setLevel(cx.options.getDropckOverflowLevel())
          .buffer(cx.errors);
    }

    // All things in the result may be touched by the destructor and must be live here.
    Cause cause = new Cause.DropVar(droppedLocal, location);
    for (GenericArg kind : data.dropckResult.kinds()) {
      pushTypeLiveConstraint(kind, location, cause);
    }
  }

  private DropData computeDropData(Ty droppedTy) {
    logger.fine("compute_drop_data(dropped_ty=" + droppedTy + ")");
    return new DropData(cx.queries.dropckOutlives(droppedTy));
  }
}
