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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.borrowck.mir.Body;
import com.google.borrowck.mir.Location;
import com.google.borrowck.ty.RegionVid;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Computes the value of every region variable of a body from its outlives and liveness
 * constraints, then checks the result against what the signature promises.
 *
 * <p>A region value is a set of points of the body plus a set of free-region elements. A universal
 * region of the signature starts out with every point and its own element, since the caller may
 * use it anywhere. A placeholder starts out with its own element only. Every other region starts
 * with the points at which it is live. Values then grow along the constraints: for {@code R1:
 * R2}, everything in {@code R2} is added to {@code R1}.
 */
final class RegionInferenceContext {
  private static final Logger logger = Logger.getLogger(RegionInferenceContext.class.getName());

  private final Body body;
  private final UniversalRegions universalRegions;
  private final RegionVariables variables;
  private final ConstraintSet constraints;
  private final LivenessConstraints livenessConstraints;
  private final BorrowckOptions options;
  private final int regionCount;
  private final RegionValueElements elements;
  private final ConstraintGraph constraintGraph;
  private final BitSet[] points;
  private final BitSet[] freeRegionElements;
  private final RegionErrorReporter errorReporter;
  private boolean solved = false;

  RegionInferenceContext(
      Body body,
      UniversalRegions universalRegions,
      ConstraintSet constraints,
      LivenessConstraints livenessConstraints,
      BorrowckOptions options) {
    this.body = body;
    this.universalRegions = universalRegions;
    this.variables = universalRegions.getVariables();
    this.constraints = constraints;
    this.livenessConstraints = livenessConstraints;
    this.options = options;
    this.regionCount = variables.size();
    this.elements = new RegionValueElements(body);
    this.constraintGraph = ConstraintGraph.forward(constraints, regionCount);
    this.points = new BitSet[regionCount];
    this.freeRegionElements = new BitSet[regionCount];
    for (int i = 0; i < regionCount; i++) {
      points[i] = new BitSet(elements.numPoints());
      freeRegionElements[i] = new BitSet(regionCount);
    }
    this.errorReporter = new RegionErrorReporter(this);
  }

  /**
   * Propagates the constraints to a fixed point and buffers an error for each promise of the
   * signature the body breaks. May be called once.
   */
  void solve(List<BorrowckError> errors) {
    checkState(!solved, "solve() called twice");
    solved = true;
    initializeValues();
    propagateConstraints();
    checkUniversalRegions(errors);
    checkUniverses(errors);
    if (logger.isLoggable(Level.FINER)) {
      for (int i = 0; i < regionCount; i++) {
        logger.finer(RegionVid.of(i) + " = " + regionValueString(RegionVid.of(i)));
      }
    }
  }

  private void initializeValues() {
    for (RegionVid region : livenessConstraints.regions()) {
      checkArgument(
          region.index() < regionCount, "live region %s created after inference began", region);
      for (Location location : livenessConstraints.pointsOf(region)) {
        points[region.index()].set(elements.pointIndex(location));
      }
    }
    for (int i = 0; i < regionCount; i++) {
      RegionVariables.RegionDefinition definition = variables.definition(RegionVid.of(i));
      switch (definition.origin()) {
        case FREE_REGION:
          points[i].set(0, elements.numPoints());
          freeRegionElements[i].set(i);
          break;
        case PLACEHOLDER:
          freeRegionElements[i].set(i);
          break;
        case EXISTENTIAL:
          break;
      }
    }
  }

  /**
   * Grows each value until every constraint holds. The constraints are linked into one list per
   * sub region, so a region whose value changed only revisits the constraints it feeds.
   */
  private void propagateConstraints() {
    @Nullable ConstraintIndex[] dependencies = constraints.link(regionCount);
    Deque<RegionVid> dirtyList = new ArrayDeque<>(variables.all());
    boolean[] dirty = new boolean[regionCount];
    Arrays.fill(dirty, true);
    int steps = 0;
    while (!dirtyList.isEmpty()) {
      RegionVid subRegion = dirtyList.pop();
      dirty[subRegion.index()] = false;
      steps++;
      constraints.eachAffectedByDirty(
          dependencies[subRegion.index()],
          index -> {
            OutlivesConstraint constraint = constraints.get(index);
            int sup = constraint.sup.index();
            if (addAll(sup, subRegion.index()) && !dirty[sup]) {
              dirty[sup] = true;
              dirtyList.push(constraint.sup);
            }
          });
    }
    logger.fine("propagated " + constraints.size() + " constraints in " + steps + " steps");
  }

  /** Adds the value of {@code from} to {@code to}; returns whether {@code to} changed. */
  private boolean addAll(int to, int from) {
    int pointCount = points[to].cardinality();
    int elementCount = freeRegionElements[to].cardinality();
    points[to].or(points[from]);
    freeRegionElements[to].or(freeRegionElements[from]);
    return points[to].cardinality() != pointCount
        || freeRegionElements[to].cardinality() != elementCount;
  }

  /**
   * Once regions are inferred, checks that each universal region only ended up containing the
   * universal regions it is known to outlive.
   */
  private void checkUniversalRegions(List<BorrowckError> errors) {
    for (RegionVid longerFr : universalRegions.universalRegions()) {
      int reported = 0;
      BitSet value = freeRegionElements[longerFr.index()];
      for (int e = value.nextSetBit(0); e >= 0; e = value.nextSetBit(e + 1)) {
        RegionVid shorterFr = RegionVid.of(e);
        if (!universalRegions.isUniversalRegion(shorterFr)
            || universalRegions.outlives(longerFr, shorterFr)) {
          continue;
        }
        logger.fine("check_universal_region: " + longerFr + " does not outlive " + shorterFr);
        errorReporter.reportError(longerFr, shorterFr, errors);
        if (++reported >= options.getMaxErrorsPerRegion()) {
          break;
        }
      }
    }
  }

  /**
   * Checks that placeholders stayed within their universe. A placeholder may contain nothing
   * but itself, and a region may only contain placeholders of a universe it can name. Each
   * placeholder is reported at most once.
   */
  private void checkUniverses(List<BorrowckError> errors) {
    Set<RegionVid> reported = new HashSet<>();
    for (int i = 0; i < regionCount; i++) {
      RegionVid placeholder = RegionVid.of(i);
      if (variables.definition(placeholder).origin() != RegionVariables.Origin.PLACEHOLDER) {
        continue;
      }
      BitSet others = (BitSet) freeRegionElements[i].clone();
      others.clear(i);
      if (!others.isEmpty()) {
        reportHigherRanked(placeholder, RegionVid.of(others.nextSetBit(0)), errors);
        reported.add(placeholder);
      } else if (!points[i].isEmpty()) {
        Location point = elements.toLocation(points[i].nextSetBit(0));
        RegionVid liveRegion = errorReporter.findSubRegionLiveAt(placeholder, point);
        reportHigherRanked(placeholder, liveRegion, errors);
        reported.add(placeholder);
      }
    }
    for (int i = 0; i < regionCount; i++) {
      RegionVid region = RegionVid.of(i);
      UniverseIndex universe = variables.definition(region).universe();
      BitSet value = freeRegionElements[i];
      for (int e = value.nextSetBit(0); e >= 0; e = value.nextSetBit(e + 1)) {
        RegionVid element = RegionVid.of(e);
        RegionVariables.RegionDefinition definition = variables.definition(element);
        if (definition.origin() == RegionVariables.Origin.PLACEHOLDER
            && !universe.canName(definition.universe())
            && reported.add(element)) {
          reportHigherRanked(region, element, errors);
        }
      }
    }
  }

  private void reportHigherRanked(RegionVid fr, RegionVid outlived, List<BorrowckError> errors) {
    logger.fine("higher-ranked subtype error: " + fr + " / " + outlived);
    BorrowckError.builder(
            NllDiagnostics.NLL_HIGHER_RANKED_SUBTYPE_ERROR,
            errorReporter.findOutlivesBlameSpan(fr, outlived))
        .buffer(errors);
  }

  /** Whether the inferred value of {@code region} contains {@code location}. */
  boolean regionContainsPoint(RegionVid region, Location location) {
    checkState(solved, "region values queried before solve()");
    return points[region.index()].get(elements.pointIndex(location));
  }

  /** Whether the inferred value of {@code region} contains the free-region element {@code fr}. */
  boolean regionContainsFreeRegion(RegionVid region, RegionVid fr) {
    checkState(solved, "region values queried before solve()");
    return freeRegionElements[region.index()].get(fr.index());
  }

  ImmutableSet<Location> regionPoints(RegionVid region) {
    checkState(solved, "region values queried before solve()");
    ImmutableSet.Builder<Location> result = ImmutableSet.builder();
    BitSet value = points[region.index()];
    for (int p = value.nextSetBit(0); p >= 0; p = value.nextSetBit(p + 1)) {
      result.add(elements.toLocation(p));
    }
    return result.build();
  }

  /**
   * Renders the value of a region, collapsing consecutive statements of a block into ranges,
   * for example {@code {bb0[1..=3], bb2[0], '_#1r}}.
   */
  String regionValueString(RegionVid region) {
    List<String> parts = new ArrayList<>();
    BitSet value = points[region.index()];
    int p = value.nextSetBit(0);
    while (p >= 0) {
      Location start = elements.toLocation(p);
      int end = p;
      while (end + 1 < elements.numPoints()
          && value.get(end + 1)
          && elements.toLocation(end + 1).block() == start.block()) {
        end++;
      }
      Location last = elements.toLocation(end);
      parts.add(
          end == p
              ? start.toString()
              : "bb" + start.block() + "[" + start.statementIndex() + "..=" + last.statementIndex()
                  + "]");
      p = value.nextSetBit(end + 1);
    }
    BitSet frs = freeRegionElements[region.index()];
    for (int e = frs.nextSetBit(0); e >= 0; e = frs.nextSetBit(e + 1)) {
      parts.add(RegionVid.of(e).toString());
    }
    return "{" + String.join(", ", parts) + "}";
  }

  /**
   * Finds why {@code borrowRegion} contains {@code location}: the liveness cause of a region it
   * outlives that is live there, or the universal region it outlives.
   */
  @Nullable Cause whyRegionContainsPoint(RegionVid borrowRegion, Location location) {
    checkArgument(
        regionContainsPoint(borrowRegion, location),
        "%s does not contain %s",
        borrowRegion,
        location);
    RegionVid liveRegion = errorReporter.findSubRegionLiveAt(borrowRegion, location);
    if (universalRegions.isUniversalRegion(liveRegion)) {
      return new Cause.UniversalRegion(liveRegion);
    }
    return livenessConstraints.cause(liveRegion, location);
  }

  boolean isSolved() {
    return solved;
  }

  int regionCount() {
    return regionCount;
  }

  Body getBody() {
    return body;
  }

  UniversalRegions getUniversalRegions() {
    return universalRegions;
  }

  ConstraintSet getConstraints() {
    return constraints;
  }

  ConstraintGraph getConstraintGraph() {
    return constraintGraph;
  }

  LivenessConstraints getLivenessConstraints() {
    return livenessConstraints;
  }

  BorrowckOptions getOptions() {
    return options;
  }

  RegionErrorReporter getErrorReporter() {
    return errorReporter;
  }
}
