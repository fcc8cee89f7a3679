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

import static com.google.common.base.Preconditions.checkState;

import com.google.borrowck.mir.BasicBlockData;
import com.google.borrowck.mir.Body;
import com.google.borrowck.mir.Location;
import com.google.borrowck.mir.Rvalue;
import com.google.borrowck.mir.SourceSpan;
import com.google.borrowck.mir.Statement;
import com.google.borrowck.mir.Terminator;
import com.google.borrowck.ty.RegionVid;
import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Explains region errors by walking the constraint graph.
 *
 * <p>For an error {@code fr: outlived}, the shortest chain of constraints forcing {@code fr} to
 * outlive {@code outlived} is found by breadth-first search. Each constraint on it is classified by
 * the statement it came from, and the most specific one is blamed.
 */
final class RegionErrorReporter {
  private static final Logger logger = Logger.getLogger(RegionErrorReporter.class.getName());

  /** How the search reached a region. */
  private interface Trace {
    Trace START_REGION = new StartRegion();

    record StartRegion() implements Trace {}

    record FromConstraint(ConstraintIndex constraint) implements Trace {}
  }

  /** A chain of constraints from a region to the region satisfying a target test. */
  record ConstraintPath(ImmutableList<ConstraintIndex> constraints, RegionVid target) {}

  /** The constraint blamed for a path, reduced to what a diagnostic shows. */
  record BlameConstraint(ConstraintCategory category, SourceSpan span, RegionVid target) {}

  private final RegionInferenceContext regionCx;
  private final Body body;
  private final UniversalRegions universalRegions;
  private final ConstraintSet constraints;

  RegionErrorReporter(RegionInferenceContext regionCx) {
    this.regionCx = regionCx;
    this.body = regionCx.getBody();
    this.universalRegions = regionCx.getUniversalRegions();
    this.constraints = regionCx.getConstraints();
  }

  /**
   * Finds the shortest chain of constraints {@code from: R1, R1: R2, ..., Rn-1: Rn} such that
   * {@code Rn} passes {@code targetTest}. The chain is empty if {@code from} passes itself.
   * Returns null if no region reachable from {@code from} passes.
   */
  @Nullable ConstraintPath findConstraintPathBetweenRegions(
      RegionVid from, Predicate<RegionVid> targetTest) {
    ConstraintGraph graph = regionCx.getConstraintGraph();
    @Nullable Trace[] context = new Trace[regionCx.regionCount()];
    context[from.index()] = Trace.START_REGION;

    Deque<RegionVid> deque = new ArrayDeque<>();
    deque.add(from);
    while (!deque.isEmpty()) {
      RegionVid r = deque.poll();
      if (targetTest.test(r)) {
        List<ConstraintIndex> result = new ArrayList<>();
        RegionVid p = r;
        while (true) {
          Trace trace = context[p.index()];
          checkState(trace != null, "found unvisited region %s on path to %s", p, r);
          if (trace instanceof Trace.FromConstraint fromConstraint) {
            result.add(fromConstraint.constraint());
            p = constraints.get(fromConstraint.constraint()).sup;
          } else {
            break;
          }
        }
        return new ConstraintPath(ImmutableList.copyOf(result).reverse(), r);
      }

      for (ConstraintIndex index : graph.outgoingEdges(r)) {
        OutlivesConstraint constraint = constraints.get(index);
        checkState(constraint.sup.equals(r), "%s is not an outgoing edge of %s", constraint, r);
        RegionVid subRegion = constraint.sub;
        if (context[subRegion.index()] == null) {
          context[subRegion.index()] = new Trace.FromConstraint(index);
          deque.add(subRegion);
        }
      }
    }
    return null;
  }

  /**
   * Finds the constraint to blame for {@code from} outliving a region that passes {@code
   * targetTest}: the first, in path order, of the best category on the shortest path.
   */
  BlameConstraint bestBlameConstraint(RegionVid from, Predicate<RegionVid> targetTest) {
    ConstraintPath path = findConstraintPathBetweenRegions(from, targetTest);
    checkState(path != null, "no constraint path from %s", from);
    if (path.constraints().isEmpty()) {
      return new BlameConstraint(ConstraintCategory.BORING, body.getSpan(), path.target());
    }
    List<BlameConstraint> categorized = new ArrayList<>();
    for (ConstraintIndex index : path.constraints()) {
      categorized.add(classifyConstraint(index, path.target()));
    }
    if (logger.isLoggable(Level.FINER)) {
      logger.finer("best_blame_constraint(from=" + from + "): path=" + categorized);
    }
    categorized.sort(Comparator.comparing(BlameConstraint::category));
    return categorized.get(0);
  }

  private BlameConstraint classifyConstraint(ConstraintIndex index, RegionVid target) {
    OutlivesConstraint constraint = constraints.get(index);
    return new BlameConstraint(categorize(constraint), constraint.span, target);
  }

  /** Classifies a constraint by the statement or terminator at its location. */
  ConstraintCategory categorize(OutlivesConstraint constraint) {
    if (!constraint.locations.isInteresting()) {
      return ConstraintCategory.BORING;
    }
    Location location = constraint.locations.fromLocation();
    if (location == null) {
      location = Location.START;
    }
    BasicBlockData data = body.block(location.block());
    if (location.statementIndex() == data.statements().size()) {
      Terminator terminator = data.terminator();
      if (terminator instanceof Terminator.DropAndReplace) {
        return ConstraintCategory.ASSIGNMENT;
      } else if (terminator instanceof Terminator.Call) {
        return ConstraintCategory.CALL_ARGUMENT;
      }
      return ConstraintCategory.OTHER;
    }
    Statement statement = data.statements().get(location.statementIndex());
    if (!(statement instanceof Statement.Assign assign)) {
      return ConstraintCategory.OTHER;
    }
    if (assign.place().isReturnPlace()) {
      return ConstraintCategory.RETURN;
    }
    Rvalue rvalue = assign.rvalue();
    if (rvalue instanceof Rvalue.Cast) {
      return ConstraintCategory.CAST;
    } else if (rvalue instanceof Rvalue.Use || rvalue instanceof Rvalue.Aggregate) {
      return ConstraintCategory.ASSIGNMENT;
    }
    return ConstraintCategory.OTHER;
  }

  /**
   * Reports that the universal region {@code fr} must outlive {@code outlivedFr}, which it is not
   * known to do.
   */
  void reportError(RegionVid fr, RegionVid outlivedFr, List<BorrowckError> errors) {
    BlameConstraint blame = bestBlameConstraint(fr, r -> r.equals(outlivedFr));
    ConstraintCategory category = blame.category();
    if (universalRegions.isLocalFreeRegion(fr) && !universalRegions.isLocalFreeRegion(outlivedFr)) {
      if (category == ConstraintCategory.ASSIGNMENT) {
        category = ConstraintCategory.ASSIGNMENT_TO_UPVAR;
      } else if (category == ConstraintCategory.CALL_ARGUMENT) {
        category = ConstraintCategory.CALL_ARGUMENT_TO_UPVAR;
      }
    }
    logger.fine(
        "report_error(fr=" + fr + ", outlived_fr=" + outlivedFr + "): category=" + category.name());

    if (category.isToUpvar() && regionCx.getOptions().getReportClosureEscapes()) {
      reportClosureError(fr, outlivedFr, category, blame.span(), errors);
    } else {
      reportGeneralError(fr, outlivedFr, category, blame.span(), errors);
    }
  }

  private void reportClosureError(
      RegionVid fr,
      RegionVid outlivedFr,
      ConstraintCategory category,
      SourceSpan span,
      List<BorrowckError> errors) {
    RegionVarNames.VarNameAndSpan frNameAndSpan =
        RegionVarNames.forRegion(body, universalRegions, fr);
    RegionVarNames.VarNameAndSpan outlivedNameAndSpan =
        RegionVarNames.forRegion(body, universalRegions, outlivedFr);
    if (frNameAndSpan == null && outlivedNameAndSpan == null) {
      reportGeneralError(fr, outlivedFr, category, span, errors);
      return;
    }

    BorrowckError.Builder diag =
        BorrowckError.builder(NllDiagnostics.NLL_BORROWED_DATA_ESCAPES_CLOSURE, span);
    if (outlivedNameAndSpan != null && outlivedNameAndSpan.name() != null) {
      diag.addSpanLabel(
          outlivedNameAndSpan.span(),
          "`" + outlivedNameAndSpan.name() + "` is declared here, outside of the closure body");
    }
    if (frNameAndSpan != null && frNameAndSpan.name() != null) {
      String name = frNameAndSpan.name();
      diag.addSpanLabel(
          frNameAndSpan.span(),
          "`" + name + "` is a reference that is only valid in the closure body");
      diag.addSpanLabel(span, "`" + name + "` escapes the closure body here");
    }
    diag.buffer(errors);
  }

  private void reportGeneralError(
      RegionVid fr,
      RegionVid outlivedFr,
      ConstraintCategory category,
      SourceSpan span,
      List<BorrowckError> errors) {
    BorrowckError.Builder diag =
        BorrowckError.builder(NllDiagnostics.NLL_UNSATISFIED_LIFETIME_CONSTRAINTS, span);
    RegionNamer namer = new RegionNamer(body, universalRegions);
    String frName = namer.giveRegionAName(fr, diag);
    String outlivedFrName = namer.giveRegionAName(outlivedFr, diag);
    diag.addSpanLabel(
        span,
        category + " requires that `" + frName + "` must outlive `" + outlivedFrName + "`");
    diag.buffer(errors);
  }

  /** Finds a region {@code R} with {@code fr: R} that is live at {@code location}. */
  RegionVid findSubRegionLiveAt(RegionVid fr, Location location) {
    LivenessConstraints liveness = regionCx.getLivenessConstraints();
    ConstraintPath path =
        findConstraintPathBetweenRegions(
            fr,
            r -> liveness.contains(r, location) || universalRegions.isUniversalRegion(r));
    checkState(path != null, "%s reaches no region live at %s", fr, location);
    return path.target();
  }

  /** Finds a good span to blame for the fact that {@code fr1} outlives {@code fr2}. */
  SourceSpan findOutlivesBlameSpan(RegionVid fr1, RegionVid fr2) {
    return bestBlameConstraint(fr1, r -> r.equals(fr2)).span();
  }
}
