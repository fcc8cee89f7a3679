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
import com.google.borrowck.mir.LocalDecl;
import com.google.borrowck.mir.Location;
import com.google.borrowck.mir.MirVisitor;
import com.google.borrowck.mir.PlaceContext;
import com.google.borrowck.ty.RegionVid;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Annotates a borrow error with why the borrow is still live at the point of the conflicting
 * access: the later use or drop of a variable that holds the borrow, or the universal region the
 * borrow must outlive.
 */
final class BorrowExplanation {
  private static final Logger logger = Logger.getLogger(BorrowExplanation.class.getName());

  private enum DefUse {
    DEF,
    USE,
    DROP,
    NONE
  }

  private final RegionInferenceContext regionCx;
  private final Body body;

  BorrowExplanation(RegionInferenceContext regionCx) {
    this.regionCx = regionCx;
    this.body = regionCx.getBody();
  }

  /**
   * Adds labels to {@code err} explaining why {@code borrowRegion} contains {@code location}.
   * Does nothing if the region does not contain it.
   */
  void explainWhyBorrowContainsPoint(
      RegionVid borrowRegion, Location location, BorrowckError.Builder err) {
    if (!regionCx.regionContainsPoint(borrowRegion, location)) {
      return;
    }
    Cause cause = regionCx.whyRegionContainsPoint(borrowRegion, location);
    logger.fine(
        "explain_why_borrow_contains_point: " + borrowRegion + " at " + location + " because "
            + cause);
    if (cause instanceof Cause.LiveVar liveVar) {
      Location use = findUse(borrowRegion, liveVar.location(), liveVar.local(), DefUse.USE);
      if (use == null) {
        throw new IllegalStateException("cause should end in a use of " + liveVar.local());
      }
      err.addSpanLabel(body.sourceSpan(use), "borrow later used here");
    } else if (cause instanceof Cause.DropVar dropVar) {
      Location drop = findUse(borrowRegion, dropVar.location(), dropVar.local(), DefUse.DROP);
      if (drop == null) {
        throw new IllegalStateException("cause should end in a drop of " + dropVar.local());
      }
      LocalDecl decl = body.localDecl(dropVar.local());
      if (decl.name() != null) {
        err.addSpanLabel(
            body.sourceSpan(drop), "borrow later used here, when `" + decl.name() + "` is dropped");
      } else {
        err.addSpanLabel(decl.span(), "borrow may end up in a temporary, created here");
        err.addSpanLabel(
            body.sourceSpan(drop), "temporary later dropped here, potentially using the reference");
      }
    } else if (cause instanceof Cause.UniversalRegion universal) {
      String name = regionCx.getUniversalRegions().name(universal.region());
      if (name != null) {
        err.addNote("borrowed value must be valid for the lifetime " + name + "...");
      }
    }
  }

  /**
   * Searches forward from {@code start}, within the points of {@code region}, for the first
   * location where {@code local} is used the way {@code wanted} says. Paths on which the local is
   * overwritten first are abandoned.
   */
  private @Nullable Location findUse(
      RegionVid region, Location start, Local local, DefUse wanted) {
    Deque<Location> queue = new ArrayDeque<>();
    Set<Location> visited = new HashSet<>();
    queue.add(start);
    while (!queue.isEmpty()) {
      Location p = queue.poll();
      if (!visited.add(p) || !regionCx.regionContainsPoint(region, p)) {
        continue;
      }
      DefUse defUse = defUse(p, local);
      if (defUse == wanted) {
        return p;
      }
      if (defUse != DefUse.DEF) {
        queue.addAll(body.successors(p));
      }
    }
    return null;
  }

  private DefUse defUse(Location location, Local local) {
    DefUseVisitor visitor = new DefUseVisitor(local);
    if (body.isTerminatorLocation(location)) {
      visitor.visitTerminator(body.block(location.block()).terminator(), location);
    } else {
      visitor.visitStatement(body.statementAt(location), location);
    }
    return visitor.result;
  }

  /** Finds what one location does to a local; the last context reported wins. */
  private static final class DefUseVisitor extends MirVisitor {
    private final Local local;
    DefUse result = DefUse.NONE;

    DefUseVisitor(Local local) {
      this.local = local;
    }

    @Override
    public void visitLocal(Local visited, PlaceContext context, Location location) {
      if (!visited.equals(local)) {
        return;
      }
      if (context.isDef()) {
        result = DefUse.DEF;
      } else if (context.isDrop()) {
        result = DefUse.DROP;
      } else {
        result = DefUse.USE;
      }
    }
  }
}
