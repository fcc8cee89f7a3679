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

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkState;

import com.google.borrowck.ty.RegionVid;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * The outlives constraints gathered while checking one body.
 *
 * <p>Only the existence of an edge is recorded: pushing {@code sup: sub} again, or pushing a
 * self-loop {@code r: r}, leaves the set unchanged and the first push keeps the location used to
 * explain the edge.
 */
final class ConstraintSet implements Iterable<OutlivesConstraint> {
  private static final Logger logger = Logger.getLogger(ConstraintSet.class.getName());

  private record DedupKey(RegionVid sup, RegionVid sub) {}

  private final List<OutlivesConstraint> constraints = new ArrayList<>();
  private final Set<DedupKey> seenConstraints = new HashSet<>();
  private int discardedCount = 0;
  private boolean linked = false;

  /**
   * Adds {@code constraint} unless it is a self-loop or an edge already present.
   *
   * @return whether the constraint was added
   */
  @CanIgnoreReturnValue
  boolean push(OutlivesConstraint constraint) {
    if (logger.isLoggable(Level.FINER)) {
      logger.finer("push(" + constraint + ")");
    }
    checkState(!linked, "constraint pushed after link()");
    if (constraint.sup.equals(constraint.sub)) {
      discardedCount++;
      return false;
    }
    if (!seenConstraints.add(new DedupKey(constraint.sup, constraint.sub))) {
      discardedCount++;
      return false;
    }
    constraints.add(constraint);
    return true;
  }

  OutlivesConstraint get(ConstraintIndex index) {
    return constraints.get(index.index());
  }

  int size() {
    return constraints.size();
  }

  boolean isEmpty() {
    return constraints.isEmpty();
  }

  /** Number of pushes that were dropped as self-loops or duplicates. */
  int getDiscardedCount() {
    return discardedCount;
  }

  boolean contains(RegionVid sup, RegionVid sub) {
    return seenConstraints.contains(new DedupKey(sup, sub));
  }

  @Override
  public Iterator<OutlivesConstraint> iterator() {
    return constraints.iterator();
  }

  /**
   * Threads every constraint onto the list of constraints sharing its {@code sub}, and returns
   * the head of that list for each region. Lists are in push order. May be called once, after
   * the last push.
   */
  @Nullable ConstraintIndex[] link(int regionCount) {
    checkState(!linked, "link() called twice");
    linked = true;
    @Nullable ConstraintIndex[] heads = new ConstraintIndex[regionCount];
    for (int i = constraints.size() - 1; i >= 0; i--) {
      OutlivesConstraint constraint = constraints.get(i);
      int sub = constraint.sub.index();
      checkElementIndex(sub, regionCount, "sub region");
      checkState(constraint.next == null, "%s already linked", constraint);
      constraint.next = heads[sub];
      heads[sub] = ConstraintIndex.of(i);
    }
    logger.fine("linked " + constraints.size() + " constraints over " + regionCount + " regions");
    return heads;
  }

  boolean isLinked() {
    return linked;
  }

  /** Invokes {@code op} on each constraint of the list starting at {@code head}. */
  void eachAffectedByDirty(@Nullable ConstraintIndex head, Consumer<ConstraintIndex> op) {
    checkState(linked, "eachAffectedByDirty() before link()");
    ConstraintIndex current = head;
    while (current != null) {
      op.accept(current);
      current = get(current).next;
    }
  }
}
