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

import com.google.borrowck.ty.RegionVid;
import com.google.common.collect.ImmutableList;
import java.util.Arrays;

/**
 * Adjacency over a {@link ConstraintSet}. In the normal direction the constraint {@code R1: R2} is
 * an edge from {@code R1} to {@code R2}; in the reverse direction it goes from {@code R2} to
 * {@code R1}.
 */
final class ConstraintGraph {

  enum Direction {
    NORMAL,
    REVERSE
  }

  private final Direction direction;
  private final ConstraintSet constraints;
  private final int[] firstConstraints;
  private final int[] nextConstraints;

  private ConstraintGraph(Direction direction, ConstraintSet constraints, int regionCount) {
    this.direction = direction;
    this.constraints = constraints;
    this.firstConstraints = new int[regionCount];
    this.nextConstraints = new int[constraints.size()];
    Arrays.fill(firstConstraints, -1);
    for (int i = constraints.size() - 1; i >= 0; i--) {
      int source = source(constraints.get(ConstraintIndex.of(i))).index();
      nextConstraints[i] = firstConstraints[source];
      firstConstraints[source] = i;
    }
  }

  static ConstraintGraph forward(ConstraintSet constraints, int regionCount) {
    return new ConstraintGraph(Direction.NORMAL, constraints, regionCount);
  }

  static ConstraintGraph reverse(ConstraintSet constraints, int regionCount) {
    return new ConstraintGraph(Direction.REVERSE, constraints, regionCount);
  }

  RegionVid source(OutlivesConstraint constraint) {
    return direction == Direction.NORMAL ? constraint.sup : constraint.sub;
  }

  RegionVid target(OutlivesConstraint constraint) {
    return direction == Direction.NORMAL ? constraint.sub : constraint.sup;
  }

  /** The constraints leaving {@code region}, in push order. */
  ImmutableList<ConstraintIndex> outgoingEdges(RegionVid region) {
    ImmutableList.Builder<ConstraintIndex> edges = ImmutableList.builder();
    for (int c = firstConstraints[region.index()]; c != -1; c = nextConstraints[c]) {
      edges.add(ConstraintIndex.of(c));
    }
    return edges.build();
  }

  /** The regions at the other end of the edges leaving {@code region}. */
  ImmutableList<RegionVid> outgoingRegions(RegionVid region) {
    ImmutableList.Builder<RegionVid> regions = ImmutableList.builder();
    for (int c = firstConstraints[region.index()]; c != -1; c = nextConstraints[c]) {
      regions.add(target(constraints.get(ConstraintIndex.of(c))));
    }
    return regions.build();
  }
}
