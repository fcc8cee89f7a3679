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

import com.google.borrowck.mir.Location;
import com.google.borrowck.ty.RegionVid;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.HashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * The points at which each region must be live. Only grows: points are added, never removed, and
 * the first cause recorded for a (region, point) pair is the one kept.
 */
final class LivenessConstraints {

  private record Key(RegionVid region, Location location) {}

  private final SetMultimap<RegionVid, Location> points = LinkedHashMultimap.create();
  private final Map<Key, Cause> causes = new HashMap<>();

  /**
   * Requires {@code region} to contain {@code location}.
   *
   * @return whether the point is new for the region
   */
  @CanIgnoreReturnValue
  boolean addElement(RegionVid region, Location location, Cause cause) {
    if (!points.put(region, location)) {
      return false;
    }
    causes.put(new Key(region, location), cause);
    return true;
  }

  boolean contains(RegionVid region, Location location) {
    return points.containsEntry(region, location);
  }

  ImmutableSet<Location> pointsOf(RegionVid region) {
    return ImmutableSet.copyOf(points.get(region));
  }

  /** Regions with at least one live point. */
  ImmutableSet<RegionVid> regions() {
    return ImmutableSet.copyOf(points.keySet());
  }

  @Nullable Cause cause(RegionVid region, Location location) {
    return causes.get(new Key(region, location));
  }

  int size() {
    return points.size();
  }
}
