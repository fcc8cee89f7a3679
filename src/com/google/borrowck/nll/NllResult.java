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
import com.google.borrowck.ty.Region;
import com.google.borrowck.ty.RegionVid;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * The outcome of region checking one body: the constraints collected, the inferred region values
 * and the diagnostics buffered along the way.
 */
public final class NllResult {
  private final UniversalRegions universalRegions;
  private final ConstraintSet constraints;
  private final LivenessConstraints livenessConstraints;
  private final RegionInferenceContext regionCx;
  private final ImmutableList<BorrowckError> errors;

  NllResult(
      UniversalRegions universalRegions,
      ConstraintSet constraints,
      LivenessConstraints livenessConstraints,
      RegionInferenceContext regionCx,
      ImmutableList<BorrowckError> errors) {
    this.universalRegions = universalRegions;
    this.constraints = constraints;
    this.livenessConstraints = livenessConstraints;
    this.regionCx = regionCx;
    this.errors = errors;
  }

  /** Diagnostics in the order they were produced. */
  public ImmutableList<BorrowckError> getErrors() {
    return errors;
  }

  /** Whether some constraint requires {@code sup: sub}. */
  public boolean requiresOutlives(RegionVid sup, RegionVid sub) {
    return constraints.contains(sup, sub);
  }

  /** Whether liveness alone forces {@code region} to contain {@code location}. */
  public boolean isLiveAt(RegionVid region, Location location) {
    return livenessConstraints.contains(region, location);
  }

  /** Whether the inferred value of {@code region} contains {@code location}. */
  public boolean regionContainsPoint(RegionVid region, Location location) {
    return regionCx.regionContainsPoint(region, location);
  }

  public ImmutableSet<Location> regionPoints(RegionVid region) {
    return regionCx.regionPoints(region);
  }

  public String regionValueString(RegionVid region) {
    return regionCx.regionValueString(region);
  }

  /**
   * Adds labels to {@code err} explaining why the borrow with region {@code borrowRegion} is still
   * live at {@code location}.
   */
  public void explainWhyBorrowContainsPoint(
      Region borrowRegion, Location location, BorrowckError.Builder err) {
    new BorrowExplanation(regionCx)
        .explainWhyBorrowContainsPoint(
            universalRegions.toRegionVid(borrowRegion), location, err);
  }
}
