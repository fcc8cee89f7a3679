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

import static java.util.Objects.requireNonNull;

import com.google.borrowck.mir.Body;
import com.google.borrowck.mir.SourceSpan;
import com.google.borrowck.ty.GenericArg;
import com.google.borrowck.ty.OutlivesPredicate;
import com.google.borrowck.ty.Region;
import com.google.borrowck.ty.RegionVid;
import com.google.borrowck.ty.TypeQueries;
import com.google.borrowck.ty.Types;
import java.util.ArrayList;
import java.util.List;

/**
 * The state owned by the region check of one body: the tables the type check walk and the
 * liveness generator fill in, and the buffer their diagnostics go to. Nothing in it is shared with
 * the check of another body.
 */
final class BorrowCheckContext {
  final Body body;
  final UniversalRegions universalRegions;
  final TypeQueries queries;
  final BorrowckOptions options;
  final ConstraintSet constraints = new ConstraintSet();
  final LivenessConstraints livenessConstraints = new LivenessConstraints();
  final List<BorrowckError> errors = new ArrayList<>();

  BorrowCheckContext(
      Body body, UniversalRegions universalRegions, TypeQueries queries, BorrowckOptions options) {
    this.body = requireNonNull(body);
    this.universalRegions = requireNonNull(universalRegions);
    this.queries = requireNonNull(queries);
    this.options = requireNonNull(options);
  }

  RegionVariables variables() {
    return universalRegions.getVariables();
  }

  TypeRelating.Context relatingContext() {
    return new TypeRelating.Context(universalRegions, constraints);
  }

  void pushOutlives(RegionVid sup, RegionVid sub, Locations locations) {
    constraints.push(new OutlivesConstraint(sup, sub, locations, locations.span(body)));
  }

  /**
   * Adds the region constraints a type query answered with. A type outlives a region when all of
   * its free regions do.
   */
  void pushRegionConstraints(Locations locations, List<OutlivesPredicate> predicates) {
    SourceSpan span = locations.span(body);
    for (OutlivesPredicate predicate : predicates) {
      RegionVid sub = universalRegions.toRegionVid(predicate.sub());
      GenericArg sup = predicate.sup();
      if (sup instanceof Region) {
        constraints.push(
            new OutlivesConstraint(
                universalRegions.toRegionVid((Region) sup), sub, locations, span));
      } else {
        Types.forEachFreeRegion(
            sup,
            r ->
                constraints.push(
                    new OutlivesConstraint(
                        universalRegions.toRegionVid(r), sub, locations, span)));
      }
    }
  }
}
