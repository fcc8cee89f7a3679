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
import com.google.borrowck.ty.TypeQueries;
import com.google.common.collect.ImmutableList;
import java.util.logging.Logger;

/**
 * Checks the regions of function bodies with non-lexical lifetimes.
 *
 * <p>For each body, the type check walk relates the types of every assignment, borrow and call
 * and records the resulting outlives constraints. Liveness then adds the points at which each
 * region must be live, the region values are solved, and every constraint the signature of the
 * body does not allow is reported.
 *
 * <p>The diagnostics of a body are returned with its result and reported to the error manager of
 * the check, which by default logs them when its report is generated.
 */
public final class NllRegionCheck {
  private static final Logger logger = Logger.getLogger(NllRegionCheck.class.getName());

  private final BorrowckOptions options;
  private final TypeQueries queries;
  private final ErrorManager errorManager;

  public NllRegionCheck(BorrowckOptions options, TypeQueries queries) {
    this(options, queries, new LoggerErrorManager(logger));
  }

  public NllRegionCheck(BorrowckOptions options, TypeQueries queries, ErrorManager errorManager) {
    this.options = requireNonNull(options);
    this.queries = requireNonNull(queries);
    this.errorManager = requireNonNull(errorManager);
  }

  public ErrorManager getErrorManager() {
    return errorManager;
  }

  /**
   * Checks {@code body}, whose free regions are variables of {@code universalRegions}. The
   * region variables of a body must not be shared with another one.
   */
  public NllResult check(Body body, UniversalRegions universalRegions) {
    logger.fine("checking " + body);
    BorrowCheckContext cx = new BorrowCheckContext(body, universalRegions, queries, options);
    MirTypeChecker.typeCheck(cx);
    TypeLivenessGenerator.generate(cx);

    RegionInferenceContext regionCx =
        new RegionInferenceContext(
            body, universalRegions, cx.constraints, cx.livenessConstraints, options);
    regionCx.solve(cx.errors);
    logger.fine(
        body + ": " + cx.constraints.size() + " constraints ("
            + cx.constraints.getDiscardedCount() + " discarded), " + cx.errors.size()
            + " diagnostics");
    errorManager.reportAll(cx.errors);
    return new NllResult(
        universalRegions,
        cx.constraints,
        cx.livenessConstraints,
        regionCx,
        ImmutableList.copyOf(cx.errors));
  }
}
