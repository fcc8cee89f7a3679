/*
 * Copyright 2009 The Closure Compiler Authors.
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

import java.io.Serializable;

/** Options that control region checking of a body. */
public class BorrowckOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  /** Level of the report issued when drop-check rules overflow for a type. */
  CheckLevel dropckOverflowLevel = CheckLevel.ERROR;

  public void setDropckOverflowLevel(CheckLevel level) {
    this.dropckOverflowLevel = level;
  }

  public CheckLevel getDropckOverflowLevel() {
    return dropckOverflowLevel;
  }

  /** How many times a dataflow analysis may revisit one block before it is considered diverged. */
  int maxDataflowStepsPerBlock = 20000;

  public void setMaxDataflowStepsPerBlock(int steps) {
    checkArgument(steps > 0, "steps must be positive");
    this.maxDataflowStepsPerBlock = steps;
  }

  public int getMaxDataflowStepsPerBlock() {
    return maxDataflowStepsPerBlock;
  }

  /**
   * Leave out of liveness computation the locals whose regions all outlive some free region. Those
   * regions contain every point anyway.
   */
  boolean skipLivenessForFreeRegionOutlivers = true;

  public void setSkipLivenessForFreeRegionOutlivers(boolean skip) {
    this.skipLivenessForFreeRegionOutlivers = skip;
  }

  public boolean getSkipLivenessForFreeRegionOutlivers() {
    return skipLivenessForFreeRegionOutlivers;
  }

  /** Use the "borrowed data escapes outside of closure" report where it applies. */
  boolean reportClosureEscapes = true;

  public void setReportClosureEscapes(boolean report) {
    this.reportClosureEscapes = report;
  }

  public boolean getReportClosureEscapes() {
    return reportClosureEscapes;
  }

  /** How many unsatisfied relations are reported for one universal region. */
  int maxErrorsPerRegion = 1;

  public void setMaxErrorsPerRegion(int max) {
    checkArgument(max > 0, "max must be positive");
    this.maxErrorsPerRegion = max;
  }

  public int getMaxErrorsPerRegion() {
    return maxErrorsPerRegion;
  }
}
