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
import com.google.borrowck.ty.RegionVid;
import com.google.borrowck.ty.Types;
import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Numbers the locals that take part in liveness computation. A local takes part if its type
 * mentions a region that is not already known to outlive a free region: such regions contain
 * every point anyway, so computing where they are live gains nothing.
 */
final class NllLivenessMap {
  private static final Logger logger = Logger.getLogger(NllLivenessMap.class.getName());

  private final int[] fromLocal;
  private final ImmutableList<Local> toLocal;

  private NllLivenessMap(int[] fromLocal, ImmutableList<Local> toLocal) {
    this.fromLocal = fromLocal;
    this.toLocal = toLocal;
  }

  /**
   * @param freeRegions the free regions and every region known to outlive one of them
   * @param skipFreeRegionOutlivers if false, every local whose type mentions a region is kept
   */
  static NllLivenessMap compute(
      Body body,
      UniversalRegions universalRegions,
      Set<RegionVid> freeRegions,
      boolean skipFreeRegionOutlivers) {
    int[] fromLocal = new int[body.localCount()];
    Arrays.fill(fromLocal, -1);
    ImmutableList.Builder<Local> toLocal = ImmutableList.builder();
    int next = 0;
    for (int i = 0; i < body.localCount(); i++) {
      LocalDecl decl = body.getLocalDecls().get(i);
      boolean relevant =
          Types.anyFreeRegion(
              decl.ty(),
              r ->
                  !skipFreeRegionOutlivers
                      || !freeRegions.contains(universalRegions.toRegionVid(r)));
      if (relevant) {
        fromLocal[i] = next++;
        toLocal.add(Local.of(i));
      }
    }
    NllLivenessMap map = new NllLivenessMap(fromLocal, toLocal.build());
    logger.fine("liveness map for " + body + ": " + map.toLocal);
    return map;
  }

  /** The live-variable index of {@code local}, or -1 if it takes no part. */
  int fromLocal(Local local) {
    return fromLocal[local.index()];
  }

  Local fromLiveVar(int liveVar) {
    return toLocal.get(liveVar);
  }

  int numVariables() {
    return toLocal.size();
  }

  boolean isEmpty() {
    return toLocal.isEmpty();
  }
}
