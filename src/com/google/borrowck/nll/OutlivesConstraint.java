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

import com.google.borrowck.mir.SourceSpan;
import com.google.borrowck.ty.RegionVid;
import org.jspecify.annotations.Nullable;

/**
 * The requirement {@code sup: sub}, that is {@code sub <= sup}. Seen as a graph edge it points
 * from {@code sup} to {@code sub}.
 */
final class OutlivesConstraint {
  final RegionVid sup;
  final RegionVid sub;
  final Locations locations;
  final SourceSpan span;

  /** Next constraint with the same {@code sub}; set by {@link ConstraintSet#link}. */
  @Nullable ConstraintIndex next;

  OutlivesConstraint(RegionVid sup, RegionVid sub, Locations locations, SourceSpan span) {
    this.sup = requireNonNull(sup);
    this.sub = requireNonNull(sub);
    this.locations = requireNonNull(locations);
    this.span = requireNonNull(span);
  }

  @Override
  public String toString() {
    return "(" + sup + ": " + sub + " @ " + locations + ") due to " + span;
  }
}
