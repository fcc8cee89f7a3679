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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.borrowck.mir.Body;
import com.google.borrowck.mir.Location;
import com.google.borrowck.mir.SourceSpan;
import org.jspecify.annotations.Nullable;

/**
 * Where a constraint must hold, and whether the location is worth showing to the user when the
 * constraint is blamed.
 */
record Locations(Locations.Kind kind, @Nullable Location location) {

  enum Kind {
    /** The constraint holds everywhere, for example because it comes from the signature. */
    ALL,
    /** The constraint arises from the statement at the location. */
    INTERESTING,
    /** Mechanically generated at the location, such as a reborrow or drop-check rule. */
    BORING
  }

  static final Locations ALL = new Locations(Kind.ALL, null);

  Locations {
    requireNonNull(kind, "kind");
    checkArgument((kind == Kind.ALL) == (location == null), "%s with location %s", kind, location);
  }

  static Locations interesting(Location location) {
    return new Locations(Kind.INTERESTING, requireNonNull(location));
  }

  static Locations boring(Location location) {
    return new Locations(Kind.BORING, requireNonNull(location));
  }

  boolean isInteresting() {
    return kind == Kind.INTERESTING;
  }

  /** The location the constraint arises from, or null if it holds everywhere. */
  @Nullable Location fromLocation() {
    return location;
  }

  SourceSpan span(Body body) {
    return location == null ? body.getSpan() : body.sourceSpan(location);
  }

  @Override
  public String toString() {
    return switch (kind) {
      case ALL -> "All";
      case INTERESTING -> "Interesting(" + location + ")";
      case BORING -> "Boring(" + location + ")";
    };
  }
}
