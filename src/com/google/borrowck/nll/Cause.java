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

import com.google.borrowck.mir.Local;
import com.google.borrowck.mir.Location;
import com.google.borrowck.ty.RegionVid;

/** Why a region must contain a point. */
interface Cause {

  /** The value of {@code local} may be used at or after {@code location}. */
  record LiveVar(Local local, Location location) implements Cause {
    public LiveVar {
      requireNonNull(local, "local");
      requireNonNull(location, "location");
    }
  }

  /** The value of {@code local} may be dropped at or after {@code location}. */
  record DropVar(Local local, Location location) implements Cause {
    public DropVar {
      requireNonNull(local, "local");
      requireNonNull(location, "location");
    }
  }

  /** The region outlives a universal region of the signature, which contains every point. */
  record UniversalRegion(RegionVid region) implements Cause {
    public UniversalRegion {
      requireNonNull(region, "region");
    }
  }

  /** The point was added without a variable to blame, for example by a type query. */
  record Unspecified() implements Cause {}

  Cause UNSPECIFIED = new Unspecified();
}
