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

/**
 * A universe of region names. Placeholders created while entering a binder live in a fresh
 * universe that regions of enclosing universes cannot name.
 */
public record UniverseIndex(int index) implements Comparable<UniverseIndex> {

  public static final UniverseIndex ROOT = new UniverseIndex(0);

  public UniverseIndex {
    checkArgument(index >= 0, "negative universe %s", index);
  }

  public UniverseIndex next() {
    return new UniverseIndex(index + 1);
  }

  /** Whether a region of this universe may contain names from {@code other}. */
  public boolean canName(UniverseIndex other) {
    return index >= other.index;
  }

  @Override
  public int compareTo(UniverseIndex other) {
    return Integer.compare(index, other.index);
  }

  @Override
  public String toString() {
    return "U" + index;
  }
}
