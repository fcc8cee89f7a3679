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
package com.google.borrowck.ty;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Counts binders outward from a late-bound region occurrence to the binder that introduced it.
 * {@link #INNERMOST} refers to the closest enclosing binder.
 */
public record DebruijnIndex(int index) implements Comparable<DebruijnIndex> {

  public static final DebruijnIndex INNERMOST = new DebruijnIndex(0);

  public DebruijnIndex {
    checkArgument(index >= 0, "negative debruijn index %s", index);
  }

  public static DebruijnIndex of(int index) {
    return index == 0 ? INNERMOST : new DebruijnIndex(index);
  }

  public DebruijnIndex shiftedIn(int amount) {
    return new DebruijnIndex(index + amount);
  }

  public DebruijnIndex shiftedOut(int amount) {
    return new DebruijnIndex(index - amount);
  }

  @Override
  public int compareTo(DebruijnIndex other) {
    return Integer.compare(index, other.index);
  }

  @Override
  public String toString() {
    return "^" + index;
  }
}
