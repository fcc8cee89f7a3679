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

/** A densely numbered region inference variable. Never recycled within one body's analysis. */
public record RegionVid(int index) implements Comparable<RegionVid> {

  public RegionVid {
    checkArgument(index >= 0, "negative region index %s", index);
  }

  public static RegionVid of(int index) {
    return new RegionVid(index);
  }

  @Override
  public int compareTo(RegionVid other) {
    return Integer.compare(index, other.index);
  }

  @Override
  public String toString() {
    return "'_#" + index + "r";
  }
}
