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

import static com.google.common.base.Preconditions.checkElementIndex;

import com.google.borrowck.mir.Body;
import com.google.borrowck.mir.Location;

/** Numbers the locations of a body densely, block by block, for use as bit set indices. */
final class RegionValueElements {
  private final int[] blockStarts;
  private final int[] blockOfPoint;
  private final int numPoints;

  RegionValueElements(Body body) {
    blockStarts = new int[body.blockCount()];
    int points = 0;
    for (int block = 0; block < body.blockCount(); block++) {
      blockStarts[block] = points;
      points += body.block(block).statements().size() + 1;
    }
    numPoints = points;
    blockOfPoint = new int[numPoints];
    for (int block = 0; block < blockStarts.length; block++) {
      int end = block + 1 < blockStarts.length ? blockStarts[block + 1] : numPoints;
      for (int i = blockStarts[block]; i < end; i++) {
        blockOfPoint[i] = block;
      }
    }
  }

  int numPoints() {
    return numPoints;
  }

  int pointIndex(Location location) {
    int index = blockStarts[location.block()] + location.statementIndex();
    checkElementIndex(index, numPoints, "point");
    return index;
  }

  Location toLocation(int pointIndex) {
    checkElementIndex(pointIndex, numPoints, "point");
    int block = blockOfPoint[pointIndex];
    return Location.of(block, pointIndex - blockStarts[block]);
  }
}
