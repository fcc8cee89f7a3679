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
package com.google.borrowck.mir;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Comparator;

/**
 * A point in the control flow graph: the statement at {@code statementIndex} of basic block
 * {@code block}. The index equal to the number of statements of the block designates its
 * terminator.
 *
 * <p>Locations are ordered by block and then by statement index. Only the order within a block
 * reflects execution order; the order across blocks merely makes iteration deterministic.
 */
public record Location(int block, int statementIndex) implements Comparable<Location> {

  public static final Location START = new Location(0, 0);

  private static final Comparator<Location> ORDER =
      Comparator.comparingInt(Location::block).thenComparingInt(Location::statementIndex);

  public Location {
    checkArgument(
        block >= 0 && statementIndex >= 0, "bad location bb%s[%s]", block, statementIndex);
  }

  public static Location of(int block, int statementIndex) {
    return new Location(block, statementIndex);
  }

  /** The location of the next statement in the same block. */
  public Location successorWithinBlock() {
    return new Location(block, statementIndex + 1);
  }

  @Override
  public int compareTo(Location other) {
    return ORDER.compare(this, other);
  }

  @Override
  public String toString() {
    return "bb" + block + "[" + statementIndex + "]";
  }
}
