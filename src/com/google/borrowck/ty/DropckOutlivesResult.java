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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;

/**
 * The result of {@code dropck_outlives(ty)}.
 *
 * @param kinds the types and regions that the destructors run when dropping the value may
 *     access; they must be live wherever the value may be dropped
 * @param overflows types at which the computation gave up, because the type expanded without
 *     bound
 */
public record DropckOutlivesResult(ImmutableList<GenericArg> kinds, ImmutableList<Ty> overflows) {

  public static final DropckOutlivesResult EMPTY =
      new DropckOutlivesResult(ImmutableList.of(), ImmutableList.of());

  public DropckOutlivesResult {
    requireNonNull(kinds, "kinds");
    requireNonNull(overflows, "overflows");
  }

  public boolean hasOverflowed() {
    return !overflows.isEmpty();
  }
}
