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

/** Stable address of a constraint within its {@link ConstraintSet}. */
record ConstraintIndex(int index) {

  ConstraintIndex {
    checkArgument(index >= 0, "negative constraint index %s", index);
  }

  static ConstraintIndex of(int index) {
    return new ConstraintIndex(index);
  }

  @Override
  public String toString() {
    return "ConstraintIndex(" + index + ")";
  }
}
