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

/**
 * A region obligation {@code sup: sub} produced by a type query. {@code sup} is a region or a
 * type; a type outlives {@code sub} when all of its free regions do.
 */
public record OutlivesPredicate(GenericArg sup, Region sub) {

  public OutlivesPredicate {
    requireNonNull(sup, "sup");
    requireNonNull(sub, "sub");
  }

  @Override
  public String toString() {
    return sup + ": " + sub;
  }
}
