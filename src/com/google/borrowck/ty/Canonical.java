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
import static java.util.Objects.requireNonNull;

/**
 * A value produced by a query, in which type and region variables of the query are replaced by
 * {@link Ty.CanonicalVar} and {@link Region.Canonical} numbered from zero.
 *
 * @param variableCount the number of canonical variables {@code value} may mention
 */
public record Canonical<T>(int variableCount, T value) {

  public Canonical {
    checkArgument(variableCount >= 0, "negative variable count");
    requireNonNull(value, "value");
  }

  public static <T> Canonical<T> of(int variableCount, T value) {
    return new Canonical<>(variableCount, value);
  }
}
