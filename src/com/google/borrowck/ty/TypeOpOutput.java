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
 * The value computed by a type query together with the region obligations the query left for
 * the caller to enforce.
 *
 * @param <T> the query result type
 */
public record TypeOpOutput<T>(T value, ImmutableList<OutlivesPredicate> regionConstraints) {

  public TypeOpOutput {
    requireNonNull(value, "value");
    requireNonNull(regionConstraints, "regionConstraints");
  }

  public static <T> TypeOpOutput<T> of(T value) {
    return new TypeOpOutput<>(value, ImmutableList.of());
  }
}
