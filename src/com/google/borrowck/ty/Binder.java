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
 * A value under a {@code for<..>} binder. The bound regions are not listed explicitly: they are
 * the {@link Region.LateBound} occurrences inside {@code value} whose De Bruijn index points at
 * this binder.
 *
 * @param <T> the bound value type
 */
public record Binder<T>(T value) {

  public Binder {
    requireNonNull(value, "value");
  }

  public static <T> Binder<T> bind(T value) {
    return new Binder<>(value);
  }

  /** Wraps a value that binds no regions. */
  public static <T> Binder<T> dummy(T value) {
    return new Binder<>(value);
  }

  /** Returns the bound value, with late-bound regions still referring to this binder. */
  public T skipBinder() {
    return value;
  }

  @Override
  public String toString() {
    return "for<> " + value;
  }
}
