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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/** The signature of a function pointer. */
public record FnSig(ImmutableList<Ty> inputs, Ty output) {

  public FnSig {
    requireNonNull(inputs, "inputs");
    requireNonNull(output, "output");
  }

  public static FnSig of(Ty output, Ty... inputs) {
    return new FnSig(ImmutableList.copyOf(inputs), output);
  }

  @Override
  public String toString() {
    return "fn(" + Joiner.on(", ").join(inputs) + ") -> " + output;
  }
}
