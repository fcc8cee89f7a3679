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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;

/** The statements of a basic block followed by its terminator. */
public record BasicBlockData(ImmutableList<Statement> statements, Terminator terminator) {

  public BasicBlockData {
    requireNonNull(statements, "statements");
    requireNonNull(terminator, "terminator");
  }

  /** The location of the terminator: one past the last statement. */
  public int terminatorIndex() {
    return statements.size();
  }
}
