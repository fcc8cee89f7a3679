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

import com.google.common.collect.ImmutableList;

/** Sink for the diagnostics that a caller decides to surface. */
public interface ErrorManager {

  /** Reports a diagnostic at the given level. */
  void report(CheckLevel level, BorrowckError error);

  /** Reports every diagnostic of {@code errors} at its own level. */
  default void reportAll(Iterable<BorrowckError> errors) {
    for (BorrowckError error : errors) {
      report(error.level(), error);
    }
  }

  /** Writes the report of everything reported so far. */
  void generateReport();

  int getErrorCount();

  int getWarningCount();

  ImmutableList<BorrowckError> getErrors();

  ImmutableList<BorrowckError> getWarnings();
}
