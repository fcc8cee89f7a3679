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

/**
 * The syntactic origin of an outlives constraint, as shown to the user. Declaration order is
 * the order of preference when choosing which constraint of a path to blame.
 */
public enum ConstraintCategory {
  CAST("cast"),
  ASSIGNMENT("assignment"),
  ASSIGNMENT_TO_UPVAR("assignment"),
  RETURN("return"),
  CALL_ARGUMENT_TO_UPVAR("argument"),
  CALL_ARGUMENT("argument"),
  OTHER("free region"),
  /** Generated mechanically; never blamed if anything else is on the path. */
  BORING("free region");

  private final String description;

  ConstraintCategory(String description) {
    this.description = description;
  }

  /** Whether the constraint flows data into a variable captured by a closure. */
  public boolean isToUpvar() {
    return this == ASSIGNMENT_TO_UPVAR || this == CALL_ARGUMENT_TO_UPVAR;
  }

  @Override
  public String toString() {
    return description;
  }
}
