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

/** How a place is accessed at a location. */
public enum PlaceContext {
  /** Written by an assignment. */
  STORE,
  /** Written as the destination of a call. */
  CALL,
  STORAGE_LIVE,
  STORAGE_DEAD,
  /** Read by a copy operand. */
  COPY,
  /** Read by a move operand. */
  MOVE,
  BORROW,
  /** The base of a projected place; the projected place has its own context. */
  PROJECTION,
  DROP;

  /** Whether this context overwrites the whole place. */
  public boolean isDef() {
    return this == STORE || this == CALL || this == STORAGE_LIVE || this == STORAGE_DEAD;
  }

  public boolean isDrop() {
    return this == DROP;
  }

  /** Whether this context reads the current value. */
  public boolean isUse() {
    return !isDef() && !isDrop();
  }
}
