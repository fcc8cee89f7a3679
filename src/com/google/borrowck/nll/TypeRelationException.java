/*
 * Copyright 2017 The Closure Compiler Authors.
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

import com.google.borrowck.ty.GenericArg;

/** Thrown when two types cannot be related because their shapes differ. */
public final class TypeRelationException extends Exception {
  private static final long serialVersionUID = 1L;

  private final transient GenericArg expected;
  private final transient GenericArg found;

  TypeRelationException(String message, GenericArg expected, GenericArg found) {
    super(message + ": expected `" + expected + "`, found `" + found + "`");
    this.expected = expected;
    this.found = found;
  }

  static TypeRelationException mismatch(GenericArg a, GenericArg b) {
    return new TypeRelationException("mismatched types", b, a);
  }

  public GenericArg getExpected() {
    return expected;
  }

  public GenericArg getFound() {
    return found;
  }
}
